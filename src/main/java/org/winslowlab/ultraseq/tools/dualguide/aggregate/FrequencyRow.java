package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.utils.Utils;

import java.util.Objects;
import java.util.Optional;

/**
 * The number of reads of one (combination, cluster center, guides, sample) group, and in raw rows also of one
 * raw clonal barcode within that cluster.
 */
public final class FrequencyRow {

    private final String combination;
    private final String clonalBarcodeCenter;
    private final String gRNA1;
    private final String gRNA2;
    private final String clonalBarcode;
    private final String sampleId;
    private final long frequency;

    /**
     * @param clonalBarcode the raw barcode, {@code null} for complete (cluster level) rows.
     */
    public FrequencyRow(final String combination, final String clonalBarcodeCenter, final String gRNA1, final String gRNA2,
                        final String clonalBarcode, final String sampleId, final long frequency) {
        this.combination = Utils.nonNull(combination, "the combination cannot be null");
        this.clonalBarcodeCenter = Utils.nonNull(clonalBarcodeCenter, "the clonal barcode center cannot be null");
        this.gRNA1 = Utils.nonNull(gRNA1, "gRNA1 cannot be null");
        this.gRNA2 = Utils.nonNull(gRNA2, "gRNA2 cannot be null");
        this.clonalBarcode = clonalBarcode;
        this.sampleId = Utils.nonNull(sampleId, "the sample id cannot be null");
        Utils.validateArg(frequency > 0, "the frequency must be positive");
        this.frequency = frequency;
    }

    public String getCombination() {
        return combination;
    }

    public String getClonalBarcodeCenter() {
        return clonalBarcodeCenter;
    }

    public String getGRNA1() {
        return gRNA1;
    }

    public String getGRNA2() {
        return gRNA2;
    }

    /**
     * @return empty for complete rows.
     */
    public Optional<String> getClonalBarcode() {
        return Optional.ofNullable(clonalBarcode);
    }

    public String getSampleId() {
        return sampleId;
    }

    public long getFrequency() {
        return frequency;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final FrequencyRow that = (FrequencyRow) o;
        return frequency == that.frequency && combination.equals(that.combination)
                && clonalBarcodeCenter.equals(that.clonalBarcodeCenter) && gRNA1.equals(that.gRNA1)
                && gRNA2.equals(that.gRNA2) && Objects.equals(clonalBarcode, that.clonalBarcode)
                && sampleId.equals(that.sampleId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(combination, clonalBarcodeCenter, gRNA1, gRNA2, clonalBarcode, sampleId, frequency);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s %s %d", sampleId, combination, clonalBarcodeCenter,
                clonalBarcode == null ? "-" : clonalBarcode, frequency);
    }
}
