package org.winslowlab.ultraseq.tools.dualguide;

import org.winslowlab.ultraseq.utils.Utils;

import java.util.Objects;

/**
 * The barcode and guides found in one read pair, with its classification.
 */
public final class ExtractedRead {

    /**
     * Separator between the two guides in a combination key.
     */
    public static final String COMBINATION_SEPARATOR = "_";

    private final String gRNA1;
    private final String gRNA2;
    private final String clonalBarcode;
    private final String readId;
    private final String sampleId;
    private final ReadClass readClass;

    public ExtractedRead(final String gRNA1, final String gRNA2, final String clonalBarcode,
                         final String readId, final String sampleId, final ReadClass readClass) {
        this.gRNA1 = Utils.nonNull(gRNA1, "gRNA1 cannot be null");
        this.gRNA2 = Utils.nonNull(gRNA2, "gRNA2 cannot be null");
        this.clonalBarcode = Utils.nonNull(clonalBarcode, "the clonal barcode cannot be null");
        this.readId = Utils.nonNull(readId, "the read id cannot be null");
        this.sampleId = Utils.nonNull(sampleId, "the sample id cannot be null");
        this.readClass = Utils.nonNull(readClass, "the read class cannot be null");
    }

    public String getGRNA1() {
        return gRNA1;
    }

    public String getGRNA2() {
        return gRNA2;
    }

    public String getClonalBarcode() {
        return clonalBarcode;
    }

    public String getReadId() {
        return readId;
    }

    public String getSampleId() {
        return sampleId;
    }

    public ReadClass getReadClass() {
        return readClass;
    }

    /**
     * @return {@code gRNA1 + "_" + gRNA2}.
     */
    public String getCombination() {
        return combination(gRNA1, gRNA2);
    }

    public static String combination(final String gRNA1, final String gRNA2) {
        return gRNA1 + COMBINATION_SEPARATOR + gRNA2;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ExtractedRead that = (ExtractedRead) o;
        return gRNA1.equals(that.gRNA1) && gRNA2.equals(that.gRNA2) && clonalBarcode.equals(that.clonalBarcode)
                && readId.equals(that.readId) && sampleId.equals(that.sampleId) && readClass == that.readClass;
    }

    @Override
    public int hashCode() {
        return Objects.hash(gRNA1, gRNA2, clonalBarcode, readId, sampleId, readClass);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s %s", readId, clonalBarcode, getCombination(), readClass);
    }
}
