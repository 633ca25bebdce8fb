package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.tools.dualguide.ExtractedRead;
import org.winslowlab.ultraseq.utils.Utils;

import java.util.Optional;

/**
 * A read annotated with both its clustering result and its extraction record.
 */
public final class UnifiedRow {

    private final ClusteredRead clusteredRead;
    private final ExtractedRead extractedRead;

    public UnifiedRow(final ClusteredRead clusteredRead, final ExtractedRead extractedRead) {
        this.clusteredRead = Utils.nonNull(clusteredRead, "the clustered read cannot be null");
        this.extractedRead = Utils.nonNull(extractedRead, "the extracted read cannot be null");
        Utils.validateArg(clusteredRead.getReadId().equals(extractedRead.getReadId())
                        && clusteredRead.getClonalBarcode().equals(extractedRead.getClonalBarcode()),
                "the clustered and extracted reads must share read id and clonal barcode");
    }

    public String getReadId() {
        return clusteredRead.getReadId();
    }

    public String getClonalBarcode() {
        return clusteredRead.getClonalBarcode();
    }

    /**
     * @return empty when the barcode was not clustered.
     */
    public Optional<String> getClonalBarcodeCenter() {
        return clusteredRead.getClonalBarcodeCenter();
    }

    public String getGRNA1() {
        return extractedRead.getGRNA1();
    }

    public String getGRNA2() {
        return extractedRead.getGRNA2();
    }

    public String getCombination() {
        return extractedRead.getCombination();
    }

    public String getSampleId() {
        return extractedRead.getSampleId();
    }
}
