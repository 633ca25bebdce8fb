package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.utils.Utils;

import java.util.Optional;

/**
 * A read of a bartender input file with the center of its barcode cluster, if the barcode was clustered.
 */
public final class ClusteredRead {

    private final String readId;
    private final String clonalBarcode;
    private final String clonalBarcodeCenter;

    /**
     * @param clonalBarcodeCenter {@code null} when the barcode has no cluster.
     */
    public ClusteredRead(final String readId, final String clonalBarcode, final String clonalBarcodeCenter) {
        this.readId = Utils.nonNull(readId, "the read id cannot be null");
        this.clonalBarcode = Utils.nonNull(clonalBarcode, "the clonal barcode cannot be null");
        this.clonalBarcodeCenter = clonalBarcodeCenter;
    }

    public String getReadId() {
        return readId;
    }

    public String getClonalBarcode() {
        return clonalBarcode;
    }

    public Optional<String> getClonalBarcodeCenter() {
        return Optional.ofNullable(clonalBarcodeCenter);
    }
}
