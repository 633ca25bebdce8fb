package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.utils.Utils;

/**
 * A raw clonal barcode and the center of the cluster it belongs to.
 */
public final class ClusteredBarcode {

    private final String clonalBarcode;
    private final String clonalBarcodeCenter;

    public ClusteredBarcode(final String clonalBarcode, final String clonalBarcodeCenter) {
        this.clonalBarcode = Utils.nonNull(clonalBarcode, "the clonal barcode cannot be null");
        this.clonalBarcodeCenter = Utils.nonNull(clonalBarcodeCenter, "the clonal barcode center cannot be null");
    }

    public String getClonalBarcode() {
        return clonalBarcode;
    }

    public String getClonalBarcodeCenter() {
        return clonalBarcodeCenter;
    }
}
