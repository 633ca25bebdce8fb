package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.utils.Utils;

/**
 * One distinct barcode observed by a barcode clustering run and the cluster it was assigned to.
 */
public final class BarcodeEntry {

    private final String clonalBarcode;
    private final String clusterId;

    public BarcodeEntry(final String clonalBarcode, final String clusterId) {
        this.clonalBarcode = Utils.nonNull(clonalBarcode, "the clonal barcode cannot be null");
        this.clusterId = Utils.nonNull(clusterId, "the cluster id cannot be null");
    }

    public String getClonalBarcode() {
        return clonalBarcode;
    }

    public String getClusterId() {
        return clusterId;
    }

    @Override
    public String toString() {
        return clonalBarcode + ":" + clusterId;
    }
}
