package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.utils.Utils;

/**
 * One cluster of a barcode clustering run: its identifier and its center barcode.
 */
public final class ClusterEntry {

    private final String clusterId;
    private final String center;

    public ClusterEntry(final String clusterId, final String center) {
        this.clusterId = Utils.nonNull(clusterId, "the cluster id cannot be null");
        this.center = Utils.nonNull(center, "the cluster center cannot be null");
    }

    public String getClusterId() {
        return clusterId;
    }

    public String getCenter() {
        return center;
    }

    @Override
    public String toString() {
        return clusterId + ":" + center;
    }
}
