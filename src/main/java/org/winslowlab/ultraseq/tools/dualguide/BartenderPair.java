package org.winslowlab.ultraseq.tools.dualguide;

import org.winslowlab.ultraseq.utils.Utils;

import java.util.Objects;

/**
 * A (clonal barcode, read id) pair, one line of a bartender input file.
 */
public final class BartenderPair {

    private final String clonalBarcode;
    private final String readId;

    public BartenderPair(final String clonalBarcode, final String readId) {
        this.clonalBarcode = Utils.nonNull(clonalBarcode, "the clonal barcode cannot be null");
        this.readId = Utils.nonNull(readId, "the read id cannot be null");
    }

    public String getClonalBarcode() {
        return clonalBarcode;
    }

    public String getReadId() {
        return readId;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final BartenderPair that = (BartenderPair) o;
        return clonalBarcode.equals(that.clonalBarcode) && readId.equals(that.readId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clonalBarcode, readId);
    }

    @Override
    public String toString() {
        return clonalBarcode + "," + readId;
    }
}
