package org.winslowlab.ultraseq.utils.fastq;

import htsjdk.samtools.fastq.FastqConstants;
import org.winslowlab.ultraseq.utils.Utils;

/**
 * One paired-end fragment: the mate-1 and mate-2 records read at the same position of their files.
 * Either sequence may be empty.
 */
public final class ReadPair {

    private final String readName;
    private final String read1Bases;
    private final String read2Bases;

    /**
     * @param readName the mate-1 header line without its leading {@code @}.
     */
    public ReadPair(final String readName, final String read1Bases, final String read2Bases) {
        this.readName = Utils.nonNull(readName, "the read name cannot be null");
        this.read1Bases = Utils.nonNull(read1Bases, "read1 bases cannot be null");
        this.read2Bases = Utils.nonNull(read2Bases, "read2 bases cannot be null");
    }

    /**
     * @return the complete mate-1 header line, including the leading {@code @}.
     */
    public String getReadId() {
        return FastqConstants.SEQUENCE_HEADER + readName;
    }

    public String getRead1Bases() {
        return read1Bases;
    }

    public String getRead2Bases() {
        return read2Bases;
    }

    @Override
    public String toString() {
        return getReadId();
    }
}
