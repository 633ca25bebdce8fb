package org.winslowlab.ultraseq.tools.dualguide;

import org.winslowlab.ultraseq.metrics.DualGuideExtractionMetrics;
import org.winslowlab.ultraseq.utils.BaseUtils;
import org.winslowlab.ultraseq.utils.Utils;
import org.winslowlab.ultraseq.utils.fastq.ReadPair;

import java.util.Optional;

/**
 * Finds the clonal barcode and the two guides of a read pair and classifies the pair against a {@link GuideReference}.
 * <p>
 * The mate-1 structure must capture the barcode and then guide 1; the mate-2 structure is searched in the
 * reverse complement of mate 2 and must capture guide 2. A pair yields an {@link ExtractedRead} only when both
 * structures are found. Every pair offered counts towards the total.
 * </p>
 * Not thread-safe: the counters are plain fields.
 */
public final class DualGuideReadExtractor {

    private final String sampleId;
    private final GuideReference reference;
    private final AnchoredSequencePattern read1Structure;
    private final AnchoredSequencePattern read2Structure;

    private long totalReads = 0;
    private long extractedReads = 0;
    private long expectedReads = 0;

    public DualGuideReadExtractor(final String sampleId, final GuideReference reference,
                                  final AnchoredSequencePattern read1Structure, final AnchoredSequencePattern read2Structure) {
        this.sampleId = Utils.nonNull(sampleId, "the sample id cannot be null");
        this.reference = Utils.nonNull(reference, "the guide reference cannot be null");
        this.read1Structure = Utils.nonNull(read1Structure, "the read 1 structure cannot be null");
        this.read2Structure = Utils.nonNull(read2Structure, "the read 2 structure cannot be null");
        Utils.validateArg(read1Structure.getCaptureCount() == 2,
                () -> "the read 1 structure must capture the clonal barcode and guide 1: " + read1Structure);
        Utils.validateArg(read2Structure.getCaptureCount() == 1,
                () -> "the read 2 structure must capture guide 2 only: " + read2Structure);
    }

    /**
     * Extracts a read pair.
     *
     * @return empty if either structure is not found.
     */
    public Optional<ExtractedRead> extract(final ReadPair pair) {
        Utils.nonNull(pair, "the read pair cannot be null");
        return extract(pair.getReadId(), pair.getRead1Bases(), pair.getRead2Bases());
    }

    /**
     * @param read2Bases mate-2 bases as sequenced; they are reverse complemented here.
     */
    public Optional<ExtractedRead> extract(final String readId, final String read1Bases, final String read2Bases) {
        totalReads++;
        final Optional<AnchoredSequencePattern.Match> match1 = read1Structure.search(read1Bases);
        if (!match1.isPresent()) {
            return Optional.empty();
        }
        final Optional<AnchoredSequencePattern.Match> match2 = read2Structure.search(BaseUtils.simpleReverseComplement(read2Bases));
        if (!match2.isPresent()) {
            return Optional.empty();
        }
        extractedReads++;
        final String clonalBarcode = match1.get().group(1);
        final String gRNA1 = match1.get().group(2);
        final String gRNA2 = match2.get().group(1);
        final ReadClass readClass = reference.classify(gRNA1, gRNA2);
        if (readClass == ReadClass.EXPECTED) {
            expectedReads++;
        }
        return Optional.of(new ExtractedRead(gRNA1, gRNA2, clonalBarcode, readId, sampleId, readClass));
    }

    public long getTotalReads() {
        return totalReads;
    }

    public long getExtractedReads() {
        return extractedReads;
    }

    public long getExpectedReads() {
        return expectedReads;
    }

    public String getSampleId() {
        return sampleId;
    }

    public DualGuideExtractionMetrics getMetrics() {
        return new DualGuideExtractionMetrics(sampleId, totalReads, extractedReads, expectedReads);
    }

    /**
     * @return the one-line summary of the counters, with ratios of 0.000 when no read was seen.
     */
    public String getSummary() {
        return String.format("Sample %s has a total of %d reads. %d reads (%s) have barcode and sgRNA. %d reads (%s) have expected sgRNA.",
                sampleId, totalReads,
                extractedReads, Utils.formattedRatio(extractedReads, totalReads),
                expectedReads, Utils.formattedRatio(expectedReads, totalReads));
    }
}
