package org.winslowlab.ultraseq.metrics;

import htsjdk.samtools.metrics.MetricBase;

import java.io.Serializable;

/** Read counts of one dual-guide extraction run, for one sample */
public final class DualGuideExtractionMetrics extends MetricBase implements Serializable {
    private static final long serialVersionUID = 1;

    //Note: the field names are upper case and public because MetricsFile finds and writes them reflectively.

    /** The sample the reads belong to */
    public String SAMPLE;

    /** The total number of read pairs in the mate files */
    public long TOTAL_READS;

    /** The number of read pairs where both the barcode/guide 1 structure and the guide 2 structure were found */
    public long EXTRACTED_READS;

    /** The number of extracted read pairs whose two guides are both in the reference */
    public long EXPECTED_READS;

    /** EXTRACTED_READS / TOTAL_READS, 0 when there are no reads */
    public double PCT_EXTRACTED;

    /** EXPECTED_READS / TOTAL_READS, 0 when there are no reads */
    public double PCT_EXPECTED;

    public DualGuideExtractionMetrics() {}

    public DualGuideExtractionMetrics(final String sample, final long totalReads, final long extractedReads, final long expectedReads) {
        this.SAMPLE = sample;
        this.TOTAL_READS = totalReads;
        this.EXTRACTED_READS = extractedReads;
        this.EXPECTED_READS = expectedReads;
        calculateDerivedFields();
    }

    public void calculateDerivedFields() {
        PCT_EXTRACTED = TOTAL_READS == 0 ? 0.0 : EXTRACTED_READS / (double) TOTAL_READS;
        PCT_EXPECTED = TOTAL_READS == 0 ? 0.0 : EXPECTED_READS / (double) TOTAL_READS;
    }
}
