package org.winslowlab.ultraseq.tools.dualguide;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.winslowlab.ultraseq.cmdline.CommandLineProgram;
import org.winslowlab.ultraseq.cmdline.StandardArgumentDefinitions;
import org.winslowlab.ultraseq.cmdline.programgroups.ClonalBarcodeProgramGroup;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.utils.config.ConfigFactory;
import org.winslowlab.ultraseq.utils.config.UltraSeqConfig;
import org.winslowlab.ultraseq.utils.fastq.PairedFastqReader;
import org.winslowlab.ultraseq.utils.fastq.ReadPair;
import org.winslowlab.ultraseq.utils.io.IOUtils;
import org.winslowlab.ultraseq.utils.table.TableWriter;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Extracts the clonal barcode and the two guides of every read pair of a dual-guide library.
 *
 * <p>The clonal barcode and guide 1 are found in mate 1 between fixed anchors; guide 2 is found in the reverse
 * complement of mate 2. Pairs where both are found are classified as Expected when both guides are in the
 * reference for their position, Unexpected otherwise.</p>
 *
 * <h3>Outputs, in the output directory</h3>
 * <ul>
 *     <li>Unexpected_reads.csv: the Unexpected reads</li>
 *     <li>Intermediate_df.csv: every extracted read, or the Expected ones with --expected-reads-only</li>
 *     <li>Clonal_barcode/&lt;gRNA1&gt;_&lt;gRNA2&gt;.bartender: barcode and read id of the reads in Intermediate_df.csv,
 *     one file per guide combination, ready for barcode clustering</li>
 *     <li>Bartender_input_address: the list of bartender files</li>
 * </ul>
 *
 * <h3>Usage example</h3>
 * <pre>
 * ultraseq ExtractDualGuideBarcodes \
 *   -R1 sample_R1.fastq.gz \
 *   -R2 sample_R2.fastq.gz \
 *   -G guide_reference.csv \
 *   -O output/Mouse_1
 * </pre>
 */
@DocumentedFeature
@CommandLineProgramProperties(
        summary = "Extracts clonal barcodes and guide pairs from paired dual-guide reads, classifies them against a guide " +
                "reference and writes the per-read tables and the bartender input files of one sample.",
        oneLineSummary = "Extract clonal barcodes and guide pairs from paired reads",
        programGroup = ClonalBarcodeProgramGroup.class
)
public final class ExtractDualGuideBarcodes extends CommandLineProgram {

    public static final String READ1_LONG_NAME = "read1";
    public static final String READ1_SHORT_NAME = "R1";
    public static final String READ2_LONG_NAME = "read2";
    public static final String READ2_SHORT_NAME = "R2";
    public static final String GUIDE_REFERENCE_LONG_NAME = "guide-reference";
    public static final String GUIDE_REFERENCE_SHORT_NAME = "G";
    public static final String VALIDATE_MATE_NAMES_LONG_NAME = "validate-mate-names";
    public static final String EXPECTED_READS_ONLY_LONG_NAME = "expected-reads-only";

    @Argument(fullName = READ1_LONG_NAME, shortName = READ1_SHORT_NAME, doc = "Mate 1 FASTQ file, gzipped or not")
    public File read1;

    @Argument(fullName = READ2_LONG_NAME, shortName = READ2_SHORT_NAME, doc = "Mate 2 FASTQ file, gzipped or not")
    public File read2;

    @Argument(fullName = GUIDE_REFERENCE_LONG_NAME, shortName = GUIDE_REFERENCE_SHORT_NAME,
            doc = "CSV file of reference guides, with a position column (G1 or G2) and a guide sequence column")
    public File guideReference;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME, shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output directory of the sample; created if it does not exist")
    public File outputDirectory;

    @Argument(fullName = StandardArgumentDefinitions.SAMPLE_ID_LONG_NAME,
            doc = "Sample identifier; the name of the output directory by default", optional = true)
    public String sampleId = null;

    @Argument(fullName = StandardArgumentDefinitions.METRICS_FILE_LONG_NAME, shortName = StandardArgumentDefinitions.METRICS_FILE_SHORT_NAME,
            doc = "File to write the extraction metrics to", optional = true)
    public File metricsFile = null;

    @Argument(fullName = VALIDATE_MATE_NAMES_LONG_NAME,
            doc = "Fail when the read names of the two mates of a pair differ", optional = true)
    public boolean validateMateNames = true;

    @Argument(fullName = EXPECTED_READS_ONLY_LONG_NAME,
            doc = "Write only Expected reads to Intermediate_df.csv and the bartender input files", optional = true)
    public boolean expectedReadsOnly = false;

    private DualGuideReadExtractor extractor;

    @Override
    protected String[] customCommandLineValidation() {
        if (sampleId != null && sampleId.trim().isEmpty()) {
            return new String[]{"--" + StandardArgumentDefinitions.SAMPLE_ID_LONG_NAME + " cannot be blank"};
        }
        return null;
    }

    @Override
    protected void onStartup() {
        final UltraSeqConfig config = ConfigFactory.getInstance().getUltraSeqConfig();
        final Path output = outputDirectory.toPath().toAbsolutePath().normalize();
        if (sampleId == null) {
            sampleId = output.getFileName().toString();
        }
        final GuideReference reference = GuideReference.load(guideReference.toPath(), config);
        final AnchoredSequencePattern read1Structure;
        final AnchoredSequencePattern read2Structure;
        try {
            read1Structure = AnchoredSequencePattern.compile(config.read1_structure());
            read2Structure = AnchoredSequencePattern.compile(config.read2_structure());
        } catch (final IllegalArgumentException e) {
            throw new UserException.BadInput("invalid read structure in the configuration", e);
        }
        extractor = new DualGuideReadExtractor(sampleId, reference, read1Structure, read2Structure);
        logger.info(String.format("Sample %s: searching mate 1 for %s and reverse complemented mate 2 for %s",
                sampleId, read1Structure, read2Structure));
    }

    @Override
    protected Object doWork() {
        final Path output = IOUtils.createDirectories(outputDirectory.toPath());
        final Path unexpectedPath = output.resolve(ExtractedReadTable.UNEXPECTED_READS_FILE_NAME);
        final Path intermediatePath = output.resolve(ExtractedReadTable.INTERMEDIATE_FILE_NAME);
        final BartenderInputWriter bartenderWriter = new BartenderInputWriter(output);

        try (final PairedFastqReader pairs = new PairedFastqReader(read1.toPath(), read2.toPath(), validateMateNames);
             final TableWriter<ExtractedRead> unexpectedWriter = ExtractedReadTable.writer(unexpectedPath);
             final TableWriter<ExtractedRead> intermediateWriter = ExtractedReadTable.writer(intermediatePath)) {
            for (final ReadPair pair : pairs) {
                final Optional<ExtractedRead> extracted = extractor.extract(pair);
                if (extractor.getTotalReads() % 1_000_000 == 0) {
                    logger.info(String.format("Processed %,d read pairs", extractor.getTotalReads()));
                }
                if (!extracted.isPresent()) {
                    continue;
                }
                final ExtractedRead read = extracted.get();
                if (read.getReadClass() == ReadClass.UNEXPECTED) {
                    unexpectedWriter.writeRecord(read);
                }
                if (!expectedReadsOnly || read.getReadClass() == ReadClass.EXPECTED) {
                    intermediateWriter.writeRecord(read);
                    bartenderWriter.add(read);
                }
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, "the per-read tables could not be written", e);
        }

        bartenderWriter.write();

        if (metricsFile != null) {
            writeMetrics(extractor.getMetrics(), metricsFile);
        }

        final String summary = extractor.getSummary();
        logger.info(summary);
        return summary;
    }
}
