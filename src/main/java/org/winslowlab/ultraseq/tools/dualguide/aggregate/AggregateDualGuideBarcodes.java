package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.winslowlab.ultraseq.cmdline.CommandLineProgram;
import org.winslowlab.ultraseq.cmdline.StandardArgumentDefinitions;
import org.winslowlab.ultraseq.cmdline.programgroups.ClonalBarcodeProgramGroup;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.utils.table.TableWriter;

import java.io.File;
import java.io.IOException;

/**
 * Merges the barcode clustering output of every sample with its extracted reads and counts reads per clonal barcode.
 *
 * <p>The input directory holds one sub-directory per sample, as written by ExtractDualGuideBarcodes, with the
 * {@code <combination>_cluster.csv} and {@code <combination>_barcode.csv} tables of the clustering tool next to each
 * bartender file. Reads are counted per raw barcode (Combined_ND_df.csv) and per cluster center
 * (Combined_deduplexed_df.csv); the per-center tables of all samples are concatenated into
 * gRNA_clonalbarcode_combined.csv.</p>
 *
 * <p>Barcodes whose cluster is missing from the cluster table and reads missing from Intermediate_df.csv are dropped
 * by the joins; their counts are logged and can be saved with --join-statistics-file.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 * ultraseq AggregateDualGuideBarcodes \
 *   -I bartender_output/ \
 *   -O aggregated/
 * </pre>
 */
@DocumentedFeature
@CommandLineProgramProperties(
        summary = "Merges barcode clustering output with the extracted reads of each sample, counts reads per raw " +
                "barcode and per cluster center, and concatenates the per-center counts of all samples.",
        oneLineSummary = "Count dual-guide clonal barcodes per sample and combine samples",
        programGroup = ClonalBarcodeProgramGroup.class
)
public final class AggregateDualGuideBarcodes extends CommandLineProgram {

    public static final String OUTPUT_PREFIX_LONG_NAME = "output-prefix";
    public static final String JOIN_STATISTICS_FILE_LONG_NAME = "join-statistics-file";

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME, shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Directory with one sub-directory per sample")
    public File inputDirectory;

    @Argument(fullName = OUTPUT_PREFIX_LONG_NAME, shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Prefix of the output paths; per-sample tables go to <prefix><sample>/ and the combined table to " +
                    "<prefix>gRNA_clonalbarcode_combined.csv")
    public String outputPrefix;

    @Argument(fullName = JOIN_STATISTICS_FILE_LONG_NAME,
            doc = "File to write the per-sample join counts to", optional = true)
    public File joinStatisticsFile = null;

    @Override
    protected Object doWork() {
        final DualGuideAggregationPipeline pipeline = new DualGuideAggregationPipeline(inputDirectory.toPath(), outputPrefix);
        final DualGuideAggregationPipeline.Result result = pipeline.run();

        if (joinStatisticsFile != null) {
            try (final TableWriter<JoinStatistics> writer = JoinStatistics.writer(joinStatisticsFile.toPath())) {
                for (final SampleAggregation aggregation : result.getAggregations()) {
                    writer.writeRecord(aggregation.getStatistics());
                }
            } catch (final IOException e) {
                throw new UserException.CouldNotCreateOutputFile(joinStatisticsFile.toPath(), e);
            }
        }

        if (!result.getFailures().isEmpty()) {
            throw new UserException.FailedSamples(result.describeFailures());
        }
        return result.getCombined().size();
    }
}
