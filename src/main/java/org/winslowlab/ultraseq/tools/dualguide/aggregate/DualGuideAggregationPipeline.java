package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.utils.Utils;
import org.winslowlab.ultraseq.utils.io.IOUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Aggregates every sample directory under an input root and concatenates the complete tables of all samples.
 * <p>
 * For a sample directory {@code <root>/<sample>} the raw and complete tables go to
 * {@code <prefix><sample>/Combined_ND_df.csv} and {@code <prefix><sample>/Combined_deduplexed_df.csv};
 * the concatenation goes to {@code <prefix>gRNA_clonalbarcode_combined.csv}. The prefix is used as a plain string,
 * so a prefix ending in a path separator names a directory.
 * </p>
 * <p>
 * A sample that fails with a {@link UserException} is logged and recorded, and the other samples are still
 * processed; the combined table then holds the successful samples only.
 * </p>
 */
public final class DualGuideAggregationPipeline {

    private static final Logger logger = LogManager.getLogger(DualGuideAggregationPipeline.class);

    private final Path inputRoot;
    private final String outputPrefix;

    public DualGuideAggregationPipeline(final Path inputRoot, final String outputPrefix) {
        this.inputRoot = Utils.nonNull(inputRoot, "the input root cannot be null");
        this.outputPrefix = Utils.nonNull(outputPrefix, "the output prefix cannot be null");
    }

    public Path rawTablePath(final String sample) {
        return Paths.get(outputPrefix + sample, FrequencyTable.RAW_FILE_NAME);
    }

    public Path completeTablePath(final String sample) {
        return Paths.get(outputPrefix + sample, FrequencyTable.COMPLETE_FILE_NAME);
    }

    public Path combinedTablePath() {
        return Paths.get(outputPrefix + FrequencyTable.COMBINED_FILE_NAME);
    }

    /**
     * Runs all samples and writes every output table.
     *
     * @throws UserException.BadInput if the input root has no sample directory.
     */
    public Result run() {
        final List<Path> sampleDirectories = findSampleDirectories(inputRoot);
        if (sampleDirectories.isEmpty()) {
            throw new UserException.BadInput("no sample directory found under " + inputRoot);
        }
        logger.info(String.format("Aggregating %d samples under %s", sampleDirectories.size(), inputRoot));

        final List<SampleAggregation> aggregations = new ArrayList<>(sampleDirectories.size());
        final Map<String, String> failures = new LinkedHashMap<>();
        for (final Path sampleDirectory : sampleDirectories) {
            final String sample = sampleDirectory.getFileName().toString();
            try {
                final SampleAggregation aggregation = SampleAggregator.aggregate(sampleDirectory);
                writeSample(aggregation);
                aggregations.add(aggregation);
            } catch (final UserException e) {
                logger.error(String.format("Sample %s failed: %s", sample, e.getMessage()));
                failures.put(sample, e.getMessage());
            }
        }

        final List<FrequencyRow> combined = combine(aggregations.stream().map(SampleAggregation::getComplete).collect(Collectors.toList()));
        final Path combinedPath = combinedTablePath();
        if (combinedPath.getParent() != null) {
            IOUtils.createDirectories(combinedPath.getParent());
        }
        FrequencyTable.writeComplete(combinedPath, combined);
        logger.info(String.format("Wrote %d rows of %d samples to %s", combined.size(), aggregations.size(), combinedPath));
        return new Result(aggregations, failures, combined);
    }

    private void writeSample(final SampleAggregation aggregation) {
        final Path rawPath = rawTablePath(aggregation.getSample());
        final Path completePath = completeTablePath(aggregation.getSample());
        IOUtils.createDirectories(rawPath.getParent());
        FrequencyTable.writeRaw(rawPath, aggregation.getRaw());
        FrequencyTable.writeComplete(completePath, aggregation.getComplete());
        logger.info(String.format("Sample %s: %d raw rows, %d complete rows", aggregation.getSample(),
                aggregation.getRaw().size(), aggregation.getComplete().size()));
    }

    /**
     * Concatenates per-sample complete tables in the given order. No deduplication across samples.
     */
    public static List<FrequencyRow> combine(final Collection<? extends List<FrequencyRow>> perSampleTables) {
        Utils.nonNull(perSampleTables, "the tables cannot be null");
        final List<FrequencyRow> combined = new ArrayList<>();
        perSampleTables.forEach(combined::addAll);
        return combined;
    }

    /**
     * @return the sub-directories of {@code root}, sorted by name.
     */
    static List<Path> findSampleDirectories(final Path root) {
        IOUtils.assertDirectoryIsReadable(root);
        try (final Stream<Path> children = Files.list(root)) {
            return children.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(root, "the directory could not be listed", e);
        } catch (final UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(root, "the directory could not be listed", e.getCause());
        }
    }

    /**
     * The outcome of a run: successful samples, failed samples with their error, and the combined table.
     */
    public static final class Result {
        private final ImmutableList<SampleAggregation> aggregations;
        private final Map<String, String> failures;
        private final ImmutableList<FrequencyRow> combined;

        private Result(final List<SampleAggregation> aggregations, final Map<String, String> failures, final List<FrequencyRow> combined) {
            this.aggregations = ImmutableList.copyOf(aggregations);
            this.failures = new LinkedHashMap<>(failures);
            this.combined = ImmutableList.copyOf(combined);
        }

        public ImmutableList<SampleAggregation> getAggregations() {
            return aggregations;
        }

        /**
         * @return failed sample to error message, in processing order.
         */
        public Map<String, String> getFailures() {
            return failures;
        }

        public ImmutableList<FrequencyRow> getCombined() {
            return combined;
        }

        public List<String> describeFailures() {
            return failures.entrySet().stream().map(e -> e.getKey() + ": " + e.getValue()).collect(Collectors.toList());
        }
    }
}
