package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.tools.dualguide.BartenderInputWriter;
import org.winslowlab.ultraseq.tools.dualguide.BartenderPair;
import org.winslowlab.ultraseq.tools.dualguide.ExtractedRead;
import org.winslowlab.ultraseq.tools.dualguide.ExtractedReadTable;
import org.winslowlab.ultraseq.utils.io.IOUtils;
import org.winslowlab.ultraseq.utils.table.TableReader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the frequency tables of one sample directory.
 * <p>
 * Every {@code Clonal_barcode/*_cluster.csv} below the sample directory, at any depth, is joined with its sibling
 * {@code _barcode.csv} table on the cluster id, and the result is right joined onto the sibling {@code .bartender}
 * file on the clonal barcode. The clustered reads of all combinations are concatenated, then inner joined with
 * {@code Intermediate_df.csv} of the sample directory on (read id, clonal barcode), and counted.
 * </p>
 */
public final class SampleAggregator {

    private static final Logger logger = LogManager.getLogger(SampleAggregator.class);

    private SampleAggregator() {}

    /**
     * @param sampleDirectory the directory of one sample.
     * @throws UserException if a file is missing or malformed, or if there is no cluster table.
     */
    public static SampleAggregation aggregate(final Path sampleDirectory) {
        IOUtils.assertDirectoryIsReadable(sampleDirectory);
        final String sample = sampleDirectory.getFileName().toString();
        final JoinStatistics statistics = new JoinStatistics(sample);

        final List<Path> clusterFiles = findClusterFiles(sampleDirectory);
        if (clusterFiles.isEmpty()) {
            throw new UserException.BadInput(String.format("no %s/*%s file found under %s",
                    BartenderInputWriter.CLONAL_BARCODE_DIRECTORY, ClusteringOutputTables.CLUSTER_FILE_SUFFIX, sampleDirectory));
        }

        final List<ClusteredRead> clusteredReads = new ArrayList<>();
        for (final Path clusterFile : clusterFiles) {
            final List<ClusterEntry> clusters = ClusteringOutputTables.readClusters(clusterFile);
            final List<BarcodeEntry> barcodes = ClusteringOutputTables.readBarcodes(ClusteringOutputTables.barcodeFileFor(clusterFile));
            final List<BartenderPair> pairs = readBartenderPairs(ClusteringOutputTables.bartenderFileFor(clusterFile));
            final List<ClusteredBarcode> clusteredBarcodes = CrossSourceMerger.innerJoinOnClusterId(barcodes, clusters, statistics);
            clusteredReads.addAll(CrossSourceMerger.rightJoinOnBarcode(clusteredBarcodes, pairs, statistics));
            logger.debug(String.format("Sample %s, combination %s: %d clusters, %d barcodes, %d reads",
                    sample, ClusteringOutputTables.combinationOf(clusterFile), clusters.size(), barcodes.size(), pairs.size()));
        }

        final List<ExtractedRead> extractedReads = readExtractedReads(sampleDirectory.resolve(ExtractedReadTable.INTERMEDIATE_FILE_NAME));
        final List<UnifiedRow> unifiedRows = CrossSourceMerger.innerJoinOnReadAndBarcode(clusteredReads, extractedReads, statistics);

        final List<FrequencyRow> raw = BarcodeFrequencyAggregator.aggregateRaw(unifiedRows);
        final List<FrequencyRow> complete = BarcodeFrequencyAggregator.aggregateComplete(unifiedRows);
        logger.info(statistics.toString());
        if (statistics.getBarcodeEntriesWithoutCluster() > 0 || statistics.getReadsWithoutExtractionRecord() > 0) {
            logger.warn(String.format("Sample %s: the joins dropped %d barcode entries and %d reads",
                    sample, statistics.getBarcodeEntriesWithoutCluster(), statistics.getReadsWithoutExtractionRecord()));
        }
        return new SampleAggregation(sample, raw, complete, statistics);
    }

    /**
     * @return the cluster tables below {@code sampleDirectory}, sorted by path.
     */
    static List<Path> findClusterFiles(final Path sampleDirectory) {
        try (final Stream<Path> paths = Files.walk(sampleDirectory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(ClusteringOutputTables.CLUSTER_FILE_SUFFIX))
                    .filter(p -> p.getParent() != null && p.getParent().getFileName() != null
                            && p.getParent().getFileName().toString().equals(BartenderInputWriter.CLONAL_BARCODE_DIRECTORY))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(sampleDirectory, "the directory could not be listed", e);
        } catch (final UncheckedIOException e) {
            // raised while walking, e.g. by a sub-directory that cannot be read
            throw new UserException.CouldNotReadInputFile(sampleDirectory, "a sub-directory could not be listed", e.getCause());
        }
    }

    private static List<BartenderPair> readBartenderPairs(final Path path) {
        IOUtils.assertFileIsReadable(path);
        try (final TableReader<BartenderPair> reader = BartenderInputWriter.reader(path)) {
            return reader.toList();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    private static List<ExtractedRead> readExtractedReads(final Path path) {
        IOUtils.assertFileIsReadable(path);
        try (final TableReader<ExtractedRead> reader = ExtractedReadTable.reader(path)) {
            return reader.toList();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }
}
