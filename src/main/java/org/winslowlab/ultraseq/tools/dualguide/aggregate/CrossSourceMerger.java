package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import org.apache.commons.lang3.tuple.Pair;
import org.winslowlab.ultraseq.tools.dualguide.BartenderPair;
import org.winslowlab.ultraseq.tools.dualguide.ExtractedRead;
import org.winslowlab.ultraseq.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The three joins that rebuild the annotated per-read table of a sample.
 * <p>
 * Each join is a hash join: the right side is indexed and the left side (or, for the right join, the right side)
 * is scanned in order, so outputs follow the order of the scanned side. Keys matching several rows on the
 * indexed side produce one output row per match. Dropped and unmatched rows are counted in the given
 * {@link JoinStatistics}.
 * </p>
 */
public final class CrossSourceMerger {

    private CrossSourceMerger() {}

    /**
     * Inner join of barcode entries with cluster entries on the cluster id.
     * Barcode entries whose cluster id is not in {@code clusters} are dropped.
     *
     * @return one row per matching (barcode entry, cluster entry), in barcode entry order.
     */
    public static List<ClusteredBarcode> innerJoinOnClusterId(final Collection<BarcodeEntry> barcodes,
                                                              final Collection<ClusterEntry> clusters,
                                                              final JoinStatistics statistics) {
        Utils.nonNull(barcodes, "barcodes cannot be null");
        Utils.nonNull(clusters, "clusters cannot be null");
        Utils.nonNull(statistics, "statistics cannot be null");
        final ListMultimap<String, ClusterEntry> clustersById = ArrayListMultimap.create();
        clusters.forEach(cluster -> clustersById.put(cluster.getClusterId(), cluster));

        final List<ClusteredBarcode> result = new ArrayList<>(barcodes.size());
        for (final BarcodeEntry barcode : barcodes) {
            statistics.barcodeEntries++;
            final List<ClusterEntry> matches = clustersById.get(barcode.getClusterId());
            if (matches.isEmpty()) {
                statistics.barcodeEntriesWithoutCluster++;
            }
            for (final ClusterEntry cluster : matches) {
                result.add(new ClusteredBarcode(barcode.getClonalBarcode(), cluster.getCenter()));
            }
        }
        return result;
    }

    /**
     * Right join of clustered barcodes onto the bartender pairs on the clonal barcode.
     * Every pair is kept; pairs whose barcode is not clustered get no center.
     *
     * @return at least one row per pair, in pair order.
     */
    public static List<ClusteredRead> rightJoinOnBarcode(final Collection<ClusteredBarcode> clusteredBarcodes,
                                                         final Collection<BartenderPair> pairs,
                                                         final JoinStatistics statistics) {
        Utils.nonNull(clusteredBarcodes, "clustered barcodes cannot be null");
        Utils.nonNull(pairs, "pairs cannot be null");
        Utils.nonNull(statistics, "statistics cannot be null");
        final ListMultimap<String, ClusteredBarcode> centersByBarcode = ArrayListMultimap.create();
        clusteredBarcodes.forEach(barcode -> centersByBarcode.put(barcode.getClonalBarcode(), barcode));

        final List<ClusteredRead> result = new ArrayList<>(pairs.size());
        for (final BartenderPair pair : pairs) {
            statistics.bartenderPairs++;
            final List<ClusteredBarcode> matches = centersByBarcode.get(pair.getClonalBarcode());
            if (matches.isEmpty()) {
                statistics.bartenderPairsWithoutCenter++;
                result.add(new ClusteredRead(pair.getReadId(), pair.getClonalBarcode(), null));
            }
            for (final ClusteredBarcode match : matches) {
                result.add(new ClusteredRead(pair.getReadId(), pair.getClonalBarcode(), match.getClonalBarcodeCenter()));
            }
        }
        return result;
    }

    /**
     * Inner join of clustered reads with extracted reads on (read id, clonal barcode).
     * Clustered reads with no extracted read are dropped, as are extracted reads with no clustered read.
     *
     * @return one row per matching (clustered read, extracted read), in clustered read order.
     */
    public static List<UnifiedRow> innerJoinOnReadAndBarcode(final Collection<ClusteredRead> clusteredReads,
                                                             final Collection<ExtractedRead> extractedReads,
                                                             final JoinStatistics statistics) {
        Utils.nonNull(clusteredReads, "clustered reads cannot be null");
        Utils.nonNull(extractedReads, "extracted reads cannot be null");
        Utils.nonNull(statistics, "statistics cannot be null");
        final ListMultimap<Pair<String, String>, ExtractedRead> extractedByKey = ArrayListMultimap.create();
        extractedReads.forEach(read -> extractedByKey.put(Pair.of(read.getReadId(), read.getClonalBarcode()), read));

        final List<UnifiedRow> result = new ArrayList<>(clusteredReads.size());
        for (final ClusteredRead clusteredRead : clusteredReads) {
            final List<ExtractedRead> matches = extractedByKey.get(Pair.of(clusteredRead.getReadId(), clusteredRead.getClonalBarcode()));
            if (matches.isEmpty()) {
                statistics.readsWithoutExtractionRecord++;
            }
            for (final ExtractedRead extractedRead : matches) {
                final UnifiedRow row = new UnifiedRow(clusteredRead, extractedRead);
                statistics.unifiedRows++;
                if (!row.getClonalBarcodeCenter().isPresent()) {
                    statistics.unifiedRowsWithoutCenter++;
                }
                result.add(row);
            }
        }
        return result;
    }
}
