package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.utils.table.TableColumnCollection;
import org.winslowlab.ultraseq.utils.table.TableUtils;
import org.winslowlab.ultraseq.utils.table.TableWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Row counts going in and out of the joins of one sample, so that rows dropped by inner joins are visible.
 */
public final class JoinStatistics {

    public static final TableColumnCollection COLUMNS = new TableColumnCollection(
            "Sample", "Barcode_entries", "Barcode_entries_without_cluster", "Bartender_pairs",
            "Bartender_pairs_without_center", "Reads_without_extraction_record", "Unified_rows", "Unified_rows_without_center");

    private final String sample;

    long barcodeEntries;
    long barcodeEntriesWithoutCluster;
    long bartenderPairs;
    long bartenderPairsWithoutCenter;
    long readsWithoutExtractionRecord;
    long unifiedRows;
    long unifiedRowsWithoutCenter;

    public JoinStatistics(final String sample) {
        this.sample = sample;
    }

    public String getSample() {
        return sample;
    }

    /**
     * @return barcode entries read from the barcode tables.
     */
    public long getBarcodeEntries() {
        return barcodeEntries;
    }

    /**
     * @return barcode entries dropped because their cluster is not in the cluster table.
     */
    public long getBarcodeEntriesWithoutCluster() {
        return barcodeEntriesWithoutCluster;
    }

    public long getBartenderPairs() {
        return bartenderPairs;
    }

    /**
     * @return bartender pairs kept with no cluster center.
     */
    public long getBartenderPairsWithoutCenter() {
        return bartenderPairsWithoutCenter;
    }

    /**
     * @return clustered reads dropped because no extracted read has the same read id and barcode.
     */
    public long getReadsWithoutExtractionRecord() {
        return readsWithoutExtractionRecord;
    }

    public long getUnifiedRows() {
        return unifiedRows;
    }

    /**
     * @return unified rows left out of both aggregations because they have no cluster center.
     */
    public long getUnifiedRowsWithoutCenter() {
        return unifiedRowsWithoutCenter;
    }

    @Override
    public String toString() {
        return String.format("Sample %s: %d barcode entries (%d without cluster), %d bartender pairs (%d without center), " +
                        "%d reads without extraction record, %d unified rows (%d without center)",
                sample, barcodeEntries, barcodeEntriesWithoutCluster, bartenderPairs, bartenderPairsWithoutCenter,
                readsWithoutExtractionRecord, unifiedRows, unifiedRowsWithoutCenter);
    }

    public static TableWriter<JoinStatistics> writer(final Path path) throws IOException {
        return TableUtils.writer(path, COLUMNS, (stats, dataLine) -> dataLine
                .set("Sample", stats.sample)
                .set("Barcode_entries", stats.barcodeEntries)
                .set("Barcode_entries_without_cluster", stats.barcodeEntriesWithoutCluster)
                .set("Bartender_pairs", stats.bartenderPairs)
                .set("Bartender_pairs_without_center", stats.bartenderPairsWithoutCenter)
                .set("Reads_without_extraction_record", stats.readsWithoutExtractionRecord)
                .set("Unified_rows", stats.unifiedRows)
                .set("Unified_rows_without_center", stats.unifiedRowsWithoutCenter));
    }
}
