package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import com.google.common.collect.ImmutableMap;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.tools.dualguide.BartenderInputWriter;
import org.winslowlab.ultraseq.utils.io.IOUtils;
import org.winslowlab.ultraseq.utils.table.TableColumnCollection;
import org.winslowlab.ultraseq.utils.table.TableReader;
import org.winslowlab.ultraseq.utils.table.TableReaderOptions;
import org.winslowlab.ultraseq.utils.table.TableUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Readers for the tables written by the barcode clustering tool for each bartender input file:
 * {@code <combination>_cluster.csv} and {@code <combination>_barcode.csv}.
 * <p>
 * Only the columns needed downstream are read; {@code Cluster.Score}, {@code time_point_1} and {@code Frequency}
 * are ignored. {@code Unique.reads} is read as {@code Clonal_barcode} and {@code Center} as {@code Clonal_barcode_center}.
 * </p>
 */
public final class ClusteringOutputTables {

    public static final String CLUSTER_ID_COLUMN = "Cluster.ID";
    public static final String CENTER_COLUMN = "Center";
    public static final String UNIQUE_READS_COLUMN = "Unique.reads";

    public static final String CLONAL_BARCODE_COLUMN = "Clonal_barcode";
    public static final String CLONAL_BARCODE_CENTER_COLUMN = "Clonal_barcode_center";

    public static final String CLUSTER_FILE_SUFFIX = "_cluster.csv";
    public static final String BARCODE_FILE_SUFFIX = "_barcode.csv";

    private static final TableReaderOptions RENAMING_OPTIONS = new TableReaderOptions(ImmutableMap.of(
            UNIQUE_READS_COLUMN, CLONAL_BARCODE_COLUMN,
            CENTER_COLUMN, CLONAL_BARCODE_CENTER_COLUMN));

    private ClusteringOutputTables() {}

    public static List<ClusterEntry> readClusters(final Path path) {
        IOUtils.assertFileIsReadable(path);
        try (final TableReader<ClusterEntry> reader = TableUtils.reader(path, RENAMING_OPTIONS, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns,
                    new TableColumnCollection(CLUSTER_ID_COLUMN, CLONAL_BARCODE_CENTER_COLUMN), formatExceptionFactory);
            return dataLine -> new ClusterEntry(dataLine.get(CLUSTER_ID_COLUMN).trim(), dataLine.get(CLONAL_BARCODE_CENTER_COLUMN));
        })) {
            return reader.toList();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    public static List<BarcodeEntry> readBarcodes(final Path path) {
        IOUtils.assertFileIsReadable(path);
        try (final TableReader<BarcodeEntry> reader = TableUtils.reader(path, RENAMING_OPTIONS, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns,
                    new TableColumnCollection(CLUSTER_ID_COLUMN, CLONAL_BARCODE_COLUMN), formatExceptionFactory);
            return dataLine -> new BarcodeEntry(dataLine.get(CLONAL_BARCODE_COLUMN), dataLine.get(CLUSTER_ID_COLUMN).trim());
        })) {
            return reader.toList();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * @return the barcode table written next to a cluster table.
     */
    public static Path barcodeFileFor(final Path clusterFile) {
        return siblingWithSuffix(clusterFile, BARCODE_FILE_SUFFIX);
    }

    /**
     * @return the bartender input file a cluster table was computed from.
     */
    public static Path bartenderFileFor(final Path clusterFile) {
        return siblingWithSuffix(clusterFile, BartenderInputWriter.BARTENDER_EXTENSION);
    }

    /**
     * @return the combination a cluster table belongs to, its file name without the cluster suffix.
     */
    public static String combinationOf(final Path clusterFile) {
        final String name = clusterFile.getFileName().toString();
        return name.substring(0, name.length() - CLUSTER_FILE_SUFFIX.length());
    }

    private static Path siblingWithSuffix(final Path clusterFile, final String suffix) {
        final String name = clusterFile.getFileName().toString();
        if (!name.endsWith(CLUSTER_FILE_SUFFIX)) {
            throw new IllegalArgumentException("not a cluster file: " + clusterFile);
        }
        return clusterFile.resolveSibling(combinationOf(clusterFile) + suffix);
    }
}
