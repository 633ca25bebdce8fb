package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.tools.dualguide.ExtractedReadTable;
import org.winslowlab.ultraseq.utils.table.TableColumnCollection;
import org.winslowlab.ultraseq.utils.table.TableReader;
import org.winslowlab.ultraseq.utils.table.TableUtils;
import org.winslowlab.ultraseq.utils.table.TableWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Layouts of the frequency tables.
 * <p>
 * Raw tables ({@code Combined_ND_df.csv}) keep the cluster center and the raw barcode. Complete tables
 * ({@code Combined_deduplexed_df.csv} and the combined table of all samples) keep the cluster center only,
 * under the {@code Clonal_barcode} column.
 * </p>
 */
public final class FrequencyTable {

    public static final String FREQUENCY_COLUMN = "Frequency";

    public static final TableColumnCollection RAW_COLUMNS = new TableColumnCollection(
            ExtractedReadTable.COMBINATION_COLUMN, ClusteringOutputTables.CLONAL_BARCODE_CENTER_COLUMN,
            ExtractedReadTable.GRNA1_COLUMN, ExtractedReadTable.GRNA2_COLUMN,
            ExtractedReadTable.CLONAL_BARCODE_COLUMN, ExtractedReadTable.SAMPLE_ID_COLUMN, FREQUENCY_COLUMN);

    public static final TableColumnCollection COMPLETE_COLUMNS = new TableColumnCollection(
            ExtractedReadTable.COMBINATION_COLUMN, ExtractedReadTable.CLONAL_BARCODE_COLUMN,
            ExtractedReadTable.GRNA1_COLUMN, ExtractedReadTable.GRNA2_COLUMN,
            ExtractedReadTable.SAMPLE_ID_COLUMN, FREQUENCY_COLUMN);

    public static final String RAW_FILE_NAME = "Combined_ND_df.csv";
    public static final String COMPLETE_FILE_NAME = "Combined_deduplexed_df.csv";
    public static final String COMBINED_FILE_NAME = "gRNA_clonalbarcode_combined.csv";

    private FrequencyTable() {}

    public static void writeRaw(final Path path, final List<FrequencyRow> rows) {
        try (final TableWriter<FrequencyRow> writer = TableUtils.writer(path, RAW_COLUMNS, (row, dataLine) -> dataLine
                .set(ExtractedReadTable.COMBINATION_COLUMN, row.getCombination())
                .set(ClusteringOutputTables.CLONAL_BARCODE_CENTER_COLUMN, row.getClonalBarcodeCenter())
                .set(ExtractedReadTable.GRNA1_COLUMN, row.getGRNA1())
                .set(ExtractedReadTable.GRNA2_COLUMN, row.getGRNA2())
                .set(ExtractedReadTable.CLONAL_BARCODE_COLUMN, row.getClonalBarcode()
                        .orElseThrow(() -> new IllegalArgumentException("raw frequency rows need a clonal barcode")))
                .set(ExtractedReadTable.SAMPLE_ID_COLUMN, row.getSampleId())
                .set(FREQUENCY_COLUMN, row.getFrequency()))) {
            writer.writeAllRecords(rows);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, e);
        }
    }

    public static void writeComplete(final Path path, final List<FrequencyRow> rows) {
        try (final TableWriter<FrequencyRow> writer = TableUtils.writer(path, COMPLETE_COLUMNS, (row, dataLine) -> dataLine
                .set(ExtractedReadTable.COMBINATION_COLUMN, row.getCombination())
                .set(ExtractedReadTable.CLONAL_BARCODE_COLUMN, row.getClonalBarcodeCenter())
                .set(ExtractedReadTable.GRNA1_COLUMN, row.getGRNA1())
                .set(ExtractedReadTable.GRNA2_COLUMN, row.getGRNA2())
                .set(ExtractedReadTable.SAMPLE_ID_COLUMN, row.getSampleId())
                .set(FREQUENCY_COLUMN, row.getFrequency()))) {
            writer.writeAllRecords(rows);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, e);
        }
    }

    /**
     * Reads a complete table, per sample or combined.
     */
    public static List<FrequencyRow> readComplete(final Path path) {
        try (final TableReader<FrequencyRow> reader = TableUtils.reader(path, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns, COMPLETE_COLUMNS, formatExceptionFactory);
            return dataLine -> new FrequencyRow(
                    dataLine.get(ExtractedReadTable.COMBINATION_COLUMN),
                    dataLine.get(ExtractedReadTable.CLONAL_BARCODE_COLUMN),
                    dataLine.get(ExtractedReadTable.GRNA1_COLUMN),
                    dataLine.get(ExtractedReadTable.GRNA2_COLUMN),
                    null,
                    dataLine.get(ExtractedReadTable.SAMPLE_ID_COLUMN),
                    dataLine.getLong(FREQUENCY_COLUMN));
        })) {
            return reader.toList();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }
}
