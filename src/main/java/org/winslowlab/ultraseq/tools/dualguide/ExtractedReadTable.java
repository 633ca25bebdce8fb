package org.winslowlab.ultraseq.tools.dualguide;

import org.winslowlab.ultraseq.utils.table.DataLine;
import org.winslowlab.ultraseq.utils.table.TableColumnCollection;
import org.winslowlab.ultraseq.utils.table.TableReader;
import org.winslowlab.ultraseq.utils.table.TableUtils;
import org.winslowlab.ultraseq.utils.table.TableWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Layout of the per-read tables written by extraction ({@code Unexpected_reads.csv} and {@code Intermediate_df.csv})
 * and read back by aggregation.
 */
public final class ExtractedReadTable {

    public static final String GRNA1_COLUMN = "gRNA1";
    public static final String GRNA2_COLUMN = "gRNA2";
    public static final String CLONAL_BARCODE_COLUMN = "Clonal_barcode";
    public static final String READ_ID_COLUMN = "Read_ID";
    public static final String SAMPLE_ID_COLUMN = "Sample_ID";
    public static final String CLASS_COLUMN = "Class";
    public static final String COMBINATION_COLUMN = "gRNA_combination";

    public static final TableColumnCollection COLUMNS = new TableColumnCollection(
            GRNA1_COLUMN, GRNA2_COLUMN, CLONAL_BARCODE_COLUMN, READ_ID_COLUMN, SAMPLE_ID_COLUMN, CLASS_COLUMN, COMBINATION_COLUMN);

    public static final String UNEXPECTED_READS_FILE_NAME = "Unexpected_reads.csv";
    public static final String INTERMEDIATE_FILE_NAME = "Intermediate_df.csv";

    private ExtractedReadTable() {}

    public static TableWriter<ExtractedRead> writer(final Path path) throws IOException {
        return TableUtils.writer(path, COLUMNS, ExtractedReadTable::compose);
    }

    private static void compose(final ExtractedRead read, final DataLine dataLine) {
        dataLine.set(GRNA1_COLUMN, read.getGRNA1())
                .set(GRNA2_COLUMN, read.getGRNA2())
                .set(CLONAL_BARCODE_COLUMN, read.getClonalBarcode())
                .set(READ_ID_COLUMN, read.getReadId())
                .set(SAMPLE_ID_COLUMN, read.getSampleId())
                .set(CLASS_COLUMN, read.getReadClass().getLabel())
                .set(COMBINATION_COLUMN, read.getCombination());
    }

    /**
     * Opens a per-read table. The combination column is not read back; it is always derived from the two guides.
     *
     * @throws org.winslowlab.ultraseq.exceptions.UserException.BadInput if a column is missing or a class is unknown.
     */
    public static TableReader<ExtractedRead> reader(final Path path) throws IOException {
        return TableUtils.reader(path, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns, new TableColumnCollection(
                    GRNA1_COLUMN, GRNA2_COLUMN, CLONAL_BARCODE_COLUMN, READ_ID_COLUMN, SAMPLE_ID_COLUMN, CLASS_COLUMN), formatExceptionFactory);
            return dataLine -> {
                final ReadClass readClass;
                try {
                    readClass = ReadClass.fromLabel(dataLine.get(CLASS_COLUMN));
                } catch (final IllegalArgumentException e) {
                    throw formatExceptionFactory.apply(e.getMessage());
                }
                return new ExtractedRead(dataLine.get(GRNA1_COLUMN), dataLine.get(GRNA2_COLUMN),
                        dataLine.get(CLONAL_BARCODE_COLUMN), dataLine.get(READ_ID_COLUMN),
                        dataLine.get(SAMPLE_ID_COLUMN), readClass);
            };
        });
    }
}
