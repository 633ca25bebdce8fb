package org.winslowlab.ultraseq.utils.table;

import com.opencsv.CSVWriter;
import org.winslowlab.ultraseq.utils.Utils;
import org.winslowlab.ultraseq.utils.io.IOUtils;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;

/**
 * Class to write comma separated value tables.
 * <p>
 * Values are quoted only when they contain a separator, a quote or a line break; quotes inside a value are doubled.
 * The header line is written before the first record, or on {@link #close} for empty tables,
 * unless the writer was created without a header.
 * </p>
 * <p>
 * Sub-classes implement {@link #composeLine} to fill in a {@link DataLine} from a record.
 * </p>
 *
 * @param <R> the row record type.
 */
public abstract class TableWriter<R> implements Closeable {

    /**
     * Lines written so far, including the header.
     */
    private long lineNumber;

    private final CSVWriter writer;

    private final TableColumnCollection columns;

    private boolean headerWritten;

    /**
     * Creates a new table writer given the file and column names.
     *
     * @param path         the destination file.
     * @param tableColumns the table column names.
     * @param writeHeader  whether a header line with the column names is written.
     * @throws IOException if one was raised when opening the destination file for writing.
     */
    public TableWriter(final Path path, final TableColumnCollection tableColumns, final boolean writeHeader) throws IOException {
        this(IOUtils.makeWriter(Utils.nonNull(path, "The file cannot be null.")), tableColumns, writeHeader);
    }

    public TableWriter(final Writer writer, final TableColumnCollection columns, final boolean writeHeader) {
        this.columns = Utils.nonNull(columns, "The columns cannot be null.");
        this.writer = new CSVWriter(Utils.nonNull(writer, "the input writer cannot be null"),
                TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.WRITE_ESCAPE_CHARACTER);
        this.headerWritten = !writeHeader;
    }

    /**
     * Writes a new record.
     *
     * @param record the record to write, cannot be {@code null}.
     * @throws IOException if one was raised by the underlying writer.
     */
    public void writeRecord(final R record) throws IOException {
        Utils.nonNull(record, "The record cannot be null.");
        writeHeaderIfApplies();
        final DataLine dataLine = new DataLine(lineNumber + 1, columns, IllegalArgumentException::new);
        composeLine(record, dataLine);
        writer.writeNext(dataLine.unpack(), false);
        lineNumber++;
    }

    /**
     * Writes several records in the order the iterable produces them.
     */
    public final void writeAllRecords(final Iterable<R> records) throws IOException {
        Utils.nonNull(records, "The record iterable cannot be null.");
        for (final R record : records) {
            writeRecord(record);
        }
    }

    @Override
    public final void close() throws IOException {
        writeHeaderIfApplies();
        writer.close();
    }

    public void flush() throws IOException {
        writer.flush();
    }

    private void writeHeaderIfApplies() {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[columns.columnCount()]), false);
            lineNumber++;
        }
        headerWritten = true;
    }

    /**
     * Composes the data-line to write for a record.
     *
     * @param record   the record to write, never {@code null}.
     * @param dataLine the destination data-line, never {@code null}; every column must be set.
     */
    protected abstract void composeLine(final R record, final DataLine dataLine);
}
