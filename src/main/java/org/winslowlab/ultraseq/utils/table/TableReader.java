package org.winslowlab.ultraseq.utils.table;

import com.opencsv.CSVReader;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.utils.Utils;
import org.winslowlab.ultraseq.utils.io.IOUtils;

import java.io.*;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the contents of a comma separated value table.
 * <p>
 * The first non-comment line is the header with the column names, unless the reader was created with
 * {@link TableReaderOptions#headerless} options, in which case every non-comment line is a record.
 * Lines starting with {@link TableUtils#COMMENT_PREFIX} and blank lines are ignored.
 * </p>
 * <p>
 * Sub-classes turn each {@link DataLine} into a record by implementing {@link #createRecord}; they can
 * also validate the header by overriding {@link #processColumns}. Any format problem is reported as a
 * {@link UserException.BadInput} that names the source and line number, see {@link #formatException}.
 * </p>
 *
 * @param <R> the record type.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    /**
     * Name of the source, {@code null} if anonymous.
     */
    private final String source;

    /**
     * Line-number tracking reader underneath the CSV parser.
     */
    private final LineNumberReader reader;

    private TableColumnCollection columns;

    private final CSVReader csvReader;

    /**
     * Whether {@link #nextRecord} holds the next record to return, which may be {@code null} at the end of input.
     */
    private boolean nextRecordFetched = false;

    private R nextRecord;

    /**
     * Creates a new table reader for a plain or gzipped file.
     *
     * @param path the source file.
     * @throws IOException if an I/O exception occurred while reading the header.
     */
    public TableReader(final Path path) throws IOException {
        this(path, new TableReaderOptions());
    }

    public TableReader(final Path path, final TableReaderOptions tableReaderOptions) throws IOException {
        this(
            Utils.nonNull(path, "the input file cannot be null").toString(),
            IOUtils.makeReaderMaybeGzipped(path),
            tableReaderOptions
        );
    }

    /**
     * Creates a new table reader on an anonymous character source.
     */
    public TableReader(final Reader sourceReader) throws IOException {
        this(null, sourceReader, new TableReaderOptions());
    }

    protected TableReader(final String sourceName, final Reader sourceReader,
                          final TableReaderOptions tableReaderOptions) throws IOException {
        Utils.nonNull(sourceReader, "the reader cannot be null");
        Utils.nonNull(tableReaderOptions, "the options cannot be null");

        this.source = sourceName;
        this.reader = sourceReader instanceof LineNumberReader ? (LineNumberReader) sourceReader : new LineNumberReader(sourceReader);
        this.csvReader = new CSVReader(this.reader, TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.READ_ESCAPE_CHARACTER);
        findAndProcessHeaderLine(tableReaderOptions);
        this.nextRecordFetched = false;
    }

    private void findAndProcessHeaderLine(final TableReaderOptions tableReaderOptions) throws IOException {
        if (tableReaderOptions.headerlessColumns != null) {
            columns = tableReaderOptions.headerlessColumns;
        } else {
            final String[] line = Arrays.stream(skipCommentLines())
                    .map(columnName -> tableReaderOptions.columnRenamer.getOrDefault(columnName, columnName))
                    .toArray(String[]::new);
            TableColumnCollection.checkNames(line, this::formatException);
            columns = new TableColumnCollection(line);
        }
        processColumns(columns);
    }

    protected boolean isCommentLine(final String[] line) {
        return line.length > 0 && line[0].startsWith(TableUtils.COMMENT_PREFIX);
    }

    private static boolean isBlankLine(final String[] line) {
        return line.length == 0 || (line.length == 1 && line[0].trim().isEmpty());
    }

    /**
     * Composes the exception to throw when there is a formatting error, adding the source and current line.
     *
     * @param message the error message, can be {@code null}.
     * @return never {@code null}.
     */
    protected final UserException.BadInput formatException(final String message) {
        final String explanation = message == null ? "" : ": " + message;
        if (source == null) {
            return new UserException.BadInput(String.format("format error at line %d" + explanation, reader.getLineNumber()));
        } else {
            return new UserException.BadInput(String.format("format error in '%s' at line %d" + explanation, source, reader.getLineNumber()));
        }
    }

    /**
     * Process the columns of the table, by default does nothing.
     * Sub-classes check for mandatory columns here.
     *
     * @param tableColumns the table columns, never {@code null}.
     */
    protected void processColumns(@SuppressWarnings("unused") final TableColumnCollection tableColumns) {
        // nothing by default.
    }

    public TableColumnCollection columns() {
        Utils.validate(columns != null, "columns are null");
        return columns;
    }

    /**
     * Reads the next record from the source.
     *
     * @return {@code null} if there are no more records.
     * @throws IOException if any I/O exception occurred.
     */
    public final R readRecord() throws IOException {
        if (!nextRecordFetched) {
            nextRecord = fetchNextRecord();
        }
        nextRecordFetched = false;
        return nextRecord;
    }

    private R fetchNextRecord() throws IOException {
        nextRecordFetched = true;
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (isCommentLine(line) || isBlankLine(line)) {
                continue;
            }
            if (line.length != columns.columnCount()) {
                throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)", line.length, columns.columnCount()));
            }
            final R result = createRecord(new DataLine(reader.getLineNumber(), line, columns, this::formatException));
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private String[] skipCommentLines() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (!isCommentLine(line) && !isBlankLine(line)) {
                return line;
            }
        }
        throw formatException("premature end of table: header line not found");
    }

    /**
     * Transforms a data-line into a record; returning {@code null} skips the line.
     *
     * @param dataLine the data-line to transform, never {@code null}.
     * @return {@code null} to skip the line.
     */
    protected abstract R createRecord(final DataLine dataLine);

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {

            @Override
            public boolean hasNext() {
                if (!nextRecordFetched) {
                    try {
                        nextRecord = fetchNextRecord();
                    } catch (final IOException ex) {
                        throw new UncheckedIOException(ex);
                    }
                }
                return nextRecord != null;
            }

            @Override
            public R next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("there is no more record in the input");
                }
                nextRecordFetched = false;
                return nextRecord;
            }
        };
    }

    @Override
    public Spliterator<R> spliterator() {
        return Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
    }

    public Stream<R> stream() {
        return Utils.stream(this);
    }

    /**
     * Reads all remaining records into a list.
     * <p>
     * I/O problems are rethrown as {@link UserException.CouldNotReadInputFile}.
     * </p>
     */
    public List<R> toList() {
        try {
            return stream().collect(Collectors.toList());
        } catch (final UncheckedIOException ex) {
            throw new UserException.CouldNotReadInputFile("table " + (source == null ? "<anonymous>" : source), ex.getCause());
        }
    }
}
