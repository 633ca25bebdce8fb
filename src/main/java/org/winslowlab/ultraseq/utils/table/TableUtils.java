package org.winslowlab.ultraseq.utils.table;

import com.google.common.collect.Sets;
import org.apache.commons.lang3.StringUtils;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.utils.Utils;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Common constants and utility methods for comma separated tables.
 */
public final class TableUtils {

    /**
     * Column separator.
     */
    public static final char COLUMN_SEPARATOR = ',';

    /**
     * Column separator as a string.
     */
    public static final String COLUMN_SEPARATOR_STRING = String.valueOf(COLUMN_SEPARATOR);

    /**
     * Comment line prefix string {@value}.
     * <p>
     * Lines that start with this prefix are comments and are ignored by readers.
     * </p>
     */
    public static final String COMMENT_PREFIX = "#";

    /**
     * Quote character.
     */
    public static final char QUOTE_CHARACTER = '\"';

    /**
     * Escape character used when writing; a quote inside a quoted value is doubled.
     */
    public static final char WRITE_ESCAPE_CHARACTER = QUOTE_CHARACTER;

    /**
     * Escape character used when reading. Doubled quotes are always understood by the parser,
     * so no other escape is recognized.
     */
    public static final char READ_ESCAPE_CHARACTER = '\0';

    /**
     * Creates a new table reader given a record extractor factory based on the columns found in the input.
     * <p>
     * The factory receives the input columns and the exception factory to use for formatting errors,
     * and must return a function that maps {@link DataLine} instances into records.
     * </p>
     *
     * @param path                   the input file.
     * @param recordExtractorFactory the record extractor function factory.
     * @param <R>                    the end record type.
     * @return never {@code null}.
     * @throws IOException if any took place while instantiating the reader.
     */
    public static <R> TableReader<R> reader(final Path path,
                                            final BiFunction<TableColumnCollection, Function<String, RuntimeException>, Function<DataLine, R>> recordExtractorFactory)
            throws IOException {
        return reader(path, new TableReaderOptions(), recordExtractorFactory);
    }

    /**
     * Same as {@link #reader(Path, BiFunction)} with explicit reading options.
     */
    public static <R> TableReader<R> reader(final Path path,
                                            final TableReaderOptions options,
                                            final BiFunction<TableColumnCollection, Function<String, RuntimeException>, Function<DataLine, R>> recordExtractorFactory)
            throws IOException {
        Utils.nonNull(recordExtractorFactory, "the record extractor factory cannot be null");
        return new TableReader<R>(path, options) {
            private Function<DataLine, R> recordExtractor;

            @Override
            protected void processColumns(final TableColumnCollection columns) {
                recordExtractor = recordExtractorFactory.apply(columns, this::formatException);
                if (recordExtractor == null) {
                    throw new IllegalStateException("the record extractor function cannot be null");
                }
            }

            @Override
            protected R createRecord(final DataLine dataLine) {
                return recordExtractor.apply(dataLine);
            }
        };
    }

    /**
     * Creates a new table reader from an anonymous or named character source.
     *
     * @param sourceName             the source name, {@code null} indicates that the source is anonymous.
     * @param reader                 the input reader.
     * @param recordExtractorFactory the record extractor function factory.
     * @param <R>                    the end record type.
     * @return never {@code null}.
     * @throws IOException if any took place while instantiating the reader.
     */
    public static <R> TableReader<R> reader(final String sourceName,
                                            final Reader reader,
                                            final BiFunction<TableColumnCollection, Function<String, RuntimeException>, Function<DataLine, R>> recordExtractorFactory)
            throws IOException {
        Utils.nonNull(recordExtractorFactory, "the record extractor factory cannot be null");
        return new TableReader<R>(sourceName, reader, new TableReaderOptions()) {
            private Function<DataLine, R> recordExtractor;

            @Override
            protected void processColumns(final TableColumnCollection columns) {
                recordExtractor = recordExtractorFactory.apply(columns, this::formatException);
                if (recordExtractor == null) {
                    throw new IllegalStateException("the record extractor function cannot be null");
                }
            }

            @Override
            protected R createRecord(final DataLine dataLine) {
                return recordExtractor.apply(dataLine);
            }
        };
    }

    /**
     * Creates a new table writer given the destination file, columns and the data-line composer.
     * @param path the destination file.
     * @param columns the output columns.
     * @param dataLineComposer the data-line composer given the record object.
     * @param <R> the record type.
     * @return never {@code null}.
     * @throws IOException if any was thrown when instantiating the writer.
     */
    public static <R> TableWriter<R> writer(final Path path, final TableColumnCollection columns, final BiConsumer<R, DataLine> dataLineComposer) throws IOException {
        return new DataLineComposerBasedTableWriter<>(path, columns, true, dataLineComposer);
    }

    /**
     * Creates a new table writer that does not emit a header line.
     */
    public static <R> TableWriter<R> headerlessWriter(final Path path, final TableColumnCollection columns, final BiConsumer<R, DataLine> dataLineComposer) throws IOException {
        return new DataLineComposerBasedTableWriter<>(path, columns, false, dataLineComposer);
    }

    /**
     * Creates a new table writer given the destination writer, columns and the data-line composer.
     */
    public static <R> TableWriter<R> writer(final Writer writer, final TableColumnCollection columns, final BiConsumer<R, DataLine> dataLineComposer) throws IOException {
        return new DataLineComposerBasedTableWriter<>(writer, columns, true, dataLineComposer);
    }

    /**
     * Checks if all mandatory columns are present in a {@link TableColumnCollection}.
     * @param columns                   the TableColumnCollection of columns to check
     * @param mandatoryColumns          the TableColumnCollection of mandatory columns
     * @param formatExceptionFactory    the format exception function factory
     * @throws UserException.BadInput   if any mandatory columns are missing
     */
    public static void checkMandatoryColumns(final TableColumnCollection columns, final TableColumnCollection mandatoryColumns,
                                             final Function<String, RuntimeException> formatExceptionFactory) {
        if (!columns.containsAll(mandatoryColumns.names())) {
            final Set<String> missingColumns = Sets.difference(new HashSet<>(mandatoryColumns.names()), new HashSet<>(columns.names()));
            throw formatExceptionFactory.apply("Bad header in file.  Not all mandatory columns are present.  Missing: " + StringUtils.join(missingColumns, ", "));
        }
    }

    private static final class DataLineComposerBasedTableWriter<R> extends TableWriter<R> {
        private final BiConsumer<R, DataLine> dataLineComposer;

        private DataLineComposerBasedTableWriter(final Path path, final TableColumnCollection columns, final boolean writeHeader,
                                                 final BiConsumer<R, DataLine> dataLineComposer) throws IOException {
            super(path, columns, writeHeader);
            this.dataLineComposer = Utils.nonNull(dataLineComposer, "the data-line composer cannot be null");
        }

        private DataLineComposerBasedTableWriter(final Writer writer, final TableColumnCollection columns, final boolean writeHeader,
                                                 final BiConsumer<R, DataLine> dataLineComposer) {
            super(writer, columns, writeHeader);
            this.dataLineComposer = Utils.nonNull(dataLineComposer, "the data-line composer cannot be null");
        }

        @Override
        protected void composeLine(final R record, final DataLine dataLine) {
            dataLineComposer.accept(record, dataLine);
        }
    }

    private TableUtils() {
        throw new UnsupportedOperationException();
    }
}
