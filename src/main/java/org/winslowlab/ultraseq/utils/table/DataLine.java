package org.winslowlab.ultraseq.utils.table;

import org.winslowlab.ultraseq.utils.Utils;

import java.util.function.Function;

/**
 * Table data-line string array wrapper.
 * <p>
 * Values are accessed by column name or index. Typed getters report conversion problems through the
 * format error factory provided by the enclosing reader, so the message carries the source location.
 * </p>
 */
public final class DataLine {

    private final long lineNumber;

    private final String[] values;

    private final TableColumnCollection columns;

    private final Function<String, RuntimeException> formatErrorFactory;

    /**
     * Creates a new data-line instance.
     * <p>
     * The value array passed is not copied and will be used directly to store the data-line values.
     * </p>
     */
    DataLine(final long lineNumber, final String[] values, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this.lineNumber = lineNumber;
        this.values = Utils.nonNull(values, "the value array cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "the format error factory cannot be null");
        if (values.length != columns.columnCount()) {
            throw new IllegalArgumentException("mismatching value length and column count");
        }
    }

    /**
     * Creates a new empty data-line instance to be filled with {@link #set} calls.
     */
    public DataLine(final long lineNumber, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this(lineNumber, new String[Utils.nonNull(columns, "the columns cannot be null").columnCount()], columns, formatErrorFactory);
    }

    public TableColumnCollection columns() {
        return columns;
    }

    /**
     * @return the line number of this data-line in its source or destination, 1-based.
     */
    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns a reference to the data-line values after making sure that they are all defined.
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException(String.format("some data line value remains undefined: e.g. column '%s' index %d", columns.nameAt(i), i));
            }
        }
        return values;
    }

    /**
     * Sets the string value in the data-line that correspond to a column by its name.
     *
     * @throws IllegalArgumentException if {@code name} is {@code null} or it does not match an actual column name.
     */
    public DataLine set(final String name, final String value) {
        return set(columnIndex(name), value);
    }

    public DataLine set(final String name, final long value) {
        return set(columnIndex(name), Long.toString(value));
    }

    public DataLine set(final int index, final String value) {
        Utils.validateArg(index >= 0 && index < values.length, () -> "invalid column index: " + index);
        if (index == 0 && value != null && value.startsWith(TableUtils.COMMENT_PREFIX)) {
            throw new IllegalArgumentException("the value of the first column cannot start with the comment prefix: " + TableUtils.COMMENT_PREFIX);
        }
        values[index] = value;
        return this;
    }

    /**
     * Returns the string value in a column by its index.
     *
     * @throws IllegalStateException if the value for that column is undefined ({@code null}).
     */
    public String get(final int index) {
        Utils.validateArg(index >= 0 && index < values.length, () -> "invalid column index: " + index);
        final String result = values[index];
        if (result == null) {
            throw new IllegalStateException("requested column value at " + index + " has not been initialized yet");
        }
        return result;
    }

    /**
     * Returns the string value in a column by its name.
     *
     * @throws IllegalArgumentException if {@code columnName} is {@code null} or an unknown column name.
     */
    public String get(final String columnName) {
        return get(columnIndex(columnName));
    }

    /**
     * Returns the long value in a column by its name.
     *
     * @throws RuntimeException the format error factory product if the value is not a long.
     */
    public long getLong(final String columnName) {
        final int index = columnIndex(columnName);
        try {
            return Long.parseLong(get(index).trim());
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected long value for column %s but found %s", columnName, get(index)));
        }
    }

    private int columnIndex(final String columnName) {
        final int index = columns.indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("there is no such a column: " + columnName);
        }
        return index;
    }
}
