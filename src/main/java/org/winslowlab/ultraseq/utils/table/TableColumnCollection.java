package org.winslowlab.ultraseq.utils.table;

import org.winslowlab.ultraseq.utils.Utils;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Represents a list of table columns.
 * <p>
 * Column names are unique and never {@code null}. The first column name cannot start with
 * {@link TableUtils#COMMENT_PREFIX} since the whole line would then be read as a comment.
 * </p>
 */
public final class TableColumnCollection {

    private final List<String> names;

    private final Map<String, Integer> indexByName;

    public TableColumnCollection(final Iterable<String> names) {
        this(Utils.stream(Utils.nonNull(names, "the names cannot be null")).toArray(String[]::new));
    }

    public TableColumnCollection(final String... names) {
        this.names = Collections.unmodifiableList(Arrays.asList(checkNames(names.clone(), IllegalArgumentException::new)));
        this.indexByName = IntStream.range(0, names.length).boxed()
                .collect(Collectors.toMap(this.names::get, Function.identity()));
    }

    /**
     * Returns the column names ordered by column index.
     *
     * @return never {@code null}, an unmodifiable view.
     */
    public List<String> names() {
        return names;
    }

    public String nameAt(final int index) {
        Utils.validateArg(index >= 0 && index < names.size(), () -> "invalid column index: " + index);
        return names.get(index);
    }

    /**
     * @return -1 if there is no such column, the column index otherwise.
     */
    public int indexOf(final String name) {
        Utils.nonNull(name, "the column name cannot be null");
        return indexByName.getOrDefault(name, -1);
    }

    public boolean contains(final String name) {
        return indexByName.containsKey(Utils.nonNull(name, "cannot be null"));
    }

    public boolean containsAll(final String... names) {
        return Stream.of(Utils.nonNull(names, "names cannot be null")).allMatch(this::contains);
    }

    public boolean containsAll(final Iterable<String> names) {
        for (final String name : Utils.nonNull(names, "names cannot be null")) {
            if (!contains(name)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether the columns, in order, are exactly the given names.
     */
    public boolean matchesExactly(final String... names) {
        Utils.nonNull(names, "names cannot be null");
        if (names.length != this.names.size()) {
            return false;
        }
        for (int i = 0; i < names.length; i++) {
            if (!this.names.get(i).equals(names[i])) {
                return false;
            }
        }
        return true;
    }

    public int columnCount() {
        return names.size();
    }

    /**
     * Checks that a column name array is valid: non-empty, no {@code null} or repeated names and
     * a first name that does not look like a comment.
     *
     * @param columnNames      the column names to check.
     * @param exceptionFactory the factory of the exception to throw if the names are invalid.
     * @return the input {@code columnNames}.
     */
    public static String[] checkNames(final String[] columnNames,
                                      final Function<String, RuntimeException> exceptionFactory) {
        Utils.nonNull(columnNames, "column names cannot be null");
        Utils.nonNull(exceptionFactory, "exception factory cannot be null");

        if (columnNames.length == 0) {
            throw Utils.nonNull(exceptionFactory.apply("there must be at least one column"));
        }
        final Set<String> columnNameSet = new HashSet<>(columnNames.length);
        for (int i = 0; i < columnNames.length; i++) {
            final String columnName = Utils.nonNull(columnNames[i], "no column name can be null: e.g. " + i + " element");
            if (!columnNameSet.add(columnName)) {
                throw Utils.nonNull(exceptionFactory.apply("more than one column have the same name: " + columnNames[i]), "exception factory produces null exceptions");
            }
        }
        if (columnNames[0].startsWith(TableUtils.COMMENT_PREFIX)) {
            throw Utils.nonNull(exceptionFactory.apply("the first column name cannot start with the comment prefix"), "exception factory produces null exceptions");
        }
        return columnNames;
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof TableColumnCollection && ((TableColumnCollection) other).names.equals(names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return String.join(TableUtils.COLUMN_SEPARATOR_STRING, names);
    }
}
