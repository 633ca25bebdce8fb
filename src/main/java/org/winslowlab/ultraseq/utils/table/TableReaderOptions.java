package org.winslowlab.ultraseq.utils.table;

import org.winslowlab.ultraseq.utils.Utils;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Options that change how a {@link TableReader} interprets the start of its input.
 */
public class TableReaderOptions {

    /**
     * When not {@code null} the input has no header line and these are its columns.
     */
    TableColumnCollection headerlessColumns = null;

    /**
     * Header names to replace as the header is read, old name to new name.
     */
    Map<String, String> columnRenamer = new HashMap<>();

    public TableReaderOptions() {}

    public TableReaderOptions(final Map<String, String> columnRenamer) {
        this.columnRenamer = Collections.unmodifiableMap(new HashMap<>(Utils.nonNull(columnRenamer)));
    }

    /**
     * Options for a headerless input whose columns are known in advance.
     */
    public static TableReaderOptions headerless(final TableColumnCollection columns) {
        final TableReaderOptions result = new TableReaderOptions();
        result.headerlessColumns = Utils.nonNull(columns, "the columns cannot be null");
        return result;
    }
}
