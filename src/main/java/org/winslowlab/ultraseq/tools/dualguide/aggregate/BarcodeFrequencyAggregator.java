package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import org.winslowlab.ultraseq.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Counts unified rows (reads) per group, at two granularities.
 * <ul>
 *     <li>raw: per (combination, cluster center, gRNA1, gRNA2, raw clonal barcode, sample)</li>
 *     <li>complete: per (combination, cluster center, gRNA1, gRNA2, sample), all raw barcodes of a cluster together</li>
 * </ul>
 * Rows with no cluster center belong to no group and are not counted. Output rows come in ascending order of
 * their group key, compared field by field in the order listed above.
 */
public final class BarcodeFrequencyAggregator {

    private static final Ordering<Iterable<String>> KEY_ORDER = Ordering.<String>natural().lexicographical();

    private BarcodeFrequencyAggregator() {}

    public static List<FrequencyRow> aggregateRaw(final Collection<UnifiedRow> rows) {
        return aggregate(rows,
                row -> ImmutableList.of(row.getCombination(), row.getClonalBarcodeCenter().get(), row.getGRNA1(),
                        row.getGRNA2(), row.getClonalBarcode(), row.getSampleId()),
                (key, count) -> new FrequencyRow(key.get(0), key.get(1), key.get(2), key.get(3), key.get(4), key.get(5), count));
    }

    public static List<FrequencyRow> aggregateComplete(final Collection<UnifiedRow> rows) {
        return aggregate(rows,
                row -> ImmutableList.of(row.getCombination(), row.getClonalBarcodeCenter().get(), row.getGRNA1(),
                        row.getGRNA2(), row.getSampleId()),
                (key, count) -> new FrequencyRow(key.get(0), key.get(1), key.get(2), key.get(3), null, key.get(4), count));
    }

    private static List<FrequencyRow> aggregate(final Collection<UnifiedRow> rows,
                                                final Function<UnifiedRow, List<String>> keyFunction,
                                                final RowFactory rowFactory) {
        Utils.nonNull(rows, "rows cannot be null");
        final SortedMap<List<String>, Long> counts = new TreeMap<>(KEY_ORDER);
        for (final UnifiedRow row : rows) {
            if (row.getClonalBarcodeCenter().isPresent()) {
                counts.merge(keyFunction.apply(row), 1L, Long::sum);
            }
        }
        final List<FrequencyRow> result = new ArrayList<>(counts.size());
        for (final Map.Entry<List<String>, Long> entry : counts.entrySet()) {
            result.add(rowFactory.create(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    @FunctionalInterface
    private interface RowFactory {
        FrequencyRow create(List<String> key, long count);
    }
}
