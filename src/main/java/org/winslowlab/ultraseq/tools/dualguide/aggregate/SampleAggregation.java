package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import com.google.common.collect.ImmutableList;
import org.winslowlab.ultraseq.utils.Utils;

import java.util.List;

/**
 * The raw and complete frequency tables of one sample, with the join counts that produced them.
 */
public final class SampleAggregation {

    private final String sample;
    private final ImmutableList<FrequencyRow> raw;
    private final ImmutableList<FrequencyRow> complete;
    private final JoinStatistics statistics;

    public SampleAggregation(final String sample, final List<FrequencyRow> raw, final List<FrequencyRow> complete,
                             final JoinStatistics statistics) {
        this.sample = Utils.nonNull(sample);
        this.raw = ImmutableList.copyOf(raw);
        this.complete = ImmutableList.copyOf(complete);
        this.statistics = Utils.nonNull(statistics);
    }

    public String getSample() {
        return sample;
    }

    public ImmutableList<FrequencyRow> getRaw() {
        return raw;
    }

    public ImmutableList<FrequencyRow> getComplete() {
        return complete;
    }

    public JoinStatistics getStatistics() {
        return statistics;
    }
}
