package com.prism.service.core.catalog;

import com.prism.core.model.Event;
import com.prism.core.support.ScalarValues;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/** Closed set of aggregates. Counts report {@link Long}, sums report a normalised {@link BigDecimal}. */
public enum Metric {
    EVENTS("events", "Events", Aggregation.COUNT, null),
    USERS("users", "Users", Aggregation.DISTINCT_USERS, null),
    REVENUE("revenue", "Revenue", Aggregation.SUM, "revenue"),
    NET_DEMAND("netDemand", "Net Demand", Aggregation.SUM, "netDemand");

    public enum Aggregation {
        COUNT,
        DISTINCT_USERS,
        SUM
    }

    private final String key;
    private final String label;
    private final Aggregation aggregation;
    private final String property;

    Metric(String key, String label, Aggregation aggregation, String property) {
        this.key = key;
        this.label = label;
        this.aggregation = aggregation;
        this.property = property;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public Aggregation aggregation() {
        return aggregation;
    }

    /** Summed property for {@link Aggregation#SUM} metrics, otherwise {@code null}. */
    public String property() {
        return property;
    }

    /**
     * Per-event contribution before aggregation: {@code 1} for counts, the user id (possibly {@code null})
     * for distinct users, the coerced property value for sums.
     */
    public Object contribution(Event event) {
        return switch (aggregation) {
            case COUNT -> 1L;
            case DISTINCT_USERS -> event.userId();
            case SUM -> ScalarValues.toNumber(event.property(property));
        };
    }

    public Accumulator newAccumulator() {
        return switch (aggregation) {
            case COUNT -> new CountAccumulator();
            case DISTINCT_USERS -> new DistinctUsersAccumulator();
            case SUM -> new SumAccumulator(this);
        };
    }

    public static Metric fromKey(String key) {
        if (key == null) return null;
        for (Metric m : values()) {
            if (m.key.equals(key)) return m;
        }
        return null;
    }

    /** Running aggregate for one metric in one bucket. Not thread-safe; allocated per query. */
    public interface Accumulator {
        void accept(Event event);

        Number value();
    }

    private static final class CountAccumulator implements Accumulator {
        private long count;

        @Override
        public void accept(Event event) {
            count++;
        }

        @Override
        public Number value() {
            return count;
        }
    }

    private static final class DistinctUsersAccumulator implements Accumulator {
        private final Set<String> users = new HashSet<>();

        @Override
        public void accept(Event event) {
            if (event.userId() != null) {
                users.add(event.userId());
            }
        }

        @Override
        public Number value() {
            return (long) users.size();
        }
    }

    private static final class SumAccumulator implements Accumulator {
        private final Metric metric;
        private BigDecimal sum = BigDecimal.ZERO;

        private SumAccumulator(Metric metric) {
            this.metric = metric;
        }

        @Override
        public void accept(Event event) {
            sum = sum.add((BigDecimal) metric.contribution(event));
        }

        @Override
        public Number value() {
            return ScalarValues.normalize(sum);
        }
    }
}
