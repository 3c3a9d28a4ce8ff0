package com.tradesim.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Latest value of each requested indicator. An indicator that is still in its
 * warm-up period is absent, never zero.
 */
public final class IndicatorSnapshot {
    private static final IndicatorSnapshot EMPTY = new IndicatorSnapshot(Collections.emptyMap());

    private final Map<String, Double> values;

    public IndicatorSnapshot(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static IndicatorSnapshot empty() {
        return EMPTY;
    }

    public OptionalDouble value(String indicatorId) {
        Double value = values.get(indicatorId);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean has(String indicatorId) {
        return values.containsKey(indicatorId);
    }

    public Set<String> ids() {
        return values.keySet();
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
