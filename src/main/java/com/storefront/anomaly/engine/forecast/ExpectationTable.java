package com.storefront.anomaly.engine.forecast;

import com.storefront.anomaly.model.Expectation;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable result of fitting every series of a run: one expectation per (series, hour).
 */
public final class ExpectationTable {

    private final Instant start;
    private final Map<SeriesKey, List<Expectation>> bySeries;

    public ExpectationTable(Instant start, Map<SeriesKey, List<Expectation>> bySeries) {
        this.start = start;
        this.bySeries = Collections.unmodifiableMap(bySeries);
    }

    public Optional<Expectation> find(SeriesKey key, Instant hour) {
        List<Expectation> expectations = bySeries.get(key);
        if (expectations == null) return Optional.empty();
        long index = (hour.getEpochSecond() - start.getEpochSecond()) / 3600L;
        if (index < 0 || index >= expectations.size()) return Optional.empty();
        return Optional.of(expectations.get((int) index));
    }

    public Set<SeriesKey> keys() {
        return bySeries.keySet();
    }

    public int seriesCount() {
        return bySeries.size();
    }
}
