package com.storefront.anomaly.engine.group;

import com.storefront.anomaly.model.AnomalyRecord;
import com.storefront.anomaly.model.Direction;

import java.time.Instant;
import java.util.List;

/**
 * Consecutive anomalous hours of one metric, all in the same direction and no more than the
 * maximum gap apart.
 */
record MetricRun(String metric, Direction direction, List<AnomalyRecord> records) {

    MetricRun {
        records = List.copyOf(records);
    }

    Instant start() {
        return records.get(0).getHour();
    }

    Instant end() {
        return records.get(records.size() - 1).getHour();
    }
}
