package com.storefront.anomaly.engine;

import com.storefront.anomaly.model.DimensionValue;

import java.util.Comparator;
import java.util.List;

/**
 * Fixed order used to break ties between dimension values: configured dimensions first,
 * in list order, then any other dimension alphabetically; within a dimension, values alphabetically.
 */
public final class DimensionPriority implements Comparator<DimensionValue> {

    private final List<String> order;

    public DimensionPriority(List<String> order) {
        this.order = List.copyOf(order);
    }

    public int rank(String dimension) {
        int idx = order.indexOf(dimension);
        return idx >= 0 ? idx : order.size();
    }

    public Comparator<String> dimensionOrder() {
        return Comparator.comparingInt(this::rank).thenComparing(Comparator.naturalOrder());
    }

    @Override
    public int compare(DimensionValue a, DimensionValue b) {
        int byDimension = dimensionOrder().compare(a.dimension(), b.dimension());
        if (byDimension != 0) return byDimension;
        return a.value().compareTo(b.value());
    }
}
