package com.storefront.anomaly.engine;

import java.util.Comparator;
import java.util.List;

/**
 * Position of metrics in the conversion funnel, top first. Metrics outside the funnel sort after it, alphabetically.
 */
public final class FunnelOrder implements Comparator<String> {

    private final List<String> stages;

    public FunnelOrder(List<String> stages) {
        this.stages = List.copyOf(stages);
    }

    /**
     * Funnel position of the metric, -1 when it is not part of the funnel.
     */
    public int position(String metric) {
        return stages.indexOf(metric);
    }

    public boolean contains(String metric) {
        return position(metric) >= 0;
    }

    @Override
    public int compare(String a, String b) {
        int pa = position(a);
        int pb = position(b);
        if (pa >= 0 && pb >= 0) return Integer.compare(pa, pb);
        if (pa >= 0) return -1;
        if (pb >= 0) return 1;
        return a.compareTo(b);
    }
}
