package com.storefront.anomaly.engine.classify;

import com.storefront.anomaly.config.AnalysisConfig;
import com.storefront.anomaly.engine.FunnelOrder;
import com.storefront.anomaly.model.AnomalyGroup;
import com.storefront.anomaly.model.MetricGroupSummary;
import com.storefront.anomaly.model.RootCause;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Points an anomaly group at the metric it most likely started from.
 *
 * The lead metric is the one with the most anomalous hours. When metrics further up the funnel
 * are anomalous too, and together reach funnelUpstreamShare of the lead's hours, the group is
 * read as a funnel effect of the most anomalous upstream metric. Otherwise the lead metric is
 * the direct cause.
 */
@Component
public class RootCauseAnalyzer {

    private final AnalysisConfig config;

    public RootCauseAnalyzer(AnalysisConfig config) {
        this.config = config;
    }

    public AnomalyGroup annotate(AnomalyGroup group) {
        return group.withRootCause(analyze(group));
    }

    RootCause analyze(AnomalyGroup group) {
        FunnelOrder funnel = new FunnelOrder(config.getReporting().getFunnelOrder());
        // Metrics arrive in funnel order; ties keep the upper one.
        Comparator<MetricGroupSummary> byHours = Comparator.comparingInt(MetricGroupSummary::getAnomalousHours);

        MetricGroupSummary lead = maxFirst(group.getMetrics(), byHours).orElseThrow();

        int leadPosition = funnel.position(lead.getMetric());
        List<MetricGroupSummary> upstream = leadPosition <= 0
                ? List.of()
                : group.getMetrics().stream()
                        .filter(m -> funnel.contains(m.getMetric()))
                        .filter(m -> funnel.position(m.getMetric()) < leadPosition)
                        .toList();

        int upstreamHours = upstream.stream().mapToInt(MetricGroupSummary::getAnomalousHours).sum();
        double share = config.getReporting().getFunnelUpstreamShare();

        if (!upstream.isEmpty() && upstreamHours >= share * lead.getAnomalousHours()) {
            MetricGroupSummary source = maxFirst(upstream, byHours).orElseThrow();
            return RootCause.builder()
                    .type(RootCause.Type.FUNNEL_EFFECT)
                    .metric(source.getMetric())
                    .contributor(source.getPrimaryContributor())
                    .description(describe("Funnel effect from " + source.getMetric(), source))
                    .build();
        }
        return RootCause.builder()
                .type(RootCause.Type.DIRECT)
                .metric(lead.getMetric())
                .contributor(lead.getPrimaryContributor())
                .description(describe("Direct anomaly in " + lead.getMetric(), lead))
                .build();
    }

    private static Optional<MetricGroupSummary> maxFirst(List<MetricGroupSummary> summaries,
                                                         Comparator<MetricGroupSummary> comparator) {
        MetricGroupSummary best = null;
        for (MetricGroupSummary s : summaries) {
            if (best == null || comparator.compare(s, best) > 0) {
                best = s;
            }
        }
        return Optional.ofNullable(best);
    }

    private static String describe(String prefix, MetricGroupSummary summary) {
        return summary.hasPrimaryContributor()
                ? prefix + " (" + summary.getPrimaryContributor() + ")"
                : prefix;
    }
}
