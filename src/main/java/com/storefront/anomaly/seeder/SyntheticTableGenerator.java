package com.storefront.anomaly.seeder;

import com.storefront.anomaly.model.MetricHourObservation;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates a realistic hourly storefront table for demos and tests.
 *
 * Visitors follow a daily curve (quiet nights, evening peak) and a weekend uplift. Every lower
 * funnel stage is a fixed conversion rate of visitors, with count noise of roughly sqrt(mean).
 * Each hour is broken down by device and by location.
 *
 * Three incidents are injected near the end of the table (see {@link #plannedInjections(int)}):
 *   - an iOS outage on the day before the last one, hitting every funnel stage (shared cause)
 *   - a one-hour US visitors spike on the last night (isolated)
 *   - on the last afternoon, DE landing page views vanish while Android product views surge (different causes)
 *
 * The same seed always yields the same table.
 */
@Component
public class SyntheticTableGenerator {

    public static final int DEFAULT_DAYS = 28;

    // Monday, so weekly cycles line up with calendar weeks.
    public static final Instant DEFAULT_START = Instant.parse("2025-02-03T00:00:00Z");

    private static final long SEED = 42L;

    private static final Map<String, Double> FUNNEL_RATES = orderedMap(
            "visitors", 1.0,
            "landing_page_viewers", 0.9,
            "product_viewers", 0.6,
            "added_to_cart", 0.15,
            "checkout_started", 0.08,
            "orders", 0.05,
            "buyers", 0.045);

    private static final Map<String, Map<String, Double>> DIMENSION_SHARES = orderedMap(
            "device", orderedMap("iOS", 0.45, "Android", 0.35, "desktop", 0.20),
            "location", orderedMap("US", 0.5, "UK", 0.2, "DE", 0.15, "FR", 0.15));

    private static final double BASE_VISITORS = 400.0;

    /**
     * Incident injected into the table: the value's share of each listed metric is multiplied by
     * {@code multiplier} for {@code length} hours starting at hour index {@code startIndex}.
     */
    public record Injection(List<String> metrics, String dimension, String value,
                            int startIndex, int length, double multiplier) {

        boolean covers(String metric, int index) {
            return metrics.contains(metric) && index >= startIndex && index < startIndex + length;
        }
    }

    public List<MetricHourObservation> generate(int days) {
        return generate(DEFAULT_START, days);
    }

    public List<MetricHourObservation> generate(Instant start, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1, got " + days);
        }
        Random random = new Random(SEED);
        int hours = days * 24;
        List<Injection> injections = plannedInjections(days);

        List<MetricHourObservation> table = new ArrayList<>(hours * FUNNEL_RATES.size());
        for (Map.Entry<String, Double> stage : FUNNEL_RATES.entrySet()) {
            String metric = stage.getKey();
            for (int i = 0; i < hours; i++) {
                Instant hour = start.plus(Duration.ofHours(i));
                double mean = BASE_VISITORS * stage.getValue() * dailyFactor(hour) * weeklyFactor(hour);
                long total = Math.max(0L, Math.round(mean + random.nextGaussian() * Math.sqrt(mean)));

                Injection injection = null;
                for (Injection candidate : injections) {
                    if (candidate.covers(metric, i)) {
                        injection = candidate;
                        break;
                    }
                }
                table.add(observation(metric, hour, total, injection));
            }
        }
        return table;
    }

    /**
     * Incidents injected into a table of the given length. Incidents that would fall before the
     * start of a short table are left out.
     */
    public List<Injection> plannedInjections(int days) {
        int hours = days * 24;
        List<Injection> injections = new ArrayList<>();
        addIfInside(injections, hours, new Injection(List.copyOf(FUNNEL_RATES.keySet()),
                "device", "iOS", hours - 48 + 10, 4, 0.15));
        addIfInside(injections, hours, new Injection(List.of("visitors"),
                "location", "US", hours - 24 + 3, 1, 4.0));
        addIfInside(injections, hours, new Injection(List.of("landing_page_viewers"),
                "location", "DE", hours - 24 + 15, 4, 0.0));
        addIfInside(injections, hours, new Injection(List.of("product_viewers"),
                "device", "Android", hours - 24 + 15, 4, 2.5));
        return List.copyOf(injections);
    }

    private static void addIfInside(List<Injection> injections, int hours, Injection injection) {
        if (injection.startIndex() >= 0 && injection.startIndex() + injection.length() <= hours) {
            injections.add(injection);
        }
    }

    private MetricHourObservation observation(String metric, Instant hour, long total, Injection injection) {
        String leading = injection != null ? injection.dimension() : "device";
        Map<String, Long> leadingSplit = split(total, DIMENSION_SHARES.get(leading));
        if (injection != null) {
            leadingSplit.computeIfPresent(injection.value(),
                    (v, c) -> Math.round(c * injection.multiplier()));
        }
        long adjustedTotal = leadingSplit.values().stream().mapToLong(Long::longValue).sum();

        MetricHourObservation.MetricHourObservationBuilder builder = MetricHourObservation.builder()
                .metric(metric)
                .hour(hour)
                .count(adjustedTotal)
                .dimension(leading, leadingSplit);
        for (Map.Entry<String, Map<String, Double>> dimension : DIMENSION_SHARES.entrySet()) {
            if (!dimension.getKey().equals(leading)) {
                builder.dimension(dimension.getKey(), split(adjustedTotal, dimension.getValue()));
            }
        }
        return builder.build();
    }

    // Rounded shares; the last value takes the remainder so the split sums to the total.
    private static Map<String, Long> split(long total, Map<String, Double> shares) {
        Map<String, Long> counts = new LinkedHashMap<>();
        long assigned = 0;
        int remaining = shares.size();
        for (Map.Entry<String, Double> share : shares.entrySet()) {
            long count = --remaining == 0
                    ? total - assigned
                    : Math.min(total - assigned, Math.round(total * share.getValue()));
            counts.put(share.getKey(), count);
            assigned += count;
        }
        return counts;
    }

    private static double dailyFactor(Instant hour) {
        int hourOfDay = (int) ((hour.getEpochSecond() / 3600L) % 24);
        // Trough around 04:00 UTC, peak around 16:00 UTC.
        return 1.0 + 0.6 * Math.sin(2 * Math.PI * (hourOfDay - 10) / 24.0);
    }

    private static double weeklyFactor(Instant hour) {
        // 1970-01-01 was a Thursday: day 0 of the epoch is Thursday, so Saturday/Sunday are days 2 and 3.
        long dayOfWeek = Math.floorMod(hour.getEpochSecond() / 86_400L, 7L);
        return dayOfWeek == 2 || dayOfWeek == 3 ? 1.25 : 1.0;
    }

    private static <V> Map<String, V> orderedMap(Object... keysAndValues) {
        Map<String, V> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            @SuppressWarnings("unchecked")
            V value = (V) keysAndValues[i + 1];
            map.put((String) keysAndValues[i], value);
        }
        return map;
    }
}
