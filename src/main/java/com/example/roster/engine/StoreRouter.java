package com.example.roster.engine;

import com.example.roster.catalog.StoreProfile;
import com.example.roster.catalog.TimeRange;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

/**
 * Chooses the store a worker is sent to.
 * <ol>
 *   <li>A station that only one store requires always goes to that store.</li>
 *   <li>Café stations follow demand: the busiest store when it clearly dominates, the runner-up otherwise.</li>
 *   <li>Everything else is a weighted draw on traffic, nudged towards stores in a peak window.</li>
 * </ol>
 */
public class StoreRouter {

    static final double DOMINANCE_RATIO = 1.5;
    static final double PEAK_BONUS = 0.10;
    static final double JITTER_STEP = 0.05;
    static final double MIN_SHARE_FACTOR = 0.8;
    static final double MAX_SHARE_FACTOR = 1.4;

    private final List<StoreProfile> stores;
    private final List<StoreProfile> byTraffic;
    private final int iteration;
    private final Random random;

    public StoreRouter(List<StoreProfile> stores, int iteration, Random random) {
        this.stores = List.copyOf(stores);
        List<StoreProfile> sorted = new ArrayList<>(this.stores);
        sorted.sort(Comparator.comparingDouble(StoreProfile::trafficWeight).reversed());
        this.byTraffic = List.copyOf(sorted);
        this.iteration = iteration;
        this.random = random;
    }

    public Optional<StoreProfile> route(String station, DayOfWeek day, Optional<TimeRange> shift) {
        if (stores.isEmpty()) {
            return Optional.empty();
        }
        if (stores.size() == 1) {
            return Optional.of(stores.get(0));
        }
        List<StoreProfile> requiring = stores.stream().filter(s -> s.requires(station)).toList();
        if (requiring.size() == 1) {
            return Optional.of(requiring.get(0));
        }
        if (isDemandLed(station)) {
            StoreProfile busiest = byTraffic.get(0);
            StoreProfile runnerUp = byTraffic.get(1);
            return Optional.of(busiest.trafficWeight() > runnerUp.trafficWeight() * DOMINANCE_RATIO ? busiest : runnerUp);
        }
        return Optional.of(weightedDraw(day, shift));
    }

    static boolean isDemandLed(String station) {
        return station != null && station.toLowerCase(Locale.ROOT).contains("cafe");
    }

    private StoreProfile weightedDraw(DayOfWeek day, Optional<TimeRange> shift) {
        double[] shares = shares(day, shift);
        double roll = random.nextDouble();
        double cumulative = 0;
        for (int i = 0; i < stores.size() - 1; i++) {
            cumulative += shares[i];
            if (roll < cumulative) {
                return stores.get(i);
            }
        }
        return stores.get(stores.size() - 1);
    }

    /**
     * Share of each store in catalog order, after peak bonus, jitter and clamping.
     */
    double[] shares(DayOfWeek day, Optional<TimeRange> shift) {
        int n = stores.size();
        double total = stores.stream().mapToDouble(StoreProfile::trafficWeight).sum();
        StoreProfile busiest = byTraffic.get(0);
        double jitter = (iteration % 3) * JITTER_STEP - JITTER_STEP;
        double min = MIN_SHARE_FACTOR / n;
        double max = MAX_SHARE_FACTOR / n;
        double[] shares = new double[n];
        double sum = 0;
        for (int i = 0; i < n; i++) {
            StoreProfile store = stores.get(i);
            double share = total > 0 ? store.trafficWeight() / total : 1.0 / n;
            if (store.isPeak(day, shift)) {
                share += PEAK_BONUS;
            }
            if (store == busiest) {
                share += jitter;
            }
            shares[i] = Math.max(min, Math.min(max, share));
            sum += shares[i];
        }
        if (sum > 1.0) {
            for (int i = 0; i < n; i++) {
                shares[i] /= sum;
            }
        }
        return shares;
    }
}
