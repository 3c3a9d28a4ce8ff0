package com.tradesim.market;

import com.tradesim.model.PricePoint;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Offline price source: a bounded random walk around an anchor price per asset.
 * Also produces a synthetic history so bots have data right after startup.
 */
public class SimulatedPriceSource implements PriceSource {

    private static final double STEP_VOLATILITY = 0.0008; // 0.08% per sample
    private static final double MAX_DRIFT = 0.10; // stay within +/-10% of anchor

    private final Map<String, Double> anchors = new HashMap<>();
    private final Map<String, Double> lastPrices = new HashMap<>();
    private final Random random;
    private final Clock clock;

    public SimulatedPriceSource() {
        this(new Random(), Clock.systemUTC());
    }

    public SimulatedPriceSource(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
        anchors.put("BTC", 50000.0);
        anchors.put("ETH", 3000.0);
    }

    public void setAnchor(String asset, double price) {
        synchronized (this) {
            anchors.put(asset, price);
            lastPrices.remove(asset);
        }
    }

    @Override
    public PricePoint fetch(String asset) {
        synchronized (this) {
            double anchor = anchors.getOrDefault(asset, 100.0);
            double last = lastPrices.getOrDefault(asset, anchor);
            double next = last * (1 + random.nextGaussian() * STEP_VOLATILITY);
            next = Math.max(anchor * (1 - MAX_DRIFT), Math.min(anchor * (1 + MAX_DRIFT), next));
            lastPrices.put(asset, next);
            return new PricePoint(clock.instant(), asset, next);
        }
    }

    /**
     * Synthetic history of {@code count} samples spaced {@code step} apart, ending now.
     * Slow trend plus a shorter swing plus noise, all relative to the anchor.
     */
    public List<PricePoint> backfill(String asset, int count, Duration step) {
        double base;
        synchronized (this) {
            base = anchors.getOrDefault(asset, 100.0);
        }
        Instant now = clock.instant();
        List<PricePoint> points = new ArrayList<>(count);
        for (int i = count - 1; i >= 0; i--) {
            Instant timestamp = now.minus(step.multipliedBy(i + 1L));
            double trend = Math.sin(i / 100.0) * base * 0.01;
            double shortTerm = Math.sin(i / 20.0) * base * 0.005;
            double noise = Math.sin(i * 7.0) * base * 0.0002;
            points.add(new PricePoint(timestamp, asset, base + trend + shortTerm + noise));
        }
        return points;
    }

    @Override
    public String getName() {
        return "simulated";
    }
}
