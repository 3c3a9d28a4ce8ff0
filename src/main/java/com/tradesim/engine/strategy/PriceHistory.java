package com.tradesim.engine.strategy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded list of the prices a strategy has seen, oldest first.
 */
public class PriceHistory {
    private final Deque<Double> prices = new ArrayDeque<>();
    private final int maxSize;

    public PriceHistory(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.maxSize = maxSize;
    }

    public void push(double price) {
        prices.addLast(price);
        if (prices.size() > maxSize) {
            prices.removeFirst();
        }
    }

    public List<Double> prices() {
        return new ArrayList<>(prices);
    }

    /**
     * The most recent n prices, or fewer if not enough were seen
     */
    public List<Double> lastN(int n) {
        List<Double> all = prices();
        return all.subList(Math.max(0, all.size() - n), all.size());
    }

    public boolean hasAtLeast(int n) {
        return prices.size() >= n;
    }

    public int size() {
        return prices.size();
    }
}
