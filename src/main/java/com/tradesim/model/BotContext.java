package com.tradesim.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view handed to a strategy once per cycle. Built fresh every cycle;
 * strategies must not keep a reference to it after decide() returns.
 */
public final class BotContext {
    private final List<PricePoint> priceWindow;
    private final double baseBalance;
    private final double quoteBalance;
    private final double currentPrice;
    private final TradingPair pair;
    private final long cycle;
    private final IndicatorSnapshot indicators;

    public BotContext(List<PricePoint> priceWindow, double baseBalance, double quoteBalance, double currentPrice,
            TradingPair pair, long cycle, IndicatorSnapshot indicators) {
        this.priceWindow = Collections.unmodifiableList(priceWindow);
        this.baseBalance = baseBalance;
        this.quoteBalance = quoteBalance;
        this.currentPrice = currentPrice;
        this.pair = Objects.requireNonNull(pair, "pair");
        this.cycle = cycle;
        this.indicators = indicators != null ? indicators : IndicatorSnapshot.empty();
    }

    /**
     * Raw (uninterpolated) recent samples of the base asset, oldest first
     */
    public List<PricePoint> getPriceWindow() {
        return priceWindow;
    }

    public double getBaseBalance() {
        return baseBalance;
    }

    public double getQuoteBalance() {
        return quoteBalance;
    }

    /**
     * Price of one base unit in quote terms
     */
    public double getCurrentPrice() {
        return currentPrice;
    }

    public TradingPair getPair() {
        return pair;
    }

    /**
     * Zero-based count of cycles run before this one
     */
    public long getCycle() {
        return cycle;
    }

    public IndicatorSnapshot getIndicators() {
        return indicators;
    }
}
