package com.tradesim.model;

import java.util.Objects;

/**
 * Pair A/B: A is the base asset being bought or sold, B is the quote asset it is priced in.
 */
public final class TradingPair {
    private final String baseAsset;
    private final String quoteAsset;

    public TradingPair(String baseAsset, String quoteAsset) {
        if (baseAsset == null || baseAsset.isBlank() || quoteAsset == null || quoteAsset.isBlank()) {
            throw new IllegalArgumentException("Base and quote asset are required");
        }
        if (baseAsset.equals(quoteAsset)) {
            throw new IllegalArgumentException("Base and quote asset must differ: " + baseAsset);
        }
        this.baseAsset = baseAsset;
        this.quoteAsset = quoteAsset;
    }

    public static TradingPair of(String baseAsset, String quoteAsset) {
        return new TradingPair(baseAsset, quoteAsset);
    }

    public String getBaseAsset() {
        return baseAsset;
    }

    public String getQuoteAsset() {
        return quoteAsset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TradingPair))
            return false;
        TradingPair other = (TradingPair) o;
        return baseAsset.equals(other.baseAsset) && quoteAsset.equals(other.quoteAsset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseAsset, quoteAsset);
    }

    @Override
    public String toString() {
        return baseAsset + "/" + quoteAsset;
    }
}
