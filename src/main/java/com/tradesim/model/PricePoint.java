package com.tradesim.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One price sample of an asset, quoted in the reference currency
 */
public final class PricePoint {
    private final Instant timestamp;
    private final String asset;
    private final double price;

    public PricePoint(Instant timestamp, String asset, double price) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.asset = Objects.requireNonNull(asset, "asset");
        this.price = price;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getAsset() {
        return asset;
    }

    public double getPrice() {
        return price;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PricePoint))
            return false;
        PricePoint other = (PricePoint) o;
        return Double.compare(other.price, price) == 0
                && timestamp.equals(other.timestamp)
                && asset.equals(other.asset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, asset, price);
    }

    @Override
    public String toString() {
        return asset + "@" + price + " (" + timestamp + ")";
    }
}
