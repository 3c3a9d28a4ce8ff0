package com.tradesim.market;

import com.tradesim.config.Config;
import com.tradesim.model.PricePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * System-wide price history: one {@link PriceWindow} per asset. Windows are
 * locked independently, so a busy asset never blocks readers of another one.
 */
public class MarketDataStore {
    private static final Logger logger = LoggerFactory.getLogger(MarketDataStore.class);

    private final Map<String, PriceWindow> windows = new ConcurrentHashMap<>();
    private final int capacity;
    private final String referenceCurrency;

    public MarketDataStore() {
        this(Config.getInt(Config.WINDOW_CAPACITY, 17280), Config.get(Config.REFERENCE_CURRENCY, "USD"));
    }

    public MarketDataStore(int capacity, String referenceCurrency) {
        this.capacity = capacity;
        this.referenceCurrency = referenceCurrency;
        logger.info("Market data store initialized (window capacity: {}, reference: {})", capacity,
                referenceCurrency);
    }

    public boolean append(PricePoint point) {
        return windows.computeIfAbsent(point.getAsset(), asset -> new PriceWindow(asset, capacity)).append(point);
    }

    /**
     * Most recent samples of an asset, oldest first. Empty when the asset was never seen.
     */
    public List<PricePoint> window(String asset, int count) {
        PriceWindow window = windows.get(asset);
        return window == null ? Collections.emptyList() : window.snapshot(count);
    }

    /**
     * Latest price of an asset in the reference currency. The reference currency itself is always 1.
     */
    public OptionalDouble latestPrice(String asset) {
        if (referenceCurrency.equals(asset)) {
            return OptionalDouble.of(1.0);
        }
        PriceWindow window = windows.get(asset);
        if (window == null) {
            return OptionalDouble.empty();
        }
        return window.latest().map(p -> OptionalDouble.of(p.getPrice())).orElse(OptionalDouble.empty());
    }

    /**
     * Price of one base unit expressed in the quote asset.
     */
    public OptionalDouble pairPrice(String baseAsset, String quoteAsset) {
        OptionalDouble base = latestPrice(baseAsset);
        OptionalDouble quote = latestPrice(quoteAsset);
        if (base.isEmpty() || quote.isEmpty() || quote.getAsDouble() <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(base.getAsDouble() / quote.getAsDouble());
    }

    public Optional<Instant> newestTimestamp(String asset) {
        PriceWindow window = windows.get(asset);
        return window == null ? Optional.empty() : window.newestTimestamp();
    }

    public Set<String> assets() {
        return Collections.unmodifiableSet(windows.keySet());
    }

    public String getReferenceCurrency() {
        return referenceCurrency;
    }

    public int getCapacity() {
        return capacity;
    }
}
