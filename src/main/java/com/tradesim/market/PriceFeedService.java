package com.tradesim.market;

import com.tradesim.config.Config;
import com.tradesim.model.PricePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the {@link MarketDataStore} fed. Each asset gets its own polling task,
 * which makes it the only writer of that asset's window.
 */
public class PriceFeedService {
    private static final Logger logger = LoggerFactory.getLogger(PriceFeedService.class);

    private final MarketDataStore store;
    private final PriceSource source;
    private final List<String> assets;
    private final Duration interval;
    private final int backfillPoints;
    private final ScheduledExecutorService pollingScheduler;
    private final List<ScheduledFuture<?>> pollers = new ArrayList<>();
    private volatile boolean running = false;

    public PriceFeedService(MarketDataStore store, PriceSource source) {
        this(store, source,
                Config.getList(Config.FEED_ASSETS, "BTC,ETH"),
                Duration.ofSeconds(Config.getLong(Config.FEED_INTERVAL_SECONDS, 5)),
                Config.getInt(Config.FEED_BACKFILL_POINTS, 720));
    }

    public PriceFeedService(MarketDataStore store, PriceSource source, List<String> assets, Duration interval,
            int backfillPoints) {
        this.store = store;
        this.source = source;
        this.assets = List.copyOf(assets);
        this.interval = interval;
        this.backfillPoints = backfillPoints;
        AtomicInteger threadCount = new AtomicInteger();
        this.pollingScheduler = Executors.newScheduledThreadPool(Math.max(1, this.assets.size()),
                r -> new Thread(r, "price-feed-" + threadCount.incrementAndGet()));
    }

    public synchronized void start() {
        if (running) {
            logger.warn("Price feed is already running");
            return;
        }
        running = true;

        for (String asset : assets) {
            backfill(asset);
            pollers.add(pollingScheduler.scheduleWithFixedDelay(() -> poll(asset),
                    interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS));
        }
        logger.info("📡 Price feed started for {} from {} source ({}s interval)",
                assets, source.getName(), interval.getSeconds());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        pollers.forEach(f -> f.cancel(false));
        pollers.clear();
        pollingScheduler.shutdown();
        logger.info("Price feed stopped");
    }

    /**
     * One poll of one asset. Errors are logged and the next poll runs anyway.
     */
    void poll(String asset) {
        try {
            PricePoint point = source.fetch(asset);
            if (store.append(point)) {
                logger.debug("Fetched {} price: ${}", asset, String.format("%.2f", point.getPrice()));
            }
        } catch (Exception e) {
            logger.error("Failed to fetch {} price from {}: {}", asset, source.getName(), e.getMessage());
        }
    }

    private void backfill(String asset) {
        if (backfillPoints <= 0 || !(source instanceof SimulatedPriceSource)) {
            return;
        }
        int added = 0;
        for (PricePoint point : ((SimulatedPriceSource) source).backfill(asset, backfillPoints, interval)) {
            if (store.append(point)) {
                added++;
            }
        }
        logger.info("Backfilled {} with {} simulated points", asset, added);
    }

    public boolean isRunning() {
        return running;
    }
}
