package com.tradesim.engine;

import com.tradesim.config.Config;
import com.tradesim.engine.strategy.StrategyFactory;
import com.tradesim.engine.strategy.TradingStrategy;
import com.tradesim.market.MarketDataStore;
import com.tradesim.model.AccountSnapshot;
import com.tradesim.model.BotState;
import com.tradesim.model.BotStatus;
import com.tradesim.model.TradingPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one independent cycle task per active bot on a shared worker pool.
 *
 * Control surface: {@link #start}, {@link #stop}, {@link #status}. All three are
 * safe to call concurrently for different users and well-defined when repeated.
 */
public class BotScheduler {
    private static final Logger logger = LoggerFactory.getLogger(BotScheduler.class);

    private final MarketDataStore marketData;
    private final IndicatorService indicatorService;
    private final PortfolioLedger ledger;
    private final PortfolioValuator valuator;
    private final ActiveBotRegistry registry;
    private final StrategyFactory strategyFactory;
    private final Duration tickInterval;
    private final int windowPoints;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor executor;

    public BotScheduler(MarketDataStore marketData, IndicatorService indicatorService, PortfolioLedger ledger,
            PortfolioValuator valuator, ActiveBotRegistry registry) {
        this(marketData, indicatorService, ledger, valuator, registry, new StrategyFactory(),
                Duration.ofSeconds(Config.getLong(Config.BOT_TICK_INTERVAL_SECONDS, 60)),
                Config.getInt(Config.BOT_CONTEXT_WINDOW_POINTS, 720),
                Config.getInt(Config.BOT_SCHEDULER_THREADS, 4),
                Clock.systemUTC());
    }

    public BotScheduler(MarketDataStore marketData, IndicatorService indicatorService, PortfolioLedger ledger,
            PortfolioValuator valuator, ActiveBotRegistry registry, StrategyFactory strategyFactory,
            Duration tickInterval, int windowPoints, int threads, Clock clock) {
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("Tick interval must be positive");
        }
        this.marketData = marketData;
        this.indicatorService = indicatorService;
        this.ledger = ledger;
        this.valuator = valuator;
        this.registry = registry;
        this.strategyFactory = strategyFactory;
        this.tickInterval = tickInterval;
        this.windowPoints = windowPoints;
        this.clock = clock;

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "bot-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        logger.info("✅ Bot scheduler ready: tick={}s, window={} points, threads={}", tickInterval.getSeconds(),
                windowPoints, Math.max(1, threads));
    }

    /**
     * Start a bot for the user.
     *
     * @throws IllegalArgumentException for an unknown strategy or account, or a non-positive stoploss
     * @throws BotAlreadyRunningException when the user already has a running bot; that bot is left alone
     */
    public BotStatus start(String userId, String strategyId, TradingPair pair, double stoploss) {
        if (!(stoploss > 0) || Double.isInfinite(stoploss)) {
            throw new IllegalArgumentException("Stoploss must be positive, got " + stoploss);
        }
        if (executor.isShutdown()) {
            throw new IllegalStateException("Scheduler is shut down");
        }
        TradingStrategy strategy = strategyFactory.create(strategyId, stoploss);
        BotInstance instance;
        try {
            // claimed under the account lock so no manual trade lands between the check and the claim
            instance = ledger.withAccountLocked(userId, () -> {
                AccountSnapshot account = ledger.snapshot(userId).orElseThrow();

                // STARTING: capture the stoploss reference
                double initialValue = valuator.totalValue(account.getBalances());
                BotInstance claimed = new BotInstance(userId, strategy, pair, stoploss, initialValue,
                        clock.instant());
                if (!registry.tryStart(userId, claimed)) {
                    throw new BotAlreadyRunningException(userId);
                }
                return claimed;
            });
        } catch (TradeRejectedException e) {
            throw new IllegalArgumentException("Account not found: " + userId, e);
        }

        instance.markRunning();
        BotTask task = new BotTask(instance, marketData, indicatorService, ledger, valuator, registry, clock,
                windowPoints);
        ScheduledFuture<?> handle = executor.scheduleAtFixedRate(task, 0, tickInterval.toMillis(),
                TimeUnit.MILLISECONDS);
        instance.attachHandle(handle);

        logger.info("🚀 Started {} for {} on {} (stoploss ${}, portfolio ${})", strategy.getName(), userId, pair,
                String.format("%.2f", stoploss), String.format("%.2f", instance.getInitialValue()));
        return instance.toStatus();
    }

    /**
     * Stop the user's bot. Stopping a bot that is not running returns its last status.
     */
    public BotStatus stop(String userId) {
        return registry.stop(userId);
    }

    public BotStatus status(String userId) {
        return registry.status(userId);
    }

    public int activeCount() {
        return registry.activeCount();
    }

    /**
     * Abort every running bot and release the worker pool.
     */
    public void shutdown() {
        List<String> users = new ArrayList<>(registry.activeInstances().keySet());
        for (String userId : users) {
            registry.abort(userId, BotState.STOPPED, "Scheduler shutdown");
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Bot scheduler shut down ({} bots stopped)", users.size());
    }

    public Duration getTickInterval() {
        return tickInterval;
    }
}
