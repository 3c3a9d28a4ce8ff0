package com.tradesim.engine;

import com.tradesim.engine.strategy.TradingStrategy;
import com.tradesim.market.MarketDataStore;
import com.tradesim.model.AccountSnapshot;
import com.tradesim.model.BotContext;
import com.tradesim.model.BotState;
import com.tradesim.model.Decision;
import com.tradesim.model.IndicatorSnapshot;
import com.tradesim.model.PricePoint;
import com.tradesim.model.TradingPair;
import com.tradesim.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One decision cycle of a bot, run by the scheduler at a fixed rate.
 *
 * Cycle: snapshot prices and balances, compute indicators, ask the strategy,
 * check the stoploss against the balances captured at cycle start, then apply
 * the trade through the ledger. Every failure ends this bot only.
 */
class BotTask implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(BotTask.class);

    private final BotInstance instance;
    private final MarketDataStore marketData;
    private final IndicatorService indicatorService;
    private final PortfolioLedger ledger;
    private final PortfolioValuator valuator;
    private final ActiveBotRegistry registry;
    private final Clock clock;
    private final int windowPoints;

    BotTask(BotInstance instance, MarketDataStore marketData, IndicatorService indicatorService,
            PortfolioLedger ledger, PortfolioValuator valuator, ActiveBotRegistry registry, Clock clock,
            int windowPoints) {
        this.instance = instance;
        this.marketData = marketData;
        this.indicatorService = indicatorService;
        this.ledger = ledger;
        this.valuator = valuator;
        this.registry = registry;
        this.clock = clock;
        this.windowPoints = windowPoints;
    }

    @Override
    public void run() {
        long cycle = instance.beginCycle();
        if (cycle < 0) {
            return;
        }
        try {
            runCycle(cycle);
        } catch (TradeRejectedException e) {
            BotState terminal = e.getReason().isShortfall() ? BotState.INSUFFICIENT_FUNDS : BotState.INVALID_DECISION;
            logger.warn("⚠️ Bot {} for {} rejected at cycle {}: {}", strategyId(), instance.getUserId(), cycle,
                    e.getMessage());
            end(terminal, e.getMessage(), false);
        } catch (Exception e) {
            logger.error("❌ Bot {} for {} failed at cycle {}", strategyId(), instance.getUserId(), cycle, e);
            end(BotState.ERRORED, e.getClass().getSimpleName() + ": " + e.getMessage(), true);
        } catch (Error e) {
            // the bot must not stay RUNNING once its periodic task dies with the error
            logger.error("❌ Bot {} for {} hit a fatal error at cycle {}", strategyId(), instance.getUserId(), cycle,
                    e);
            end(BotState.ERRORED, e.getClass().getSimpleName() + ": " + e.getMessage(), true);
            throw e;
        }
    }

    private void runCycle(long cycle) throws TradeRejectedException {
        TradingPair pair = instance.getPair();
        String userId = instance.getUserId();

        // 1. Market snapshot
        List<PricePoint> window = marketData.window(pair.getBaseAsset(), windowPoints);
        OptionalDouble price = marketData.pairPrice(pair.getBaseAsset(), pair.getQuoteAsset());
        if (window.isEmpty() || price.isEmpty()) {
            logger.warn("⏭️ Bot {} for {} skipping cycle {}: no price for {}", strategyId(), userId, cycle, pair);
            return;
        }

        // 2. Account snapshot, the reference for this cycle's stoploss check
        Optional<AccountSnapshot> account = ledger.snapshot(userId);
        if (account.isEmpty()) {
            throw new IllegalStateException("Account disappeared: " + userId);
        }
        AccountSnapshot balances = account.get();
        double portfolioValue = valuator.totalValue(balances.getBalances());

        // 3. Decide
        TradingStrategy strategy = instance.getStrategy();
        IndicatorSnapshot indicators = indicatorService.computeFromPoints(window, strategy.requiredIndicators());
        BotContext context = new BotContext(window, balances.getBalance(pair.getBaseAsset()),
                balances.getBalance(pair.getQuoteAsset()), price.getAsDouble(), pair, cycle, indicators);
        Decision decision = strategy.decide(context);
        if (decision == null) {
            throw new IllegalStateException("Strategy " + strategy.getId() + " returned no decision");
        }

        // 4. Stoploss, before anything is applied
        double loss = instance.getInitialValue() - portfolioValue;
        if (loss >= instance.getStoploss()) {
            String why = String.format("Portfolio lost $%.2f of $%.2f (stoploss $%.2f)", loss,
                    instance.getInitialValue(), instance.getStoploss());
            logger.warn("🛑 Stoploss hit for {} on {}: {}", userId, pair, why);
            end(BotState.STOPLOSS_TRIGGERED, why, false);
            return;
        }

        logger.info("🤖 {} cycle {} on {} @ {}: {} (portfolio ${})", strategy.getId(), cycle, pair,
                String.format("%.4f", price.getAsDouble()), decision, String.format("%.2f", portfolioValue));
        if (decision.isHold()) {
            return;
        }

        // 5. Apply, unless a stop arrived while deciding
        Transaction tx;
        synchronized (instance) {
            if (!instance.isRunning()) {
                logger.info("Bot for {} stopped before applying {}", userId, decision);
                return;
            }
            tx = ledger.validateAndApply(userId, pair, decision, price.getAsDouble(),
                    valuator.usdPrice(pair.getBaseAsset()), valuator.usdPrice(pair.getQuoteAsset()),
                    strategy.getId());
        }
        strategy.onTradeExecuted(decision, tx);
    }

    private void end(BotState terminal, String reason, boolean interrupt) {
        if (instance.terminate(terminal, reason, clock.instant(), interrupt)) {
            logger.info("Bot {} for {} ended: {} ({})", strategyId(), instance.getUserId(), terminal, reason);
        }
        registry.finish(instance);
    }

    private String strategyId() {
        return instance.getStrategy().getId();
    }
}
