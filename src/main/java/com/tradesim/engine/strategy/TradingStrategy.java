package com.tradesim.engine.strategy;

import com.tradesim.engine.IndicatorSpec;
import com.tradesim.model.BotContext;
import com.tradesim.model.Decision;
import com.tradesim.model.Transaction;

import java.util.Set;

/**
 * A trading style. Implementations keep private state across cycles (counters,
 * previous values, their own price history) for as long as the bot instance lives.
 *
 * The scheduler is the only caller. A strategy reads nothing but the context it is
 * handed and never executes anything itself.
 */
public interface TradingStrategy {

    /**
     * Examine the context, update internal state and return this cycle's decision.
     * Must not keep a reference to {@code context} after returning.
     */
    Decision decide(BotContext context);

    /**
     * Indicators the scheduler should compute into each context
     */
    default Set<IndicatorSpec> requiredIndicators() {
        return Set.of();
    }

    /**
     * Called after one of this strategy's own decisions was applied. This is the only
     * trade history a strategy ever sees.
     */
    default void onTradeExecuted(Decision decision, Transaction transaction) {
    }

    /**
     * Identifier used to create the strategy and to tag its transactions
     */
    String getId();

    /**
     * Display name
     */
    String getName();
}
