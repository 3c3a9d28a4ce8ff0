package com.tradesim.model;

import java.time.Instant;

/**
 * Point-in-time status of a user's bot as reported by the control surface.
 */
public final class BotStatus {
    private static final BotStatus NOT_RUNNING = new BotStatus(BotState.NOT_RUNNING, null, null, null, 0.0, 0.0, 0L,
            null, null, null);

    private final BotState state;
    private final String strategyId;
    private final String strategyName;
    private final TradingPair pair;
    private final double stoploss;
    private final double initialPortfolioValue;
    private final long cycleCount;
    private final Instant startedAt;
    private final Instant endedAt;
    private final String reason;

    public BotStatus(BotState state, String strategyId, String strategyName, TradingPair pair, double stoploss,
            double initialPortfolioValue, long cycleCount, Instant startedAt, Instant endedAt, String reason) {
        this.state = state;
        this.strategyId = strategyId;
        this.strategyName = strategyName;
        this.pair = pair;
        this.stoploss = stoploss;
        this.initialPortfolioValue = initialPortfolioValue;
        this.cycleCount = cycleCount;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.reason = reason;
    }

    public static BotStatus notRunning() {
        return NOT_RUNNING;
    }

    public BotState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == BotState.RUNNING;
    }

    public String getStrategyId() {
        return strategyId;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public TradingPair getPair() {
        return pair;
    }

    public double getStoploss() {
        return stoploss;
    }

    public double getInitialPortfolioValue() {
        return initialPortfolioValue;
    }

    public long getCycleCount() {
        return cycleCount;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    /**
     * Why the bot left RUNNING; null while it runs
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        if (state == BotState.NOT_RUNNING) {
            return "NOT_RUNNING";
        }
        return String.format("%s %s on %s (cycles=%d%s)", state, strategyName, pair, cycleCount,
                reason != null ? ", reason=" + reason : "");
    }
}
