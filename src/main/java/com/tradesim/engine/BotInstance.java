package com.tradesim.engine;

import com.tradesim.engine.strategy.TradingStrategy;
import com.tradesim.model.BotState;
import com.tradesim.model.BotStatus;
import com.tradesim.model.TradingPair;

import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runtime record of one running bot. Never persisted; the strategy state it owns
 * is lost once the instance ends.
 *
 * State changes and trade application both synchronize on the instance, so a stop
 * request either lands before a cycle applies its trade or after it has finished.
 */
public class BotInstance {

    private final String userId;
    private final TradingStrategy strategy;
    private final TradingPair pair;
    private final double stoploss;
    private final double initialValue;
    private final Instant startedAt;
    private final AtomicLong cycles = new AtomicLong();

    private volatile BotState state = BotState.STARTING;
    private volatile String reason;
    private volatile Instant endedAt;
    private Future<?> handle;

    public BotInstance(String userId, TradingStrategy strategy, TradingPair pair, double stoploss,
            double initialValue, Instant startedAt) {
        this.userId = userId;
        this.strategy = strategy;
        this.pair = pair;
        this.stoploss = stoploss;
        this.initialValue = initialValue;
        this.startedAt = startedAt;
    }

    /**
     * STARTING to RUNNING, once the starting value has been captured.
     */
    synchronized boolean markRunning() {
        if (state != BotState.STARTING) {
            return false;
        }
        state = BotState.RUNNING;
        return true;
    }

    synchronized void attachHandle(Future<?> handle) {
        this.handle = handle;
        if (!state.isActive()) {
            // terminated before the task was attached
            handle.cancel(false);
        }
    }

    /**
     * Move to a terminal state. Only the first call wins; later calls leave the
     * recorded state and reason untouched.
     *
     * @param interrupt abort the task thread instead of letting the current cycle finish
     * @return true when this call ended the bot
     */
    synchronized boolean terminate(BotState terminal, String why, Instant at, boolean interrupt) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        if (!state.isActive()) {
            return false;
        }
        state = terminal;
        reason = why;
        endedAt = at;
        if (handle != null) {
            handle.cancel(interrupt);
        }
        return true;
    }

    /**
     * Claim the next cycle index, or -1 once the bot has left RUNNING.
     */
    synchronized long beginCycle() {
        if (state != BotState.RUNNING) {
            return -1;
        }
        return cycles.getAndIncrement();
    }

    public boolean isRunning() {
        return state == BotState.RUNNING;
    }

    public BotStatus toStatus() {
        return new BotStatus(state, strategy.getId(), strategy.getName(), pair, stoploss, initialValue,
                cycles.get(), startedAt, endedAt, reason);
    }

    public String getUserId() {
        return userId;
    }

    public TradingStrategy getStrategy() {
        return strategy;
    }

    public TradingPair getPair() {
        return pair;
    }

    public double getStoploss() {
        return stoploss;
    }

    public double getInitialValue() {
        return initialValue;
    }

    public BotState getState() {
        return state;
    }

    public long getCycleCount() {
        return cycles.get();
    }
}
