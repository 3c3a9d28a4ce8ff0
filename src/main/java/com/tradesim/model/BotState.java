package com.tradesim.model;

/**
 * Lifecycle of a bot instance. Every terminal state is absorbing.
 */
public enum BotState {
    NOT_RUNNING(false),
    STARTING(false),
    RUNNING(false),
    STOPPED(true),
    STOPLOSS_TRIGGERED(true),
    INSUFFICIENT_FUNDS(true),
    INVALID_DECISION(true),
    ERRORED(true);

    private final boolean terminal;

    BotState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isActive() {
        return this == STARTING || this == RUNNING;
    }
}
