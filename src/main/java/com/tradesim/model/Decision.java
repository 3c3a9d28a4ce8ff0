package com.tradesim.model;

import java.util.Objects;

/**
 * Strategy output for one cycle. Amounts are always in the quote asset of the
 * traded pair, never in base units.
 */
public final class Decision {

    public enum Action {
        HOLD,
        BUY,
        SELL
    }

    private static final Decision HOLD = new Decision(Action.HOLD, 0.0);

    private final Action action;
    private final double quoteAmount;

    private Decision(Action action, double quoteAmount) {
        this.action = action;
        this.quoteAmount = quoteAmount;
    }

    public static Decision hold() {
        return HOLD;
    }

    public static Decision buy(double quoteAmount) {
        return new Decision(Action.BUY, quoteAmount);
    }

    public static Decision sell(double quoteAmount) {
        return new Decision(Action.SELL, quoteAmount);
    }

    public Action getAction() {
        return action;
    }

    public double getQuoteAmount() {
        return quoteAmount;
    }

    public boolean isHold() {
        return action == Action.HOLD;
    }

    /**
     * Side of the trade this decision asks for; null for HOLD
     */
    public TradeSide getSide() {
        switch (action) {
            case BUY:
                return TradeSide.BUY;
            case SELL:
                return TradeSide.SELL;
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Decision))
            return false;
        Decision other = (Decision) o;
        return action == other.action && Double.compare(other.quoteAmount, quoteAmount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, quoteAmount);
    }

    @Override
    public String toString() {
        return isHold() ? "HOLD" : String.format("%s %.2f", action, quoteAmount);
    }
}
