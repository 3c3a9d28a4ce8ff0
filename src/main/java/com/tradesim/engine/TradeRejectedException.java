package com.tradesim.engine;

/**
 * A request the ledger refused. Nothing was mutated when this is thrown.
 */
public class TradeRejectedException extends Exception {
    private final RejectionReason reason;

    public TradeRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TradeRejectedException(RejectionReason reason) {
        this(reason, reason.getDescription());
    }

    public RejectionReason getReason() {
        return reason;
    }
}
