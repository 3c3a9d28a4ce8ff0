package com.tradesim.engine;

public enum RejectionReason {
    INVALID_QUANTITY("Quantity must be positive"),
    INSUFFICIENT_FUNDS("Insufficient quote balance"),
    INSUFFICIENT_ASSETS("Insufficient base balance"),
    UNKNOWN_ACCOUNT("Account not found"),
    PRICE_UNAVAILABLE("No price available"),
    DEPOSIT_TOO_SMALL("Deposit below minimum"),
    DEPOSIT_TOO_LARGE("Deposit above maximum"),
    WITHDRAWAL_EXCEEDS_BALANCE("Withdrawal exceeds balance"),
    BOT_ACTIVE("A bot is trading this account");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * True for the balance shortfalls that end a bot with INSUFFICIENT_FUNDS
     */
    public boolean isShortfall() {
        return this == INSUFFICIENT_FUNDS || this == INSUFFICIENT_ASSETS;
    }
}
