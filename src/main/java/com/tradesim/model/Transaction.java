package com.tradesim.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable ledger record. Trades carry a side; deposits and withdrawals are
 * always USD-for-USD at price 1 and have no side.
 */
public final class Transaction {
    private final String userId;
    private final TransactionKind kind;
    private final String baseAsset;
    private final String quoteAsset;
    private final TradeSide side;
    private final double quantity;
    private final double price;
    private final Instant timestamp;
    private final Double baseUsdPrice;
    private final Double quoteUsdPrice;
    private final String executedByBot;

    public Transaction(String userId, TransactionKind kind, String baseAsset, String quoteAsset, TradeSide side,
            double quantity, double price, Instant timestamp, Double baseUsdPrice, Double quoteUsdPrice,
            String executedByBot) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.baseAsset = Objects.requireNonNull(baseAsset, "baseAsset");
        this.quoteAsset = Objects.requireNonNull(quoteAsset, "quoteAsset");
        if (kind == TransactionKind.TRADE && side == null) {
            throw new IllegalArgumentException("Trade transactions need a side");
        }
        this.side = kind == TransactionKind.TRADE ? side : null;
        this.quantity = quantity;
        this.price = price;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.baseUsdPrice = baseUsdPrice;
        this.quoteUsdPrice = quoteUsdPrice;
        this.executedByBot = executedByBot;
    }

    public static Transaction trade(String userId, TradingPair pair, TradeSide side, double quantity, double price,
            Instant timestamp, Double baseUsdPrice, Double quoteUsdPrice, String executedByBot) {
        return new Transaction(userId, TransactionKind.TRADE, pair.getBaseAsset(), pair.getQuoteAsset(), side,
                quantity, price, timestamp, baseUsdPrice, quoteUsdPrice, executedByBot);
    }

    public static Transaction deposit(String userId, String currency, double amount, Instant timestamp) {
        return new Transaction(userId, TransactionKind.DEPOSIT, currency, currency, null, amount, 1.0, timestamp,
                1.0, 1.0, null);
    }

    public static Transaction withdrawal(String userId, String currency, double amount, Instant timestamp) {
        return new Transaction(userId, TransactionKind.WITHDRAWAL, currency, currency, null, amount, 1.0, timestamp,
                1.0, 1.0, null);
    }

    /**
     * Signed change this record applies to each asset balance.
     */
    public Map<String, Double> balanceEffects() {
        Map<String, Double> effects = new LinkedHashMap<>();
        switch (kind) {
            case DEPOSIT:
                effects.put(baseAsset, quantity);
                break;
            case WITHDRAWAL:
                effects.put(baseAsset, -quantity);
                break;
            case TRADE:
                double quoteAmount = getQuoteAmount();
                if (side == TradeSide.BUY) {
                    effects.put(baseAsset, quantity);
                    effects.put(quoteAsset, -quoteAmount);
                } else {
                    effects.put(baseAsset, -quantity);
                    effects.put(quoteAsset, quoteAmount);
                }
                break;
        }
        return effects;
    }

    /**
     * Quote-asset value of the record (quantity x price)
     */
    public double getQuoteAmount() {
        return quantity * price;
    }

    public boolean isBotTrade() {
        return kind == TransactionKind.TRADE && executedByBot != null;
    }

    public String getUserId() {
        return userId;
    }

    public TransactionKind getKind() {
        return kind;
    }

    public String getBaseAsset() {
        return baseAsset;
    }

    public String getQuoteAsset() {
        return quoteAsset;
    }

    public TradeSide getSide() {
        return side;
    }

    public double getQuantity() {
        return quantity;
    }

    public double getPrice() {
        return price;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Double getBaseUsdPrice() {
        return baseUsdPrice;
    }

    public Double getQuoteUsdPrice() {
        return quoteUsdPrice;
    }

    public String getExecutedByBot() {
        return executedByBot;
    }

    @Override
    public String toString() {
        if (kind != TransactionKind.TRADE) {
            return String.format("%s %s %.2f %s", userId, kind, quantity, baseAsset);
        }
        return String.format("%s %s %.8f %s/%s @ %.2f%s", userId, side, quantity, baseAsset, quoteAsset, price,
                executedByBot != null ? " [bot " + executedByBot + "]" : "");
    }
}
