package com.tradesim.model;

import java.util.List;

/**
 * Lifetime figures derived from a transaction history on demand. Nothing here
 * is stored alongside the ledger.
 */
public final class LedgerStatistics {
    private final int tradeCount;
    private final int botTradeCount;
    private final int buyCount;
    private final int sellCount;
    private final double totalBoughtUsd;
    private final double totalSoldUsd;
    private final double totalDeposits;
    private final double totalWithdrawals;

    private LedgerStatistics(int tradeCount, int botTradeCount, int buyCount, int sellCount, double totalBoughtUsd,
            double totalSoldUsd, double totalDeposits, double totalWithdrawals) {
        this.tradeCount = tradeCount;
        this.botTradeCount = botTradeCount;
        this.buyCount = buyCount;
        this.sellCount = sellCount;
        this.totalBoughtUsd = totalBoughtUsd;
        this.totalSoldUsd = totalSoldUsd;
        this.totalDeposits = totalDeposits;
        this.totalWithdrawals = totalWithdrawals;
    }

    public static LedgerStatistics from(List<Transaction> history) {
        int trades = 0, botTrades = 0, buys = 0, sells = 0;
        double bought = 0.0, sold = 0.0, deposits = 0.0, withdrawals = 0.0;

        for (Transaction tx : history) {
            switch (tx.getKind()) {
                case DEPOSIT:
                    deposits += tx.getQuantity();
                    break;
                case WITHDRAWAL:
                    withdrawals += tx.getQuantity();
                    break;
                case TRADE:
                    trades++;
                    if (tx.isBotTrade()) {
                        botTrades++;
                    }
                    // Quote amount converted with the USD snapshot taken at execution time
                    double quoteUsd = tx.getQuoteUsdPrice() != null ? tx.getQuoteUsdPrice() : 1.0;
                    double usdValue = tx.getQuoteAmount() * quoteUsd;
                    if (tx.getSide() == TradeSide.BUY) {
                        buys++;
                        bought += usdValue;
                    } else {
                        sells++;
                        sold += usdValue;
                    }
                    break;
            }
        }
        return new LedgerStatistics(trades, botTrades, buys, sells, bought, sold, deposits, withdrawals);
    }

    public int getTradeCount() {
        return tradeCount;
    }

    public int getBotTradeCount() {
        return botTradeCount;
    }

    public int getManualTradeCount() {
        return tradeCount - botTradeCount;
    }

    public int getBuyCount() {
        return buyCount;
    }

    public int getSellCount() {
        return sellCount;
    }

    public double getTotalBoughtUsd() {
        return totalBoughtUsd;
    }

    public double getTotalSoldUsd() {
        return totalSoldUsd;
    }

    public double getTotalDeposits() {
        return totalDeposits;
    }

    public double getTotalWithdrawals() {
        return totalWithdrawals;
    }

    public double getNetDeposits() {
        return totalDeposits - totalWithdrawals;
    }

    @Override
    public String toString() {
        return String.format("trades=%d (bot=%d, buys=%d, sells=%d), bought=$%.2f, sold=$%.2f, net deposits=$%.2f",
                tradeCount, botTradeCount, buyCount, sellCount, totalBoughtUsd, totalSoldUsd, getNetDeposits());
    }
}
