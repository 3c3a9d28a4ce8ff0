package com.tradesim.engine;

import com.tradesim.config.Config;
import com.tradesim.model.AccountSnapshot;
import com.tradesim.model.Decision;
import com.tradesim.model.LedgerStatistics;
import com.tradesim.model.TradeSide;
import com.tradesim.model.TradingPair;
import com.tradesim.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * Per-user balances and append-only transaction history. The only code path that
 * changes a user's funds.
 *
 * Every mutation runs under that user's write lock and pairs the balance change
 * with exactly one appended {@link Transaction}; a concurrent reader sees both or
 * neither. Locks are per user, so activity on one account never waits on another.
 */
public class PortfolioLedger {
    private static final Logger logger = LoggerFactory.getLogger(PortfolioLedger.class);

    private final Map<String, UserAccount> accounts = new ConcurrentHashMap<>();
    private final String currency;
    private final double depositMin;
    private final double depositMax;
    private final Clock clock;

    public PortfolioLedger() {
        this(Config.get(Config.REFERENCE_CURRENCY, "USD"),
                Config.getDouble("ledger.deposit.min", 10.0),
                Config.getDouble("ledger.deposit.max", 100000.0),
                Clock.systemUTC());
    }

    public PortfolioLedger(String currency, double depositMin, double depositMax, Clock clock) {
        this.currency = currency;
        this.depositMin = depositMin;
        this.depositMax = depositMax;
        this.clock = clock;
    }

    /**
     * Open an empty-history account with the given balances.
     */
    public void openAccount(String userId, String displayName, Map<String, Double> openingBalances) {
        checkNonNegative(openingBalances);
        UserAccount account = new UserAccount(userId, displayName, openingBalances, openingBalances, List.of());
        if (accounts.putIfAbsent(userId, account) != null) {
            throw new IllegalArgumentException("Account already exists: " + userId);
        }
        logger.info("Opened account {} ({}) with {}", userId, displayName, openingBalances);
    }

    /**
     * Re-open an account loaded from persistence: current balances plus the history
     * that led to them. Opening balances are derived so that replaying the history
     * reproduces the current balances.
     */
    public void restoreAccount(String userId, String displayName, Map<String, Double> balances,
            List<Transaction> history) {
        checkNonNegative(balances);
        Map<String, Double> opening = new HashMap<>(balances);
        for (Transaction tx : history) {
            for (Map.Entry<String, Double> effect : tx.balanceEffects().entrySet()) {
                opening.merge(effect.getKey(), -effect.getValue(), Double::sum);
            }
        }
        UserAccount account = new UserAccount(userId, displayName, opening, balances, history);
        if (accounts.putIfAbsent(userId, account) != null) {
            throw new IllegalArgumentException("Account already exists: " + userId);
        }
        logger.info("Restored account {} with {} transactions", userId, history.size());
    }

    /**
     * Turn a strategy decision into a trade and apply it.
     *
     * The quote amount is converted to base units at {@code price}; the Buy side needs
     * enough quote asset, the Sell side enough base asset. Balance check, balance change
     * and history append happen under one hold of the user's write lock.
     *
     * @param executedByBot strategy id tagging the record, or null for a manual trade
     * @throws TradeRejectedException when the decision cannot be applied; nothing changed
     */
    public Transaction validateAndApply(String userId, TradingPair pair, Decision decision, double price,
            Double baseUsdPrice, Double quoteUsdPrice, String executedByBot) throws TradeRejectedException {
        if (decision.isHold()) {
            throw new TradeRejectedException(RejectionReason.INVALID_QUANTITY, "HOLD has nothing to apply");
        }
        double quoteAmount = decision.getQuoteAmount();
        if (!(quoteAmount > 0) || Double.isInfinite(quoteAmount)) {
            throw new TradeRejectedException(RejectionReason.INVALID_QUANTITY,
                    "Decision amount must be positive, got " + quoteAmount);
        }
        checkPrice(price);
        double quantity = quoteAmount / price;
        // quantity x price must not round above the requested amount, or a buy of the whole balance fails
        while (quantity * price > quoteAmount && quantity > 0) {
            quantity = Math.nextDown(quantity);
        }
        return executeTrade(userId, pair, decision.getSide(), quantity, price, baseUsdPrice,
                quoteUsdPrice, executedByBot);
    }

    /**
     * Apply a trade expressed in base units.
     */
    public Transaction executeTrade(String userId, TradingPair pair, TradeSide side, double quantity, double price,
            Double baseUsdPrice, Double quoteUsdPrice, String executedByBot) throws TradeRejectedException {
        if (!(quantity > 0) || Double.isInfinite(quantity)) {
            throw new TradeRejectedException(RejectionReason.INVALID_QUANTITY,
                    "Quantity must be positive, got " + quantity);
        }
        checkPrice(price);
        UserAccount account = require(userId);

        Lock lock = account.writeLock();
        lock.lock();
        try {
            Transaction tx = Transaction.trade(userId, pair, side, quantity, price, clock.instant(),
                    baseUsdPrice, quoteUsdPrice, executedByBot);
            if (side == TradeSide.BUY) {
                double cost = tx.getQuoteAmount();
                double available = account.balance(pair.getQuoteAsset());
                if (available < cost) {
                    throw new TradeRejectedException(RejectionReason.INSUFFICIENT_FUNDS,
                            String.format("Cannot buy: need %.2f %s but only have %.2f",
                                    cost, pair.getQuoteAsset(), available));
                }
            } else {
                double available = account.balance(pair.getBaseAsset());
                if (available < quantity) {
                    throw new TradeRejectedException(RejectionReason.INSUFFICIENT_ASSETS,
                            String.format("Cannot sell: need %.8f %s but only have %.8f",
                                    quantity, pair.getBaseAsset(), available));
                }
            }
            account.record(tx);
            logger.info("💱 Executed {}", tx);
            return tx;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Work that must not interleave with any other change to one account.
     */
    @FunctionalInterface
    public interface AccountAction<T> {
        T run() throws TradeRejectedException;
    }

    /**
     * Run {@code action} while holding the user's write lock. Ledger calls for the same
     * user made from inside the action re-enter the lock, so a check made in the action
     * still holds when its trade is applied.
     *
     * @throws TradeRejectedException UNKNOWN_ACCOUNT, or whatever the action throws
     */
    public <T> T withAccountLocked(String userId, AccountAction<T> action) throws TradeRejectedException {
        Lock lock = require(userId).writeLock();
        lock.lock();
        try {
            return action.run();
        } finally {
            lock.unlock();
        }
    }

    public Transaction deposit(String userId, double amount) throws TradeRejectedException {
        if (Double.isNaN(amount) || amount < depositMin) {
            throw new TradeRejectedException(RejectionReason.DEPOSIT_TOO_SMALL,
                    String.format("Deposit must be at least %.2f %s", depositMin, currency));
        }
        if (amount > depositMax) {
            throw new TradeRejectedException(RejectionReason.DEPOSIT_TOO_LARGE,
                    String.format("Deposit must be at most %.2f %s", depositMax, currency));
        }
        UserAccount account = require(userId);

        Lock lock = account.writeLock();
        lock.lock();
        try {
            Transaction tx = Transaction.deposit(userId, currency, amount, clock.instant());
            account.record(tx);
            logger.info("Deposit of {} {} for {}", String.format("%.2f", amount), currency, userId);
            return tx;
        } finally {
            lock.unlock();
        }
    }

    public Transaction withdraw(String userId, double amount) throws TradeRejectedException {
        if (!(amount > 0) || Double.isInfinite(amount)) {
            throw new TradeRejectedException(RejectionReason.INVALID_QUANTITY,
                    "Withdrawal must be positive, got " + amount);
        }
        UserAccount account = require(userId);

        Lock lock = account.writeLock();
        lock.lock();
        try {
            double available = account.balance(currency);
            if (amount > available) {
                throw new TradeRejectedException(RejectionReason.WITHDRAWAL_EXCEEDS_BALANCE,
                        String.format("Cannot withdraw %.2f %s, balance is %.2f", amount, currency, available));
            }
            Transaction tx = Transaction.withdrawal(userId, currency, amount, clock.instant());
            account.record(tx);
            logger.info("Withdrawal of {} {} for {}", String.format("%.2f", amount), currency, userId);
            return tx;
        } finally {
            lock.unlock();
        }
    }

    public Optional<AccountSnapshot> snapshot(String userId) {
        UserAccount account = accounts.get(userId);
        return account == null ? Optional.empty() : Optional.of(account.snapshot());
    }

    public boolean hasAccount(String userId) {
        return accounts.containsKey(userId);
    }

    public double balance(String userId, String asset) {
        return snapshot(userId).map(s -> s.getBalance(asset)).orElse(0.0);
    }

    /**
     * Recompute balances from the opening balances plus every recorded transaction.
     * Equal to the live balances whenever the ledger is consistent.
     */
    public Map<String, Double> replay(String userId) {
        UserAccount account = accounts.get(userId);
        if (account == null) {
            return Collections.emptyMap();
        }
        AccountSnapshot snapshot = account.snapshot();
        Map<String, Double> replayed = new HashMap<>(account.getOpeningBalances());
        for (Transaction tx : snapshot.getHistory()) {
            for (Map.Entry<String, Double> effect : tx.balanceEffects().entrySet()) {
                replayed.merge(effect.getKey(), effect.getValue(), Double::sum);
            }
        }
        return replayed;
    }

    public Optional<LedgerStatistics> statistics(String userId) {
        return snapshot(userId).map(s -> LedgerStatistics.from(s.getHistory()));
    }

    public Set<String> accountIds() {
        return Collections.unmodifiableSet(accounts.keySet());
    }

    public String getCurrency() {
        return currency;
    }

    private UserAccount require(String userId) throws TradeRejectedException {
        UserAccount account = accounts.get(userId);
        if (account == null) {
            throw new TradeRejectedException(RejectionReason.UNKNOWN_ACCOUNT, "Account not found: " + userId);
        }
        return account;
    }

    private void checkNonNegative(Map<String, Double> balances) {
        for (Map.Entry<String, Double> entry : balances.entrySet()) {
            if (entry.getValue() < 0) {
                throw new IllegalArgumentException("Negative balance for " + entry.getKey());
            }
        }
    }

    private void checkPrice(double price) throws TradeRejectedException {
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new TradeRejectedException(RejectionReason.PRICE_UNAVAILABLE, "Invalid price: " + price);
        }
    }
}
