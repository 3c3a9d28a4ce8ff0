package com.tradesim.engine;

import com.tradesim.model.AccountSnapshot;
import com.tradesim.model.Transaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Balances and history of one user, guarded by a lock of its own.
 *
 * Writers hold the write lock across the balance change and the history append;
 * readers copy both under the read lock. Only {@link PortfolioLedger} touches the
 * mutable state.
 */
class UserAccount {
    private final String userId;
    private final String displayName;
    private final Map<String, Double> openingBalances;
    private final Map<String, Double> balances = new HashMap<>();
    private final List<Transaction> history = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    UserAccount(String userId, String displayName, Map<String, Double> openingBalances,
            Map<String, Double> currentBalances, List<Transaction> priorHistory) {
        this.userId = userId;
        this.displayName = displayName;
        this.openingBalances = Map.copyOf(openingBalances);
        this.balances.putAll(currentBalances);
        this.history.addAll(priorHistory);
    }

    String getUserId() {
        return userId;
    }

    String getDisplayName() {
        return displayName;
    }

    Map<String, Double> getOpeningBalances() {
        return openingBalances;
    }

    ReentrantReadWriteLock.WriteLock writeLock() {
        return lock.writeLock();
    }

    /**
     * Caller must hold the write or read lock
     */
    double balance(String asset) {
        return balances.getOrDefault(asset, 0.0);
    }

    /**
     * Apply the record's balance effects and append it. Caller holds the write lock
     * and has already checked that no balance goes negative.
     */
    void record(Transaction tx) {
        for (Map.Entry<String, Double> effect : tx.balanceEffects().entrySet()) {
            balances.merge(effect.getKey(), effect.getValue(), Double::sum);
        }
        history.add(tx);
    }

    AccountSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new AccountSnapshot(userId, displayName, balances, history);
        } finally {
            lock.readLock().unlock();
        }
    }
}
