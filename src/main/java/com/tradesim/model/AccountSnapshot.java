package com.tradesim.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.ArrayList;

/**
 * Consistent copy of one account: balances and the history that produced them.
 */
public final class AccountSnapshot {
    private final String userId;
    private final String displayName;
    private final Map<String, Double> balances;
    private final List<Transaction> history;

    public AccountSnapshot(String userId, String displayName, Map<String, Double> balances,
            List<Transaction> history) {
        this.userId = userId;
        this.displayName = displayName;
        this.balances = Collections.unmodifiableMap(new TreeMap<>(balances));
        this.history = Collections.unmodifiableList(new ArrayList<>(history));
    }

    public String getUserId() {
        return userId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Map<String, Double> getBalances() {
        return balances;
    }

    public double getBalance(String asset) {
        return balances.getOrDefault(asset, 0.0);
    }

    public List<Transaction> getHistory() {
        return history;
    }
}
