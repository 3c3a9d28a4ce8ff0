package com.tradesim.infra;

import com.tradesim.engine.PortfolioLedger;
import com.tradesim.model.TradeSide;
import com.tradesim.model.Transaction;
import com.tradesim.model.TransactionKind;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Seeds the ledger with accounts kept outside the process.
 *
 * Format:
 * <pre>
 * {"users": [{"id": "alice", "name": "Alice", "balances": {"USD": 9000.0},
 *             "history": [{"kind": "TRADE", "base": "BTC", "quote": "USD", "side": "BUY",
 *                          "quantity": 0.02, "price": 50000.0, "timestamp": "2025-01-21T10:05:00Z",
 *                          "baseUsd": 50000.0, "quoteUsd": 1.0, "bot": "trend_follow"}]}]}
 * </pre>
 */
public class LedgerSeedLoader {
    private static final Logger logger = LoggerFactory.getLogger(LedgerSeedLoader.class);

    private final PortfolioLedger ledger;

    public LedgerSeedLoader(PortfolioLedger ledger) {
        this.ledger = ledger;
    }

    /**
     * @return number of accounts loaded
     */
    public int load(Path file) throws IOException {
        logger.info("📂 Loading ledger seed from {}", file);
        return load(Files.readString(file, StandardCharsets.UTF_8));
    }

    public int load(InputStream in) throws IOException {
        return load(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }

    public int load(String json) throws IOException {
        JSONArray users;
        try {
            users = new JSONObject(json).getJSONArray("users");
        } catch (JSONException e) {
            throw new IOException("Malformed ledger seed: " + e.getMessage(), e);
        }

        // every entry is parsed and checked before the first account is restored,
        // so a bad seed leaves the ledger as it was
        List<SeedEntry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < users.length(); i++) {
            String userId = "#" + i;
            try {
                JSONObject user = users.getJSONObject(i);
                userId = user.getString("id");
                Map<String, Double> balances = parseBalances(user.optJSONObject("balances"));
                for (Map.Entry<String, Double> balance : balances.entrySet()) {
                    if (balance.getValue() < 0) {
                        throw new IllegalArgumentException("Negative balance for " + balance.getKey());
                    }
                }
                if (!seen.add(userId) || ledger.hasAccount(userId)) {
                    throw new IllegalArgumentException("Account already exists: " + userId);
                }
                List<Transaction> history = parseHistory(userId, user.optJSONArray("history"));
                entries.add(new SeedEntry(userId, user.optString("name", userId), balances, history));
            } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
                throw new IOException("Invalid seed entry for user " + userId + ": " + e.getMessage(), e);
            }
        }

        for (SeedEntry entry : entries) {
            try {
                ledger.restoreAccount(entry.userId, entry.name, entry.balances, entry.history);
            } catch (IllegalArgumentException e) {
                throw new IOException("Could not restore " + entry.userId + ": " + e.getMessage(), e);
            }
        }
        logger.info("✅ Ledger seeded with {} accounts", entries.size());
        return entries.size();
    }

    private Map<String, Double> parseBalances(JSONObject json) {
        Map<String, Double> balances = new HashMap<>();
        if (json == null) {
            return balances;
        }
        for (String asset : json.keySet()) {
            balances.put(asset, json.getDouble(asset));
        }
        return balances;
    }

    private List<Transaction> parseHistory(String userId, JSONArray json) {
        List<Transaction> history = new ArrayList<>();
        if (json == null) {
            return history;
        }
        for (int i = 0; i < json.length(); i++) {
            JSONObject tx = json.getJSONObject(i);
            TransactionKind kind = TransactionKind.valueOf(tx.getString("kind"));
            TradeSide side = tx.has("side") ? TradeSide.valueOf(tx.getString("side")) : null;
            history.add(new Transaction(userId, kind,
                    tx.getString("base"),
                    tx.getString("quote"),
                    side,
                    tx.getDouble("quantity"),
                    tx.optDouble("price", 1.0),
                    Instant.parse(tx.getString("timestamp")),
                    tx.has("baseUsd") ? tx.getDouble("baseUsd") : null,
                    tx.has("quoteUsd") ? tx.getDouble("quoteUsd") : null,
                    tx.optString("bot", null)));
        }
        return history;
    }

    private static final class SeedEntry {
        final String userId;
        final String name;
        final Map<String, Double> balances;
        final List<Transaction> history;

        SeedEntry(String userId, String name, Map<String, Double> balances, List<Transaction> history) {
            this.userId = userId;
            this.name = name;
            this.balances = balances;
            this.history = history;
        }
    }
}
