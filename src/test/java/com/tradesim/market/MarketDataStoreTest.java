package com.tradesim.market;

import com.tradesim.model.PricePoint;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class MarketDataStoreTest {

    private static final Instant NOW = Instant.parse("2025-01-21T12:00:00Z");

    @Test
    public void testPairPriceDividesReferencePrices() {
        MarketDataStore store = new MarketDataStore(100, "USD");
        store.append(new PricePoint(NOW, "BTC", 60000.0));
        store.append(new PricePoint(NOW, "ETH", 3000.0));

        assertEquals(60000.0, store.pairPrice("BTC", "USD").getAsDouble(), 1e-9);
        assertEquals(20.0, store.pairPrice("BTC", "ETH").getAsDouble(), 1e-9);
        assertEquals(0.05, store.pairPrice("ETH", "BTC").getAsDouble(), 1e-12);
    }

    @Test
    public void testReferenceCurrencyIsAlwaysOne() {
        MarketDataStore store = new MarketDataStore(100, "USD");

        assertEquals(1.0, store.latestPrice("USD").getAsDouble(), 1e-12);
        assertTrue(store.latestPrice("BTC").isEmpty());
        assertTrue(store.pairPrice("BTC", "USD").isEmpty(), "No BTC sample yet");
    }

    @Test
    public void testWindowsArePerAsset() {
        MarketDataStore store = new MarketDataStore(2, "USD");
        for (int i = 0; i < 3; i++) {
            store.append(new PricePoint(NOW.plusSeconds(i), "BTC", 100 + i));
        }
        store.append(new PricePoint(NOW, "ETH", 10));

        assertEquals(2, store.window("BTC", 10).size());
        assertEquals(1, store.window("ETH", 10).size());
        assertTrue(store.window("SOL", 10).isEmpty());
        assertEquals(NOW.plusSeconds(2), store.newestTimestamp("BTC").orElseThrow());
        assertEquals(102.0, store.latestPrice("BTC").getAsDouble(), 1e-9);
    }
}
