package com.tradesim.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @AfterEach
    public void cleanUp() {
        Config.clearProperty("test.config.value");
    }

    @Test
    public void testReadsBundledProperties() {
        // application.properties from src/main/resources is on the test classpath
        assertEquals(60, Config.getInt(Config.BOT_TICK_INTERVAL_SECONDS, -1));
        assertEquals("USD", Config.get(Config.REFERENCE_CURRENCY));
        assertEquals(List.of("BTC", "ETH"), Config.getList(Config.FEED_ASSETS, ""));
    }

    @Test
    public void testMissingKeyFallsBackToDefault() {
        assertNull(Config.get("test.config.value"));
        assertEquals("fallback", Config.get("test.config.value", "fallback"));
        assertEquals(1.5, Config.getDouble("test.config.value", 1.5), 1e-9);
        assertTrue(Config.getBoolean("test.config.value", true));
    }

    @Test
    public void testMalformedNumberFallsBackToDefault() {
        Config.setProperty("test.config.value", "not-a-number");

        assertEquals(7, Config.getInt("test.config.value", 7));
        assertEquals(7L, Config.getLong("test.config.value", 7L));
        assertEquals(0.25, Config.getDouble("test.config.value", 0.25), 1e-9);
    }

    @Test
    public void testListDropsBlankEntries() {
        Config.setProperty("test.config.value", " BTC, ,ETH ,SOL,");

        assertEquals(List.of("BTC", "ETH", "SOL"), Config.getList("test.config.value", ""));
    }
}
