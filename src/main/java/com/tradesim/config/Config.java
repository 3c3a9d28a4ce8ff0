package com.tradesim.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public class Config {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final Properties properties = new Properties();

    static {
        try (InputStream input = Config.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException e) {
            logger.warn("Could not load application.properties", e);
        }
    }

    public static String get(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = properties.getProperty(key);
        }
        return value;
    }

    public static String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    public static double getDouble(String key, double defaultValue) {
        String value = get(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid format for key {}: {}", key, value);
            }
        }
        return defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid format for key {}: {}", key, value);
            }
        }
        return defaultValue;
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid format for key {}: {}", key, value);
            }
        }
        return defaultValue;
    }

    public static boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    /**
     * Comma separated list, blanks dropped
     */
    public static List<String> getList(String key, String defaultValue) {
        List<String> result = new ArrayList<>();
        for (String part : get(key, defaultValue).split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    public static final String WINDOW_CAPACITY = "market.window.capacity";
    public static final String REFERENCE_CURRENCY = "market.reference.currency";
    public static final String FEED_ASSETS = "feed.assets";
    public static final String FEED_INTERVAL_SECONDS = "feed.interval.seconds";
    public static final String FEED_BACKFILL_POINTS = "feed.backfill.points";
    public static final String BOT_TICK_INTERVAL_SECONDS = "bot.tick.interval.seconds";
    public static final String BOT_CONTEXT_WINDOW_POINTS = "bot.context.window.points";
    public static final String BOT_SCHEDULER_THREADS = "bot.scheduler.threads";
    public static final String LEDGER_STARTING_BALANCE = "ledger.starting.balance";
    public static final String LEDGER_SEED_FILE = "ledger.seed.file";

    /**
     * Set a property value (useful for testing)
     */
    public static void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    /**
     * Remove a property (useful for testing)
     */
    public static void clearProperty(String key) {
        properties.remove(key);
    }
}
