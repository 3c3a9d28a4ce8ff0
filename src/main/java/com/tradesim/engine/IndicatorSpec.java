package com.tradesim.engine;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Identifies one indicator and its parameters. The textual id (e.g. "sma_20",
 * "rsi_14", "macd_12_26") is the key used in an {@link com.tradesim.model.IndicatorSnapshot}.
 */
public final class IndicatorSpec {

    public enum Type {
        SMA("sma", 1),
        EMA("ema", 1),
        RSI("rsi", 1),
        MACD("macd", 2),
        MACD_SIGNAL("macd_signal", 3),
        BB_UPPER("bb_upper", 1),
        BB_MIDDLE("bb_middle", 1),
        BB_LOWER("bb_lower", 1);

        private final String prefix;
        private final int paramCount;

        Type(String prefix, int paramCount) {
            this.prefix = prefix;
            this.paramCount = paramCount;
        }
    }

    private final Type type;
    private final int[] params;

    private IndicatorSpec(Type type, int... params) {
        if (params.length != type.paramCount) {
            throw new IllegalArgumentException(type + " takes " + type.paramCount + " parameter(s)");
        }
        for (int p : params) {
            if (p <= 0) {
                throw new IllegalArgumentException("Indicator periods must be positive: " + Arrays.toString(params));
            }
        }
        if ((type == Type.MACD || type == Type.MACD_SIGNAL) && params[0] >= params[1]) {
            throw new IllegalArgumentException("MACD short period must be below long period");
        }
        this.type = type;
        this.params = params.clone();
    }

    public static IndicatorSpec sma(int period) {
        return new IndicatorSpec(Type.SMA, period);
    }

    public static IndicatorSpec ema(int period) {
        return new IndicatorSpec(Type.EMA, period);
    }

    public static IndicatorSpec rsi(int period) {
        return new IndicatorSpec(Type.RSI, period);
    }

    public static IndicatorSpec macd(int shortPeriod, int longPeriod) {
        return new IndicatorSpec(Type.MACD, shortPeriod, longPeriod);
    }

    public static IndicatorSpec macdSignal(int shortPeriod, int longPeriod, int signalPeriod) {
        return new IndicatorSpec(Type.MACD_SIGNAL, shortPeriod, longPeriod, signalPeriod);
    }

    public static IndicatorSpec bollingerUpper(int period) {
        return new IndicatorSpec(Type.BB_UPPER, period);
    }

    public static IndicatorSpec bollingerMiddle(int period) {
        return new IndicatorSpec(Type.BB_MIDDLE, period);
    }

    public static IndicatorSpec bollingerLower(int period) {
        return new IndicatorSpec(Type.BB_LOWER, period);
    }

    /**
     * Parse an id such as "ema_12" or "macd_signal_12_26_9" (case-insensitive).
     */
    public static IndicatorSpec parse(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        // Longest prefix first so "macd_signal" is not read as "macd"
        Type[] byPrefixLength = Type.values().clone();
        Arrays.sort(byPrefixLength, (a, b) -> b.prefix.length() - a.prefix.length());
        for (Type type : byPrefixLength) {
            if (normalized.startsWith(type.prefix + "_")) {
                String[] parts = normalized.substring(type.prefix.length() + 1).split("_");
                try {
                    int[] params = Arrays.stream(parts).mapToInt(Integer::parseInt).toArray();
                    return new IndicatorSpec(type, params);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Malformed indicator id: " + id, e);
                }
            }
        }
        throw new IllegalArgumentException("Unknown indicator: " + id);
    }

    public String id() {
        StringBuilder sb = new StringBuilder(type.prefix);
        for (int p : params) {
            sb.append('_').append(p);
        }
        return sb.toString();
    }

    /**
     * Fewest prices needed before the value means anything.
     */
    public int warmupLength() {
        switch (type) {
            case RSI:
                return params[0] + 1;
            case MACD:
                return params[1];
            case MACD_SIGNAL:
                return params[1] + params[2] - 1;
            default:
                return params[0];
        }
    }

    public Type getType() {
        return type;
    }

    public int param(int index) {
        return params[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IndicatorSpec))
            return false;
        IndicatorSpec other = (IndicatorSpec) o;
        return type == other.type && Arrays.equals(params, other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, Arrays.hashCode(params));
    }

    @Override
    public String toString() {
        return id();
    }
}
