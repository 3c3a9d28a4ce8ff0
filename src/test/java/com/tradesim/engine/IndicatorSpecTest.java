package com.tradesim.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IndicatorSpecTest {

    @Test
    public void testParseRoundTripsIds() {
        assertEquals(IndicatorSpec.ema(9), IndicatorSpec.parse("ema_9"));
        assertEquals(IndicatorSpec.rsi(14), IndicatorSpec.parse("RSI_14"));
        assertEquals("macd_12_26", IndicatorSpec.parse("macd_12_26").id());
        // "macd_signal" must not be mistaken for "macd"
        assertEquals(IndicatorSpec.macdSignal(12, 26, 9), IndicatorSpec.parse("macd_signal_12_26_9"));
        assertEquals(IndicatorSpec.bollingerLower(20), IndicatorSpec.parse("bb_lower_20"));
    }

    @Test
    public void testParseRejectsBadIds() {
        assertThrows(IllegalArgumentException.class, () -> IndicatorSpec.parse("vwap_20"));
        assertThrows(IllegalArgumentException.class, () -> IndicatorSpec.parse("sma_x"));
        assertThrows(IllegalArgumentException.class, () -> IndicatorSpec.parse("sma_0"));
        assertThrows(IllegalArgumentException.class, () -> IndicatorSpec.parse("macd_26_12"));
    }

    @Test
    public void testWarmupLengths() {
        assertEquals(20, IndicatorSpec.sma(20).warmupLength());
        assertEquals(15, IndicatorSpec.rsi(14).warmupLength(), "RSI needs one extra price for the first change");
        assertEquals(26, IndicatorSpec.macd(12, 26).warmupLength());
        assertEquals(34, IndicatorSpec.macdSignal(12, 26, 9).warmupLength());
    }
}
