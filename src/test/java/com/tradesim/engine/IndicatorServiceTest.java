package com.tradesim.engine;

import com.tradesim.model.IndicatorSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class IndicatorServiceTest {

    private final IndicatorService service = new IndicatorService();

    private static List<Double> ramp(int count, double start, double step) {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            prices.add(start + i * step);
        }
        return prices;
    }

    @Test
    public void testSimpleMovingAverageOfLatestPrices() {
        IndicatorSnapshot snapshot = service.compute(List.of(1.0, 2.0, 3.0, 4.0, 5.0),
                Set.of(IndicatorSpec.sma(3), IndicatorSpec.bollingerMiddle(3)));

        assertEquals(4.0, snapshot.value("sma_3").getAsDouble(), 1e-9);
        assertEquals(4.0, snapshot.value("bb_middle_3").getAsDouble(), 1e-9, "Middle band is the SMA");
    }

    @Test
    public void testAbsentBelowWarmup() {
        IndicatorSnapshot snapshot = service.compute(ramp(14, 100, 1),
                Set.of(IndicatorSpec.rsi(14), IndicatorSpec.sma(14), IndicatorSpec.ema(21)));

        assertFalse(snapshot.has("rsi_14"), "14 prices give only 13 changes");
        assertTrue(snapshot.has("sma_14"));
        assertTrue(snapshot.value("ema_21").isEmpty());
    }

    @Test
    public void testOscillatorExtremes() {
        Set<IndicatorSpec> rsi = Set.of(IndicatorSpec.rsi(14));

        assertEquals(100.0, service.compute(ramp(30, 100, 1), rsi).value("rsi_14").getAsDouble(), 1e-6);
        assertEquals(0.0, service.compute(ramp(30, 100, -1), rsi).value("rsi_14").getAsDouble(), 1e-6);
    }

    @Test
    public void testBandsBracketThePrice() {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            prices.add(100 + Math.sin(i / 3.0) * 5);
        }
        IndicatorSnapshot snapshot = service.compute(prices, Set.of(IndicatorSpec.bollingerUpper(20),
                IndicatorSpec.bollingerMiddle(20), IndicatorSpec.bollingerLower(20)));

        double upper = snapshot.value("bb_upper_20").getAsDouble();
        double middle = snapshot.value("bb_middle_20").getAsDouble();
        double lower = snapshot.value("bb_lower_20").getAsDouble();
        assertTrue(upper > middle && middle > lower);
    }

    @Test
    public void testStatelessAcrossCalls() {
        Set<IndicatorSpec> specs = Set.of(IndicatorSpec.ema(9), IndicatorSpec.macd(12, 26));
        List<Double> prices = ramp(40, 50, 0.5);

        IndicatorSnapshot first = service.compute(prices, specs);
        service.compute(ramp(60, 10, -0.1), specs);
        IndicatorSnapshot again = service.compute(prices, specs);

        assertEquals(first.asMap(), again.asMap());
        assertTrue(again.value("macd_12_26").getAsDouble() > 0, "Rising prices give a positive MACD");
    }

    @Test
    public void testEmptyInput() {
        assertTrue(service.compute(List.of(), Set.of(IndicatorSpec.sma(3))).ids().isEmpty());
        assertTrue(service.compute(ramp(5, 1, 1), Set.of()).ids().isEmpty());
    }
}
