package com.tradesim.market;

import com.tradesim.model.PricePoint;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class PriceWindowTest {

    private static final Instant START = Instant.parse("2025-01-21T00:00:00Z");

    private static PricePoint btc(int second, double price) {
        return new PricePoint(START.plusSeconds(second), "BTC", price);
    }

    @Test
    public void testKeepsMostRecentPointsInOrderWhenOverfilled() {
        PriceWindow window = new PriceWindow("BTC", 5);

        for (int i = 0; i < 13; i++) {
            assertTrue(window.append(btc(i, 100 + i)));
        }

        List<PricePoint> points = window.snapshot();
        assertEquals(5, points.size());
        assertEquals(5, window.size());
        for (int i = 0; i < 5; i++) {
            assertEquals(108 + i, points.get(i).getPrice(), 1e-9, "Oldest first, only the last 5 survive");
        }
        assertEquals(112.0, window.latest().orElseThrow().getPrice(), 1e-9);
    }

    @Test
    public void testPartialSnapshotReturnsNewestTail() {
        PriceWindow window = new PriceWindow("BTC", 10);
        for (int i = 0; i < 4; i++) {
            window.append(btc(i, i));
        }

        List<PricePoint> lastTwo = window.snapshot(2);
        assertEquals(2, lastTwo.size());
        assertEquals(2.0, lastTwo.get(0).getPrice(), 1e-9);
        assertEquals(3.0, lastTwo.get(1).getPrice(), 1e-9);

        assertEquals(4, window.snapshot(50).size(), "Asking for more than stored returns what is there");
    }

    @Test
    public void testRefusesOutOfOrderAndForeignPoints() {
        PriceWindow window = new PriceWindow("BTC", 5);
        assertTrue(window.append(btc(10, 100)));

        assertFalse(window.append(btc(5, 99)), "Older point must be refused");
        assertFalse(window.append(btc(10, 101)), "Same timestamp must be refused");
        assertFalse(window.append(new PricePoint(START.plusSeconds(20), "ETH", 3000)));

        assertEquals(1, window.size());
        assertEquals(START.plusSeconds(10), window.newestTimestamp().orElseThrow());
    }

    @Test
    public void testEmptyWindow() {
        PriceWindow window = new PriceWindow("ETH", 3);

        assertTrue(window.snapshot().isEmpty());
        assertTrue(window.latest().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new PriceWindow("ETH", 0));
    }

    @Test
    public void testReadersAlwaysSeeChronologicalCopies() throws Exception {
        PriceWindow window = new PriceWindow("BTC", 50);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch writerDone = new CountDownLatch(1);

        pool.submit(() -> {
            for (int i = 0; i < 5000; i++) {
                window.append(btc(i, i));
            }
            writerDone.countDown();
        });

        for (int r = 0; r < 3; r++) {
            pool.submit(() -> {
                while (writerDone.getCount() > 0) {
                    List<PricePoint> copy = window.snapshot();
                    for (int i = 1; i < copy.size(); i++) {
                        assertTrue(copy.get(i).getTimestamp().isAfter(copy.get(i - 1).getTimestamp()));
                    }
                }
                return null;
            }).get(10, TimeUnit.SECONDS);
        }

        assertTrue(writerDone.await(10, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(50, window.size());
        assertEquals(4999.0, window.latest().orElseThrow().getPrice(), 1e-9);
    }
}
