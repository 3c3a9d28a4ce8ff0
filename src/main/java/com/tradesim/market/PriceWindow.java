package com.tradesim.market;

import com.tradesim.model.PricePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fixed-capacity ring buffer of recent samples for one asset.
 *
 * Appends evict the oldest sample once the buffer is full. Readers always get an
 * independent copy taken under the read lock, so a half-written buffer is never
 * visible. Insertion order is chronological order: a sample that is not newer
 * than the newest one is refused.
 */
public class PriceWindow {
    private static final Logger logger = LoggerFactory.getLogger(PriceWindow.class);

    private final String asset;
    private final PricePoint[] buffer;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Index the next append writes to, and number of live entries
    private int head = 0;
    private int size = 0;

    public PriceWindow(String asset, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.asset = asset;
        this.buffer = new PricePoint[capacity];
    }

    /**
     * Append a sample, evicting the oldest one when full.
     *
     * @return false if the sample was refused (wrong asset or not newer than the newest sample)
     */
    public boolean append(PricePoint point) {
        if (!asset.equals(point.getAsset())) {
            logger.warn("Refusing {} sample in {} window", point.getAsset(), asset);
            return false;
        }

        lock.writeLock().lock();
        try {
            if (size > 0) {
                PricePoint newest = buffer[(head - 1 + buffer.length) % buffer.length];
                if (!point.getTimestamp().isAfter(newest.getTimestamp())) {
                    logger.warn("Refusing out-of-order {} sample: {} is not after {}",
                            asset, point.getTimestamp(), newest.getTimestamp());
                    return false;
                }
            }
            buffer[head] = point;
            head = (head + 1) % buffer.length;
            if (size < buffer.length) {
                size++;
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Most recent {@code count} samples (fewer if not available), oldest first.
     */
    public List<PricePoint> snapshot(int count) {
        lock.readLock().lock();
        try {
            int n = Math.max(0, Math.min(count, size));
            List<PricePoint> result = new ArrayList<>(n);
            int start = (head - n + buffer.length) % buffer.length;
            for (int i = 0; i < n; i++) {
                result.add(buffer[(start + i) % buffer.length]);
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<PricePoint> snapshot() {
        return snapshot(buffer.length);
    }

    public Optional<PricePoint> latest() {
        lock.readLock().lock();
        try {
            if (size == 0) {
                return Optional.empty();
            }
            return Optional.of(buffer[(head - 1 + buffer.length) % buffer.length]);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Timestamp of the newest sample; how stale the feed is can be read from this.
     */
    public Optional<Instant> newestTimestamp() {
        return latest().map(PricePoint::getTimestamp);
    }

    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return buffer.length;
    }

    public String getAsset() {
        return asset;
    }
}
