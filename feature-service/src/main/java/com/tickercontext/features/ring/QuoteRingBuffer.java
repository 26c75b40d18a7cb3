package com.tickercontext.features.ring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-ticker history of observed last prices, used for trailing returns when
 * candle data is missing or too short.
 *
 * <p>Each ring is bounded by both {@link #CAPACITY} entries and a {@link #WINDOW} of
 * wall-clock time; whichever bound is tighter decides the size. Samples are time-ordered
 * by construction so eviction is always a prefix trim.
 *
 * <p>Rings for different tickers never contend: mutation synchronizes on the ticker's
 * own deque only.
 */
@Component
public class QuoteRingBuffer {

    private static final Logger log = LoggerFactory.getLogger(QuoteRingBuffer.class);

    public static final int CAPACITY = 600;
    public static final Duration WINDOW = Duration.ofMinutes(10);

    private final ConcurrentHashMap<String, Deque<QuoteSample>> rings = new ConcurrentHashMap<>();
    private final Clock clock;

    public QuoteRingBuffer(Clock clock) {
        this.clock = clock;
    }

    public void append(String ticker, double price) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(WINDOW);
        Deque<QuoteSample> ring = rings.computeIfAbsent(ticker, k -> new ArrayDeque<>());
        synchronized (ring) {
            ring.addLast(new QuoteSample(now, price));
            while (!ring.isEmpty() && ring.peekFirst().timestamp().isBefore(cutoff)) {
                ring.pollFirst();
            }
            while (ring.size() > CAPACITY) {
                ring.pollFirst();
            }
            log.debug("QUOTE_RING_APPEND symbol={} price={} size={}", ticker, price, ring.size());
        }
    }

    /**
     * Return since the newest sample at least {@code minutes} old, or since the oldest
     * sample when none is that old.
     *
     * @return {@code (last - base) / base}; 0.0 for an empty ring or a zero base
     */
    public double trailingReturn(String ticker, int minutes) {
        Deque<QuoteSample> ring = rings.get(ticker);
        if (ring == null) return 0.0;
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(minutes));
        synchronized (ring) {
            if (ring.isEmpty()) return 0.0;
            double last = ring.peekLast().price();
            double base = last;
            Iterator<QuoteSample> it = ring.descendingIterator();
            while (it.hasNext()) {
                QuoteSample sample = it.next();
                base = sample.price();
                if (!sample.timestamp().isAfter(cutoff)) break;
            }
            if (base == 0.0) return 0.0;
            return (last - base) / base;
        }
    }

    public int size(String ticker) {
        Deque<QuoteSample> ring = rings.get(ticker);
        if (ring == null) return 0;
        synchronized (ring) {
            return ring.size();
        }
    }

    /** Snapshot of the ring, oldest first. */
    public List<QuoteSample> samples(String ticker) {
        Deque<QuoteSample> ring = rings.get(ticker);
        if (ring == null) return List.of();
        synchronized (ring) {
            return List.copyOf(ring);
        }
    }
}
