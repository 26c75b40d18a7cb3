package com.tickercontext.features.ring;

import com.tickercontext.features.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuoteRingBufferTest {

    private static final Instant T0 = Instant.parse("2024-05-01T14:00:00Z");
    private static final double EPS = 1e-9;

    private MutableClock clock;
    private QuoteRingBuffer ring;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        ring = new QuoteRingBuffer(clock);
    }

    @Test
    @DisplayName("empty ring → 0.0 return")
    void emptyRing() {
        assertEquals(0.0, ring.trailingReturn("AAPL", 1));
        assertEquals(0, ring.size("AAPL"));
        assertTrue(ring.samples("AAPL").isEmpty());
    }

    @Test
    @DisplayName("appends spanning 15 minutes keep only the last 10 minutes")
    void timeWindowEviction() {
        for (int minute = 0; minute <= 15; minute++) {
            ring.append("AAPL", 100.0 + minute);
            if (minute < 15) clock.advance(Duration.ofMinutes(1));
        }
        List<QuoteSample> samples = ring.samples("AAPL");
        Instant cutoff = clock.instant().minus(QuoteRingBuffer.WINDOW);

        assertEquals(11, samples.size());
        assertTrue(samples.stream().noneMatch(s -> s.timestamp().isBefore(cutoff)));
        assertEquals(105.0, samples.get(0).price());
    }

    @Test
    @DisplayName("never holds more than 600 samples")
    void capacityBound() {
        for (int i = 0; i < 700; i++) {
            ring.append("AAPL", 100.0 + i);
            clock.advance(Duration.ofMillis(100));
        }
        assertEquals(QuoteRingBuffer.CAPACITY, ring.size("AAPL"));
        assertEquals(200.0, ring.samples("AAPL").get(0).price());
    }

    @Test
    @DisplayName("baseline is the newest sample at least N minutes old")
    void baselineSelection() {
        ring.append("AAPL", 100.0);
        clock.advance(Duration.ofMinutes(2));
        ring.append("AAPL", 101.0);
        clock.advance(Duration.ofMinutes(2));
        ring.append("AAPL", 102.0);
        clock.advance(Duration.ofMinutes(1));
        ring.append("AAPL", 103.0);

        assertEquals((103.0 - 102.0) / 102.0, ring.trailingReturn("AAPL", 1), EPS);
        assertEquals(0.03, ring.trailingReturn("AAPL", 5), EPS);
    }

    @Test
    @DisplayName("no sample old enough → baseline is the oldest sample")
    void oldestFallback() {
        ring.append("AAPL", 200.0);
        clock.advance(Duration.ofSeconds(30));
        ring.append("AAPL", 202.0);

        assertEquals(0.01, ring.trailingReturn("AAPL", 5), EPS);
    }

    @Test
    @DisplayName("zero baseline → 0.0")
    void zeroBase() {
        ring.append("AAPL", 0.0);
        clock.advance(Duration.ofMinutes(2));
        ring.append("AAPL", 10.0);
        assertEquals(0.0, ring.trailingReturn("AAPL", 1));
    }

    @Test
    @DisplayName("tickers are isolated")
    void perTicker() {
        ring.append("AAPL", 100.0);
        ring.append("MSFT", 300.0);
        assertEquals(1, ring.size("AAPL"));
        assertEquals(1, ring.size("MSFT"));
    }
}
