package com.tickercontext.features.service;

import com.tickercontext.common.model.FeaturePayload;
import com.tickercontext.common.model.FeatureVector;
import com.tickercontext.common.model.HeadlineRef;
import com.tickercontext.common.model.QuoteQuality;
import com.tickercontext.common.model.QuoteSnapshot;
import com.tickercontext.common.time.IsoTimestamps;
import com.tickercontext.common.trace.TraceContextUtil;
import com.tickercontext.features.cache.CachedFeatures;
import com.tickercontext.features.cache.FeatureCache;
import com.tickercontext.features.fallback.FallbackChain;
import com.tickercontext.features.fallback.ProviderOutcome;
import com.tickercontext.features.indicator.FeatureIndicators;
import com.tickercontext.features.model.Candle;
import com.tickercontext.features.model.Headline;
import com.tickercontext.features.model.ProviderQuote;
import com.tickercontext.features.provider.ProviderSet;
import com.tickercontext.features.provider.QuoteProvider;
import com.tickercontext.features.ring.QuoteRingBuffer;
import com.tickercontext.features.sentiment.SentimentScore;
import com.tickercontext.features.sentiment.SentimentScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the {@link FeaturePayload} for one ticker.
 *
 * <p><strong>Flow (live mode):</strong>
 * <ol>
 *   <li>Check {@link FeatureCache}; a hit is returned as-is with no provider call.</li>
 *   <li>Fetch primary/secondary headlines, primary quote, candles and the earnings date
 *       concurrently. Every call site yields a {@link ProviderOutcome}, never an error.</li>
 *   <li>Resolve the last price through a {@link FallbackChain}: primary quote → latest
 *       candle close → secondary quote (fetched lazily) → sentinel 1.0.</li>
 *   <li>Merge refs, score sentiment, derive returns/volatility/liquidity/earnings flags,
 *       clamp, cache, return.</li>
 * </ol>
 *
 * <p>When both the primary quote and the candle feed failed and no positive price was
 * found, or when any step throws, the synthetic payload is returned instead (still
 * cached, {@code error} populated). Nothing escapes {@link #featuresFor} as an error signal.
 */
@Service
public class FeatureAggregator {

    private static final Logger log = LoggerFactory.getLogger(FeatureAggregator.class);

    public static final double RV20_MIN = 0.02;
    public static final double RV20_MAX = 0.80;
    public static final int MAX_MINS_SINCE_NEWS = 240;

    static final int CANDLE_LOOKBACK_MINUTES = 120;
    static final String CANDLE_FREQUENCY = "1min";
    static final String SENTINEL_SOURCE = "sentinel";
    static final double SENTINEL_PRICE = 1.0;
    static final double ESTIMATED_SPREAD_BPS = 8.0;
    static final double LIQUID_SPREAD_BPS = 30.0;
    static final long LIQUID_VOLUME_1M = 1_000;
    static final long LIQUID_VOLUME_5M = 5_000;
    static final int EARNINGS_WINDOW_DAYS = 14;

    private record FetchResults(
        ProviderOutcome<List<Headline>> primaryNews,
        ProviderOutcome<List<Headline>> secondaryNews,
        ProviderOutcome<ProviderQuote> primaryQuote,
        ProviderOutcome<List<Candle>> candles,
        ProviderOutcome<LocalDate> earnings
    ) {}

    private record PriceSignals(double return1m, double return5m, boolean aboveSma20, double rv20) {}

    private final ProviderSet providers;
    private final SentimentScorer sentimentScorer;
    private final QuoteRingBuffer quoteRing;
    private final FeatureCache cache;
    private final FeatureSettings settings;
    private final Clock clock;

    public FeatureAggregator(ProviderSet providers, SentimentScorer sentimentScorer,
                             QuoteRingBuffer quoteRing, FeatureCache cache,
                             FeatureSettings settings, Clock clock) {
        this.providers       = providers;
        this.sentimentScorer = sentimentScorer;
        this.quoteRing       = quoteRing;
        this.cache           = cache;
        this.settings        = settings;
        this.clock           = clock;
    }

    public static String normalize(String ticker) {
        return ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
    }

    public Mono<FeaturePayload> featuresFor(String rawTicker) {
        String ticker = normalize(rawTicker);

        if (!settings.liveProviders()) {
            return Mono.fromSupplier(() -> {
                FeaturePayload payload = syntheticPayload(ticker, null, null);
                cache.put(ticker, payload);
                return payload;
            });
        }

        return Mono.defer(() -> {
                CachedFeatures cached = cache.get(ticker);
                if (cached != null) {
                    log.info("CACHE_HIT symbol={} storedAt={}", ticker, cached.storedAt());
                    return Mono.just(cached.payload());
                }
                log.info("CACHE_MISS symbol={}", ticker);
                return aggregate(ticker);
            })
            .onErrorResume(e -> {
                log.error("Feature aggregation failed, serving synthetic payload. symbol={}", ticker, e);
                FeaturePayload payload = syntheticPayload(ticker, null,
                    "providers failed: " + ProviderOutcome.describe(e));
                cache.put(ticker, payload);
                return Mono.just(payload);
            })
            .doOnEach(signal -> {
                if (!signal.isOnNext()) return;
                FeaturePayload p = signal.get();
                String traceId = TraceContextUtil.getTraceId(signal.getContextView());
                TraceContextUtil.withMdc(traceId, () ->
                    log.info("FEATURES_READY symbol={} quality={} degraded={} traceId={}",
                             ticker, p.quote().quality(), p.error() != null, traceId));
            });
    }

    /** Synthetic payload without cache interaction, for the legacy stub endpoint. */
    public FeaturePayload stubPayload(String rawTicker) {
        return syntheticPayload(normalize(rawTicker), null, null);
    }

    // ── FETCH ────────────────────────────────────────────────────────────────

    private Mono<FeaturePayload> aggregate(String ticker) {
        Duration timeout = settings.providerTimeout();
        int limit = settings.headlineLimit();

        Mono<ProviderOutcome<List<Headline>>> primaryNews = ProviderOutcome.capture(
            providers.primaryHeadlines().name(),
            () -> providers.primaryHeadlines().fetchHeadlines(ticker, limit), timeout);
        Mono<ProviderOutcome<List<Headline>>> secondaryNews = ProviderOutcome.capture(
            providers.secondaryHeadlines().name(),
            () -> providers.secondaryHeadlines().fetchHeadlines(ticker, limit), timeout);
        Mono<ProviderOutcome<ProviderQuote>> primaryQuote = ProviderOutcome.capture(
            providers.primaryQuotes().name(),
            () -> providers.primaryQuotes().fetchQuote(ticker), timeout);
        Mono<ProviderOutcome<List<Candle>>> candles = ProviderOutcome.capture(
            providers.candles().name(),
            () -> providers.candles().fetchCandles(ticker, CANDLE_LOOKBACK_MINUTES, CANDLE_FREQUENCY), timeout);
        Mono<ProviderOutcome<LocalDate>> earnings = ProviderOutcome.capture(
            providers.earnings().name() + " earnings",
            () -> providers.earnings().fetchEarningsDate(ticker), timeout);

        return Mono.zip(primaryNews, secondaryNews, primaryQuote, candles, earnings)
            .map(t -> new FetchResults(t.getT1(), t.getT2(), t.getT3(), t.getT4(), t.getT5()))
            .flatMap(fetched -> merge(ticker, fetched));
    }

    // ── MERGE ────────────────────────────────────────────────────────────────

    private Mono<FeaturePayload> merge(String ticker, FetchResults fetched) {
        List<Headline> primary   = fetched.primaryNews().valueOr(List.of());
        List<Headline> secondary = fetched.secondaryNews().valueOr(List.of());
        List<Candle> bars        = fetched.candles().valueOr(List.of());

        List<String> diagnostics = new ArrayList<>();
        addDiagnostic(diagnostics, fetched.primaryNews());
        addDiagnostic(diagnostics, fetched.secondaryNews());

        return resolveLastPrice(ticker, fetched, bars)
            .flatMap(last -> {
                if (last.diagnostic() != null) diagnostics.add(last.diagnostic());
                addDiagnostic(diagnostics, fetched.candles());
                addDiagnostic(diagnostics, fetched.earnings());
                if (SENTINEL_SOURCE.equals(last.source())
                        && fetched.primaryQuote().isFailed() && fetched.candles().isFailed()) {
                    log.warn("Quote and candle feeds exhausted, serving synthetic payload. symbol={}", ticker);
                    FeaturePayload payload = syntheticPayload(ticker,
                        HeadlineMerger.topHeadline(primary, secondary), joinDiagnostics(diagnostics));
                    cache.put(ticker, payload);
                    return Mono.just(payload);
                }
                return sentimentScorer.score(HeadlineMerger.sentimentTitles(primary, secondary))
                    .onErrorReturn(SentimentScore.NEUTRAL)
                    .defaultIfEmpty(SentimentScore.NEUTRAL)
                    .map(sentiment -> derive(ticker, fetched, last.value(), sentiment,
                                             primary, secondary, bars, diagnostics));
            });
    }

    private Mono<ProviderOutcome<Double>> resolveLastPrice(String ticker, FetchResults fetched, List<Candle> bars) {
        QuoteProvider secondary = providers.secondaryQuotes();
        ProviderOutcome<Double> latestClose = bars.isEmpty()
            ? ProviderOutcome.<Double>success(null, providers.candles().name())
            : ProviderOutcome.<Double>success(bars.get(bars.size() - 1).close(), providers.candles().name());

        return FallbackChain.<Double>of("quote.last")
            .thenOutcome(providers.primaryQuotes().name(), fetched.primaryQuote().map(ProviderQuote::last))
            .thenOutcome(providers.candles().name(), latestClose)
            .then(secondary.name(), () -> ProviderOutcome.capture(secondary.name(),
                    () -> secondary.fetchQuote(ticker), settings.providerTimeout())
                .map(outcome -> outcome.map(ProviderQuote::last)))
            .thenValue(SENTINEL_SOURCE, SENTINEL_PRICE)
            .resolve(price -> price > 0.0);
    }

    // ── DERIVE + CLAMP + CACHE_WRITE ─────────────────────────────────────────

    private FeaturePayload derive(String ticker, FetchResults fetched, double last, SentimentScore sentiment,
                                  List<Headline> primary, List<Headline> secondary,
                                  List<Candle> bars, List<String> diagnostics) {
        quoteRing.append(ticker, last);
        Instant now = clock.instant();

        QuoteSnapshot quote = displayQuote(last, fetched.primaryQuote().valueOr(null));
        PriceSignals signals = priceSignals(ticker, bars, last);
        int minsSinceNews = (int) FeatureIndicators.clamp(
            HeadlineMerger.minutesSinceNews(primary, secondary, now), 0, MAX_MINS_SINCE_NEWS);

        FeatureVector features = new FeatureVector(
            sentiment.mean(),
            sentiment.std(),
            signals.return1m(),
            signals.return5m(),
            signals.aboveSma20(),
            minsSinceNews,
            FeatureIndicators.clamp(signals.rv20(), RV20_MIN, RV20_MAX),
            earningsSoon(fetched.earnings().valueOr(null), now),
            liquid(quote, bars));

        List<HeadlineRef> refs = HeadlineMerger.mergeRefs(primary, secondary);
        FeaturePayload payload = new FeaturePayload(
            ticker,
            features,
            HeadlineMerger.topHeadline(primary, secondary),
            HeadlineMerger.padSlots(refs),
            HeadlineMerger.sources(refs),
            joinDiagnostics(diagnostics),
            quote,
            IsoTimestamps.format(now));

        cache.put(ticker, payload);
        return payload;
    }

    /**
     * Observed bid/ask when both are present with {@code ask > bid}; otherwise an
     * 8 bps spread centred on {@code last}.
     */
    static QuoteSnapshot displayQuote(double last, ProviderQuote observed) {
        Double bid = observed == null ? null : positiveOrNull(observed.bid());
        Double ask = observed == null ? null : positiveOrNull(observed.ask());
        if (bid != null && ask != null && ask > bid) {
            return new QuoteSnapshot(last, bid, ask, QuoteQuality.REAL);
        }
        double half = (ESTIMATED_SPREAD_BPS / 1e4) * last * 0.5;
        return new QuoteSnapshot(last, last - half, last + half, QuoteQuality.ESTIMATED);
    }

    private PriceSignals priceSignals(String ticker, List<Candle> bars, double last) {
        if (bars.size() < 2) {
            List<Double> flat = FeatureIndicators.padToLength(List.of(), FeatureIndicators.PADDED_LENGTH, last);
            return new PriceSignals(
                quoteRing.trailingReturn(ticker, 1),
                quoteRing.trailingReturn(ticker, 5),
                false,
                FeatureIndicators.normalizedAtr(flat, flat, flat, FeatureIndicators.MA_PERIOD));
        }

        List<Double> closes = bars.stream().map(Candle::close).toList();
        List<Double> highs  = bars.stream().map(Candle::high).toList();
        List<Double> lows   = bars.stream().map(Candle::low).toList();

        double r1 = FeatureIndicators.percentReturn(closes, 1);
        double r5 = closes.size() >= 6
            ? FeatureIndicators.percentReturn(closes, 5)
            : quoteRing.trailingReturn(ticker, 5);

        List<Double> series = FeatureIndicators.tail(closes, CANDLE_LOOKBACK_MINUTES);
        double padValue = series.get(series.size() - 1);
        List<Double> paddedCloses = FeatureIndicators.padToLength(series, FeatureIndicators.PADDED_LENGTH, padValue);
        List<Double> paddedHighs = FeatureIndicators.padToLength(
            FeatureIndicators.tail(highs, series.size()), paddedCloses.size(), padValue);
        List<Double> paddedLows = FeatureIndicators.padToLength(
            FeatureIndicators.tail(lows, series.size()), paddedCloses.size(), padValue);

        return new PriceSignals(r1, r5,
            FeatureIndicators.aboveMovingAverage20(series),
            FeatureIndicators.normalizedAtr(paddedHighs, paddedLows, paddedCloses, FeatureIndicators.MA_PERIOD));
    }

    private static boolean earningsSoon(LocalDate earningsDate, Instant now) {
        if (earningsDate == null) return false;
        long days = ChronoUnit.DAYS.between(LocalDate.ofInstant(now, ZoneOffset.UTC), earningsDate);
        return days >= 0 && days <= EARNINGS_WINDOW_DAYS;
    }

    private static boolean liquid(QuoteSnapshot quote, List<Candle> bars) {
        double spreadBps = quote.last() > 0 && quote.bid() != null && quote.ask() != null
            ? Math.abs(quote.ask() - quote.bid()) / quote.last() * 1e4
            : Double.MAX_VALUE;
        long volume1m = bars.isEmpty() ? 0 : bars.get(bars.size() - 1).volume();
        long volume5m = bars.subList(Math.max(0, bars.size() - 5), bars.size()).stream()
            .mapToLong(Candle::volume)
            .sum();
        return spreadBps <= LIQUID_SPREAD_BPS || volume1m >= LIQUID_VOLUME_1M || volume5m >= LIQUID_VOLUME_5M;
    }

    // ── DEGRADED ─────────────────────────────────────────────────────────────

    private FeaturePayload syntheticPayload(String ticker, HeadlineRef topHeadline, String error) {
        return new FeaturePayload(
            ticker,
            SyntheticFeatures.build(),
            topHeadline,
            HeadlineMerger.padSlots(List.of()),
            List.of(),
            error,
            QuoteSnapshot.unknown(),
            IsoTimestamps.now(clock));
    }

    private static void addDiagnostic(List<String> diagnostics, ProviderOutcome<?> outcome) {
        if (outcome.isFailed() && outcome.diagnostic() != null) {
            diagnostics.add(outcome.diagnostic());
        }
    }

    private static String joinDiagnostics(List<String> diagnostics) {
        return diagnostics.isEmpty() ? null : String.join(FallbackChain.DIAGNOSTIC_SEPARATOR, diagnostics);
    }

    private static Double positiveOrNull(Double v) {
        return v != null && v > 0 ? v : null;
    }
}
