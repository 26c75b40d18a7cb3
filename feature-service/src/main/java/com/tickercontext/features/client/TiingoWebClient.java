package com.tickercontext.features.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickercontext.common.exception.ProviderException;
import com.tickercontext.features.model.Candle;
import com.tickercontext.features.model.ProviderQuote;
import com.tickercontext.features.provider.CandleProvider;
import com.tickercontext.features.provider.QuoteProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Tiingo IEX client: primary quote (last/bid/ask) and intraday candles.
 */
public class TiingoWebClient implements QuoteProvider, CandleProvider {

    private static final Logger log = LoggerFactory.getLogger(TiingoWebClient.class);

    public static final String NAME = "tiingo";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final Clock clock;

    public TiingoWebClient(WebClient tiingoWebClient, ObjectMapper objectMapper, String apiKey, Clock clock) {
        this.webClient    = tiingoWebClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
        this.clock        = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    // ── Top-of-book quote ────────────────────────────────────────────────────

    @Override
    public Mono<ProviderQuote> fetchQuote(String ticker) {
        return get(uriBuilder -> uriBuilder
                .path("/iex/")
                .queryParam("tickers", ticker)
                .queryParam("token", apiKey)
                .build())
            .map(json -> parseQuote(ticker, json))
            .doOnNext(q -> log.info("Quote fetched. provider=Tiingo symbol={} last={} bid={} ask={}",
                ticker, q.last(), q.bid(), q.ask()));
    }

    private ProviderQuote parseQuote(String ticker, String json) {
        JsonNode root = readTree(ticker, json);
        JsonNode row = root.isArray() ? root.path(0) : root;
        if (row.isMissingNode() || row.isNull()) {
            throw new ProviderException(NAME, "no quote for symbol: " + ticker);
        }
        Double last = positiveOrNull(row.path("last"));
        if (last == null) {
            last = positiveOrNull(row.path("tngoLast"));
        }
        return new ProviderQuote(last, positiveOrNull(row.path("bidPrice")), positiveOrNull(row.path("askPrice")));
    }

    // ── Intraday candles ─────────────────────────────────────────────────────

    @Override
    public Mono<List<Candle>> fetchCandles(String ticker, int lookbackMinutes, String frequency) {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofMinutes(lookbackMinutes));
        LocalDate startDate = LocalDate.ofInstant(since, ZoneOffset.UTC);
        return get(uriBuilder -> uriBuilder
                .path("/iex/{ticker}/prices")
                .queryParam("startDate", startDate.toString())
                .queryParam("resampleFreq", frequency)
                .queryParam("columns", "open,high,low,close,volume")
                .queryParam("token", apiKey)
                .build(ticker))
            .map(json -> parseCandles(ticker, json, since))
            .doOnSuccess(list -> log.info("Candles fetched. provider=Tiingo symbol={} bars={}",
                ticker, list == null ? 0 : list.size()));
    }

    private List<Candle> parseCandles(String ticker, String json, Instant since) {
        JsonNode root = readTree(ticker, json);
        if (!root.isArray()) {
            throw new ProviderException(NAME, "unexpected candle body for symbol: " + ticker);
        }
        List<Candle> out = new ArrayList<>();
        for (JsonNode bar : root) {
            Instant ts;
            try {
                ts = OffsetDateTime.parse(bar.path("date").asText()).toInstant();
            } catch (DateTimeParseException e) {
                log.debug("[Tiingo] Skipping malformed candle: {}", bar);
                continue;
            }
            if (ts.isBefore(since)) continue;
            out.add(new Candle(ts,
                bar.path("open").asDouble(),
                bar.path("high").asDouble(),
                bar.path("low").asDouble(),
                bar.path("close").asDouble(),
                bar.path("volume").asLong(0)));
        }
        return out;
    }

    // ── plumbing ─────────────────────────────────────────────────────────────

    private Mono<String> get(Function<UriBuilder, URI> uri) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new ProviderException(NAME, "api key not configured"));
        }
        return webClient.get()
            .uri(uri)
            .retrieve()
            .bodyToMono(String.class);
    }

    private JsonNode readTree(String ticker, String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ProviderException(NAME, "malformed response for symbol: " + ticker, e);
        }
    }

    private static Double positiveOrNull(JsonNode node) {
        if (node == null || !node.isNumber()) return null;
        double v = node.asDouble();
        return v > 0 ? v : null;
    }
}
