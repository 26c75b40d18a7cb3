package com.tickercontext.features.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickercontext.common.exception.ProviderException;
import com.tickercontext.features.model.Headline;
import com.tickercontext.features.model.ProviderQuote;
import com.tickercontext.features.provider.EarningsDateProvider;
import com.tickercontext.features.provider.HeadlineProvider;
import com.tickercontext.features.provider.QuoteProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Finnhub REST client: primary headline source, secondary quote source and the
 * earnings calendar. Every failure surfaces as an error signal; callers decide how
 * to degrade.
 */
public class FinnhubWebClient implements HeadlineProvider, QuoteProvider, EarningsDateProvider {

    private static final Logger log = LoggerFactory.getLogger(FinnhubWebClient.class);

    public static final String NAME = "finnhub";
    private static final int NEWS_LOOKBACK_DAYS = 3;
    private static final int EARNINGS_HORIZON_DAYS = 30;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final Clock clock;

    public FinnhubWebClient(WebClient finnhubWebClient, ObjectMapper objectMapper, String apiKey, Clock clock) {
        this.webClient    = finnhubWebClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
        this.clock        = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    // ── Company news ─────────────────────────────────────────────────────────

    @Override
    public Mono<List<Headline>> fetchHeadlines(String ticker, int limit) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        return get(uriBuilder -> uriBuilder
                .path("/api/v1/company-news")
                .queryParam("symbol", ticker)
                .queryParam("from", today.minusDays(NEWS_LOOKBACK_DAYS).toString())
                .queryParam("to", today.toString())
                .queryParam("token", apiKey)
                .build())
            .map(json -> parseNews(ticker, json, limit))
            .doOnSuccess(list -> log.info("Headlines fetched. provider=Finnhub symbol={} count={}",
                ticker, list == null ? 0 : list.size()));
    }

    private List<Headline> parseNews(String ticker, String json, int limit) {
        JsonNode root = readTree(ticker, json);
        if (!root.isArray()) {
            throw new ProviderException(NAME, "unexpected news body for symbol: " + ticker);
        }
        List<Headline> out = new ArrayList<>();
        for (JsonNode item : root) {
            if (out.size() >= limit) break;
            long epoch = item.path("datetime").asLong(0);
            out.add(new Headline(
                item.path("headline").asText(""),
                item.path("url").asText(""),
                item.path("source").asText(""),
                epoch > 0 ? Instant.ofEpochSecond(epoch) : null));
        }
        return out;
    }

    // ── Quote ────────────────────────────────────────────────────────────────

    @Override
    public Mono<ProviderQuote> fetchQuote(String ticker) {
        return get(uriBuilder -> uriBuilder
                .path("/api/v1/quote")
                .queryParam("symbol", ticker)
                .queryParam("token", apiKey)
                .build())
            .map(json -> {
                JsonNode root = readTree(ticker, json);
                double last = root.path("c").asDouble(0.0);
                return new ProviderQuote(last, null, null);
            })
            .doOnNext(q -> log.info("Quote fetched. provider=Finnhub symbol={} last={}", ticker, q.last()));
    }

    // ── Earnings calendar ────────────────────────────────────────────────────

    @Override
    public Mono<LocalDate> fetchEarningsDate(String ticker) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        return get(uriBuilder -> uriBuilder
                .path("/api/v1/calendar/earnings")
                .queryParam("symbol", ticker)
                .queryParam("from", today.toString())
                .queryParam("to", today.plusDays(EARNINGS_HORIZON_DAYS).toString())
                .queryParam("token", apiKey)
                .build())
            .flatMap(json -> Mono.justOrEmpty(parseEarliestEarnings(ticker, json, today)));
    }

    private LocalDate parseEarliestEarnings(String ticker, String json, LocalDate today) {
        JsonNode calendar = readTree(ticker, json).path("earningsCalendar");
        LocalDate earliest = null;
        for (JsonNode entry : calendar) {
            String raw = entry.path("date").asText("");
            try {
                LocalDate date = LocalDate.parse(raw);
                if (!date.isBefore(today) && (earliest == null || date.isBefore(earliest))) {
                    earliest = date;
                }
            } catch (DateTimeParseException e) {
                log.debug("[Finnhub] Skipping malformed earnings date '{}' symbol={}", raw, ticker);
            }
        }
        return earliest;
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
}
