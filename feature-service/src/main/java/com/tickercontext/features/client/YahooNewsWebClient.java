package com.tickercontext.features.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickercontext.common.exception.ProviderException;
import com.tickercontext.features.model.Headline;
import com.tickercontext.features.provider.HeadlineProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Yahoo Finance search endpoint, used as the secondary headline source. Keyless.
 */
public class YahooNewsWebClient implements HeadlineProvider {

    private static final Logger log = LoggerFactory.getLogger(YahooNewsWebClient.class);

    public static final String NAME = "yahoo";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public YahooNewsWebClient(WebClient yahooWebClient, ObjectMapper objectMapper) {
        this.webClient    = yahooWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<List<Headline>> fetchHeadlines(String ticker, int limit) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/v1/finance/search")
                .queryParam("q", ticker)
                .queryParam("newsCount", limit)
                .queryParam("quotesCount", 0)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parse(ticker, json, limit))
            .doOnSuccess(list -> log.info("Headlines fetched. provider=Yahoo symbol={} count={}",
                ticker, list == null ? 0 : list.size()));
    }

    private List<Headline> parse(String ticker, String json, int limit) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ProviderException(NAME, "malformed response for symbol: " + ticker, e);
        }
        JsonNode news = root.path("news");
        if (!news.isArray()) {
            throw new ProviderException(NAME, "no news array for symbol: " + ticker);
        }
        List<Headline> out = new ArrayList<>();
        for (JsonNode item : news) {
            if (out.size() >= limit) break;
            long epoch = item.path("providerPublishTime").asLong(0);
            out.add(new Headline(
                item.path("title").asText(""),
                item.path("link").asText(""),
                item.path("publisher").asText(""),
                epoch > 0 ? Instant.ofEpochSecond(epoch) : null));
        }
        return out;
    }
}
