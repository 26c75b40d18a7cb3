package com.tickercontext.features.provider;

import com.tickercontext.features.model.Candle;
import reactor.core.publisher.Mono;

import java.util.List;

public interface CandleProvider {
    String name();

    /**
     * @return bars oldest-to-newest covering the last {@code lookbackMinutes}
     */
    Mono<List<Candle>> fetchCandles(String ticker, int lookbackMinutes, String frequency);
}
