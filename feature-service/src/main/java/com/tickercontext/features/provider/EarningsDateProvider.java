package com.tickercontext.features.provider;

import reactor.core.publisher.Mono;

import java.time.LocalDate;

public interface EarningsDateProvider {
    String name();

    /**
     * @return the next scheduled earnings date, or an empty Mono when none is known
     */
    Mono<LocalDate> fetchEarningsDate(String ticker);
}
