package com.tickercontext.features.fallback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Ordered list of attempt strategies for one data kind.
 *
 * <p>{@link #resolve} subscribes to the attempts one at a time and stops at the first
 * value accepted by the predicate. Attempts after that are never subscribed, so a lazy
 * provider call placed late in the chain costs nothing when an earlier step succeeds.
 * Diagnostics of failed attempts accumulate in order and are joined with {@code "; "}.
 *
 * <p>Result tags: SUCCESS when the first attempt is accepted, DEGRADED when a later one
 * is, FAILED when every attempt is exhausted.
 */
public final class FallbackChain<T> {

    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    public static final String DIAGNOSTIC_SEPARATOR = "; ";

    private record Attempt<T>(String label, Supplier<Mono<ProviderOutcome<T>>> call) {}

    private final String kind;
    private final List<Attempt<T>> attempts = new ArrayList<>();

    private FallbackChain(String kind) {
        this.kind = kind;
    }

    public static <T> FallbackChain<T> of(String kind) {
        return new FallbackChain<>(kind);
    }

    /** Adds an attempt whose outcome is computed lazily on subscription. */
    public FallbackChain<T> then(String label, Supplier<Mono<ProviderOutcome<T>>> call) {
        attempts.add(new Attempt<>(label, call));
        return this;
    }

    /** Adds an attempt backed by an outcome that has already been fetched. */
    public FallbackChain<T> thenOutcome(String label, ProviderOutcome<T> outcome) {
        return then(label, () -> Mono.just(outcome));
    }

    /** Adds a constant last-resort value. */
    public FallbackChain<T> thenValue(String label, T value) {
        return then(label, () -> Mono.just(ProviderOutcome.success(value, label)));
    }

    public Mono<ProviderOutcome<T>> resolve(Predicate<? super T> accept) {
        return Mono.defer(() -> attempt(0, accept, new ArrayList<>()));
    }

    private Mono<ProviderOutcome<T>> attempt(int index, Predicate<? super T> accept, List<String> diagnostics) {
        if (index >= attempts.size()) {
            String joined = diagnostics.isEmpty()
                ? kind + ": no usable value"
                : String.join(DIAGNOSTIC_SEPARATOR, diagnostics);
            log.warn("FALLBACK_EXHAUSTED kind={} attempts={} diagnostics={}", kind, attempts.size(), joined);
            return Mono.just(ProviderOutcome.failed(joined));
        }
        Attempt<T> current = attempts.get(index);
        return Mono.defer(current.call())
            .onErrorResume(e -> Mono.just(ProviderOutcome.failed(current.label() + ": " + ProviderOutcome.describe(e))))
            .defaultIfEmpty(ProviderOutcome.failed(current.label() + ": no response"))
            .flatMap(outcome -> {
                if (outcome.hasValue() && accept.test(outcome.value())) {
                    if (index == 0) {
                        return Mono.just(ProviderOutcome.success(outcome.value(), current.label()));
                    }
                    log.info("FALLBACK_USED kind={} source={} step={}", kind, current.label(), index + 1);
                    String joined = diagnostics.isEmpty() ? null : String.join(DIAGNOSTIC_SEPARATOR, diagnostics);
                    return Mono.just(ProviderOutcome.degraded(outcome.value(), joined, current.label()));
                }
                if (outcome.isFailed() && outcome.diagnostic() != null) {
                    diagnostics.add(outcome.diagnostic());
                }
                log.debug("FALLBACK_SKIP kind={} source={} status={}", kind, current.label(), outcome.status());
                return attempt(index + 1, accept, diagnostics);
            });
    }
}
