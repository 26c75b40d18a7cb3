package com.tickercontext.features.fallback;

import com.tickercontext.common.exception.ProviderException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Tagged result of one provider call site.
 *
 * <p>{@code SUCCESS} and {@code DEGRADED} carry a value (which may be null when the
 * provider legitimately returned nothing); {@code FAILED} carries only a diagnostic.
 * {@code source} names the attempt that produced the value.
 */
public record ProviderOutcome<T>(
    Status status,
    T value,
    String diagnostic,
    String source
) {

    public enum Status { SUCCESS, DEGRADED, FAILED }

    public static <T> ProviderOutcome<T> success(T value, String source) {
        return new ProviderOutcome<>(Status.SUCCESS, value, null, source);
    }

    public static <T> ProviderOutcome<T> degraded(T value, String diagnostic, String source) {
        return new ProviderOutcome<>(Status.DEGRADED, value, diagnostic, source);
    }

    public static <T> ProviderOutcome<T> failed(String diagnostic) {
        return new ProviderOutcome<>(Status.FAILED, null, diagnostic, null);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean hasValue() {
        return status != Status.FAILED && value != null;
    }

    public T valueOr(T fallback) {
        return hasValue() ? value : fallback;
    }

    public <R> ProviderOutcome<R> map(Function<? super T, ? extends R> mapper) {
        if (!hasValue()) {
            return new ProviderOutcome<>(status, null, diagnostic, source);
        }
        return new ProviderOutcome<>(status, mapper.apply(value), diagnostic, source);
    }

    /**
     * Runs one provider call with a timeout and folds every terminal signal into an outcome:
     * a value becomes SUCCESS, completion without a value becomes SUCCESS with a null value,
     * and any error (including timeout and assembly-time exceptions) becomes FAILED with a
     * {@code "<label>: <reason>"} diagnostic. The returned Mono never errors.
     */
    public static <T> Mono<ProviderOutcome<T>> capture(String label, Supplier<Mono<T>> call, Duration timeout) {
        return Mono.defer(call)
            .timeout(timeout)
            .map(value -> ProviderOutcome.success(value, label))
            .defaultIfEmpty(ProviderOutcome.success(null, label))
            .onErrorResume(e -> Mono.just(ProviderOutcome.failed(label + ": " + describe(e))));
    }

    /**
     * Short reason for a diagnostic. A {@link ProviderException} contributes its bare reason
     * because the call-site label already names the provider.
     */
    public static String describe(Throwable e) {
        String message = e instanceof ProviderException
            ? ((ProviderException) e).getReason()
            : e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
