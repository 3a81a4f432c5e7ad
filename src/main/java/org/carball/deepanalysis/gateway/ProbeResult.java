package org.carball.deepanalysis.gateway;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of one probe: either a value or the reason it is missing.
 */
public final class ProbeResult<T> {

    private final T value;
    private final String failureReason;

    private ProbeResult(T value, String failureReason) {
        this.value = value;
        this.failureReason = failureReason;
    }

    public static <T> ProbeResult<T> success(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Successful probe result needs a value");
        }
        return new ProbeResult<>(value, null);
    }

    public static <T> ProbeResult<T> failure(String reason) {
        return new ProbeResult<>(null, reason != null ? reason : "unknown failure");
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public boolean isFailure() {
        return failureReason != null;
    }

    public T get() {
        if (isFailure()) {
            throw new NoSuchElementException("Probe failed: " + failureReason);
        }
        return value;
    }

    public String failureReason() {
        return failureReason;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public <R> ProbeResult<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? ProbeResult.success(mapper.apply(value)) : ProbeResult.failure(failureReason);
    }

    public <R> ProbeResult<R> flatMap(Function<? super T, ProbeResult<R>> mapper) {
        return isSuccess() ? mapper.apply(value) : ProbeResult.failure(failureReason);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ProbeResult[success]" : "ProbeResult[failure: " + failureReason + "]";
    }
}
