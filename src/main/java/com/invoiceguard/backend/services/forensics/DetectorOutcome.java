package com.invoiceguard.backend.services.forensics;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Result of running one detector: either a value, or a failure carrying a reason code.
 * Detectors turn failures into their documented inconclusive payload via
 * {@link #orElseGet(BiFunction)}, so the fallback policy is part of the signature
 * instead of a catch block convention.
 */
public record DetectorOutcome<T>(
        T value,
        FailureReason failureReason,
        String message
) {
    public DetectorOutcome {
        if ((value == null) == (failureReason == null)) {
            throw new IllegalArgumentException("Exactly one of value or failureReason must be set");
        }
    }

    public static <T> DetectorOutcome<T> success(T value) {
        return new DetectorOutcome<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> DetectorOutcome<T> failure(FailureReason reason, String message) {
        return new DetectorOutcome<>(null, Objects.requireNonNull(reason, "reason"), message);
    }

    /**
     * Runs {@code action}, mapping a thrown exception, a recoverable error or a null result to a failure.
     * Native-library errors, stack overflows and out-of-memory on one page are treated as recoverable.
     */
    public static <T> DetectorOutcome<T> capture(FailureReason reason, Supplier<T> action) {
        try {
            T value = action.get();
            if (value == null) {
                return failure(reason, "Detector returned no result");
            }
            return success(value);
        } catch (Exception | LinkageError | StackOverflowError | OutOfMemoryError e) {
            return failure(reason, describe(e));
        }
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public <R> R fold(Function<? super T, ? extends R> onSuccess,
                      BiFunction<FailureReason, String, ? extends R> onFailure) {
        return isSuccess() ? onSuccess.apply(value) : onFailure.apply(failureReason, message);
    }

    public T orElseGet(BiFunction<FailureReason, String, ? extends T> fallback) {
        return fold(Function.identity(), fallback);
    }

    public static String describe(Throwable error) {
        if (error == null) return "Unknown error";
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
