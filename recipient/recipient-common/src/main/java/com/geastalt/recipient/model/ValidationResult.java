/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.model;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the result of validating a recipient using a functional Either pattern.
 * Can be either a success with the validated value or a failure with the reason
 * the input was rejected.
 */
public sealed interface ValidationResult<T> {

    /**
     * Checks if this result represents a success.
     */
    boolean isSuccess();

    /**
     * Gets the value if successful, throws if not.
     */
    T getValue();

    /**
     * Gets the error if failed, throws if successful.
     */
    RecipientError getError();

    /**
     * Maps the success value to a new type.
     */
    <U> ValidationResult<U> map(Function<T, U> mapper);

    /**
     * FlatMaps the success value to a new ValidationResult.
     */
    <U> ValidationResult<U> flatMap(Function<T, ValidationResult<U>> mapper);

    /**
     * Tries an alternative when this is a failure. The alternative's result is used
     * only if it succeeds; otherwise this failure is kept.
     */
    ValidationResult<T> orElseTry(Supplier<ValidationResult<T>> alternative);

    /**
     * Executes the given consumer if this is a success.
     */
    ValidationResult<T> onSuccess(Consumer<T> consumer);

    /**
     * Executes the given consumer if this is a failure.
     */
    ValidationResult<T> onFailure(Consumer<RecipientError> consumer);

    /**
     * Returns the value if successful, otherwise returns the default value.
     */
    T orElse(T defaultValue);

    /**
     * Returns the value if successful, otherwise throws {@link InvalidRecipientException}.
     */
    T orElseThrow();

    /**
     * Creates a successful result.
     */
    static <T> ValidationResult<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * Creates a failed result.
     */
    static <T> ValidationResult<T> failure(RecipientError error) {
        return new Failure<>(error);
    }

    /**
     * Creates a failed result carrying the code's standard message.
     */
    static <T> ValidationResult<T> failure(RecipientErrorCode code) {
        return new Failure<>(RecipientError.of(code));
    }

    // Success implementation
    record Success<T>(T value) implements ValidationResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public RecipientError getError() {
            throw new IllegalStateException("Cannot get error from success result");
        }

        @Override
        public <U> ValidationResult<U> map(Function<T, U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> ValidationResult<U> flatMap(Function<T, ValidationResult<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public ValidationResult<T> orElseTry(Supplier<ValidationResult<T>> alternative) {
            return this;
        }

        @Override
        public ValidationResult<T> onSuccess(Consumer<T> consumer) {
            consumer.accept(value);
            return this;
        }

        @Override
        public ValidationResult<T> onFailure(Consumer<RecipientError> consumer) {
            return this;
        }

        @Override
        public T orElse(T defaultValue) {
            return value;
        }

        @Override
        public T orElseThrow() {
            return value;
        }
    }

    // Failure implementation
    record Failure<T>(RecipientError error) implements ValidationResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Cannot get value from failure result: " + error);
        }

        @Override
        public RecipientError getError() {
            return error;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> ValidationResult<U> map(Function<T, U> mapper) {
            return (ValidationResult<U>) this;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> ValidationResult<U> flatMap(Function<T, ValidationResult<U>> mapper) {
            return (ValidationResult<U>) this;
        }

        @Override
        public ValidationResult<T> orElseTry(Supplier<ValidationResult<T>> alternative) {
            ValidationResult<T> next = alternative.get();
            return next.isSuccess() ? next : this;
        }

        @Override
        public ValidationResult<T> onSuccess(Consumer<T> consumer) {
            return this;
        }

        @Override
        public ValidationResult<T> onFailure(Consumer<RecipientError> consumer) {
            consumer.accept(error);
            return this;
        }

        @Override
        public T orElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T orElseThrow() {
            throw new InvalidRecipientException(error);
        }
    }
}
