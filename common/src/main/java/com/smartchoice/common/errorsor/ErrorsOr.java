package com.smartchoice.common.errorsor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 *
 * <p>Used wherever several problems should be reported together (spec validation, definition
 * loading, codecs) instead of failing on the first one.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /** Value when {@code errors} is empty, otherwise all of them. */
    static <T> ErrorsOr<T> liftOrErrors(T value, List<String> errors) {
        return errors.isEmpty() ? lift(value) : errors(errors);
    }

    /** All values in order, or every error from every failed element. */
    static <T> ErrorsOr<List<T>> sequence(List<ErrorsOr<T>> items) {
        List<T> values = new ArrayList<>(items.size());
        List<String> errors = new ArrayList<>();
        for (ErrorsOr<T> item : items) {
            if (item.isError()) errors.addAll(item.getErrors());
            else values.add(item.getValue().get());
        }
        return errors.isEmpty() ? lift(List.copyOf(values)) : errors(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    /** Value, or the exception built from the joined error messages. */
    default T valueOrThrow(Function<String, ? extends RuntimeException> toException) {
        if (isValue()) return getValue().get();
        throw toException.apply(String.join("; ", getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }

    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : ErrorsOr.lift(f.apply(getValue().get()));
    }

    default ErrorsOr<T> addPrefixIfError(String prefix) {
        return isError() ? ErrorsOr.errors(getErrors().stream().map(e -> prefix + e).toList()) : this;
    }
}
