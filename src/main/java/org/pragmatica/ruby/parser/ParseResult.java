package org.pragmatica.ruby.parser;

import java.util.function.Function;

/**
 * Result of running a parser against a cursor - either a value with the cursor after it,
 * or a failure. Both carry the furthest expectation seen, so a successful ordered choice
 * still remembers how far its abandoned branches got.
 */
public sealed interface ParseResult<T> {

    Expectation furthest();

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Continue from a success; failures pass through unchanged.
     */
    <R> ParseResult<R> flatMap(Function<Success<T>, ParseResult<R>> continuation);

    ParseResult<T> withFurthest(Expectation other);

    static <T> ParseResult<T> success(T value, Cursor rest) {
        return new Success<>(value, rest, Expectation.NONE);
    }

    static <T> ParseResult<T> failure(int offset, String expected) {
        return new Failure<>(Expectation.at(offset, expected));
    }

    /**
     * Successful parse with value and remaining input.
     */
    record Success<T>(
        T value,
        Cursor rest,
        Expectation furthest
    ) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value), rest, furthest);
        }

        @Override
        public <R> ParseResult<R> flatMap(Function<Success<T>, ParseResult<R>> continuation) {
            return continuation.apply(this).withFurthest(furthest);
        }

        @Override
        public ParseResult<T> withFurthest(Expectation other) {
            return new Success<>(value, rest, furthest.merge(other));
        }
    }

    /**
     * Failed parse - no match at the current position.
     */
    record Failure<T>(Expectation furthest) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        public int offset() {
            return furthest.offset();
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(furthest);
        }

        @Override
        public <R> ParseResult<R> flatMap(Function<Success<T>, ParseResult<R>> continuation) {
            return new Failure<>(furthest);
        }

        @Override
        public ParseResult<T> withFurthest(Expectation other) {
            return new Failure<>(furthest.merge(other));
        }
    }
}
