package org.pragmatica.ruby.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * A parser of {@code T} values. Parsers are stateless and reusable; all per-parse state travels
 * in the {@link Cursor}.
 */
@FunctionalInterface
public interface Parser<T> {

    ParseResult<T> parse(Cursor cursor);

    default <R> Parser<R> map(Function<? super T, ? extends R> mapper) {
        return cursor -> parse(cursor).map(mapper);
    }

    /**
     * Sequence: run the parser chosen from this parser's value on the remaining input.
     */
    default <R> Parser<R> flatMap(Function<? super T, ? extends Parser<R>> next) {
        return cursor -> parse(cursor).flatMap(success -> next.apply(success.value())
                                                              .parse(success.rest()));
    }

    /**
     * Sequence keeping the right value.
     */
    default <R> Parser<R> then(Parser<R> next) {
        return flatMap(ignored -> next);
    }

    /**
     * Sequence keeping the left value.
     */
    default <R> Parser<T> skip(Parser<R> next) {
        return flatMap(value -> next.map(ignored -> value));
    }

    default Parser<T> or(Parser<? extends T> alternative) {
        return Parsers.choice(this, alternative);
    }

    default Parser<Optional<T>> optional() {
        return cursor -> {
            var result = parse(cursor);
            if (result instanceof ParseResult.Success<T> success) {
                return success.map(Optional::of);
            }
            return new ParseResult.Success<>(Optional.<T>empty(), cursor, result.furthest());
        };
    }

    /**
     * Repeat until the parser fails or stops consuming input.
     */
    default Parser<List<T>> zeroOrMore() {
        return cursor -> {
            var values = new ArrayList<T>();
            var current = cursor;
            var furthest = Expectation.NONE;

            while (true) {
                var result = parse(current);
                furthest = furthest.merge(result.furthest());
                if (!(result instanceof ParseResult.Success<T> success)
                    || success.rest().offset() == current.offset()) {
                    break;
                }
                values.add(success.value());
                current = success.rest();
            }
            return new ParseResult.Success<>(List.copyOf(values), current, furthest);
        };
    }

    default Parser<List<T>> oneOrMore() {
        return flatMap(first -> zeroOrMore().map(rest -> {
            var values = new ArrayList<T>(rest.size() + 1);
            values.add(first);
            values.addAll(rest);
            return List.copyOf(values);
        }));
    }

    /**
     * Describe a failure that made no progress with {@code expected} instead of the inner
     * description. Failures that got further keep their more specific description.
     */
    default Parser<T> named(String expected) {
        return cursor -> {
            var result = parse(cursor);
            if (result.isSuccess() || result.furthest().offset() > cursor.offset()) {
                return result;
            }
            return ParseResult.failure(cursor.offset(), expected);
        };
    }
}
