package org.pragmatica.ruby.parser;

import java.util.List;
import java.util.function.Supplier;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Factory for primitive parsers and combinators.
 */
public final class Parsers {
    private Parsers() {}

    // === Terminals ===

    public static Parser<String> literal(String text) {
        var expected = "'" + text + "'";
        return cursor -> cursor.startsWith(text)
                         ? ParseResult.success(text, cursor.advance(text.length()))
                         : ParseResult.failure(cursor.offset(), expected);
    }

    public static Parser<String> pattern(String regex, String expected) {
        return regex(Pattern.compile(regex), expected).map(MatchResult::group);
    }

    /**
     * Anchored regular expression match; the value is the full match result so callers can
     * read group offsets.
     */
    public static Parser<MatchResult> regex(Pattern pattern, String expected) {
        return cursor -> cursor.match(pattern)
                               .<ParseResult<MatchResult>>map(match -> ParseResult.success(match, cursor.moveTo(match.end())))
                               .orElseGet(() -> ParseResult.failure(cursor.offset(), expected));
    }

    public static Parser<Boolean> end() {
        return cursor -> cursor.isAtEnd()
                         ? ParseResult.success(Boolean.TRUE, cursor)
                         : ParseResult.failure(cursor.offset(), "end of input");
    }

    public static <T> Parser<T> success(T value) {
        return cursor -> ParseResult.success(value, cursor);
    }

    // === Combinators ===

    /**
     * Ordered choice: the first alternative that succeeds wins, later ones are never tried.
     * Each alternative starts from the same cursor.
     */
    @SafeVarargs
    public static <T> Parser<T> choice(Parser<? extends T>... alternatives) {
        return choice(List.of(alternatives));
    }

    public static <T> Parser<T> choice(List<? extends Parser<? extends T>> alternatives) {
        var copy = List.copyOf(alternatives);
        return cursor -> {
            var furthest = Expectation.NONE;
            for (var alternative : copy) {
                ParseResult<T> result = alternative.parse(cursor).map(value -> value);
                if (result.isSuccess()) {
                    return result.withFurthest(furthest);
                }
                furthest = furthest.merge(result.furthest());
            }
            return furthest.isNone()
                   ? ParseResult.failure(cursor.offset(), "one of alternatives")
                   : new ParseResult.Failure<>(furthest);
        };
    }

    /**
     * Negative lookahead; consumes nothing and reports nothing from the inner parser.
     */
    public static Parser<Boolean> not(Parser<?> parser, String description) {
        return cursor -> parser.parse(cursor).isSuccess()
                         ? ParseResult.failure(cursor.offset(), description)
                         : ParseResult.success(Boolean.TRUE, cursor);
    }

    /**
     * Positive lookahead; yields the inner value without consuming input.
     */
    public static <T> Parser<T> lookahead(Parser<T> parser) {
        return cursor -> parser.parse(cursor)
                               .flatMap(success -> ParseResult.success(success.value(), cursor));
    }

    /**
     * Deferred parser for forward and self references while a grammar is being assembled.
     */
    public static <T> Parser<T> lazy(Supplier<? extends Parser<T>> supplier) {
        return new Rule<>("<lazy>", supplier, false);
    }

    /**
     * Named, lazily resolved and (when packrat is enabled) memoized production.
     */
    public static <T> Parser<T> rule(String name, Supplier<? extends Parser<T>> definition) {
        return new Rule<>(name, definition, true);
    }
}
