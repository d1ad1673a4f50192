package org.pragmatica.ruby;

import org.pragmatica.ruby.error.ParseError;
import org.pragmatica.ruby.grammar.RubyGrammar;
import org.pragmatica.ruby.parser.Cursor;
import org.pragmatica.ruby.parser.Expectation;
import org.pragmatica.ruby.parser.ParseResult;
import org.pragmatica.ruby.parser.ParserConfig;
import org.pragmatica.ruby.tree.PositionTable;
import org.pragmatica.ruby.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for parsing Ruby source into a syntax tree.
 *
 * <p>Example usage:
 * <pre>{@code
 * var tree = RubyParser.create()
 *                      .parse("x = 1 + 2 * 3")
 *                      .unwrap();
 * // (= x (+ 1 (* 2 3)))
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads; every call to {@link #parse}
 * works on its own cursor, memo table and tree.
 */
public final class RubyParser {
    private static final Logger LOG = LoggerFactory.getLogger(RubyParser.class);

    private final RubyGrammar grammar;
    private final ParserConfig config;

    private RubyParser(RubyGrammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
    }

    /**
     * Parser with the default configuration: packrat memoization on, comments captured.
     */
    public static RubyParser create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Parse {@code source} completely. The text is read once; the returned tree has every node,
     * and every comment, resolved to a line and column.
     *
     * @throws NullPointerException if {@code source} is null
     */
    public ParseOutcome parse(CharSequence source) {
        Objects.requireNonNull(source, "source");
        var input = source.toString();
        var positions = PositionTable.of(input);
        var result = grammar.program()
                            .parse(Cursor.start(input, config));

        if (result instanceof ParseResult.Success<SyntaxNode> success) {
            LOG.debug("Parsed {} characters", input.length());
            return ParseOutcome.success(positions.resolve(success.value()));
        }
        var error = errorAt(input, positions, result.furthest());
        LOG.debug("Parse of {} characters failed: {}", input.length(), error.message());
        return ParseOutcome.failure(error);
    }

    private static ParseError errorAt(String input, PositionTable positions, Expectation furthest) {
        var offset = Math.max(0, Math.min(furthest.offset(), input.length()));
        var location = positions.at(offset);
        if (offset >= input.length()) {
            return new ParseError.UnexpectedEndOfInput(offset, location, furthest.describe());
        }
        return new ParseError.UnexpectedInput(offset, location, found(input.charAt(offset)), furthest.describe());
    }

    private static String found(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            default -> String.valueOf(c);
        };
    }

    /**
     * Builder for {@link RubyParser}.
     */
    public static final class Builder {
        private boolean packrat = ParserConfig.DEFAULT.packratEnabled();
        private boolean comments = ParserConfig.DEFAULT.captureComments();

        private Builder() {}

        /**
         * Memoize rule results per offset within a parse.
         */
        public Builder packrat(boolean enabled) {
            this.packrat = enabled;
            return this;
        }

        /**
         * Attach comments to nodes; when disabled comments are skipped like whitespace.
         */
        public Builder comments(boolean capture) {
            this.comments = capture;
            return this;
        }

        public RubyParser build() {
            return new RubyParser(RubyGrammar.create(), new ParserConfig(packrat, comments));
        }
    }
}
