package org.pragmatica.ruby.grammar;

import org.pragmatica.ruby.parser.ParseResult;
import org.pragmatica.ruby.parser.Parser;
import org.pragmatica.ruby.parser.Parsers;
import org.pragmatica.ruby.tree.SyntaxNode;

import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Whitespace and comment handling applied at the grammar level, immediately before the
 * parser that produces a node. Comments are never tokens: they become metadata on the
 * nearest following node.
 */
public final class Filters {
    private Filters() {}

    private static final Pattern WHITESPACE = Pattern.compile("(?:[ \\t\\r\\f\\n]|\\\\\\r?\\n)*");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("(?:[ \\t\\f]|\\\\\\r?\\n)*");
    private static final Pattern LINE_BREAK = Pattern.compile("[\\r\\n#]");
    private static final Pattern LINE_COMMENT = Pattern.compile("#[ \\t]*([^\\r\\n]*)");
    private static final Pattern EMBEDDED_DOCUMENT = Pattern.compile(
        "(?m)^=begin\\b[ \\t]*\\r?\\n?((?s:.*?))^=end\\b[^\\r\\n]*");

    /**
     * Leading whitespace, newlines included. Never fails.
     */
    public static Parser<String> whitespace() {
        return Parsers.regex(WHITESPACE, "whitespace").map(MatchResult::group);
    }

    /**
     * Spaces, tabs and backslash line continuations. Never fails.
     */
    public static Parser<String> horizontalSpace() {
        return Parsers.regex(HORIZONTAL_SPACE, "space").map(MatchResult::group);
    }

    /**
     * One comment of either kind, as a comment node.
     */
    public static Parser<SyntaxNode> comment() {
        return Parsers.choice(commentOf(LINE_COMMENT, SyntaxNode.LINE_COMMENT, "comment"),
                              commentOf(EMBEDDED_DOCUMENT, SyntaxNode.EMBEDDED_DOCUMENT, "=begin"));
    }

    private static Parser<SyntaxNode> commentOf(Pattern pattern, String marker, String expected) {
        return Parsers.regex(pattern, expected)
                      .map(match -> SyntaxNode.comment(marker,
                                                       match.start(),
                                                       SyntaxNode.leaf(match.group(1), match.start(1))));
    }

    /**
     * Comments, each optionally preceded by whitespace, up to (not including) the whitespace
     * that follows the last one. Never fails and reports no expectation.
     */
    public static Parser<List<SyntaxNode>> comments() {
        var repeated = whitespace().then(comment())
                                   .zeroOrMore();
        return cursor -> {
            var result = repeated.parse(cursor);
            if (result instanceof ParseResult.Success<List<SyntaxNode>> found) {
                return ParseResult.success(found.value(), found.rest());
            }
            return result;
        };
    }

    /**
     * Consume leading comments and attach them to the node {@code parser} produces. With comment
     * capture disabled they are consumed and dropped.
     */
    public static Parser<SyntaxNode> skipCommentBefore(Parser<SyntaxNode> parser) {
        return cursor -> comments().parse(cursor)
                                   .flatMap(found -> parser.parse(found.rest())
                                                           .map(node -> cursor.config().captureComments()
                                                                        ? node.withLeadingComments(found.value())
                                                                        : node));
    }

    public static <T> Parser<T> skipWhitespaceBefore(Parser<T> parser) {
        return whitespace().then(parser);
    }

    public static Parser<SyntaxNode> spaceInsensitive(Parser<SyntaxNode> parser) {
        return skipCommentBefore(skipWhitespaceBefore(parser));
    }

    /**
     * Horizontal whitespace only, so a newline or a comment in front of {@code parser} makes it fail.
     */
    public static <T> Parser<T> noNewlinesBefore(Parser<T> parser) {
        return horizontalSpace().then(Parsers.not(Parsers.regex(LINE_BREAK, "newline"), "same line"))
                                .then(parser);
    }

    /**
     * No whitespace at all; used where adjacency changes meaning, e.g. {@code f(x)} against
     * {@code f (x)}.
     */
    public static <T> Parser<T> immediately(Parser<T> parser) {
        return parser;
    }

    /**
     * Comments and whitespace before a closing delimiter. They have no following node to
     * attach to, so the caller appends them to the enclosing node.
     */
    public static <T> Parser<Closing<T>> closedBy(Parser<T> closing) {
        return cursor -> comments().parse(cursor)
                                   .flatMap(found -> skipWhitespaceBefore(closing)
                                       .parse(found.rest())
                                       .map(value -> new Closing<>(value, cursor.config().captureComments()
                                                                          ? found.value()
                                                                          : List.<SyntaxNode>of())));
    }

    /**
     * Tag the text matched by {@code parser} with the offset the match started at.
     */
    public static Parser<SyntaxNode> recordsPosition(Parser<String> parser) {
        return cursor -> parser.parse(cursor)
                               .map(text -> SyntaxNode.leaf(text, cursor.offset()));
    }

    /**
     * A matched closing delimiter together with the comments found in front of it.
     */
    public record Closing<T>(T value, List<SyntaxNode> comments) {
        public Closing {
            comments = List.copyOf(comments);
        }

        public SyntaxNode attachTo(SyntaxNode node) {
            return node.withTrailingComments(comments);
        }
    }
}
