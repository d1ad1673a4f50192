package org.pragmatica.ruby.grammar;

import org.pragmatica.ruby.parser.ParseResult;
import org.pragmatica.ruby.parser.Parser;
import org.pragmatica.ruby.parser.Parsers;
import org.pragmatica.ruby.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.pragmatica.ruby.grammar.Filters.recordsPosition;

/**
 * Lexical terminals. Each one produces exactly one leaf carrying the offset its match
 * started at. None of them skip whitespace; the grammar wraps them in a filter.
 */
public final class Terminals {
    private Terminals() {}

    public static final Set<String> RESERVED = Set.of(
        "BEGIN", "END", "alias", "and", "begin", "break", "case", "class", "def", "defined?", "do",
        "else", "elsif", "end", "ensure", "false", "for", "if", "in", "module", "next", "nil", "not",
        "or", "redo", "rescue", "retry", "return", "self", "super", "then", "true", "undef", "unless",
        "until", "when", "while", "yield", "__FILE__", "__LINE__");

    // Ruby names may use any letter, not only ASCII ones
    private static final String NAME = "[\\p{L}_][\\p{L}\\p{N}_]*";
    private static final String WORD_END = "(?![\\p{L}\\p{N}_])";

    private static final Pattern IDENTIFIER = Pattern.compile(NAME + "(?:[?!](?!=))?");
    private static final Pattern GLOBAL = Pattern.compile(
        "\\$(?:" + NAME + "|[0-9]+|[!@&`'+~=/\\\\,;.<>_*$?:\"])");
    private static final Pattern INSTANCE_VARIABLE = Pattern.compile("@@?" + NAME);
    private static final Pattern SYMBOL = Pattern.compile(
        ":(?!:)(?:" + NAME + "(?:[?!]|=(?![=>~]))?|\\$(?:" + NAME + "|[0-9]+|[!@&`'+~=/\\\\,;.<>_*$?:\"])|@@?" + NAME
        + "|\\[\\]=?|\\*\\*|<=>|===?|=~|!=|!~|<<|>>|<=|>=|[+\\-]@?|[*/%<>!~^&|])");
    private static final Pattern NUMBER = Pattern.compile(
        "0[xX][0-9a-fA-F][0-9a-fA-F_]*"
        + "|0[bB][01][01_]*"
        + "|0[oO]?[0-7_]*[0-7](?![.\\d])"
        + "|\\d[\\d_]*(?:\\.\\d[\\d_]*)?(?:[eE][+-]?\\d+)?");
    private static final Pattern REGEXP = Pattern.compile("/(?:[^/\\\\\\n]|\\\\.)*/");
    private static final Pattern METHOD_NAME = Pattern.compile(
        NAME + "[?!=]?|\\[\\]=?|\\*\\*|<=>|===?|=~|!=|!~|<<|>>|<=|>=|[+\\-]@?|[*/%<>!~^&|]");

    public static Parser<SyntaxNode> identifier() {
        return recordsPosition(word(IDENTIFIER, "identifier", false));
    }

    /**
     * Identifier position after {@code .} or in a definition: reserved words are names too.
     */
    public static Parser<SyntaxNode> methodName() {
        return recordsPosition(word(IDENTIFIER, "method name", true));
    }

    /**
     * Method name as written after {@code def} or {@code alias}: setters, predicates and
     * operator methods included.
     */
    public static Parser<SyntaxNode> definitionName() {
        return recordsPosition(Parsers.regex(METHOD_NAME, "method name")
                                      .map(MatchResult::group));
    }

    public static Parser<SyntaxNode> global() {
        return token(GLOBAL, "global variable");
    }

    /**
     * Instance variable {@code @name} or class variable {@code @@name}.
     */
    public static Parser<SyntaxNode> instanceVariable() {
        return token(INSTANCE_VARIABLE, "instance variable");
    }

    public static Parser<SyntaxNode> symbol() {
        return token(SYMBOL, "symbol");
    }

    public static Parser<SyntaxNode> number() {
        return token(NUMBER, "number");
    }

    public static Parser<SyntaxNode> regexp() {
        return token(REGEXP, "regexp");
    }

    /**
     * A reserved word that must not run into a following identifier character.
     */
    public static Parser<SyntaxNode> keyword(String word) {
        return token(Pattern.compile(Pattern.quote(word) + WORD_END), "'" + word + "'");
    }

    /**
     * Punctuation such as brackets and separators.
     */
    public static Parser<SyntaxNode> punctuation(String text) {
        return recordsPosition(Parsers.literal(text));
    }

    /**
     * Any of {@code symbols}, longest first. Words need a boundary on both sides.
     */
    public static Parser<SyntaxNode> oneOf(Collection<String> symbols, String expected) {
        var sorted = new ArrayList<>(symbols);
        sorted.sort(Comparator.comparingInt(String::length)
                              .reversed()
                              .thenComparing(Comparator.naturalOrder()));
        var regex = sorted.stream()
                          .map(Terminals::operatorPattern)
                          .collect(Collectors.joining("|"));
        return token(Pattern.compile(regex), expected);
    }

    public static boolean isReserved(String text) {
        return RESERVED.contains(text);
    }

    private static String operatorPattern(String symbol) {
        var first = symbol.charAt(0);
        return Character.isLetter(first) || first == '_'
               ? "(?<![\\p{L}\\p{N}_])" + Pattern.quote(symbol) + WORD_END
               : Pattern.quote(symbol);
    }

    private static Parser<SyntaxNode> token(Pattern pattern, String expected) {
        return recordsPosition(Parsers.regex(pattern, expected)
                                      .map(MatchResult::group));
    }

    private static Parser<String> word(Pattern pattern, String expected, boolean allowReserved) {
        var matcher = Parsers.regex(pattern, expected)
                             .map(MatchResult::group);
        if (allowReserved) {
            return matcher;
        }
        return cursor -> matcher.parse(cursor)
                                .flatMap(success -> isReserved(success.value())
                                                    ? ParseResult.<String>failure(cursor.offset(), expected)
                                                    : success);
    }
}
