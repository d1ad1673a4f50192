package org.pragmatica.ruby.grammar;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Binding power and associativity of every operator the grammar knows.
 *
 * <p>The table is built from ordered groups, tightest first; every group is one level, so a
 * larger level binds more loosely. Unary forms are keyed with the {@value #UNARY} prefix so
 * {@code -} and {@code u-} can sit at different levels. The statement comma and the argument
 * comma are distinct keys sharing the {@code ","} node tag.
 *
 * <p>Instances are immutable and shared by every parse.
 */
public final class OperatorTable {

    public static final String UNARY = "u";
    public static final String STATEMENT_COMMA = ",statement";
    public static final String ARGUMENT_COMMA = ",argument";
    public static final String COMMA = ",";
    public static final String TERNARY = "?";
    public static final String LABEL = ":";

    private final Map<String, Integer> levels;
    private final Set<String> unaryKeys;
    private final Set<String> rightAssociative;
    private final Map<Scope, Set<String>> scopes;

    private OperatorTable(Map<String, Integer> levels,
                          Set<String> unaryKeys,
                          Set<String> rightAssociative,
                          Map<Scope, Set<String>> scopes) {
        this.levels = Map.copyOf(levels);
        this.unaryKeys = Set.copyOf(unaryKeys);
        this.rightAssociative = Set.copyOf(rightAssociative);
        this.scopes = Map.copyOf(scopes);
    }

    /**
     * Where an operator may appear.
     */
    public enum Scope {
        /** Everywhere. */
        EXPRESSION,
        /** Only where the statement comma applies. */
        STATEMENT,
        /** Only in argument lists and container literals. */
        ARGUMENT,
        /** Where either comma applies; not in parameter defaults. */
        ASSIGNMENT
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The operator set of the supported Ruby subset.
     */
    public static OperatorTable ruby() {
        return builder()
            .scope(Scope.EXPRESSION)
            .group("::", ".", "&.", "()", "[]")
            .unaryGroup("!", "~", "+")
            .group("**")
            .unaryGroup("-")
            .group("*", "/", "%")
            .group("+", "-")
            .group("<<", ">>")
            .group("&")
            .group("|", "^")
            .group(">", ">=", "<", "<=")
            .group("<=>", "==", "===", "!=", "=~", "!~")
            .group("&&")
            .group("||")
            .group("..", "...")
            .group(TERNARY)
            .scope(Scope.STATEMENT)
            .group("rescue")
            .group(STATEMENT_COMMA)
            .scope(Scope.ASSIGNMENT)
            .group("=", "+=", "-=", "*=", "/=", "%=", "**=", "<<=", ">>=", "&&=", "&=", "||=", "|=", "^=")
            .unaryGroup("defined?")
            .scope(Scope.STATEMENT)
            .unaryGroup("not", "return", "break", "next", "yield")
            .group("and", "or")
            .group("if", "unless", "while", "until")
            .scope(Scope.ARGUMENT)
            .unaryGroup("*", "&")
            .group("=>", LABEL)
            .group(ARGUMENT_COMMA)
            .rightAssociative("**", TERNARY)
            .rightAssociative("=", "+=", "-=", "*=", "/=", "%=", "**=", "<<=", ">>=", "&&=", "&=", "||=", "|=", "^=")
            .build();
    }

    public static String unary(String symbol) {
        return UNARY + symbol;
    }

    /**
     * Level of an operator key; larger binds more loosely.
     */
    public Optional<Integer> level(String key) {
        return Optional.ofNullable(levels.get(key));
    }

    /**
     * Key for a node tag in a given mode: only the comma is ambiguous.
     */
    public String binaryKey(String tag, GrammarMode mode) {
        if (COMMA.equals(tag)) {
            return mode.statementLevel() ? STATEMENT_COMMA : ARGUMENT_COMMA;
        }
        return tag;
    }

    public boolean isBinary(String key) {
        return !unaryKeys.contains(key) && levels.containsKey(key);
    }

    public boolean isUnary(String key) {
        return unaryKeys.contains(key);
    }

    /**
     * Unary forms and the keys listed as right-associative.
     */
    public boolean isRightAssociative(String key) {
        return unaryKeys.contains(key) || rightAssociative.contains(key);
    }

    /**
     * True when {@code inner} must end up above {@code outer} after a reduction
     * {@code (outer ... inner-application)}: it binds more loosely, or equally while
     * {@code outer} groups to the left.
     */
    public boolean rotates(String outer, String inner) {
        var outerLevel = levels.get(outer);
        var innerLevel = levels.get(inner);
        if (outerLevel == null || innerLevel == null) {
            return false;
        }
        return innerLevel > outerLevel || innerLevel.equals(outerLevel) && !isRightAssociative(outer);
    }

    /**
     * True when {@code inner} binds strictly more loosely than {@code outer}.
     */
    public boolean looser(String inner, String outer) {
        var outerLevel = levels.get(outer);
        var innerLevel = levels.get(inner);
        return outerLevel != null && innerLevel != null && innerLevel > outerLevel;
    }

    /**
     * Binary operator symbols usable in the given mode, as written in source. Postfix tags
     * and the ternary question mark are excluded, as are the commas and the label colon.
     */
    public Set<String> binaryOperators(GrammarMode mode) {
        var result = new LinkedHashSet<String>();
        for (var symbol : symbols(mode)) {
            if (!unaryKeys.contains(symbol) && !symbol.startsWith(COMMA) && !isPostfix(symbol)
                && !TERNARY.equals(symbol) && !LABEL.equals(symbol)) {
                result.add(symbol);
            }
        }
        return result;
    }

    /**
     * Prefix operator symbols usable in the given mode, without the marker.
     */
    public Set<String> unaryOperators(GrammarMode mode) {
        var result = new LinkedHashSet<String>();
        for (var symbol : symbols(mode)) {
            if (unaryKeys.contains(symbol)) {
                result.add(symbol.substring(UNARY.length()));
            }
        }
        return result;
    }

    private List<String> symbols(GrammarMode mode) {
        var result = new ArrayList<String>(scopes.getOrDefault(Scope.EXPRESSION, Set.of()));
        if (mode.statementLevel()) {
            result.addAll(scopes.getOrDefault(Scope.ASSIGNMENT, Set.of()));
            result.addAll(scopes.getOrDefault(Scope.STATEMENT, Set.of()));
        } else if (mode.argumentLevel()) {
            result.addAll(scopes.getOrDefault(Scope.ASSIGNMENT, Set.of()));
            result.addAll(scopes.getOrDefault(Scope.ARGUMENT, Set.of()));
        }
        result.sort((left, right) -> Integer.compare(levels.get(left), levels.get(right)));
        return result;
    }

    private static boolean isPostfix(String symbol) {
        return "()".equals(symbol) || "[]".equals(symbol);
    }

    /**
     * Accumulates groups; each {@link #group} call starts a new level.
     */
    public static final class Builder {
        private final Map<String, Integer> levels = new HashMap<>();
        private final Set<String> unaryKeys = new HashSet<>();
        private final Set<String> rightAssociative = new HashSet<>();
        private final Map<Scope, Set<String>> scopes = new HashMap<>();
        private Scope scope = Scope.EXPRESSION;
        private int level = 0;

        private Builder() {}

        public Builder scope(Scope newScope) {
            this.scope = newScope;
            return this;
        }

        public Builder group(String... symbols) {
            for (var symbol : symbols) {
                if (levels.putIfAbsent(symbol, level) != null) {
                    throw new IllegalArgumentException("Operator " + symbol + " listed twice");
                }
                scopes.computeIfAbsent(scope, key -> new LinkedHashSet<>())
                      .add(symbol);
            }
            level++;
            return this;
        }

        /**
         * A level of prefix forms; each symbol is stored under its {@value OperatorTable#UNARY}-marked key.
         */
        public Builder unaryGroup(String... symbols) {
            var keys = new String[symbols.length];
            for (int i = 0; i < symbols.length; i++) {
                keys[i] = unary(symbols[i]);
                unaryKeys.add(keys[i]);
            }
            return group(keys);
        }

        public Builder rightAssociative(String... symbols) {
            rightAssociative.addAll(List.of(symbols));
            return this;
        }

        public OperatorTable build() {
            var frozen = new HashMap<Scope, Set<String>>();
            scopes.forEach((key, value) -> frozen.put(key, Set.copyOf(value)));
            return new OperatorTable(levels, unaryKeys, rightAssociative, frozen);
        }
    }
}
