package org.pragmatica.ruby.grammar;

import java.util.List;

/**
 * Parameterizes the expression grammar by the context it runs in.
 *
 * <p>Five modes exist:
 * <ul>
 *   <li>{@link #STATEMENT} - top-level and body statements; a newline ends the expression</li>
 *   <li>{@link #GROUP} - inside parentheses; newlines are insignificant</li>
 *   <li>{@link #ARGUMENT} - argument lists and container literals</li>
 *   <li>{@link #COMMAND} - arguments of a call written without parentheses</li>
 *   <li>{@link #PARAMETER} - default values in parameter lists, where a comma ends the value</li>
 * </ul>
 *
 * @param separator what ends an expression at this level
 * @param comma     which comma, and with it which operator set, applies
 */
public record GrammarMode(Separator separator, Comma comma) {

    public static final GrammarMode STATEMENT = new GrammarMode(Separator.NEWLINE, Comma.STATEMENT);
    public static final GrammarMode GROUP = new GrammarMode(Separator.COMMA, Comma.STATEMENT);
    public static final GrammarMode ARGUMENT = new GrammarMode(Separator.COMMA, Comma.ARGUMENT);
    public static final GrammarMode COMMAND = new GrammarMode(Separator.NEWLINE, Comma.ARGUMENT);
    public static final GrammarMode PARAMETER = new GrammarMode(Separator.COMMA, Comma.NONE);

    public static final List<GrammarMode> ALL = List.of(STATEMENT, GROUP, ARGUMENT, COMMAND, PARAMETER);

    public enum Separator {
        /** A newline ends the expression; binary operators must stay on the operand's line. */
        NEWLINE,
        /** Newlines are whitespace; only the enclosing delimiter ends the expression. */
        COMMA
    }

    public enum Comma {
        /** Comma binds tighter than assignment: {@code x, y = 1, 2}. */
        STATEMENT,
        /** Comma is the loosest operator: {@code f(x, y = 1, 2)} has three arguments. */
        ARGUMENT,
        /** No comma operator and no assignment. */
        NONE
    }

    public boolean newlineSignificant() {
        return separator == Separator.NEWLINE;
    }

    public boolean statementLevel() {
        return comma == Comma.STATEMENT;
    }

    public boolean argumentLevel() {
        return comma == Comma.ARGUMENT;
    }

    /**
     * Short name used for rule names and logging.
     */
    public String label() {
        if (equals(STATEMENT)) {
            return "statement";
        }
        if (equals(GROUP)) {
            return "group";
        }
        if (equals(ARGUMENT)) {
            return "argument";
        }
        if (equals(COMMAND)) {
            return "command";
        }
        return "parameter";
    }
}
