package org.pragmatica.ruby.tree;

/**
 * A resolved position in source text. Lines are 0-based; columns are 0-based, with {@code -1}
 * reserved for the newline character that opens the line.
 */
public record Position(int line, int column) {

    public static final Position START = new Position(0, 0);

    public static Position at(int line, int column) {
        return new Position(line, column);
    }

    /**
     * 1-based rendering for human-facing messages.
     */
    public String display() {
        return (line + 1) + ":" + (column + 1);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
