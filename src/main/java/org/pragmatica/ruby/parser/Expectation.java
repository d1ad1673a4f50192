package org.pragmatica.ruby.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * What the parser was looking for at the furthest offset any alternative reached.
 */
public record Expectation(int offset, List<String> alternatives) {

    public static final Expectation NONE = new Expectation(-1, List.of());

    public Expectation {
        alternatives = List.copyOf(alternatives);
    }

    public static Expectation at(int offset, String expected) {
        return new Expectation(offset, List.of(expected));
    }

    public boolean isNone() {
        return offset < 0;
    }

    /**
     * Keep the further of the two; at equal offsets combine the alternatives.
     */
    public Expectation merge(Expectation other) {
        if (other.offset > offset) {
            return other;
        }
        if (other.offset < offset) {
            return this;
        }
        var merged = new ArrayList<>(alternatives);
        for (var alternative : other.alternatives) {
            if (!merged.contains(alternative)) {
                merged.add(alternative);
            }
        }
        return merged.size() == alternatives.size() ? this : new Expectation(offset, merged);
    }

    public String describe() {
        return alternatives.isEmpty() ? "valid input" : String.join(" or ", alternatives);
    }

    @Override
    public String toString() {
        return describe() + " at " + offset;
    }
}
