package org.pragmatica.ruby.error;

import org.pragmatica.ruby.tree.Position;

/**
 * Parse error with location and context information. The location is the furthest offset any
 * attempted alternative reached.
 */
public sealed interface ParseError {

    int offset();

    Position location();

    String expected();

    String message();

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(
        int offset,
        Position location,
        String found,
        String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location.display() + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEndOfInput(
        int offset,
        Position location,
        String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location.display() + ", expected " + expected;
        }
    }
}
