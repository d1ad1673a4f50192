package org.pragmatica.ruby.error;

/**
 * Thrown when a failed parse outcome is unwrapped.
 */
public final class ParseException extends RuntimeException {

    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
