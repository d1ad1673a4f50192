package org.pragmatica.ruby.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Immutable position in the input. Advancing returns a new cursor, so a failed alternative
 * is abandoned by simply dropping the cursor it was given.
 *
 * <p>All cursors of one parse share a session holding the input, the configuration and the
 * packrat memo table. The memo table is the only mutable state and is never shared between
 * parses.
 */
public final class Cursor {

    private final Session session;
    private final int offset;

    private Cursor(Session session, int offset) {
        this.session = session;
        this.offset = offset;
    }

    public static Cursor start(String input, ParserConfig config) {
        return new Cursor(new Session(input, config), 0);
    }

    // === Position Management ===

    public int offset() {
        return offset;
    }

    public boolean isAtEnd() {
        return offset >= session.input.length();
    }

    public int remaining() {
        return session.input.length() - offset;
    }

    public Cursor advance(int count) {
        return moveTo(offset + count);
    }

    public Cursor moveTo(int newOffset) {
        if (newOffset < offset || newOffset > session.input.length()) {
            throw new IllegalArgumentException("Cannot move cursor from " + offset + " to " + newOffset);
        }
        return newOffset == offset ? this : new Cursor(session, newOffset);
    }

    public ParserConfig config() {
        return session.config;
    }

    // === Matching ===

    boolean startsWith(String text) {
        return session.input.startsWith(text, offset);
    }

    /**
     * Anchored match at the cursor. Bounds are transparent, so lookbehind and word boundaries
     * see the text before the cursor.
     */
    Optional<MatchResult> match(Pattern pattern) {
        var matcher = pattern.matcher(session.input)
                             .region(offset, session.input.length())
                             .useTransparentBounds(true)
                             .useAnchoringBounds(false);
        return matcher.lookingAt()
               ? Optional.of(matcher.toMatchResult())
               : Optional.empty();
    }

    // === Packrat Cache ===

    @SuppressWarnings("unchecked")
    <T> Optional<ParseResult<T>> memoized(Rule<T> rule) {
        if (!session.config.packratEnabled()) {
            return Optional.empty();
        }
        return Optional.ofNullable((ParseResult<T>) session.memo.get(new MemoKey(rule, offset)));
    }

    <T> void memoize(Rule<T> rule, ParseResult<T> result) {
        if (session.config.packratEnabled()) {
            session.memo.put(new MemoKey(rule, offset), result);
        }
    }

    int memoSize() {
        return session.memo.size();
    }

    @Override
    public String toString() {
        return "Cursor@" + offset;
    }

    private record MemoKey(Rule<?> rule, int offset) {}

    private static final class Session {
        private final String input;
        private final ParserConfig config;
        private final Map<MemoKey, ParseResult<?>> memo = new HashMap<>();

        private Session(String input, ParserConfig config) {
            this.input = input;
            this.config = config;
        }
    }
}
