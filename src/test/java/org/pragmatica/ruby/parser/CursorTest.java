package org.pragmatica.ruby.parser;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Cursor movement, anchored matching and the packrat memo table.
 */
class CursorTest {

    // === Position Management ===

    @Test
    void advance_returnsNewCursor_originalUnchanged() {
        var start = Cursor.start("abc", ParserConfig.DEFAULT);
        var next = start.advance(2);

        assertEquals(0, start.offset());
        assertEquals(2, next.offset());
        assertEquals(1, next.remaining());
    }

    @Test
    void moveTo_sameOffset_returnsSameCursor() {
        var start = Cursor.start("abc", ParserConfig.DEFAULT);

        assertSame(start, start.moveTo(0));
    }

    @Test
    void moveTo_backwardsOrPastEnd_isRejected() {
        var cursor = Cursor.start("abc", ParserConfig.DEFAULT).advance(2);

        assertThatThrownBy(() -> cursor.moveTo(1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cursor.moveTo(4)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isAtEnd_onlyAfterLastCharacter() {
        var cursor = Cursor.start("ab", ParserConfig.DEFAULT);

        assertFalse(cursor.isAtEnd());
        assertFalse(cursor.advance(1).isAtEnd());
        assertTrue(cursor.advance(2).isAtEnd());
    }

    // === Matching ===

    @Test
    void match_isAnchoredAtCursor() {
        var cursor = Cursor.start("ab12", ParserConfig.DEFAULT);
        var digits = Pattern.compile("\\d+");

        assertThat(cursor.match(digits)).isEmpty();
        assertThat(cursor.advance(2).match(digits)).hasValueSatisfying(match -> {
            assertThat(match.group()).isEqualTo("12");
            assertThat(match.start()).isEqualTo(2);
        });
    }

    @Test
    void match_lookbehindSeesTextBeforeCursor() {
        var cursor = Cursor.start("ab cd", ParserConfig.DEFAULT);
        var wordStart = Pattern.compile("(?<![a-z])[a-z]+");

        assertThat(cursor.advance(1).match(wordStart)).isEmpty();
        assertThat(cursor.advance(3).match(wordStart)).isPresent();
    }

    // === Packrat Cache ===

    @Test
    void memo_whenEnabled_returnsStoredResult() {
        var rule = new Rule<String>("a", () -> Parsers.literal("a"), true);
        var cursor = Cursor.start("a", ParserConfig.DEFAULT);
        var result = ParseResult.success("a", cursor.advance(1));

        assertThat(cursor.memoized(rule)).isEmpty();
        cursor.memoize(rule, result);

        assertThat(cursor.memoized(rule)).contains(result);
        assertThat(cursor.advance(1).memoized(rule)).isEmpty();
    }

    @Test
    void memo_whenDisabled_storesNothing() {
        var rule = new Rule<String>("a", () -> Parsers.literal("a"), true);
        var cursor = Cursor.start("a", new ParserConfig(false, true));

        cursor.memoize(rule, ParseResult.success("a", cursor.advance(1)));

        assertThat(cursor.memoized(rule)).isEmpty();
        assertEquals(0, cursor.memoSize());
    }

    @Test
    void memo_isNotSharedBetweenParses() {
        var rule = new Rule<String>("a", () -> Parsers.literal("a"), true);
        var first = Cursor.start("a", ParserConfig.DEFAULT);
        var second = Cursor.start("a", ParserConfig.DEFAULT);

        rule.parse(first);

        assertEquals(1, first.memoSize());
        assertEquals(0, second.memoSize());
    }
}
