package org.pragmatica.ruby.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.ruby.parser.Cursor;
import org.pragmatica.ruby.parser.Expectation;
import org.pragmatica.ruby.parser.ParseResult;
import org.pragmatica.ruby.parser.Parser;
import org.pragmatica.ruby.parser.ParserConfig;
import org.pragmatica.ruby.tree.SyntaxNode;

import static org.assertj.core.api.Assertions.assertThat;

class FiltersTest {

    private static final ParserConfig WITHOUT_COMMENTS = new ParserConfig(true, false);

    private static <T> ParseResult<T> run(Parser<T> parser, String input, ParserConfig config) {
        return parser.parse(Cursor.start(input, config));
    }

    private static <T> T valueOf(ParseResult<T> result) {
        assertThat(result.isSuccess()).isTrue();
        return ((ParseResult.Success<T>) result).value();
    }

    @Test
    void spaceInsensitive_attachesLeadingLineComment() {
        var node = valueOf(run(Filters.spaceInsensitive(Terminals.identifier()), "  # hi there\n  x", ParserConfig.DEFAULT));

        assertThat(node.data()).isEqualTo("x");
        assertThat(node.comments()).hasSize(1);
        var comment = node.comments().get(0);
        assertThat(comment.data()).isEqualTo(SyntaxNode.LINE_COMMENT);
        assertThat(comment.offset()).isEqualTo(2);
        assertThat(comment.child(0).data()).isEqualTo("hi there");
        assertThat(comment.child(0).offset()).isEqualTo(4);
    }

    @Test
    void spaceInsensitive_keepsCommentsInSourceOrder() {
        var node = valueOf(run(Filters.spaceInsensitive(Terminals.identifier()), "# one\n# two\nx", ParserConfig.DEFAULT));

        assertThat(node.comments()).extracting(comment -> comment.child(0).data())
                                   .containsExactly("one", "two");
    }

    @Test
    void spaceInsensitive_withoutCapture_dropsComments() {
        var node = valueOf(run(Filters.spaceInsensitive(Terminals.identifier()), "# hi\nx", WITHOUT_COMMENTS));

        assertThat(node.data()).isEqualTo("x");
        assertThat(node.comments()).isEmpty();
    }

    @Test
    void embeddedDocument_isOneComment() {
        var source = "=begin\nsome docs\n=end\nx";
        var node = valueOf(run(Filters.spaceInsensitive(Terminals.identifier()), source, ParserConfig.DEFAULT));

        assertThat(node.comments()).hasSize(1);
        assertThat(node.comments().get(0).data()).isEqualTo(SyntaxNode.EMBEDDED_DOCUMENT);
        assertThat(node.comments().get(0).child(0).data()).isEqualTo("some docs\n");
    }

    @Test
    void embeddedDocument_mustStartTheLine() {
        var result = run(Filters.comment(), " =begin\nx\n=end", ParserConfig.DEFAULT);

        assertThat(result.isFailure()).isTrue();
    }

    @Test
    void comments_neverReportExpectations() {
        var result = run(Filters.comments(), "x", ParserConfig.DEFAULT);

        assertThat(valueOf(result)).isEmpty();
        assertThat(result.furthest()).isEqualTo(Expectation.NONE);
    }

    @Test
    void noNewlinesBefore_allowsSpacesAndContinuations() {
        var parser = Filters.noNewlinesBefore(Terminals.identifier());

        assertThat(valueOf(run(parser, "  x", ParserConfig.DEFAULT)).data()).isEqualTo("x");
        assertThat(valueOf(run(parser, " \\\n x", ParserConfig.DEFAULT)).data()).isEqualTo("x");
    }

    @Test
    void noNewlinesBefore_failsOnNewlineOrComment() {
        var parser = Filters.noNewlinesBefore(Terminals.identifier());

        assertThat(run(parser, "\nx", ParserConfig.DEFAULT).isFailure()).isTrue();
        assertThat(run(parser, " # note\nx", ParserConfig.DEFAULT).isFailure()).isTrue();
    }

    @Test
    void closedBy_collectsCommentsBeforeDelimiter() {
        var closing = valueOf(run(Filters.closedBy(Terminals.punctuation(")")), " # last\n )", ParserConfig.DEFAULT));
        var owner = closing.attachTo(SyntaxNode.leaf("(", 0));

        assertThat(closing.value().data()).isEqualTo(")");
        assertThat(owner.comments()).extracting(comment -> comment.child(0).data())
                                    .containsExactly("last");
    }

    @Test
    void closedBy_withoutCapture_collectsNothing() {
        var closing = valueOf(run(Filters.closedBy(Terminals.punctuation(")")), " # last\n )", WITHOUT_COMMENTS));

        assertThat(closing.comments()).isEmpty();
    }

    @Test
    void recordsPosition_usesStartOfMatch() {
        var cursor = Cursor.start("ab", ParserConfig.DEFAULT).advance(1);
        var result = Filters.recordsPosition(Terminals.punctuation("b").map(SyntaxNode::data)).parse(cursor);

        assertThat(valueOf(result)).isEqualTo(SyntaxNode.leaf("b", 1));
    }
}
