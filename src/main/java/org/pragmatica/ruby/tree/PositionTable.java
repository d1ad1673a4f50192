package org.pragmatica.ruby.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Offset to line/column index, computed once per input in a single pass.
 *
 * <p>Entries exist for offsets {@code 0..length}; the last one is the end-of-input position.
 * A newline is recorded at column {@code -1} of the line it opens, so the character after it
 * lands on column {@code 0}.
 */
public final class PositionTable {

    private final int[] lines;
    private final int[] columns;

    private PositionTable(int[] lines, int[] columns) {
        this.lines = lines;
        this.columns = columns;
    }

    public static PositionTable of(CharSequence input) {
        var length = input.length();
        var lines = new int[length + 1];
        var columns = new int[length + 1];
        int line = 0;
        int column = 0;

        for (int i = 0; i < length; i++) {
            if (input.charAt(i) == '\n') {
                line++;
                column = -1;
            }
            lines[i] = line;
            columns[i] = column;
            column++;
        }
        lines[length] = line;
        columns[length] = column;
        return new PositionTable(lines, columns);
    }

    public int length() {
        return lines.length - 1;
    }

    public Position at(int offset) {
        if (offset < 0 || offset >= lines.length) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside 0.." + length());
        }
        return Position.at(lines[offset], columns[offset]);
    }

    /**
     * Replace the raw offset of every node, and of every comment node, with its position.
     * The pass performs no validation; running it again on its own output changes nothing.
     * The walk keeps its own stack, so a deeply nested tree needs no call-stack depth.
     */
    public SyntaxNode resolve(SyntaxNode node) {
        var pending = new ArrayDeque<Visit>();
        pending.push(new Visit(node));
        SyntaxNode finished = null;
        while (true) {
            var visit = pending.peek();
            if (finished != null) {
                visit.resolved.add(finished);
                finished = null;
            }
            var next = visit.next();
            if (next != null) {
                pending.push(new Visit(next));
                continue;
            }
            pending.pop();
            finished = visit.build(at(visit.node.offset()));
            if (pending.isEmpty()) {
                return finished;
            }
        }
    }

    /**
     * A node whose children, then comments, are being resolved.
     */
    private static final class Visit {
        private final SyntaxNode node;
        private final List<SyntaxNode> resolved;

        private Visit(SyntaxNode node) {
            this.node = node;
            this.resolved = new ArrayList<>(node.size() + node.comments().size());
        }

        private SyntaxNode next() {
            var done = resolved.size();
            if (done < node.size()) {
                return node.child(done);
            }
            var comment = done - node.size();
            return comment < node.comments().size() ? node.comments().get(comment) : null;
        }

        private SyntaxNode build(Position position) {
            return node.withChildren(resolved.subList(0, node.size()))
                       .withComments(resolved.subList(node.size(), resolved.size()))
                       .withPosition(position);
        }
    }
}
