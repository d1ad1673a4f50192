package org.pragmatica.ruby.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One grammar production or terminal token.
 *
 * <p>A node with no children is a leaf (identifier, variable, literal, nullary keyword).
 * A node with children is a composite whose {@code data} names an operator, keyword form or
 * structural tag. The same tag may appear as either; child count is what tells them apart.
 *
 * <p>Nodes are immutable. Attaching comments, restructuring children and resolving the
 * position all produce new nodes.
 *
 * @param data     token text or structural tag
 * @param children ordered children, owned by this node
 * @param comments comment nodes immediately preceding this node in source order
 * @param offset   character offset at which the node's anchoring token starts
 * @param position resolved line/column, empty until the position pass has run
 */
public record SyntaxNode(
    String data,
    List<SyntaxNode> children,
    List<SyntaxNode> comments,
    int offset,
    Optional<Position> position
) {
    /** Placeholder for an absent optional part of a form, e.g. a class without a parent. */
    public static final String EMPTY = "";

    public static final String LINE_COMMENT = "#";
    public static final String EMBEDDED_DOCUMENT = "=begin";

    public static final String INVOCATION = "()";
    public static final String INDEX = "[]";
    public static final String GROUP = "(";
    public static final String HASH = "{";
    public static final String ARRAY = "[";
    public static final String BLOCK = "{}";
    public static final String SEQUENCE = ";";

    public SyntaxNode {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(position, "position");
        children = List.copyOf(children);
        comments = List.copyOf(comments);
    }

    public static SyntaxNode leaf(String data, int offset) {
        return new SyntaxNode(data, List.of(), List.of(), offset, Optional.empty());
    }

    public static SyntaxNode empty(int offset) {
        return leaf(EMPTY, offset);
    }

    public static SyntaxNode composite(String data, int offset, List<SyntaxNode> children) {
        return new SyntaxNode(data, children, List.of(), offset, Optional.empty());
    }

    public static SyntaxNode composite(String data, int offset, SyntaxNode... children) {
        return composite(data, offset, List.of(children));
    }

    /**
     * Comment node: unary, tagged with its marker, the single child holding the text.
     */
    public static SyntaxNode comment(String marker, int offset, SyntaxNode text) {
        return composite(marker, offset, text);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isEmptyPlaceholder() {
        return isLeaf() && EMPTY.equals(data);
    }

    public boolean is(String tag) {
        return data.equals(tag);
    }

    public int size() {
        return children.size();
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    public SyntaxNode withChildren(List<SyntaxNode> newChildren) {
        return new SyntaxNode(data, newChildren, comments, offset, position);
    }

    public SyntaxNode withComments(List<SyntaxNode> newComments) {
        return new SyntaxNode(data, children, newComments, offset, position);
    }

    /**
     * Comments found before this node's leading token; they precede any already attached.
     */
    public SyntaxNode withLeadingComments(List<SyntaxNode> leading) {
        if (leading.isEmpty()) {
            return this;
        }
        var merged = new ArrayList<SyntaxNode>(leading.size() + comments.size());
        merged.addAll(leading);
        merged.addAll(comments);
        return withComments(merged);
    }

    /**
     * Comments found inside this node, before its closing token.
     */
    public SyntaxNode withTrailingComments(List<SyntaxNode> trailing) {
        if (trailing.isEmpty()) {
            return this;
        }
        var merged = new ArrayList<SyntaxNode>(comments.size() + trailing.size());
        merged.addAll(comments);
        merged.addAll(trailing);
        return withComments(merged);
    }

    public SyntaxNode withPosition(Position resolved) {
        return new SyntaxNode(data, children, comments, offset, Optional.of(resolved));
    }

    /**
     * S-expression rendering: leaves print their data (the empty placeholder as {@code ()}),
     * composites print {@code (data child ...)}.
     */
    @Override
    public String toString() {
        var sb = new StringBuilder();
        render(sb);
        return sb.toString();
    }

    private void render(StringBuilder sb) {
        if (isLeaf()) {
            sb.append(data.isEmpty() ? "()" : data);
            return;
        }
        sb.append('(').append(data);
        for (var child : children) {
            sb.append(' ');
            child.render(sb);
        }
        sb.append(')');
    }
}
