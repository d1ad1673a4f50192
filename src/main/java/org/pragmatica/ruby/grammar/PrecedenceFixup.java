package org.pragmatica.ruby.grammar;

import org.pragmatica.ruby.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Puts operators at the depth their binding power asks for.
 *
 * <p>The grammar reads an operator chain left to right and feeds it to a {@link Chain}, which
 * reduces it on an operator stack: an operator is reduced as soon as a later one
 * {@linkplain OperatorTable#rotates rotates} above it. Commas of one chain collect into a single
 * list node. The work is linear in the chain length and uses no recursion per operand.
 *
 * <p>{@link #binary} handles the one case the stack cannot see: a member operator whose right
 * operand already is a call or index, as in {@code x.each { }}, is rotated down into it.
 * {@link #prefix} is its mirror image for prefix forms. Both return new nodes; the nodes they
 * are given are never modified, and comments and offsets travel with the node records they
 * belong to.
 */
public final class PrecedenceFixup {
    private static final Logger LOG = LoggerFactory.getLogger(PrecedenceFixup.class);

    private final OperatorTable table;

    public PrecedenceFixup(OperatorTable table) {
        this.table = table;
    }

    /**
     * Empty reduction stack for one operator chain in {@code mode}.
     */
    public Chain chain(GrammarMode mode) {
        return new Chain(mode);
    }

    /**
     * Fix a freshly reduced {@code (op c0 ... last)} whose last child may be an application
     * built elsewhere.
     */
    public SyntaxNode binary(SyntaxNode node, GrammarMode mode) {
        if (node.isLeaf()) {
            return node;
        }
        var last = node.child(node.size() - 1);
        if (!isApplication(last, mode)) {
            return node;
        }
        var outerKey = table.binaryKey(node.data(), mode);
        var innerKey = table.binaryKey(last.data(), mode);
        if (!table.rotates(outerKey, innerKey)) {
            return node;
        }
        var leftChildren = new ArrayList<>(node.children().subList(0, node.size() - 1));
        leftChildren.add(last.child(0));
        var left = binary(node.withChildren(leftChildren), mode);

        var children = new ArrayList<SyntaxNode>(last.size());
        children.add(left);
        children.addAll(last.children().subList(1, last.size()));
        LOG.trace("Rotated '{}' under '{}' at offset {}", node.data(), last.data(), node.offset());
        return last.withChildren(children);
    }

    /**
     * Fix a freshly reduced prefix form {@code (op operand)}.
     */
    public SyntaxNode prefix(SyntaxNode node, GrammarMode mode) {
        if (node.size() != 1) {
            return node;
        }
        var operand = node.child(0);
        if (!isApplication(operand, mode)
            || !table.looser(table.binaryKey(operand.data(), mode), OperatorTable.unary(node.data()))) {
            return node;
        }
        var pushed = prefix(node.withChildren(List.of(operand.child(0))), mode);
        var children = new ArrayList<SyntaxNode>(operand.size());
        children.add(pushed);
        children.addAll(operand.children().subList(1, operand.size()));
        LOG.trace("Pushed prefix '{}' below '{}' at offset {}", node.data(), operand.data(), node.offset());
        return operand.withChildren(children);
    }

    /**
     * A composite whose tag is a binary operator and whose child count is that operator's arity.
     * Prefix forms and keyword forms sharing an operator tag are not applications.
     */
    public boolean isApplication(SyntaxNode node, GrammarMode mode) {
        if (node.isLeaf() || !table.isBinary(table.binaryKey(node.data(), mode))) {
            return false;
        }
        var size = node.size();
        return switch (node.data()) {
            case OperatorTable.TERNARY -> size == 3;
            case SyntaxNode.INVOCATION -> size == 2 || size == 3;
            case OperatorTable.COMMA -> size >= 2;
            default -> size == 2;
        };
    }

    /**
     * Operator-precedence stack for one chain. Feed it in source order: prefix operators, an
     * operand, then any number of infix operators each followed by prefix operators and an
     * operand. Not thread-safe; one instance serves one chain.
     */
    public final class Chain {
        private final GrammarMode mode;
        private final Deque<SyntaxNode> operands = new ArrayDeque<>();
        private final Deque<Pending> operators = new ArrayDeque<>();

        private Chain(GrammarMode mode) {
            this.mode = mode;
        }

        public Chain prefix(SyntaxNode operator) {
            operators.push(new Pending(operator, OperatorTable.unary(operator.data()), true, List.of()));
            return this;
        }

        public Chain operand(SyntaxNode node) {
            operands.push(node);
            return this;
        }

        public Chain infix(SyntaxNode operator) {
            return push(operator, List.of());
        }

        /**
         * {@code ?} with its middle operand; the operand fed next is the false branch.
         */
        public Chain ternary(SyntaxNode operator, SyntaxNode whenTrue) {
            return push(operator, List.of(whenTrue));
        }

        /**
         * Reduce whatever is left and return the single tree.
         *
         * @throws IllegalStateException if the chain does not end with an operand
         */
        public SyntaxNode finish() {
            while (!operators.isEmpty()) {
                reduce();
            }
            if (operands.size() != 1) {
                throw new IllegalStateException("Operator chain left " + operands.size() + " operands");
            }
            return operands.pop();
        }

        private Chain push(SyntaxNode operator, List<SyntaxNode> middle) {
            var key = table.binaryKey(operator.data(), mode);
            while (!operators.isEmpty()) {
                var top = operators.peek();
                if (operator.is(OperatorTable.COMMA) && top.absorbs(key)) {
                    top.extend(operator);
                    return this;
                }
                if (!table.rotates(top.key, key)) {
                    break;
                }
                reduce();
            }
            operators.push(new Pending(operator, key, false, middle));
            return this;
        }

        private void reduce() {
            var pending = operators.pop();
            if (operands.size() < pending.arity) {
                throw new IllegalStateException("Operator '" + pending.operator.data() + "' is missing an operand");
            }
            var taken = new ArrayList<SyntaxNode>(pending.arity);
            for (int i = 0; i < pending.arity; i++) {
                taken.add(operands.pop());
            }
            Collections.reverse(taken);

            if (pending.prefix) {
                operands.push(PrecedenceFixup.this.prefix(pending.operator.withChildren(taken), mode));
                return;
            }
            var children = new ArrayList<SyntaxNode>(taken.size() + pending.middle.size());
            children.add(taken.get(0));
            children.addAll(pending.middle);
            children.addAll(taken.subList(1, taken.size()));
            if (pending.operator.is(OperatorTable.COMMA)) {
                operands.push(pending.operator.withChildren(children)
                                              .withComments(pending.comments));
                return;
            }
            operands.push(binary(pending.operator.withChildren(children), mode));
        }
    }

    /**
     * An operator waiting for its right operand. A comma absorbs the commas that follow it at
     * the same level, together with their comments.
     */
    private static final class Pending {
        private final SyntaxNode operator;
        private final String key;
        private final boolean prefix;
        private final List<SyntaxNode> middle;
        private final List<SyntaxNode> comments;
        private int arity;

        private Pending(SyntaxNode operator, String key, boolean prefix, List<SyntaxNode> middle) {
            this.operator = operator;
            this.key = key;
            this.prefix = prefix;
            this.middle = middle;
            this.comments = new ArrayList<>(operator.comments());
            this.arity = prefix ? 1 : 2;
        }

        private boolean absorbs(String otherKey) {
            return !prefix && operator.is(OperatorTable.COMMA) && key.equals(otherKey);
        }

        private void extend(SyntaxNode comma) {
            comments.addAll(comma.comments());
            arity++;
        }
    }
}
