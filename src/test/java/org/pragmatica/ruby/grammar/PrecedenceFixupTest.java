package org.pragmatica.ruby.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.ruby.tree.SyntaxNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Rotation and chain reduction on hand-built operands, as the grammar would hand them over.
 */
class PrecedenceFixupTest {

    private final PrecedenceFixup fixup = new PrecedenceFixup(OperatorTable.ruby());

    private static SyntaxNode leaf(String data) {
        return SyntaxNode.leaf(data, 0);
    }

    private static SyntaxNode node(String data, SyntaxNode... children) {
        return SyntaxNode.composite(data, 0, children);
    }

    private static SyntaxNode comment(String text) {
        return SyntaxNode.comment(SyntaxNode.LINE_COMMENT, 0, leaf(text));
    }

    @Test
    void binary_tighterOuter_rotatesLeft() {
        var reduced = node("*", leaf("1"), node("+", leaf("2"), leaf("3")));

        assertThat(fixup.binary(reduced, GrammarMode.STATEMENT)).hasToString("(+ (* 1 2) 3)");
    }

    @Test
    void binary_looserOuter_staysNested() {
        var reduced = node("+", leaf("1"), node("*", leaf("2"), leaf("3")));

        assertThat(fixup.binary(reduced, GrammarMode.STATEMENT)).hasToString("(+ 1 (* 2 3))");
    }

    @Test
    void binary_equalLeftAssociative_rotatesThroughChain() {
        // the reduction of "2 - 3 - 4" is fixed before the outer one
        var inner = fixup.binary(node("-", leaf("2"), node("-", leaf("3"), leaf("4"))), GrammarMode.STATEMENT);
        var reduced = node("-", leaf("1"), inner);

        assertThat(fixup.binary(reduced, GrammarMode.STATEMENT)).hasToString("(- (- (- 1 2) 3) 4)");
    }

    @Test
    void binary_rightAssociative_staysNested() {
        var reduced = node("**", leaf("2"), node("**", leaf("3"), leaf("2")));

        assertThat(fixup.binary(reduced, GrammarMode.STATEMENT)).hasToString("(** 2 (** 3 2))");
    }

    @Test
    void binary_rotationPreservesComments() {
        var onTimes = comment("times");
        var onPlus = comment("plus");
        var onTwo = comment("two");
        var reduced = node("*", leaf("1"), node("+", leaf("2").withComments(List.of(onTwo)), leaf("3"))
            .withComments(List.of(onPlus)))
            .withComments(List.of(onTimes));

        var fixed = fixup.binary(reduced, GrammarMode.STATEMENT);

        assertThat(fixed).hasToString("(+ (* 1 2) 3)");
        assertThat(fixed.comments()).containsExactly(onPlus);
        assertThat(fixed.child(0).comments()).containsExactly(onTimes);
        assertThat(fixed.child(0).child(1).comments()).containsExactly(onTwo);
    }

    @Test
    void binary_rotationPreservesOffsets() {
        var reduced = SyntaxNode.composite("*", 2,
                                           SyntaxNode.leaf("1", 0),
                                           SyntaxNode.composite("+", 6, SyntaxNode.leaf("2", 4), SyntaxNode.leaf("3", 8)));

        var fixed = fixup.binary(reduced, GrammarMode.STATEMENT);

        assertThat(fixed.offset()).isEqualTo(6);
        assertThat(fixed.child(0).offset()).isEqualTo(2);
    }

    @Test
    void binary_givenNodesAreNotModified() {
        var inner = node("+", leaf("2"), leaf("3"));
        var reduced = node("*", leaf("1"), inner);

        fixup.binary(reduced, GrammarMode.STATEMENT);

        assertThat(reduced).hasToString("(* 1 (+ 2 3))");
        assertThat(inner).hasToString("(+ 2 3)");
    }

    @Test
    void binary_commaAgainstAssignment_dependsOnMode() {
        var reduced = node("=", leaf("y"), node(",", leaf("1"), leaf("2")));

        assertThat(fixup.binary(reduced, GrammarMode.STATEMENT)).hasToString("(= y (, 1 2))");
        assertThat(fixup.binary(reduced, GrammarMode.ARGUMENT)).hasToString("(, (= y 1) 2)");
    }

    @Test
    void binary_memberAccessAgainstCall_rotates() {
        var reduced = node(".", leaf("x"), node(SyntaxNode.INVOCATION, leaf("each"), SyntaxNode.empty(0),
                                                node(SyntaxNode.BLOCK, SyntaxNode.empty(0), leaf("y"))));

        assertThat(fixup.binary(reduced, GrammarMode.STATEMENT)).hasToString("(() (. x each) () ({} () y))");
    }

    @Test
    void binary_keywordFormWithOperatorTag_isNotRotated() {
        var conditional = node("if", leaf("c"), leaf("a"), SyntaxNode.empty(0));
        var reduced = node("=", leaf("x"), conditional);

        assertThat(fixup.binary(reduced, GrammarMode.STATEMENT)).hasToString("(= x (if c a ()))");
    }

    @Test
    void binary_ternaryAsInner_rotatesUnderTighterOuter() {
        var reduced = node("==", leaf("a"), node("?", leaf("b"), leaf("c"), leaf("d")));

        assertThat(fixup.binary(reduced, GrammarMode.STATEMENT)).hasToString("(? (== a b) c d)");
    }

    @Test
    void prefix_looserOperand_pushesOperatorDown() {
        var reduced = node("-", node("+", leaf("a"), leaf("b")));

        assertThat(fixup.prefix(reduced, GrammarMode.STATEMENT)).hasToString("(+ (- a) b)");
    }

    @Test
    void prefix_tighterOperand_staysOnTop() {
        var reduced = node("-", node("**", leaf("2"), leaf("2")));

        assertThat(fixup.prefix(reduced, GrammarMode.STATEMENT)).hasToString("(- (** 2 2))");
    }

    @Test
    void prefix_keywordOperator_pushesBelowModifier() {
        var reduced = node("return", node("if", leaf("x"), leaf("y")));

        assertThat(fixup.prefix(reduced, GrammarMode.STATEMENT)).hasToString("(if (return x) y)");
    }

    @Test
    void prefix_pushesThroughSeveralLevels() {
        var reduced = node("!", node("||", node("&&", leaf("a"), leaf("b")), leaf("c")));

        assertThat(fixup.prefix(reduced, GrammarMode.STATEMENT)).hasToString("(|| (&& (! a) b) c)");
    }

    @Test
    void isApplication_checksArity() {
        var mode = GrammarMode.STATEMENT;

        assertThat(fixup.isApplication(node("+", leaf("a"), leaf("b")), mode)).isTrue();
        assertThat(fixup.isApplication(node("*", leaf("a")), mode)).isFalse();
        assertThat(fixup.isApplication(node("?", leaf("a"), leaf("b"), leaf("c")), mode)).isTrue();
        assertThat(fixup.isApplication(node(SyntaxNode.INVOCATION, leaf("f"), leaf("x")), mode)).isTrue();
        assertThat(fixup.isApplication(node(",", leaf("a"), leaf("b"), leaf("c")), mode)).isTrue();
        assertThat(fixup.isApplication(node("class", leaf("A"), leaf("B")), mode)).isFalse();
        assertThat(fixup.isApplication(leaf("+"), mode)).isFalse();
    }

    // === Chain ===

    @Test
    void chain_mixedPrecedence_reducesTighterFirst() {
        var tree = fixup.chain(GrammarMode.STATEMENT)
                        .operand(leaf("1"))
                        .infix(leaf("+"))
                        .operand(leaf("2"))
                        .infix(leaf("*"))
                        .operand(leaf("3"))
                        .infix(leaf("-"))
                        .operand(leaf("4"))
                        .finish();

        assertThat(tree).hasToString("(- (+ 1 (* 2 3)) 4)");
    }

    @Test
    void chain_rightAssociative_groupsRight() {
        var tree = fixup.chain(GrammarMode.STATEMENT)
                        .operand(leaf("a"))
                        .infix(leaf("="))
                        .operand(leaf("b"))
                        .infix(leaf("="))
                        .operand(leaf("c"))
                        .finish();

        assertThat(tree).hasToString("(= a (= b c))");
    }

    @Test
    void chain_commas_collectIntoFirstCommaWithAllComments() {
        var first = comment("first");
        var second = comment("second");
        var tree = fixup.chain(GrammarMode.ARGUMENT)
                        .operand(leaf("a"))
                        .infix(SyntaxNode.leaf(",", 1).withComments(List.of(first)))
                        .operand(leaf("b"))
                        .infix(SyntaxNode.leaf(",", 4).withComments(List.of(second)))
                        .operand(leaf("c"))
                        .finish();

        assertThat(tree).hasToString("(, a b c)");
        assertThat(tree.offset()).isEqualTo(1);
        assertThat(tree.comments()).containsExactly(first, second);
    }

    @Test
    void chain_commaAgainstAssignment_dependsOnMode() {
        var statement = fixup.chain(GrammarMode.STATEMENT)
                             .operand(leaf("y"))
                             .infix(leaf("="))
                             .operand(leaf("1"))
                             .infix(leaf(","))
                             .operand(leaf("2"))
                             .finish();
        var argument = fixup.chain(GrammarMode.ARGUMENT)
                            .operand(leaf("y"))
                            .infix(leaf("="))
                            .operand(leaf("1"))
                            .infix(leaf(","))
                            .operand(leaf("2"))
                            .finish();

        assertThat(statement).hasToString("(= y (, 1 2))");
        assertThat(argument).hasToString("(, (= y 1) 2)");
    }

    @Test
    void chain_prefixOperator_yieldsToLooserInfix() {
        var tree = fixup.chain(GrammarMode.STATEMENT)
                        .prefix(leaf("-"))
                        .operand(leaf("a"))
                        .infix(leaf("*"))
                        .operand(leaf("b"))
                        .finish();
        var power = fixup.chain(GrammarMode.STATEMENT)
                         .prefix(leaf("-"))
                         .operand(leaf("a"))
                         .infix(leaf("**"))
                         .operand(leaf("2"))
                         .finish();

        assertThat(tree).hasToString("(* (- a) b)");
        assertThat(power).hasToString("(- (** a 2))");
    }

    @Test
    void chain_ternary_keepsMiddleOperand() {
        var tree = fixup.chain(GrammarMode.STATEMENT)
                        .operand(leaf("x"))
                        .infix(leaf("="))
                        .operand(leaf("c"))
                        .ternary(leaf("?"), leaf("a"))
                        .operand(leaf("b"))
                        .infix(leaf("if"))
                        .operand(leaf("d"))
                        .finish();

        assertThat(tree).hasToString("(if (= x (? c a b)) d)");
    }

    @Test
    void chain_memberOperandCall_isRotated() {
        var call = node(SyntaxNode.INVOCATION, leaf("each"), SyntaxNode.empty(0),
                        node(SyntaxNode.BLOCK, SyntaxNode.empty(0), leaf("y")));
        var tree = fixup.chain(GrammarMode.STATEMENT)
                        .operand(leaf("x"))
                        .infix(leaf("."))
                        .operand(call)
                        .finish();

        assertThat(tree).hasToString("(() (. x each) () ({} () y))");
    }

    @Test
    void chain_longLeftAssociativeChain_isReducedWithoutDeepRecursion() {
        var chain = fixup.chain(GrammarMode.STATEMENT).operand(leaf("0"));
        for (int i = 0; i < 20_000; i++) {
            chain.infix(leaf("+")).operand(leaf("1"));
        }

        var tree = chain.finish();

        var depth = 0;
        for (var current = tree; !current.isLeaf(); current = current.child(0)) {
            depth++;
        }
        assertThat(depth).isEqualTo(20_000);
        assertThat(tree.child(1)).hasToString("1");
    }

    @Test
    void chain_endingWithOperator_isRejected() {
        var chain = fixup.chain(GrammarMode.STATEMENT)
                         .operand(leaf("a"))
                         .infix(leaf("+"));

        assertThatThrownBy(chain::finish).isInstanceOf(IllegalStateException.class);
    }
}
