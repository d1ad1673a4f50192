package org.pragmatica.ruby;

import org.pragmatica.ruby.error.ParseError;
import org.pragmatica.ruby.error.ParseException;
import org.pragmatica.ruby.tree.SyntaxNode;

import java.util.function.Function;

/**
 * Result of parsing a whole source: a fully position-resolved tree or the error that stopped it.
 * There is no partial tree.
 */
public sealed interface ParseOutcome {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The tree, or a {@link ParseException} carrying the error.
     */
    SyntaxNode unwrap();

    <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super SyntaxNode, ? extends R> onSuccess);

    static ParseOutcome success(SyntaxNode tree) {
        return new Success(tree);
    }

    static ParseOutcome failure(ParseError error) {
        return new Failure(error);
    }

    record Success(SyntaxNode tree) implements ParseOutcome {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public SyntaxNode unwrap() {
            return tree;
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super SyntaxNode, ? extends R> onSuccess) {
            return onSuccess.apply(tree);
        }
    }

    record Failure(ParseError error) implements ParseOutcome {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public SyntaxNode unwrap() {
            throw new ParseException(error);
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super SyntaxNode, ? extends R> onSuccess) {
            return onFailure.apply(error);
        }
    }
}
