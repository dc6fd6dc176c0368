package org.Aayush.solver.core.id;

import lombok.experimental.StandardException;
import org.Aayush.solver.domain.Token;

import java.util.Collection;

/**
 * Bidirectional mapping between tokens and dense internal node ids.
 */
public interface TokenIndex {

    /**
     * Converts a token to its dense node id.
     * @param token the token.
     * @return node id in {@code [0, size)}.
     * @throws UnknownTokenException If the token is not indexed.
     */
    int toNode(Token token) throws UnknownTokenException;

    /**
     * Converts a dense node id back to its token.
     * @param nodeId internal node id.
     * @return indexed token.
     * @throws IndexOutOfBoundsException If the node id is invalid.
     */
    Token toToken(int nodeId);

    /**
     * Checks whether a token is indexed.
     *
     * @param token token to test.
     * @return true when the token has a node id.
     */
    boolean contains(Token token);

    /**
     * Returns number of indexed tokens.
     *
     * @return total index size.
     */
    int size();

    /**
     * Exception thrown when a token has no node id.
     */
    @StandardException
    class UnknownTokenException extends RuntimeException {
    }

    /**
     * Factory method for the default immutable implementation.
     *
     * @param tokens tokens in node-id order; duplicates are rejected.
     * @return An immutable TokenIndex instance.
     */
    static TokenIndex of(Collection<Token> tokens) {
        return new FastUtilTokenIndex(tokens);
    }
}
