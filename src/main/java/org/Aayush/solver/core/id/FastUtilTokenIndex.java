package org.Aayush.solver.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.Aayush.solver.domain.Token;

import java.util.Collection;

/**
 * Token index backed by a FastUtil primitive-valued hash map.
 *
 * <p>Node ids follow the iteration order of the source collection. The index is immutable and
 * safe for concurrent reads.</p>
 */
public class FastUtilTokenIndex implements TokenIndex {

    // Token -> node id without boxing on lookup
    private final Object2IntOpenHashMap<Token> forward;
    // node id -> token, zero allocation read
    private final Token[] reverse;

    /**
     * Builds the index from tokens in node-id order.
     */
    public FastUtilTokenIndex(Collection<Token> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("Tokens cannot be null");
        }
        this.forward = new Object2IntOpenHashMap<>(tokens.size());
        this.forward.defaultReturnValue(-1); // Sentinel value
        this.reverse = new Token[tokens.size()];

        int nodeId = 0;
        for (Token token : tokens) {
            if (token == null) {
                throw new IllegalArgumentException("Token at position " + nodeId + " is null");
            }
            if (forward.containsKey(token)) {
                throw new IllegalArgumentException("Duplicate token detected in index input: " + token.address());
            }
            forward.put(token, nodeId);
            reverse[nodeId] = token;
            nodeId++;
        }
        this.forward.trim();
    }

    @Override
    public int toNode(Token token) throws UnknownTokenException {
        int id = forward.getInt(token);
        if (id == -1) {
            throw new UnknownTokenException("Token not indexed: " + token);
        }
        return id;
    }

    @Override
    public Token toToken(int nodeId) {
        try {
            return reverse[nodeId];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Node id out of bounds: " + nodeId);
        }
    }

    @Override
    public boolean contains(Token token) {
        return forward.containsKey(token);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
