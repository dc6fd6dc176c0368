package org.Aayush.solver.routing;

import org.Aayush.solver.domain.Interaction;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Execution path from a sell token to a buy token, legs in execution order.
 */
public record Route(List<RouteLeg> legs) {
    public Route {
        legs = List.copyOf(legs);
        if (legs.isEmpty()) {
            throw new IllegalArgumentException("route requires at least one leg");
        }
        for (int i = 1; i < legs.size(); i++) {
            if (!legs.get(i - 1).tokenOut().equals(legs.get(i).tokenIn())) {
                throw new IllegalArgumentException("route legs are not connected at index " + i);
            }
        }
    }

    public Token tokenIn() {
        return legs.get(0).tokenIn();
    }

    public Token tokenOut() {
        return legs.get(legs.size() - 1).tokenOut();
    }

    public BigDecimal amountIn() {
        return legs.get(0).amountIn();
    }

    public BigDecimal amountOut() {
        return legs.get(legs.size() - 1).amountOut();
    }

    public int hops() {
        return legs.size();
    }

    /**
     * Flattened interactions in execution order.
     */
    public List<Interaction> interactions() {
        List<Interaction> all = new ArrayList<>();
        for (RouteLeg leg : legs) {
            all.addAll(leg.interactions());
        }
        return all;
    }

    /**
     * Token path including both endpoints.
     */
    public List<Token> tokenPath() {
        List<Token> path = new ArrayList<>(legs.size() + 1);
        path.add(tokenIn());
        for (RouteLeg leg : legs) {
            path.add(leg.tokenOut());
        }
        return path;
    }
}
