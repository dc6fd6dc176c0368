package org.Aayush.solver.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.solver.core.id.TokenIndex;
import org.Aayush.solver.domain.Auction;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.liquidity.LiquidityPool;
import org.Aayush.solver.liquidity.PoolMath;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link LiquidityGraph} from one auction snapshot.
 *
 * <p>Every pool with {@code k} tokens contributes up to {@code k·(k-1)} directed edges, one per
 * ordered token pair with a defined marginal price. Pools are visited in declaration order,
 * which fixes edge order among parallel edges.</p>
 */
@Slf4j
public final class LiquidityGraphBuilder {

    private LiquidityGraphBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static LiquidityGraph build(Auction auction) {
        Objects.requireNonNull(auction, "auction");
        return build(auction.getTokens(), auction.getLiquidity());
    }

    /**
     * Builds a graph over {@code tokens} (node-id order) from {@code pools}.
     *
     * @throws TokenIndex.UnknownTokenException when a pool references a token outside {@code tokens}.
     */
    public static LiquidityGraph build(List<Token> tokens, List<LiquidityPool> pools) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(pools, "pools");
        TokenIndex index = TokenIndex.of(tokens);
        int nodeCount = index.size();

        List<IntArrayList> targetsByOrigin = new ArrayList<>(nodeCount);
        List<IntArrayList> poolsByOrigin = new ArrayList<>(nodeCount);
        List<List<BigDecimal>> weightsByOrigin = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            targetsByOrigin.add(new IntArrayList());
            poolsByOrigin.add(new IntArrayList());
            weightsByOrigin.add(new ArrayList<>());
        }

        int edgeCount = 0;
        for (int poolIndex = 0; poolIndex < pools.size(); poolIndex++) {
            LiquidityPool pool = pools.get(poolIndex);
            for (Token tokenIn : pool.getTokens()) {
                int origin = index.toNode(tokenIn);
                for (Token tokenOut : pool.getTokens()) {
                    if (tokenIn.equals(tokenOut)) {
                        continue;
                    }
                    BigDecimal price = PoolMath.marginalPrice(pool, tokenIn, tokenOut);
                    if (price == null || price.signum() <= 0) {
                        log.debug("Skipping edge {} {}->{}: no marginal price", pool.getId(), tokenIn, tokenOut);
                        continue;
                    }
                    targetsByOrigin.get(origin).add(index.toNode(tokenOut));
                    poolsByOrigin.get(origin).add(poolIndex);
                    weightsByOrigin.get(origin).add(price);
                    edgeCount++;
                }
            }
        }

        int[] firstEdge = new int[nodeCount + 1];
        int[] edgeOrigin = new int[edgeCount];
        int[] edgeTarget = new int[edgeCount];
        int[] edgePool = new int[edgeCount];
        BigDecimal[] baseWeights = new BigDecimal[edgeCount];
        int cursor = 0;
        for (int origin = 0; origin < nodeCount; origin++) {
            firstEdge[origin] = cursor;
            IntArrayList targets = targetsByOrigin.get(origin);
            for (int i = 0; i < targets.size(); i++) {
                edgeOrigin[cursor] = origin;
                edgeTarget[cursor] = targets.getInt(i);
                edgePool[cursor] = poolsByOrigin.get(origin).getInt(i);
                baseWeights[cursor] = weightsByOrigin.get(origin).get(i);
                cursor++;
            }
        }
        firstEdge[nodeCount] = edgeCount;

        LiquidityGraph graph = new LiquidityGraph(index, pools, firstEdge, edgeOrigin, edgeTarget, edgePool, baseWeights);
        log.debug("Built {}", graph);
        return graph;
    }
}
