package org.Aayush.solver.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.solver.liquidity.LiquidityPool;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable root of one solve invocation.
 *
 * <p>Instances are produced by {@link AuctionFactory} from raw input and are never modified while
 * solving; order prioritization creates a new auction through {@link #withOrders(List)}.</p>
 */
@Value
@Builder(toBuilder = true)
public class Auction {
    @NonNull
    String id;
    @Singular
    List<Token> tokens;
    /** Orders in arrival sequence. */
    @Singular
    List<Order> orders;
    @Singular("pool")
    List<LiquidityPool> liquidity;
    @NonNull
    Instant deadline;
    /** Optional per-token value in a common numeraire. */
    @Singular
    Map<Token, BigDecimal> referencePrices;

    /**
     * Returns orders keyed by id, in arrival sequence.
     */
    public Map<String, Order> ordersById() {
        Map<String, Order> byId = new LinkedHashMap<>(orders.size() * 2);
        for (Order order : orders) {
            byId.put(order.getId(), order);
        }
        return byId;
    }

    /**
     * Returns a copy with the given order sequence.
     */
    public Auction withOrders(List<Order> newOrders) {
        return toBuilder().clearOrders().orders(newOrders).build();
    }
}
