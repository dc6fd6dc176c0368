package org.Aayush.solver.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.solver.liquidity.PoolKind;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Raw auction snapshot as handed over by the snapshot provider.
 *
 * <p>Nothing here is validated; tokens are referenced by address string. {@link AuctionFactory}
 * turns this payload into an {@link Auction} or fails with {@link InvalidAuctionException}.</p>
 */
@Value
@Builder
public class AuctionInput {
    String id;
    @Singular
    List<TokenInput> tokens;
    @Singular
    List<OrderInput> orders;
    @Singular
    List<PoolInput> pools;
    /** Token address to numeraire value. */
    @Singular
    Map<String, BigDecimal> referencePrices;
    Instant deadline;

    /**
     * Raw token metadata.
     */
    @Value
    @Builder
    public static class TokenInput {
        String address;
        Integer decimals;
        String symbol;
    }

    /**
     * Raw order payload.
     */
    @Value
    @Builder
    public static class OrderInput {
        String id;
        String sellToken;
        String buyToken;
        BigDecimal sellAmount;
        BigDecimal buyAmount;
        OrderKind kind;
        boolean partiallyFillable;
        BigDecimal feeAmount;
        Instant validTo;
        Instant createdAt;
    }

    /**
     * Raw pool payload.
     */
    @Value
    @Builder
    public static class PoolInput {
        String id;
        PoolKind kind;
        @Singular
        List<String> tokens;
        /** Token address to reserve amount. */
        @Singular("reserve")
        Map<String, BigDecimal> reserves;
        int feeBps;
        /** Token address to weight (WEIGHTED pools). */
        @Singular
        Map<String, BigDecimal> weights;
        /** Amplification coefficient (STABLE_SWAP pools). */
        BigDecimal amplification;
    }
}
