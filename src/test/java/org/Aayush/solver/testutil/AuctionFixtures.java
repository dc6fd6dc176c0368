package org.Aayush.solver.testutil;

import org.Aayush.solver.domain.Auction;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.OrderKind;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.liquidity.LiquidityPool;
import org.Aayush.solver.liquidity.PoolKind;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared auction fixtures for solver tests.
 */
public final class AuctionFixtures {
    public static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    public static final Instant FAR_FUTURE = NOW.plusSeconds(3_600);

    public static final Token A = Token.of("0x00000000000000000000000000000000000000aa", 18, "A");
    public static final Token B = Token.of("0x00000000000000000000000000000000000000bb", 18, "B");
    public static final Token C = Token.of("0x00000000000000000000000000000000000000cc", 18, "C");
    public static final Token D = Token.of("0x00000000000000000000000000000000000000dd", 18, "D");
    public static final Token USDC = Token.of("0x00000000000000000000000000000000000000ee", 6, "USDC");

    private AuctionFixtures() {
    }

    public static BigDecimal dec(String value) {
        return new BigDecimal(value);
    }

    public static LiquidityPool constantProduct(String id, Token x, String reserveX, Token y, String reserveY, int feeBps) {
        return LiquidityPool.builder()
                .id(id)
                .kind(PoolKind.CONSTANT_PRODUCT)
                .token(x)
                .token(y)
                .reserve(x, dec(reserveX))
                .reserve(y, dec(reserveY))
                .feeBps(feeBps)
                .build();
    }

    public static LiquidityPool weighted(
            String id,
            Token x, String reserveX, String weightX,
            Token y, String reserveY, String weightY,
            int feeBps
    ) {
        return LiquidityPool.builder()
                .id(id)
                .kind(PoolKind.WEIGHTED)
                .token(x)
                .token(y)
                .reserve(x, dec(reserveX))
                .reserve(y, dec(reserveY))
                .weight(x, dec(weightX))
                .weight(y, dec(weightY))
                .feeBps(feeBps)
                .build();
    }

    public static LiquidityPool stable(String id, Token x, String reserveX, Token y, String reserveY, String amp, int feeBps) {
        return LiquidityPool.builder()
                .id(id)
                .kind(PoolKind.STABLE_SWAP)
                .token(x)
                .token(y)
                .reserve(x, dec(reserveX))
                .reserve(y, dec(reserveY))
                .amplification(dec(amp))
                .feeBps(feeBps)
                .build();
    }

    public static Order sell(String id, Token sellToken, String sellAmount, Token buyToken, String minBuy, boolean partial) {
        return Order.builder()
                .id(id)
                .sellToken(sellToken)
                .buyToken(buyToken)
                .sellAmount(dec(sellAmount))
                .buyAmount(dec(minBuy))
                .kind(OrderKind.SELL)
                .partiallyFillable(partial)
                .validTo(FAR_FUTURE)
                .build();
    }

    public static Order buy(String id, Token sellToken, String maxSell, Token buyToken, String buyAmount, boolean partial) {
        return Order.builder()
                .id(id)
                .sellToken(sellToken)
                .buyToken(buyToken)
                .sellAmount(dec(maxSell))
                .buyAmount(dec(buyAmount))
                .kind(OrderKind.BUY)
                .partiallyFillable(partial)
                .validTo(FAR_FUTURE)
                .build();
    }

    public static Auction auction(String id, List<Order> orders, List<LiquidityPool> pools) {
        return Auction.builder()
                .id(id)
                .token(A)
                .token(B)
                .token(C)
                .token(D)
                .orders(orders)
                .liquidity(pools)
                .deadline(FAR_FUTURE)
                .build();
    }

    /**
     * Chain A-B-C-D of deep constant-product pools plus a shallow direct A-C pool.
     */
    public static List<LiquidityPool> chainPools() {
        return List.of(
                constantProduct("ab", A, "1000", B, "1000", 30),
                constantProduct("bc", B, "1000", C, "2000", 30),
                constantProduct("cd", C, "2000", D, "500", 30),
                constantProduct("ac-shallow", A, "10", C, "20", 30)
        );
    }

    /**
     * Random auction over the four 18-decimal tokens with a connected pool set.
     */
    public static Auction randomAuction(long seed, int orderCount) {
        Random random = new Random(seed);
        Token[] tokens = {A, B, C, D};
        List<LiquidityPool> pools = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            for (int j = i + 1; j < tokens.length; j++) {
                if (i + 1 == j || random.nextBoolean()) {
                    pools.add(constantProduct(
                            "p" + i + j,
                            tokens[i], (500 + random.nextInt(2_000)) + "",
                            tokens[j], (500 + random.nextInt(2_000)) + "",
                            random.nextInt(4) * 10
                    ));
                }
            }
        }
        List<Order> orders = new ArrayList<>();
        for (int k = 0; k < orderCount; k++) {
            int s = random.nextInt(tokens.length);
            int b = (s + 1 + random.nextInt(tokens.length - 1)) % tokens.length;
            String amount = (1 + random.nextInt(50)) + "";
            // limits from generous to unreachable
            String limit = new BigDecimal(amount)
                    .multiply(BigDecimal.valueOf(1 + random.nextInt(300)))
                    .movePointLeft(2)
                    .toPlainString();
            boolean partial = random.nextBoolean();
            orders.add(random.nextBoolean()
                    ? sell("o" + k, tokens[s], amount, tokens[b], limit, partial)
                    : buy("o" + k, tokens[s], limit, tokens[b], amount, partial));
        }
        return auction("random-" + seed, orders, pools);
    }
}
