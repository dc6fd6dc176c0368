package org.Aayush.solver.domain;

import org.Aayush.solver.liquidity.PoolKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AuctionFactoryTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static AuctionInput.AuctionInputBuilder validInput() {
        return AuctionInput.builder()
                .id("auction-1")
                .deadline(NOW.plusSeconds(10))
                .token(AuctionInput.TokenInput.builder().address("0xAA").decimals(18).symbol("A").build())
                .token(AuctionInput.TokenInput.builder().address("0xbb").decimals(6).symbol("B").build())
                .order(validOrder("o1").build())
                .pool(AuctionInput.PoolInput.builder()
                        .id("pool-1")
                        .kind(PoolKind.CONSTANT_PRODUCT)
                        .token("0xaa")
                        .token("0xBB")
                        .reserve("0xaa", new BigDecimal("100"))
                        .reserve("0xbb", new BigDecimal("200"))
                        .feeBps(30)
                        .build())
                .referencePrice("0xaa", BigDecimal.ONE);
    }

    private static AuctionInput.OrderInput.OrderInputBuilder validOrder(String id) {
        return AuctionInput.OrderInput.builder()
                .id(id)
                .sellToken("0xaa")
                .buyToken("0xbb")
                .sellAmount(new BigDecimal("1"))
                .buyAmount(new BigDecimal("1.5"))
                .kind(OrderKind.SELL)
                .validTo(NOW.plusSeconds(60));
    }

    private static String reasonOf(AuctionInput input) {
        return assertThrows(InvalidAuctionException.class, () -> AuctionFactory.create(input, NOW)).reasonCode();
    }

    @Test
    @DisplayName("Happy path: tokens resolve by normalized address and order sequence is kept")
    void testCreateValidAuction() {
        Auction auction = AuctionFactory.create(validInput().order(validOrder("o2").build()).build(), NOW);

        assertEquals("auction-1", auction.getId());
        assertEquals(2, auction.getTokens().size());
        assertEquals("0xaa", auction.getTokens().get(0).address());
        assertEquals(6, auction.getTokens().get(1).decimals());
        assertEquals("o1", auction.getOrders().get(0).getId());
        assertEquals("o2", auction.getOrders().get(1).getId());
        assertEquals(BigDecimal.ZERO, auction.getOrders().get(0).getFeeAmount());
        assertEquals(new BigDecimal("200"), auction.getLiquidity().get(0).reserve(Token.of("0xbb", 6)));
        assertEquals(BigDecimal.ONE, auction.getReferencePrices().get(Token.of("0xaa", 18)));
    }

    @Test
    @DisplayName("Orders: non-positive amounts, same tokens and expiry are INVALID_ORDER")
    void testInvalidOrders() {
        assertEquals(InvalidAuctionException.REASON_INVALID_ORDER,
                reasonOf(validInput().clearOrders().order(validOrder("x").sellAmount(BigDecimal.ZERO).build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_ORDER,
                reasonOf(validInput().clearOrders().order(validOrder("x").buyAmount(new BigDecimal("-1")).build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_ORDER,
                reasonOf(validInput().clearOrders().order(validOrder("x").buyToken("0xAA").build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_ORDER,
                reasonOf(validInput().clearOrders().order(validOrder("x").validTo(NOW).build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_ORDER,
                reasonOf(validInput().clearOrders().order(validOrder("x").kind(null).build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_ORDER,
                reasonOf(validInput().clearOrders().order(validOrder("x").feeAmount(new BigDecimal("-0.1")).build()).build()));
    }

    @Test
    @DisplayName("Tokens: references to unknown tokens are UNKNOWN_TOKEN")
    void testUnknownTokens() {
        assertEquals(InvalidAuctionException.REASON_UNKNOWN_TOKEN,
                reasonOf(validInput().clearOrders().order(validOrder("x").buyToken("0xcc").build()).build()));
        assertEquals(InvalidAuctionException.REASON_UNKNOWN_TOKEN,
                reasonOf(validInput().referencePrice("0xdd", BigDecimal.TEN).build()));
    }

    @Test
    @DisplayName("Pools: bad fee, missing reserve, single token and weighted without weights are INVALID_POOL")
    void testInvalidPools() {
        AuctionInput.PoolInput.PoolInputBuilder base = AuctionInput.PoolInput.builder()
                .id("p")
                .kind(PoolKind.CONSTANT_PRODUCT)
                .token("0xaa")
                .token("0xbb")
                .reserve("0xaa", BigDecimal.ONE)
                .reserve("0xbb", BigDecimal.ONE);

        assertEquals(InvalidAuctionException.REASON_INVALID_POOL,
                reasonOf(validInput().clearPools().pool(base.feeBps(10_000).build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_POOL,
                reasonOf(validInput().clearPools().pool(base.feeBps(0).clearReserves().reserve("0xaa", BigDecimal.ONE).build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_POOL,
                reasonOf(validInput().clearPools().pool(AuctionInput.PoolInput.builder()
                        .id("single").kind(PoolKind.CONSTANT_PRODUCT).token("0xaa").reserve("0xaa", BigDecimal.ONE).build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_POOL,
                reasonOf(validInput().clearPools().pool(AuctionInput.PoolInput.builder()
                        .id("w").kind(PoolKind.WEIGHTED).token("0xaa").token("0xbb")
                        .reserve("0xaa", BigDecimal.ONE).reserve("0xbb", BigDecimal.ONE).build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_POOL,
                reasonOf(validInput().clearPools().pool(AuctionInput.PoolInput.builder()
                        .id("s").kind(PoolKind.STABLE_SWAP).token("0xaa").token("0xbb")
                        .reserve("0xaa", BigDecimal.ONE).reserve("0xbb", BigDecimal.ONE).build()).build()));
    }

    @Test
    @DisplayName("Envelope: duplicate ids and missing deadline are INVALID_AUCTION")
    void testInvalidEnvelope() {
        assertEquals(InvalidAuctionException.REASON_INVALID_AUCTION,
                reasonOf(validInput().order(validOrder("o1").build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_AUCTION,
                reasonOf(validInput().deadline(null).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_AUCTION,
                reasonOf(validInput().token(AuctionInput.TokenInput.builder().address("0xaa").decimals(18).build()).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_AUCTION,
                reasonOf(validInput().referencePrice("0xaa", BigDecimal.ZERO).build()));
        assertEquals(InvalidAuctionException.REASON_INVALID_AUCTION,
                reasonOf(validInput().id(" ").build()));
    }

    @Test
    @DisplayName("Message: reason code is embedded in the exception message")
    void testMessageFormat() {
        InvalidAuctionException ex = assertThrows(InvalidAuctionException.class,
                () -> AuctionFactory.create(validInput().deadline(null).build(), NOW));
        assertTrue(ex.getMessage().startsWith("[INVALID_AUCTION] "));
        assertThrows(InvalidAuctionException.class, () -> AuctionFactory.create(null, NOW));
    }
}
