package org.Aayush.solver.domain;

import org.Aayush.solver.liquidity.LiquidityPool;
import org.Aayush.solver.liquidity.PoolKind;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Assembles validated {@link Auction} instances from raw snapshot input.
 *
 * <p>Validation order is deterministic: auction envelope, tokens, orders (in input order), pools
 * (in input order), reference prices. The first violation wins and is reported with one of the
 * {@link InvalidAuctionException} reason codes.</p>
 */
public final class AuctionFactory {

    private AuctionFactory() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Converts raw input into an immutable auction.
     *
     * @param input raw snapshot payload.
     * @param now current instant used for order expiry checks.
     * @return validated auction.
     * @throws InvalidAuctionException when any input contract is violated.
     */
    public static Auction create(AuctionInput input, Instant now) {
        if (input == null) {
            throw new InvalidAuctionException(InvalidAuctionException.REASON_INVALID_AUCTION, "auction input must be provided");
        }
        Objects.requireNonNull(now, "now");
        if (input.getId() == null || input.getId().isBlank()) {
            throw new InvalidAuctionException(InvalidAuctionException.REASON_INVALID_AUCTION, "auction id must be non-blank");
        }
        if (input.getDeadline() == null) {
            throw new InvalidAuctionException(InvalidAuctionException.REASON_INVALID_AUCTION, "auction deadline must be provided");
        }

        Map<String, Token> tokensByAddress = resolveTokens(input.getTokens());
        Auction.AuctionBuilder builder = Auction.builder()
                .id(input.getId())
                .deadline(input.getDeadline())
                .tokens(tokensByAddress.values());

        Set<String> orderIds = new HashSet<>();
        List<AuctionInput.OrderInput> orders = input.getOrders();
        for (int i = 0; i < orders.size(); i++) {
            Order order = toOrder(orders.get(i), i, tokensByAddress, now);
            if (!orderIds.add(order.getId())) {
                throw new InvalidAuctionException(
                        InvalidAuctionException.REASON_INVALID_AUCTION,
                        "duplicate order id: " + order.getId()
                );
            }
            builder.order(order);
        }

        Set<String> poolIds = new HashSet<>();
        List<AuctionInput.PoolInput> pools = input.getPools();
        for (int i = 0; i < pools.size(); i++) {
            LiquidityPool pool = toPool(pools.get(i), i, tokensByAddress);
            if (!poolIds.add(pool.getId())) {
                throw new InvalidAuctionException(
                        InvalidAuctionException.REASON_INVALID_AUCTION,
                        "duplicate pool id: " + pool.getId()
                );
            }
            builder.pool(pool);
        }

        for (Map.Entry<String, BigDecimal> price : input.getReferencePrices().entrySet()) {
            Token token = requireToken(tokensByAddress, price.getKey(), "referencePrices");
            if (price.getValue() == null || price.getValue().signum() <= 0) {
                throw new InvalidAuctionException(
                        InvalidAuctionException.REASON_INVALID_AUCTION,
                        "reference price must be > 0 for token " + token.address()
                );
            }
            builder.referencePrice(token, price.getValue());
        }
        return builder.build();
    }

    private static Map<String, Token> resolveTokens(List<AuctionInput.TokenInput> tokens) {
        Map<String, Token> byAddress = new LinkedHashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            AuctionInput.TokenInput raw = tokens.get(i);
            if (raw == null || raw.getAddress() == null || raw.getAddress().isBlank()) {
                throw new InvalidAuctionException(
                        InvalidAuctionException.REASON_INVALID_AUCTION,
                        "tokens[" + i + "].address must be non-blank"
                );
            }
            if (raw.getDecimals() == null || raw.getDecimals() < 0 || raw.getDecimals() > Token.MAX_DECIMALS) {
                throw new InvalidAuctionException(
                        InvalidAuctionException.REASON_INVALID_AUCTION,
                        "tokens[" + i + "].decimals must be within [0, " + Token.MAX_DECIMALS + "]"
                );
            }
            Token token = Token.of(raw.getAddress(), raw.getDecimals(), raw.getSymbol());
            if (byAddress.putIfAbsent(token.address(), token) != null) {
                throw new InvalidAuctionException(
                        InvalidAuctionException.REASON_INVALID_AUCTION,
                        "duplicate token address: " + token.address()
                );
            }
        }
        return byAddress;
    }

    private static Order toOrder(AuctionInput.OrderInput raw, int index, Map<String, Token> tokens, Instant now) {
        String field = "orders[" + index + "]";
        if (raw == null) {
            throw invalidOrder(field + " must be provided");
        }
        if (raw.getId() == null || raw.getId().isBlank()) {
            throw invalidOrder(field + ".id must be non-blank");
        }
        String label = "order " + raw.getId();
        if (raw.getKind() == null) {
            throw invalidOrder(label + ": kind must be provided");
        }
        requirePositive(raw.getSellAmount(), label + ": sellAmount");
        requirePositive(raw.getBuyAmount(), label + ": buyAmount");
        BigDecimal fee = raw.getFeeAmount() == null ? BigDecimal.ZERO : raw.getFeeAmount();
        if (fee.signum() < 0) {
            throw invalidOrder(label + ": feeAmount must be >= 0, got " + fee);
        }
        if (raw.getValidTo() == null || !raw.getValidTo().isAfter(now)) {
            throw invalidOrder(label + ": validTo must be after " + now + ", got " + raw.getValidTo());
        }
        if (raw.getSellToken() == null || raw.getBuyToken() == null) {
            throw invalidOrder(label + ": sellToken and buyToken must be provided");
        }
        Token sellToken = requireToken(tokens, raw.getSellToken(), label + ".sellToken");
        Token buyToken = requireToken(tokens, raw.getBuyToken(), label + ".buyToken");
        if (sellToken.equals(buyToken)) {
            throw invalidOrder(label + ": sellToken and buyToken must differ");
        }
        return Order.builder()
                .id(raw.getId())
                .sellToken(sellToken)
                .buyToken(buyToken)
                .sellAmount(raw.getSellAmount())
                .buyAmount(raw.getBuyAmount())
                .kind(raw.getKind())
                .partiallyFillable(raw.isPartiallyFillable())
                .feeAmount(fee)
                .validTo(raw.getValidTo())
                .createdAt(raw.getCreatedAt())
                .build();
    }

    private static LiquidityPool toPool(AuctionInput.PoolInput raw, int index, Map<String, Token> tokens) {
        String field = "pools[" + index + "]";
        if (raw == null) {
            throw invalidPool(field + " must be provided");
        }
        if (raw.getId() == null || raw.getId().isBlank()) {
            throw invalidPool(field + ".id must be non-blank");
        }
        String label = "pool " + raw.getId();
        if (raw.getKind() == null) {
            throw invalidPool(label + ": kind must be provided");
        }
        if (raw.getFeeBps() < 0 || raw.getFeeBps() >= LiquidityPool.BPS_DENOMINATOR) {
            throw invalidPool(label + ": feeBps must be within [0, " + LiquidityPool.BPS_DENOMINATOR + "), got " + raw.getFeeBps());
        }
        if (raw.getTokens().size() < 2) {
            throw invalidPool(label + ": at least two tokens required");
        }

        LiquidityPool.LiquidityPoolBuilder builder = LiquidityPool.builder()
                .id(raw.getId())
                .kind(raw.getKind())
                .feeBps(raw.getFeeBps());
        Set<Token> seen = new HashSet<>();
        for (String address : raw.getTokens()) {
            Token token = requireToken(tokens, address, label + ".tokens");
            if (!seen.add(token)) {
                throw invalidPool(label + ": duplicate token " + token.address());
            }
            BigDecimal reserve = lookup(raw.getReserves(), token);
            if (reserve == null || reserve.signum() <= 0) {
                throw invalidPool(label + ": reserve of " + token.address() + " must be > 0");
            }
            builder.token(token).reserve(token, reserve);
            if (raw.getKind() == PoolKind.WEIGHTED) {
                BigDecimal weight = lookup(raw.getWeights(), token);
                if (weight == null || weight.signum() <= 0) {
                    throw invalidPool(label + ": weight of " + token.address() + " must be > 0");
                }
                builder.weight(token, weight);
            }
        }
        for (String address : raw.getReserves().keySet()) {
            Token token = requireToken(tokens, address, label + ".reserves");
            if (!seen.contains(token)) {
                throw invalidPool(label + ": reserve listed for non-member token " + token.address());
            }
        }
        if (raw.getKind() == PoolKind.STABLE_SWAP) {
            if (raw.getAmplification() == null || raw.getAmplification().signum() <= 0) {
                throw invalidPool(label + ": amplification must be > 0");
            }
            builder.amplification(raw.getAmplification());
        }
        return builder.build();
    }

    private static BigDecimal lookup(Map<String, BigDecimal> byAddress, Token token) {
        for (Map.Entry<String, BigDecimal> entry : byAddress.entrySet()) {
            if (entry.getKey() != null && Token.normalizeAddress(entry.getKey()).equals(token.address())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static Token requireToken(Map<String, Token> tokens, String address, String fieldName) {
        Token token = address == null ? null : tokens.get(Token.normalizeAddress(address));
        if (token == null) {
            throw new InvalidAuctionException(
                    InvalidAuctionException.REASON_UNKNOWN_TOKEN,
                    fieldName + " references unknown token: " + address
            );
        }
        return token;
    }

    private static void requirePositive(BigDecimal amount, String fieldName) {
        if (amount == null || amount.signum() <= 0) {
            throw invalidOrder(fieldName + " must be > 0, got " + amount);
        }
    }

    private static InvalidAuctionException invalidOrder(String message) {
        return new InvalidAuctionException(InvalidAuctionException.REASON_INVALID_ORDER, message);
    }

    private static InvalidAuctionException invalidPool(String message) {
        return new InvalidAuctionException(InvalidAuctionException.REASON_INVALID_POOL, message);
    }
}
