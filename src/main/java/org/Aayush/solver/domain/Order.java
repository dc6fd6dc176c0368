package org.Aayush.solver.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Validated auction order.
 *
 * <p>Orders are never mutated by solving; matching and routing derive {@link Fill} records that
 * reference the order id. Limit checks are exact cross-multiplications, so no price quotient is
 * ever rounded when deciding whether a fill is acceptable.</p>
 */
@Value
@Builder(toBuilder = true)
public class Order {
    @NonNull
    String id;
    @NonNull
    Token sellToken;
    @NonNull
    Token buyToken;
    /** Maximum sell amount (exact amount for SELL orders). */
    @NonNull
    BigDecimal sellAmount;
    /** Minimum buy amount for SELL orders, exact amount for BUY orders. */
    @NonNull
    BigDecimal buyAmount;
    @NonNull
    OrderKind kind;
    boolean partiallyFillable;
    /** Fee charged in sell token on top of the traded amount. Informational for solving. */
    @NonNull
    @Builder.Default
    BigDecimal feeAmount = BigDecimal.ZERO;
    @NonNull
    Instant validTo;
    /** Optional creation timestamp used by order prioritization. */
    Instant createdAt;

    /**
     * Returns whether a realized exchange meets or beats this order's limit price.
     *
     * @param executedSell realized sell amount.
     * @param executedBuy realized buy amount.
     * @return true when {@code executedBuy / executedSell >= buyAmount / sellAmount}.
     */
    public boolean respectsLimit(BigDecimal executedSell, BigDecimal executedBuy) {
        return executedBuy.multiply(sellAmount).compareTo(buyAmount.multiply(executedSell)) >= 0;
    }

    /**
     * Returns whether the realized amounts stay within the order's capped side.
     */
    public boolean withinCap(BigDecimal executedSell, BigDecimal executedBuy) {
        return switch (kind) {
            case SELL -> executedSell.compareTo(sellAmount) <= 0;
            case BUY -> executedBuy.compareTo(buyAmount) <= 0;
        };
    }

    /**
     * Returns the amount on the capped side (sell for SELL orders, buy for BUY orders).
     */
    public BigDecimal cappedAmount() {
        return kind == OrderKind.SELL ? sellAmount : buyAmount;
    }

    /**
     * Returns the capped-side token.
     */
    public Token cappedToken() {
        return kind == OrderKind.SELL ? sellToken : buyToken;
    }
}
