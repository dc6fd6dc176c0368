package org.Aayush.solver.matching;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.solver.domain.Fill;
import org.Aayush.solver.domain.FillSource;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.OrderKind;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.liquidity.DecimalMath;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Direct order-to-order matching without pool liquidity.
 *
 * <p>Two orders are counterparts when one sells what the other buys and vice versa. With order
 * {@code a} selling X for Y and order {@code b} selling Y for X, prices are quoted as Y per X:
 * {@code a} accepts any price {@code >= a.buy / a.sell}, {@code b} any price
 * {@code <= b.sell / b.buy}. A match is possible only when that interval is non-empty.</p>
 *
 * <p><b>Pricing policy:</b></p>
 * <ol>
 * <li>Midpoint of the interval; the side with the smaller remaining volume is consumed fully and
 * the other keeps a remainder.</li>
 * <li>If that remainder belongs to a fill-or-kill order, the full-clearance exchange (both
 * remaining amounts swapped in full) is tried instead; it applies only when it respects both
 * limits.</li>
 * <li>Otherwise the pair is skipped and both orders remain available.</li>
 * </ol>
 *
 * <p>Orders are scanned in arrival sequence and each order takes the first eligible counterparty.
 * Partially fillable orders keep scanning until exhausted. Amounts derived from a price are
 * rounded down to token decimals and every match is re-verified against both limits exactly.</p>
 */
@Slf4j
public final class PeerMatcher {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /**
     * Matches counterparts within {@code orders}.
     *
     * @param orders orders in arrival sequence.
     * @return peer fills plus per-order residuals.
     */
    public MatchResult match(List<Order> orders) {
        Objects.requireNonNull(orders, "orders");
        int n = orders.size();
        BigDecimal[] remaining = new BigDecimal[n];
        boolean[] touched = new boolean[n];
        for (int i = 0; i < n; i++) {
            remaining[i] = orders.get(i).cappedAmount();
        }

        List<Fill> fills = new ArrayList<>();
        for (int a = 0; a < n; a++) {
            for (int b = 0; b < n && remaining[a].signum() > 0; b++) {
                if (b == a || remaining[b].signum() == 0) {
                    continue;
                }
                Order orderA = orders.get(a);
                Order orderB = orders.get(b);
                if (!counterparts(orderA, orderB)) {
                    continue;
                }
                Trade trade = tryMatch(orderA, remaining[a], orderB, remaining[b]);
                if (trade == null) {
                    continue;
                }
                fills.add(Fill.of(orderA, trade.amountX(), trade.amountY(), FillSource.PEER_MATCH));
                fills.add(Fill.of(orderB, trade.amountY(), trade.amountX(), FillSource.PEER_MATCH));
                remaining[a] = remaining[a].subtract(consumed(orderA, trade.amountX(), trade.amountY()));
                remaining[b] = remaining[b].subtract(consumed(orderB, trade.amountY(), trade.amountX()));
                touched[a] = true;
                touched[b] = true;
                log.debug("Matched {} with {}: {} {} for {} {}",
                        orderA.getId(), orderB.getId(),
                        trade.amountX(), orderA.getSellToken(), trade.amountY(), orderA.getBuyToken());
            }
        }

        MatchResult.MatchResultBuilder result = MatchResult.builder().fills(fills);
        for (int i = 0; i < n; i++) {
            if (remaining[i].signum() > 0) {
                result.residual(new Residual(orders.get(i), remaining[i], touched[i]));
            }
        }
        return result.build();
    }

    /**
     * Matches one pair given remaining capped amounts.
     *
     * @return the exchange, or null when the pair cannot be matched.
     */
    Trade tryMatch(Order a, BigDecimal remainingA, Order b, BigDecimal remainingB) {
        // a.buy / a.sell <= b.sell / b.buy
        if (a.getBuyAmount().multiply(b.getBuyAmount())
                .compareTo(a.getSellAmount().multiply(b.getSellAmount())) > 0) {
            return null;
        }
        BigDecimal minPrice = a.getBuyAmount().divide(a.getSellAmount(), DecimalMath.MC);
        BigDecimal maxPrice = b.getSellAmount().divide(b.getBuyAmount(), DecimalMath.MC);
        BigDecimal midpoint = minPrice.add(maxPrice).divide(TWO, DecimalMath.MC);

        Trade atMidpoint = midpointTrade(a, remainingA, b, remainingB, midpoint);
        if (atMidpoint != null && acceptable(a, remainingA, b, remainingB, atMidpoint)) {
            return atMidpoint;
        }
        Trade fullClearance = fullClearanceTrade(a, remainingA, b, remainingB, midpoint);
        if (fullClearance != null && acceptable(a, remainingA, b, remainingB, fullClearance)) {
            return fullClearance;
        }
        return null;
    }

    private static Trade midpointTrade(Order a, BigDecimal remainingA, Order b, BigDecimal remainingB, BigDecimal price) {
        Token tokenX = a.getSellToken();
        Token tokenY = a.getBuyToken();
        // both volumes in X
        BigDecimal volumeA = a.getKind() == OrderKind.SELL ? remainingA : remainingA.divide(price, DecimalMath.MC);
        BigDecimal volumeB = b.getKind() == OrderKind.BUY ? remainingB : remainingB.divide(price, DecimalMath.MC);

        BigDecimal amountX;
        BigDecimal amountY;
        if (volumeA.compareTo(volumeB) <= 0) {
            if (a.getKind() == OrderKind.SELL) {
                amountX = remainingA;
                amountY = tokenY.floor(amountX.multiply(price));
            } else {
                amountY = remainingA;
                amountX = tokenX.floor(amountY.divide(price, DecimalMath.MC));
            }
        } else {
            if (b.getKind() == OrderKind.BUY) {
                amountX = remainingB;
                amountY = tokenY.floor(amountX.multiply(price));
            } else {
                amountY = remainingB;
                amountX = tokenX.floor(amountY.divide(price, DecimalMath.MC));
            }
        }
        return new Trade(amountX, amountY);
    }

    private static Trade fullClearanceTrade(Order a, BigDecimal remainingA, Order b, BigDecimal remainingB, BigDecimal price) {
        BigDecimal amountX = null;
        BigDecimal amountY = null;
        if (a.getKind() == OrderKind.SELL) {
            amountX = remainingA;
        } else {
            amountY = remainingA;
        }
        if (b.getKind() == OrderKind.BUY) {
            if (amountX != null && amountX.compareTo(remainingB) != 0) {
                return null;
            }
            amountX = remainingB;
        } else {
            if (amountY != null && amountY.compareTo(remainingB) != 0) {
                return null;
            }
            amountY = remainingB;
        }
        if (amountX == null) {
            amountX = a.getSellToken().floor(amountY.divide(price, DecimalMath.MC));
        }
        if (amountY == null) {
            amountY = a.getBuyToken().floor(amountX.multiply(price));
        }
        return new Trade(amountX, amountY);
    }

    private static boolean acceptable(Order a, BigDecimal remainingA, Order b, BigDecimal remainingB, Trade trade) {
        if (trade.amountX().signum() <= 0 || trade.amountY().signum() <= 0) {
            return false;
        }
        if (!a.respectsLimit(trade.amountX(), trade.amountY()) || !b.respectsLimit(trade.amountY(), trade.amountX())) {
            return false;
        }
        BigDecimal leftA = remainingA.subtract(consumed(a, trade.amountX(), trade.amountY()));
        BigDecimal leftB = remainingB.subtract(consumed(b, trade.amountY(), trade.amountX()));
        if (leftA.signum() < 0 || leftB.signum() < 0) {
            return false;
        }
        return (leftA.signum() == 0 || a.isPartiallyFillable())
                && (leftB.signum() == 0 || b.isPartiallyFillable());
    }

    private static boolean counterparts(Order a, Order b) {
        return a.getSellToken().equals(b.getBuyToken()) && a.getBuyToken().equals(b.getSellToken());
    }

    private static BigDecimal consumed(Order order, BigDecimal executedSell, BigDecimal executedBuy) {
        return order.getKind() == OrderKind.SELL ? executedSell : executedBuy;
    }

    /**
     * One exchange: {@code amountX} of the first order's sell token against {@code amountY} of
     * its buy token.
     */
    record Trade(BigDecimal amountX, BigDecimal amountY) {
    }
}
