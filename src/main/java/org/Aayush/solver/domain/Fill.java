package org.Aayush.solver.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Realized (possibly partial) execution of one order.
 *
 * @param orderId id of the executed order.
 * @param sellToken token the trader pays.
 * @param buyToken token the trader receives.
 * @param executedSell amount paid by the trader.
 * @param executedBuy amount received by the trader.
 * @param source whether the fill came from a peer match or a pool route.
 */
public record Fill(
        String orderId,
        Token sellToken,
        Token buyToken,
        BigDecimal executedSell,
        BigDecimal executedBuy,
        FillSource source
) {
    public Fill {
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(sellToken, "sellToken");
        Objects.requireNonNull(buyToken, "buyToken");
        Objects.requireNonNull(executedSell, "executedSell");
        Objects.requireNonNull(executedBuy, "executedBuy");
        Objects.requireNonNull(source, "source");
    }

    /**
     * Creates a fill for an order.
     */
    public static Fill of(Order order, BigDecimal executedSell, BigDecimal executedBuy, FillSource source) {
        return new Fill(order.getId(), order.getSellToken(), order.getBuyToken(), executedSell, executedBuy, source);
    }
}
