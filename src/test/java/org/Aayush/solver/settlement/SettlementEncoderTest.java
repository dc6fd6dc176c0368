package org.Aayush.solver.settlement;

import org.Aayush.solver.domain.Fill;
import org.Aayush.solver.domain.FillSource;
import org.Aayush.solver.domain.Interaction;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.Solution;
import org.Aayush.solver.domain.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.Aayush.solver.testutil.AuctionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SettlementEncoderTest {
    private final SettlementEncoder encoder = new SettlementEncoder();

    private static final Order SELL_A = sell("sa", A, "100", B, "80", true);
    private static final Order SELL_B = sell("sb", B, "50", A, "40", true);
    private static final Map<String, Order> ORDERS = Map.of(SELL_A.getId(), SELL_A, SELL_B.getId(), SELL_B);

    private String reasonOf(List<Fill> fills, List<Interaction> interactions) {
        return assertThrows(InfeasibleSettlementException.class,
                () -> encoder.encode("x", "s", ORDERS, fills, interactions, Map.of())).reasonCode();
    }

    @Test
    @DisplayName("Routed fill: balanced interaction, clearing prices derived from the reference token")
    void testRoutedFillEncodes() {
        List<Fill> fills = List.of(Fill.of(SELL_A, dec("100"), dec("90"), FillSource.ROUTED));
        List<Interaction> interactions = List.of(new Interaction("ab", A, B, dec("100"), dec("90")));

        Solution solution = encoder.encode("x", "s", ORDERS, fills, interactions, Map.of(A, dec("2")));

        assertEquals("x", solution.getAuctionId());
        assertEquals("s", solution.getStrategyId());
        assertEquals(fills, solution.getFills());
        assertEquals(interactions, solution.getInteractions());
        Map<Token, BigDecimal> prices = solution.getClearingPrices();
        assertEquals(0, prices.get(A).compareTo(dec("2")));
        // 100 A * 2 = 90 B * p(B)
        assertTrue(prices.get(B).multiply(dec("90")).subtract(dec("200")).abs().compareTo(dec("1e-40")) <= 0);
        assertEquals(0, solution.getScore().signum());
    }

    @Test
    @DisplayName("Peer fills: no interactions needed when both sides net out")
    void testPeerFillsConserve() {
        List<Fill> fills = List.of(
                Fill.of(SELL_A, dec("45"), dec("50"), FillSource.PEER_MATCH),
                Fill.of(SELL_B, dec("50"), dec("45"), FillSource.PEER_MATCH)
        );

        Solution solution = encoder.encode("x", "s", ORDERS, fills, List.of(), Map.of());

        assertEquals(2, solution.getFills().size());
        assertTrue(solution.getClearingPrices().isEmpty(), "no reference price, nothing to anchor");
    }

    @Test
    @DisplayName("Only traded tokens get clearing prices")
    void testUntradedTokensOmitted() {
        List<Fill> fills = List.of(
                Fill.of(SELL_A, dec("45"), dec("50"), FillSource.PEER_MATCH),
                Fill.of(SELL_B, dec("50"), dec("45"), FillSource.PEER_MATCH)
        );

        Solution solution = encoder.encode("x", "s", ORDERS, fills, List.of(),
                Map.of(A, BigDecimal.ONE, C, BigDecimal.TEN));

        assertEquals(2, solution.getClearingPrices().size());
        assertFalse(solution.getClearingPrices().containsKey(C));
    }

    @Test
    @DisplayName("Conservation: an unbalanced token flow is rejected")
    void testConservationViolation() {
        List<Fill> fills = List.of(Fill.of(SELL_A, dec("100"), dec("90"), FillSource.ROUTED));
        List<Interaction> interactions = List.of(new Interaction("ab", A, B, dec("100"), dec("89.999")));

        assertEquals(InfeasibleSettlementException.REASON_CONSERVATION_VIOLATED, reasonOf(fills, interactions));
    }

    @Test
    @DisplayName("Fill checks: limit, cap, unknown order and non-positive amounts")
    void testFillViolations() {
        assertEquals(InfeasibleSettlementException.REASON_LIMIT_VIOLATED,
                reasonOf(List.of(Fill.of(SELL_A, dec("100"), dec("79"), FillSource.ROUTED)), List.of()));
        assertEquals(InfeasibleSettlementException.REASON_CAP_EXCEEDED, reasonOf(List.of(
                Fill.of(SELL_A, dec("60"), dec("60"), FillSource.PEER_MATCH),
                Fill.of(SELL_A, dec("60"), dec("60"), FillSource.ROUTED)), List.of()));
        assertEquals(InfeasibleSettlementException.REASON_UNKNOWN_ORDER, reasonOf(List.of(
                Fill.of(sell("ghost", A, "1", B, "1", false), dec("1"), dec("1"), FillSource.ROUTED)), List.of()));
        assertEquals(InfeasibleSettlementException.REASON_NON_POSITIVE_AMOUNT,
                reasonOf(List.of(Fill.of(SELL_A, dec("0"), dec("1"), FillSource.ROUTED)), List.of()));
    }

    @Test
    @DisplayName("Message: reason code prefixes the exception message")
    void testMessageFormat() {
        InfeasibleSettlementException ex = assertThrows(InfeasibleSettlementException.class,
                () -> encoder.encode("x", "s", ORDERS,
                        List.of(Fill.of(SELL_A, dec("100"), dec("79"), FillSource.ROUTED)), List.of(), Map.of()));
        assertTrue(ex.getMessage().startsWith("[LIMIT_VIOLATED] "));
    }
}
