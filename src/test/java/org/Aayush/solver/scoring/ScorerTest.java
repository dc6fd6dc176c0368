package org.Aayush.solver.scoring;

import org.Aayush.solver.domain.Fill;
import org.Aayush.solver.domain.FillSource;
import org.Aayush.solver.domain.Interaction;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.Solution;
import org.Aayush.solver.domain.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.Aayush.solver.testutil.AuctionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ScorerTest {
    private static final Order SELL_A = sell("sa", A, "100", B, "80", true);
    private static final Order BUY_B = buy("bb", A, "100", B, "80", true);
    private static final Map<String, Order> ORDERS = Map.of(SELL_A.getId(), SELL_A, BUY_B.getId(), BUY_B);

    private static Solution solution(List<Fill> fills, int interactionCount, Map<Token, BigDecimal> prices) {
        List<Interaction> interactions = new ArrayList<>();
        for (int i = 0; i < interactionCount; i++) {
            interactions.add(new Interaction("p" + i, A, B, BigDecimal.ONE, BigDecimal.ONE));
        }
        return Solution.builder()
                .auctionId("x")
                .strategyId("s")
                .fills(fills)
                .interactions(interactions)
                .clearingPrices(prices)
                .build();
    }

    @Test
    @DisplayName("Surplus: SELL earns in buy token, BUY saves in sell token")
    void testSurplus() {
        Fill sellFill = Fill.of(SELL_A, dec("50"), dec("45"), FillSource.ROUTED);
        Fill buyFill = Fill.of(BUY_B, dec("90"), dec("80"), FillSource.ROUTED);

        assertEquals(0, Scorer.surplus(SELL_A, sellFill).compareTo(dec("5")));
        assertEquals(B, Scorer.surplusToken(SELL_A));
        assertEquals(0, Scorer.surplus(BUY_B, buyFill).compareTo(dec("10")));
        assertEquals(A, Scorer.surplusToken(BUY_B));
    }

    @Test
    @DisplayName("Score: priced surplus minus interaction penalty")
    void testScore() {
        Scorer scorer = new Scorer(dec("0.5"));
        Solution solution = solution(List.of(
                Fill.of(SELL_A, dec("50"), dec("45"), FillSource.ROUTED),
                Fill.of(BUY_B, dec("90"), dec("80"), FillSource.ROUTED)
        ), 2, Map.of(A, dec("2"), B, dec("3")));

        // 5 * 3 + 10 * 2 - 2 * 0.5
        assertEquals(0, scorer.score(solution, ORDERS).compareTo(dec("34")));
        assertEquals(0, scorer.scored(solution, ORDERS).getScore().compareTo(dec("34")));
    }

    @Test
    @DisplayName("Empty solution scores exactly zero, penalty or not")
    void testEmptyScoresZero() {
        Scorer scorer = new Scorer(dec("1"));

        assertEquals(BigDecimal.ZERO, scorer.score(Solution.empty("x"), ORDERS));
    }

    @Test
    @DisplayName("Unpriced surplus token contributes nothing")
    void testUnpricedSurplusIgnored() {
        Scorer scorer = new Scorer(BigDecimal.ZERO);
        Solution solution = solution(List.of(Fill.of(SELL_A, dec("50"), dec("45"), FillSource.PEER_MATCH)), 0, Map.of(A, dec("1")));

        assertEquals(0, scorer.score(solution, ORDERS).signum());
    }

    @Test
    @DisplayName("Ordering and validation")
    void testOrderingAndValidation() {
        Solution low = Solution.empty("x").withScore(dec("1"));
        Solution high = Solution.empty("x").withScore(dec("2"));
        List<Solution> ranked = new ArrayList<>(List.of(low, high));
        ranked.sort(Scorer.BY_SCORE_DESC);

        assertSame(high, ranked.get(0));
        assertThrows(IllegalArgumentException.class, () -> new Scorer(dec("-0.1")));
        Solution orphan = solution(List.of(Fill.of(sell("ghost", A, "1", B, "1", false), dec("1"), dec("1"), FillSource.ROUTED)), 0, Map.of());
        assertThrows(IllegalArgumentException.class, () -> new Scorer(BigDecimal.ZERO).score(orphan, ORDERS));
    }
}
