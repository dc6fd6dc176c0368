package org.Aayush.solver.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.Aayush.solver.testutil.AuctionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class OrderTest {

    @Test
    @DisplayName("Limit: exact cross-multiplication accepts the boundary price")
    void testRespectsLimitBoundary() {
        Order order = sell("s", A, "3", B, "1", false);

        assertTrue(order.respectsLimit(dec("3"), dec("1")));
        assertTrue(order.respectsLimit(dec("1.5"), dec("0.5")));
        assertFalse(order.respectsLimit(dec("3"), dec("0.999999999999999999")));
        assertTrue(order.respectsLimit(dec("1"), dec("0.333333333333333334")));
        assertFalse(order.respectsLimit(dec("1"), dec("0.333333333333333333")));
    }

    @Test
    @DisplayName("Cap: SELL caps the sold amount, BUY caps the bought amount")
    void testCaps() {
        Order sellOrder = sell("s", A, "10", B, "5", true);
        Order buyOrder = buy("b", A, "10", B, "5", true);

        assertTrue(sellOrder.withinCap(dec("10"), dec("100")));
        assertFalse(sellOrder.withinCap(dec("10.1"), dec("100")));
        assertTrue(buyOrder.withinCap(dec("100"), dec("5")));
        assertFalse(buyOrder.withinCap(dec("1"), dec("5.0001")));

        assertEquals(dec("10"), sellOrder.cappedAmount());
        assertEquals(A, sellOrder.cappedToken());
        assertEquals(dec("5"), buyOrder.cappedAmount());
        assertEquals(B, buyOrder.cappedToken());
    }
}
