package org.Aayush.solver.governor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.Aayush.solver.domain.Auction;
import org.Aayush.solver.domain.OrderKind;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Single-trade price request against an auction's liquidity.
 */
@Value
@Builder
public class QuoteRequest {
    /** Liquidity snapshot to quote against; its orders are ignored. */
    @NonNull
    Auction auction;
    @NonNull
    Token sellToken;
    @NonNull
    Token buyToken;
    /** SELL quotes the output of selling {@code amount}; BUY the input needed to buy it. */
    @NonNull
    OrderKind side;
    @NonNull
    BigDecimal amount;
    /** Optional; a passed deadline yields an unavailable quote. */
    Instant deadline;
}
