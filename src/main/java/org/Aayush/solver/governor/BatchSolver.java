package org.Aayush.solver.governor;

import org.Aayush.solver.domain.Auction;
import org.Aayush.solver.domain.AuctionInput;
import org.Aayush.solver.domain.InvalidAuctionException;
import org.Aayush.solver.domain.Solution;

import java.time.Instant;

/**
 * Public solving surface.
 */
public interface BatchSolver {

    /**
     * Computes the best settlement found before {@code deadline}.
     *
     * <p>Never fails for solving problems: when nothing beats it, the zero-fill baseline is
     * returned.</p>
     */
    Solution solve(Auction auction, Instant deadline);

    /**
     * Validates raw input and solves it against the auction's own deadline.
     *
     * @throws InvalidAuctionException when the input violates an auction contract.
     */
    Solution solve(AuctionInput input);

    /**
     * Quotes one trade against the request's liquidity snapshot.
     */
    Quote quote(QuoteRequest request);
}
