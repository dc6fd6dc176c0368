package org.Aayush.solver.governor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.solver.domain.Interaction;
import org.Aayush.solver.domain.OrderKind;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Answer to a {@link QuoteRequest}.
 *
 * <p>Clearing prices follow the uniform-price convention
 * {@code sellAmount · price(sell) = buyAmount · price(buy)}. An unavailable quote carries no
 * amounts, interactions or prices.</p>
 */
@Value
@Builder
public class Quote {
    @NonNull
    Token sellToken;
    @NonNull
    Token buyToken;
    @NonNull
    OrderKind side;
    boolean available;
    BigDecimal sellAmount;
    BigDecimal buyAmount;
    @Singular
    List<Interaction> interactions;
    @Singular
    Map<Token, BigDecimal> clearingPrices;

    /**
     * Quote for a request no route can serve.
     */
    public static Quote unavailable(QuoteRequest request) {
        return Quote.builder()
                .sellToken(request.getSellToken())
                .buyToken(request.getBuyToken())
                .side(request.getSide())
                .available(false)
                .build();
    }
}
