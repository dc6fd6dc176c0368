package org.Aayush.solver.settlement;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Encoded settlement violates a hard settlement rule.
 *
 * <p>Fatal to the candidate that produced it; the governor discards that candidate.</p>
 */
@Getter
@Accessors(fluent = true)
public final class InfeasibleSettlementException extends RuntimeException {
    public static final String REASON_CONSERVATION_VIOLATED = "CONSERVATION_VIOLATED";
    public static final String REASON_LIMIT_VIOLATED = "LIMIT_VIOLATED";
    public static final String REASON_CAP_EXCEEDED = "CAP_EXCEEDED";
    public static final String REASON_UNKNOWN_ORDER = "UNKNOWN_ORDER";
    public static final String REASON_NON_POSITIVE_AMOUNT = "NON_POSITIVE_AMOUNT";

    private final String reasonCode;

    public InfeasibleSettlementException(String reasonCode, String message) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] " + message);
        this.reasonCode = reasonCode;
    }
}
