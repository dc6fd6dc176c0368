package org.Aayush.solver.domain;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Construction-time auction failure with deterministic reason codes.
 *
 * <p>This is the only failure surfaced by the solver to its caller. It is raised synchronously
 * while assembling the auction, before any concurrent work starts.</p>
 */
@Getter
@Accessors(fluent = true)
public final class InvalidAuctionException extends RuntimeException {
    public static final String REASON_INVALID_ORDER = "INVALID_ORDER";
    public static final String REASON_UNKNOWN_TOKEN = "UNKNOWN_TOKEN";
    public static final String REASON_INVALID_POOL = "INVALID_POOL";
    public static final String REASON_INVALID_AUCTION = "INVALID_AUCTION";

    private final String reasonCode;

    /**
     * Creates a reason-coded construction failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public InvalidAuctionException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded construction failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public InvalidAuctionException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
