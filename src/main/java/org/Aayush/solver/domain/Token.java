package org.Aayush.solver.domain;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable chain token identified by its contract address.
 *
 * <p>Equality and hashing use the normalized (lower-case) address only; decimals and symbol
 * are metadata. Decimals drive the rounding scale of every amount denominated in this token.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Token {
    public static final int MAX_DECIMALS = 36;

    private final String address;
    private final int decimals;
    private final String symbol;

    private Token(String address, int decimals, String symbol) {
        this.address = address;
        this.decimals = decimals;
        this.symbol = symbol;
    }

    /**
     * Creates a token with normalized address.
     *
     * @param address non-blank chain address.
     * @param decimals token decimals in {@code [0, 36]}.
     * @param symbol optional display symbol.
     * @return immutable token.
     */
    public static Token of(String address, int decimals, String symbol) {
        Objects.requireNonNull(address, "address");
        if (address.isBlank()) {
            throw new IllegalArgumentException("address must be non-blank");
        }
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new IllegalArgumentException("decimals must be within [0, " + MAX_DECIMALS + "], got " + decimals);
        }
        return new Token(normalizeAddress(address), decimals, symbol);
    }

    public static Token of(String address, int decimals) {
        return of(address, decimals, null);
    }

    /**
     * Normalizes an address into its canonical identity form.
     */
    public static String normalizeAddress(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Rounds an amount down to the smallest unit of this token.
     */
    public BigDecimal floor(BigDecimal amount) {
        return amount.setScale(decimals, RoundingMode.DOWN);
    }

    /**
     * Rounds an amount up to the smallest unit of this token.
     */
    public BigDecimal ceil(BigDecimal amount) {
        return amount.setScale(decimals, RoundingMode.UP);
    }

    /**
     * Returns one smallest unit of this token.
     */
    public BigDecimal atom() {
        return BigDecimal.ONE.movePointLeft(decimals);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Token)) {
            return false;
        }
        return address.equals(((Token) other).address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return symbol == null ? address : symbol;
    }
}
