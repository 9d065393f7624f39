// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.model;

import java.math.BigInteger;
import java.util.Objects;

import sh.ballast.core.types.Address;

/**
 * A guarded price reading together with the precision of the feed that produced it.
 * <p>
 * Quotes are ephemeral: they are fetched on every valuation and never cached.
 *
 * @param feed     the price feed that produced the reading
 * @param round    the raw round data
 * @param decimals the feed's decimal precision
 * @since 0.1.0
 */
public record PriceQuote(Address feed, RoundData round, int decimals) {

    /** Fixed-point precision every price is normalized to. */
    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);

    public PriceQuote {
        Objects.requireNonNull(feed, "feed cannot be null");
        Objects.requireNonNull(round, "round cannot be null");
        if (decimals < 0 || decimals > 255) {
            throw new IllegalArgumentException("decimals must fit in uint8: " + decimals);
        }
    }

    /**
     * Returns the reported price.
     *
     * @return the raw price in feed units
     */
    public BigInteger price() {
        return round.answer();
    }

    /**
     * Returns the price scaled to 18-decimal fixed point: {@code price * 1e18 / 10^decimals}.
     *
     * @return the normalized price
     */
    public BigInteger normalizedPrice() {
        return round.answer().multiply(PRECISION).divide(BigInteger.TEN.pow(decimals));
    }
}
