// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.error;

import sh.ballast.core.types.Address;

/**
 * Thrown when the oracle guard rejects a price-feed reading.
 * <p>
 * Not retried internally. Callers resubmit once the feed has published a fresh round.
 *
 * @since 0.1.0
 */
public final class StalePriceException extends BallastException {

    /**
     * Why a reading was rejected.
     */
    public enum Reason {
        /** The feed has never answered ({@code updatedAt == 0}). */
        NEVER_UPDATED,
        /** The answer was carried forward from an earlier round. */
        STALE_ROUND,
        /** The reading is older than the staleness window. */
        TIMEOUT,
        /** The reading claims to be from the future relative to the engine clock. */
        FUTURE_TIMESTAMP,
        /** The reported price is zero or negative. */
        NON_POSITIVE_PRICE
    }

    private final Address feed;
    private final Reason reason;

    public StalePriceException(final Address feed, final Reason reason, final String detail) {
        super("Stale price from feed " + feed + " [" + reason + "]: " + detail);
        this.feed = feed;
        this.reason = reason;
    }

    public Address feed() {
        return feed;
    }

    public Reason reason() {
        return reason;
    }
}
