// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.feed;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import sh.ballast.core.DebugLogger;
import sh.ballast.core.LogFormatter;
import sh.ballast.core.error.StalePriceException;
import sh.ballast.core.error.StalePriceException.Reason;
import sh.ballast.core.model.PriceQuote;
import sh.ballast.core.model.RoundData;

/**
 * Rejects stale or inconsistent price-feed readings before any value is computed.
 *
 * <p>
 * The guard fails closed: any doubt about a reading's freshness halts the caller
 * with a {@link StalePriceException}. An asset whose feed is broken therefore makes
 * every operation that values it unavailable until the feed recovers.
 *
 * <p>
 * A reading is rejected when:
 * <ul>
 * <li>{@code updatedAt == 0} (the round never answered)</li>
 * <li>{@code answeredInRound < roundId} (an answer carried forward from an older round)</li>
 * <li>{@code updatedAt} lies after the current time</li>
 * <li>{@code now - updatedAt > timeout}; a reading exactly {@code timeout} old is accepted</li>
 * <li>the answer is zero or negative</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class PriceOracleGuard {

    /** Maximum tolerated age of a reading (3 hours). */
    public static final Duration STALE_TIMEOUT = Duration.ofHours(3);

    private final Clock clock;
    private final Duration timeout;

    public PriceOracleGuard(final Clock clock) {
        this(clock, STALE_TIMEOUT);
    }

    public PriceOracleGuard(final Clock clock, final Duration timeout) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
    }

    /**
     * Fetches a fresh reading from the feed and validates it.
     *
     * @param feed the feed to query
     * @return the validated quote
     * @throws StalePriceException if the reading is stale or inconsistent
     */
    public PriceQuote latestQuote(final PriceFeed feed) {
        Objects.requireNonNull(feed, "feed");
        final RoundData round = feed.latestRoundData();

        if (round.updatedAt() == 0) {
            throw new StalePriceException(feed.address(), Reason.NEVER_UPDATED, "round " + round.roundId() + " has no answer");
        }
        if (round.answeredInRound().compareTo(round.roundId()) < 0) {
            throw new StalePriceException(feed.address(), Reason.STALE_ROUND,
                    "answeredInRound=" + round.answeredInRound() + " < roundId=" + round.roundId());
        }

        final long now = clock.instant().getEpochSecond();
        final long age = now - round.updatedAt();
        if (age < 0) {
            throw new StalePriceException(feed.address(), Reason.FUTURE_TIMESTAMP,
                    "updatedAt=" + round.updatedAt() + " is after now=" + now);
        }
        if (age > timeout.getSeconds()) {
            throw new StalePriceException(feed.address(), Reason.TIMEOUT,
                    "age=" + age + "s exceeds timeout=" + timeout.getSeconds() + "s");
        }
        if (round.answer().signum() <= 0) {
            throw new StalePriceException(feed.address(), Reason.NON_POSITIVE_PRICE, "answer=" + round.answer());
        }

        final PriceQuote quote = new PriceQuote(feed.address(), round, feed.decimals());
        if (quote.normalizedPrice().signum() == 0) {
            throw new StalePriceException(feed.address(), Reason.NON_POSITIVE_PRICE,
                    "answer=" + round.answer() + " with decimals=" + quote.decimals() + " normalizes to zero");
        }
        DebugLogger.logOracle(LogFormatter.formatQuote(quote));
        return quote;
    }

    /**
     * Returns the staleness window this guard enforces.
     *
     * @return the timeout
     */
    public Duration timeout() {
        return timeout;
    }
}
