// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.sim;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Objects;

import sh.ballast.core.model.RoundData;
import sh.ballast.core.types.Address;
import sh.ballast.engine.feed.PriceFeed;

/**
 * Aggregator-style price feed whose rounds are set by hand.
 *
 * <p>
 * {@link #updateAnswer} opens a new round stamped with the clock's current time.
 * {@link #setRoundData} installs arbitrary round data, including inconsistent
 * rounds, for staleness tests.
 *
 * @since 0.1.0
 */
public final class SimulatedPriceFeed implements PriceFeed {

    private final Address address;
    private final int decimals;
    private final Clock clock;
    private RoundData latest;

    public SimulatedPriceFeed(final Address address, final int decimals, final BigInteger initialAnswer, final Clock clock) {
        this.address = Objects.requireNonNull(address, "address");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.decimals = decimals;
        this.latest = new RoundData(BigInteger.ZERO, BigInteger.ZERO, 0, 0, BigInteger.ZERO);
        updateAnswer(initialAnswer);
    }

    /**
     * Opens the next round with {@code answer}, timestamped now.
     */
    public void updateAnswer(final BigInteger answer) {
        final long now = clock.instant().getEpochSecond();
        updateRoundData(latest.roundId().add(BigInteger.ONE), answer, now, now);
    }

    /**
     * Opens round {@code roundId}, answered in that same round.
     */
    public void updateRoundData(final BigInteger roundId, final BigInteger answer, final long startedAt, final long updatedAt) {
        this.latest = new RoundData(roundId, answer, startedAt, updatedAt, roundId);
    }

    public void setRoundData(final RoundData round) {
        this.latest = Objects.requireNonNull(round, "round");
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public RoundData latestRoundData() {
        return latest;
    }

    @Override
    public int decimals() {
        return decimals;
    }
}
