// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.sim;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A clock that only moves when told to.
 *
 * @since 0.1.0
 */
public final class MutableClock extends Clock {

    private Instant instant;
    private final ZoneId zone;

    public MutableClock(final Instant instant) {
        this(instant, ZoneOffset.UTC);
    }

    private MutableClock(final Instant instant, final ZoneId zone) {
        this.instant = Objects.requireNonNull(instant, "instant");
        this.zone = zone;
    }

    public void advance(final Duration duration) {
        instant = instant.plus(duration);
    }

    public void setInstant(final Instant instant) {
        this.instant = Objects.requireNonNull(instant, "instant");
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
