// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.ballast.engine.event.EngineEventListener;
import sh.ballast.engine.feed.PriceOracleGuard;

/**
 * Configuration options for a {@link StablecoinEngine}.
 *
 * <p>Risk parameters are fixed constants and are not configurable here.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * var options = EngineOptions.builder()
 *     .clock(Clock.systemUTC())
 *     .staleTimeout(Duration.ofHours(3))
 *     .listener(new JsonEventLogger())
 *     .build();
 * }</pre>
 */
public final class EngineOptions {

    /** Default staleness window for price readings (3 hours). */
    public static final Duration DEFAULT_STALE_TIMEOUT = PriceOracleGuard.STALE_TIMEOUT;

    private static final EngineOptions DEFAULTS = new EngineOptions(
            Clock.systemUTC(),
            DEFAULT_STALE_TIMEOUT,
            List.of());

    private final Clock clock;
    private final Duration staleTimeout;
    private final List<EngineEventListener> listeners;

    private EngineOptions(
            final Clock clock,
            final Duration staleTimeout,
            final List<EngineEventListener> listeners) {
        this.clock = clock;
        this.staleTimeout = staleTimeout;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Returns an EngineOptions instance with all default values.
     *
     * @return default options
     */
    public static EngineOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the clock the oracle guard measures reading age against.
     *
     * @return the clock
     */
    public Clock clock() {
        return clock;
    }

    /**
     * Returns the maximum tolerated age of a price reading.
     *
     * @return the staleness window
     */
    public Duration staleTimeout() {
        return staleTimeout;
    }

    public List<EngineEventListener> listeners() {
        return listeners;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EngineOptions other)) {
            return false;
        }
        return Objects.equals(clock, other.clock)
                && Objects.equals(staleTimeout, other.staleTimeout)
                && Objects.equals(listeners, other.listeners);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clock, staleTimeout, listeners);
    }

    @Override
    public String toString() {
        return "EngineOptions{"
                + "clock=" + clock
                + ", staleTimeout=" + staleTimeout
                + ", listeners=" + listeners.size()
                + '}';
    }

    /**
     * Builder for creating EngineOptions instances.
     */
    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private Duration staleTimeout = DEFAULT_STALE_TIMEOUT;
        private final List<EngineEventListener> listeners = new ArrayList<>();

        private Builder() {
        }

        /**
         * Sets the clock used as the current time for staleness checks.
         *
         * @param clock the clock
         * @return this builder
         * @throws NullPointerException if clock is null
         */
        public Builder clock(final Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets the staleness window for price readings.
         *
         * @param staleTimeout the window (must be positive)
         * @return this builder
         * @throws NullPointerException     if staleTimeout is null
         * @throws IllegalArgumentException if staleTimeout is zero or negative
         */
        public Builder staleTimeout(final Duration staleTimeout) {
            Objects.requireNonNull(staleTimeout, "staleTimeout must not be null");
            if (staleTimeout.isNegative() || staleTimeout.isZero()) {
                throw new IllegalArgumentException("staleTimeout must be positive");
            }
            this.staleTimeout = staleTimeout;
            return this;
        }

        /**
         * Adds a listener for committed events.
         *
         * @param listener the listener
         * @return this builder
         * @throws NullPointerException if listener is null
         */
        public Builder listener(final EngineEventListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(clock, staleTimeout, listeners);
        }
    }
}
