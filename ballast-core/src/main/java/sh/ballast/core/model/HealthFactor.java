// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.model;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed-point ratio (1e18 = 1.0) of risk-adjusted collateral value to debt.
 * <p>
 * A position with no debt has no meaningful ratio; it is represented by
 * {@link Unconstrained} instead of a sentinel integer, so comparisons never depend
 * on a chosen maximum value. {@code Unconstrained} orders above every {@link Ratio}.
 *
 * <pre>{@code
 * HealthFactor hf = engine.healthFactor(user);
 * if (hf instanceof HealthFactor.Ratio ratio) {
 *     System.out.println("ratio = " + ratio.value());
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed interface HealthFactor extends Comparable<HealthFactor>
        permits HealthFactor.Unconstrained, HealthFactor.Ratio {

    /** Largest value representable by a 256-bit unsigned word. */
    BigInteger UINT256_MAX = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    /** The health factor of a debt-free position. */
    HealthFactor UNCONSTRAINED = new Unconstrained();

    /**
     * Creates a ratio health factor.
     *
     * @param value fixed-point value, 1e18 = 1.0
     * @return the health factor
     */
    static HealthFactor ratio(final BigInteger value) {
        return new Ratio(value);
    }

    /**
     * Returns true if this health factor is strictly below the given fixed-point threshold.
     *
     * @param threshold fixed-point threshold
     * @return whether the factor is below the threshold
     */
    boolean isBelow(BigInteger threshold);

    /**
     * Returns the raw fixed-point number, mapping {@link Unconstrained} to {@link #UINT256_MAX}.
     *
     * @return the fixed-point value
     */
    @JsonValue
    BigInteger toFixedPoint();

    /**
     * Health factor of a position without debt.
     */
    record Unconstrained() implements HealthFactor {

        @Override
        public boolean isBelow(final BigInteger threshold) {
            return false;
        }

        @Override
        public BigInteger toFixedPoint() {
            return UINT256_MAX;
        }

        @Override
        public int compareTo(final HealthFactor other) {
            return other instanceof Unconstrained ? 0 : 1;
        }

        @Override
        public String toString() {
            return "Unconstrained";
        }
    }

    /**
     * Health factor of a position carrying debt.
     *
     * @param value fixed-point ratio, never negative
     */
    record Ratio(BigInteger value) implements HealthFactor {

        public Ratio {
            Objects.requireNonNull(value, "value");
            if (value.signum() < 0) {
                throw new IllegalArgumentException("health factor must be non-negative: " + value);
            }
        }

        @Override
        public boolean isBelow(final BigInteger threshold) {
            return value.compareTo(threshold) < 0;
        }

        @Override
        public BigInteger toFixedPoint() {
            return value;
        }

        @Override
        public int compareTo(final HealthFactor other) {
            if (other instanceof Ratio ratio) {
                return value.compareTo(ratio.value);
            }
            return -1;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }
}
