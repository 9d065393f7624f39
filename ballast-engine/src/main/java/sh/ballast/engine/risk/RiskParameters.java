// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.risk;

import java.math.BigInteger;

/**
 * Fixed risk parameters of the engine. All ratios are fixed point with 18 decimals
 * unless noted as percentages.
 *
 * @since 0.1.0
 */
public final class RiskParameters {

    /** Fixed-point unit: 1e18 = 1.0. */
    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);

    /** Share of collateral value counted toward the health factor, in percent (200% overcollateralized). */
    public static final BigInteger LIQUIDATION_THRESHOLD_PCT = BigInteger.valueOf(50);

    /** Denominator for the percentage parameters. */
    public static final BigInteger LIQUIDATION_PRECISION = BigInteger.valueOf(100);

    /** Extra collateral awarded to a liquidator, in percent of the covered amount. */
    public static final BigInteger LIQUIDATION_BONUS_PCT = BigInteger.TEN;

    /** Health factor below which a position may be liquidated: exactly 1.0. */
    public static final BigInteger MIN_HEALTH_FACTOR = PRECISION;

    private RiskParameters() {
    }
}
