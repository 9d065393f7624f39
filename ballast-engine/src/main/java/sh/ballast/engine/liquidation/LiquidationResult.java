// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.liquidation;

import java.math.BigInteger;
import java.util.Objects;

import sh.ballast.core.model.HealthFactor;
import sh.ballast.core.types.Address;

/**
 * Outcome of a successful liquidation.
 *
 * @param target               the liquidated user
 * @param liquidator           who paid the debt and received the collateral
 * @param token                the seized collateral token
 * @param debtCovered          debt burned on the target's behalf
 * @param collateralSeized     total collateral moved to the liquidator, bonus included
 * @param bonus                the bonus part of {@code collateralSeized}
 * @param startingHealthFactor target's factor before liquidation
 * @param endingHealthFactor   target's factor after liquidation, strictly higher
 * @since 0.1.0
 */
public record LiquidationResult(
        Address target,
        Address liquidator,
        Address token,
        BigInteger debtCovered,
        BigInteger collateralSeized,
        BigInteger bonus,
        HealthFactor startingHealthFactor,
        HealthFactor endingHealthFactor
) {

    public LiquidationResult {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(liquidator, "liquidator");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(debtCovered, "debtCovered");
        Objects.requireNonNull(collateralSeized, "collateralSeized");
        Objects.requireNonNull(bonus, "bonus");
        Objects.requireNonNull(startingHealthFactor, "startingHealthFactor");
        Objects.requireNonNull(endingHealthFactor, "endingHealthFactor");
    }
}
