// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Composition of a user's position.
 *
 * @param totalDebtMinted      debt tokens minted against the position (18 decimals)
 * @param collateralValueInUsd USD value of all deposited collateral (18 decimals)
 * @since 0.1.0
 */
public record AccountInformation(BigInteger totalDebtMinted, BigInteger collateralValueInUsd) {

    public AccountInformation {
        Objects.requireNonNull(totalDebtMinted, "totalDebtMinted cannot be null");
        Objects.requireNonNull(collateralValueInUsd, "collateralValueInUsd cannot be null");
    }
}
