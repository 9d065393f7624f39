// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.error;

import sh.ballast.core.model.HealthFactor;
import sh.ballast.core.types.Address;

/**
 * Thrown when an operation would leave an account below the minimum health factor.
 * Carries the resulting factor.
 *
 * @since 0.1.0
 */
public final class HealthFactorBrokenException extends BallastException {

    private final Address user;
    private final HealthFactor healthFactor;

    public HealthFactorBrokenException(final Address user, final HealthFactor healthFactor) {
        super("Health factor broken for " + user + ": " + healthFactor);
        this.user = user;
        this.healthFactor = healthFactor;
    }

    public Address user() {
        return user;
    }

    public HealthFactor healthFactor() {
        return healthFactor;
    }
}
