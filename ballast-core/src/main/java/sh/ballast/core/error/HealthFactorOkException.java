// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.error;

import sh.ballast.core.model.HealthFactor;
import sh.ballast.core.types.Address;

/**
 * Thrown when a liquidation targets a position that is not below the minimum health factor.
 *
 * @since 0.1.0
 */
public final class HealthFactorOkException extends BallastException {

    private final Address user;
    private final HealthFactor healthFactor;

    public HealthFactorOkException(final Address user, final HealthFactor healthFactor) {
        super("Health factor ok for " + user + ": " + healthFactor);
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
