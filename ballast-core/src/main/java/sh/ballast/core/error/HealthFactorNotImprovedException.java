// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.error;

import sh.ballast.core.model.HealthFactor;
import sh.ballast.core.types.Address;

/**
 * Thrown when a liquidation ran its mechanics without raising the target's health factor.
 *
 * @since 0.1.0
 */
public final class HealthFactorNotImprovedException extends BallastException {

    private final Address user;
    private final HealthFactor starting;
    private final HealthFactor ending;

    public HealthFactorNotImprovedException(
            final Address user,
            final HealthFactor starting,
            final HealthFactor ending) {
        super("Health factor not improved for " + user + ": " + starting + " -> " + ending);
        this.user = user;
        this.starting = starting;
        this.ending = ending;
    }

    public Address user() {
        return user;
    }

    public HealthFactor starting() {
        return starting;
    }

    public HealthFactor ending() {
        return ending;
    }
}
