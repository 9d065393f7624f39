// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.error;

/**
 * Thrown at construction time for mismatched asset/feed lists or duplicate registrations.
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends BallastException {

    public ConfigurationException(final String message) {
        super(message);
    }
}
