// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.error;

import java.math.BigInteger;

import sh.ballast.core.types.Address;

/**
 * Thrown when an operation receives a zero amount where a positive one is
 * required, a null identity, or an amount exceeding the recorded balance.
 *
 * @since 0.1.0
 */
public final class InvalidArgumentException extends BallastException {

    public InvalidArgumentException(final String message) {
        super(message);
    }

    /**
     * Validates that an amount is strictly positive.
     *
     * @param name   parameter name used in the message
     * @param amount the amount to check
     * @return the amount
     * @throws InvalidArgumentException if the amount is null, zero or negative
     */
    public static BigInteger requirePositive(final String name, final BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidArgumentException(name + " must be more than zero, got " + amount);
        }
        return amount;
    }

    /**
     * Validates that an identity is present and not the zero address.
     *
     * @param name    parameter name used in the message
     * @param address the identity to check
     * @return the address
     * @throws InvalidArgumentException if the address is null or zero
     */
    public static Address requireIdentity(final String name, final Address address) {
        if (address == null || address.isZero()) {
            throw new InvalidArgumentException(name + " must not be the zero address");
        }
        return address;
    }
}
