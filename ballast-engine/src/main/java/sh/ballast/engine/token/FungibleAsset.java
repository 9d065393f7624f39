// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.token;

import java.math.BigInteger;

import sh.ballast.core.types.Address;

/**
 * A fungible asset as seen from the engine's custody account.
 *
 * <p>
 * The instance handed to the engine is bound to the custody identity: {@link #transfer}
 * moves tokens out of custody, and {@link #transferFrom} moves tokens the owner has
 * approved custody to spend. Implementations may signal failure by returning
 * {@code false} or by throwing; the engine treats both the same way.
 *
 * @since 0.1.0
 */
public interface FungibleAsset {

    /**
     * Returns the token's identity.
     *
     * @return the token address
     */
    Address address();

    /**
     * Moves {@code amount} from {@code from} to {@code to} using custody's allowance.
     *
     * @return true on success
     */
    boolean transferFrom(Address from, Address to, BigInteger amount);

    /**
     * Moves {@code amount} from custody to {@code to}.
     *
     * @return true on success
     */
    boolean transfer(Address to, BigInteger amount);

    /**
     * Returns the token balance held by {@code account}.
     *
     * @param account the holder
     * @return the balance in raw units
     */
    BigInteger balanceOf(Address account);
}
