// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.token;

import java.math.BigInteger;

import sh.ballast.core.types.Address;

/**
 * The pegged debt token. Minting and burning are gated to its owner, the engine's custody account.
 *
 * @since 0.1.0
 */
public interface DebtToken extends FungibleAsset {

    /**
     * Mints {@code amount} new tokens to {@code to}.
     *
     * @return true on success
     */
    boolean mint(Address to, BigInteger amount);

    /**
     * Burns {@code amount} tokens from custody's own balance.
     */
    void burn(BigInteger amount);
}
