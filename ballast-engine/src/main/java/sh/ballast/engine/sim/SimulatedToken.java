// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.sim;

import java.math.BigInteger;

import sh.ballast.core.types.Address;

/**
 * Collateral token with an unrestricted faucet.
 *
 * <pre>{@code
 * SimulatedToken weth = new SimulatedToken(wethAddress, "WETH");
 * weth.mint(alice, tenEther);
 * weth.boundTo(alice).approve(custody, tenEther);
 * }</pre>
 *
 * @since 0.1.0
 */
public class SimulatedToken extends AbstractSimulatedToken {

    public SimulatedToken(final Address address, final String symbol) {
        super(address, symbol);
    }

    /**
     * Creates {@code amount} tokens for {@code to}. Anyone may call this.
     */
    public void mint(final Address to, final BigInteger amount) {
        credit(to, amount);
    }

    @Override
    public Holder boundTo(final Address caller) {
        return new Holder(caller);
    }
}
