// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.sim;

import java.math.BigInteger;
import java.util.Objects;

import sh.ballast.core.types.Address;
import sh.ballast.engine.token.DebtToken;

/**
 * Debt token whose mint and burn are restricted to a single owner.
 *
 * <p>
 * Hand {@code boundTo(owner)} to the engine; users interact through their own bound views.
 *
 * @since 0.1.0
 */
public final class SimulatedStableToken extends AbstractSimulatedToken {

    private final Address owner;

    public SimulatedStableToken(final Address address, final String symbol, final Address owner) {
        super(address, symbol);
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public Address owner() {
        return owner;
    }

    @Override
    public StableHolder boundTo(final Address caller) {
        return new StableHolder(caller);
    }

    /**
     * Bound view that also exposes owner-gated mint and burn.
     */
    public final class StableHolder extends Holder implements DebtToken {

        private StableHolder(final Address caller) {
            super(caller);
        }

        @Override
        public boolean mint(final Address to, final BigInteger amount) {
            requireOwner();
            if (to == null || to.isZero()) {
                throw new IllegalArgumentException(symbol() + ": cannot mint to the zero address");
            }
            requirePositive(amount);
            credit(to, amount);
            return true;
        }

        @Override
        public void burn(final BigInteger amount) {
            requireOwner();
            requirePositive(amount);
            final BigInteger held = balanceOf(caller);
            if (held.compareTo(amount) < 0) {
                throw new IllegalStateException(symbol() + ": burn amount " + amount + " exceeds balance " + held);
            }
            debit(caller, amount);
        }

        private void requireOwner() {
            if (!caller.equals(owner)) {
                throw new IllegalStateException(symbol() + ": caller " + caller + " is not the owner");
            }
        }

        private void requirePositive(final BigInteger amount) {
            if (amount == null || amount.signum() <= 0) {
                throw new IllegalArgumentException(symbol() + ": amount must be more than zero");
            }
        }
    }
}
