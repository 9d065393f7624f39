// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.sim;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.ballast.core.types.Address;
import sh.ballast.engine.token.FungibleAsset;

/**
 * In-memory ERC-20 style balances and allowances shared by the simulated tokens.
 *
 * <p>
 * Collaborators handed to the engine are {@link Holder} views bound to one caller
 * identity. A {@link FailureMode} lets tests make transfers report failure either
 * by returning {@code false} or by throwing, and a transfer hook runs before every
 * transfer so tests can attempt re-entrant calls.
 *
 * @since 0.1.0
 */
public abstract class AbstractSimulatedToken {

    /**
     * How transfers report failure.
     */
    public enum FailureMode {
        /** Transfers succeed when balances and allowances allow them. */
        NONE,
        /** Every transfer returns {@code false} without moving tokens. */
        RETURN_FALSE,
        /** Every transfer throws {@link IllegalStateException} without moving tokens. */
        THROW
    }

    private final Address address;
    private final String symbol;
    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final Map<Address, Map<Address, BigInteger>> allowances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;
    private FailureMode failureMode = FailureMode.NONE;
    private @Nullable Runnable transferHook;

    protected AbstractSimulatedToken(final Address address, final String symbol) {
        this.address = Objects.requireNonNull(address, "address");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
    }

    public Address address() {
        return address;
    }

    public String symbol() {
        return symbol;
    }

    public BigInteger balanceOf(final Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    public BigInteger allowance(final Address owner, final Address spender) {
        return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, BigInteger.ZERO);
    }

    public BigInteger totalSupply() {
        return totalSupply;
    }

    public void setFailureMode(final FailureMode failureMode) {
        this.failureMode = Objects.requireNonNull(failureMode, "failureMode");
    }

    /**
     * Installs a callback that runs before every transfer, or clears it with {@code null}.
     */
    public void setTransferHook(final @Nullable Runnable transferHook) {
        this.transferHook = transferHook;
    }

    /**
     * Returns a view of this token acting as {@code caller}.
     *
     * @param caller the acting identity
     * @return the bound view
     */
    public abstract Holder boundTo(Address caller);

    protected void credit(final Address account, final BigInteger amount) {
        balances.put(account, balanceOf(account).add(amount));
        totalSupply = totalSupply.add(amount);
    }

    protected void debit(final Address account, final BigInteger amount) {
        final BigInteger held = balanceOf(account);
        if (held.compareTo(amount) < 0) {
            throw new IllegalStateException(symbol + ": insufficient balance, " + account + " holds " + held);
        }
        balances.put(account, held.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
    }

    private boolean move(final Address from, final Address to, final BigInteger amount) {
        if (transferHook != null) {
            transferHook.run();
        }
        switch (failureMode) {
            case RETURN_FALSE:
                return false;
            case THROW:
                throw new IllegalStateException(symbol + ": transfer rejected");
            default:
                break;
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(symbol + ": negative amount " + amount);
        }
        final BigInteger held = balanceOf(from);
        if (held.compareTo(amount) < 0) {
            throw new IllegalStateException(symbol + ": insufficient balance, " + from + " holds " + held
                    + ", needs " + amount);
        }
        balances.put(from, held.subtract(amount));
        balances.put(to, balanceOf(to).add(amount));
        return true;
    }

    /**
     * This token as seen by one identity.
     */
    public class Holder implements FungibleAsset {

        protected final Address caller;

        protected Holder(final Address caller) {
            this.caller = Objects.requireNonNull(caller, "caller");
        }

        public Address caller() {
            return caller;
        }

        @Override
        public Address address() {
            return address;
        }

        /**
         * Allows {@code spender} to move up to {@code amount} of the caller's tokens.
         */
        public boolean approve(final Address spender, final BigInteger amount) {
            allowances.computeIfAbsent(caller, k -> new HashMap<>()).put(spender, amount);
            return true;
        }

        @Override
        public boolean transfer(final Address to, final BigInteger amount) {
            return move(caller, to, amount);
        }

        @Override
        public boolean transferFrom(final Address from, final Address to, final BigInteger amount) {
            final BigInteger allowed = allowance(from, caller);
            if (allowed.compareTo(amount) < 0) {
                throw new IllegalStateException(symbol + ": insufficient allowance, " + caller
                        + " may spend " + allowed + " of " + from);
            }
            final boolean moved = move(from, to, amount);
            if (moved) {
                allowances.computeIfAbsent(from, k -> new HashMap<>()).put(caller, allowed.subtract(amount));
            }
            return moved;
        }

        @Override
        public BigInteger balanceOf(final Address account) {
            return AbstractSimulatedToken.this.balanceOf(account);
        }
    }
}
