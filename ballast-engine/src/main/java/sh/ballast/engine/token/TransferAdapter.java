// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.token;

import java.math.BigInteger;
import java.util.Objects;
import java.util.function.BooleanSupplier;

import sh.ballast.core.error.BallastException;
import sh.ballast.core.error.TransferFailedException;
import sh.ballast.core.types.Address;

/**
 * Single point through which the engine calls token collaborators.
 *
 * <p>
 * Normalizes both collaborator failure conventions, a {@code false} return and a
 * thrown fault, into one {@link TransferFailedException}, so the rest of the engine
 * never branches on how a particular token reports errors. Ballast's own exceptions,
 * such as a rejected re-entrant call raised inside a collaborator callback, pass
 * through unchanged.
 *
 * @since 0.1.0
 */
public final class TransferAdapter {

    private final Address custody;

    public TransferAdapter(final Address custody) {
        this.custody = Objects.requireNonNull(custody, "custody");
    }

    /**
     * Pulls {@code amount} of {@code token} from {@code from} into custody.
     */
    public void pull(final FungibleAsset token, final Address from, final BigInteger amount) {
        invoke(token.address(), "transferFrom", () -> token.transferFrom(from, custody, amount));
    }

    /**
     * Pushes {@code amount} of {@code token} from custody to {@code to}.
     */
    public void push(final FungibleAsset token, final Address to, final BigInteger amount) {
        invoke(token.address(), "transfer", () -> token.transfer(to, amount));
    }

    public void mint(final DebtToken token, final Address to, final BigInteger amount) {
        invoke(token.address(), "mint", () -> token.mint(to, amount));
    }

    public void burn(final DebtToken token, final BigInteger amount) {
        invoke(token.address(), "burn", () -> {
            token.burn(amount);
            return true;
        });
    }

    /**
     * Returns the custody identity tokens are pulled into.
     *
     * @return the custody address
     */
    public Address custody() {
        return custody;
    }

    private static void invoke(final Address token, final String operation, final BooleanSupplier call) {
        final boolean success;
        try {
            success = call.getAsBoolean();
        } catch (BallastException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransferFailedException(token, operation, e);
        }
        if (!success) {
            throw new TransferFailedException(token, operation);
        }
    }
}
