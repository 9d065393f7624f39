// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.ledger;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import sh.ballast.core.DebugLogger;
import sh.ballast.core.LogFormatter;
import sh.ballast.core.error.InvalidArgumentException;
import sh.ballast.core.model.EngineEvent;
import sh.ballast.core.types.Address;
import sh.ballast.engine.token.DebtToken;
import sh.ballast.engine.token.TransferAdapter;

/**
 * Per-user minted debt (18 decimals), mirrored against the debt token's supply.
 *
 * <p>
 * Minting is always the last external effect of an operation. Burning pulls the
 * payer's tokens into custody first and then burns them; both steps record
 * compensations (return the pulled tokens, re-mint the burned ones into custody).
 *
 * @since 0.1.0
 */
public final class DebtLedger {

    private final Map<Address, BigInteger> minted = new HashMap<>();
    private final DebtToken debtToken;
    private final TransferAdapter transfers;
    private final Journal journal;

    public DebtLedger(final DebtToken debtToken, final TransferAdapter transfers, final Journal journal) {
        this.debtToken = Objects.requireNonNull(debtToken, "debtToken");
        this.transfers = Objects.requireNonNull(transfers, "transfers");
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    public BigInteger debtOf(final Address user) {
        return minted.getOrDefault(user, BigInteger.ZERO);
    }

    /**
     * Reduces {@code onBehalfOf}'s debt, paid for with {@code payer}'s tokens.
     */
    public void burnDebt(final Address onBehalfOf, final Address payer, final BigInteger amount) {
        decrease(onBehalfOf, payer, amount);
        pullAndBurn(payer, amount);
    }

    public void increase(final Address user, final BigInteger amount) {
        InvalidArgumentException.requirePositive("amount", amount);
        final BigInteger before = debtOf(user);
        minted.put(user, before.add(amount));
        journal.record("debt increase for " + user, () -> minted.put(user, before));
        journal.emit(new EngineEvent.DebtMinted(user, amount));
        DebugLogger.logOperation(LogFormatter.formatDebt("MINT", user, amount));
    }

    /**
     * Reduces recorded debt without moving tokens.
     *
     * @throws IllegalStateException if the debt would go below zero; callers validate first
     */
    public void decrease(final Address onBehalfOf, final Address payer, final BigInteger amount) {
        InvalidArgumentException.requirePositive("amount", amount);
        final BigInteger before = debtOf(onBehalfOf);
        if (before.compareTo(amount) < 0) {
            throw new IllegalStateException("debt underflow: " + onBehalfOf + " owes " + before + ", burn of " + amount);
        }
        minted.put(onBehalfOf, before.subtract(amount));
        journal.record("debt decrease for " + onBehalfOf, () -> minted.put(onBehalfOf, before));
        journal.emit(new EngineEvent.DebtBurned(onBehalfOf, payer, amount));
        DebugLogger.logOperation(LogFormatter.formatDebt("BURN", onBehalfOf, amount));
    }

    public void mint(final Address to, final BigInteger amount) {
        transfers.mint(debtToken, to, amount);
    }

    /**
     * Pulls {@code amount} debt tokens from {@code payer} into custody and burns them.
     */
    public void pullAndBurn(final Address payer, final BigInteger amount) {
        transfers.pull(debtToken, payer, amount);
        journal.record("return debt tokens to " + payer, () -> transfers.push(debtToken, payer, amount));
        transfers.burn(debtToken, amount);
        journal.record("re-mint burned debt tokens", () -> transfers.mint(debtToken, transfers.custody(), amount));
    }

    public DebtToken debtToken() {
        return debtToken;
    }
}
