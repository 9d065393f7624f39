// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.ledger;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import sh.ballast.core.DebugLogger;
import sh.ballast.core.LogFormatter;
import sh.ballast.core.error.InvalidArgumentException;
import sh.ballast.core.error.TransferFailedException;
import sh.ballast.core.model.EngineEvent;
import sh.ballast.core.types.Address;
import sh.ballast.engine.registry.CollateralAsset;
import sh.ballast.engine.registry.CollateralRegistry;
import sh.ballast.engine.token.TransferAdapter;

/**
 * Per-user, per-asset deposited collateral, in the asset's raw units.
 *
 * <p>
 * Balances change only through {@link #credit} and {@link #debit}, each paired by
 * the engine with a custody transfer in the same operation. Both are journaled.
 * A pull into custody records a compensating transfer back to the owner; a push
 * out of custody is always the last external effect of an operation and records
 * nothing.
 *
 * @since 0.1.0
 */
public final class CollateralLedger {

    private final Map<Address, Map<Address, BigInteger>> balances = new HashMap<>();
    private final CollateralRegistry registry;
    private final TransferAdapter transfers;
    private final Journal journal;

    public CollateralLedger(
            final CollateralRegistry registry,
            final TransferAdapter transfers,
            final Journal journal) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.transfers = Objects.requireNonNull(transfers, "transfers");
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    /**
     * Returns {@code user}'s recorded balance of {@code token}, zero if none.
     */
    public BigInteger balanceOf(final Address user, final Address token) {
        final Map<Address, BigInteger> byToken = balances.get(user);
        if (byToken == null) {
            return BigInteger.ZERO;
        }
        return byToken.getOrDefault(token, BigInteger.ZERO);
    }

    /**
     * Records a deposit and pulls the tokens into custody.
     *
     * @throws InvalidArgumentException if amount is not positive
     * @throws TransferFailedException  if the pull fails; the credit is undone on rollback
     */
    public void deposit(final Address user, final Address token, final BigInteger amount) {
        credit(user, token, amount);
        pullFrom(user, token, amount);
    }

    /**
     * Increases {@code user}'s balance without moving tokens.
     */
    public void credit(final Address user, final Address token, final BigInteger amount) {
        InvalidArgumentException.requirePositive("amount", amount);
        registry.require(token);
        final BigInteger before = balanceOf(user, token);
        set(user, token, before.add(amount));
        journal.record("credit " + token + " to " + user, () -> set(user, token, before));
        journal.emit(new EngineEvent.CollateralDeposited(user, token, amount));
        DebugLogger.logOperation(LogFormatter.formatCollateral("DEPOSIT", user, token, amount));
    }

    /**
     * Decreases {@code from}'s balance without moving tokens.
     *
     * @throws IllegalStateException if the balance would go below zero; callers validate first
     */
    public void debit(final Address from, final Address to, final Address token, final BigInteger amount) {
        InvalidArgumentException.requirePositive("amount", amount);
        registry.require(token);
        final BigInteger before = balanceOf(from, token);
        if (before.compareTo(amount) < 0) {
            throw new IllegalStateException("collateral underflow: " + from + " holds " + before + " of " + token
                    + ", debit of " + amount);
        }
        set(from, token, before.subtract(amount));
        journal.record("debit " + token + " from " + from, () -> set(from, token, before));
        journal.emit(new EngineEvent.CollateralRedeemed(from, to, token, amount));
        DebugLogger.logOperation(LogFormatter.formatCollateral("REDEEM", from, token, amount));
    }

    /**
     * Pulls tokens from {@code user} into custody and records the transfer back.
     */
    public void pullFrom(final Address user, final Address token, final BigInteger amount) {
        final CollateralAsset asset = registry.require(token);
        transfers.pull(asset.token(), user, amount);
        journal.record("return " + token + " to " + user, () -> transfers.push(asset.token(), user, amount));
    }

    /**
     * Pushes tokens from custody to {@code to}.
     */
    public void pushTo(final Address to, final Address token, final BigInteger amount) {
        final CollateralAsset asset = registry.require(token);
        transfers.push(asset.token(), to, amount);
    }

    private void set(final Address user, final Address token, final BigInteger value) {
        balances.computeIfAbsent(user, k -> new HashMap<>()).put(token, value);
    }
}
