// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.liquidation;

import static sh.ballast.engine.risk.RiskParameters.LIQUIDATION_BONUS_PCT;
import static sh.ballast.engine.risk.RiskParameters.LIQUIDATION_PRECISION;
import static sh.ballast.engine.risk.RiskParameters.MIN_HEALTH_FACTOR;

import java.math.BigInteger;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.ballast.core.DebugLogger;
import sh.ballast.core.LogFormatter;
import sh.ballast.core.error.HealthFactorBrokenException;
import sh.ballast.core.error.HealthFactorNotImprovedException;
import sh.ballast.core.error.HealthFactorOkException;
import sh.ballast.core.error.InvalidArgumentException;
import sh.ballast.core.model.EngineEvent;
import sh.ballast.core.model.HealthFactor;
import sh.ballast.core.types.Address;
import sh.ballast.engine.ledger.CollateralLedger;
import sh.ballast.engine.ledger.DebtLedger;
import sh.ballast.engine.ledger.Journal;
import sh.ballast.engine.registry.CollateralRegistry;
import sh.ballast.engine.risk.RiskEngine;

/**
 * Forced partial close of an under-collateralized position.
 *
 * <p>
 * Steps, all within the caller's atomic operation:
 * <ol>
 * <li>Eligible-check: the target's health factor must be below 1.0</li>
 * <li>Convert {@code debtToCover} to collateral units and add a 10% bonus</li>
 * <li>Seize: debit the target's collateral in favor of the liquidator</li>
 * <li>Settle: reduce the target's debt, paid with the liquidator's debt tokens</li>
 * <li>Verify-improved: the target's health factor must strictly increase</li>
 * <li>Verify-liquidator-health: the liquidator must remain healthy</li>
 * </ol>
 * Ledger effects and both verifications happen before any token moves. The external
 * calls then run as: pull debt tokens from the liquidator, burn them, push the
 * seized collateral to the liquidator.
 *
 * <p>
 * When collateral value is at or below 110% of the target's debt, the bonus makes
 * every liquidation lower the target's health factor, so such positions cannot be
 * liquidated. No reduced-bonus path exists for them.
 *
 * @since 0.1.0
 */
public final class LiquidationProtocol {

    private static final Logger log = LoggerFactory.getLogger(LiquidationProtocol.class);

    private final CollateralRegistry registry;
    private final CollateralLedger collateral;
    private final DebtLedger debt;
    private final RiskEngine risk;
    private final Journal journal;

    public LiquidationProtocol(
            final CollateralRegistry registry,
            final CollateralLedger collateral,
            final DebtLedger debt,
            final RiskEngine risk,
            final Journal journal) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.collateral = Objects.requireNonNull(collateral, "collateral");
        this.debt = Objects.requireNonNull(debt, "debt");
        this.risk = Objects.requireNonNull(risk, "risk");
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    /**
     * Liquidates part of {@code target}'s position.
     *
     * @param liquidator  who pays {@code debtToCover} and receives the collateral
     * @param token       the collateral token to seize
     * @param target      the under-collateralized user
     * @param debtToCover debt to burn on the target's behalf, 18 decimals
     * @return what was seized and how the target's health factor moved
     * @throws HealthFactorOkException          if the target is not liquidatable
     * @throws HealthFactorNotImprovedException if the liquidation would not help the target
     * @throws HealthFactorBrokenException      if the liquidator would end up unhealthy
     * @throws InvalidArgumentException         if the target lacks the collateral or debt being claimed
     */
    public LiquidationResult liquidate(
            final Address liquidator,
            final Address token,
            final Address target,
            final BigInteger debtToCover) {
        InvalidArgumentException.requirePositive("debtToCover", debtToCover);
        InvalidArgumentException.requireIdentity("user", target);
        InvalidArgumentException.requireIdentity("liquidator", liquidator);
        registry.require(token);

        final HealthFactor starting = risk.healthFactor(target);
        if (!starting.isBelow(MIN_HEALTH_FACTOR)) {
            throw new HealthFactorOkException(target, starting);
        }

        final BigInteger tokenAmount = risk.tokenAmountForValue(token, debtToCover);
        final BigInteger bonus = tokenAmount.multiply(LIQUIDATION_BONUS_PCT).divide(LIQUIDATION_PRECISION);
        final BigInteger totalSeize = tokenAmount.add(bonus);

        final BigInteger held = collateral.balanceOf(target, token);
        if (held.compareTo(totalSeize) < 0) {
            throw new InvalidArgumentException("cannot seize " + totalSeize + " of " + token
                    + ", target holds " + held);
        }
        final BigInteger owed = debt.debtOf(target);
        if (owed.compareTo(debtToCover) < 0) {
            throw new InvalidArgumentException("debtToCover " + debtToCover + " exceeds target debt " + owed);
        }

        collateral.debit(target, liquidator, token, totalSeize);
        debt.decrease(target, liquidator, debtToCover);

        final HealthFactor ending = risk.healthFactor(target);
        if (ending.compareTo(starting) <= 0) {
            throw new HealthFactorNotImprovedException(target, starting, ending);
        }
        risk.assertHealthy(liquidator);

        debt.pullAndBurn(liquidator, debtToCover);
        collateral.pushTo(liquidator, token, totalSeize);

        journal.emit(new EngineEvent.PositionLiquidated(
                target, liquidator, token, debtToCover, totalSeize, starting, ending));
        log.info("Liquidated {}: covered={} seized={} of {} hf {} -> {}",
                target, debtToCover, totalSeize, token, starting, ending);
        DebugLogger.logLiquidation(LogFormatter.formatLiquidation(
                target, liquidator, debtToCover, totalSeize, starting, ending));

        return new LiquidationResult(target, liquidator, token, debtToCover, totalSeize, bonus, starting, ending);
    }
}
