// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.risk;

import static sh.ballast.engine.risk.RiskParameters.LIQUIDATION_PRECISION;
import static sh.ballast.engine.risk.RiskParameters.LIQUIDATION_THRESHOLD_PCT;
import static sh.ballast.engine.risk.RiskParameters.MIN_HEALTH_FACTOR;
import static sh.ballast.engine.risk.RiskParameters.PRECISION;

import java.math.BigInteger;
import java.util.Objects;

import sh.ballast.core.error.HealthFactorBrokenException;
import sh.ballast.core.error.InvalidArgumentException;
import sh.ballast.core.error.StalePriceException;
import sh.ballast.core.error.UnsupportedAssetException;
import sh.ballast.core.model.HealthFactor;
import sh.ballast.core.model.PriceQuote;
import sh.ballast.core.types.Address;
import sh.ballast.engine.feed.PriceOracleGuard;
import sh.ballast.engine.ledger.CollateralLedger;
import sh.ballast.engine.ledger.DebtLedger;
import sh.ballast.engine.registry.CollateralAsset;
import sh.ballast.engine.registry.CollateralRegistry;

/**
 * Converts ledger state and guarded oracle prices into USD values and health factors.
 *
 * <p>
 * Every valuation fetches a fresh quote through the {@link PriceOracleGuard}; nothing
 * is cached, so a stale feed fails any call that needs that asset's price.
 *
 * <p>
 * {@code healthFactor = collateralValue * 50 * 1e18 / (100 * debt)}: a position is
 * healthy only while its collateral is worth at least twice its debt.
 *
 * @since 0.1.0
 */
public final class RiskEngine {

    private final CollateralRegistry registry;
    private final PriceOracleGuard oracle;
    private final CollateralLedger collateral;
    private final DebtLedger debt;

    public RiskEngine(
            final CollateralRegistry registry,
            final PriceOracleGuard oracle,
            final CollateralLedger collateral,
            final DebtLedger debt) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.collateral = Objects.requireNonNull(collateral, "collateral");
        this.debt = Objects.requireNonNull(debt, "debt");
    }

    /**
     * Returns the USD value (18 decimals) of {@code amount} raw units of {@code token}.
     *
     * @throws InvalidArgumentException  if amount is negative
     * @throws UnsupportedAssetException if token is null, zero or not registered
     * @throws StalePriceException       if the token's feed reading is rejected
     */
    public BigInteger valuationOf(final Address token, final BigInteger amount) {
        requireNonNegative(amount);
        final BigInteger price = normalizedPrice(token);
        return amount.multiply(price).divide(PRECISION);
    }

    /**
     * Returns how many raw units of {@code token} are worth {@code usdValue}, rounding down.
     */
    public BigInteger tokenAmountForValue(final Address token, final BigInteger usdValue) {
        requireNonNegative(usdValue);
        final BigInteger price = normalizedPrice(token);
        return usdValue.multiply(PRECISION).divide(price);
    }

    /**
     * Returns the USD value of all collateral {@code user} has deposited.
     * Every registered asset is valued, held or not.
     */
    public BigInteger accountValue(final Address user) {
        BigInteger total = BigInteger.ZERO;
        for (CollateralAsset asset : registry.assets()) {
            total = total.add(valuationOf(asset.address(), collateral.balanceOf(user, asset.address())));
        }
        return total;
    }

    public HealthFactor healthFactor(final Address user) {
        return calculateHealthFactor(debt.debtOf(user), accountValue(user));
    }

    /**
     * Computes a health factor from explicit totals.
     *
     * @param totalDebt       minted debt, 18 decimals
     * @param collateralValue collateral USD value, 18 decimals
     * @return {@link HealthFactor#UNCONSTRAINED} when there is no debt, otherwise the ratio
     */
    public static HealthFactor calculateHealthFactor(final BigInteger totalDebt, final BigInteger collateralValue) {
        requireNonNegative(totalDebt);
        requireNonNegative(collateralValue);
        if (totalDebt.signum() == 0) {
            return HealthFactor.UNCONSTRAINED;
        }
        final BigInteger numerator = collateralValue.multiply(LIQUIDATION_THRESHOLD_PCT).multiply(PRECISION);
        return HealthFactor.ratio(numerator.divide(LIQUIDATION_PRECISION.multiply(totalDebt)));
    }

    /**
     * Fails if {@code user}'s health factor is below {@link RiskParameters#MIN_HEALTH_FACTOR}.
     *
     * @throws HealthFactorBrokenException carrying the current factor
     */
    public void assertHealthy(final Address user) {
        final HealthFactor factor = healthFactor(user);
        if (factor.isBelow(MIN_HEALTH_FACTOR)) {
            throw new HealthFactorBrokenException(user, factor);
        }
    }

    private BigInteger normalizedPrice(final Address token) {
        final CollateralAsset asset = registry.require(token);
        final PriceQuote quote = oracle.latestQuote(asset.feed());
        return quote.normalizedPrice();
    }

    private static void requireNonNegative(final BigInteger value) {
        if (value == null || value.signum() < 0) {
            throw new InvalidArgumentException("value must be non-negative, got " + value);
        }
    }
}
