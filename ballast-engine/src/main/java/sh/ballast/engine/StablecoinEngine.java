// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.ballast.core.DebugLogger;
import sh.ballast.core.LogFormatter;
import sh.ballast.core.error.BallastException;
import sh.ballast.core.error.ConfigurationException;
import sh.ballast.core.error.HealthFactorBrokenException;
import sh.ballast.core.error.InvalidArgumentException;
import sh.ballast.core.error.ReentrantCallException;
import sh.ballast.core.error.TransferFailedException;
import sh.ballast.core.model.AccountInformation;
import sh.ballast.core.model.EngineEvent;
import sh.ballast.core.model.HealthFactor;
import sh.ballast.core.types.Address;
import sh.ballast.engine.event.EngineEventListener;
import sh.ballast.engine.feed.PriceFeed;
import sh.ballast.engine.feed.PriceOracleGuard;
import sh.ballast.engine.ledger.CollateralLedger;
import sh.ballast.engine.ledger.DebtLedger;
import sh.ballast.engine.ledger.Journal;
import sh.ballast.engine.liquidation.LiquidationProtocol;
import sh.ballast.engine.liquidation.LiquidationResult;
import sh.ballast.engine.registry.CollateralRegistry;
import sh.ballast.engine.risk.RiskEngine;
import sh.ballast.engine.risk.RiskParameters;
import sh.ballast.engine.token.DebtToken;
import sh.ballast.engine.token.FungibleAsset;
import sh.ballast.engine.token.TransferAdapter;

/**
 * Entry point for depositing collateral, minting and burning debt, redeeming
 * collateral and liquidating unhealthy positions.
 *
 * <p>
 * The engine exclusively owns the collateral and debt ledgers. Each mutating
 * method takes the acting account as its first argument and runs as one
 * all-or-nothing operation: checks, then ledger effects and health verification,
 * then token transfers. Any failure restores the ledgers (and reverses token
 * transfers already made) before the exception reaches the caller.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * StablecoinEngine engine = StablecoinEngine.create(
 *         custody, List.of(weth, wbtc), List.of(wethUsdFeed, wbtcUsdFeed), stableToken);
 *
 * engine.depositCollateralAndMintDebt(alice, weth.address(), tenEther, thousandUsd);
 * HealthFactor hf = engine.healthFactor(alice);
 * }</pre>
 *
 * <p>
 * Not thread-safe. Callers serialize operations; re-entrant calls made by token
 * collaborators while an operation is in progress fail with
 * {@link ReentrantCallException}.
 *
 * @since 0.1.0
 */
public final class StablecoinEngine {

    private static final Logger log = LoggerFactory.getLogger(StablecoinEngine.class);

    private final Address custody;
    private final CollateralRegistry registry;
    private final DebtToken debtToken;
    private final PriceOracleGuard oracle;
    private final CollateralLedger collateral;
    private final DebtLedger debt;
    private final RiskEngine risk;
    private final LiquidationProtocol liquidation;
    private final Journal journal;
    private final ReentrancyGuard guard = new ReentrancyGuard();
    private final List<EngineEventListener> listeners;

    private StablecoinEngine(
            final Address custody,
            final CollateralRegistry registry,
            final DebtToken debtToken,
            final EngineOptions options) {
        this.custody = custody;
        this.registry = registry;
        this.debtToken = debtToken;
        this.listeners = options.listeners();
        this.journal = new Journal();
        final TransferAdapter transfers = new TransferAdapter(custody);
        this.oracle = new PriceOracleGuard(options.clock(), options.staleTimeout());
        this.collateral = new CollateralLedger(registry, transfers, journal);
        this.debt = new DebtLedger(debtToken, transfers, journal);
        this.risk = new RiskEngine(registry, oracle, collateral, debt);
        this.liquidation = new LiquidationProtocol(registry, collateral, debt, risk, journal);
    }

    /**
     * Creates an engine with default options.
     *
     * @see #create(Address, List, List, DebtToken, EngineOptions)
     */
    public static StablecoinEngine create(
            final Address custody,
            final List<? extends FungibleAsset> collateralTokens,
            final List<? extends PriceFeed> priceFeeds,
            final DebtToken debtToken) {
        return create(custody, collateralTokens, priceFeeds, debtToken, EngineOptions.defaults());
    }

    /**
     * Creates an engine.
     *
     * @param custody          the engine's own account; token collaborators are bound to it and it owns the debt token
     * @param collateralTokens supported collateral, in order
     * @param priceFeeds       USD price feeds, {@code priceFeeds.get(i)} values {@code collateralTokens.get(i)}
     * @param debtToken        the debt token
     * @param options          clock, staleness window and listeners
     * @return the engine
     * @throws ConfigurationException   if the lists differ in length or a token repeats
     * @throws InvalidArgumentException if any identity is null or zero
     */
    public static StablecoinEngine create(
            final Address custody,
            final List<? extends FungibleAsset> collateralTokens,
            final List<? extends PriceFeed> priceFeeds,
            final DebtToken debtToken,
            final EngineOptions options) {
        InvalidArgumentException.requireIdentity("custody", custody);
        final CollateralRegistry registry = CollateralRegistry.of(collateralTokens, priceFeeds);
        if (debtToken == null) {
            throw new InvalidArgumentException("debt token must not be null");
        }
        InvalidArgumentException.requireIdentity("debt token", debtToken.address());
        Objects.requireNonNull(options, "options");
        log.info("Engine {} created with {} collateral asset(s), debt token {}",
                custody, registry.size(), debtToken.address());
        return new StablecoinEngine(custody, registry, debtToken, options);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Mutating operations
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Deposits collateral. Cannot lower the caller's health factor.
     *
     * @throws InvalidArgumentException if amount is not positive
     * @throws TransferFailedException  if the token pull fails
     */
    public void depositCollateral(final Address caller, final Address token, final BigInteger amount) {
        execute("depositCollateral", () -> {
            validate(caller, amount);
            collateral.deposit(caller, token, amount);
            return null;
        });
    }

    /**
     * Mints debt tokens to the caller.
     *
     * @throws HealthFactorBrokenException if the caller would end up below the minimum health factor
     */
    public void mintDebt(final Address caller, final BigInteger amount) {
        execute("mintDebt", () -> {
            validate(caller, amount);
            mintChecked(caller, amount);
            return null;
        });
    }

    /**
     * Deposits collateral and mints debt against it in one operation.
     */
    public void depositCollateralAndMintDebt(
            final Address caller,
            final Address token,
            final BigInteger collateralAmount,
            final BigInteger debtAmount) {
        execute("depositCollateralAndMintDebt", () -> {
            validate(caller, collateralAmount);
            InvalidArgumentException.requirePositive("debt amount", debtAmount);
            collateral.deposit(caller, token, collateralAmount);
            mintChecked(caller, debtAmount);
            return null;
        });
    }

    /**
     * Redeems collateral back to the caller.
     *
     * @throws InvalidArgumentException    if amount is not positive or exceeds the deposited balance
     * @throws HealthFactorBrokenException if the caller would end up below the minimum health factor
     */
    public void redeemCollateral(final Address caller, final Address token, final BigInteger amount) {
        execute("redeemCollateral", () -> {
            validate(caller, amount);
            redeemChecked(caller, token, amount);
            return null;
        });
    }

    /**
     * Burns the caller's debt tokens against their recorded debt. Cannot lower the caller's health factor.
     *
     * @throws InvalidArgumentException if amount is not positive or exceeds the caller's debt
     */
    public void burnDebt(final Address caller, final BigInteger amount) {
        execute("burnDebt", () -> {
            validate(caller, amount);
            burnValidated(caller, amount);
            return null;
        });
    }

    /**
     * Burns debt and then redeems collateral in one operation.
     */
    public void redeemCollateralForDebt(
            final Address caller,
            final Address token,
            final BigInteger collateralAmount,
            final BigInteger debtAmount) {
        execute("redeemCollateralForDebt", () -> {
            validate(caller, collateralAmount);
            InvalidArgumentException.requirePositive("debt amount", debtAmount);
            burnValidated(caller, debtAmount);
            redeemChecked(caller, token, collateralAmount);
            return null;
        });
    }

    /**
     * Liquidates part of an unhealthy position. See {@link LiquidationProtocol}.
     *
     * @param caller      the liquidator
     * @param token       collateral to seize
     * @param target      the unhealthy user
     * @param debtToCover debt the liquidator pays down
     * @return the liquidation outcome
     */
    public LiquidationResult liquidate(
            final Address caller,
            final Address token,
            final Address target,
            final BigInteger debtToCover) {
        return execute("liquidate", () -> liquidation.liquidate(caller, token, target, debtToCover));
    }

    private void mintChecked(final Address caller, final BigInteger amount) {
        debt.increase(caller, amount);
        risk.assertHealthy(caller);
        debt.mint(caller, amount);
    }

    private void redeemChecked(final Address caller, final Address token, final BigInteger amount) {
        final BigInteger held = collateral.balanceOf(caller, token);
        if (held.compareTo(amount) < 0) {
            registry.require(token);
            throw new InvalidArgumentException("cannot redeem " + amount + " of " + token + ", deposited " + held);
        }
        collateral.debit(caller, caller, token, amount);
        risk.assertHealthy(caller);
        collateral.pushTo(caller, token, amount);
    }

    private void burnValidated(final Address caller, final BigInteger amount) {
        final BigInteger owed = debt.debtOf(caller);
        if (owed.compareTo(amount) < 0) {
            throw new InvalidArgumentException("cannot burn " + amount + ", debt is " + owed);
        }
        debt.burnDebt(caller, caller, amount);
    }

    private static void validate(final Address caller, final BigInteger amount) {
        InvalidArgumentException.requireIdentity("caller", caller);
        InvalidArgumentException.requirePositive("amount", amount);
    }

    /**
     * Runs {@code body} as one atomic, non-reentrant operation and publishes its events on success.
     */
    private <T> T execute(final String operation, final Supplier<T> body) {
        final T result;
        final List<EngineEvent> events;
        try (ReentrancyGuard.Permit permit = guard.enter(operation)) {
            journal.begin();
            try {
                result = body.get();
                events = journal.commit();
            } catch (RuntimeException | Error e) {
                final int undone = journal.rollback(e);
                if (e instanceof BallastException) {
                    log.debug("{} rolled back {} change(s): {}", operation, undone, e.getMessage());
                } else {
                    log.warn("{} rolled back {} change(s) after unexpected failure", operation, undone, e);
                }
                DebugLogger.logOperation(LogFormatter.formatRollback(operation, undone, String.valueOf(e.getMessage())));
                throw e;
            }
        }
        publish(events);
        return result;
    }

    private void publish(final List<EngineEvent> events) {
        for (EngineEvent event : events) {
            for (EngineEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("Event listener failed for {}", event.getClass().getSimpleName(), e);
                }
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // Read-only accessors
    // ═══════════════════════════════════════════════════════════════════

    public AccountInformation accountInformation(final Address user) {
        return new AccountInformation(debt.debtOf(user), risk.accountValue(user));
    }

    public BigInteger accountCollateralValue(final Address user) {
        return risk.accountValue(user);
    }

    public BigInteger collateralBalanceOf(final Address user, final Address token) {
        return collateral.balanceOf(user, token);
    }

    public BigInteger debtOf(final Address user) {
        return debt.debtOf(user);
    }

    /**
     * Returns the health factor of {@code user}; {@link HealthFactor#UNCONSTRAINED} without debt.
     */
    public HealthFactor healthFactor(final Address user) {
        return risk.healthFactor(user);
    }

    public HealthFactor calculateHealthFactor(final BigInteger totalDebt, final BigInteger collateralValueInUsd) {
        return RiskEngine.calculateHealthFactor(totalDebt, collateralValueInUsd);
    }

    public BigInteger valuationOf(final Address token, final BigInteger amount) {
        return risk.valuationOf(token, amount);
    }

    public BigInteger tokenAmountForValue(final Address token, final BigInteger usdValue) {
        return risk.tokenAmountForValue(token, usdValue);
    }

    /**
     * Returns the supported collateral tokens in registration order.
     */
    public List<Address> collateralAssets() {
        return registry.tokens();
    }

    public boolean isSupportedCollateral(final Address token) {
        return registry.isSupported(token);
    }

    /**
     * Returns the price feed registered for {@code token}.
     *
     * @throws sh.ballast.core.error.UnsupportedAssetException if the token is not supported
     */
    public Address priceFeedOf(final Address token) {
        return registry.require(token).feed().address();
    }

    public Address debtToken() {
        return debtToken.address();
    }

    public Address custody() {
        return custody;
    }

    public Duration staleTimeout() {
        return oracle.timeout();
    }

    public BigInteger precision() {
        return RiskParameters.PRECISION;
    }

    public BigInteger minHealthFactor() {
        return RiskParameters.MIN_HEALTH_FACTOR;
    }

    public BigInteger liquidationThresholdPct() {
        return RiskParameters.LIQUIDATION_THRESHOLD_PCT;
    }

    public BigInteger liquidationBonusPct() {
        return RiskParameters.LIQUIDATION_BONUS_PCT;
    }

    public BigInteger liquidationPrecision() {
        return RiskParameters.LIQUIDATION_PRECISION;
    }
}
