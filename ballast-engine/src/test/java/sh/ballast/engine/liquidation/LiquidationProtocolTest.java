// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.liquidation;

import static org.junit.jupiter.api.Assertions.*;
import static sh.ballast.engine.EngineFixture.ALICE;
import static sh.ballast.engine.EngineFixture.BOB;
import static sh.ballast.engine.EngineFixture.CUSTODY;
import static sh.ballast.engine.EngineFixture.ether;
import static sh.ballast.engine.EngineFixture.usd8;

import java.math.BigInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.ballast.core.error.HealthFactorBrokenException;
import sh.ballast.core.error.HealthFactorNotImprovedException;
import sh.ballast.core.error.HealthFactorOkException;
import sh.ballast.core.error.InvalidArgumentException;
import sh.ballast.core.error.TransferFailedException;
import sh.ballast.core.error.UnsupportedAssetException;
import sh.ballast.core.model.HealthFactor;
import sh.ballast.engine.EngineFixture;
import sh.ballast.engine.StablecoinEngine;
import sh.ballast.engine.sim.AbstractSimulatedToken.FailureMode;

/**
 * Liquidation scenarios driven through the engine against simulated collaborators.
 */
class LiquidationProtocolTest {

    private static final BigInteger SEIZED = new BigInteger("611111111111111110");

    private EngineFixture market;
    private StablecoinEngine engine;

    @BeforeEach
    void setUp() {
        market = new EngineFixture();
        engine = market.engine;
    }

    /** Alice: 10 WETH against 100 debt. Bob: 20 WETH against 100 debt. WETH then drops to $18. */
    private void underwaterAlice() {
        market.open(ALICE, market.weth, ether(10), ether(100));
        market.open(BOB, market.weth, ether(20), ether(100));
        market.wethFeed.updateAnswer(usd8(18));
    }

    @Test
    void liquidationPaysCollateralWithBonus() {
        underwaterAlice();
        market.approveDebt(BOB, ether(10));

        LiquidationResult result = engine.liquidate(BOB, market.weth.address(), ALICE, ether(10));

        assertEquals(SEIZED, result.collateralSeized());
        assertEquals(new BigInteger("55555555555555555"), result.bonus());
        assertEquals(HealthFactor.ratio(new BigInteger("900000000000000000")), result.startingHealthFactor());
        assertEquals(HealthFactor.ratio(new BigInteger("938888888888888889")), result.endingHealthFactor());

        assertEquals(SEIZED, market.weth.balanceOf(BOB));
        assertEquals(ether(10).subtract(SEIZED), engine.collateralBalanceOf(ALICE, market.weth.address()));
        assertEquals(ether(30).subtract(SEIZED), market.weth.balanceOf(CUSTODY));
        assertEquals(ether(90), engine.debtOf(ALICE));
        assertEquals(ether(100), engine.debtOf(BOB));
        assertEquals(ether(90), market.stable.balanceOf(BOB));
        assertEquals(ether(190), market.stable.totalSupply());
    }

    @Test
    void coveringAllDebtLeavesTargetUnconstrained() {
        underwaterAlice();
        market.approveDebt(BOB, ether(100));

        LiquidationResult result = engine.liquidate(BOB, market.weth.address(), ALICE, ether(100));

        assertEquals(HealthFactor.UNCONSTRAINED, result.endingHealthFactor());
        assertEquals(BigInteger.ZERO, engine.debtOf(ALICE));
        assertEquals(BigInteger.ZERO, market.stable.balanceOf(BOB));
    }

    @Test
    void healthyTargetCannotBeLiquidated() {
        market.open(ALICE, market.weth, ether(10), ether(100));
        market.open(BOB, market.weth, ether(20), ether(100));
        market.approveDebt(BOB, ether(10));

        HealthFactorOkException ex = assertThrows(HealthFactorOkException.class,
                () -> engine.liquidate(BOB, market.weth.address(), ALICE, ether(10)));
        assertEquals(ALICE, ex.user());
    }

    @Test
    void liquidationThatLowersHealthFactorIsRejected() {
        market.open(ALICE, market.weth, ether(10), ether(100));
        market.open(BOB, market.weth, ether(20), ether(100));
        market.wethFeed.updateAnswer(usd8(10));
        market.approveDebt(BOB, ether(10));

        HealthFactorNotImprovedException ex = assertThrows(HealthFactorNotImprovedException.class,
                () -> engine.liquidate(BOB, market.weth.address(), ALICE, ether(10)));

        assertTrue(ex.ending().compareTo(ex.starting()) < 0);
        assertEquals(ether(10), engine.collateralBalanceOf(ALICE, market.weth.address()));
        assertEquals(ether(100), engine.debtOf(ALICE));
        assertEquals(ether(100), market.stable.balanceOf(BOB));
        assertEquals(BigInteger.ZERO, market.weth.balanceOf(BOB));
    }

    @Test
    void unhealthyLiquidatorIsRejected() {
        market.open(ALICE, market.wbtc, ether(1), ether(400));
        market.open(BOB, market.weth, ether(1), ether(500));
        market.wbtcFeed.updateAnswer(usd8(700));
        market.wethFeed.updateAnswer(usd8(900));
        market.approveDebt(BOB, ether(100));

        HealthFactorBrokenException ex = assertThrows(HealthFactorBrokenException.class,
                () -> engine.liquidate(BOB, market.wbtc.address(), ALICE, ether(100)));

        assertEquals(BOB, ex.user());
        assertEquals(ether(1), engine.collateralBalanceOf(ALICE, market.wbtc.address()));
        assertEquals(ether(400), engine.debtOf(ALICE));
        assertEquals(BigInteger.ZERO, market.wbtc.balanceOf(BOB));
    }

    @Test
    void missingApprovalRollsBackSeizure() {
        underwaterAlice();

        TransferFailedException ex = assertThrows(TransferFailedException.class,
                () -> engine.liquidate(BOB, market.weth.address(), ALICE, ether(10)));

        assertEquals(market.stable.address(), ex.token());
        assertEquals(ether(10), engine.collateralBalanceOf(ALICE, market.weth.address()));
        assertEquals(ether(100), engine.debtOf(ALICE));
        assertEquals(BigInteger.ZERO, market.weth.balanceOf(BOB));
    }

    @Test
    void failedCollateralPushRestoresBurnedDebtTokens() {
        underwaterAlice();
        market.approveDebt(BOB, ether(10));
        market.weth.setFailureMode(FailureMode.RETURN_FALSE);

        assertThrows(TransferFailedException.class,
                () -> engine.liquidate(BOB, market.weth.address(), ALICE, ether(10)));

        assertEquals(ether(100), market.stable.balanceOf(BOB));
        assertEquals(ether(200), market.stable.totalSupply());
        assertEquals(BigInteger.ZERO, market.stable.balanceOf(CUSTODY));
        assertEquals(ether(10), engine.collateralBalanceOf(ALICE, market.weth.address()));
        assertEquals(ether(100), engine.debtOf(ALICE));
        assertEquals(ether(30), market.weth.balanceOf(CUSTODY));
    }

    @Test
    void coverMustNotExceedTargetDebt() {
        underwaterAlice();
        market.approveDebt(BOB, ether(101));

        assertThrows(InvalidArgumentException.class,
                () -> engine.liquidate(BOB, market.weth.address(), ALICE, ether(101)));
    }

    @Test
    void seizureMustNotExceedTargetCollateral() {
        market.open(ALICE, market.weth, ether(1), ether(1000));
        market.open(ALICE, market.wbtc, ether(10), ether(100));
        market.open(BOB, market.wbtc, ether(100), ether(1000));
        market.wethFeed.updateAnswer(usd8(100));
        market.wbtcFeed.updateAnswer(usd8(100));
        market.approveDebt(BOB, ether(500));

        assertThrows(InvalidArgumentException.class,
                () -> engine.liquidate(BOB, market.weth.address(), ALICE, ether(500)));
    }

    @Test
    void rejectsInvalidArguments() {
        underwaterAlice();

        assertThrows(InvalidArgumentException.class,
                () -> engine.liquidate(BOB, market.weth.address(), ALICE, BigInteger.ZERO));
        assertThrows(UnsupportedAssetException.class,
                () -> engine.liquidate(BOB, market.stable.address(), ALICE, ether(1)));
    }
}
