// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.examples;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import sh.ballast.core.BallastDebug;
import sh.ballast.core.types.Address;
import sh.ballast.engine.EngineOptions;
import sh.ballast.engine.StablecoinEngine;
import sh.ballast.engine.event.JsonEventLogger;
import sh.ballast.engine.liquidation.LiquidationResult;
import sh.ballast.engine.sim.MutableClock;
import sh.ballast.engine.sim.SimulatedPriceFeed;
import sh.ballast.engine.sim.SimulatedStableToken;
import sh.ballast.engine.sim.SimulatedToken;

/**
 * Walks a position from open to liquidation against simulated collaborators.
 *
 * <p>Usage:
 * <pre>
 * mvn -pl ballast-examples exec:java \
 *   -Dexec.mainClass=sh.ballast.examples.LiquidationExample \
 *   -Dballast.examples.debug=true
 * </pre>
 */
public final class LiquidationExample {

    private static final BigInteger ETHER = BigInteger.TEN.pow(18);

    private static final Address CUSTODY = Addresses.of(0xC0);
    private static final Address ALICE = Addresses.of(0xA1);
    private static final Address BOB = Addresses.of(0xB0);

    private LiquidationExample() {
    }

    public static void main(String[] args) {
        BallastDebug.setEnabled(Boolean.getBoolean("ballast.examples.debug"));
        BallastDebug.setLiquidationLogging(true);

        final MutableClock clock = new MutableClock(Instant.now());
        final SimulatedToken weth = new SimulatedToken(Addresses.of(0x1001), "WETH");
        final SimulatedStableToken busd = new SimulatedStableToken(Addresses.of(0x2001), "BUSD", CUSTODY);
        final SimulatedPriceFeed wethUsd = new SimulatedPriceFeed(Addresses.of(0x3001), 8, usd8(2000), clock);

        final StablecoinEngine engine = StablecoinEngine.create(
                CUSTODY,
                List.of(weth.boundTo(CUSTODY)),
                List.of(wethUsd),
                busd.boundTo(CUSTODY),
                EngineOptions.builder().clock(clock).listener(new JsonEventLogger()).build());

        System.out.println("=== Opening positions at $2000/WETH ===");
        open(engine, weth, ALICE, ether(10), ether(100));
        open(engine, weth, BOB, ether(20), ether(100));
        System.out.println("alice hf = " + engine.healthFactor(ALICE));
        System.out.println("bob   hf = " + engine.healthFactor(BOB));

        System.out.println("\n=== WETH crashes to $18 ===");
        wethUsd.updateAnswer(usd8(18));
        System.out.println("alice hf = " + engine.healthFactor(ALICE));

        System.out.println("\n=== Bob covers 10 BUSD of Alice's debt ===");
        busd.boundTo(BOB).approve(CUSTODY, ether(10));
        final LiquidationResult result = engine.liquidate(BOB, weth.address(), ALICE, ether(10));
        System.out.println("seized   = " + result.collateralSeized() + " (bonus " + result.bonus() + ")");
        System.out.println("alice hf = " + result.startingHealthFactor() + " -> " + result.endingHealthFactor());
        System.out.println("bob WETH = " + weth.balanceOf(BOB));
        System.out.println("alice    = " + engine.accountInformation(ALICE));
    }

    private static void open(
            StablecoinEngine engine, SimulatedToken token, Address user, BigInteger collateral, BigInteger debt) {
        token.mint(user, collateral);
        token.boundTo(user).approve(CUSTODY, collateral);
        engine.depositCollateralAndMintDebt(user, token.address(), collateral, debt);
    }

    private static BigInteger ether(long whole) {
        return BigInteger.valueOf(whole).multiply(ETHER);
    }

    private static BigInteger usd8(long dollars) {
        return BigInteger.valueOf(dollars).multiply(BigInteger.TEN.pow(8));
    }
}
