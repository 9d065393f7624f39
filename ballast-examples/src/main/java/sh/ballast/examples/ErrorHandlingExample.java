// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.examples;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import sh.ballast.core.error.BallastException;
import sh.ballast.core.error.HealthFactorBrokenException;
import sh.ballast.core.error.StalePriceException;
import sh.ballast.core.error.TransferFailedException;
import sh.ballast.core.types.Address;
import sh.ballast.engine.EngineOptions;
import sh.ballast.engine.StablecoinEngine;
import sh.ballast.engine.sim.MutableClock;
import sh.ballast.engine.sim.SimulatedPriceFeed;
import sh.ballast.engine.sim.SimulatedStableToken;
import sh.ballast.engine.sim.SimulatedToken;

/**
 * Demonstrates the engine's failure modes. Every rejected operation leaves the
 * ledgers exactly as they were.
 *
 * <p>Usage:
 * <pre>
 * mvn -pl ballast-examples exec:java \
 *   -Dexec.mainClass=sh.ballast.examples.ErrorHandlingExample
 * </pre>
 */
public final class ErrorHandlingExample {

    private static final BigInteger ETHER = BigInteger.TEN.pow(18);
    private static final Address CUSTODY = Addresses.of(0xC0);
    private static final Address ALICE = Addresses.of(0xA1);

    private ErrorHandlingExample() {
    }

    public static void main(String[] args) {
        final MutableClock clock = new MutableClock(Instant.now());
        final SimulatedToken weth = new SimulatedToken(Addresses.of(0x1001), "WETH");
        final SimulatedStableToken busd = new SimulatedStableToken(Addresses.of(0x2001), "BUSD", CUSTODY);
        final SimulatedPriceFeed wethUsd = new SimulatedPriceFeed(
                Addresses.of(0x3001), 8, BigInteger.valueOf(2000).multiply(BigInteger.TEN.pow(8)), clock);
        final StablecoinEngine engine = StablecoinEngine.create(
                CUSTODY, List.of(weth.boundTo(CUSTODY)), List.of(wethUsd), busd.boundTo(CUSTODY),
                EngineOptions.builder().clock(clock).build());

        weth.mint(ALICE, ETHER.multiply(BigInteger.TEN));
        weth.boundTo(ALICE).approve(CUSTODY, ETHER.multiply(BigInteger.TEN));

        System.out.println("=== Over-minting ===");
        try {
            engine.depositCollateralAndMintDebt(ALICE, weth.address(), ETHER.multiply(BigInteger.TEN),
                    ETHER.multiply(BigInteger.valueOf(15_000)));
        } catch (HealthFactorBrokenException e) {
            System.out.println("rejected: hf would be " + e.healthFactor());
            System.out.println("deposit kept? " + engine.collateralBalanceOf(ALICE, weth.address()));
        }

        System.out.println("\n=== Burning more than owed ===");
        try {
            engine.burnDebt(ALICE, ETHER);
        } catch (BallastException e) {
            System.out.println(describe(e));
        }

        System.out.println("\n=== Stale price ===");
        weth.boundTo(ALICE).approve(CUSTODY, ETHER);
        engine.depositCollateral(ALICE, weth.address(), ETHER);
        clock.advance(Duration.ofHours(4));
        try {
            engine.mintDebt(ALICE, ETHER);
        } catch (StalePriceException e) {
            System.out.println("rejected: " + e.reason() + " from feed " + e.feed());
        }

        System.out.println("\n=== Token refusing transfers ===");
        wethUsd.updateAnswer(BigInteger.valueOf(2000).multiply(BigInteger.TEN.pow(8)));
        weth.setFailureMode(SimulatedToken.FailureMode.RETURN_FALSE);
        try {
            engine.redeemCollateral(ALICE, weth.address(), ETHER);
        } catch (TransferFailedException e) {
            System.out.println("rejected: " + e.operation() + " on " + e.token());
            System.out.println("collateral still recorded: " + engine.collateralBalanceOf(ALICE, weth.address()));
        }
    }

    private static String describe(BallastException e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
