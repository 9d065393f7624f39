// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine;

import static org.junit.jupiter.api.Assertions.*;
import static sh.ballast.engine.EngineFixture.CUSTODY;
import static sh.ballast.engine.EngineFixture.address;
import static sh.ballast.engine.EngineFixture.ether;
import static sh.ballast.engine.EngineFixture.usd8;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.ballast.core.error.BallastException;
import sh.ballast.core.model.HealthFactor;
import sh.ballast.core.types.Address;
import sh.ballast.engine.sim.SimulatedToken;

/**
 * Random operation sequences against a simulated market. After every step the ledgers
 * must match custody holdings and debt-token supply, and a rejected step must leave
 * every balance untouched. Until the first price change, total collateral value must
 * also cover total debt.
 */
class SolvencyPropertyTest {

    private static final int STEPS = 400;

    private final List<Address> users = List.of(address(0xA1), address(0xA2), address(0xA3), address(0xA4));

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 2024L})
    void ledgersStayBackedByCustody(final long seed) {
        Random random = new Random(seed);
        EngineFixture market = new EngineFixture();
        StablecoinEngine engine = market.engine;
        List<SimulatedToken> collateral = List.of(market.weth, market.wbtc);

        for (Address user : users) {
            for (SimulatedToken token : collateral) {
                market.fund(user, token, ether(1_000));
            }
            market.approveDebt(user, ether(10_000_000));
        }

        int succeeded = 0;
        boolean pricesMoved = false;
        for (int step = 0; step < STEPS; step++) {
            Address user = pick(random, users);
            SimulatedToken token = pick(random, collateral);
            List<BigInteger> before = snapshot(market, collateral);
            String op = "";
            try {
                switch (random.nextInt(7)) {
                    case 0:
                        op = "deposit";
                        engine.depositCollateral(user, token.address(), amount(random, 20));
                        break;
                    case 1:
                        op = "mint";
                        engine.mintDebt(user, amount(random, 5_000));
                        assertHealthy(engine, user);
                        break;
                    case 2:
                        op = "redeem";
                        engine.redeemCollateral(user, token.address(), amount(random, 10));
                        assertHealthy(engine, user);
                        break;
                    case 3:
                        op = "burn";
                        engine.burnDebt(user, amount(random, 2_000));
                        break;
                    case 4:
                        op = "depositAndMint";
                        engine.depositCollateralAndMintDebt(user, token.address(), amount(random, 10), amount(random, 5_000));
                        assertHealthy(engine, user);
                        break;
                    case 5:
                        op = "liquidate";
                        Address target = pick(random, users);
                        HealthFactor starting = engine.healthFactor(target);
                        engine.liquidate(user, token.address(), target, amount(random, 1_000));
                        assertTrue(engine.healthFactor(target).compareTo(starting) > 0, "liquidation must improve target");
                        assertHealthy(engine, user);
                        break;
                    default:
                        op = "price";
                        pricesMoved = true;
                        long dollars = token == market.weth ? 200 + random.nextInt(2_000) : 100 + random.nextInt(1_000);
                        (token == market.weth ? market.wethFeed : market.wbtcFeed).updateAnswer(usd8(dollars));
                        break;
                }
                succeeded++;
            } catch (BallastException e) {
                assertEquals(before, snapshot(market, collateral), "rejected " + op + " changed state: " + e.getMessage());
            }
            assertBacked(market, engine, collateral);
            if (!pricesMoved) {
                assertSolvent(engine);
            }
        }
        assertTrue(succeeded > STEPS / 5, "too few operations succeeded: " + succeeded);
    }

    private void assertBacked(EngineFixture market, StablecoinEngine engine, List<SimulatedToken> collateral) {
        for (SimulatedToken token : collateral) {
            BigInteger recorded = BigInteger.ZERO;
            for (Address user : users) {
                recorded = recorded.add(engine.collateralBalanceOf(user, token.address()));
            }
            assertEquals(token.balanceOf(CUSTODY), recorded, token.symbol() + " ledger diverged from custody");
        }
        BigInteger debt = BigInteger.ZERO;
        for (Address user : users) {
            debt = debt.add(engine.debtOf(user));
        }
        assertEquals(market.stable.totalSupply(), debt, "debt ledger diverged from supply");
    }

    private void assertSolvent(StablecoinEngine engine) {
        BigInteger value = BigInteger.ZERO;
        BigInteger debt = BigInteger.ZERO;
        for (Address user : users) {
            value = value.add(engine.accountCollateralValue(user));
            debt = debt.add(engine.debtOf(user));
        }
        assertTrue(value.compareTo(debt) >= 0, "collateral value " + value + " below total debt " + debt);
    }

    private List<BigInteger> snapshot(EngineFixture market, List<SimulatedToken> collateral) {
        List<BigInteger> values = new ArrayList<>();
        for (Address user : users) {
            for (SimulatedToken token : collateral) {
                values.add(market.engine.collateralBalanceOf(user, token.address()));
                values.add(token.balanceOf(user));
            }
            values.add(market.engine.debtOf(user));
            values.add(market.stable.balanceOf(user));
        }
        values.add(market.stable.totalSupply());
        return values;
    }

    private static void assertHealthy(StablecoinEngine engine, Address user) {
        assertFalse(engine.healthFactor(user).isBelow(engine.minHealthFactor()));
    }

    private static BigInteger amount(Random random, int maxWhole) {
        return ether(1 + random.nextInt(maxWhole)).divide(BigInteger.valueOf(1 + random.nextInt(4)));
    }

    private static <T> T pick(Random random, List<T> values) {
        return values.get(random.nextInt(values.size()));
    }
}
