// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static sh.ballast.engine.EngineFixture.ALICE;
import static sh.ballast.engine.EngineFixture.CUSTODY;
import static sh.ballast.engine.EngineFixture.GENESIS;
import static sh.ballast.engine.EngineFixture.address;
import static sh.ballast.engine.EngineFixture.ether;
import static sh.ballast.engine.EngineFixture.usd8;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.ballast.core.error.HealthFactorBrokenException;
import sh.ballast.core.error.ReentrantCallException;
import sh.ballast.core.error.TransferFailedException;
import sh.ballast.core.types.Address;
import sh.ballast.engine.sim.MutableClock;
import sh.ballast.engine.sim.SimulatedPriceFeed;
import sh.ballast.engine.token.DebtToken;
import sh.ballast.engine.token.FungibleAsset;

/**
 * Engine behavior against collaborators that fail in each supported way.
 */
@ExtendWith(MockitoExtension.class)
class StablecoinEngineCollaboratorTest {

    private static final Address TOKEN = address(0x1001);

    @Mock
    private FungibleAsset collateralToken;

    @Mock
    private DebtToken debtToken;

    private StablecoinEngine engine;

    @BeforeEach
    void setUp() {
        lenient().when(collateralToken.address()).thenReturn(TOKEN);
        lenient().when(debtToken.address()).thenReturn(address(0x2001));
        MutableClock clock = new MutableClock(GENESIS);
        SimulatedPriceFeed feed = new SimulatedPriceFeed(address(0x3001), 8, usd8(2000), clock);
        engine = StablecoinEngine.create(
                CUSTODY, List.of(collateralToken), List.of(feed), debtToken,
                EngineOptions.builder().clock(clock).build());
    }

    @Test
    void falseFromPullAbortsDeposit() {
        when(collateralToken.transferFrom(ALICE, CUSTODY, ether(1))).thenReturn(false);

        TransferFailedException ex = assertThrows(TransferFailedException.class,
                () -> engine.depositCollateral(ALICE, TOKEN, ether(1)));

        assertEquals(TOKEN, ex.token());
        assertEquals(BigInteger.ZERO, engine.collateralBalanceOf(ALICE, TOKEN));
    }

    @Test
    void thrownPullAbortsDeposit() {
        when(collateralToken.transferFrom(any(), any(), any())).thenThrow(new IllegalStateException("paused"));

        TransferFailedException ex = assertThrows(TransferFailedException.class,
                () -> engine.depositCollateral(ALICE, TOKEN, ether(1)));

        assertEquals("paused", ex.getCause().getMessage());
        assertEquals(BigInteger.ZERO, engine.collateralBalanceOf(ALICE, TOKEN));
    }

    @Test
    void failedMintReturnsDepositedCollateral() {
        when(collateralToken.transferFrom(ALICE, CUSTODY, ether(10))).thenReturn(true);
        when(collateralToken.transfer(ALICE, ether(10))).thenReturn(true);
        when(debtToken.mint(ALICE, ether(100))).thenReturn(false);

        assertThrows(TransferFailedException.class,
                () -> engine.depositCollateralAndMintDebt(ALICE, TOKEN, ether(10), ether(100)));

        InOrder order = inOrder(collateralToken, debtToken);
        order.verify(collateralToken).transferFrom(ALICE, CUSTODY, ether(10));
        order.verify(debtToken).mint(ALICE, ether(100));
        order.verify(collateralToken).transfer(ALICE, ether(10));
        assertEquals(BigInteger.ZERO, engine.collateralBalanceOf(ALICE, TOKEN));
        assertEquals(BigInteger.ZERO, engine.debtOf(ALICE));
    }

    @Test
    void unhealthyMintNeverCallsToken() {
        when(collateralToken.transferFrom(ALICE, CUSTODY, ether(1))).thenReturn(true);
        engine.depositCollateral(ALICE, TOKEN, ether(1));

        HealthFactorBrokenException ex = assertThrows(HealthFactorBrokenException.class,
                () -> engine.mintDebt(ALICE, ether(1001)));

        assertEquals(ALICE, ex.user());
        assertEquals(BigInteger.ZERO, engine.debtOf(ALICE));
        verify(debtToken, never()).mint(any(), any());
    }

    @Test
    void reentrantCallFromTokenIsRejected() {
        when(collateralToken.transferFrom(ALICE, CUSTODY, ether(1))).thenAnswer(invocation -> {
            engine.redeemCollateral(ALICE, TOKEN, ether(1));
            return true;
        });

        ReentrantCallException ex = assertThrows(ReentrantCallException.class,
                () -> engine.depositCollateral(ALICE, TOKEN, ether(1)));

        assertEquals("redeemCollateral", ex.operation());
        assertEquals(BigInteger.ZERO, engine.collateralBalanceOf(ALICE, TOKEN));
    }

    @Test
    void redeemPushesLast() {
        when(collateralToken.transferFrom(ALICE, CUSTODY, ether(5))).thenReturn(true);
        when(collateralToken.transfer(ALICE, ether(2))).thenReturn(true);
        engine.depositCollateral(ALICE, TOKEN, ether(5));

        engine.redeemCollateral(ALICE, TOKEN, ether(2));

        verify(collateralToken).transfer(ALICE, ether(2));
        assertEquals(ether(3), engine.collateralBalanceOf(ALICE, TOKEN));
    }
}
