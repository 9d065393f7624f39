// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.ballast.core.types.Address;

class PriceQuoteTest {

    private static final Address FEED = new Address("0x" + "f".repeat(40));

    private static RoundData round(long answer) {
        return new RoundData(BigInteger.ONE, BigInteger.valueOf(answer), 1L, 1L, BigInteger.ONE);
    }

    @Test
    void normalizesEightDecimalFeedTo18Decimals() {
        PriceQuote quote = new PriceQuote(FEED, round(2000_00000000L), 8);

        assertEquals(new BigInteger("2000000000000000000000"), quote.normalizedPrice());
    }

    @Test
    void normalizesEighteenDecimalFeedUnchanged() {
        BigInteger price = new BigInteger("1500000000000000000");
        PriceQuote quote = new PriceQuote(FEED, new RoundData(BigInteger.ONE, price, 1L, 1L, BigInteger.ONE), 18);

        assertEquals(price, quote.normalizedPrice());
    }

    @Test
    void normalizesZeroDecimalFeed() {
        PriceQuote quote = new PriceQuote(FEED, round(3), 0);

        assertEquals(BigInteger.valueOf(3).multiply(PriceQuote.PRECISION), quote.normalizedPrice());
    }

    @Test
    void rejectsDecimalsOutsideUint8() {
        assertThrows(IllegalArgumentException.class, () -> new PriceQuote(FEED, round(1), -1));
        assertThrows(IllegalArgumentException.class, () -> new PriceQuote(FEED, round(1), 256));
    }

    @Test
    void roundDataRequiresIdentifiers() {
        assertThrows(NullPointerException.class,
                () -> new RoundData(null, BigInteger.ONE, 0L, 0L, BigInteger.ONE));
    }
}
