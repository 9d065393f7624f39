// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.ballast.core.model.HealthFactor;
import sh.ballast.core.model.PriceQuote;
import sh.ballast.core.model.RoundData;
import sh.ballast.core.types.Address;

class LogFormatterTest {

    private static final Address USER = new Address("0x1234567890abcdef1234567890abcdef12345678");

    @Test
    void shortensAddresses() {
        assertEquals("0x1234...5678", LogFormatter.shorten(USER));
        assertEquals("null", LogFormatter.shorten(null));
    }

    @Test
    void rendersAmountsAsDecimalsWithRawValue() {
        String line = LogFormatter.formatDebt("MINT", USER, new BigInteger("1500000000000000000"));

        assertTrue(line.contains("[MINT]"));
        assertTrue(line.contains("amount=1.5"));
        assertTrue(line.contains("1500000000000000000"));
    }

    @Test
    void rendersUnconstrainedHealthFactorAsInfinity() {
        assertEquals("∞", LogFormatter.healthFactor(HealthFactor.UNCONSTRAINED));
        assertEquals("0.9", LogFormatter.healthFactor(HealthFactor.ratio(new BigInteger("900000000000000000"))));
    }

    @Test
    void formatsQuote() {
        PriceQuote quote = new PriceQuote(USER,
                new RoundData(BigInteger.valueOf(7), BigInteger.valueOf(2000_00000000L), 10L, 20L, BigInteger.valueOf(7)), 8);

        String line = LogFormatter.formatQuote(quote);

        assertTrue(line.contains("[ORACLE]"));
        assertTrue(line.contains("round=7"));
        assertTrue(line.contains("decimals=8"));
        assertTrue(line.contains("updatedAt=20"));
    }

    @Test
    void formatsRollback() {
        String line = LogFormatter.formatRollback("mintDebt", 2, "Health factor broken");

        assertTrue(line.contains("[ROLLBACK]"));
        assertTrue(line.contains("operation=mintDebt"));
        assertTrue(line.contains("undone=2"));
    }
}
