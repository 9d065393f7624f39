// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core;

import static sh.ballast.core.AnsiColors.*;

import java.math.BigDecimal;
import java.math.BigInteger;

import sh.ballast.core.model.HealthFactor;
import sh.ballast.core.model.PriceQuote;
import sh.ballast.core.types.Address;

/**
 * Log formatter for engine traces with colored, structured output.
 *
 * <p>
 * All logs use a bracketed {@code [OPERATION]} prefix, shortened addresses
 * ({@code 0x1234...5678}) and 18-decimal amounts rendered as decimals next to
 * their raw value. Status symbols (✓ ✗) mark committed and rejected operations.
 *
 * <h2>Log Types</h2>
 * <table border="1">
 * <tr>
 * <th>Method</th>
 * <th>Format</th>
 * <th>Color</th>
 * </tr>
 * <tr>
 * <td>formatCollateral</td>
 * <td>[DEPOSIT] / [REDEEM]</td>
 * <td>Indigo</td>
 * </tr>
 * <tr>
 * <td>formatDebt</td>
 * <td>[MINT] / [BURN]</td>
 * <td>Lavender</td>
 * </tr>
 * <tr>
 * <td>formatQuote</td>
 * <td>[ORACLE]</td>
 * <td>Amber</td>
 * </tr>
 * <tr>
 * <td>formatLiquidation</td>
 * <td>✓ [LIQUIDATE]</td>
 * <td>Teal</td>
 * </tr>
 * <tr>
 * <td>formatRollback</td>
 * <td>✗ [ROLLBACK]</td>
 * <td>Coral</td>
 * </tr>
 * </table>
 *
 * <p>
 * All methods are pure; the strings can be passed to any logging system.
 *
 * @since 0.1.0
 * @see AnsiColors
 * @see DebugLogger
 */
public final class LogFormatter {

    /**
     * Number of characters kept at the start of shortened addresses (includes "0x").
     */
    private static final int PREFIX_LENGTH = 6;

    /**
     * Number of characters kept at the end of shortened addresses.
     */
    private static final int SUFFIX_LENGTH = 4;

    private static final int SHORTEN_THRESHOLD = PREFIX_LENGTH + SUFFIX_LENGTH;

    private static final int AMOUNT_DECIMALS = 18;

    private LogFormatter() {
    }

    /**
     * Format: [DEPOSIT] user=0x1234...5678 token=0xabcd...ef01 amount=10 (10000000000000000000)
     */
    public static String formatCollateral(String operation, Address user, Address token, BigInteger amount) {
        return String.format(
                "%s[%s]%s user=%s token=%s amount=%s",
                INDIGO, operation, RESET,
                shorten(user), shorten(token), amount(amount));
    }

    /**
     * Format: [MINT] user=0x1234...5678 amount=1000 (1000000000000000000000)
     */
    public static String formatDebt(String operation, Address user, BigInteger amount) {
        return String.format(
                "%s[%s]%s user=%s amount=%s",
                LAVENDER, operation, RESET,
                shorten(user), amount(amount));
    }

    /**
     * Format: [ORACLE] feed=0x1234...5678 round=7 price=200000000000 decimals=8 updatedAt=1700000000
     */
    public static String formatQuote(PriceQuote quote) {
        return String.format(
                "%s[ORACLE]%s feed=%s round=%s price=%s decimals=%d updatedAt=%d",
                AMBER, RESET,
                shorten(quote.feed()),
                quote.round().roundId(),
                quote.price(),
                quote.decimals(),
                quote.round().updatedAt());
    }

    /**
     * Format: ✓ [LIQUIDATE] target=0x1234...5678 liquidator=0xabcd...ef01 covered=10 seized=0.61 hf=0.9 -> 0.94
     */
    public static String formatLiquidation(
            Address target,
            Address liquidator,
            BigInteger debtCovered,
            BigInteger collateralSeized,
            HealthFactor starting,
            HealthFactor ending) {
        return String.format(
                "%s✓%s %s[LIQUIDATE]%s target=%s liquidator=%s covered=%s seized=%s %shf=%s -> %s%s",
                TEAL, RESET,
                TEAL, RESET,
                shorten(target), shorten(liquidator),
                amount(debtCovered), amount(collateralSeized),
                SLATE, healthFactor(starting), healthFactor(ending), RESET);
    }

    /**
     * Format: ✗ [ROLLBACK] operation=mintDebt undone=2 reason=Health factor broken ...
     */
    public static String formatRollback(String operation, int undone, String reason) {
        return String.format(
                "%s✗%s %s[ROLLBACK]%s operation=%s undone=%d reason=%s%s%s",
                CORAL, RESET,
                CORAL, RESET,
                operation,
                undone,
                CORAL, reason, RESET);
    }

    /**
     * Renders a health factor as a decimal, or {@code ∞} when unconstrained.
     */
    static String healthFactor(HealthFactor factor) {
        if (factor instanceof HealthFactor.Ratio ratio) {
            return decimal(ratio.value());
        }
        return "∞";
    }

    private static String amount(BigInteger raw) {
        return decimal(raw) + " " + SLATE + "(" + raw + ")" + RESET;
    }

    private static String decimal(BigInteger raw) {
        return new BigDecimal(raw, AMOUNT_DECIMALS).stripTrailingZeros().toPlainString();
    }

    /**
     * Shortens an address to a readable format: {@code 0xabcd...ef12}.
     *
     * @param address the address to shorten
     * @return the shortened form, or "null"
     */
    static String shorten(Address address) {
        if (address == null) {
            return "null";
        }
        final String full = address.value();
        if (full.length() <= SHORTEN_THRESHOLD) {
            return full;
        }
        return full.substring(0, PREFIX_LENGTH)
                + "..."
                + full.substring(full.length() - SUFFIX_LENGTH);
    }
}
