// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core;

/**
 * Global toggle for verbose debug logging across Ballast modules.
 *
 * <p>Thread safety: the individual boolean fields are volatile. The compound check
 * in {@link #isEnabled()} is not atomic, which only matters for best-effort logging.
 */
public final class BallastDebug {

    private static volatile boolean operationLogging = false;
    private static volatile boolean oracleLogging = false;
    private static volatile boolean liquidationLogging = false;

    private BallastDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if any of operation, oracle or liquidation logging is enabled
     */
    public static boolean isEnabled() {
        return operationLogging || oracleLogging || liquidationLogging;
    }

    public static void setEnabled(final boolean enabled) {
        operationLogging = enabled;
        oracleLogging = enabled;
        liquidationLogging = enabled;
    }

    public static void setOperationLogging(final boolean enabled) {
        operationLogging = enabled;
    }

    public static boolean isOperationLoggingEnabled() {
        return operationLogging;
    }

    public static void setOracleLogging(final boolean enabled) {
        oracleLogging = enabled;
    }

    public static boolean isOracleLoggingEnabled() {
        return oracleLogging;
    }

    /**
     * Toggles the liquidation trace: one line per settled liquidation with the seized
     * amount, bonus and the target's health factor before and after.
     */
    public static void setLiquidationLogging(final boolean enabled) {
        liquidationLogging = enabled;
    }

    public static boolean isLiquidationLoggingEnabled() {
        return liquidationLogging;
    }
}
