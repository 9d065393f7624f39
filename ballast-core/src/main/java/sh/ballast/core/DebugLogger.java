// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for engine operation, oracle and liquidation traces.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.ballast.debug");

    private DebugLogger() {
    }

    public static void logOperation(final String message, final Object... args) {
        if (!BallastDebug.isOperationLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logOracle(final String message, final Object... args) {
        if (!BallastDebug.isOracleLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Logs a liquidation trace. Printed when either liquidation or operation logging is on;
     * liquidation logging alone leaves out the per-ledger deposit, mint and burn lines.
     */
    public static void logLiquidation(final String message, final Object... args) {
        if (!BallastDebug.isLiquidationLoggingEnabled() && !BallastDebug.isOperationLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!BallastDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Direct output to stdout for colored logs in TTY environments.
     * Falls back to SLF4J for non-TTY environments.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);

        if (AnsiColors.IS_TTY) {
            System.out.println(formatted);
        } else {
            LOG.info(formatted);
        }
    }
}
