// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core;

/**
 * Curated ANSI color palette for terminal output with automatic TTY detection.
 *
 * <p>
 * Colors are disabled when not running in a TTY unless {@code FORCE_COLOR=true}
 * is set, so every constant is safe to concatenate into plain log lines.
 *
 * <h2>Color Roles</h2>
 * <ul>
 * <li><b>TEAL</b> - committed operations
 * <li><b>CORAL</b> - rejections and rollbacks
 * <li><b>INDIGO</b> - collateral movements
 * <li><b>AMBER</b> - oracle readings
 * <li><b>LAVENDER</b> - debt mint and burn
 * <li><b>SLATE</b> - metadata
 * </ul>
 *
 * @since 0.1.0
 * @see LogFormatter
 */
public final class AnsiColors {

    /** Whether output goes to an interactive terminal (or color is forced). */
    public static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code - clears all formatting */
    public static final String RESET = ansi("0");

    public static final String TEAL = ansi("38;5;44");

    public static final String CORAL = ansi("38;5;204");

    public static final String INDIGO = ansi("38;5;99");

    public static final String AMBER = ansi("38;5;214");

    public static final String SLATE = ansi("38;5;247");

    public static final String LAVENDER = ansi("38;5;183");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
