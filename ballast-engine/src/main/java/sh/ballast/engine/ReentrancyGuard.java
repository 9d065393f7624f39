// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine;

import org.jspecify.annotations.Nullable;

import sh.ballast.core.error.ReentrantCallException;

/**
 * In-progress flag around the engine's state-mutating entry points.
 *
 * <p>
 * The flag is set before any collaborator is called and cleared when the returned
 * {@link Permit} is closed, so a collaborator calling back into the engine is
 * rejected. This is not a lock: the engine assumes its caller already serializes
 * operations.
 *
 * <pre>{@code
 * try (ReentrancyGuard.Permit permit = guard.enter("depositCollateral")) {
 *     ...
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ReentrancyGuard {

    private @Nullable String inProgress;

    /**
     * Marks {@code operation} as in progress.
     *
     * @param operation the entry point being entered
     * @return a permit that clears the flag when closed
     * @throws ReentrantCallException if another operation is in progress
     */
    public Permit enter(final String operation) {
        if (inProgress != null) {
            throw new ReentrantCallException(operation, inProgress);
        }
        inProgress = operation;
        return new Permit();
    }

    public boolean isEntered() {
        return inProgress != null;
    }

    /**
     * Scoped release of the in-progress flag. Closing twice is harmless.
     */
    public final class Permit implements AutoCloseable {

        private boolean released;

        private Permit() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                inProgress = null;
            }
        }
    }
}
