// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.error;

/**
 * Thrown when a collaborator calls back into the engine while another
 * state-mutating operation is still in progress.
 *
 * @since 0.1.0
 */
public final class ReentrantCallException extends BallastException {

    private final String operation;
    private final String inProgress;

    public ReentrantCallException(final String operation, final String inProgress) {
        super("Reentrant call to " + operation + " while " + inProgress + " is in progress");
        this.operation = operation;
        this.inProgress = inProgress;
    }

    public String operation() {
        return operation;
    }

    public String inProgress() {
        return inProgress;
    }
}
