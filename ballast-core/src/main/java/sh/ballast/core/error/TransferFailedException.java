// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.error;

import org.jspecify.annotations.Nullable;

import sh.ballast.core.types.Address;

/**
 * Thrown when a collateral or debt-token collaborator reports a failed transfer,
 * either by returning {@code false} or by raising its own fault (kept as the cause).
 *
 * @since 0.1.0
 */
public final class TransferFailedException extends BallastException {

    private final Address token;
    private final String operation;

    public TransferFailedException(final Address token, final String operation, final @Nullable Throwable cause) {
        super(messageFor(token, operation, cause), cause);
        this.token = token;
        this.operation = operation;
    }

    public TransferFailedException(final Address token, final String operation) {
        this(token, operation, null);
    }

    private static String messageFor(final Address token, final String operation, final @Nullable Throwable cause) {
        final String base = "Transfer failed: " + operation + " on token " + token;
        return cause != null ? base + " (" + cause.getMessage() + ")" : base;
    }

    /**
     * Returns the token whose transfer failed.
     *
     * @return the token identity
     */
    public Address token() {
        return token;
    }

    /**
     * Returns the collaborator operation that failed, e.g. {@code transferFrom} or {@code mint}.
     *
     * @return the operation name
     */
    public String operation() {
        return operation;
    }
}
