// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.error;

import org.jspecify.annotations.Nullable;

import sh.ballast.core.types.Address;

/**
 * Thrown when an operation references an asset that has no registered price feed.
 *
 * @since 0.1.0
 */
public final class UnsupportedAssetException extends BallastException {

    private final @Nullable Address asset;

    public UnsupportedAssetException(final @Nullable Address asset) {
        super("Token not allowed as collateral: " + asset);
        this.asset = asset;
    }

    public @Nullable Address asset() {
        return asset;
    }
}
