// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.registry;

import java.util.Objects;

import sh.ballast.core.types.Address;
import sh.ballast.engine.feed.PriceFeed;
import sh.ballast.engine.token.FungibleAsset;

/**
 * A supported collateral token and the price feed that values it.
 *
 * @param token the collateral token, bound to custody
 * @param feed  the token's USD price feed
 * @since 0.1.0
 */
public record CollateralAsset(FungibleAsset token, PriceFeed feed) {

    public CollateralAsset {
        Objects.requireNonNull(token, "token cannot be null");
        Objects.requireNonNull(feed, "feed cannot be null");
    }

    public Address address() {
        return token.address();
    }
}
