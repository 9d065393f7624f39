// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import sh.ballast.core.error.ConfigurationException;
import sh.ballast.core.error.InvalidArgumentException;
import sh.ballast.core.error.UnsupportedAssetException;
import sh.ballast.core.types.Address;
import sh.ballast.engine.feed.PriceFeed;
import sh.ballast.engine.token.FungibleAsset;

/**
 * Immutable set of supported collateral assets, fixed at construction.
 *
 * <p>
 * Preserves the order in which assets were supplied. There is no runtime
 * registration; every engine component shares the same instance.
 *
 * @since 0.1.0
 */
public final class CollateralRegistry {

    private final Map<Address, CollateralAsset> assets;

    private CollateralRegistry(final Map<Address, CollateralAsset> assets) {
        this.assets = Collections.unmodifiableMap(assets);
    }

    /**
     * Pairs tokens with price feeds by position.
     *
     * @param tokens collateral tokens
     * @param feeds  price feeds, {@code feeds.get(i)} values {@code tokens.get(i)}
     * @return the registry
     * @throws ConfigurationException   if the lists differ in length or a token repeats
     * @throws InvalidArgumentException if a list, token or feed is null or has the zero identity
     */
    public static CollateralRegistry of(
            final List<? extends FungibleAsset> tokens,
            final List<? extends PriceFeed> feeds) {
        if (tokens == null || feeds == null) {
            throw new InvalidArgumentException("token and price feed lists must not be null");
        }
        if (tokens.size() != feeds.size()) {
            throw new ConfigurationException("Token addresses and price feed addresses must be the same length: "
                    + tokens.size() + " != " + feeds.size());
        }

        final Map<Address, CollateralAsset> assets = new LinkedHashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            final FungibleAsset token = tokens.get(i);
            final PriceFeed feed = feeds.get(i);
            if (token == null || feed == null) {
                throw new InvalidArgumentException("collateral entry " + i + " has a null token or feed");
            }
            final Address tokenAddress = InvalidArgumentException.requireIdentity("token", token.address());
            InvalidArgumentException.requireIdentity("price feed", feed.address());
            if (assets.putIfAbsent(tokenAddress, new CollateralAsset(token, feed)) != null) {
                throw new ConfigurationException("Duplicate collateral token: " + tokenAddress);
            }
        }
        return new CollateralRegistry(assets);
    }

    /**
     * Looks up a supported asset.
     *
     * @param token the token identity
     * @return the asset
     * @throws UnsupportedAssetException if the identity is null or zero, or has no registered price feed
     */
    public CollateralAsset require(final @Nullable Address token) {
        final CollateralAsset asset = token == null || token.isZero() ? null : assets.get(token);
        if (asset == null) {
            throw new UnsupportedAssetException(token);
        }
        return asset;
    }

    public boolean isSupported(final Address token) {
        return token != null && assets.containsKey(token);
    }

    /**
     * Returns the supported token identities in registration order.
     *
     * @return immutable list of token addresses
     */
    public List<Address> tokens() {
        return List.copyOf(assets.keySet());
    }

    /**
     * Returns the supported assets in registration order.
     *
     * @return immutable list of assets
     */
    public List<CollateralAsset> assets() {
        return Collections.unmodifiableList(new ArrayList<>(assets.values()));
    }

    public int size() {
        return assets.size();
    }
}
