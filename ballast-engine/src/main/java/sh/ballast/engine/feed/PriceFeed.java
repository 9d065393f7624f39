// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.feed;

import sh.ballast.core.model.RoundData;
import sh.ballast.core.types.Address;

/**
 * Read-only view of an external price feed, one per collateral asset.
 * <p>
 * Queried on every valuation; implementations must not cache on the engine's behalf.
 *
 * @since 0.1.0
 */
public interface PriceFeed {

    /**
     * Returns the feed's identity.
     *
     * @return the feed address
     */
    Address address();

    /**
     * Returns the latest reading.
     *
     * @return round data, never null
     */
    RoundData latestRoundData();

    /**
     * Returns the number of decimals the feed's answers are expressed in.
     *
     * @return decimal precision, 0 to 255
     */
    int decimals();
}
