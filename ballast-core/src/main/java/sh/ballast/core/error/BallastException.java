// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.error;

/**
 * Base runtime exception for all Ballast engine failures.
 *
 * <p>
 * This sealed class forms the root of Ballast's exception hierarchy. Every
 * failure is synchronous and terminal for the triggering call, and is raised
 * only after the engine's ledgers have been restored to their state before the
 * call began.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * BallastException
 * ├── {@link InvalidArgumentException} - zero amounts, null identities
 * ├── {@link UnsupportedAssetException} - asset without a registered price feed
 * ├── {@link ConfigurationException} - invalid construction parameters
 * ├── {@link TransferFailedException} - collateral or debt-token transfer failure
 * ├── {@link HealthFactorBrokenException} - operation would leave a position under-collateralized
 * ├── {@link HealthFactorOkException} - liquidation of a healthy position
 * ├── {@link HealthFactorNotImprovedException} - liquidation that did not help the position
 * ├── {@link StalePriceException} - oracle reading rejected
 * └── {@link ReentrantCallException} - call into the engine during an in-flight operation
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     engine.mintDebt(user, amount);
 * } catch (HealthFactorBrokenException e) {
 *     // Deposit more collateral first
 * } catch (StalePriceException e) {
 *     // Retry once the feed has updated
 * } catch (BallastException e) {
 *     // Catch-all for any other engine error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class BallastException extends RuntimeException
        permits InvalidArgumentException,
        UnsupportedAssetException,
        ConfigurationException,
        TransferFailedException,
        HealthFactorBrokenException,
        HealthFactorOkException,
        HealthFactorNotImprovedException,
        StalePriceException,
        ReentrantCallException {

    public BallastException(final String message) {
        super(message);
    }

    public BallastException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
