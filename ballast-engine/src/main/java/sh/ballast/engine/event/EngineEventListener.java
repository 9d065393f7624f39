// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.event;

import sh.ballast.core.model.EngineEvent;

/**
 * Receives events of committed engine operations.
 * <p>
 * Called after the operation has released the engine, in emission order. A listener
 * that throws is logged and does not affect the committed operation or other listeners.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EngineEventListener {

    void onEvent(EngineEvent event);
}
