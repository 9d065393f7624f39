// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.event;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.ballast.core.model.EngineEvent;

/**
 * Writes each committed event as one JSON line to the {@code sh.ballast.events} logger.
 *
 * <pre>{@code
 * {"event":"CollateralDeposited","user":"0x...","token":"0x...","amount":10000000000000000000}
 * }</pre>
 *
 * @since 0.1.0
 */
public final class JsonEventLogger implements EngineEventListener {

    /** Logger name events are written to. */
    public static final String LOGGER_NAME = "sh.ballast.events";

    private static final Logger log = LoggerFactory.getLogger(JsonEventLogger.class);

    private final Logger events;
    private final ObjectMapper mapper;

    public JsonEventLogger() {
        this(new ObjectMapper());
    }

    public JsonEventLogger(final ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.events = LoggerFactory.getLogger(LOGGER_NAME);
    }

    @Override
    public void onEvent(final EngineEvent event) {
        if (!events.isInfoEnabled()) {
            return;
        }
        try {
            events.info(mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} event", event.getClass().getSimpleName(), e);
        }
    }
}
