// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine.ledger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.ballast.core.model.EngineEvent;

/**
 * Undo log for one engine operation.
 *
 * <p>
 * Every ledger mutation and every external effect that succeeded records the
 * action that reverses it. If the operation fails, {@link #rollback(Throwable)}
 * replays those actions newest first, so no partial state of the operation remains
 * observable. Events are buffered and handed out only by {@link #commit()}.
 *
 * <p>
 * Not thread-safe. An operation runs to completion on one thread.
 *
 * @since 0.1.0
 */
public final class Journal {

    private static final Logger log = LoggerFactory.getLogger(Journal.class);

    private final Deque<Entry> undo = new ArrayDeque<>();
    private final List<EngineEvent> events = new ArrayList<>();
    private boolean open;

    private record Entry(String description, Runnable action) {
    }

    /**
     * Opens the journal for a new operation.
     *
     * @throws IllegalStateException if an operation is already open
     */
    public void begin() {
        if (open) {
            throw new IllegalStateException("journal already open");
        }
        open = true;
    }

    /**
     * Records how to reverse a change that has just been applied.
     *
     * @param description what the action undoes, for logs
     * @param action      the reversing action
     * @throws IllegalStateException if no operation is open
     */
    public void record(final String description, final Runnable action) {
        requireOpen();
        undo.push(new Entry(
                Objects.requireNonNull(description, "description"),
                Objects.requireNonNull(action, "action")));
    }

    /**
     * Buffers an event until the operation commits.
     *
     * @param event the event
     */
    public void emit(final EngineEvent event) {
        requireOpen();
        events.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * Closes the operation successfully, discarding the undo log.
     *
     * @return the events buffered by the operation, in emission order
     */
    public List<EngineEvent> commit() {
        requireOpen();
        final List<EngineEvent> committed = List.copyOf(events);
        reset();
        return committed;
    }

    /**
     * Reverses every recorded change, newest first, and closes the operation.
     * <p>
     * An undo action that itself fails is logged and attached to {@code cause} as
     * a suppressed exception; the remaining actions still run.
     *
     * @param cause the failure that aborted the operation
     * @return the number of undo actions executed
     */
    public int rollback(final Throwable cause) {
        requireOpen();
        int undone = 0;
        while (!undo.isEmpty()) {
            final Entry entry = undo.pop();
            try {
                entry.action().run();
            } catch (RuntimeException e) {
                log.error("Failed to undo '{}' while rolling back", entry.description(), e);
                cause.addSuppressed(e);
            }
            undone++;
        }
        reset();
        return undone;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Returns the number of undo actions recorded so far.
     *
     * @return pending undo count
     */
    public int pending() {
        return undo.size();
    }

    private void requireOpen() {
        if (!open) {
            throw new IllegalStateException("no operation in progress");
        }
    }

    private void reset() {
        undo.clear();
        events.clear();
        open = false;
    }
}
