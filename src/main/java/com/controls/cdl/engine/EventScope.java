package com.controls.cdl.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * The open-event stack of one execution context.
 *
 * <p>
 * Each context owns exactly one scope and nothing else touches it. A nested
 * composite runs in its own child context with its own scope, so evaluating
 * a composite can never close or corrupt an event opened by an ancestor.
 * Within one context, {@link #enterExclusive} refuses to open a step while
 * another step of the same context is still open (an implementation calling
 * back into the context that is evaluating it).
 */
final class EventScope {
    private final Deque<ExecutionEvent> open = new ArrayDeque<>();
    private final Deque<ExecutionEvent> history = new ArrayDeque<>();
    private final int historyLimit;

    EventScope(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    /** Opens an event, failing if an event of the same type is already open. */
    void enterExclusive(ExecutionEvent event) {
        for (ExecutionEvent e : open) {
            if (e.type() == event.type())
                throw new IllegalStateException(
                        "Cannot begin " + event.type() + ": a " + e.type() + " is already in progress");
        }
        enter(event);
    }

    void enter(ExecutionEvent event) {
        open.push(event);
        record(event);
    }

    /** Closes the innermost open event. */
    void exit() {
        if (open.isEmpty())
            throw new IllegalStateException("Cannot end event: no event in progress");
        open.pop();
    }

    /** Records an instantaneous event without opening it. */
    void record(ExecutionEvent event) {
        if (history.size() == historyLimit)
            history.removeFirst();
        history.addLast(event);
    }

    int depth() {
        return open.size();
    }

    List<ExecutionEvent> history() {
        return List.copyOf(history);
    }
}
