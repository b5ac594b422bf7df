package app.lexora.cards.generation.service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation signal of one run plus the external calls it currently waits on. Once the run
 * starts writing cards the handle is sealed and later cancel requests are refused.
 */
public class CancellationHandle {

    private enum State { ACTIVE, CANCELLED, SEALED }

    private final AtomicReference<State> state = new AtomicReference<>(State.ACTIVE);
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public void register(Future<?> future) {
        inFlight.add(future);
        // a cancel may have raced the registration
        if (isCancelled()) {
            future.cancel(true);
        }
    }

    public void unregister(Future<?> future) {
        inFlight.remove(future);
    }

    public boolean cancel() {
        if (!state.compareAndSet(State.ACTIVE, State.CANCELLED)) {
            return false;
        }
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
        return true;
    }

    /**
     * Marks the point of no return. Returns {@code false} if the run was cancelled first.
     */
    public boolean seal() {
        return state.compareAndSet(State.ACTIVE, State.SEALED) || state.get() == State.SEALED;
    }

    public boolean isCancelled() {
        return state.get() == State.CANCELLED;
    }
}
