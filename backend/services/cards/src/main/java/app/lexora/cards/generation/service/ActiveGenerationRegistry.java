package app.lexora.cards.generation.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs currently executing in this process, keyed by session id.
 */
@Component
public class ActiveGenerationRegistry {

    private final Map<UUID, CancellationHandle> runs = new ConcurrentHashMap<>();

    public CancellationHandle register(UUID sessionId) {
        CancellationHandle handle = new CancellationHandle();
        runs.put(sessionId, handle);
        return handle;
    }

    public void remove(UUID sessionId) {
        runs.remove(sessionId);
    }

    public boolean isActive(UUID sessionId) {
        return runs.containsKey(sessionId);
    }

    public boolean cancel(UUID sessionId) {
        CancellationHandle handle = runs.get(sessionId);
        return handle != null && handle.cancel();
    }
}
