package org.background.task.engine.core.processor;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live cancellation tokens keyed by task id. A token exists from submission until the task
 * reaches a terminal state.
 */
public class CancellationTokens {

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken create(String taskId) {
        CancellationToken token = new CancellationToken(taskId);
        tokens.put(taskId, token);
        return token;
    }

    public Optional<CancellationToken> get(String taskId) {
        return Optional.ofNullable(tokens.get(taskId));
    }

    /**
     * @return {@code true} if a live token existed and this call flipped it
     */
    public boolean cancel(String taskId, String reason) {
        CancellationToken token = tokens.get(taskId);
        return token != null && token.cancel(reason);
    }

    public boolean isCancelled(String taskId) {
        CancellationToken token = tokens.get(taskId);
        return token != null && token.isCancelled();
    }

    public void release(String taskId) {
        tokens.remove(taskId);
    }

    public int size() {
        return tokens.size();
    }
}
