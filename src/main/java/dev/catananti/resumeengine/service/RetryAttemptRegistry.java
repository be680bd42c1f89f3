package dev.catananti.resumeengine.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Failure counts per (template, user) pair, shared by every retrying caller.
 */
public class RetryAttemptRegistry {

    private final Map<OperationKey, Integer> attempts = new ConcurrentHashMap<>();

    public int get(String templateId, String userId) {
        return attempts.getOrDefault(OperationKey.of(templateId, userId), 0);
    }

    public int increment(String templateId, String userId) {
        return attempts.merge(OperationKey.of(templateId, userId), 1, Integer::sum);
    }

    public void clear(String templateId, String userId) {
        attempts.remove(OperationKey.of(templateId, userId));
    }

    public void clearAll() {
        attempts.clear();
    }

    public Map<OperationKey, Integer> snapshot() {
        return Map.copyOf(attempts);
    }

    public record OperationKey(String templateId, String userId) {

        static OperationKey of(String templateId, String userId) {
            return new OperationKey(
                    templateId == null ? "unknown" : templateId,
                    userId == null ? "anonymous" : userId);
        }

        @Override
        public String toString() {
            return templateId + "-" + userId;
        }
    }
}
