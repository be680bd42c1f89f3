package dev.catananti.resumeengine.dto;

import java.util.Map;

/**
 * @param retryDetails attempts so far, keyed by {@code templateId-userId}
 */
public record RetryStats(int activeRetries, int maxRetries, Map<String, Integer> retryDetails) {
}
