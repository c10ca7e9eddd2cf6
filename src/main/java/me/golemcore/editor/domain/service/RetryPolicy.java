package me.golemcore.editor.domain.service;

/**
 * Per-tool reliability settings: attempt timeout, attempt ceiling and
 * exponential backoff between attempts.
 */
public record RetryPolicy(long timeoutMs, int maxAttempts, long retryDelayMs, double backoffMultiplier) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(30_000, 2, 1_000, 2.0);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
    }

    /**
     * Delay to wait after the given failed attempt (1-based). Zero after the
     * final attempt.
     */
    public long delayAfterAttempt(int attempt) {
        if (attempt >= maxAttempts) {
            return 0;
        }
        return Math.round(retryDelayMs * Math.pow(backoffMultiplier, attempt - 1.0));
    }
}
