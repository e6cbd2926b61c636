package io.trading.rofex.client.stream;

import io.trading.rofex.client.config.SessionConfig;

/**
 * Exponential backoff for the reconnection attempts after one connection loss.
 * Not thread-safe: owned by the session's worker thread.
 */
public class ReconnectPolicy {

    private final int maxRetries;
    private final long maxDelayMs;
    private final double multiplier;

    private int retryCount = 0;
    private long currentDelay;

    public ReconnectPolicy(SessionConfig config) {
        this(config.reconnectMaxRetries(), config.reconnectInitialDelayMs(),
            config.reconnectMaxDelayMs(), config.backoffMultiplier());
    }

    /**
     * @param maxRetries     Maximum number of attempts (-1 for unlimited)
     * @param initialDelayMs Delay before the first attempt
     * @param maxDelayMs     Upper bound of the delay
     * @param multiplier     Factor applied after each attempt
     */
    public ReconnectPolicy(int maxRetries, long initialDelayMs, long maxDelayMs, double multiplier) {
        this.maxRetries = maxRetries;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.currentDelay = initialDelayMs;
    }

    public boolean hasAttemptsLeft() {
        return maxRetries < 0 || retryCount < maxRetries;
    }

    /**
     * Counts an attempt and returns how long to wait before making it.
     *
     * @throws IllegalStateException if no attempts are left
     */
    public long nextDelayMs() {
        if (!hasAttemptsLeft()) {
            throw new IllegalStateException("Max reconnect retries (" + maxRetries + ") reached");
        }
        retryCount++;
        long delay = currentDelay;
        currentDelay = Math.min((long) (currentDelay * multiplier), maxDelayMs);
        return delay;
    }

    public int getRetryCount() {
        return retryCount;
    }
}
