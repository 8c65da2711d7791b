package com.matcast.server.socket;

import java.time.Duration;

/**
 * Capped exponential backoff for broker reconnect attempts.
 *
 * delay(n) = min(initialDelay * multiplier^n, maxDelay), n = failed attempts
 * since the last success. There is no attempt limit: the bridge keeps trying
 * for the life of the process, at most once per {@code maxDelay}.
 *
 * Thread-safe.
 */
public final class BrokerReconnectPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private int attemptCount;

    private BrokerReconnectPolicy(Builder builder) {
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
    }

    public static Builder builder() {
        return new Builder();
    }

    public synchronized Duration getNextDelay() {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attemptCount);
        if (millis >= maxDelay.toMillis() || Double.isInfinite(millis)) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public synchronized void recordFailure() {
        if (attemptCount < Integer.MAX_VALUE) {
            attemptCount++;
        }
    }

    public synchronized void recordSuccess() {
        attemptCount = 0;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public static final class Builder {
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public BrokerReconnectPolicy build() {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("initialDelay must be positive");
            }
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must be >= initialDelay");
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0");
            }
            return new BrokerReconnectPolicy(this);
        }
    }
}
