package com.suko.lendpool;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Runtime behaviour of an {@link ObjectPool}: statistics, idle eviction and validation.
 * Instances are immutable; use {@link #toBuilder()} to derive a changed copy for
 * {@link ObjectPool#reconfigure(PoolConfig)}.
 *
 * @param <T> the type of objects to pool
 */
public final class PoolConfig<T> {

    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_MAX_IDLE_TIME = Duration.ofMinutes(30);

    private final boolean enableStats;
    private final boolean enableAutoCleanup;
    private final Duration cleanupInterval;
    private final Duration maxIdleTime;
    private final boolean validateOnAcquire;
    private final boolean validateOnRelease;
    private final Predicate<? super T> validator;
    private final Consumer<? super T> destroyer;

    private PoolConfig(Builder<T> builder) {
        this.enableStats = builder.enableStats;
        this.enableAutoCleanup = builder.enableAutoCleanup;
        this.cleanupInterval = builder.cleanupInterval;
        this.maxIdleTime = builder.maxIdleTime;
        this.validateOnAcquire = builder.validateOnAcquire;
        this.validateOnRelease = builder.validateOnRelease;
        this.validator = builder.validator;
        this.destroyer = builder.destroyer;
    }

    public boolean isEnableStats() { return enableStats; }
    public boolean isEnableAutoCleanup() { return enableAutoCleanup; }
    public Duration getCleanupInterval() { return cleanupInterval; }
    public Duration getMaxIdleTime() { return maxIdleTime; }
    public boolean isValidateOnAcquire() { return validateOnAcquire; }
    public boolean isValidateOnRelease() { return validateOnRelease; }

    /**
     * @return the validator, or {@code null} when every object is considered valid
     */
    public Predicate<? super T> getValidator() { return validator; }

    /**
     * @return the action run on objects the pool drops, or {@code null}
     */
    public Consumer<? super T> getDestroyer() { return destroyer; }

    public static <T> PoolConfig<T> defaults() {
        return new Builder<T>().build();
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public Builder<T> toBuilder() {
        Builder<T> builder = new Builder<>();
        builder.enableStats = enableStats;
        builder.enableAutoCleanup = enableAutoCleanup;
        builder.cleanupInterval = cleanupInterval;
        builder.maxIdleTime = maxIdleTime;
        builder.validateOnAcquire = validateOnAcquire;
        builder.validateOnRelease = validateOnRelease;
        builder.validator = validator;
        builder.destroyer = destroyer;
        return builder;
    }

    public static class Builder<T> {
        private boolean enableStats = true;
        private boolean enableAutoCleanup = false;
        private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
        private Duration maxIdleTime = DEFAULT_MAX_IDLE_TIME;
        private boolean validateOnAcquire = false;
        private boolean validateOnRelease = true;
        private Predicate<? super T> validator;
        private Consumer<? super T> destroyer;

        private Builder() {}

        public Builder<T> enableStats(boolean enableStats) {
            this.enableStats = enableStats;
            return this;
        }

        public Builder<T> enableAutoCleanup(boolean enableAutoCleanup) {
            this.enableAutoCleanup = enableAutoCleanup;
            return this;
        }

        public Builder<T> cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = requireNonNegative(cleanupInterval, "cleanupInterval");
            return this;
        }

        public Builder<T> maxIdleTime(Duration maxIdleTime) {
            this.maxIdleTime = requireNonNegative(maxIdleTime, "maxIdleTime");
            return this;
        }

        public Builder<T> validateOnAcquire(boolean validateOnAcquire) {
            this.validateOnAcquire = validateOnAcquire;
            return this;
        }

        public Builder<T> validateOnRelease(boolean validateOnRelease) {
            this.validateOnRelease = validateOnRelease;
            return this;
        }

        public Builder<T> validator(Predicate<? super T> validator) {
            this.validator = validator;
            return this;
        }

        public Builder<T> destroyer(Consumer<? super T> destroyer) {
            this.destroyer = destroyer;
            return this;
        }

        public PoolConfig<T> build() {
            return new PoolConfig<>(this);
        }

        private static Duration requireNonNegative(Duration duration, String name) {
            if (duration == null) throw new IllegalArgumentException(name + " cannot be null");
            if (duration.isNegative()) throw new IllegalArgumentException(name + " must be >= 0");
            return duration;
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "enableStats=" + enableStats +
                ", enableAutoCleanup=" + enableAutoCleanup +
                ", cleanupInterval=" + cleanupInterval +
                ", maxIdleTime=" + maxIdleTime +
                ", validateOnAcquire=" + validateOnAcquire +
                ", validateOnRelease=" + validateOnRelease +
                ", validator=" + (validator != null) +
                ", destroyer=" + (destroyer != null) +
                '}';
    }
}
