package org.absint.dataflow.analysis;

import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Tuning knobs of the fixpoint engines.
 *
 * <p>Options can be given programmatically through {@link #builder()} or parsed from a map of
 * {@code -A}-style key/value pairs with {@link #fromOptions(Map)}:
 *
 * <ul>
 *   <li>{@code maxWidens}: how many times a node may be visited before the analysis is declared
 *       divergent (default {@value #DEFAULT_MAX_WIDENS})
 *   <li>{@code maxNarrows}: how many visits a node may have before narrowing stops early (default
 *       {@value #DEFAULT_MAX_NARROWS})
 *   <li>{@code timeoutMillis}: wall-clock budget of one run, 0 for none (default 0)
 * </ul>
 */
public final class FixpointOptions {

    /** Default for {@link #getMaxWidens()}. */
    public static final int DEFAULT_MAX_WIDENS = 10000;

    /** Default for {@link #getMaxNarrows()}. */
    public static final int DEFAULT_MAX_NARROWS = 10;

    private static final FixpointOptions DEFAULTS = builder().build();

    /** The number of widenings of a node after which the analysis diverges. */
    private final int maxWidens;

    /** The number of visits of a node after which narrowing stops. */
    private final int maxNarrows;

    /** The time budget of a run in milliseconds, or 0 for none. */
    private final long timeoutMillis;

    private FixpointOptions(Builder builder) {
        this.maxWidens = builder.maxWidens;
        this.maxNarrows = builder.maxNarrows;
        this.timeoutMillis = builder.timeoutMillis;
    }

    /** @return the default options */
    public static FixpointOptions defaults() {
        return DEFAULTS;
    }

    /** @return a builder initialized with the defaults */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse options from key/value pairs. Unknown keys are ignored so that the same map can carry
     * the options of other components.
     *
     * @param options the options
     * @return the parsed options
     * @throws IllegalArgumentException if a known key has a malformed value
     */
    public static FixpointOptions fromOptions(Map<String, String> options) {
        Builder builder = builder();
        Integer maxWidens = parseInt(options, "maxWidens");
        if (maxWidens != null) {
            builder.maxWidens(maxWidens);
        }
        Integer maxNarrows = parseInt(options, "maxNarrows");
        if (maxNarrows != null) {
            builder.maxNarrows(maxNarrows);
        }
        String timeout = options.get("timeoutMillis");
        if (timeout != null) {
            try {
                builder.timeoutMillis(Long.parseLong(timeout.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Option timeoutMillis expects a number, got: " + timeout, e);
            }
        }
        return builder.build();
    }

    /**
     * Parse an integer option. Also used by the options of other components.
     *
     * @param options the options
     * @param key the key to look up
     * @return the value, or {@code null} if absent
     */
    public static @Nullable Integer parseInt(Map<String, String> options, String key) {
        String value = options.get(key);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Option " + key + " expects an integer, got: " + value, e);
        }
    }

    /** @return the largest visit count a node may reach */
    public int getMaxWidens() {
        return maxWidens;
    }

    /** @return the visit count past which narrowing stops for a node */
    public int getMaxNarrows() {
        return maxNarrows;
    }

    /** @return the wall-clock budget of a run in milliseconds, 0 for none */
    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    /** @return a cancellation check implementing the timeout of these options */
    public CancellationCheck newCancellationCheck() {
        return timeoutMillis > 0 ? Deadline.startingNow(timeoutMillis) : CancellationCheck.NONE;
    }

    @Override
    public String toString() {
        return "FixpointOptions{maxWidens="
                + maxWidens
                + ", maxNarrows="
                + maxNarrows
                + ", timeoutMillis="
                + timeoutMillis
                + "}";
    }

    /** Builder for {@link FixpointOptions}. */
    public static final class Builder {
        private int maxWidens = DEFAULT_MAX_WIDENS;
        private int maxNarrows = DEFAULT_MAX_NARROWS;
        private long timeoutMillis = 0;

        private Builder() {}

        /**
         * @param maxWidens the largest visit count a node may reach, at least 1
         * @return this builder
         */
        public Builder maxWidens(int maxWidens) {
            if (maxWidens < 1) {
                throw new IllegalArgumentException("maxWidens must be at least 1: " + maxWidens);
            }
            this.maxWidens = maxWidens;
            return this;
        }

        /**
         * @param maxNarrows the visit count past which narrowing stops, at least 0
         * @return this builder
         */
        public Builder maxNarrows(int maxNarrows) {
            if (maxNarrows < 0) {
                throw new IllegalArgumentException(
                        "maxNarrows must not be negative: " + maxNarrows);
            }
            this.maxNarrows = maxNarrows;
            return this;
        }

        /**
         * @param timeoutMillis wall-clock budget of a run, 0 for none
         * @return this builder
         */
        public Builder timeoutMillis(long timeoutMillis) {
            if (timeoutMillis < 0) {
                throw new IllegalArgumentException(
                        "timeoutMillis must not be negative: " + timeoutMillis);
            }
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        /** @return the options */
        public FixpointOptions build() {
            return new FixpointOptions(this);
        }
    }
}
