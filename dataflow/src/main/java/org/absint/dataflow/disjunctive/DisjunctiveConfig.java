package org.absint.dataflow.disjunctive;

import java.util.Map;
import org.absint.dataflow.analysis.FixpointOptions;

/**
 * Configuration of a {@link DisjunctiveDomain}.
 *
 * <ul>
 *   <li>{@code disjunctLimit}: the number of disjuncts a state keeps; further disjuncts are
 *       dropped, under-approximating the state (default {@value #DEFAULT_DISJUNCT_LIMIT})
 *   <li>{@code disjunctWidenIterations}: the number of widening iterations after which widening
 *       returns the previous state unchanged (default {@value #DEFAULT_WIDEN_ITERATIONS})
 *   <li>{@code bottomWhenExhausted}: use bottom rather than top for the non-disjunctive part of
 *       a node whose disjuncts are all non-executable (default false)
 * </ul>
 */
public final class DisjunctiveConfig {

    /** Default for {@link #getDisjunctLimit()}. */
    public static final int DEFAULT_DISJUNCT_LIMIT = 20;

    /** Default for {@link #getWidenIterations()}. */
    public static final int DEFAULT_WIDEN_ITERATIONS = 3;

    /** The maximal number of disjuncts of a state. */
    private final int disjunctLimit;

    /** The number of widening iterations after which a loop head keeps its state. */
    private final int widenIterations;

    /** Whether an exhausted node gets a bottom instead of a top non-disjunctive part. */
    private final boolean bottomWhenExhausted;

    private DisjunctiveConfig(Builder builder) {
        this.disjunctLimit = builder.disjunctLimit;
        this.widenIterations = builder.widenIterations;
        this.bottomWhenExhausted = builder.bottomWhenExhausted;
    }

    /** @return the default configuration */
    public static DisjunctiveConfig defaults() {
        return builder().build();
    }

    /** @return a builder initialized with the defaults */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse a configuration from key/value pairs. Unknown keys are ignored.
     *
     * @param options the options
     * @return the parsed configuration
     * @throws IllegalArgumentException if a known key has a malformed or out-of-range value
     */
    public static DisjunctiveConfig fromOptions(Map<String, String> options) {
        Builder builder = builder();
        Integer limit = FixpointOptions.parseInt(options, "disjunctLimit");
        if (limit != null) {
            builder.disjunctLimit(limit);
        }
        Integer iterations = FixpointOptions.parseInt(options, "disjunctWidenIterations");
        if (iterations != null) {
            builder.widenIterations(iterations);
        }
        String bottom = options.get("bottomWhenExhausted");
        if (bottom != null) {
            String value = bottom.trim();
            if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
                throw new IllegalArgumentException(
                        "Option bottomWhenExhausted expects true or false, got: " + bottom);
            }
            builder.bottomWhenExhausted(Boolean.parseBoolean(value));
        }
        return builder.build();
    }

    /** @return the maximal number of disjuncts of a state */
    public int getDisjunctLimit() {
        return disjunctLimit;
    }

    /** @return the widening iteration past which widening freezes */
    public int getWidenIterations() {
        return widenIterations;
    }

    /** @return whether exhausted nodes get a bottom rather than top non-disjunctive part */
    public boolean isBottomWhenExhausted() {
        return bottomWhenExhausted;
    }

    @Override
    public String toString() {
        return "DisjunctiveConfig{disjunctLimit="
                + disjunctLimit
                + ", widenIterations="
                + widenIterations
                + ", bottomWhenExhausted="
                + bottomWhenExhausted
                + "}";
    }

    /** Builder for {@link DisjunctiveConfig}. */
    public static final class Builder {
        private int disjunctLimit = DEFAULT_DISJUNCT_LIMIT;
        private int widenIterations = DEFAULT_WIDEN_ITERATIONS;
        private boolean bottomWhenExhausted = false;

        private Builder() {}

        /**
         * @param disjunctLimit the maximal number of disjuncts, at least 1
         * @return this builder
         */
        public Builder disjunctLimit(int disjunctLimit) {
            if (disjunctLimit < 1) {
                throw new IllegalArgumentException(
                        "disjunctLimit must be at least 1: " + disjunctLimit);
            }
            this.disjunctLimit = disjunctLimit;
            return this;
        }

        /**
         * @param widenIterations the widening iteration past which widening freezes, at least 0
         * @return this builder
         */
        public Builder widenIterations(int widenIterations) {
            if (widenIterations < 0) {
                throw new IllegalArgumentException(
                        "disjunctWidenIterations must not be negative: " + widenIterations);
            }
            this.widenIterations = widenIterations;
            return this;
        }

        /**
         * @param bottomWhenExhausted whether exhausted nodes get a bottom non-disjunctive part
         * @return this builder
         */
        public Builder bottomWhenExhausted(boolean bottomWhenExhausted) {
            this.bottomWhenExhausted = bottomWhenExhausted;
            return this;
        }

        /** @return the configuration */
        public DisjunctiveConfig build() {
            return new DisjunctiveConfig(this);
        }
    }
}
