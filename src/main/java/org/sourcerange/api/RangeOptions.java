package org.sourcerange.api;

import com.typesafe.config.Config;

/**
 * Options for a single range computation.
 *
 * @param includeComments Whether leading comments attached to the node widen the range.
 * @param maxDepth The maximum nesting depth the engine descends before giving up.
 */
public record RangeOptions(boolean includeComments, int maxDepth) {

    /** Path of the configuration block read by {@link #fromConfig(Config)}. */
    public static final String CONFIG_PATH = "source-range";

    /** Default maximum depth, kept in sync with {@code reference.conf}. */
    public static final int DEFAULT_MAX_DEPTH = 512;

    private static final RangeOptions DEFAULTS = new RangeOptions(false, DEFAULT_MAX_DEPTH);

    public RangeOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
    }

    public static RangeOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Builds options from the {@code source-range} block of the given configuration.
     * @param config A resolved configuration, usually from {@code ConfigLoader}.
     * @return The options.
     */
    public static RangeOptions fromConfig(Config config) {
        Config block = config.getConfig(CONFIG_PATH);
        return new RangeOptions(block.getBoolean("include-comments"), block.getInt("max-depth"));
    }

    public RangeOptions withIncludeComments(boolean include) {
        return new RangeOptions(include, maxDepth);
    }

    public RangeOptions withMaxDepth(int depth) {
        return new RangeOptions(includeComments, depth);
    }
}
