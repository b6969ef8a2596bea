package io.maptransform.config;

/**
 * Record flattening settings. Stream maps carry them for the host, which does the flattening.
 *
 * @param maxDepth maximum nesting depth to flatten, {@code null} for the host's default
 */
public record FlatteningOptions(boolean enabled, Integer maxDepth) {
    private static final FlatteningOptions DISABLED = new FlatteningOptions(false, null);

    public static FlatteningOptions disabled() {
        return DISABLED;
    }
}
