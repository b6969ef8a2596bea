package io.maptransform.mapper.rule;

/**
 * A configuration entry that cannot be compiled. Registering any stream fails while it is present.
 */
public record InvalidRule(String key, String reason) implements MapRule {
}
