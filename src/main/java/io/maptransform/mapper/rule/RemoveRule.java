package io.maptransform.mapper.rule;

/**
 * Drops every record of the stream named by {@link #key()}.
 */
public record RemoveRule(String key) implements MapRule {
}
