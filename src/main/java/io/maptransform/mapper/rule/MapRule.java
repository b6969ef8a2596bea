package io.maptransform.mapper.rule;

/**
 * One configured stream map entry, classified once when the configuration is read.
 *
 * @see RemoveRule
 * @see ProjectionRule
 * @see InvalidRule
 */
public interface MapRule {
    /**
     * The configuration key the rule was declared under.
     */
    String key();
}
