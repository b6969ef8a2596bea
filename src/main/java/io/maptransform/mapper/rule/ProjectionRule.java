package io.maptransform.mapper.rule;

import java.util.List;

/**
 * Field expressions applied to the records of {@link #source()}, emitted under {@link #alias()}.
 *
 * @param excludedFields         source properties dropped from the output, declared as
 *                               {@code null} or {@code "__NULL__"}
 * @param includeUnmapped        whether properties without an expression are copied through;
 *                               cleared by {@code "__else__": null}
 * @param keyProperties          replacement key properties, only meaningful when
 *                               {@code overridesKeyProperties} is set; may be {@code null}
 *                               to declare that the output has no key
 */
public record ProjectionRule(
    String key,
    String source,
    String alias,
    List<FieldMapping> fields,
    List<String> excludedFields,
    String filter,
    boolean includeUnmapped,
    boolean overridesKeyProperties,
    List<String> keyProperties
) implements MapRule {
    public ProjectionRule {
        fields = List.copyOf(fields);
        excludedFields = List.copyOf(excludedFields);
        keyProperties = keyProperties == null ? null : List.copyOf(keyProperties);
    }

    /**
     * Whether this rule is the one keyed by its own source stream, as opposed to an extra alias.
     */
    public boolean isPrimary() {
        return key.equals(source);
    }
}
