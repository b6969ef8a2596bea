package io.maptransform.mapper.rule;

import io.maptransform.ion.IonTypeName;

public record FieldMapping(
    String targetField,
    String expression,
    IonTypeName type
) {
}
