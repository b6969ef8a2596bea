package io.maptransform.ion;

import java.util.Locale;

/**
 * Target types a mapped field can be cast to, with the JSON schema type each one is
 * published as in a transformed stream schema.
 */
public enum IonTypeName {
    STRING("string", null),
    INT("integer", null),
    FLOAT("number", null),
    DECIMAL("number", null),
    BOOLEAN("boolean", null),
    TIMESTAMP("string", "date-time"),
    LIST("array", null),
    STRUCT("object", null);

    private final String jsonType;
    private final String jsonFormat;

    IonTypeName(String jsonType, String jsonFormat) {
        this.jsonType = jsonType;
        this.jsonFormat = jsonFormat;
    }

    public String jsonType() {
        return jsonType;
    }

    public String jsonFormat() {
        return jsonFormat;
    }

    public static IonTypeName parse(String raw) throws CastException {
        if (raw == null || raw.isBlank()) {
            throw new CastException("Type name is required");
        }
        try {
            return IonTypeName.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CastException("Unknown type: " + raw, e);
        }
    }
}
