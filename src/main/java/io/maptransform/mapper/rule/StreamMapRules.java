package io.maptransform.mapper.rule;

import io.maptransform.ion.CastException;
import io.maptransform.ion.IonTypeName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered stream map rules. Declaration order decides which projections are appended first when
 * several rules read the same source stream.
 */
public final class StreamMapRules {
    public static final String ELSE_OPTION = "__else__";
    public static final String FILTER_OPTION = "__filter__";
    public static final String SOURCE_OPTION = "__source__";
    public static final String ALIAS_OPTION = "__alias__";
    public static final String KEY_PROPERTIES_OPTION = "__key_properties__";
    public static final String NULL_STRING = "__NULL__";

    private static final Set<String> RESERVED_OPTIONS = Set.of(
        ELSE_OPTION, FILTER_OPTION, SOURCE_OPTION, ALIAS_OPTION, KEY_PROPERTIES_OPTION
    );

    private static final StreamMapRules EMPTY = new StreamMapRules(List.of(), false);

    private final List<MapRule> rules;
    private final boolean removeUnmappedStreams;

    private StreamMapRules(List<MapRule> rules, boolean removeUnmappedStreams) {
        this.rules = rules;
        this.removeUnmappedStreams = removeUnmappedStreams;
    }

    public static StreamMapRules empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads rules from a map whose iteration order is the declaration order, such as a
     * {@link java.util.LinkedHashMap}.
     */
    public static StreamMapRules fromMap(Map<String, ?> streamMaps) {
        Builder builder = builder();
        if (streamMaps != null) {
            streamMaps.forEach(builder::rule);
        }
        return builder.build();
    }

    public List<MapRule> rules() {
        return rules;
    }

    /**
     * True when the top-level {@code __else__} option removes every stream without its own rule.
     */
    public boolean removeUnmappedStreams() {
        return removeUnmappedStreams;
    }

    static boolean isNullMarker(Object value) {
        return value == null || NULL_STRING.equals(value);
    }

    static MapRule parse(String key, Object definition) {
        if (isNullMarker(definition)) {
            return new RemoveRule(key);
        }
        if (definition instanceof String) {
            return new InvalidRule(key, "Option '" + key + ":" + definition + "' is not expected.");
        }
        if (!(definition instanceof Map<?, ?> body)) {
            return new InvalidRule(key, "Unexpected stream definition type. Expected str, dict, or None. Got '"
                + definition.getClass().getSimpleName() + "'.");
        }

        String source = key;
        String alias = key;
        String filter = null;
        boolean includeUnmapped = true;
        boolean overridesKeyProperties = false;
        List<String> keyProperties = null;
        List<FieldMapping> fields = new ArrayList<>();
        List<String> excludedFields = new ArrayList<>();

        for (Map.Entry<?, ?> entry : body.entrySet()) {
            String option = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (option) {
                case SOURCE_OPTION, ALIAS_OPTION -> {
                    if (!(value instanceof String name) || name.isBlank()) {
                        return new InvalidRule(key, "Option '" + option + "' of '" + key + "' must be a stream name, got '" + value + "'.");
                    }
                    if (SOURCE_OPTION.equals(option)) {
                        source = name;
                    } else {
                        alias = name;
                    }
                }
                case FILTER_OPTION -> {
                    if (value != null && !(value instanceof String)) {
                        return new InvalidRule(key, "Option '" + FILTER_OPTION + "' of '" + key + "' must be an expression string, got '" + value + "'.");
                    }
                    filter = (String) value;
                }
                case KEY_PROPERTIES_OPTION -> {
                    List<String> parsed = parseKeyProperties(value);
                    if (value != null && parsed == null) {
                        return new InvalidRule(key, "Option '" + KEY_PROPERTIES_OPTION + "' of '" + key + "' must be a list of property names, got '" + value + "'.");
                    }
                    overridesKeyProperties = true;
                    keyProperties = parsed;
                }
                case ELSE_OPTION -> {
                    if (!isNullMarker(value)) {
                        return new InvalidRule(key, "Option '" + ELSE_OPTION + "=" + value + "' is not supported.");
                    }
                    includeUnmapped = false;
                }
                default -> {
                    if (option.startsWith("__") && option.endsWith("__") && !RESERVED_OPTIONS.contains(option)) {
                        return new InvalidRule(key, "Option '" + option + "' of '" + key + "' is not a known option.");
                    }
                    if (isNullMarker(value)) {
                        excludedFields.add(option);
                        continue;
                    }
                    FieldMapping mapping = parseField(option, value);
                    if (mapping == null) {
                        return new InvalidRule(key, "Unexpected mapping for '" + key + "." + option + "': '" + value + "'.");
                    }
                    fields.add(mapping);
                }
            }
        }
        return new ProjectionRule(key, source, alias, fields, excludedFields, filter, includeUnmapped,
            overridesKeyProperties, keyProperties);
    }

    private static FieldMapping parseField(String field, Object value) {
        if (value instanceof String expression) {
            return new FieldMapping(field, expression, null);
        }
        if (value instanceof Map<?, ?> definition && definition.get("expr") instanceof String expression) {
            Object type = definition.get("type");
            if (type == null) {
                return new FieldMapping(field, expression, null);
            }
            try {
                return new FieldMapping(field, expression, IonTypeName.parse(String.valueOf(type)));
            } catch (CastException e) {
                return null;
            }
        }
        return null;
    }

    private static List<String> parseKeyProperties(Object value) {
        if (!(value instanceof List<?> list)) {
            return null;
        }
        List<String> names = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof String name)) {
                return null;
            }
            names.add(name);
        }
        return names;
    }

    public static final class Builder {
        private final List<MapRule> rules = new ArrayList<>();
        private boolean removeUnmappedStreams;

        private Builder() {
        }

        /**
         * Adds a rule from its raw configuration value: {@code null} or {@code "__NULL__"}, a map of
         * field expressions and options, or anything else (kept as an {@link InvalidRule}).
         */
        public Builder rule(String key, Object definition) {
            if (ELSE_OPTION.equals(key)) {
                if (isNullMarker(definition)) {
                    removeUnmappedStreams = true;
                } else {
                    rules.add(new InvalidRule(key, "Option '" + ELSE_OPTION + "=" + definition + "' is not supported."));
                }
                return this;
            }
            rules.add(parse(key, definition));
            return this;
        }

        public StreamMapRules build() {
            return new StreamMapRules(Collections.unmodifiableList(new ArrayList<>(rules)), removeUnmappedStreams);
        }
    }
}
