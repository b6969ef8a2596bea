package io.maptransform.config;

import com.amazon.ion.IonStruct;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.maptransform.ion.IonValueUtils;
import io.maptransform.mapper.StreamMapConfigException;
import io.maptransform.mapper.rule.StreamMapRules;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads a {@link MapperConfig} from its JSON form:
 * <pre>
 * {
 *   "stream_maps": { "orders": { "__filter__": "amount > 100" }, "users": "__NULL__" },
 *   "stream_map_config": { "hash_seed": "..." },
 *   "flattening_enabled": false,
 *   "flattening_max_depth": 2
 * }
 * </pre>
 * Entries of {@code stream_maps} keep their declaration order.
 */
public final class MapperConfigLoader {
    public static final String STREAM_MAPS = "stream_maps";
    public static final String STREAM_MAP_CONFIG = "stream_map_config";
    public static final String FLATTENING_ENABLED = "flattening_enabled";
    public static final String FLATTENING_MAX_DEPTH = "flattening_max_depth";

    private final ObjectMapper objectMapper;

    public MapperConfigLoader() {
        this(new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    public MapperConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public MapperConfig load(Path path) throws StreamMapConfigException {
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new StreamMapConfigException("Unable to read mapper configuration: " + path, e);
        }
    }

    public MapperConfig parse(String json) throws StreamMapConfigException {
        try {
            return fromJson(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new StreamMapConfigException("Invalid mapper configuration: " + e.getOriginalMessage(), e);
        }
    }

    public MapperConfig fromMap(Map<String, ?> config) throws StreamMapConfigException {
        return fromJson(objectMapper.valueToTree(config));
    }

    public MapperConfig fromJson(JsonNode root) throws StreamMapConfigException {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return MapperConfig.builder().build();
        }
        if (!root.isObject()) {
            throw new StreamMapConfigException("Mapper configuration must be an object, got " + root.getNodeType());
        }
        return MapperConfig.builder()
            .streamMaps(readStreamMaps(root.get(STREAM_MAPS)))
            .streamMapConfig(readStreamMapConfig(root.get(STREAM_MAP_CONFIG)))
            .flattening(readFlattening(root))
            .build();
    }

    private StreamMapRules readStreamMaps(JsonNode node) throws StreamMapConfigException {
        if (node == null || node.isNull()) {
            return StreamMapRules.empty();
        }
        if (!node.isObject()) {
            throw new StreamMapConfigException("'" + STREAM_MAPS + "' must be an object, got " + node.getNodeType());
        }
        StreamMapRules.Builder builder = StreamMapRules.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            builder.rule(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class));
        }
        return builder.build();
    }

    private IonStruct readStreamMapConfig(JsonNode node) throws StreamMapConfigException {
        if (node == null || node.isNull()) {
            return IonValueUtils.emptyStruct();
        }
        if (!node.isObject()) {
            throw new StreamMapConfigException("'" + STREAM_MAP_CONFIG + "' must be an object, got " + node.getNodeType());
        }
        return (IonStruct) IonValueUtils.toIonValue(objectMapper.convertValue(node, Map.class));
    }

    private FlatteningOptions readFlattening(JsonNode root) throws StreamMapConfigException {
        JsonNode enabled = root.get(FLATTENING_ENABLED);
        JsonNode maxDepth = root.get(FLATTENING_MAX_DEPTH);
        if (enabled != null && !enabled.isNull() && !enabled.isBoolean()) {
            throw new StreamMapConfigException("'" + FLATTENING_ENABLED + "' must be a boolean, got " + enabled);
        }
        if (maxDepth != null && !maxDepth.isNull() && !maxDepth.canConvertToInt()) {
            throw new StreamMapConfigException("'" + FLATTENING_MAX_DEPTH + "' must be an integer, got " + maxDepth);
        }
        boolean flatten = enabled != null && enabled.asBoolean();
        Integer depth = maxDepth == null || maxDepth.isNull() ? null : maxDepth.intValue();
        if (!flatten && depth == null) {
            return FlatteningOptions.disabled();
        }
        return new FlatteningOptions(flatten, depth);
    }
}
