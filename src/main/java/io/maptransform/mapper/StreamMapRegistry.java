package io.maptransform.mapper;

import com.amazon.ion.IonStruct;
import io.maptransform.config.FlatteningOptions;
import io.maptransform.config.MapperConfig;
import io.maptransform.expression.DefaultExpressionEngine;
import io.maptransform.expression.ExpressionEngine;
import io.maptransform.expression.BuiltinFunctions;
import io.maptransform.expression.FunctionTable;
import io.maptransform.ion.DefaultIonCaster;
import io.maptransform.ion.IonCaster;
import io.maptransform.ion.IonValueUtils;
import io.maptransform.mapper.rule.InvalidRule;
import io.maptransform.mapper.rule.MapRule;
import io.maptransform.mapper.rule.ProjectionRule;
import io.maptransform.mapper.rule.RemoveRule;
import io.maptransform.mapper.rule.StreamMapRules;
import io.maptransform.util.TransformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Resolves the configured stream map rules against each stream schema the host announces and
 * keeps the resulting ordered list of compiled {@link StreamMap}s per stream.
 *
 * <p>Index 0 of a list is the map emitting under the stream's own key: the identity mapper, a
 * removal, or the rule keyed by the stream name. Further entries are extra aliases reading from
 * the same stream, in declaration order.
 *
 * <p>Published lists are immutable. Re-registering a stream swaps in a new list and leaves the
 * previous one untouched for readers still holding it.
 */
public final class StreamMapRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(StreamMapRegistry.class);

    private final StreamMapRules rules;
    private final IonStruct mapConfig;
    private final FlatteningOptions flattening;
    private final ExpressionEngine expressionEngine;
    private final FunctionTable functions;
    private final IonCaster caster;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Registration> registrations = new HashMap<>();

    public StreamMapRegistry(MapperConfig config) {
        this(config, new DefaultExpressionEngine(), BuiltinFunctions.defaults(), new DefaultIonCaster());
    }

    public StreamMapRegistry(MapperConfig config,
                             ExpressionEngine expressionEngine,
                             FunctionTable functions,
                             IonCaster caster) {
        this.rules = config.getStreamMaps();
        this.mapConfig = IonValueUtils.readOnlyCopy(config.getStreamMapConfig());
        this.flattening = config.getFlattening();
        this.expressionEngine = Objects.requireNonNull(expressionEngine, "expressionEngine");
        this.functions = Objects.requireNonNull(functions, "functions");
        this.caster = Objects.requireNonNull(caster, "caster");
    }

    public void registerRawStreamSchema(String streamName,
                                        Map<String, ?> schema,
                                        List<String> keyProperties) throws StreamMapConfigException {
        registerRawStreamSchema(streamName, schema == null ? null : IonValueUtils.toIonStruct(schema), keyProperties);
    }

    /**
     * Compiles the stream maps of {@code streamName} for the given schema. Registering the same
     * schema and keys again is a no-op; a different schema or key set discards the previous maps.
     *
     * @throws StreamMapConfigException when any configured rule is invalid or an expression does
     *                                  not compile; the previous registration is kept in that case
     */
    public void registerRawStreamSchema(String streamName,
                                        IonStruct schema,
                                        List<String> keyProperties) throws StreamMapConfigException {
        Objects.requireNonNull(streamName, "streamName");
        IonStruct frozenSchema = IonValueUtils.readOnlyCopy(schema == null ? IonValueUtils.emptyStruct() : schema);
        List<String> frozenKeys = keyProperties == null ? null : List.copyOf(keyProperties);

        lock.writeLock().lock();
        try {
            Registration existing = registrations.get(streamName);
            if (existing != null) {
                if (existing.matches(frozenSchema, frozenKeys)) {
                    LOG.debug("Schema of stream '{}' unchanged, keeping {} stream map(s)", streamName, existing.maps().size());
                    return;
                }
                LOG.info("Schema or key properties of stream '{}' changed, rebuilding its stream maps", streamName);
            }

            List<StreamMap> maps = compile(streamName, frozenSchema, frozenKeys);
            registrations.put(streamName, new Registration(frozenSchema, frozenKeys, List.copyOf(maps)));
            LOG.debug("Registered stream '{}' with maps {}", streamName, maps);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<StreamMap> compile(String streamName,
                                    IonStruct schema,
                                    List<String> keyProperties) throws StreamMapConfigException {
        List<StreamMap> maps = new ArrayList<>();
        if (rules.removeUnmappedStreams()) {
            maps.add(new RemoveRecordTransform(streamName, schema, flattening));
        } else {
            maps.add(new SameRecordTransform(streamName, schema, keyProperties, flattening));
        }

        for (MapRule rule : rules.rules()) {
            if (rule instanceof InvalidRule invalid) {
                throw new StreamMapConfigException("Invalid stream map '" + invalid.key() + "': " + invalid.reason());
            }
            if (rule instanceof RemoveRule remove) {
                if (remove.key().equals(streamName)) {
                    LOG.info("Set null transform as default for '{}'", streamName);
                    maps.set(0, new RemoveRecordTransform(streamName, schema, flattening));
                }
                continue;
            }
            if (rule instanceof ProjectionRule projection && projection.source().equals(streamName)) {
                CustomStreamMap map = new CustomStreamMap(
                    projection.alias(),
                    projection,
                    mapConfig,
                    schema,
                    keyProperties,
                    flattening,
                    expressionEngine,
                    functions,
                    caster
                );
                if (projection.isPrimary()) {
                    maps.set(0, map);
                } else {
                    maps.add(map);
                }
            }
        }
        return maps;
    }

    /**
     * The stream maps registered for {@code streamName}, or an empty list if it was never registered.
     */
    public List<StreamMap> getMapsFor(String streamName) {
        lock.readLock().lock();
        try {
            Registration registration = registrations.get(streamName);
            return registration == null ? List.of() : registration.maps();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(String streamName) {
        lock.readLock().lock();
        try {
            return registrations.containsKey(streamName);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<MapResult> transform(Map<String, ?> record, String streamName) throws TransformException {
        return transform(IonValueUtils.toIonStruct(record), streamName);
    }

    /**
     * Applies every stream map of {@code streamName} to the record, in registry order.
     *
     * @return the emitted results only; filtered and removed outcomes are dropped
     * @throws TransformException when the stream was never registered or an expression fails
     */
    public List<MapResult> transform(IonStruct record, String streamName) throws TransformException {
        List<StreamMap> maps;
        lock.readLock().lock();
        try {
            Registration registration = registrations.get(streamName);
            if (registration == null) {
                throw new TransformException("Stream '" + streamName + "' has no registered schema");
            }
            maps = registration.maps();
        } finally {
            lock.readLock().unlock();
        }

        List<MapResult> emitted = new ArrayList<>(maps.size());
        for (StreamMap map : maps) {
            MapResult result = map.apply(record);
            if (result.isEmitted()) {
                emitted.add(result);
            }
        }
        return emitted;
    }

    private record Registration(IonStruct schema, List<String> keyProperties, List<StreamMap> maps) {
        boolean matches(IonStruct otherSchema, List<String> otherKeys) {
            return schema.equals(otherSchema) && Objects.equals(keyProperties, otherKeys);
        }
    }
}
