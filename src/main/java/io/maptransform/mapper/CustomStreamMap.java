package io.maptransform.mapper;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonList;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.maptransform.config.FlatteningOptions;
import io.maptransform.expression.CompiledExpression;
import io.maptransform.expression.ExpressionEngine;
import io.maptransform.expression.ExpressionException;
import io.maptransform.expression.FunctionTable;
import io.maptransform.ion.CastException;
import io.maptransform.ion.IonCaster;
import io.maptransform.ion.IonTypeName;
import io.maptransform.ion.IonValueUtils;
import io.maptransform.mapper.rule.FieldMapping;
import io.maptransform.mapper.rule.ProjectionRule;
import io.maptransform.mapper.rule.StreamMapRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stream map compiled from a {@link ProjectionRule}: an optional filter plus field expressions,
 * emitted under the rule's alias.
 *
 * <p>Expressions see each record field by name, every property declared in the raw schema
 * (null when the record lacks it), the whole record as {@code _} and {@code record}, the map
 * configuration as {@code config} and, for field expressions, the source value of the field
 * being computed as {@code self}. Field expressions never see each other's results.
 *
 * <p>Unless the rule carries {@code "__else__": null}, properties without an expression are
 * copied through unchanged. Properties declared as {@code null} are dropped, which is not
 * allowed for key properties.
 */
public final class CustomStreamMap extends StreamMap {
    private static final Logger LOG = LoggerFactory.getLogger(CustomStreamMap.class);

    static final String RECORD_BINDING = "record";
    static final String UNDERSCORE_BINDING = "_";
    static final String CONFIG_BINDING = "config";
    static final String SELF_BINDING = "self";

    private static final IonValue NULL = IonValueUtils.readOnlyNull();

    private final String sourceStream;
    private final IonStruct mapConfig;
    private final FunctionTable functions;
    private final IonCaster caster;
    private final CompiledExpression filter;
    private final List<CompiledField> fields;
    private final boolean includeUnmapped;
    private final List<String> excludedFields;
    private final List<String> schemaProperties;
    private final boolean overridesKeyProperties;
    private final List<String> keyProperties;
    private final IonStruct transformedSchema;

    public CustomStreamMap(String streamAlias,
                           ProjectionRule rule,
                           IonStruct mapConfig,
                           IonStruct rawSchema,
                           List<String> rawKeyProperties,
                           FlatteningOptions flatteningOptions,
                           ExpressionEngine expressionEngine,
                           FunctionTable functions,
                           IonCaster caster) throws StreamMapConfigException {
        super(streamAlias, rawSchema, rawKeyProperties, flatteningOptions);
        this.sourceStream = rule.source();
        this.mapConfig = IonValueUtils.readOnlyCopy(mapConfig == null ? IonValueUtils.emptyStruct() : mapConfig);
        this.functions = functions;
        this.caster = caster;
        this.filter = rule.filter() == null ? null : compile(expressionEngine, rule, StreamMapRules.FILTER_OPTION, rule.filter());
        List<CompiledField> compiled = new ArrayList<>(rule.fields().size());
        for (FieldMapping mapping : rule.fields()) {
            compiled.add(new CompiledField(mapping, compile(expressionEngine, rule, mapping.targetField(), mapping.expression())));
        }
        this.fields = List.copyOf(compiled);
        this.includeUnmapped = rule.includeUnmapped();
        this.excludedFields = rule.excludedFields();
        this.schemaProperties = declaredProperties(this.rawSchema);
        this.overridesKeyProperties = rule.overridesKeyProperties();
        this.keyProperties = rule.keyProperties();
        checkKeyPropertiesKept(rule);
        this.transformedSchema = buildSchema();
    }

    private void checkKeyPropertiesKept(ProjectionRule rule) throws StreamMapConfigException {
        List<String> keys = transformedKeyProperties();
        if (keys == null) {
            return;
        }
        for (String excluded : excludedFields) {
            if (keys.contains(excluded)) {
                throw new StreamMapConfigException("Removing key property '" + excluded + "' is not permitted in '"
                    + rule.key() + "' stream map config. To remove a key property, use the `"
                    + StreamMapRules.KEY_PROPERTIES_OPTION + "` operator to specify either a new list of key property "
                    + "names or `null` to remove all key properties from the stream.");
            }
        }
    }

    private static CompiledExpression compile(ExpressionEngine engine,
                                              ProjectionRule rule,
                                              String property,
                                              String expression) throws StreamMapConfigException {
        try {
            return engine.compile(expression);
        } catch (ExpressionException e) {
            throw new StreamMapConfigException("Invalid expression for '" + rule.key() + "." + property + "': "
                + e.getMessage(), e);
        }
    }

    private static List<String> declaredProperties(IonStruct schema) {
        List<String> names = new ArrayList<>();
        if (schema.get("properties") instanceof IonStruct properties) {
            for (IonValue property : properties) {
                names.add(property.getFieldName());
            }
        }
        return List.copyOf(names);
    }

    @Override
    public MapResult apply(IonStruct record) throws MapExpressionException {
        Map<String, IonValue> bindings = bindingsFor(record);

        if (filter != null) {
            bindings.put(SELF_BINDING, NULL);
            IonValue decision = evaluate(filter, bindings);
            if (!passes(decision)) {
                LOG.debug("Record of stream '{}' rejected by filter '{}'", streamAlias, filter.source());
                return MapResult.suppressed(streamAlias);
            }
        }

        IonStruct output = includeUnmapped ? record.clone() : IonValueUtils.emptyStruct();
        for (String excluded : excludedFields) {
            output.remove(excluded);
        }
        for (CompiledField field : fields) {
            IonValue self = record.get(field.mapping().targetField());
            bindings.put(SELF_BINDING, self == null ? NULL : self);
            IonValue value = evaluate(field.expression(), bindings);
            if (field.mapping().type() != null) {
                value = cast(field, value);
            }
            output.put(field.mapping().targetField(), value.clone());
        }
        return MapResult.emit(streamAlias, output, transformedKeyProperties());
    }

    private Map<String, IonValue> bindingsFor(IonStruct record) {
        Map<String, IonValue> bindings = new HashMap<>();
        for (String property : schemaProperties) {
            bindings.put(property, NULL);
        }
        for (IonValue value : record) {
            bindings.put(value.getFieldName(), value);
        }
        bindings.put(UNDERSCORE_BINDING, record);
        bindings.put(RECORD_BINDING, record);
        bindings.put(CONFIG_BINDING, mapConfig);
        return bindings;
    }

    private IonValue evaluate(CompiledExpression expression, Map<String, IonValue> bindings) throws MapExpressionException {
        try {
            return expression.evaluate(bindings, functions);
        } catch (ExpressionException e) {
            throw new MapExpressionException(sourceStream, expression.source(), e.getMessage(), e);
        }
    }

    private boolean passes(IonValue decision) throws MapExpressionException {
        if (IonValueUtils.isNull(decision)) {
            return false;
        }
        if (decision instanceof IonBool bool) {
            return bool.booleanValue();
        }
        throw new MapExpressionException(sourceStream, filter.source(),
            "filter must evaluate to a boolean, got " + decision.getType(), null);
    }

    private IonValue cast(CompiledField field, IonValue value) throws MapExpressionException {
        try {
            return caster.cast(value, field.mapping().type());
        } catch (CastException e) {
            throw new MapExpressionException(sourceStream, field.expression().source(), e.getMessage(), e);
        }
    }

    private IonStruct buildSchema() {
        IonStruct schema = IonValueUtils.emptyStruct();
        schema.put("type", IonValueUtils.system().newString("object"));
        IonStruct rawProperties = rawSchema.get("properties") instanceof IonStruct struct ? struct : null;
        IonStruct properties = includeUnmapped && rawProperties != null
            ? rawProperties.clone()
            : IonValueUtils.emptyStruct();
        for (String excluded : excludedFields) {
            properties.remove(excluded);
        }
        for (CompiledField field : fields) {
            properties.put(field.mapping().targetField(), propertySchema(field, rawProperties));
        }
        schema.put("properties", properties);
        schema.makeReadOnly();
        return schema;
    }

    private IonValue propertySchema(CompiledField field, IonStruct rawProperties) {
        if (field.mapping().type() != null) {
            return typeSchema(field.mapping().type());
        }
        String reference = field.expression().fieldReference();
        if (reference != null && rawProperties != null && rawProperties.get(reference) != null) {
            return rawProperties.get(reference).clone();
        }
        IonTypeName inferred = field.expression().resultType(functions);
        return inferred == null ? IonValueUtils.emptyStruct() : typeSchema(inferred);
    }

    private static IonStruct typeSchema(IonTypeName type) {
        IonStruct schema = IonValueUtils.emptyStruct();
        IonList types = IonValueUtils.system().newEmptyList();
        types.add(IonValueUtils.system().newString(type.jsonType()));
        types.add(IonValueUtils.system().newString("null"));
        schema.put("type", types);
        if (type.jsonFormat() != null) {
            schema.put("format", IonValueUtils.system().newString(type.jsonFormat()));
        }
        return schema;
    }

    @Override
    public IonStruct transformedSchema() {
        return transformedSchema;
    }

    @Override
    public List<String> transformedKeyProperties() {
        return overridesKeyProperties ? keyProperties : rawKeyProperties;
    }

    private record CompiledField(FieldMapping mapping, CompiledExpression expression) {
    }
}
