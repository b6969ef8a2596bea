package io.maptransform.mapper;

import com.amazon.ion.IonStruct;
import io.maptransform.config.FlatteningOptions;
import io.maptransform.ion.IonValueUtils;

import java.util.List;

/**
 * A compiled transformation bound to one source stream and one output stream name.
 * Instances are immutable and safe to apply from several threads.
 */
public abstract class StreamMap {
    protected final String streamAlias;
    protected final IonStruct rawSchema;
    protected final List<String> rawKeyProperties;
    protected final FlatteningOptions flatteningOptions;

    protected StreamMap(String streamAlias,
                        IonStruct rawSchema,
                        List<String> rawKeyProperties,
                        FlatteningOptions flatteningOptions) {
        this.streamAlias = streamAlias;
        this.rawSchema = IonValueUtils.readOnlyCopy(rawSchema == null ? IonValueUtils.emptyStruct() : rawSchema);
        this.rawKeyProperties = rawKeyProperties == null ? null : List.copyOf(rawKeyProperties);
        this.flatteningOptions = flatteningOptions == null ? FlatteningOptions.disabled() : flatteningOptions;
    }

    public abstract MapResult apply(IonStruct record) throws MapExpressionException;

    public String getStreamAlias() {
        return streamAlias;
    }

    public IonStruct getRawSchema() {
        return rawSchema;
    }

    public List<String> getRawKeyProperties() {
        return rawKeyProperties;
    }

    public FlatteningOptions getFlatteningOptions() {
        return flatteningOptions;
    }

    /**
     * Schema of the records this map emits.
     */
    public IonStruct transformedSchema() {
        return rawSchema;
    }

    public List<String> transformedKeyProperties() {
        return rawKeyProperties;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + streamAlias + "]";
    }
}
