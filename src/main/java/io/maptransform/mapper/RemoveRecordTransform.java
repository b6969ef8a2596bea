package io.maptransform.mapper;

import com.amazon.ion.IonStruct;
import io.maptransform.config.FlatteningOptions;

import java.util.List;

/**
 * Suppresses every record of its stream, whatever the record holds.
 */
public final class RemoveRecordTransform extends StreamMap {
    public RemoveRecordTransform(String streamAlias, IonStruct rawSchema, FlatteningOptions flatteningOptions) {
        super(streamAlias, rawSchema, null, flatteningOptions);
    }

    @Override
    public MapResult apply(IonStruct record) {
        return MapResult.removed(streamAlias);
    }

    @Override
    public List<String> transformedKeyProperties() {
        return null;
    }
}
