package io.maptransform.mapper;

import com.amazon.ion.IonStruct;
import io.maptransform.config.FlatteningOptions;
import io.maptransform.ion.IonValueUtils;

import java.util.List;

/**
 * Default mapper: emits every record unchanged under its own stream name.
 */
public final class SameRecordTransform extends StreamMap {
    public SameRecordTransform(String streamAlias,
                               IonStruct rawSchema,
                               List<String> rawKeyProperties,
                               FlatteningOptions flatteningOptions) {
        super(streamAlias, rawSchema, rawKeyProperties, flatteningOptions);
    }

    @Override
    public MapResult apply(IonStruct record) {
        return MapResult.emit(streamAlias, (IonStruct) IonValueUtils.cloneValue(record), rawKeyProperties);
    }
}
