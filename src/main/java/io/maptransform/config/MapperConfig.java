package io.maptransform.config;

import com.amazon.ion.IonStruct;
import io.maptransform.ion.IonValueUtils;
import io.maptransform.mapper.rule.StreamMapRules;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class MapperConfig {
    /**
     * Ordered stream map rules ({@code stream_maps}).
     */
    @Builder.Default
    private final StreamMapRules streamMaps = StreamMapRules.empty();

    /**
     * Free-form values exposed to every expression as {@code config} ({@code stream_map_config}).
     */
    @Builder.Default
    private final IonStruct streamMapConfig = IonValueUtils.emptyStruct();

    @Builder.Default
    private final FlatteningOptions flattening = FlatteningOptions.disabled();
}
