package io.maptransform.mapper;

import com.amazon.ion.IonStruct;
import io.maptransform.config.FlatteningOptions;
import io.maptransform.ion.IonValueUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

class RemoveRecordTransformTest {
    @Test
    void removesEveryRecord() {
        RemoveRecordTransform map = new RemoveRecordTransform(
            "users",
            IonValueUtils.toIonStruct(Map.of("type", "object")),
            FlatteningOptions.disabled()
        );
        List<IonStruct> records = List.of(
            IonValueUtils.toIonStruct(Map.of("id", 1, "email", "a@example.com")),
            IonValueUtils.emptyStruct(),
            IonValueUtils.toIonStruct(Map.of("nested", Map.of("deep", List.of(1, 2))))
        );

        for (IonStruct record : records) {
            MapResult result = map.apply(record);

            assertThat(result.kind(), is(MapResult.Kind.REMOVED));
            assertThat(result.isEmitted(), is(false));
            assertThat(result.streamName(), is("users"));
            assertThat(result.record(), is(nullValue()));
            assertThat(result.recordAsMap(), is(nullValue()));
        }
    }

    @Test
    void dropsKeyProperties() {
        RemoveRecordTransform map = new RemoveRecordTransform("users", null, null);

        assertThat(map.transformedKeyProperties(), is(nullValue()));
        assertThat(map.transformedSchema().isEmpty(), is(true));
        assertThat(map.getFlatteningOptions(), is(FlatteningOptions.disabled()));
    }
}
