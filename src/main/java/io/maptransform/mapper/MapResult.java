package io.maptransform.mapper;

import com.amazon.ion.IonStruct;
import io.maptransform.ion.IonValueUtils;

import java.util.List;
import java.util.Map;

/**
 * Outcome of applying one stream map to one record.
 *
 * @param streamName    output stream name for {@link Kind#EMIT}, the mapped stream otherwise
 * @param record        the transformed record, only set for {@link Kind#EMIT}
 * @param keyProperties key properties of the output stream, carried for the host's upsert logic
 */
public record MapResult(
    Kind kind,
    String streamName,
    IonStruct record,
    List<String> keyProperties
) {
    public enum Kind {
        EMIT,
        SUPPRESSED,
        REMOVED
    }

    public static MapResult emit(String streamName, IonStruct record, List<String> keyProperties) {
        return new MapResult(Kind.EMIT, streamName, record, keyProperties);
    }

    public static MapResult suppressed(String streamName) {
        return new MapResult(Kind.SUPPRESSED, streamName, null, null);
    }

    public static MapResult removed(String streamName) {
        return new MapResult(Kind.REMOVED, streamName, null, null);
    }

    public boolean isEmitted() {
        return kind == Kind.EMIT;
    }

    /**
     * The emitted record as plain Java maps and lists, or {@code null} when nothing was emitted.
     */
    public Map<String, Object> recordAsMap() {
        return record == null ? null : IonValueUtils.toJavaMap(record);
    }
}
