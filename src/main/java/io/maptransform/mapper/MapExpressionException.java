package io.maptransform.mapper;

import io.maptransform.util.TransformException;
import lombok.Getter;

/**
 * Raised when a field or filter expression fails on a record.
 */
@Getter
public class MapExpressionException extends TransformException {
    private final String streamName;
    private final String expression;

    public MapExpressionException(String streamName, String expression, String message, Throwable cause) {
        super("Failed to evaluate expression '" + expression + "' on stream '" + streamName + "': " + message, cause);
        this.streamName = streamName;
        this.expression = expression;
    }
}
