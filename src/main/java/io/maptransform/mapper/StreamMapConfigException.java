package io.maptransform.mapper;

import io.maptransform.util.TransformException;

/**
 * Raised when stream map configuration cannot be compiled. Fatal to the registration that hit it.
 */
public class StreamMapConfigException extends TransformException {
    public StreamMapConfigException(String message) {
        super(message);
    }

    public StreamMapConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
