package io.maptransform.ion;

import lombok.Getter;

/**
 * A value that cannot be read as, or converted to, the requested Ion type.
 */
@Getter
public class CastException extends Exception {
    /**
     * Declared type of the failed conversion, {@code null} for lenient reads outside a cast.
     */
    private final IonTypeName targetType;

    public CastException(String message) {
        this(null, message, null);
    }

    public CastException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public CastException(IonTypeName targetType, String message, Throwable cause) {
        super(targetType == null ? message : "Cannot cast to " + targetType.name().toLowerCase() + ": " + message, cause);
        this.targetType = targetType;
    }
}
