package io.maptransform.ion;

import com.amazon.ion.IonValue;

/**
 * Converts values to the type declared by a typed field mapping. Null input stays null for every
 * target type. Failures are reported with the target type set on the {@link CastException}.
 */
public interface IonCaster {
    IonValue cast(IonValue value, IonTypeName targetType) throws CastException;
}
