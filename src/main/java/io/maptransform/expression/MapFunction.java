package io.maptransform.expression;

import com.amazon.ion.IonValue;
import io.maptransform.ion.IonTypeName;

import java.util.List;

/**
 * A function callable from a map expression. Arguments are evaluated before the call and
 * must not be mutated.
 */
@FunctionalInterface
public interface MapFunction {
    IonValue apply(List<IonValue> args) throws ExpressionException;

    /**
     * Type of the values this function returns, or {@code null} when it depends on the arguments.
     */
    default IonTypeName returnType() {
        return null;
    }

    static MapFunction returning(IonTypeName type, MapFunction function) {
        return new MapFunction() {
            @Override
            public IonValue apply(List<IonValue> args) throws ExpressionException {
                return function.apply(args);
            }

            @Override
            public IonTypeName returnType() {
                return type;
            }
        };
    }
}
