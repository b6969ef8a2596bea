package io.maptransform.expression;

import com.amazon.ion.IonValue;
import io.maptransform.ion.IonTypeName;

import java.util.Map;

/**
 * A parsed expression. Instances are immutable and may be evaluated concurrently.
 */
public interface CompiledExpression {
    String source();

    IonValue evaluate(Map<String, IonValue> bindings, FunctionTable functions) throws ExpressionException;

    /**
     * Statically known result type, or {@code null} when it depends on the evaluated data.
     */
    IonTypeName resultType(FunctionTable functions);

    /**
     * Name of the binding this expression reads when it is a bare identifier, otherwise {@code null}.
     */
    String fieldReference();
}
