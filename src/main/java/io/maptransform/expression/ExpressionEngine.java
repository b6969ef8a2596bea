package io.maptransform.expression;

import com.amazon.ion.IonValue;

import java.util.Map;

public interface ExpressionEngine {
    CompiledExpression compile(String expression) throws ExpressionException;

    default IonValue evaluate(String expression,
                              Map<String, IonValue> bindings,
                              FunctionTable functions) throws ExpressionException {
        return compile(expression).evaluate(bindings, functions);
    }
}
