package io.maptransform.ion;

import com.amazon.ion.IonFloat;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonList;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;

import java.math.BigDecimal;
import java.time.Instant;

public final class DefaultIonCaster implements IonCaster {
    @Override
    public IonValue cast(IonValue value, IonTypeName targetType) throws CastException {
        if (IonValueUtils.isNull(value)) {
            return IonValueUtils.nullValue();
        }
        try {
            return convert(value, targetType);
        } catch (CastException e) {
            if (e.getTargetType() != null) {
                throw e;
            }
            throw new CastException(targetType, e.getMessage(), e);
        }
    }

    private IonValue convert(IonValue value, IonTypeName targetType) throws CastException {
        return switch (targetType) {
            case STRING -> IonValueUtils.system().newString(IonValueUtils.asString(value));
            case INT -> castInt(value);
            case FLOAT -> value instanceof IonFloat
                ? value
                : IonValueUtils.system().newFloat(IonValueUtils.asDecimal(value).doubleValue());
            case DECIMAL -> IonValueUtils.system().newDecimal(IonValueUtils.asDecimal(value));
            case BOOLEAN -> IonValueUtils.system().newBool(asBoolean(value));
            case TIMESTAMP -> {
                Instant instant = IonValueUtils.asInstant(value);
                yield IonValueUtils.newTimestamp(instant);
            }
            case LIST -> {
                if (!(value instanceof IonList)) {
                    throw new CastException(IonTypeName.LIST, "Expected list value, got " + value.getType(), null);
                }
                yield value;
            }
            case STRUCT -> {
                if (!(value instanceof IonStruct)) {
                    throw new CastException(IonTypeName.STRUCT, "Expected struct value, got " + value.getType(), null);
                }
                yield value;
            }
        };
    }

    private IonValue castInt(IonValue value) throws CastException {
        if (value instanceof IonInt) {
            return value;
        }
        BigDecimal decimal = IonValueUtils.asDecimal(value);
        try {
            return IonValueUtils.system().newInt(decimal.toBigIntegerExact());
        } catch (ArithmeticException e) {
            throw new CastException(IonTypeName.INT, "Expected integer value, got " + decimal.toPlainString(), e);
        }
    }

    private boolean asBoolean(IonValue value) throws CastException {
        if (value instanceof IonInt || value instanceof IonFloat || value instanceof com.amazon.ion.IonDecimal) {
            return IonValueUtils.asDecimal(value).signum() != 0;
        }
        return IonValueUtils.asBoolean(value);
    }
}
