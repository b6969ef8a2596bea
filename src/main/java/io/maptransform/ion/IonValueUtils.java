package io.maptransform.ion;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonFloat;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonList;
import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonSymbol;
import com.amazon.ion.IonSystem;
import com.amazon.ion.IonTimestamp;
import com.amazon.ion.IonValue;
import com.amazon.ion.Timestamp;
import com.amazon.ion.system.IonSystemBuilder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class IonValueUtils {
    private static final IonSystem SYSTEM = IonSystemBuilder.standard().build();

    private IonValueUtils() {
    }

    public static IonSystem system() {
        return SYSTEM;
    }

    public static boolean isNull(IonValue value) {
        return value == null || value.isNullValue();
    }

    public static IonValue nullValue() {
        return SYSTEM.newNull();
    }

    public static IonValue cloneValue(IonValue value) {
        if (value == null) {
            return null;
        }
        return value.clone();
    }

    /**
     * Returns a read-only deep copy of {@code value}. Read-only Ion values may be shared between
     * threads as long as nobody writes to them.
     */
    public static IonStruct readOnlyCopy(IonStruct value) {
        if (value == null) {
            return null;
        }
        IonStruct copy = value.clone();
        copy.makeReadOnly();
        return copy;
    }

    public static IonValue readOnlyNull() {
        IonValue value = SYSTEM.newNull();
        value.makeReadOnly();
        return value;
    }

    public static IonStruct emptyStruct() {
        return SYSTEM.newEmptyStruct();
    }

    public static IonTimestamp newTimestamp(Instant instant) {
        return SYSTEM.newTimestamp(Timestamp.forMillis(instant.toEpochMilli(), 0));
    }

    public static IonValue toIonValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof IonValue ionValue) {
            return ionValue;
        }
        if (value instanceof String stringValue) {
            return SYSTEM.newString(stringValue);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return SYSTEM.newInt(((Number) value).longValue());
        }
        if (value instanceof BigInteger bigInteger) {
            return SYSTEM.newInt(bigInteger);
        }
        if (value instanceof Float || value instanceof Double) {
            return SYSTEM.newFloat(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return SYSTEM.newDecimal(decimal);
        }
        if (value instanceof Boolean bool) {
            return SYSTEM.newBool(bool);
        }
        if (value instanceof Instant instant) {
            return newTimestamp(instant);
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return newTimestamp(offsetDateTime.toInstant());
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return newTimestamp(zonedDateTime.toInstant());
        }
        if (value instanceof Date date) {
            return newTimestamp(date.toInstant());
        }
        if (value instanceof Map<?, ?> map) {
            IonStruct struct = SYSTEM.newEmptyStruct();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                IonValue ionValue = toIonValue(entry.getValue());
                struct.put(key, ionValue == null ? nullValue() : detached(ionValue));
            }
            return struct;
        }
        if (value instanceof List<?> list) {
            IonList ionList = SYSTEM.newEmptyList();
            for (Object element : list) {
                IonValue ionValue = toIonValue(element);
                ionList.add(ionValue == null ? nullValue() : detached(ionValue));
            }
            return ionList;
        }
        return SYSTEM.newString(String.valueOf(value));
    }

    /**
     * Converts a Java map into a struct, failing when the map does not describe one.
     */
    public static IonStruct toIonStruct(Map<String, ?> value) {
        if (value == null) {
            return null;
        }
        return (IonStruct) toIonValue(value);
    }

    private static IonValue detached(IonValue value) {
        return value.getContainer() == null ? value : value.clone();
    }

    public static BigDecimal asDecimal(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonDecimal ionDecimal) {
            return ionDecimal.bigDecimalValue();
        }
        if (value instanceof IonInt ionInt) {
            return new BigDecimal(ionInt.bigIntegerValue());
        }
        if (value instanceof IonFloat ionFloat) {
            double doubleValue = ionFloat.doubleValue();
            if (Double.isNaN(doubleValue) || Double.isInfinite(doubleValue)) {
                throw new CastException("Expected finite numeric value, got " + doubleValue);
            }
            return BigDecimal.valueOf(doubleValue);
        }
        if (value instanceof IonString ionString) {
            try {
                return new BigDecimal(ionString.stringValue().trim());
            } catch (NumberFormatException e) {
                throw new CastException("Invalid decimal: " + ionString.stringValue(), e);
            }
        }
        throw new CastException("Expected numeric value, got " + value.getType());
    }

    public static boolean isNumeric(IonValue value) {
        return value instanceof IonInt || value instanceof IonDecimal || value instanceof IonFloat;
    }

    public static String asString(IonValue value) {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonString ionString) {
            return ionString.stringValue();
        }
        if (value instanceof IonSymbol ionSymbol) {
            return ionSymbol.stringValue();
        }
        if (value instanceof IonInt ionInt) {
            return ionInt.bigIntegerValue().toString();
        }
        if (value instanceof IonDecimal ionDecimal) {
            return ionDecimal.bigDecimalValue().toPlainString();
        }
        if (value instanceof IonFloat ionFloat) {
            return Double.toString(ionFloat.doubleValue());
        }
        if (value instanceof IonBool ionBool) {
            return Boolean.toString(ionBool.booleanValue());
        }
        if (value instanceof IonTimestamp ionTimestamp) {
            return Instant.ofEpochMilli(ionTimestamp.timestampValue().getMillis()).toString();
        }
        return value.toString();
    }

    public static Boolean asBoolean(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonBool ionBool) {
            return ionBool.booleanValue();
        }
        if (value instanceof IonString ionString) {
            String raw = ionString.stringValue();
            if ("true".equalsIgnoreCase(raw)) {
                return true;
            }
            if ("false".equalsIgnoreCase(raw)) {
                return false;
            }
        }
        throw new CastException("Expected boolean value, got " + value.getType());
    }

    public static Instant asInstant(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonTimestamp ionTimestamp) {
            return Instant.ofEpochMilli(ionTimestamp.timestampValue().getMillis());
        }
        if (value instanceof IonString ionString) {
            try {
                return Instant.parse(ionString.stringValue());
            } catch (Exception e) {
                try {
                    return OffsetDateTime.parse(ionString.stringValue()).toInstant();
                } catch (Exception ignored) {
                    throw new CastException("Invalid timestamp: " + ionString.stringValue(), e);
                }
            }
        }
        throw new CastException("Expected timestamp value, got " + value.getType());
    }

    /**
     * Converts a struct into an insertion-ordered map of plain Java values.
     */
    public static Map<String, Object> toJavaMap(IonStruct struct) {
        if (isNull(struct)) {
            return null;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (IonValue child : struct) {
            map.put(child.getFieldName(), toJavaValue(child));
        }
        return map;
    }

    public static Object toJavaValue(IonValue value) {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonStruct ionStruct) {
            return toJavaMap(ionStruct);
        }
        if (value instanceof IonList ionList) {
            List<Object> list = new ArrayList<>();
            for (IonValue child : ionList) {
                list.add(toJavaValue(child));
            }
            return list;
        }
        if (value instanceof IonString ionString) {
            return ionString.stringValue();
        }
        if (value instanceof IonInt ionInt) {
            return ionInt.longValue();
        }
        if (value instanceof IonFloat ionFloat) {
            return ionFloat.doubleValue();
        }
        if (value instanceof IonDecimal ionDecimal) {
            return ionDecimal.bigDecimalValue();
        }
        if (value instanceof IonBool ionBool) {
            return ionBool.booleanValue();
        }
        if (value instanceof IonTimestamp ionTimestamp) {
            return Instant.ofEpochMilli(ionTimestamp.timestampValue().getMillis()).toString();
        }
        return value.toString();
    }
}
