package io.maptransform.ion;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonList;
import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

class IonValueUtilsTest {
    @Test
    void convertsRecordMapsToStructs() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("name", "alpha");
        input.put("count", 12);
        input.put("big", new BigInteger("123456789012345678901234567890"));
        input.put("price", new BigDecimal("3.50"));
        input.put("active", true);
        input.put("missing", null);
        input.put("tags", List.of("a", "b"));

        IonStruct struct = IonValueUtils.toIonStruct(input);

        assertThat(((IonString) struct.get("name")).stringValue(), is("alpha"));
        assertThat(((IonInt) struct.get("count")).intValue(), is(12));
        assertThat(((IonInt) struct.get("big")).bigIntegerValue(), is(new BigInteger("123456789012345678901234567890")));
        assertThat(((IonDecimal) struct.get("price")).bigDecimalValue(), is(new BigDecimal("3.50")));
        assertThat(((IonBool) struct.get("active")).booleanValue(), is(true));
        assertThat(IonValueUtils.isNull(struct.get("missing")), is(true));
        IonList tags = (IonList) struct.get("tags");
        assertThat(tags.size(), is(2));
        assertThat(((IonString) tags.get(0)).stringValue(), is("a"));
    }

    @Test
    void detachesValuesOwnedByAnotherContainer() {
        IonStruct source = IonValueUtils.emptyStruct();
        source.put("city", IonValueUtils.system().newString("Lyon"));

        IonStruct copy = IonValueUtils.toIonStruct(Map.of("city", source.get("city")));

        assertThat(((IonString) copy.get("city")).stringValue(), is("Lyon"));
        assertThat(source.get("city").getContainer() == source, is(true));
    }

    @Test
    void convertsFromIonValues() {
        IonStruct struct = IonValueUtils.emptyStruct();
        struct.put("name", IonValueUtils.system().newString("beta"));
        struct.put("count", IonValueUtils.system().newInt(42));
        struct.put("when", IonValueUtils.newTimestamp(Instant.parse("2024-01-01T00:00:00Z")));

        Map<String, Object> result = IonValueUtils.toJavaMap(struct);

        assertThat(result.get("name"), is("beta"));
        assertThat(result.get("count"), is(42L));
        assertThat(result.get("when"), is("2024-01-01T00:00:00Z"));
        assertThat(IonValueUtils.toJavaValue(struct), is((Object) result));
        assertThat(IonValueUtils.toJavaMap(null), is(nullValue()));
    }

    @Test
    void readsValuesLeniently() throws Exception {
        IonValue nullValue = IonValueUtils.nullValue();
        assertThat(IonValueUtils.asDecimal(nullValue), is(nullValue()));
        assertThat(IonValueUtils.asBoolean(nullValue), is(nullValue()));
        assertThat(IonValueUtils.asInstant(nullValue), is(nullValue()));
        assertThat(IonValueUtils.asString(nullValue), is(nullValue()));

        assertThat(IonValueUtils.asDecimal(IonValueUtils.system().newString(" 12.75 ")), is(new BigDecimal("12.75")));
        assertThat(IonValueUtils.asBoolean(IonValueUtils.system().newString("TRUE")), is(true));
        assertThat(IonValueUtils.asString(IonValueUtils.system().newDecimal(new BigDecimal("1E+3"))), is("1000"));
        assertThat(IonValueUtils.asInstant(IonValueUtils.system().newString("2024-02-01T14:00:00+02:00")),
            is(Instant.parse("2024-02-01T12:00:00Z")));
    }

    @Test
    void rejectsInvalidConversions() {
        Assertions.assertThrows(CastException.class,
            () -> IonValueUtils.asDecimal(IonValueUtils.system().newString("nope")));
        Assertions.assertThrows(CastException.class,
            () -> IonValueUtils.asDecimal(IonValueUtils.system().newFloat(Double.NaN)));
        Assertions.assertThrows(CastException.class,
            () -> IonValueUtils.asBoolean(IonValueUtils.system().newString("truthy")));
        Assertions.assertThrows(CastException.class,
            () -> IonValueUtils.asInstant(IonValueUtils.system().newString("not-a-timestamp")));
    }

    @Test
    void makesReadOnlyCopies() {
        IonStruct original = IonValueUtils.emptyStruct();
        original.put("a", IonValueUtils.system().newInt(1));

        IonStruct copy = IonValueUtils.readOnlyCopy(original);
        original.put("b", IonValueUtils.system().newInt(2));

        assertThat(copy.isReadOnly(), is(true));
        assertThat(copy.containsKey("b"), is(false));
        Assertions.assertThrows(
            com.amazon.ion.ReadOnlyValueException.class,
            () -> copy.put("c", IonValueUtils.system().newInt(3))
        );
        assertThat(IonValueUtils.readOnlyNull().isReadOnly(), is(true));
        assertThat(IonValueUtils.readOnlyNull().isNullValue(), is(true));
    }
}
