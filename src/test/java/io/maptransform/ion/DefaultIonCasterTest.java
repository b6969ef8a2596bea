package io.maptransform.ion;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonFloat;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonString;
import com.amazon.ion.IonTimestamp;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

class DefaultIonCasterTest {
    private final DefaultIonCaster caster = new DefaultIonCaster();

    @Test
    void castsScalars() throws Exception {
        assertThat(((IonInt) caster.cast(IonValueUtils.system().newString("42"), IonTypeName.INT)).intValue(), is(42));
        assertThat(((IonString) caster.cast(IonValueUtils.system().newInt(7), IonTypeName.STRING)).stringValue(), is("7"));
        assertThat(((IonFloat) caster.cast(IonValueUtils.system().newDecimal(new BigDecimal("1.25")), IonTypeName.FLOAT)).doubleValue(), is(1.25d));
        assertThat(((IonBool) caster.cast(IonValueUtils.system().newInt(0), IonTypeName.BOOLEAN)).booleanValue(), is(false));
        IonTimestamp timestamp = (IonTimestamp) caster.cast(IonValueUtils.system().newString("2024-05-01T08:00:00Z"), IonTypeName.TIMESTAMP);
        assertThat(IonValueUtils.asInstant(timestamp), is(Instant.parse("2024-05-01T08:00:00Z")));
    }

    @Test
    void keepsNulls() throws Exception {
        assertThat(IonValueUtils.isNull(caster.cast(IonValueUtils.nullValue(), IonTypeName.INT)), is(true));
    }

    @Test
    void rejectsLossyIntegerCast() {
        CastException exception = Assertions.assertThrows(
            CastException.class,
            () -> caster.cast(IonValueUtils.system().newDecimal(new BigDecimal("1.5")), IonTypeName.INT)
        );

        assertThat(exception.getMessage(), is("Cannot cast to int: Expected integer value, got 1.5"));
        assertThat(exception.getTargetType(), is(IonTypeName.INT));
    }

    @Test
    void namesTargetTypeOfLenientReadFailures() {
        CastException exception = Assertions.assertThrows(
            CastException.class,
            () -> caster.cast(IonValueUtils.system().newString("soon"), IonTypeName.TIMESTAMP)
        );

        assertThat(exception.getTargetType(), is(IonTypeName.TIMESTAMP));
        assertThat(exception.getMessage(), is("Cannot cast to timestamp: Invalid timestamp: soon"));
        assertThat(((CastException) exception.getCause()).getTargetType(), is(nullValue()));
    }

    @Test
    void rejectsContainerMismatch() {
        CastException list = Assertions.assertThrows(CastException.class,
            () -> caster.cast(IonValueUtils.system().newString("x"), IonTypeName.LIST));
        CastException struct = Assertions.assertThrows(CastException.class,
            () -> caster.cast(IonValueUtils.system().newString("x"), IonTypeName.STRUCT));

        assertThat(list.getTargetType(), is(IonTypeName.LIST));
        assertThat(struct.getMessage(), containsString("Expected struct value, got STRING"));
    }

    @Test
    void parsesTypeNames() throws Exception {
        assertThat(IonTypeName.parse(" decimal "), is(IonTypeName.DECIMAL));
        assertThat(IonTypeName.TIMESTAMP.jsonFormat(), is("date-time"));
        Assertions.assertThrows(CastException.class, () -> IonTypeName.parse("money"));
    }
}
