package io.maptransform.expression;

import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonTimestamp;
import com.amazon.ion.IonValue;
import io.maptransform.ion.IonTypeName;
import io.maptransform.ion.IonValueUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.comparesEqualTo;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.is;

class BuiltinFunctionsTest {
    private static final Instant NOW = Instant.parse("2024-03-15T10:30:00Z");

    private final DefaultExpressionEngine engine = new DefaultExpressionEngine();
    private final FunctionTable functions = BuiltinFunctions.create(
        Clock.fixed(NOW, ZoneOffset.UTC),
        Map.of("REGION", "eu-west-1")::get
    );

    @Test
    void exposesBaselineFunctions() {
        FunctionTable baseline = BuiltinFunctions.baseline();

        assertThat(baseline.names(), containsInAnyOrder(BuiltinFunctions.BASELINE_NAMES.toArray()));
        assertThat(functions.names(), hasItems(BuiltinFunctions.ADDITION_NAMES.toArray(new String[0])));
        assertThat(functions.size(), is(BuiltinFunctions.BASELINE_NAMES.size() + BuiltinFunctions.ADDITION_NAMES.size()));
    }

    @Test
    void hashesWithMd5() throws Exception {
        assertThat(BuiltinFunctions.md5Hex("abc"), is("900150983cd24fb0d6963f7d28e17f72"));
        assertThat(string("md5(email)", record("email", "abc")), is("900150983cd24fb0d6963f7d28e17f72"));
    }

    @Test
    void readsTheInjectedClock() throws Exception {
        IonTimestamp now = (IonTimestamp) evaluate("datetime.now()", IonValueUtils.emptyStruct());

        assertThat(IonValueUtils.asInstant(now), is(NOW));
        assertThat(string("datetime.format(datetime.today(), 'yyyy-MM-dd')", IonValueUtils.emptyStruct()), is("2024-03-15"));
    }

    @Test
    void acceptsModuleQualifiedDatetimeNames() throws Exception {
        IonStruct empty = IonValueUtils.emptyStruct();

        assertThat(IonValueUtils.asInstant(evaluate("datetime.datetime.now()", empty)), is(NOW));
        assertThat(IonValueUtils.asInstant(evaluate("datetime.datetime.utcnow()", empty)), is(NOW));
        assertThat(string("datetime.format(datetime.date.today(), 'yyyy-MM-dd')", empty), is("2024-03-15"));
        assertThat(engine.compile("datetime.date.today()").resultType(functions), is(IonTypeName.TIMESTAMP));
    }

    @Test
    void shiftsAndFormatsTimestamps() throws Exception {
        IonStruct record = record("created_at", "2024-01-31T23:00:00Z");

        assertThat(string("datetime.format(datetime.addDays(created_at, 1), 'yyyy-MM-dd')", record), is("2024-02-01"));
        assertThat(string("str(datetime.addSeconds(created_at, 3600))", record), is("2024-02-01T00:00:00Z"));
        assertThat(((IonInt) evaluate("datetime.epochSeconds(datetime.parse(created_at))", record)).longValue(),
            is(Instant.parse("2024-01-31T23:00:00Z").getEpochSecond()));
    }

    @Test
    void readsInjectedEnvironment() throws Exception {
        assertThat(string("os.getenv('REGION')", IonValueUtils.emptyStruct()), is("eu-west-1"));
        assertThat(string("os.environ.get('REGION')", IonValueUtils.emptyStruct()), is("eu-west-1"));
        assertThat(string("os.getenv('MISSING', 'local')", IonValueUtils.emptyStruct()), is("local"));
        assertThat(IonValueUtils.isNull(evaluate("os.getenv('MISSING')", IonValueUtils.emptyStruct())), is(true));
    }

    @Test
    void convertsAndAggregates() throws Exception {
        IonStruct record = (IonStruct) IonValueUtils.toIonValue(Map.of(
            "name", "Ada",
            "price", "12.50",
            "scores", List.of(3, 9, 4)
        ));

        assertThat(string("upper(name) + lower(name)", record), is("ADAada"));
        assertThat(((IonInt) evaluate("len(name)", record)).intValue(), is(3));
        assertThat(((IonDecimal) evaluate("toDecimal(price)", record)).bigDecimalValue(), comparesEqualTo(new BigDecimal("12.50")));
        assertThat(((IonInt) evaluate("int(toDecimal(price))", record)).intValue(), is(12));
        assertThat(((IonInt) evaluate("round(2.5)", record)).intValue(), is(2));
        assertThat(((IonInt) evaluate("max(scores)", record)).intValue(), is(9));
        assertThat(((IonInt) evaluate("min(7, 2, 5)", record)).intValue(), is(2));
        assertThat(((IonDecimal) evaluate("sum(scores)", record)).bigDecimalValue(), comparesEqualTo(new BigDecimal("16")));
        assertThat(((IonInt) evaluate("count(scores)", record)).intValue(), is(3));
        assertThat(string("coalesce(null, name)", record), is("Ada"));
        assertThat(string("concat(name, '-', 42)", record), is("Ada-42"));
        assertThat(((IonInt) evaluate("abs(-4)", record)).intValue(), is(4));
    }

    @Test
    void reportsInvalidCast() {
        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> evaluate("toInt(name)", record("name", "not a number"))
        );

        assertThat(exception.getMessage(), containsString("Invalid int cast"));
    }

    @Test
    void keepsTablesImmutable() {
        FunctionTable baseline = BuiltinFunctions.baseline();
        FunctionTable extended = baseline.with("triple", args -> args.get(0));

        assertThat(baseline.contains("triple"), is(false));
        assertThat(extended.contains("triple"), is(true));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> baseline.names().add("exec"));
    }

    private String string(String expression, IonStruct record) throws ExpressionException {
        return ((IonString) evaluate(expression, record)).stringValue();
    }

    private IonValue evaluate(String expression, IonStruct record) throws ExpressionException {
        Map<String, IonValue> bindings = new HashMap<>();
        for (IonValue value : record) {
            bindings.put(value.getFieldName(), value);
        }
        return engine.evaluate(expression, bindings, functions);
    }

    private static IonStruct record(String field, String value) {
        IonStruct record = IonValueUtils.emptyStruct();
        record.put(field, IonValueUtils.system().newString(value));
        return record;
    }
}
