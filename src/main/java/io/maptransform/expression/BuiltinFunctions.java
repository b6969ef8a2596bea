package io.maptransform.expression;

import com.amazon.ion.IonInt;
import com.amazon.ion.IonSequence;
import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import com.amazon.ion.Timestamp;
import io.maptransform.ion.CastException;
import io.maptransform.ion.DefaultIonCaster;
import io.maptransform.ion.IonCaster;
import io.maptransform.ion.IonTypeName;
import io.maptransform.ion.IonValueUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * The closed set of functions available to map expressions.
 *
 * <p>The baseline is fixed: {@code abs, len, lower, upper, str, int, float, bool, round, min,
 * max, sum, count, coalesce, concat, toInt, toDecimal, toString, toBoolean, parseTimestamp}.
 * {@link #create(Clock, Function)} adds {@code md5}, the {@code datetime.*} helpers and the
 * {@code os.getenv}/{@code os.environ.get} environment lookups on top of it.
 */
public final class BuiltinFunctions {
    public static final List<String> BASELINE_NAMES = List.of(
        "abs", "len", "lower", "upper", "str", "int", "float", "bool", "round", "min", "max",
        "sum", "count", "coalesce", "concat", "toInt", "toDecimal", "toString", "toBoolean", "parseTimestamp"
    );

    public static final List<String> ADDITION_NAMES = List.of(
        "md5",
        "datetime.now", "datetime.utcnow", "datetime.today", "datetime.parse", "datetime.format",
        "datetime.addDays", "datetime.addSeconds", "datetime.epochSeconds",
        "datetime.datetime.now", "datetime.datetime.utcnow", "datetime.date.today",
        "os.getenv", "os.environ.get"
    );

    private static final FunctionTable DEFAULTS = create(Clock.systemUTC(), System::getenv);

    private BuiltinFunctions() {
    }

    /**
     * Process-wide table bound to the system clock and the process environment.
     */
    public static FunctionTable defaults() {
        return DEFAULTS;
    }

    public static FunctionTable baseline() {
        return baseline(new DefaultIonCaster());
    }

    public static FunctionTable baseline(IonCaster caster) {
        Map<String, MapFunction> functions = new LinkedHashMap<>();
        functions.put("abs", BuiltinFunctions::abs);
        functions.put("len", MapFunction.returning(IonTypeName.INT, BuiltinFunctions::len));
        functions.put("lower", MapFunction.returning(IonTypeName.STRING, args -> changeCase(args, false)));
        functions.put("upper", MapFunction.returning(IonTypeName.STRING, args -> changeCase(args, true)));
        functions.put("str", MapFunction.returning(IonTypeName.STRING, args -> cast(caster, args, IonTypeName.STRING)));
        functions.put("int", MapFunction.returning(IonTypeName.INT, BuiltinFunctions::truncate));
        functions.put("float", MapFunction.returning(IonTypeName.FLOAT, args -> cast(caster, args, IonTypeName.FLOAT)));
        functions.put("bool", MapFunction.returning(IonTypeName.BOOLEAN, args -> cast(caster, args, IonTypeName.BOOLEAN)));
        functions.put("round", BuiltinFunctions::round);
        functions.put("min", args -> extreme(args, true));
        functions.put("max", args -> extreme(args, false));
        functions.put("sum", MapFunction.returning(IonTypeName.DECIMAL, BuiltinFunctions::sum));
        functions.put("count", MapFunction.returning(IonTypeName.INT, BuiltinFunctions::count));
        functions.put("coalesce", BuiltinFunctions::coalesce);
        functions.put("concat", MapFunction.returning(IonTypeName.STRING, BuiltinFunctions::concat));
        functions.put("toInt", MapFunction.returning(IonTypeName.INT, args -> cast(caster, args, IonTypeName.INT)));
        functions.put("toDecimal", MapFunction.returning(IonTypeName.DECIMAL, args -> cast(caster, args, IonTypeName.DECIMAL)));
        functions.put("toString", MapFunction.returning(IonTypeName.STRING, args -> cast(caster, args, IonTypeName.STRING)));
        functions.put("toBoolean", MapFunction.returning(IonTypeName.BOOLEAN, args -> cast(caster, args, IonTypeName.BOOLEAN)));
        functions.put("parseTimestamp", MapFunction.returning(IonTypeName.TIMESTAMP, args -> cast(caster, args, IonTypeName.TIMESTAMP)));
        return FunctionTable.of(functions);
    }

    public static FunctionTable create(Clock clock, Function<String, String> environment) {
        Map<String, MapFunction> additions = new LinkedHashMap<>();
        additions.put("md5", MapFunction.returning(IonTypeName.STRING, BuiltinFunctions::md5));
        MapFunction now = MapFunction.returning(IonTypeName.TIMESTAMP, args -> now(clock, args));
        MapFunction today = MapFunction.returning(IonTypeName.TIMESTAMP, args -> today(clock, args));
        additions.put("datetime.now", now);
        additions.put("datetime.utcnow", now);
        additions.put("datetime.today", today);
        additions.put("datetime.parse", MapFunction.returning(IonTypeName.TIMESTAMP, BuiltinFunctions::parse));
        additions.put("datetime.format", MapFunction.returning(IonTypeName.STRING, BuiltinFunctions::format));
        additions.put("datetime.addDays", MapFunction.returning(IonTypeName.TIMESTAMP, args -> shift(args, Duration.ofDays(1))));
        additions.put("datetime.addSeconds", MapFunction.returning(IonTypeName.TIMESTAMP, args -> shift(args, Duration.ofSeconds(1))));
        additions.put("datetime.epochSeconds", MapFunction.returning(IonTypeName.INT, BuiltinFunctions::epochSeconds));
        // module-qualified spellings: datetime.datetime.now(), datetime.date.today()
        additions.put("datetime.datetime.now", now);
        additions.put("datetime.datetime.utcnow", now);
        additions.put("datetime.date.today", today);
        MapFunction getenv = MapFunction.returning(IonTypeName.STRING, args -> getenv(environment, args));
        additions.put("os.getenv", getenv);
        additions.put("os.environ.get", getenv);
        return baseline().withAll(additions);
    }

    static String md5Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest is not available", e);
        }
    }

    private static IonValue md5(List<IonValue> args) throws ExpressionException {
        requireArgCount("md5", args, 1);
        String input = IonValueUtils.asString(args.get(0));
        if (input == null) {
            return IonValueUtils.nullValue();
        }
        return IonValueUtils.system().newString(md5Hex(input));
    }

    private static IonValue now(Clock clock, List<IonValue> args) throws ExpressionException {
        requireArgCount("datetime.now", args, 0);
        return IonValueUtils.newTimestamp(clock.instant());
    }

    private static IonValue today(Clock clock, List<IonValue> args) throws ExpressionException {
        requireArgCount("datetime.today", args, 0);
        LocalDate date = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        return IonValueUtils.system().newTimestamp(
            Timestamp.forDay(date.getYear(), date.getMonthValue(), date.getDayOfMonth()));
    }

    private static IonValue parse(List<IonValue> args) throws ExpressionException {
        requireArgCount("datetime.parse", args, 1);
        Instant instant = asInstant(args.get(0));
        return instant == null ? IonValueUtils.nullValue() : IonValueUtils.newTimestamp(instant);
    }

    private static IonValue format(List<IonValue> args) throws ExpressionException {
        requireArgCount("datetime.format", args, 2);
        Instant instant = asInstant(args.get(0));
        String pattern = IonValueUtils.asString(args.get(1));
        if (instant == null || pattern == null) {
            return IonValueUtils.nullValue();
        }
        try {
            DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withZone(ZoneOffset.UTC);
            return IonValueUtils.system().newString(formatter.format(instant));
        } catch (IllegalArgumentException | java.time.DateTimeException e) {
            throw new ExpressionException("Invalid date pattern: " + pattern, e);
        }
    }

    private static IonValue shift(List<IonValue> args, Duration unit) throws ExpressionException {
        requireArgCount("datetime shift", args, 2);
        Instant instant = asInstant(args.get(0));
        BigDecimal amount = asDecimal(args.get(1));
        if (instant == null || amount == null) {
            return IonValueUtils.nullValue();
        }
        try {
            return IonValueUtils.newTimestamp(instant.plus(unit.multipliedBy(amount.longValueExact())));
        } catch (ArithmeticException e) {
            throw new ExpressionException("Expected whole number of units, got " + amount.toPlainString(), e);
        }
    }

    private static IonValue epochSeconds(List<IonValue> args) throws ExpressionException {
        requireArgCount("datetime.epochSeconds", args, 1);
        Instant instant = asInstant(args.get(0));
        return instant == null ? IonValueUtils.nullValue() : IonValueUtils.system().newInt(instant.getEpochSecond());
    }

    private static IonValue getenv(Function<String, String> environment, List<IonValue> args) throws ExpressionException {
        if (args.isEmpty() || args.size() > 2) {
            throw new ExpressionException("Expected 1 or 2 arguments, got " + args.size());
        }
        String name = IonValueUtils.asString(args.get(0));
        String value = name == null ? null : environment.apply(name);
        if (value != null) {
            return IonValueUtils.system().newString(value);
        }
        return args.size() == 2 ? args.get(1) : IonValueUtils.nullValue();
    }

    private static IonValue abs(List<IonValue> args) throws ExpressionException {
        requireArgCount("abs", args, 1);
        IonValue value = args.get(0);
        if (IonValueUtils.isNull(value)) {
            return IonValueUtils.nullValue();
        }
        if (value instanceof IonInt ionInt) {
            return IonValueUtils.system().newInt(ionInt.bigIntegerValue().abs());
        }
        return IonValueUtils.system().newDecimal(asDecimal(value).abs());
    }

    private static IonValue len(List<IonValue> args) throws ExpressionException {
        requireArgCount("len", args, 1);
        IonValue value = args.get(0);
        if (IonValueUtils.isNull(value)) {
            return IonValueUtils.nullValue();
        }
        if (value instanceof IonString ionString) {
            String text = ionString.stringValue();
            return IonValueUtils.system().newInt(text.codePointCount(0, text.length()));
        }
        if (value instanceof IonSequence sequence) {
            return IonValueUtils.system().newInt(sequence.size());
        }
        if (value instanceof IonStruct struct) {
            return IonValueUtils.system().newInt(struct.size());
        }
        throw new ExpressionException("len() is not defined for " + value.getType());
    }

    private static IonValue changeCase(List<IonValue> args, boolean upper) throws ExpressionException {
        requireArgCount(upper ? "upper" : "lower", args, 1);
        String text = IonValueUtils.asString(args.get(0));
        if (text == null) {
            return IonValueUtils.nullValue();
        }
        return IonValueUtils.system().newString(upper ? text.toUpperCase(Locale.ROOT) : text.toLowerCase(Locale.ROOT));
    }

    private static IonValue cast(IonCaster caster, List<IonValue> args, IonTypeName type) throws ExpressionException {
        requireArgCount(type.name().toLowerCase(Locale.ROOT), args, 1);
        try {
            return caster.cast(args.get(0), type);
        } catch (CastException e) {
            throw new ExpressionException("Invalid " + type.name().toLowerCase(Locale.ROOT) + " cast", e);
        }
    }

    private static IonValue truncate(List<IonValue> args) throws ExpressionException {
        requireArgCount("int", args, 1);
        IonValue value = args.get(0);
        if (IonValueUtils.isNull(value)) {
            return IonValueUtils.nullValue();
        }
        if (value instanceof IonInt) {
            return value;
        }
        BigDecimal decimal = asDecimal(value);
        return IonValueUtils.system().newInt(decimal.setScale(0, RoundingMode.DOWN).toBigInteger());
    }

    private static IonValue round(List<IonValue> args) throws ExpressionException {
        if (args.isEmpty() || args.size() > 2) {
            throw new ExpressionException("Expected 1 or 2 arguments, got " + args.size());
        }
        BigDecimal value = asDecimal(args.get(0));
        if (value == null) {
            return IonValueUtils.nullValue();
        }
        if (args.size() == 1) {
            return IonValueUtils.system().newInt(value.setScale(0, RoundingMode.HALF_EVEN).toBigInteger());
        }
        BigDecimal digits = asDecimal(args.get(1));
        if (digits == null) {
            return IonValueUtils.nullValue();
        }
        return IonValueUtils.system().newDecimal(value.setScale(digits.intValue(), RoundingMode.HALF_EVEN));
    }

    private static IonValue sum(List<IonValue> args) throws ExpressionException {
        requireArgCount("sum", args, 1);
        IonSequence list = asList(args.get(0));
        if (list == null) {
            return IonValueUtils.nullValue();
        }
        BigDecimal total = BigDecimal.ZERO;
        for (IonValue value : list) {
            if (IonValueUtils.isNull(value)) {
                continue;
            }
            total = total.add(asDecimal(value));
        }
        return IonValueUtils.system().newDecimal(total);
    }

    private static IonValue count(List<IonValue> args) throws ExpressionException {
        requireArgCount("count", args, 1);
        IonSequence list = asList(args.get(0));
        if (list == null) {
            return IonValueUtils.nullValue();
        }
        return IonValueUtils.system().newInt(list.size());
    }

    private static IonValue extreme(List<IonValue> args, boolean min) throws ExpressionException {
        if (args.isEmpty()) {
            throw new ExpressionException("Expected at least 1 argument");
        }
        List<IonValue> candidates = new ArrayList<>();
        if (args.size() == 1) {
            IonSequence list = asList(args.get(0));
            if (list == null) {
                return IonValueUtils.nullValue();
            }
            candidates.addAll(list);
        } else {
            candidates.addAll(args);
        }
        IonValue best = null;
        BigDecimal bestDecimal = null;
        for (IonValue value : candidates) {
            if (IonValueUtils.isNull(value)) {
                continue;
            }
            BigDecimal decimal = asDecimal(value);
            if (bestDecimal == null || (min ? decimal.compareTo(bestDecimal) < 0 : decimal.compareTo(bestDecimal) > 0)) {
                best = value;
                bestDecimal = decimal;
            }
        }
        return best == null ? IonValueUtils.nullValue() : best;
    }

    private static IonValue coalesce(List<IonValue> args) {
        for (IonValue value : args) {
            if (!IonValueUtils.isNull(value)) {
                return value;
            }
        }
        return IonValueUtils.nullValue();
    }

    private static IonValue concat(List<IonValue> args) {
        StringBuilder builder = new StringBuilder();
        for (IonValue value : args) {
            if (IonValueUtils.isNull(value)) {
                continue;
            }
            builder.append(IonValueUtils.asString(value));
        }
        return IonValueUtils.system().newString(builder.toString());
    }

    private static IonSequence asList(IonValue value) throws ExpressionException {
        if (IonValueUtils.isNull(value)) {
            return null;
        }
        if (!(value instanceof IonSequence list)) {
            throw new ExpressionException("Expected list argument, got " + value.getType());
        }
        return list;
    }

    private static BigDecimal asDecimal(IonValue value) throws ExpressionException {
        try {
            return IonValueUtils.asDecimal(value);
        } catch (CastException e) {
            throw new ExpressionException(e.getMessage(), e);
        }
    }

    private static Instant asInstant(IonValue value) throws ExpressionException {
        try {
            return IonValueUtils.asInstant(value);
        } catch (CastException e) {
            throw new ExpressionException(e.getMessage(), e);
        }
    }

    private static void requireArgCount(String name, List<IonValue> values, int expected) throws ExpressionException {
        if (values.size() != expected) {
            throw new ExpressionException(name + " expects " + expected + " arguments, got " + values.size());
        }
    }
}
