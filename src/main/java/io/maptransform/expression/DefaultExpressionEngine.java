package io.maptransform.expression;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonFloat;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonList;
import com.amazon.ion.IonSequence;
import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonTimestamp;
import com.amazon.ion.IonValue;
import io.maptransform.ion.CastException;
import io.maptransform.ion.IonTypeName;
import io.maptransform.ion.IonValueUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Parser and tree-walking evaluator for map expressions.
 *
 * <p>The grammar covers literals, arithmetic, comparison and boolean operators, the
 * {@code a if cond else b} conditional, field/index access and calls to functions found in the
 * {@link FunctionTable} passed at evaluation time. Nothing else is reachable from an expression.
 */
public final class DefaultExpressionEngine implements ExpressionEngine {
    private static final IonValue NULL = readOnly(IonValueUtils.nullValue());

    @Override
    public CompiledExpression compile(String expression) throws ExpressionException {
        if (expression == null || expression.isBlank()) {
            return new Compiled(expression == null ? "" : expression, new LiteralExpr(NULL));
        }
        try {
            Tokenizer tokenizer = new Tokenizer(expression);
            Parser parser = new Parser(tokenizer);
            return new Compiled(expression, parser.parseExpression());
        } catch (ExpressionException e) {
            throw new ExpressionException("Invalid expression: " + expression + " (" + e.getMessage() + ")", e);
        }
    }

    private static IonValue readOnly(IonValue value) {
        value.makeReadOnly();
        return value;
    }

    private record Compiled(String source, Expr root) implements CompiledExpression {
        @Override
        public IonValue evaluate(Map<String, IonValue> bindings, FunctionTable functions) throws ExpressionException {
            try {
                IonValue value = root.eval(new EvalContext(bindings, functions));
                return value == null ? NULL : value;
            } catch (RuntimeException e) {
                throw new ExpressionException("Failed to evaluate '" + source + "': " + e.getMessage(), e);
            }
        }

        @Override
        public IonTypeName resultType(FunctionTable functions) {
            return root.resultType(functions);
        }

        @Override
        public String fieldReference() {
            if (root instanceof PathExpr path && path.segments.isEmpty()) {
                return path.root;
            }
            return null;
        }
    }

    private record EvalContext(Map<String, IonValue> bindings, FunctionTable functions) {
    }

    private interface Expr {
        IonValue eval(EvalContext context) throws ExpressionException;

        default IonTypeName resultType(FunctionTable functions) {
            return null;
        }
    }

    private static final class LiteralExpr implements Expr {
        private final IonValue value;

        private LiteralExpr(IonValue value) {
            this.value = value;
        }

        @Override
        public IonValue eval(EvalContext context) {
            return value;
        }

        @Override
        public IonTypeName resultType(FunctionTable functions) {
            if (value instanceof IonString) {
                return IonTypeName.STRING;
            }
            if (value instanceof IonInt) {
                return IonTypeName.INT;
            }
            if (value instanceof IonDecimal) {
                return IonTypeName.DECIMAL;
            }
            if (value instanceof IonBool) {
                return IonTypeName.BOOLEAN;
            }
            return null;
        }
    }

    private enum SegmentKind {
        FIELD,
        INDEX,
        EXPAND
    }

    private record PathSegment(SegmentKind kind, String name, int index) {
        static PathSegment field(String name) {
            return new PathSegment(SegmentKind.FIELD, name, 0);
        }

        static PathSegment index(int index) {
            return new PathSegment(SegmentKind.INDEX, null, index);
        }

        static PathSegment expand() {
            return new PathSegment(SegmentKind.EXPAND, null, 0);
        }
    }

    private static final class PathExpr implements Expr {
        private final String root;
        private final List<PathSegment> segments;

        private PathExpr(String root, List<PathSegment> segments) {
            this.root = root;
            this.segments = segments;
        }

        @Override
        public IonValue eval(EvalContext context) throws ExpressionException {
            if (!context.bindings().containsKey(root)) {
                throw new ExpressionException("Unknown identifier: " + root);
            }
            return resolvePath(context.bindings().get(root), 0);
        }

        private IonValue resolvePath(IonValue value, int index) throws ExpressionException {
            if (index >= segments.size()) {
                return value == null ? NULL : value;
            }
            if (IonValueUtils.isNull(value)) {
                return NULL;
            }
            PathSegment segment = segments.get(index);
            return switch (segment.kind()) {
                case FIELD -> {
                    if (!(value instanceof IonStruct struct)) {
                        throw new ExpressionException("Expected struct for path segment '" + segment.name()
                            + "', got " + value.getType());
                    }
                    yield resolvePath(struct.get(segment.name()), index + 1);
                }
                case INDEX -> {
                    if (!(value instanceof IonSequence sequence)) {
                        throw new ExpressionException("Cannot index into " + value.getType());
                    }
                    int position = segment.index() < 0 ? sequence.size() + segment.index() : segment.index();
                    if (position < 0 || position >= sequence.size()) {
                        yield NULL;
                    }
                    yield resolvePath(sequence.get(position), index + 1);
                }
                case EXPAND -> expand(value, index);
            };
        }

        private IonValue expand(IonValue value, int index) throws ExpressionException {
            if (!(value instanceof IonSequence sequence)) {
                throw new ExpressionException("Expected list for array expansion, got " + value.getType());
            }
            if (index == segments.size() - 1) {
                return sequence;
            }
            IonList result = IonValueUtils.system().newEmptyList();
            for (IonValue element : sequence) {
                IonValue resolved = resolvePath(element, index + 1);
                result.add(IonValueUtils.isNull(resolved)
                    ? IonValueUtils.nullValue()
                    : IonValueUtils.cloneValue(resolved));
            }
            return result;
        }
    }

    private static final class UnaryExpr implements Expr {
        private final TokenType operator;
        private final Expr expr;

        private UnaryExpr(TokenType operator, Expr expr) {
            this.operator = operator;
            this.expr = expr;
        }

        @Override
        public IonValue eval(EvalContext context) throws ExpressionException {
            IonValue value = expr.eval(context);
            if (IonValueUtils.isNull(value)) {
                return NULL;
            }
            return switch (operator) {
                case MINUS -> negate(value);
                case BANG -> IonValueUtils.system().newBool(!asBoolean(value));
                default -> throw new ExpressionException("Unsupported unary operator: " + operator);
            };
        }

        private IonValue negate(IonValue value) throws ExpressionException {
            if (value instanceof IonInt ionInt) {
                return IonValueUtils.system().newInt(ionInt.bigIntegerValue().negate());
            }
            return IonValueUtils.system().newDecimal(asDecimal(value).negate());
        }

        @Override
        public IonTypeName resultType(FunctionTable functions) {
            return operator == TokenType.BANG ? IonTypeName.BOOLEAN : expr.resultType(functions);
        }
    }

    private static final class BinaryExpr implements Expr {
        private final Expr left;
        private final Expr right;
        private final TokenType operator;

        private BinaryExpr(Expr left, Expr right, TokenType operator) {
            this.left = left;
            this.right = right;
            this.operator = operator;
        }

        @Override
        public IonValue eval(EvalContext context) throws ExpressionException {
            if (operator == TokenType.AND_AND || operator == TokenType.OR_OR) {
                return evaluateBoolean(context);
            }
            IonValue leftValue = left.eval(context);
            IonValue rightValue = right.eval(context);
            if (operator == TokenType.EQ_EQ || operator == TokenType.NOT_EQ) {
                boolean equals = equalsValue(leftValue, rightValue);
                return IonValueUtils.system().newBool(operator == TokenType.EQ_EQ ? equals : !equals);
            }
            if (operator == TokenType.GT || operator == TokenType.GTE || operator == TokenType.LT || operator == TokenType.LTE) {
                return compare(leftValue, rightValue);
            }
            return arithmetic(leftValue, rightValue);
        }

        @Override
        public IonTypeName resultType(FunctionTable functions) {
            switch (operator) {
                case AND_AND, OR_OR, EQ_EQ, NOT_EQ, GT, GTE, LT, LTE:
                    return IonTypeName.BOOLEAN;
                case SLASH:
                    return IonTypeName.DECIMAL;
                default:
                    break;
            }
            IonTypeName leftType = left.resultType(functions);
            IonTypeName rightType = right.resultType(functions);
            if (operator == TokenType.PLUS && leftType == IonTypeName.STRING && rightType == IonTypeName.STRING) {
                return IonTypeName.STRING;
            }
            if (leftType == IonTypeName.INT && rightType == IonTypeName.INT) {
                return IonTypeName.INT;
            }
            if (isNumericType(leftType) && isNumericType(rightType)) {
                return IonTypeName.DECIMAL;
            }
            return null;
        }

        private boolean isNumericType(IonTypeName type) {
            return type == IonTypeName.INT || type == IonTypeName.DECIMAL || type == IonTypeName.FLOAT;
        }

        private IonValue evaluateBoolean(EvalContext context) throws ExpressionException {
            IonValue leftValue = left.eval(context);
            if (IonValueUtils.isNull(leftValue)) {
                return NULL;
            }
            boolean leftBool = asBoolean(leftValue);
            if (operator == TokenType.AND_AND) {
                if (!leftBool) {
                    return IonValueUtils.system().newBool(false);
                }
            } else {
                if (leftBool) {
                    return IonValueUtils.system().newBool(true);
                }
            }

            IonValue rightValue = right.eval(context);
            if (IonValueUtils.isNull(rightValue)) {
                return NULL;
            }
            return IonValueUtils.system().newBool(asBoolean(rightValue));
        }

        private boolean equalsValue(IonValue leftValue, IonValue rightValue) throws ExpressionException {
            if (IonValueUtils.isNull(leftValue) && IonValueUtils.isNull(rightValue)) {
                return true;
            }
            if (IonValueUtils.isNull(leftValue) || IonValueUtils.isNull(rightValue)) {
                return false;
            }
            if (IonValueUtils.isNumeric(leftValue) && IonValueUtils.isNumeric(rightValue)) {
                return asDecimal(leftValue).compareTo(asDecimal(rightValue)) == 0;
            }
            if (leftValue instanceof IonTimestamp && rightValue instanceof IonTimestamp) {
                return asInstant(leftValue).equals(asInstant(rightValue));
            }
            return leftValue.equals(rightValue);
        }

        private IonValue compare(IonValue leftValue, IonValue rightValue) throws ExpressionException {
            if (IonValueUtils.isNull(leftValue) || IonValueUtils.isNull(rightValue)) {
                return NULL;
            }
            int comparison;
            try {
                if (leftValue instanceof IonString leftString && rightValue instanceof IonString rightString) {
                    comparison = leftString.stringValue().compareTo(rightString.stringValue());
                } else if (leftValue instanceof IonTimestamp || rightValue instanceof IonTimestamp) {
                    Instant leftInstant = IonValueUtils.asInstant(leftValue);
                    comparison = leftInstant.compareTo(IonValueUtils.asInstant(rightValue));
                } else {
                    comparison = IonValueUtils.asDecimal(leftValue).compareTo(IonValueUtils.asDecimal(rightValue));
                }
            } catch (CastException e) {
                throw new ExpressionException("Cannot compare " + leftValue.getType() + " with "
                    + rightValue.getType() + ": " + e.getMessage(), e);
            }
            return IonValueUtils.system().newBool(switch (operator) {
                case GT -> comparison > 0;
                case GTE -> comparison >= 0;
                case LT -> comparison < 0;
                case LTE -> comparison <= 0;
                default -> false;
            });
        }

        private IonValue arithmetic(IonValue leftValue, IonValue rightValue) throws ExpressionException {
            if (IonValueUtils.isNull(leftValue) || IonValueUtils.isNull(rightValue)) {
                return NULL;
            }
            if (operator == TokenType.PLUS && leftValue instanceof IonString leftString
                && rightValue instanceof IonString rightString) {
                return IonValueUtils.system().newString(leftString.stringValue() + rightString.stringValue());
            }
            if (leftValue instanceof IonInt leftInt && rightValue instanceof IonInt rightInt && operator != TokenType.SLASH) {
                return integerArithmetic(leftInt.bigIntegerValue(), rightInt.bigIntegerValue());
            }
            BigDecimal leftDecimal = asDecimal(leftValue);
            BigDecimal rightDecimal = asDecimal(rightValue);
            BigDecimal result = switch (operator) {
                case PLUS -> leftDecimal.add(rightDecimal);
                case MINUS -> leftDecimal.subtract(rightDecimal);
                case STAR -> leftDecimal.multiply(rightDecimal);
                case SLASH -> rightDecimal.signum() == 0
                    ? null
                    : leftDecimal.divide(rightDecimal, MathContext.DECIMAL64);
                case PERCENT -> rightDecimal.signum() == 0 ? null : floorMod(leftDecimal, rightDecimal);
                default -> throw new ExpressionException("Unsupported arithmetic operator: " + operator);
            };
            if (result == null) {
                return NULL;
            }
            if (leftValue instanceof IonFloat || rightValue instanceof IonFloat) {
                return IonValueUtils.system().newFloat(result.doubleValue());
            }
            return IonValueUtils.system().newDecimal(result);
        }

        private IonValue integerArithmetic(BigInteger leftInt, BigInteger rightInt) throws ExpressionException {
            BigInteger result = switch (operator) {
                case PLUS -> leftInt.add(rightInt);
                case MINUS -> leftInt.subtract(rightInt);
                case STAR -> leftInt.multiply(rightInt);
                case PERCENT -> rightInt.signum() == 0 ? null : floorMod(leftInt, rightInt);
                default -> throw new ExpressionException("Unsupported arithmetic operator: " + operator);
            };
            return result == null ? NULL : IonValueUtils.system().newInt(result);
        }

        // the result takes the sign of the divisor
        private static BigInteger floorMod(BigInteger dividend, BigInteger divisor) {
            BigInteger remainder = dividend.remainder(divisor);
            return remainder.signum() != 0 && remainder.signum() != divisor.signum() ? remainder.add(divisor) : remainder;
        }

        private static BigDecimal floorMod(BigDecimal dividend, BigDecimal divisor) {
            BigDecimal remainder = dividend.remainder(divisor);
            return remainder.signum() != 0 && remainder.signum() != divisor.signum() ? remainder.add(divisor) : remainder;
        }
    }

    private static final class ConditionalExpr implements Expr {
        private final Expr condition;
        private final Expr whenTrue;
        private final Expr whenFalse;

        private ConditionalExpr(Expr condition, Expr whenTrue, Expr whenFalse) {
            this.condition = condition;
            this.whenTrue = whenTrue;
            this.whenFalse = whenFalse;
        }

        @Override
        public IonValue eval(EvalContext context) throws ExpressionException {
            IonValue test = condition.eval(context);
            boolean truthy = !IonValueUtils.isNull(test) && asBoolean(test);
            return truthy ? whenTrue.eval(context) : whenFalse.eval(context);
        }

        @Override
        public IonTypeName resultType(FunctionTable functions) {
            IonTypeName trueType = whenTrue.resultType(functions);
            return trueType == whenFalse.resultType(functions) ? trueType : null;
        }
    }

    private static final class FunctionExpr implements Expr {
        private final String name;
        private final List<Expr> args;

        private FunctionExpr(String name, List<Expr> args) {
            this.name = name;
            this.args = args;
        }

        @Override
        public IonValue eval(EvalContext context) throws ExpressionException {
            MapFunction function = context.functions().get(name);
            if (function == null) {
                throw new ExpressionException("Unknown function: " + name);
            }
            List<IonValue> values = new ArrayList<>(args.size());
            for (Expr expr : args) {
                values.add(expr.eval(context));
            }
            IonValue result = function.apply(Collections.unmodifiableList(values));
            return result == null ? NULL : result;
        }

        @Override
        public IonTypeName resultType(FunctionTable functions) {
            MapFunction function = functions.get(name);
            return function == null ? null : function.returnType();
        }
    }

    private static boolean asBoolean(IonValue value) throws ExpressionException {
        try {
            Boolean bool = IonValueUtils.asBoolean(value);
            return bool != null && bool;
        } catch (CastException e) {
            throw new ExpressionException(e.getMessage(), e);
        }
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

    private enum TokenType {
        IDENT,
        NUMBER,
        STRING,
        LPAREN,
        RPAREN,
        COMMA,
        DOT,
        LBRACKET,
        RBRACKET,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        PERCENT,
        AND_AND,
        OR_OR,
        EQ_EQ,
        NOT_EQ,
        GT,
        GTE,
        LT,
        LTE,
        BANG,
        IF,
        ELSE,
        EOF
    }

    private record Token(TokenType type, String text) {
    }

    private static final class Tokenizer {
        private final String input;
        private int index;

        private Tokenizer(String input) {
            this.input = input;
        }

        Token next() throws ExpressionException {
            skipWhitespace();
            if (index >= input.length()) {
                return new Token(TokenType.EOF, "");
            }
            char current = input.charAt(index);
            if (Character.isLetter(current) || current == '_') {
                return keyword(readIdentifier());
            }
            if (Character.isDigit(current)) {
                return readNumber();
            }
            if (current == '"' || current == '\'') {
                return readString(current);
            }
            if (current == '&' && peek('&')) {
                index += 2;
                return new Token(TokenType.AND_AND, "&&");
            }
            if (current == '|' && peek('|')) {
                index += 2;
                return new Token(TokenType.OR_OR, "||");
            }
            if (current == '=' && peek('=')) {
                index += 2;
                return new Token(TokenType.EQ_EQ, "==");
            }
            if (current == '!' && peek('=')) {
                index += 2;
                return new Token(TokenType.NOT_EQ, "!=");
            }
            if (current == '>' && peek('=')) {
                index += 2;
                return new Token(TokenType.GTE, ">=");
            }
            if (current == '<' && peek('=')) {
                index += 2;
                return new Token(TokenType.LTE, "<=");
            }
            index++;
            return switch (current) {
                case '(' -> new Token(TokenType.LPAREN, "(");
                case ')' -> new Token(TokenType.RPAREN, ")");
                case ',' -> new Token(TokenType.COMMA, ",");
                case '.' -> new Token(TokenType.DOT, ".");
                case '[' -> new Token(TokenType.LBRACKET, "[");
                case ']' -> new Token(TokenType.RBRACKET, "]");
                case '+' -> new Token(TokenType.PLUS, "+");
                case '-' -> new Token(TokenType.MINUS, "-");
                case '*' -> new Token(TokenType.STAR, "*");
                case '/' -> new Token(TokenType.SLASH, "/");
                case '%' -> new Token(TokenType.PERCENT, "%");
                case '>' -> new Token(TokenType.GT, ">");
                case '<' -> new Token(TokenType.LT, "<");
                case '!' -> new Token(TokenType.BANG, "!");
                default -> throw new ExpressionException("Unexpected character: " + current);
            };
        }

        private Token keyword(Token identifier) {
            return switch (identifier.text()) {
                case "and" -> new Token(TokenType.AND_AND, "and");
                case "or" -> new Token(TokenType.OR_OR, "or");
                case "not" -> new Token(TokenType.BANG, "not");
                case "if" -> new Token(TokenType.IF, "if");
                case "else" -> new Token(TokenType.ELSE, "else");
                default -> identifier;
            };
        }

        private Token readIdentifier() {
            int start = index;
            index++;
            while (index < input.length()) {
                char current = input.charAt(index);
                if (!Character.isLetterOrDigit(current) && current != '_') {
                    break;
                }
                index++;
            }
            return new Token(TokenType.IDENT, input.substring(start, index));
        }

        private Token readNumber() {
            int start = index;
            index++;
            while (index < input.length()) {
                char current = input.charAt(index);
                if (Character.isDigit(current) || current == '.') {
                    index++;
                    continue;
                }
                if (current == 'e' || current == 'E') {
                    index++;
                    if (index < input.length()) {
                        char sign = input.charAt(index);
                        if (sign == '+' || sign == '-') {
                            index++;
                        }
                    }
                    continue;
                }
                break;
            }
            return new Token(TokenType.NUMBER, input.substring(start, index));
        }

        private Token readString(char quote) throws ExpressionException {
            index++; // opening quote
            StringBuilder builder = new StringBuilder();
            while (index < input.length()) {
                char current = input.charAt(index);
                if (current == quote) {
                    index++;
                    return new Token(TokenType.STRING, builder.toString());
                }
                if (current == '\\') {
                    index++;
                    if (index >= input.length()) {
                        throw new ExpressionException("Unterminated string literal");
                    }
                    char escaped = input.charAt(index);
                    builder.append(switch (escaped) {
                        case '"', '\'', '\\', '/' -> escaped;
                        case 'n' -> '\n';
                        case 'r' -> '\r';
                        case 't' -> '\t';
                        default -> throw new ExpressionException("Invalid escape sequence: \\" + escaped);
                    });
                    index++;
                    continue;
                }
                builder.append(current);
                index++;
            }
            throw new ExpressionException("Unterminated string literal");
        }

        private boolean peek(char expected) {
            return index + 1 < input.length() && input.charAt(index + 1) == expected;
        }

        private void skipWhitespace() {
            while (index < input.length() && Character.isWhitespace(input.charAt(index))) {
                index++;
            }
        }
    }

    private static final class Parser {
        private final Tokenizer tokenizer;
        private Token current;
        private Token previous;

        private Parser(Tokenizer tokenizer) throws ExpressionException {
            this.tokenizer = tokenizer;
            this.current = tokenizer.next();
        }

        Expr parseExpression() throws ExpressionException {
            Expr expr = parseConditional();
            if (current.type() != TokenType.EOF) {
                throw new ExpressionException("Unexpected token: " + current.text());
            }
            return expr;
        }

        private Expr parseConditional() throws ExpressionException {
            Expr expr = parseOr();
            if (match(TokenType.IF)) {
                Expr condition = parseOr();
                consume(TokenType.ELSE, "Expected 'else'");
                return new ConditionalExpr(condition, expr, parseConditional());
            }
            return expr;
        }

        private Expr parseOr() throws ExpressionException {
            Expr expr = parseAnd();
            while (match(TokenType.OR_OR)) {
                expr = new BinaryExpr(expr, parseAnd(), TokenType.OR_OR);
            }
            return expr;
        }

        private Expr parseAnd() throws ExpressionException {
            Expr expr = parseNot();
            while (match(TokenType.AND_AND)) {
                expr = new BinaryExpr(expr, parseNot(), TokenType.AND_AND);
            }
            return expr;
        }

        // "not" binds looser than comparisons: "not a == b" is "not (a == b)"
        private Expr parseNot() throws ExpressionException {
            if (match(TokenType.BANG)) {
                return new UnaryExpr(TokenType.BANG, parseNot());
            }
            return parseEquality();
        }

        private Expr parseEquality() throws ExpressionException {
            Expr expr = parseComparison();
            while (true) {
                if (match(TokenType.EQ_EQ)) {
                    expr = new BinaryExpr(expr, parseComparison(), TokenType.EQ_EQ);
                } else if (match(TokenType.NOT_EQ)) {
                    expr = new BinaryExpr(expr, parseComparison(), TokenType.NOT_EQ);
                } else {
                    break;
                }
            }
            return expr;
        }

        private Expr parseComparison() throws ExpressionException {
            Expr expr = parseTerm();
            while (true) {
                if (match(TokenType.GT)) {
                    expr = new BinaryExpr(expr, parseTerm(), TokenType.GT);
                } else if (match(TokenType.GTE)) {
                    expr = new BinaryExpr(expr, parseTerm(), TokenType.GTE);
                } else if (match(TokenType.LT)) {
                    expr = new BinaryExpr(expr, parseTerm(), TokenType.LT);
                } else if (match(TokenType.LTE)) {
                    expr = new BinaryExpr(expr, parseTerm(), TokenType.LTE);
                } else {
                    break;
                }
            }
            return expr;
        }

        private Expr parseTerm() throws ExpressionException {
            Expr expr = parseFactor();
            while (true) {
                if (match(TokenType.PLUS)) {
                    expr = new BinaryExpr(expr, parseFactor(), TokenType.PLUS);
                } else if (match(TokenType.MINUS)) {
                    expr = new BinaryExpr(expr, parseFactor(), TokenType.MINUS);
                } else {
                    break;
                }
            }
            return expr;
        }

        private Expr parseFactor() throws ExpressionException {
            Expr expr = parseUnary();
            while (true) {
                if (match(TokenType.STAR)) {
                    expr = new BinaryExpr(expr, parseUnary(), TokenType.STAR);
                } else if (match(TokenType.SLASH)) {
                    expr = new BinaryExpr(expr, parseUnary(), TokenType.SLASH);
                } else if (match(TokenType.PERCENT)) {
                    expr = new BinaryExpr(expr, parseUnary(), TokenType.PERCENT);
                } else {
                    break;
                }
            }
            return expr;
        }

        private Expr parseUnary() throws ExpressionException {
            if (match(TokenType.MINUS)) {
                return new UnaryExpr(TokenType.MINUS, parseUnary());
            }
            return parsePrimary();
        }

        private Expr parsePrimary() throws ExpressionException {
            if (match(TokenType.NUMBER)) {
                return parseNumber(previous.text());
            }
            if (match(TokenType.STRING)) {
                return new LiteralExpr(readOnly(IonValueUtils.system().newString(previous.text())));
            }
            if (match(TokenType.IDENT)) {
                String ident = previous.text();
                if ("true".equals(ident) || "True".equals(ident)) {
                    return new LiteralExpr(readOnly(IonValueUtils.system().newBool(true)));
                }
                if ("false".equals(ident) || "False".equals(ident)) {
                    return new LiteralExpr(readOnly(IonValueUtils.system().newBool(false)));
                }
                if ("null".equals(ident) || "None".equals(ident)) {
                    return new LiteralExpr(NULL);
                }
                return parseAccess(ident);
            }
            if (match(TokenType.LPAREN)) {
                Expr expr = parseConditional();
                consume(TokenType.RPAREN, "Expected ')'");
                return expr;
            }
            throw new ExpressionException("Unexpected token: " + (current.type() == TokenType.EOF ? "end of input" : current.text()));
        }

        private Expr parseNumber(String raw) throws ExpressionException {
            try {
                if (raw.indexOf('.') < 0 && raw.indexOf('e') < 0 && raw.indexOf('E') < 0) {
                    return new LiteralExpr(readOnly(IonValueUtils.system().newInt(new BigInteger(raw))));
                }
                return new LiteralExpr(readOnly(IonValueUtils.system().newDecimal(new BigDecimal(raw))));
            } catch (NumberFormatException e) {
                throw new ExpressionException("Invalid number literal: " + raw, e);
            }
        }

        private Expr parseAccess(String root) throws ExpressionException {
            List<PathSegment> segments = new ArrayList<>();
            StringBuilder qualifiedName = new StringBuilder(root);
            boolean plainName = true;
            while (true) {
                if (match(TokenType.LBRACKET)) {
                    plainName = false;
                    segments.add(parseBracket());
                    continue;
                }
                if (match(TokenType.DOT)) {
                    consume(TokenType.IDENT, "Expected identifier after '.'");
                    String name = previous.text();
                    segments.add(PathSegment.field(name));
                    qualifiedName.append('.').append(name);
                    continue;
                }
                break;
            }
            if (match(TokenType.LPAREN)) {
                if (!plainName) {
                    throw new ExpressionException("Only named functions can be called");
                }
                List<Expr> args = new ArrayList<>();
                if (!check(TokenType.RPAREN)) {
                    do {
                        args.add(parseConditional());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RPAREN, "Expected ')'");
                return new FunctionExpr(qualifiedName.toString(), List.copyOf(args));
            }
            return new PathExpr(root, List.copyOf(segments));
        }

        private PathSegment parseBracket() throws ExpressionException {
            if (match(TokenType.RBRACKET)) {
                return PathSegment.expand();
            }
            if (match(TokenType.STRING)) {
                String fieldName = previous.text();
                consume(TokenType.RBRACKET, "Expected ']'");
                return PathSegment.field(fieldName);
            }
            boolean negative = match(TokenType.MINUS);
            if (match(TokenType.NUMBER)) {
                int position;
                try {
                    position = Integer.parseInt(previous.text());
                } catch (NumberFormatException e) {
                    throw new ExpressionException("Invalid index: " + previous.text(), e);
                }
                consume(TokenType.RBRACKET, "Expected ']'");
                return PathSegment.index(negative ? -position : position);
            }
            throw new ExpressionException("Expected ']', string key or integer index after '['");
        }

        private boolean match(TokenType type) throws ExpressionException {
            if (check(type)) {
                advance();
                return true;
            }
            return false;
        }

        private boolean check(TokenType type) {
            return current.type() == type;
        }

        private void advance() throws ExpressionException {
            previous = current;
            current = tokenizer.next();
        }

        private void consume(TokenType type, String message) throws ExpressionException {
            if (check(type)) {
                advance();
                return;
            }
            throw new ExpressionException(message);
        }
    }
}
