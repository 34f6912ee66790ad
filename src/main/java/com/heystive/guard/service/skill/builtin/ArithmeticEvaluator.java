package com.heystive.guard.service.skill.builtin;

/**
 * Recursive-descent evaluator for plain arithmetic. Nothing but numbers and operators is
 * ever interpreted.
 *
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := unary (('*' | '/' | '//' | '%') unary)*
 * unary  := ('+' | '-') unary | power
 * power  := atom (('^' | '**') unary)?
 * atom   := number | '(' expr ')'
 * </pre>
 *
 * <p>Integer operands stay integral under {@code + - * // % ^}; true division always
 * yields a double. Modulo and floor division round toward negative infinity.
 *
 * <p>Input is capped at {@value #MAX_EXPRESSION_CHARS} characters and at
 * {@value #MAX_NESTING} levels of nested parentheses, signs or exponents.
 */
final class ArithmeticEvaluator {

    static final int MAX_EXPRESSION_CHARS = 1024;
    static final int MAX_NESTING = 64;

    private final String src;
    private int pos;
    private int depth;

    private ArithmeticEvaluator(String src) {
        this.src = src;
    }

    /**
     * @throws IllegalArgumentException if the expression is malformed
     * @throws ArithmeticException on division by zero
     */
    static Number evaluate(String expression) {
        if (expression.length() > MAX_EXPRESSION_CHARS) {
            throw new IllegalArgumentException("Expression longer than " + MAX_EXPRESSION_CHARS + " characters");
        }
        ArithmeticEvaluator parser = new ArithmeticEvaluator(expression.replace(" ", ""));
        Number value = parser.expr();
        if (parser.pos != parser.src.length()) {
            throw new IllegalArgumentException("Unexpected '" + parser.src.charAt(parser.pos)
                    + "' at position " + parser.pos);
        }
        return value;
    }

    private Number expr() {
        Number left = term();
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '+') {
                pos++;
                left = add(left, term());
            } else if (c == '-') {
                pos++;
                left = subtract(left, term());
            } else {
                break;
            }
        }
        return left;
    }

    private Number term() {
        Number left = unary();
        while (pos < src.length()) {
            if (src.startsWith("//", pos)) {
                pos += 2;
                left = floorDivide(left, unary());
                continue;
            }
            char c = src.charAt(pos);
            if (c == '*') {
                pos++;
                left = multiply(left, unary());
            } else if (c == '/') {
                pos++;
                left = divide(left, unary());
            } else if (c == '%') {
                pos++;
                left = modulo(left, unary());
            } else {
                break;
            }
        }
        return left;
    }

    private Number unary() {
        if (++depth > MAX_NESTING) {
            throw new IllegalArgumentException("Expression nested deeper than " + MAX_NESTING + " levels");
        }
        try {
            return signedOperand();
        } finally {
            depth--;
        }
    }

    private Number signedOperand() {
        if (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '-') {
                pos++;
                Number operand = unary();
                return operand instanceof Long ? (Number) (-operand.longValue()) : (Number) (-operand.doubleValue());
            }
            if (c == '+') {
                pos++;
                return unary();
            }
        }
        return power();
    }

    private Number power() {
        Number base = atom();
        if (src.startsWith("**", pos)) {
            pos += 2;
            return pow(base, unary());
        }
        if (pos < src.length() && src.charAt(pos) == '^') {
            pos++;
            return pow(base, unary());
        }
        return base;
    }

    private Number atom() {
        if (pos >= src.length()) {
            throw new IllegalArgumentException("Unexpected end of expression");
        }
        if (src.charAt(pos) == '(') {
            pos++;
            Number value = expr();
            if (pos >= src.length() || src.charAt(pos) != ')') {
                throw new IllegalArgumentException("Missing ')' at position " + pos);
            }
            pos++;
            return value;
        }
        int start = pos;
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '.')) {
            pos++;
        }
        if (start == pos) {
            throw new IllegalArgumentException("Expected number at position " + pos);
        }
        String literal = src.substring(start, pos);
        try {
            return literal.contains(".") ? (Number) Double.parseDouble(literal) : (Number) Long.parseLong(literal);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number: " + literal, e);
        }
    }

    private static boolean integral(Number a, Number b) {
        return a instanceof Long && b instanceof Long;
    }

    private static Number add(Number a, Number b) {
        return integral(a, b) ? (Number) Math.addExact(a.longValue(), b.longValue())
                : (Number) (a.doubleValue() + b.doubleValue());
    }

    private static Number subtract(Number a, Number b) {
        return integral(a, b) ? (Number) Math.subtractExact(a.longValue(), b.longValue())
                : (Number) (a.doubleValue() - b.doubleValue());
    }

    private static Number multiply(Number a, Number b) {
        return integral(a, b) ? (Number) Math.multiplyExact(a.longValue(), b.longValue())
                : (Number) (a.doubleValue() * b.doubleValue());
    }

    private static Number divide(Number a, Number b) {
        if (b.doubleValue() == 0.0) {
            throw new ArithmeticException("division by zero");
        }
        return a.doubleValue() / b.doubleValue();
    }

    private static Number floorDivide(Number a, Number b) {
        if (b.doubleValue() == 0.0) {
            throw new ArithmeticException("division by zero");
        }
        if (integral(a, b)) {
            return Math.floorDiv(a.longValue(), b.longValue());
        }
        return Math.floor(a.doubleValue() / b.doubleValue());
    }

    private static Number modulo(Number a, Number b) {
        if (b.doubleValue() == 0.0) {
            throw new ArithmeticException("modulo by zero");
        }
        if (integral(a, b)) {
            return Math.floorMod(a.longValue(), b.longValue());
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        return x - y * Math.floor(x / y);
    }

    private static Number pow(Number base, Number exponent) {
        if (integral(base, exponent) && exponent.longValue() >= 0 && exponent.longValue() <= 62) {
            long result = 1;
            for (long i = 0; i < exponent.longValue(); i++) {
                result = Math.multiplyExact(result, base.longValue());
            }
            return result;
        }
        return Math.pow(base.doubleValue(), exponent.doubleValue());
    }
}
