package com.heystive.guard.service.skill.builtin;

import com.heystive.guard.service.skill.Skill;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates arithmetic such as {@code "2 + 3 * (4 - 1)"}. Only digits, {@code . ( )} and
 * the operators {@code + - * / % ^} are accepted, and at least one of {@code + - * /}
 * must appear.
 */
public final class CalcSkill implements Skill {

    private static final String ALLOWED = "0123456789+-*/().%^";
    private static final String REQUIRED_OPERATORS = "+-*/";

    @Override
    public String name() {
        return "calc";
    }

    @Override
    public String description() {
        return "Evaluates arithmetic expressions";
    }

    @Override
    public boolean canHandle(String text) {
        String t = text.replace(" ", "");
        if (t.isEmpty()) {
            return false;
        }
        boolean hasOperator = false;
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (ALLOWED.indexOf(c) < 0) {
                return false;
            }
            hasOperator |= REQUIRED_OPERATORS.indexOf(c) >= 0;
        }
        return hasOperator;
    }

    /**
     * @throws IllegalArgumentException if the expression is not valid arithmetic
     * @throws ArithmeticException on division by zero or overflow
     */
    @Override
    public Map<String, Object> handle(String text, Map<String, Object> args) {
        Object direct = args.get("expression");
        String expression = (direct != null ? direct.toString() : text).strip();
        if (!canHandle(expression)) {
            throw new IllegalArgumentException("Not an arithmetic expression: " + expression);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("expression", expression);
        result.put("result", ArithmeticEvaluator.evaluate(expression));
        return result;
    }
}
