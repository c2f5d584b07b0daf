package com.keystone.workflow.core.engine.flow.condition;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates edge conditions of decision nodes against flow variables.
 *
 * <h2>Grammar</h2>
 * <ul>
 *   <li>{@code field == literal} and {@code field != literal}, the literal optionally double-quoted</li>
 *   <li>{@code field > number}, {@code >=}, {@code <}, {@code <=} for numeric variables</li>
 *   <li>{@code field} alone, true when the variable is truthy</li>
 * </ul>
 *
 * <p>Literals {@code true} and {@code false} match both boolean values and their string form.
 * Numeric literals only match numeric variables. Anything else compares the variable's string form.
 * Expressions outside the grammar evaluate to {@code false}.
 */
@Slf4j
public class KeystoneConditionEvaluator {

    private static final Pattern COMPARISON = Pattern.compile("^(\\w+)\\s*(==|!=|>=|<=|>|<)\\s*\"?([^\"]*)\"?$");
    private static final Pattern FIELD = Pattern.compile("^\\w+$");

    public boolean evaluate(String condition, Map<String, Object> variables) {
        if (condition == null) {
            return false;
        }
        String expression = condition.trim();
        try {
            Matcher matcher = COMPARISON.matcher(expression);
            if (matcher.matches()) {
                Object actual = variables.get(matcher.group(1));
                String operator = matcher.group(2);
                String expected = matcher.group(3);
                switch (operator) {
                    case "==":
                        return equalsLiteral(actual, expected);
                    case "!=":
                        return !equalsLiteral(actual, expected);
                    default:
                        return compareNumeric(actual, operator, expected);
                }
            }
            if (FIELD.matcher(expression).matches()) {
                return isTruthy(variables.get(expression));
            }
            log.debug("Condition is not a supported expression, treating as false: [{}]", condition);
            return false;
        } catch (RuntimeException e) {
            log.debug("Condition evaluation failed, treating as false: [{}]", condition, e);
            return false;
        }
    }

    private boolean equalsLiteral(Object actual, String expected) {
        if ("true".equals(expected)) {
            return Boolean.TRUE.equals(actual) || "true".equals(actual);
        }
        if ("false".equals(expected)) {
            return Boolean.FALSE.equals(actual) || "false".equals(actual);
        }
        BigDecimal number = parseNumber(expected);
        if (number != null) {
            BigDecimal actualNumber = toNumber(actual);
            return actualNumber != null && actualNumber.compareTo(number) == 0;
        }
        return String.valueOf(actual).equals(expected);
    }

    private boolean compareNumeric(Object actual, String operator, String expected) {
        BigDecimal limit = parseNumber(expected);
        BigDecimal value = toNumber(actual);
        if (limit == null || value == null) {
            return false;
        }
        int comparison = value.compareTo(limit);
        switch (operator) {
            case ">":
                return comparison > 0;
            case ">=":
                return comparison >= 0;
            case "<":
                return comparison < 0;
            case "<=":
                return comparison <= 0;
            default:
                return false;
        }
    }

    private BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return null;
    }

    private BigDecimal parseNumber(String literal) {
        if (literal == null || literal.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(literal.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number) {
            BigDecimal number = toNumber(value);
            return number != null && number.signum() != 0;
        }
        if (value instanceof String string) {
            return !string.isEmpty();
        }
        return true;
    }
}
