package com.errorengine.routing;

import com.errorengine.model.ConditionOperator;
import com.errorengine.model.RoutingCondition;
import com.errorengine.util.RowValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates a single routing condition against an error row.
 *
 * <p>A missing field reads as the empty string. Text comparisons fold case unless the condition is
 * case-sensitive. Ordering operators compare numerically when both sides parse as numbers; a
 * numeric field compared with a non-numeric literal never matches. Regex operators use find
 * semantics. Any evaluation problem makes the condition false.
 */
@Slf4j
@Component
public class ConditionEvaluator {

    private final Map<String, Optional<Pattern>> patternCache = new ConcurrentHashMap<>();

    public boolean matches(RoutingCondition condition, Map<String, Object> row) {
        ConditionOperator op = condition.getOperator();
        if (op == null) {
            log.warn("Routing condition without operator treated as no match: field={}", condition.getFieldName());
            return false;
        }
        try {
            String fieldText = RowValues.asText(RowValues.lookup(row, condition.getFieldName()));
            String literal = condition.getValue() != null ? condition.getValue() : "";
            boolean cs = condition.isCaseSensitive();

            return switch (op) {
                case IS_EMPTY -> fieldText.trim().isEmpty();
                case IS_NOT_EMPTY -> !fieldText.trim().isEmpty();
                case REGEX -> regexFind(literal, cs, fieldText).orElse(false);
                case NOT_REGEX -> regexFind(literal, cs, fieldText).map(found -> !found).orElse(false);
                case GT -> compare(fieldText, literal, cs).stream().anyMatch(c -> c > 0);
                case GTE -> compare(fieldText, literal, cs).stream().anyMatch(c -> c >= 0);
                case LT -> compare(fieldText, literal, cs).stream().anyMatch(c -> c < 0);
                case LTE -> compare(fieldText, literal, cs).stream().anyMatch(c -> c <= 0);
                default -> textMatch(op, fold(fieldText, cs), fold(literal, cs));
            };
        } catch (RuntimeException e) {
            log.warn("Routing condition evaluation failed, treated as no match: field={}, operator={}",
                    condition.getFieldName(), op.getCode(), e);
            return false;
        }
    }

    /**
     * Check that a pattern compiles, for edit-time validation.
     *
     * @param pattern regex
     * @return error description, empty when the pattern is valid
     */
    public static Optional<String> patternError(String pattern) {
        try {
            Pattern.compile(pattern);
            return Optional.empty();
        } catch (PatternSyntaxException e) {
            return Optional.of(e.getDescription());
        }
    }

    private static boolean textMatch(ConditionOperator op, String field, String literal) {
        return switch (op) {
            case EQUALS -> field.equals(literal);
            case NOT_EQUALS -> !field.equals(literal);
            case CONTAINS -> field.contains(literal);
            case NOT_CONTAINS -> !field.contains(literal);
            case STARTSWITH -> field.startsWith(literal);
            case ENDSWITH -> field.endsWith(literal);
            case IN -> inList(field, literal);
            case NOT_IN -> !inList(field, literal);
            default -> throw new IllegalStateException("Not a text operator: " + op);
        };
    }

    private static boolean inList(String field, String literal) {
        return Arrays.stream(literal.split(","))
                .map(String::trim)
                .anyMatch(field::equals);
    }

    private static OptionalInt compare(String fieldText, String literal, boolean caseSensitive) {
        Optional<BigDecimal> left = RowValues.parseNumber(fieldText);
        Optional<BigDecimal> right = RowValues.parseNumber(literal);
        if (left.isPresent() && right.isPresent()) {
            return OptionalInt.of(left.get().compareTo(right.get()));
        }
        if (left.isPresent()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(fold(fieldText, caseSensitive).compareTo(fold(literal, caseSensitive)));
    }

    private Optional<Boolean> regexFind(String pattern, boolean caseSensitive, String text) {
        return compiled(pattern, caseSensitive).map(p -> p.matcher(text).find());
    }

    private Optional<Pattern> compiled(String pattern, boolean caseSensitive) {
        String cacheKey = (caseSensitive ? "s:" : "i:") + pattern;
        return patternCache.computeIfAbsent(cacheKey, k -> {
            try {
                return Optional.of(caseSensitive
                        ? Pattern.compile(pattern)
                        : Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            } catch (PatternSyntaxException e) {
                log.warn("Invalid regex in routing condition, condition never matches: pattern={}, error={}",
                        pattern, e.getDescription());
                return Optional.empty();
            }
        });
    }

    private static String fold(String s, boolean caseSensitive) {
        return caseSensitive ? s : s.toLowerCase(Locale.ROOT);
    }
}
