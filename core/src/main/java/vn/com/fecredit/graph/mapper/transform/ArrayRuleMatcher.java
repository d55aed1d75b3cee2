package vn.com.fecredit.graph.mapper.transform;

import com.fasterxml.jackson.databind.JsonNode;
import vn.com.fecredit.graph.mapper.model.TransformRule;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Evaluates ARRAY_TO_BOOL rules: true when some element of the source array satisfies the
 * rule. Conditions are {@code field=value} clauses joined with {@code AND}; values may be
 * single or double quoted.
 */
public final class ArrayRuleMatcher {

    private static final Pattern AND = Pattern.compile("\\s+(?i:AND)\\s+");

    private ArrayRuleMatcher() {
    }

    public static boolean matches(JsonNode source, TransformRule rule) {
        List<JsonNode> elements = new ArrayList<>();
        if (source.isArray()) {
            source.forEach(elements::add);
        } else {
            elements.add(source);
        }
        for (JsonNode el : elements) {
            if (matchesElement(el, rule)) return true;
        }
        return false;
    }

    private static boolean matchesElement(JsonNode el, TransformRule rule) {
        String condition = rule.getCondition();
        if (condition != null && !condition.isBlank()) {
            for (String clause : AND.split(condition.trim())) {
                int eq = clause.indexOf('=');
                if (eq <= 0) return false;
                String field = clause.substring(0, eq).trim();
                String expected = unquote(clause.substring(eq + 1).trim());
                JsonNode actual = el.path(field);
                if (actual.isMissingNode() || actual.isNull() || !actual.asText().equals(expected)) {
                    return false;
                }
            }
            return true;
        }
        if (rule.getValue() != null) {
            JsonNode actual = rule.getField() == null ? el : el.path(rule.getField());
            return actual.isValueNode() && actual.asText().equals(rule.getValue());
        }
        // no condition at all: any element counts
        return true;
    }

    private static String unquote(String s) {
        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return s.substring(1, s.length() - 1);
            }
        }
        return s;
    }
}
