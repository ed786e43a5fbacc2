package com.plotline.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.plotline.core.model.ContinuityIssue;
import com.plotline.core.model.ContinuityIssueType;
import com.plotline.core.model.Severity;
import com.plotline.core.model.TextSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Tolerant accessors over decoded provider JSON, shared by every analysis pass.
 * <p>
 * Provider output is never trusted: every accessor takes an explicit default and returns it
 * for missing, null or mistyped fields. None of these methods throw.
 */
public final class ResponseDecoder {

    private ResponseDecoder() {}

    /**
     * Finds the object that carries {@code marker}. Providers nest their payload under
     * varying wrapper keys; the root wins when it already has the marker, then the first
     * wrapper that is an object.
     */
    public static JsonNode locate(JsonNode root, String marker, String... wrapperKeys) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return root;
        }
        if (root.has(marker)) {
            return root;
        }
        for (String key : wrapperKeys) {
            JsonNode wrapped = root.get(key);
            if (wrapped != null && wrapped.isObject()) {
                return wrapped;
            }
        }
        return root;
    }

    /** A score in [0, 1]. Numbers and numeric strings are accepted; out-of-range values are clamped. */
    public static double score(JsonNode node, String field, double defaultValue) {
        double value = number(node, field, Double.NaN);
        if (Double.isNaN(value)) {
            return defaultValue;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static double number(JsonNode node, String field, double defaultValue) {
        JsonNode value = node == null ? null : node.get(field);
        return asNumber(value, defaultValue);
    }

    public static double asNumber(JsonNode value, double defaultValue) {
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isNumber()) {
            double d = value.asDouble();
            return Double.isFinite(d) ? d : defaultValue;
        }
        if (value.isTextual()) {
            try {
                double d = Double.parseDouble(value.asText().trim());
                return Double.isFinite(d) ? d : defaultValue;
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static int integer(JsonNode node, String field, int defaultValue) {
        double value = number(node, field, Double.NaN);
        return Double.isNaN(value) ? defaultValue : (int) Math.round(value);
    }

    public static boolean flag(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if ("true".equalsIgnoreCase(text)) return true;
            if ("false".equalsIgnoreCase(text)) return false;
        }
        return defaultValue;
    }

    public static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return defaultValue;
        }
        return value.asText();
    }

    /** String elements of an array field; a bare string becomes a one-element list. */
    public static List<String> strings(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        List<String> result = new ArrayList<>();
        if (value == null || value.isNull()) {
            return result;
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (element.isValueNode() && !element.isNull()) {
                    result.add(element.asText());
                }
            }
        } else if (value.isTextual()) {
            result.add(value.asText());
        }
        return result;
    }

    /** Object elements of an array field; anything else is skipped. */
    public static List<JsonNode> objects(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        List<JsonNode> result = new ArrayList<>();
        if (value != null && value.isArray()) {
            for (JsonNode element : value) {
                if (element.isObject()) {
                    result.add(element);
                }
            }
        }
        return result;
    }

    /**
     * Generic scene-local issues under {@code issues}.
     */
    public static List<ContinuityIssue> continuityIssues(JsonNode root) {
        List<ContinuityIssue> issues = new ArrayList<>();
        for (JsonNode node : objects(root, "issues")) {
            TextSpan span = null;
            JsonNode spanNode = node.get("textSpan");
            if (spanNode != null && spanNode.isArray() && spanNode.size() >= 2) {
                span = new TextSpan((int) asNumber(spanNode.get(0), 0), (int) asNumber(spanNode.get(1), 0));
            }
            issues.add(new ContinuityIssue(
                    ContinuityIssueType.normalize(text(node, "type", null)),
                    Severity.normalize(text(node, "severity", null)),
                    text(node, "description", ""),
                    span,
                    text(node, "suggestedFix", null)));
        }
        return issues;
    }
}
