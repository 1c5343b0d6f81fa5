package com.keystone.core.gate;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link QualityAssessor}.
 * <p>
 * Scores a reviewer wrote into the output's {@code quality} object (one number per criterion key)
 * are taken as given. Any criterion without an explicit score is derived from the output itself:
 * <ul>
 *   <li>completeness: share of required fields that are non-blank</li>
 *   <li>accuracy: 10 minus 2.5 per placeholder marker (TODO, TBD, FIXME, {@code {{var}}})</li>
 *   <li>clarity: length of the {@code summary} field</li>
 *   <li>consistency: 10 minus 5 per declared field holding an explicit null</li>
 *   <li>actionability: share of declared array fields that are non-empty</li>
 * </ul>
 */
@Component
public class HeuristicQualityAssessor implements QualityAssessor {

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\bTODO\\b|\\bTBD\\b|\\bFIXME\\b|\\{\\{\\s*[A-Za-z0-9_.-]+\\s*}}");

    @Override
    public Assessment assess(JsonNode output, OutputSchema schema) {
        var findings = new ArrayList<String>();
        var scores = new EnumMap<Criterion, Double>(Criterion.class);

        JsonNode explicit = output.path("quality");
        if (explicit.isObject()) {
            for (Criterion c : Criterion.values()) {
                JsonNode value = explicit.get(c.key());
                if (value != null && value.isNumber()) {
                    scores.put(c, QualityRubric.clamp(value.asDouble()));
                }
            }
        }

        scores.putIfAbsent(Criterion.COMPLETENESS, completeness(output, schema, findings));
        scores.putIfAbsent(Criterion.ACCURACY, accuracy(output, findings));
        scores.putIfAbsent(Criterion.CLARITY, clarity(output, findings));
        scores.putIfAbsent(Criterion.CONSISTENCY, consistency(output, schema, findings));
        scores.putIfAbsent(Criterion.ACTIONABILITY, actionability(output, schema, findings));
        return new Assessment(scores, findings);
    }

    private static double completeness(JsonNode output, OutputSchema schema, List<String> findings) {
        if (schema.required().isEmpty()) {
            return 10.0;
        }
        int filled = 0;
        for (String field : schema.required().keySet()) {
            if (isFilled(output.get(field))) {
                filled++;
            } else {
                findings.add("required field '" + field + "' is empty");
            }
        }
        return 10.0 * filled / schema.required().size();
    }

    private static double accuracy(JsonNode output, List<String> findings) {
        int markers = countPlaceholders(output, findings);
        return Math.max(0.0, 10.0 - 2.5 * markers);
    }

    private static double clarity(JsonNode output, List<String> findings) {
        JsonNode summary = output.get("summary");
        if (summary == null || !summary.isTextual()) {
            return 5.0;
        }
        int length = summary.asText().strip().length();
        if (length == 0) {
            findings.add("summary is blank");
            return 0.0;
        }
        if (length < 20) {
            findings.add("summary is very short");
            return 6.0;
        }
        return 10.0;
    }

    private static double consistency(JsonNode output, OutputSchema schema, List<String> findings) {
        int nulls = 0;
        for (String field : declaredFields(schema)) {
            JsonNode value = output.get(field);
            if (value != null && value.isNull()) {
                findings.add("field '" + field + "' is null");
                nulls++;
            }
        }
        return Math.max(0.0, 10.0 - 5.0 * nulls);
    }

    private static double actionability(JsonNode output, OutputSchema schema, List<String> findings) {
        int arrays = 0;
        int nonEmpty = 0;
        for (var field : schema.required().entrySet()) {
            if (field.getValue() != FieldType.ARRAY) continue;
            arrays++;
            JsonNode value = output.get(field.getKey());
            if (value != null && value.isArray() && !value.isEmpty()) {
                nonEmpty++;
            } else {
                findings.add("'" + field.getKey() + "' lists nothing");
            }
        }
        if (arrays == 0) {
            return 10.0;
        }
        return 2.0 + 8.0 * nonEmpty / arrays;
    }

    private static int countPlaceholders(JsonNode node, List<String> findings) {
        if (node.isTextual()) {
            Matcher m = PLACEHOLDER.matcher(node.asText());
            int count = 0;
            while (m.find()) {
                findings.add("placeholder '" + m.group() + "'");
                count++;
            }
            return count;
        }
        int count = 0;
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                if (!entry.getKey().equals("quality")) {
                    count += countPlaceholders(entry.getValue(), findings);
                }
            }
        } else if (node.isArray()) {
            for (JsonNode element : node) {
                count += countPlaceholders(element, findings);
            }
        }
        return count;
    }

    private static boolean isFilled(JsonNode value) {
        if (value == null || value.isNull()) return false;
        if (value.isTextual()) return !value.asText().isBlank();
        if (value.isContainerNode()) return !value.isEmpty();
        return true;
    }

    private static List<String> declaredFields(OutputSchema schema) {
        var fields = new ArrayList<>(schema.required().keySet());
        fields.addAll(schema.optional().keySet());
        return fields;
    }
}
