package com.keystone.core.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output contract a step's output must conform to.
 *
 * @param name     contract name referenced by plan steps
 * @param required required fields and their types
 * @param optional optional fields; type-checked when present
 * @param autofix  fill missing autofixable required fields with empty defaults instead of failing
 */
public record OutputSchema(
    String name,
    Map<String, FieldType> required,
    Map<String, FieldType> optional,
    boolean autofix
) {

    public OutputSchema {
        required = required == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(required));
        optional = optional == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(optional));
    }

    public OutputSchema withAutofix(boolean enabled) {
        return new OutputSchema(name, required, optional, enabled);
    }

    /**
     * Structural check of a parsed output.
     *
     * @param errors        violations; empty when the output conforms
     * @param fixedFields   required fields filled by autofix
     * @param output        the output after autofix (the input itself when nothing was fixed)
     */
    public record Result(List<String> errors, List<String> fixedFields, JsonNode output) {
        public boolean valid() {
            return errors.isEmpty();
        }
    }

    public Result check(JsonNode output) {
        var errors = new ArrayList<String>();
        var fixed = new ArrayList<String>();
        if (output == null || !output.isObject()) {
            errors.add("output must be a JSON object");
            return new Result(errors, fixed, output);
        }
        JsonNode working = output;
        for (var field : required.entrySet()) {
            JsonNode value = working.get(field.getKey());
            if (value == null || value.isNull()) {
                if (autofix && field.getValue().autofixable()) {
                    if (working == output) {
                        working = output.deepCopy();
                    }
                    ((ObjectNode) working).set(field.getKey(), field.getValue().emptyDefault());
                    fixed.add(field.getKey());
                } else {
                    errors.add("missing required field '" + field.getKey() + "'");
                }
            } else if (!field.getValue().matches(value)) {
                errors.add("field '" + field.getKey() + "' must be " + field.getValue()
                        + " but was " + value.getNodeType());
            }
        }
        for (var field : optional.entrySet()) {
            JsonNode value = working.get(field.getKey());
            if (value != null && !value.isNull() && !field.getValue().matches(value)) {
                errors.add("field '" + field.getKey() + "' must be " + field.getValue()
                        + " but was " + value.getNodeType());
            }
        }
        return new Result(errors, fixed, working);
    }
}
