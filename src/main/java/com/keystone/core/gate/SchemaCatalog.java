package com.keystone.core.gate;

import com.keystone.core.plan.PlanBlueprint;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Output contracts by name. Ships the contracts {@link PlanBlueprint} assigns to routed steps;
 * ad-hoc blueprints may reference contracts registered at runtime.
 */
@Component
public class SchemaCatalog {

    private final Map<String, OutputSchema> schemas = new ConcurrentHashMap<>();

    public SchemaCatalog() {
        register(new OutputSchema(PlanBlueprint.PLAN_SCHEMA,
                fields("summary", FieldType.STRING, "steps", FieldType.ARRAY),
                fields("risks", FieldType.ARRAY, "requirements", FieldType.OBJECT),
                false));
        register(new OutputSchema(PlanBlueprint.WORK_SCHEMA,
                fields("summary", FieldType.STRING, "actions", FieldType.ARRAY),
                fields("requirements", FieldType.OBJECT, "notes", FieldType.STRING),
                false));
        register(new OutputSchema(PlanBlueprint.REVIEW_SCHEMA,
                fields("summary", FieldType.STRING, "approved", FieldType.BOOLEAN, "findings", FieldType.ARRAY),
                fields("requirements", FieldType.OBJECT),
                false));
    }

    public void register(OutputSchema schema) {
        schemas.put(schema.name(), schema);
    }

    public Optional<OutputSchema> get(String name) {
        return Optional.ofNullable(schemas.get(name));
    }

    public OutputSchema require(String name) {
        return get(name).orElseThrow(() -> new IllegalArgumentException("Unknown output schema: " + name));
    }

    private static Map<String, FieldType> fields(Object... pairs) {
        var map = new LinkedHashMap<String, FieldType>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (FieldType) pairs[i + 1]);
        }
        return map;
    }
}
