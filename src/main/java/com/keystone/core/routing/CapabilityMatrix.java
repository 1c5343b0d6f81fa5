package com.keystone.core.routing;

import com.keystone.core.model.TaskType;
import com.keystone.core.roles.Capability;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static {task type -> capabilities} matrix: the primary capability owns the task, the
 * supporting capabilities contribute alongside it.
 */
public final class CapabilityMatrix {

    public record Entry(Capability primary, List<Capability> supporting) {}

    private static final Map<TaskType, Entry> MATRIX = new EnumMap<>(TaskType.class);

    static {
        MATRIX.put(TaskType.IMPLEMENTATION, new Entry(Capability.IMPLEMENTATION, List.of()));
        MATRIX.put(TaskType.BUGFIX, new Entry(Capability.IMPLEMENTATION, List.of(Capability.TESTING)));
        MATRIX.put(TaskType.REFACTOR, new Entry(Capability.IMPLEMENTATION, List.of(Capability.ARCHITECTURE_DESIGN)));
        MATRIX.put(TaskType.TESTING, new Entry(Capability.TESTING, List.of(Capability.IMPLEMENTATION)));
        MATRIX.put(TaskType.DOCUMENTATION, new Entry(Capability.DOCUMENTATION, List.of()));
        MATRIX.put(TaskType.SPECIFICATION, new Entry(Capability.SPECIFICATION, List.of(Capability.REQUIREMENTS)));
        MATRIX.put(TaskType.ARCHITECTURE, new Entry(Capability.ARCHITECTURE_DESIGN, List.of(Capability.IMPLEMENTATION)));
        MATRIX.put(TaskType.INFRASTRUCTURE, new Entry(Capability.INFRASTRUCTURE, List.of(Capability.IMPLEMENTATION)));
        MATRIX.put(TaskType.UI, new Entry(Capability.UX_DESIGN, List.of(Capability.IMPLEMENTATION)));
        MATRIX.put(TaskType.RESEARCH, new Entry(Capability.RESEARCH, List.of(Capability.REQUIREMENTS)));
    }

    private CapabilityMatrix() {}

    public static Entry entryFor(TaskType type) {
        return MATRIX.get(type);
    }
}
