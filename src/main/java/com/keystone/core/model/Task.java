package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A classified user request. Immutable once classified; complexity changes only through
 * explicit re-classification.
 *
 * @param id             deterministic identifier derived from the request text and file context
 * @param description    the original request text
 * @param type           classified kind of work
 * @param complexity     classified complexity tier
 * @param requiredGates  gates implied by the complexity tier
 * @param fileContext    files the request is known to touch (may be empty)
 * @param ambiguous      true when no type rule matched and the safe default was applied
 * @param reasons        the rules that fired, in evaluation order
 */
public record Task(
    String id,
    String description,
    TaskType type,
    Complexity complexity,
    RequiredGates requiredGates,
    List<String> fileContext,
    boolean ambiguous,
    List<String> reasons
) implements Serializable {

    public Task {
        fileContext = fileContext == null ? List.of() : List.copyOf(fileContext);
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
