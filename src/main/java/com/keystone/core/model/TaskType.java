package com.keystone.core.model;

/**
 * Classified kind of work. Declaration order breaks keyword-score ties in the classifier.
 */
public enum TaskType {
    IMPLEMENTATION,
    BUGFIX,
    REFACTOR,
    TESTING,
    DOCUMENTATION,
    SPECIFICATION,
    ARCHITECTURE,
    INFRASTRUCTURE,
    UI,
    RESEARCH
}
