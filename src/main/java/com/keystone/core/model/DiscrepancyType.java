package com.keystone.core.model;

public enum DiscrepancyType {
    MISSING_CONTENT,         // record without stored content
    ORPHANED_CONTENT,        // stored content without record
    CONTENT_MODIFIED,        // stored content no longer matches the recorded hash
    UNSATISFIED_DEPENDENCY   // record depends on an artifact the registry does not hold
}
