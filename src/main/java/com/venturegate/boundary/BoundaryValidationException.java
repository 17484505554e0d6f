package com.venturegate.boundary;

import java.util.List;

/**
 * Aborts a whole batch in closed (or strict) mode. Callers treat it as fatal for the
 * request; replaying the same malformed rows will fail the same way.
 */
public class BoundaryValidationException extends RuntimeException {

    private final EntityKind entityKind;
    private final List<BoundaryIssue> issues;

    public BoundaryValidationException(EntityKind entityKind, List<BoundaryIssue> issues) {
        super(entityKind.getLabel() + " boundary validation failed (" + issues.size() + " issues)");
        this.entityKind = entityKind;
        this.issues = List.copyOf(issues);
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public List<BoundaryIssue> getIssues() {
        return issues;
    }
}
