package io.github.codegraph.model;

public enum RelationshipKind {
    CALLS,
    EXTENDS,
    IMPORTS,
    CONTAINS,
    /** Definition to declaration link, added when per-file results are merged. */
    DEFINES
}
