package io.github.codegraph.model;

/** How certain the resolver is that a relationship's target is correctly identified. */
public enum Confidence {
    /** Resolved to a known entity in the same file. */
    EXACT,
    /** Matches an external reference or an unresolved symbol by name. */
    PROBABLE,
    /** Best-effort string match only, e.g. a call through a function pointer. */
    UNKNOWN
}
