package io.github.codegraph.model;

/** Non-fatal problems recorded against a file. None of them abort a batch. */
public enum ExtractionIssue {
    /** The parser produced no tree. */
    PARSE_TREE_MISSING,
    /** Scope frames were left open (or popped past empty) at the end of a traversal. */
    UNBALANCED_SCOPE,
    /** An entity ended before it started and was dropped. */
    MALFORMED_SPAN,
    /** The node budget ran out while reading the tree; the remainder of the file was not visited. */
    NODE_BUDGET_EXCEEDED,
    /** Declarations nested past the depth limit were not visited. */
    NESTING_TOO_DEEP,
    /** The tree contains error or missing nodes. */
    PARSE_ERRORS
}
