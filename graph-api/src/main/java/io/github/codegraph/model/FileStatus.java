package io.github.codegraph.model;

/** Outcome of extracting one file. */
public enum FileStatus {
    /** Extracted with no issues. */
    COMPLETE,
    /** Extracted, but the tree had syntax errors, was truncated, or some entities were dropped. */
    PARTIAL,
    /** No syntax tree was available; the result holds a single slice and nothing else. */
    EMPTY,
    /** Extraction threw; the result holds no entities. */
    FAILED,
    /** The pipeline was cancelled before this file started. */
    SKIPPED
}
