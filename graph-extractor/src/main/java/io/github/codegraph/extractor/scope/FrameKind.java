package io.github.codegraph.extractor.scope;

public enum FrameKind {
    NAMESPACE,
    CLASS,
    STRUCT,
    UNION,
    ENUM,
    FUNCTION;

    /** Frames whose members are reached through {@code Type::member}. */
    public boolean typeFrame() {
        return this == CLASS || this == STRUCT || this == UNION;
    }
}
