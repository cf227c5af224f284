package io.github.codegraph.extractor.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * One level of lexical nesting. Anonymous frames have a null {@link #name()}; they still separate lookups but add
 * nothing to visible qualified names.
 */
public final class ScopeFrame {
    private final @Nullable String name;
    private final FrameKind kind;
    private final int nodeId;
    private final String lookupTag;
    private final List<String> usingNamespaces = new ArrayList<>();

    ScopeFrame(@Nullable String name, FrameKind kind, int nodeId) {
        this.name = name;
        this.kind = kind;
        this.nodeId = nodeId;
        this.lookupTag = name != null ? name : "(anonymous@" + nodeId + ")";
    }

    public @Nullable String name() {
        return name;
    }

    public FrameKind kind() {
        return kind;
    }

    /** Id of the syntax node that opened this frame. */
    public int nodeId() {
        return nodeId;
    }

    public boolean anonymous() {
        return name == null;
    }

    String lookupTag() {
        return lookupTag;
    }

    void addUsingNamespace(String namespace) {
        if (!usingNamespaces.contains(namespace)) {
            usingNamespaces.add(namespace);
        }
    }

    List<String> usingNamespaces() {
        return Collections.unmodifiableList(usingNamespaces);
    }

    @Override
    public String toString() {
        return kind + ":" + lookupTag;
    }
}
