package io.github.codegraph.tree;

import org.jetbrains.annotations.Nullable;

/** A parsed file: the root node plus the source it was parsed from. */
public interface SyntaxTree {

    /** Root node, or null when the parser produced nothing. */
    @Nullable
    SyntaxNode root();

    String source();

    SyntaxNode node(int id);

    int nodeCount();

    /** Number of lines in {@link #source()}; at least 1, a trailing newline does not open a new line. */
    int lineCount();

    /** True when the tree contains error or missing nodes. */
    boolean hasErrors();

    /** True when node collection stopped early and the tree covers only a prefix of the parse. */
    boolean truncated();

    /** True when subtrees nested deeper than the provider's depth limit were left out. */
    default boolean depthLimited() {
        return false;
    }
}
