package io.github.codegraph.tree;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Grammar-neutral view of one node in a {@link SyntaxTree}.
 *
 * <p>Nodes are addressed by {@link #id()}, an index into the owning tree, so holding a node never pins anything but
 * the tree itself. Lines are 0-based; byte offsets index the UTF-8 encoding of the source.
 */
public interface SyntaxNode {

    int id();

    /** Grammar kind tag, e.g. {@code function_definition}. Anonymous tokens use their literal text. */
    String kind();

    /** False for anonymous tokens such as punctuation and keywords. */
    boolean named();

    /** True for error and missing nodes inserted by error recovery. */
    boolean error();

    int startLine();

    int endLine();

    int startByte();

    int endByte();

    /** Field name this node occupies in its parent, if any. */
    @Nullable
    String fieldName();

    @Nullable
    SyntaxNode parent();

    /** All children in source order. The returned iterable is lazy and can be iterated repeatedly. */
    Iterable<SyntaxNode> children();

    /** Named children in source order. */
    List<SyntaxNode> namedChildren();

    /** First child occupying the given field. */
    @Nullable
    SyntaxNode field(String name);

    /** All children occupying the given field, in source order. */
    List<SyntaxNode> fields(String name);

    /** Raw source text covered by this node. */
    String text();

    default boolean is(String kindTag) {
        return kind().equals(kindTag);
    }
}
