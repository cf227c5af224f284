package io.github.codegraph.extractor.tree;

import io.github.codegraph.tree.SyntaxNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.Nullable;

/** A node handle: the owning arena plus an index into it. */
record ArenaNode(ArenaSyntaxTree tree, int id) implements SyntaxNode {

    @Override
    public String kind() {
        return tree.kindOf(id);
    }

    @Override
    public boolean named() {
        return tree.namedAt(id);
    }

    @Override
    public boolean error() {
        return tree.errorAt(id);
    }

    @Override
    public int startLine() {
        return tree.startLineOf(id);
    }

    @Override
    public int endLine() {
        return tree.endLineOf(id);
    }

    @Override
    public int startByte() {
        return tree.startByteOf(id);
    }

    @Override
    public int endByte() {
        return tree.endByteOf(id);
    }

    @Override
    public @Nullable String fieldName() {
        return tree.fieldNameOf(id);
    }

    @Override
    public @Nullable SyntaxNode parent() {
        int p = tree.parentOf(id);
        return p == ArenaSyntaxTree.NONE ? null : new ArenaNode(tree, p);
    }

    @Override
    public Iterable<SyntaxNode> children() {
        return () -> new Iterator<>() {
            private int next = tree.firstChildOf(id);

            @Override
            public boolean hasNext() {
                return next != ArenaSyntaxTree.NONE;
            }

            @Override
            public SyntaxNode next() {
                if (next == ArenaSyntaxTree.NONE) {
                    throw new NoSuchElementException();
                }
                var node = new ArenaNode(tree, next);
                next = tree.nextSiblingOf(next);
                return node;
            }
        };
    }

    @Override
    public List<SyntaxNode> namedChildren() {
        var result = new ArrayList<SyntaxNode>();
        for (int c = tree.firstChildOf(id); c != ArenaSyntaxTree.NONE; c = tree.nextSiblingOf(c)) {
            if (tree.namedAt(c)) {
                result.add(new ArenaNode(tree, c));
            }
        }
        return result;
    }

    @Override
    public @Nullable SyntaxNode field(String name) {
        for (int c = tree.firstChildOf(id); c != ArenaSyntaxTree.NONE; c = tree.nextSiblingOf(c)) {
            if (name.equals(tree.fieldNameOf(c))) {
                return new ArenaNode(tree, c);
            }
        }
        return null;
    }

    @Override
    public List<SyntaxNode> fields(String name) {
        var result = new ArrayList<SyntaxNode>();
        for (int c = tree.firstChildOf(id); c != ArenaSyntaxTree.NONE; c = tree.nextSiblingOf(c)) {
            if (name.equals(tree.fieldNameOf(c))) {
                result.add(new ArenaNode(tree, c));
            }
        }
        return result;
    }

    @Override
    public String text() {
        return tree.textOf(id);
    }

    @Override
    public String toString() {
        return kind() + "[" + startLine() + "-" + endLine() + "]";
    }
}
