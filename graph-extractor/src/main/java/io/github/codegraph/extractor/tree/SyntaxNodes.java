package io.github.codegraph.extractor.tree;

import io.github.codegraph.tree.SyntaxNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/** Traversal helpers shared by the extractor, resolver and slicer. */
public final class SyntaxNodes {

    private SyntaxNodes() {}

    /** Finds the first node, in pre-order, matching the predicate. */
    public static @Nullable SyntaxNode findFirst(@Nullable SyntaxNode root, Predicate<SyntaxNode> predicate) {
        if (root == null) {
            return null;
        }
        var stack = new ArrayDeque<SyntaxNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (predicate.test(node)) {
                return node;
            }
            pushChildrenReversed(stack, node);
        }
        return null;
    }

    /** Finds all nodes matching the predicate, in pre-order. */
    public static List<SyntaxNode> findAll(@Nullable SyntaxNode root, Predicate<SyntaxNode> predicate) {
        var results = new ArrayList<SyntaxNode>();
        if (root == null) {
            return results;
        }
        var stack = new ArrayDeque<SyntaxNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (predicate.test(node)) {
                results.add(node);
            }
            pushChildrenReversed(stack, node);
        }
        return results;
    }

    public static @Nullable SyntaxNode firstChildOfKind(SyntaxNode node, Set<String> kinds) {
        for (var child : node.children()) {
            if (kinds.contains(child.kind())) {
                return child;
            }
        }
        return null;
    }

    public static boolean hasChildOfKind(SyntaxNode node, String kind) {
        for (var child : node.children()) {
            if (child.is(kind)) {
                return true;
            }
        }
        return false;
    }

    /** Text of a node with runs of whitespace collapsed to one space, or "" for null. */
    public static String compactText(@Nullable SyntaxNode node) {
        return node == null ? "" : collapseWhitespace(node.text());
    }

    public static String collapseWhitespace(String text) {
        return text.strip().replaceAll("\\s+", " ");
    }

    private static void pushChildrenReversed(ArrayDeque<SyntaxNode> stack, SyntaxNode node) {
        var children = new ArrayList<SyntaxNode>();
        node.children().forEach(children::add);
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
