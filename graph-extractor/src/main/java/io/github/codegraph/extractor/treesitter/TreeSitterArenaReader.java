package io.github.codegraph.extractor.treesitter;

import io.github.codegraph.extractor.tree.ArenaSyntaxTree;
import java.util.ArrayDeque;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Copies a tree-sitter tree into an {@link ArenaSyntaxTree}, stopping once the node budget is spent. Nodes at the depth
 * limit are kept without their children, which bounds the recursion of every later visitor.
 */
final class TreeSitterArenaReader {
    private static final Logger logger = LogManager.getLogger(TreeSitterArenaReader.class);

    private record Pending(TSNode node, int parentId, @Nullable String fieldName, int depth) {}

    private TreeSitterArenaReader() {}

    static ArenaSyntaxTree read(TSNode root, String source, int maxNodes, int maxDepth) {
        var builder = ArenaSyntaxTree.builder(source);
        var stack = new ArrayDeque<Pending>();
        stack.push(new Pending(root, -1, null, 0));
        boolean truncated = false;
        boolean depthLimited = false;

        while (!stack.isEmpty()) {
            var pending = stack.pop();
            if (builder.size() >= maxNodes) {
                truncated = true;
                break;
            }
            var node = pending.node();
            int startRow = node.getStartPoint().getRow();
            var end = node.getEndPoint();
            // a node ending at column 0 ends on the previous line (preprocessor directives own their newline)
            int endRow = end.getColumn() == 0 && end.getRow() > startRow ? end.getRow() - 1 : end.getRow();
            int id = builder.add(
                    pending.parentId(),
                    node.getType(),
                    pending.fieldName(),
                    node.isNamed(),
                    node.isError() || node.isMissing(),
                    node.getStartByte(),
                    node.getEndByte(),
                    startRow,
                    endRow);

            int childCount = node.getChildCount();
            if (pending.depth() >= maxDepth) {
                depthLimited |= childCount > 0;
                continue;
            }
            for (int i = childCount - 1; i >= 0; i--) {
                var child = node.getChild(i);
                if (child == null || child.isNull()) {
                    continue;
                }
                stack.push(new Pending(child, id, node.getFieldNameForChild(i), pending.depth() + 1));
            }
        }

        if (truncated) {
            logger.warn("Node budget of {} exhausted; tree truncated", maxNodes);
        }
        if (depthLimited) {
            logger.warn("Tree nested deeper than {} levels; deeper nodes left out", maxDepth);
        }
        return builder.build(truncated, depthLimited);
    }
}
