package io.github.codegraph.extractor.slice;

import io.github.codegraph.extractor.tree.SyntaxNodes;
import io.github.codegraph.tree.SyntaxTree;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.Set;

/**
 * Marks which lines of a file carry code. A line is content when it has a non-whitespace byte outside every comment
 * node; text inside block comments never counts, whatever it looks like.
 */
public final class LineClassifier {

    private final BitSet content;
    private final int lineCount;

    private LineClassifier(BitSet content, int lineCount) {
        this.content = content;
        this.lineCount = lineCount;
    }

    /** @param commentKinds node kinds the grammar uses for comments */
    public static LineClassifier of(SyntaxTree tree, Set<String> commentKinds) {
        var bytes = tree.source().getBytes(StandardCharsets.UTF_8);
        var comments = new BitSet(bytes.length);
        for (var comment : SyntaxNodes.findAll(tree.root(), n -> commentKinds.contains(n.kind()))) {
            comments.set(Math.max(0, comment.startByte()), Math.min(bytes.length, comment.endByte()));
        }
        var content = new BitSet();
        int line = 0;
        for (int i = 0; i < bytes.length; i++) {
            byte b = bytes[i];
            if (b == '\n') {
                line++;
            } else if (!whitespace(b) && !comments.get(i)) {
                content.set(line);
            }
        }
        return new LineClassifier(content, tree.lineCount());
    }

    public boolean content(int line) {
        return content.get(line);
    }

    /** True if any line in {@code [from, to]} carries code. */
    public boolean anyContent(int from, int to) {
        int next = content.nextSetBit(Math.max(0, from));
        return next >= 0 && next <= to;
    }

    public int lineCount() {
        return lineCount;
    }

    private static boolean whitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\r' || b == '\f' || b == 0x0B;
    }
}
