package io.github.codegraph.extractor.tree;

import io.github.codegraph.tree.SyntaxNode;
import io.github.codegraph.tree.SyntaxTree;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link SyntaxTree} stored as parallel arrays indexed by node id.
 *
 * <p>Ids are assigned in pre-order, so a parent always has a smaller id than its children and sibling order follows
 * id order. Instances are immutable once built and safe to share between threads.
 */
public final class ArenaSyntaxTree implements SyntaxTree {
    static final int NONE = -1;

    private static final byte NAMED = 1;
    private static final byte ERROR = 2;

    private final String source;
    private final byte[] utf8;
    private final int lineCount;
    private final int count;
    private final String[] kinds;
    private final @Nullable String[] fieldNames;
    private final int[] parent;
    private final int[] firstChild;
    private final int[] nextSibling;
    private final int[] startByte;
    private final int[] endByte;
    private final int[] startLine;
    private final int[] endLine;
    private final byte[] flags;
    private final boolean hasErrors;
    private final boolean truncated;
    private final boolean depthLimited;

    private ArenaSyntaxTree(Builder b, boolean truncated, boolean depthLimited) {
        this.source = b.source;
        this.utf8 = b.utf8;
        this.lineCount = countLines(b.source);
        this.count = b.count;
        this.kinds = Arrays.copyOf(b.kinds, count);
        this.fieldNames = Arrays.copyOf(b.fieldNames, count);
        this.parent = Arrays.copyOf(b.parent, count);
        this.firstChild = Arrays.copyOf(b.firstChild, count);
        this.nextSibling = Arrays.copyOf(b.nextSibling, count);
        this.startByte = Arrays.copyOf(b.startByte, count);
        this.endByte = Arrays.copyOf(b.endByte, count);
        this.startLine = Arrays.copyOf(b.startLine, count);
        this.endLine = Arrays.copyOf(b.endLine, count);
        this.flags = Arrays.copyOf(b.flags, count);
        this.hasErrors = b.sawError;
        this.truncated = truncated;
        this.depthLimited = depthLimited;
    }

    public static Builder builder(String source) {
        return new Builder(source);
    }

    /** A tree with no nodes, for sources the parser could not handle. */
    public static ArenaSyntaxTree empty(String source) {
        return new Builder(source).build(false);
    }

    static int countLines(String text) {
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n' && i < text.length() - 1) {
                lines++;
            }
        }
        return lines;
    }

    @Override
    public @Nullable SyntaxNode root() {
        return count == 0 ? null : new ArenaNode(this, 0);
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public SyntaxNode node(int id) {
        if (id < 0 || id >= count) {
            throw new IndexOutOfBoundsException("No node " + id + " in tree of " + count + " nodes");
        }
        return new ArenaNode(this, id);
    }

    @Override
    public int nodeCount() {
        return count;
    }

    @Override
    public int lineCount() {
        return lineCount;
    }

    @Override
    public boolean hasErrors() {
        return hasErrors;
    }

    @Override
    public boolean truncated() {
        return truncated;
    }

    @Override
    public boolean depthLimited() {
        return depthLimited;
    }

    byte[] utf8() {
        return utf8;
    }

    String kindOf(int id) {
        return kinds[id];
    }

    @Nullable
    String fieldNameOf(int id) {
        return fieldNames[id];
    }

    int parentOf(int id) {
        return parent[id];
    }

    int firstChildOf(int id) {
        return firstChild[id];
    }

    int nextSiblingOf(int id) {
        return nextSibling[id];
    }

    int startByteOf(int id) {
        return startByte[id];
    }

    int endByteOf(int id) {
        return endByte[id];
    }

    int startLineOf(int id) {
        return startLine[id];
    }

    int endLineOf(int id) {
        return endLine[id];
    }

    boolean namedAt(int id) {
        return (flags[id] & NAMED) != 0;
    }

    boolean errorAt(int id) {
        return (flags[id] & ERROR) != 0;
    }

    String textOf(int id) {
        int start = Math.max(0, Math.min(startByte[id], utf8.length));
        int end = Math.max(start, Math.min(endByte[id], utf8.length));
        return new String(utf8, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Appends nodes in pre-order. Parsers feed this from their own trees; tests use it to hand-build trees for shapes a
     * real parser never produces.
     */
    public static final class Builder {
        private final String source;
        private final byte[] utf8;
        private final Map<String, String> internedKinds = new HashMap<>();
        private int count;
        private String[] kinds = new String[64];
        private @Nullable String[] fieldNames = new String[64];
        private int[] parent = new int[64];
        private int[] firstChild = new int[64];
        private int[] lastChild = new int[64];
        private int[] nextSibling = new int[64];
        private int[] startByte = new int[64];
        private int[] endByte = new int[64];
        private int[] startLine = new int[64];
        private int[] endLine = new int[64];
        private byte[] flags = new byte[64];
        private boolean sawError;

        private Builder(String source) {
            this.source = source;
            this.utf8 = source.getBytes(StandardCharsets.UTF_8);
        }

        public int size() {
            return count;
        }

        /**
         * Adds a node as the last child of {@code parentId} (or as the root when {@code parentId} is negative) and
         * returns its id.
         */
        public int add(
                int parentId,
                String kind,
                @Nullable String fieldName,
                boolean named,
                boolean error,
                int fromByte,
                int toByte,
                int fromLine,
                int toLine) {
            if (parentId >= count) {
                throw new IllegalArgumentException("Parent " + parentId + " has not been added yet");
            }
            if (parentId < 0 && count > 0) {
                throw new IllegalStateException("Tree already has a root");
            }
            ensureCapacity(count + 1);
            int id = count++;
            kinds[id] = internedKinds.computeIfAbsent(kind, k -> k);
            fieldNames[id] = fieldName;
            parent[id] = parentId < 0 ? NONE : parentId;
            firstChild[id] = NONE;
            lastChild[id] = NONE;
            nextSibling[id] = NONE;
            startByte[id] = fromByte;
            endByte[id] = toByte;
            startLine[id] = fromLine;
            endLine[id] = toLine;
            flags[id] = (byte) ((named ? NAMED : 0) | (error ? ERROR : 0));
            sawError |= error;
            if (parentId >= 0) {
                if (lastChild[parentId] == NONE) {
                    firstChild[parentId] = id;
                } else {
                    nextSibling[lastChild[parentId]] = id;
                }
                lastChild[parentId] = id;
            }
            return id;
        }

        public ArenaSyntaxTree build(boolean truncated) {
            return build(truncated, false);
        }

        /** @param depthLimited whether children below the depth limit were left out */
        public ArenaSyntaxTree build(boolean truncated, boolean depthLimited) {
            return new ArenaSyntaxTree(this, truncated, depthLimited);
        }

        private void ensureCapacity(int needed) {
            if (needed <= kinds.length) {
                return;
            }
            int size = Math.max(needed, kinds.length * 2);
            kinds = Arrays.copyOf(kinds, size);
            fieldNames = Arrays.copyOf(fieldNames, size);
            parent = Arrays.copyOf(parent, size);
            firstChild = Arrays.copyOf(firstChild, size);
            lastChild = Arrays.copyOf(lastChild, size);
            nextSibling = Arrays.copyOf(nextSibling, size);
            startByte = Arrays.copyOf(startByte, size);
            endByte = Arrays.copyOf(endByte, size);
            startLine = Arrays.copyOf(startLine, size);
            endLine = Arrays.copyOf(endLine, size);
            flags = Arrays.copyOf(flags, size);
        }
    }
}
