package io.github.codegraph.extractor.slice;

import io.github.codegraph.model.CodeEntity;
import io.github.codegraph.model.Slice;
import io.github.codegraph.tree.SyntaxTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Partitions a file into contiguous slices that start at entity boundaries.
 *
 * <p>Slice 0 opens at line 0. Each distinct entity start line opens a new slice, unless everything since the current
 * slice opened is blank or comment-only, in which case the current slice simply extends over the entity (a file that
 * opens with comments keeps them with its first entity). Entities starting on the same line share a slice. The last
 * slice runs to the last line, so the slices always cover the whole file without gaps or overlaps.
 */
public final class Slicer {
    private static final Logger logger = LogManager.getLogger(Slicer.class);

    /** @param commentKinds node kinds the grammar uses for comments */
    public List<Slice> slice(
            SyntaxTree tree,
            String file,
            Set<String> commentKinds,
            List<CodeEntity> entities,
            List<CodeEntity> externalReferences) {
        var lines = LineClassifier.of(tree, commentKinds);
        int lastLine = Math.max(0, lines.lineCount() - 1);

        var starts = new TreeSet<Integer>();
        for (var entity : entities) {
            if (!entity.external()) {
                starts.add(Math.min(entity.startLine(), lastLine));
            }
        }

        var ranges = new ArrayList<int[]>();
        int current = 0;
        for (int start : starts) {
            if (start > current && lines.anyContent(current, start - 1)) {
                ranges.add(new int[] {current, start - 1});
                current = start;
            }
        }
        ranges.add(new int[] {current, lastLine});

        var entityIds = new ArrayList<List<String>>();
        var externalIds = new ArrayList<List<String>>();
        for (int i = 0; i < ranges.size(); i++) {
            entityIds.add(new ArrayList<>());
            externalIds.add(new ArrayList<>());
        }
        for (var entity : entities) {
            var target = entity.external() ? externalIds : entityIds;
            target.get(indexOf(ranges, entity.startLine())).add(entity.id());
        }
        for (var external : externalReferences) {
            externalIds.get(indexOf(ranges, external.startLine())).add(external.id());
        }

        var source = tree.source();
        var lineStarts = lineStarts(source);
        var slices = new ArrayList<Slice>(ranges.size());
        for (int i = 0; i < ranges.size(); i++) {
            var range = ranges.get(i);
            var text = text(source, lineStarts, range[0], range[1]);
            slices.add(new Slice(file, i, range[0], range[1], entityIds.get(i), externalIds.get(i), text));
        }
        logger.trace("{}: {} slices over {} lines", file, slices.size(), lastLine + 1);
        return slices;
    }

    /** A single slice covering the whole source, for files with no usable tree. */
    public Slice whole(SyntaxTree tree, String file) {
        return new Slice(file, 0, 0, Math.max(0, tree.lineCount() - 1), List.of(), List.of(), tree.source());
    }

    /** Char offset of the start of every line. */
    private static int[] lineStarts(String source) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n' && i + 1 < source.length()) {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /** Lines {@code from..to} with their terminators; the slices of a file concatenate back to its source. */
    private static String text(String source, int[] lineStarts, int from, int to) {
        if (from >= lineStarts.length) {
            return "";
        }
        int end = to + 1 < lineStarts.length ? lineStarts[to + 1] : source.length();
        return source.substring(lineStarts[from], end);
    }

    private static int indexOf(List<int[]> ranges, int line) {
        int low = 0;
        int high = ranges.size() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (ranges.get(mid)[0] <= line) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }
}
