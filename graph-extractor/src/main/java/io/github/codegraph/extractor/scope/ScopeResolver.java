package io.github.codegraph.extractor.scope;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The lexical scope stack of one traversal. A new instance is created per file and passed down the traversal, so no
 * two files ever share one.
 */
public final class ScopeResolver {
    private static final Logger logger = LogManager.getLogger(ScopeResolver.class);

    public static final String SEPARATOR = "::";
    private static final Joiner JOINER = Joiner.on(SEPARATOR);
    private static final Splitter SPLITTER = Splitter.on(SEPARATOR).omitEmptyStrings();

    private final Deque<ScopeFrame> frames = new ArrayDeque<>();
    private final List<String> fileUsings = new ArrayList<>();
    private int underflows;

    public void push(String name, FrameKind kind, int nodeId) {
        frames.push(new ScopeFrame(name, kind, nodeId));
    }

    /** Pushes one frame per component of a qualified name such as {@code A::B}. */
    public int pushQualified(String qualifiedName, FrameKind kind, int nodeId) {
        int pushed = 0;
        for (var part : split(qualifiedName)) {
            push(part, kind, nodeId);
            pushed++;
        }
        return pushed;
    }

    public void pushAnonymous(FrameKind kind, int nodeId) {
        frames.push(new ScopeFrame(null, kind, nodeId));
    }

    /**
     * Pops the innermost frame. Popping an empty stack is recorded as an underflow and otherwise ignored.
     *
     * @return false on underflow
     */
    public boolean pop() {
        if (frames.isEmpty()) {
            underflows++;
            logger.warn("Scope stack underflow");
            return false;
        }
        frames.pop();
        return true;
    }

    public void pop(int count) {
        for (int i = 0; i < count; i++) {
            pop();
        }
    }

    /**
     * Closes any frames left open at the end of a traversal.
     *
     * @return true if the stack was balanced (nothing left open and no underflow)
     */
    public boolean finish() {
        int open = frames.size();
        if (open > 0) {
            logger.warn("{} scope frame(s) still open at end of traversal, innermost {}; closing", open, frames.peek());
            frames.clear();
        }
        return open == 0 && underflows == 0;
    }

    public int depth() {
        return frames.size();
    }

    public @Nullable ScopeFrame current() {
        return frames.peek();
    }

    /** Qualifies a local name with every named enclosing frame. */
    public String qualify(String localName) {
        var prefix = visiblePrefix();
        return prefix.isEmpty() ? localName : prefix + SEPARATOR + localName;
    }

    /** Joined names of the named frames, outermost first, or "" at file scope. */
    public String visiblePrefix() {
        var names = new ArrayList<String>();
        for (Iterator<ScopeFrame> it = frames.descendingIterator(); it.hasNext(); ) {
            var frame = it.next();
            if (!frame.anonymous()) {
                names.add(frame.name());
            }
        }
        return JOINER.join(names);
    }

    /**
     * Like {@link #qualify} but keeps anonymous frames as tags, so symbols from different anonymous namespaces never
     * collide.
     */
    public String lookupKey(String localName) {
        var names = new ArrayList<String>();
        for (Iterator<ScopeFrame> it = frames.descendingIterator(); it.hasNext(); ) {
            var frame = it.next();
            if (frame.kind() != FrameKind.FUNCTION) {
                names.add(frame.lookupTag());
            }
        }
        names.add(localName);
        return JOINER.join(names);
    }

    /**
     * Candidate qualified names for an unqualified or partially qualified reference, most specific first: every
     * enclosing prefix from innermost to file scope, then each active {@code using namespace} target.
     */
    public List<String> lookupCandidates(String name) {
        var candidates = new LinkedHashSet<String>();
        if (frames.stream().anyMatch(ScopeFrame::anonymous)) {
            for (var prefix : taggedPrefixes()) {
                candidates.add(prefix.isEmpty() ? name : prefix + SEPARATOR + name);
            }
        }
        for (var prefix : visiblePrefixes()) {
            candidates.add(prefix.isEmpty() ? name : prefix + SEPARATOR + name);
        }
        for (var ns : activeUsings()) {
            candidates.add(ns + SEPARATOR + name);
        }
        return new ArrayList<>(candidates);
    }

    /** Enclosing visible prefixes from innermost to the file scope (""). */
    public List<String> visiblePrefixes() {
        var named = new ArrayList<String>();
        for (Iterator<ScopeFrame> it = frames.descendingIterator(); it.hasNext(); ) {
            var frame = it.next();
            if (!frame.anonymous() && frame.kind() != FrameKind.FUNCTION) {
                named.add(frame.name());
            }
        }
        var prefixes = new ArrayList<String>();
        for (int i = named.size(); i >= 0; i--) {
            prefixes.add(JOINER.join(named.subList(0, i)));
        }
        return prefixes;
    }

    private List<String> taggedPrefixes() {
        var tags = new ArrayList<String>();
        for (Iterator<ScopeFrame> it = frames.descendingIterator(); it.hasNext(); ) {
            var frame = it.next();
            if (frame.kind() != FrameKind.FUNCTION) {
                tags.add(frame.lookupTag());
            }
        }
        var prefixes = new ArrayList<String>();
        for (int i = tags.size(); i > 0; i--) {
            prefixes.add(JOINER.join(tags.subList(0, i)));
        }
        return prefixes;
    }

    /** Qualified name of the innermost class, struct or union frame, or null outside any type. */
    public @Nullable String enclosingType() {
        var names = new ArrayList<String>();
        String result = null;
        for (Iterator<ScopeFrame> it = frames.descendingIterator(); it.hasNext(); ) {
            var frame = it.next();
            if (frame.kind() == FrameKind.FUNCTION) {
                continue;
            }
            if (!frame.anonymous()) {
                names.add(frame.name());
            }
            if (frame.kind().typeFrame()) {
                result = JOINER.join(names);
            }
        }
        return result;
    }

    /** True when the innermost non-anonymous frame is a class, struct or union. */
    public boolean inType() {
        var frame = frames.peek();
        return frame != null && frame.kind().typeFrame();
    }

    public boolean inFunction() {
        return frames.stream().anyMatch(f -> f.kind() == FrameKind.FUNCTION);
    }

    /** Records a {@code using namespace} directive for the rest of the current scope. */
    public void addUsingNamespace(String namespace) {
        var frame = frames.peek();
        if (frame == null) {
            if (!fileUsings.contains(namespace)) {
                fileUsings.add(namespace);
            }
        } else {
            frame.addUsingNamespace(namespace);
        }
    }

    /** Namespaces brought in by {@code using namespace}, innermost scope first. */
    public List<String> activeUsings() {
        var result = new LinkedHashSet<String>();
        for (var frame : frames) {
            result.addAll(frame.usingNamespaces());
        }
        result.addAll(fileUsings);
        return new ArrayList<>(result);
    }

    public static List<String> split(String qualifiedName) {
        return SPLITTER.splitToList(qualifiedName);
    }

    public static String join(List<String> parts) {
        return JOINER.join(parts);
    }

    /** Last component of a qualified name. */
    public static String lastSegment(String qualifiedName) {
        int sep = qualifiedName.lastIndexOf(SEPARATOR);
        return sep < 0 ? qualifiedName : qualifiedName.substring(sep + SEPARATOR.length());
    }

    /** Everything before the last component, or "" for an unqualified name. */
    public static String qualifier(String qualifiedName) {
        int sep = qualifiedName.lastIndexOf(SEPARATOR);
        return sep < 0 ? "" : qualifiedName.substring(0, sep);
    }

    @Override
    public String toString() {
        return "ScopeResolver" + Objects.toString(new ArrayList<>(frames));
    }
}
