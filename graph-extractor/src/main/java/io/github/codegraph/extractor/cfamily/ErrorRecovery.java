package io.github.codegraph.extractor.cfamily;

import static io.github.codegraph.extractor.cfamily.CFamilyNodeTypes.*;

import io.github.codegraph.tree.SyntaxNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Reads the scopes left open inside an ERROR node.
 *
 * <p>When a brace is never closed, tree-sitter folds the rest of the file into one ERROR node whose children are the
 * complete declarations it still recognised plus the loose tokens of each unfinished header, such as the keyword, name
 * and brace of a namespace. {@link #steps} turns that child list back into complete nodes, openings and closings, so
 * both passes can keep their scope stacks in step with the braces.
 */
final class ErrorRecovery {
    private static final Set<String> NAMESPACE_NAMES =
            Set.of(IDENTIFIER, NAMESPACE_IDENTIFIER, NESTED_NAMESPACE_SPECIFIER, QUALIFIED_IDENTIFIER);
    private static final Set<String> RECORD_NAMES =
            Set.of(TYPE_IDENTIFIER, IDENTIFIER, QUALIFIED_TYPE_IDENTIFIER, TEMPLATE_TYPE);

    enum OpeningKind {
        NAMESPACE,
        CLASS,
        STRUCT,
        UNION,
        FUNCTION,
        /** A brace that opens nothing recognisable; tracked only to keep the braces paired. */
        BLOCK
    }

    /** An opening brace and what it opened. The end line is the closing brace, or the end of the ERROR node. */
    static final class Opening {
        final OpeningKind kind;
        /** Name as written, "" for anonymous namespaces and blocks. */
        final String name;
        /** Name node for namespaces and records, the declarator for functions, the brace otherwise. */
        final SyntaxNode anchor;
        final @Nullable SyntaxNode type;
        final @Nullable SyntaxNode baseClause;
        final int startLine;
        int endLine;
        boolean closed;

        Opening(
                OpeningKind kind,
                String name,
                SyntaxNode anchor,
                @Nullable SyntaxNode type,
                @Nullable SyntaxNode baseClause,
                int startLine) {
            this.kind = kind;
            this.name = name;
            this.anchor = anchor;
            this.type = type;
            this.baseClause = baseClause;
            this.startLine = startLine;
            this.endLine = startLine;
        }
    }

    /** Exactly one of the three is set: a complete child, an opening, or the closing of the innermost opening. */
    record Step(@Nullable SyntaxNode node, @Nullable Opening opening, @Nullable Opening closing) {}

    private ErrorRecovery() {}

    static List<Step> steps(SyntaxNode error) {
        var children = new ArrayList<SyntaxNode>();
        error.children().forEach(children::add);
        var steps = new ArrayList<Step>();
        var open = new ArrayDeque<Opening>();
        int i = 0;
        while (i < children.size()) {
            var child = children.get(i);
            if (child.named()) {
                var function = Declarators.functionDeclarator(child);
                var functionName = function == null ? null : function.field(FIELD_DECLARATOR);
                if (functionName != null && brace(children, i + 1)) {
                    var previous = i > 0 ? children.get(i - 1) : null;
                    var type = previous != null && FIELD_TYPE.equals(previous.fieldName()) ? previous : null;
                    int start = type != null ? type.startLine() : child.startLine();
                    var opening = new Opening(
                            OpeningKind.FUNCTION, Declarators.nameOf(functionName), child, type, null, start);
                    steps.add(new Step(null, opening, null));
                    open.push(opening);
                    i += 2;
                } else {
                    steps.add(new Step(child, null, null));
                    i++;
                }
                continue;
            }

            Opening opening = null;
            int next = i + 1;
            switch (child.kind()) {
                case "namespace" -> {
                    SyntaxNode name = null;
                    if (next < children.size() && NAMESPACE_NAMES.contains(children.get(next).kind())) {
                        name = children.get(next);
                        next++;
                    }
                    if (brace(children, next)) {
                        var anchor = name != null ? name : children.get(next);
                        opening = new Opening(
                                OpeningKind.NAMESPACE,
                                name == null ? "" : Declarators.nameOf(name),
                                anchor,
                                null,
                                null,
                                child.startLine());
                    }
                }
                case "class", "struct", "union" -> {
                    if (next < children.size() && RECORD_NAMES.contains(children.get(next).kind())) {
                        var name = children.get(next);
                        next++;
                        SyntaxNode bases = null;
                        if (next < children.size() && children.get(next).is(BASE_CLASS_CLAUSE)) {
                            bases = children.get(next);
                            next++;
                        }
                        if (brace(children, next)) {
                            var kind = switch (child.kind()) {
                                case "class" -> OpeningKind.CLASS;
                                case "union" -> OpeningKind.UNION;
                                default -> OpeningKind.STRUCT;
                            };
                            opening = new Opening(kind, Declarators.nameOf(name), name, null, bases, child.startLine());
                        }
                    }
                }
                case "{" -> {
                    next = i;
                    opening = new Opening(OpeningKind.BLOCK, "", child, null, null, child.startLine());
                }
                case "}" -> {
                    if (!open.isEmpty()) {
                        var closing = open.pop();
                        closing.closed = true;
                        closing.endLine = child.endLine();
                        steps.add(new Step(null, null, closing));
                    }
                }
                default -> {}
            }
            if (opening != null) {
                steps.add(new Step(null, opening, null));
                open.push(opening);
                i = next + 1;
            } else {
                i++;
            }
        }
        for (var unclosed : open) {
            unclosed.endLine = Math.max(unclosed.startLine, error.endLine());
        }
        return steps;
    }

    private static boolean brace(List<SyntaxNode> children, int index) {
        return index < children.size() && !children.get(index).named() && children.get(index).is("{");
    }
}
