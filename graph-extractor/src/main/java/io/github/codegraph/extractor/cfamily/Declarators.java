package io.github.codegraph.extractor.cfamily;

import static io.github.codegraph.extractor.cfamily.CFamilyNodeTypes.*;

import io.github.codegraph.extractor.tree.SyntaxNodes;
import io.github.codegraph.extractor.util.TextCanonicalizer;
import io.github.codegraph.tree.SyntaxNode;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Helpers for the nested declarator shapes of C and C++ declarations. */
final class Declarators {

    private static final Set<String> WRAPPERS =
            Set.of(POINTER_DECLARATOR, REFERENCE_DECLARATOR, ATTRIBUTED_DECLARATOR, "rvalue_reference_declarator");

    private static final Set<String> NAME_KINDS = Set.of(
            IDENTIFIER,
            FIELD_IDENTIFIER,
            TYPE_IDENTIFIER,
            QUALIFIED_IDENTIFIER,
            DESTRUCTOR_NAME,
            OPERATOR_NAME,
            TEMPLATE_FUNCTION,
            "operator_cast");

    private static final Set<String> LITERALS = Set.of(
            NUMBER_LITERAL,
            STRING_LITERAL,
            RAW_STRING_LITERAL,
            CONCATENATED_STRING,
            CHAR_LITERAL,
            TRUE,
            FALSE,
            NULL,
            NULLPTR);

    private Declarators() {}

    /**
     * The function declarator of a function definition or prototype, looking through pointer and reference wrappers
     * (return types such as {@code T* f()}). Returns null for anything else, including function pointer variables.
     */
    static @Nullable SyntaxNode functionDeclarator(@Nullable SyntaxNode declarator) {
        var current = declarator;
        while (current != null && WRAPPERS.contains(current.kind())) {
            current = inner(current);
        }
        if (current == null || !current.is(FUNCTION_DECLARATOR)) {
            return null;
        }
        var name = current.field(FIELD_DECLARATOR);
        if (name == null || name.is(PARENTHESIZED_DECLARATOR)) {
            return null;
        }
        return current;
    }

    /** True for {@code void (*name)(...)} style declarators, with or without an initializer. */
    static boolean functionPointer(SyntaxNode declarator) {
        var current = declarator.is(INIT_DECLARATOR) ? declarator.field(FIELD_DECLARATOR) : declarator;
        while (current != null && WRAPPERS.contains(current.kind())) {
            current = inner(current);
        }
        if (current == null || !current.is(FUNCTION_DECLARATOR)) {
            return false;
        }
        var name = current.field(FIELD_DECLARATOR);
        return name != null && name.is(PARENTHESIZED_DECLARATOR);
    }

    /** The node naming what a declarator declares, looking through every wrapper shape. */
    static @Nullable SyntaxNode nameNode(@Nullable SyntaxNode declarator) {
        var current = declarator;
        int guard = 0;
        while (current != null && guard++ < 64) {
            if (NAME_KINDS.contains(current.kind())) {
                return current;
            }
            current = inner(current);
        }
        return null;
    }

    /** Canonical declared name, or null if the declarator has none (abstract declarators). */
    static @Nullable String declaredName(@Nullable SyntaxNode declarator) {
        var node = nameNode(declarator);
        return node == null ? null : nameOf(node);
    }

    /** Canonical text of a name node: template arguments and whitespace removed, {@code ~X} and operators kept. */
    static String nameOf(SyntaxNode nameNode) {
        if (nameNode.is(TEMPLATE_FUNCTION) || nameNode.is(TEMPLATE_METHOD)) {
            var base = nameNode.field(FIELD_NAME);
            return TextCanonicalizer.canonicalName(base != null ? base.text() : nameNode.text());
        }
        return TextCanonicalizer.canonicalName(nameNode.text());
    }

    /** True if the declarator, looking through any initializer, declares a pointer. */
    static boolean pointer(SyntaxNode declarator) {
        var current = declarator.is(INIT_DECLARATOR) ? declarator.field(FIELD_DECLARATOR) : declarator;
        return current != null && current.is(POINTER_DECLARATOR);
    }

    static boolean literal(SyntaxNode node) {
        return LITERALS.contains(node.kind());
    }

    /** True for literal initializers, optionally negated, and brace lists of them. */
    static boolean trivialInitializer(SyntaxNode value) {
        if (LITERALS.contains(value.kind())) {
            return true;
        }
        if (value.is(UNARY_EXPRESSION)) {
            var arg = value.field(FIELD_ARGUMENT);
            return arg != null && LITERALS.contains(arg.kind());
        }
        if (value.is(INITIALIZER_LIST)) {
            return value.namedChildren().stream().allMatch(Declarators::trivialInitializer);
        }
        return false;
    }

    /**
     * Declaration text up to and including the declarator: specifiers, return type, name, parameters and trailing
     * qualifiers, whitespace collapsed.
     */
    static String signature(SyntaxNode owner, SyntaxNode declarator) {
        var sb = new StringBuilder();
        for (var child : owner.children()) {
            if (child.id() == declarator.id() || FIELD_DECLARATOR.equals(child.fieldName())) {
                break;
            }
            if (child.named() || isKeyword(child.kind())) {
                sb.append(child.text()).append(' ');
            }
        }
        var decl = declarator.is(INIT_DECLARATOR) ? declarator.field(FIELD_DECLARATOR) : declarator;
        sb.append(decl != null ? decl.text() : declarator.text());
        return SyntaxNodes.collapseWhitespace(sb.toString());
    }

    private static boolean isKeyword(String kind) {
        return !kind.isEmpty() && kind.chars().allMatch(Character::isLetter);
    }

    private static @Nullable SyntaxNode inner(SyntaxNode node) {
        var declarator = node.field(FIELD_DECLARATOR);
        if (declarator != null) {
            return declarator;
        }
        for (var child : node.namedChildren()) {
            if (!child.is(TYPE_QUALIFIER) && !child.is("ms_pointer_modifier")) {
                return child;
            }
        }
        return null;
    }
}
