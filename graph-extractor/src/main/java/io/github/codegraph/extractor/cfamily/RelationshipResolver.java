package io.github.codegraph.extractor.cfamily;

import static io.github.codegraph.extractor.cfamily.CFamilyNodeTypes.*;

import io.github.codegraph.extractor.Languages;
import io.github.codegraph.extractor.scope.FrameKind;
import io.github.codegraph.extractor.scope.ScopeResolver;
import io.github.codegraph.extractor.tree.SyntaxNodes;
import io.github.codegraph.extractor.util.TextCanonicalizer;
import io.github.codegraph.model.CodeEntity;
import io.github.codegraph.model.Confidence;
import io.github.codegraph.model.EntityKind;
import io.github.codegraph.model.Relationship;
import io.github.codegraph.model.RelationshipAttributes;
import io.github.codegraph.model.RelationshipKind;
import io.github.codegraph.tree.SyntaxNode;
import io.github.codegraph.tree.SyntaxTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Emits the relationships of one file: CONTAINS from the extracted nesting, EXTENDS from base lists, IMPORTS from
 * include and using directives, and CALLS from call sites inside function bodies.
 *
 * <p>Call targets are resolved best effort against the file's own entities. In order:
 *
 * <ol>
 *   <li>calls through a local variable are {@link Confidence#UNKNOWN}, targeting the variable's last assigned
 *       function or its type's {@code operator()} when known
 *   <li>names found through the enclosing scopes, active {@code using namespace} directives, or the enclosing
 *       type's in-file bases are {@link Confidence#EXACT}
 *   <li>member calls on a receiver of known in-file type resolve through that type and its bases
 *   <li>a unique in-file callable with the same simple name is {@link Confidence#PROBABLE}
 *   <li>anything else becomes an external reference (when the file has includes) or a bare name, both
 *       {@link Confidence#PROBABLE}
 * </ol>
 */
public final class RelationshipResolver {
    private static final Logger logger = LogManager.getLogger(RelationshipResolver.class);

    private static final Set<String> OVERLOADABLE = Set.of(
            "+", "-", "*", "/", "%", "^", "&", "|", "<", ">", "<=", ">=", "==", "!=", "<=>", "<<", ">>", "&&", "||");
    private static final Set<String> LOCAL_SCOPES =
            Set.of(COMPOUND_STATEMENT, "for_statement", FOR_RANGE_LOOP, LAMBDA_EXPRESSION, "catch_clause");
    private static final Set<String> RECORD_SPECIFIERS = Set.of(CLASS_SPECIFIER, STRUCT_SPECIFIER, UNION_SPECIFIER);
    private static final Set<String> TEMPLATE_PARAMETER_KINDS = Set.of(
            TYPE_PARAMETER_DECLARATION,
            "optional_type_parameter_declaration",
            "variadic_type_parameter_declaration");

    private final LanguageProfile profile;

    public RelationshipResolver(LanguageProfile profile) {
        this.profile = profile;
    }

    public ResolvedRelationships resolve(SyntaxTree tree, String file, ExtractedEntities extracted) {
        var root = tree.root();
        boolean hasIncludes = root != null && SyntaxNodes.findFirst(root, n -> n.is(PREPROC_INCLUDE)) != null;
        var pass = new Pass(file, extracted, hasIncludes);
        pass.contains();
        if (root != null) {
            pass.visit(root);
            if (!pass.scope.finish()) {
                logger.debug("{}: scope stack unbalanced while resolving relationships", file);
            }
        }
        logger.debug(
                "{}: {} relationships, {} external references",
                file,
                pass.relationships.size(),
                pass.externals.all().size());
        return new ResolvedRelationships(new ArrayList<>(pass.relationships), pass.externals.all());
    }

    /** A resolved or symbolic call, base or import target. */
    private record Target(String target, String name, Confidence confidence) {
        static Target of(CodeEntity entity, Confidence confidence) {
            return new Target(entity.id(), entity.qualifiedName(), confidence);
        }

        static Target bare(String name, Confidence confidence) {
            return new Target(name, name, confidence);
        }
    }

    private enum TypeCategory {
        RECORD,
        ENUM,
        BUILTIN,
        TEMPLATE_PARAMETER,
        EXTERNAL
    }

    private record TypeInfo(String name, TypeCategory category, @Nullable CodeEntity entity) {}

    /** A local variable or parameter, with the symbolic value of its last straight-line assignment. */
    private static final class LocalVariable {
        final String name;
        final @Nullable String typeName;
        final boolean pointer;
        final boolean functionPointer;
        @Nullable
        String value;

        LocalVariable(String name, @Nullable String typeName, boolean pointer, boolean functionPointer) {
            this.name = name;
            this.typeName = typeName;
            this.pointer = pointer;
            this.functionPointer = functionPointer;
        }
    }

    private record Step(SyntaxNode node, boolean exit) {}

    /** Scope frames pushed on entering a function, and the call source to restore on leaving it. */
    private record FunctionFrame(int pushed, @Nullable String previousSource) {}

    /** Frames pushed for a scope reopened in an ERROR node; {@code body} marks a function body or a block in one. */
    private record Reopened(int pushed, @Nullable FunctionFrame function, boolean body) {}

    private final class Pass {
        final String file;
        final ExtractedEntities extracted;
        final SymbolIndex index;
        final boolean hasIncludes;
        final ScopeResolver scope = new ScopeResolver();
        final ExternalReferences externals;
        final Set<Relationship> relationships = new LinkedHashSet<>();
        final Deque<Map<String, LocalVariable>> locals = new ArrayDeque<>();
        final Map<String, LocalVariable> globals = new HashMap<>();
        final Deque<Set<String>> templateParameters = new ArrayDeque<>();
        @Nullable
        String source;

        Pass(String file, ExtractedEntities extracted, boolean hasIncludes) {
            this.file = file;
            this.extracted = extracted;
            this.index = new SymbolIndex(extracted);
            this.hasIncludes = hasIncludes;
            this.externals = new ExternalReferences(file, profile.language());
        }

        void contains() {
            var byId = new HashMap<String, CodeEntity>();
            extracted.entities().forEach(e -> byId.put(e.id(), e));
            for (var entry : extracted.parentOf().entrySet()) {
                var child = byId.get(entry.getKey());
                if (child != null) {
                    relationships.add(new Relationship(
                            RelationshipKind.CONTAINS,
                            entry.getValue(),
                            child.id(),
                            child.qualifiedName(),
                            Confidence.EXACT));
                }
            }
        }

        void visit(SyntaxNode node) {
            if (node.error()) {
                recover(node);
                return;
            }
            switch (profile.shapeOf(node)) {
                case TRANSLATION_UNIT, DECLARATION_LIST, PREPROC_CONDITIONAL -> visitChildren(node);
                case NAMESPACE -> namespace(node);
                case CLASS, STRUCT, UNION -> record(node);
                case FUNCTION_DEFINITION -> function(node);
                case DECLARATION -> declaration(node);
                case FIELD_DECLARATION, TYPE_DEFINITION -> nestedRecord(node);
                case TEMPLATE -> template(node);
                case INCLUDE -> include(node);
                case USING -> using(node);
                case LINKAGE -> linkage(node);
                case ENUM, FRIEND_DECLARATION, TEMPLATE_INSTANTIATION, ALIAS, MACRO, COMMENT, UNRECOGNIZED -> {}
            }
        }

        private void visitChildren(SyntaxNode node) {
            for (var child : node.children()) {
                if (child.named()) {
                    visit(child);
                }
            }
        }

        private void namespace(SyntaxNode node) {
            var nameNode = node.field(FIELD_NAME);
            var body = node.field(FIELD_BODY);
            var parts = nameNode == null ? List.<String>of() : ScopeResolver.split(Declarators.nameOf(nameNode));
            int pushed = parts.size();
            if (parts.isEmpty()) {
                scope.pushAnonymous(FrameKind.NAMESPACE, node.id());
                pushed = 1;
            } else {
                parts.forEach(part -> scope.push(part, FrameKind.NAMESPACE, node.id()));
            }
            if (body != null) {
                visitChildren(body);
            }
            scope.pop(pushed);
        }

        private void record(SyntaxNode node) {
            var entity = extracted.atNode(node.id());
            var body = node.field(FIELD_BODY);
            if (entity == null || body == null) {
                return;
            }
            extendsEdges(entity);
            var nameNode = node.field(FIELD_NAME);
            var name = nameNode != null ? Declarators.nameOf(nameNode) : entity.displayName();
            var frame = switch (entity.kind()) {
                case CLASS -> FrameKind.CLASS;
                case UNION -> FrameKind.UNION;
                default -> FrameKind.STRUCT;
            };
            int pushed = scope.pushQualified(name, frame, node.id());
            visitChildren(body);
            scope.pop(pushed);
        }

        private void nestedRecord(SyntaxNode node) {
            var type = node.field(FIELD_TYPE);
            if (type != null && RECORD_SPECIFIERS.contains(type.kind())) {
                record(type);
            }
        }

        private void extendsEdges(CodeEntity derived) {
            for (var base : extracted.bases(derived.id())) {
                var canonical = TextCanonicalizer.canonicalName(base.name());
                var arguments = TextCanonicalizer.templateArguments(base.name());
                var attributes = new LinkedHashMap<String, String>();
                attributes.put(RelationshipAttributes.ACCESS, base.access().keyword());
                attributes.put(RelationshipAttributes.ORDER, Integer.toString(base.order()));
                if (base.virtual()) {
                    attributes.put(RelationshipAttributes.VIRTUAL, "true");
                }
                if (!arguments.isEmpty()) {
                    attributes.put(RelationshipAttributes.TEMPLATE_ARGUMENTS, arguments);
                }
                var resolved = index.lookup(scope.lookupCandidates(canonical), SymbolIndex.RECORD);
                Target target;
                if (resolved == null) {
                    target = externalOrUnresolved(base.name(), base.line());
                } else if (arguments.isEmpty()) {
                    target = Target.of(resolved, Confidence.EXACT);
                } else {
                    target = new Target(resolved.id(), resolved.qualifiedName() + arguments, Confidence.PROBABLE);
                }
                relationships.add(new Relationship(
                        RelationshipKind.EXTENDS,
                        derived.id(),
                        target.target(),
                        target.name(),
                        target.confidence(),
                        attributes));
            }
        }

        private void function(SyntaxNode node) {
            var entity = extracted.atNode(node.id());
            var function = Declarators.functionDeclarator(node.field(FIELD_DECLARATOR));
            if (entity == null || function == null || function.field(FIELD_DECLARATOR) == null) {
                return;
            }
            var frame = enterFunction(entity, function, node.id());
            try {
                var initializers = SyntaxNodes.firstChildOfKind(node, Set.of(FIELD_INITIALIZER_LIST));
                if (initializers != null) {
                    for (var initializer : initializers.namedChildren()) {
                        if (initializer.is(FIELD_INITIALIZER)) {
                            fieldInitializer(initializer);
                        }
                    }
                }
                var body = node.field(FIELD_BODY);
                if (body != null) {
                    walk(body);
                }
            } finally {
                exitFunction(frame);
            }
        }

        /** Pushes the function's qualifier frames and its own frame, declares parameters and makes it the caller. */
        private FunctionFrame enterFunction(CodeEntity entity, SyntaxNode function, int nodeId) {
            var name = Declarators.nameOf(Objects.requireNonNull(function.field(FIELD_DECLARATOR)));
            int pushed = 0;
            for (var part : ScopeResolver.split(ScopeResolver.qualifier(name))) {
                var kind = index.exact(scope.qualify(part), SymbolIndex.RECORD) != null
                        ? FrameKind.CLASS
                        : FrameKind.NAMESPACE;
                scope.push(part, kind, nodeId);
                pushed++;
            }
            scope.push(ScopeResolver.lastSegment(name), FrameKind.FUNCTION, nodeId);
            pushed++;
            locals.push(new HashMap<>());
            var frame = new FunctionFrame(pushed, source);
            source = entity.id();
            parameters(function);
            return frame;
        }

        private void exitFunction(FunctionFrame frame) {
            source = frame.previousSource();
            locals.pop();
            scope.pop(frame.pushed());
        }

        /**
         * Visits an ERROR node, reopening the namespaces, records and functions whose closing brace is missing. The
         * statements of an unfinished function body are walked with that function as the caller.
         */
        private void recover(SyntaxNode error) {
            var entered = new ArrayDeque<Reopened>();
            int bodies = 0;
            for (var step : ErrorRecovery.steps(error)) {
                var node = step.node();
                var opening = step.opening();
                if (node != null) {
                    if (bodies == 0) {
                        visit(node);
                    } else if (source != null) {
                        walk(node);
                    }
                } else if (opening != null) {
                    var reopened = bodies > 0 ? new Reopened(0, null, true) : reopen(opening);
                    if (reopened.body()) {
                        bodies++;
                    }
                    entered.push(reopened);
                } else if (!entered.isEmpty()) {
                    var closed = entered.pop();
                    if (closed.body()) {
                        bodies--;
                    }
                    close(closed);
                }
            }
            while (!entered.isEmpty()) {
                close(entered.pop());
            }
        }

        private Reopened reopen(ErrorRecovery.Opening opening) {
            int id = opening.anchor.id();
            switch (opening.kind) {
                case NAMESPACE -> {
                    var parts = ScopeResolver.split(opening.name);
                    if (parts.isEmpty()) {
                        scope.pushAnonymous(FrameKind.NAMESPACE, id);
                        return new Reopened(1, null, false);
                    }
                    parts.forEach(part -> scope.push(part, FrameKind.NAMESPACE, id));
                    return new Reopened(parts.size(), null, false);
                }
                case CLASS, STRUCT, UNION -> {
                    var entity = extracted.atNode(id);
                    if (entity != null) {
                        extendsEdges(entity);
                    }
                    var frame = switch (opening.kind) {
                        case CLASS -> FrameKind.CLASS;
                        case UNION -> FrameKind.UNION;
                        default -> FrameKind.STRUCT;
                    };
                    return new Reopened(scope.pushQualified(opening.name, frame, id), null, false);
                }
                case FUNCTION -> {
                    var entity = extracted.atNode(id);
                    var function = Declarators.functionDeclarator(opening.anchor);
                    if (entity == null || function == null || function.field(FIELD_DECLARATOR) == null) {
                        return new Reopened(0, null, true);
                    }
                    return new Reopened(0, enterFunction(entity, function, id), true);
                }
                default -> {
                    return new Reopened(0, null, false);
                }
            }
        }

        private void close(Reopened reopened) {
            if (reopened.function() != null) {
                exitFunction(reopened.function());
            }
            scope.pop(reopened.pushed());
        }

        private void declaration(SyntaxNode node) {
            var type = node.field(FIELD_TYPE);
            if (type != null && RECORD_SPECIFIERS.contains(type.kind())) {
                record(type);
            }
            globals(type, node);
            var entity = extracted.atNode(node.id());
            if (entity == null || entity.kind() != EntityKind.VARIABLE) {
                return;
            }
            var previous = source;
            source = entity.id();
            try {
                for (var declarator : node.fields(FIELD_DECLARATOR)) {
                    var value = declarator.is(INIT_DECLARATOR) ? declarator.field(FIELD_VALUE) : null;
                    if (value == null) {
                        continue;
                    }
                    if (value.is(ARGUMENT_LIST) && type != null) {
                        constructorCall(type.text(), declarator.startLine());
                    }
                    walk(value);
                }
            } finally {
                source = previous;
            }
        }

        /** Remembers namespace-scope variables so calls through them resolve like calls through locals. */
        private void globals(@Nullable SyntaxNode type, SyntaxNode node) {
            for (var declarator : node.fields(FIELD_DECLARATOR)) {
                if (Declarators.functionDeclarator(declarator) != null) {
                    continue;
                }
                var name = Declarators.declaredName(declarator);
                if (name == null || name.isEmpty()) {
                    continue;
                }
                var variable = new LocalVariable(
                        name,
                        type == null ? null : TypeNames.baseName(type.text()),
                        Declarators.pointer(declarator),
                        Declarators.functionPointer(declarator));
                var value = declarator.is(INIT_DECLARATOR) ? declarator.field(FIELD_VALUE) : null;
                if (value != null) {
                    variable.value = symbolicValue(value);
                }
                globals.put(scope.qualify(name), variable);
                globals.put(scope.lookupKey(name), variable);
            }
        }

        private void template(SyntaxNode node) {
            var names = new HashSet<String>();
            var parameters = node.field(FIELD_PARAMETERS);
            if (parameters != null) {
                for (var parameter : parameters.namedChildren()) {
                    if (TEMPLATE_PARAMETER_KINDS.contains(parameter.kind())) {
                        var name = SyntaxNodes.firstChildOfKind(parameter, Set.of(TYPE_IDENTIFIER));
                        if (name != null) {
                            names.add(name.text());
                        }
                    }
                }
            }
            templateParameters.push(names);
            for (var child : node.children()) {
                if (child.named() && !FIELD_PARAMETERS.equals(child.fieldName())) {
                    visit(child);
                }
            }
            templateParameters.pop();
        }

        private void include(SyntaxNode node) {
            var path = node.field(FIELD_PATH);
            if (path == null) {
                return;
            }
            var raw = path.text().strip();
            var name = raw.length() >= 2 ? raw.substring(1, raw.length() - 1).strip() : raw;
            if (name.isEmpty()) {
                return;
            }
            var style = path.is(SYSTEM_LIB_STRING) ? "system" : "local";
            var module = externals.register(name, node.startLine(), firstLine(node.text()));
            relationships.add(new Relationship(
                    RelationshipKind.IMPORTS,
                    file,
                    module.id(),
                    name,
                    Confidence.EXACT,
                    Map.of(RelationshipAttributes.INCLUDE_STYLE, style)));
        }

        private void using(SyntaxNode node) {
            boolean directive = false;
            SyntaxNode named = null;
            for (var child : node.children()) {
                if (!child.named() && child.is("namespace")) {
                    directive = true;
                } else if (child.named()) {
                    named = child;
                }
            }
            if (named == null) {
                return;
            }
            var name = TextCanonicalizer.canonicalName(named.text());
            if (name.isEmpty()) {
                return;
            }
            var candidates = scope.lookupCandidates(name);
            var resolved = directive
                    ? index.lookup(candidates, e -> e.kind() == EntityKind.NAMESPACE)
                    : index.lookup(candidates, SymbolIndex.ANY);
            var target = resolved != null
                    ? resolved
                    : externals.register(name, node.startLine(), firstLine(node.text()));
            relationships.add(new Relationship(
                    RelationshipKind.IMPORTS, file, target.id(), target.qualifiedName(), Confidence.EXACT));
            if (directive) {
                scope.addUsingNamespace(target.qualifiedName());
            }
        }

        private void linkage(SyntaxNode node) {
            var body = node.field(FIELD_BODY);
            if (body == null) {
                return;
            }
            if (body.is(DECLARATION_LIST)) {
                visitChildren(body);
            } else {
                visit(body);
            }
        }

        private void parameters(SyntaxNode functionDeclarator) {
            var parameters = functionDeclarator.field(FIELD_PARAMETERS);
            if (parameters == null) {
                return;
            }
            for (var parameter : parameters.namedChildren()) {
                if (parameter.is(PARAMETER_DECLARATION) || parameter.is(OPTIONAL_PARAMETER_DECLARATION)) {
                    declare(parameter.field(FIELD_TYPE), parameter.field(FIELD_DECLARATOR));
                }
            }
        }

        private @Nullable LocalVariable declare(@Nullable SyntaxNode type, @Nullable SyntaxNode declarator) {
            if (declarator == null || locals.isEmpty()) {
                return null;
            }
            var name = Declarators.declaredName(declarator);
            if (name == null || name.isEmpty()) {
                return null;
            }
            var variable = new LocalVariable(
                    name,
                    type == null ? null : TypeNames.baseName(type.text()),
                    Declarators.pointer(declarator),
                    Declarators.functionPointer(declarator));
            locals.peek().put(name, variable);
            return variable;
        }

        private @Nullable LocalVariable local(String name) {
            for (var frame : locals) {
                var variable = frame.get(name);
                if (variable != null) {
                    return variable;
                }
            }
            return null;
        }

        /** A local first, then a namespace-scope variable visible from the current scope. */
        private @Nullable LocalVariable variable(String name) {
            var variable = local(name);
            if (variable != null) {
                return variable;
            }
            for (var candidate : scope.lookupCandidates(name)) {
                variable = globals.get(candidate);
                if (variable != null) {
                    return variable;
                }
            }
            return null;
        }

        /** Walks statements and expressions iteratively; bodies can nest far deeper than declarations. */
        private void walk(SyntaxNode root) {
            var stack = new ArrayDeque<Step>();
            locals.push(new HashMap<>());
            stack.push(new Step(root, false));
            while (!stack.isEmpty()) {
                var step = stack.pop();
                if (step.exit()) {
                    locals.pop();
                    continue;
                }
                var node = step.node();
                if (LOCAL_SCOPES.contains(node.kind())) {
                    locals.push(new HashMap<>());
                    stack.push(new Step(node, true));
                    scopedDeclarations(node);
                }
                boolean descend = true;
                switch (node.kind()) {
                    case DECLARATION -> localDeclaration(node);
                    case CALL_EXPRESSION -> {
                        call(node);
                        pushCallChildren(stack, node);
                        descend = false;
                    }
                    case NEW_EXPRESSION -> {
                        var type = node.field(FIELD_TYPE);
                        if (type != null) {
                            constructorCall(type.text(), node.startLine());
                        }
                    }
                    case BINARY_EXPRESSION -> operator(node);
                    case ASSIGNMENT_EXPRESSION -> assignment(node);
                    case QUALIFIED_IDENTIFIER -> {
                        looseReference(node);
                        descend = false;
                    }
                    default -> {}
                }
                if (descend) {
                    pushChildren(stack, node);
                }
            }
            locals.pop();
        }

        private void pushChildren(Deque<Step> stack, SyntaxNode node) {
            var children = node.namedChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Step(children.get(i), false));
            }
        }

        private void pushCallChildren(Deque<Step> stack, SyntaxNode call) {
            var arguments = call.field(FIELD_ARGUMENTS);
            if (arguments != null) {
                stack.push(new Step(arguments, false));
            }
            var function = call.field(FIELD_FUNCTION);
            if (function == null) {
                return;
            }
            if (function.is(FIELD_EXPRESSION)) {
                var receiver = function.field(FIELD_ARGUMENT);
                if (receiver != null) {
                    stack.push(new Step(receiver, false));
                }
            } else if (!function.is(IDENTIFIER)
                    && !function.is(QUALIFIED_IDENTIFIER)
                    && !function.is(TEMPLATE_FUNCTION)) {
                stack.push(new Step(function, false));
            }
        }

        private void scopedDeclarations(SyntaxNode node) {
            if (node.is(FOR_RANGE_LOOP)) {
                declare(node.field(FIELD_TYPE), node.field(FIELD_DECLARATOR));
            } else if (node.is(LAMBDA_EXPRESSION)) {
                var declarator = node.field(FIELD_DECLARATOR);
                if (declarator != null) {
                    parameters(declarator);
                }
            }
        }

        private void localDeclaration(SyntaxNode node) {
            var type = node.field(FIELD_TYPE);
            for (var declarator : node.fields(FIELD_DECLARATOR)) {
                var variable = declare(type, declarator);
                var value = declarator.is(INIT_DECLARATOR) ? declarator.field(FIELD_VALUE) : null;
                if (variable == null || value == null) {
                    continue;
                }
                if (value.is(ARGUMENT_LIST) && type != null) {
                    constructorCall(type.text(), declarator.startLine());
                } else {
                    variable.value = symbolicValue(value);
                }
            }
        }

        private void assignment(SyntaxNode node) {
            var left = node.field(FIELD_LEFT);
            var right = node.field(FIELD_RIGHT);
            if (left == null || right == null || !left.is(IDENTIFIER)) {
                return;
            }
            var variable = local(left.text());
            if (variable != null) {
                variable.value = symbolicValue(right);
            }
        }

        /** The function a value names: {@code f}, {@code ns::f} or {@code &f}. */
        private @Nullable String symbolicValue(SyntaxNode value) {
            if (value.is(IDENTIFIER)) {
                return value.text();
            }
            if (value.is(QUALIFIED_IDENTIFIER)) {
                return TextCanonicalizer.canonicalName(value.text());
            }
            if (value.is(POINTER_EXPRESSION) && value.text().strip().startsWith("&")) {
                var argument = value.field(FIELD_ARGUMENT);
                return argument == null ? null : symbolicValue(argument);
            }
            return null;
        }

        private void call(SyntaxNode node) {
            var function = node.field(FIELD_FUNCTION);
            if (function == null) {
                return;
            }
            int line = node.startLine();
            switch (function.kind()) {
                case IDENTIFIER -> identifierCall(function.text(), node, true);
                case TEMPLATE_FUNCTION, QUALIFIED_IDENTIFIER -> {
                    var name = Declarators.nameOf(function);
                    if (name.contains(ScopeResolver.SEPARATOR)) {
                        qualifiedCall(name, line);
                    } else {
                        identifierCall(name, node, false);
                    }
                }
                case FIELD_EXPRESSION -> memberCall(function, line);
                default -> {
                    var inner = unwrap(function);
                    var variable = inner != null && inner.is(IDENTIFIER) ? variable(inner.text()) : null;
                    if (variable != null) {
                        variableCall(variable, node);
                    } else {
                        emitCall(Target.bare(SyntaxNodes.compactText(node), Confidence.UNKNOWN), line, Map.of());
                    }
                }
            }
        }

        private void identifierCall(String name, SyntaxNode node, boolean allowLocal) {
            int line = node.startLine();
            if (allowLocal) {
                var variable = variable(name);
                if (variable != null) {
                    variableCall(variable, node);
                    return;
                }
            }
            var candidates = scope.lookupCandidates(name);
            var type = index.lookup(candidates, SymbolIndex.RECORD);
            if (type != null) {
                emitCall(constructorTarget(type), line, Map.of());
                return;
            }
            var target = index.lookup(candidates, SymbolIndex.CALLABLE);
            var enclosing = scope.enclosingType();
            if (target == null && enclosing != null) {
                target = index.member(enclosing, name);
            }
            if (target != null) {
                emitCall(Target.of(target, Confidence.EXACT), line, Map.of());
                return;
            }
            emitCall(bySimpleName(name, name, line), line, Map.of());
        }

        private void qualifiedCall(String name, int line) {
            var candidates = scope.lookupCandidates(name);
            var type = index.lookup(candidates, SymbolIndex.RECORD);
            if (type != null) {
                emitCall(constructorTarget(type), line, Map.of());
                return;
            }
            var target = index.lookup(candidates, SymbolIndex.CALLABLE);
            var qualifier = ScopeResolver.qualifier(name);
            var member = ScopeResolver.lastSegment(name);
            if (target == null) {
                var owner = index.lookup(scope.lookupCandidates(qualifier), SymbolIndex.RECORD);
                if (owner != null) {
                    target = index.member(owner.qualifiedName(), member);
                }
            }
            if (target != null) {
                emitCall(Target.of(target, Confidence.EXACT), line, Map.of());
                return;
            }
            var root = ScopeResolver.split(name).get(0);
            boolean inFile = index.lookup(scope.lookupCandidates(root), SymbolIndex.ANY) != null;
            emitCall(inFile ? bySimpleName(member, name, line) : externalOrUnresolved(name, line), line, Map.of());
        }

        private void memberCall(SyntaxNode fieldExpression, int line) {
            var receiver = fieldExpression.field(FIELD_ARGUMENT);
            var field = fieldExpression.field(FIELD_FIELD);
            if (field == null) {
                emitCall(Target.bare(SyntaxNodes.compactText(fieldExpression), Confidence.UNKNOWN), line, Map.of());
                return;
            }
            var member = Declarators.nameOf(field);
            var receiverType = receiver == null ? null : receiverType(receiver);
            if (receiverType == null) {
                emitCall(bySimpleName(member, member, line), line, Map.of());
                return;
            }
            var info = typeInfo(receiverType);
            if (info.category() == TypeCategory.RECORD && info.entity() != null) {
                var target = index.member(info.entity().qualifiedName(), member);
                if (target != null) {
                    emitCall(Target.of(target, Confidence.EXACT), line, Map.of());
                    return;
                }
            }
            var qualified = info.name() + ScopeResolver.SEPARATOR + member;
            emitCall(externalOrUnresolved(qualified, line), line, Map.of());
        }

        private @Nullable String receiverType(SyntaxNode receiver) {
            var inner = unwrap(receiver);
            if (inner == null) {
                return null;
            }
            if (inner.is(THIS)) {
                return scope.enclosingType();
            }
            if (inner.is(IDENTIFIER)) {
                var variable = variable(inner.text());
                if (variable != null && variable.typeName != null && !TypeNames.primitive(variable.typeName)) {
                    return variable.typeName;
                }
            }
            return null;
        }

        private void variableCall(LocalVariable variable, SyntaxNode call) {
            int line = call.startLine();
            var via = Map.of(RelationshipAttributes.VIA, variable.name);
            if (variable.value != null) {
                var target = index.lookup(scope.lookupCandidates(variable.value), SymbolIndex.CALLABLE);
                emitCall(
                        target != null
                                ? Target.of(target, Confidence.UNKNOWN)
                                : Target.bare(variable.value, Confidence.UNKNOWN),
                        line,
                        via);
                return;
            }
            if (!variable.pointer && !variable.functionPointer && variable.typeName != null) {
                var info = typeInfo(variable.typeName);
                if (info.category() == TypeCategory.RECORD && info.entity() != null) {
                    var operator = index.member(info.entity().qualifiedName(), "operator()");
                    var attributes = Map.of(
                            RelationshipAttributes.VIA, variable.name, RelationshipAttributes.OPERATOR, "()");
                    emitCall(
                            operator != null
                                    ? Target.of(operator, Confidence.UNKNOWN)
                                    : Target.bare(info.name() + "::operator()", Confidence.UNKNOWN),
                            line,
                            attributes);
                    return;
                }
            }
            emitCall(Target.bare(SyntaxNodes.compactText(call), Confidence.UNKNOWN), line, via);
        }

        private void operator(SyntaxNode node) {
            if (!Languages.CPP.equals(profile.language())) {
                return;
            }
            var operatorNode = node.field(FIELD_OPERATOR);
            var left = node.field(FIELD_LEFT);
            if (operatorNode == null || left == null) {
                return;
            }
            var op = operatorNode.text().strip();
            if (!OVERLOADABLE.contains(op)) {
                return;
            }
            var operatorName = "operator" + op;
            var attributes = Map.of(RelationshipAttributes.OPERATOR, op);
            int line = node.startLine();
            if (left.is(QUALIFIED_IDENTIFIER) || left.is(FIELD_EXPRESSION)) {
                emitCall(Target.bare(operatorName, Confidence.UNKNOWN), line, attributes);
                return;
            }
            if (!left.is(IDENTIFIER)) {
                return;
            }
            var variable = variable(left.text());
            if (variable == null) {
                var known = index.lookup(scope.lookupCandidates(left.text()), SymbolIndex.ANY);
                if (known == null || known.kind() != EntityKind.ENUM_VALUE) {
                    emitCall(Target.bare(operatorName, Confidence.UNKNOWN), line, attributes);
                }
                return;
            }
            if (variable.pointer || variable.functionPointer) {
                return;
            }
            if (variable.typeName == null) {
                emitCall(Target.bare(operatorName, Confidence.UNKNOWN), line, attributes);
                return;
            }
            var info = typeInfo(variable.typeName);
            switch (info.category()) {
                case BUILTIN, ENUM -> {}
                case TEMPLATE_PARAMETER -> emitCall(Target.bare(operatorName, Confidence.UNKNOWN), line, attributes);
                case RECORD -> {
                    var qualified = info.name() + ScopeResolver.SEPARATOR + operatorName;
                    var target = info.entity() != null ? index.member(info.entity().qualifiedName(), operatorName) : null;
                    if (target == null) {
                        target = index.lookup(scope.lookupCandidates(operatorName), SymbolIndex.CALLABLE);
                    }
                    emitCall(
                            target != null
                                    ? Target.of(target, Confidence.EXACT)
                                    : Target.bare(qualified, Confidence.PROBABLE),
                            line,
                            attributes);
                }
                case EXTERNAL -> emitCall(
                        externalOrUnresolved(info.name() + ScopeResolver.SEPARATOR + operatorName, line),
                        line,
                        attributes);
            }
        }

        private void fieldInitializer(SyntaxNode initializer) {
            SyntaxNode nameNode = null;
            SyntaxNode arguments = null;
            for (var child : initializer.namedChildren()) {
                if (child.is(ARGUMENT_LIST) || child.is(INITIALIZER_LIST)) {
                    arguments = child;
                } else if (nameNode == null) {
                    nameNode = child;
                }
            }
            if (nameNode != null) {
                var name = Declarators.nameOf(nameNode);
                var enclosing = scope.enclosingType();
                boolean base = enclosing != null
                        && index.bases(enclosing).stream()
                                .anyMatch(b -> name.equals(TextCanonicalizer.canonicalName(b.name()))
                                        || name.equals(ScopeResolver.lastSegment(
                                                TextCanonicalizer.canonicalName(b.name()))));
                if (base || index.lookup(scope.lookupCandidates(name), SymbolIndex.RECORD) != null) {
                    constructorCall(name, initializer.startLine());
                }
            }
            if (arguments != null) {
                walk(arguments);
            }
        }

        private void constructorCall(String typeText, int line) {
            var base = TypeNames.baseName(typeText);
            if (base == null) {
                return;
            }
            var info = typeInfo(base);
            switch (info.category()) {
                case BUILTIN, ENUM, TEMPLATE_PARAMETER -> {}
                case RECORD -> {
                    if (info.entity() != null) {
                        emitCall(constructorTarget(info.entity()), line, Map.of());
                    }
                }
                case EXTERNAL -> emitCall(
                        externalOrUnresolved(
                                info.name() + ScopeResolver.SEPARATOR + ScopeResolver.lastSegment(info.name()), line),
                        line,
                        Map.of());
            }
        }

        private Target constructorTarget(CodeEntity type) {
            var constructor = index.constructor(type.qualifiedName());
            return constructor != null
                    ? Target.of(constructor, Confidence.EXACT)
                    : Target.of(type, Confidence.PROBABLE);
        }

        /** Follows in-file aliases to the named record or enum. */
        private TypeInfo typeInfo(String typeName) {
            var name = typeName;
            for (int depth = 0; depth < 8; depth++) {
                if (TypeNames.primitive(name)) {
                    return new TypeInfo(name, TypeCategory.BUILTIN, null);
                }
                var current = name;
                if (templateParameters.stream().anyMatch(s -> s.contains(current))) {
                    return new TypeInfo(name, TypeCategory.TEMPLATE_PARAMETER, null);
                }
                var entity = index.lookup(scope.lookupCandidates(name), SymbolIndex.TYPE);
                if (entity == null) {
                    return new TypeInfo(name, TypeCategory.EXTERNAL, null);
                }
                if (entity.kind() == EntityKind.ENUM) {
                    return new TypeInfo(entity.qualifiedName(), TypeCategory.ENUM, entity);
                }
                if (entity.kind() != EntityKind.TYPE_ALIAS) {
                    return new TypeInfo(entity.qualifiedName(), TypeCategory.RECORD, entity);
                }
                var aliased = TypeNames.baseName(entity.aliasOf());
                if (aliased == null || aliased.equals(name)) {
                    return new TypeInfo(entity.qualifiedName(), TypeCategory.EXTERNAL, null);
                }
                name = aliased;
            }
            return new TypeInfo(name, TypeCategory.EXTERNAL, null);
        }

        private Target bySimpleName(String simpleName, String fullName, int line) {
            var matches = index.bySimpleName(simpleName, SymbolIndex.CALLABLE);
            if (matches.size() == 1) {
                return Target.of(matches.get(0), Confidence.PROBABLE);
            }
            return externalOrUnresolved(fullName, line);
        }

        private Target externalOrUnresolved(String name, int line) {
            if (!hasIncludes) {
                return Target.bare(name, Confidence.PROBABLE);
            }
            var external = externals.register(name, line, null);
            return new Target(external.id(), name, Confidence.PROBABLE);
        }

        /** Records {@code std::cout} style names used from included modules as external references. */
        private void looseReference(SyntaxNode node) {
            if (!hasIncludes) {
                return;
            }
            var name = TextCanonicalizer.canonicalName(node.text());
            var parts = ScopeResolver.split(name);
            if (parts.size() < 2
                    || index.lookup(scope.lookupCandidates(name), SymbolIndex.ANY) != null
                    || index.lookup(scope.lookupCandidates(parts.get(0)), SymbolIndex.ANY) != null) {
                return;
            }
            externals.register(name, node.startLine(), null);
        }

        private void emitCall(Target target, int line, Map<String, String> attributes) {
            if (source == null || target.target().isEmpty()) {
                return;
            }
            var all = new LinkedHashMap<String, String>(attributes);
            all.put(RelationshipAttributes.LINE, Integer.toString(line));
            relationships.add(new Relationship(
                    RelationshipKind.CALLS, source, target.target(), target.name(), target.confidence(), all));
        }
    }

    private static @Nullable SyntaxNode unwrap(SyntaxNode expression) {
        var current = expression;
        while (current != null && (current.is(PARENTHESIZED_EXPRESSION) || current.is(POINTER_EXPRESSION))) {
            current = current.is(POINTER_EXPRESSION) ? current.field(FIELD_ARGUMENT) : first(current.namedChildren());
        }
        return current;
    }

    private static @Nullable SyntaxNode first(List<SyntaxNode> nodes) {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return (newline < 0 ? text : text.substring(0, newline)).strip();
    }
}
