package io.github.codegraph.extractor.cfamily;

import static io.github.codegraph.extractor.cfamily.CFamilyNodeTypes.*;

import io.github.codegraph.extractor.scope.FrameKind;
import io.github.codegraph.extractor.scope.ScopeResolver;
import io.github.codegraph.extractor.tree.SyntaxNodes;
import io.github.codegraph.model.AccessSpecifier;
import io.github.codegraph.model.CodeEntity;
import io.github.codegraph.model.EntityKind;
import io.github.codegraph.model.ExtractionIssue;
import io.github.codegraph.model.Span;
import io.github.codegraph.tree.SyntaxNode;
import io.github.codegraph.tree.SyntaxTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Recognizes the declarative shapes of a C or C++ file and turns them into {@link CodeEntity} records.
 *
 * <p>Only container nodes are walked (translation unit, namespace bodies, record bodies, linkage blocks and
 * preprocessor conditionals); function bodies are never entered. Symbols are not resolved here: base lists are
 * recorded as written and left to {@link RelationshipResolver}.
 *
 * <p>Instances are stateless and may be shared between threads; each call to {@link #extract} runs its own pass.
 */
public final class EntityExtractor {
    private static final Logger logger = LogManager.getLogger(EntityExtractor.class);

    private static final Set<String> BASE_TYPE_KINDS =
            Set.of(TYPE_IDENTIFIER, QUALIFIED_IDENTIFIER, TEMPLATE_TYPE, QUALIFIED_TYPE_IDENTIFIER);
    private static final Set<String> RECORD_SPECIFIERS =
            Set.of(CLASS_SPECIFIER, STRUCT_SPECIFIER, UNION_SPECIFIER, ENUM_SPECIFIER);

    private final LanguageProfile profile;

    public EntityExtractor(LanguageProfile profile) {
        this.profile = profile;
    }

    public ExtractedEntities extract(SyntaxTree tree, String file) {
        var root = tree.root();
        if (root == null) {
            return ExtractedEntities.empty();
        }
        var pass = new Pass(file);
        pass.visit(root, null, -1);
        if (!pass.scope.finish()) {
            pass.issues.add(ExtractionIssue.UNBALANCED_SCOPE);
        }
        var result = pass.finish();
        logger.debug("{}: {} entities", file, result.entities().size());
        return result;
    }

    /** A pending entity; kind and parent may still change before it is frozen into a {@link CodeEntity}. */
    private static final class Candidate {
        EntityKind kind;
        final String qualifiedName;
        final String lookupKey;
        final int startLine;
        final int endLine;
        final boolean declarationOnly;
        final @Nullable String signature;
        final @Nullable String aliasOf;
        final int nodeId;
        @Nullable
        Candidate parent;

        List<BaseSpecifier> bases = List.of();
        boolean forward;
        @Nullable
        String outOfLineQualifier;

        Candidate(
                EntityKind kind,
                String qualifiedName,
                String lookupKey,
                int startLine,
                int endLine,
                boolean declarationOnly,
                @Nullable String signature,
                @Nullable String aliasOf,
                int nodeId,
                @Nullable Candidate parent) {
            this.kind = kind;
            this.qualifiedName = qualifiedName;
            this.lookupKey = lookupKey;
            this.startLine = startLine;
            this.endLine = endLine;
            this.declarationOnly = declarationOnly;
            this.signature = signature;
            this.aliasOf = aliasOf;
            this.nodeId = nodeId;
            this.parent = parent;
        }

        String key() {
            return kind + ":" + qualifiedName;
        }
    }

    private final class Pass {
        final String file;
        final ScopeResolver scope = new ScopeResolver();
        final List<Candidate> candidates = new ArrayList<>();
        final Set<ExtractionIssue> issues = EnumSet.noneOf(ExtractionIssue.class);

        Pass(String file) {
            this.file = file;
        }

        void visitContainer(SyntaxNode container, @Nullable Candidate parent) {
            for (var child : container.children()) {
                if (child.named()) {
                    visit(child, parent, -1);
                }
            }
        }

        void visit(SyntaxNode node, @Nullable Candidate parent, int templateStart) {
            if (node.error()) {
                // error recovery keeps whole declarations under ERROR nodes; salvage what we can
                recover(node, parent);
                return;
            }
            switch (profile.shapeOf(node)) {
                case TRANSLATION_UNIT, DECLARATION_LIST, PREPROC_CONDITIONAL -> visitContainer(node, parent);
                case NAMESPACE -> namespace(node, parent);
                case CLASS, STRUCT, UNION, ENUM -> specifier(node, node, parent, templateStart, null);
                case FUNCTION_DEFINITION -> functionDefinition(node, parent, templateStart);
                case DECLARATION, FIELD_DECLARATION -> declaration(node, parent, templateStart);
                case TEMPLATE -> template(node, parent, templateStart);
                case TYPE_DEFINITION -> typeDefinition(node, parent);
                case ALIAS -> alias(node, parent, templateStart);
                case MACRO -> macro(node, parent);
                case LINKAGE -> linkage(node, parent);
                case FRIEND_DECLARATION, TEMPLATE_INSTANTIATION, USING, INCLUDE, COMMENT, UNRECOGNIZED -> {}
            }
        }

        private record Entered(
                ErrorRecovery.Opening opening, @Nullable Candidate outer, @Nullable Candidate inner, int pushed) {}

        /** Visits an ERROR node, reopening the namespaces, records and functions whose closing brace is missing. */
        private void recover(SyntaxNode error, @Nullable Candidate parent) {
            var entered = new ArrayDeque<Entered>();
            var owner = parent;
            int functions = 0;
            for (var step : ErrorRecovery.steps(error)) {
                if (step.node() != null) {
                    // statements of an unfinished body hold no entities
                    if (functions == 0) {
                        visit(step.node(), owner, -1);
                    }
                } else if (step.opening() != null) {
                    var opening = step.opening();
                    var entry = functions == 0 ? enter(opening, owner) : new Entered(opening, owner, owner, 0);
                    if (opening.kind == ErrorRecovery.OpeningKind.FUNCTION) {
                        functions++;
                    }
                    entered.push(entry);
                    owner = entry.inner();
                } else if (!entered.isEmpty()) {
                    var closed = entered.pop();
                    if (closed.opening().kind == ErrorRecovery.OpeningKind.FUNCTION) {
                        functions--;
                    }
                    owner = leave(closed);
                }
            }
            while (!entered.isEmpty()) {
                var unclosed = entered.pop();
                if (!unclosed.opening().closed) {
                    issues.add(ExtractionIssue.UNBALANCED_SCOPE);
                }
                leave(unclosed);
            }
        }

        /** Adds the entities an opening declares and pushes its scope frames. */
        private Entered enter(ErrorRecovery.Opening opening, @Nullable Candidate parent) {
            switch (opening.kind) {
                case NAMESPACE -> {
                    var parts = ScopeResolver.split(opening.name);
                    if (parts.isEmpty()) {
                        scope.pushAnonymous(FrameKind.NAMESPACE, opening.anchor.id());
                        return new Entered(opening, parent, parent, 1);
                    }
                    var owner = parent;
                    for (var part : parts) {
                        owner = add(
                                EntityKind.NAMESPACE,
                                part,
                                opening.startLine,
                                opening.endLine,
                                false,
                                null,
                                null,
                                opening.anchor,
                                owner);
                        scope.push(part, FrameKind.NAMESPACE, opening.anchor.id());
                    }
                    return new Entered(opening, parent, owner, parts.size());
                }
                case CLASS, STRUCT, UNION -> {
                    var kind = switch (opening.kind) {
                        case CLASS -> EntityKind.CLASS;
                        case UNION -> EntityKind.UNION;
                        default -> EntityKind.STRUCT;
                    };
                    var record = add(
                            kind, opening.name, opening.startLine, opening.endLine, false, null, null, opening.anchor,
                            parent);
                    record.bases = bases(opening.baseClause, kind);
                    int pushed = scope.pushQualified(opening.name, frameKind(kind), opening.anchor.id());
                    return new Entered(opening, parent, record, pushed);
                }
                case FUNCTION -> {
                    var function = Declarators.functionDeclarator(opening.anchor);
                    var nameNode = function == null ? null : function.field(FIELD_DECLARATOR);
                    if (nameNode != null) {
                        var type = opening.type != null ? opening.type.text() + " " : "";
                        var signature = SyntaxNodes.collapseWhitespace(type + opening.anchor.text());
                        callable(
                                opening.anchor,
                                opening.startLine,
                                opening.endLine,
                                nameNode,
                                false,
                                signature,
                                parent);
                    }
                    return new Entered(opening, parent, parent, 0);
                }
                default -> {
                    return new Entered(opening, parent, parent, 0);
                }
            }
        }

        private @Nullable Candidate leave(Entered entered) {
            scope.pop(entered.pushed());
            return entered.outer();
        }

        private void namespace(SyntaxNode node, @Nullable Candidate parent) {
            var nameNode = node.field(FIELD_NAME);
            var body = node.field(FIELD_BODY);
            var parts = nameNode == null ? List.<String>of() : ScopeResolver.split(Declarators.nameOf(nameNode));
            if (parts.isEmpty()) {
                scope.pushAnonymous(FrameKind.NAMESPACE, node.id());
                if (body != null) {
                    visitContainer(body, parent);
                }
                scope.pop();
                return;
            }
            var owner = parent;
            for (var part : parts) {
                owner = add(
                        EntityKind.NAMESPACE, part, node.startLine(), node.endLine(), false, null, null, node, owner);
                scope.push(part, FrameKind.NAMESPACE, node.id());
            }
            if (body != null) {
                visitContainer(body, owner);
            }
            scope.pop(parts.size());
        }

        /** Class, struct, union or enum specifier, with or without a body. */
        private void specifier(
                SyntaxNode node,
                SyntaxNode spanNode,
                @Nullable Candidate parent,
                int templateStart,
                @Nullable String typedefName) {
            if (node.is(ENUM_SPECIFIER)) {
                enumeration(node, spanNode, parent, templateStart, typedefName);
                return;
            }
            var kind = recordKind(node);
            var nameNode = node.field(FIELD_NAME);
            var body = node.field(FIELD_BODY);
            int start = templateStart >= 0 ? templateStart : spanNode.startLine();
            if (body == null) {
                if (nameNode != null) {
                    var forward =
                            add(kind, Declarators.nameOf(nameNode), start, spanNode.endLine(), true, null, null, node, parent);
                    forward.forward = true;
                }
                return;
            }
            var name = nameNode != null ? Declarators.nameOf(nameNode) : typedefName;
            if (name == null || name.isEmpty()) {
                // anonymous member struct or union: its fields are not entities
                return;
            }
            var record = add(kind, name, start, spanNode.endLine(), false, null, null, node, parent);
            record.bases = basesOfRecord(node, kind);
            int pushed = scope.pushQualified(name, frameKind(kind), node.id());
            visitContainer(body, record);
            scope.pop(pushed);
        }

        private void enumeration(
                SyntaxNode node,
                SyntaxNode spanNode,
                @Nullable Candidate parent,
                int templateStart,
                @Nullable String typedefName) {
            var nameNode = node.field(FIELD_NAME);
            var body = node.field(FIELD_BODY);
            int start = templateStart >= 0 ? templateStart : spanNode.startLine();
            if (body == null) {
                if (nameNode != null) {
                    var forward = add(
                            EntityKind.ENUM,
                            Declarators.nameOf(nameNode),
                            start,
                            spanNode.endLine(),
                            true,
                            null,
                            null,
                            node,
                            parent);
                    forward.forward = true;
                }
                return;
            }
            var name = nameNode != null ? Declarators.nameOf(nameNode) : typedefName;
            var owner = parent;
            int pushed = 0;
            if (name != null && !name.isEmpty()) {
                owner = add(EntityKind.ENUM, name, start, spanNode.endLine(), false, null, null, node, parent);
                if (scoped(node)) {
                    pushed = scope.pushQualified(name, FrameKind.ENUM, node.id());
                }
            }
            for (var enumerator : body.namedChildren()) {
                var valueName = enumerator.is(ENUMERATOR) ? enumerator.field(FIELD_NAME) : null;
                if (valueName != null) {
                    add(
                            EntityKind.ENUM_VALUE,
                            valueName.text(),
                            enumerator.startLine(),
                            enumerator.endLine(),
                            false,
                            null,
                            null,
                            enumerator,
                            owner);
                }
            }
            scope.pop(pushed);
        }

        private void functionDefinition(SyntaxNode node, @Nullable Candidate parent, int templateStart) {
            var declarator = node.field(FIELD_DECLARATOR);
            var function = Declarators.functionDeclarator(declarator);
            var nameNode = function == null ? null : function.field(FIELD_DECLARATOR);
            if (declarator == null || nameNode == null) {
                logger.debug("{}: function definition without a usable declarator at line {}", file, node.startLine());
                return;
            }
            boolean declarationOnly =
                    node.field(FIELD_BODY) == null && !SyntaxNodes.hasChildOfKind(node, "default_method_clause")
                            || SyntaxNodes.hasChildOfKind(node, DELETE_METHOD_CLAUSE);
            callable(node, nameNode, declarationOnly, Declarators.signature(node, declarator), parent, templateStart);
        }

        private void declaration(SyntaxNode node, @Nullable Candidate parent, int templateStart) {
            var type = node.field(FIELD_TYPE);
            var declarators = node.fields(FIELD_DECLARATOR);
            if (type != null && RECORD_SPECIFIERS.contains(type.kind())) {
                if (type.field(FIELD_BODY) != null || declarators.isEmpty()) {
                    specifier(type, type, parent, templateStart, null);
                }
            }
            for (var declarator : declarators) {
                var function = Declarators.functionDeclarator(declarator);
                if (function != null) {
                    var nameNode = function.field(FIELD_DECLARATOR);
                    if (nameNode != null) {
                        callable(
                                node,
                                nameNode,
                                true,
                                Declarators.signature(node, declarator),
                                parent,
                                templateStart);
                    }
                } else if (node.is(DECLARATION) && !scope.inType() && declarator.is(INIT_DECLARATOR)) {
                    variable(node, declarator, parent);
                }
            }
        }

        private void variable(SyntaxNode node, SyntaxNode initDeclarator, @Nullable Candidate parent) {
            var value = initDeclarator.field(FIELD_VALUE);
            var name = Declarators.declaredName(initDeclarator);
            if (value == null || name == null || name.isEmpty() || Declarators.trivialInitializer(value)) {
                return;
            }
            add(
                    EntityKind.VARIABLE,
                    name,
                    node.startLine(),
                    node.endLine(),
                    false,
                    Declarators.signature(node, initDeclarator),
                    null,
                    node,
                    parent);
        }

        private void callable(
                SyntaxNode owner,
                SyntaxNode nameNode,
                boolean declarationOnly,
                String signature,
                @Nullable Candidate parent,
                int templateStart) {
            int start = templateStart >= 0 ? templateStart : owner.startLine();
            callable(owner, start, owner.endLine(), nameNode, declarationOnly, signature, parent);
        }

        private void callable(
                SyntaxNode owner,
                int start,
                int end,
                SyntaxNode nameNode,
                boolean declarationOnly,
                String signature,
                @Nullable Candidate parent) {
            var name = Declarators.nameOf(nameNode);
            if (name.isEmpty()) {
                return;
            }
            var display = ScopeResolver.lastSegment(name);
            var qualifier = ScopeResolver.qualifier(name);
            EntityKind kind;
            if (!qualifier.isEmpty()) {
                if (display.startsWith("~")) {
                    kind = EntityKind.DESTRUCTOR;
                } else if (display.equals(ScopeResolver.lastSegment(qualifier))) {
                    kind = EntityKind.CONSTRUCTOR;
                } else {
                    kind = EntityKind.METHOD;
                }
            } else if (scope.inType()) {
                var frame = scope.current();
                if (display.startsWith("~")) {
                    kind = EntityKind.DESTRUCTOR;
                } else if (frame != null && display.equals(frame.name())) {
                    kind = EntityKind.CONSTRUCTOR;
                } else {
                    kind = EntityKind.METHOD;
                }
            } else {
                kind = EntityKind.FUNCTION;
            }
            var candidate = add(kind, name, start, end, declarationOnly, signature, null, owner, parent);
            if (!qualifier.isEmpty()) {
                candidate.outOfLineQualifier = scope.qualify(qualifier);
            }
        }

        private void template(SyntaxNode node, @Nullable Candidate parent, int templateStart) {
            int start = templateStart >= 0 ? templateStart : node.startLine();
            for (var child : node.children()) {
                if (child.named() && !FIELD_PARAMETERS.equals(child.fieldName())) {
                    visit(child, parent, start);
                }
            }
        }

        private void typeDefinition(SyntaxNode node, @Nullable Candidate parent) {
            var type = node.field(FIELD_TYPE);
            var declarators = node.fields(FIELD_DECLARATOR);
            if (type == null) {
                return;
            }
            String typeText = SyntaxNodes.compactText(type);
            String recordName = null;
            if (RECORD_SPECIFIERS.contains(type.kind()) && type.field(FIELD_BODY) != null) {
                var typeName = type.field(FIELD_NAME);
                if (typeName == null) {
                    // typedef struct { ... } Name;
                    recordName = declarators.isEmpty() ? null : Declarators.declaredName(declarators.get(0));
                    specifier(type, node, parent, -1, recordName);
                } else {
                    recordName = Declarators.nameOf(typeName);
                    specifier(type, type, parent, -1, null);
                }
                if (recordName != null) {
                    typeText = recordName;
                }
            }
            for (var declarator : declarators) {
                var nameNode = Declarators.nameNode(declarator);
                if (nameNode == null) {
                    continue;
                }
                var name = Declarators.nameOf(nameNode);
                if (name.isEmpty() || name.equals(recordName)) {
                    continue;
                }
                var rest = declarator.text().replaceFirst(Pattern.quote(nameNode.text()), "");
                var aliasOf = SyntaxNodes.collapseWhitespace(typeText + " " + rest);
                add(EntityKind.TYPE_ALIAS, name, node.startLine(), node.endLine(), false, null, aliasOf, node, parent);
            }
        }

        private void alias(SyntaxNode node, @Nullable Candidate parent, int templateStart) {
            var nameNode = node.field(FIELD_NAME);
            if (nameNode == null) {
                return;
            }
            int start = templateStart >= 0 ? templateStart : node.startLine();
            add(
                    EntityKind.TYPE_ALIAS,
                    Declarators.nameOf(nameNode),
                    start,
                    node.endLine(),
                    false,
                    null,
                    SyntaxNodes.compactText(node.field(FIELD_TYPE)),
                    node,
                    parent);
        }

        private void macro(SyntaxNode node, @Nullable Candidate parent) {
            var nameNode = node.field(FIELD_NAME);
            if (nameNode == null) {
                return;
            }
            var text = node.text();
            int newline = text.indexOf('\n');
            var firstLine = (newline < 0 ? text : text.substring(0, newline)).strip();
            var candidate = new Candidate(
                    EntityKind.MACRO,
                    nameNode.text(),
                    nameNode.text(),
                    node.startLine(),
                    node.endLine(),
                    false,
                    firstLine,
                    null,
                    node.id(),
                    parent);
            candidates.add(candidate);
        }

        private void linkage(SyntaxNode node, @Nullable Candidate parent) {
            var body = node.field(FIELD_BODY);
            if (body == null) {
                return;
            }
            if (body.is(DECLARATION_LIST)) {
                visitContainer(body, parent);
            } else {
                visit(body, parent, -1);
            }
        }

        private List<BaseSpecifier> basesOfRecord(SyntaxNode record, EntityKind kind) {
            return bases(SyntaxNodes.firstChildOfKind(record, Set.of(BASE_CLASS_CLAUSE)), kind);
        }

        private List<BaseSpecifier> bases(@Nullable SyntaxNode clause, EntityKind kind) {
            if (clause == null) {
                return List.of();
            }
            var defaultAccess = kind == EntityKind.CLASS ? AccessSpecifier.PRIVATE : AccessSpecifier.PUBLIC;
            var bases = new ArrayList<BaseSpecifier>();
            AccessSpecifier access = null;
            boolean virtual = false;
            for (var child : clause.children()) {
                var k = child.kind();
                if (k.equals(ACCESS_SPECIFIER) || AccessSpecifier.fromKeyword(k) != null) {
                    access = AccessSpecifier.fromKeyword(child.text());
                } else if (k.equals("virtual")) {
                    virtual = true;
                } else if (k.equals(",")) {
                    access = null;
                    virtual = false;
                } else if (BASE_TYPE_KINDS.contains(k)) {
                    var name = child.text().replaceAll("\\s+", "");
                    if (name.startsWith("::")) {
                        name = name.substring(2);
                    }
                    bases.add(new BaseSpecifier(
                            name, access != null ? access : defaultAccess, virtual, bases.size(), child.startLine()));
                    access = null;
                    virtual = false;
                }
            }
            return bases;
        }

        private Candidate add(
                EntityKind kind,
                String localName,
                int startLine,
                int endLine,
                boolean declarationOnly,
                @Nullable String signature,
                @Nullable String aliasOf,
                SyntaxNode node,
                @Nullable Candidate parent) {
            var candidate = new Candidate(
                    kind,
                    scope.qualify(localName),
                    scope.lookupKey(localName),
                    startLine,
                    endLine,
                    declarationOnly,
                    signature,
                    aliasOf,
                    node.id(),
                    parent);
            candidates.add(candidate);
            return candidate;
        }

        ExtractedEntities finish() {
            var namespaces = new HashSet<String>();
            var records = new HashMap<String, Candidate>();
            var defined = new HashSet<String>();
            for (var c : candidates) {
                if (c.kind == EntityKind.NAMESPACE) {
                    namespaces.add(c.qualifiedName);
                } else if (c.kind.recordType() && !c.forward) {
                    records.putIfAbsent(c.qualifiedName, c);
                }
                if (!c.forward) {
                    defined.add(c.key());
                }
            }

            // out-of-line definitions: Outer::f in a namespace is a function, Type::f in a record is a method
            for (var c : candidates) {
                if (c.outOfLineQualifier == null) {
                    continue;
                }
                var owner = records.get(c.outOfLineQualifier);
                if (owner != null) {
                    c.parent = owner;
                } else if (c.kind == EntityKind.METHOD && namespaces.contains(c.outOfLineQualifier)) {
                    c.kind = EntityKind.FUNCTION;
                }
            }

            var kept = new IdentityHashMap<Candidate, CodeEntity>();
            var seenForwards = new HashSet<String>();
            var seenIds = new HashSet<String>();
            var entities = new ArrayList<CodeEntity>();
            for (var c : candidates) {
                if (c.forward && (defined.contains(c.key()) || !seenForwards.add(c.key()))) {
                    logger.trace("{}: forward declaration of {} absorbed", file, c.qualifiedName);
                    continue;
                }
                if (!Span.wellFormed(c.startLine, c.endLine)) {
                    logger.warn(
                            "{}: dropping {} {} with malformed span {}-{}",
                            file,
                            c.kind,
                            c.qualifiedName,
                            c.startLine,
                            c.endLine);
                    issues.add(ExtractionIssue.MALFORMED_SPAN);
                    continue;
                }
                var entity = CodeEntity.of(
                        file,
                        profile.language(),
                        c.kind,
                        c.qualifiedName,
                        new Span(c.startLine, c.endLine),
                        c.declarationOnly || c.forward,
                        c.signature,
                        c.aliasOf);
                if (!seenIds.add(entity.id())) {
                    logger.debug("{}: duplicate entity {} ignored", file, entity.id());
                    continue;
                }
                kept.put(c, entity);
                entities.add(entity);
            }

            var parentOf = new LinkedHashMap<String, String>();
            var basesOf = new LinkedHashMap<String, List<BaseSpecifier>>();
            var byNode = new HashMap<Integer, CodeEntity>();
            var lookupKeys = new HashMap<String, String>();
            for (var c : candidates) {
                var entity = kept.get(c);
                if (entity == null) {
                    continue;
                }
                var p = c.parent;
                while (p != null && !kept.containsKey(p)) {
                    p = p.parent;
                }
                if (p != null) {
                    parentOf.put(entity.id(), kept.get(p).id());
                }
                if (!c.bases.isEmpty()) {
                    basesOf.put(entity.id(), c.bases);
                }
                byNode.put(c.nodeId, entity);
                lookupKeys.put(entity.id(), c.lookupKey);
            }
            return new ExtractedEntities(entities, parentOf, basesOf, byNode, lookupKeys, issues);
        }
    }

    private static EntityKind recordKind(SyntaxNode node) {
        return switch (node.kind()) {
            case CLASS_SPECIFIER -> EntityKind.CLASS;
            case UNION_SPECIFIER -> EntityKind.UNION;
            default -> EntityKind.STRUCT;
        };
    }

    private static FrameKind frameKind(EntityKind kind) {
        return switch (kind) {
            case CLASS -> FrameKind.CLASS;
            case UNION -> FrameKind.UNION;
            default -> FrameKind.STRUCT;
        };
    }

    private static boolean scoped(SyntaxNode enumSpecifier) {
        for (var child : enumSpecifier.children()) {
            if (!child.named() && (child.is("class") || child.is("struct"))) {
                return true;
            }
        }
        return false;
    }
}
