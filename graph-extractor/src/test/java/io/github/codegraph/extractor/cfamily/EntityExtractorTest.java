package io.github.codegraph.extractor.cfamily;

import static io.github.codegraph.extractor.TestSources.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.codegraph.extractor.tree.ArenaSyntaxTree;
import io.github.codegraph.model.EntityKind;
import io.github.codegraph.model.ExtractionIssue;
import io.github.codegraph.model.FileExtraction;
import io.github.codegraph.model.FileStatus;
import io.github.codegraph.model.RelationshipKind;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class EntityExtractorTest {

    private static FileExtraction features;
    private static FileExtraction processorHeader;
    private static FileExtraction processorSource;
    private static FileExtraction forward;

    @BeforeAll
    public static void setup() {
        features = extract(cpp("features.cpp"));
        processorHeader = extract(cpp("processor.hpp"));
        processorSource = extract(cpp("processor.cpp"));
        forward = extract(cpp("forward.hpp"));
    }

    @Test
    public void fixturesExtractCleanly() {
        for (var extraction : new FileExtraction[] {features, processorHeader, processorSource, forward}) {
            assertEquals(FileStatus.COMPLETE, extraction.status(), extraction.file() + " " + extraction.issues());
            assertTrue(extraction.issues().isEmpty());
        }
    }

    @Test
    public void nestedNamespacesQualifyTheirMembers() {
        var inner = entity(features, EntityKind.NAMESPACE, "Outer::Inner");
        assertEquals("Inner", inner.displayName());
        var fn = entity(features, EntityKind.FUNCTION, "Outer::Inner::innerFunction");
        assertEquals(14, fn.span().startLine());
        assertEquals(16, fn.span().endLine());
        assertFalse(fn.declarationOnly());
        assertEquals("void innerFunction()", fn.signature());

        // namespace Outer is reopened twice; each block is its own entity
        assertEquals(3, features.entitiesOfKind(EntityKind.NAMESPACE).stream()
                .filter(e -> e.qualifiedName().equals("Outer"))
                .count());
    }

    @Test
    public void anonymousNamespaceAddsNothingToNames() {
        var hidden = entity(features, EntityKind.FUNCTION, "hidden");
        assertEquals(31, hidden.startLine());
        // trivially initialized constants are not variables
        assertTrue(entities(features, "RATIO").isEmpty());
    }

    @Test
    public void classMembersGetTheirKinds() {
        var cls = entity(features, EntityKind.CLASS, "LaterDefined");
        assertEquals(46, cls.span().startLine());
        assertEquals(67, cls.span().endLine());
        assertFalse(cls.declarationOnly());

        var ctor = entity(features, EntityKind.CONSTRUCTOR, "LaterDefined::LaterDefined");
        assertEquals(50, ctor.startLine());
        var dtor = entity(features, EntityKind.DESTRUCTOR, "LaterDefined::~LaterDefined");
        assertEquals("~LaterDefined", dtor.displayName());
        assertTrue(dtor.signature().startsWith("virtual"), dtor.signature());

        var describe = entity(features, EntityKind.METHOD, "LaterDefined::describe");
        assertEquals("virtual void describe()", describe.signature());
        assertFalse(describe.declarationOnly());

        var deleted = entity(features, EntityKind.METHOD, "LaterDefined::forbidden");
        assertTrue(deleted.declarationOnly());

        var plus = entity(features, EntityKind.METHOD, "LaterDefined::operator+");
        assertEquals("operator+", plus.displayName());

        var childCtor = entity(features, EntityKind.CONSTRUCTOR, "Outer::Child::Child");
        assertEquals(73, childCtor.startLine());
        entity(features, EntityKind.METHOD, "Outer::Child::describe");
    }

    @Test
    public void forwardDeclarationIsAbsorbedByLaterDefinition() {
        var laterDefined = features.entitiesOfKind(EntityKind.CLASS).stream()
                .filter(e -> e.qualifiedName().equals("LaterDefined"))
                .toList();
        assertEquals(1, laterDefined.size());
        assertFalse(laterDefined.get(0).declarationOnly());

        var neverDefined = entity(features, EntityKind.CLASS, "NeverDefined");
        assertTrue(neverDefined.declarationOnly());
        assertEquals(6, neverDefined.startLine());
    }

    @Test
    public void forwardOnlyHeader() {
        assertTrue(entity(forward, EntityKind.CLASS, "FwdClass").declarationOnly());
        assertTrue(entity(forward, EntityKind.STRUCT, "FwdStruct").declarationOnly());
        assertTrue(entity(forward, EntityKind.ENUM, "FwdNS::FwdEnum").declarationOnly());
        assertTrue(entity(forward, EntityKind.CLASS, "FwdNS::NestedFwd").declarationOnly());

        var fn = entity(forward, EntityKind.FUNCTION, "fwdFunction");
        assertTrue(fn.declarationOnly());
        assertEquals("void fwdFunction(int)", fn.signature());

        assertTrue(entities(forward, "plainGlobal").isEmpty());
        assertTrue(entities(forward, "externGlobal").isEmpty());
    }

    @Test
    public void enumsAndTheirValues() {
        var plain = entity(features, EntityKind.ENUM, "Plain");
        var one = entity(features, EntityKind.ENUM_VALUE, "P_ONE");
        assertTrue(features.relationshipsOfKind(RelationshipKind.CONTAINS).stream()
                .anyMatch(r -> r.sourceId().equals(plain.id()) && r.target().equals(one.id())));

        // scoped enum values are qualified by the enum
        entity(features, EntityKind.ENUM, "Outer::Mode");
        entity(features, EntityKind.ENUM_VALUE, "Outer::Mode::FAST");
        entity(features, EntityKind.ENUM_VALUE, "Outer::Mode::SLOW");
    }

    @Test
    public void typedefsAndAliases() {
        assertEquals("int", entity(features, EntityKind.TYPE_ALIAS, "Number").aliasOf());
        assertEquals("void (*)(int)", entity(features, EntityKind.TYPE_ALIAS, "Callback").aliasOf());
        assertEquals("std::vector<std::string>", entity(features, EntityKind.TYPE_ALIAS, "Names").aliasOf());
    }

    @Test
    public void templateSpanStartsAtTemplateKeyword() {
        var twice = entity(features, EntityKind.FUNCTION, "twice");
        assertEquals(41, twice.startLine());
        assertEquals(44, twice.span().endLine());

        var identity = entity(processorHeader, EntityKind.METHOD, "Processing::DataProcessor::identity");
        assertEquals(19, identity.startLine());
    }

    @Test
    public void variablesNeedANonTrivialInitializer() {
        var primes = entity(features, EntityKind.VARIABLE, "primes");
        assertEquals(81, primes.startLine());
        assertTrue(primes.signature().contains("primes"), primes.signature());
        // out-of-line static member initialized with a literal
        assertTrue(entities(features, "LaterDefined::counter").isEmpty());
    }

    @Test
    public void linkageBlockMembersAreExtracted() {
        entity(features, EntityKind.FUNCTION, "c_entry");
    }

    @Test
    public void headerDeclarations() {
        var process = entity(processorHeader, EntityKind.METHOD, "Processing::DataProcessor::process");
        assertTrue(process.declarationOnly());
        assertTrue(entity(processorHeader, EntityKind.FUNCTION, "Processing::helper").declarationOnly());
        // = default is a definition
        assertFalse(entity(processorHeader, EntityKind.DESTRUCTOR, "Processing::DataProcessor::~DataProcessor")
                .declarationOnly());

        var guard = entity(processorHeader, EntityKind.MACRO, "PROCESSOR_HPP");
        assertEquals("#define PROCESSOR_HPP", guard.signature());
    }

    @Test
    public void outOfLineMethodKeepsQualifiedName() {
        var process = entity(processorSource, EntityKind.METHOD, "Processing::DataProcessor::process");
        assertFalse(process.declarationOnly());
        assertEquals(9, process.startLine());
        entity(processorSource, EntityKind.FUNCTION, "Processing::helper");
        entity(processorSource, EntityKind.FUNCTION, "main");
    }

    @Test
    public void outOfLineMethodIsContainedByItsClassInTheSameFile() {
        var source = inline("widget.cpp", """
                namespace ui {
                class Widget {
                public:
                    void draw();
                };
                void Widget::draw() {}
                }
                """);
        var extraction = extract(source);
        var widget = entity(extraction, EntityKind.CLASS, "ui::Widget");
        var methods = extraction.entitiesOfKind(EntityKind.METHOD);
        assertEquals(2, methods.size());
        var definition = methods.stream().filter(m -> !m.declarationOnly()).findFirst().orElseThrow();
        assertEquals(5, definition.startLine());
        assertTrue(extraction.relationshipsOfKind(RelationshipKind.CONTAINS).stream()
                .anyMatch(r -> r.sourceId().equals(widget.id()) && r.target().equals(definition.id())));
    }

    @Test
    public void entitiesAreNeverDuplicated() {
        for (var extraction : new FileExtraction[] {features, processorHeader, processorSource, forward}) {
            var ids = extraction.entities().stream().map(e -> e.id()).collect(Collectors.toList());
            assertEquals(Set.copyOf(ids).size(), ids.size(), "duplicate ids in " + extraction.file());
        }
    }

    @Test
    public void unclosedNamespaceKeepsItsScope() {
        var result = extract(inline("unclosed.cpp", """
                namespace A {
                class B { public: void f(); };
                void B::f() {}
                void g() {
                  h(1);
                """));
        assertEquals(FileStatus.PARTIAL, result.status());
        assertTrue(result.issues().contains(ExtractionIssue.UNBALANCED_SCOPE));
        assertTrue(result.issues().contains(ExtractionIssue.PARSE_ERRORS));

        var ns = entity(result, EntityKind.NAMESPACE, "A");
        assertEquals(0, ns.span().startLine());
        assertEquals(4, ns.span().endLine());
        var cls = entity(result, EntityKind.CLASS, "A::B");
        assertTrue(entities(result, "A::B::f").stream().anyMatch(e -> !e.declarationOnly()));
        var g = entity(result, EntityKind.FUNCTION, "A::g");
        assertEquals(3, g.span().startLine());
        assertEquals(4, g.span().endLine());
        assertFalse(g.declarationOnly());
        assertTrue(entities(result, "h").isEmpty());
        assertTrue(result.relationshipsOfKind(RelationshipKind.CONTAINS).stream()
                .anyMatch(r -> r.sourceId().equals(ns.id()) && r.target().equals(cls.id())));
    }

    @Test
    public void unclosedClassKeepsItsMembers() {
        var result = extract(inline("open_class.cpp", "class C {\npublic:\n  void f();\n  int x;\n"));
        assertTrue(result.issues().contains(ExtractionIssue.UNBALANCED_SCOPE));
        entity(result, EntityKind.CLASS, "C");
        assertTrue(entity(result, EntityKind.METHOD, "C::f").declarationOnly());
    }

    @Test
    public void malformedSpanIsDroppedAndReported() {
        var source = "class A {};";
        var b = ArenaSyntaxTree.builder(source);
        int root = b.add(-1, "translation_unit", null, true, false, 0, 11, 0, 0);
        // start after end, which a real parser never produces
        int cls = b.add(root, "class_specifier", null, true, false, 0, 10, 5, 3);
        b.add(cls, "class", null, false, false, 0, 5, 5, 5);
        b.add(cls, "type_identifier", "name", true, false, 6, 7, 5, 5);
        b.add(cls, "field_declaration_list", "body", true, false, 8, 10, 5, 3);
        var tree = b.build(false);

        var extracted = new EntityExtractor(LanguageProfile.CPP).extract(tree, "a.cpp");
        assertTrue(extracted.entities().isEmpty());
        assertTrue(extracted.issues().contains(ExtractionIssue.MALFORMED_SPAN));

        var result = extractor().extract(inline("a.cpp", source), tree);
        assertEquals(FileStatus.PARTIAL, result.status());
        assertEquals(Set.of(ExtractionIssue.MALFORMED_SPAN), result.issues());
        assertEquals(1, result.slices().size());
    }
}
