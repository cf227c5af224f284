package io.github.codegraph.extractor.cfamily;

import static io.github.codegraph.extractor.TestSources.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.codegraph.model.CodeEntity;
import io.github.codegraph.model.Confidence;
import io.github.codegraph.model.EntityKind;
import io.github.codegraph.model.FileExtraction;
import io.github.codegraph.model.Relationship;
import io.github.codegraph.model.RelationshipAttributes;
import io.github.codegraph.model.RelationshipKind;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class RelationshipResolverTest {

    private static FileExtraction calls;
    private static FileExtraction inheritance;
    private static FileExtraction features;

    @BeforeAll
    public static void setup() {
        calls = extract(cpp("calls.cpp"));
        inheritance = extract(cpp("inheritance.hpp"));
        features = extract(cpp("features.cpp"));
    }

    private static List<Relationship> extendsOf(FileExtraction extraction, CodeEntity derived) {
        return extraction.relationshipsOfKind(RelationshipKind.EXTENDS).stream()
                .filter(r -> r.sourceId().equals(derived.id()))
                .toList();
    }

    // ---- CALLS ----

    @Test
    public void directCallsResolveExactly() {
        var runCalls = entity(calls, EntityKind.FUNCTION, "runCalls");
        var noArgs = entity(calls, EntityKind.FUNCTION, "noArgs");
        var call = callTo(calls, runCalls, "noArgs");
        assertEquals(noArgs.id(), call.target());
        assertEquals(Confidence.EXACT, call.confidence());
        assertEquals("70", call.attribute(RelationshipAttributes.LINE));

        assertEquals(Confidence.EXACT, callTo(calls, runCalls, "withArgs").confidence());
    }

    @Test
    public void qualifiedCallsResolveThroughNamespacesAndClasses() {
        var runCalls = entity(calls, EntityKind.FUNCTION, "runCalls");
        var routed = entity(calls, EntityKind.FUNCTION, "Dispatch::routed");
        assertEquals(routed.id(), callTo(calls, runCalls, "Dispatch::routed").target());

        var staticTarget = callTo(calls, runCalls, "Tester::staticTarget");
        assertEquals(Confidence.EXACT, staticTarget.confidence());
        assertEquals(entity(calls, EntityKind.METHOD, "Tester::staticTarget").id(), staticTarget.target());
        assertEquals(Confidence.EXACT, callTo(calls, runCalls, "Tester::staticCaller").confidence());
    }

    @Test
    public void templateCallsDropTheirArguments() {
        var runCalls = entity(calls, EntityKind.FUNCTION, "runCalls");
        var passThrough = entity(calls, EntityKind.FUNCTION, "Dispatch::passThrough");
        var edges = callsFrom(calls, runCalls).stream()
                .filter(r -> r.target().equals(passThrough.id()))
                .toList();
        assertEquals(2, edges.size());
        assertTrue(edges.stream().allMatch(r -> r.confidence() == Confidence.EXACT));
    }

    @Test
    public void callsInsideNamespaceFindEnclosingScopeFirst() {
        var routed = entity(calls, EntityKind.FUNCTION, "Dispatch::routed");
        var report = callTo(calls, routed, "report");
        assertEquals(Confidence.EXACT, report.confidence());
        // the definition wins over the prototype on line 5
        var definition = calls.entitiesOfKind(EntityKind.FUNCTION).stream()
                .filter(e -> e.qualifiedName().equals("report") && !e.declarationOnly())
                .findFirst()
                .orElseThrow();
        assertEquals(definition.id(), report.target());

        var passThrough = entity(calls, EntityKind.FUNCTION, "Dispatch::passThrough");
        assertEquals(routed.id(), callTo(calls, passThrough, "Dispatch::routed").target());
    }

    @Test
    public void memberCallsUseTheReceiverType() {
        var runCalls = entity(calls, EntityKind.FUNCTION, "runCalls");
        assertEquals(
                entity(calls, EntityKind.METHOD, "Tester::first").id(),
                callTo(calls, runCalls, "Tester::first").target());
        // through a pointer
        var second = callTo(calls, runCalls, "Tester::second");
        assertEquals(Confidence.EXACT, second.confidence());
        assertEquals("88", second.attribute(RelationshipAttributes.LINE));
        assertEquals(Confidence.EXACT, callTo(calls, runCalls, "Tester::numbers").confidence());

        var first = entity(calls, EntityKind.METHOD, "Tester::first");
        var viaThis = callTo(calls, first, "Tester::second");
        assertEquals(Confidence.EXACT, viaThis.confidence());
        assertEquals(Confidence.EXACT, callTo(calls, first, "noArgs").confidence());
    }

    @Test
    public void constructionCallsTheConstructor() {
        var runCalls = entity(calls, EntityKind.FUNCTION, "runCalls");
        var ctor = entity(calls, EntityKind.CONSTRUCTOR, "Tester::Tester");
        var ctorCalls = callsFrom(calls, runCalls).stream()
                .filter(r -> r.target().equals(ctor.id()))
                .map(r -> r.attribute(RelationshipAttributes.LINE))
                .toList();
        // stack object on line 84, new-expression on line 87
        assertEquals(List.of("84", "87"), ctorCalls);
    }

    @Test
    public void functionPointerCallsAreUnknownAndTargetTheAssignedFunction() {
        var runCalls = entity(calls, EntityKind.FUNCTION, "runCalls");
        var viaTypedef = callsFrom(calls, runCalls).stream()
                .filter(r -> "fn".equals(r.attribute(RelationshipAttributes.VIA)))
                .findFirst()
                .orElseThrow();
        assertEquals(Confidence.UNKNOWN, viaTypedef.confidence());
        assertEquals("report", viaTypedef.targetName());
        var definition = calls.entitiesOfKind(EntityKind.FUNCTION).stream()
                .filter(e -> e.qualifiedName().equals("report") && !e.declarationOnly())
                .findFirst()
                .orElseThrow();
        assertEquals(definition.id(), viaTypedef.target());

        var viaRaw = callsFrom(calls, runCalls).stream()
                .filter(r -> "raw".equals(r.attribute(RelationshipAttributes.VIA)))
                .findFirst()
                .orElseThrow();
        assertEquals(Confidence.UNKNOWN, viaRaw.confidence());
        assertEquals("report", viaRaw.targetName());
        assertEquals("79", viaRaw.attribute(RelationshipAttributes.LINE));
    }

    @Test
    public void callsThroughFileScopeFunctionPointers() {
        var extraction = extract(inline("fnptr.cpp", """
                typedef int (*Op)(int, int);
                int add(int a, int b) { return a + b; }
                Op g_op = add;
                int (*raw_op)(int, int) = &add;
                int run() { return g_op(1, 2) + raw_op(3, 4); }
                """));
        var run = entity(extraction, EntityKind.FUNCTION, "run");
        var add = entity(extraction, EntityKind.FUNCTION, "add");
        for (var via : List.of("g_op", "raw_op")) {
            var call = callsFrom(extraction, run).stream()
                    .filter(r -> via.equals(r.attribute(RelationshipAttributes.VIA)))
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("no call via " + via));
            assertEquals(add.id(), call.target());
            assertEquals("add", call.targetName());
            assertEquals(Confidence.UNKNOWN, call.confidence());
            assertEquals("4", call.attribute(RelationshipAttributes.LINE));
        }
        assertTrue(callsFrom(extraction, run).stream().noneMatch(r -> r.targetName().equals("g_op")));
    }

    @Test
    public void functorCallsTargetCallOperator() {
        var runCalls = entity(calls, EntityKind.FUNCTION, "runCalls");
        var operator = entity(calls, EntityKind.METHOD, "Dispatch::Functor::operator()");
        var call = callsFrom(calls, runCalls).stream()
                .filter(r -> "functor".equals(r.attribute(RelationshipAttributes.VIA)))
                .findFirst()
                .orElseThrow();
        assertEquals(operator.id(), call.target());
        assertEquals(Confidence.UNKNOWN, call.confidence());
        assertEquals("()", call.attribute(RelationshipAttributes.OPERATOR));
    }

    @Test
    public void lambdaCallWithoutKnownValueKeepsTheCallText() {
        var useLambda = entity(features, EntityKind.FUNCTION, "useLambda");
        var call = callsFrom(features, useLambda).stream()
                .filter(r -> "add".equals(r.attribute(RelationshipAttributes.VIA)))
                .findFirst()
                .orElseThrow();
        assertEquals(Confidence.UNKNOWN, call.confidence());
        assertEquals("add(5, 3)", call.targetName());
    }

    @Test
    public void unresolvedCallsBecomeExternalReferences() {
        var runCalls = entity(calls, EntityKind.FUNCTION, "runCalls");
        var process = callTo(calls, runCalls, "Processing::DataProcessor::process");
        assertEquals(Confidence.PROBABLE, process.confidence());
        var external = calls.entities().stream()
                .filter(e -> e.id().equals(process.target()))
                .findFirst()
                .orElseThrow();
        assertEquals(EntityKind.EXTERNAL_REFERENCE, external.kind());
        assertEquals(102, external.startLine());

        assertEquals(Confidence.PROBABLE, callTo(calls, runCalls, "std::vector::push_back").confidence());
        assertEquals(
                Confidence.PROBABLE,
                callTo(calls, runCalls, "Processing::DataProcessor::DataProcessor").confidence());
    }

    @Test
    public void everyCallSourceIsACallableOrVariable() {
        for (var extraction : List.of(calls, features)) {
            for (var call : extraction.relationshipsOfKind(RelationshipKind.CALLS)) {
                var source = extraction.entities().stream()
                        .filter(e -> e.id().equals(call.sourceId()))
                        .findFirst()
                        .orElseThrow(() -> new AssertionError("Dangling source " + call));
                assertTrue(source.kind().callable() || source.kind() == EntityKind.VARIABLE, call.toString());
                assertNotNull(call.attribute(RelationshipAttributes.LINE));
            }
        }
    }

    @Test
    public void callsThroughInheritedMembers() {
        var touch = entity(inheritance, EntityKind.METHOD, "Shapes::Multiple::touch");
        var base2Only = entity(inheritance, EntityKind.METHOD, "Shapes::Base2::base2Only");
        assertEquals(base2Only.id(), callTo(inheritance, touch, "Shapes::Base2::base2Only").target());

        var fill = entity(inheritance, EntityKind.METHOD, "Shapes::FromTemplate::fill");
        var store = callTo(inheritance, fill, "Shapes::Generic::store");
        assertEquals(Confidence.EXACT, store.confidence());
    }

    @Test
    public void baseConstructorAndQualifiedBaseMethodCalls() {
        var childCtor = entity(features, EntityKind.CONSTRUCTOR, "Outer::Child::Child");
        var baseCtor = entity(features, EntityKind.CONSTRUCTOR, "LaterDefined::LaterDefined");
        assertEquals(baseCtor.id(), callTo(features, childCtor, "LaterDefined::LaterDefined").target());

        var childDescribe = entity(features, EntityKind.METHOD, "Outer::Child::describe");
        var baseDescribe = entity(features, EntityKind.METHOD, "LaterDefined::describe");
        assertEquals(baseDescribe.id(), callTo(features, childDescribe, "LaterDefined::describe").target());
    }

    @Test
    public void overloadedOperatorOnRecordResolvesToMember() {
        var main = entity(features, EntityKind.FUNCTION, "main");
        var plus = callsFrom(features, main).stream()
                .filter(r -> "+".equals(r.attribute(RelationshipAttributes.OPERATOR)))
                .findFirst()
                .orElseThrow();
        assertEquals(entity(features, EntityKind.METHOD, "LaterDefined::operator+").id(), plus.target());
        assertEquals(Confidence.EXACT, plus.confidence());
    }

    @Test
    public void builtinOperatorsProduceNoCalls() {
        var lambdaOwner = entity(features, EntityKind.FUNCTION, "useLambda");
        assertTrue(callsFrom(features, lambdaOwner).stream()
                .noneMatch(r -> "+".equals(r.attribute(RelationshipAttributes.OPERATOR))));
    }

    @Test
    public void anonymousNamespaceFunctionIsFoundFromFileScope() {
        var main = entity(features, EntityKind.FUNCTION, "main");
        var hidden = entity(features, EntityKind.FUNCTION, "hidden");
        assertEquals(hidden.id(), callTo(features, main, "hidden").target());
        assertEquals(Confidence.EXACT, callTo(features, main, "twice").confidence());
        assertEquals(Confidence.EXACT, callTo(features, main, "c_entry").confidence());
    }

    @Test
    public void uniqueSimpleNameMatchIsProbable() {
        var source = inline("probable.cpp", """
                namespace a {
                    void helper() {}
                }
                void run() {
                    helper();
                }
                """);
        var extraction = extract(source);
        var run = entity(extraction, EntityKind.FUNCTION, "run");
        var call = callTo(extraction, run, "a::helper");
        assertEquals(Confidence.PROBABLE, call.confidence());
        assertEquals(entity(extraction, EntityKind.FUNCTION, "a::helper").id(), call.target());
    }

    @Test
    public void callsInsideUnclosedScopesKeepTheirCaller() {
        var extraction = extract(inline("unclosed.cpp", """
                namespace A {
                class B { public: void f(); };
                void B::f() {}
                void g() {
                  h(1);
                """));
        var g = entity(extraction, EntityKind.FUNCTION, "A::g");
        var call = callTo(extraction, g, "h");
        assertEquals("4", call.attribute(RelationshipAttributes.LINE));
        assertEquals(Confidence.PROBABLE, call.confidence());
    }

    @Test
    public void nestedUnclosedNamespacesResolveCallsToSiblings() {
        var extraction = extract(inline("nested_unclosed.cpp", """
                namespace A { namespace B {
                void g() { h(); }
                void k() {
                  g();
                """));
        var k = entity(extraction, EntityKind.FUNCTION, "A::B::k");
        var call = callTo(extraction, k, "A::B::g");
        assertEquals(entity(extraction, EntityKind.FUNCTION, "A::B::g").id(), call.target());
        assertEquals(Confidence.EXACT, call.confidence());
        assertFalse(callsFrom(extraction, entity(extraction, EntityKind.FUNCTION, "A::B::g")).isEmpty());
    }

    @Test
    public void withoutIncludesUnresolvedCallsStayBare() {
        var extraction = extract(inline("bare.cpp", "void run() {\n    missing(1);\n}\n"));
        var run = entity(extraction, EntityKind.FUNCTION, "run");
        var call = callTo(extraction, run, "missing");
        assertEquals("missing", call.target());
        assertEquals(Confidence.PROBABLE, call.confidence());
        assertTrue(extraction.entitiesOfKind(EntityKind.EXTERNAL_REFERENCE).isEmpty());
    }

    // ---- EXTENDS ----

    @Test
    public void singleInheritance() {
        var single = entity(inheritance, EntityKind.CLASS, "Shapes::Single");
        var edges = extendsOf(inheritance, single);
        assertEquals(1, edges.size());
        var edge = edges.get(0);
        assertEquals(entity(inheritance, EntityKind.CLASS, "Shapes::Base1").id(), edge.target());
        assertEquals(Confidence.EXACT, edge.confidence());
        assertEquals("public", edge.attribute(RelationshipAttributes.ACCESS));
        assertEquals("0", edge.attribute(RelationshipAttributes.ORDER));
    }

    @Test
    public void multipleInheritanceKeepsOrderAndAccess() {
        var multiple = entity(inheritance, EntityKind.CLASS, "Shapes::Multiple");
        var edges = extendsOf(inheritance, multiple);
        assertEquals(2, edges.size());
        assertEquals("Shapes::Base1", edges.get(0).targetName());
        assertEquals("public", edges.get(0).attribute(RelationshipAttributes.ACCESS));
        assertEquals("Shapes::Base2", edges.get(1).targetName());
        assertEquals("private", edges.get(1).attribute(RelationshipAttributes.ACCESS));
        assertEquals("1", edges.get(1).attribute(RelationshipAttributes.ORDER));
    }

    @Test
    public void templatedBaseIsProbableWithArguments() {
        var fromTemplate = entity(inheritance, EntityKind.CLASS, "Shapes::FromTemplate");
        var edge = extendsOf(inheritance, fromTemplate).get(0);
        assertEquals(Confidence.PROBABLE, edge.confidence());
        assertEquals(entity(inheritance, EntityKind.CLASS, "Shapes::Generic").id(), edge.target());
        assertEquals("Shapes::Generic<int>", edge.targetName());
        assertEquals("<int>", edge.attribute(RelationshipAttributes.TEMPLATE_ARGUMENTS));
    }

    @Test
    public void structBasesDefaultToPublic() {
        var plain = entity(inheritance, EntityKind.STRUCT, "Shapes::PlainStruct");
        assertEquals("public", extendsOf(inheritance, plain).get(0).attribute(RelationshipAttributes.ACCESS));
        var prot = entity(inheritance, EntityKind.CLASS, "Shapes::Protected");
        assertEquals("protected", extendsOf(inheritance, prot).get(0).attribute(RelationshipAttributes.ACCESS));
        assertTrue(extendsOf(inheritance, entity(inheritance, EntityKind.CLASS, "Shapes::Standalone")).isEmpty());
    }

    @Test
    public void virtualAndExternalBases() {
        var extraction = extract(inline("virtual.cpp", """
                #include <stdexcept>
                class Local {};
                class Both : protected virtual Local, public std::runtime_error {};
                """));
        var both = entity(extraction, EntityKind.CLASS, "Both");
        var edges = extendsOf(extraction, both);
        assertEquals(2, edges.size());
        assertEquals("true", edges.get(0).attribute(RelationshipAttributes.VIRTUAL));
        assertEquals("protected", edges.get(0).attribute(RelationshipAttributes.ACCESS));
        assertEquals(Confidence.EXACT, edges.get(0).confidence());

        var external = edges.get(1);
        assertEquals("std::runtime_error", external.targetName());
        assertEquals(Confidence.PROBABLE, external.confidence());
        assertNull(external.attribute(RelationshipAttributes.VIRTUAL));
        assertTrue(extraction.entitiesOfKind(EntityKind.EXTERNAL_REFERENCE).stream()
                .anyMatch(e -> e.id().equals(external.target())));
    }

    // ---- IMPORTS and CONTAINS ----

    @Test
    public void includesImportExternalModules() {
        var imports = calls.relationshipsOfKind(RelationshipKind.IMPORTS);
        var names = imports.stream().map(Relationship::targetName).toList();
        assertEquals(List.of("iostream", "vector", "string", "processor.hpp"), names);
        assertTrue(imports.stream().allMatch(r -> r.sourceId().equals("calls.cpp")));
        assertEquals("system", imports.get(0).attribute(RelationshipAttributes.INCLUDE_STYLE));
        assertEquals("local", imports.get(3).attribute(RelationshipAttributes.INCLUDE_STYLE));

        var module = calls.entities().stream()
                .filter(e -> e.id().equals(imports.get(3).target()))
                .findFirst()
                .orElseThrow();
        assertEquals(EntityKind.EXTERNAL_REFERENCE, module.kind());
        assertEquals("#include \"processor.hpp\"", module.signature());
        assertEquals(3, module.startLine());
    }

    @Test
    public void usingNamespaceImportsAndEnablesLookup() {
        var processor = extract(cpp("processor.cpp"));
        var std = processor.relationshipsOfKind(RelationshipKind.IMPORTS).stream()
                .filter(r -> r.targetName().equals("std"))
                .findFirst()
                .orElseThrow();
        assertEquals(Confidence.EXACT, std.confidence());

        var extraction = extract(inline("using.cpp", """
                namespace util {
                    void tool() {}
                }
                using namespace util;
                void run() {
                    tool();
                }
                """));
        var run = entity(extraction, EntityKind.FUNCTION, "run");
        var tool = entity(extraction, EntityKind.FUNCTION, "util::tool");
        var call = callTo(extraction, run, "util::tool");
        assertEquals(tool.id(), call.target());
        assertEquals(Confidence.EXACT, call.confidence());
        var namespace = entity(extraction, EntityKind.NAMESPACE, "util");
        assertTrue(extraction.relationshipsOfKind(RelationshipKind.IMPORTS).stream()
                .anyMatch(r -> r.target().equals(namespace.id())));
    }

    @Test
    public void containsFollowsNesting() {
        var contains = inheritance.relationshipsOfKind(RelationshipKind.CONTAINS);
        var shapes = entity(inheritance, EntityKind.NAMESPACE, "Shapes");
        var base1 = entity(inheritance, EntityKind.CLASS, "Shapes::Base1");
        var common = entity(inheritance, EntityKind.METHOD, "Shapes::Base1::common");
        assertTrue(contains.contains(
                new Relationship(RelationshipKind.CONTAINS, shapes.id(), base1.id(), base1.qualifiedName(),
                        Confidence.EXACT)));
        assertTrue(contains.contains(
                new Relationship(RelationshipKind.CONTAINS, base1.id(), common.id(), common.qualifiedName(),
                        Confidence.EXACT)));
        assertTrue(common.declarationOnly());
        // every non-namespace entity except top-level ones has exactly one container
        assertEquals(contains.size(), contains.stream().map(Relationship::target).distinct().count());
    }
}
