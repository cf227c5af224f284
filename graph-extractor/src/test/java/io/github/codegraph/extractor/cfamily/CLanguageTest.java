package io.github.codegraph.extractor.cfamily;

import static io.github.codegraph.extractor.TestSources.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.codegraph.model.Confidence;
import io.github.codegraph.model.EntityKind;
import io.github.codegraph.model.FileExtraction;
import io.github.codegraph.model.FileStatus;
import io.github.codegraph.model.RelationshipAttributes;
import io.github.codegraph.model.RelationshipKind;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class CLanguageTest {

    private static FileExtraction main;
    private static FileExtraction shapes;

    @BeforeAll
    public static void setup() {
        main = extract(c("main.c"));
        shapes = extract(c("shapes.h"));
    }

    @Test
    public void cFilesExtractCompletely() {
        assertEquals(FileStatus.COMPLETE, main.status());
        assertEquals(FileStatus.COMPLETE, shapes.status());
        assertEquals("c", main.language());
    }

    @Test
    public void includesAreImports() {
        var imports = main.relationshipsOfKind(RelationshipKind.IMPORTS);
        assertEquals(3, imports.size());
        assertEquals("stdio.h", imports.get(0).targetName());
        assertEquals("system", imports.get(0).attribute(RelationshipAttributes.INCLUDE_STYLE));
        assertEquals("stdlib.h", imports.get(1).targetName());
        assertEquals("shapes.h", imports.get(2).targetName());
        assertEquals("local", imports.get(2).attribute(RelationshipAttributes.INCLUDE_STYLE));
    }

    @Test
    public void macros() {
        var maxItems = entity(main, EntityKind.MACRO, "MAX_ITEMS");
        assertEquals(4, maxItems.startLine());
        assertEquals("#define MAX_ITEMS 100", maxItems.signature());
        var square = entity(main, EntityKind.MACRO, "SQUARE");
        assertEquals("#define SQUARE(x) ((x) * (x))", square.signature());
    }

    @Test
    public void functionsAndRecords() {
        var add = entity(main, EntityKind.FUNCTION, "add");
        assertFalse(add.declarationOnly());
        assertEquals(10, add.span().startLine());
        assertEquals(12, add.span().endLine());

        // typedef of an anonymous struct names the struct
        var record = entity(main, EntityKind.STRUCT, "Record");
        assertEquals(14, record.startLine());
        assertTrue(main.entitiesOfKind(EntityKind.TYPE_ALIAS).isEmpty());

        assertFalse(entity(main, EntityKind.STRUCT, "Node").declarationOnly());

        var level = entity(main, EntityKind.ENUM, "Level");
        assertNotNull(entity(main, EntityKind.ENUM_VALUE, "LOW"));
        assertNotNull(entity(main, EntityKind.ENUM_VALUE, "HIGH"));
        assertEquals(23, level.startLine());
    }

    @Test
    public void callsFromMain() {
        var mainFn = entity(main, EntityKind.FUNCTION, "main");
        var add = callTo(main, mainFn, "add");
        assertEquals(Confidence.EXACT, add.confidence());
        assertEquals(entity(main, EntityKind.FUNCTION, "add").id(), add.target());
        assertEquals("27", add.attribute(RelationshipAttributes.LINE));

        for (var name : new String[] {"printf", "print_point", "puts"}) {
            var call = callTo(main, mainFn, name);
            assertEquals(Confidence.PROBABLE, call.confidence(), name);
            var external = main.entities().stream()
                    .filter(e -> e.id().equals(call.target()))
                    .findFirst()
                    .orElseThrow();
            assertEquals(EntityKind.EXTERNAL_REFERENCE, external.kind());
        }
    }

    @Test
    public void noOperatorEdgesInC() {
        assertTrue(main.relationshipsOfKind(RelationshipKind.CALLS).stream()
                .noneMatch(r -> r.targetName().startsWith("operator")));
    }

    @Test
    public void headerDeclarations() {
        assertNotNull(entity(shapes, EntityKind.STRUCT, "Point"));
        assertNotNull(entity(shapes, EntityKind.UNION, "Value"));
        assertTrue(entity(shapes, EntityKind.FUNCTION, "print_point").declarationOnly());
        assertTrue(entity(shapes, EntityKind.FUNCTION, "add").declarationOnly());
        assertEquals("#define SHAPES_H", entity(shapes, EntityKind.MACRO, "SHAPES_H").signature());
    }
}
