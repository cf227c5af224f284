package io.github.codegraph.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

public class CodeEntityTest {

    @Test
    public void idEncodesFileKindNameAndStartLine() {
        var entity = CodeEntity.of(
                "src/shapes.hpp", "cpp", EntityKind.METHOD, "geo::Circle::area", new Span(10, 12), false, null, null);
        assertEquals("src/shapes.hpp#METHOD:geo::Circle::area@10", entity.id());
        assertEquals("area", entity.displayName());
        assertEquals(10, entity.startLine());
        assertFalse(entity.external());
    }

    @Test
    public void declarationAndDefinitionHaveDistinctIds() {
        var decl = CodeEntity.of("a.hpp", "cpp", EntityKind.FUNCTION, "f", new Span(1, 1), true, "void f()", null);
        var def = CodeEntity.of("a.cpp", "cpp", EntityKind.FUNCTION, "f", new Span(7, 9), false, "void f()", null);
        assertNotEquals(decl.id(), def.id());
        assertNotEquals(decl, def);
    }

    @Test
    public void operatorNamesKeepTheirSymbols() {
        var entity = CodeEntity.of(
                "a.cpp", "cpp", EntityKind.METHOD, "Vec::operator()", new Span(2, 2), false, null, null);
        assertEquals("operator()", entity.displayName());
    }

    @Test
    public void emptyNamesAreRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new CodeEntity("x", EntityKind.CLASS, "", "", "cpp", "a.cpp", new Span(0, 0), false, null, null));
    }

    @Test
    public void relationshipTargetsEntityOnlyWhenIdDiffersFromName() {
        var bare = new Relationship(RelationshipKind.CALLS, "src", "printf", "printf", Confidence.PROBABLE);
        assertFalse(bare.targetsEntity());
        var resolved = new Relationship(
                RelationshipKind.CALLS, "src", "a.cpp#FUNCTION:f@3", "f", Confidence.EXACT, Map.of("line", "4"));
        assertTrue(resolved.targetsEntity());
        assertEquals("4", resolved.attribute(RelationshipAttributes.LINE));
        assertNull(resolved.attribute(RelationshipAttributes.VIA));
    }

    @Test
    public void relationshipRejectsEmptyEndpoints() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new Relationship(RelationshipKind.CALLS, "", "f", "f", Confidence.EXACT));
    }

    @Test
    public void accessKeywords() {
        assertEquals(AccessSpecifier.PROTECTED, AccessSpecifier.fromKeyword(" protected "));
        assertNull(AccessSpecifier.fromKeyword("virtual"));
        assertEquals("private", AccessSpecifier.PRIVATE.keyword());
    }
}
