package io.github.codegraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * A declared or defined program construct found in one file.
 *
 * <p>Identity is {@code (qualifiedName, kind, span)} within a file; the {@link #id()} encodes exactly that, so two
 * records for the same qualified name with different spans (a declaration in a header and the definition in a source
 * file) stay distinct and are linked by a {@link RelationshipKind#DEFINES} relationship when merged.
 *
 * @param id deterministic id, see {@link #idFor}
 * @param kind construct kind
 * @param qualifiedName scope-qualified name using {@code ::} as separator
 * @param displayName the last name component
 * @param language language id of the file
 * @param file path of the file, as given to the extractor
 * @param span lines covered by the construct
 * @param declarationOnly true for prototypes, forward declarations, pure virtual and deleted functions
 * @param signature declaration text for callables and macros, directive text for external modules
 * @param aliasOf aliased type text for {@link EntityKind#TYPE_ALIAS}
 */
public record CodeEntity(
        @JsonProperty("id") String id,
        @JsonProperty("kind") EntityKind kind,
        @JsonProperty("qualifiedName") String qualifiedName,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("language") String language,
        @JsonProperty("file") String file,
        @JsonProperty("span") Span span,
        @JsonProperty("declarationOnly") boolean declarationOnly,
        @JsonProperty("signature") @Nullable String signature,
        @JsonProperty("aliasOf") @Nullable String aliasOf) {

    @JsonCreator
    public CodeEntity {
        if (qualifiedName.isEmpty()) {
            throw new IllegalArgumentException("qualifiedName must not be empty");
        }
        if (displayName.isEmpty()) {
            throw new IllegalArgumentException("displayName must not be empty");
        }
    }

    public static CodeEntity of(
            String file,
            String language,
            EntityKind kind,
            String qualifiedName,
            Span span,
            boolean declarationOnly,
            @Nullable String signature,
            @Nullable String aliasOf) {
        int sep = qualifiedName.lastIndexOf("::");
        var display = sep >= 0 ? qualifiedName.substring(sep + 2) : qualifiedName;
        return new CodeEntity(
                idFor(file, kind, qualifiedName, span.startLine()),
                kind,
                qualifiedName,
                display.isEmpty() ? qualifiedName : display,
                language,
                file,
                span,
                declarationOnly,
                signature,
                aliasOf);
    }

    /** {@code <file>#<KIND>:<qualifiedName>@<startLine>} */
    public static String idFor(String file, EntityKind kind, String qualifiedName, int startLine) {
        return file + "#" + kind.name() + ":" + qualifiedName + "@" + startLine;
    }

    public int startLine() {
        return span.startLine();
    }

    public boolean external() {
        return kind == EntityKind.EXTERNAL_REFERENCE;
    }

    @Override
    public String toString() {
        return kind + " " + qualifiedName + " [" + file + ":" + span.startLine() + "-" + span.endLine() + "]"
                + (declarationOnly ? " (decl)" : "");
    }
}
