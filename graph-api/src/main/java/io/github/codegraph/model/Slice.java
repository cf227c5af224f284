package io.github.codegraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * A contiguous chunk of one file with the entities that start inside it.
 *
 * @param file file path
 * @param index position of the slice within its file
 * @param startLine first line, inclusive, 0-based
 * @param endLine last line, inclusive
 * @param entityIds ids of entities whose start line falls in this slice
 * @param externalReferenceIds ids of external references first used in this slice
 * @param text source of lines {@code startLine..endLine}, including their line terminators
 */
public record Slice(
        @JsonProperty("file") String file,
        @JsonProperty("index") int index,
        @JsonProperty("startLine") int startLine,
        @JsonProperty("endLine") int endLine,
        @JsonProperty("entityIds") List<String> entityIds,
        @JsonProperty("externalReferenceIds") List<String> externalReferenceIds,
        @JsonProperty("text") String text) {

    @JsonCreator
    public Slice {
        if (!Span.wellFormed(startLine, endLine)) {
            throw new IllegalArgumentException("Invalid slice range " + startLine + ".." + endLine);
        }
        entityIds = List.copyOf(entityIds);
        externalReferenceIds = List.copyOf(externalReferenceIds);
        text = Objects.requireNonNull(text, "text");
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }
}
