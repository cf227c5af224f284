package io.github.codegraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The record set produced for one file.
 *
 * @param file file path
 * @param language language id
 * @param status overall outcome
 * @param issues non-fatal problems met along the way
 * @param entities entities in source order; external references follow the declarations
 * @param relationships relationships in discovery order
 * @param slices slices covering the whole file
 * @param message failure detail for {@link FileStatus#FAILED}, otherwise null
 */
public record FileExtraction(
        @JsonProperty("file") String file,
        @JsonProperty("language") String language,
        @JsonProperty("status") FileStatus status,
        @JsonProperty("issues") Set<ExtractionIssue> issues,
        @JsonProperty("entities") List<CodeEntity> entities,
        @JsonProperty("relationships") List<Relationship> relationships,
        @JsonProperty("slices") List<Slice> slices,
        @JsonProperty("message") @Nullable String message) {

    @JsonCreator
    public FileExtraction {
        issues = Set.copyOf(issues);
        entities = List.copyOf(entities);
        relationships = List.copyOf(relationships);
        slices = List.copyOf(slices);
    }

    public static FileExtraction failed(String file, String language, String message) {
        return new FileExtraction(file, language, FileStatus.FAILED, Set.of(), List.of(), List.of(), List.of(), message);
    }

    public static FileExtraction skipped(String file, String language) {
        return new FileExtraction(file, language, FileStatus.SKIPPED, Set.of(), List.of(), List.of(), List.of(), null);
    }

    public List<CodeEntity> entitiesOfKind(EntityKind kind) {
        return entities.stream().filter(e -> e.kind() == kind).toList();
    }

    public List<Relationship> relationshipsOfKind(RelationshipKind kind) {
        return relationships.stream().filter(r -> r.kind() == kind).toList();
    }
}
