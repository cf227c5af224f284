package io.github.codegraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A merged, immutable view over many files.
 *
 * @param files per-file record sets in merge order, with their status
 * @param entities every entity of every file, deduplicated by id
 * @param relationships every relationship, deduplicated, including assembler-made {@link RelationshipKind#DEFINES}
 * @param primary id of the primary entity per {@link #primaryKey} (the definition if one is known)
 */
public record CodeGraph(
        @JsonProperty("files") List<FileExtraction> files,
        @JsonProperty("entities") List<CodeEntity> entities,
        @JsonProperty("relationships") List<Relationship> relationships,
        @JsonProperty("primary") Map<String, String> primary) {

    @JsonCreator
    public CodeGraph {
        files = List.copyOf(files);
        entities = List.copyOf(entities);
        relationships = List.copyOf(relationships);
        primary = Collections.unmodifiableMap(new LinkedHashMap<>(primary));
    }

    public static String primaryKey(EntityKind kind, String qualifiedName) {
        return kind.name() + ":" + qualifiedName;
    }

    public @Nullable CodeEntity entity(String id) {
        return entities.stream().filter(e -> e.id().equals(id)).findFirst().orElse(null);
    }

    public @Nullable CodeEntity primaryEntity(EntityKind kind, String qualifiedName) {
        var id = primary.get(primaryKey(kind, qualifiedName));
        return id == null ? null : entity(id);
    }

    public @Nullable FileExtraction file(String path) {
        return files.stream().filter(f -> f.file().equals(path)).findFirst().orElse(null);
    }

    public List<Relationship> relationshipsOfKind(RelationshipKind kind) {
        return relationships.stream().filter(r -> r.kind() == kind).toList();
    }
}
