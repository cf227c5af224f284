package io.github.codegraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import java.util.TreeMap;
import org.jetbrains.annotations.Nullable;

/**
 * A directed, confidence-tagged edge.
 *
 * @param kind edge kind
 * @param sourceId id of the source entity, or the file path for file-level directives
 * @param target id of the target entity when one is known, otherwise the symbolic target text
 * @param targetName qualified name (or expression text) of the target, always present
 * @param confidence how certain the target is
 * @param attributes additional facts, keyed by the constants in {@link RelationshipAttributes}
 */
public record Relationship(
        @JsonProperty("kind") RelationshipKind kind,
        @JsonProperty("sourceId") String sourceId,
        @JsonProperty("target") String target,
        @JsonProperty("targetName") String targetName,
        @JsonProperty("confidence") Confidence confidence,
        @JsonProperty("attributes") Map<String, String> attributes) {

    @JsonCreator
    public Relationship {
        if (sourceId.isEmpty() || target.isEmpty()) {
            throw new IllegalArgumentException("Relationship endpoints must not be empty");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public Relationship(
            RelationshipKind kind, String sourceId, String target, String targetName, Confidence confidence) {
        this(kind, sourceId, target, targetName, confidence, Map.of());
    }

    public @Nullable String attribute(String key) {
        return attributes.get(key);
    }

    /** True when {@link #target()} is an entity id rather than a bare name. */
    public boolean targetsEntity() {
        return !target.equals(targetName);
    }

    @Override
    public String toString() {
        var attrs = attributes.isEmpty() ? "" : " " + new TreeMap<>(attributes);
        return kind + " " + sourceId + " -> " + targetName + " (" + confidence + ")" + attrs;
    }
}
