package io.github.codegraph.extractor.cfamily;

import io.github.codegraph.model.CodeEntity;
import io.github.codegraph.model.ExtractionIssue;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Entities of one file plus the structural facts the relationship pass needs.
 *
 * @param entities entities in source order
 * @param parentOf lexical parent entity id per child entity id
 * @param basesOf ordered base list per record entity id
 * @param entityByNode entity per declaring syntax node id; for {@code namespace A::B} the innermost namespace
 * @param lookupKeys scope lookup key per entity id (anonymous scopes tagged)
 * @param issues problems met while extracting
 */
public record ExtractedEntities(
        List<CodeEntity> entities,
        Map<String, String> parentOf,
        Map<String, List<BaseSpecifier>> basesOf,
        Map<Integer, CodeEntity> entityByNode,
        Map<String, String> lookupKeys,
        Set<ExtractionIssue> issues) {

    public ExtractedEntities {
        entities = List.copyOf(entities);
        parentOf = Map.copyOf(parentOf);
        basesOf = Map.copyOf(basesOf);
        entityByNode = Map.copyOf(entityByNode);
        lookupKeys = Map.copyOf(lookupKeys);
        issues = Set.copyOf(issues);
    }

    public static ExtractedEntities empty() {
        return new ExtractedEntities(List.of(), Map.of(), Map.of(), Map.of(), Map.of(), Set.of());
    }

    public @Nullable CodeEntity atNode(int nodeId) {
        return entityByNode.get(nodeId);
    }

    public List<BaseSpecifier> bases(String entityId) {
        return basesOf.getOrDefault(entityId, List.of());
    }
}
