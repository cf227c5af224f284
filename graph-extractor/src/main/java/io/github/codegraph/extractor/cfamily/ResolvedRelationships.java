package io.github.codegraph.extractor.cfamily;

import io.github.codegraph.model.CodeEntity;
import io.github.codegraph.model.Relationship;
import java.util.List;

/**
 * Output of {@link RelationshipResolver}.
 *
 * @param relationships edges in discovery order, without duplicates
 * @param externalReferences external reference entities created while resolving, in first-use order
 */
public record ResolvedRelationships(List<Relationship> relationships, List<CodeEntity> externalReferences) {

    public ResolvedRelationships {
        relationships = List.copyOf(relationships);
        externalReferences = List.copyOf(externalReferences);
    }
}
