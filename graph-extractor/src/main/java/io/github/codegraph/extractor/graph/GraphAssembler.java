package io.github.codegraph.extractor.graph;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import io.github.codegraph.model.CodeEntity;
import io.github.codegraph.model.CodeGraph;
import io.github.codegraph.model.Confidence;
import io.github.codegraph.model.EntityKind;
import io.github.codegraph.model.FileExtraction;
import io.github.codegraph.model.FileStatus;
import io.github.codegraph.model.Relationship;
import io.github.codegraph.model.RelationshipKind;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Merges per-file results into one graph.
 *
 * <p>Entities are kept per file and deduplicated by id. Entities sharing kind and qualified name across files are
 * linked, not merged: a definition gets a {@link RelationshipKind#DEFINES} edge to each matching declaration, and the
 * primary entity for the name moves to the latest definition merged. Confidence of existing relationships is never
 * changed by a merge.
 *
 * <p>All mutation happens under one lock; {@link io.github.codegraph.extractor.ExtractionPipeline} additionally calls
 * it from a single ingest thread.
 */
public final class GraphAssembler {
    private static final Logger logger = LogManager.getLogger(GraphAssembler.class);

    /** Kinds whose declarations and definitions are linked. */
    private static final Set<EntityKind> LINKED_KINDS = EnumSet.of(
            EntityKind.FUNCTION,
            EntityKind.METHOD,
            EntityKind.CONSTRUCTOR,
            EntityKind.DESTRUCTOR,
            EntityKind.CLASS,
            EntityKind.STRUCT,
            EntityKind.UNION,
            EntityKind.ENUM);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, FileExtraction> files = new LinkedHashMap<>();
    private final Map<String, CodeEntity> entities = new LinkedHashMap<>();
    private final ListMultimap<String, CodeEntity> byName = MultimapBuilder.hashKeys().arrayListValues().build();
    private final Set<Relationship> relationships = new LinkedHashSet<>();
    private final Set<Relationship> definitions = new LinkedHashSet<>();
    private final Map<String, String> primary = new LinkedHashMap<>();

    /**
     * Adds one file's results. Merging the same result twice changes nothing; a different result for a file already
     * merged replaces it.
     */
    public void merge(FileExtraction extraction) {
        lock.lock();
        try {
            var previous = files.put(extraction.file(), extraction);
            if (extraction.equals(previous)) {
                logger.debug("{} already merged, skipping", extraction.file());
                return;
            }
            if (previous != null) {
                logger.debug("{} re-extracted, rebuilding merged graph", extraction.file());
                rebuild();
            } else {
                ingest(extraction);
            }
            if (extraction.status() != FileStatus.COMPLETE) {
                logger.debug("{} merged with status {} {}", extraction.file(), extraction.status(), extraction.issues());
            }
        } finally {
            lock.unlock();
        }
    }

    /** Re-ingests the per-file record sets of an earlier graph. */
    public void mergeAll(CodeGraph graph) {
        graph.files().forEach(this::merge);
    }

    public @Nullable FileStatus status(String file) {
        lock.lock();
        try {
            var extraction = files.get(file);
            return extraction == null ? null : extraction.status();
        } finally {
            lock.unlock();
        }
    }

    public CodeGraph snapshot() {
        lock.lock();
        try {
            var allRelationships = new ArrayList<Relationship>(relationships.size() + definitions.size());
            allRelationships.addAll(relationships);
            allRelationships.addAll(definitions);
            return new CodeGraph(
                    new ArrayList<>(files.values()), new ArrayList<>(entities.values()), allRelationships, primary);
        } finally {
            lock.unlock();
        }
    }

    private void rebuild() {
        entities.clear();
        byName.clear();
        relationships.clear();
        definitions.clear();
        primary.clear();
        files.values().forEach(this::ingest);
    }

    private void ingest(FileExtraction extraction) {
        for (var entity : extraction.entities()) {
            if (entities.putIfAbsent(entity.id(), entity) != null) {
                continue;
            }
            var key = CodeGraph.primaryKey(entity.kind(), entity.qualifiedName());
            if (LINKED_KINDS.contains(entity.kind())) {
                for (var other : byName.get(key)) {
                    link(entity, other);
                }
            }
            byName.put(key, entity);
            var current = primary.get(key);
            if (current == null || !entity.declarationOnly()) {
                primary.put(key, entity.id());
            }
        }
        relationships.addAll(extraction.relationships());
    }

    private void link(CodeEntity a, CodeEntity b) {
        if (a.declarationOnly() == b.declarationOnly()) {
            return;
        }
        var definition = a.declarationOnly() ? b : a;
        var declaration = a.declarationOnly() ? a : b;
        if (definition.kind().callable() && !sameArity(definition, declaration)) {
            return;
        }
        definitions.add(new Relationship(
                RelationshipKind.DEFINES,
                definition.id(),
                declaration.id(),
                declaration.qualifiedName(),
                Confidence.EXACT));
    }

    private static boolean sameArity(CodeEntity a, CodeEntity b) {
        int left = arity(a.signature());
        int right = arity(b.signature());
        return left < 0 || right < 0 || left == right;
    }

    /** Number of parameters in a signature's first parameter list, or -1 if it has none. */
    static int arity(@Nullable String signature) {
        if (signature == null) {
            return -1;
        }
        int open = signature.indexOf('(');
        if (open < 0) {
            return -1;
        }
        int depth = 0;
        int commas = 0;
        var inside = new StringBuilder();
        for (int i = open; i < signature.length(); i++) {
            char c = signature.charAt(i);
            if (c == '(' || c == '<' || c == '[' || c == '{') {
                depth++;
                if (depth == 1) {
                    continue;
                }
            } else if (c == ')' || c == '>' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (c == ',' && depth == 1) {
                commas++;
            }
            if (depth >= 1) {
                inside.append(c);
            }
        }
        var params = inside.toString().strip();
        if (params.isEmpty() || params.equals("void")) {
            return 0;
        }
        return commas + 1;
    }
}
