package io.github.codegraph.extractor.cfamily;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import io.github.codegraph.extractor.scope.ScopeResolver;
import io.github.codegraph.extractor.util.TextCanonicalizer;
import io.github.codegraph.model.CodeEntity;
import io.github.codegraph.model.EntityKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/** Name lookups over the entities of one file. */
final class SymbolIndex {

    static final Predicate<CodeEntity> CALLABLE = e -> e.kind().callable();
    static final Predicate<CodeEntity> RECORD = e -> e.kind().recordType();
    static final Predicate<CodeEntity> TYPE = e -> e.kind().recordType()
            || e.kind() == EntityKind.ENUM
            || e.kind() == EntityKind.TYPE_ALIAS;
    static final Predicate<CodeEntity> ANY = e -> true;

    private final ListMultimap<String, CodeEntity> byQualifiedName =
            MultimapBuilder.hashKeys().arrayListValues().build();
    private final ListMultimap<String, CodeEntity> byLookupKey =
            MultimapBuilder.hashKeys().arrayListValues().build();
    private final ListMultimap<String, CodeEntity> bySimpleName =
            MultimapBuilder.hashKeys().arrayListValues().build();
    private final Map<String, List<BaseSpecifier>> basesByRecord = new HashMap<>();
    private final Set<String> namespaces = new HashSet<>();

    SymbolIndex(ExtractedEntities extracted) {
        for (var entity : extracted.entities()) {
            byQualifiedName.put(entity.qualifiedName(), entity);
            bySimpleName.put(entity.displayName(), entity);
            var key = extracted.lookupKeys().get(entity.id());
            if (key != null && !key.equals(entity.qualifiedName())) {
                byLookupKey.put(key, entity);
            }
            if (entity.kind() == EntityKind.NAMESPACE) {
                namespaces.add(entity.qualifiedName());
            }
            var bases = extracted.bases(entity.id());
            if (!bases.isEmpty()) {
                basesByRecord.putIfAbsent(entity.qualifiedName(), bases);
            }
        }
    }

    /** First candidate name that names a matching entity; definitions win over declarations. */
    @Nullable
    CodeEntity lookup(List<String> candidates, Predicate<CodeEntity> filter) {
        for (var candidate : candidates) {
            var hit = pick(byLookupKey.get(candidate), filter);
            if (hit == null) {
                hit = pick(byQualifiedName.get(candidate), filter);
            }
            if (hit != null) {
                return hit;
            }
        }
        return null;
    }

    @Nullable
    CodeEntity exact(String qualifiedName, Predicate<CodeEntity> filter) {
        return pick(byQualifiedName.get(qualifiedName), filter);
    }

    boolean namespace(String qualifiedName) {
        return namespaces.contains(qualifiedName);
    }

    /** A callable member of a record, searched through the record's in-file bases depth first. */
    @Nullable
    CodeEntity member(String recordName, String memberName) {
        return member(recordName, memberName, new HashSet<>());
    }

    private @Nullable CodeEntity member(String recordName, String memberName, Set<String> visited) {
        if (!visited.add(recordName)) {
            return null;
        }
        var direct = exact(recordName + ScopeResolver.SEPARATOR + memberName, CALLABLE);
        if (direct != null) {
            return direct;
        }
        for (var base : basesByRecord.getOrDefault(recordName, List.of())) {
            var baseRecord = resolveBase(recordName, base);
            if (baseRecord != null) {
                var inherited = member(baseRecord.qualifiedName(), memberName, visited);
                if (inherited != null) {
                    return inherited;
                }
            }
        }
        return null;
    }

    /** Resolves a base name relative to the scopes enclosing the derived record. */
    @Nullable
    CodeEntity resolveBase(String recordName, BaseSpecifier base) {
        var name = TextCanonicalizer.canonicalName(base.name());
        var candidates = new ArrayList<String>();
        var scope = ScopeResolver.qualifier(recordName);
        while (true) {
            candidates.add(scope.isEmpty() ? name : scope + ScopeResolver.SEPARATOR + name);
            if (scope.isEmpty()) {
                break;
            }
            scope = ScopeResolver.qualifier(scope);
        }
        return lookup(candidates, RECORD);
    }

    List<BaseSpecifier> bases(String recordName) {
        return basesByRecord.getOrDefault(recordName, List.of());
    }

    @Nullable
    CodeEntity constructor(String recordName) {
        var ctorName = recordName + ScopeResolver.SEPARATOR + ScopeResolver.lastSegment(recordName);
        return exact(ctorName, e -> e.kind() == EntityKind.CONSTRUCTOR);
    }

    /** Entities with the given display name, one per distinct qualified name. */
    List<CodeEntity> bySimpleName(String simpleName, Predicate<CodeEntity> filter) {
        var distinct = new LinkedHashMap<String, CodeEntity>();
        for (var entity : bySimpleName.get(simpleName)) {
            if (filter.test(entity)) {
                var existing = distinct.get(entity.qualifiedName());
                if (existing == null || existing.declarationOnly() && !entity.declarationOnly()) {
                    distinct.put(entity.qualifiedName(), entity);
                }
            }
        }
        return new ArrayList<>(distinct.values());
    }

    private static @Nullable CodeEntity pick(List<CodeEntity> entities, Predicate<CodeEntity> filter) {
        CodeEntity declaration = null;
        for (var entity : entities) {
            if (!filter.test(entity)) {
                continue;
            }
            if (!entity.declarationOnly()) {
                return entity;
            }
            if (declaration == null) {
                declaration = entity;
            }
        }
        return declaration;
    }
}
