package io.github.codegraph.extractor.cfamily;

import io.github.codegraph.model.CodeEntity;
import io.github.codegraph.model.EntityKind;
import io.github.codegraph.model.Span;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * The external reference entities of one file, one per referenced name. The span of each is the line that first
 * referenced it, which is how the slicer attaches it.
 */
final class ExternalReferences {
    private final String file;
    private final String language;
    private final Map<String, CodeEntity> byName = new LinkedHashMap<>();

    ExternalReferences(String file, String language) {
        this.file = file;
        this.language = language;
    }

    CodeEntity register(String name, int line, @Nullable String signature) {
        return byName.computeIfAbsent(
                name,
                n -> CodeEntity.of(
                        file, language, EntityKind.EXTERNAL_REFERENCE, n, new Span(line, line), false, signature, null));
    }

    List<CodeEntity> all() {
        return new ArrayList<>(byName.values());
    }
}
