package io.github.codegraph.extractor;

import io.github.codegraph.extractor.cfamily.EntityExtractor;
import io.github.codegraph.extractor.cfamily.LanguageProfile;
import io.github.codegraph.extractor.cfamily.RelationshipResolver;
import io.github.codegraph.extractor.slice.Slicer;
import io.github.codegraph.extractor.util.TextCanonicalizer;
import io.github.codegraph.model.CodeEntity;
import io.github.codegraph.model.ExtractionIssue;
import io.github.codegraph.model.FileExtraction;
import io.github.codegraph.model.FileStatus;
import io.github.codegraph.model.SourceFile;
import io.github.codegraph.tree.SyntaxTree;
import io.github.codegraph.tree.SyntaxTreeProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Extraction of a single file: parse, extract entities, resolve relationships, slice. Holds no per-file state, so one
 * instance serves every worker thread.
 */
public final class FileExtractor {
    private static final Logger logger = LogManager.getLogger(FileExtractor.class);

    private final SyntaxTreeProvider provider;
    private final Slicer slicer = new Slicer();

    public FileExtractor(SyntaxTreeProvider provider) {
        this.provider = provider;
    }

    /** Parses and extracts; never throws, unexpected failures come back as {@link FileStatus#FAILED}. */
    public FileExtraction extract(SourceFile file) {
        try {
            return extract(file, provider.parse(file.language(), file.content()));
        } catch (RuntimeException e) {
            logger.error("Extraction failed for {}", file.path(), e);
            return FileExtraction.failed(
                    file.path(), file.language(), e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (StackOverflowError e) {
            logger.error("Extraction of {} overflowed the stack; lower {}", file.path(),
                    ExtractionConfig.MAX_TREE_DEPTH_PROPERTY);
            return FileExtraction.failed(file.path(), file.language(), "StackOverflowError: nesting too deep");
        }
    }

    /** Extracts from an already parsed tree. */
    public FileExtraction extract(SourceFile file, SyntaxTree tree) {
        var path = file.path();
        if (tree.root() == null) {
            logger.warn("{}: no parse tree, emitting an empty result", path);
            return new FileExtraction(
                    path,
                    file.language(),
                    FileStatus.EMPTY,
                    Set.of(ExtractionIssue.PARSE_TREE_MISSING),
                    List.of(),
                    List.of(),
                    List.of(slicer.whole(tree, path)),
                    null);
        }

        var profile = LanguageProfile.forLanguage(file.language());
        var issues = EnumSet.noneOf(ExtractionIssue.class);
        if (tree.hasErrors()) {
            issues.add(ExtractionIssue.PARSE_ERRORS);
        }
        if (tree.truncated()) {
            issues.add(ExtractionIssue.NODE_BUDGET_EXCEEDED);
        }
        if (tree.depthLimited()) {
            issues.add(ExtractionIssue.NESTING_TOO_DEEP);
        }

        var extracted = new EntityExtractor(profile).extract(tree, path);
        issues.addAll(extracted.issues());
        var resolved = new RelationshipResolver(profile).resolve(tree, path, extracted);

        var entities = new ArrayList<CodeEntity>(extracted.entities());
        entities.addAll(resolved.externalReferences());
        var slices = slicer.slice(
                tree, path, profile.commentKinds(), extracted.entities(), resolved.externalReferences());

        var status = issues.isEmpty() ? FileStatus.COMPLETE : FileStatus.PARTIAL;
        if (status == FileStatus.PARTIAL) {
            logger.warn("{}: partial extraction {}", path, issues);
        }
        logger.debug(
                "{}: {} entities, {} relationships, {} slices",
                path,
                entities.size(),
                resolved.relationships().size(),
                slices.size());
        return new FileExtraction(
                path, file.language(), status, issues, entities, resolved.relationships(), slices, null);
    }

    /**
     * Reads a file for extraction, detecting its language from the extension.
     *
     * @throws ExtractionException if the file cannot be read, is too large, or has no supported language
     */
    public static SourceFile read(Path path, ExtractionConfig config) throws ExtractionException {
        return read(path, path.toString(), config);
    }

    /**
     * Like {@link #read(Path, ExtractionConfig)} but records the file under {@code displayPath}.
     *
     * @throws ExtractionException if the file cannot be read, is too large, or has no supported language
     */
    public static SourceFile read(Path path, String displayPath, ExtractionConfig config) throws ExtractionException {
        var language = Languages.fromPath(path);
        if (language == null) {
            throw new ExtractionException("No supported language for " + path);
        }
        try {
            long size = Files.size(path);
            if (size > config.maxFileBytes()) {
                throw new ExtractionException(
                        "%s is %d bytes, over the %d byte limit".formatted(path, size, config.maxFileBytes()));
            }
            var bytes = TextCanonicalizer.stripUtf8Bom(Files.readAllBytes(path));
            return new SourceFile(displayPath, language, new String(bytes, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ExtractionException("Failed to read " + path + ": " + Objects.toString(e.getMessage()), e);
        }
    }
}
