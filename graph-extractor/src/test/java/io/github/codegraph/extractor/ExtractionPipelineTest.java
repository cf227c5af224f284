package io.github.codegraph.extractor;

import static io.github.codegraph.extractor.TestSources.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.codegraph.model.EntityKind;
import io.github.codegraph.model.FileStatus;
import io.github.codegraph.model.RelationshipKind;
import io.github.codegraph.model.SourceFile;
import io.github.codegraph.tree.SyntaxTree;
import io.github.codegraph.tree.SyntaxTreeProvider;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ExtractionPipelineTest {

    private static final List<String> CPP_FIXTURES = List.of(
            "calls.cpp", "features.cpp", "forward.hpp", "inheritance.hpp", "processor.cpp", "processor.hpp");

    @TempDir
    Path tempDir;

    private ExtractionPipeline pipeline;

    @BeforeEach
    public void setup() {
        pipeline = new ExtractionPipeline(ExtractionConfig.defaults().withParallelism(4));
    }

    @AfterEach
    public void tearDown() {
        pipeline.close();
    }

    private static List<SourceFile> fixtures() {
        var sources = new ArrayList<SourceFile>();
        CPP_FIXTURES.forEach(f -> sources.add(cpp(f)));
        return sources;
    }

    @Test
    public void parallelExtractionMatchesSequentialResults() {
        var graph = pipeline.extract(fixtures());

        assertEquals(CPP_FIXTURES.size(), graph.files().size());
        for (var name : CPP_FIXTURES) {
            var file = graph.file(name);
            assertNotNull(file, name);
            assertEquals(FileStatus.COMPLETE, file.status(), name);
            assertEquals(extract(cpp(name)), file, name);
        }
        var process = graph.primaryEntity(EntityKind.METHOD, "Processing::DataProcessor::process");
        assertNotNull(process);
        assertEquals("processor.cpp", process.file());
        assertFalse(graph.relationshipsOfKind(RelationshipKind.DEFINES).isEmpty());
    }

    @Test
    public void resultDoesNotDependOnWorkerCount() {
        var parallel = pipeline.extract(fixtures());
        try (var single = new ExtractionPipeline(ExtractionConfig.defaults().withParallelism(1))) {
            var sequential = single.extract(fixtures());
            assertEquals(new HashSet<>(sequential.files()), new HashSet<>(parallel.files()));
            assertEquals(new HashSet<>(sequential.entities()), new HashSet<>(parallel.entities()));
            assertEquals(new HashSet<>(sequential.relationships()), new HashSet<>(parallel.relationships()));
        }
    }

    @Test
    public void cancelledPipelineSkipsFiles() {
        pipeline.cancel();
        assertTrue(pipeline.isCancelled());
        var graph = pipeline.extract(fixtures());
        assertEquals(CPP_FIXTURES.size(), graph.files().size());
        assertTrue(graph.files().stream().allMatch(f -> f.status() == FileStatus.SKIPPED));
        assertTrue(graph.entities().isEmpty());
    }

    @Test
    public void failureInOneFileDoesNotStopTheBatch() {
        var broken = new FileExtractor(new CrashingProvider("int a;\n"));
        try (var failing = new ExtractionPipeline(ExtractionConfig.defaults().withParallelism(2), broken)) {
            var graph = failing.extract(List.of(
                    new SourceFile("bad.cpp", Languages.CPP, "int a;\n"),
                    new SourceFile("good.cpp", Languages.CPP, "int b() { return 1; }\n")));
            assertEquals(FileStatus.FAILED, graph.file("bad.cpp").status());
            assertEquals(FileStatus.COMPLETE, graph.file("good.cpp").status());
            assertNotNull(graph.primaryEntity(EntityKind.FUNCTION, "b"));
        }
    }

    @Test
    public void extractDirectoryReadsSupportedFiles() throws IOException, ExtractionException {
        var sub = Files.createDirectories(tempDir.resolve("lib"));
        Files.writeString(tempDir.resolve("api.hpp"), "int twice(int v);\n");
        Files.writeString(sub.resolve("impl.cpp"), "int twice(int v) { return v * 2; }\n");
        Files.writeString(sub.resolve("legacy.c"), "int legacy(void) { return 0; }\n");
        Files.writeString(tempDir.resolve("README.txt"), "not code");

        var graph = pipeline.extractDirectory(tempDir);

        assertEquals(3, graph.files().size());
        assertNull(graph.file("README.txt"));
        assertEquals(Languages.C, graph.file("lib/legacy.c").language());
        var twice = graph.primaryEntity(EntityKind.FUNCTION, "twice");
        assertNotNull(twice);
        assertEquals("lib/impl.cpp", twice.file());
        assertEquals(1, graph.relationshipsOfKind(RelationshipKind.DEFINES).size());
    }

    @Test
    public void extractDirectoryPrunesIgnoredDirectoriesAndFiles() throws IOException, ExtractionException {
        Files.writeString(tempDir.resolve("main.cpp"), "int main() { return 0; }\n");
        for (var ignored : List.of(".git", "build", "node_modules", "target")) {
            var dir = Files.createDirectories(tempDir.resolve(ignored).resolve("nested"));
            Files.writeString(dir.resolve("generated.cpp"), "int generated() { return 1; }\n");
        }
        var kept = Files.createDirectories(tempDir.resolve("src").resolve("builder"));
        Files.writeString(kept.resolve("builder.cpp"), "int build() { return 2; }\n");
        Files.writeString(kept.resolve("scratch.cpp"), "int scratch() { return 3; }\n");

        var config = ExtractionConfig.defaults()
                .withParallelism(2)
                .withIgnored(ExtractionConfig.DEFAULT_IGNORED_DIRECTORIES, Set.of("scratch.*"));
        try (var configured = new ExtractionPipeline(config)) {
            var graph = configured.extractDirectory(tempDir);

            assertEquals(
                    List.of("main.cpp", "src/builder/builder.cpp"),
                    graph.files().stream().map(f -> f.file()).sorted().toList());
            assertNull(graph.primaryEntity(EntityKind.FUNCTION, "generated"));
            assertNull(graph.primaryEntity(EntityKind.FUNCTION, "scratch"));
            assertNotNull(graph.primaryEntity(EntityKind.FUNCTION, "build"));
        }
    }

    @Test
    public void oversizedFileIsFailed() throws Exception {
        Files.writeString(tempDir.resolve("small.c"), "int a;\n");
        Files.writeString(tempDir.resolve("large.c"), "int a_much_longer_declaration_name;\n");
        var config = new ExtractionConfig(2, ExtractionConfig.DEFAULT_MAX_NODES, 10_000, 10);
        try (var limited = new ExtractionPipeline(config)) {
            var graph = limited.extractPathsAsync(List.of(
                            tempDir.resolve("small.c"), tempDir.resolve("large.c"), tempDir.resolve("skip.md")))
                    .get(30, TimeUnit.SECONDS);
            assertEquals(2, graph.files().size());
            assertEquals(FileStatus.COMPLETE, graph.file(tempDir.resolve("small.c").toString()).status());
            var large = graph.file(tempDir.resolve("large.c").toString());
            assertEquals(FileStatus.FAILED, large.status());
            assertTrue(large.message().contains("byte limit"));
        }
    }

    @Test
    public void missingDirectoryThrows() {
        assertThrows(ExtractionException.class, () -> pipeline.extractDirectory(tempDir.resolve("nope")));
    }

    /** Delegates to tree-sitter, except that parsing one exact text throws. */
    private static final class CrashingProvider implements SyntaxTreeProvider {
        private final String crashOn;

        CrashingProvider(String crashOn) {
            this.crashOn = crashOn;
        }

        @Override
        public boolean supports(String language) {
            return provider().supports(language);
        }

        @Override
        public SyntaxTree parse(String language, String source) {
            if (source.equals(crashOn)) {
                throw new IllegalStateException("simulated parser crash");
            }
            return provider().parse(language, source);
        }
    }
}
