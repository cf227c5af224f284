package io.github.codegraph.extractor;

import io.github.codegraph.extractor.graph.GraphAssembler;
import io.github.codegraph.extractor.treesitter.TreeSitterTreeProvider;
import io.github.codegraph.extractor.util.ExecutorServiceUtil;
import io.github.codegraph.model.CodeGraph;
import io.github.codegraph.model.FileExtraction;
import io.github.codegraph.model.FileStatus;
import io.github.codegraph.model.SourceFile;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Extracts many files in parallel and merges them into one {@link CodeGraph}.
 *
 * <p>Files are extracted on a fixed pool of worker threads; every result is handed to a single ingest thread that
 * owns the {@link GraphAssembler}, so merging is never concurrent. A failure in one file is logged and recorded as
 * that file's status. {@link #cancel()} stops files that have not started yet; they are recorded as
 * {@link FileStatus#SKIPPED}.
 */
public final class ExtractionPipeline implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ExtractionPipeline.class);

    private final ExtractionConfig config;
    private final FileExtractor extractor;
    private final ExecutorService parseExecutor;
    private final ExecutorService ingestExecutor;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public ExtractionPipeline(ExtractionConfig config) {
        this(config, new FileExtractor(new TreeSitterTreeProvider(config)));
    }

    public ExtractionPipeline(ExtractionConfig config, FileExtractor extractor) {
        this.config = config;
        this.extractor = extractor;
        this.parseExecutor = ExecutorServiceUtil.newFixedThreadExecutor(config.parallelism(), "codegraph-parse-");
        this.ingestExecutor = ExecutorServiceUtil.newFixedThreadExecutor(1, "codegraph-ingest-");
    }

    /** Extracts the given sources and returns the merged graph once every file is merged. */
    public CompletableFuture<CodeGraph> extractAsync(List<SourceFile> files) {
        var tasks = new ArrayList<Task>(files.size());
        for (var file : files) {
            tasks.add(new Task(file.path(), file.language(), () -> extractor.extract(file)));
        }
        return run(tasks);
    }

    /** Reads and extracts the given paths. Paths without a supported language are ignored. */
    public CompletableFuture<CodeGraph> extractPathsAsync(Collection<Path> paths) {
        var tasks = new ArrayList<Task>(paths.size());
        for (var path : paths) {
            var task = pathTask(path, path.toString());
            if (task != null) {
                tasks.add(task);
            }
        }
        return run(tasks);
    }

    public CodeGraph extract(List<SourceFile> files) {
        return extractAsync(files).join();
    }

    /**
     * Extracts every supported file under a directory, skipping the configured ignored directories and files. Files
     * are recorded by their path relative to {@code root}, with {@code /} separators.
     *
     * @throws ExtractionException if the directory cannot be walked
     */
    public CodeGraph extractDirectory(Path root) throws ExtractionException {
        var tasks = new ArrayList<Task>();
        for (var path : discover(root)) {
            var task = pathTask(path, displayPath(root, path));
            if (task != null) {
                tasks.add(task);
            }
        }
        return run(tasks).join();
    }

    /** Supported source files under {@code root}, sorted, with ignored directories pruned. */
    List<Path> discover(Path root) throws ExtractionException {
        var ignoredFiles = config.ignoredFileMatchers();
        var found = new ArrayList<Path>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && config.ignoresDirectory(dir)) {
                        logger.debug("Skipping ignored directory {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (!Files.isReadable(dir)) {
                        logger.warn("Skipping inaccessible directory: {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    var name = file.getFileName();
                    if (name != null && ignoredFiles.stream().anyMatch(m -> m.matches(name))) {
                        logger.trace("Skipping ignored file {}", file);
                    } else if (Languages.fromPath(file) != null) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    if (file.equals(root)) {
                        throw exc;
                    }
                    logger.warn("Cannot visit {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ExtractionException("Failed to list " + root, e);
        }
        found.sort(null);
        return found;
    }

    /** Files that have not started extracting yet will be skipped. Files in flight finish normally. */
    public void cancel() {
        if (!cancelled.getAndSet(true)) {
            logger.info("Extraction cancelled");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public void close() {
        ExecutorServiceUtil.shutdownAndAwait(parseExecutor, 30, TimeUnit.SECONDS);
        ExecutorServiceUtil.shutdownAndAwait(ingestExecutor, 30, TimeUnit.SECONDS);
    }

    private record Task(String path, String language, Supplier<FileExtraction> work) {}

    private @Nullable Task pathTask(Path path, String displayPath) {
        var language = Languages.fromPath(path);
        if (language == null) {
            logger.trace("Ignoring {}: unsupported extension", path);
            return null;
        }
        return new Task(displayPath, language, () -> {
            try {
                return extractor.extract(FileExtractor.read(path, displayPath, config));
            } catch (ExtractionException e) {
                logger.warn("Cannot extract {}: {}", path, e.getMessage());
                return FileExtraction.failed(displayPath, language, e.getMessage());
            }
        });
    }

    private static String displayPath(Path root, Path file) {
        var relative = root.relativize(file).toString();
        return File.separatorChar == '/' ? relative : relative.replace(File.separatorChar, '/');
    }

    private CompletableFuture<CodeGraph> run(List<Task> tasks) {
        var assembler = new GraphAssembler();
        var completed = new AtomicInteger();
        var failed = new AtomicInteger();
        var skipped = new AtomicInteger();
        long startNanos = System.nanoTime();
        logger.info("Extracting {} files with {} workers", tasks.size(), config.parallelism());

        var futures = new ArrayList<CompletableFuture<Void>>(tasks.size());
        for (var task : tasks) {
            CompletableFuture<Void> future = CompletableFuture.supplyAsync(
                            () -> {
                                if (cancelled.get()) {
                                    return FileExtraction.skipped(task.path(), task.language());
                                }
                                return task.work().get();
                            },
                            parseExecutor)
                    .exceptionally(ex -> {
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                                ? ex.getCause()
                                : ex;
                        logger.error("Runtime error extracting {}: {}", task.path(), cause.getMessage(), cause);
                        return FileExtraction.failed(task.path(), task.language(), String.valueOf(cause.getMessage()));
                    })
                    .thenAcceptAsync(
                            extraction -> {
                                assembler.merge(extraction);
                                switch (extraction.status()) {
                                    case FAILED -> failed.incrementAndGet();
                                    case SKIPPED -> skipped.incrementAndGet();
                                    default -> completed.incrementAndGet();
                                }
                            },
                            ingestExecutor)
                    .whenComplete((ignored, ex) -> {
                        if (ex != null) {
                            logger.error("Failed to merge {}", task.path(), ex);
                        }
                    });
            futures.add(future);
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .handle((ignored, ex) -> {
                    long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                    logger.info(
                            "Extraction finished in {} ms: {} extracted, {} failed, {} skipped",
                            millis,
                            completed.get(),
                            failed.get(),
                            skipped.get());
                    return assembler.snapshot();
                });
    }
}
