package io.github.codegraph.extractor;

import com.google.common.base.Splitter;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Limits and sizing for extraction.
 *
 * @param parallelism worker threads used by {@link ExtractionPipeline}
 * @param maxNodesPerFile node budget per file; the tree is truncated beyond it
 * @param parseTimeoutMillis parser time limit per file, 0 for none
 * @param maxFileBytes files larger than this are not parsed
 * @param maxTreeDepth syntax nodes nested deeper than this are left out of the tree
 * @param ignoredDirectories directory names pruned when walking a source root
 * @param ignoredFiles file name globs skipped when walking a source root
 */
public record ExtractionConfig(
        int parallelism,
        int maxNodesPerFile,
        long parseTimeoutMillis,
        long maxFileBytes,
        int maxTreeDepth,
        Set<String> ignoredDirectories,
        Set<String> ignoredFiles) {
    private static final Logger logger = LogManager.getLogger(ExtractionConfig.class);

    public static final String PARALLELISM_PROPERTY = "codegraph.parallelism";
    public static final String MAX_NODES_PROPERTY = "codegraph.maxNodesPerFile";
    public static final String PARSE_TIMEOUT_PROPERTY = "codegraph.parseTimeoutMillis";
    public static final String MAX_FILE_BYTES_PROPERTY = "codegraph.maxFileBytes";
    public static final String MAX_TREE_DEPTH_PROPERTY = "codegraph.maxTreeDepth";
    public static final String IGNORED_DIRECTORIES_PROPERTY = "codegraph.ignoredDirectories";
    public static final String IGNORED_FILES_PROPERTY = "codegraph.ignoredFiles";

    public static final int DEFAULT_MAX_NODES = 2_000_000;
    public static final long DEFAULT_PARSE_TIMEOUT_MILLIS = 10_000L;
    public static final long DEFAULT_MAX_FILE_BYTES = 8L * 1024 * 1024;
    public static final int DEFAULT_MAX_TREE_DEPTH = 1_000;

    /** VCS metadata, IDE state, dependency caches and build outputs. */
    public static final Set<String> DEFAULT_IGNORED_DIRECTORIES = Set.of(
            ".git",
            ".hg",
            ".svn",
            ".idea",
            ".vscode",
            ".venv",
            "venv",
            "__pycache__",
            "node_modules",
            ".gradle",
            "build",
            "dist",
            "target",
            "out",
            "CMakeFiles",
            "coverage",
            "logs",
            "tmp",
            "temp");

    public static final Set<String> DEFAULT_IGNORED_FILES =
            Set.of(".DS_Store", "*.o", "*.obj", "*.a", "*.so", "*.dll", "*.swp", "*.swo", "*.log");

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public ExtractionConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, was " + parallelism);
        }
        if (maxNodesPerFile < 1) {
            throw new IllegalArgumentException("maxNodesPerFile must be >= 1, was " + maxNodesPerFile);
        }
        if (parseTimeoutMillis < 0 || maxFileBytes < 1) {
            throw new IllegalArgumentException("parseTimeoutMillis must be >= 0 and maxFileBytes >= 1");
        }
        if (maxTreeDepth < 1) {
            throw new IllegalArgumentException("maxTreeDepth must be >= 1, was " + maxTreeDepth);
        }
        ignoredDirectories = Set.copyOf(ignoredDirectories);
        ignoredFiles = Set.copyOf(ignoredFiles);
    }

    /** Default depth limit and ignore lists. */
    public ExtractionConfig(int parallelism, int maxNodesPerFile, long parseTimeoutMillis, long maxFileBytes) {
        this(
                parallelism,
                maxNodesPerFile,
                parseTimeoutMillis,
                maxFileBytes,
                DEFAULT_MAX_TREE_DEPTH,
                DEFAULT_IGNORED_DIRECTORIES,
                DEFAULT_IGNORED_FILES);
    }

    public static ExtractionConfig defaults() {
        return new ExtractionConfig(
                Math.max(1, Runtime.getRuntime().availableProcessors()),
                DEFAULT_MAX_NODES,
                DEFAULT_PARSE_TIMEOUT_MILLIS,
                DEFAULT_MAX_FILE_BYTES);
    }

    /**
     * Defaults, overridden by any of the {@code codegraph.*} system properties that are set. Invalid values are logged
     * and ignored. The ignore lists are comma separated and replace the defaults.
     */
    public static ExtractionConfig fromSystemProperties() {
        var d = defaults();
        return new ExtractionConfig(
                (int) longProperty(PARALLELISM_PROPERTY, d.parallelism(), 1, Integer.MAX_VALUE),
                (int) longProperty(MAX_NODES_PROPERTY, d.maxNodesPerFile(), 1, Integer.MAX_VALUE),
                longProperty(PARSE_TIMEOUT_PROPERTY, d.parseTimeoutMillis(), 0, Long.MAX_VALUE / 1000),
                longProperty(MAX_FILE_BYTES_PROPERTY, d.maxFileBytes(), 1, Long.MAX_VALUE),
                (int) longProperty(MAX_TREE_DEPTH_PROPERTY, d.maxTreeDepth(), 1, Integer.MAX_VALUE),
                listProperty(IGNORED_DIRECTORIES_PROPERTY, d.ignoredDirectories()),
                listProperty(IGNORED_FILES_PROPERTY, d.ignoredFiles()));
    }

    public ExtractionConfig withParallelism(int threads) {
        return new ExtractionConfig(
                threads,
                maxNodesPerFile,
                parseTimeoutMillis,
                maxFileBytes,
                maxTreeDepth,
                ignoredDirectories,
                ignoredFiles);
    }

    public ExtractionConfig withMaxNodesPerFile(int nodes) {
        return new ExtractionConfig(
                parallelism,
                nodes,
                parseTimeoutMillis,
                maxFileBytes,
                maxTreeDepth,
                ignoredDirectories,
                ignoredFiles);
    }

    public ExtractionConfig withMaxTreeDepth(int depth) {
        return new ExtractionConfig(
                parallelism,
                maxNodesPerFile,
                parseTimeoutMillis,
                maxFileBytes,
                depth,
                ignoredDirectories,
                ignoredFiles);
    }

    public ExtractionConfig withIgnored(Set<String> directories, Set<String> files) {
        return new ExtractionConfig(
                parallelism, maxNodesPerFile, parseTimeoutMillis, maxFileBytes, maxTreeDepth, directories, files);
    }

    public boolean ignoresDirectory(Path directory) {
        var name = directory.getFileName();
        return name != null && ignoredDirectories.contains(name.toString());
    }

    /** Matchers for {@link #ignoredFiles}, applied to file names only. */
    public List<PathMatcher> ignoredFileMatchers() {
        var fs = FileSystems.getDefault();
        return ignoredFiles.stream().map(glob -> fs.getPathMatcher("glob:" + glob)).toList();
    }

    private static long longProperty(String name, long fallback, long min, long max) {
        String prop = System.getProperty(name);
        if (prop == null) {
            return fallback;
        }
        try {
            long value = Long.parseLong(prop.strip());
            if (value < min || value > max) {
                logger.warn("Out of range {} value '{}'; using {}", name, prop, fallback);
                return fallback;
            }
            logger.info("Using overridden {} from system property: {}", name, value);
            return value;
        } catch (NumberFormatException nfe) {
            logger.warn("Invalid {} value '{}'; ignoring override", name, prop);
            return fallback;
        }
    }

    private static Set<String> listProperty(String name, Set<String> fallback) {
        String prop = System.getProperty(name);
        if (prop == null) {
            return fallback;
        }
        var values = Set.copyOf(LIST_SPLITTER.splitToList(prop));
        logger.info("Using overridden {} from system property: {}", name, values);
        return values;
    }
}
