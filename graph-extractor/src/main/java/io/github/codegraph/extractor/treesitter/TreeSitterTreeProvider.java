package io.github.codegraph.extractor.treesitter;

import io.github.codegraph.extractor.ExtractionConfig;
import io.github.codegraph.extractor.Languages;
import io.github.codegraph.extractor.tree.ArenaSyntaxTree;
import io.github.codegraph.extractor.util.TextCanonicalizer;
import io.github.codegraph.tree.SyntaxTree;
import io.github.codegraph.tree.SyntaxTreeProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSException;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterC;
import org.treesitter.TreeSitterCpp;

/**
 * Parses C and C++ with tree-sitter. Parsers are not thread-safe, so each thread gets its own per language.
 */
public final class TreeSitterTreeProvider implements SyntaxTreeProvider {
    private static final Logger logger = LogManager.getLogger(TreeSitterTreeProvider.class);

    private final int maxNodes;
    private final int maxDepth;
    private final long timeoutMicros;
    private final ThreadLocal<TSParser> cppParser;
    private final ThreadLocal<TSParser> cParser;

    public TreeSitterTreeProvider(ExtractionConfig config) {
        this.maxNodes = config.maxNodesPerFile();
        this.maxDepth = config.maxTreeDepth();
        this.timeoutMicros = config.parseTimeoutMillis() * 1000L;
        this.cppParser = ThreadLocal.withInitial(() -> newParser(new TreeSitterCpp()));
        this.cParser = ThreadLocal.withInitial(() -> newParser(new TreeSitterC()));
    }

    @Override
    public boolean supports(String language) {
        return Languages.ALL.contains(language);
    }

    @Override
    public SyntaxTree parse(String language, String source) {
        var parser = switch (language) {
            case Languages.CPP -> cppParser.get();
            case Languages.C -> cParser.get();
            default -> throw new IllegalArgumentException("Unsupported language: " + language);
        };
        var src = TextCanonicalizer.stripUtf8Bom(source);

        TSTree tree;
        try {
            tree = parser.parseString(null, src);
        } catch (TSException e) {
            logger.warn("Parser failed for {} source: {}", language, e.getMessage());
            parser.reset();
            return ArenaSyntaxTree.empty(src);
        }
        if (tree == null) {
            logger.warn("Parser produced no tree for {} source ({} chars); timeout or cancellation", language,
                    src.length());
            parser.reset();
            return ArenaSyntaxTree.empty(src);
        }

        var root = tree.getRootNode();
        if (root == null || root.isNull()) {
            logger.warn("Parsed {} tree has no root node", language);
            return ArenaSyntaxTree.empty(src);
        }
        return TreeSitterArenaReader.read(root, src, maxNodes, maxDepth);
    }

    private TSParser newParser(TSLanguage language) {
        var parser = new TSParser();
        if (!parser.setLanguage(language)) {
            throw new IllegalStateException("Incompatible tree-sitter grammar: " + language.getClass().getSimpleName());
        }
        if (timeoutMicros > 0) {
            parser.setTimeoutMicros(timeoutMicros);
        }
        return parser;
    }
}
