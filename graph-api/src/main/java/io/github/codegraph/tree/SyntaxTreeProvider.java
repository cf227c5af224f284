package io.github.codegraph.tree;

/** The grammar/parser collaborator: turns source text into a {@link SyntaxTree}. */
public interface SyntaxTreeProvider {

    boolean supports(String language);

    /**
     * Parses {@code source}. Never returns null; a failed parse yields a tree whose {@link SyntaxTree#root()} is null.
     *
     * @throws IllegalArgumentException if the language is not supported
     */
    SyntaxTree parse(String language, String source);
}
