package io.github.codegraph.model;

/**
 * Input to extraction: one file's text.
 *
 * @param path path used for ids and slices; not read again
 * @param language language id, e.g. {@code cpp} or {@code c}
 * @param content full text of the file
 */
public record SourceFile(String path, String language, String content) {

    public SourceFile {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
    }
}
