package io.github.codegraph.extractor;

/** A source file could not be read or is not eligible for extraction. */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
