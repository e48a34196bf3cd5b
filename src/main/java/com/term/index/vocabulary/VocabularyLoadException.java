package com.term.index.vocabulary;

/**
 * Runtime exception thrown when a vocabulary source cannot be read or has the
 * wrong overall shape.
 */
public class VocabularyLoadException extends RuntimeException {

    public VocabularyLoadException(String message) {
        super(message);
    }

    public VocabularyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
