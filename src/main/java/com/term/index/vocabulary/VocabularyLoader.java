package com.term.index.vocabulary;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Reads a vocabulary from a specific format.
 */
public interface VocabularyLoader {

    /**
     * Loads a vocabulary from a UTF-8 input stream.
     *
     * @param input    the input stream to read from
     * @param callback optional progress callback
     * @return the load result
     * @throws VocabularyLoadException if the input cannot be read
     */
    default LoadResult load(InputStream input, ProgressCallback callback) {
        return load(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    /**
     * Loads a vocabulary from a reader.
     *
     * @param reader   the reader to read from
     * @param callback optional progress callback
     * @return the load result
     * @throws VocabularyLoadException if the input cannot be read
     */
    LoadResult load(Reader reader, ProgressCallback callback);

    /**
     * Returns the format supported by this loader (e.g., "text", "json").
     */
    String getFormat();
}
