package com.term.index.vocabulary;

import com.term.index.logging.LogContext;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Plain text vocabulary loader.
 *
 * <p>Expected format: one term per line, taken verbatim.</p>
 * <pre>
 * # colours
 * red
 * green
 * blue
 * </pre>
 *
 * <p>Empty lines and lines starting with {@code #} are skipped.</p>
 */
public class TextVocabularyLoader implements VocabularyLoader {

    private static final String COMMENT_PREFIX = "#";

    @Override
    public LoadResult load(Reader reader, ProgressCallback callback) {
        VocabularyCollector collector = new VocabularyCollector(callback);
        try (LogContext ctx = LogContext.forLoad(getFormat());
             BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                    continue;
                }
                collector.accept(lineNumber, line);
            }
        } catch (IOException e) {
            throw new VocabularyLoadException("Failed to read text vocabulary: " + e.getMessage(), e);
        }
        return collector.finish();
    }

    @Override
    public String getFormat() {
        return "text";
    }
}
