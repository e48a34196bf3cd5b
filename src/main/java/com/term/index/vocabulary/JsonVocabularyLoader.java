package com.term.index.vocabulary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.term.index.logging.LogContext;

import java.io.IOException;
import java.io.Reader;
import java.util.Iterator;

/**
 * JSON vocabulary loader.
 *
 * <p>Accepts either an array of strings:</p>
 * <pre>
 * ["cat", "cats", "bat"]
 * </pre>
 *
 * <p>or an object mapping each token to its id, as written by token dictionaries:</p>
 * <pre>
 * {"cat": 0, "cats": 1, "bat": 2}
 * </pre>
 *
 * <p>In the object form only the keys are used. Non-string array elements are
 * rejected individually and reported in {@link LoadResult#errors()}.</p>
 */
public class JsonVocabularyLoader implements VocabularyLoader {

    private final ObjectMapper objectMapper;

    public JsonVocabularyLoader() {
        this(new ObjectMapper());
    }

    public JsonVocabularyLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public LoadResult load(Reader reader, ProgressCallback callback) {
        VocabularyCollector collector = new VocabularyCollector(callback);
        try (LogContext ctx = LogContext.forLoad(getFormat()); Reader r = reader) {
            JsonNode root = objectMapper.readTree(r);
            if (root == null || root.isMissingNode()) {
                return collector.finish();
            }
            if (root.isArray()) {
                long index = 0;
                for (JsonNode element : root) {
                    index++;
                    if (element.isTextual()) {
                        collector.accept(index, element.textValue());
                    } else {
                        collector.reject(index, element.toString(), "Expected a string, got " + element.getNodeType());
                    }
                }
            } else if (root.isObject()) {
                long index = 0;
                Iterator<String> names = root.fieldNames();
                while (names.hasNext()) {
                    index++;
                    collector.accept(index, names.next());
                }
            } else {
                throw new VocabularyLoadException("Expected a JSON array or object, got " + root.getNodeType());
            }
        } catch (IOException e) {
            throw new VocabularyLoadException("Failed to read JSON vocabulary: " + e.getMessage(), e);
        }
        return collector.finish();
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
