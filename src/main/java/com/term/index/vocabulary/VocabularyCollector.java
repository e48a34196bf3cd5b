package com.term.index.vocabulary;

import com.term.index.core.model.Terms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Accumulates terms for the loaders: validates each record, counts duplicates,
 * collects rejected records and reports progress.
 */
class VocabularyCollector {
    private static final Logger log = LoggerFactory.getLogger(VocabularyCollector.class);
    private static final int PROGRESS_INTERVAL = 1_000;
    private static final int MAX_ECHOED_INPUT = 80;

    private final ProgressCallback callback;
    private final Set<String> terms = new LinkedHashSet<>();
    private final List<LoadResult.LoadError> errors = new ArrayList<>();
    private long recordsRead;
    private long duplicates;

    VocabularyCollector(ProgressCallback callback) {
        this.callback = callback != null ? callback : ProgressCallback.NOOP;
    }

    void accept(long position, String term) {
        recordsRead++;
        try {
            Terms.validate(term);
            if (!terms.add(term)) {
                duplicates++;
            }
        } catch (IllegalArgumentException e) {
            reject(position, term, e.getMessage());
        }
        if (recordsRead % PROGRESS_INTERVAL == 0) {
            callback.onProgress(recordsRead, terms.size(), false);
        }
    }

    void reject(long position, String input, String message) {
        String echoed = abbreviate(input);
        errors.add(new LoadResult.LoadError(position, echoed, message));
        log.warn("vocabulary.load.error position={} input='{}' error={}", position, echoed, message);
    }

    LoadResult finish() {
        LoadResult result = new LoadResult(InMemoryVocabulary.of(terms), recordsRead, duplicates, errors);
        callback.onProgress(recordsRead, terms.size(), true);
        log.info("vocabulary.load.completed result={}", result);
        return result;
    }

    private static String abbreviate(String input) {
        if (input == null) {
            return "";
        }
        if (input.length() <= MAX_ECHOED_INPUT) {
            return input;
        }
        return input.substring(0, MAX_ECHOED_INPUT) + "...";
    }
}
