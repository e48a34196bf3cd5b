package com.term.index.vocabulary;

import java.util.List;
import java.util.Objects;

/**
 * Result of loading a vocabulary.
 *
 * @param vocabulary  the loaded vocabulary
 * @param recordsRead number of term records read from the input
 * @param duplicates  number of records that repeated an earlier term
 * @param errors      records that were rejected
 */
public record LoadResult(
        Vocabulary vocabulary,
        long recordsRead,
        long duplicates,
        List<LoadError> errors
) {
    public LoadResult {
        Objects.requireNonNull(vocabulary, "vocabulary is required");
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record rejected during loading.
     *
     * @param position line number (text) or element index (JSON), 1-based
     * @param input    the rejected input, possibly abbreviated
     * @param message  the error message
     */
    public record LoadError(long position, String input, String message) {}

    @Override
    public String toString() {
        return "LoadResult{terms=" + vocabulary.size() +
                ", read=" + recordsRead +
                ", duplicates=" + duplicates +
                ", errors=" + errors.size() + '}';
    }
}
