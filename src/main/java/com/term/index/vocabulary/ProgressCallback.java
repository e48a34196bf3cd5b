package com.term.index.vocabulary;

/**
 * Receives progress while a vocabulary is being loaded.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param recordsRead   term records read so far, including rejected ones
     * @param distinctTerms distinct valid terms collected so far
     * @param completed     true exactly once, after the last record
     */
    void onProgress(long recordsRead, long distinctTerms, boolean completed);

    ProgressCallback NOOP = (recordsRead, distinctTerms, completed) -> {};
}
