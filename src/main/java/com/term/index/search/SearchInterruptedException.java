package com.term.index.search;

/**
 * Runtime exception thrown when the searching thread is interrupted during a
 * trie traversal. The thread's interrupt status is preserved.
 */
public class SearchInterruptedException extends RuntimeException {

    public SearchInterruptedException(String message) {
        super(message);
    }

    public SearchInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
