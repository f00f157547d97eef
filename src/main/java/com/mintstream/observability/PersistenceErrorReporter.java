package com.mintstream.observability;

/**
 * Receives store failures that are handled by logging and continuing.
 *
 * <p>Callers never rethrow after reporting: a failed insert or purge must not stop the
 * receive loop or the periodic tasks.
 */
public interface PersistenceErrorReporter {

    /**
     * @param operation short name of the store operation, e.g. "insert-token"
     * @param mint token the operation concerned, or null for bulk operations
     * @param error the failure
     */
    void report(String operation, String mint, Throwable error);
}
