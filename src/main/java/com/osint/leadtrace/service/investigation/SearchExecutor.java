package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.exception.SearchExecutionException;

/**
 * Performs the real investigative lookups for one value and writes what it finds
 * back into the graph. Blocking: the call returns only once the lookup and its
 * graph writes are complete.
 */
@FunctionalInterface
public interface SearchExecutor {

    /**
     * @throws SearchExecutionException when the lookup for {@code value} fails
     */
    void search(String value);
}
