package de.mirkosertic.querywarmup.warmup;

/**
 * Failure of building a query and its warm-up plan. The cause is the original error, unchanged.
 */
public class QueryBuildException extends Exception {

    public QueryBuildException(final Exception cause) {
        super("invalid query: " + cause.getMessage(), cause);
    }
}
