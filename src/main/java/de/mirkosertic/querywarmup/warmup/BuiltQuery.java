package de.mirkosertic.querywarmup.warmup;

import org.apache.lucene.search.Query;

import java.util.Objects;

/**
 * An executable query together with the index artifacts it touches.
 */
public record BuiltQuery(Query query, WarmUpPlan plan) {

    public BuiltQuery {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(plan, "plan");
    }
}
