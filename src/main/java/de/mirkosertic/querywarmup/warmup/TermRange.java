package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.util.Bound;
import org.apache.lucene.index.Term;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * A range of terms to warm up, capped at {@code limit} distinct terms.
 *
 * <p>Two clauses producing equal ranges (same start, end and limit) are the same warm-up unit.</p>
 */
public record TermRange(Bound<Term> start, Bound<Term> end, OptionalLong limit) {

    /**
     * Limit of ranges derived from clauses that declare no expansion limit of their own.
     */
    public static final long UNBOUNDED_EXPANSIONS = 0xFFFF_FFFFL;

    public TermRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(limit, "limit");
    }
}
