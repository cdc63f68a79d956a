package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.util.Bound;
import org.apache.lucene.index.Term;
import org.apache.lucene.util.BytesRef;

import java.util.Arrays;
import java.util.OptionalLong;

/**
 * Converts prefix terms into the half open term range holding every term that starts with them.
 */
public final class PrefixRanges {

    private PrefixRanges() {
    }

    /**
     * Returns {@code [prefix, upper)} where {@code upper} is the prefix with its last byte below
     * {@code 0xFF} incremented and the bytes after it dropped. A prefix made only of {@code 0xFF}
     * bytes, or an empty one, has no finite upper bound: the range is {@code [prefix, unbounded)}.
     */
    public static TermRange prefixTermToRange(final Term prefix, final OptionalLong limit) {
        return new TermRange(Bound.included(prefix), exclusiveUpperBound(prefix), limit);
    }

    static Bound<Term> exclusiveUpperBound(final Term prefix) {
        final BytesRef bytes = prefix.bytes();
        final byte[] upper = Arrays.copyOfRange(bytes.bytes, bytes.offset, bytes.offset + bytes.length);
        for (int i = upper.length - 1; i >= 0; i--) {
            if ((upper[i] & 0xFF) != 0xFF) {
                upper[i]++;
                return Bound.excluded(new Term(prefix.field(), new BytesRef(Arrays.copyOf(upper, i + 1))));
            }
        }
        return Bound.unbounded();
    }
}
