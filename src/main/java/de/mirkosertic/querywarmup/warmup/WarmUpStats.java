package de.mirkosertic.querywarmup.warmup;

/**
 * What a {@link SegmentWarmer} read from one segment.
 *
 * @param termDictionaryTerms terms walked in whole term dictionaries
 * @param literalTerms        literal terms found in the segment
 * @param rangeTerms          terms walked in term ranges
 * @param postings            postings iterated, one per matching document and term
 * @param positions           positions read
 * @param docValues           documents with a value read from fast fields
 */
public record WarmUpStats(
        long termDictionaryTerms,
        long literalTerms,
        long rangeTerms,
        long postings,
        long positions,
        long docValues
) {
}
