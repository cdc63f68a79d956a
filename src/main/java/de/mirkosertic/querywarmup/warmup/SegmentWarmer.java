package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.FieldDoesNotExistException;
import de.mirkosertic.querywarmup.schema.Field;
import de.mirkosertic.querywarmup.schema.FieldResolver;
import de.mirkosertic.querywarmup.schema.Schema;
import de.mirkosertic.querywarmup.util.Bound;
import org.apache.lucene.index.DocValuesType;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.index.PostingsEnum;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.search.DocIdSetIterator;
import org.apache.lucene.util.BytesRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Reads exactly the artifacts a {@link WarmUpPlan} names from a segment, so that a query run
 * afterwards finds them in the cache of the underlying directory.
 */
public class SegmentWarmer {

    private static final Logger logger = LoggerFactory.getLogger(SegmentWarmer.class);

    private final Schema schema;

    public SegmentWarmer(final Schema schema) {
        this.schema = schema;
    }

    public WarmUpStats warmUp(final LeafReader reader, final WarmUpPlan plan) throws IOException {
        final Counters counters = new Counters();

        for (final Field field : plan.termDictFields()) {
            final Terms terms = reader.terms(schema.getFieldName(field));
            if (terms == null) {
                continue;
            }
            final TermsEnum termsEnum = terms.iterator();
            while (termsEnum.next() != null) {
                counters.termDictionaryTerms++;
            }
        }

        for (final Map.Entry<Field, Map<Term, Boolean>> perField : plan.termsByField().entrySet()) {
            final Terms terms = reader.terms(schema.getFieldName(perField.getKey()));
            if (terms == null) {
                continue;
            }
            final TermsEnum termsEnum = terms.iterator();
            for (final Map.Entry<Term, Boolean> term : perField.getValue().entrySet()) {
                if (termsEnum.seekExact(term.getKey().bytes())) {
                    counters.literalTerms++;
                    readPostings(termsEnum, term.getValue(), counters);
                }
            }
        }

        for (final Map.Entry<Field, Map<TermRange, Boolean>> perField : plan.termRangesByField().entrySet()) {
            final Terms terms = reader.terms(schema.getFieldName(perField.getKey()));
            if (terms == null) {
                continue;
            }
            for (final Map.Entry<TermRange, Boolean> range : perField.getValue().entrySet()) {
                walkRange(terms.iterator(), range.getKey(), range.getValue(), counters);
            }
        }

        for (final String fastFieldName : plan.fastFieldNames()) {
            readDocValues(reader, fastFieldName, counters);
        }

        final WarmUpStats stats = counters.toStats();
        logger.debug("Warmed up segment {}: {}", reader, stats);
        return stats;
    }

    private void walkRange(final TermsEnum termsEnum, final TermRange range, final boolean positions,
                           final Counters counters) throws IOException {
        BytesRef term;
        if (range.start() instanceof Bound.Unbounded) {
            term = termsEnum.next();
        } else {
            final BytesRef start = range.start().valueOrNull().bytes();
            if (termsEnum.seekCeil(start) == TermsEnum.SeekStatus.END) {
                return;
            }
            term = termsEnum.term();
            if (range.start() instanceof Bound.Excluded && term.bytesEquals(start)) {
                term = termsEnum.next();
            }
        }

        final long limit = range.limit().orElse(Long.MAX_VALUE);
        long walked = 0;
        while (term != null && walked < limit && beforeEnd(term, range.end())) {
            counters.rangeTerms++;
            walked++;
            readPostings(termsEnum, positions, counters);
            term = termsEnum.next();
        }
    }

    private static boolean beforeEnd(final BytesRef term, final Bound<Term> end) {
        if (end instanceof Bound.Included<Term> included) {
            return term.compareTo(included.value().bytes()) <= 0;
        }
        if (end instanceof Bound.Excluded<Term> excluded) {
            return term.compareTo(excluded.value().bytes()) < 0;
        }
        return true;
    }

    private static void readPostings(final TermsEnum termsEnum, final boolean positions, final Counters counters)
            throws IOException {
        final PostingsEnum postings = termsEnum.postings(null, positions ? PostingsEnum.POSITIONS : PostingsEnum.NONE);
        while (postings.nextDoc() != DocIdSetIterator.NO_MORE_DOCS) {
            counters.postings++;
            if (positions) {
                final int freq = postings.freq();
                for (int i = 0; i < freq; i++) {
                    postings.nextPosition();
                    counters.positions++;
                }
            }
        }
    }

    private void readDocValues(final LeafReader reader, final String fieldName, final Counters counters)
            throws IOException {
        final String luceneFieldName;
        try {
            luceneFieldName = FieldResolver.resolve(fieldName, schema).luceneFieldName();
        } catch (final FieldDoesNotExistException e) {
            // Lenient ranges on missing fields compile to match none
            logger.debug("No fast field to warm up for {}", fieldName);
            return;
        }
        final FieldInfo fieldInfo = reader.getFieldInfos().fieldInfo(luceneFieldName);
        if (fieldInfo == null || fieldInfo.getDocValuesType() == DocValuesType.NONE) {
            return;
        }
        final DocIdSetIterator values = switch (fieldInfo.getDocValuesType()) {
            case NUMERIC -> reader.getNumericDocValues(luceneFieldName);
            case BINARY -> reader.getBinaryDocValues(luceneFieldName);
            case SORTED -> reader.getSortedDocValues(luceneFieldName);
            case SORTED_NUMERIC -> reader.getSortedNumericDocValues(luceneFieldName);
            case SORTED_SET -> reader.getSortedSetDocValues(luceneFieldName);
            default -> null;
        };
        if (values == null) {
            return;
        }
        while (values.nextDoc() != DocIdSetIterator.NO_MORE_DOCS) {
            counters.docValues++;
        }
    }

    private static final class Counters {
        long termDictionaryTerms;
        long literalTerms;
        long rangeTerms;
        long postings;
        long positions;
        long docValues;

        WarmUpStats toStats() {
            return new WarmUpStats(termDictionaryTerms, literalTerms, rangeTerms, postings, positions, docValues);
        }
    }
}
