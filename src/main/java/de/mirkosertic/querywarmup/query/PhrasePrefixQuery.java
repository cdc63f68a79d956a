package de.mirkosertic.querywarmup.query;

import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.MultiPhraseQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.QueryVisitor;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.StringHelper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A phrase whose last term is a prefix.
 *
 * <p>At rewrite time the prefix is expanded against the term dictionary into at most
 * {@code maxExpansions} terms (the smallest ones, in byte order) and the query becomes a
 * {@link MultiPhraseQuery}. Without preceding phrase terms it becomes a disjunction of the
 * expansions.</p>
 *
 * <p>{@link #visit(QueryVisitor)} only reports the exact phrase terms. The prefix is not a term of
 * the index and is warmed up as a term range instead.</p>
 */
public final class PhrasePrefixQuery extends Query {

    private final String field;
    private final List<Term> phraseTerms;
    private final List<Integer> phrasePositions;
    private final Term prefix;
    private final int prefixPosition;
    private final int maxExpansions;
    private final int slop;

    public PhrasePrefixQuery(final List<Term> phraseTerms, final List<Integer> phrasePositions, final Term prefix,
                             final int prefixPosition, final int maxExpansions, final int slop) {
        Objects.requireNonNull(prefix, "prefix");
        if (phraseTerms.size() != phrasePositions.size()) {
            throw new IllegalArgumentException("Each phrase term needs a position");
        }
        for (final Term term : phraseTerms) {
            if (!term.field().equals(prefix.field())) {
                throw new IllegalArgumentException("All terms must target field " + prefix.field() + ", got " + term);
            }
        }
        if (maxExpansions <= 0) {
            throw new IllegalArgumentException("maxExpansions must be positive, got " + maxExpansions);
        }
        this.field = prefix.field();
        this.phraseTerms = List.copyOf(phraseTerms);
        this.phrasePositions = List.copyOf(phrasePositions);
        this.prefix = prefix;
        this.prefixPosition = prefixPosition;
        this.maxExpansions = maxExpansions;
        this.slop = slop;
    }

    public static PhrasePrefixQuery of(final ClauseTerms.AnalyzedPhrase phrase, final int maxExpansions,
                                       final int slop) {
        return new PhrasePrefixQuery(phrase.phraseTerms(), phrase.phrasePositions(), phrase.prefixTerm(),
                phrase.prefixPosition(), maxExpansions, slop);
    }

    public String getField() {
        return field;
    }

    public List<Term> getPhraseTerms() {
        return phraseTerms;
    }

    public Term getPrefix() {
        return prefix;
    }

    public int getMaxExpansions() {
        return maxExpansions;
    }

    public int getSlop() {
        return slop;
    }

    @Override
    public Query rewrite(final IndexSearcher searcher) throws IOException {
        final List<Term> expansions = expandPrefix(searcher.getIndexReader());
        if (expansions.isEmpty()) {
            return new MatchNoDocsQuery("no term of " + field + " starts with " + prefix.text());
        }
        if (phraseTerms.isEmpty()) {
            if (expansions.size() == 1) {
                return new TermQuery(expansions.get(0));
            }
            final BooleanQuery.Builder builder = new BooleanQuery.Builder();
            for (final Term expansion : expansions) {
                builder.add(new TermQuery(expansion), BooleanClause.Occur.SHOULD);
            }
            return builder.build();
        }
        final MultiPhraseQuery.Builder builder = new MultiPhraseQuery.Builder();
        for (int i = 0; i < phraseTerms.size(); i++) {
            builder.add(new Term[]{phraseTerms.get(i)}, phrasePositions.get(i));
        }
        builder.add(expansions.toArray(new Term[0]), prefixPosition);
        builder.setSlop(slop);
        return builder.build();
    }

    /**
     * Collects the smallest {@code maxExpansions} terms starting with the prefix over all segments.
     */
    List<Term> expandPrefix(final IndexReader reader) throws IOException {
        final SortedSet<BytesRef> expanded = new TreeSet<>();
        for (final LeafReaderContext leaf : reader.leaves()) {
            final Terms terms = leaf.reader().terms(field);
            if (terms == null) {
                continue;
            }
            final TermsEnum termsEnum = terms.iterator();
            if (termsEnum.seekCeil(prefix.bytes()) == TermsEnum.SeekStatus.END) {
                continue;
            }
            int seen = 0;
            BytesRef term = termsEnum.term();
            while (term != null && seen < maxExpansions && StringHelper.startsWith(term, prefix.bytes())) {
                expanded.add(BytesRef.deepCopyOf(term));
                seen++;
                term = termsEnum.next();
            }
        }
        final List<Term> result = new ArrayList<>(Math.min(expanded.size(), maxExpansions));
        for (final BytesRef bytes : expanded) {
            if (result.size() == maxExpansions) {
                break;
            }
            result.add(new Term(field, bytes));
        }
        return result;
    }

    @Override
    public void visit(final QueryVisitor visitor) {
        if (!visitor.acceptField(field)) {
            return;
        }
        if (!phraseTerms.isEmpty()) {
            visitor.consumeTerms(this, phraseTerms.toArray(new Term[0]));
        }
    }

    @Override
    public String toString(final String defaultField) {
        final StringBuilder result = new StringBuilder();
        if (!field.equals(defaultField)) {
            result.append(field).append(':');
        }
        result.append('"');
        for (final Term term : phraseTerms) {
            result.append(term.text()).append(' ');
        }
        result.append(prefix.text()).append("*\"");
        if (slop != 0) {
            result.append('~').append(slop);
        }
        return result.toString();
    }

    @Override
    public boolean equals(final Object other) {
        return sameClassAs(other) && equalsTo(getClass().cast(other));
    }

    private boolean equalsTo(final PhrasePrefixQuery other) {
        return prefixPosition == other.prefixPosition
                && maxExpansions == other.maxExpansions
                && slop == other.slop
                && prefix.equals(other.prefix)
                && phraseTerms.equals(other.phraseTerms)
                && phrasePositions.equals(other.phrasePositions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classHash(), phraseTerms, phrasePositions, prefix, prefixPosition, maxExpansions, slop);
    }
}
