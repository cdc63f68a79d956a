package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.query.PhrasePrefixQuery;
import de.mirkosertic.querywarmup.schema.Field;
import de.mirkosertic.querywarmup.schema.Schema;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.MultiPhraseQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.QueryVisitor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Enumerates the literal terms of a compiled query, grouped per field. A term needs positions
 * when a phrase query uses it.
 *
 * <p>Prohibited clauses are visited too: their postings are read to exclude documents.
 * Automaton based queries (prefix, wildcard) and terms sets of several values report no literal
 * terms; they are covered by term ranges and term dictionaries.</p>
 */
public final class QueryTermCollector extends QueryVisitor {

    private final Schema schema;
    private final Map<Field, Map<Term, Boolean>> termsByField = new TreeMap<>();

    private QueryTermCollector(final Schema schema) {
        this.schema = schema;
    }

    public static Map<Field, Map<Term, Boolean>> collect(final Query query, final Schema schema) {
        final QueryTermCollector collector = new QueryTermCollector(schema);
        query.visit(collector);
        return collector.termsByField;
    }

    @Override
    public void consumeTerms(final Query query, final Term... terms) {
        final boolean positionsNeeded = query instanceof PhraseQuery
                || query instanceof MultiPhraseQuery
                || query instanceof PhrasePrefixQuery;
        for (final Term term : terms) {
            final Field field = schema.getField(term.field())
                    .orElseThrow(() -> new IllegalStateException("Compiled term on unknown field " + term.field()));
            WarmUpPlan.mergeFlag(termsByField, field, term, positionsNeeded);
        }
    }

    @Override
    public QueryVisitor getSubVisitor(final BooleanClause.Occur occur, final Query parent) {
        return this;
    }
}
