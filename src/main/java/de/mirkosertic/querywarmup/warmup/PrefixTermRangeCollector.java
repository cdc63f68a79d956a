package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.FieldDoesNotExistException;
import de.mirkosertic.querywarmup.InvalidQueryException;
import de.mirkosertic.querywarmup.ast.FullTextQuery;
import de.mirkosertic.querywarmup.ast.PhrasePrefixQuery;
import de.mirkosertic.querywarmup.ast.QueryAst;
import de.mirkosertic.querywarmup.ast.QueryAstVisitor;
import de.mirkosertic.querywarmup.ast.WildcardQuery;
import de.mirkosertic.querywarmup.query.ClauseTerms;
import de.mirkosertic.querywarmup.schema.Field;
import de.mirkosertic.querywarmup.schema.Schema;
import de.mirkosertic.querywarmup.tokenizer.TokenizerManager;
import org.apache.lucene.index.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns every prefix shaped clause into a term range, grouped per field.
 *
 * <ul>
 *   <li>full text in bool prefix mode: its last token, no expansion limit, no positions</li>
 *   <li>phrase prefix: its last token, limited to the clause's max expansions, positions when the
 *       phrase has more than one token</li>
 *   <li>wildcard of the {@code literal*} shape: the literal, no expansion limit, no positions</li>
 * </ul>
 * Clauses yielding the same range are merged, the merged entry needing positions if any of them
 * does. Phrase prefix clauses on missing fields or failing with a schema error, and wildcard
 * clauses on missing fields, are skipped: the compiler nullifies or rejects them.
 */
public final class PrefixTermRangeCollector implements QueryAstVisitor<InvalidQueryException> {

    private static final Logger logger = LoggerFactory.getLogger(PrefixTermRangeCollector.class);

    static final Set<InvalidQueryException.Reason> SKIPPED_PHRASE_PREFIX_REASONS =
            EnumSet.of(InvalidQueryException.Reason.SCHEMA_ERROR, InvalidQueryException.Reason.FIELD_DOES_NOT_EXIST);

    private final Schema schema;
    private final TokenizerManager tokenizers;
    private final Map<Field, Map<TermRange, Boolean>> termRangesByField = new TreeMap<>();

    PrefixTermRangeCollector(final Schema schema, final TokenizerManager tokenizers) {
        this.schema = schema;
        this.tokenizers = tokenizers;
    }

    public static Map<Field, Map<TermRange, Boolean>> collect(final QueryAst ast, final Schema schema,
                                                              final TokenizerManager tokenizers)
            throws InvalidQueryException {
        final PrefixTermRangeCollector collector = new PrefixTermRangeCollector(schema, tokenizers);
        collector.visit(ast);
        return collector.termRangesByField;
    }

    Map<Field, Map<TermRange, Boolean>> termRangesByField() {
        return termRangesByField;
    }

    @Override
    public void visitFullText(final FullTextQuery fullTextQuery) throws InvalidQueryException {
        final Optional<Term> prefix = ClauseTerms.fullTextPrefixTerm(fullTextQuery, schema, tokenizers);
        if (prefix.isPresent()) {
            addPrefix(prefix.get(), OptionalLong.of(TermRange.UNBOUNDED_EXPANSIONS), false);
        }
    }

    @Override
    public void visitPhrasePrefix(final PhrasePrefixQuery phrasePrefixQuery) throws InvalidQueryException {
        final ClauseTerms.AnalyzedPhrase phrase;
        try {
            phrase = ClauseTerms.analyzePhrasePrefix(phrasePrefixQuery, schema, tokenizers);
        } catch (final InvalidQueryException e) {
            if (!SKIPPED_PHRASE_PREFIX_REASONS.contains(e.getReason())) {
                throw e;
            }
            logger.debug("Skipping phrase prefix on {}: {}", phrasePrefixQuery.field(), e.getMessage());
            return;
        }
        if (phrase.isEmpty()) {
            return;
        }
        addPrefix(phrase.prefixTerm(), OptionalLong.of(phrasePrefixQuery.maxExpansions()), phrase.needsPositions());
    }

    @Override
    public void visitWildcard(final WildcardQuery wildcardQuery) throws InvalidQueryException {
        final Optional<Term> prefix;
        try {
            prefix = ClauseTerms.wildcardPrefixTerm(wildcardQuery, schema, tokenizers);
        } catch (final FieldDoesNotExistException e) {
            logger.debug("Skipping wildcard on missing field {}", e.getFieldName());
            return;
        }
        if (prefix.isPresent()) {
            addPrefix(prefix.get(), OptionalLong.of(TermRange.UNBOUNDED_EXPANSIONS), false);
        }
    }

    private void addPrefix(final Term prefix, final OptionalLong limit, final boolean positionsNeeded) {
        final Field field = schema.getField(prefix.field())
                .orElseThrow(() -> new IllegalStateException("Prefix term on unknown field " + prefix.field()));
        WarmUpPlan.mergeFlag(termRangesByField, field, PrefixRanges.prefixTermToRange(prefix, limit), positionsNeeded);
    }
}
