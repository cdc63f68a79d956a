package de.mirkosertic.querywarmup.query;

import de.mirkosertic.querywarmup.FieldDoesNotExistException;
import de.mirkosertic.querywarmup.InvalidQueryException;
import de.mirkosertic.querywarmup.ast.BoolQuery;
import de.mirkosertic.querywarmup.ast.BooleanOperand;
import de.mirkosertic.querywarmup.ast.FieldPresenceQuery;
import de.mirkosertic.querywarmup.ast.FullTextMode;
import de.mirkosertic.querywarmup.ast.FullTextParams;
import de.mirkosertic.querywarmup.ast.FullTextQuery;
import de.mirkosertic.querywarmup.ast.MatchAllQuery;
import de.mirkosertic.querywarmup.ast.MatchNoneQuery;
import de.mirkosertic.querywarmup.ast.QueryAst;
import de.mirkosertic.querywarmup.ast.QueryAstVisitor;
import de.mirkosertic.querywarmup.ast.RangeQuery;
import de.mirkosertic.querywarmup.ast.TermSetQuery;
import de.mirkosertic.querywarmup.ast.UserInputQuery;
import de.mirkosertic.querywarmup.ast.ZeroTermsQuery;
import de.mirkosertic.querywarmup.schema.FieldEntry;
import de.mirkosertic.querywarmup.schema.FieldResolver;
import de.mirkosertic.querywarmup.schema.FieldType;
import de.mirkosertic.querywarmup.schema.ResolvedField;
import de.mirkosertic.querywarmup.schema.Schema;
import de.mirkosertic.querywarmup.schema.TermEncoder;
import de.mirkosertic.querywarmup.tokenizer.Token;
import de.mirkosertic.querywarmup.tokenizer.TokenizerManager;
import de.mirkosertic.querywarmup.util.Bound;
import org.apache.lucene.document.SortedNumericDocValuesField;
import org.apache.lucene.document.SortedSetDocValuesField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.FieldExistsQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermInSetQuery;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.WildcardQuery;
import org.apache.lucene.util.BytesRef;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles a {@link QueryAst} into a Lucene query.
 *
 * <p>Values are encoded with {@link TermEncoder} and analyzed with the field's tokenizer, which
 * is also how documents are indexed, so compiled terms match indexed terms byte for byte.
 * Range and presence predicates run on doc values and therefore require fast fields.</p>
 *
 * <p>A clause on a field that does not exist compiles to {@link MatchNoDocsQuery} when validation
 * is off or the clause is lenient. Otherwise it fails the whole compilation.</p>
 */
public class LuceneQueryCompiler implements QueryCompiler {

    private static final Logger logger = LoggerFactory.getLogger(LuceneQueryCompiler.class);

    @Override
    public Query compile(final QueryAst ast, final Schema schema, final TokenizerManager tokenizers,
                         final List<String> defaultFields, final boolean validate) throws InvalidQueryException {
        // Default fields only matter for user text, which has to be parsed before it gets here
        return new Compilation(schema, tokenizers, validate).compile(ast);
    }

    @FunctionalInterface
    private interface LeafCompiler {
        Query compile() throws InvalidQueryException;
    }

    /**
     * State of a single compilation. Each callback stores the compiled form of its node in
     * {@link #result}.
     */
    private static final class Compilation implements QueryAstVisitor<InvalidQueryException> {

        private final Schema schema;
        private final TokenizerManager tokenizers;
        private final boolean validate;
        private @Nullable Query result;

        Compilation(final Schema schema, final TokenizerManager tokenizers, final boolean validate) {
            this.schema = schema;
            this.tokenizers = tokenizers;
            this.validate = validate;
        }

        Query compile(final QueryAst ast) throws InvalidQueryException {
            result = null;
            ast.accept(this);
            if (result == null) {
                throw new IllegalStateException("No query compiled for " + ast);
            }
            return result;
        }

        @Override
        public void visitBool(final BoolQuery boolQuery) throws InvalidQueryException {
            final BooleanQuery.Builder builder = new BooleanQuery.Builder();
            addClauses(builder, boolQuery.must(), BooleanClause.Occur.MUST);
            addClauses(builder, boolQuery.mustNot(), BooleanClause.Occur.MUST_NOT);
            addClauses(builder, boolQuery.should(), BooleanClause.Occur.SHOULD);
            addClauses(builder, boolQuery.filter(), BooleanClause.Occur.FILTER);
            if (boolQuery.must().isEmpty() && boolQuery.should().isEmpty() && boolQuery.filter().isEmpty()) {
                if (boolQuery.mustNot().isEmpty()) {
                    result = new MatchAllDocsQuery();
                    return;
                }
                // Negations alone would match nothing in Lucene
                builder.add(new MatchAllDocsQuery(), BooleanClause.Occur.MUST);
            }
            if (boolQuery.minimumShouldMatch() != null) {
                builder.setMinimumNumberShouldMatch(boolQuery.minimumShouldMatch());
            }
            result = builder.build();
        }

        private void addClauses(final BooleanQuery.Builder builder, final List<QueryAst> clauses,
                                final BooleanClause.Occur occur) throws InvalidQueryException {
            for (final QueryAst clause : clauses) {
                builder.add(compile(clause), occur);
            }
        }

        @Override
        public void visitBoost(final de.mirkosertic.querywarmup.ast.BoostQuery boostQuery)
                throws InvalidQueryException {
            final float boost = boostQuery.boost();
            if (!Float.isFinite(boost) || Float.compare(boost, 0f) < 0) {
                throw InvalidQueryException.other("boost must be a finite, non-negative number, got " + boost);
            }
            final Query underlying = compile(boostQuery.underlying());
            result = new org.apache.lucene.search.BoostQuery(underlying, boost);
        }

        @Override
        public void visitMatchAll(final MatchAllQuery matchAllQuery) {
            result = new MatchAllDocsQuery();
        }

        @Override
        public void visitMatchNone(final MatchNoneQuery matchNoneQuery) {
            result = new MatchNoDocsQuery();
        }

        @Override
        public void visitTerm(final de.mirkosertic.querywarmup.ast.TermQuery termQuery)
                throws InvalidQueryException {
            result = leaf(false, () -> {
                final ResolvedField field = FieldResolver.resolve(termQuery.field(), schema);
                return disjunction(field, valueTerms(field, termQuery.field(), termQuery.value()));
            });
        }

        @Override
        public void visitTermSet(final TermSetQuery termSetQuery) throws InvalidQueryException {
            final List<Query> perField = new ArrayList<>();
            for (final Map.Entry<String, Set<String>> entry : termSetQuery.termsPerField().entrySet()) {
                perField.add(leaf(false, () -> {
                    final ResolvedField field = FieldResolver.resolve(entry.getKey(), schema);
                    final List<BytesRef> terms = new ArrayList<>();
                    for (final String value : entry.getValue()) {
                        terms.addAll(valueTerms(field, entry.getKey(), value));
                    }
                    if (terms.isEmpty()) {
                        return new MatchNoDocsQuery("empty term set on " + entry.getKey());
                    }
                    return new TermInSetQuery(field.luceneFieldName(), terms);
                }));
            }
            if (perField.isEmpty()) {
                result = new MatchNoDocsQuery("empty term set");
            } else if (perField.size() == 1) {
                result = perField.get(0);
            } else {
                final BooleanQuery.Builder builder = new BooleanQuery.Builder();
                for (final Query query : perField) {
                    builder.add(query, BooleanClause.Occur.SHOULD);
                }
                result = builder.build();
            }
        }

        @Override
        public void visitFullText(final FullTextQuery fullTextQuery) throws InvalidQueryException {
            result = leaf(fullTextQuery.lenient(), () -> compileFullText(fullTextQuery));
        }

        private Query compileFullText(final FullTextQuery query) throws InvalidQueryException {
            final ResolvedField field = FieldResolver.resolve(query.field(), schema);
            if (!ClauseTerms.isTextual(field)) {
                // Numbers, dates, booleans and addresses are matched as exact values
                return disjunction(field, valueTerms(field, query.field(), query.text()));
            }
            requireIndexed(field, query.field());
            final List<Token> tokens = ClauseTerms.tokenize(field, query.text(), query.params(), tokenizers);
            if (tokens.isEmpty()) {
                return zeroTerms(query.params());
            }

            final FullTextMode mode = query.params().mode();
            if (mode instanceof FullTextMode.Bool bool) {
                return tokenConjunction(field, tokens, bool.operator(), false);
            }
            if (mode instanceof FullTextMode.BoolPrefix boolPrefix) {
                return tokenConjunction(field, tokens, boolPrefix.operator(), true);
            }
            if (tokens.size() == 1) {
                return new TermQuery(ClauseTerms.textTerm(field, tokens.get(0).text()));
            }
            if (mode instanceof FullTextMode.Phrase phrase) {
                if (!field.entry().hasPositions()) {
                    throw InvalidQueryException.schemaError("trying to run a phrase query on field `" + query.field()
                            + "` which does not have positions indexed");
                }
                return phraseQuery(field, tokens, phrase.slop());
            }
            if (field.entry().hasPositions()) {
                return phraseQuery(field, tokens, 0);
            }
            return tokenConjunction(field, tokens, BooleanOperand.AND, false);
        }

        private Query tokenConjunction(final ResolvedField field, final List<Token> tokens,
                                       final BooleanOperand operator, final boolean lastIsPrefix) {
            if (tokens.size() == 1 && !lastIsPrefix) {
                return new TermQuery(ClauseTerms.textTerm(field, tokens.get(0).text()));
            }
            final BooleanClause.Occur occur = operator == BooleanOperand.AND
                    ? BooleanClause.Occur.MUST
                    : BooleanClause.Occur.SHOULD;
            final BooleanQuery.Builder builder = new BooleanQuery.Builder();
            for (int i = 0; i < tokens.size(); i++) {
                final Term term = ClauseTerms.textTerm(field, tokens.get(i).text());
                final boolean prefix = lastIsPrefix && i == tokens.size() - 1;
                builder.add(prefix ? new PrefixQuery(term) : new TermQuery(term), occur);
            }
            return builder.build();
        }

        private Query phraseQuery(final ResolvedField field, final List<Token> tokens, final int slop) {
            final PhraseQuery.Builder builder = new PhraseQuery.Builder();
            for (final Token token : tokens) {
                builder.add(ClauseTerms.textTerm(field, token.text()), token.position());
            }
            builder.setSlop(slop);
            return builder.build();
        }

        @Override
        public void visitPhrasePrefix(final de.mirkosertic.querywarmup.ast.PhrasePrefixQuery phrasePrefixQuery)
                throws InvalidQueryException {
            result = leaf(phrasePrefixQuery.lenient(), () -> {
                final ClauseTerms.AnalyzedPhrase phrase =
                        ClauseTerms.analyzePhrasePrefix(phrasePrefixQuery, schema, tokenizers);
                if (phrase.isEmpty()) {
                    return zeroTerms(phrasePrefixQuery.params());
                }
                final int slop = phrasePrefixQuery.params().mode() instanceof FullTextMode.Phrase phraseMode
                        ? phraseMode.slop()
                        : 0;
                return PhrasePrefixQuery.of(phrase, phrasePrefixQuery.maxExpansions(), slop);
            });
        }

        @Override
        public void visitWildcard(final de.mirkosertic.querywarmup.ast.WildcardQuery wildcardQuery)
                throws InvalidQueryException {
            result = leaf(wildcardQuery.lenient(), () -> {
                final Optional<Term> prefix = ClauseTerms.wildcardPrefixTerm(wildcardQuery, schema, tokenizers);
                if (prefix.isPresent()) {
                    return new PrefixQuery(prefix.get());
                }
                final ResolvedField field = FieldResolver.resolve(wildcardQuery.field(), schema);
                final String pattern = ClauseTerms.normalize(field, wildcardQuery.value(), tokenizers).utf8ToString();
                if (field.isJson()) {
                    final String framed = escapeWildcard(field.jsonPath()) + (char) TermEncoder.JSON_END_OF_PATH
                            + (char) TermEncoder.JSON_TYPE_STR + pattern;
                    return new WildcardQuery(new Term(field.luceneFieldName(), framed));
                }
                return new WildcardQuery(new Term(field.luceneFieldName(), pattern));
            });
        }

        @Override
        public void visitRange(final RangeQuery rangeQuery) throws InvalidQueryException {
            result = leaf(rangeQuery.lenient(), () -> compileRange(rangeQuery));
        }

        private Query compileRange(final RangeQuery range) throws InvalidQueryException {
            final ResolvedField field = FieldResolver.resolve(range.field(), schema);
            if (field.isJson()) {
                throw InvalidQueryException.schemaError(
                        "range queries are not supported on json fields (`" + range.field() + "`)");
            }
            final FieldEntry entry = field.entry();
            if (!entry.fast()) {
                throw InvalidQueryException.notAFastField("range", range.field());
            }
            if (entry.type() == FieldType.IP_ADDR) {
                return bytesRange(entry, range.lowerBound().map(value ->
                        TermEncoder.ipBytes(TermEncoder.parseIp(entry.name(), value))),
                        range.upperBound().map(value ->
                                TermEncoder.ipBytes(TermEncoder.parseIp(entry.name(), value))));
            }
            if (entry.type() == FieldType.TEXT) {
                return bytesRange(entry, range.lowerBound().map(value -> ClauseTerms.normalize(field, value, tokenizers)),
                        range.upperBound().map(value -> ClauseTerms.normalize(field, value, tokenizers)));
            }

            final Bound<Long> lowerBound = range.lowerBound().map(value -> TermEncoder.toSortableLong(entry, value));
            final Bound<Long> upperBound = range.upperBound().map(value -> TermEncoder.toSortableLong(entry, value));
            long lower = Long.MIN_VALUE;
            long upper = Long.MAX_VALUE;
            if (lowerBound instanceof Bound.Included<Long> included) {
                lower = included.value();
            } else if (lowerBound instanceof Bound.Excluded<Long> excluded) {
                if (excluded.value() == Long.MAX_VALUE) {
                    return new MatchNoDocsQuery("empty range on " + range.field());
                }
                lower = excluded.value() + 1;
            }
            if (upperBound instanceof Bound.Included<Long> included) {
                upper = included.value();
            } else if (upperBound instanceof Bound.Excluded<Long> excluded) {
                if (excluded.value() == Long.MIN_VALUE) {
                    return new MatchNoDocsQuery("empty range on " + range.field());
                }
                upper = excluded.value() - 1;
            }
            if (lower > upper) {
                return new MatchNoDocsQuery("empty range on " + range.field());
            }
            return SortedNumericDocValuesField.newSlowRangeQuery(entry.name(), lower, upper);
        }

        private Query bytesRange(final FieldEntry entry, final Bound<BytesRef> lower, final Bound<BytesRef> upper) {
            return SortedSetDocValuesField.newSlowRangeQuery(entry.name(), lower.valueOrNull(), upper.valueOrNull(),
                    lower instanceof Bound.Included, upper instanceof Bound.Included);
        }

        @Override
        public void visitExists(final FieldPresenceQuery fieldPresenceQuery) throws InvalidQueryException {
            result = leaf(false, () -> {
                final ResolvedField field = FieldResolver.resolve(fieldPresenceQuery.field(), schema);
                if (field.hasColumnarPresence()) {
                    return new FieldExistsQuery(field.luceneFieldName());
                }
                if (schema.recordsFieldPresence()) {
                    return new TermQuery(new Term(Schema.FIELD_PRESENCE_FIELD_NAME, field.presencePath()));
                }
                throw InvalidQueryException.notAFastField("field presence", fieldPresenceQuery.field());
            });
        }

        @Override
        public void visitUserText(final UserInputQuery userInputQuery) throws InvalidQueryException {
            throw InvalidQueryException.userQueryNotParsed();
        }

        /**
         * Compiles a leaf, turning a missing field into a match none when that is allowed.
         */
        private Query leaf(final boolean lenient, final LeafCompiler compiler) throws InvalidQueryException {
            try {
                return compiler.compile();
            } catch (final FieldDoesNotExistException e) {
                if (validate && !lenient) {
                    throw e;
                }
                logger.debug("Clause on missing field {} matches nothing", e.getFieldName());
                return new MatchNoDocsQuery(e.getMessage());
            }
        }

        /**
         * The term bytes an exact value may be indexed as.
         */
        private List<BytesRef> valueTerms(final ResolvedField field, final String fieldName, final String value)
                throws InvalidQueryException {
            requireIndexed(field, fieldName);
            final FieldEntry entry = field.entry();
            if (entry.type() == FieldType.TEXT) {
                return List.of(ClauseTerms.normalize(field, value, tokenizers));
            }
            if (entry.type() == FieldType.JSON) {
                final List<BytesRef> terms = new ArrayList<>();
                terms.add(TermEncoder.jsonTerm(field.jsonPath(), TermEncoder.JSON_TYPE_STR,
                        ClauseTerms.normalize(field, value, tokenizers)));
                terms.addAll(TermEncoder.jsonLiteralTerms(field.jsonPath(), value));
                return terms;
            }
            return List.of(TermEncoder.encodeValue(entry, value));
        }

        private Query disjunction(final ResolvedField field, final List<BytesRef> terms) {
            if (terms.size() == 1) {
                return new TermQuery(new Term(field.luceneFieldName(), terms.get(0)));
            }
            final BooleanQuery.Builder builder = new BooleanQuery.Builder();
            for (final BytesRef bytes : terms) {
                builder.add(new TermQuery(new Term(field.luceneFieldName(), bytes)), BooleanClause.Occur.SHOULD);
            }
            return builder.build();
        }

        private static void requireIndexed(final ResolvedField field, final String fieldName)
                throws InvalidQueryException {
            if (!field.entry().indexed()) {
                throw InvalidQueryException.schemaError("field `" + fieldName + "` is not indexed");
            }
        }

        private static Query zeroTerms(final FullTextParams params) {
            return params.zeroTermsQuery() == ZeroTermsQuery.MATCH_ALL
                    ? new MatchAllDocsQuery()
                    : new MatchNoDocsQuery("no tokens");
        }

        private static String escapeWildcard(final String literal) {
            final StringBuilder escaped = new StringBuilder(literal.length());
            for (int i = 0; i < literal.length(); i++) {
                final char c = literal.charAt(i);
                if (c == WildcardQuery.WILDCARD_STRING || c == WildcardQuery.WILDCARD_CHAR
                        || c == WildcardQuery.WILDCARD_ESCAPE) {
                    escaped.append('\\');
                }
                escaped.append(c);
            }
            return escaped.toString();
        }
    }
}
