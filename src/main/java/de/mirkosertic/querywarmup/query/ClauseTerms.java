package de.mirkosertic.querywarmup.query;

import de.mirkosertic.querywarmup.FieldDoesNotExistException;
import de.mirkosertic.querywarmup.InvalidQueryException;
import de.mirkosertic.querywarmup.ast.FullTextMode;
import de.mirkosertic.querywarmup.ast.FullTextParams;
import de.mirkosertic.querywarmup.ast.FullTextQuery;
import de.mirkosertic.querywarmup.ast.PhrasePrefixQuery;
import de.mirkosertic.querywarmup.ast.WildcardQuery;
import de.mirkosertic.querywarmup.schema.FieldResolver;
import de.mirkosertic.querywarmup.schema.FieldType;
import de.mirkosertic.querywarmup.schema.ResolvedField;
import de.mirkosertic.querywarmup.schema.Schema;
import de.mirkosertic.querywarmup.schema.TermEncoder;
import de.mirkosertic.querywarmup.tokenizer.Token;
import de.mirkosertic.querywarmup.tokenizer.TokenizerManager;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.index.Term;
import org.apache.lucene.util.BytesRef;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the text carried by full text, phrase prefix and wildcard clauses into index terms.
 *
 * <p>The compiler and the warm-up collectors both go through this class, so the terms a compiled
 * query looks up are exactly the terms the warm-up plan names.</p>
 */
public final class ClauseTerms {

    private ClauseTerms() {
    }

    /**
     * The analyzed phrase of a phrase prefix clause. The last term is the prefix, the preceding
     * ones must match exactly at their positions.
     */
    public record AnalyzedPhrase(ResolvedField field, List<Term> terms, List<Integer> positions) {

        public AnalyzedPhrase {
            terms = List.copyOf(terms);
            positions = List.copyOf(positions);
            if (terms.size() != positions.size()) {
                throw new IllegalArgumentException("Each term needs a position");
            }
        }

        public boolean isEmpty() {
            return terms.isEmpty();
        }

        public Term prefixTerm() {
            return terms.get(terms.size() - 1);
        }

        public int prefixPosition() {
            return positions.get(positions.size() - 1);
        }

        public List<Term> phraseTerms() {
            return terms.subList(0, terms.size() - 1);
        }

        public List<Integer> phrasePositions() {
            return positions.subList(0, positions.size() - 1);
        }

        /**
         * A phrase of several tokens has to check adjacency, which needs positions.
         */
        public boolean needsPositions() {
            return terms.size() > 1;
        }
    }

    /**
     * The prefix term of a full text clause in {@link FullTextMode.BoolPrefix} mode: its last token.
     * Other modes, unknown fields, non text fields and texts without tokens have none.
     */
    public static Optional<Term> fullTextPrefixTerm(final FullTextQuery query, final Schema schema,
                                                    final TokenizerManager tokenizers) throws InvalidQueryException {
        if (!(query.params().mode() instanceof FullTextMode.BoolPrefix)) {
            return Optional.empty();
        }
        final ResolvedField field;
        try {
            field = FieldResolver.resolve(query.field(), schema);
        } catch (final FieldDoesNotExistException e) {
            // The compiler nullifies or rejects this clause
            return Optional.empty();
        }
        if (!isTextual(field)) {
            return Optional.empty();
        }
        final List<Token> tokens = tokenize(field, query.text(), query.params(), tokenizers);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(textTerm(field, tokens.get(tokens.size() - 1).text()));
    }

    /**
     * Analyzes the phrase of a phrase prefix clause.
     *
     * @throws FieldDoesNotExistException if the field cannot be resolved
     * @throws InvalidQueryException      with {@link InvalidQueryException.Reason#SCHEMA_ERROR} if the field is
     *                                    not a text field or a multi token phrase targets a field without positions
     */
    public static AnalyzedPhrase analyzePhrasePrefix(final PhrasePrefixQuery query, final Schema schema,
                                                     final TokenizerManager tokenizers) throws InvalidQueryException {
        final ResolvedField field = FieldResolver.resolve(query.field(), schema);
        requireTextual(field, query.field(), "phrase prefix");
        final List<Token> tokens = tokenize(field, query.phrase(), query.params(), tokenizers);
        if (tokens.size() > 1 && !field.entry().hasPositions()) {
            throw InvalidQueryException.schemaError("trying to run a phrase prefix query on field `" + query.field()
                    + "` which does not have positions indexed");
        }
        final List<Term> terms = new ArrayList<>(tokens.size());
        final List<Integer> positions = new ArrayList<>(tokens.size());
        for (final Token token : tokens) {
            terms.add(textTerm(field, token.text()));
            positions.add(token.position());
        }
        return new AnalyzedPhrase(field, terms, positions);
    }

    /**
     * The prefix term of a wildcard clause whose pattern is a literal followed by a single trailing
     * {@code *}. The literal is normalized with the field's analyzer.
     *
     * @throws FieldDoesNotExistException if the field cannot be resolved
     * @throws InvalidQueryException      if the field is not a text field or the pattern is malformed
     */
    public static Optional<Term> wildcardPrefixTerm(final WildcardQuery query, final Schema schema,
                                                    final TokenizerManager tokenizers) throws InvalidQueryException {
        final ResolvedField field = FieldResolver.resolve(query.field(), schema);
        requireTextual(field, query.field(), "wildcard");
        final Optional<String> prefix = literalPrefix(query.value());
        if (prefix.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(textTerm(field, normalize(field, prefix.get(), tokenizers)));
    }

    /**
     * Returns the unescaped literal of a {@code literal*} pattern, or nothing for any other shape.
     *
     * @throws InvalidQueryException if the pattern ends with a dangling escape
     */
    public static Optional<String> literalPrefix(final String pattern) throws InvalidQueryException {
        final StringBuilder literal = new StringBuilder();
        boolean prefixOnly = true;
        for (int i = 0; i < pattern.length(); i++) {
            final char c = pattern.charAt(i);
            if (c == '\\') {
                if (i + 1 == pattern.length()) {
                    throw InvalidQueryException.other("wildcard pattern `" + pattern + "` ends with a dangling escape");
                }
                literal.append(pattern.charAt(++i));
            } else if (c == '*' && i == pattern.length() - 1) {
                return prefixOnly ? Optional.of(literal.toString()) : Optional.empty();
            } else if (c == '*' || c == '?') {
                prefixOnly = false;
            } else {
                literal.append(c);
            }
        }
        return Optional.empty();
    }

    /**
     * Normalizes a single value with the field's analyzer, without splitting it.
     */
    public static BytesRef normalize(final ResolvedField field, final String value, final TokenizerManager tokenizers)
            throws InvalidQueryException {
        if (value.isEmpty()) {
            return new BytesRef();
        }
        return analyzer(field, null, tokenizers).normalize(field.luceneFieldName(), value);
    }

    public static List<Token> tokenize(final ResolvedField field, final String text, final FullTextParams params,
                                       final TokenizerManager tokenizers) throws InvalidQueryException {
        return TokenizerManager.tokenize(analyzer(field, params.tokenizer(), tokenizers), field.luceneFieldName(), text);
    }

    static Analyzer analyzer(final ResolvedField field, final @Nullable String tokenizerOverride,
                             final TokenizerManager tokenizers) throws InvalidQueryException {
        final String name = tokenizerOverride != null ? tokenizerOverride : field.entry().tokenizerName();
        return tokenizers.get(name)
                .orElseThrow(() -> InvalidQueryException.schemaError("unknown tokenizer `" + name + "`"));
    }

    /**
     * A string term of a text field, or of a JSON field framed with the field's path.
     */
    public static Term textTerm(final ResolvedField field, final String token) {
        return textTerm(field, new BytesRef(token));
    }

    public static Term textTerm(final ResolvedField field, final BytesRef bytes) {
        if (field.isJson()) {
            return new Term(field.luceneFieldName(),
                    TermEncoder.jsonTerm(field.jsonPath(), TermEncoder.JSON_TYPE_STR, bytes));
        }
        return new Term(field.luceneFieldName(), bytes);
    }

    static boolean isTextual(final ResolvedField field) {
        return field.entry().type() == FieldType.TEXT || field.entry().type() == FieldType.JSON;
    }

    static void requireTextual(final ResolvedField field, final String fieldName, final String queryKind)
            throws InvalidQueryException {
        if (!isTextual(field)) {
            throw InvalidQueryException.schemaError(queryKind + " queries are only supported on text and json fields (`"
                    + fieldName + "` is a `" + field.entry().type().typeName() + "` field)");
        }
    }
}
