package de.mirkosertic.querywarmup.query;

import de.mirkosertic.querywarmup.InvalidQueryException;
import de.mirkosertic.querywarmup.TestSchemas;
import de.mirkosertic.querywarmup.ast.BoolQuery;
import de.mirkosertic.querywarmup.ast.BooleanOperand;
import de.mirkosertic.querywarmup.ast.FieldPresenceQuery;
import de.mirkosertic.querywarmup.ast.FullTextMode;
import de.mirkosertic.querywarmup.ast.FullTextParams;
import de.mirkosertic.querywarmup.ast.FullTextQuery;
import de.mirkosertic.querywarmup.ast.QueryAst;
import de.mirkosertic.querywarmup.ast.RangeQuery;
import de.mirkosertic.querywarmup.ast.TermSetQuery;
import de.mirkosertic.querywarmup.ast.UserInputQuery;
import de.mirkosertic.querywarmup.ast.ZeroTermsQuery;
import de.mirkosertic.querywarmup.schema.Schema;
import de.mirkosertic.querywarmup.schema.TermEncoder;
import de.mirkosertic.querywarmup.tokenizer.TokenizerManager;
import de.mirkosertic.querywarmup.util.Bound;
import org.apache.lucene.document.SortedNumericDocValuesField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LuceneQueryCompiler Tests")
class LuceneQueryCompilerTest {

    private final LuceneQueryCompiler compiler = new LuceneQueryCompiler();
    private final TokenizerManager tokenizers = TokenizerManager.createDefault();

    private Query compile(final QueryAst ast) throws InvalidQueryException {
        return compile(ast, TestSchemas.strict(), true);
    }

    private Query compile(final QueryAst ast, final Schema schema, final boolean validate)
            throws InvalidQueryException {
        return compiler.compile(ast, schema, tokenizers, List.of(), validate);
    }

    private static FullTextQuery fullText(final String field, final String text, final FullTextParams params) {
        return new FullTextQuery(field, text, params, false);
    }

    private static FullTextParams withTokenizer(final String tokenizer, final FullTextMode mode) {
        return new FullTextParams(tokenizer, mode, ZeroTermsQuery.MATCH_NONE);
    }

    @Nested
    @DisplayName("Term clauses")
    class TermTests {

        @Test
        @DisplayName("Should normalize the value of a text field")
        void shouldNormalizeTextValue() throws Exception {
            assertThat(compile(new de.mirkosertic.querywarmup.ast.TermQuery("title", "Hello")))
                    .isEqualTo(new TermQuery(new Term("title", "hello")));
        }

        @Test
        @DisplayName("Should encode the value of a numeric field")
        void shouldEncodeNumericValue() throws Exception {
            assertThat(compile(new de.mirkosertic.querywarmup.ast.TermQuery("server.mem", "42")))
                    .isEqualTo(new TermQuery(new Term("server.mem", TermEncoder.sortableBytes(42L ^ Long.MIN_VALUE))));
        }

        @Test
        @DisplayName("Should reject a value that does not fit the field type")
        void shouldRejectWrongValueType() {
            assertThatThrownBy(() -> compile(new de.mirkosertic.querywarmup.ast.TermQuery("server.mem", "lots")))
                    .isInstanceOf(InvalidQueryException.class)
                    .hasMessage("expected a `u64` search value for field `server.mem`, got `lots`");
        }

        @Test
        @DisplayName("Should match a json literal as string and as typed value")
        void shouldMatchJsonLiteralAllWays() throws Exception {
            final Query query = compile(new de.mirkosertic.querywarmup.ast.TermQuery("attributes.size", "42"));

            final BooleanQuery expected = new BooleanQuery.Builder()
                    .add(new TermQuery(new Term("attributes", TermEncoder.jsonStringTerm("size", "42"))),
                            BooleanClause.Occur.SHOULD)
                    .add(new TermQuery(new Term("attributes", TermEncoder.jsonValueTerm("size", 42L))),
                            BooleanClause.Occur.SHOULD)
                    .build();
            assertThat(query).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should compile a term set per field")
        void shouldCompileTermSet() throws Exception {
            assertThat(compile(TermSetQuery.of("title", Set.of("A", "b"))))
                    .isEqualTo(new TermInSetQuery("title", List.of(new BytesRef("a"), new BytesRef("b"))));

            final Query multi = compile(new TermSetQuery(Map.of("title", Set.of("a"), "desc", Set.of("b"))));
            assertThat(multi).isInstanceOf(BooleanQuery.class);
            assertThat(((BooleanQuery) multi).clauses()).hasSize(2)
                    .allSatisfy(clause -> assertThat(clause.getOccur()).isEqualTo(BooleanClause.Occur.SHOULD));
        }
    }

    @Nested
    @DisplayName("Full text clauses")
    class FullTextTests {

        @Test
        @DisplayName("Should compile a phrase on a field with positions")
        void shouldCompilePhrase() throws Exception {
            final Query query = compile(fullText("title", "Quick Fox",
                    FullTextParams.of(new FullTextMode.PhraseFallbackToIntersection())));

            assertThat(query).isEqualTo(new PhraseQuery("title", "quick", "fox"));
        }

        @Test
        @DisplayName("Should fall back to a conjunction on a field without positions")
        void shouldFallBackToConjunction() throws Exception {
            final Query query = compile(fullText("tags", "quick fox",
                    withTokenizer("default", new FullTextMode.PhraseFallbackToIntersection())));

            assertThat(query).isEqualTo(new BooleanQuery.Builder()
                    .add(new TermQuery(new Term("tags", "quick")), BooleanClause.Occur.MUST)
                    .add(new TermQuery(new Term("tags", "fox")), BooleanClause.Occur.MUST)
                    .build());
        }

        @Test
        @DisplayName("Should reject an explicit phrase on a field without positions")
        void shouldRejectPhraseWithoutPositions() {
            assertThatThrownBy(() -> compile(fullText("tags", "quick fox",
                    withTokenizer("default", new FullTextMode.Phrase(0)))))
                    .isInstanceOf(InvalidQueryException.class)
                    .hasMessage("trying to run a phrase query on field `tags` which does not have positions indexed");
        }

        @Test
        @DisplayName("Should expand the last token of a bool prefix clause")
        void shouldCompileBoolPrefix() throws Exception {
            final Query query = compile(fullText("title", "hello wor",
                    FullTextParams.of(new FullTextMode.BoolPrefix(BooleanOperand.OR, 0))));

            assertThat(query).isEqualTo(new BooleanQuery.Builder()
                    .add(new TermQuery(new Term("title", "hello")), BooleanClause.Occur.SHOULD)
                    .add(new PrefixQuery(new Term("title", "wor")), BooleanClause.Occur.SHOULD)
                    .build());
        }

        @Test
        @DisplayName("Should follow the zero terms setting when analysis leaves nothing")
        void shouldFollowZeroTermsSetting() throws Exception {
            assertThat(compile(fullText("title", " !! ", FullTextParams.of(new FullTextMode.Phrase(0)))))
                    .isInstanceOf(MatchNoDocsQuery.class);
            assertThat(compile(fullText("title", " !! ",
                    new FullTextParams(null, new FullTextMode.Phrase(0), ZeroTermsQuery.MATCH_ALL))))
                    .isInstanceOf(MatchAllDocsQuery.class);
        }

        @Test
        @DisplayName("Should compile a phrase prefix into the project phrase prefix query")
        void shouldCompilePhrasePrefix() throws Exception {
            final Query query = compile(new de.mirkosertic.querywarmup.ast.PhrasePrefixQuery("title", "Not so sh", 20,
                    null, false));

            assertThat(query).isEqualTo(new PhrasePrefixQuery(
                    List.of(new Term("title", "not"), new Term("title", "so")), List.of(0, 1),
                    new Term("title", "sh"), 2, 20, 0));
        }

        @Test
        @DisplayName("Should compile a prefix pattern to a prefix query and others to wildcard queries")
        void shouldCompileWildcards() throws Exception {
            assertThat(compile(new de.mirkosertic.querywarmup.ast.WildcardQuery("title", "HeL*", false)))
                    .isEqualTo(new PrefixQuery(new Term("title", "hel")));
            assertThat(compile(new de.mirkosertic.querywarmup.ast.WildcardQuery("title", "h?l*", false)))
                    .isEqualTo(new WildcardQuery(new Term("title", "h?l*")));
        }
    }

    @Nested
    @DisplayName("Range clauses")
    class RangeTests {

        @Test
        @DisplayName("Should compile a numeric range to a doc values range")
        void shouldCompileNumericRange() throws Exception {
            final Query query = compile(new RangeQuery("u64_fast", Bound.included("1"), Bound.excluded("10"), false));

            assertThat(query).isEqualTo(SortedNumericDocValuesField.newSlowRangeQuery("u64_fast",
                    1L ^ Long.MIN_VALUE, 9L ^ Long.MIN_VALUE));
        }

        @Test
        @DisplayName("Should compile an empty range to match none")
        void shouldCompileEmptyRange() throws Exception {
            assertThat(compile(new RangeQuery("i64_fast", Bound.excluded("5"), Bound.excluded("6"), false)))
                    .isInstanceOf(MatchNoDocsQuery.class);
            assertThat(compile(new RangeQuery("i64_fast", Bound.excluded(String.valueOf(Long.MAX_VALUE)),
                    Bound.unbounded(), false)))
                    .isInstanceOf(MatchNoDocsQuery.class);
        }

        @Test
        @DisplayName("Should reject a range on a field that is not fast")
        void shouldRejectNonFastField() {
            assertThatThrownBy(() -> compile(new RangeQuery("ip_notff", Bound.included("127.0.0.1"),
                    Bound.included("127.1.1.1"), false)))
                    .isInstanceOf(InvalidQueryException.class)
                    .hasMessage("range queries are only supported for fast fields. (`ip_notff` is not a fast field)")
                    .satisfies(e -> assertThat(((InvalidQueryException) e).getReason())
                            .isEqualTo(InvalidQueryException.Reason.NOT_A_FAST_FIELD));
        }

        @Test
        @DisplayName("Should reject a range on a json path")
        void shouldRejectJsonRange() {
            assertThatThrownBy(() -> compile(new RangeQuery("attributes.size", Bound.included("1"),
                    Bound.unbounded(), false)))
                    .isInstanceOf(InvalidQueryException.class)
                    .satisfies(e -> assertThat(((InvalidQueryException) e).getReason())
                            .isEqualTo(InvalidQueryException.Reason.SCHEMA_ERROR));
        }
    }

    @Nested
    @DisplayName("Presence clauses")
    class PresenceTests {

        @Test
        @DisplayName("Should check doc values of a fast field")
        void shouldUseDocValues() throws Exception {
            assertThat(compile(new FieldPresenceQuery("ip"))).isEqualTo(new FieldExistsQuery("ip"));
        }

        @Test
        @DisplayName("Should use the presence marker for other fields")
        void shouldUsePresenceMarker() throws Exception {
            final Schema schema = TestSchemas.withFieldPresence();

            assertThat(compile(new FieldPresenceQuery("title"), schema, true))
                    .isEqualTo(new TermQuery(new Term(Schema.FIELD_PRESENCE_FIELD_NAME, "title")));
            assertThat(compile(new FieldPresenceQuery("attributes.color"), schema, true))
                    .isEqualTo(new TermQuery(new Term(Schema.FIELD_PRESENCE_FIELD_NAME, "attributes.color")));
        }

        @Test
        @DisplayName("Should reject presence on other fields without the marker")
        void shouldRejectWithoutMarker() {
            assertThatThrownBy(() -> compile(new FieldPresenceQuery("title")))
                    .isInstanceOf(InvalidQueryException.class)
                    .hasMessage("field presence queries are only supported for fast fields. (`title` is not a fast field)");
        }
    }

    @Nested
    @DisplayName("Missing fields")
    class MissingFieldTests {

        @Test
        @DisplayName("Should fail when validating strictly")
        void shouldFailWhenValidating() {
            assertThatThrownBy(() -> compile(new de.mirkosertic.querywarmup.ast.TermQuery("nope", "x")))
                    .isInstanceOf(InvalidQueryException.class)
                    .hasMessage("field does not exist: `nope`");
        }

        @Test
        @DisplayName("Should match nothing without validation")
        void shouldMatchNothingWithoutValidation() throws Exception {
            final Query query = compile(BoolQuery.ofMust(List.of(
                    new de.mirkosertic.querywarmup.ast.TermQuery("nope", "x"),
                    new de.mirkosertic.querywarmup.ast.TermQuery("title", "x"))), TestSchemas.strict(), false);

            assertThat(((BooleanQuery) query).clauses().get(0).getQuery()).isInstanceOf(MatchNoDocsQuery.class);
            assertThat(((BooleanQuery) query).clauses().get(1).getQuery())
                    .isEqualTo(new TermQuery(new Term("title", "x")));
        }

        @Test
        @DisplayName("Should match nothing for a lenient clause even when validating")
        void shouldMatchNothingForLenientClause() throws Exception {
            assertThat(compile(new RangeQuery("nope", Bound.included("1"), Bound.unbounded(), true)))
                    .isInstanceOf(MatchNoDocsQuery.class);
        }

        @Test
        @DisplayName("Should resolve unknown names to the dynamic field when there is one")
        void shouldUseDynamicField() throws Exception {
            final Query query = compile(new de.mirkosertic.querywarmup.ast.TermQuery("color", "red"),
                    TestSchemas.dynamic(), true);

            assertThat(query).isInstanceOf(TermQuery.class);
            assertThat(((TermQuery) query).getTerm().field()).isEqualTo(Schema.DYNAMIC_FIELD_NAME);
        }
    }

    @Nested
    @DisplayName("Combinators")
    class CombinatorTests {

        @Test
        @DisplayName("Should keep the occurrence of every clause")
        void shouldKeepOccurrences() throws Exception {
            final Query query = compile(new BoolQuery(
                    List.of(new de.mirkosertic.querywarmup.ast.TermQuery("title", "a")),
                    List.of(new de.mirkosertic.querywarmup.ast.TermQuery("title", "b")),
                    List.of(new de.mirkosertic.querywarmup.ast.TermQuery("title", "c"),
                            new de.mirkosertic.querywarmup.ast.TermQuery("title", "d")),
                    List.of(new de.mirkosertic.querywarmup.ast.TermQuery("title", "e")),
                    1));

            final BooleanQuery bool = (BooleanQuery) query;
            assertThat(bool.getMinimumNumberShouldMatch()).isEqualTo(1);
            assertThat(bool.clauses()).extracting(BooleanClause::getOccur).containsExactly(
                    BooleanClause.Occur.MUST, BooleanClause.Occur.MUST_NOT, BooleanClause.Occur.SHOULD,
                    BooleanClause.Occur.SHOULD, BooleanClause.Occur.FILTER);
        }

        @Test
        @DisplayName("Should match everything but the negated clauses of a pure negation")
        void shouldCompilePureNegation() throws Exception {
            final Query query = compile(BoolQuery.ofMustNot(List.of(
                    new de.mirkosertic.querywarmup.ast.TermQuery("title", "spam"))));

            assertThat(query).isEqualTo(new BooleanQuery.Builder()
                    .add(new TermQuery(new Term("title", "spam")), BooleanClause.Occur.MUST_NOT)
                    .add(new MatchAllDocsQuery(), BooleanClause.Occur.MUST)
                    .build());
        }

        @Test
        @DisplayName("Should compile an empty bool to match all")
        void shouldCompileEmptyBool() throws Exception {
            assertThat(compile(BoolQuery.ofMust(List.of()))).isInstanceOf(MatchAllDocsQuery.class);
        }

        @Test
        @DisplayName("Should wrap boosted clauses")
        void shouldCompileBoost() throws Exception {
            assertThat(compile(new de.mirkosertic.querywarmup.ast.BoostQuery(
                    new de.mirkosertic.querywarmup.ast.TermQuery("title", "a"), 2.0f)))
                    .isEqualTo(new BoostQuery(new TermQuery(new Term("title", "a")), 2.0f));
        }

        @Test
        @DisplayName("Should reject negative and non finite boosts")
        void shouldRejectInvalidBoost() {
            final QueryAst term = new de.mirkosertic.querywarmup.ast.TermQuery("title", "a");

            assertThatThrownBy(() -> compile(new de.mirkosertic.querywarmup.ast.BoostQuery(term, -1.0f)))
                    .isInstanceOf(InvalidQueryException.class)
                    .hasMessage("boost must be a finite, non-negative number, got -1.0")
                    .satisfies(e -> assertThat(((InvalidQueryException) e).getReason())
                            .isEqualTo(InvalidQueryException.Reason.OTHER));
            assertThatThrownBy(() -> compile(new de.mirkosertic.querywarmup.ast.BoostQuery(term, Float.NaN)))
                    .isInstanceOf(InvalidQueryException.class);
            assertThatThrownBy(() -> compile(new de.mirkosertic.querywarmup.ast.BoostQuery(term,
                    Float.POSITIVE_INFINITY)))
                    .isInstanceOf(InvalidQueryException.class);
        }

        @Test
        @DisplayName("Should refuse unparsed user text")
        void shouldRefuseUserText() {
            assertThatThrownBy(() -> compile(UserInputQuery.of("title:a")))
                    .isInstanceOf(InvalidQueryException.class)
                    .satisfies(e -> assertThat(((InvalidQueryException) e).getReason())
                            .isEqualTo(InvalidQueryException.Reason.USER_QUERY_NOT_PARSED));
        }
    }
}
