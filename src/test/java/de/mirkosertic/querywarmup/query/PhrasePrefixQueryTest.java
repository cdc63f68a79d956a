package de.mirkosertic.querywarmup.query;

import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.QueryVisitor;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PhrasePrefixQuery Tests")
class PhrasePrefixQueryTest {

    private Directory directory;
    private DirectoryReader reader;
    private IndexSearcher searcher;

    @BeforeEach
    void setUp() throws IOException {
        directory = new ByteBuffersDirectory();
        try (IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(new WhitespaceAnalyzer()))) {
            addDocument(writer, "quick brown fox");
            addDocument(writer, "quick brown fix");
            // Second segment
            writer.commit();
            addDocument(writer, "quick brownie");
            addDocument(writer, "slow brown fox");
        }
        reader = DirectoryReader.open(directory);
        searcher = new IndexSearcher(reader);
    }

    @AfterEach
    void tearDown() throws IOException {
        reader.close();
        directory.close();
    }

    private static void addDocument(final IndexWriter writer, final String title) throws IOException {
        final Document document = new Document();
        document.add(new TextField("title", title, Field.Store.NO));
        writer.addDocument(document);
    }

    private static PhrasePrefixQuery prefixOnly(final String prefix, final int maxExpansions) {
        return new PhrasePrefixQuery(List.of(), List.of(), new Term("title", prefix), 0, maxExpansions, 0);
    }

    @Test
    @DisplayName("Should expand the prefix over all segments in byte order")
    void shouldExpandAcrossSegments() throws IOException {
        assertThat(reader.leaves()).hasSizeGreaterThan(1);

        assertThat(prefixOnly("br", 50).expandPrefix(reader))
                .containsExactly(new Term("title", "brown"), new Term("title", "brownie"));
    }

    @Test
    @DisplayName("Should keep only the smallest expansions")
    void shouldLimitExpansions() throws IOException {
        assertThat(prefixOnly("f", 1).expandPrefix(reader)).containsExactly(new Term("title", "fix"));
    }

    @Test
    @DisplayName("Should rewrite a lone prefix to its expansions")
    void shouldRewriteLonePrefix() throws IOException {
        assertThat(searcher.rewrite(prefixOnly("fi", 50))).isEqualTo(new TermQuery(new Term("title", "fix")));
        assertThat(searcher.count(prefixOnly("br", 50))).isEqualTo(4);
    }

    @Test
    @DisplayName("Should match the phrase with any expansion at the prefix position")
    void shouldMatchPhrase() throws IOException {
        final PhrasePrefixQuery query = new PhrasePrefixQuery(
                List.of(new Term("title", "quick"), new Term("title", "brown")), List.of(0, 1),
                new Term("title", "f"), 2, 50, 0);

        assertThat(searcher.count(query)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should match nothing when no term starts with the prefix")
    void shouldMatchNothingWithoutExpansions() throws IOException {
        final PhrasePrefixQuery query = new PhrasePrefixQuery(List.of(new Term("title", "quick")), List.of(0),
                new Term("title", "zz"), 1, 50, 0);

        assertThat(searcher.rewrite(query)).isInstanceOf(MatchNoDocsQuery.class);
        assertThat(searcher.count(query)).isZero();
    }

    @Test
    @DisplayName("Should report only the phrase terms to visitors")
    void shouldVisitPhraseTermsOnly() {
        final PhrasePrefixQuery query = new PhrasePrefixQuery(List.of(new Term("title", "quick")), List.of(0),
                new Term("title", "br"), 1, 50, 0);
        final Set<Term> terms = new HashSet<>();

        query.visit(QueryVisitor.termCollector(terms));

        assertThat(terms).containsExactly(new Term("title", "quick"));
    }

    @Test
    @DisplayName("Should reject terms of other fields and non positive limits")
    void shouldValidateArguments() {
        assertThatThrownBy(() -> new PhrasePrefixQuery(List.of(new Term("desc", "a")), List.of(0),
                new Term("title", "b"), 1, 50, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> prefixOnly("a", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should print as a phrase with a starred last term")
    void shouldPrintReadably() {
        final PhrasePrefixQuery query = new PhrasePrefixQuery(List.of(new Term("title", "quick")), List.of(0),
                new Term("title", "br"), 1, 50, 2);

        assertThat(query.toString()).isEqualTo("title:\"quick br*\"~2");
        assertThat(query.toString("title")).isEqualTo("\"quick br*\"~2");
    }
}
