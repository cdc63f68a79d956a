package de.mirkosertic.querywarmup.tokenizer;

import de.mirkosertic.querywarmup.schema.FieldEntry;
import de.mirkosertic.querywarmup.schema.FieldType;
import de.mirkosertic.querywarmup.schema.Schema;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.KeywordTokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.en.PorterStemFilter;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.miscellaneous.PerFieldAnalyzerWrapper;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;
import org.apache.lucene.util.BytesRef;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named {@link Analyzer}s used to tokenize text and json fields.
 *
 * <p>The default registry knows:</p>
 * <ul>
 *   <li>{@code default} - standard tokenizer, lower cased, tokens longer than 255 chars dropped</li>
 *   <li>{@code raw} - the whole value as a single token</li>
 *   <li>{@code lowercase} - the whole value as a single lower cased token</li>
 *   <li>{@code whitespace} - split on whitespace, case preserved</li>
 *   <li>{@code en_stem} - like {@code default}, plus Porter stemming</li>
 * </ul>
 * Analyzers are deterministic: the same input always yields the same tokens.
 */
public class TokenizerManager {

    public static final int MAX_TOKEN_LENGTH = 255;

    private final Map<String, Analyzer> analyzers = new ConcurrentHashMap<>();

    public static TokenizerManager createDefault() {
        final TokenizerManager manager = new TokenizerManager();
        manager.register("default", new DefaultAnalyzer(false));
        manager.register("en_stem", new DefaultAnalyzer(true));
        manager.register("raw", new SingleTokenAnalyzer(false));
        manager.register("lowercase", new SingleTokenAnalyzer(true));
        manager.register("whitespace", new WhitespaceOnlyAnalyzer());
        return manager;
    }

    public void register(final String name, final Analyzer analyzer) {
        analyzers.put(name, analyzer);
    }

    public Optional<Analyzer> get(final String name) {
        return Optional.ofNullable(analyzers.get(name));
    }

    /**
     * Tokenizes a text with the named analyzer.
     *
     * @throws IllegalArgumentException if no analyzer is registered under that name
     */
    public List<Token> tokenize(final String tokenizerName, final String fieldName, final String text) {
        final Analyzer analyzer = get(tokenizerName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tokenizer: " + tokenizerName));
        return tokenize(analyzer, fieldName, text);
    }

    /**
     * Runs an analyzer over a text and returns its tokens with their positions.
     */
    public static List<Token> tokenize(final Analyzer analyzer, final String fieldName, final String text) {
        final List<Token> tokens = new ArrayList<>();
        try (TokenStream stream = analyzer.tokenStream(fieldName, text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            final PositionIncrementAttribute increment = stream.addAttribute(PositionIncrementAttribute.class);
            stream.reset();
            int position = -1;
            while (stream.incrementToken()) {
                position += increment.getPositionIncrement();
                tokens.add(new Token(position, term.toString()));
            }
            stream.end();
        } catch (final IOException e) {
            // Analyzers read from a StringReader here
            throw new UncheckedIOException("Failed to tokenize field " + fieldName, e);
        }
        return tokens;
    }

    /**
     * Normalizes a single value (for instance lower casing it) without splitting it into tokens.
     */
    public BytesRef normalize(final String tokenizerName, final String fieldName, final String value) {
        return get(tokenizerName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tokenizer: " + tokenizerName))
                .normalize(fieldName, value);
    }

    /**
     * Builds the analyzer an {@link org.apache.lucene.index.IndexWriter} should use for documents of
     * the given schema: each text or json field uses its declared tokenizer.
     */
    public Analyzer perFieldAnalyzer(final Schema schema) {
        final Map<String, Analyzer> perField = new HashMap<>();
        for (final FieldEntry entry : schema.fields()) {
            if (entry.type() == FieldType.TEXT || entry.type() == FieldType.JSON) {
                perField.put(entry.name(), get(entry.tokenizerName())
                        .orElseThrow(() -> new IllegalArgumentException(
                                "Unknown tokenizer " + entry.tokenizerName() + " for field " + entry.name())));
            }
        }
        return new PerFieldAnalyzerWrapper(analyzers.get("raw"), perField);
    }

    private static final class DefaultAnalyzer extends Analyzer {

        private final boolean stem;

        DefaultAnalyzer(final boolean stem) {
            this.stem = stem;
        }

        @Override
        protected TokenStreamComponents createComponents(final String fieldName) {
            final StandardTokenizer source = new StandardTokenizer();
            source.setMaxTokenLength(MAX_TOKEN_LENGTH + 1);
            TokenStream result = new LowerCaseFilter(source);
            result = new LengthFilter(result, 1, MAX_TOKEN_LENGTH);
            if (stem) {
                result = new PorterStemFilter(result);
            }
            return new TokenStreamComponents(source, result);
        }

        @Override
        protected TokenStream normalize(final String fieldName, final TokenStream in) {
            return new LowerCaseFilter(in);
        }
    }

    private static final class SingleTokenAnalyzer extends Analyzer {

        private final boolean lowercase;

        SingleTokenAnalyzer(final boolean lowercase) {
            this.lowercase = lowercase;
        }

        @Override
        protected TokenStreamComponents createComponents(final String fieldName) {
            final Tokenizer source = new KeywordTokenizer();
            return new TokenStreamComponents(source, lowercase ? new LowerCaseFilter(source) : source);
        }

        @Override
        protected TokenStream normalize(final String fieldName, final TokenStream in) {
            return lowercase ? new LowerCaseFilter(in) : in;
        }
    }

    private static final class WhitespaceOnlyAnalyzer extends Analyzer {

        @Override
        protected TokenStreamComponents createComponents(final String fieldName) {
            final Tokenizer source = new WhitespaceTokenizer();
            return new TokenStreamComponents(source);
        }
    }
}
