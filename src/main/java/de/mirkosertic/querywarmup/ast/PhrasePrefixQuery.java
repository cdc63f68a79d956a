package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A phrase whose last token is matched as a prefix, expanded to at most {@code maxExpansions}
 * terms.
 */
public record PhrasePrefixQuery(
        String field,
        String phrase,
        @JsonProperty("max_expansions") int maxExpansions,
        FullTextParams params,
        boolean lenient
) implements QueryAst {

    public static final int DEFAULT_MAX_EXPANSIONS = 50;

    public PhrasePrefixQuery {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(phrase, "phrase");
        if (maxExpansions <= 0) {
            maxExpansions = DEFAULT_MAX_EXPANSIONS;
        }
        if (params == null) {
            params = FullTextParams.of(new FullTextMode.Phrase(0));
        }
    }

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitPhrasePrefix(this);
    }
}
