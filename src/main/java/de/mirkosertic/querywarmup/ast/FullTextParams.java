package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Analysis and matching parameters of full text and phrase prefix clauses.
 *
 * @param tokenizer      tokenizer overriding the field's own one, if set
 * @param mode           how tokens are matched
 * @param zeroTermsQuery what the clause matches when no token is left
 */
public record FullTextParams(
        @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable String tokenizer,
        FullTextMode mode,
        @JsonProperty("zero_terms_query") ZeroTermsQuery zeroTermsQuery
) {

    public FullTextParams {
        if (mode == null) {
            mode = new FullTextMode.PhraseFallbackToIntersection();
        }
        if (zeroTermsQuery == null) {
            zeroTermsQuery = ZeroTermsQuery.MATCH_NONE;
        }
    }

    public static FullTextParams of(final FullTextMode mode) {
        return new FullTextParams(null, mode, ZeroTermsQuery.MATCH_NONE);
    }
}
