package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * How the tokens of a full text clause are matched.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FullTextMode.Bool.class, name = "bool"),
        @JsonSubTypes.Type(value = FullTextMode.BoolPrefix.class, name = "bool_prefix"),
        @JsonSubTypes.Type(value = FullTextMode.Phrase.class, name = "phrase"),
        @JsonSubTypes.Type(value = FullTextMode.PhraseFallbackToIntersection.class,
                name = "phrase_fallback_to_intersection")
})
public sealed interface FullTextMode {

    /**
     * Each token is a clause, combined with the operator.
     */
    record Bool(BooleanOperand operator) implements FullTextMode {
        public Bool {
            Objects.requireNonNull(operator, "operator");
        }
    }

    /**
     * Like {@link Bool}, the last token being matched as a prefix.
     */
    record BoolPrefix(BooleanOperand operator,
                      @JsonProperty("max_expansions") int maxExpansions) implements FullTextMode {
        public BoolPrefix {
            Objects.requireNonNull(operator, "operator");
        }
    }

    /**
     * Tokens must appear in order, with at most {@code slop} moves.
     */
    record Phrase(int slop) implements FullTextMode {
    }

    /**
     * A phrase on fields recording positions, a conjunction of tokens on the others.
     */
    record PhraseFallbackToIntersection() implements FullTextMode {
    }
}
