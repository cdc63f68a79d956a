package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Immutable, structured representation of a search query.
 *
 * <p>Combinators ({@link BoolQuery}, {@link BoostQuery}) compose leaves. Every node kind
 * dispatches to its own {@link QueryAstVisitor} callback, so traversals are exhaustive over the
 * closed set of node kinds listed in {@code permits}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BoolQuery.class, name = "bool"),
        @JsonSubTypes.Type(value = BoostQuery.class, name = "boost"),
        @JsonSubTypes.Type(value = MatchAllQuery.class, name = "match_all"),
        @JsonSubTypes.Type(value = MatchNoneQuery.class, name = "match_none"),
        @JsonSubTypes.Type(value = TermQuery.class, name = "term"),
        @JsonSubTypes.Type(value = TermSetQuery.class, name = "term_set"),
        @JsonSubTypes.Type(value = FullTextQuery.class, name = "full_text"),
        @JsonSubTypes.Type(value = PhrasePrefixQuery.class, name = "phrase_prefix"),
        @JsonSubTypes.Type(value = WildcardQuery.class, name = "wildcard"),
        @JsonSubTypes.Type(value = RangeQuery.class, name = "range"),
        @JsonSubTypes.Type(value = FieldPresenceQuery.class, name = "field_presence"),
        @JsonSubTypes.Type(value = UserInputQuery.class, name = "user_text")
})
public sealed interface QueryAst permits BoolQuery, BoostQuery, MatchAllQuery, MatchNoneQuery, TermQuery,
        TermSetQuery, FullTextQuery, PhrasePrefixQuery, WildcardQuery, RangeQuery, FieldPresenceQuery,
        UserInputQuery {

    /**
     * Calls the visitor callback matching this node kind.
     */
    <E extends Exception> void accept(QueryAstVisitor<E> visitor) throws E;
}
