package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Boolean composition of sub queries.
 *
 * @param must               clauses every match must satisfy (scored)
 * @param mustNot            clauses no match may satisfy
 * @param should             optional clauses
 * @param filter             clauses every match must satisfy (not scored)
 * @param minimumShouldMatch minimum number of should clauses a match satisfies, if set
 */
public record BoolQuery(
        List<QueryAst> must,
        @JsonProperty("must_not") List<QueryAst> mustNot,
        List<QueryAst> should,
        List<QueryAst> filter,
        @JsonProperty("minimum_should_match") @JsonInclude(JsonInclude.Include.NON_NULL)
        @Nullable Integer minimumShouldMatch
) implements QueryAst {

    public BoolQuery {
        must = must == null ? List.of() : List.copyOf(must);
        mustNot = mustNot == null ? List.of() : List.copyOf(mustNot);
        should = should == null ? List.of() : List.copyOf(should);
        filter = filter == null ? List.of() : List.copyOf(filter);
    }

    public static BoolQuery ofMust(final List<QueryAst> clauses) {
        return new BoolQuery(clauses, List.of(), List.of(), List.of(), null);
    }

    public static BoolQuery ofMustNot(final List<QueryAst> clauses) {
        return new BoolQuery(List.of(), clauses, List.of(), List.of(), null);
    }

    public static BoolQuery ofShould(final List<QueryAst> clauses) {
        return new BoolQuery(List.of(), List.of(), clauses, List.of(), null);
    }

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitBool(this);
    }
}
