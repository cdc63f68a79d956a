package de.mirkosertic.querywarmup.ast;

import java.util.List;

/**
 * Recursive traversal over a {@link QueryAst}.
 *
 * <p>Every callback has a default: combinators recurse into their children, leaves do nothing.
 * A concrete visitor overrides the node kinds it cares about. The first callback that throws
 * aborts the whole traversal; no further node is visited.</p>
 *
 * <p>Visitors that cannot fail are declared with {@code E = RuntimeException}, which leaves
 * no checked exception in their signature.</p>
 *
 * @param <E> the exception a callback may raise
 */
public interface QueryAstVisitor<E extends Exception> {

    /**
     * Visits a node and, unless overridden callbacks stop it, all nodes reachable from it.
     * Children of a {@link BoolQuery} are visited in must, must not, should, filter order.
     */
    default void visit(final QueryAst ast) throws E {
        ast.accept(this);
    }

    default void visitBool(final BoolQuery boolQuery) throws E {
        visitAll(boolQuery.must());
        visitAll(boolQuery.mustNot());
        visitAll(boolQuery.should());
        visitAll(boolQuery.filter());
    }

    default void visitBoost(final BoostQuery boostQuery) throws E {
        visit(boostQuery.underlying());
    }

    default void visitMatchAll(final MatchAllQuery matchAllQuery) throws E {
    }

    default void visitMatchNone(final MatchNoneQuery matchNoneQuery) throws E {
    }

    default void visitTerm(final TermQuery termQuery) throws E {
    }

    default void visitTermSet(final TermSetQuery termSetQuery) throws E {
    }

    default void visitFullText(final FullTextQuery fullTextQuery) throws E {
    }

    default void visitPhrasePrefix(final PhrasePrefixQuery phrasePrefixQuery) throws E {
    }

    default void visitWildcard(final WildcardQuery wildcardQuery) throws E {
    }

    default void visitRange(final RangeQuery rangeQuery) throws E {
    }

    default void visitExists(final FieldPresenceQuery fieldPresenceQuery) throws E {
    }

    default void visitUserText(final UserInputQuery userInputQuery) throws E {
    }

    private void visitAll(final List<QueryAst> children) throws E {
        for (final QueryAst child : children) {
            visit(child);
        }
    }
}
