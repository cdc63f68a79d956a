package de.mirkosertic.querywarmup.ast;

import java.util.Objects;

/**
 * Multiplies the score of the underlying query.
 */
public record BoostQuery(QueryAst underlying, float boost) implements QueryAst {

    public BoostQuery {
        Objects.requireNonNull(underlying, "underlying");
    }

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitBoost(this);
    }
}
