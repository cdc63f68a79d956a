package de.mirkosertic.querywarmup.ast;

public record MatchNoneQuery() implements QueryAst {

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitMatchNone(this);
    }
}
