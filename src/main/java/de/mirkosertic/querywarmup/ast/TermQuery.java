package de.mirkosertic.querywarmup.ast;

import java.util.Objects;

/**
 * Matches documents whose field holds exactly the given value. The value is normalized,
 * not tokenized.
 */
public record TermQuery(String field, String value) implements QueryAst {

    public TermQuery {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitTerm(this);
    }
}
