package de.mirkosertic.querywarmup.ast;

import java.util.Objects;

/**
 * Matches documents that have any value for the field.
 */
public record FieldPresenceQuery(String field) implements QueryAst {

    public FieldPresenceQuery {
        Objects.requireNonNull(field, "field");
    }

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitExists(this);
    }
}
