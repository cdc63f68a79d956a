package de.mirkosertic.querywarmup.ast;

import java.util.Objects;

/**
 * A pattern where {@code *} matches any sequence and {@code ?} any single character.
 * A backslash escapes the next character.
 */
public record WildcardQuery(String field, String value, boolean lenient) implements QueryAst {

    public WildcardQuery {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitWildcard(this);
    }
}
