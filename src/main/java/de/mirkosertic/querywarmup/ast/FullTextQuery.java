package de.mirkosertic.querywarmup.ast;

import java.util.Objects;

/**
 * Analyzed text matched against a field according to {@link FullTextParams#mode()}.
 *
 * @param lenient whether a missing field turns this clause into a match none instead of an error
 */
public record FullTextQuery(String field, String text, FullTextParams params, boolean lenient) implements QueryAst {

    public FullTextQuery {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(text, "text");
        if (params == null) {
            params = FullTextParams.of(new FullTextMode.PhraseFallbackToIntersection());
        }
    }

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitFullText(this);
    }
}
