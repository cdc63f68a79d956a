package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import de.mirkosertic.querywarmup.util.Bound;

import java.util.Objects;

/**
 * Matches values between two bounds. Bound values are literals, interpreted according to the
 * field type when the query is compiled.
 */
public record RangeQuery(
        String field,
        @JsonProperty("lower_bound")
        @JsonSerialize(using = BoundJson.Serializer.class)
        @JsonDeserialize(using = BoundJson.Deserializer.class)
        Bound<String> lowerBound,
        @JsonProperty("upper_bound")
        @JsonSerialize(using = BoundJson.Serializer.class)
        @JsonDeserialize(using = BoundJson.Deserializer.class)
        Bound<String> upperBound,
        boolean lenient
) implements QueryAst {

    public RangeQuery {
        Objects.requireNonNull(field, "field");
        if (lowerBound == null) {
            lowerBound = Bound.unbounded();
        }
        if (upperBound == null) {
            upperBound = Bound.unbounded();
        }
    }

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitRange(this);
    }
}
