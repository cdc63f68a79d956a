package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Matches documents holding any of the listed values, per field.
 * Fields and values are kept sorted so that traversal order is deterministic.
 */
public record TermSetQuery(
        @JsonProperty("terms_per_field") Map<String, Set<String>> termsPerField
) implements QueryAst {

    public TermSetQuery {
        final SortedMap<String, Set<String>> sorted = new TreeMap<>();
        if (termsPerField != null) {
            for (final Map.Entry<String, Set<String>> entry : termsPerField.entrySet()) {
                sorted.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
            }
        }
        termsPerField = Collections.unmodifiableSortedMap(sorted);
    }

    public static TermSetQuery of(final String field, final Set<String> values) {
        return new TermSetQuery(Map.of(field, values));
    }

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitTermSet(this);
    }
}
