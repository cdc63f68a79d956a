package de.mirkosertic.querywarmup.schema;

import java.util.List;
import java.util.Objects;

/**
 * A text field indexing the values of other fields.
 *
 * @param name                 name of the text field receiving the values
 * @param sources              names of the declared fields whose values are copied
 * @param includeDynamicFields whether values of undeclared fields are copied too
 */
public record ConcatenateField(String name, List<String> sources, boolean includeDynamicFields) {

    public ConcatenateField {
        Objects.requireNonNull(name, "name");
        sources = List.copyOf(sources);
    }

    public boolean copies(final String sourceName, final boolean dynamic) {
        return dynamic ? includeDynamicFields : sources.contains(sourceName);
    }
}
