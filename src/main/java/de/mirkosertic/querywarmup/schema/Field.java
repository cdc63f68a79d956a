package de.mirkosertic.querywarmup.schema;

/**
 * Stable identifier of a schema field: its position in the schema.
 */
public record Field(int fieldId) implements Comparable<Field> {

    public Field {
        if (fieldId < 0) {
            throw new IllegalArgumentException("field id must not be negative: " + fieldId);
        }
    }

    @Override
    public int compareTo(final Field other) {
        return Integer.compare(fieldId, other.fieldId);
    }

    @Override
    public String toString() {
        return "Field(" + fieldId + ")";
    }
}
