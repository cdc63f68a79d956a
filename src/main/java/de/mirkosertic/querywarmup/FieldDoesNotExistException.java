package de.mirkosertic.querywarmup;

/**
 * Thrown when a field name neither matches the schema nor falls back to a JSON field.
 */
public class FieldDoesNotExistException extends InvalidQueryException {

    private final String fieldName;

    public FieldDoesNotExistException(final String fieldName) {
        super(Reason.FIELD_DOES_NOT_EXIST, "field does not exist: `" + fieldName + "`");
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
