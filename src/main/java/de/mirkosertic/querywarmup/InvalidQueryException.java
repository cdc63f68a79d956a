package de.mirkosertic.querywarmup;

/**
 * Signals a query that cannot be turned into an executable query against a given schema.
 */
public class InvalidQueryException extends Exception {

    /**
     * Broad categories of invalid queries. Callers use them to tell clauses that are
     * nullified during compilation apart from genuine misconfigurations.
     */
    public enum Reason {
        SCHEMA_ERROR,
        FIELD_DOES_NOT_EXIST,
        EXPECTED_VALUE_TYPE,
        NOT_A_FAST_FIELD,
        USER_QUERY_NOT_PARSED,
        OTHER
    }

    private final Reason reason;

    public InvalidQueryException(final Reason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public static InvalidQueryException schemaError(final String message) {
        return new InvalidQueryException(Reason.SCHEMA_ERROR, message);
    }

    public static InvalidQueryException notAFastField(final String queryKind, final String fieldName) {
        return new InvalidQueryException(Reason.NOT_A_FAST_FIELD,
                queryKind + " queries are only supported for fast fields. (`" + fieldName + "` is not a fast field)");
    }

    public static InvalidQueryException expectedValueType(final String expectedType, final String fieldName,
                                                          final String value) {
        return new InvalidQueryException(Reason.EXPECTED_VALUE_TYPE,
                "expected a `" + expectedType + "` search value for field `" + fieldName + "`, got `" + value + "`");
    }

    public static InvalidQueryException userQueryNotParsed() {
        return new InvalidQueryException(Reason.USER_QUERY_NOT_PARSED,
                "user input query must be parsed before building a query");
    }

    public static InvalidQueryException other(final String message) {
        return new InvalidQueryException(Reason.OTHER, message);
    }
}
