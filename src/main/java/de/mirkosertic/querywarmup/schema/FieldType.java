package de.mirkosertic.querywarmup.schema;

/**
 * Declared value type of a schema field.
 */
public enum FieldType {
    TEXT("text"),
    U64("u64"),
    I64("i64"),
    F64("f64"),
    BOOL("bool"),
    IP_ADDR("ip"),
    DATETIME("datetime"),
    JSON("json");

    private final String typeName;

    FieldType(final String typeName) {
        this.typeName = typeName;
    }

    /**
     * The name used in doc mappings and error messages.
     */
    public String typeName() {
        return typeName;
    }

    public static FieldType fromTypeName(final String typeName) {
        for (final FieldType type : values()) {
            if (type.typeName.equalsIgnoreCase(typeName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + typeName);
    }
}
