package de.mirkosertic.querywarmup.schema;

/**
 * Outcome of resolving a field name: the schema field, its entry and, for JSON
 * fields, the path inside the JSON object ({@code ""} for non JSON fields).
 */
public record ResolvedField(Field field, FieldEntry entry, String jsonPath) {

    public boolean isJson() {
        return entry.type() == FieldType.JSON;
    }

    /**
     * Whether presence of this field is checked on its doc values. JSON fields keep no doc values
     * per path, their presence goes through the marker field.
     */
    public boolean hasColumnarPresence() {
        return entry.fast() && !isJson();
    }

    /**
     * The Lucene field name terms and doc values of this field are indexed under.
     */
    public String luceneFieldName() {
        return entry.name();
    }

    /**
     * The value recorded in the field presence marker field for documents populating this field.
     */
    public String presencePath() {
        return jsonPath.isEmpty() ? entry.name() : entry.name() + "." + jsonPath;
    }
}
