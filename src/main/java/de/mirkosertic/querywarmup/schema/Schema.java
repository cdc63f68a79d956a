package de.mirkosertic.querywarmup.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable catalog of the fields of an index.
 *
 * <p>Field ids are assigned in declaration order. A JSON field named {@value #DYNAMIC_FIELD_NAME}
 * acts as dynamic fallback for names that are not declared, and a field named
 * {@value #FIELD_PRESENCE_FIELD_NAME} records which fields each document populates.</p>
 */
public final class Schema {

    public static final String DYNAMIC_FIELD_NAME = "_dynamic";
    public static final String FIELD_PRESENCE_FIELD_NAME = "_field_presence";

    private final List<FieldEntry> entries;
    private final Map<String, Field> fieldsByName;
    private final List<ConcatenateField> concatenateFields;

    private Schema(final List<FieldEntry> entries, final List<ConcatenateField> concatenateFields) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.concatenateFields = List.copyOf(concatenateFields);
        final Map<String, Field> byName = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            byName.put(entries.get(i).name(), new Field(i));
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a declared field by its exact name.
     */
    public Optional<Field> getField(final String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    public FieldEntry getFieldEntry(final Field field) {
        if (field.fieldId() >= entries.size()) {
            throw new IllegalArgumentException("Unknown field: " + field);
        }
        return entries.get(field.fieldId());
    }

    public String getFieldName(final Field field) {
        return getFieldEntry(field).name();
    }

    public List<FieldEntry> fields() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Text fields filled with the values of other fields. Each is also declared as a text field.
     */
    public List<ConcatenateField> concatenateFields() {
        return concatenateFields;
    }

    /**
     * The JSON field absorbing undeclared field names, if the schema has one.
     */
    public Optional<Field> dynamicField() {
        return getField(DYNAMIC_FIELD_NAME)
                .filter(field -> getFieldEntry(field).type() == FieldType.JSON);
    }

    /**
     * Whether documents carry the indexed field presence marker.
     */
    public boolean recordsFieldPresence() {
        return fieldsByName.containsKey(FIELD_PRESENCE_FIELD_NAME);
    }

    @Override
    public String toString() {
        return "Schema" + entries;
    }

    /**
     * Collects field declarations in order.
     */
    public static final class Builder {

        private final List<FieldEntry> entries = new ArrayList<>();
        private final Map<String, Field> names = new HashMap<>();
        private final List<ConcatenateField> concatenateFields = new ArrayList<>();

        private Builder() {
        }

        /**
         * Declares a field and returns its id.
         *
         * @throws IllegalArgumentException if a field with the same name was already declared
         */
        public Field addField(final FieldEntry entry) {
            if (names.containsKey(entry.name())) {
                throw new IllegalArgumentException("Field declared twice: " + entry.name());
            }
            final Field field = new Field(entries.size());
            entries.add(entry);
            names.put(entry.name(), field);
            return field;
        }

        /**
         * Declares a text field receiving the values of {@code sources}.
         */
        public Field addConcatenateField(final FieldEntry entry, final List<String> sources,
                                         final boolean includeDynamicFields) {
            if (entry.type() != FieldType.TEXT) {
                throw new IllegalArgumentException("Concatenate field `" + entry.name() + "` must be a text field");
            }
            final Field field = addField(entry);
            concatenateFields.add(new ConcatenateField(entry.name(), sources, includeDynamicFields));
            return field;
        }

        /**
         * Declares the JSON dynamic fallback field.
         */
        public Field addDynamicField(final String tokenizer) {
            return addField(FieldEntry.json(DYNAMIC_FIELD_NAME).withTokenizer(tokenizer));
        }

        /**
         * Declares the indexed field presence marker.
         */
        public Field addFieldPresenceField() {
            return addField(FieldEntry.text(FIELD_PRESENCE_FIELD_NAME)
                    .withTokenizer("raw")
                    .withRecordOption(IndexRecordOption.BASIC));
        }

        public Schema build() {
            return new Schema(entries, concatenateFields);
        }
    }
}
