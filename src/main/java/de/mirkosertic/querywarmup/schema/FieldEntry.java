package de.mirkosertic.querywarmup.schema;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Declaration of one schema field: its name, value type and capabilities.
 *
 * <p>Entries are immutable; the {@code with*} methods return modified copies so that
 * declarations read fluently:</p>
 * <pre>
 * FieldEntry.text("desc").withStored(true)
 * FieldEntry.of("ip", FieldType.IP_ADDR).withFast(true)
 * </pre>
 *
 * @param name         the field name, may contain dots
 * @param type         the declared value type
 * @param indexed      whether values are searchable through the inverted index
 * @param stored       whether values are kept in the document store
 * @param fast         whether values are kept in columnar (doc values) storage
 * @param tokenizer    the tokenizer name for text and json fields, null otherwise
 * @param recordOption posting information recorded for text and json fields
 * @param precision    truncation applied to datetime values
 */
public record FieldEntry(
        String name,
        FieldType type,
        boolean indexed,
        boolean stored,
        boolean fast,
        @Nullable String tokenizer,
        IndexRecordOption recordOption,
        DatetimePrecision precision
) {

    public static final String DEFAULT_TOKENIZER = "default";

    public FieldEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("field name must not be empty");
        }
        if (recordOption == null) {
            recordOption = IndexRecordOption.POSITION;
        }
        if (precision == null) {
            precision = DatetimePrecision.MICROSECONDS;
        }
        if (tokenizer == null && (type == FieldType.TEXT || type == FieldType.JSON)) {
            tokenizer = DEFAULT_TOKENIZER;
        }
    }

    /**
     * An indexed, non-stored, non-fast field of the given type.
     */
    public static FieldEntry of(final String name, final FieldType type) {
        return new FieldEntry(name, type, true, false, false, null, null, null);
    }

    /**
     * An indexed text field using the default tokenizer and recording positions.
     */
    public static FieldEntry text(final String name) {
        return of(name, FieldType.TEXT);
    }

    public static FieldEntry json(final String name) {
        return of(name, FieldType.JSON);
    }

    public FieldEntry withIndexed(final boolean indexed) {
        return new FieldEntry(name, type, indexed, stored, fast, tokenizer, recordOption, precision);
    }

    public FieldEntry withStored(final boolean stored) {
        return new FieldEntry(name, type, indexed, stored, fast, tokenizer, recordOption, precision);
    }

    public FieldEntry withFast(final boolean fast) {
        return new FieldEntry(name, type, indexed, stored, fast, tokenizer, recordOption, precision);
    }

    public FieldEntry withTokenizer(final String tokenizer) {
        return new FieldEntry(name, type, indexed, stored, fast, tokenizer, recordOption, precision);
    }

    public FieldEntry withRecordOption(final IndexRecordOption recordOption) {
        return new FieldEntry(name, type, indexed, stored, fast, tokenizer, recordOption, precision);
    }

    public FieldEntry withPrecision(final DatetimePrecision precision) {
        return new FieldEntry(name, type, indexed, stored, fast, tokenizer, recordOption, precision);
    }

    /**
     * Whether phrase queries can run against this field.
     */
    public boolean hasPositions() {
        return (type == FieldType.TEXT || type == FieldType.JSON) && recordOption.hasPositions();
    }

    /**
     * The tokenizer to use for this field, falling back to the default one.
     */
    public String tokenizerName() {
        return tokenizer != null ? tokenizer : DEFAULT_TOKENIZER;
    }
}
