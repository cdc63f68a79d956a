package de.mirkosertic.querywarmup.schema;

import de.mirkosertic.querywarmup.InvalidQueryException;
import de.mirkosertic.querywarmup.tokenizer.TokenizerManager;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.SortedNumericDocValuesField;
import org.apache.lucene.document.SortedSetDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.util.BytesRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Creates Lucene documents for a {@link Schema}, with the same term encoding the query compiler
 * uses.
 *
 * <p>Text fields are analyzed by the {@link org.apache.lucene.index.IndexWriter}, which therefore
 * has to be configured with {@link #indexAnalyzer()}. Fast fields get doc values, and when the
 * schema records field presence every populated field (JSON paths included) gets a marker term.</p>
 */
public class DocumentMapper {

    private static final Logger logger = LoggerFactory.getLogger(DocumentMapper.class);

    private final Schema schema;
    private final TokenizerManager tokenizers;

    public DocumentMapper(final Schema schema, final TokenizerManager tokenizers) {
        this.schema = schema;
        this.tokenizers = tokenizers;
    }

    /**
     * The analyzer routing each text field to its declared tokenizer.
     */
    public Analyzer indexAnalyzer() {
        return tokenizers.perFieldAnalyzer(schema);
    }

    /**
     * Maps a source document. Nested maps address dotted field names or JSON fields; lists hold
     * multiple values.
     *
     * @throws IllegalArgumentException if a value does not fit its field or a name matches no field
     */
    public Document createDocument(final Map<String, Object> source) {
        final Document doc = new Document();
        final Set<String> presentPaths = new LinkedHashSet<>();
        for (final Map.Entry<String, Object> entry : source.entrySet()) {
            mapValue(doc, presentPaths, entry.getKey(), entry.getValue());
        }
        if (schema.recordsFieldPresence()) {
            for (final String path : presentPaths) {
                doc.add(new StringField(Schema.FIELD_PRESENCE_FIELD_NAME, path, Field.Store.NO));
            }
        }
        return doc;
    }

    private void mapValue(final Document doc, final Set<String> presentPaths, final String path, final Object value) {
        if (value == null) {
            return;
        }
        final Optional<de.mirkosertic.querywarmup.schema.Field> field = schema.getField(path);
        if (field.isPresent()) {
            final FieldEntry entry = schema.getFieldEntry(field.get());
            if (entry.type() == FieldType.JSON) {
                addJson(doc, presentPaths, entry, "", value);
            } else {
                for (final Object single : values(value)) {
                    addValue(doc, entry, single);
                    addToConcatenateFields(doc, entry.name(), false, single);
                }
                presentPaths.add(path);
            }
            return;
        }
        if (value instanceof Map<?, ?> object) {
            for (final Map.Entry<?, ?> child : object.entrySet()) {
                mapValue(doc, presentPaths, path + "." + child.getKey(), child.getValue());
            }
            return;
        }
        final Optional<de.mirkosertic.querywarmup.schema.Field> dynamicField = schema.dynamicField();
        if (dynamicField.isEmpty()) {
            throw new IllegalArgumentException("Field `" + path + "` is not declared and the schema has no dynamic field");
        }
        addJson(doc, presentPaths, schema.getFieldEntry(dynamicField.get()), path, value);
    }

    private void addValue(final Document doc, final FieldEntry entry, final Object value) {
        final String literal = value.toString();
        if (entry.stored()) {
            doc.add(new StoredField(entry.name(), literal));
        }
        try {
            switch (entry.type()) {
                case TEXT -> {
                    if (entry.indexed()) {
                        doc.add(new Field(entry.name(), literal, textFieldType(entry)));
                    }
                    if (entry.fast()) {
                        doc.add(new SortedSetDocValuesField(entry.name(),
                                tokenizers.normalize(entry.tokenizerName(), entry.name(), literal)));
                    }
                }
                case IP_ADDR -> {
                    final BytesRef bytes = TermEncoder.ipBytes(TermEncoder.parseIp(entry.name(), literal));
                    if (entry.indexed()) {
                        doc.add(new StringField(entry.name(), bytes, Field.Store.NO));
                    }
                    if (entry.fast()) {
                        doc.add(new SortedSetDocValuesField(entry.name(), bytes));
                    }
                }
                default -> {
                    final long sortable = TermEncoder.toSortableLong(entry, literal);
                    if (entry.indexed()) {
                        doc.add(new StringField(entry.name(), TermEncoder.sortableBytes(sortable), Field.Store.NO));
                    }
                    if (entry.fast()) {
                        doc.add(new SortedNumericDocValuesField(entry.name(), sortable));
                    }
                }
            }
        } catch (final InvalidQueryException e) {
            throw new IllegalArgumentException("Invalid value for field `" + entry.name() + "`: " + literal, e);
        }
    }

    private void addJson(final Document doc, final Set<String> presentPaths, final FieldEntry entry,
                         final String path, final Object value) {
        if (value instanceof Map<?, ?> object) {
            for (final Map.Entry<?, ?> child : object.entrySet()) {
                final String childPath = path.isEmpty() ? child.getKey().toString() : path + "." + child.getKey();
                if (child.getValue() != null) {
                    addJson(doc, presentPaths, entry, childPath, child.getValue());
                }
            }
            return;
        }
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Field `" + entry.name() + "` expects a JSON object, got " + value);
        }
        if (!entry.indexed()) {
            return;
        }
        final boolean dynamic = Schema.DYNAMIC_FIELD_NAME.equals(entry.name());
        for (final Object single : values(value)) {
            if (!(single instanceof Map<?, ?>)) {
                addToConcatenateFields(doc, entry.name(), dynamic, single);
            }
            if (single instanceof Number || single instanceof Boolean) {
                // Same index options as the string terms of the field, a field keeps one schema
                doc.add(new Field(entry.name(), TermEncoder.jsonValueTerm(path, single), jsonValueFieldType(entry)));
            } else if (single instanceof Map<?, ?>) {
                addJson(doc, presentPaths, entry, path, single);
            } else {
                final String prefix = path + (char) TermEncoder.JSON_END_OF_PATH + (char) TermEncoder.JSON_TYPE_STR;
                doc.add(new Field(entry.name(), new PrefixedTokenStream(prefix,
                        tokenizers.tokenize(entry.tokenizerName(), entry.name(), single.toString())),
                        textFieldType(entry)));
            }
        }
        presentPaths.add(entry.name() + "." + path);
        logger.trace("Mapped JSON path {} of field {}", path, entry.name());
    }

    private void addToConcatenateFields(final Document doc, final String sourceName, final boolean dynamic,
                                        final Object value) {
        for (final ConcatenateField concatenate : schema.concatenateFields()) {
            if (!concatenate.copies(sourceName, dynamic)) {
                continue;
            }
            final FieldEntry target = schema.getFieldEntry(schema.getField(concatenate.name()).orElseThrow());
            if (target.indexed()) {
                doc.add(new Field(target.name(), value.toString(), textFieldType(target)));
            }
        }
    }

    private static List<?> values(final Object value) {
        return value instanceof List<?> list ? list : List.of(value);
    }

    private static org.apache.lucene.document.FieldType textFieldType(final FieldEntry entry) {
        final org.apache.lucene.document.FieldType type = new org.apache.lucene.document.FieldType();
        type.setTokenized(true);
        type.setIndexOptions(entry.recordOption().indexOptions());
        type.freeze();
        return type;
    }

    private static org.apache.lucene.document.FieldType jsonValueFieldType(final FieldEntry entry) {
        final org.apache.lucene.document.FieldType type = new org.apache.lucene.document.FieldType(textFieldType(entry));
        type.setTokenized(false);
        type.freeze();
        return type;
    }
}
