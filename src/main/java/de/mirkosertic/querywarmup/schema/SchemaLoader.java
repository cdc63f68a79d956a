package de.mirkosertic.querywarmup.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Schema} from a YAML doc mapping.
 * <pre>
 * doc_mapping:
 *   mode: dynamic              # strict (default) or dynamic
 *   dynamic_mapping:
 *     tokenizer: raw           # tokenizer of the dynamic field, default "default"
 *   store_field_presence: true
 *   field_mappings:
 *     - name: title
 *       type: text
 *       tokenizer: en_stem
 *       record: position
 *     - name: everything
 *       type: concatenate
 *       concatenate_fields: [title, server.mem]
 *       include_dynamic_fields: true
 *     - name: server
 *       type: object
 *       field_mappings:
 *         - name: mem
 *           type: u64
 *           fast: true
 * </pre>
 * Fields of objects are flattened into dotted names ({@code server.mem}). Fields are indexed by
 * default and neither stored nor fast. A concatenate field is a text field indexing the values of
 * the fields it lists. Keys the loader does not know, such as {@code index_id}, are ignored.
 */
public final class SchemaLoader {

    private static final Logger logger = LoggerFactory.getLogger(SchemaLoader.class);

    private SchemaLoader() {
    }

    public static Schema load(final Path path) throws IOException {
        try (final InputStream is = Files.newInputStream(path)) {
            final Schema schema = load(is);
            logger.info("Loaded schema with {} fields from {}", schema.size(), path);
            return schema;
        }
    }

    /**
     * @throws IllegalArgumentException if the mapping is malformed
     */
    public static Schema load(final InputStream is) {
        final Yaml yaml = new Yaml();
        final Object document = yaml.load(is);
        if (!(document instanceof Map<?, ?> root)) {
            throw new IllegalArgumentException("Doc mapping must be a YAML mapping");
        }
        final Map<?, ?> docMapping = asMap(root.get("doc_mapping"), "doc_mapping");

        final Schema.Builder builder = Schema.builder();
        addFields(builder, "", asList(docMapping.get("field_mappings"), "field_mappings"));

        final String mode = stringValue(docMapping, "mode", "strict");
        switch (mode) {
            case "dynamic" -> builder.addDynamicField(dynamicTokenizer(docMapping));
            case "strict" -> logger.debug("Strict doc mapping, no dynamic field");
            default -> throw new IllegalArgumentException("Unknown doc mapping mode: " + mode);
        }
        if (booleanValue(docMapping, "store_field_presence", false)) {
            builder.addFieldPresenceField();
        }
        return builder.build();
    }

    private static void addFields(final Schema.Builder builder, final String prefix, final List<?> mappings) {
        for (final Object mapping : mappings) {
            final Map<?, ?> fieldMapping = asMap(mapping, "field mapping");
            final String name = prefix + requiredString(fieldMapping, "name");
            final String type = requiredString(fieldMapping, "type");
            if ("object".equals(type)) {
                addFields(builder, name + ".", asList(fieldMapping.get("field_mappings"), name + ".field_mappings"));
                continue;
            }
            if ("concatenate".equals(type)) {
                final List<String> sources = new ArrayList<>();
                for (final Object source : asList(fieldMapping.get("concatenate_fields"),
                        name + ".concatenate_fields")) {
                    sources.add(source.toString());
                }
                builder.addConcatenateField(toEntry(name, FieldType.TEXT, fieldMapping), sources,
                        booleanValue(fieldMapping, "include_dynamic_fields", false));
                logger.debug("Concatenate field {} copies {}", name, sources);
                continue;
            }
            builder.addField(toEntry(name, FieldType.fromTypeName(type), fieldMapping));
        }
    }

    private static String dynamicTokenizer(final Map<?, ?> docMapping) {
        final Object dynamicMapping = docMapping.get("dynamic_mapping");
        if (dynamicMapping == null) {
            return FieldEntry.DEFAULT_TOKENIZER;
        }
        return stringValue(asMap(dynamicMapping, "dynamic_mapping"), "tokenizer", FieldEntry.DEFAULT_TOKENIZER);
    }

    private static FieldEntry toEntry(final String name, final FieldType type, final Map<?, ?> mapping) {
        FieldEntry entry = FieldEntry.of(name, type)
                .withIndexed(booleanValue(mapping, "indexed", true))
                .withStored(booleanValue(mapping, "stored", false))
                .withFast(booleanValue(mapping, "fast", false));
        if (mapping.get("tokenizer") != null) {
            entry = entry.withTokenizer(mapping.get("tokenizer").toString());
        }
        if (mapping.get("record") != null) {
            entry = entry.withRecordOption(IndexRecordOption.fromName(mapping.get("record").toString()));
        }
        if (mapping.get("precision") != null) {
            entry = entry.withPrecision(DatetimePrecision.fromName(mapping.get("precision").toString()));
        }
        return entry;
    }

    private static Map<?, ?> asMap(final Object value, final String what) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException("Expected a mapping for " + what + ", got " + value);
    }

    private static List<?> asList(final Object value, final String what) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list;
        }
        throw new IllegalArgumentException("Expected a list for " + what + ", got " + value);
    }

    private static String requiredString(final Map<?, ?> mapping, final String key) {
        final Object value = mapping.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing `" + key + "` in field mapping " + mapping);
        }
        return value.toString();
    }

    private static String stringValue(final Map<?, ?> mapping, final String key, final String defaultValue) {
        final Object value = mapping.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean booleanValue(final Map<?, ?> mapping, final String key, final boolean defaultValue) {
        final Object value = mapping.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null ? Boolean.parseBoolean(value.toString()) : defaultValue;
    }
}
