package de.mirkosertic.querywarmup.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SchemaLoader Tests")
class SchemaLoaderTest {

    private static final String MAPPING = """
            doc_mapping:
              mode: dynamic
              dynamic_mapping:
                tokenizer: raw
              store_field_presence: true
              field_mappings:
                - name: title
                  type: text
                  tokenizer: en_stem
                  stored: true
                - name: tags
                  type: text
                  tokenizer: raw
                  record: basic
                  fast: true
                - name: server
                  type: object
                  field_mappings:
                    - name: mem
                      type: u64
                      fast: true
                    - name: ip
                      type: ip
                      indexed: false
                - name: created
                  type: datetime
                  fast: true
                  precision: seconds
            """;

    private static InputStream yaml(final String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should declare fields in mapping order with their options")
    void shouldLoadFields() {
        final Schema schema = SchemaLoader.load(yaml(MAPPING));

        assertThat(schema.fields()).extracting(FieldEntry::name).containsExactly(
                "title", "tags", "server.mem", "server.ip", "created",
                Schema.DYNAMIC_FIELD_NAME, Schema.FIELD_PRESENCE_FIELD_NAME);

        final FieldEntry title = schema.getFieldEntry(schema.getField("title").orElseThrow());
        assertThat(title.tokenizerName()).isEqualTo("en_stem");
        assertThat(title.stored()).isTrue();
        assertThat(title.fast()).isFalse();
        assertThat(title.hasPositions()).isTrue();

        final FieldEntry tags = schema.getFieldEntry(schema.getField("tags").orElseThrow());
        assertThat(tags.recordOption()).isEqualTo(IndexRecordOption.BASIC);
        assertThat(tags.hasPositions()).isFalse();

        final FieldEntry ip = schema.getFieldEntry(schema.getField("server.ip").orElseThrow());
        assertThat(ip.type()).isEqualTo(FieldType.IP_ADDR);
        assertThat(ip.indexed()).isFalse();

        final FieldEntry created = schema.getFieldEntry(schema.getField("created").orElseThrow());
        assertThat(created.precision()).isEqualTo(DatetimePrecision.SECONDS);
    }

    @Test
    @DisplayName("Should set up the dynamic field and the presence marker")
    void shouldLoadDocMappingOptions() {
        final Schema schema = SchemaLoader.load(yaml(MAPPING));

        assertThat(schema.dynamicField()).isPresent();
        assertThat(schema.getFieldEntry(schema.dynamicField().orElseThrow()).tokenizerName()).isEqualTo("raw");
        assertThat(schema.recordsFieldPresence()).isTrue();
    }

    @Test
    @DisplayName("Should load an index config with concatenate fields")
    void shouldLoadConcatenateFields() throws Exception {
        final Schema schema = SchemaLoader.load(yaml("""
                version: "0.7"
                index_id: concat
                doc_mapping:
                  mode: dynamic
                  field_mappings:
                    - name: text1
                      type: text
                      tokenizer: default
                    - name: text2
                      type: text
                      tokenizer: raw
                    - name: boolean
                      type: bool
                    - name: int
                      type: u64
                    - name: json
                      type: json
                    - name: concat_raw
                      type: concatenate
                      concatenate_fields:
                        - text1
                        - text2
                        - boolean
                        - int
                        - json
                      tokenizer: raw
                      include_dynamic_fields: true
                    - name: concat_default
                      type: concatenate
                      concatenate_fields:
                        - text1
                        - text2
                        - boolean
                        - int
                        - json
                      tokenizer: default
                  dynamic_mapping:
                    tokenizer: default
                    expand_dots: true
                """));

        assertThat(schema.fields()).extracting(FieldEntry::name).containsExactly(
                "text1", "text2", "boolean", "int", "json", "concat_raw", "concat_default",
                Schema.DYNAMIC_FIELD_NAME);
        assertThat(schema.concatenateFields()).containsExactly(
                new ConcatenateField("concat_raw", List.of("text1", "text2", "boolean", "int", "json"), true),
                new ConcatenateField("concat_default", List.of("text1", "text2", "boolean", "int", "json"), false));

        final ResolvedField concatRaw = FieldResolver.resolve("concat_raw", schema);
        assertThat(concatRaw.entry().type()).isEqualTo(FieldType.TEXT);
        assertThat(concatRaw.entry().tokenizerName()).isEqualTo("raw");
        assertThat(schema.getFieldEntry(schema.dynamicField().orElseThrow()).tokenizerName())
                .isEqualTo(FieldEntry.DEFAULT_TOKENIZER);
    }

    @Test
    @DisplayName("Should default to a strict mapping")
    void shouldDefaultToStrict() {
        final Schema schema = SchemaLoader.load(yaml("""
                doc_mapping:
                  field_mappings:
                    - name: body
                      type: text
                """));

        assertThat(schema.dynamicField()).isEmpty();
        assertThat(schema.recordsFieldPresence()).isFalse();
        assertThat(schema.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should load a mapping file")
    void shouldLoadFromFile(@TempDir final Path tempDir) throws Exception {
        final Path file = tempDir.resolve("schema.yaml");
        Files.writeString(file, MAPPING);

        assertThat(SchemaLoader.load(file).getField("server.mem")).isPresent();
    }

    @Test
    @DisplayName("Should reject malformed mappings")
    void shouldRejectMalformedMappings() {
        assertThatThrownBy(() -> SchemaLoader.load(yaml("- a\n- b\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Doc mapping must be a YAML mapping");
        assertThatThrownBy(() -> SchemaLoader.load(yaml("""
                doc_mapping:
                  field_mappings:
                    - name: body
                      type: blob
                """)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown field type: blob");
        assertThatThrownBy(() -> SchemaLoader.load(yaml("""
                doc_mapping:
                  mode: lax
                """)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown doc mapping mode: lax");
        assertThatThrownBy(() -> SchemaLoader.load(yaml("""
                doc_mapping:
                  field_mappings:
                    - type: text
                """)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Missing `name`");
    }
}
