package de.mirkosertic.querywarmup.schema;

import de.mirkosertic.querywarmup.FieldDoesNotExistException;
import de.mirkosertic.querywarmup.TestSchemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FieldResolver Tests")
class FieldResolverTest {

    @Nested
    @DisplayName("Resolution")
    class ResolutionTests {

        @Test
        @DisplayName("Should resolve a declared field by exact name")
        void shouldResolveExactName() throws Exception {
            final ResolvedField resolved = FieldResolver.resolve("title", TestSchemas.strict());

            assertThat(resolved.field()).isEqualTo(new Field(TestSchemas.TITLE));
            assertThat(resolved.jsonPath()).isEmpty();
            assertThat(resolved.isJson()).isFalse();
        }

        @Test
        @DisplayName("Should prefer a declared dotted name over splitting it")
        void shouldResolveDottedName() throws Exception {
            final ResolvedField resolved = FieldResolver.resolve("server.mem", TestSchemas.strict());

            assertThat(resolved.field()).isEqualTo(new Field(TestSchemas.SERVER_MEM));
            assertThat(resolved.entry().type()).isEqualTo(FieldType.U64);
        }

        @Test
        @DisplayName("Should resolve the remainder of a name below a json field as path")
        void shouldResolveJsonPath() throws Exception {
            final ResolvedField resolved = FieldResolver.resolve("attributes.color.name", TestSchemas.strict());

            assertThat(resolved.field()).isEqualTo(new Field(TestSchemas.ATTRIBUTES));
            assertThat(resolved.jsonPath()).isEqualTo("color.name");
            assertThat(resolved.presencePath()).isEqualTo("attributes.color.name");
        }

        @Test
        @DisplayName("Should fall back to the dynamic field with the whole name as path")
        void shouldFallBackToDynamicField() throws Exception {
            final ResolvedField resolved = FieldResolver.resolve("foo.bar", TestSchemas.dynamic());

            assertThat(resolved.field()).isEqualTo(new Field(TestSchemas.DYNAMIC));
            assertThat(resolved.jsonPath()).isEqualTo("foo.bar");
        }

        @Test
        @DisplayName("Should not use the dynamic field when it is disabled")
        void shouldNotFallBackWhenDisabled() {
            assertThatThrownBy(() -> FieldResolver.resolve("foo", TestSchemas.dynamic(), false))
                    .isInstanceOf(FieldDoesNotExistException.class)
                    .hasMessage("field does not exist: `foo`");
        }

        @Test
        @DisplayName("Should reject unknown names on a strict schema")
        void shouldRejectUnknownName() {
            assertThatThrownBy(() -> FieldResolver.resolve("foo", TestSchemas.strict()))
                    .isInstanceOf(FieldDoesNotExistException.class)
                    .satisfies(e -> assertThat(((FieldDoesNotExistException) e).getFieldName()).isEqualTo("foo"));
        }

        @Test
        @DisplayName("Should not split below a non json field")
        void shouldNotSplitBelowNonJsonField() {
            assertThatThrownBy(() -> FieldResolver.resolve("title.sub", TestSchemas.strict()))
                    .isInstanceOf(FieldDoesNotExistException.class);
        }

        @Test
        @DisplayName("Should reject the empty name")
        void shouldRejectEmptyName() {
            assertThatThrownBy(() -> FieldResolver.resolve("", TestSchemas.dynamic()))
                    .isInstanceOf(FieldDoesNotExistException.class);
        }
    }

    @Nested
    @DisplayName("Fast field probe")
    class FastFieldTests {

        @Test
        @DisplayName("Should report fast fields")
        void shouldReportFastField() {
            assertThat(FieldResolver.isFast(TestSchemas.strict(), "ip")).isTrue();
            assertThat(FieldResolver.isFast(TestSchemas.strict(), "server.running")).isTrue();
        }

        @Test
        @DisplayName("Should report non fast and unknown fields as not fast")
        void shouldReportNonFastField() {
            assertThat(FieldResolver.isFast(TestSchemas.strict(), "ip_notff")).isFalse();
            assertThat(FieldResolver.isFast(TestSchemas.strict(), "missing")).isFalse();
        }

        @Test
        @DisplayName("Should check presence on doc values only for fast fields outside json")
        void shouldReportColumnarPresence() {
            final Schema.Builder builder = Schema.builder();
            builder.addField(FieldEntry.json("attributes").withFast(true));
            builder.addField(FieldEntry.of("count", FieldType.U64).withFast(true));
            final Schema schema = builder.build();

            assertThat(FieldResolver.isFast(schema, "attributes.color")).isTrue();
            assertThat(FieldResolver.hasColumnarPresence(schema, "attributes.color")).isFalse();
            assertThat(FieldResolver.hasColumnarPresence(schema, "count")).isTrue();
            assertThat(FieldResolver.hasColumnarPresence(schema, "missing")).isFalse();
        }
    }

    @Nested
    @DisplayName("Path splitting")
    class SplitPathTests {

        @Test
        @DisplayName("Should split on unescaped dots")
        void shouldSplitOnDots() {
            assertThat(FieldResolver.splitPath("a.b.c")).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("Should keep escaped dots inside a segment")
        void shouldKeepEscapedDots() {
            assertThat(FieldResolver.splitPath("a\\.b.c")).containsExactly("a.b", "c");
        }

        @Test
        @DisplayName("Should resolve an escaped dotted key below a json field")
        void shouldResolveEscapedKey() throws Exception {
            final ResolvedField resolved = FieldResolver.resolve("attributes.k8s\\.io", TestSchemas.strict());

            assertThat(resolved.jsonPath()).isEqualTo("k8s.io");
        }
    }
}
