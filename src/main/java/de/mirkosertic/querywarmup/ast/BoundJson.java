package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import de.mirkosertic.querywarmup.util.Bound;

import java.io.IOException;
import java.util.Map;

/**
 * JSON form of range bounds: {@code "unbounded"}, {@code {"included": v}} or {@code {"excluded": v}}.
 * Numeric and boolean literals are accepted and kept as their text.
 */
final class BoundJson {

    private static final String UNBOUNDED = "unbounded";
    private static final String INCLUDED = "included";
    private static final String EXCLUDED = "excluded";

    private BoundJson() {
    }

    public static final class Serializer extends StdSerializer<Bound<String>> {

        public Serializer() {
            super(Bound.class, false);
        }

        @Override
        public void serialize(final Bound<String> bound, final JsonGenerator gen, final SerializerProvider provider)
                throws IOException {
            if (bound instanceof Bound.Included<String> included) {
                gen.writeStartObject();
                gen.writeStringField(INCLUDED, included.value());
                gen.writeEndObject();
            } else if (bound instanceof Bound.Excluded<String> excluded) {
                gen.writeStartObject();
                gen.writeStringField(EXCLUDED, excluded.value());
                gen.writeEndObject();
            } else {
                gen.writeString(UNBOUNDED);
            }
        }
    }

    public static final class Deserializer extends StdDeserializer<Bound<String>> {

        public Deserializer() {
            super(Bound.class);
        }

        @Override
        public Bound<String> deserialize(final JsonParser parser, final DeserializationContext context)
                throws IOException {
            final JsonNode node = parser.readValueAsTree();
            if (node == null || node.isNull()) {
                return Bound.unbounded();
            }
            if (node.isTextual() && UNBOUNDED.equalsIgnoreCase(node.asText())) {
                return Bound.unbounded();
            }
            if (node.isObject() && node.size() == 1) {
                final Map.Entry<String, JsonNode> entry = node.properties().iterator().next();
                final JsonNode value = entry.getValue();
                if (value.isValueNode() && !value.isNull()) {
                    if (INCLUDED.equalsIgnoreCase(entry.getKey())) {
                        return Bound.included(value.asText());
                    }
                    if (EXCLUDED.equalsIgnoreCase(entry.getKey())) {
                        return Bound.excluded(value.asText());
                    }
                }
            }
            throw JsonMappingException.from(parser, "Invalid range bound: " + node);
        }
    }
}
