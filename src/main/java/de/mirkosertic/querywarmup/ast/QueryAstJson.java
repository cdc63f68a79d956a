package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

/**
 * Reads and writes {@link QueryAst}s as JSON payloads.
 *
 * <p>Nodes carry a {@code "type"} discriminator, properties are snake_case and range bounds are
 * written as {@code "unbounded"}, {@code {"included": v}} or {@code {"excluded": v}}:</p>
 * <pre>
 * {"type":"bool","must":[{"type":"term","field":"title","value":"hello"}],"must_not":[],...}
 * </pre>
 */
public final class QueryAstJson {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private QueryAstJson() {
    }

    /**
     * Parses a JSON payload into a query.
     *
     * @throws JsonProcessingException if the payload is not valid JSON or does not describe a query
     */
    public static QueryAst parse(final String json) throws JsonProcessingException {
        final QueryAst ast = OBJECT_MAPPER.readValue(json, QueryAst.class);
        if (ast == null) {
            throw MismatchedInputException.from(null, QueryAst.class, "query payload must not be null");
        }
        return ast;
    }

    public static String toJson(final QueryAst ast) {
        try {
            return OBJECT_MAPPER.writeValueAsString(ast);
        } catch (final JsonProcessingException e) {
            // Every node is a plain record, so this points at a broken mapping
            throw new IllegalStateException("Failed to serialize query " + ast, e);
        }
    }
}
