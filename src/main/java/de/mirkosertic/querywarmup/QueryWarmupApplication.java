package de.mirkosertic.querywarmup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.querywarmup.config.ApplicationConfig;
import de.mirkosertic.querywarmup.schema.Schema;
import de.mirkosertic.querywarmup.schema.SchemaLoader;
import de.mirkosertic.querywarmup.tokenizer.TokenizerManager;
import de.mirkosertic.querywarmup.warmup.BuiltQuery;
import de.mirkosertic.querywarmup.warmup.QueryBuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line entry point. Compiles a query against a schema and prints the compiled query and
 * its warm-up plan as JSON.
 * <pre>
 * java -jar query-warmup.jar schema.yaml 'title:hello* AND ip:[10.0.0.0 TO 10.0.0.255]'
 * </pre>
 * A query starting with {@code {} is read as a structured JSON query. The schema argument may be
 * left out when {@code warmup.schema-path} is configured.
 */
public class QueryWarmupApplication {

    private static final Logger logger = LoggerFactory.getLogger(QueryWarmupApplication.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final QueryWarmupService service;

    public QueryWarmupApplication(final QueryWarmupService service) {
        this.service = service;
    }

    /**
     * Plans the query and writes the result to {@code out}.
     *
     * @throws QueryBuildException if the query is rejected
     */
    public void run(final String queryText, final PrintStream out) throws QueryBuildException {
        final String trimmed = queryText.trim();
        final BuiltQuery built = trimmed.startsWith("{") ? service.planJson(trimmed) : service.plan(queryText);

        final Map<String, Object> result = new LinkedHashMap<>();
        result.put("query", built.query().toString());
        result.put("warmup", service.describe(built.plan()));
        try {
            out.println(OBJECT_MAPPER.writeValueAsString(result));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to write plan", e);
        }
    }

    static Path schemaPath(final String[] args, final ApplicationConfig config) {
        if (args.length >= 2) {
            return Paths.get(args[0]);
        }
        if (config.getSchemaPath() != null) {
            return Paths.get(config.getSchemaPath());
        }
        throw new IllegalArgumentException("Usage: query-warmup [schema.yaml] <query>");
    }

    public static void main(final String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: query-warmup [schema.yaml] <query>");
            System.exit(2);
        }
        try {
            final ApplicationConfig config = ApplicationConfig.load();
            final Schema schema = SchemaLoader.load(schemaPath(args, config));
            final QueryWarmupService service = new QueryWarmupService(schema, TokenizerManager.createDefault(), config);

            new QueryWarmupApplication(service).run(args[args.length - 1], System.out);
        } catch (final QueryBuildException e) {
            logger.error("Query rejected: {}", e.getMessage());
            System.exit(1);
        } catch (final IOException | IllegalArgumentException e) {
            logger.error("Failed to plan query", e);
            System.exit(1);
        }
    }
}
