package de.mirkosertic.querywarmup;

import com.fasterxml.jackson.core.JsonProcessingException;
import de.mirkosertic.querywarmup.ast.QueryAst;
import de.mirkosertic.querywarmup.ast.QueryAstJson;
import de.mirkosertic.querywarmup.ast.UserInputQuery;
import de.mirkosertic.querywarmup.config.ApplicationConfig;
import de.mirkosertic.querywarmup.schema.Field;
import de.mirkosertic.querywarmup.schema.Schema;
import de.mirkosertic.querywarmup.tokenizer.TokenizerManager;
import de.mirkosertic.querywarmup.util.Bound;
import de.mirkosertic.querywarmup.warmup.BuiltQuery;
import de.mirkosertic.querywarmup.warmup.QueryBuildException;
import de.mirkosertic.querywarmup.warmup.TermRange;
import de.mirkosertic.querywarmup.warmup.WarmUpPlan;
import de.mirkosertic.querywarmup.warmup.WarmUpPlanBuilder;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for planning queries against one schema.
 * <p>
 * User text is parsed with the configured default fields, operator and leniency before it is
 * compiled. Structured queries may embed user text nodes, which are parsed the same way.
 */
public class QueryWarmupService {

    private static final Logger logger = LoggerFactory.getLogger(QueryWarmupService.class);

    private final Schema schema;
    private final TokenizerManager tokenizers;
    private final ApplicationConfig config;
    private final WarmUpPlanBuilder planBuilder;

    public QueryWarmupService(final Schema schema, final TokenizerManager tokenizers, final ApplicationConfig config) {
        this(schema, tokenizers, config, new WarmUpPlanBuilder());
    }

    public QueryWarmupService(final Schema schema, final TokenizerManager tokenizers, final ApplicationConfig config,
                              final WarmUpPlanBuilder planBuilder) {
        this.schema = schema;
        this.tokenizers = tokenizers;
        this.config = config;
        this.planBuilder = planBuilder;
    }

    /**
     * Plans a query typed by a user.
     *
     * @throws QueryBuildException if the text cannot be parsed or compiled
     */
    public BuiltQuery plan(final String userText) throws QueryBuildException {
        final UserInputQuery query = new UserInputQuery(userText, null, config.getDefaultOperator(),
                config.isLenient());
        return build(query);
    }

    /**
     * Plans a structured query given as JSON.
     *
     * @throws QueryBuildException if the payload is malformed or the query cannot be compiled
     */
    public BuiltQuery planJson(final String json) throws QueryBuildException {
        final QueryAst ast;
        try {
            ast = QueryAstJson.parse(json);
        } catch (final JsonProcessingException e) {
            logger.debug("Malformed query payload: {}", e.getOriginalMessage());
            throw new QueryBuildException(e);
        }
        return build(ast);
    }

    private BuiltQuery build(final QueryAst ast) throws QueryBuildException {
        final QueryAst parsed;
        if (ast instanceof UserInputQuery userInput) {
            try {
                parsed = userInput.parse(config.getDefaultFields(), config.getPhrasePrefixMaxExpansions());
            } catch (final ParseException e) {
                logger.debug("Failed to parse user query '{}': {}", userInput.userText(), e.getMessage());
                throw new QueryBuildException(e);
            }
        } else {
            parsed = ast;
        }
        return planBuilder.build(parsed, schema, tokenizers, config.getDefaultFields(), config.isValidate());
    }

    /**
     * Describes a plan with field names and readable terms, ready to be written as JSON.
     */
    public Map<String, Object> describe(final WarmUpPlan plan) {
        final Map<String, Object> result = new LinkedHashMap<>();

        final List<String> termDictFields = new ArrayList<>();
        for (final Field field : plan.termDictFields()) {
            termDictFields.add(schema.getFieldName(field));
        }
        result.put("term_dict_fields", termDictFields);

        final Map<String, Object> terms = new LinkedHashMap<>();
        for (final Map.Entry<Field, Map<Term, Boolean>> perField : plan.termsByField().entrySet()) {
            final List<Map<String, Object>> entries = new ArrayList<>();
            for (final Map.Entry<Term, Boolean> entry : perField.getValue().entrySet()) {
                final Map<String, Object> term = new LinkedHashMap<>();
                term.put("term", Term.toString(entry.getKey().bytes()));
                term.put("positions", entry.getValue());
                entries.add(term);
            }
            terms.put(schema.getFieldName(perField.getKey()), entries);
        }
        result.put("terms", terms);

        final Map<String, Object> ranges = new LinkedHashMap<>();
        for (final Map.Entry<Field, Map<TermRange, Boolean>> perField : plan.termRangesByField().entrySet()) {
            final List<Map<String, Object>> entries = new ArrayList<>();
            for (final Map.Entry<TermRange, Boolean> entry : perField.getValue().entrySet()) {
                final Map<String, Object> range = new LinkedHashMap<>();
                range.put("start", describe(entry.getKey().start()));
                range.put("end", describe(entry.getKey().end()));
                entry.getKey().limit().ifPresent(limit -> range.put("limit", limit));
                range.put("positions", entry.getValue());
                entries.add(range);
            }
            ranges.put(schema.getFieldName(perField.getKey()), entries);
        }
        result.put("term_ranges", ranges);

        result.put("fast_fields", List.copyOf(plan.fastFieldNames()));
        return result;
    }

    private static Object describe(final Bound<Term> bound) {
        if (bound instanceof Bound.Included<Term> included) {
            return Map.of("included", Term.toString(included.value().bytes()));
        }
        if (bound instanceof Bound.Excluded<Term> excluded) {
            return Map.of("excluded", Term.toString(excluded.value().bytes()));
        }
        return "unbounded";
    }

    public Schema getSchema() {
        return schema;
    }
}
