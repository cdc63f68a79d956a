package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.InvalidQueryException;
import de.mirkosertic.querywarmup.ast.QueryAst;
import de.mirkosertic.querywarmup.query.LuceneQueryCompiler;
import de.mirkosertic.querywarmup.query.QueryCompiler;
import de.mirkosertic.querywarmup.schema.Field;
import de.mirkosertic.querywarmup.schema.FieldResolver;
import de.mirkosertic.querywarmup.schema.Schema;
import de.mirkosertic.querywarmup.tokenizer.TokenizerManager;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compiles a query and works out the index artifacts it will touch.
 *
 * <p>The plan is assembled from four independent sources:</p>
 * <ol>
 *   <li>fast fields of range clauses, plus those of presence clauses that target fast fields,</li>
 *   <li>fields of term set clauses, whose term dictionaries are needed,</li>
 *   <li>term ranges of prefix shaped clauses,</li>
 *   <li>literal terms of the compiled query.</li>
 * </ol>
 * A build only reads its inputs, so one builder serves concurrent calls.
 */
public class WarmUpPlanBuilder {

    private static final Logger logger = LoggerFactory.getLogger(WarmUpPlanBuilder.class);

    private final QueryCompiler compiler;

    public WarmUpPlanBuilder() {
        this(new LuceneQueryCompiler());
    }

    public WarmUpPlanBuilder(final QueryCompiler compiler) {
        this.compiler = compiler;
    }

    /**
     * @param ast           the query, with user text already parsed
     * @param schema        schema of the split
     * @param tokenizers    analyzers of text and json fields
     * @param defaultFields fields targeted by clauses naming none
     * @param validate      whether clauses on missing fields fail the build
     * @throws QueryBuildException wrapping the first error encountered
     */
    public BuiltQuery build(final QueryAst ast, final Schema schema, final TokenizerManager tokenizers,
                            final List<String> defaultFields, final boolean validate) throws QueryBuildException {
        try {
            return buildPlan(ast, schema, tokenizers, defaultFields, validate);
        } catch (final InvalidQueryException e) {
            logger.debug("Rejected query {}: {}", ast, e.getMessage());
            throw new QueryBuildException(e);
        }
    }

    private BuiltQuery buildPlan(final QueryAst ast, final Schema schema, final TokenizerManager tokenizers,
                                 final List<String> defaultFields, final boolean validate)
            throws InvalidQueryException {
        final Set<String> fastFieldNames = new TreeSet<>(RangeQueryFieldCollector.collect(ast));
        for (final String name : ExistsQueryFieldCollector.collect(ast)) {
            // Presence on other fields, JSON paths included, is answered by the presence marker term
            if (FieldResolver.hasColumnarPresence(schema, name)) {
                fastFieldNames.add(name);
            }
        }

        final Query query = compiler.compile(ast, schema, tokenizers, defaultFields, validate);

        final Set<Field> termDictFields = TermSetFieldCollector.collect(ast, schema);
        final Map<Field, Map<TermRange, Boolean>> termRangesByField =
                PrefixTermRangeCollector.collect(ast, schema, tokenizers);
        final Map<Field, Map<Term, Boolean>> termsByField = QueryTermCollector.collect(query, schema);

        final WarmUpPlan plan = new WarmUpPlan(termDictFields, termsByField, termRangesByField, fastFieldNames);
        if (logger.isDebugEnabled()) {
            logger.debug("Warm-up plan: {} term dictionaries, {} terms, {} term ranges, {} fast fields",
                    plan.termDictFields().size(), countEntries(plan.termsByField()),
                    countEntries(plan.termRangesByField()), plan.fastFieldNames().size());
        }
        return new BuiltQuery(query, plan);
    }

    private static int countEntries(final Map<Field, ? extends Map<?, Boolean>> perField) {
        int count = 0;
        for (final Map<?, Boolean> entries : perField.values()) {
            count += entries.size();
        }
        return count;
    }
}
