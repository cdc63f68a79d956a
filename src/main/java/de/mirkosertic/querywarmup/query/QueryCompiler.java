package de.mirkosertic.querywarmup.query;

import de.mirkosertic.querywarmup.InvalidQueryException;
import de.mirkosertic.querywarmup.ast.QueryAst;
import de.mirkosertic.querywarmup.schema.Schema;
import de.mirkosertic.querywarmup.tokenizer.TokenizerManager;
import org.apache.lucene.search.Query;

import java.util.List;

/**
 * Translates a {@link QueryAst} into an executable Lucene {@link Query} for a schema.
 */
public interface QueryCompiler {

    /**
     * @param ast           the query, with user text already parsed
     * @param schema        the schema of the searched index
     * @param tokenizers    analyzers of text and json fields
     * @param defaultFields fields targeted by clauses that name none
     * @param validate      whether clauses on missing fields fail the compilation (strict) or match nothing
     * @throws InvalidQueryException if a clause cannot run against the schema
     */
    Query compile(QueryAst ast, Schema schema, TokenizerManager tokenizers, List<String> defaultFields,
                  boolean validate) throws InvalidQueryException;
}
