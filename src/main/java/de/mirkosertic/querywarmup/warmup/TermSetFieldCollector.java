package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.FieldDoesNotExistException;
import de.mirkosertic.querywarmup.ast.QueryAst;
import de.mirkosertic.querywarmup.ast.QueryAstVisitor;
import de.mirkosertic.querywarmup.ast.TermSetQuery;
import de.mirkosertic.querywarmup.schema.Field;
import de.mirkosertic.querywarmup.schema.FieldResolver;
import de.mirkosertic.querywarmup.schema.Schema;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves the fields targeted by term set clauses. Their term dictionaries are addressed by
 * field, so a name that does not resolve fails the traversal.
 */
public final class TermSetFieldCollector implements QueryAstVisitor<FieldDoesNotExistException> {

    private final Schema schema;
    private final Set<Field> fields = new TreeSet<>();

    private TermSetFieldCollector(final Schema schema) {
        this.schema = schema;
    }

    public static Set<Field> collect(final QueryAst ast, final Schema schema) throws FieldDoesNotExistException {
        final TermSetFieldCollector collector = new TermSetFieldCollector(schema);
        collector.visit(ast);
        return Collections.unmodifiableSet(collector.fields);
    }

    @Override
    public void visitTermSet(final TermSetQuery termSetQuery) throws FieldDoesNotExistException {
        for (final String fieldName : termSetQuery.termsPerField().keySet()) {
            fields.add(FieldResolver.resolve(fieldName, schema).field());
        }
    }
}
