package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.ast.FieldPresenceQuery;
import de.mirkosertic.querywarmup.ast.QueryAst;
import de.mirkosertic.querywarmup.ast.QueryAstVisitor;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects the field names targeted by field presence clauses, fast or not.
 */
public final class ExistsQueryFieldCollector implements QueryAstVisitor<RuntimeException> {

    private final Set<String> fieldNames = new TreeSet<>();

    public static Set<String> collect(final QueryAst ast) {
        final ExistsQueryFieldCollector collector = new ExistsQueryFieldCollector();
        collector.visit(ast);
        return Collections.unmodifiableSet(collector.fieldNames);
    }

    @Override
    public void visitExists(final FieldPresenceQuery fieldPresenceQuery) {
        fieldNames.add(fieldPresenceQuery.field());
    }
}
