package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.ast.QueryAst;
import de.mirkosertic.querywarmup.ast.QueryAstVisitor;
import de.mirkosertic.querywarmup.ast.RangeQuery;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects the field names targeted by range clauses. Ranges only run on fast fields, so every
 * name found here is a columnar read.
 */
public final class RangeQueryFieldCollector implements QueryAstVisitor<RuntimeException> {

    private final Set<String> fieldNames = new TreeSet<>();

    public static Set<String> collect(final QueryAst ast) {
        final RangeQueryFieldCollector collector = new RangeQueryFieldCollector();
        collector.visit(ast);
        return Collections.unmodifiableSet(collector.fieldNames);
    }

    @Override
    public void visitRange(final RangeQuery rangeQuery) {
        fieldNames.add(rangeQuery.field());
    }
}
