package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.schema.Field;
import org.apache.lucene.index.Term;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The index artifacts a query touches, to be fetched before it runs.
 *
 * @param termDictFields    fields whose whole term dictionary is needed
 * @param termsByField      literal terms per field, flagged when their positions are needed
 * @param termRangesByField term ranges per field, flagged when their positions are needed
 * @param fastFieldNames    names of fields whose columnar values are needed
 */
public record WarmUpPlan(
        Set<Field> termDictFields,
        Map<Field, Map<Term, Boolean>> termsByField,
        Map<Field, Map<TermRange, Boolean>> termRangesByField,
        Set<String> fastFieldNames
) {

    private static final WarmUpPlan EMPTY = new WarmUpPlan(Set.of(), Map.of(), Map.of(), Set.of());

    public WarmUpPlan {
        termDictFields = Collections.unmodifiableSortedSet(new TreeSet<>(termDictFields));
        termsByField = copyFlags(termsByField, true);
        termRangesByField = copyFlags(termRangesByField, false);
        fastFieldNames = Collections.unmodifiableSortedSet(new TreeSet<>(fastFieldNames));
    }

    public static WarmUpPlan empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return termDictFields.isEmpty() && termsByField.isEmpty() && termRangesByField.isEmpty()
                && fastFieldNames.isEmpty();
    }

    /**
     * Combines the artifacts of two plans against the same split. Sets are united; a term or range
     * present in both needs positions if either plan says so.
     */
    public WarmUpPlan merge(final WarmUpPlan other) {
        final Set<Field> mergedTermDictFields = new TreeSet<>(termDictFields);
        mergedTermDictFields.addAll(other.termDictFields);

        final Map<Field, Map<Term, Boolean>> mergedTerms = new TreeMap<>();
        mergeAll(mergedTerms, termsByField);
        mergeAll(mergedTerms, other.termsByField);

        final Map<Field, Map<TermRange, Boolean>> mergedRanges = new TreeMap<>();
        mergeAll(mergedRanges, termRangesByField);
        mergeAll(mergedRanges, other.termRangesByField);

        final Set<String> mergedFastFields = new TreeSet<>(fastFieldNames);
        mergedFastFields.addAll(other.fastFieldNames);
        return new WarmUpPlan(mergedTermDictFields, mergedTerms, mergedRanges, mergedFastFields);
    }

    /**
     * Records {@code key} under {@code field}, OR-ing its flag with the one already recorded.
     */
    static <K> void mergeFlag(final Map<Field, Map<K, Boolean>> target, final Field field, final K key,
                              final boolean flag) {
        target.computeIfAbsent(field, ignored -> new LinkedHashMap<>()).merge(key, flag, Boolean::logicalOr);
    }

    private static <K> void mergeAll(final Map<Field, Map<K, Boolean>> target,
                                     final Map<Field, Map<K, Boolean>> source) {
        for (final Map.Entry<Field, Map<K, Boolean>> perField : source.entrySet()) {
            for (final Map.Entry<K, Boolean> entry : perField.getValue().entrySet()) {
                mergeFlag(target, perField.getKey(), entry.getKey(), entry.getValue());
            }
        }
    }

    private static <K> Map<Field, Map<K, Boolean>> copyFlags(final Map<Field, Map<K, Boolean>> source,
                                                             final boolean sortKeys) {
        final SortedMap<Field, Map<K, Boolean>> copy = new TreeMap<>();
        for (final Map.Entry<Field, Map<K, Boolean>> entry : source.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            final Map<K, Boolean> flags = sortKeys
                    ? new TreeMap<>(entry.getValue())
                    : new LinkedHashMap<>(entry.getValue());
            copy.put(entry.getKey(), Collections.unmodifiableMap(flags));
        }
        return Collections.unmodifiableSortedMap(copy);
    }
}
