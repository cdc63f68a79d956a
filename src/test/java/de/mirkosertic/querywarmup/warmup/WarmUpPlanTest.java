package de.mirkosertic.querywarmup.warmup;

import de.mirkosertic.querywarmup.schema.Field;
import de.mirkosertic.querywarmup.util.Bound;
import org.apache.lucene.index.Term;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WarmUpPlan Tests")
class WarmUpPlanTest {

    private static final Field TITLE = new Field(0);
    private static final Field DESC = new Field(1);

    private static TermRange range(final String start) {
        return PrefixRanges.prefixTermToRange(new Term("title", start), OptionalLong.of(50));
    }

    @Test
    @DisplayName("Should be empty when nothing is named")
    void shouldBeEmpty() {
        assertThat(WarmUpPlan.empty().isEmpty()).isTrue();
        assertThat(new WarmUpPlan(Set.of(), Map.of(TITLE, Map.of()), Map.of(), Set.of()).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should drop fields without entries")
    void shouldDropEmptyFields() {
        final WarmUpPlan plan = new WarmUpPlan(Set.of(), Map.of(TITLE, Map.of(), DESC,
                Map.of(new Term("desc", "a"), false)), Map.of(), Set.of());

        assertThat(plan.termsByField()).containsOnlyKeys(DESC);
    }

    @Test
    @DisplayName("Should not be affected by later changes of its inputs")
    void shouldCopyInputs() {
        final Map<Term, Boolean> terms = new HashMap<>();
        terms.put(new Term("title", "a"), false);
        final Map<Field, Map<Term, Boolean>> byField = new HashMap<>();
        byField.put(TITLE, terms);

        final WarmUpPlan plan = new WarmUpPlan(Set.of(), byField, Map.of(), Set.of());
        terms.put(new Term("title", "b"), true);

        assertThat(plan.termsByField().get(TITLE)).containsOnlyKeys(new Term("title", "a"));
        assertThatThrownBy(() -> plan.termsByField().get(TITLE).put(new Term("title", "c"), true))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should unite sets and OR position flags when merging")
    void shouldMergePlans() {
        final WarmUpPlan first = new WarmUpPlan(Set.of(TITLE),
                Map.of(TITLE, Map.of(new Term("title", "a"), false)),
                Map.of(TITLE, Map.of(range("short"), false)),
                Set.of("ip"));
        final WarmUpPlan second = new WarmUpPlan(Set.of(DESC),
                Map.of(TITLE, Map.of(new Term("title", "a"), true, new Term("title", "b"), false)),
                Map.of(TITLE, Map.of(range("short"), true)),
                Set.of("dt"));

        final WarmUpPlan merged = first.merge(second);

        assertThat(merged.termDictFields()).containsExactly(TITLE, DESC);
        assertThat(merged.termsByField().get(TITLE))
                .containsEntry(new Term("title", "a"), true)
                .containsEntry(new Term("title", "b"), false);
        assertThat(merged.termRangesByField().get(TITLE)).containsExactly(Map.entry(range("short"), true));
        assertThat(merged.fastFieldNames()).containsExactly("dt", "ip");
        assertThat(second.merge(first)).isEqualTo(merged);
    }

    @Test
    @DisplayName("Should treat ranges with equal bounds and limit as the same entry")
    void shouldTreatEqualRangesAsOne() {
        final TermRange explicit = new TermRange(Bound.included(new Term("title", "short")),
                Bound.excluded(new Term("title", "shoru")), OptionalLong.of(50));

        assertThat(explicit).isEqualTo(range("short"));
        assertThat(explicit).isNotEqualTo(PrefixRanges.prefixTermToRange(new Term("title", "short"),
                OptionalLong.of(10)));
    }
}
