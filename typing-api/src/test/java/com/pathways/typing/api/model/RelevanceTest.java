package com.pathways.typing.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelevanceTest {

    private static final List<Stratum> BOTH = List.of(Stratum.RURAL, Stratum.URBAN);

    private final NumericSplit rural = new NumericSplit("hh_size", Comparison.LESS_THAN, 4.5);
    private final NumericSplit urban = new NumericSplit("hh_size", Comparison.LESS_THAN, 6.5);

    @Test
    @DisplayName("Should start from an unconditional relevance for every stratum")
    void testAlways() {
        Relevance always = Relevance.always(BOTH);

        assertThat(always.isAlwaysTrue()).isTrue();
        assertThat(always.strata()).containsExactly(Stratum.RURAL, Stratum.URBAN);
        assertThat(always.references()).isEmpty();
        assertThat(always).hasToString("true");
    }

    @Test
    @DisplayName("Should conjoin a different atom per stratum")
    void testPerStratumAtoms() {
        Relevance child = Relevance.always(BOTH).and(Map.of(Stratum.RURAL, rural.holds(1), Stratum.URBAN, urban.holds(1)));

        assertThat(child.isAlwaysTrue()).isFalse();
        assertThat(child.paths(Stratum.RURAL)).containsExactly(Conjunction.of(rural.holds(1)));
        assertThat(child.paths(Stratum.URBAN)).containsExactly(Conjunction.of(urban.holds(1)));
        assertThat(child.groups()).hasSize(2);
        assertThat(child.test(Stratum.RURAL, Map.of("hh_size", 5))).isFalse();
        assertThat(child.test(Stratum.URBAN, Map.of("hh_size", 5))).isTrue();
    }

    @Test
    @DisplayName("Should drop strata without an atom and restrict to the given strata")
    void testRestriction() {
        Relevance child = Relevance.always(BOTH).and(Map.of(Stratum.RURAL, rural.fails(1)));

        assertThat(child.strata()).containsExactly(Stratum.RURAL);
        assertThat(Relevance.always(BOTH).restrictTo(List.of(Stratum.URBAN)).strata()).containsExactly(Stratum.URBAN);
        assertThat(Relevance.never(BOTH).isNever()).isTrue();
    }

    @Test
    @DisplayName("Should never widen on descent")
    void testMonotonicity() {
        Relevance parent = Relevance.always(BOTH).andAll(rural.holds(1));
        Relevance child = parent.andAll(new NumericAtom(2, "age", Comparison.GREATER_THAN_OR_EQUAL, 18));

        for (Stratum stratum : child.strata()) {
            Conjunction parentPath = parent.paths(stratum).get(0);
            Conjunction childPath = child.paths(stratum).get(0);
            assertThat(childPath.size()).isEqualTo(parentPath.size() + 1);
            assertThat(parentPath.subsumes(childPath)).isTrue();
        }
    }

    @Test
    @DisplayName("Should absorb conjunctions implied by a shorter one when normalizing")
    void testNormalizeAbsorbs() {
        Conjunction shorter = Conjunction.of(rural.holds(1));
        Conjunction longer = shorter.and(new MembershipAtom(2, "region", List.of("north")));
        Conjunction contradiction = Conjunction.of(rural.holds(1), rural.fails(3));
        Relevance relevance = Relevance.of(BOTH, Map.of(Stratum.RURAL, List.of(longer, shorter, contradiction, shorter)));

        Relevance normalized = relevance.normalize();

        assertThat(normalized.paths(Stratum.RURAL)).containsExactly(shorter);
        assertThat(normalized.normalize()).isEqualTo(normalized);
    }

    @Test
    @DisplayName("Should OR relevance of two positions stratum by stratum")
    void testOr() {
        Relevance left = Relevance.always(BOTH).andAll(rural.holds(1));
        Relevance right = Relevance.always(BOTH).and(Map.of(Stratum.URBAN, rural.fails(1)));

        Relevance union = left.or(right);

        assertThat(union.paths(Stratum.RURAL)).containsExactly(Conjunction.of(rural.holds(1)));
        assertThat(union.paths(Stratum.URBAN)).containsExactly(Conjunction.of(rural.holds(1)), Conjunction.of(rural.fails(1)));
        assertThatThrownBy(() -> left.or(Relevance.always(List.of(Stratum.RURAL))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should report and remap referenced node ids")
    void testReferencesAndRemap() {
        Relevance relevance = Relevance.always(BOTH)
                .andAll(rural.holds(1))
                .andAll(new MembershipAtom(4, "region", List.of("north")));

        assertThat(relevance.references()).containsExactly(1, 4);
        assertThat(relevance.remapSources(id -> id == 4 ? 2 : id).references()).containsExactly(1, 2);
    }
}
