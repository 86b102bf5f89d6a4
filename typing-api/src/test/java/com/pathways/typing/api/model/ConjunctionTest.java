package com.pathways.typing.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConjunctionTest {

    private static NumericAtom num(int source, String variable, Comparison comparison, double threshold) {
        return new NumericAtom(source, variable, comparison, threshold);
    }

    private static MembershipAtom in(int source, String variable, String... values) {
        return new MembershipAtom(source, variable, List.of(values));
    }

    @Test
    @DisplayName("Should keep the deeper test when a variable is bounded twice in the same direction")
    void testDeeperNumericTestWins() {
        Conjunction conjunction = Conjunction.of(
                num(1, "hh_size", Comparison.LESS_THAN, 6.5),
                num(2, "hh_size", Comparison.LESS_THAN, 4.5));

        assertThat(conjunction.atoms()).containsExactly(num(2, "hh_size", Comparison.LESS_THAN, 4.5));
    }

    @Test
    @DisplayName("Should keep lower and upper bounds of the same variable side by side")
    void testOppositeBoundsKept() {
        Conjunction conjunction = Conjunction.of(
                num(1, "age", Comparison.GREATER_THAN_OR_EQUAL, 18),
                num(3, "age", Comparison.LESS_THAN, 65));

        assertThat(conjunction.size()).isEqualTo(2);
        assertThat(conjunction.isSatisfiable()).isTrue();
        assertThat(conjunction.test(Map.of("age", 30))).isTrue();
        assertThat(conjunction.test(Map.of("age", 70))).isFalse();
    }

    @Test
    @DisplayName("Should detect contradictory numeric bounds")
    void testContradictoryBounds() {
        assertThat(Conjunction.of(
                num(1, "x", Comparison.LESS_THAN, 3),
                num(2, "x", Comparison.GREATER_THAN_OR_EQUAL, 5)).isSatisfiable()).isFalse();
        assertThat(Conjunction.of(
                num(1, "x", Comparison.LESS_THAN, 3),
                num(2, "x", Comparison.GREATER_THAN_OR_EQUAL, 3)).isSatisfiable()).isFalse();
        assertThat(Conjunction.of(
                num(1, "x", Comparison.LESS_THAN_OR_EQUAL, 3),
                num(2, "x", Comparison.GREATER_THAN_OR_EQUAL, 3)).isSatisfiable()).isTrue();
    }

    @Test
    @DisplayName("Should intersect membership tests on the same variable")
    void testMembershipIntersection() {
        Conjunction conjunction = Conjunction.of(
                in(1, "region", "north", "south", "east"),
                in(4, "region", "south", "east", "west"));

        assertThat(conjunction.atoms()).containsExactly(in(4, "region", "south", "east"));
        assertThat(Conjunction.of(in(1, "region", "north"), in(2, "region", "south")).isSatisfiable()).isFalse();
    }

    @Test
    @DisplayName("Should treat a conjunction as implied by any superset of its atoms")
    void testSubsumption() {
        Conjunction shorter = Conjunction.of(num(1, "x", Comparison.LESS_THAN, 3));
        Conjunction longer = shorter.and(in(2, "region", "north"));

        assertThat(shorter.subsumes(longer)).isTrue();
        assertThat(longer.subsumes(shorter)).isFalse();
        assertThat(Conjunction.empty().subsumes(longer)).isTrue();
    }

    @Test
    @DisplayName("Should re-target atoms of one source node")
    void testRewriteSource() {
        Conjunction conjunction = Conjunction.of(num(3, "x", Comparison.LESS_THAN, 3), in(5, "region", "north"));

        Conjunction rewritten = conjunction.rewriteSource(5, 2);

        assertThat(rewritten.atoms()).containsExactly(num(3, "x", Comparison.LESS_THAN, 3), in(2, "region", "north"));
        assertThat(conjunction.rewriteSource(9, 1)).isSameAs(conjunction);
    }

    @Test
    @DisplayName("Should describe atoms in path order")
    void testToString() {
        assertThat(Conjunction.empty()).hasToString("true");
        assertThat(Conjunction.of(num(1, "hh_size", Comparison.LESS_THAN, 4.5), in(2, "region", "north", "east")))
                .hasToString("hh_size < 4.5 and region in {north, east}");
    }
}
