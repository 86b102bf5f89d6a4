package com.pathways.typing.compiler.merge;

import com.pathways.typing.api.exceptions.MergeConflictException;
import com.pathways.typing.api.model.Branch;
import com.pathways.typing.api.model.CartModelDefinition;
import com.pathways.typing.api.model.Comparison;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.NumericSplit;
import com.pathways.typing.api.model.Origin;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.pathways.typing.compiler.CartFixtures.CLASSES;
import static com.pathways.typing.compiler.CartFixtures.VARIABLES;
import static com.pathways.typing.compiler.CartFixtures.leaf;
import static com.pathways.typing.compiler.CartFixtures.model;
import static com.pathways.typing.compiler.CartFixtures.stump;
import static com.pathways.typing.compiler.CartFixtures.tree;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeMergerTest {

    private TreeMerger merger;

    @BeforeEach
    void setUp() {
        merger = new TreeMerger();
    }

    @Test
    @DisplayName("Should keep one position per split when both strata test the same variable")
    void testSameVariableDifferentThresholds() {
        DecisionTree merged = merger.merge(
                tree(stump("hh_size", 4.5, "A", "B"), Stratum.RURAL),
                tree(stump("hh_size", 6.5, "A", "B"), Stratum.URBAN));

        assertThat(merged.size()).isEqualTo(3);
        assertThat(merged.strata()).containsExactly(Stratum.RURAL, Stratum.URBAN);
        assertThat(merged.root().splits())
                .containsEntry(Stratum.RURAL, new NumericSplit("hh_size", Comparison.LESS_THAN, 4.5))
                .containsEntry(Stratum.URBAN, new NumericSplit("hh_size", Comparison.LESS_THAN, 6.5));
        assertThat(merged.root().variable()).contains("hh_size");
        assertThat(merged.leaves()).allSatisfy(leaf ->
                assertThat(leaf.terminalStrata()).containsExactly(Stratum.RURAL, Stratum.URBAN));
        assertThat(merged.root().relevance()).isNull();
    }

    @Test
    @DisplayName("Should give the same shape when a tree is merged with itself")
    void testIdempotence() {
        DecisionTree rural = tree(stump("hh_size", 4.5, "A", "B"), Stratum.RURAL);

        DecisionTree merged = merger.merge(rural, rural);

        assertThat(merged.preorder()).extracting(TreeNode::id)
                .containsExactlyElementsOf(rural.preorder().stream().map(TreeNode::id).toList());
        assertThat(merged.root().splits()).isEqualTo(rural.root().splits());
        assertThat(merged.requireNode(2).terminalStrata()).containsExactly(Stratum.RURAL);
        assertThat(merged.root().origins()).containsExactly(new Origin(Stratum.RURAL, 1), new Origin(Stratum.RURAL, 1));
    }

    @Test
    @DisplayName("Should keep the splitting side when the other stratum ends at the same position")
    void testTerminalAgainstSplit() {
        DecisionTree merged = merger.merge(
                tree(model(List.of(), leaf(1, "C", 100)), Stratum.RURAL),
                tree(stump("hh_size", 6.5, "A", "B"), Stratum.URBAN));

        TreeNode root = merged.root();
        assertThat(merged.size()).isEqualTo(3);
        assertThat(root.terminalStrata()).containsExactly(Stratum.RURAL);
        assertThat(root.splits()).containsOnlyKeys(Stratum.URBAN);
        assertThat(root.questionStrata()).containsExactly(Stratum.URBAN);
        assertThat(root.left().orElseThrow().strata()).containsExactly(Stratum.URBAN);
        assertThat(merged.leaves()).extracting(TreeNode::id).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Should attach the later subtree as an alternative when strata split on different variables")
    void testDifferentVariables() {
        DecisionTree merged = merger.merge(
                tree(stump("hh_size", 4.5, "A", "B"), Stratum.RURAL),
                tree(stump("age", 30, "B", "C"), Stratum.URBAN));

        TreeNode root = merged.root();
        assertThat(merged.size()).isEqualTo(6);
        assertThat(root.splits()).containsOnlyKeys(Stratum.RURAL);
        assertThat(root.strata()).containsExactly(Stratum.RURAL, Stratum.URBAN);

        TreeNode alternative = root.child(Branch.ALTERNATIVE).orElseThrow();
        assertThat(alternative.id()).isEqualTo(4);
        assertThat(alternative.strata()).containsExactly(Stratum.URBAN);
        assertThat(alternative.variable()).contains("age");
        assertThat(alternative.children()).hasSize(2);
        assertThat(merged.preorder()).extracting(TreeNode::id).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    @DisplayName("Should reject trees over different variable universes")
    void testDifferentUniverses() {
        CartModelDefinition narrow = new CartModelDefinition(List.of("hh_size", "age"), CLASSES, Map.of(), List.of(),
                List.of(leaf(1, "A", 10)));

        assertThatThrownBy(() -> merger.merge(
                tree(model(List.of(), leaf(1, "A", 10)), Stratum.RURAL),
                tree(narrow, Stratum.URBAN)))
                .isInstanceOf(MergeConflictException.class)
                .hasMessageContaining("different variables")
                .extracting(e -> ((MergeConflictException) e).getIdentifier())
                .isEqualTo("region");
    }

    @Test
    @DisplayName("Should reject a variable declared with different levels")
    void testDifferentLevels() {
        CartModelDefinition otherLevels = new CartModelDefinition(VARIABLES, CLASSES,
                Map.of("region", List.of("north", "south")), List.of(), List.of(leaf(1, "A", 10)));

        assertThatThrownBy(() -> merger.merge(
                tree(model(List.of(), leaf(1, "A", 10)), Stratum.RURAL),
                tree(otherLevels, Stratum.URBAN)))
                .isInstanceOf(MergeConflictException.class)
                .extracting(e -> ((MergeConflictException) e).getIdentifier())
                .isEqualTo("region");
    }

    @Test
    @DisplayName("Should reject one stratum splitting a position two ways")
    void testSameStratumConflict() {
        assertThatThrownBy(() -> merger.merge(
                tree(stump("hh_size", 4.5, "A", "B"), Stratum.RURAL),
                tree(stump("hh_size", 5.5, "A", "B"), Stratum.RURAL)))
                .isInstanceOf(MergeConflictException.class)
                .hasMessageContaining("hh_size < 4.5")
                .extracting(e -> ((MergeConflictException) e).getIdentifier())
                .isEqualTo("rural");
    }
}
