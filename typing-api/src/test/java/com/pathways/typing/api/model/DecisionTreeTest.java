package com.pathways.typing.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionTreeTest {

    private static final List<Stratum> RURAL_ONLY = List.of(Stratum.RURAL);

    private TreeNode split(int id, String variable, double threshold) {
        TreeNode node = new TreeNode(id);
        node.putSplit(Stratum.RURAL, new NumericSplit(variable, Comparison.LESS_THAN, threshold));
        return node;
    }

    private TreeNode leaf(int id, String segment) {
        TreeNode node = new TreeNode(id);
        node.addTerminalStratum(Stratum.RURAL);
        node.putDistribution(Stratum.RURAL, new ClassDistribution(segment, 10));
        return node;
    }

    private DecisionTree sampleTree() {
        TreeNode root = split(1, "hh_size", 4.5);
        TreeNode left = root.addChild(Branch.HOLDS, split(2, "age", 30));
        left.addChild(Branch.HOLDS, leaf(4, "A"));
        left.addChild(Branch.FAILS, leaf(5, "B"));
        root.addChild(Branch.FAILS, leaf(3, "C"));
        return new DecisionTree(root, RURAL_ONLY, List.of("hh_size", "age"));
    }

    @Test
    @DisplayName("Should visit nodes in pre-order with children in stored order")
    void testPreorder() {
        DecisionTree tree = sampleTree();

        assertThat(tree.preorder()).extracting(TreeNode::id).containsExactly(1, 2, 4, 5, 3);
        assertThat(tree.leaves()).extracting(TreeNode::id).containsExactly(4, 5, 3);
        assertThat(tree.node(2).left()).map(TreeNode::id).contains(4);
        assertThat(tree.nextId()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should renumber in pre-order and follow relevance references")
    void testRenumber() {
        DecisionTree tree = sampleTree();
        TreeNode node5 = tree.node(5);
        node5.setRelevance(Relevance.always(RURAL_ONLY)
                .andAll(new NumericAtom(1, "hh_size", Comparison.LESS_THAN, 4.5))
                .andAll(new NumericAtom(2, "age", Comparison.GREATER_THAN_OR_EQUAL, 30)));
        tree.node(3).setDuplicateOf(5);

        tree.renumber();

        assertThat(tree.preorder()).extracting(TreeNode::id).containsExactly(1, 2, 3, 4, 5);
        assertThat(tree.node(4)).isSameAs(node5);
        assertThat(tree.node(5).duplicateOf()).isEqualTo(4);
        assertThat(node5.relevance().references()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should deep copy so edits never reach the original tree")
    void testCopyIsIndependent() {
        DecisionTree tree = sampleTree();

        DecisionTree copy = tree.copy();
        copy.node(3).setQuestion(Question.calculate("x", "1"));
        copy.node(2).clearChildren();
        copy.reindex();

        assertThat(tree.node(3).question()).isNull();
        assertThat(tree.size()).isEqualTo(5);
        assertThat(copy.size()).isEqualTo(3);
        assertThat(copy.node(2)).isNotSameAs(tree.node(2));
    }

    @Test
    @DisplayName("Should reject duplicate ids and double attachment")
    void testStructuralGuards() {
        TreeNode root = split(1, "x", 1);
        root.addChild(Branch.HOLDS, leaf(2, "A"));
        root.addChild(Branch.FAILS, leaf(2, "B"));
        assertThatThrownBy(() -> new DecisionTree(root, RURAL_ONLY, List.of("x")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate node id 2");

        TreeNode child = leaf(5, "A");
        split(3, "x", 1).addChild(Branch.HOLDS, child);
        assertThatThrownBy(() -> split(4, "x", 1).addChild(Branch.HOLDS, child))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should give a copied subtree fresh ids while keeping outside references")
    void testAssignIds() {
        DecisionTree tree = sampleTree();
        TreeNode subtree = tree.node(2).deepCopy();
        subtree.children().get(0).setRelevance(Relevance.always(RURAL_ONLY)
                .andAll(new NumericAtom(1, "hh_size", Comparison.LESS_THAN, 4.5))
                .andAll(new NumericAtom(2, "age", Comparison.LESS_THAN, 30)));

        int next = DecisionTree.assignIds(subtree, 10);

        assertThat(next).isEqualTo(13);
        assertThat(DecisionTree.preorder(subtree)).extracting(TreeNode::id).containsExactly(10, 11, 12);
        assertThat(subtree.children().get(0).relevance().references()).containsExactly(1, 10);
    }
}
