package com.pathways.typing.emitter.diagram;

import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.SplitOption;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.compiler.merge.TreeMerger;
import com.pathways.typing.compiler.options.SplitTransform;
import com.pathways.typing.compiler.relevance.RelevanceCompiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.pathways.typing.emitter.EmitterFixtures.configuration;
import static com.pathways.typing.emitter.EmitterFixtures.configurationBuilder;
import static com.pathways.typing.emitter.EmitterFixtures.householdTree;
import static com.pathways.typing.emitter.EmitterFixtures.prepared;
import static com.pathways.typing.emitter.EmitterFixtures.stump;
import static com.pathways.typing.emitter.EmitterFixtures.tree;
import static org.assertj.core.api.Assertions.assertThat;

class MermaidDiagramEmitterTest {

    private FormConfiguration configuration;

    @BeforeEach
    void setUp() {
        configuration = configuration();
    }

    @Test
    @DisplayName("Should list each stratum's condition when the strata split differently")
    void testPerStratumConditions() {
        String diagram = new MermaidDiagramEmitter().emit(householdTree(configuration));

        assertThat(diagram).isEqualTo("""
                flowchart TD
                    n1["hh_size"]
                    n2["A"]
                    n3["B"]
                    n1 -->|"rural: hh_size < 4.5<br>urban: hh_size < 6.5"| n2
                    n1 -->|"rural: hh_size >= 4.5<br>urban: hh_size >= 6.5"| n3
                """);
    }

    @Test
    @DisplayName("Should label edges yes/no when every stratum uses the same rule")
    void testSharedRule() {
        String diagram = new MermaidDiagramEmitter().emit(householdTree(configuration, 4.5, 4.5));

        assertThat(diagram).contains("n1[\"hh_size < 4.5\"]");
        assertThat(diagram).contains("n1 -->|\"yes\"| n2");
        assertThat(diagram).contains("n1 -->|\"no\"| n3");
    }

    @Test
    @DisplayName("Should show node ids and conditions when asked to")
    void testNodeIdsAndConditionLabels() {
        DiagramOptions options = DiagramOptions.defaults().withNodeIds(true).withChoiceLabels(true);

        String diagram = new MermaidDiagramEmitter(options).emit(householdTree(configuration, 4.5, 4.5));

        assertThat(diagram).contains("n1[\"(1) hh_size < 4.5\"]");
        assertThat(diagram).contains("n2[\"(2) A\"]");
        assertThat(diagram).contains("n1 -->|\"hh_size < 4.5\"| n2");
        assertThat(diagram).contains("n1 -->|\"hh_size >= 4.5\"| n3");
    }

    @Test
    @DisplayName("Should add segment notes and question labels when asked to")
    void testNotesAndQuestionLabels() {
        DiagramOptions options = DiagramOptions.defaults().withNotes(true).withQuestionLabels(true);

        String diagram = new MermaidDiagramEmitter(options).emit(householdTree(configuration));

        assertThat(diagram).contains("n1[\"How many people live in the household?\"]");
        assertThat(diagram).contains("n2[\"A<br>Segment A\"]");
        assertThat(diagram).contains("n3[\"B<br>Segment B\"]");
    }

    @Test
    @DisplayName("Should draw an alternative subtree with a dotted edge labelled by its strata")
    void testAlternativeEdge() {
        DecisionTree merged = new TreeMerger().merge(
                tree(stump("hh_size", 4.5, "A", "B"), Stratum.RURAL),
                tree(stump("age", 30, "B", "A"), Stratum.URBAN));

        String diagram = new MermaidDiagramEmitter().emit(merged);

        assertThat(diagram).contains("n1 -.->|\"urban\"| n4");
        assertThat(diagram).contains("n4[\"age < 30\"]");
        assertThat(diagram).contains("n1 -->|\"yes\"| n2");
    }

    @Test
    @DisplayName("Should label choice edges with the value or the choice label")
    void testChoiceEdges() {
        SplitOption option = new SplitOption("hh_size", "residence", Map.of());
        FormConfiguration splitConfiguration = configurationBuilder().option(option).build().validate();
        DecisionTree split = new SplitTransform(option, splitConfiguration, new RelevanceCompiler()).apply(
                prepared(splitConfiguration,
                        tree(stump("hh_size", 4.5, "A", "B"), Stratum.RURAL),
                        tree(stump("hh_size", 4.5, "A", "B"), Stratum.URBAN)));

        String values = new MermaidDiagramEmitter().emit(split);
        String labels = new MermaidDiagramEmitter(DiagramOptions.defaults().withChoiceLabels(true)).emit(split);

        assertThat(values).contains("n1[\"residence\"]", "n1 -->|\"own\"| n2", "n1 -->|\"rent\"| n5");
        assertThat(labels).contains("n1 -->|\"Owned\"| n2", "n1 -->|\"Rented\"| n5");
    }

    @Test
    @DisplayName("Should render the same tree to the same text")
    void testDeterminism() {
        DecisionTree tree = householdTree(configuration);

        assertThat(new MermaidDiagramEmitter().emit(tree.copy()))
                .isEqualTo(new MermaidDiagramEmitter().emit(tree))
                .startsWith(MermaidDiagramEmitter.HEADER + "\n");
    }

    @Test
    @DisplayName("Should escape quotes in labels")
    void testEscape() {
        assertThat(MermaidDiagramEmitter.escape("the \"main\" earner")).isEqualTo("the #quot;main#quot; earner");
    }
}
