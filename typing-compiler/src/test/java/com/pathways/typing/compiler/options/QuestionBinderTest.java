package com.pathways.typing.compiler.options;

import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.QuestionType;
import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Outcome;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.compiler.merge.TreeMerger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.pathways.typing.compiler.CartFixtures.configuration;
import static com.pathways.typing.compiler.CartFixtures.leaf;
import static com.pathways.typing.compiler.CartFixtures.model;
import static com.pathways.typing.compiler.CartFixtures.regionModel;
import static com.pathways.typing.compiler.CartFixtures.stump;
import static com.pathways.typing.compiler.CartFixtures.tree;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionBinderTest {

    @Test
    @DisplayName("Should bind configured questions to splits and predicted classes to outcomes")
    void testBinding() {
        DecisionTree merged = new TreeMerger().merge(
                tree(stump("hh_size", 4.5, "A", "B"), Stratum.RURAL),
                tree(stump("hh_size", 6.5, "B", "B"), Stratum.URBAN));

        DecisionTree bound = new QuestionBinder(configuration()).apply(merged);

        assertThat(bound.root().question().name()).isEqualTo("hh_size");
        assertThat(bound.root().question().type()).isEqualTo(QuestionType.INTEGER);
        assertThat(bound.root().outcome()).isNull();
        Outcome left = bound.requireNode(2).outcome();
        assertThat(left.classes()).containsExactly(Map.entry(Stratum.RURAL, "A"), Map.entry(Stratum.URBAN, "B"));
        assertThat(left.isUniform()).isFalse();
        assertThat(bound.requireNode(3).outcome().isUniform()).isTrue();
        assertThat(merged.root().question()).isNull();
    }

    @Test
    @DisplayName("Should carry the configured choices of select questions")
    void testSelectChoices() {
        DecisionTree bound = new QuestionBinder(configuration()).apply(tree(regionModel(), Stratum.RURAL));

        assertThat(bound.root().question().choiceValues()).containsExactly("north", "south", "east");
        assertThat(bound.root().question().isRestricted()).isFalse();
    }

    @Test
    @DisplayName("Should bind an outcome for a stratum ending where another keeps splitting")
    void testMixedPosition() {
        DecisionTree merged = new TreeMerger().merge(
                tree(model(List.of(), leaf(1, "C", 100)), Stratum.RURAL),
                tree(stump("hh_size", 6.5, "A", "B"), Stratum.URBAN));

        DecisionTree bound = new QuestionBinder(configuration()).apply(merged);

        assertThat(bound.root().question().name()).isEqualTo("hh_size");
        assertThat(bound.root().outcome().classes()).containsExactly(Map.entry(Stratum.RURAL, "C"));
    }

    @Test
    @DisplayName("Should fail when a split variable has no configured question")
    void testMissingQuestion() {
        FormConfiguration configuration = FormConfiguration.builder()
                .question("hh_size", QuestionType.INTEGER, "Household size")
                .build();

        assertThatThrownBy(() -> new QuestionBinder(configuration).apply(tree(stump("age", 30, "A", "B"), Stratum.RURAL)))
                .isInstanceOf(ConfigReferenceException.class)
                .extracting(e -> ((ConfigReferenceException) e).getIdentifier())
                .isEqualTo("age");
    }
}
