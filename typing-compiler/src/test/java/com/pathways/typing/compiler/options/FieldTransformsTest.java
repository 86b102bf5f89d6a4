package com.pathways.typing.compiler.options;

import com.pathways.typing.api.config.CalculateOption;
import com.pathways.typing.api.config.ChoiceDefinition;
import com.pathways.typing.api.config.HideOption;
import com.pathways.typing.api.config.QuestionType;
import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.model.Attachment;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Question;
import com.pathways.typing.api.model.Stratum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.pathways.typing.compiler.CartFixtures.configuration;
import static com.pathways.typing.compiler.CartFixtures.prepared;
import static com.pathways.typing.compiler.CartFixtures.regionModel;
import static com.pathways.typing.compiler.CartFixtures.tree;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Calculate and hide options, which change what is emitted for a question but not the tree.
 */
class FieldTransformsTest {

    private DecisionTree tree;

    @BeforeEach
    void setUp() {
        tree = prepared(configuration(), tree(regionModel(), Stratum.RURAL));
    }

    @Test
    @DisplayName("Should attach a calculated field to every occurrence of the question")
    void testCalculate() {
        CalculateOption option = new CalculateOption("hh_size", "large_household", "${src_question} >= 5");

        DecisionTree result = new CalculateTransform(option).apply(tree);

        assertThat(result.requireNode(3).attachments()).containsExactly(
                new Attachment(Question.calculate("large_household", "${src_question} >= 5"), Attachment.Scope.QUESTION));
        assertThat(result.root().attachments()).isEmpty();
        assertThat(tree.requireNode(3).attachments()).isEmpty();
    }

    @Test
    @DisplayName("Should hide a single choice of a select question")
    void testHideChoice() {
        DecisionTree result = new HideTransform(new HideOption("region", "east", null)).apply(tree);

        Question region = result.root().question();
        assertThat(region.hiddenChoices()).containsExactly("east");
        assertThat(region.offeredChoices()).extracting(ChoiceDefinition::value).containsExactly("north", "south");
        assertThat(region.hidden()).isFalse();
    }

    @Test
    @DisplayName("Should hide a whole question behind a pinned value")
    void testHideQuestion() {
        DecisionTree result = new HideTransform(new HideOption("hh_size", null, "3")).apply(tree);

        Question hhSize = result.requireNode(3).question();
        assertThat(hhSize.hidden()).isTrue();
        assertThat(hhSize.pinnedValue()).isEqualTo("3");
        assertThat(hhSize.type()).isEqualTo(QuestionType.INTEGER);
    }

    @Test
    @DisplayName("Should reject a hidden choice the question does not offer")
    void testUnknownChoice() {
        assertThatThrownBy(() -> new HideTransform(new HideOption("region", "west", null)).apply(tree))
                .isInstanceOf(ConfigReferenceException.class)
                .extracting(e -> ((ConfigReferenceException) e).getIdentifier())
                .isEqualTo("region:west");
    }

    @Test
    @DisplayName("Should reject options on questions the tree never asks")
    void testUnknownQuestion() {
        assertThatThrownBy(() -> new CalculateTransform(new CalculateOption("age", "adult", "${src_question} >= 18"))
                .apply(tree))
                .isInstanceOf(ConfigReferenceException.class)
                .extracting(e -> ((ConfigReferenceException) e).getIdentifier())
                .isEqualTo("age");
    }
}
