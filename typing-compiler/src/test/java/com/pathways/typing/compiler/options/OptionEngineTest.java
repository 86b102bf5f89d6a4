package com.pathways.typing.compiler.options;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.config.CalculateOption;
import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.HideOption;
import com.pathways.typing.api.config.SplitOption;
import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.compiler.relevance.RelevanceCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.pathways.typing.compiler.CartFixtures.configuration;
import static com.pathways.typing.compiler.CartFixtures.configurationBuilder;
import static com.pathways.typing.compiler.CartFixtures.prepared;
import static com.pathways.typing.compiler.CartFixtures.stump;
import static com.pathways.typing.compiler.CartFixtures.tree;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptionEngineTest {

    @Test
    @DisplayName("Should apply transforms in order, each on the previous result")
    void testOrder() {
        List<String> calls = new ArrayList<>();
        DecisionTree input = prepared(configuration(), tree(stump("hh_size", 4.5, "A", "B"), Stratum.RURAL));
        OptionEngine engine = new OptionEngine(List.of(
                tree -> {
                    calls.add("first");
                    return tree.copy();
                },
                tree -> {
                    calls.add("second");
                    return tree;
                }));

        DecisionTree result = engine.apply(input);

        assertThat(calls).containsExactly("first", "second");
        assertThat(result).isNotSameAs(input);
        assertThat(engine.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should stop at the first failing transform")
    void testAbortOnFailure() {
        List<String> calls = new ArrayList<>();
        ITreeTransform failing = tree -> {
            calls.add("failing");
            throw new ConfigReferenceException("broken option", "broken");
        };
        OptionEngine engine = new OptionEngine(List.of(failing, tree -> {
            calls.add("never");
            return tree;
        }));
        DecisionTree input = prepared(configuration(), tree(stump("hh_size", 4.5, "A", "B"), Stratum.RURAL));

        assertThatThrownBy(() -> engine.apply(input))
                .isInstanceOf(ConfigReferenceException.class)
                .hasMessage("broken option");
        assertThat(calls).containsExactly("failing");
    }

    @Test
    @DisplayName("Should keep structural options in configuration order and defer hide options")
    void testOptionPartition() {
        FormConfiguration configuration = configurationBuilder()
                .option(new HideOption("region", "east", null))
                .option(new CalculateOption("hh_size", "large", "${src_question} >= 5"))
                .option(new SplitOption("hh_size", "residence", Map.of()))
                .build()
                .validate();

        List<ITreeTransform> structural = OptionTransforms.structural(configuration, new RelevanceCompiler());
        List<ITreeTransform> hiding = OptionTransforms.hiding(configuration);

        assertThat(structural).hasSize(2);
        assertThat(structural.get(0)).isInstanceOf(CalculateTransform.class);
        assertThat(structural.get(1)).isInstanceOf(SplitTransform.class);
        assertThat(hiding).singleElement().isInstanceOf(HideTransform.class);
    }
}
