package com.pathways.typing.core.template;

import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.FormSettings;
import com.pathways.typing.api.config.QuestionDefinition;
import com.pathways.typing.api.config.QuestionType;
import com.pathways.typing.api.config.SegmentDefinition;
import com.pathways.typing.api.model.CartModelDefinition;
import com.pathways.typing.api.model.CartModelDefinition.NodeRecord;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.core.config.ConfigurationLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigTemplateGeneratorTest {

    private static final List<String> VARIABLES = List.of("region", "hh_size", "income", "age");
    private static final List<String> CLASSES = List.of("A", "B", "C");

    @TempDir
    Path tempDir;

    private final ConfigTemplateGenerator generator = new ConfigTemplateGenerator();

    @Test
    @DisplayName("Should ask every split variable once, in alphabetical order")
    void testQuestions() {
        FormConfiguration template = generator.generate(models());

        assertThat(template.questions()).containsOnlyKeys("hh_size", "income", "region");
        assertThat(template.questions().keySet()).containsExactly("hh_size", "income", "region");
        assertThat(template.requireQuestion("hh_size").labels()).containsValue("hh_size");
    }

    @Test
    @DisplayName("Should guess question types from the splits")
    void testQuestionTypes() {
        FormConfiguration template = generator.generate(models());

        assertThat(template.questions().values()).extracting(QuestionDefinition::type)
                .containsExactly(QuestionType.INTEGER, QuestionType.DECIMAL, QuestionType.SELECT_ONE);
        assertThat(template.choiceValues("region")).containsExactly("north", "south", "east");
    }

    @Test
    @DisplayName("Should add one segment per class and stratum")
    void testSegments() {
        FormConfiguration template = generator.generate(models());

        assertThat(template.segments()).hasSize(6);
        assertThat(template.segments()).extracting(SegmentDefinition::stratum)
                .containsExactly(Stratum.RURAL, Stratum.RURAL, Stratum.RURAL,
                        Stratum.URBAN, Stratum.URBAN, Stratum.URBAN);
        assertThat(template.segments()).extracting(SegmentDefinition::value)
                .containsExactly("A", "B", "C", "A", "B", "C");
    }

    @Test
    @DisplayName("Should fill in default form settings")
    void testSettings() {
        FormConfiguration template = generator.generate(models());

        assertThat(template.settings().asMap())
                .containsEntry(FormSettings.FORM_TITLE, "Typing tool")
                .containsEntry(FormSettings.FORM_ID, "typing_tool")
                .containsKey(FormSettings.VERSION);
        assertThat(template.settings().typingGroupLabels()).containsValue("Typing");
    }

    @Test
    @DisplayName("Should write a template the configuration loader reads back")
    void testWrite() throws IOException {
        Path file = tempDir.resolve("template.json");

        generator.write(models(), file);
        FormConfiguration reloaded = new ConfigurationLoader().load(file);

        assertThat(reloaded.questions().keySet()).containsExactly("hh_size", "income", "region");
        assertThat(reloaded.choiceValues("region")).containsExactly("north", "south", "east");
        assertThat(reloaded.segments()).hasSize(6);
    }

    @Test
    @DisplayName("Should treat whole and half thresholds as integer splits")
    void testWholeOrHalf() {
        assertThat(ConfigTemplateGenerator.isWholeOrHalf(4.0)).isTrue();
        assertThat(ConfigTemplateGenerator.isWholeOrHalf(4.5)).isTrue();
        assertThat(ConfigTemplateGenerator.isWholeOrHalf(1234.75)).isFalse();
    }

    @Test
    @DisplayName("Should refuse to generate without models")
    void testNoModels() {
        assertThatThrownBy(() -> generator.generate(Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Rural: region north goes to A, the other regions split on hh_size &lt; 2.5 into B and C.
     * Urban: income &lt; 1234.75 goes to A, above to C.
     */
    private static Map<Stratum, CartModelDefinition> models() {
        CartModelDefinition rural = new CartModelDefinition(VARIABLES, CLASSES,
                Map.of("region", List.of("north", "south", "east")),
                List.of(List.of(1, 3, 3)),
                List.of(
                        new NodeRecord(1, 100, 0, 3, 1.0, 1, null),
                        new NodeRecord(2, 50, null, null, null, 1, null),
                        new NodeRecord(3, 50, 1, -1, 2.5, 2, null),
                        new NodeRecord(6, 30, null, null, null, 2, null),
                        new NodeRecord(7, 20, null, null, null, 3, null)));
        CartModelDefinition urban = new CartModelDefinition(VARIABLES, CLASSES, Map.of(), List.of(),
                List.of(
                        new NodeRecord(1, 100, 2, -1, 1234.75, 1, null),
                        new NodeRecord(2, 60, null, null, null, 1, null),
                        new NodeRecord(3, 40, null, null, null, 3, null)));
        Map<Stratum, CartModelDefinition> models = new LinkedHashMap<>();
        models.put(Stratum.RURAL, rural);
        models.put(Stratum.URBAN, urban);
        return models;
    }
}
