package com.pathways.typing.core.pipeline;

import com.pathways.typing.api.CompilationListener;
import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.QuestionType;
import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.form.CompiledForm;
import com.pathways.typing.api.form.RowSet;
import com.pathways.typing.api.model.CartModelDefinition;
import com.pathways.typing.api.model.CartModelDefinition.NodeRecord;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.compiler.analysis.ConfigurationValidator;
import com.pathways.typing.emitter.diagram.DiagramOptions;
import com.pathways.typing.emitter.form.FormEmitter;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class FormCompilerTest {

    private static final List<String> VARIABLES = List.of("hh_size", "age");
    private static final List<String> CLASSES = List.of("A", "B");

    @TempDir
    Path tempDir;

    @Mock
    CompilationListener listener;

    private FormCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new FormCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    @DisplayName("Should compile the rural/urban household size trees into one question and two outcomes")
    void testHouseholdSizeScenario() {
        CompiledForm compiled = compiler.compile(householdModels(), configuration());

        RowSet survey = compiled.form().survey();
        assertThat(survey.column(FormEmitter.NAME)).containsExactly(
                "typing", "hh_size", "segment_2", "segment_note_2", "segment_3", "segment_note_3", "segment", "");
        assertThat(survey.value(1, FormEmitter.RELEVANT)).isEmpty();
        assertThat(survey.value(2, FormEmitter.RELEVANT)).isEqualTo(
                "(${strata} = 'rural' and ${hh_size} < 4.5) or (${strata} = 'urban' and ${hh_size} < 6.5)");
        assertThat(survey.value(2, FormEmitter.CALCULATION)).isEqualTo("'A'");
        assertThat(survey.value(4, FormEmitter.CALCULATION)).isEqualTo("'B'");

        assertThat(compiled.tree().questionNodes()).hasSize(1);
        assertThat(compiled.tree().leaves()).hasSize(2);
        assertThat(compiled.diagram()).contains("rural: hh_size < 4.5<br>urban: hh_size < 6.5");
        assertThat(compiled.diagram()).doesNotContain("Segment A");
    }

    @Test
    @DisplayName("Should report compilation statistics")
    void testStats() {
        CompiledForm compiled = compiler.compile(householdModels(), configuration());

        assertThat(compiled.stats())
                .containsEntry("strata", List.of("rural", "urban"))
                .containsEntry("questionCount", 1)
                .containsEntry("outcomeCount", 2)
                .containsEntry("duplicateCount", 0)
                .containsEntry("unreachableOutcomes", 0)
                .containsKey("compilationTimeMs");
    }

    @Test
    @DisplayName("Should notify the listener of all nine stages in order")
    void testListenerStages() {
        compiler.setCompilationListener(listener);

        compiler.compile(householdModels(), configuration());

        verify(listener, times(9)).onStageStart(anyString(), anyInt(), eq(9));
        verify(listener).onStageStart("PARSING", 1, 9);
        verify(listener).onStageStart("BINDING", 4, 9);
        verify(listener).onStageStart("HIDING", 8, 9);
        verify(listener).onStageStart("EMISSION", 9, 9);
        verify(listener, times(9)).onStageComplete(anyString(), any(CompilationListener.StageResult.class));
        verify(listener, never()).onError(anyString(), any());
    }

    @Test
    @DisplayName("Should stop at binding and rethrow when a split variable has no question")
    void testMissingQuestion() {
        compiler.setCompilationListener(listener);
        FormConfiguration configuration = FormConfiguration.builder()
                .question("age", QuestionType.INTEGER, "Age of the head of household")
                .segment(null, "A", "Segment A")
                .segment(null, "B", "Segment B")
                .build()
                .validate();

        assertThatThrownBy(() -> compiler.compile(householdModels(), configuration))
                .isInstanceOf(ConfigReferenceException.class)
                .hasMessageContaining("hh_size");

        verify(listener).onError(eq("BINDING"), any(ConfigReferenceException.class));
        verify(listener, never()).onStageStart(eq("RELEVANCE"), anyInt(), anyInt());
    }

    @Test
    @DisplayName("Should reject an empty model map")
    void testNoModels() {
        assertThatThrownBy(() -> compiler.compile(Map.of(), configuration()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should give the same form for the same inputs")
    void testDeterminism() {
        CompiledForm first = compiler.compile(householdModels(), configuration());
        CompiledForm second = compiler.compile(householdModels(), configuration());

        assertThat(second.form()).isEqualTo(first.form());
        assertThat(second.diagram()).isEqualTo(first.diagram());
    }

    @Test
    @DisplayName("Should add segment notes to the form diagram only when asked to")
    void testFormDiagramNotes() {
        FormCompiler withNotes = new FormCompiler(OpenTelemetry.noop().getTracer("test"),
                CompilerOptions.defaults().withFormDiagram(
                        DiagramOptions.defaults().withNotes(true)));

        assertThat(withNotes.compile(householdModels(), configuration()).diagram()).contains("Segment A");
    }

    @Test
    @DisplayName("Should leave segment notes out when disabled")
    void testWithoutSegmentNotes() {
        FormCompiler withoutNotes = new FormCompiler(OpenTelemetry.noop().getTracer("test"),
                CompilerOptions.defaults().withSegmentNotes(false));

        RowSet survey = withoutNotes.compile(householdModels(), configuration()).form().survey();

        assertThat(survey.column(FormEmitter.TYPE)).doesNotContain("note");
    }

    @Test
    @DisplayName("Should draw the merged model tree with node ids before binding questions")
    void testCartDiagram() {
        String diagram = compiler.compileCartDiagram(householdModels());

        assertThat(diagram).startsWith("flowchart TD");
        assertThat(diagram).contains("(1) hh_size");
        assertThat(diagram).contains("rural: hh_size < 4.5<br>urban: hh_size < 6.5");
    }

    @Test
    @DisplayName("Should report configuration problems without compiling")
    void testValidate() {
        FormConfiguration configuration = FormConfiguration.builder()
                .question("hh_size", QuestionType.TEXT, "Household size")
                .build()
                .validate();

        ConfigurationValidator.ValidationReport report = compiler.validate(householdModels(), configuration);

        assertThat(report.isValid()).isFalse();
        assertThat(report.problems()).extracting(ConfigurationValidator.Problem::variable).contains("hh_size");
        assertThat(compiler.validate(householdModels(), configuration()).isValid()).isTrue();
    }

    @Test
    @DisplayName("Should compile models and configuration read from JSON files")
    void testCompileFromFiles() throws IOException {
        Path rural = tempDir.resolve("cart_rural.json");
        Path urban = tempDir.resolve("cart_urban.json");
        Path config = tempDir.resolve("config.json");
        Files.writeString(rural, stumpJson(4.5));
        Files.writeString(urban, stumpJson(6.5));
        Files.writeString(config, """
                {
                  "questions": [
                    {"name": "hh_size", "type": "integer", "label::English (en)": "How many people live in the household?"}
                  ],
                  "segments": [
                    {"strata": "", "value": "A", "label": "Segment A"},
                    {"strata": "", "value": "B", "label": "Segment B"}
                  ],
                  "settings": {"form_title": "Household typing"}
                }
                """);
        Map<Stratum, Path> models = new LinkedHashMap<>();
        models.put(Stratum.RURAL, rural);
        models.put(Stratum.URBAN, urban);

        CompiledForm compiled = compiler.compile(models, config);

        assertThat(compiled.form().survey().column(FormEmitter.NAME)).contains("hh_size", "segment");
        assertThat(compiled.form().settings().value(0, "form_title")).isEqualTo("Household typing");
        assertThat(compiled.form().survey().value(1, "label::English (en)"))
                .isEqualTo("How many people live in the household?");
    }

    private static String stumpJson(double threshold) {
        return """
                {
                  "variables": ["hh_size", "age"],
                  "ylevels": ["A", "B"],
                  "nodes": [
                    {"id": 1, "n": 100, "var": 0, "ncat": -1, "index": %s, "yval": 1},
                    {"id": 2, "n": 60, "yval": 1},
                    {"id": 3, "n": 40, "yval": 2}
                  ]
                }
                """.formatted(threshold);
    }

    private static Map<Stratum, CartModelDefinition> householdModels() {
        Map<Stratum, CartModelDefinition> models = new LinkedHashMap<>();
        models.put(Stratum.RURAL, stump(4.5));
        models.put(Stratum.URBAN, stump(6.5));
        return models;
    }

    private static CartModelDefinition stump(double threshold) {
        return new CartModelDefinition(VARIABLES, CLASSES, Map.of(), List.of(), List.of(
                new NodeRecord(1, 100, 0, -1, threshold, 1, null),
                new NodeRecord(2, 60, null, null, null, 1, null),
                new NodeRecord(3, 40, null, null, null, 2, null)));
    }

    private static FormConfiguration configuration() {
        return FormConfiguration.builder()
                .question("hh_size", QuestionType.INTEGER, "How many people live in the household?")
                .question("age", QuestionType.INTEGER, "Age of the head of household")
                .segment(null, "A", "Segment A")
                .segment(null, "B", "Segment B")
                .build()
                .validate();
    }
}
