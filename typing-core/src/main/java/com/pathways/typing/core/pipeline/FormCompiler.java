/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.core.pipeline;

import com.pathways.typing.api.CompilationListener;
import com.pathways.typing.api.IFormCompiler;
import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.form.CompiledForm;
import com.pathways.typing.api.form.FormDocument;
import com.pathways.typing.api.model.CartModelDefinition;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;
import com.pathways.typing.compiler.analysis.ConfigurationValidator;
import com.pathways.typing.compiler.analysis.OutcomeAnalyzer;
import com.pathways.typing.compiler.merge.TreeMerger;
import com.pathways.typing.compiler.optimization.DuplicateQuestionCollapser;
import com.pathways.typing.compiler.options.ChoiceFilter;
import com.pathways.typing.compiler.options.OptionEngine;
import com.pathways.typing.compiler.options.OptionTransforms;
import com.pathways.typing.compiler.options.QuestionBinder;
import com.pathways.typing.compiler.options.RelevanceEnforcer;
import com.pathways.typing.compiler.options.SegmentNoteTransform;
import com.pathways.typing.compiler.relevance.RelevanceCompiler;
import com.pathways.typing.compiler.rpart.CartModelReader;
import com.pathways.typing.compiler.rpart.ParsedCartModel;
import com.pathways.typing.compiler.rpart.SplitParser;
import com.pathways.typing.compiler.rpart.TreeBuilder;
import com.pathways.typing.core.config.ConfigurationLoader;
import com.pathways.typing.core.infra.telemetry.TracingService;
import com.pathways.typing.emitter.diagram.MermaidDiagramEmitter;
import com.pathways.typing.emitter.form.FormEmitter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles stratum trees and a form configuration into a typing form and its flow diagram.
 *
 * <p>The compilation runs these stages, each in its own span:
 * <ol>
 *   <li>PARSING: decode every stratum model</li>
 *   <li>BUILDING: rebuild one tree per stratum</li>
 *   <li>MERGING: merge the stratum trees, in the iteration order of the model map</li>
 *   <li>BINDING: check the configuration against the trees and bind questions and outcomes</li>
 *   <li>RELEVANCE: compile per-node relevance</li>
 *   <li>OPTIONS: split and calculate options in configuration order, then segment notes,
 *       relevance enforcement and, when enabled, choice filtering</li>
 *   <li>DEDUPLICATION: collapse duplicate questions when enabled</li>
 *   <li>HIDING: hide options, after deduplication so every occurrence is hidden alike</li>
 *   <li>EMISSION: form rows and the flow diagram</li>
 * </ol>
 * A failing stage records the exception on its span, notifies the listener, logs and rethrows;
 * later stages do not run.
 */
public class FormCompiler implements IFormCompiler {
    private static final Logger logger = Logger.getLogger(FormCompiler.class.getName());

    private static final int TOTAL_STAGES = 9;

    private final CompilerOptions options;
    private final CartModelReader modelReader;
    private final ConfigurationLoader configurationLoader;
    private final SplitParser splitParser = new SplitParser();
    private final TreeBuilder treeBuilder = new TreeBuilder();
    private final TreeMerger treeMerger = new TreeMerger();
    private final RelevanceCompiler relevanceCompiler = new RelevanceCompiler();
    private final ConfigurationValidator configurationValidator = new ConfigurationValidator();
    private final OutcomeAnalyzer outcomeAnalyzer = new OutcomeAnalyzer();

    private Tracer tracer;
    private CompilationListener listener;

    public FormCompiler() {
        this(TracingService.getInstance().getTracer());
    }

    public FormCompiler(Tracer tracer) {
        this(tracer, CompilerOptions.defaults());
    }

    public FormCompiler(Tracer tracer, CompilerOptions options) {
        this(tracer, options, new CartModelReader(), new ConfigurationLoader());
    }

    public FormCompiler(Tracer tracer, CompilerOptions options, CartModelReader modelReader,
                        ConfigurationLoader configurationLoader) {
        this.tracer = tracer;
        this.options = options;
        this.modelReader = modelReader;
        this.configurationLoader = configurationLoader;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    public CompilerOptions options() {
        return options;
    }

    @Override
    public CompiledForm compile(Map<Stratum, Path> modelPaths, Path configurationPath) throws IOException {
        FormConfiguration configuration = configurationLoader.load(configurationPath);
        return compile(readModels(modelPaths), configuration);
    }

    @Override
    public CompiledForm compile(Map<Stratum, CartModelDefinition> models, FormConfiguration configuration) {
        requireModels(models);
        Span span = tracer.spanBuilder("compile-form").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("strata", models.keySet().toString());
            long startTime = System.nanoTime();

            Map<Stratum, ParsedCartModel> parsed = stage("PARSING", 1, () -> parse(models),
                    p -> Map.of("strata", p.size(), "nodeCount", nodeCount(p)));
            List<DecisionTree> trees = stage("BUILDING", 2, () -> build(parsed),
                    t -> Map.of("treeCount", t.size()));
            DecisionTree merged = stage("MERGING", 3, () -> treeMerger.merge(trees),
                    t -> Map.of("nodeCount", t.size()));
            DecisionTree bound = stage("BINDING", 4, () -> {
                configurationValidator.validate(configuration, trees).requireValid();
                return new QuestionBinder(configuration).apply(merged);
            }, t -> Map.of("questionCount", t.questionNodes().size(), "outcomeCount", t.leaves().size()));
            DecisionTree compiled = stage("RELEVANCE", 5, () -> relevanceCompiler.apply(bound),
                    t -> Map.of("nodeCount", t.size()));

            OptionEngine optionEngine = new OptionEngine(optionPasses(configuration));
            DecisionTree optioned = stage("OPTIONS", 6, () -> optionEngine.apply(compiled),
                    t -> Map.of("passes", optionEngine.size(), "nodeCount", t.size()));
            DecisionTree deduplicated = stage("DEDUPLICATION", 7, () -> options.mergeDuplicateQuestions()
                            ? new DuplicateQuestionCollapser(outcomeAnalyzer).apply(optioned) : optioned,
                    t -> Map.of("duplicateCount", duplicateCount(t)));
            OptionEngine hiding = new OptionEngine(OptionTransforms.hiding(configuration));
            DecisionTree finalTree = stage("HIDING", 8, () -> hiding.apply(deduplicated),
                    t -> Map.of("passes", hiding.size()));

            OutcomeAnalyzer.OutcomeReport outcomes = outcomeAnalyzer.analyze(finalTree);
            if (!outcomes.unreachable().isEmpty()) {
                logger.warning("Outcomes no respondent can reach: " + outcomes.unreachable());
            }

            FormEmitter formEmitter = new FormEmitter(configuration, options.enableScreening());
            MermaidDiagramEmitter diagramEmitter = new MermaidDiagramEmitter(options.formDiagram());
            FormDocument form = stage("EMISSION", 9, () -> formEmitter.emit(finalTree),
                    f -> Map.of("surveyRows", f.survey().size(), "choiceRows", f.choices().size()));
            String diagram = diagramEmitter.emit(finalTree);

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));
            span.setAttribute("nodeCount", finalTree.size());

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("strata", models.keySet().stream().map(Stratum::name).toList());
            stats.put("nodeCount", finalTree.size());
            stats.put("questionCount", finalTree.questionNodes().size());
            stats.put("outcomeCount", finalTree.leaves().size());
            stats.put("duplicateCount", duplicateCount(finalTree));
            stats.put("unreachableOutcomes", outcomes.unreachable().size());
            stats.put("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));

            logger.info(String.format("Compiled form for strata %s: %d nodes, %d questions, %d survey rows in %d ms",
                    models.keySet(), finalTree.size(), finalTree.questionNodes().size(), form.survey().size(),
                    TimeUnit.NANOSECONDS.toMillis(compilationTime)));
            return new CompiledForm(form, diagram, finalTree, stats);
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Diagram of the merged stratum trees before any question is bound.
     */
    public String compileCartDiagram(Map<Stratum, CartModelDefinition> models) {
        requireModels(models);
        Span span = tracer.spanBuilder("compile-cart-diagram").startSpan();
        try (Scope scope = span.makeCurrent()) {
            DecisionTree merged = treeMerger.merge(build(parse(models)));
            span.setAttribute("nodeCount", merged.size());
            String diagram = new MermaidDiagramEmitter(options.cartDiagram()).emit(merged);
            logger.info(String.format("Rendered diagram of %d merged nodes for strata %s", merged.size(), models.keySet()));
            return diagram;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            logger.log(Level.SEVERE, "Diagram rendering failed: " + e.getMessage(), e);
            throw e;
        } finally {
            span.end();
        }
    }

    public String compileCartDiagramFromFiles(Map<Stratum, Path> modelPaths) throws IOException {
        return compileCartDiagram(readModels(modelPaths));
    }

    /**
     * Checks a configuration against the stratum trees without compiling a form.
     */
    public ConfigurationValidator.ValidationReport validate(Map<Stratum, CartModelDefinition> models,
                                                            FormConfiguration configuration) {
        requireModels(models);
        Span span = tracer.spanBuilder("validate-configuration").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ConfigurationValidator.ValidationReport report =
                    configurationValidator.validate(configuration, build(parse(models)));
            span.setAttribute("problemCount", report.problems().size());
            return report;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    private List<ITreeTransform> optionPasses(FormConfiguration configuration) {
        List<ITreeTransform> passes = new ArrayList<>(OptionTransforms.structural(configuration, relevanceCompiler));
        if (options.segmentNotes()) {
            passes.add(new SegmentNoteTransform(configuration));
        }
        passes.add(new RelevanceEnforcer());
        if (options.skipUnavailableChoices()) {
            passes.add(new ChoiceFilter());
        }
        return passes;
    }

    private <T> T stage(String name, int number, Supplier<T> work, Function<T, Map<String, Object>> metrics) {
        Span span = tracer.spanBuilder("stage-" + name.toLowerCase()).startSpan();
        if (listener != null) {
            listener.onStageStart(name, number, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            T result = work.get();
            long duration = System.nanoTime() - start;
            Map<String, Object> stageMetrics = metrics.apply(result);
            stageMetrics.forEach((key, value) -> span.setAttribute(key, String.valueOf(value)));
            span.setAttribute("durationMs", TimeUnit.NANOSECONDS.toMillis(duration));
            if (listener != null) {
                listener.onStageComplete(name, new CompilationListener.StageResult(name, duration, stageMetrics));
            }
            logger.info(String.format("Stage %d/%d %s completed in %d ms %s",
                    number, TOTAL_STAGES, name, TimeUnit.NANOSECONDS.toMillis(duration), stageMetrics));
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            if (listener != null) {
                listener.onError(name, e);
            }
            logger.log(Level.SEVERE, "Stage " + name + " failed: " + e.getMessage(), e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Map<Stratum, ParsedCartModel> parse(Map<Stratum, CartModelDefinition> models) {
        Map<Stratum, ParsedCartModel> parsed = new LinkedHashMap<>();
        models.forEach((stratum, model) -> parsed.put(stratum, splitParser.parse(model)));
        return parsed;
    }

    private List<DecisionTree> build(Map<Stratum, ParsedCartModel> parsed) {
        List<DecisionTree> trees = new ArrayList<>(parsed.size());
        parsed.forEach((stratum, model) -> trees.add(treeBuilder.build(model, stratum)));
        return trees;
    }

    private Map<Stratum, CartModelDefinition> readModels(Map<Stratum, Path> modelPaths) throws IOException {
        Map<Stratum, CartModelDefinition> models = new LinkedHashMap<>();
        for (Map.Entry<Stratum, Path> entry : modelPaths.entrySet()) {
            models.put(entry.getKey(), modelReader.read(entry.getValue()));
        }
        return models;
    }

    private static void requireModels(Map<Stratum, ?> models) {
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("At least one stratum model is required");
        }
    }

    private static int nodeCount(Map<Stratum, ParsedCartModel> parsed) {
        int count = 0;
        for (ParsedCartModel model : parsed.values()) {
            count += model.nodeCount();
        }
        return count;
    }

    private static int duplicateCount(DecisionTree tree) {
        int count = 0;
        for (TreeNode node : tree.preorder()) {
            if (node.isDuplicate()) {
                count++;
            }
        }
        return count;
    }
}
