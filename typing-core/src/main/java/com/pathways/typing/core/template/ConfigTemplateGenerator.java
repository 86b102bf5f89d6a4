/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.core.template;

import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.FormSettings;
import com.pathways.typing.api.config.Labels;
import com.pathways.typing.api.config.QuestionType;
import com.pathways.typing.api.model.CartModelDefinition;
import com.pathways.typing.api.model.NumericSplit;
import com.pathways.typing.api.model.SplitRule;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.compiler.rpart.ParsedCartModel;
import com.pathways.typing.compiler.rpart.SplitParser;
import com.pathways.typing.core.config.ConfigurationLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Derives a starting configuration from the stratum models.
 *
 * <p>Every variable used by a split gets a question labelled with its own name, in alphabetical
 * order. Variables split by level sets become {@code select_one} questions offering every
 * declared level. Numeric variables become {@code integer} questions when all their thresholds
 * fall on whole or half numbers, {@code decimal} otherwise. Each stratum gets one segment per
 * outcome class.
 */
public class ConfigTemplateGenerator {
    private static final Logger logger = Logger.getLogger(ConfigTemplateGenerator.class.getName());

    static final String DEFAULT_TITLE = "Typing tool";
    static final String DEFAULT_FORM_ID = "typing_tool";
    static final String DEFAULT_VERSION = "1";

    private final SplitParser splitParser;
    private final ConfigurationLoader loader;

    public ConfigTemplateGenerator() {
        this(new SplitParser(), new ConfigurationLoader());
    }

    public ConfigTemplateGenerator(SplitParser splitParser, ConfigurationLoader loader) {
        this.splitParser = splitParser;
        this.loader = loader;
    }

    public FormConfiguration generate(Map<Stratum, CartModelDefinition> models) {
        if (models.isEmpty()) {
            throw new IllegalArgumentException("At least one stratum model is required");
        }
        Map<String, VariableUsage> usages = new TreeMap<>();
        Map<Stratum, List<String>> classes = new LinkedHashMap<>();
        for (Map.Entry<Stratum, CartModelDefinition> entry : models.entrySet()) {
            ParsedCartModel parsed = splitParser.parse(entry.getValue());
            classes.put(entry.getKey(), parsed.classes());
            for (SplitRule rule : parsed.splits().values()) {
                VariableUsage usage = usages.computeIfAbsent(rule.variable(), VariableUsage::new);
                if (rule instanceof NumericSplit numeric) {
                    usage.integral &= isWholeOrHalf(numeric.threshold());
                } else {
                    usage.categorical = true;
                    List<String> levels = parsed.levels().get(rule.variable());
                    if (levels != null && usage.levels.isEmpty()) {
                        usage.levels.addAll(levels);
                    }
                }
            }
        }

        FormConfiguration.Builder builder = FormConfiguration.builder();
        for (VariableUsage usage : usages.values()) {
            builder.question(usage.variable, usage.type(), usage.variable);
            if (usage.categorical) {
                for (String level : usage.levels) {
                    builder.choice(usage.variable, level, level);
                }
            }
        }
        classes.forEach((stratum, values) -> {
            for (String value : values) {
                builder.segment(stratum, value, value);
            }
        });
        builder.settings(defaultSettings());

        FormConfiguration template = builder.build().validate();
        logger.info(String.format("Generated configuration template: %d questions, %d segments for strata %s",
                template.questions().size(), template.segments().size(), models.keySet()));
        return template;
    }

    public void write(Map<Stratum, CartModelDefinition> models, Path path) throws IOException {
        loader.write(generate(models), path);
    }

    static FormSettings defaultSettings() {
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put(FormSettings.FORM_TITLE, DEFAULT_TITLE);
        settings.put(FormSettings.FORM_ID, DEFAULT_FORM_ID);
        settings.put(FormSettings.VERSION, DEFAULT_VERSION);
        settings.put(FormSettings.DEFAULT_LANGUAGE, Labels.DEFAULT_LANGUAGE);
        settings.put(FormSettings.TYPING_GROUP_LABEL + "::" + Labels.DEFAULT_LANGUAGE, "Typing");
        return new FormSettings(settings);
    }

    static boolean isWholeOrHalf(double threshold) {
        double doubled = threshold * 2;
        return doubled == Math.rint(doubled);
    }

    private static final class VariableUsage {
        private final String variable;
        private final List<String> levels = new ArrayList<>();
        private boolean categorical;
        private boolean integral = true;

        private VariableUsage(String variable) {
            this.variable = variable;
        }

        private QuestionType type() {
            if (categorical) {
                return QuestionType.SELECT_ONE;
            }
            return integral ? QuestionType.INTEGER : QuestionType.DECIMAL;
        }
    }
}
