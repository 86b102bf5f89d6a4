/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.model.Stratum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed form configuration: questions, choices, options, segments, settings and screening
 * questions.
 *
 * <p>Cross references are checked once by {@link #validate()} so that a dangling reference
 * surfaces as a {@link ConfigReferenceException} before any tree transform runs.
 */
public final class FormConfiguration {

    private final Map<String, QuestionDefinition> questions;
    private final Map<String, List<ChoiceDefinition>> choices;
    private final List<OptionDefinition> options;
    private final List<SegmentDefinition> segments;
    private final FormSettings settings;
    private final List<ScreeningQuestion> screeningQuestions;
    private final Map<String, List<ChoiceDefinition>> screeningChoices;

    private FormConfiguration(Builder builder) {
        this.questions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.questions));
        Map<String, List<ChoiceDefinition>> choiceCopy = new LinkedHashMap<>();
        builder.choices.forEach((question, list) -> choiceCopy.put(question, List.copyOf(list)));
        this.choices = Collections.unmodifiableMap(choiceCopy);
        this.options = List.copyOf(builder.options);
        this.segments = List.copyOf(builder.segments);
        this.settings = builder.settings;
        this.screeningQuestions = List.copyOf(builder.screeningQuestions);
        Map<String, List<ChoiceDefinition>> screeningCopy = new LinkedHashMap<>();
        builder.screeningChoices.forEach((list, values) -> screeningCopy.put(list, List.copyOf(values)));
        this.screeningChoices = Collections.unmodifiableMap(screeningCopy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, QuestionDefinition> questions() {
        return questions;
    }

    public Optional<QuestionDefinition> question(String name) {
        return Optional.ofNullable(questions.get(name));
    }

    public QuestionDefinition requireQuestion(String name) {
        QuestionDefinition definition = questions.get(name);
        if (definition == null) {
            throw new ConfigReferenceException("No question configured for '" + name + "'", name);
        }
        return definition;
    }

    public List<ChoiceDefinition> choices(String question) {
        return choices.getOrDefault(question, List.of());
    }

    public Map<String, List<ChoiceDefinition>> choices() {
        return choices;
    }

    public List<OptionDefinition> options() {
        return options;
    }

    public List<SegmentDefinition> segments() {
        return segments;
    }

    /**
     * Segment for a predicted class; a stratum-specific row wins over a row for all strata.
     */
    public Optional<SegmentDefinition> segment(Stratum stratum, String value) {
        SegmentDefinition fallback = null;
        for (SegmentDefinition segment : segments) {
            if (!segment.value().equals(value)) {
                continue;
            }
            if (stratum.equals(segment.stratum())) {
                return Optional.of(segment);
            }
            if (segment.stratum() == null && fallback == null) {
                fallback = segment;
            }
        }
        return Optional.ofNullable(fallback);
    }

    public FormSettings settings() {
        return settings;
    }

    public List<ScreeningQuestion> screeningQuestions() {
        return screeningQuestions;
    }

    public Map<String, List<ChoiceDefinition>> screeningChoices() {
        return screeningChoices;
    }

    /**
     * Checks every cross reference between the tables.
     *
     * @return this configuration, for chaining
     * @throws ConfigReferenceException naming the first missing identifier
     */
    public FormConfiguration validate() {
        for (String question : choices.keySet()) {
            if (!questions.containsKey(question)) {
                throw new ConfigReferenceException("Choices reference unknown question '" + question + "'", question);
            }
        }
        for (QuestionDefinition definition : questions.values()) {
            if (definition.type().isSelect() && choices(definition.name()).isEmpty()) {
                throw new ConfigReferenceException(
                        "Select question '" + definition.name() + "' has no choices", definition.name());
            }
        }
        for (OptionDefinition option : options) {
            validateOption(option);
        }
        for (ScreeningQuestion screening : screeningQuestions) {
            QuestionDefinition definition = screening.definition();
            if (definition.type().isSelect() && !screeningChoices.containsKey(definition.listName())) {
                throw new ConfigReferenceException(
                        "Screening question '" + definition.name() + "' has no choice list '" + definition.listName() + "'",
                        definition.listName());
            }
        }
        return this;
    }

    private void validateOption(OptionDefinition option) {
        QuestionDefinition source = questions.get(option.question());
        if (source == null) {
            throw new ConfigReferenceException(
                    option.kind() + " option references unknown question '" + option.question() + "'", option.question());
        }
        if (option instanceof SplitOption split) {
            QuestionDefinition splitQuestion = questions.get(split.splitQuestion());
            if (splitQuestion == null) {
                throw new ConfigReferenceException(
                        "split option references unknown question '" + split.splitQuestion() + "'", split.splitQuestion());
            }
            if (splitQuestion.type() != QuestionType.SELECT_ONE) {
                throw new ConfigReferenceException(
                        "split question '" + split.splitQuestion() + "' must be select_one", split.splitQuestion());
            }
            List<String> values = choiceValues(split.splitQuestion());
            for (Map.Entry<String, String> entry : split.questionsByChoice().entrySet()) {
                if (!values.contains(entry.getKey())) {
                    throw new ConfigReferenceException("split option references unknown choice '" + entry.getKey()
                            + "' of '" + split.splitQuestion() + "'", split.splitQuestion() + ":" + entry.getKey());
                }
                if (!questions.containsKey(entry.getValue())) {
                    throw new ConfigReferenceException(
                            "split option references unknown question '" + entry.getValue() + "'", entry.getValue());
                }
            }
        } else if (option instanceof HideOption hide && hide.hidesChoice()) {
            if (!choiceValues(hide.question()).contains(hide.choice())) {
                throw new ConfigReferenceException("hide option references unknown choice '" + hide.choice()
                        + "' of '" + hide.question() + "'", hide.question() + ":" + hide.choice());
            }
        }
    }

    public List<String> choiceValues(String question) {
        List<String> values = new ArrayList<>();
        for (ChoiceDefinition choice : choices(question)) {
            values.add(choice.value());
        }
        return values;
    }

    public static final class Builder {
        private final Map<String, QuestionDefinition> questions = new LinkedHashMap<>();
        private final Map<String, List<ChoiceDefinition>> choices = new LinkedHashMap<>();
        private final List<OptionDefinition> options = new ArrayList<>();
        private final List<SegmentDefinition> segments = new ArrayList<>();
        private final List<ScreeningQuestion> screeningQuestions = new ArrayList<>();
        private final Map<String, List<ChoiceDefinition>> screeningChoices = new LinkedHashMap<>();
        private FormSettings settings = FormSettings.empty();

        private Builder() {
        }

        public Builder question(QuestionDefinition definition) {
            if (questions.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate question: " + definition.name());
            }
            return this;
        }

        public Builder question(String name, QuestionType type, String label) {
            return question(new QuestionDefinition(name, type, Labels.of(label)));
        }

        public Builder choice(String question, ChoiceDefinition choice) {
            List<ChoiceDefinition> list = choices.computeIfAbsent(question, k -> new ArrayList<>());
            for (ChoiceDefinition existing : list) {
                if (existing.value().equals(choice.value())) {
                    throw new IllegalArgumentException("Duplicate choice '" + choice.value() + "' for " + question);
                }
            }
            list.add(choice);
            return this;
        }

        public Builder choice(String question, String value, String label) {
            return choice(question, new ChoiceDefinition(value, Labels.of(label)));
        }

        public Builder option(OptionDefinition option) {
            options.add(Objects.requireNonNull(option));
            return this;
        }

        public Builder segment(SegmentDefinition segment) {
            segments.add(Objects.requireNonNull(segment));
            return this;
        }

        public Builder segment(Stratum stratum, String value, String label) {
            return segment(new SegmentDefinition(stratum, value, Labels.of(label)));
        }

        public Builder settings(FormSettings settings) {
            this.settings = Objects.requireNonNull(settings);
            return this;
        }

        public Builder screeningQuestion(ScreeningQuestion question) {
            screeningQuestions.add(Objects.requireNonNull(question));
            return this;
        }

        public Builder screeningChoice(String listName, ChoiceDefinition choice) {
            screeningChoices.computeIfAbsent(listName, k -> new ArrayList<>()).add(choice);
            return this;
        }

        public FormConfiguration build() {
            return new FormConfiguration(this);
        }
    }
}
