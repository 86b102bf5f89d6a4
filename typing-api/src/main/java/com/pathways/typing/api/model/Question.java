/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import com.pathways.typing.api.config.ChoiceDefinition;
import com.pathways.typing.api.config.Labels;
import com.pathways.typing.api.config.QuestionDefinition;
import com.pathways.typing.api.config.QuestionType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Question bound to a tree position.
 *
 * <p>{@code availableChoices} is {@code null} while every configured choice is offered; once a
 * filter ran it holds the allowed values in configuration order (possibly none).
 * {@code hiddenChoices} are never offered but stay part of the choice list. A hidden question is
 * emitted as a calculated field pinned to {@code pinnedValue}.
 */
public record Question(
        String name,
        QuestionType type,
        Map<String, String> labels,
        Map<String, String> hints,
        String listName,
        List<ChoiceDefinition> choices,
        List<String> availableChoices,
        Set<String> hiddenChoices,
        boolean hidden,
        String pinnedValue,
        String calculation
) {

    public Question {
        Objects.requireNonNull(name, "Question name cannot be null");
        Objects.requireNonNull(type, "Question type cannot be null");
        labels = Labels.copyOf(labels);
        hints = Labels.copyOf(hints);
        listName = listName == null ? name : listName;
        choices = choices == null ? List.of() : List.copyOf(choices);
        availableChoices = availableChoices == null ? null : List.copyOf(new LinkedHashSet<>(availableChoices));
        hiddenChoices = hiddenChoices == null ? Set.of() : Set.copyOf(hiddenChoices);
    }

    public static Question of(QuestionDefinition definition, List<ChoiceDefinition> choices) {
        return new Question(definition.name(), definition.type(), definition.labels(), definition.hints(),
                definition.listName(), choices, null, Set.of(), false, null, null);
    }

    public static Question calculate(String name, String calculation) {
        return new Question(name, QuestionType.CALCULATE, Map.of(), Map.of(), null, List.of(), null, Set.of(),
                false, null, calculation);
    }

    public static Question note(String name, Map<String, String> labels) {
        return new Question(name, QuestionType.NOTE, labels, Map.of(), null, List.of(), null, Set.of(),
                false, null, null);
    }

    public List<String> choiceValues() {
        List<String> values = new ArrayList<>(choices.size());
        for (ChoiceDefinition choice : choices) {
            values.add(choice.value());
        }
        return values;
    }

    /**
     * Choices a respondent can pick, in configuration order.
     */
    public List<ChoiceDefinition> offeredChoices() {
        List<ChoiceDefinition> offered = new ArrayList<>();
        for (ChoiceDefinition choice : choices) {
            if (hiddenChoices.contains(choice.value())) {
                continue;
            }
            if (availableChoices != null && !availableChoices.contains(choice.value())) {
                continue;
            }
            offered.add(choice);
        }
        return offered;
    }

    public boolean isRestricted() {
        return availableChoices != null || !hiddenChoices.isEmpty();
    }

    public boolean isSelect() {
        return type.isSelect();
    }

    public String label() {
        return Labels.firstText(labels, name);
    }

    public Question withAvailableChoices(Collection<String> values) {
        List<String> ordered = new ArrayList<>();
        for (String value : choiceValues()) {
            if (values.contains(value)) {
                ordered.add(value);
            }
        }
        return new Question(name, type, labels, hints, listName, choices, ordered, hiddenChoices, hidden,
                pinnedValue, calculation);
    }

    /**
     * Union of the offered subsets of two bindings of the same question.
     */
    public Question widenAvailableChoices(Question other) {
        if (availableChoices == null || other.availableChoices == null) {
            return new Question(name, type, labels, hints, listName, choices, null, hiddenChoices, hidden,
                    pinnedValue, calculation);
        }
        Set<String> union = new LinkedHashSet<>(availableChoices);
        union.addAll(other.availableChoices);
        return withAvailableChoices(union);
    }

    public Question withHiddenChoice(String value) {
        Set<String> hiddenValues = new LinkedHashSet<>(hiddenChoices);
        hiddenValues.add(value);
        return new Question(name, type, labels, hints, listName, choices, availableChoices, hiddenValues, hidden,
                pinnedValue, calculation);
    }

    public Question hiddenAs(String value) {
        return new Question(name, type, labels, hints, listName, choices, availableChoices, hiddenChoices, true,
                value, calculation);
    }
}
