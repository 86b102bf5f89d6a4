/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pathways.typing.api.config.CalculateOption;
import com.pathways.typing.api.config.ChoiceDefinition;
import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.FormSettings;
import com.pathways.typing.api.config.HideOption;
import com.pathways.typing.api.config.Labels;
import com.pathways.typing.api.config.OptionDefinition;
import com.pathways.typing.api.config.QuestionDefinition;
import com.pathways.typing.api.config.QuestionType;
import com.pathways.typing.api.config.ScreeningQuestion;
import com.pathways.typing.api.config.SegmentDefinition;
import com.pathways.typing.api.config.SplitOption;
import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.model.Stratum;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads and writes the form configuration as JSON.
 *
 * <p>Tables and columns follow the configuration workbook:
 * <ul>
 *   <li>questions: {@code name}, {@code type} (optionally {@code select_one <list>}),
 *       {@code list_name}, {@code label::<lang>}, {@code hint::<lang>}</li>
 *   <li>choices: {@code list_name}, {@code name}, {@code label::<lang>}</li>
 *   <li>options: {@code option} ({@code split}, {@code calculate} or {@code hide}) and {@code config}</li>
 *   <li>segments: {@code strata} (blank for every stratum), {@code value}, {@code label::<lang>}</li>
 *   <li>settings: free key/value pairs</li>
 *   <li>screening_questions, screening_choices: as questions and choices, plus {@code relevant}</li>
 * </ul>
 * A bare {@code label} or {@code hint} column is read as the default language.
 */
public class ConfigurationLoader {

    private static final Logger logger = Logger.getLogger(ConfigurationLoader.class.getName());

    private static final TypeReference<Map<String, Object>> CONFIG_MAP = new TypeReference<>() {
    };

    static final String NAME = "name";
    static final String TYPE = "type";
    static final String LIST_NAME = "list_name";
    static final String STRATA = "strata";
    static final String VALUE = "value";
    static final String RELEVANT = "relevant";

    private final ObjectMapper objectMapper;

    public ConfigurationLoader() {
        this(new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ConfigurationLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads and validates a configuration file.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     * @throws ConfigReferenceException if a row is incomplete or references an unknown entry
     */
    public FormConfiguration load(Path path) throws IOException {
        FormConfiguration configuration = read(Files.readString(path));
        logger.info(String.format("Loaded configuration from %s: %d questions, %d options, %d segments",
                path, configuration.questions().size(), configuration.options().size(),
                configuration.segments().size()));
        return configuration;
    }

    public FormConfiguration read(String json) throws IOException {
        ConfigurationDocument document = objectMapper.readValue(json, ConfigurationDocument.class);
        return fromDocument(document).validate();
    }

    public void write(FormConfiguration configuration, Path path) throws IOException {
        Files.writeString(path, writeString(configuration));
        logger.info("Wrote configuration to " + path);
    }

    public String writeString(FormConfiguration configuration) throws IOException {
        return objectMapper.writeValueAsString(toDocument(configuration));
    }

    // --- Reading ---

    public FormConfiguration fromDocument(ConfigurationDocument document) {
        FormConfiguration.Builder builder = FormConfiguration.builder();

        Map<String, List<ChoiceDefinition>> lists = choiceLists(document.choices(), "choices");
        Set<String> usedLists = new HashSet<>();
        for (Map<String, String> row : document.questions()) {
            QuestionDefinition definition = question(row, "questions");
            builder.question(definition);
            List<ChoiceDefinition> choices = lists.get(definition.listName());
            if (choices != null) {
                usedLists.add(definition.listName());
                for (ChoiceDefinition choice : choices) {
                    builder.choice(definition.name(), choice);
                }
            }
        }
        for (String list : lists.keySet()) {
            if (!usedLists.contains(list)) {
                logger.warning("Ignoring choice list '" + list + "': no question uses it");
            }
        }

        for (ConfigurationDocument.OptionRow row : document.options()) {
            builder.option(option(row));
        }
        for (Map<String, String> row : document.segments()) {
            builder.segment(segment(row));
        }
        builder.settings(new FormSettings(document.settings()));

        for (Map<String, String> row : document.screeningQuestions()) {
            builder.screeningQuestion(new ScreeningQuestion(question(row, "screening_questions"), text(row, RELEVANT)));
        }
        choiceLists(document.screeningChoices(), "screening_choices")
                .forEach((list, choices) -> choices.forEach(choice -> builder.screeningChoice(list, choice)));
        return builder.build();
    }

    private static QuestionDefinition question(Map<String, String> row, String table) {
        String name = required(row, NAME, table);
        String[] typeParts = required(row, TYPE, table).trim().split("\\s+");
        QuestionType type;
        try {
            type = QuestionType.fromString(typeParts[0]);
        } catch (IllegalArgumentException e) {
            throw new ConfigReferenceException(
                    "Question '" + name + "' in table '" + table + "': " + e.getMessage(), name, e);
        }
        String listName = text(row, LIST_NAME);
        if (listName.isEmpty() && typeParts.length > 1) {
            listName = typeParts[1];
        }
        return new QuestionDefinition(name, type, localized(row, Labels.LABEL), localized(row, Labels.HINT), listName);
    }

    private static Map<String, List<ChoiceDefinition>> choiceLists(List<Map<String, String>> rows, String table) {
        Map<String, List<ChoiceDefinition>> lists = new LinkedHashMap<>();
        for (Map<String, String> row : rows) {
            String list = required(row, LIST_NAME, table);
            ChoiceDefinition choice = new ChoiceDefinition(required(row, NAME, table), localized(row, Labels.LABEL));
            lists.computeIfAbsent(list, k -> new ArrayList<>()).add(choice);
        }
        return lists;
    }

    private OptionDefinition option(ConfigurationDocument.OptionRow row) {
        String kind = row.option() == null ? "" : row.option().trim().toLowerCase();
        Class<? extends OptionDefinition> type = switch (kind) {
            case SplitOption.KIND -> SplitOption.class;
            case CalculateOption.KIND -> CalculateOption.class;
            case HideOption.KIND -> HideOption.class;
            default -> throw new ConfigReferenceException("Unknown option kind '" + row.option() + "'", row.option());
        };
        try {
            return objectMapper.convertValue(row.config(), type);
        } catch (IllegalArgumentException e) {
            Object question = row.config().get("src_question");
            throw new ConfigReferenceException("Invalid " + kind + " option: " + e.getMessage(),
                    question == null ? kind : question.toString(), e);
        }
    }

    private static SegmentDefinition segment(Map<String, String> row) {
        String strata = text(row, STRATA);
        return new SegmentDefinition(strata.isEmpty() ? null : Stratum.of(strata),
                required(row, VALUE, "segments"), localized(row, Labels.LABEL));
    }

    private static Map<String, String> localized(Map<String, String> row, String prefix) {
        Map<String, String> texts = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : row.entrySet()) {
            String value = entry.getValue();
            if (value == null || value.isBlank()) {
                continue;
            }
            String key = entry.getKey().trim();
            if (key.equals(prefix)) {
                texts.put(prefix + "::" + Labels.DEFAULT_LANGUAGE, value.trim());
            } else if (key.startsWith(prefix + "::")) {
                texts.put(key, value.trim());
            }
        }
        return texts;
    }

    private static String required(Map<String, String> row, String column, String table) {
        String value = text(row, column);
        if (value.isEmpty()) {
            throw new ConfigReferenceException("A row of table '" + table + "' has no '" + column + "': " + row, column);
        }
        return value;
    }

    private static String text(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null ? "" : value.trim();
    }

    // --- Writing ---

    public ConfigurationDocument toDocument(FormConfiguration configuration) {
        List<Map<String, String>> questions = new ArrayList<>();
        List<Map<String, String>> choices = new ArrayList<>();
        Set<String> writtenLists = new HashSet<>();
        for (QuestionDefinition definition : configuration.questions().values()) {
            questions.add(questionRow(definition));
            if (writtenLists.add(definition.listName())) {
                for (ChoiceDefinition choice : configuration.choices(definition.name())) {
                    choices.add(choiceRow(definition.listName(), choice));
                }
            }
        }

        List<ConfigurationDocument.OptionRow> options = new ArrayList<>();
        for (OptionDefinition option : configuration.options()) {
            Map<String, Object> config = new LinkedHashMap<>(objectMapper.convertValue(option, CONFIG_MAP));
            config.values().removeIf(Objects::isNull);
            options.add(new ConfigurationDocument.OptionRow(option.kind(), config));
        }

        List<Map<String, String>> segments = new ArrayList<>();
        for (SegmentDefinition segment : configuration.segments()) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put(STRATA, segment.stratum() == null ? "" : segment.stratum().name());
            row.put(VALUE, segment.value());
            row.putAll(segment.labels());
            segments.add(row);
        }

        List<Map<String, String>> screeningQuestions = new ArrayList<>();
        for (ScreeningQuestion screening : configuration.screeningQuestions()) {
            Map<String, String> row = questionRow(screening.definition());
            row.put(RELEVANT, screening.relevance() == null ? "" : screening.relevance());
            screeningQuestions.add(row);
        }
        List<Map<String, String>> screeningChoices = new ArrayList<>();
        configuration.screeningChoices().forEach((list, values) ->
                values.forEach(choice -> screeningChoices.add(choiceRow(list, choice))));

        return new ConfigurationDocument(questions, choices, options, segments,
                configuration.settings().asMap(), screeningQuestions, screeningChoices);
    }

    private static Map<String, String> questionRow(QuestionDefinition definition) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(NAME, definition.name());
        row.put(TYPE, definition.type().formName());
        if (!definition.listName().equals(definition.name())) {
            row.put(LIST_NAME, definition.listName());
        }
        row.putAll(definition.labels());
        row.putAll(definition.hints());
        return row;
    }

    private static Map<String, String> choiceRow(String list, ChoiceDefinition choice) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(LIST_NAME, list);
        row.put(NAME, choice.value());
        row.putAll(choice.labels());
        return row;
    }
}
