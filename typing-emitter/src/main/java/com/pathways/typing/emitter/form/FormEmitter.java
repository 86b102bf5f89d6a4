/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.emitter.form;

import com.pathways.typing.api.config.ChoiceDefinition;
import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.FormSettings;
import com.pathways.typing.api.config.Labels;
import com.pathways.typing.api.config.QuestionDefinition;
import com.pathways.typing.api.config.QuestionType;
import com.pathways.typing.api.config.ScreeningQuestion;
import com.pathways.typing.api.form.FormDocument;
import com.pathways.typing.api.form.RowSet;
import com.pathways.typing.api.model.Attachment;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Outcome;
import com.pathways.typing.api.model.Question;
import com.pathways.typing.api.model.Relevance;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns a compiled tree into the survey, choices and settings sheets of an XLSForm.
 *
 * <p>Survey layout:
 * <pre>
 * begin_group screening      (only when screening is enabled)
 *   screening questions
 * end_group
 * begin_group typing         (label and relevance from the settings)
 *   per node, in pre-order:
 *     question row, then its calculated fields
 *     outcome row segment_&lt;id&gt;, then its notes
 *   segment                  (concatenation of the outcome fields)
 * end_group
 * </pre>
 * Collapsed duplicate occurrences emit no question rows. Emission is a pure function of the tree and the
 * configuration: the same input always gives the same rows.
 */
public class FormEmitter {

    private static final Logger logger = Logger.getLogger(FormEmitter.class.getName());

    public static final String TYPE = "type";
    public static final String NAME = "name";
    public static final String REQUIRED = "required";
    public static final String RELEVANT = "relevant";
    public static final String CALCULATION = "calculation";
    public static final String CHOICE_FILTER = "choice_filter";
    public static final String LIST_NAME = "list_name";

    public static final String TYPING_GROUP = "typing";
    public static final String SCREENING_GROUP = "screening";
    public static final String SEGMENT_FIELD = "segment";

    private static final String SRC_QUESTION = "${src_question}";

    private final FormConfiguration configuration;
    private final boolean enableScreening;

    public FormEmitter(FormConfiguration configuration) {
        this(configuration, false);
    }

    public FormEmitter(FormConfiguration configuration, boolean enableScreening) {
        this.configuration = configuration;
        this.enableScreening = enableScreening;
    }

    public FormDocument emit(DecisionTree tree) {
        FormSettings settings = configuration.settings();
        FieldNamer namer = FieldNamer.assign(tree, reservedNames(settings));
        XlsFormConditions conditions = new XlsFormConditions(namer, settings.strataField());

        RowSet survey = survey(tree, namer, conditions, settings);
        RowSet choices = choices(tree);
        RowSet settingsSheet = settingsSheet(settings);
        logger.info(String.format("Emitted form with %d survey rows, %d choices and %d settings rows",
                survey.size(), choices.size(), settingsSheet.size()));
        return new FormDocument(survey, choices, settingsSheet);
    }

    private Set<String> reservedNames(FormSettings settings) {
        Set<String> reserved = new LinkedHashSet<>();
        reserved.add(SEGMENT_FIELD);
        reserved.add(TYPING_GROUP);
        reserved.add(settings.strataField());
        if (enableScreening) {
            reserved.add(SCREENING_GROUP);
            for (ScreeningQuestion screening : configuration.screeningQuestions()) {
                reserved.add(screening.definition().name());
            }
        }
        return reserved;
    }

    // --- Survey ---

    private RowSet survey(DecisionTree tree, FieldNamer namer, XlsFormConditions conditions, FormSettings settings) {
        RowSet.Builder rows = RowSet.builder(FormDocument.SURVEY);
        rows.columns(TYPE, NAME);
        rows.columns(labelColumns(tree, settings).toArray(String[]::new));
        rows.columns(REQUIRED, RELEVANT, CALCULATION, CHOICE_FILTER);

        if (enableScreening) {
            rows.row(group("begin_group", SCREENING_GROUP, Labels.of("Screening"), ""));
            for (ScreeningQuestion screening : configuration.screeningQuestions()) {
                QuestionDefinition definition = screening.definition();
                Map<String, String> row = row(formType(definition.type(), definition.listName()), definition.name());
                row.putAll(definition.labels());
                row.putAll(definition.hints());
                row.put(REQUIRED, required(definition.type()));
                row.put(RELEVANT, screening.relevance());
                rows.row(row);
            }
            rows.row(row("end_group", ""));
        }

        rows.row(group("begin_group", TYPING_GROUP, settings.typingGroupLabels(), settings.typingGroupRelevance()));
        List<String> outcomeFields = new ArrayList<>();
        for (TreeNode node : tree.preorder()) {
            if (node.hasQuestion() && !node.isDuplicate()) {
                emitQuestion(node, namer, conditions, rows);
            }
            if (node.hasOutcome()) {
                outcomeFields.add(emitOutcome(node, tree.strata(), namer, conditions, settings, rows));
            }
        }
        Map<String, String> segment = row("calculate", SEGMENT_FIELD);
        segment.put(CALCULATION, concat(outcomeFields));
        rows.row(segment);
        rows.row(row("end_group", ""));
        return rows.build();
    }

    private void emitQuestion(TreeNode node, FieldNamer namer, XlsFormConditions conditions, RowSet.Builder rows) {
        Question question = node.question();
        String field = namer.questionField(node.id());
        String relevant = conditions.render(node.questionRelevance());

        if (question.hidden()) {
            Map<String, String> row = row("calculate", field);
            row.put(RELEVANT, relevant);
            row.put(CALCULATION, XlsFormConditions.literal(question.pinnedValue() == null ? "" : question.pinnedValue()));
            rows.row(row);
        } else {
            Map<String, String> row = row(formType(question.type(), question.listName()), field);
            row.putAll(question.labels());
            row.putAll(question.hints());
            row.put(REQUIRED, required(question.type()));
            row.put(RELEVANT, relevant);
            if (question.isSelect() && question.isRestricted()) {
                row.put(CHOICE_FILTER, choiceFilter(question));
            }
            rows.row(row);
        }

        List<Attachment> attachments = node.attachments();
        for (int i = 0; i < attachments.size(); i++) {
            Attachment attachment = attachments.get(i);
            if (attachment.scope() != Attachment.Scope.QUESTION) {
                continue;
            }
            Map<String, String> row = row("calculate", namer.attachmentField(node.id(), i));
            row.put(RELEVANT, relevant);
            row.put(CALCULATION, attachment.question().calculation().replace(SRC_QUESTION, XlsFormConditions.field(field)));
            rows.row(row);
        }
    }

    private String emitOutcome(TreeNode node, List<Stratum> strata, FieldNamer namer, XlsFormConditions conditions,
                               FormSettings settings, RowSet.Builder rows) {
        Outcome outcome = node.outcome();
        if (outcome == null) {
            throw new IllegalStateException("Outcome of node " + node.id() + " is not bound");
        }
        String field = Outcome.fieldName(node.id());
        Relevance reached = node.relevance().restrictTo(node.terminalStrata());
        Map<String, String> row = row("calculate", field);
        row.put(RELEVANT, conditions.render(reached));
        row.put(CALCULATION, outcomeCalculation(outcome, strata, settings));
        rows.row(row);

        List<Attachment> attachments = node.attachments();
        for (int i = 0; i < attachments.size(); i++) {
            Attachment attachment = attachments.get(i);
            if (attachment.scope() != Attachment.Scope.OUTCOME) {
                continue;
            }
            Relevance shown = attachment.strata().isEmpty() ? reached : reached.restrictTo(attachment.strata());
            Map<String, String> note = row(attachment.question().type().formName(), namer.attachmentField(node.id(), i));
            note.putAll(attachment.question().labels());
            note.put(RELEVANT, conditions.render(shown));
            rows.row(note);
        }
        return field;
    }

    /**
     * {@code 'A'} when every ending stratum predicts the same class, otherwise nested
     * {@code if()} over the stratum field in stratum order.
     */
    private static String outcomeCalculation(Outcome outcome, List<Stratum> strata, FormSettings settings) {
        List<Stratum> ordered = new ArrayList<>();
        for (Stratum stratum : strata) {
            if (outcome.classes().containsKey(stratum)) {
                ordered.add(stratum);
            }
        }
        if (outcome.isUniform() || ordered.size() == 1) {
            return XlsFormConditions.literal(outcome.classFor(ordered.get(0)));
        }
        String expression = XlsFormConditions.literal(outcome.classFor(ordered.get(ordered.size() - 1)));
        for (int i = ordered.size() - 2; i >= 0; i--) {
            Stratum stratum = ordered.get(i);
            expression = "if(" + XlsFormConditions.field(settings.strataField()) + " = "
                    + XlsFormConditions.literal(stratum.name()) + ", "
                    + XlsFormConditions.literal(outcome.classFor(stratum)) + ", " + expression + ")";
        }
        return expression;
    }

    private static String concat(List<String> fields) {
        if (fields.size() == 1) {
            return XlsFormConditions.field(fields.get(0));
        }
        List<String> references = new ArrayList<>(fields.size());
        for (String field : fields) {
            references.add(XlsFormConditions.field(field));
        }
        return "concat(" + String.join(", ", references) + ")";
    }

    private static String choiceFilter(Question question) {
        List<ChoiceDefinition> offered = question.offeredChoices();
        if (offered.isEmpty()) {
            return "false()";
        }
        List<String> tests = new ArrayList<>(offered.size());
        for (ChoiceDefinition choice : offered) {
            tests.add(NAME + " = " + XlsFormConditions.literal(choice.value()));
        }
        return String.join(" or ", tests);
    }

    private List<String> labelColumns(DecisionTree tree, FormSettings settings) {
        Set<String> labels = new LinkedHashSet<>(settings.typingGroupLabels().keySet());
        Set<String> hints = new LinkedHashSet<>();
        if (enableScreening) {
            labels.add(Labels.LABEL + "::" + Labels.DEFAULT_LANGUAGE);
            for (ScreeningQuestion screening : configuration.screeningQuestions()) {
                labels.addAll(screening.definition().labels().keySet());
                hints.addAll(screening.definition().hints().keySet());
            }
        }
        for (TreeNode node : tree.preorder()) {
            if (node.isDuplicate()) {
                continue;
            }
            if (node.hasQuestion() && !node.question().hidden()) {
                labels.addAll(node.question().labels().keySet());
                hints.addAll(node.question().hints().keySet());
            }
            for (Attachment attachment : node.attachments()) {
                labels.addAll(attachment.question().labels().keySet());
            }
        }
        List<String> columns = new ArrayList<>(labels);
        columns.addAll(hints);
        return columns;
    }

    // --- Choices ---

    private RowSet choices(DecisionTree tree) {
        RowSet.Builder rows = RowSet.builder(FormDocument.CHOICES);
        rows.columns(LIST_NAME, NAME);
        Set<String> seen = new LinkedHashSet<>();
        if (enableScreening) {
            configuration.screeningChoices().forEach((list, choices) -> addChoices(rows, seen, list, choices));
        }
        for (TreeNode node : tree.preorder()) {
            if (node.isDuplicate() || !node.hasQuestion()) {
                continue;
            }
            Question question = node.question();
            if (question.isSelect() && !question.hidden()) {
                addChoices(rows, seen, question.listName(), question.choices());
            }
        }
        return rows.build();
    }

    private static void addChoices(RowSet.Builder rows, Set<String> seen, String list, List<ChoiceDefinition> choices) {
        for (ChoiceDefinition choice : choices) {
            if (!seen.add(list + "\u0000" + choice.value())) {
                continue;
            }
            Map<String, String> row = new LinkedHashMap<>();
            row.put(LIST_NAME, list);
            row.put(NAME, choice.value());
            row.putAll(choice.labels());
            rows.row(row);
        }
    }

    // --- Settings ---

    private static RowSet settingsSheet(FormSettings settings) {
        RowSet.Builder rows = RowSet.builder(FormDocument.SETTINGS);
        Map<String, String> entries = settings.sheetEntries();
        if (!entries.isEmpty()) {
            rows.row(entries);
        }
        return rows.build();
    }

    // --- Helpers ---

    private static Map<String, String> row(String type, String name) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(TYPE, type);
        row.put(NAME, name);
        return row;
    }

    private static Map<String, String> group(String type, String name, Map<String, String> labels, String relevance) {
        Map<String, String> row = row(type, name);
        row.putAll(labels);
        row.put(RELEVANT, relevance);
        return row;
    }

    private static String formType(QuestionType type, String listName) {
        return type.isSelect() ? type.formName() + " " + listName : type.formName();
    }

    private static String required(QuestionType type) {
        return type.isRequiredByDefault() ? "yes" : "";
    }
}
