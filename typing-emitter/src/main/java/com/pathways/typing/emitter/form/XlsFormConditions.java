/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.emitter.form;

import com.pathways.typing.api.model.Atom;
import com.pathways.typing.api.model.Conjunction;
import com.pathways.typing.api.model.MembershipAtom;
import com.pathways.typing.api.model.NumericAtom;
import com.pathways.typing.api.model.Relevance;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.Thresholds;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders relevance conditions in XLSForm expression syntax.
 *
 * <ul>
 *   <li>numeric test: {@code ${hh_size} < 4.5}</li>
 *   <li>membership: {@code selected(${region}, 'north')}, several values joined with {@code or}</li>
 *   <li>stratum guard: {@code ${strata} = 'rural'}, omitted when every stratum shares the condition</li>
 *   <li>always true: empty string</li>
 * </ul>
 */
public class XlsFormConditions {

    private final FieldNamer namer;
    private final String strataField;

    public XlsFormConditions(FieldNamer namer, String strataField) {
        this.namer = namer;
        this.strataField = strataField;
    }

    public String render(Relevance relevance) {
        if (relevance == null || relevance.isAlwaysTrue()) {
            return "";
        }
        if (relevance.isNever()) {
            return "false()";
        }
        List<Relevance.StratumGroup> groups = relevance.groups();
        if (groups.size() == 1 && groups.get(0).strata().size() == relevance.universe().size()) {
            return disjunction(groups.get(0).disjuncts());
        }
        List<String> parts = new ArrayList<>(groups.size());
        for (Relevance.StratumGroup group : groups) {
            String guard = guard(group.strata());
            if (group.isUnconditional()) {
                parts.add(guard);
            } else {
                parts.add(guard + " and " + parenthesize(disjunction(group.disjuncts()), group.disjuncts().size() > 1));
            }
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        List<String> wrapped = new ArrayList<>(parts.size());
        for (String part : parts) {
            wrapped.add("(" + part + ")");
        }
        return String.join(" or ", wrapped);
    }

    /**
     * {@code ${strata} = 'rural'}, or an {@code or} of such tests for several strata.
     */
    public String guard(List<Stratum> strata) {
        List<String> tests = new ArrayList<>(strata.size());
        for (Stratum stratum : strata) {
            tests.add(field(strataField) + " = " + literal(stratum.name()));
        }
        return tests.size() == 1 ? tests.get(0) : "(" + String.join(" or ", tests) + ")";
    }

    public String atom(Atom atom) {
        String field = field(namer.questionField(atom.sourceNodeId()));
        if (atom instanceof NumericAtom numeric) {
            return field + " " + numeric.comparison().symbol() + " " + Thresholds.format(numeric.threshold());
        }
        if (atom instanceof MembershipAtom membership) {
            List<String> tests = new ArrayList<>(membership.values().size());
            for (String value : membership.values()) {
                tests.add("selected(" + field + ", " + literal(value) + ")");
            }
            return tests.size() == 1 ? tests.get(0) : "(" + String.join(" or ", tests) + ")";
        }
        throw new IllegalArgumentException("Unsupported atom: " + atom);
    }

    private String disjunction(List<Conjunction> disjuncts) {
        if (disjuncts.size() == 1) {
            return conjunction(disjuncts.get(0));
        }
        List<String> parts = new ArrayList<>(disjuncts.size());
        for (Conjunction conjunction : disjuncts) {
            parts.add("(" + conjunction(conjunction) + ")");
        }
        return String.join(" or ", parts);
    }

    private String conjunction(Conjunction conjunction) {
        if (conjunction.isEmpty()) {
            return "true()";
        }
        List<String> parts = new ArrayList<>(conjunction.size());
        for (Atom atom : conjunction.atoms()) {
            parts.add(atom(atom));
        }
        return String.join(" and ", parts);
    }

    private static String parenthesize(String expression, boolean needed) {
        return needed ? "(" + expression + ")" : expression;
    }

    static String field(String name) {
        return "${" + name + "}";
    }

    /**
     * String literal for {@code value}. XPath literals have no escape character, so a value
     * holding both quote kinds is built with {@code concat()} around each apostrophe.
     */
    static String literal(String value) {
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int quote = value.indexOf('\''); quote >= 0; quote = value.indexOf('\'', start)) {
            if (quote > start) {
                parts.add("'" + value.substring(start, quote) + "'");
            }
            parts.add("\"'\"");
            start = quote + 1;
        }
        if (start < value.length()) {
            parts.add("'" + value.substring(start) + "'");
        }
        return "concat(" + String.join(", ", parts) + ")";
    }
}
