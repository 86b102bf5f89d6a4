/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Holds when the answer of a categorical variable is one of {@link #values()}.
 * Values keep the declaration order of the variable's levels.
 */
public record MembershipAtom(
        int sourceNodeId,
        String variable,
        List<String> values
) implements Atom {

    public MembershipAtom {
        Objects.requireNonNull(variable, "Variable cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        values = List.copyOf(new LinkedHashSet<>(values));
    }

    /**
     * Keeps only the values allowed by both atoms; the source of {@code deeper} wins.
     */
    public MembershipAtom intersect(MembershipAtom deeper) {
        List<String> kept = new ArrayList<>(values);
        kept.retainAll(deeper.values());
        return new MembershipAtom(deeper.sourceNodeId(), variable, kept);
    }

    @Override
    public MembershipAtom withSource(int nodeId) {
        return new MembershipAtom(nodeId, variable, values);
    }

    @Override
    public boolean test(Object answer) {
        if (answer instanceof Collection<?> selected) {
            return selected.stream().anyMatch(v -> values.contains(String.valueOf(v)));
        }
        return answer != null && values.contains(String.valueOf(answer));
    }

    @Override
    public String describe() {
        if (values.size() == 1) {
            return variable + " = " + values.get(0);
        }
        return variable + " in {" + String.join(", ", values) + "}";
    }
}
