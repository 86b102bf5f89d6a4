/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntUnaryOperator;
import java.util.stream.Collectors;

/**
 * Immutable AND of atoms along one root-to-node path.
 *
 * <p>A variable is constrained at most once per bound direction: when a path tests the same
 * variable again, the deeper test replaces the earlier one (numeric atoms with the same bound
 * direction) or is intersected with it (membership atoms). In a consistent tree the deeper
 * test is always the more specific one.
 */
public final class Conjunction {

    private static final Conjunction EMPTY = new Conjunction(List.of());

    private final List<Atom> atoms;

    private Conjunction(List<Atom> atoms) {
        this.atoms = List.copyOf(atoms);
    }

    public static Conjunction empty() {
        return EMPTY;
    }

    public static Conjunction of(Atom... atoms) {
        Conjunction conjunction = EMPTY;
        for (Atom atom : atoms) {
            conjunction = conjunction.and(atom);
        }
        return conjunction;
    }

    public Conjunction and(Atom atom) {
        List<Atom> next = new ArrayList<>(atoms.size() + 1);
        Atom added = atom;
        for (Atom existing : atoms) {
            if (!existing.variable().equals(atom.variable())) {
                next.add(existing);
            } else if (existing instanceof NumericAtom e && atom instanceof NumericAtom a
                    && e.comparison().isUpperBound() == a.comparison().isUpperBound()) {
                // replaced by the deeper test
                continue;
            } else if (existing instanceof MembershipAtom e && atom instanceof MembershipAtom a) {
                added = e.intersect(a);
            } else {
                next.add(existing);
            }
        }
        next.add(added);
        return new Conjunction(next);
    }

    public Conjunction and(Conjunction other) {
        Conjunction result = this;
        for (Atom atom : other.atoms) {
            result = result.and(atom);
        }
        return result;
    }

    public List<Atom> atoms() {
        return atoms;
    }

    public int size() {
        return atoms.size();
    }

    public boolean isEmpty() {
        return atoms.isEmpty();
    }

    /**
     * False when the atoms contradict each other, e.g. {@code x < 3 and x >= 5} or an empty
     * membership set.
     */
    public boolean isSatisfiable() {
        Map<String, double[]> bounds = new HashMap<>();
        Map<String, boolean[]> strict = new HashMap<>();
        for (Atom atom : atoms) {
            if (atom instanceof MembershipAtom membership && membership.values().isEmpty()) {
                return false;
            }
            if (atom instanceof NumericAtom numeric) {
                double[] b = bounds.computeIfAbsent(numeric.variable(),
                        k -> new double[]{Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY});
                boolean[] s = strict.computeIfAbsent(numeric.variable(), k -> new boolean[2]);
                if (numeric.comparison().isUpperBound()) {
                    b[1] = numeric.threshold();
                    s[1] = numeric.comparison().isStrict();
                } else {
                    b[0] = numeric.threshold();
                    s[0] = numeric.comparison().isStrict();
                }
            }
        }
        for (Map.Entry<String, double[]> entry : bounds.entrySet()) {
            double lower = entry.getValue()[0];
            double upper = entry.getValue()[1];
            boolean[] s = strict.get(entry.getKey());
            if (lower > upper || (lower == upper && (s[0] || s[1]))) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when every atom of this conjunction also appears in {@code other}, i.e. {@code other}
     * implies this conjunction syntactically.
     */
    public boolean subsumes(Conjunction other) {
        return other.atoms.containsAll(atoms);
    }

    public boolean test(Map<String, ?> answers) {
        for (Atom atom : atoms) {
            if (!atom.test(answers)) {
                return false;
            }
        }
        return true;
    }

    public Conjunction rewriteSource(int from, int to) {
        return remapSources(id -> id == from ? to : id);
    }

    /**
     * Re-targets every atom through {@code mapping}; ids mapped to themselves are kept.
     */
    public Conjunction remapSources(IntUnaryOperator mapping) {
        boolean changed = false;
        List<Atom> rewritten = new ArrayList<>(atoms.size());
        for (Atom atom : atoms) {
            int target = mapping.applyAsInt(atom.sourceNodeId());
            if (target != atom.sourceNodeId()) {
                rewritten.add(atom.withSource(target));
                changed = true;
            } else {
                rewritten.add(atom);
            }
        }
        return changed ? new Conjunction(rewritten) : this;
    }

    public List<Atom> atomsOn(String variable) {
        List<Atom> matching = new ArrayList<>();
        for (Atom atom : atoms) {
            if (atom.variable().equals(variable)) {
                matching.add(atom);
            }
        }
        return Collections.unmodifiableList(matching);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return atoms.equals(((Conjunction) o).atoms);
    }

    @Override
    public int hashCode() {
        return atoms.hashCode();
    }

    @Override
    public String toString() {
        if (atoms.isEmpty()) {
            return "true";
        }
        return atoms.stream().map(Atom::describe).collect(Collectors.joining(" and "));
    }
}
