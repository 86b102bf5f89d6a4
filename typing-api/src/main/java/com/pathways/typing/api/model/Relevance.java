/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntUnaryOperator;
import java.util.stream.Collectors;

/**
 * Immutable visibility condition of a tree position.
 *
 * <p>For every stratum that can reach the position, the condition is a disjunction of
 * {@link Conjunction}s (a single conjunction until duplicate questions are collapsed). A
 * stratum absent from {@link #strata()} never reaches the position. The relevance of the root
 * is {@link #always(List)}.
 */
public final class Relevance {

    private final List<Stratum> universe;
    private final Map<Stratum, List<Conjunction>> paths;

    private Relevance(List<Stratum> universe, Map<Stratum, List<Conjunction>> paths) {
        this.universe = List.copyOf(universe);
        Map<Stratum, List<Conjunction>> ordered = new LinkedHashMap<>();
        for (Stratum stratum : this.universe) {
            List<Conjunction> disjuncts = paths.get(stratum);
            if (disjuncts != null && !disjuncts.isEmpty()) {
                ordered.put(stratum, List.copyOf(disjuncts));
            }
        }
        for (Stratum stratum : paths.keySet()) {
            if (!this.universe.contains(stratum)) {
                throw new IllegalArgumentException("Stratum '" + stratum + "' is not part of " + this.universe);
            }
        }
        this.paths = ordered;
    }

    public static Relevance always(List<Stratum> universe) {
        Map<Stratum, List<Conjunction>> paths = new LinkedHashMap<>();
        for (Stratum stratum : universe) {
            paths.put(stratum, List.of(Conjunction.empty()));
        }
        return new Relevance(universe, paths);
    }

    public static Relevance never(List<Stratum> universe) {
        return new Relevance(universe, Map.of());
    }

    public static Relevance of(List<Stratum> universe, Map<Stratum, List<Conjunction>> paths) {
        return new Relevance(universe, paths);
    }

    public List<Stratum> universe() {
        return universe;
    }

    /**
     * Strata that can reach this position, in universe order.
     */
    public Set<Stratum> strata() {
        return new LinkedHashSet<>(paths.keySet());
    }

    public List<Conjunction> paths(Stratum stratum) {
        return paths.getOrDefault(stratum, List.of());
    }

    public Relevance restrictTo(Collection<Stratum> strata) {
        Map<Stratum, List<Conjunction>> kept = new LinkedHashMap<>();
        for (Map.Entry<Stratum, List<Conjunction>> entry : paths.entrySet()) {
            if (strata.contains(entry.getKey())) {
                kept.put(entry.getKey(), entry.getValue());
            }
        }
        return new Relevance(universe, kept);
    }

    /**
     * Conjoins one atom per stratum; strata without an atom are dropped.
     */
    public Relevance and(Map<Stratum, ? extends Atom> atomsByStratum) {
        Map<Stratum, List<Conjunction>> next = new LinkedHashMap<>();
        for (Map.Entry<Stratum, List<Conjunction>> entry : paths.entrySet()) {
            Atom atom = atomsByStratum.get(entry.getKey());
            if (atom == null) {
                continue;
            }
            List<Conjunction> disjuncts = new ArrayList<>(entry.getValue().size());
            for (Conjunction conjunction : entry.getValue()) {
                Conjunction narrowed = conjunction.and(atom);
                if (narrowed.isSatisfiable()) {
                    disjuncts.add(narrowed);
                }
            }
            next.put(entry.getKey(), disjuncts);
        }
        return new Relevance(universe, next);
    }

    /**
     * Conjoins the same atom for every stratum.
     */
    public Relevance andAll(Atom atom) {
        Map<Stratum, Atom> atoms = new LinkedHashMap<>();
        for (Stratum stratum : paths.keySet()) {
            atoms.put(stratum, atom);
        }
        return and(atoms);
    }

    public Relevance or(Relevance other) {
        if (!universe.equals(other.universe)) {
            throw new IllegalArgumentException("Cannot combine relevance over " + universe + " and " + other.universe);
        }
        Map<Stratum, List<Conjunction>> union = new LinkedHashMap<>();
        for (Stratum stratum : universe) {
            Set<Conjunction> disjuncts = new LinkedHashSet<>(paths(stratum));
            disjuncts.addAll(other.paths(stratum));
            if (!disjuncts.isEmpty()) {
                union.put(stratum, new ArrayList<>(disjuncts));
            }
        }
        return new Relevance(universe, union);
    }

    /**
     * Drops contradictory and duplicate conjunctions and conjunctions implied by a shorter one
     * of the same stratum. Applying it twice gives the same result as applying it once.
     */
    public Relevance normalize() {
        Map<Stratum, List<Conjunction>> normalized = new LinkedHashMap<>();
        for (Map.Entry<Stratum, List<Conjunction>> entry : paths.entrySet()) {
            List<Conjunction> distinct = new ArrayList<>(new LinkedHashSet<>(entry.getValue()));
            distinct.removeIf(c -> !c.isSatisfiable());
            List<Conjunction> kept = new ArrayList<>();
            for (Conjunction candidate : distinct) {
                boolean absorbed = false;
                for (Conjunction other : distinct) {
                    if (other != candidate && other.size() < candidate.size() && other.subsumes(candidate)) {
                        absorbed = true;
                        break;
                    }
                }
                if (!absorbed) {
                    kept.add(candidate);
                }
            }
            normalized.put(entry.getKey(), kept);
        }
        return new Relevance(universe, normalized);
    }

    public Relevance rewriteSource(int from, int to) {
        return remapSources(id -> id == from ? to : id);
    }

    public Relevance remapSources(IntUnaryOperator mapping) {
        Map<Stratum, List<Conjunction>> rewritten = new LinkedHashMap<>();
        for (Map.Entry<Stratum, List<Conjunction>> entry : paths.entrySet()) {
            rewritten.put(entry.getKey(), entry.getValue().stream()
                    .map(c -> c.remapSources(mapping))
                    .toList());
        }
        return new Relevance(universe, rewritten);
    }

    /**
     * Ids of the nodes whose answers this condition reads.
     */
    public IntSet references() {
        IntSet references = new IntLinkedOpenHashSet();
        for (List<Conjunction> disjuncts : paths.values()) {
            for (Conjunction conjunction : disjuncts) {
                for (Atom atom : conjunction.atoms()) {
                    references.add(atom.sourceNodeId());
                }
            }
        }
        return references;
    }

    public boolean isAlwaysTrue() {
        if (paths.size() != universe.size()) {
            return false;
        }
        for (List<Conjunction> disjuncts : paths.values()) {
            if (disjuncts.stream().noneMatch(Conjunction::isEmpty)) {
                return false;
            }
        }
        return true;
    }

    public boolean isNever() {
        return paths.isEmpty();
    }

    public boolean test(Stratum stratum, Map<String, ?> answers) {
        for (Conjunction conjunction : paths(stratum)) {
            if (conjunction.test(answers)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Strata grouped by identical disjunct lists, in universe order. Used by renderers that
     * only need to mention a stratum when the strata disagree.
     */
    public List<StratumGroup> groups() {
        Map<List<Conjunction>, List<Stratum>> grouped = new LinkedHashMap<>();
        for (Map.Entry<Stratum, List<Conjunction>> entry : paths.entrySet()) {
            grouped.computeIfAbsent(entry.getValue(), k -> new ArrayList<>()).add(entry.getKey());
        }
        return grouped.entrySet().stream()
                .map(e -> new StratumGroup(e.getValue(), e.getKey()))
                .toList();
    }

    /**
     * A set of strata sharing the same disjunction of conjunctions.
     */
    public record StratumGroup(List<Stratum> strata, List<Conjunction> disjuncts) {
        public StratumGroup {
            strata = List.copyOf(strata);
            disjuncts = List.copyOf(disjuncts);
        }

        public boolean isUnconditional() {
            return disjuncts.stream().anyMatch(Conjunction::isEmpty);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relevance other = (Relevance) o;
        return universe.equals(other.universe) && paths.equals(other.paths);
    }

    @Override
    public int hashCode() {
        return Objects.hash(universe, paths);
    }

    @Override
    public String toString() {
        if (isAlwaysTrue()) {
            return "true";
        }
        if (isNever()) {
            return "false";
        }
        return groups().stream()
                .map(g -> g.strata() + ": " + g.disjuncts().stream()
                        .map(Conjunction::toString)
                        .collect(Collectors.joining(" or ")))
                .collect(Collectors.joining("; "));
    }
}
