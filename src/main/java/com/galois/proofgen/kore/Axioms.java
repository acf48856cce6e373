package com.galois.proofgen.kore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.galois.proofgen.pattern.Pattern;

/**
 * Axioms grouped by classification.  Each group keeps the order in which
 * its axioms were first added and holds no duplicates.
 */
public final class Axioms {
    private final EnumMap<AxiomType, List<ConvertedAxiom>> groups =
        new EnumMap<AxiomType, List<ConvertedAxiom>>(AxiomType.class);

    public Axioms() {
    }

    /**
     * Group a list of axioms by their classification.
     */
    public static Axioms organize(List<ConvertedAxiom> axioms) {
        Axioms r = new Axioms();
        for (ConvertedAxiom a : axioms) {
            r.add(a);
        }
        return r;
    }

    /**
     * Add an axiom unless it is already present.
     * @return whether the axiom was added
     */
    public boolean add(ConvertedAxiom axiom) {
        List<ConvertedAxiom> group = groups.get(axiom.kind());
        if (group == null) {
            group = new ArrayList<ConvertedAxiom>();
            groups.put(axiom.kind(), group);
        }
        if (group.contains(axiom)) return false;
        group.add(axiom);
        return true;
    }

    /**
     * Return the axioms of one classification, empty if there are none.
     */
    public List<ConvertedAxiom> get(AxiomType type) {
        List<ConvertedAxiom> group = groups.get(type);
        if (group == null) return Collections.<ConvertedAxiom>emptyList();
        return Collections.unmodifiableList(group);
    }

    /** Classifications with at least one axiom. */
    public Set<AxiomType> types() {
        return Collections.unmodifiableSet(groups.keySet());
    }

    /**
     * Return the patterns of all axioms, grouped in declaration order of
     * {@link AxiomType}.
     */
    public List<Pattern> patterns() {
        List<Pattern> r = new ArrayList<Pattern>();
        for (Map.Entry<AxiomType, List<ConvertedAxiom>> e : groups.entrySet()) {
            for (ConvertedAxiom a : e.getValue()) {
                r.add(a.pattern());
            }
        }
        return r;
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public String toString() {
        return groups.toString();
    }
}
