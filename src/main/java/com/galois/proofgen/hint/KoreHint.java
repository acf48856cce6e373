package com.galois.proofgen.hint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.proofgen.kore.syntax.KorePattern;
import com.galois.proofgen.pattern.Location;

/**
 * One step of an execution trace as reported by the backend: the axiom
 * that was applied, given by ordinal, and the values of its variables.
 */
public final class KoreHint {
    private final KorePattern configuration;
    private final int ordinal;
    private final Map<String, KorePattern> substitutions;
    private final List<FunctionalEvent> events;
    private final Location location;

    /**
     * @param configuration configuration before the step, or
     *   <code>null</code> if it is not reported
     * @param ordinal ordinal of the applied axiom
     * @param substitutions values of the axiom's variables, by name
     * @param events auxiliary events of the step
     * @param location position of a simplification, or <code>null</code>
     *   for a rewrite
     */
    public KoreHint(KorePattern configuration,
                    int ordinal,
                    Map<String, KorePattern> substitutions,
                    List<FunctionalEvent> events,
                    Location location) {
        this.configuration = configuration;
        this.ordinal = ordinal;
        this.substitutions = Collections.unmodifiableMap(new LinkedHashMap<String, KorePattern>(substitutions));
        this.events = Collections.unmodifiableList(new ArrayList<FunctionalEvent>(events));
        this.location = location;
    }

    public KorePattern configuration() {
        return configuration;
    }

    public int ordinal() {
        return ordinal;
    }

    public Map<String, KorePattern> substitutions() {
        return substitutions;
    }

    public List<FunctionalEvent> events() {
        return events;
    }

    public Location location() {
        return location;
    }
}
