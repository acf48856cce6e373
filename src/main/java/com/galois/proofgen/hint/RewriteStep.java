package com.galois.proofgen.hint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.galois.proofgen.pattern.Location;
import com.galois.proofgen.pattern.Pattern;

/**
 * A trace step with its patterns converted.  Substitutions are keyed by
 * metavariable id.
 */
public final class RewriteStep {
    private final Pattern configurationBefore;
    private final int ordinal;
    private final Map<Integer, Pattern> substitution;
    private final List<FunctionalEvent> events;
    private final Location location;

    public RewriteStep(Pattern configurationBefore,
                       int ordinal,
                       Map<Integer, Pattern> substitution,
                       List<FunctionalEvent> events,
                       Location location) {
        this.configurationBefore = configurationBefore;
        this.ordinal = ordinal;
        this.substitution = Collections.unmodifiableMap(new TreeMap<Integer, Pattern>(substitution));
        this.events = Collections.unmodifiableList(new ArrayList<FunctionalEvent>(events));
        this.location = location;
    }

    /** Configuration before this step, or <code>null</code>. */
    public Pattern configurationBefore() {
        return configurationBefore;
    }

    public int ordinal() {
        return ordinal;
    }

    public Map<Integer, Pattern> substitution() {
        return substitution;
    }

    public List<FunctionalEvent> events() {
        return events;
    }

    /** Position of a simplification, or <code>null</code>. */
    public Location location() {
        return location;
    }

    public boolean isSimplification() {
        return location != null;
    }

    public String toString() {
        return String.format("step %d %s%s", ordinal, substitution,
                             location == null ? "" : " at " + location);
    }
}
