package com.galois.proofgen.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Notations indexed by name.
 */
public final class NotationRegistry {
    private final Map<String, NotationDefinition> notations =
        new LinkedHashMap<String, NotationDefinition>();

    public NotationRegistry() {
    }

    /**
     * Add a notation.  Registering the same definition twice is allowed;
     * registering a different definition under a taken name is not.
     *
     * @param def the notation to add
     */
    public void register(NotationDefinition def) {
        NotationDefinition old = notations.get(def.name());
        if (old != null && !old.equals(def)) {
            String msg = String.format("Notation %s is already defined.", def.name());
            throw new IllegalArgumentException(msg);
        }
        notations.put(def.name(), def);
    }

    /**
     * Returns whether a notation is registered under <code>name</code>.
     */
    public boolean contains(String name) {
        return notations.containsKey(name);
    }

    /**
     * Returns the notation with the given name, or <code>null</code>.
     */
    public NotationDefinition lookup(String name) {
        return notations.get(name);
    }

    /**
     * Build the notation <code>name</code> applied to <code>args</code>.  If
     * no notation has that name, a placeholder notation is built that keeps
     * <code>symbol</code> and the arguments.
     *
     * @param name name of the notation
     * @param symbol symbol standing for the notation if it is unknown
     * @param args arguments of the notation
     * @return the notation instance
     */
    public Notation resolve(String name, Symbol symbol, List<Pattern> args) {
        NotationDefinition def = notations.get(name);
        if (def == null) {
            def = NotationDefinition.placeholder(name, symbol, args.size());
        }
        return def.apply(args);
    }

    /**
     * Return the registered notations in registration order.
     */
    public List<NotationDefinition> definitions() {
        return Collections.unmodifiableList(new ArrayList<NotationDefinition>(notations.values()));
    }

    public int size() {
        return notations.size();
    }
}
