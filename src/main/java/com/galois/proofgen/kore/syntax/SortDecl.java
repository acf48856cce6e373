package com.galois.proofgen.kore.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sort declaration.
 */
public final class SortDecl {
    private final String name;
    private final List<App> attrs;

    public SortDecl(String name, List<App> attrs) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
        this.attrs = Collections.unmodifiableList(new ArrayList<App>(attrs));
    }

    public String name() {
        return name;
    }

    public List<App> attrs() {
        return attrs;
    }
}
