package com.galois.proofgen.pattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Path from the root of a pattern to one of its subpatterns, given as
 * zero-based child indices.
 */
public final class Location {
    /** The location of the root. */
    public static final Location ROOT = new Location(new int[0]);

    private final int[] path;

    private Location(int[] path) {
        this.path = path;
    }

    /**
     * Create a location.
     * @param path non-negative child indices, outermost first
     * @return the location
     */
    public static Location of(int... path) {
        for (int i : path) {
            if (i < 0) {
                throw new IllegalArgumentException("Location indices must be non-negative.");
            }
        }
        return new Location(path.clone());
    }

    public static Location of(List<Integer> path) {
        int[] a = new int[path.size()];
        for (int i = 0; i != a.length; ++i) {
            a[i] = path.get(i);
        }
        return of(a);
    }

    public int depth() {
        return path.length;
    }

    public int index(int i) {
        return path[i];
    }

    public boolean isRoot() {
        return path.length == 0;
    }

    public List<Integer> indices() {
        List<Integer> r = new ArrayList<Integer>(path.length);
        for (int i : path) {
            r.add(i);
        }
        return Collections.unmodifiableList(r);
    }

    public boolean equals(Object o) {
        if (!(o instanceof Location)) return false;
        return Arrays.equals(path, ((Location) o).path);
    }

    public int hashCode() {
        return Arrays.hashCode(path);
    }

    public String toString() {
        return Arrays.toString(path);
    }
}
