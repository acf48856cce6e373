package com.galois.proofgen.execution;

import com.galois.proofgen.pattern.Location;
import com.galois.proofgen.pattern.Pattern;

/**
 * A simplification in progress.
 *
 * <p>
 * The location is relative to the result of the simplification below it
 * on the stack, or to the configuration for the bottom one.
 */
public final class SimplificationInfo {
    private final Location location;
    private final Pattern initialPattern;
    private Pattern result;
    private int simplificationsLeft;

    SimplificationInfo(Location location, Pattern initialPattern, Pattern result, int simplificationsLeft) {
        this.location = location;
        this.initialPattern = initialPattern;
        this.result = result;
        this.simplificationsLeft = simplificationsLeft;
    }

    public Location location() {
        return location;
    }

    /** The subpattern that is simplified. */
    public Pattern initialPattern() {
        return initialPattern;
    }

    public Pattern result() {
        return result;
    }

    void setResult(Pattern result) {
        this.result = result;
    }

    /** Number of nested simplifications still expected in the result. */
    public int simplificationsLeft() {
        return simplificationsLeft;
    }

    void decrementSimplificationsLeft() {
        --simplificationsLeft;
    }

    public String toString() {
        return String.format("%s at %s -> %s (%d left)",
                             initialPattern, location, result, simplificationsLeft);
    }
}
