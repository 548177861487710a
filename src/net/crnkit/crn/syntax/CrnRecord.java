package net.crnkit.crn.syntax;

import net.crnkit.util.parser.TextLocation;

/**
 * A top-level item of a CRN document as produced by the grammar engine.
 */
public abstract class CrnRecord {

    private final TextLocation location;

    protected CrnRecord(TextLocation location) {
        this.location = location;
    }

    /**
     * Where the record starts in the input.
     */
    public TextLocation getLocation() {
        return location;
    }

}
