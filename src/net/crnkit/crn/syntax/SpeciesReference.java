package net.crnkit.crn.syntax;

import net.crnkit.util.parser.TextLocation;

/**
 * A species name with a stoichiometric multiplier, as written in a
 * reactant or product list.
 */
public class SpeciesReference {

    private final int multiplier;
    private final String name;
    private final TextLocation location;

    public SpeciesReference(int multiplier, String name,
                            TextLocation location) {
        if (multiplier < 1)
            throw new IllegalArgumentException("Invalid multiplier " +
                                               multiplier);
        if (name == null)
            throw new NullPointerException("Species name may not be null");
        this.multiplier = multiplier;
        this.name = name;
        this.location = location;
    }
    public SpeciesReference(String name, TextLocation location) {
        this(1, name, location);
    }

    public String toString() {
        return (multiplier == 1) ? name : multiplier + " " + name;
    }

    public boolean equals(Object other) {
        if (! (other instanceof SpeciesReference)) return false;
        SpeciesReference so = (SpeciesReference) other;
        return (multiplier == so.multiplier && name.equals(so.name));
    }

    public int hashCode() {
        return name.hashCode() * 31 + multiplier;
    }

    public int getMultiplier() {
        return multiplier;
    }

    public String getName() {
        return name;
    }

    public TextLocation getLocation() {
        return location;
    }

}
