package net.crnkit.crn.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A finalized reaction of a CRN.
 * Reactants and products are flat lists of species names in which
 * stoichiometric multipliers have already been expanded into repetitions.
 * Instances are immutable.
 */
public abstract class Reaction {

    private final List<String> reactants;
    private final List<String> products;

    protected Reaction(List<String> reactants, List<String> products) {
        if (reactants == null || products == null)
            throw new NullPointerException(
                "Reaction sides may not be null");
        this.reactants = Collections.unmodifiableList(
            new ArrayList<String>(reactants));
        this.products = Collections.unmodifiableList(
            new ArrayList<String>(products));
    }

    public boolean equals(Object other) {
        if (other == null || other.getClass() != getClass()) return false;
        Reaction ro = (Reaction) other;
        return (reactants.equals(ro.reactants) &&
                products.equals(ro.products) &&
                getRates().equals(ro.getRates()));
    }

    public int hashCode() {
        return reactants.hashCode() ^ products.hashCode() * 31 ^
            getRates().hashCode() ^ (isReversible() ? 1 : 0);
    }

    public List<String> getReactants() {
        return reactants;
    }

    public List<String> getProducts() {
        return products;
    }

    public abstract boolean isReversible();

    /**
     * The rate constants, one for irreversible and two (forward, then
     * backward) for reversible reactions.
     */
    public abstract List<RateConstant> getRates();

    /**
     * The arrow this reaction is written with.
     */
    public abstract String getArrow();

}
