package net.crnkit.crn.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.crnkit.util.parser.TextLocation;

/**
 * A reaction as written, before multipliers are expanded and rates are
 * checked.
 */
public abstract class ReactionRecord extends CrnRecord {

    private final List<SpeciesReference> reactants;
    private final List<SpeciesReference> products;
    private final RateClause rateClause;

    protected ReactionRecord(List<SpeciesReference> reactants,
                             List<SpeciesReference> products,
                             RateClause rateClause, TextLocation location) {
        super(location);
        this.reactants = Collections.unmodifiableList(
            new ArrayList<SpeciesReference>(reactants));
        this.products = Collections.unmodifiableList(
            new ArrayList<SpeciesReference>(products));
        this.rateClause = rateClause;
    }

    public String toString() {
        return String.format("%s@%h[%s %s %s%s]", getClass().getName(),
            this, reactants, getArrow(), products,
            (rateClause == null) ? "" : " " + rateClause);
    }

    public List<SpeciesReference> getReactants() {
        return reactants;
    }

    public List<SpeciesReference> getProducts() {
        return products;
    }

    /**
     * The rate clause, or null if none was given.
     */
    public RateClause getRateClause() {
        return rateClause;
    }

    public abstract boolean isReversible();

    public abstract String getArrow();

}
