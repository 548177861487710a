package net.crnkit.crn.syntax;

import java.util.List;
import net.crnkit.util.parser.TextLocation;

public class ReversibleRecord extends ReactionRecord {

    public ReversibleRecord(List<SpeciesReference> reactants,
                            List<SpeciesReference> products,
                            RateClause rateClause, TextLocation location) {
        super(reactants, products, rateClause, location);
    }

    public boolean isReversible() {
        return true;
    }

    public String getArrow() {
        return "<=>";
    }

}
