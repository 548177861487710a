package net.crnkit.crn.syntax;

import java.util.List;
import net.crnkit.util.parser.TextLocation;

public class IrreversibleRecord extends ReactionRecord {

    public IrreversibleRecord(List<SpeciesReference> reactants,
                              List<SpeciesReference> products,
                              RateClause rateClause, TextLocation location) {
        super(reactants, products, rateClause, location);
    }

    public boolean isReversible() {
        return false;
    }

    public String getArrow() {
        return "->";
    }

}
