package net.crnkit.crn.model;

import java.util.Collections;
import java.util.List;

public class IrreversibleReaction extends Reaction {

    private final RateConstant rate;

    public IrreversibleReaction(List<String> reactants, List<String> products,
                                RateConstant rate) {
        super(reactants, products);
        if (rate == null)
            throw new NullPointerException(
                "Rate may not be null (use RateConstant.UNSPECIFIED)");
        this.rate = rate;
    }

    public String toString() {
        return String.format("%s@%h[reactants=%s,products=%s,k=%s]",
            getClass().getName(), this, getReactants(), getProducts(), rate);
    }

    public boolean isReversible() {
        return false;
    }

    public RateConstant getRate() {
        return rate;
    }

    public List<RateConstant> getRates() {
        return Collections.singletonList(rate);
    }

    public String getArrow() {
        return "->";
    }

}
