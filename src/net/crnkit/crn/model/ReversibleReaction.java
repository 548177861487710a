package net.crnkit.crn.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ReversibleReaction extends Reaction {

    private final RateConstant forwardRate;
    private final RateConstant backwardRate;

    public ReversibleReaction(List<String> reactants, List<String> products,
                              RateConstant forwardRate,
                              RateConstant backwardRate) {
        super(reactants, products);
        if (forwardRate == null || backwardRate == null)
            throw new NullPointerException(
                "Rates may not be null (use RateConstant.UNSPECIFIED)");
        this.forwardRate = forwardRate;
        this.backwardRate = backwardRate;
    }

    public String toString() {
        return String.format("%s@%h[reactants=%s,products=%s,kf=%s,kr=%s]",
            getClass().getName(), this, getReactants(), getProducts(),
            forwardRate, backwardRate);
    }

    public boolean isReversible() {
        return true;
    }

    public RateConstant getForwardRate() {
        return forwardRate;
    }

    public RateConstant getBackwardRate() {
        return backwardRate;
    }

    public List<RateConstant> getRates() {
        return Collections.unmodifiableList(
            Arrays.asList(forwardRate, backwardRate));
    }

    public String getArrow() {
        return "<=>";
    }

}
