package net.crnkit.crn.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * A finalized CRN: its reactions plus the formal, signal, and fuel species.
 * The species lists are sorted and free of duplicates. Reactions are
 * additionally grouped into modules; a document parsed without module
 * grouping consists of a single module holding every reaction.
 * Every species occurring in a reaction must be formal, and no species may
 * be both a signal and a fuel; the constructor enforces both.
 * Instances are immutable.
 */
public final class CrnDocument {

    private final List<Reaction> reactions;
    private final List<List<Reaction>> modules;
    private final List<String> formals;
    private final List<String> signals;
    private final List<String> fuels;

    public CrnDocument(List<List<Reaction>> modules,
                       Collection<String> formals,
                       Collection<String> signals,
                       Collection<String> fuels) {
        List<Reaction> allReactions = new ArrayList<Reaction>();
        List<List<Reaction>> allModules = new ArrayList<List<Reaction>>();
        for (List<Reaction> m : modules) {
            for (Reaction r : m) {
                if (r == null)
                    throw new NullPointerException(
                        "Reactions may not be null");
            }
            allReactions.addAll(m);
            allModules.add(Collections.unmodifiableList(
                new ArrayList<Reaction>(m)));
        }
        this.reactions = Collections.unmodifiableList(allReactions);
        this.modules = Collections.unmodifiableList(allModules);
        this.formals = sorted(formals);
        this.signals = sorted(signals);
        this.fuels = sorted(fuels);
        for (Reaction r : allReactions) {
            if (! this.formals.containsAll(r.getReactants()) ||
                    ! this.formals.containsAll(r.getProducts()))
                throw new IllegalArgumentException("Species of reaction " +
                    r + " missing from formals " + this.formals);
        }
        for (String s : this.signals) {
            if (this.fuels.contains(s))
                throw new IllegalArgumentException("Species " + s +
                    " is both a signal and a fuel");
        }
    }

    public String toString() {
        return String.format("%s@%h[reactions=%s,formals=%s,signals=%s," +
            "fuels=%s]", getClass().getName(), this, reactions, formals,
            signals, fuels);
    }

    public boolean equals(Object other) {
        if (! (other instanceof CrnDocument)) return false;
        CrnDocument co = (CrnDocument) other;
        return (modules.equals(co.modules) && formals.equals(co.formals) &&
                signals.equals(co.signals) && fuels.equals(co.fuels));
    }

    public int hashCode() {
        return modules.hashCode() ^ formals.hashCode() * 7 ^
            signals.hashCode() * 13 ^ fuels.hashCode() * 17;
    }

    public List<Reaction> getReactions() {
        return reactions;
    }

    public List<List<Reaction>> getModules() {
        return modules;
    }

    public List<String> getFormals() {
        return formals;
    }

    public List<String> getSignals() {
        return signals;
    }

    public List<String> getFuels() {
        return fuels;
    }

    public List<String> getSpecies(SpeciesCategory cat) {
        switch (cat) {
            case FORMALS: return formals;
            case SIGNALS: return signals;
            case FUELS  : return fuels;
            default: throw new IllegalArgumentException(
                "Unknown species category " + cat);
        }
    }

    private static List<String> sorted(Collection<String> items) {
        return Collections.unmodifiableList(new ArrayList<String>(
            new TreeSet<String>(items)));
    }

}
