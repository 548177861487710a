package net.crnkit.crn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import net.crnkit.crn.model.CrnDocument;
import net.crnkit.crn.model.IrreversibleReaction;
import net.crnkit.crn.model.RateConstant;
import net.crnkit.crn.model.Reaction;
import net.crnkit.crn.model.ReversibleReaction;
import net.crnkit.crn.model.SpeciesCategory;
import net.crnkit.crn.syntax.CrnRecord;
import net.crnkit.crn.syntax.DeclarationRecord;
import net.crnkit.crn.syntax.ModuleRecord;
import net.crnkit.crn.syntax.RateClause;
import net.crnkit.crn.syntax.ReactionRecord;
import net.crnkit.crn.syntax.SpeciesReference;
import net.crnkit.util.parser.TextLocation;

/**
 * Turns grammar records into a CrnDocument.
 *
 * Multipliers are expanded into repetitions, rate clauses are checked
 * against the reaction type, and species are sorted into categories:
 * every species occurring in a reaction is formal; signals default to the
 * formal species and fuels to none. No species may be both a signal and
 * a fuel. A reactant or product list may expand to at most
 * MAX_SIDE_SIZE species.
 *
 * Instances are stateless.
 */
public class CrnPostProcessor {

    public static final List<String> IRREVERSIBLE_RATES =
        Collections.singletonList("k");
    public static final List<String> REVERSIBLE_RATES =
        Collections.unmodifiableList(Arrays.asList("kf", "kr"));

    public static final int MAX_SIDE_SIZE = 65536;

    private static final Logger LOGGER = Logger.getLogger("CrnPostProcessor");

    public CrnDocument process(List<? extends CrnRecord> records)
            throws CrnFormatException, CrnConsistencyException {
        Map<SpeciesCategory, Set<String>> declared =
            new EnumMap<SpeciesCategory, Set<String>>(SpeciesCategory.class);
        for (SpeciesCategory c : SpeciesCategory.values())
            declared.put(c, new TreeSet<String>());
        Set<String> formals = declared.get(SpeciesCategory.FORMALS);
        List<List<Reaction>> modules = new ArrayList<List<Reaction>>();
        List<Reaction> loose = null;
        for (CrnRecord rec : records) {
            if (rec instanceof DeclarationRecord) {
                DeclarationRecord d = (DeclarationRecord) rec;
                declared.get(d.getCategory()).addAll(d.getIdentifiers());
            } else if (rec instanceof ModuleRecord) {
                List<Reaction> module = new ArrayList<Reaction>();
                for (ReactionRecord r : ((ModuleRecord) rec).getReactions())
                    module.add(convert(r, formals));
                modules.add(module);
            } else if (rec instanceof ReactionRecord) {
                if (loose == null) {
                    loose = new ArrayList<Reaction>();
                    modules.add(loose);
                }
                loose.add(convert((ReactionRecord) rec, formals));
            } else {
                throw new CrnFormatException("Unknown record type " +
                    ((rec == null) ? "null" : rec.getClass().getName()));
            }
        }
        CrnDocument ret = assemble(modules, formals,
            declared.get(SpeciesCategory.SIGNALS),
            declared.get(SpeciesCategory.FUELS));
        LOGGER.fine("Processed " + ret.getReactions().size() +
            " reactions in " + modules.size() + " modules; " +
            ret.getFormals().size() + " formal, " +
            ret.getSignals().size() + " signal, " +
            ret.getFuels().size() + " fuel species");
        return ret;
    }

    /**
     * Build a CrnDocument from already-converted reactions and declared
     * species, applying the category rules.
     * Every species occurring in a reaction is added to the formals; empty
     * signals default to the formals; overlapping signals and fuels are
     * rejected.
     */
    public static CrnDocument assemble(List<List<Reaction>> modules,
            Collection<String> formals, Collection<String> signals,
            Collection<String> fuels) throws CrnConsistencyException {
        Set<String> allFormals = new TreeSet<String>(formals);
        for (List<Reaction> m : modules) {
            for (Reaction r : m) {
                allFormals.addAll(r.getReactants());
                allFormals.addAll(r.getProducts());
            }
        }
        Set<String> allSignals = new TreeSet<String>(signals);
        if (allSignals.isEmpty()) allSignals.addAll(allFormals);
        Set<String> overlap = new TreeSet<String>(allSignals);
        overlap.retainAll(fuels);
        if (! overlap.isEmpty()) {
            CrnConsistencyException exc =
                new CrnConsistencyException(overlap);
            LOGGER.fine(exc.getMessage());
            throw exc;
        }
        return new CrnDocument(modules, allFormals, allSignals, fuels);
    }

    protected Reaction convert(ReactionRecord rec, Set<String> formals)
            throws CrnFormatException {
        List<String> reactants = expand(rec.getReactants());
        List<String> products = expand(rec.getProducts());
        formals.addAll(reactants);
        formals.addAll(products);
        if (rec.isReversible()) {
            List<RateConstant> rates = rates(rec, REVERSIBLE_RATES);
            return new ReversibleReaction(reactants, products, rates.get(0),
                                          rates.get(1));
        } else {
            List<RateConstant> rates = rates(rec, IRREVERSIBLE_RATES);
            return new IrreversibleReaction(reactants, products,
                                            rates.get(0));
        }
    }

    /**
     * Expand multipliers, preserving order: "A + 2 B" becomes [A, B, B].
     * Fails if the result would hold more than MAX_SIDE_SIZE species.
     */
    public static List<String> expand(List<SpeciesReference> refs)
            throws CrnFormatException {
        long total = 0;
        for (SpeciesReference r : refs) total += r.getMultiplier();
        if (total > MAX_SIDE_SIZE) {
            TextLocation loc = refs.get(0).getLocation();
            CrnFormatException exc = new CrnFormatException(
                "Species list " + ((loc == null) ? "" : "at " + loc + " ") +
                "expands to " + total + " species, at most " +
                MAX_SIDE_SIZE + " are allowed");
            LOGGER.fine(exc.getMessage());
            throw exc;
        }
        List<String> ret = new ArrayList<String>((int) total);
        for (SpeciesReference r : refs) {
            for (int i = 0; i < r.getMultiplier(); i++) ret.add(r.getName());
        }
        return ret;
    }

    /* Match the rate clause of rec against the expected names; an absent
     * clause yields as many unspecified rates. */
    private static List<RateConstant> rates(ReactionRecord rec,
            List<String> expected) throws CrnFormatException {
        RateClause clause = rec.getRateClause();
        List<RateConstant> ret = new ArrayList<RateConstant>();
        if (clause == null) {
            for (int i = 0; i < expected.size(); i++)
                ret.add(RateConstant.UNSPECIFIED);
            return ret;
        }
        if (! clause.getNames().equals(expected)) {
            StringBuilder want = new StringBuilder("[");
            for (String name : expected) {
                if (want.length() > 1) want.append(", ");
                want.append(name).append(" = <rate>");
            }
            want.append(']');
            CrnFormatException exc = new CrnFormatException(
                (rec.isReversible() ? "Reversible" : "Irreversible") +
                " reaction at " + rec.getLocation() + " requires rates " +
                want + ", got " + clause);
            LOGGER.fine(exc.getMessage());
            throw exc;
        }
        for (RateClause.Entry e : clause.getEntries())
            ret.add(RateConstant.of(e.getLiteral()));
        return ret;
    }

}
