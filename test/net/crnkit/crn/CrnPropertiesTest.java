package net.crnkit.crn;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.crnkit.crn.model.CrnDocument;
import net.crnkit.crn.model.Reaction;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.From;
import net.jqwik.api.Property;
import net.jqwik.api.PropertyDefaults;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

@PropertyDefaults(tries = 200)
public class CrnPropertiesTest {

    private final CrnParser parser = new CrnParser();

    @Provide
    Arbitrary<String> species() {
        return Arbitraries.of("A", "B", "C", "X1", "fuel_2", "Zz", "k");
    }

    private static String side(List<String> names, int multiplier) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < names.size(); i++) {
            if (i != 0) sb.append(" + ");
            if (i == 0 && multiplier != 1) sb.append(multiplier).append(' ');
            sb.append(names.get(i));
        }
        return sb.toString();
    }

    /* One reaction per species group; reversible ones get rates. */
    private static String document(List<String> reactants,
                                   List<String> products, int multiplier,
                                   boolean reversible) {
        return side(reactants, multiplier) +
            (reversible ? " <=> " : " -> ") + side(products, 1) +
            (reversible ? " [kf = 1.5, kr = 2e-1]" : "") + "\n" +
            side(products, 1) + " -> " + side(reactants, 1) + "\n";
    }

    @Property
    void parsingIsDeterministic(
            @ForAll @Size(max = 5) List<@From("species") String> reactants,
            @ForAll @Size(max = 5) List<@From("species") String> products,
            @ForAll @IntRange(min = 1, max = 9) int multiplier,
            @ForAll boolean reversible) throws Exception {
        String text = document(reactants, products, multiplier, reversible);
        assertEquals(parser.parseString(text), parser.parseString(text));
    }

    @Property
    void multipliersExpandInPlace(
            @ForAll @Size(min = 1, max = 5)
                List<@From("species") String> reactants,
            @ForAll @IntRange(min = 1, max = 9) int multiplier)
            throws Exception {
        CrnDocument doc = parser.parseString(
            document(reactants, Collections.<String>emptyList(), multiplier,
                     false));
        List<String> expected = new ArrayList<String>();
        for (int i = 0; i < multiplier; i++) expected.add(reactants.get(0));
        expected.addAll(reactants.subList(1, reactants.size()));
        assertEquals(expected, doc.getReactions().get(0).getReactants());
    }

    @Property
    void formalsCoverEveryReactionSpecies(
            @ForAll @Size(max = 5) List<@From("species") String> reactants,
            @ForAll @Size(max = 5) List<@From("species") String> products,
            @ForAll @IntRange(min = 1, max = 3) int multiplier,
            @ForAll boolean reversible) throws Exception {
        CrnDocument doc = parser.parseString(
            document(reactants, products, multiplier, reversible) +
            "formals = {Extra}");
        Set<String> used = new TreeSet<String>();
        for (Reaction r : doc.getReactions()) {
            used.addAll(r.getReactants());
            used.addAll(r.getProducts());
        }
        assertTrue(doc.getFormals().containsAll(used));
        assertTrue(doc.getFormals().contains("Extra"));
        assertEquals(used.size() + 1, doc.getFormals().size());
    }

    @Property
    void signalsDefaultToFormals(
            @ForAll @Size(max = 5) List<@From("species") String> reactants,
            @ForAll @Size(max = 5) List<@From("species") String> products,
            @ForAll boolean reversible) throws Exception {
        CrnDocument doc = parser.parseString(
            document(reactants, products, 1, reversible));
        assertEquals(doc.getFormals(), doc.getSignals());
        assertTrue(doc.getFuels().isEmpty());
    }

    @Property
    void signalsAndFuelsAreDisjointOrRejected(
            @ForAll @Size(max = 4) List<@From("species") String> signals,
            @ForAll @Size(max = 4) List<@From("species") String> fuels)
            throws Exception {
        String text = "A -> B\nsignals = {" + joined(signals) + "}\n" +
            "fuels = {" + joined(fuels) + "}\n";
        Set<String> effectiveSignals = new TreeSet<String>(signals);
        if (effectiveSignals.isEmpty()) {
            effectiveSignals.add("A");
            effectiveSignals.add("B");
        }
        Set<String> overlap = new TreeSet<String>(effectiveSignals);
        overlap.retainAll(fuels);
        if (overlap.isEmpty()) {
            CrnDocument doc = parser.parseString(text);
            Set<String> both = new TreeSet<String>(doc.getSignals());
            both.retainAll(doc.getFuels());
            assertTrue(both.isEmpty());
        } else {
            CrnConsistencyException exc = assertThrows(
                CrnConsistencyException.class,
                () -> parser.parseString(text));
            assertEquals(new ArrayList<String>(overlap), exc.getSpecies());
        }
    }

    @Property
    void formattedDocumentsParseBack(
            @ForAll @Size(max = 5) List<@From("species") String> reactants,
            @ForAll @Size(max = 5) List<@From("species") String> products,
            @ForAll @IntRange(min = 1, max = 4) int multiplier,
            @ForAll boolean reversible) throws Exception {
        CrnDocument doc = parser.parseString(
            document(reactants, products, multiplier, reversible));
        assertEquals(doc, parser.parseString(CrnFormatter.format(doc)));
    }

    private static String joined(List<String> names) {
        StringBuilder sb = new StringBuilder();
        for (String n : names) {
            if (sb.length() != 0) sb.append(", ");
            sb.append(n);
        }
        return sb.toString();
    }

}
