package net.crnkit.crn;

import java.util.List;
import net.crnkit.crn.model.CrnDocument;
import net.crnkit.crn.model.RateConstant;
import net.crnkit.crn.model.Reaction;
import net.crnkit.crn.model.SpeciesCategory;
import net.crnkit.util.Formats;

/**
 * Renders CRN documents back into the CRN language.
 * Runs of equal species are written with multipliers; rate clauses are
 * only written if every rate of the reaction is specified. The output
 * parses back into an equal document (in modular mode for
 * formatModules()).
 */
public final class CrnFormatter {

    public static final String LINE_SEPARATOR = "\n";

    /* Prevent construction */
    private CrnFormatter() {}

    /**
     * Render one reaction per line, followed by the declarations.
     */
    public static String format(CrnDocument doc) {
        StringBuilder sb = new StringBuilder();
        for (Reaction r : doc.getReactions())
            sb.append(formatReaction(r)).append(LINE_SEPARATOR);
        appendDeclarations(doc, sb);
        return sb.toString();
    }

    /**
     * Render each module on its own line, followed by the declarations.
     */
    public static String formatModules(CrnDocument doc) {
        StringBuilder sb = new StringBuilder();
        for (List<Reaction> module : doc.getModules()) {
            if (module.isEmpty()) continue;
            for (int i = 0; i < module.size(); i++) {
                if (i != 0) sb.append("; ");
                sb.append(formatReaction(module.get(i)));
            }
            sb.append(LINE_SEPARATOR);
        }
        appendDeclarations(doc, sb);
        return sb.toString();
    }

    public static String formatReaction(Reaction r) {
        StringBuilder sb = new StringBuilder();
        String reactants = formatSide(r.getReactants());
        sb.append(reactants);
        if (! reactants.isEmpty()) sb.append(' ');
        sb.append(r.getArrow());
        String products = formatSide(r.getProducts());
        if (! products.isEmpty()) sb.append(' ').append(products);
        List<RateConstant> rates = r.getRates();
        for (RateConstant k : rates) {
            if (! k.isSpecified()) return sb.toString();
        }
        List<String> names = (r.isReversible()) ?
            CrnPostProcessor.REVERSIBLE_RATES :
            CrnPostProcessor.IRREVERSIBLE_RATES;
        sb.append(" [");
        for (int i = 0; i < rates.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(names.get(i)).append(" = ")
              .append(rates.get(i).getLiteral());
        }
        return sb.append(']').toString();
    }

    /* [A, B, B] becomes "A + 2 B". */
    public static String formatSide(List<String> species) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < species.size()) {
            String name = species.get(i);
            int j = i + 1;
            while (j < species.size() && species.get(j).equals(name)) j++;
            if (sb.length() != 0) sb.append(" + ");
            if (j - i != 1) sb.append(j - i).append(' ');
            sb.append(name);
            i = j;
        }
        return sb.toString();
    }

    private static void appendDeclarations(CrnDocument doc,
                                           StringBuilder sb) {
        for (SpeciesCategory c : SpeciesCategory.values()) {
            sb.append(c.getKeyword()).append(" = {")
              .append(Formats.join(", ", doc.getSpecies(c))).append('}')
              .append(LINE_SEPARATOR);
        }
    }

}
