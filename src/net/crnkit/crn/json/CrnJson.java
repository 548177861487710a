package net.crnkit.crn.json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.crnkit.crn.CrnConsistencyException;
import net.crnkit.crn.CrnFormatException;
import net.crnkit.crn.CrnPostProcessor;
import net.crnkit.crn.model.CrnDocument;
import net.crnkit.crn.model.IrreversibleReaction;
import net.crnkit.crn.model.RateConstant;
import net.crnkit.crn.model.Reaction;
import net.crnkit.crn.model.ReversibleReaction;
import net.crnkit.crn.model.SpeciesCategory;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Conversion of CRN documents to and from JSON.
 *
 * A document is represented as
 * <pre>
 *     {"reactions": [{"reactants": ["A", "C", "C"], "products": ["E"],
 *                     "reversible": false, "rates": ["13.78"]}, ...],
 *      "formals": [...], "signals": [...], "fuels": [...]}
 * </pre>
 * Rates are kept as their literal strings; unspecified rates are null.
 */
public final class CrnJson {

    public static final String K_REACTIONS = "reactions";
    public static final String K_REACTANTS = "reactants";
    public static final String K_PRODUCTS = "products";
    public static final String K_REVERSIBLE = "reversible";
    public static final String K_RATES = "rates";

    /* Prevent construction */
    private CrnJson() {}

    public static JSONObject toJSON(CrnDocument doc) {
        JSONArray reactions = new JSONArray();
        for (Reaction r : doc.getReactions()) reactions.put(toJSON(r));
        JSONObject ret = createJSONObject(K_REACTIONS, reactions);
        for (SpeciesCategory c : SpeciesCategory.values())
            ret.put(c.getKeyword(), new JSONArray(doc.getSpecies(c)));
        return ret;
    }

    public static JSONObject toJSON(Reaction r) {
        JSONArray rates = new JSONArray();
        for (RateConstant k : r.getRates())
            rates.put(k.isSpecified() ? k.getLiteral() : JSONObject.NULL);
        return createJSONObject(
            K_REACTANTS, new JSONArray(r.getReactants()),
            K_PRODUCTS, new JSONArray(r.getProducts()),
            K_REVERSIBLE, r.isReversible(),
            K_RATES, rates);
    }

    /**
     * Reconstruct a document from its JSON form.
     * All reactions end up in a single module. The species categories are
     * completed and checked like those of a parsed document.
     */
    public static CrnDocument fromJSON(JSONObject obj)
            throws CrnFormatException, CrnConsistencyException {
        try {
            List<Reaction> reactions = new ArrayList<Reaction>();
            JSONArray ra = obj.getJSONArray(K_REACTIONS);
            for (int i = 0; i < ra.length(); i++)
                reactions.add(reactionFromJSON(ra.getJSONObject(i)));
            return CrnPostProcessor.assemble(
                Collections.singletonList(reactions),
                strings(obj.getJSONArray(SpeciesCategory.FORMALS
                                         .getKeyword())),
                strings(obj.getJSONArray(SpeciesCategory.SIGNALS
                                         .getKeyword())),
                strings(obj.getJSONArray(SpeciesCategory.FUELS
                                         .getKeyword())));
        } catch (JSONException exc) {
            throw new CrnFormatException("Malformed CRN JSON: " +
                                         exc.getMessage(), exc);
        }
    }

    private static Reaction reactionFromJSON(JSONObject obj)
            throws CrnFormatException {
        List<String> reactants = strings(obj.getJSONArray(K_REACTANTS));
        List<String> products = strings(obj.getJSONArray(K_PRODUCTS));
        JSONArray ra = obj.getJSONArray(K_RATES);
        List<RateConstant> rates = new ArrayList<RateConstant>();
        for (int i = 0; i < ra.length(); i++) {
            rates.add(ra.isNull(i) ? RateConstant.UNSPECIFIED :
                      RateConstant.of(ra.get(i).toString()));
        }
        if (obj.getBoolean(K_REVERSIBLE)) {
            if (rates.size() != 2)
                throw new CrnFormatException("Reversible reaction " +
                    "requires two rates, got " + rates.size());
            return new ReversibleReaction(reactants, products, rates.get(0),
                                          rates.get(1));
        } else {
            if (rates.size() != 1)
                throw new CrnFormatException("Irreversible reaction " +
                    "requires one rate, got " + rates.size());
            return new IrreversibleReaction(reactants, products,
                                            rates.get(0));
        }
    }

    private static List<String> strings(JSONArray arr) {
        List<String> ret = new ArrayList<String>(arr.length());
        for (int i = 0; i < arr.length(); i++) ret.add(arr.getString(i));
        return ret;
    }

    /**
     * Construct a JSONObject from alternating keys and values.
     */
    public static JSONObject createJSONObject(Object... params) {
        if (params.length % 2 == 1)
            throw new IllegalArgumentException("Invalid parameter amount " +
                "for createJSONObject()");
        JSONObject ret = new JSONObject();
        for (int i = 0; i < params.length; i += 2) {
            if (! (params[i] instanceof String))
                throw new IllegalArgumentException("Invalid parameter " +
                    "type for createJSONObject()");
            ret.put((String) params[i], params[i + 1]);
        }
        return ret;
    }

}
