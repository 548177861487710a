package net.crnkit.crn.json;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import net.crnkit.crn.CrnConsistencyException;
import net.crnkit.crn.CrnFormatException;
import net.crnkit.crn.CrnParser;
import net.crnkit.crn.model.CrnDocument;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

public class CrnJsonTest {

    private final CrnParser parser = new CrnParser();

    @Test
    void toJSON_reactionsAndSpecies() throws Exception {
        CrnDocument doc = parser.parseString(
            "A + 2 C -> E [k = 13.78]\n<=> A\nfuels = {E}\nsignals = {A}");
        JSONObject obj = CrnJson.toJSON(doc);
        JSONArray reactions = obj.getJSONArray("reactions");
        assertEquals(2, reactions.length());
        JSONObject first = reactions.getJSONObject(0);
        assertEquals("[\"A\",\"C\",\"C\"]",
                     first.getJSONArray("reactants").toString());
        assertFalse(first.getBoolean("reversible"));
        assertEquals("13.78", first.getJSONArray("rates").getString(0));
        JSONObject second = reactions.getJSONObject(1);
        assertTrue(second.getBoolean("reversible"));
        assertEquals(2, second.getJSONArray("rates").length());
        assertTrue(second.getJSONArray("rates").isNull(0));
        assertEquals("[\"A\",\"C\",\"E\"]",
                     obj.getJSONArray("formals").toString());
        assertEquals("[\"A\"]", obj.getJSONArray("signals").toString());
        assertEquals("[\"E\"]", obj.getJSONArray("fuels").toString());
    }

    @Test
    void fromJSON_restoresDocument() throws Exception {
        CrnDocument doc = parser.parseString(
            "A + B <=> C [kf = 1, kr = 2.5]; C -> 2 D\nsignals = {A}");
        JSONObject obj = new JSONObject(CrnJson.toJSON(doc).toString());
        assertEquals(doc, CrnJson.fromJSON(obj));
    }

    @Test
    void fromJSON_appliesSpeciesRules() throws Exception {
        String reaction = "{\"reactants\": [\"A\"], " +
            "\"products\": [\"B\"], \"reversible\": false, " +
            "\"rates\": [\"1\"]}";
        CrnConsistencyException exc = assertThrows(
            CrnConsistencyException.class,
            () -> CrnJson.fromJSON(new JSONObject(
                "{\"reactions\": [" + reaction + "], \"formals\": []," +
                "\"signals\": [\"X\"], \"fuels\": [\"X\"]}")));
        assertEquals(Collections.singletonList("X"), exc.getSpecies());
        CrnDocument doc = CrnJson.fromJSON(new JSONObject(
            "{\"reactions\": [" + reaction + "], \"formals\": []," +
            "\"signals\": [], \"fuels\": []}"));
        assertEquals(Arrays.asList("A", "B"), doc.getFormals());
        assertEquals(Arrays.asList("A", "B"), doc.getSignals());
    }

    @Test
    void fromJSON_rejectsMalformedInput() {
        assertThrows(CrnFormatException.class,
            () -> CrnJson.fromJSON(new JSONObject("{\"reactions\": 1}")));
        assertThrows(CrnFormatException.class,
            () -> CrnJson.fromJSON(new JSONObject(
                "{\"reactions\": [{\"reactants\": [], \"products\": []," +
                "\"reversible\": true, \"rates\": [null]}]," +
                "\"formals\": [], \"signals\": [], \"fuels\": []}")));
    }

}
