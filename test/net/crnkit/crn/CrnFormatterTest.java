package net.crnkit.crn;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import net.crnkit.crn.model.CrnDocument;
import net.crnkit.crn.model.IrreversibleReaction;
import net.crnkit.crn.model.RateConstant;
import net.crnkit.crn.model.ReversibleReaction;
import org.junit.jupiter.api.Test;

public class CrnFormatterTest {

    private final CrnParser parser = new CrnParser();

    @Test
    void formatSide_collapsesRuns() {
        assertEquals("A + 2 C + B",
            CrnFormatter.formatSide(Arrays.asList("A", "C", "C", "B")));
        assertEquals("", CrnFormatter.formatSide(
            Collections.<String>emptyList()));
    }

    @Test
    void formatReaction_ratesOnlyWhenSpecified() {
        assertEquals("A + 2 C -> E [k = 13.78]", CrnFormatter.formatReaction(
            new IrreversibleReaction(Arrays.asList("A", "C", "C"),
                                     Arrays.asList("E"),
                                     RateConstant.of("13.78"))));
        assertEquals("<=> A", CrnFormatter.formatReaction(
            new ReversibleReaction(Collections.<String>emptyList(),
                                   Arrays.asList("A"),
                                   RateConstant.UNSPECIFIED,
                                   RateConstant.UNSPECIFIED)));
        assertEquals("A ->", CrnFormatter.formatReaction(
            new IrreversibleReaction(Arrays.asList("A"),
                                     Collections.<String>emptyList(),
                                     RateConstant.UNSPECIFIED)));
    }

    @Test
    void format_rendersDeclarations() throws Exception {
        CrnDocument doc = parser.parseString(
            "C + A <=> D [kf = 1, kr = 1]\nfuels = {}\nsignals = {A}");
        assertEquals("C + A <=> D [kf = 1, kr = 1]\n" +
                     "formals = {A, C, D}\n" +
                     "signals = {A}\n" +
                     "fuels = {}\n", CrnFormatter.format(doc));
    }

    @Test
    void format_parsesBackToEqualDocument() throws Exception {
        String text = "A + 2 C -> E [k = 13.78]; E + F <=> 2 A " +
            "[kf = 13, kr = 14]\n<=> B\nB -> [k = 1e-3]\nsignals = {A}\n" +
            "fuels = {F}";
        CrnDocument doc = parser.parseString(text);
        assertEquals(doc, parser.parseString(CrnFormatter.format(doc)));
        CrnDocument mod = parser.parseModularString(text);
        assertEquals(mod, parser.parseModularString(
            CrnFormatter.formatModules(mod)));
    }

}
