package net.crnkit.crn;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import net.crnkit.crn.model.CrnDocument;
import net.crnkit.crn.model.SpeciesCategory;
import net.crnkit.crn.syntax.CrnRecord;
import net.crnkit.crn.syntax.DeclarationRecord;
import net.crnkit.crn.syntax.IrreversibleRecord;
import net.crnkit.crn.syntax.ModuleRecord;
import net.crnkit.crn.syntax.RateClause;
import net.crnkit.crn.syntax.ReactionRecord;
import net.crnkit.crn.syntax.ReversibleRecord;
import net.crnkit.crn.syntax.SpeciesReference;
import net.crnkit.util.parser.FixedLocation;
import org.junit.jupiter.api.Test;

public class CrnGrammarEngineTest {

    private final CrnGrammarEngine flat = new CrnGrammarEngine(false);
    private final CrnGrammarEngine modular = new CrnGrammarEngine(true);

    @Test
    void parse_recordsInInputOrder() throws Exception {
        List<CrnRecord> records = flat.parse(
            "A + 2 C -> E [k = 13.78]; E + F <=> 2 A [kf = 13, kr = 14]\n" +
            "signals = {A}");
        assertEquals(3, records.size());
        IrreversibleRecord first = (IrreversibleRecord) records.get(0);
        assertEquals(Arrays.asList(new SpeciesReference(1, "A", null),
                                   new SpeciesReference(2, "C", null)),
                     first.getReactants());
        assertEquals(new FixedLocation(1, 1, 0), first.getLocation());
        assertEquals(new FixedLocation(1, 5, 4),
                     first.getReactants().get(1).getLocation());
        RateClause rates = first.getRateClause();
        assertEquals(Arrays.asList("k"), rates.getNames());
        assertEquals("13.78", rates.getEntries().get(0).getLiteral());
        ReversibleRecord second = (ReversibleRecord) records.get(1);
        assertEquals(Arrays.asList("kf", "kr"),
                     second.getRateClause().getNames());
        assertEquals(new FixedLocation(1, 27, 26), second.getLocation());
        DeclarationRecord decl = (DeclarationRecord) records.get(2);
        assertEquals(SpeciesCategory.SIGNALS, decl.getCategory());
        assertEquals(Arrays.asList("A"), decl.getIdentifiers());
    }

    @Test
    void parse_reactionWithoutRateHasNoClause() throws Exception {
        ReactionRecord r = (ReactionRecord) flat.parse("<=> X").get(0);
        assertTrue(r.isReversible());
        assertNull(r.getRateClause());
        assertTrue(r.getReactants().isEmpty());
        // Without reactants, the arrow marks the start.
        assertEquals(new FixedLocation(1, 1, 0), r.getLocation());
    }

    @Test
    void parse_modularGroupsReactionsPerLine() throws Exception {
        List<CrnRecord> records = modular.parse(
            "A -> B; B -> C\n\nC <=> D\nfuels = {D}");
        assertEquals(3, records.size());
        assertEquals(2, ((ModuleRecord) records.get(0)).getReactions()
                                                        .size());
        assertEquals(1, ((ModuleRecord) records.get(1)).getReactions()
                                                        .size());
        assertEquals(new FixedLocation(3, 1, 16),
                     records.get(1).getLocation());
        assertTrue(records.get(2) instanceof DeclarationRecord);
    }

    @Test
    void parse_logsUnderEngineName() throws Exception {
        final List<LogRecord> seen = new ArrayList<LogRecord>();
        Handler h = new Handler() {
            public void publish(LogRecord r) { seen.add(r); }
            public void flush() {}
            public void close() {}
        };
        Logger logger = Logger.getLogger("CrnGrammarEngine");
        Level old = logger.getLevel();
        logger.setLevel(Level.FINE);
        logger.addHandler(h);
        try {
            flat.parse("A -> B");
        } finally {
            logger.removeHandler(h);
            logger.setLevel(old);
        }
        assertFalse(seen.isEmpty());
        assertEquals("CrnGrammarEngine", seen.get(0).getLoggerName());
    }

    @Test
    void parse_modularLineEndsGroupAtDeclaration() throws Exception {
        List<CrnRecord> records = modular.parse(
            "A -> B; C -> D; fuels = {X}");
        assertEquals(2, records.size());
        assertEquals(2, ((ModuleRecord) records.get(0)).getReactions()
                                                        .size());
        assertEquals(SpeciesCategory.FUELS,
                     ((DeclarationRecord) records.get(1)).getCategory());
        assertTrue(CrnRecordMapper.LINE_ITEM.getChildren().keySet()
            .containsAll(Arrays.asList(CrnGrammar.REACTION,
                                       CrnGrammar.DECLARATION)));
    }

    @Test
    void parse_engineSettingsAreCallScoped() throws Exception {
        CrnGrammarEngine narrow = new CrnGrammarEngine(4, false);
        CrnSyntaxException a = assertThrows(CrnSyntaxException.class,
                                            () -> narrow.parse("\t?"));
        CrnSyntaxException b = assertThrows(CrnSyntaxException.class,
                                            () -> flat.parse("\t?"));
        assertEquals(5, a.getLocation().getColumn());
        assertEquals(9, b.getLocation().getColumn());
        assertEquals(4, narrow.getSettings().getTabSize());
    }

    @Test
    void parseModularString_groupsModules() throws Exception {
        CrnDocument doc = new CrnParser().parseModularString(
            "A -> B; B -> C\nC <=> D [kf = 1, kr = 2]\n" +
            "D -> ; -> A\nformals = {Z}");
        assertEquals(3, doc.getModules().size());
        assertEquals(2, doc.getModules().get(0).size());
        assertEquals(1, doc.getModules().get(1).size());
        assertEquals(2, doc.getModules().get(2).size());
        assertEquals(5, doc.getReactions().size());
        assertEquals(Arrays.asList("A", "B", "C", "D", "Z"),
                     doc.getFormals());
    }

    @Test
    void parseString_flatDocumentHasSingleModule() throws Exception {
        String text = "A -> B; B -> C\nC -> D";
        CrnParser parser = new CrnParser();
        CrnDocument doc = parser.parseString(text);
        assertEquals(1, doc.getModules().size());
        assertEquals(doc.getReactions(), doc.getModules().get(0));
        CrnDocument mod = parser.parseModularString(text);
        assertEquals(doc.getReactions(), mod.getReactions());
        assertNotEquals(doc, mod);
        assertTrue(parser.withModular(true).isModular());
        assertFalse(parser.isModular());
    }

}
