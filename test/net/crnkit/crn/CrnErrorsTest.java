package net.crnkit.crn;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.crnkit.crn.syntax.CrnRecord;
import net.crnkit.crn.syntax.IrreversibleRecord;
import net.crnkit.crn.syntax.SpeciesReference;
import net.crnkit.util.parser.FixedLocation;
import net.crnkit.util.parser.ParsingException;
import org.junit.jupiter.api.Test;

public class CrnErrorsTest {

    private final CrnParser parser = new CrnParser();

    private CrnSyntaxException syntaxError(String text) {
        return assertThrows(CrnSyntaxException.class,
                            () -> parser.parseString(text));
    }

    @Test
    void syntax_trailingGarbageIsLocated() {
        CrnSyntaxException exc = syntaxError("A -> B )");
        assertEquals(new FixedLocation(1, 8, 7), exc.getLocation());
        assertTrue(exc.getMessage().contains("')'"), exc.getMessage());
        assertTrue(exc.getCause() instanceof ParsingException);
    }

    @Test
    void syntax_missingArrow() {
        CrnSyntaxException exc = syntaxError("A + B");
        assertEquals(new FixedLocation(1, 6, 5), exc.getLocation());
        assertTrue(exc.getMessage().contains("\"->\""), exc.getMessage());
        assertTrue(exc.getMessage().contains("\"<=>\""), exc.getMessage());
    }

    @Test
    void syntax_unbalancedRateBracket() {
        CrnSyntaxException exc = syntaxError("A -> B [k = 1");
        assertTrue(exc.getMessage().startsWith("Unexpected end of input"),
                   exc.getMessage());
        assertTrue(exc.getMessage().contains("\"]\""), exc.getMessage());
    }

    @Test
    void syntax_unbalancedDeclarationBrace() {
        CrnSyntaxException exc = syntaxError("A -> B\nformals = {A, B");
        assertEquals(2, exc.getLocation().getLine());
    }

    @Test
    void syntax_invalidIdentifier() {
        CrnSyntaxException exc = syntaxError("A -> _B");
        assertEquals(new FixedLocation(1, 6, 5), exc.getLocation());
    }

    @Test
    void syntax_zeroMultiplier() {
        CrnSyntaxException exc = syntaxError("0 A -> B");
        assertEquals(1, exc.getLocation().getColumn());
    }

    @Test
    void syntax_reactionsOnOneLineNeedSemicolon() {
        CrnSyntaxException exc = syntaxError("A -> B C -> D");
        assertEquals(new FixedLocation(1, 8, 7), exc.getLocation());
    }

    @Test
    void syntax_trailingSemicolon() {
        syntaxError("A -> B;");
    }

    @Test
    void syntax_documentWithoutReactions() {
        syntaxError("formals = {A}");
        syntaxError("");
        syntaxError("# nothing\n\n");
    }

    @Test
    void syntax_reactionAfterDeclarationLine() {
        CrnSyntaxException exc = syntaxError(
            "A -> B\nformals = {A}\nC -> D");
        assertEquals(new FixedLocation(3, 1, 21), exc.getLocation());
    }

    @Test
    void syntax_reactionAfterDeclarationOnSameLine() {
        CrnSyntaxException exc = syntaxError("A -> B; fuels = {A}; C -> D");
        assertEquals(new FixedLocation(1, 22, 21), exc.getLocation());
        assertThrows(CrnSyntaxException.class,
            () -> parser.parseModularString("A -> B; fuels = {A}; C -> D"));
    }

    @Test
    void syntax_declarationKeywordMisused() {
        CrnSyntaxException exc = syntaxError("A -> B\nfuels -> C");
        assertEquals(new FixedLocation(2, 7, 13), exc.getLocation());
    }

    @Test
    void syntax_categoryKeywordReservedAfterFirstLine() throws Exception {
        CrnSyntaxException exc = syntaxError("A -> B\nsignals -> C");
        assertEquals(new FixedLocation(2, 9, 15), exc.getLocation());
        assertTrue(exc.getMessage().contains("\"=\""), exc.getMessage());
        // The first line always starts a reaction.
        assertEquals(Arrays.asList("signals"), parser.parseString(
            "signals -> C").getReactions().get(0).getReactants());
    }

    @Test
    void syntax_expectationsIncludeSkippedAlternatives() {
        for (String text : Arrays.asList("0 A -> B", "_a -> B")) {
            CrnSyntaxException exc = syntaxError(text);
            assertEquals(new FixedLocation(1, 1, 0), exc.getLocation());
            assertTrue(exc.getMessage().contains("multiplier"),
                       exc.getMessage());
            assertTrue(exc.getMessage().contains("identifier"),
                       exc.getMessage());
            assertTrue(exc.getMessage().contains("\"->\""),
                       exc.getMessage());
        }
    }

    @Test
    void syntax_unknownRateSyntax() {
        syntaxError("A -> B [k = fast]");
        syntaxError("A -> B [k = -1]");
        syntaxError("A -> B [k = .5]");
    }

    @Test
    void format_irreversibleWithReversibleRates() {
        CrnFormatException exc = assertThrows(CrnFormatException.class,
            () -> parser.parseString("A -> B [kf = 1, kr = 2]"));
        assertTrue(exc.getMessage().contains("[k = <rate>]"),
                   exc.getMessage());
    }

    @Test
    void format_reversibleWithIrreversibleRate() {
        CrnFormatException exc = assertThrows(CrnFormatException.class,
            () -> parser.parseString("A <=> B [k = 1]"));
        assertTrue(exc.getMessage().contains("[kf = <rate>, kr = <rate>]"),
                   exc.getMessage());
    }

    @Test
    void format_wrongRateNamesOrOrder() {
        assertThrows(CrnFormatException.class,
                     () -> parser.parseString("A -> B [rate = 1]"));
        assertThrows(CrnFormatException.class,
                     () -> parser.parseString("A <=> B [kr = 1, kf = 2]"));
        assertThrows(CrnFormatException.class,
            () -> parser.parseString("A <=> B [kf = 1, kr = 2, k = 3]"));
    }

    @Test
    void format_hugeMultiplier() {
        CrnFormatException exc = assertThrows(CrnFormatException.class,
            () -> parser.parseString("99999999999 A -> B"));
        assertTrue(exc.getMessage().contains("too large"), exc.getMessage());
    }

    @Test
    void format_oversizedExpansion() throws CrnException {
        CrnFormatException exc = assertThrows(CrnFormatException.class,
            () -> parser.parseString("2147483647 A -> B"));
        assertTrue(exc.getMessage().contains("at most " +
            CrnPostProcessor.MAX_SIDE_SIZE), exc.getMessage());
        assertThrows(CrnFormatException.class,
            () -> parser.parseString("A -> 40000 B + 40000 C"));
        assertEquals(CrnPostProcessor.MAX_SIDE_SIZE, parser.parseString(
            "65536 A -> B").getReactions().get(0).getReactants().size());
    }

    @Test
    void format_unknownRecordType() {
        CrnRecord odd = new CrnRecord(null) {};
        assertThrows(CrnFormatException.class,
            () -> new CrnPostProcessor().process(
                Collections.singletonList(odd)));
    }

    @Test
    void consistency_signalAndFuelOverlap() {
        CrnConsistencyException exc = assertThrows(
            CrnConsistencyException.class,
            () -> parser.parseString("A -> B\nsignals = {X}\nfuels = {X}"));
        assertEquals(Collections.singletonList("X"), exc.getSpecies());
        assertTrue(exc.getMessage().contains("X"));
    }

    @Test
    void consistency_defaultSignalsOverlapFuels() {
        CrnConsistencyException exc = assertThrows(
            CrnConsistencyException.class,
            () -> parser.parseString("B + A -> C\nfuels = {C, B, Q}"));
        assertEquals(Arrays.asList("B", "C"), exc.getSpecies());
    }

    @Test
    void consistency_checkedAfterAllDeclarations() throws Exception {
        // The fuel declaration precedes the signals that make it legal.
        assertEquals(Arrays.asList("B"), parser.parseString(
            "A -> B\nfuels = {B}\nsignals = {A}").getFuels());
    }

    @Test
    void postProcessor_acceptsRecordsDirectly() throws Exception {
        List<SpeciesReference> reactants = Arrays.asList(
            new SpeciesReference(3, "A", null));
        IrreversibleRecord rec = new IrreversibleRecord(reactants,
            Collections.<SpeciesReference>emptyList(), null, null);
        assertEquals(Arrays.asList("A", "A", "A"), new CrnPostProcessor()
            .process(Collections.singletonList(rec))
            .getReactions().get(0).getReactants());
    }

}
