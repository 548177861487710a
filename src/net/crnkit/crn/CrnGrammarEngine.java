package net.crnkit.crn;

import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.crnkit.crn.syntax.CrnRecord;
import net.crnkit.crn.syntax.DeclarationRecord;
import net.crnkit.util.parser.Lexer;
import net.crnkit.util.parser.LexerSettings;
import net.crnkit.util.parser.LocationTracker;
import net.crnkit.util.parser.MappingException;
import net.crnkit.util.parser.ParseTree;
import net.crnkit.util.parser.Parser;
import net.crnkit.util.parser.ParsingException;

/**
 * Turns CRN text into an ordered list of records.
 * Every call to parse() uses a fresh Lexer configured with this engine's
 * LexerSettings; engines hold no mutable state and may be shared among
 * threads.
 */
public class CrnGrammarEngine {

    private static final Logger LOGGER =
        Logger.getLogger("CrnGrammarEngine");

    private final LexerSettings settings;
    private final CrnRecordMapper mapper;

    public CrnGrammarEngine(LexerSettings settings, boolean modular) {
        if (settings == null)
            throw new NullPointerException(
                "Lexer settings may not be null");
        this.settings = settings;
        this.mapper = new CrnRecordMapper(modular);
    }
    public CrnGrammarEngine(int tabSize, boolean modular) {
        this(CrnGrammar.lexerSettings(tabSize), modular);
    }
    public CrnGrammarEngine(boolean modular) {
        this(LocationTracker.DEFAULT_TAB_SIZE, modular);
    }

    public LexerSettings getSettings() {
        return settings;
    }

    public boolean isModular() {
        return mapper.isModular();
    }

    /**
     * Parse the whole of input into records.
     * The reader is consumed and closed.
     */
    public List<CrnRecord> parse(Reader input)
            throws CrnSyntaxException, CrnFormatException {
        Parser parser = CrnGrammar.COMPILED_INSTANCE.createParser(
            new Lexer(input, settings));
        ParseTree tree;
        try {
            tree = parser.parse();
        } catch (ParsingException exc) {
            LOGGER.log(Level.FINE, "Syntax error", exc);
            throw new CrnSyntaxException(exc.getLocation(), exc.getMessage(),
                                         exc);
        }
        List<CrnRecord> ret;
        try {
            ret = mapper.map(tree);
        } catch (MappingException exc) {
            LOGGER.log(Level.FINE, "Malformed record", exc);
            throw new CrnFormatException(exc.getMessage(), exc);
        }
        checkOrder(ret);
        LOGGER.fine("Parsed " + ret.size() + " records");
        return ret;
    }
    public List<CrnRecord> parse(String input)
            throws CrnSyntaxException, CrnFormatException {
        return parse(new StringReader(input));
    }

    /* Declarations must come after all reactions. */
    protected void checkOrder(List<CrnRecord> records)
            throws CrnSyntaxException {
        boolean declared = false;
        for (CrnRecord r : records) {
            if (r instanceof DeclarationRecord) {
                declared = true;
            } else if (declared) {
                CrnSyntaxException exc = new CrnSyntaxException(
                    r.getLocation(), "Reaction after declarations at " +
                    r.getLocation());
                LOGGER.log(Level.FINE, "Syntax error", exc);
                throw exc;
            }
        }
    }

}
