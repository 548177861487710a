package net.crnkit.crn;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.logging.Logger;
import net.crnkit.crn.model.CrnDocument;
import net.crnkit.crn.syntax.CrnRecord;
import net.crnkit.util.config.ConfigValues;
import net.crnkit.util.config.Configuration;
import net.crnkit.util.parser.LocationTracker;

/**
 * Reads CRN documents.
 *
 * A CrnParser runs the grammar engine and the post-processor in sequence.
 * It holds no mutable state; any number of parses may run concurrently,
 * each with its own lexer.
 *
 * Example:
 * <pre>
 *     CrnDocument doc = new CrnParser().parseString(
 *         "A + 2 C -> E [k = 13.78]; E + F &lt;=&gt; 2 A\n" +
 *         "fuels = {F}\n");
 * </pre>
 */
public class CrnParser {

    /* Whether reactions are grouped per line by default. */
    public static final String K_MODULAR = "crnkit.parser.modular";
    /* Tab width for column numbers in error locations. */
    public static final String K_TAB_SIZE = "crnkit.parser.tabSize";

    private static final Logger LOGGER = Logger.getLogger("CrnParser");

    private final boolean modular;
    private final int tabSize;
    private final CrnGrammarEngine engine;
    private final CrnPostProcessor postProcessor;

    public CrnParser(boolean modular, int tabSize) {
        this.modular = modular;
        this.tabSize = tabSize;
        this.engine = new CrnGrammarEngine(tabSize, modular);
        this.postProcessor = new CrnPostProcessor();
    }
    public CrnParser(boolean modular) {
        this(modular, LocationTracker.DEFAULT_TAB_SIZE);
    }
    public CrnParser() {
        this(false);
    }

    public boolean isModular() {
        return modular;
    }

    public int getTabSize() {
        return tabSize;
    }

    public CrnGrammarEngine getEngine() {
        return engine;
    }

    public CrnPostProcessor getPostProcessor() {
        return postProcessor;
    }

    /**
     * Return a copy of this parser with the given module grouping mode.
     */
    public CrnParser withModular(boolean newModular) {
        if (newModular == modular) return this;
        return new CrnParser(newModular, tabSize);
    }

    public CrnDocument parseReader(Reader input) throws CrnException {
        List<CrnRecord> records = engine.parse(input);
        CrnDocument ret = postProcessor.process(records);
        LOGGER.fine("Parsed CRN with " + ret.getReactions().size() +
                    " reactions and " + ret.getFormals().size() +
                    " formal species");
        return ret;
    }

    public CrnDocument parseString(String input) throws CrnException {
        return parseReader(new StringReader(input));
    }

    /**
     * Parse the given string with reactions grouped per line, regardless
     * of this parser's mode.
     */
    public CrnDocument parseModularString(String input) throws CrnException {
        return withModular(true).parseString(input);
    }

    /**
     * Parse the given UTF-8 encoded file.
     * The whole file must be a valid document.
     */
    public CrnDocument parseFile(File path) throws IOException, CrnException {
        LOGGER.fine("Reading " + path);
        byte[] data = Files.readAllBytes(path.toPath());
        return parseString(new String(data, StandardCharsets.UTF_8));
    }

    public static CrnParser fromConfiguration(Configuration config) {
        return new CrnParser(
            ConfigValues.getBoolean(config, K_MODULAR, false),
            ConfigValues.getInt(config, K_TAB_SIZE,
                                LocationTracker.DEFAULT_TAB_SIZE));
    }

}
