package net.crnkit.crn;

import java.util.regex.Pattern;
import net.crnkit.util.parser.CompiledGrammar;
import net.crnkit.util.parser.Grammar;
import net.crnkit.util.parser.InvalidGrammarException;
import net.crnkit.util.parser.LexerSettings;

/**
 * The grammar of the CRN language.
 *
 * A document is a sequence of lines; the first non-blank line holds at least
 * one reaction. Every line holds either reactions separated by semicolons
 * (optionally followed by declarations, likewise separated by semicolons)
 * or a declaration (optionally preceded by a semicolon). Line breaks are
 * tokens; other whitespace and comments ("#" to the end of the line) are
 * skipped by the lexer.
 *
 * Parse tree node names are exposed as constants for the record mapper.
 */
public class CrnGrammar extends Grammar {

    public static final String DOCUMENT = "document";
    public static final String MODULE = "module";
    public static final String DECLARATION = "declaration";
    public static final String REACTION = "reaction";
    public static final String REACTANTS = "reactants";
    public static final String PRODUCTS = "products";
    public static final String IRREVERSIBLE = "irreversible";
    public static final String REVERSIBLE = "reversible";
    public static final String SPECIES = "species";
    public static final String RATE_CLAUSE = "rateClause";
    public static final String RATE_ENTRY = "rateEntry";

    public static final String IDENTIFIER = "identifier";
    public static final String MULTIPLIER = "multiplier";
    public static final String RATE_NAME = "rateName";
    public static final String NUMBER = "number";
    public static final String NEWLINE = "newline";

    public static final String IDENTIFIER_PATTERN = "[a-zA-Z][a-zA-Z0-9_]*";
    public static final String NUMBER_PATTERN =
        "[0-9]+(?:\\.[0-9]+)?(?:[eE][-+]?[0-9]+)?";

    public static final Pattern COMMENT = Pattern.compile("#[^\r\n]*");

    public static final CrnGrammar INSTANCE;
    public static final CompiledGrammar COMPILED_INSTANCE;

    static {
        INSTANCE = new CrnGrammar();
        try {
            COMPILED_INSTANCE = CompiledGrammar.compile(INSTANCE);
        } catch (InvalidGrammarException exc) {
            throw new RuntimeException(exc);
        }
    }

    public CrnGrammar() {
        super(DOCUMENT);
        Symbol nl = terminal(NEWLINE, "\r\n|\r|\n", Symbol.SYM_DISCARD);
        Symbol identifier = terminal(IDENTIFIER, IDENTIFIER_PATTERN, 0);
        /* Document structure */
        add(DOCUMENT,
            nl.withFlags(Symbol.SYM_DISCARD | Symbol.SYM_OPTIONAL |
                         Symbol.SYM_REPEAT),
            nonterminal(MODULE),
            nonterminal("lineTail", Symbol.SYM_INLINE | Symbol.SYM_OPTIONAL |
                                    Symbol.SYM_REPEAT));
        add("lineTail",
            nl,
            nonterminal("statement", Symbol.SYM_INLINE |
                                     Symbol.SYM_OPTIONAL));
        add("statement", nonterminal(MODULE));
        add("statement", nonterminal("declarationLine", Symbol.SYM_INLINE));
        add("declarationLine",
            literal(";", Symbol.SYM_DISCARD | Symbol.SYM_OPTIONAL),
            nonterminal(DECLARATION));
        add(MODULE,
            nonterminal(REACTION),
            nonterminal("moduleTail", Symbol.SYM_INLINE |
                                      Symbol.SYM_OPTIONAL |
                                      Symbol.SYM_REPEAT));
        add("moduleTail",
            literal(";", Symbol.SYM_DISCARD),
            nonterminal("moduleItem", Symbol.SYM_INLINE));
        add("moduleItem", nonterminal(REACTION));
        add("moduleItem", nonterminal(DECLARATION));
        /* Declarations */
        add(DECLARATION,
            nonterminal("category", Symbol.SYM_INLINE),
            literal("=", Symbol.SYM_DISCARD),
            literal("{", Symbol.SYM_DISCARD),
            nonterminal("identifierList", Symbol.SYM_INLINE |
                                          Symbol.SYM_OPTIONAL),
            literal("}", Symbol.SYM_DISCARD));
        add("category", literal("formals"));
        add("category", literal("signals"));
        add("category", literal("fuels"));
        add("identifierList",
            identifier,
            nonterminal("identifierTail", Symbol.SYM_INLINE |
                                          Symbol.SYM_OPTIONAL |
                                          Symbol.SYM_REPEAT));
        add("identifierTail", literal(",", Symbol.SYM_DISCARD), identifier);
        /* Reactions */
        add(REACTION,
            nonterminal(REACTANTS),
            nonterminal("arrow", Symbol.SYM_INLINE));
        add(REACTANTS, nonterminal("speciesList", Symbol.SYM_INLINE |
                                                  Symbol.SYM_OPTIONAL));
        add("arrow", nonterminal(IRREVERSIBLE));
        add("arrow", nonterminal(REVERSIBLE));
        add(IRREVERSIBLE,
            literal("->"),
            nonterminal(PRODUCTS),
            nonterminal(RATE_CLAUSE, Symbol.SYM_OPTIONAL));
        add(REVERSIBLE,
            literal("<=>"),
            nonterminal(PRODUCTS),
            nonterminal(RATE_CLAUSE, Symbol.SYM_OPTIONAL));
        add(PRODUCTS, nonterminal("speciesList", Symbol.SYM_INLINE |
                                                 Symbol.SYM_OPTIONAL));
        add("speciesList",
            nonterminal(SPECIES),
            nonterminal("speciesTail", Symbol.SYM_INLINE |
                                       Symbol.SYM_OPTIONAL |
                                       Symbol.SYM_REPEAT));
        add("speciesTail",
            literal("+", Symbol.SYM_DISCARD),
            nonterminal(SPECIES));
        add(SPECIES,
            terminal(MULTIPLIER, "[1-9][0-9]*", Symbol.SYM_OPTIONAL),
            identifier);
        /* Rates */
        add(RATE_CLAUSE,
            literal("[", Symbol.SYM_DISCARD),
            nonterminal(RATE_ENTRY),
            nonterminal("rateTail", Symbol.SYM_INLINE | Symbol.SYM_OPTIONAL |
                                    Symbol.SYM_REPEAT),
            literal("]", Symbol.SYM_DISCARD));
        add("rateTail",
            literal(",", Symbol.SYM_DISCARD),
            nonterminal(RATE_ENTRY));
        add(RATE_ENTRY,
            terminal(RATE_NAME, IDENTIFIER_PATTERN, 0),
            literal("=", Symbol.SYM_DISCARD),
            terminal(NUMBER, NUMBER_PATTERN, 0));
    }

    /**
     * Lexer settings for CRN documents with the given tab size.
     * Line breaks are left to the grammar; comments are skipped.
     */
    public static LexerSettings lexerSettings(int tabSize) {
        return LexerSettings.DEFAULT.withoutWhitespace("\r\n")
            .withIgnored(COMMENT).withTabSize(tabSize);
    }

}
