package net.crnkit.util.parser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.crnkit.util.Formats;

/**
 * A grammar-driven predictive parser.
 * The parser walks the productions of a CompiledGrammar top-down, deciding
 * between alternatives (and whether to take optional or repeated symbols)
 * by looking at a single token. Before every token it tells its TokenSource
 * which terminals are acceptable at that point, so that e.g. keywords are
 * only recognized where the grammar expects them.
 * A Parser is meant for a single use: parse() consumes the whole input and
 * closes the TokenSource.
 */
public class Parser {

    protected static class ParseTreeImpl implements ParseTree {

        private final String name;
        private final Token token;
        private final List<ParseTree> children;
        private final List<ParseTree> childrenView;

        {
            children = new ArrayList<ParseTree>();
            childrenView = Collections.unmodifiableList(children);
        }

        public ParseTreeImpl(Token token) {
            this.name = token.getName();
            this.token = token;
        }
        public ParseTreeImpl(String name) {
            this.name = name;
            this.token = null;
        }

        public String toString() {
            if (token != null) return Formats.formatString(getContent());
            return name + children;
        }

        public String getName() {
            return name;
        }

        public Token getToken() {
            return token;
        }

        public String getContent() {
            return (token == null) ? null : token.getContent();
        }

        public List<ParseTree> getChildren() {
            return childrenView;
        }

        public int childCount() {
            return children.size();
        }

        public ParseTree childAt(int index) {
            return children.get(index);
        }

        public void addChild(ParseTree ch) {
            children.add(ch);
        }

    }

    /* One active production (or the start symbol) on the parsing stack. */
    private static class Frame {

        private final List<Grammar.Symbol> symbols;
        private int index;
        private boolean repeating;

        public Frame(List<Grammar.Symbol> symbols) {
            this.symbols = symbols;
        }

    }

    /* The terminals acceptable at some point, plus whether the input may
     * end there. */
    private static class Expectation {

        private final Set<String> names;
        private final boolean acceptsEnd;

        public Expectation(Set<String> names, boolean acceptsEnd) {
            this.names = names;
            this.acceptsEnd = acceptsEnd;
        }

    }

    private final CompiledGrammar grammar;
    private final TokenSource source;
    private final boolean keepAll;
    private final List<Frame> frames;
    private final Map<Set<String>, TokenSource.Selection> selections;
    private final Set<String> attempted;
    private boolean attemptedEnd;
    private ParseTree result;

    public Parser(CompiledGrammar grammar, TokenSource source,
                  boolean keepAll) {
        this.grammar = grammar;
        this.source = source;
        this.keepAll = keepAll;
        this.frames = new ArrayList<Frame>();
        this.selections = new HashMap<Set<String>, TokenSource.Selection>();
        this.attempted = new LinkedHashSet<String>();
        this.attemptedEnd = false;
        this.result = null;
    }

    public CompiledGrammar getGrammar() {
        return grammar;
    }

    public TokenSource getTokenSource() {
        return source;
    }

    public boolean isKeepingAll() {
        return keepAll;
    }

    public ParseTree getResult() {
        return result;
    }

    /**
     * Parse the entire input.
     * Subsequent calls return the already-constructed tree.
     */
    public ParseTree parse() throws ParsingException {
        if (result != null) return result;
        ParseTreeImpl holder = new ParseTreeImpl((String) null);
        Grammar.Nonterminal start = grammar.getStartSymbol();
        try {
            parseSequence(Collections.<Grammar.Symbol>singletonList(start),
                          holder);
            expectEnd();
        } finally {
            try {
                source.close();
            } catch (IOException exc) {
                throw new ParsingException(source.getCurrentLocation(),
                    "Exception while closing token source: " + exc, exc);
            }
        }
        if (holder.childCount() != 1)
            throw new IllegalStateException(
                "Internal parser state corrupted!");
        result = holder.childAt(0);
        return result;
    }

    protected void parseSequence(List<Grammar.Symbol> symbols,
            ParseTreeImpl parent) throws ParsingException {
        Frame f = new Frame(symbols);
        frames.add(f);
        for (int i = 0; i < symbols.size(); i++) {
            Grammar.Symbol sym = symbols.get(i);
            int flags = sym.getFlags();
            f.index = i;
            f.repeating = false;
            if ((flags & Grammar.Symbol.SYM_OPTIONAL) != 0 &&
                    ! lookingAt(sym))
                continue;
            parseSymbol(sym, parent);
            if ((flags & Grammar.Symbol.SYM_REPEAT) != 0) {
                f.repeating = true;
                while (lookingAt(sym)) parseSymbol(sym, parent);
            }
        }
        frames.remove(frames.size() - 1);
    }

    protected void parseSymbol(Grammar.Symbol sym, ParseTreeImpl parent)
            throws ParsingException {
        int flags = sym.getFlags();
        boolean discard = ((flags & Grammar.Symbol.SYM_DISCARD) != 0 &&
                           ! keepAll);
        if (sym instanceof Grammar.Terminal) {
            Grammar.Terminal term = (Grammar.Terminal) sym;
            Token tok = peekToken();
            if (tok == null || ! tok.matches(term))
                throw unexpectedToken(tok);
            nextToken();
            if (! discard) parent.addChild(new ParseTreeImpl(tok));
            return;
        }
        String ref = ((Grammar.Nonterminal) sym).getReference();
        Grammar.Production prod = chooseProduction(ref);
        ParseTreeImpl node;
        if (discard) {
            node = new ParseTreeImpl(ref);
        } else if ((flags & Grammar.Symbol.SYM_INLINE) != 0) {
            node = parent;
        } else {
            node = new ParseTreeImpl(ref);
            parent.addChild(node);
        }
        parseSequence(prod.getSymbols(), node);
    }

    protected Grammar.Production chooseProduction(String ref)
            throws ParsingException {
        List<Grammar.Production> alts = grammar.getProductions(ref);
        if (alts.size() == 1) return alts.get(0);
        Token tok = peekToken();
        Grammar.Production empty = null;
        for (Grammar.Production p : alts) {
            if (tok != null && grammar.getFirst(p).contains(tok.getName()))
                return p;
            if (empty == null && grammar.isNullable(p)) empty = p;
        }
        if (empty != null) return empty;
        throw unexpectedToken(tok);
    }

    protected boolean lookingAt(Grammar.Symbol sym) throws ParsingException {
        Token tok = peekToken();
        return (tok != null && grammar.getFirst(sym).contains(tok.getName()));
    }

    private void addFollowing(Frame f, int from, Set<String> names,
                              boolean[] open) {
        for (int j = from; j < f.symbols.size(); j++) {
            Grammar.Symbol s = f.symbols.get(j);
            names.addAll(grammar.getFirst(s));
            if (! grammar.isSkippable(s)) {
                open[0] = false;
                return;
            }
        }
    }

    /* Compute the terminals that may come next, going up the frame stack
     * for as long as everything in between may be skipped. */
    protected Expectation expected() {
        Set<String> names = new LinkedHashSet<String>();
        boolean[] open = { true };
        for (int d = frames.size() - 1; d >= 0 && open[0]; d--) {
            Frame f = frames.get(d);
            Grammar.Symbol cur = f.symbols.get(f.index);
            if (d == frames.size() - 1) {
                names.addAll(grammar.getFirst(cur));
                if (! f.repeating && ! grammar.isSkippable(cur))
                    open[0] = false;
            } else if ((cur.getFlags() & Grammar.Symbol.SYM_REPEAT) != 0) {
                names.addAll(grammar.getFirst(cur));
            }
            if (open[0]) addFollowing(f, f.index + 1, names, open);
        }
        return new Expectation(names, open[0]);
    }

    /* Remember everything tried at the current input position, so that
     * error reports include alternatives that were skipped on the way. */
    private void attempt(Expectation exp) {
        attempted.addAll(exp.names);
        attemptedEnd |= exp.acceptsEnd;
    }

    protected TokenSource.Selection selectionFor(Set<String> names) {
        TokenSource.Selection ret = selections.get(names);
        if (ret == null) {
            List<Grammar.Terminal> terms = new ArrayList<Grammar.Terminal>();
            for (String n : names) terms.add(grammar.getTerminal(n));
            ret = new Lexer.StandardSelection(terms);
            selections.put(names, ret);
        }
        return ret;
    }

    private ParsingException wrap(MatchingException exc) {
        return new ParsingException(exc.getLocation(), exc.getMessage(),
                                    exc);
    }

    /* Returns the next token if one from the current expectation matches,
     * or null at the end of input or if nothing matches. */
    protected Token peekToken() throws ParsingException {
        Expectation exp = expected();
        attempt(exp);
        source.setSelection(selectionFor(exp.names));
        try {
            if (source.peek(false) == TokenSource.MatchStatus.OK)
                return source.getCurrentToken();
            return null;
        } catch (MatchingException exc) {
            throw wrap(exc);
        }
    }

    protected void nextToken() throws ParsingException {
        try {
            source.next();
            attempted.clear();
            attemptedEnd = false;
        } catch (MatchingException exc) {
            throw wrap(exc);
        }
    }

    protected void expectEnd() throws ParsingException {
        source.setSelection(selectionFor(Collections.<String>emptySet()));
        try {
            if (source.peek(true) == TokenSource.MatchStatus.EOI) return;
        } catch (MatchingException exc) {
            throw new ParsingException(exc.getLocation(), exc.getMessage() +
                ", expected end of input", exc);
        }
        throw new IllegalStateException(
            "Token matched against empty selection?!");
    }

    protected String formatExpectations(Expectation exp) {
        List<String> accum = new ArrayList<String>(exp.names);
        if (exp.acceptsEnd) accum.add("end of input");
        if (accum.isEmpty()) return "nothing";
        if (accum.size() == 1) return accum.get(0);
        return "any of " + Formats.join(", ", accum);
    }

    protected ParsingException unexpectedToken(Token tok) {
        attempt(expected());
        String expText = formatExpectations(new Expectation(
            new LinkedHashSet<String>(attempted), attemptedEnd));
        if (tok == null) {
            try {
                source.peek(true);
            } catch (MatchingException exc) {
                // An "unexpected character" report is more precise than
                // anything we could say here.
                return new ParsingException(exc.getLocation(),
                    exc.getMessage() + ", expected " + expText, exc);
            }
            TextLocation loc = source.getCurrentLocation();
            return new ParsingException(loc, "Unexpected end of input at " +
                loc + ", expected " + expText);
        }
        return new ParsingException(tok.getLocation(), "Unexpected token " +
            tok + ", expected " + expText);
    }

}
