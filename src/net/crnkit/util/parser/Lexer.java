package net.crnkit.util.parser;

import java.io.IOException;
import java.io.Reader;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.crnkit.util.Formats;

/**
 * The default TokenSource.
 * The input is read completely before the first match; tokens are matched
 * at the current location against all terminals of the current selection,
 * the longest match winning and ties being broken by match rank. Whitespace
 * and ignorable text (as configured by the LexerSettings) are skipped before
 * every token.
 */
public class Lexer implements TokenSource {

    public static class StandardSelection implements Selection {

        private final Map<String, Grammar.Terminal> terminals;

        public StandardSelection(Collection<Grammar.Terminal> terminals) {
            Map<String, Grammar.Terminal> map =
                new LinkedHashMap<String, Grammar.Terminal>();
            for (Grammar.Terminal t : terminals) map.put(t.getName(), t);
            this.terminals = Collections.unmodifiableMap(map);
        }

        public String toString() {
            return String.format("%s@%h%s", getClass().getName(), this,
                                 terminals.keySet());
        }

        public Map<String, Grammar.Terminal> getTerminals() {
            return terminals;
        }

        public boolean contains(Token tok) {
            Grammar.Terminal t = terminals.get(tok.getName());
            return (t != null && tok.matches(t));
        }

    }

    private static final int BUFFER_SIZE = 8192;

    private final Reader input;
    private final LexerSettings settings;
    private final StringBuilder inputBuffer;
    private final LocationTracker position;
    private final Map<Pattern, Matcher> matchers;
    private int offset;
    private boolean loaded;
    private Selection selection;
    private MatchStatus matchStatus;
    private Token currentToken;

    public Lexer(Reader input, LexerSettings settings) {
        if (input == null)
            throw new NullPointerException("Lexer input may not be null");
        if (settings == null)
            throw new NullPointerException(
                "Lexer settings may not be null");
        this.input = input;
        this.settings = settings;
        this.inputBuffer = new StringBuilder();
        this.position = new LocationTracker(settings.getTabSize());
        this.matchers = new HashMap<Pattern, Matcher>();
        this.offset = 0;
        this.loaded = false;
        this.selection = null;
        this.matchStatus = null;
        this.currentToken = null;
    }

    public LexerSettings getSettings() {
        return settings;
    }

    public TextLocation getCurrentLocation() {
        return position.snapshot();
    }

    protected Selection getSelection() {
        return selection;
    }
    public void setSelection(Selection sel) {
        if (sel == selection) return;
        selection = sel;
        // The end of input stays the end of input; anything else has to be
        // re-matched since a newly selected terminal might match longer.
        if (matchStatus == MatchStatus.EOI) return;
        matchStatus = null;
        currentToken = null;
    }

    public Token getCurrentToken() {
        return currentToken;
    }

    protected void load() throws MatchingException {
        if (loaded) return;
        char[] data = new char[BUFFER_SIZE];
        try {
            for (;;) {
                int ret = input.read(data);
                if (ret < 0) break;
                inputBuffer.append(data, 0, ret);
            }
        } catch (IOException exc) {
            throw new MatchingException(getCurrentLocation(),
                "Could not read input: " + exc.getMessage(), exc);
        }
        loaded = true;
    }

    private Matcher matcherFor(Pattern pat) {
        Matcher m = matchers.get(pat);
        if (m == null) {
            m = pat.matcher(inputBuffer);
            matchers.put(pat, m);
        } else {
            m.reset(inputBuffer);
        }
        m.region(offset, inputBuffer.length());
        return m;
    }

    protected void advance(int length) {
        position.advance(inputBuffer, offset, length);
        offset += length;
    }

    protected void skipIgnorable() {
        boolean progress = true;
        while (progress) {
            progress = false;
            while (offset < inputBuffer.length() &&
                   settings.isWhitespace(inputBuffer.charAt(offset))) {
                advance(1);
                progress = true;
            }
            for (Pattern pat : settings.getIgnored()) {
                if (offset >= inputBuffer.length()) break;
                Matcher m = matcherFor(pat);
                if (m.lookingAt() && m.end() > offset) {
                    advance(m.end() - offset);
                    progress = true;
                }
            }
        }
    }

    protected MatchStatus doMatch() throws MatchingException {
        load();
        skipIgnorable();
        if (offset >= inputBuffer.length()) return MatchStatus.EOI;
        if (selection == null) return MatchStatus.NO_MATCH;
        Grammar.Terminal best = null;
        int bestEnd = -1;
        for (Grammar.Terminal t : selection.getTerminals().values()) {
            Matcher m = matcherFor(t.getPattern());
            if (! m.lookingAt() || m.end() == offset) continue;
            int thisEnd = m.end();
            if (best != null) {
                if (thisEnd < bestEnd) continue;
                if (thisEnd == bestEnd) {
                    if (t.getMatchRank() < best.getMatchRank()) continue;
                    if (t.getMatchRank() == best.getMatchRank())
                        throw new MatchingException(getCurrentLocation(),
                            "Ambiguous classifications for prospective " +
                            "token " + Formats.formatString(
                                inputBuffer.substring(offset, thisEnd)) +
                            " at " + getCurrentLocation() + ": " +
                            best.getName() + " and " + t.getName());
                }
            }
            best = t;
            bestEnd = thisEnd;
        }
        if (best == null) return MatchStatus.NO_MATCH;
        currentToken = best.createToken(getCurrentLocation(),
                                        inputBuffer.substring(offset,
                                                              bestEnd));
        return MatchStatus.OK;
    }

    protected MatchingException unexpectedInput() {
        TextLocation pos = getCurrentLocation();
        // Blame the first character of whatever we could not match.
        String message = (offset >= inputBuffer.length()) ?
            "Unexpected end of input" :
            "Unexpected character " + Formats.formatCharacter(
                Character.codePointAt(inputBuffer, offset));
        return new MatchingException(pos, message + " at " + pos);
    }

    protected MatchStatus peek() throws MatchingException {
        if (matchStatus != null) return matchStatus;
        currentToken = null;
        matchStatus = doMatch();
        return matchStatus;
    }
    public MatchStatus peek(boolean required) throws MatchingException {
        MatchStatus ret = peek();
        if (required && ret == MatchStatus.NO_MATCH)
            throw unexpectedInput();
        return ret;
    }

    public Token next() throws MatchingException {
        MatchStatus st = peek();
        Token tok = currentToken;
        switch (st) {
            case OK:
                advance(tok.getContent().length());
                break;
            case NO_MATCH:
                throw unexpectedInput();
            case EOI:
                throw new MatchingException(getCurrentLocation(),
                                            "No more input to advance past");
        }
        matchStatus = null;
        currentToken = null;
        return tok;
    }

    public void close() throws IOException {
        input.close();
        inputBuffer.setLength(0);
        matchers.clear();
        offset = 0;
        loaded = true;
        selection = null;
        matchStatus = MatchStatus.EOI;
        currentToken = null;
    }

}
