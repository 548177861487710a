package net.crnkit.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Immutable configuration of a Lexer.
 * Instances are passed into each Lexer at construction; a Lexer never
 * consults any global setting, so differently configured lexers may run
 * side by side.
 */
public final class LexerSettings {

    /* Space, tab, line breaks, form feed, vertical tab. */
    public static final String DEFAULT_WHITESPACE = " \t\n\r\f\u000b";

    public static final LexerSettings DEFAULT = new LexerSettings(
        DEFAULT_WHITESPACE, Collections.<Pattern>emptyList(),
        LocationTracker.DEFAULT_TAB_SIZE);

    private final String whitespace;
    private final List<Pattern> ignored;
    private final int tabSize;

    private LexerSettings(String whitespace, List<Pattern> ignored,
                          int tabSize) {
        if (tabSize < 1)
            throw new IllegalArgumentException("Invalid tab size " +
                                               tabSize);
        this.whitespace = whitespace;
        this.ignored = Collections.unmodifiableList(
            new ArrayList<Pattern>(ignored));
        this.tabSize = tabSize;
    }

    public String toString() {
        List<String> ws = new ArrayList<String>();
        for (char c : whitespace.toCharArray()) ws.add(Integer.toHexString(c));
        return String.format("%s@%h[whitespace=%s,ignored=%s,tabSize=%s]",
            getClass().getName(), this, ws, ignored, tabSize);
    }

    public String getWhitespace() {
        return whitespace;
    }

    public List<Pattern> getIgnored() {
        return ignored;
    }

    public int getTabSize() {
        return tabSize;
    }

    public boolean isWhitespace(char ch) {
        return whitespace.indexOf(ch) != -1;
    }

    public LexerSettings withWhitespace(String chars) {
        return new LexerSettings(chars, ignored, tabSize);
    }

    /**
     * Return a copy of these settings where the given characters are no
     * longer skipped (and can hence be matched as tokens).
     */
    public LexerSettings withoutWhitespace(String chars) {
        StringBuilder sb = new StringBuilder();
        for (char c : whitespace.toCharArray()) {
            if (chars.indexOf(c) == -1) sb.append(c);
        }
        return withWhitespace(sb.toString());
    }

    /**
     * Return a copy of these settings that additionally skips any text
     * matching pat (e.g. comments) wherever whitespace may occur.
     */
    public LexerSettings withIgnored(Pattern pat) {
        List<Pattern> newIgnored = new ArrayList<Pattern>(ignored);
        newIgnored.add(pat);
        return new LexerSettings(whitespace, newIgnored, tabSize);
    }

    public LexerSettings withTabSize(int size) {
        return new LexerSettings(whitespace, ignored, size);
    }

}
