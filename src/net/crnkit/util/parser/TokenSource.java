package net.crnkit.util.parser;

import java.io.Closeable;
import java.util.Map;

/**
 * An externally driven tokenizer.
 * A TokenSource maintains an input stream, a current location inside it, a
 * set of acceptable terminals (the *selection*), and a cached match result.
 * peek() matches the selection against the input at the current location
 * and caches the outcome; next() advances past the matched token. Changing
 * the selection discards the cached result unless it is still valid.
 */
public interface TokenSource extends Closeable {

    /**
     * A set of terminals to be matched against the input, keyed by name.
     */
    interface Selection {

        Map<String, Grammar.Terminal> getTerminals();

        boolean contains(Token tok);

    }

    /**
     * The result of a token matching operation.
     */
    enum MatchStatus {
        /** Matching successfully resulted in a new token. */
        OK,
        /** No token from the selection matches the input. */
        NO_MATCH,
        /** The end of the input has been reached. */
        EOI
    }

    void setSelection(Selection sel);

    TextLocation getCurrentLocation();

    Token getCurrentToken();

    /**
     * Perform (or recall) a match operation and return its result.
     * If required is true, NO_MATCH is reported as a MatchingException
     * instead of being returned.
     */
    MatchStatus peek(boolean required) throws MatchingException;

    Token next() throws MatchingException;

}
