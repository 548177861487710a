package net.crnkit.crn.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.crnkit.util.parser.TextLocation;

/**
 * A bracketed list of named rate constants following a reaction.
 * The grammar accepts any names and any number of entries; whether they
 * fit the reaction is decided later.
 */
public class RateClause {

    public static class Entry {

        private final String name;
        private final String literal;

        public Entry(String name, String literal) {
            if (name == null || literal == null)
                throw new NullPointerException(
                    "Rate entry name and literal may not be null");
            this.name = name;
            this.literal = literal;
        }

        public String toString() {
            return name + " = " + literal;
        }

        public boolean equals(Object other) {
            if (! (other instanceof Entry)) return false;
            Entry eo = (Entry) other;
            return (name.equals(eo.name) && literal.equals(eo.literal));
        }

        public int hashCode() {
            return name.hashCode() ^ literal.hashCode();
        }

        public String getName() {
            return name;
        }

        public String getLiteral() {
            return literal;
        }

    }

    private final List<Entry> entries;
    private final TextLocation location;

    public RateClause(List<Entry> entries, TextLocation location) {
        this.entries = Collections.unmodifiableList(
            new ArrayList<Entry>(entries));
        this.location = location;
    }

    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        for (Entry e : entries) {
            if (! first) sb.append(", ");
            first = false;
            sb.append(e);
        }
        return sb.append(']').toString();
    }

    public List<Entry> getEntries() {
        return entries;
    }

    /**
     * The names of the entries, in order.
     */
    public List<String> getNames() {
        List<String> ret = new ArrayList<String>(entries.size());
        for (Entry e : entries) ret.add(e.getName());
        return ret;
    }

    public TextLocation getLocation() {
        return location;
    }

}
