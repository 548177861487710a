package net.crnkit.util.parser;

import net.crnkit.util.Formats;
import net.crnkit.util.NamedValue;

/**
 * A piece of input text associated with a location and the name of the
 * terminal that produced it.
 */
public class Token implements NamedValue {

    private final String name;
    private final TextLocation location;
    private final String content;

    public Token(String name, TextLocation location, String content) {
        if (location == null)
            throw new NullPointerException(
                "Token location may not be null");
        if (content == null)
            throw new NullPointerException(
                "Token content may not be null");
        this.name = name;
        this.location = location;
        this.content = content;
    }

    public String toString() {
        String name = getName();
        return String.format("%s%s at %s",
            Formats.formatString(getContent()),
            ((name == null || name.equals(Formats.formatString(content))) ?
                "" : " (" + name + ")"),
            getLocation());
    }

    public boolean equals(Object other) {
        if (! (other instanceof Token)) return false;
        Token to = (Token) other;
        return (getLocation().equals(to.getLocation()) &&
                equalOrNull(getName(), to.getName()) &&
                getContent().equals(to.getContent()));
    }

    public int hashCode() {
        return hashCodeOrNull(getName()) ^ getLocation().hashCode() ^
            getContent().hashCode();
    }

    public String getName() {
        return name;
    }

    public TextLocation getLocation() {
        return location;
    }

    public String getContent() {
        return content;
    }

    public boolean matches(Grammar.Terminal term) {
        return equalOrNull(getName(), term.getName());
    }

    private static boolean equalOrNull(String a, String b) {
        return (a == null) ? (b == null) : a.equals(b);
    }
    private static int hashCodeOrNull(Object o) {
        return (o == null) ? 0 : o.hashCode();
    }

}
