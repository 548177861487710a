package net.crnkit.util.parser;

/**
 * An immutable TextLocation.
 */
public class FixedLocation implements TextLocation {

    private final long line;
    private final long column;
    private final long characterIndex;

    public FixedLocation(long line, long column, long characterIndex) {
        this.line = line;
        this.column = column;
        this.characterIndex = characterIndex;
    }
    public FixedLocation(TextLocation other) {
        this(other.getLine(), other.getColumn(), other.getCharacterIndex());
    }

    public String toString() {
        return String.format("line %d column %d (char %d)", getLine(),
                             getColumn(), getCharacterIndex());
    }

    public boolean equals(Object other) {
        if (! (other instanceof TextLocation)) return false;
        TextLocation co = (TextLocation) other;
        return (line == co.getLine() &&
                column == co.getColumn() &&
                characterIndex == co.getCharacterIndex());
    }

    public int hashCode() {
        return (int) (line ^ line >>> 31 ^ column ^ column >>> 31 ^
            characterIndex ^ characterIndex >>> 31);
    }

    public long getLine() {
        return line;
    }

    public long getColumn() {
        return column;
    }

    public long getCharacterIndex() {
        return characterIndex;
    }

}
