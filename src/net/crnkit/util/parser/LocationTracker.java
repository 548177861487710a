package net.crnkit.util.parser;

/**
 * A mutable TextLocation that follows a stream of characters.
 * CR, LF, and CR-LF all count as a single line break; tabs advance the
 * column to the next multiple of the tab size (plus one).
 */
public class LocationTracker implements TextLocation {

    public static final int DEFAULT_TAB_SIZE = 8;

    private final int tabSize;
    private long line;
    private long column;
    private long characterIndex;
    private boolean afterCR;

    public LocationTracker(int tabSize) {
        if (tabSize < 1)
            throw new IllegalArgumentException("Invalid tab size " +
                                               tabSize);
        this.tabSize = tabSize;
        this.line = 1;
        this.column = 1;
        this.characterIndex = 0;
        this.afterCR = false;
    }
    public LocationTracker() {
        this(DEFAULT_TAB_SIZE);
    }

    public String toString() {
        return String.format("%s@%h[line=%s,column=%s,char=%s,tabSize=%s]",
            getClass().getName(), this, getLine(), getColumn(),
            getCharacterIndex(), getTabSize());
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

    public int getTabSize() {
        return tabSize;
    }

    public FixedLocation snapshot() {
        return new FixedLocation(this);
    }

    @SuppressWarnings("fallthrough")
    public void advance(char ch) {
        characterIndex++;
        switch (ch) {
            case '\t':
                column = (column + tabSize - 1) / tabSize * tabSize + 1;
                break;
            case '\n':
                if (afterCR) break;
                // Intentionally falling through.
            case '\r':
                line++;
                column = 1;
                break;
            default:
                column++;
                break;
        }
        afterCR = (ch == '\r');
    }
    public void advance(CharSequence data, int offset, int size) {
        for (int i = offset, ei = offset + size; i < ei; i++) {
            advance(data.charAt(i));
        }
    }

}
