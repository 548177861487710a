package net.crnkit.crn;

import net.crnkit.util.parser.TextLocation;

/**
 * Thrown when a CRN document does not conform to the grammar.
 */
public class CrnSyntaxException extends CrnException {

    private final TextLocation location;

    public CrnSyntaxException(TextLocation location) {
        super();
        this.location = location;
    }
    public CrnSyntaxException(TextLocation location, String message) {
        super(message);
        this.location = location;
    }
    public CrnSyntaxException(TextLocation location, Throwable cause) {
        super(cause);
        this.location = location;
    }
    public CrnSyntaxException(TextLocation location, String message,
                              Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /**
     * Where the offending input starts; may be null if unknown.
     */
    public TextLocation getLocation() {
        return location;
    }

}
