package net.crnkit.crn;

/**
 * Thrown when a syntactically valid record has the wrong shape, such as a
 * rate clause that does not fit the reaction's reversibility.
 */
public class CrnFormatException extends CrnException {

    public CrnFormatException() {
        super();
    }
    public CrnFormatException(String message) {
        super(message);
    }
    public CrnFormatException(Throwable cause) {
        super(cause);
    }
    public CrnFormatException(String message, Throwable cause) {
        super(message, cause);
    }

}
