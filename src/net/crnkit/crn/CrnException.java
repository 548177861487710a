package net.crnkit.crn;

/**
 * Base class of the exceptions raised while reading a CRN document.
 */
public class CrnException extends Exception {

    public CrnException() {
        super();
    }
    public CrnException(String message) {
        super(message);
    }
    public CrnException(Throwable cause) {
        super(cause);
    }
    public CrnException(String message, Throwable cause) {
        super(message, cause);
    }

}
