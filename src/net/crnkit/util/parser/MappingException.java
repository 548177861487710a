package net.crnkit.util.parser;

/**
 * Exception thrown by Mapper-s when a parse tree has an unexpected shape.
 */
public class MappingException extends ParserException {

    public MappingException() {
        super();
    }
    public MappingException(String message) {
        super(message);
    }
    public MappingException(Throwable cause) {
        super(cause);
    }
    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }

}
