package glow.navigator.markup;

/**
 * Embedded markup could not be parsed.
 */
public class SubDocumentException extends RuntimeException {

    public SubDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
