package glow.navigator.query;

/**
 * A query pattern that is blank or does not compile.
 */
public class PatternException extends IllegalArgumentException {

    private final String pattern;

    public PatternException(String pattern, String message, Throwable cause) {
        super(message, cause);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
