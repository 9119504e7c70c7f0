package erlang.json.term;

/// Exception thrown when JSON text cannot be read as a [Term] tree.
/// This covers malformed JSON as well as JSON objects, which the
/// abstract-syntax dump never produces.
public class TermParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// Creates a new parse exception with the given message.
    /// @param message the error message
    public TermParseException(String message) {
        super(message);
    }

    /// Creates a new parse exception with the given message and cause.
    /// @param message the error message
    /// @param cause the underlying cause
    public TermParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
