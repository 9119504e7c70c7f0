package erlang.json.ast;

/// Exception thrown by [ErlangAstParser] entry points that must return a value
/// when the root node could not be decoded. The decoders themselves never throw.
public class ErlangAstParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// Creates a new parse exception with the given message.
    /// @param message the error message
    public ErlangAstParseException(String message) {
        super(message);
    }
}
