package erlang.json.term;

/// Signals that a [Term] was accessed as a shape it does not have,
/// for example calling [Term#elements()] on a string node.
public final class TermTypeError extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// Creates a new TermTypeError with the given message.
    /// @param message the error message
    public TermTypeError(String message) {
        super(message);
    }

    static TermTypeError of(Term actual, String expected) {
        return new TermTypeError("%s is not a %s: %s".formatted(
                actual.getClass().getSimpleName(), expected, Terms.abbreviate(actual)));
    }
}
