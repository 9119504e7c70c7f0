package erlang.json.term;

/// A boolean scalar. Some dumpers encode the atoms `true` and `false` this way.
///
/// @param value the boolean value
public record TermBoolean(boolean value) implements Term {

    private static final TermBoolean TRUE = new TermBoolean(true);
    private static final TermBoolean FALSE = new TermBoolean(false);

    /// {@return the `TermBoolean` for the given value}
    /// @param value the boolean value
    public static TermBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public boolean bool() {
        return value;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
