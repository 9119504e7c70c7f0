package erlang.json.term;

/// The null scalar. Some dumpers encode the atom `null` this way.
public record TermNull() implements Term {

    private static final TermNull INSTANCE = new TermNull();

    /// {@return the `TermNull` instance}
    public static TermNull of() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "null";
    }
}
