package erlang.json.term;

/// A floating point scalar.
///
/// @param value the finite double value
public record TermFloat(double value) implements Term {

    public TermFloat {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a finite float: " + value);
        }
    }

    /// {@return a `TermFloat` holding the given value}
    /// @param value the finite double value
    public static TermFloat of(double value) {
        return new TermFloat(value);
    }

    @Override
    public double toDouble() {
        return value;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
