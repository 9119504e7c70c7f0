package erlang.json.term;

import java.math.BigInteger;
import java.util.Objects;

/// An integer scalar of arbitrary precision.
///
/// Erlang integers are unbounded, so the dump can contain literals beyond
/// the range of `long`; the exact value is kept and [#toString()] returns
/// its decimal text.
///
/// @param value the integer value
public record TermInteger(BigInteger value) implements Term {

    public TermInteger {
        Objects.requireNonNull(value, "value must not be null");
    }

    /// {@return a `TermInteger` holding the given value}
    /// @param value the integer value
    public static TermInteger of(long value) {
        return new TermInteger(BigInteger.valueOf(value));
    }

    /// {@return a `TermInteger` parsed from decimal text}
    /// @param text the decimal digits, optionally signed
    /// @throws NumberFormatException if `text` is not a decimal integer
    public static TermInteger of(String text) {
        return new TermInteger(new BigInteger(text));
    }

    @Override
    public BigInteger integer() {
        return value;
    }

    @Override
    public int toInt() {
        try {
            return value.intValueExact();
        } catch (ArithmeticException ex) {
            throw new TermTypeError("TermInteger " + value + " does not fit in an int");
        }
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
