package erlang.json.term;

import java.util.Objects;

/// A string scalar. Atoms, discriminators and string literals all arrive as `TermString`.
///
/// @param value the string value
public record TermString(String value) implements Term {

    public TermString {
        Objects.requireNonNull(value, "value must not be null");
    }

    /// {@return a `TermString` holding the given value}
    /// @param value the string value
    public static TermString of(String value) {
        return new TermString(value);
    }

    @Override
    public String string() {
        return value;
    }

    @Override
    public String toString() {
        return Terms.quote(value);
    }
}
