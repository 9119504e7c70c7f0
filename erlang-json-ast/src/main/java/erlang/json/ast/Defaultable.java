package erlang.json.ast;

import java.util.Objects;

/// A successfully decoded value that may be the `default` marker.
///
/// Wrapped in an `Optional`, this gives the three outcomes of the marker
/// decoder: empty (malformed node), [UseDefault] (the source asked for the
/// default) and [Given] (an explicit value).
///
/// @param <T> the type of an explicit value
public sealed interface Defaultable<T> {

    /// The source wrote the `default` marker.
    record UseDefault<T>() implements Defaultable<T> {}

    /// The source gave an explicit value.
    record Given<T>(T value) implements Defaultable<T> {
        public Given {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// {@return the explicit value, or null for the default}
    default T orNull() {
        return this instanceof Given<T> given ? given.value() : null;
    }

    default boolean isDefault() {
        return this instanceof UseDefault<?>;
    }
}
