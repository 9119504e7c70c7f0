package erlang.json.term;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// An ordered sequence of nodes. Tuples and lists of the abstract format
/// are both encoded as `TermList`.
///
/// @param elements the elements, copied into an unmodifiable list
public record TermList(List<Term> elements) implements Term {

    public TermList {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements); // defensive copy, rejects null elements
    }

    /// {@return a `TermList` holding the given elements}
    /// @param elements the elements
    public static TermList of(List<? extends Term> elements) {
        return new TermList(List.copyOf(elements));
    }

    /// {@return a `TermList` holding the given elements}
    /// @param elements the elements
    public static TermList of(Term... elements) {
        return new TermList(Arrays.asList(elements));
    }

    @Override
    public List<Term> elements() {
        return elements;
    }

    @Override
    public Optional<String> tag() {
        if (!elements.isEmpty() && elements.get(0) instanceof TermString discriminator) {
            return Optional.of(discriminator.value());
        }
        return Optional.empty();
    }

    @Override
    public boolean isTagged(String tag, int size) {
        return elements.size() == size && tag().filter(tag::equals).isPresent();
    }

    @Override
    public String toString() {
        return Terms.render(this, Integer.MAX_VALUE);
    }
}
