package erlang.json.term;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/// The interface that represents one node of a dumped Erlang abstract syntax tree.
///
/// A node is either a scalar (string, integer, float, boolean or null) or an
/// ordered sequence of nodes. A *tagged* node is a [TermList] whose first
/// element is a [TermString] discriminator, for example
/// `["integer", 1, 42]` or `["op", 3, "+", L, R]`.
///
/// Instances of `Term` are immutable and thread safe.
///
/// The access methods on this interface throw [TermTypeError] when the node
/// does not have the requested shape. Decoders rely on this: they navigate a
/// node assuming the shape implied by its tag and treat a `TermTypeError` as
/// a malformed node.
public sealed interface Term
        permits TermString, TermInteger, TermFloat, TermBoolean, TermNull, TermList {

    /// {@return the JSON representation of this `Term`}
    String toString();

    /// {@return the `String` value represented by a `TermString`}
    default String string() {
        throw TermTypeError.of(this, "TermString");
    }

    /// {@return the arbitrary-precision value represented by a `TermInteger`}
    default BigInteger integer() {
        throw TermTypeError.of(this, "TermInteger");
    }

    /// {@return the `int` value represented by a `TermInteger`}
    ///
    /// @throws TermTypeError if this is not a `TermInteger` or it does not fit in an `int`
    default int toInt() {
        throw TermTypeError.of(this, "TermInteger");
    }

    /// {@return the `double` value represented by a `TermFloat`}
    default double toDouble() {
        throw TermTypeError.of(this, "TermFloat");
    }

    /// {@return the `boolean` value represented by a `TermBoolean`}
    default boolean bool() {
        throw TermTypeError.of(this, "TermBoolean");
    }

    /// {@return the elements of a `TermList`}
    default List<Term> elements() {
        throw TermTypeError.of(this, "TermList");
    }

    /// {@return the element at the given index of a `TermList`}
    ///
    /// @param index the index of the element
    /// @throws TermTypeError if this is not a `TermList` or the index is out of bounds
    default Term element(int index) {
        final List<Term> elements = elements();
        if (index < 0 || index >= elements.size()) {
            throw new TermTypeError(
                    "TermList index %d out of bounds for length %d in %s"
                            .formatted(index, elements.size(), Terms.abbreviate(this)));
        }
        return elements.get(index);
    }

    /// {@return the discriminator of a tagged node, or empty if this node is not tagged}
    default Optional<String> tag() {
        return Optional.empty();
    }

    /// {@return `true` if this is a tagged node with the given discriminator and element count}
    ///
    /// The element count includes the discriminator itself, so `["nil", 1]` has size 2.
    ///
    /// @param tag the expected discriminator
    /// @param size the expected number of elements
    default boolean isTagged(String tag, int size) {
        return false;
    }
}
