package erlang.json.ast;

import erlang.json.term.Term;
import erlang.json.term.TermInteger;
import erlang.json.term.TermList;
import erlang.json.term.TermString;
import erlang.json.term.TermTypeError;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Generic decoding primitives shared by all construct decoders: the
/// failure reporter, list decoding, the `default` marker and line numbers.
///
/// Construct decoders are written as straight-line code. A nested decoder
/// that fails is unwrapped with [#need(Optional)], which aborts the
/// enclosing [#attempt] block; shape errors raised by [Term] accessors are
/// caught there too. Nothing thrown inside a decoder escapes `attempt`.
final class DecoderSupport {

    /// The marker the dump uses for "no explicit value", e.g. a bin element without size.
    static final String DEFAULT_MARKER = "default";

    enum ListMode {
        /// Any failing element fails the whole list.
        STRICT,
        /// Failing elements are dropped.
        LENIENT
    }

    private static final Logger LOG = Logger.getLogger(DecoderSupport.class.getName());

    private final DiagnosticSink sink;

    DecoderSupport(DiagnosticSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /// Reports an unrecognized node and fails.
    <T> Optional<T> unknown(String label, Term node) {
        sink.unrecognized(label, node);
        return Optional.empty();
    }

    /// Runs a decoder body for `node` and turns any failure inside it into an empty result.
    <T> Optional<T> attempt(Term node, Supplier<Optional<T>> body) {
        try {
            return body.get();
        } catch (TermTypeError e) {
            return unknown(e.getMessage(), node);
        } catch (Abort e) {
            // the decoder that failed has already reported
            return Optional.empty();
        }
    }

    /// Runs `body` and reports `node` under `label` if it nests too deeply for
    /// recursive descent. Used at the entry points, where one failure must not
    /// take its siblings down with it.
    <T> Optional<T> withinStack(String label, Term node, Supplier<Optional<T>> body) {
        try {
            return body.get();
        } catch (StackOverflowError e) {
            LOG.fine(() -> "Nesting too deep while decoding " + label);
            return unknown(label, node);
        }
    }

    /// {@return the decoded value} Aborts the enclosing [#attempt] if decoding failed.
    static <T> T need(Optional<T> decoded) {
        return decoded.orElseThrow(() -> Abort.INSTANCE);
    }

    /// Decodes every element of a list node.
    ///
    /// All elements are decoded even in strict mode, so each bad element is reported.
    <T> Optional<List<T>> list(ListMode mode, Decoder<T> element, Term node) {
        return list(mode, element, node, false);
    }

    /// Decodes every element of a list node, optionally on a parallel stream.
    /// Element order is preserved either way.
    <T> Optional<List<T>> list(ListMode mode, Decoder<T> element, Term node, boolean parallel) {
        return attempt(node, () -> {
            final List<Term> elements = node.elements();
            final Stream<Term> stream = parallel ? elements.parallelStream() : elements.stream();
            final List<Optional<T>> decoded = stream.map(element::decode).collect(Collectors.toList());
            if (mode == ListMode.STRICT && decoded.stream().anyMatch(Optional::isEmpty)) {
                return Optional.empty();
            }
            return Optional.of(decoded.stream().flatMap(Optional::stream).collect(Collectors.toList()));
        });
    }

    /// Decodes a node that is either the `default` marker or a value for `inner`.
    <T> Optional<Defaultable<T>> defaultOr(Decoder<T> inner, Term node) {
        if (node instanceof TermString marker && DEFAULT_MARKER.equals(marker.value())) {
            return Optional.of(new Defaultable.UseDefault<>());
        }
        return inner.decode(node).map(Defaultable.Given::new);
    }

    /// Decodes the line of an annotation.
    ///
    /// Accepted shapes are a bare line `7`, a generated position
    /// `[["generated", ...], ["location", 7]]` and a line with column `[7, 12]`.
    /// The column is dropped.
    Optional<Integer> line(Term anno) {
        return attempt(anno, () -> {
            if (anno instanceof TermInteger line) {
                return Optional.of(line.toInt());
            }
            if (anno instanceof TermList pair && pair.elements().size() == 2) {
                final Term first = pair.element(0);
                final Term second = pair.element(1);
                if (first.tag().filter("generated"::equals).isPresent()
                        && second.isTagged("location", 2)
                        && second.element(1) instanceof TermInteger line) {
                    return Optional.of(line.toInt());
                }
                if (first instanceof TermInteger line) {
                    return Optional.of(line.toInt());
                }
            }
            return unknown("line", anno);
        });
    }

    /// Decodes the decimal text of an integer literal.
    Optional<String> intLiteral(Term node) {
        if (node instanceof TermInteger value) {
            return Optional.of(value.toString());
        }
        return unknown("intlit", node);
    }

    /// Aborts an [#attempt] block. Carries no stack trace; it is control flow only.
    private static final class Abort extends RuntimeException {

        @java.io.Serial
        private static final long serialVersionUID = 1L;

        static final Abort INSTANCE = new Abort();

        private Abort() {
            super(null, null, false, false);
        }
    }
}
