package erlang.json.ast;

import erlang.json.term.Term;

import java.util.Optional;

/// Decodes one [Term] into a `T`.
///
/// A decoder is total: it never throws for a badly shaped node. An empty
/// result means the node could not be decoded and a diagnostic has been
/// reported to the [DiagnosticSink].
///
/// @param <T> the decoded type
@FunctionalInterface
public interface Decoder<T> {

    Optional<T> decode(Term term);
}
