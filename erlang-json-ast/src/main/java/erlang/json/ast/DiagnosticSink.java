package erlang.json.ast;

import erlang.json.term.Term;

/// Receives one report per node the decoders could not recognize.
///
/// This is a best-effort side channel, not an error channel: decoding results
/// do not depend on it. Implementations must be safe for concurrent calls when
/// a module is decoded with [ErlangAstParser.Options#parallel()] enabled.
@FunctionalInterface
public interface DiagnosticSink {

    /// Reports an unrecognized or malformed node.
    ///
    /// @param label the construct being decoded, such as `expression` or `line`,
    ///              or the message of the shape error that was hit
    /// @param node the raw node
    void unrecognized(String label, Term node);

    /// {@return the sink that logs each report at `FINE`}
    static DiagnosticSink logging() {
        return LoggingDiagnosticSink.INSTANCE;
    }
}
