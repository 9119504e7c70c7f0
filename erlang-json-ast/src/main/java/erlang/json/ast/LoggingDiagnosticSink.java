package erlang.json.ast;

import erlang.json.term.Term;
import erlang.json.term.Terms;

import java.util.logging.Logger;

/// Default [DiagnosticSink]: one structured `FINE` record per unrecognized node.
final class LoggingDiagnosticSink implements DiagnosticSink {

    static final LoggingDiagnosticSink INSTANCE = new LoggingDiagnosticSink();

    private static final Logger LOG = Logger.getLogger(LoggingDiagnosticSink.class.getName());

    private LoggingDiagnosticSink() {}

    @Override
    public void unrecognized(String label, Term node) {
        StructuredLog.fine(LOG, "UnknownShape", "label", label, "node", new Dump(node));
    }

    /// Defers rendering the node until the record is actually logged.
    private record Dump(Term node) {
        @Override
        public String toString() {
            return Terms.abbreviate(node);
        }
    }
}
