package erlang.json.ast;

import erlang.json.ast.ErlangAst.Expression;
import erlang.json.ast.ErlangAst.Form;
import erlang.json.ast.ErlangAst.Module;
import erlang.json.term.Term;
import erlang.json.term.TermParseException;
import erlang.json.term.Terms;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Decodes JSON dumps of the Erlang abstract format into an [ErlangAst].
///
/// The input is the list of forms the compiler produces for one module, each
/// form a tagged tuple such as `["attribute", 1, "module", "foo"]` or
/// `["function", 3, "f", 1, Clauses]`, with tuples and lists written as JSON
/// arrays.
///
/// ## Failure Handling
/// A form that cannot be decoded is dropped and reported to the
/// [DiagnosticSink]; the other forms are unaffected. Inside a form there is no
/// recovery: one malformed sub-expression drops the whole form. `eof`, type
/// specs and unknown attributes are skipped without a report.
///
/// Usage:
/// ```java
/// Module module = ErlangAstParser.parseModule(Path.of("foo.json"));
/// for (Form form : module.forms()) {
///     ...
/// }
/// ```
public final class ErlangAstParser {

    private static final Logger LOG = Logger.getLogger(ErlangAstParser.class.getName());

    /// System property enabling parallel decoding of top-level forms.
    public static final String PARALLEL_PROPERTY = "erlang.json.ast.parallel";

    private ErlangAstParser() {
        // Static utility class
    }

    /// Decoding options.
    ///
    /// @param parallel decode top-level forms on a parallel stream; the sink must be thread safe
    public record Options(boolean parallel) {

        /// Sequential decoding.
        public static final Options DEFAULT = new Options(false);

        /// {@return the options configured through system properties}
        ///
        /// Reads [#PARALLEL_PROPERTY]; absent or anything but `true` means sequential.
        public static Options fromSystemProperties() {
            final String parallel = System.getProperty(PARALLEL_PROPERTY);
            final Options options = new Options(Boolean.parseBoolean(parallel == null ? null : parallel.trim()));
            LOG.config(() -> PARALLEL_PROPERTY + "=" + options.parallel());
            return options;
        }
    }

    /// Decodes a module, logging unrecognized nodes at `FINE`.
    ///
    /// @param forms the list of top-level forms
    /// @return the module
    /// @throws NullPointerException if forms is null
    /// @throws ErlangAstParseException if `forms` is not a list
    public static Module parseModule(Term forms) {
        return parseModule(forms, DiagnosticSink.logging(), Options.fromSystemProperties());
    }

    /// Decodes a module, reporting unrecognized nodes to `sink`.
    ///
    /// @param forms the list of top-level forms
    /// @param sink receives one report per unrecognized node
    /// @param options decoding options
    /// @return the module
    /// @throws NullPointerException if any argument is null
    /// @throws ErlangAstParseException if `forms` is not a list
    public static Module parseModule(Term forms, DiagnosticSink sink, Options options) {
        Objects.requireNonNull(forms, "forms must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return decodeModule(forms, sink, options.parallel())
                .orElseThrow(() -> new ErlangAstParseException(
                        "Module must be a list of forms, got: " + Terms.abbreviate(forms)));
    }

    /// Reads and decodes a module from JSON text.
    ///
    /// @param json the JSON text
    /// @return the module
    /// @throws TermParseException if the text is not a valid dump
    /// @throws ErlangAstParseException if the root is not a list
    public static Module parseModule(String json) {
        return parseModule(Terms.parse(json));
    }

    /// Reads and decodes a module from a JSON file.
    ///
    /// @param path the JSON file
    /// @return the module
    /// @throws IOException if the file cannot be read
    /// @throws TermParseException if the content is not a valid dump
    /// @throws ErlangAstParseException if the root is not a list
    public static Module parseModule(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        LOG.fine(() -> "Parsing module dump " + path);
        return parseModule(Terms.read(path));
    }

    /// Decodes the lenient list of forms. Empty only if `forms` is not a list.
    ///
    /// @param forms the list of top-level forms
    /// @param sink receives one report per unrecognized node
    /// @param parallel decode forms on a parallel stream
    /// @return the module, or empty
    public static Optional<Module> decodeModule(Term forms, DiagnosticSink sink, boolean parallel) {
        return decoders(sink).forms.module(forms, parallel);
    }

    /// Decodes a single top-level form.
    ///
    /// @param form the form node
    /// @param sink receives one report per unrecognized node
    /// @return the form, or empty if it failed or carries nothing modeled (eof, unknown attribute)
    public static Optional<Form> decodeForm(Term form, DiagnosticSink sink) {
        return decoders(sink).forms.decodedForm(form);
    }

    /// Decodes a single expression.
    ///
    /// @param expression the expression node
    /// @param sink receives one report per unrecognized node
    /// @return the expression, or empty if it could not be decoded
    public static Optional<Expression> decodeExpression(Term expression, DiagnosticSink sink) {
        final Decoders decoders = decoders(sink);
        return decoders.support.withinStack("expression", expression,
                () -> decoders.expressions.expression(expression));
    }

    /// Decodes a single expression, logging unrecognized nodes at `FINE`.
    ///
    /// @param expression the expression node
    /// @return the expression
    /// @throws ErlangAstParseException if the expression could not be decoded
    public static Expression parseExpression(Term expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return decodeExpression(expression, DiagnosticSink.logging())
                .orElseThrow(() -> new ErlangAstParseException(
                        "Unrecognized expression: " + Terms.abbreviate(expression)));
    }

    static Decoders decoders(DiagnosticSink sink) {
        return new Decoders(new DecoderSupport(sink));
    }

    /// The wired decoder group for one sink.
    static final class Decoders {
        final DecoderSupport support;
        final LeafDecoder leaves;
        final ExpressionDecoder expressions;
        final FormDecoder forms;

        Decoders(DecoderSupport support) {
            this.support = support;
            this.leaves = new LeafDecoder(support);
            this.expressions = new ExpressionDecoder(support, leaves);
            this.forms = new FormDecoder(support, leaves, expressions);
        }

        ClauseDecoder clauses() {
            return expressions.clauses();
        }
    }
}
