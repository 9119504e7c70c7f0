package erlang.json.ast;

import erlang.json.ast.DecoderSupport.ListMode;
import erlang.json.ast.ErlangAst.Clause;
import erlang.json.ast.ErlangAst.Export;
import erlang.json.ast.ErlangAst.Expression;
import erlang.json.ast.ErlangAst.File;
import erlang.json.ast.ErlangAst.Form;
import erlang.json.ast.ErlangAst.FormKind;
import erlang.json.ast.ErlangAst.FunctionDecl;
import erlang.json.ast.ErlangAst.FunctionSignature;
import erlang.json.ast.ErlangAst.Import;
import erlang.json.ast.ErlangAst.ModuleDecl;
import erlang.json.ast.ErlangAst.RecordDecl;
import erlang.json.ast.ErlangAst.RecordField;
import erlang.json.term.Term;
import erlang.json.term.TermInteger;
import erlang.json.term.TermList;
import erlang.json.term.TermString;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import static erlang.json.ast.DecoderSupport.need;

/// Decodes top-level forms and assembles them into a module.
///
/// A form has three outcomes: decoded, skipped, or failed. Skipped forms
/// (`eof`, type specs and any attribute without a dedicated branch) vanish
/// without a diagnostic. Failed forms are reported and dropped; their
/// siblings are decoded independently.
final class FormDecoder {

    private static final Logger LOG = Logger.getLogger(FormDecoder.class.getName());

    private final DecoderSupport support;
    private final LeafDecoder leaves;
    private final ExpressionDecoder expressions;

    FormDecoder(DecoderSupport support, LeafDecoder leaves, ExpressionDecoder expressions) {
        this.support = support;
        this.leaves = leaves;
        this.expressions = expressions;
    }

    /// Result of decoding one top-level node that did not fail.
    sealed interface FormOutcome {
        record Decoded(Form form) implements FormOutcome {
            public Decoded {
                Objects.requireNonNull(form, "form must not be null");
            }
        }

        /// A node that carries nothing this AST models.
        record Skipped(String what) implements FormOutcome {}
    }

    /// Decodes the list of top-level forms. Failing forms are dropped, the rest keep their order.
    ///
    /// @param node the root list
    /// @param parallel decode forms on a parallel stream
    /// @return the module, or empty if the root is not a list
    Optional<ErlangAst.Module> module(Term node, boolean parallel) {
        return support.list(ListMode.LENIENT, this::form, node, parallel).map(outcomes -> {
            final List<Form> forms = outcomes.stream()
                    .filter(FormOutcome.Decoded.class::isInstance)
                    .map(outcome -> ((FormOutcome.Decoded) outcome).form())
                    .toList();
            StructuredLog.fine(LOG, "ModuleDecoded",
                    "forms", forms.size(),
                    "skipped", outcomes.size() - forms.size(),
                    "dropped", node.elements().size() - outcomes.size(),
                    "parallel", parallel);
            return new ErlangAst.Module(forms);
        });
    }

    /// Decodes one top-level node. A form nested too deeply to decode is reported
    /// and dropped like any other failing form.
    Optional<FormOutcome> form(Term node) {
        return support.withinStack("form", node, () -> support.attempt(node, () -> {
            if (node.isTagged("function", 5)) {
                return function(node);
            }
            if (node.isTagged("attribute", 4) && node.element(2) instanceof TermString attribute) {
                return attribute(node, attribute.value(), node.element(3));
            }
            if (node.isTagged("eof", 2)) {
                return skipped("eof");
            }
            return support.unknown("form", node);
        }));
    }

    /// Decodes one top-level node, treating a skipped node as absent.
    Optional<Form> decodedForm(Term node) {
        return form(node)
                .filter(FormOutcome.Decoded.class::isInstance)
                .map(outcome -> ((FormOutcome.Decoded) outcome).form());
    }

    /// `["function", Anno, Name, Arity, Clauses]`
    private Optional<FormOutcome> function(Term node) {
        if (!(node.element(2) instanceof TermString name) || !(node.element(3) instanceof TermInteger arity)) {
            return support.unknown("form", node);
        }
        final int line = line(node);
        final List<Clause<Expression>> clauses =
                need(support.list(ListMode.STRICT, expressions.clauses()::caseClause, node.element(4)));
        final FunctionSignature function = FunctionSignature.local(name.value(), arity.toInt());
        return decoded(line, new FunctionDecl(function, clauses));
    }

    /// `["attribute", Anno, Name, Value]`. Attributes whose value does not have the
    /// expected shape are skipped like unknown attributes.
    private Optional<FormOutcome> attribute(Term node, String name, Term value) {
        switch (name) {
            case "file":
                if (isPair(value) && value.element(0) instanceof TermString path) {
                    return decoded(line(node), new File(path.value()));
                }
                break;
            case "module":
                if (value instanceof TermString module) {
                    return decoded(line(node), new ModuleDecl(module.value()));
                }
                break;
            case "import":
                if (isPair(value) && value.element(0) instanceof TermString module) {
                    final int line = line(node);
                    final List<FunctionSignature> functions = need(functions(value.element(1)));
                    return decoded(line, new Import(module.value(), functions));
                }
                break;
            case "export": {
                final int line = line(node);
                return decoded(line, new Export(need(functions(value))));
            }
            case "record":
                if (isPair(value) && value.element(0) instanceof TermString record) {
                    final int line = line(node);
                    final List<RecordField> fields =
                            need(support.list(ListMode.STRICT, this::recordField, value.element(1)));
                    return decoded(line, new RecordDecl(record.value(), fields));
                }
                break;
            default:
                break;
        }
        StructuredLog.finer(LOG, "AttributeSkipped", "name", name);
        return skipped("attribute " + name);
    }

    /// A record field declaration, optionally wrapped with a type that is discarded.
    Optional<RecordField> recordField(Term node) {
        return support.attempt(node, () -> {
            if (node.isTagged("typed_record_field", 3)) {
                return recordField(node.element(1));
            }
            final boolean plain = node.isTagged("record_field", 3);
            if ((plain || node.isTagged("record_field", 4))
                    && node.element(2).isTagged("atom", 3)
                    && node.element(2).element(2) instanceof TermString field) {
                final Expression initializer = plain ? null : need(expressions.expression(node.element(3)));
                return Optional.of(new RecordField(field.value(), initializer));
            }
            return support.unknown("record_field", node);
        });
    }

    private Optional<List<FunctionSignature>> functions(Term node) {
        return support.list(ListMode.STRICT, leaves::exportedFunction, node);
    }

    private int line(Term node) {
        return need(support.line(node.element(1)));
    }

    private static boolean isPair(Term value) {
        return value instanceof TermList pair && pair.elements().size() == 2;
    }

    private static Optional<FormOutcome> decoded(int line, FormKind kind) {
        return Optional.of(new FormOutcome.Decoded(new Form(line, kind)));
    }

    private static Optional<FormOutcome> skipped(String what) {
        return Optional.of(new FormOutcome.Skipped(what));
    }
}
