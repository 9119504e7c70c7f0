package erlang.json.ast;

import erlang.json.ast.ErlangAst.BinaryOp;
import erlang.json.ast.ErlangAst.ExceptionClass;
import erlang.json.ast.ErlangAst.FunctionReference;
import erlang.json.ast.ErlangAst.FunctionSignature;
import erlang.json.ast.ErlangAst.ModuleReference;
import erlang.json.ast.ErlangAst.UnaryOp;
import erlang.json.term.Term;
import erlang.json.term.TermInteger;
import erlang.json.term.TermList;
import erlang.json.term.TermString;

import java.util.Optional;

/// Decoders for the non-recursive pieces: operators, arities, exception
/// classes and module/function references.
final class LeafDecoder {

    private final DecoderSupport support;

    LeafDecoder(DecoderSupport support) {
        this.support = support;
    }

    Optional<BinaryOp> binaryOperator(Term node) {
        if (node instanceof TermString symbol) {
            final var op = BinaryOp.fromSymbol(symbol.value());
            if (op.isPresent()) {
                return op;
            }
        }
        return support.unknown("binary_operator", node);
    }

    Optional<UnaryOp> unaryOperator(Term node) {
        if (node instanceof TermString symbol) {
            final var op = UnaryOp.fromSymbol(symbol.value());
            if (op.isPresent()) {
                return op;
            }
        }
        return support.unknown("unary_operator", node);
    }

    /// `["atom", _, name]` is a literal class, `["var", _, name]` a bound one.
    Optional<ExceptionClass> exceptionClass(Term node) {
        return support.attempt(node, () -> {
            if (node.isTagged("atom", 3) && node.element(2) instanceof TermString name) {
                return Optional.of(new ExceptionClass.Atom(name.value()));
            }
            if (node.isTagged("var", 3) && node.element(2) instanceof TermString variable) {
                return Optional.of(new ExceptionClass.Pattern(variable.value()));
            }
            return support.unknown("exception", node);
        });
    }

    /// A bare integer or `["integer", _, n]`.
    Optional<Integer> arity(Term node) {
        return support.attempt(node, () -> {
            if (node instanceof TermInteger arity) {
                return Optional.of(arity.toInt());
            }
            if (node.isTagged("integer", 3) && node.element(2) instanceof TermInteger arity) {
                return Optional.of(arity.toInt());
            }
            return support.unknown("arity", node);
        });
    }

    /// A bare name, `["atom", _, name]` or `["var", _, name]`.
    Optional<ModuleReference> moduleReference(Term node) {
        return support.attempt(node, () -> {
            if (node instanceof TermString name) {
                return Optional.of(new ModuleReference.Name(name.value()));
            }
            if (node.isTagged("atom", 3) && node.element(2) instanceof TermString name) {
                return Optional.of(new ModuleReference.Name(name.value()));
            }
            if (node.isTagged("var", 3) && node.element(2) instanceof TermString variable) {
                return Optional.of(new ModuleReference.Variable(variable.value()));
            }
            return support.unknown("module_reference", node);
        });
    }

    /// A bare name, `["atom", _, name]` or `["var", _, name]`.
    Optional<FunctionReference> functionReference(Term node) {
        return support.attempt(node, () -> {
            if (node instanceof TermString name) {
                return Optional.of(new FunctionReference.Name(name.value()));
            }
            if (node.isTagged("atom", 3) && node.element(2) instanceof TermString name) {
                return Optional.of(new FunctionReference.Name(name.value()));
            }
            if (node.isTagged("var", 3) && node.element(2) instanceof TermString variable) {
                return Optional.of(new FunctionReference.Variable(variable.value()));
            }
            return support.unknown("function_reference", node);
        });
    }

    /// `[name, arity]` as listed by export and import attributes.
    Optional<FunctionSignature> exportedFunction(Term node) {
        return support.attempt(node, () -> {
            if (node instanceof TermList pair && pair.elements().size() == 2
                    && node.element(0) instanceof TermString name
                    && node.element(1) instanceof TermInteger arity) {
                return Optional.of(FunctionSignature.local(name.value(), arity.toInt()));
            }
            return support.unknown("function", node);
        });
    }
}
