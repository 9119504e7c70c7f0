package erlang.json.ast;

import erlang.json.ast.DecoderSupport.ListMode;
import erlang.json.ast.ErlangAst.CatchPattern;
import erlang.json.ast.ErlangAst.Clause;
import erlang.json.ast.ErlangAst.ExceptionClass;
import erlang.json.ast.ErlangAst.Expression;
import erlang.json.ast.ErlangAst.Qualifier;
import erlang.json.term.Term;
import erlang.json.term.TermList;
import erlang.json.term.TermNull;
import erlang.json.term.TermString;

import java.util.List;
import java.util.Optional;

import static erlang.json.ast.DecoderSupport.need;

/// Decodes clauses, guards, comprehension qualifiers and catch patterns.
///
/// Works hand in hand with [ExpressionDecoder]: clause bodies and guards are
/// expressions, and several expressions contain clauses.
final class ClauseDecoder {

    private final DecoderSupport support;
    private final LeafDecoder leaves;
    private final ExpressionDecoder expressions;

    ClauseDecoder(DecoderSupport support, LeafDecoder leaves, ExpressionDecoder expressions) {
        this.support = support;
        this.leaves = leaves;
        this.expressions = expressions;
    }

    /// Clause of a function, case, if, receive or fun: patterns are expressions.
    Optional<Clause<Expression>> caseClause(Term node) {
        return clause(expressions::expression, node);
    }

    /// Clause of a try's catch section: patterns are `Class:Reason:Stacktrace` triples.
    Optional<Clause<CatchPattern>> catchClause(Term node) {
        return clause(this::catchPattern, node);
    }

    /// `["clause", Anno, Patterns, Guards, Body]` with patterns decoded by `pattern`.
    <P> Optional<Clause<P>> clause(Decoder<P> pattern, Term node) {
        return support.attempt(node, () -> {
            if (!node.isTagged("clause", 5)) {
                return support.unknown("clause", node);
            }
            final int line = need(support.line(node.element(1)));
            final List<P> patterns = need(support.list(ListMode.STRICT, pattern, node.element(2)));
            final List<List<Expression>> guards = need(guards(node.element(3)));
            final List<Expression> body = need(expressions.body(normalizeSingleton(node.element(4))));
            return Optional.of(new Clause<>(line, patterns, guards, body));
        });
    }

    /// Guards are a list of alternatives, each a list of tests that must all hold.
    /// An empty list, or null, means the clause has no guard.
    Optional<List<List<Expression>>> guards(Term node) {
        if (node instanceof TermNull) {
            return Optional.of(List.of());
        }
        return support.list(ListMode.STRICT, expressions::body, node);
    }

    /// Brings a clause body into the canonical form: a list of one or more expressions.
    ///
    /// A lone expression is wrapped in a list; a list is kept as is; singleton
    /// lists around something that is not an expression are unwrapped until
    /// one of the first two cases applies. Applying this twice changes nothing.
    static Term normalizeSingleton(Term node) {
        final Term unwrapped = unwrapSingletons(node);
        if (unwrapped.tag().isPresent()) {
            return TermList.of(unwrapped);
        }
        if (unwrapped instanceof TermList) {
            return unwrapped;
        }
        return TermList.of(unwrapped);
    }

    private static Term unwrapSingletons(Term node) {
        Term current = node;
        while (current.tag().isEmpty()
                && current instanceof TermList list
                && list.elements().size() == 1) {
            current = list.elements().get(0);
        }
        return current;
    }

    /// `["generate", _, P, E]` is `P <- E`, `["b_generate", _, P, E]` is `P <= E`;
    /// anything else is a filter expression.
    Optional<Qualifier> qualifier(Term node) {
        return support.attempt(node, () -> {
            if (node.isTagged("generate", 4)) {
                final Expression pattern = need(expressions.expression(node.element(2)));
                final Expression expression = need(expressions.expression(node.element(3)));
                return Optional.of(new Qualifier.Generator(pattern, expression));
            }
            if (node.isTagged("b_generate", 4)) {
                final Expression pattern = need(expressions.expression(node.element(2)));
                final Expression expression = need(expressions.expression(node.element(3)));
                return Optional.of(new Qualifier.BitsGenerator(pattern, expression));
            }
            return expressions.expression(node).map(Qualifier.Filter::new);
        });
    }

    /// `["tuple", _, [Class, Pattern, ["var", _, Stacktrace]]]`
    Optional<CatchPattern> catchPattern(Term node) {
        return support.attempt(node, () -> {
            if (node.isTagged("tuple", 3)
                    && node.element(2) instanceof TermList triple
                    && triple.elements().size() == 3
                    && triple.element(2).isTagged("var", 3)
                    && triple.element(2).element(2) instanceof TermString variable) {
                final ExceptionClass exceptionClass = need(leaves.exceptionClass(triple.element(0)));
                final Expression pattern = need(expressions.expression(triple.element(1)));
                return Optional.of(new CatchPattern(exceptionClass, pattern, variable.value()));
            }
            return support.unknown("catch_pattern", node);
        });
    }
}
