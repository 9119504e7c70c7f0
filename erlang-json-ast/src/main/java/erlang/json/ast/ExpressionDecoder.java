package erlang.json.ast;

import erlang.json.ast.DecoderSupport.ListMode;
import erlang.json.ast.ErlangAst.*;
import erlang.json.term.Term;
import erlang.json.term.TermBoolean;
import erlang.json.term.TermFloat;
import erlang.json.term.TermList;
import erlang.json.term.TermNull;
import erlang.json.term.TermString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static erlang.json.ast.DecoderSupport.need;

/// Recursive-descent decoder for expressions and the constructs nested
/// directly in them: map associations, record field updates and bin elements.
///
/// Dispatch is on the discriminator and the element count of the tagged node.
/// Position 1 of every expression node is its annotation; the line is taken
/// from there. Shapes that match no branch are reported as `expression`.
final class ExpressionDecoder {

    private final DecoderSupport support;
    private final LeafDecoder leaves;
    private final ClauseDecoder clauses;

    ExpressionDecoder(DecoderSupport support, LeafDecoder leaves) {
        this.support = support;
        this.leaves = leaves;
        this.clauses = new ClauseDecoder(support, leaves, this);
    }

    ClauseDecoder clauses() {
        return clauses;
    }

    Optional<Expression> expression(Term node) {
        return support.attempt(node, () -> {
            final Optional<String> tag = node.tag();
            if (tag.isEmpty()) {
                return support.unknown("expression", node);
            }
            final int size = node.elements().size();
            return switch (tag.get()) {
                case "atom" -> size == 3 ? atom(node) : unknown(node);
                case "bc" -> size == 4 ? bitstringComprehension(node) : unknown(node);
                case "bin" -> size == 3 ? bitstringConstructor(node) : unknown(node);
                case "block" -> size == 3 ? block(node) : unknown(node);
                case "call" -> size == 4 ? call(node) : unknown(node);
                case "case" -> size == 4 ? caseOf(node) : unknown(node);
                case "catch" -> size == 3 ? catchOf(node) : unknown(node);
                case "char" -> size == 3 ? charLiteral(node) : unknown(node);
                case "cons" -> size == 4 ? cons(node) : unknown(node);
                case "float" -> size == 3 ? floatLiteral(node) : unknown(node);
                case "fun" -> size == 3 ? fun(node) : unknown(node);
                case "if" -> size == 3 ? ifOf(node) : unknown(node);
                case "integer" -> size == 3 ? integerLiteral(node) : unknown(node);
                case "lc" -> size == 4 ? listComprehension(node) : unknown(node);
                case "map" -> size == 3 || size == 4 ? map(node, size) : unknown(node);
                case "match" -> size == 4 ? match(node) : unknown(node);
                case "named_fun" -> size == 4 ? namedFun(node) : unknown(node);
                case "nil" -> size == 2 ? at(node, new Nil()) : unknown(node);
                case "op" -> size == 4 ? unaryOperator(node) : size == 5 ? binaryOperator(node) : unknown(node);
                case "receive" -> size == 3 || size == 5 ? receive(node, size) : unknown(node);
                case "record" -> size == 4 || size == 5 ? record(node, size) : unknown(node);
                case "record_field" -> size == 5 ? recordAccess(node) : unknown(node);
                case "record_index" -> size == 4 ? recordIndex(node) : unknown(node);
                case "string" -> size == 3 ? stringLiteral(node) : unknown(node);
                case "try" -> size == 6 ? tryCatch(node) : unknown(node);
                case "tuple" -> size == 3 ? tuple(node) : unknown(node);
                case "var" -> size == 3 ? variable(node) : unknown(node);
                default -> unknown(node);
            };
        });
    }

    /// Decodes a sequence of expressions, failing if any of them fails.
    Optional<List<Expression>> body(Term node) {
        return support.list(ListMode.STRICT, this::expression, node);
    }

    /// `["map_field_assoc", _, K, V]` is `K => V`, `["map_field_exact", _, K, V]` is `K := V`.
    Optional<Association> association(Term node) {
        return support.attempt(node, () -> {
            final AssociationKind kind;
            if (node.isTagged("map_field_assoc", 4)) {
                kind = AssociationKind.ARROW;
            } else if (node.isTagged("map_field_exact", 4)) {
                kind = AssociationKind.EXACT;
            } else {
                return support.unknown("association", node);
            }
            final Expression key = need(expression(node.element(2)));
            final Expression value = need(expression(node.element(3)));
            return Optional.of(new Association(kind, key, value));
        });
    }

    /// `["record_field", _, Field, Expr]` where Field is `["atom", _, name]` or the `_` wildcard.
    Optional<RecordFieldUpdate> recordFieldUpdate(Term node) {
        return support.attempt(node, () -> {
            if (node.isTagged("record_field", 4)) {
                final Term target = node.element(2);
                if (target.isTagged("var", 3) && target.element(2) instanceof TermString variable
                        && "_".equals(variable.value())) {
                    return Optional.of(new RecordFieldUpdate(null, need(expression(node.element(3)))));
                }
                if (target.isTagged("atom", 3) && target.element(2) instanceof TermString field) {
                    return Optional.of(new RecordFieldUpdate(field.value(), need(expression(node.element(3)))));
                }
            }
            return support.unknown("record_update", node);
        });
    }

    /// `["bin_element", _, Expr, Size, TypeSpecifiers]`; Size may be the `default` marker.
    Optional<BinElement> binElement(Term node) {
        return support.attempt(node, () -> {
            if (!node.isTagged("bin_element", 5)) {
                return support.unknown("bin_element", node);
            }
            final Expression value = need(expression(node.element(2)));
            final Defaultable<Expression> size = need(support.defaultOr(this::expression, node.element(3)));
            // TODO: decode the type specifier list once an analysis consumes segment types
            return Optional.of(new BinElement(value, size.orNull()));
        });
    }

    // ========== Expression shapes ==========

    private Optional<Expression> atom(Term node) {
        final Term value = node.element(2);
        final String name;
        if (value instanceof TermString atom) {
            name = atom.value();
        } else if (value instanceof TermBoolean bool) {
            name = Boolean.toString(bool.value());
        } else if (value instanceof TermNull) {
            name = "null";
        } else {
            return unknown(node);
        }
        return at(node, new Literal(new AtomLiteral(name)));
    }

    private Optional<Expression> bitstringComprehension(Term node) {
        final int line = line(node);
        final Expression expression = need(expression(node.element(2)));
        final List<Qualifier> qualifiers = need(support.list(ListMode.STRICT, clauses::qualifier, node.element(3)));
        return Optional.of(new Expression(line, new BitstringComprehension(expression, qualifiers)));
    }

    private Optional<Expression> bitstringConstructor(Term node) {
        final int line = line(node);
        final List<BinElement> elements = need(support.list(ListMode.STRICT, this::binElement, node.element(2)));
        return Optional.of(new Expression(line, new BitstringConstructor(elements)));
    }

    private Optional<Expression> block(Term node) {
        final int line = line(node);
        return Optional.of(new Expression(line, new Block(need(body(node.element(2))))));
    }

    /// The callee shape decides between `M:F(Args)` and `F(Args)`.
    private Optional<Expression> call(Term node) {
        final int line = line(node);
        final Term callee = node.element(2);
        final Expression module;
        final Expression function;
        if (callee.isTagged("remote", 4)) {
            module = need(expression(callee.element(2)));
            function = need(expression(callee.element(3)));
        } else {
            module = null;
            function = need(expression(callee));
        }
        final List<Expression> args = need(body(node.element(3)));
        return Optional.of(new Expression(line, new Call(module, function, args)));
    }

    private Optional<Expression> caseOf(Term node) {
        final int line = line(node);
        final Expression scrutinee = need(expression(node.element(2)));
        final List<Clause<Expression>> cases = need(caseClauses(node.element(3)));
        return Optional.of(new Expression(line, new Case(scrutinee, cases)));
    }

    private Optional<Expression> catchOf(Term node) {
        final int line = line(node);
        return Optional.of(new Expression(line, new Catch(need(expression(node.element(2))))));
    }

    private Optional<Expression> charLiteral(Term node) {
        final int line = line(node);
        final String text = need(support.intLiteral(node.element(2)));
        return Optional.of(new Expression(line, new Literal(new CharLiteral(text))));
    }

    /// A list literal is a right-nested chain of `cons` nodes, one per element.
    /// The chain is walked in a loop and rebuilt from the tail up, so its length
    /// is not limited by the thread stack.
    private Optional<Expression> cons(Term node) {
        final List<Integer> lines = new ArrayList<>();
        final List<Expression> heads = new ArrayList<>();
        Term link = node;
        while (link.isTagged("cons", 4)) {
            lines.add(line(link));
            heads.add(need(expression(link.element(2))));
            link = link.element(3);
        }
        Expression list = need(expression(link));
        for (int i = heads.size() - 1; i >= 0; i--) {
            list = new Expression(lines.get(i), new Cons(heads.get(i), list));
        }
        return Optional.of(list);
    }

    private Optional<Expression> floatLiteral(Term node) {
        if (!(node.element(2) instanceof TermFloat value)) {
            return unknown(node);
        }
        return at(node, new Literal(new FloatLiteral(value.value())));
    }

    /// `fun` with an anonymous body, `fun F/A` or `fun M:F/A`.
    private Optional<Expression> fun(Term node) {
        final Term definition = node.element(2);
        if (definition.isTagged("clauses", 2)) {
            final int line = line(node);
            final List<Clause<Expression>> cases = need(caseClauses(definition.element(1)));
            return Optional.of(new Expression(line, new Lambda(null, cases)));
        }
        if (definition.isTagged("function", 3)) {
            final int line = line(node);
            final FunctionReference function = need(leaves.functionReference(definition.element(1)));
            final int arity = need(leaves.arity(definition.element(2)));
            return Optional.of(new Expression(line,
                    new Fun(new FunctionSignature(new ModuleReference.Missing(), function, arity))));
        }
        if (definition.isTagged("function", 4)) {
            final int line = line(node);
            final ModuleReference module = need(leaves.moduleReference(definition.element(1)));
            final FunctionReference function = need(leaves.functionReference(definition.element(2)));
            final int arity = need(leaves.arity(definition.element(3)));
            return Optional.of(new Expression(line, new Fun(new FunctionSignature(module, function, arity))));
        }
        return unknown(node);
    }

    private Optional<Expression> ifOf(Term node) {
        final int line = line(node);
        return Optional.of(new Expression(line, new If(need(caseClauses(node.element(2))))));
    }

    private Optional<Expression> integerLiteral(Term node) {
        final int line = line(node);
        final String text = need(support.intLiteral(node.element(2)));
        return Optional.of(new Expression(line, new Literal(new IntLiteral(text))));
    }

    private Optional<Expression> listComprehension(Term node) {
        final int line = line(node);
        final Expression expression = need(expression(node.element(2)));
        final List<Qualifier> qualifiers = need(support.list(ListMode.STRICT, clauses::qualifier, node.element(3)));
        return Optional.of(new Expression(line, new ListComprehension(expression, qualifiers)));
    }

    /// `["map", _, Updates]` builds a map, `["map", _, Base, Updates]` updates one.
    private Optional<Expression> map(Term node, int size) {
        final int line = line(node);
        final Expression base = size == 4 ? need(expression(node.element(2))) : null;
        final List<Association> updates =
                need(support.list(ListMode.STRICT, this::association, node.element(size - 1)));
        return Optional.of(new Expression(line, new MapExpr(base, updates)));
    }

    private Optional<Expression> match(Term node) {
        final int line = line(node);
        final Expression pattern = need(expression(node.element(2)));
        final Expression body = need(expression(node.element(3)));
        return Optional.of(new Expression(line, new Match(pattern, body)));
    }

    private Optional<Expression> namedFun(Term node) {
        if (!(node.element(2) instanceof TermString name)) {
            return unknown(node);
        }
        final int line = line(node);
        final List<Clause<Expression>> cases = need(caseClauses(node.element(3)));
        return Optional.of(new Expression(line, new Lambda(name.value(), cases)));
    }

    /// Unary plus is a no-op and is replaced by its operand, annotation and all.
    private Optional<Expression> unaryOperator(Term node) {
        if (node.element(2) instanceof TermString symbol && "+".equals(symbol.value())) {
            return expression(node.element(3));
        }
        final int line = line(node);
        final UnaryOp op = need(leaves.unaryOperator(node.element(2)));
        final Expression operand = need(expression(node.element(3)));
        return Optional.of(new Expression(line, new UnaryOperator(op, operand)));
    }

    private Optional<Expression> binaryOperator(Term node) {
        final int line = line(node);
        final BinaryOp op = need(leaves.binaryOperator(node.element(2)));
        final Expression left = need(expression(node.element(3)));
        final Expression right = need(expression(node.element(4)));
        return Optional.of(new Expression(line, new BinaryOperator(left, op, right)));
    }

    /// `["receive", _, Cases]` or `["receive", _, Cases, Time, Handler]` with an `after` section.
    private Optional<Expression> receive(Term node, int size) {
        final int line = line(node);
        final List<Clause<Expression>> cases = need(caseClauses(node.element(2)));
        Timeout timeout = null;
        if (size == 5) {
            final Expression time = need(expression(node.element(3)));
            final List<Expression> handler = need(body(node.element(4)));
            timeout = new Timeout(time, handler);
        }
        return Optional.of(new Expression(line, new Receive(cases, timeout)));
    }

    /// `["record", _, Name, Updates]` builds a record, `["record", _, Base, Name, Updates]` updates one.
    private Optional<Expression> record(Term node, int size) {
        final int nameIndex = size - 2;
        if (!(node.element(nameIndex) instanceof TermString name)) {
            return unknown(node);
        }
        final int line = line(node);
        final Expression base = size == 5 ? need(expression(node.element(2))) : null;
        final List<RecordFieldUpdate> updates =
                need(support.list(ListMode.STRICT, this::recordFieldUpdate, node.element(size - 1)));
        return Optional.of(new Expression(line, new RecordUpdate(base, name.value(), updates)));
    }

    /// `["record_field", _, Base, Name, ["atom", _, Field]]`
    private Optional<Expression> recordAccess(Term node) {
        final Term field = node.element(4);
        if (!(node.element(3) instanceof TermString name)
                || !field.isTagged("atom", 3)
                || !(field.element(2) instanceof TermString fieldName)) {
            return unknown(node);
        }
        final int line = line(node);
        final Expression base = need(expression(node.element(2)));
        return Optional.of(new Expression(line, new RecordAccess(base, name.value(), fieldName.value())));
    }

    /// `["record_index", _, Name, ["atom", _, Field]]`
    private Optional<Expression> recordIndex(Term node) {
        final Term field = node.element(3);
        if (!(node.element(2) instanceof TermString name)
                || !field.isTagged("atom", 3)
                || !(field.element(2) instanceof TermString fieldName)) {
            return unknown(node);
        }
        return at(node, new RecordIndex(name.value(), fieldName.value()));
    }

    /// The empty string is dumped as an empty list.
    private Optional<Expression> stringLiteral(Term node) {
        final Term value = node.element(2);
        if (value instanceof TermString text) {
            return at(node, new Literal(new StringLiteral(text.value())));
        }
        if (value instanceof TermList list && list.elements().isEmpty()) {
            return at(node, new Literal(new StringLiteral("")));
        }
        return unknown(node);
    }

    private Optional<Expression> tryCatch(Term node) {
        final int line = line(node);
        final List<Expression> body = need(body(node.element(2)));
        final List<Clause<Expression>> okCases = need(caseClauses(node.element(3)));
        final List<Clause<CatchPattern>> catchCases =
                need(support.list(ListMode.STRICT, clauses::catchClause, node.element(4)));
        final List<Expression> after = need(body(node.element(5)));
        return Optional.of(new Expression(line, new TryCatch(body, okCases, catchCases, after)));
    }

    private Optional<Expression> tuple(Term node) {
        final int line = line(node);
        return Optional.of(new Expression(line, new Tuple(need(body(node.element(2))))));
    }

    private Optional<Expression> variable(Term node) {
        if (!(node.element(2) instanceof TermString name)) {
            return unknown(node);
        }
        return at(node, new Variable(name.value()));
    }

    // ========== Helpers ==========

    private Optional<List<Clause<Expression>>> caseClauses(Term node) {
        return support.list(ListMode.STRICT, clauses::caseClause, node);
    }

    private int line(Term node) {
        return need(support.line(node.element(1)));
    }

    private Optional<Expression> at(Term node, ExpressionKind kind) {
        return Optional.of(new Expression(line(node), kind));
    }

    private Optional<Expression> unknown(Term node) {
        return support.unknown("expression", node);
    }
}
