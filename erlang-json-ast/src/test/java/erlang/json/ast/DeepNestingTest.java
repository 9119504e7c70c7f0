package erlang.json.ast;

import erlang.json.ast.ErlangAst.Cons;
import erlang.json.ast.ErlangAst.Expression;
import erlang.json.ast.ErlangAst.Form;
import erlang.json.ast.ErlangAst.FunctionDecl;
import erlang.json.ast.ErlangAst.IntLiteral;
import erlang.json.ast.ErlangAst.Literal;
import erlang.json.ast.ErlangAst.ModuleDecl;
import erlang.json.ast.ErlangAst.Nil;
import erlang.json.term.Term;
import erlang.json.term.TermInteger;
import erlang.json.term.TermList;
import erlang.json.term.TermString;
import erlang.json.term.Terms;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/// Long list literals and deeply nested expressions. Assertions walk the
/// results in loops; record equality on such trees would recurse as deep.
class DeepNestingTest extends ErlangAstTestBase {

    private static final TermInteger LINE = TermInteger.of(3);

    /// `[0, 1, ..., n - 1]` as the compiler dumps it.
    static Term listLiteral(int n) {
        Term list = Terms.tagged("nil", LINE);
        for (int i = n - 1; i >= 0; i--) {
            list = Terms.tagged("cons", LINE, Terms.tagged("integer", LINE, TermInteger.of(i)), list);
        }
        return list;
    }

    /// `1 + 1 + ... + 1`, left-nested `depth` times.
    static Term additionChain(int depth) {
        Term sum = Terms.tagged("integer", LINE, TermInteger.of(1));
        for (int i = 0; i < depth; i++) {
            sum = Terms.tagged("op", LINE, TermString.of("+"), sum, Terms.tagged("integer", LINE, TermInteger.of(1)));
        }
        return sum;
    }

    static Term function(String name, Term body) {
        return Terms.tagged("function", LINE, TermString.of(name), TermInteger.of(0), TermList.of(
                Terms.tagged("clause", LINE, TermList.of(), TermList.of(), TermList.of(body))));
    }

    static Term moduleAttribute() {
        return Terms.tagged("attribute", TermInteger.of(1), TermString.of("module"), TermString.of("deep"));
    }

    private static Expression bodyOf(Form form) {
        return ((FunctionDecl) form.kind()).clauses().get(0).body().get(0);
    }

    private static void assertCountingList(Expression list, int n) {
        Expression current = list;
        for (int i = 0; i < n; i++) {
            assertThat(current.kind()).isInstanceOf(Cons.class);
            final Cons cons = (Cons) current.kind();
            assertThat(cons.head().kind()).isEqualTo(new Literal(new IntLiteral(Integer.toString(i))));
            assertThat(current.line()).isEqualTo(3);
            current = cons.tail();
        }
        assertThat(current.kind()).isInstanceOf(Nil.class);
    }

    @Test
    void longListLiteralDecodesNextToSiblingForm() {
        final Term forms = TermList.of(moduleAttribute(), function("table", listLiteral(5000)));

        final var module = ErlangAstParser.decodeModule(forms, sink, false).orElseThrow();

        assertThat(module.forms()).hasSize(2);
        assertThat(module.forms().get(0)).isEqualTo(new Form(1, new ModuleDecl("deep")));
        assertCountingList(bodyOf(module.forms().get(1)), 5000);
        assertThat(sink.reports()).isEmpty();
    }

    @Test
    void longListLiteralDecodesFromJsonText() {
        final StringBuilder json = new StringBuilder("[[\"attribute\", 1, \"module\", \"deep\"],"
                + "[\"function\", 3, \"table\", 0, [[\"clause\", 3, [], [], [");
        final int n = 5000;
        for (int i = 0; i < n; i++) {
            json.append("[\"cons\", 3, [\"integer\", 3, ").append(i).append("], ");
        }
        json.append("[\"nil\", 3]").append("]".repeat(n)).append("]]]]]");

        final var module = ErlangAstParser.parseModule(json.toString());

        assertThat(module.forms()).hasSize(2);
        assertCountingList(bodyOf(module.forms().get(1)), n);
    }

    @Test
    void badElementDeepInListFailsOnlyItsForm() {
        Term list = Terms.tagged("cons", LINE, Terms.tagged("mystery", LINE), Terms.tagged("nil", LINE));
        for (int i = 0; i < 3000; i++) {
            list = Terms.tagged("cons", LINE, Terms.tagged("integer", LINE, TermInteger.of(i)), list);
        }
        final Term forms = TermList.of(moduleAttribute(), function("bad", list), function("ok", listLiteral(2)));

        final var module = ErlangAstParser.decodeModule(forms, sink, false).orElseThrow();

        assertThat(module.forms()).extracting(Form::kind)
                .hasSize(2)
                .element(1).isInstanceOf(FunctionDecl.class);
        assertCountingList(bodyOf(module.forms().get(1)), 2);
        assertThat(sink.labels()).containsExactly("expression");
    }

    @Test
    void formTooDeepToDecodeIsDroppedAlone() {
        final Term forms = TermList.of(
                moduleAttribute(),
                function("sum", additionChain(200_000)),
                function("ok", listLiteral(1)));

        final var module = ErlangAstParser.decodeModule(forms, sink, false);

        assertThat(module).isPresent();
        assertThat(module.get().forms()).extracting(Form::line).containsExactly(1, 3);
        assertThat(((FunctionDecl) module.get().forms().get(1).kind()).function())
                .isEqualTo(ErlangAst.FunctionSignature.local("ok", 0));
        assertThat(sink.labels()).containsExactly("form");
    }

    @Test
    void expressionTooDeepToDecodeIsReported() {
        assertThat(ErlangAstParser.decodeExpression(additionChain(200_000), sink)).isEmpty();
        assertThat(sink.labels()).containsExactly("expression");
        assertThat(ErlangAstParser.decodeExpression(additionChain(10), sink)).isPresent();
    }
}
