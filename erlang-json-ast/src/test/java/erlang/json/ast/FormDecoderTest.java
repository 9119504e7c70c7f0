package erlang.json.ast;

import erlang.json.ast.ErlangAst.*;
import erlang.json.ast.FormDecoder.FormOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static erlang.json.ast.ExpressionDecoderTest.atom;
import static erlang.json.ast.ExpressionDecoderTest.integer;
import static erlang.json.ast.ExpressionDecoderTest.var;
import static org.assertj.core.api.Assertions.*;

class FormDecoderTest extends ErlangAstTestBase {

    private Form decode(String json) {
        final var outcome = decoders.forms.form(term(json));
        assertThat(outcome).as("reports %s", sink.reports()).containsInstanceOf(FormOutcome.Decoded.class);
        return ((FormOutcome.Decoded) outcome.orElseThrow()).form();
    }

    @Test
    void fileAttribute() {
        assertThat(decode("[\"attribute\", 1, \"file\", [\"src/counter.erl\", 1]]"))
                .isEqualTo(new Form(1, new File("src/counter.erl")));
    }

    @Test
    void moduleAttribute() {
        assertThat(decode("[\"attribute\", 1, \"module\", \"counter\"]"))
                .isEqualTo(new Form(1, new ModuleDecl("counter")));
    }

    @Test
    void exportAttribute() {
        assertThat(decode("[\"attribute\", 2, \"export\", [[\"start\", 0], [\"incr\", 1]]]"))
                .isEqualTo(new Form(2, new Export(List.of(
                        FunctionSignature.local("start", 0), FunctionSignature.local("incr", 1)))));
    }

    @Test
    void exportAttribute_malformedEntryFailsTheForm() {
        assertThat(decoders.forms.form(term("[\"attribute\", 2, \"export\", [[\"start\", 0], [\"incr\"]]]")))
                .isEmpty();
        assertThat(sink.labels()).containsExactly("function");
    }

    @Test
    void importAttribute() {
        assertThat(decode("[\"attribute\", 3, \"import\", [\"lists\", [[\"map\", 2], [\"foldl\", 3]]]]"))
                .isEqualTo(new Form(3, new Import("lists", List.of(
                        FunctionSignature.local("map", 2), FunctionSignature.local("foldl", 3)))));
    }

    @Test
    void recordAttribute_withPlainTypedAndInitializedFields() {
        final var form = decode("""
                ["attribute", 4, "record", ["state", [
                  ["record_field", 4, ["atom", 4, "name"]],
                  ["record_field", 4, ["atom", 4, "count"], ["integer", 4, 0]],
                  ["typed_record_field", ["record_field", 4, ["atom", 4, "tags"], ["nil", 4]], ["type", 4, "list", []]]]]]
                """);

        assertThat(form.kind()).isEqualTo(new RecordDecl("state", List.of(
                new RecordField("name", null),
                new RecordField("count", integer(4, "0")),
                new RecordField("tags", new Expression(4, new Nil())))));
        assertThat(((RecordDecl) form.kind()).fields().get(0).initializerIfPresent()).isEmpty();
    }

    @Test
    void recordAttribute_failingInitializerFailsTheForm() {
        assertThat(decoders.forms.form(term("""
                ["attribute", 4, "record", ["state", [["record_field", 4, ["atom", 4, "count"], ["oops", 4]]]]]
                """))).isEmpty();
        assertThat(sink.labels()).containsExactly("expression");
    }

    @Test
    void functionDefinition() {
        final var form = decode("""
                ["function", 9, "incr", 1, [
                  ["clause", 9, [["var", 9, "N"]], [], [["op", 9, "+", ["var", 9, "N"], ["integer", 9, 1]]]]]]
                """);

        assertThat(form).isEqualTo(new Form(9, new FunctionDecl(FunctionSignature.local("incr", 1), List.of(
                new Clause<>(9, List.of(var(9, "N")), List.of(), List.of(new Expression(9,
                        new BinaryOperator(var(9, "N"), BinaryOp.ADD, integer(9, "1")))))))));
    }

    @Test
    void functionDefinition_withNonStringNameFails() {
        assertThat(decoders.forms.form(term("[\"function\", 9, 7, 0, []]"))).isEmpty();
        assertThat(sink.labels()).containsExactly("form");
    }

    @Test
    void eofAndUnknownAttributesAreSkippedSilently() {
        assertThat(decoders.forms.form(term("[\"eof\", 12]")))
                .contains(new FormOutcome.Skipped("eof"));
        assertThat(decoders.forms.form(term("[\"attribute\", 5, \"spec\", [[\"f\", 0], []]]")))
                .contains(new FormOutcome.Skipped("attribute spec"));
        assertThat(decoders.forms.form(term("[\"attribute\", 5, \"behaviour\", \"gen_server\"]")))
                .contains(new FormOutcome.Skipped("attribute behaviour"));
        assertThat(sink.reports()).isEmpty();
    }

    @Test
    void knownAttributeWithUnexpectedValueIsSkipped() {
        assertThat(decoders.forms.form(term("[\"attribute\", 1, \"module\", [\"counter\"]]")))
                .contains(new FormOutcome.Skipped("attribute module"));
        assertThat(sink.reports()).isEmpty();
    }

    @Test
    void unknownFormIsReported() {
        assertThat(decoders.forms.form(term("[\"warning\", [\"something\"]]"))).isEmpty();
        assertThat(sink.labels()).containsExactly("form");
    }

    @Test
    void decodedForm_treatsSkippedAsAbsent() {
        assertThat(decoders.forms.decodedForm(term("[\"eof\", 1]"))).isEmpty();
        assertThat(decoders.forms.decodedForm(term("[\"attribute\", 1, \"module\", \"m\"]")))
                .contains(new Form(1, new ModuleDecl("m")));
    }

    @Test
    void module_keepsOrderAndDropsOnlyFailingForms() {
        final var module = decoders.forms.module(term("""
                [["attribute", 1, "module", "m"],
                 ["function", 2, "bad", 0, [["clause", 2, [], [], [["wat", 2]]]]],
                 ["attribute", 3, "export", [["good", 0]]],
                 ["function", 4, "good", 0, [["clause", 4, [], [], [["atom", 4, "ok"]]]]],
                 ["eof", 5]]
                """), false).orElseThrow();

        assertThat(module.forms()).extracting(Form::line).containsExactly(1, 3, 4);
        assertThat(module.forms().get(2).kind()).isEqualTo(new FunctionDecl(FunctionSignature.local("good", 0),
                List.of(new Clause<>(4, List.<Expression>of(), List.of(), List.of(atom(4, "ok"))))));
        assertThat(sink.labels()).containsExactly("expression");
    }

    @Test
    void module_rootMustBeAList() {
        assertThat(decoders.forms.module(term("\"forms\""), false)).isEmpty();
        assertThat(sink.reports()).hasSize(1);
    }
}
