package erlang.json.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// Typed AST for Erlang modules decoded from the compiler's abstract format.
///
/// Every node is an immutable record; lists are defensively copied, so a
/// parent owns its children outright and no node is shared between trees.
/// Fields documented as nullable are the only places `null` appears.
///
/// ## Node Types
/// - [Module]: the ordered top-level [Form]s of one source file
/// - [Expression]: a line plus one of the closed [ExpressionKind] variants
/// - [Clause]: patterns, guards and body of one alternative, generic over the pattern type
///
/// ## Decode Entry Point
/// Use [ErlangAstParser#parseModule] to turn a dumped tree into a [Module].
public sealed interface ErlangAst {

    // ========== Module and forms ==========

    /// The top-level declarations of one module, in source order.
    record Module(List<Form> forms) implements ErlangAst {
        public Module {
            Objects.requireNonNull(forms, "forms must not be null");
            forms = List.copyOf(forms);
        }
    }

    /// A top-level declaration with the 1-based line it starts on.
    record Form(int line, FormKind kind) implements ErlangAst {
        public Form {
            Objects.requireNonNull(kind, "kind must not be null");
        }
    }

    sealed interface FormKind permits File, ModuleDecl, Import, Export, FunctionDecl, RecordDecl {}

    /// `-file(Path, Line).` marker, informational only.
    record File(String path) implements FormKind {
        public File {
            Objects.requireNonNull(path, "path must not be null");
        }
    }

    /// `-module(Name).`
    record ModuleDecl(String name) implements FormKind {
        public ModuleDecl {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// `-import(Module, [F/A, ...]).`
    record Import(String moduleName, List<FunctionSignature> functions) implements FormKind {
        public Import {
            Objects.requireNonNull(moduleName, "moduleName must not be null");
            Objects.requireNonNull(functions, "functions must not be null");
            functions = List.copyOf(functions);
        }
    }

    /// `-export([F/A, ...]).`
    record Export(List<FunctionSignature> functions) implements FormKind {
        public Export {
            Objects.requireNonNull(functions, "functions must not be null");
            functions = List.copyOf(functions);
        }
    }

    /// A function definition: its name and arity plus one clause per head.
    record FunctionDecl(FunctionSignature function, List<Clause<Expression>> clauses) implements FormKind {
        public FunctionDecl {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(clauses, "clauses must not be null");
            clauses = List.copyOf(clauses);
        }
    }

    /// `-record(Name, {Fields}).`
    record RecordDecl(String name, List<RecordField> fields) implements FormKind {
        public RecordDecl {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(fields, "fields must not be null");
            fields = List.copyOf(fields);
        }
    }

    /// A field of a record declaration.
    ///
    /// @param fieldName the field name
    /// @param initializer the default value expression, null if the field has none
    record RecordField(String fieldName, Expression initializer) {
        public RecordField {
            Objects.requireNonNull(fieldName, "fieldName must not be null");
        }

        public Optional<Expression> initializerIfPresent() {
            return Optional.ofNullable(initializer);
        }
    }

    // ========== References ==========

    /// The module part of a function reference.
    sealed interface ModuleReference {
        /// A literal module name.
        record Name(String name) implements ModuleReference {
            public Name {
                Objects.requireNonNull(name, "name must not be null");
            }
        }

        /// A module bound to a variable at run time.
        record Variable(String variable) implements ModuleReference {
            public Variable {
                Objects.requireNonNull(variable, "variable must not be null");
            }
        }

        /// No module given: the reference is to the current module.
        record Missing() implements ModuleReference {}
    }

    /// The function part of a function reference.
    sealed interface FunctionReference {
        record Name(String name) implements FunctionReference {
            public Name {
                Objects.requireNonNull(name, "name must not be null");
            }
        }

        record Variable(String variable) implements FunctionReference {
            public Variable {
                Objects.requireNonNull(variable, "variable must not be null");
            }
        }
    }

    /// `Module:Function/Arity` as used by exports, imports, definitions and `fun` values.
    record FunctionSignature(ModuleReference module, FunctionReference function, int arity) {
        public FunctionSignature {
            Objects.requireNonNull(module, "module must not be null");
            Objects.requireNonNull(function, "function must not be null");
            if (arity < 0) {
                throw new IllegalArgumentException("arity must not be negative: " + arity);
            }
        }

        /// {@return a signature for a function of the current module}
        /// @param name the function name
        /// @param arity the number of arguments
        public static FunctionSignature local(String name, int arity) {
            return new FunctionSignature(new ModuleReference.Missing(), new FunctionReference.Name(name), arity);
        }
    }

    // ========== Expressions ==========

    /// An expression (or pattern, or guard test) with the line it appears on.
    record Expression(int line, ExpressionKind kind) implements ErlangAst {
        public Expression {
            Objects.requireNonNull(kind, "kind must not be null");
        }
    }

    sealed interface ExpressionKind permits
            Literal,
            Variable,
            Cons,
            Nil,
            Tuple,
            MapExpr,
            BinaryOperator,
            UnaryOperator,
            Call,
            Match,
            Block,
            Case,
            If,
            Receive,
            TryCatch,
            Catch,
            Lambda,
            Fun,
            ListComprehension,
            BitstringComprehension,
            BitstringConstructor,
            RecordUpdate,
            RecordAccess,
            RecordIndex {}

    record Literal(Constant constant) implements ExpressionKind {
        public Literal {
            Objects.requireNonNull(constant, "constant must not be null");
        }
    }

    /// Literal constants. Integer and character literals keep their decimal text
    /// because Erlang integers are unbounded.
    sealed interface Constant permits AtomLiteral, IntLiteral, FloatLiteral, CharLiteral, StringLiteral {}

    record AtomLiteral(String name) implements Constant {
        public AtomLiteral {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record IntLiteral(String text) implements Constant {
        public IntLiteral {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    record FloatLiteral(double value) implements Constant {}

    /// A character literal such as `$a`, held as the decimal text of its code point.
    record CharLiteral(String text) implements Constant {
        public CharLiteral {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    record StringLiteral(String value) implements Constant {
        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Variable(String name) implements ExpressionKind {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// `[Head | Tail]`
    record Cons(Expression head, Expression tail) implements ExpressionKind {
        public Cons {
            Objects.requireNonNull(head, "head must not be null");
            Objects.requireNonNull(tail, "tail must not be null");
        }
    }

    /// `[]`
    record Nil() implements ExpressionKind {}

    record Tuple(List<Expression> elements) implements ExpressionKind {
        public Tuple {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }
    }

    /// `#{K => V, K := V}` or `Base#{...}`.
    ///
    /// @param base the map being updated, null for a map construction
    /// @param updates the associations in source order
    record MapExpr(Expression base, List<Association> updates) implements ExpressionKind {
        public MapExpr {
            Objects.requireNonNull(updates, "updates must not be null");
            updates = List.copyOf(updates);
        }

        public Optional<Expression> baseIfPresent() {
            return Optional.ofNullable(base);
        }
    }

    enum AssociationKind {
        /// `K => V`: insert or update
        ARROW,
        /// `K := V`: the key must already exist
        EXACT
    }

    record Association(AssociationKind kind, Expression key, Expression value) {
        public Association {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record BinaryOperator(Expression left, BinaryOp op, Expression right) implements ExpressionKind {
        public BinaryOperator {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record UnaryOperator(UnaryOp op, Expression operand) implements ExpressionKind {
        public UnaryOperator {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /// A function call. A remote call `M:F(Args)` has a module expression;
    /// a local call `F(Args)` has none.
    ///
    /// @param module the module expression, null for a local call
    /// @param function the function expression
    /// @param args the argument expressions
    record Call(Expression module, Expression function, List<Expression> args) implements ExpressionKind {
        public Call {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(args, "args must not be null");
            args = List.copyOf(args);
        }

        public Optional<Expression> moduleIfPresent() {
            return Optional.ofNullable(module);
        }
    }

    /// `Pattern = Body`
    record Match(Expression pattern, Expression body) implements ExpressionKind {
        public Match {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /// `begin ... end`
    record Block(List<Expression> body) implements ExpressionKind {
        public Block {
            Objects.requireNonNull(body, "body must not be null");
            body = List.copyOf(body);
        }
    }

    record Case(Expression scrutinee, List<Clause<Expression>> cases) implements ExpressionKind {
        public Case {
            Objects.requireNonNull(scrutinee, "scrutinee must not be null");
            Objects.requireNonNull(cases, "cases must not be null");
            cases = List.copyOf(cases);
        }
    }

    record If(List<Clause<Expression>> cases) implements ExpressionKind {
        public If {
            Objects.requireNonNull(cases, "cases must not be null");
            cases = List.copyOf(cases);
        }
    }

    /// `receive ... after Time -> Handler end`
    ///
    /// @param cases the message clauses
    /// @param timeout the `after` section, null if absent
    record Receive(List<Clause<Expression>> cases, Timeout timeout) implements ExpressionKind {
        public Receive {
            Objects.requireNonNull(cases, "cases must not be null");
            cases = List.copyOf(cases);
        }

        public Optional<Timeout> timeoutIfPresent() {
            return Optional.ofNullable(timeout);
        }
    }

    record Timeout(Expression time, List<Expression> handler) {
        public Timeout {
            Objects.requireNonNull(time, "time must not be null");
            Objects.requireNonNull(handler, "handler must not be null");
            handler = List.copyOf(handler);
        }
    }

    /// `try Body of OkCases catch CatchCases after After end`; absent sections are empty lists.
    record TryCatch(
            List<Expression> body,
            List<Clause<Expression>> okCases,
            List<Clause<CatchPattern>> catchCases,
            List<Expression> after
    ) implements ExpressionKind {
        public TryCatch {
            Objects.requireNonNull(body, "body must not be null");
            Objects.requireNonNull(okCases, "okCases must not be null");
            Objects.requireNonNull(catchCases, "catchCases must not be null");
            Objects.requireNonNull(after, "after must not be null");
            body = List.copyOf(body);
            okCases = List.copyOf(okCases);
            catchCases = List.copyOf(catchCases);
            after = List.copyOf(after);
        }
    }

    /// `catch Expr`
    record Catch(Expression expression) implements ExpressionKind {
        public Catch {
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    /// `fun (...) -> ... end`, or a named fun that can call itself.
    ///
    /// @param name the self-reference name of a named fun, null otherwise
    /// @param cases the clauses
    record Lambda(String name, List<Clause<Expression>> cases) implements ExpressionKind {
        public Lambda {
            Objects.requireNonNull(cases, "cases must not be null");
            cases = List.copyOf(cases);
        }

        public Optional<String> nameIfPresent() {
            return Optional.ofNullable(name);
        }
    }

    /// `fun F/A` or `fun M:F/A`: a function value, not a call.
    record Fun(FunctionSignature function) implements ExpressionKind {
        public Fun {
            Objects.requireNonNull(function, "function must not be null");
        }
    }

    /// `[Expr || Qualifiers]`
    record ListComprehension(Expression expression, List<Qualifier> qualifiers) implements ExpressionKind {
        public ListComprehension {
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(qualifiers, "qualifiers must not be null");
            qualifiers = List.copyOf(qualifiers);
        }
    }

    /// `<< Expr || Qualifiers >>`
    record BitstringComprehension(Expression expression, List<Qualifier> qualifiers) implements ExpressionKind {
        public BitstringComprehension {
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(qualifiers, "qualifiers must not be null");
            qualifiers = List.copyOf(qualifiers);
        }
    }

    /// `<< Elements >>`
    record BitstringConstructor(List<BinElement> elements) implements ExpressionKind {
        public BitstringConstructor {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }
    }

    /// One segment of a bitstring. Type specifiers are not modeled.
    ///
    /// @param expression the segment value
    /// @param size the explicit size expression, null when the default size applies
    record BinElement(Expression expression, Expression size) {
        public BinElement {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        public Optional<Expression> sizeIfPresent() {
            return Optional.ofNullable(size);
        }
    }

    /// `#name{f = V}` builds a record; `Base#name{f = V}` updates one.
    ///
    /// @param base the record being updated, null when building a new record
    /// @param name the record name
    /// @param updates the field assignments
    record RecordUpdate(Expression base, String name, List<RecordFieldUpdate> updates) implements ExpressionKind {
        public RecordUpdate {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(updates, "updates must not be null");
            updates = List.copyOf(updates);
        }

        public Optional<Expression> baseIfPresent() {
            return Optional.ofNullable(base);
        }
    }

    /// A field assignment inside a record expression.
    ///
    /// @param field the field name, null for the `_ = Expr` wildcard covering all other fields
    /// @param expression the assigned value
    record RecordFieldUpdate(String field, Expression expression) {
        public RecordFieldUpdate {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        public boolean isWildcard() {
            return field == null;
        }
    }

    /// `Base#name.field`
    record RecordAccess(Expression base, String name, String field) implements ExpressionKind {
        public RecordAccess {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(field, "field must not be null");
        }
    }

    /// `#name.field`: the tuple position of a field
    record RecordIndex(String name, String field) implements ExpressionKind {
        public RecordIndex {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(field, "field must not be null");
        }
    }

    // ========== Clauses ==========

    /// One alternative of a function, case, if, receive, fun or try.
    ///
    /// Guards are a disjunction of conjunctions: the clause applies if every
    /// test of at least one inner list holds. An empty outer list means no guard.
    ///
    /// @param <P> the pattern type, [Expression] or [CatchPattern]
    record Clause<P>(int line, List<P> patterns, List<List<Expression>> guards, List<Expression> body) {
        public Clause {
            Objects.requireNonNull(patterns, "patterns must not be null");
            Objects.requireNonNull(guards, "guards must not be null");
            Objects.requireNonNull(body, "body must not be null");
            patterns = List.copyOf(patterns);
            guards = guards.stream().map(List::copyOf).toList();
            body = List.copyOf(body);
        }
    }

    /// `Class:Pattern:Stacktrace` of a catch clause.
    record CatchPattern(ExceptionClass exceptionClass, Expression pattern, String variable) {
        public CatchPattern {
            Objects.requireNonNull(exceptionClass, "exceptionClass must not be null");
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(variable, "variable must not be null");
        }
    }

    /// The class part of a catch pattern: a literal such as `throw` or a variable.
    sealed interface ExceptionClass {
        record Atom(String name) implements ExceptionClass {
            public Atom {
                Objects.requireNonNull(name, "name must not be null");
            }
        }

        record Pattern(String variable) implements ExceptionClass {
            public Pattern {
                Objects.requireNonNull(variable, "variable must not be null");
            }
        }
    }

    /// Comprehension qualifiers, kept in source order.
    sealed interface Qualifier {
        /// `Pattern <- ListExpr`
        record Generator(Expression pattern, Expression expression) implements Qualifier {
            public Generator {
                Objects.requireNonNull(pattern, "pattern must not be null");
                Objects.requireNonNull(expression, "expression must not be null");
            }
        }

        /// `Pattern <= BitstringExpr`
        record BitsGenerator(Expression pattern, Expression expression) implements Qualifier {
            public BitsGenerator {
                Objects.requireNonNull(pattern, "pattern must not be null");
                Objects.requireNonNull(expression, "expression must not be null");
            }
        }

        /// A boolean condition.
        record Filter(Expression expression) implements Qualifier {
            public Filter {
                Objects.requireNonNull(expression, "expression must not be null");
            }
        }
    }

    // ========== Operators ==========

    /// Binary operators, keyed by their source symbol.
    enum BinaryOp {
        SEND("!"),
        MUL("*"),
        ADD("+"),
        LIST_ADD("++"),
        SUB("-"),
        LIST_SUB("--"),
        FDIV("/"),
        NOT_EQUAL("/="),
        LESS("<"),
        EXACTLY_NOT_EQUAL("=/="),
        EXACTLY_EQUAL("=:="),
        AT_MOST("=<"),
        EQUAL("=="),
        GREATER(">"),
        AT_LEAST(">="),
        AND("and"),
        AND_ALSO("andalso"),
        BAND("band"),
        BOR("bor"),
        BSL("bsl"),
        BSR("bsr"),
        BXOR("bxor"),
        IDIV("div"),
        OR("or"),
        OR_ELSE("orelse"),
        REM("rem"),
        XOR("xor");

        private static final Map<String, BinaryOp> BY_SYMBOL = Arrays.stream(values())
                .collect(Collectors.toUnmodifiableMap(BinaryOp::symbol, op -> op));

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /// {@return the operator written as `symbol`, or empty if there is none}
        public static Optional<BinaryOp> fromSymbol(String symbol) {
            return symbol == null ? Optional.empty() : Optional.ofNullable(BY_SYMBOL.get(symbol));
        }
    }

    /// Prefix operators. Unary `+` has no constant: the decoder drops it.
    enum UnaryOp {
        MINUS("-"),
        BNOT("bnot"),
        NOT("not");

        private static final Map<String, UnaryOp> BY_SYMBOL = Arrays.stream(values())
                .collect(Collectors.toUnmodifiableMap(UnaryOp::symbol, op -> op));

        private final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /// {@return the operator written as `symbol`, or empty if there is none}
        public static Optional<UnaryOp> fromSymbol(String symbol) {
            return symbol == null ? Optional.empty() : Optional.ofNullable(BY_SYMBOL.get(symbol));
        }
    }
}
