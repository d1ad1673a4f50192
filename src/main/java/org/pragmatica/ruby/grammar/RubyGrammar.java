package org.pragmatica.ruby.grammar;

import org.pragmatica.ruby.parser.Cursor;
import org.pragmatica.ruby.parser.Expectation;
import org.pragmatica.ruby.parser.ParseResult;
import org.pragmatica.ruby.parser.Parser;
import org.pragmatica.ruby.parser.Parsers;
import org.pragmatica.ruby.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

import static org.pragmatica.ruby.grammar.Filters.closedBy;
import static org.pragmatica.ruby.grammar.Filters.immediately;
import static org.pragmatica.ruby.grammar.Filters.noNewlinesBefore;
import static org.pragmatica.ruby.grammar.Filters.spaceInsensitive;

/**
 * The Ruby surface grammar, composed from combinators.
 *
 * <p>Every expression production takes a {@link GrammarMode}. The mode decides whether a newline
 * ends the expression and which operators, comma included, are available. Each mode has its own
 * memoized {@code expression}, {@code leaf} and {@code member} rules.
 *
 * <p>The tree the grammar returns carries raw offsets; positions are resolved by the caller.
 */
public final class RubyGrammar {

    private static final Set<String> MEMBER_OPERATORS = Set.of(".", "&.", "::");
    private static final List<String> KEYWORD_LEAVES = List.of(
        "nil", "true", "false", "self", "__FILE__", "__LINE__",
        "break", "next", "redo", "retry", "return", "yield", "super");
    private static final Set<String> NOT_CALLABLE = Set.of(
        "nil", "true", "false", "self", "__FILE__", "__LINE__", "break", "next", "redo", "retry", "return");

    private static final Pattern SEPARATOR = Pattern.compile("[ \\t\\f]*(?:;|\\r?\\n|(?=#))");
    // a prefix operator starts an argument only when it hugs its operand: "puts -1", not "x - 1"
    private static final Pattern COMMAND_START = Pattern.compile(
        "[ \\t]+(?=[\\p{L}\\p{N}_@$\\[(]|:[\\p{L}_@$]"
        + "|-(?![\\s=>])|!(?![\\s=~])|\\*(?![\\s*=])|&(?![\\s&=.])|~(?!\\s))");
    private static final Pattern CONTINUATION = Pattern.compile(
        "(?:and|or|not|if|unless|while|until|rescue|do|then|end|else|elsif|ensure|when|in)(?![\\p{L}\\p{N}_?!])");
    private static final Pattern CALLABLE = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*[?!]?");
    private static final Pattern COLON = Pattern.compile(":(?!:)");
    private static final Pattern ASSIGN = Pattern.compile("=(?![=~>])");

    private final OperatorTable table;
    private final PrecedenceFixup fixup;
    private final Map<GrammarMode, Parser<SyntaxNode>> expressions;
    private final Map<GrammarMode, Parser<SyntaxNode>> leaves;
    private final Map<GrammarMode, Parser<SyntaxNode>> members;
    private final Parser<SyntaxNode> compound;
    private final Parser<Optional<SyntaxNode>> body;
    private final Parser<SyntaxNode> parameters;
    private final Parser<SyntaxNode> program;

    private RubyGrammar(OperatorTable table) {
        this.table = table;
        this.fixup = new PrecedenceFixup(table);

        var expressionRules = new HashMap<GrammarMode, Parser<SyntaxNode>>();
        var leafRules = new HashMap<GrammarMode, Parser<SyntaxNode>>();
        var memberRules = new HashMap<GrammarMode, Parser<SyntaxNode>>();
        for (var mode : GrammarMode.ALL) {
            expressionRules.put(mode, Parsers.rule("expression/" + mode.label(), () -> expressionDefinition(mode)));
            leafRules.put(mode, Parsers.rule("leaf/" + mode.label(), () -> leafDefinition(mode)));
            memberRules.put(mode, Parsers.rule("member/" + mode.label(), () -> memberDefinition(mode)));
        }
        this.expressions = Map.copyOf(expressionRules);
        this.leaves = Map.copyOf(leafRules);
        this.members = Map.copyOf(memberRules);
        this.compound = Parsers.rule("compound", this::compoundDefinition);
        this.body = Parsers.rule("body", this::bodyDefinition);
        this.parameters = Parsers.rule("parameters", this::parametersDefinition);
        this.program = Parsers.rule("program", this::programDefinition);
    }

    public static RubyGrammar create() {
        return create(OperatorTable.ruby());
    }

    public static RubyGrammar create(OperatorTable table) {
        return new RubyGrammar(table);
    }

    /**
     * Whole input: a statement sequence up to the end of input. Comments after the last
     * statement become trailing comments of the returned node.
     */
    public Parser<SyntaxNode> program() {
        return program;
    }

    public Parser<SyntaxNode> expression(GrammarMode mode) {
        return expressions.get(mode);
    }

    public Parser<SyntaxNode> leaf(GrammarMode mode) {
        return leaves.get(mode);
    }

    private Parser<SyntaxNode> member(GrammarMode mode) {
        return members.get(mode);
    }

    // === Statements ===

    private Parser<SyntaxNode> programDefinition() {
        return body.flatMap(statements -> closedBy(Parsers.end())
            .map(closing -> closing.attachTo(statements.orElseGet(() -> SyntaxNode.empty(0)))));
    }

    private Parser<Optional<SyntaxNode>> bodyDefinition() {
        var statement = expression(GrammarMode.STATEMENT);
        var separators = separator().zeroOrMore();
        var following = separator().oneOrMore()
                                   .then(statement)
                                   .zeroOrMore();
        return separators.then(statement.flatMap(first -> following.map(rest -> sequence(first, rest)))
                                        .optional())
                         .skip(separators);
    }

    private static Parser<String> separator() {
        return Parsers.regex(SEPARATOR, "';' or newline")
                      .map(MatchResult::group);
    }

    private static SyntaxNode sequence(SyntaxNode first, List<SyntaxNode> rest) {
        if (rest.isEmpty()) {
            return first;
        }
        var statements = new ArrayList<SyntaxNode>(rest.size() + 1);
        statements.add(first);
        statements.addAll(rest);
        return SyntaxNode.composite(SyntaxNode.SEQUENCE, first.offset(), statements);
    }

    // === Expressions ===

    /**
     * {@code operand (operator operand)*}, read in a loop and reduced on the operator stack of a
     * {@link PrecedenceFixup.Chain}, so a long list or operator chain costs no stack depth.
     */
    private Parser<SyntaxNode> expressionDefinition(GrammarMode mode) {
        var first = operand(mode);
        var link = link(mode);
        return cursor -> first.parse(cursor).<SyntaxNode>flatMap(start -> {
            var chain = fixup.chain(mode);
            start.value().feed(chain);
            var rest = start.rest();
            var furthest = Expectation.NONE;
            while (true) {
                var next = link.parse(rest);
                furthest = furthest.merge(next.furthest());
                if (!(next instanceof ParseResult.Success<Link> linked)) {
                    break;
                }
                linked.value().feed(chain);
                rest = linked.rest();
            }
            return new ParseResult.Success<>(chain.finish(), rest, furthest);
        });
    }

    /**
     * Prefix operators followed by a leaf. A prefix operator whose operand does not parse is read
     * as a leaf itself, so a lone {@code return} is the bare keyword.
     */
    private Parser<Operand> operand(GrammarMode mode) {
        var prefix = spaceInsensitive(Terminals.oneOf(table.unaryOperators(mode), "prefix operator"));
        Parser<Boolean> sameLine = mode.newlineSignificant()
                                   ? noNewlinesBefore(Parsers.success(Boolean.TRUE))
                                   : Parsers.success(Boolean.TRUE);
        var leaf = leaf(mode);
        return cursor -> {
            var prefixes = new ArrayList<SyntaxNode>();
            var starts = new ArrayList<Cursor>();
            var furthest = Expectation.NONE;
            var current = cursor;
            while (true) {
                var operator = prefix.parse(current);
                furthest = furthest.merge(operator.furthest());
                if (!(operator instanceof ParseResult.Success<SyntaxNode> found)) {
                    break;
                }
                var guard = sameLine.parse(found.rest());
                furthest = furthest.merge(guard.furthest());
                if (!(guard instanceof ParseResult.Success<Boolean> onLine)) {
                    break;
                }
                prefixes.add(found.value());
                starts.add(current);
                current = onLine.rest();
            }
            while (true) {
                var value = leaf.parse(current);
                furthest = furthest.merge(value.furthest());
                if (value instanceof ParseResult.Success<SyntaxNode> found) {
                    return new ParseResult.Success<>(new Operand(List.copyOf(prefixes), found.value()),
                                                     found.rest(),
                                                     furthest);
                }
                if (prefixes.isEmpty()) {
                    return new ParseResult.Failure<>(furthest);
                }
                prefixes.remove(prefixes.size() - 1);
                current = starts.remove(starts.size() - 1);
            }
        };
    }

    /**
     * One infix step: {@code op operand}, or {@code ? a : operand} for the ternary.
     */
    private Parser<Link> link(GrammarMode mode) {
        var operator = binaryOperator(mode);
        var question = before(mode, Terminals.punctuation(OperatorTable.TERNARY));
        var colon = spaceInsensitive(Filters.recordsPosition(Parsers.regex(COLON, "':'")
                                                                    .map(MatchResult::group)));
        var operand = operand(mode);
        var member = member(mode).map(Operand::of);
        var ternary = question.flatMap(op -> expression(mode).flatMap(whenTrue -> colon.then(operand)
            .map(whenFalse -> new Link(op, Optional.of(whenTrue), whenFalse))));
        var infix = operator.flatMap(op -> rightOperand(op, operand, member)
            .map(right -> new Link(op, Optional.empty(), right)));
        return Parsers.choice(ternary, infix);
    }

    private static Parser<Operand> rightOperand(SyntaxNode op, Parser<Operand> operand, Parser<Operand> member) {
        if (MEMBER_OPERATORS.contains(op.data())) {
            return member;
        }
        if (op.is(OperatorTable.LABEL)) {
            // shorthand keyword argument: f(key:)
            return operand.or(Parsers.success(Operand.of(SyntaxNode.empty(op.offset()))));
        }
        return operand;
    }

    private Parser<SyntaxNode> binaryOperator(GrammarMode mode) {
        var symbols = new ArrayList<>(table.binaryOperators(mode));
        if (mode.comma() != GrammarMode.Comma.NONE) {
            symbols.add(OperatorTable.COMMA);
        }
        var spaced = before(mode, Terminals.oneOf(symbols, "operator"));
        if (!mode.argumentLevel()) {
            return spaced;
        }
        var label = immediately(Filters.recordsPosition(Parsers.regex(COLON, "':'")
                                                               .map(MatchResult::group)));
        return Parsers.choice(label, spaced);
    }

    /**
     * Whitespace in front of an operator: same line only where newlines end the expression.
     */
    private static Parser<SyntaxNode> before(GrammarMode mode, Parser<SyntaxNode> parser) {
        return mode.newlineSignificant()
               ? noNewlinesBefore(parser)
               : spaceInsensitive(parser);
    }

    // === Leaves ===

    private Parser<SyntaxNode> leafDefinition(GrammarMode mode) {
        var atom = Parsers.<SyntaxNode>choice(
            compound,
            Terminals.oneOf(KEYWORD_LEAVES, "keyword"),
            group(),
            container(SyntaxNode.ARRAY, "]"),
            container(SyntaxNode.HASH, "}"),
            Terminals.instanceVariable(),
            Terminals.global(),
            Terminals.symbol(),
            Terminals.number(),
            Terminals.regexp(),
            command(Terminals.identifier(), mode),
            Terminals.identifier());
        return postfix(spaceInsensitive(atom.named("expression")), mode);
    }

    /**
     * Right side of {@code .}, {@code &.} and {@code ::}: any method name, reserved words included.
     */
    private Parser<SyntaxNode> memberDefinition(GrammarMode mode) {
        var name = Parsers.<SyntaxNode>choice(command(Terminals.methodName(), mode), Terminals.methodName());
        return postfix(spaceInsensitive(name), mode);
    }

    private Parser<SyntaxNode> group() {
        return Terminals.punctuation(SyntaxNode.GROUP)
                        .flatMap(open -> expression(GrammarMode.GROUP).optional()
                                                                      .flatMap(inner -> closedBy(Terminals.punctuation(")"))
                                                                          .map(closing -> closing.attachTo(open.withChildren(
                                                                              List.of(inner.orElseGet(() -> SyntaxNode.empty(open.offset()))))))));
    }

    /**
     * Array or hash literal; the elements are always wrapped in a comma list.
     */
    private Parser<SyntaxNode> container(String opening, String closing) {
        return Terminals.punctuation(opening)
                        .flatMap(open -> arguments(open.offset())
                            .flatMap(elements -> closedBy(Terminals.punctuation(closing))
                                .map(close -> close.attachTo(open.withChildren(List.of(elements))))));
    }

    private Parser<SyntaxNode> arguments(int emptyOffset) {
        return expression(GrammarMode.ARGUMENT).optional()
                                               .map(value -> value.map(RubyGrammar::list)
                                                                  .orElseGet(() -> SyntaxNode.empty(emptyOffset)));
    }

    private static SyntaxNode list(SyntaxNode node) {
        if (node.is(OperatorTable.COMMA) && node.size() >= 2) {
            return node;
        }
        return SyntaxNode.composite(OperatorTable.COMMA, node.offset(), node);
    }

    /**
     * Call without parentheses: {@code puts a, b}. The name must be followed by horizontal space
     * and something that starts an argument, and that something must not be a keyword that
     * continues the statement.
     */
    private Parser<SyntaxNode> command(Parser<SyntaxNode> name, GrammarMode mode) {
        var start = Parsers.regex(COMMAND_START, "argument")
                           .then(Parsers.not(Parsers.regex(CONTINUATION, "keyword"), "argument"));
        return name.flatMap(callee -> start.then(expression(GrammarMode.COMMAND))
                                           .map(args -> SyntaxNode.composite(SyntaxNode.INVOCATION,
                                                                             callee.offset(),
                                                                             callee,
                                                                             list(args))));
    }

    // === Postfix forms ===

    /**
     * Apply calls, indexing and blocks for as long as one follows.
     */
    private Parser<SyntaxNode> postfix(Parser<SyntaxNode> atom, GrammarMode mode) {
        return cursor -> {
            var result = atom.parse(cursor);
            while (result instanceof ParseResult.Success<SyntaxNode> success) {
                var next = postfixStep(success.value(), mode).parse(success.rest());
                if (!(next instanceof ParseResult.Success<SyntaxNode> advanced)) {
                    return success.withFurthest(next.furthest());
                }
                result = advanced.withFurthest(success.furthest());
            }
            return result;
        };
    }

    private Parser<SyntaxNode> postfixStep(SyntaxNode receiver, GrammarMode mode) {
        var steps = new ArrayList<Parser<SyntaxNode>>();
        if (isCallable(receiver)) {
            steps.add(call(receiver));
        }
        steps.add(index(receiver));
        if (isCallable(receiver) || receiver.is(SyntaxNode.INVOCATION) && receiver.size() == 2) {
            steps.add(attachedBlock(receiver, mode));
        }
        return Parsers.choice(steps);
    }

    private static boolean isCallable(SyntaxNode node) {
        return node.isLeaf()
               && CALLABLE.matcher(node.data()).matches()
               && !NOT_CALLABLE.contains(node.data());
    }

    private Parser<SyntaxNode> call(SyntaxNode receiver) {
        return immediately(Terminals.punctuation("("))
            .flatMap(open -> arguments(open.offset())
                .flatMap(args -> closedBy(Terminals.punctuation(")"))
                    .map(closing -> closing.attachTo(
                        SyntaxNode.composite(SyntaxNode.INVOCATION, open.offset(), receiver, args)))));
    }

    private Parser<SyntaxNode> index(SyntaxNode receiver) {
        return immediately(Terminals.punctuation("["))
            .flatMap(open -> arguments(open.offset())
                .flatMap(args -> closedBy(Terminals.punctuation("]"))
                    .map(closing -> closing.attachTo(
                        SyntaxNode.composite(SyntaxNode.INDEX, open.offset(), receiver, args)))));
    }

    /**
     * {@code { |params| body }} or {@code do |params| body end} after a call. Command arguments
     * leave {@code do} to the command itself.
     */
    private Parser<SyntaxNode> attachedBlock(SyntaxNode receiver, GrammarMode mode) {
        var brace = block(Terminals.punctuation(SyntaxNode.HASH), Terminals.punctuation("}"));
        Parser<SyntaxNode> blockParser = mode.equals(GrammarMode.COMMAND)
                                         ? brace
                                         : Parsers.choice(brace, block(Terminals.keyword("do"), Terminals.keyword("end")));
        return noNewlinesBefore(blockParser).map(block -> withBlock(receiver, block));
    }

    private Parser<SyntaxNode> block(Parser<SyntaxNode> opening, Parser<SyntaxNode> closing) {
        return opening.flatMap(open -> blockParameters(open.offset())
            .flatMap(params -> body.flatMap(statements -> closedBy(closing)
                .map(close -> close.attachTo(SyntaxNode.composite(SyntaxNode.BLOCK,
                                                                  open.offset(),
                                                                  params,
                                                                  orEmpty(statements, open)))))));
    }

    private Parser<SyntaxNode> blockParameters(int emptyOffset) {
        var bar = spaceInsensitive(Terminals.punctuation("|"));
        var none = spaceInsensitive(Terminals.punctuation("||")).map(ignored -> SyntaxNode.empty(emptyOffset));
        var some = bar.then(parameters)
                      .skip(bar);
        return Parsers.<SyntaxNode>choice(none, some, Parsers.success(SyntaxNode.empty(emptyOffset)));
    }

    private static SyntaxNode withBlock(SyntaxNode receiver, SyntaxNode block) {
        if (receiver.is(SyntaxNode.INVOCATION) && receiver.size() == 2) {
            return receiver.withChildren(List.of(receiver.child(0), receiver.child(1), block));
        }
        return SyntaxNode.composite(SyntaxNode.INVOCATION,
                                    receiver.offset(),
                                    receiver,
                                    SyntaxNode.empty(receiver.offset()),
                                    block);
    }

    // === Parameters ===

    private Parser<SyntaxNode> parametersDefinition() {
        var parameter = spaceInsensitive(parameter());
        var comma = spaceInsensitive(Terminals.punctuation(OperatorTable.COMMA));
        var next = comma.flatMap(separator -> parameter.map(value -> new Step(separator, value)));
        return parameter.flatMap(first -> next.zeroOrMore()
                                              .map(rest -> parameterList(first, rest)));
    }

    private Parser<SyntaxNode> parameter() {
        var name = Terminals.identifier();
        var doubleSplat = Terminals.punctuation("**")
                                   .flatMap(op -> immediately(name).map(value -> op.withChildren(List.of(value))));
        var splat = Terminals.punctuation("*")
                             .flatMap(op -> immediately(name).optional()
                                                             .map(value -> op.withChildren(List.of(
                                                                 value.orElseGet(() -> SyntaxNode.empty(op.offset()))))));
        var blockParameter = Terminals.punctuation("&")
                                      .flatMap(op -> immediately(name).map(value -> op.withChildren(List.of(value))));
        var keyword = name.flatMap(key -> immediately(Filters.recordsPosition(Parsers.regex(COLON, "':'")
                                                                                     .map(MatchResult::group)))
            .flatMap(colon -> expression(GrammarMode.PARAMETER).optional()
                                                               .map(value -> colon.withChildren(List.of(
                                                                   key,
                                                                   value.orElseGet(() -> SyntaxNode.empty(colon.offset())))))));
        var assign = spaceInsensitive(Filters.recordsPosition(Parsers.regex(ASSIGN, "'='")
                                                                     .map(MatchResult::group)));
        var defaulted = name.flatMap(key -> assign.flatMap(op -> expression(GrammarMode.PARAMETER)
            .map(value -> op.withChildren(List.of(key, value)))));
        return Parsers.<SyntaxNode>choice(doubleSplat, splat, blockParameter, keyword, defaulted, name)
                      .named("parameter");
    }

    private static SyntaxNode parameterList(SyntaxNode first, List<Step> rest) {
        if (rest.isEmpty()) {
            return list(first);
        }
        var values = new ArrayList<SyntaxNode>(rest.size() + 1);
        values.add(first);
        rest.forEach(step -> values.add(step.operand()));
        var comma = rest.get(0).operator();
        return comma.withChildren(values);
    }

    // === Keyword forms ===

    private Parser<SyntaxNode> compoundDefinition() {
        return Parsers.choice(definition(),
                              classDefinition(),
                              moduleDefinition(),
                              aliasDefinition(),
                              conditional("if"),
                              conditional("unless"),
                              beginBlock());
    }

    /**
     * {@code def name params; body; end} and {@code def recv.name params; body; end}.
     */
    private Parser<SyntaxNode> definition() {
        var singleton = Parsers.<SyntaxNode>choice(Terminals.keyword("self"), Terminals.identifier())
                               .flatMap(receiver -> immediately(Terminals.punctuation("."))
                                   .flatMap(dot -> Terminals.definitionName()
                                                            .map(name -> dot.withChildren(List.of(receiver, name)))));
        var name = spaceInsensitive(Parsers.<SyntaxNode>choice(singleton, Terminals.definitionName()));
        return Terminals.keyword("def")
                        .flatMap(keyword -> name.flatMap(defined -> definitionParameters(keyword)
                            .flatMap(params -> body.flatMap(statements -> closedBy(Terminals.keyword("end"))
                                .map(closing -> closing.attachTo(keyword.withChildren(List.of(
                                    defined, params, orEmpty(statements, keyword)))))))));
    }

    private Parser<SyntaxNode> definitionParameters(SyntaxNode keyword) {
        var parenthesized = noNewlinesBefore(Terminals.punctuation("("))
            .flatMap(open -> parameters.optional()
                                       .flatMap(list -> closedBy(Terminals.punctuation(")"))
                                           .map(closing -> closing.attachTo(orEmpty(list, keyword)))));
        return Parsers.<SyntaxNode>choice(parenthesized,
                                          noNewlinesBefore(parameters),
                                          Parsers.success(SyntaxNode.empty(keyword.offset())));
    }

    /**
     * {@code class Name [< Parent]; body; end} and {@code class << target; body; end}.
     */
    private Parser<SyntaxNode> classDefinition() {
        var singleton = spaceInsensitive(Terminals.punctuation("<<"))
            .flatMap(op -> expression(GrammarMode.STATEMENT).map(target -> op.withChildren(List.of(target))));
        var parent = noNewlinesBefore(Terminals.punctuation("<")).then(expression(GrammarMode.STATEMENT));
        return Terminals.keyword("class")
                        .flatMap(keyword -> Parsers.choice(
                            singleton.flatMap(target -> body.flatMap(statements -> closedBy(Terminals.keyword("end"))
                                .map(closing -> closing.attachTo(keyword.withChildren(List.of(
                                    target, orEmpty(statements, keyword))))))),
                            scopedName().flatMap(name -> parent.optional()
                                .flatMap(superclass -> body.flatMap(statements -> closedBy(Terminals.keyword("end"))
                                    .map(closing -> closing.attachTo(keyword.withChildren(List.of(
                                        name,
                                        orEmpty(superclass, keyword),
                                        orEmpty(statements, keyword))))))))));
    }

    private Parser<SyntaxNode> moduleDefinition() {
        return Terminals.keyword("module")
                        .flatMap(keyword -> scopedName()
                            .flatMap(name -> body.flatMap(statements -> closedBy(Terminals.keyword("end"))
                                .map(closing -> closing.attachTo(keyword.withChildren(List.of(
                                    name, orEmpty(statements, keyword))))))));
    }

    /**
     * {@code A::B::C} as {@code (:: (:: A B) C)}.
     */
    private Parser<SyntaxNode> scopedName() {
        var segment = immediately(Terminals.punctuation("::"))
            .flatMap(op -> Terminals.identifier().map(name -> new Step(op, name)));
        return spaceInsensitive(Terminals.identifier())
            .flatMap(first -> segment.zeroOrMore()
                                     .map(rest -> {
                                         var name = first;
                                         for (var step : rest) {
                                             name = step.operator().withChildren(List.of(name, step.operand()));
                                         }
                                         return name;
                                     }));
    }

    private Parser<SyntaxNode> aliasDefinition() {
        var name = spaceInsensitive(Parsers.<SyntaxNode>choice(Terminals.global(),
                                                               Terminals.symbol(),
                                                               Terminals.definitionName()));
        return Terminals.keyword("alias")
                        .flatMap(keyword -> name.flatMap(first -> name.map(second -> keyword.withChildren(List.of(
                            first, second)))));
    }

    /**
     * Block form of {@code if} and {@code unless}: {@code (if cond body else)}, where {@code else}
     * is an {@code elsif} node, the else body or an empty placeholder.
     */
    private Parser<SyntaxNode> conditional(String word) {
        return Terminals.keyword(word)
                        .flatMap(keyword -> expression(GrammarMode.STATEMENT)
                            .flatMap(condition -> thenSeparator().then(body)
                                .flatMap(statements -> alternative(keyword)
                                    .flatMap(otherwise -> closedBy(Terminals.keyword("end"))
                                        .map(closing -> closing.attachTo(keyword.withChildren(List.of(
                                            condition, orEmpty(statements, keyword), otherwise))))))));
    }

    private Parser<SyntaxNode> alternative(SyntaxNode owner) {
        var elsif = spaceInsensitive(Terminals.keyword("elsif"))
            .flatMap(keyword -> expression(GrammarMode.STATEMENT)
                .flatMap(condition -> thenSeparator().then(body)
                    .flatMap(statements -> alternative(keyword)
                        .map(otherwise -> keyword.withChildren(List.of(
                            condition, orEmpty(statements, keyword), otherwise))))));
        var otherwise = spaceInsensitive(Terminals.keyword("else"))
            .flatMap(keyword -> body.map(statements -> orEmpty(statements, keyword)
                .withLeadingComments(keyword.comments())));
        return Parsers.choice(elsif, otherwise, Parsers.success(SyntaxNode.empty(owner.offset())));
    }

    private static Parser<Boolean> thenSeparator() {
        var then = noNewlinesBefore(Terminals.keyword("then"));
        return Parsers.choice(then.map(ignored -> Boolean.TRUE),
                              separator().oneOrMore()
                                         .then(then.optional())
                                         .map(ignored -> Boolean.TRUE));
    }

    private Parser<SyntaxNode> beginBlock() {
        return Terminals.keyword("begin")
                        .flatMap(keyword -> body.flatMap(statements -> closedBy(Terminals.keyword("end"))
                            .map(closing -> closing.attachTo(keyword.withChildren(List.of(
                                orEmpty(statements, keyword)))))));
    }

    private static SyntaxNode orEmpty(Optional<SyntaxNode> node, SyntaxNode owner) {
        return node.orElseGet(() -> SyntaxNode.empty(owner.offset()));
    }

    /**
     * A separator or operator token with the operand that follows it.
     */
    private record Step(SyntaxNode operator, SyntaxNode operand) {}

    /**
     * A chain operand with the prefix operators written in front of it.
     */
    private record Operand(List<SyntaxNode> prefixes, SyntaxNode value) {
        static Operand of(SyntaxNode value) {
            return new Operand(List.of(), value);
        }

        void feed(PrecedenceFixup.Chain chain) {
            prefixes.forEach(chain::prefix);
            chain.operand(value);
        }
    }

    /**
     * An infix operator, the middle operand for {@code ?}, and the operand after it.
     */
    private record Link(SyntaxNode operator, Optional<SyntaxNode> whenTrue, Operand operand) {
        void feed(PrecedenceFixup.Chain chain) {
            whenTrue.ifPresentOrElse(middle -> chain.ternary(operator, middle), () -> chain.infix(operator));
            operand.feed(chain);
        }
    }
}
