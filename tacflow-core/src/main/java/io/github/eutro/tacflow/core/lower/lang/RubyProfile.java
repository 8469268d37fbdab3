package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.lower.*;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The profile of Ruby.
 * <p>
 * Method calls, attribute reads and attribute writes all share the {@code call} node kind.
 * Blocks passed to a call become a trailing closure argument.
 */
public class RubyProfile extends LanguageProfile {
    private static final List<String> STRING_FRAGMENTS = Arrays.asList("string_content", "escape_sequence",
            "heredoc_content");
    private static final List<String> STRING_SUBSTITUTIONS = Arrays.asList("interpolation");

    public RubyProfile() {
        super("ruby");
        literals.setNone("nil");
        literals.setTrueValue("true");
        literals.setFalseValue("false");
        literals.setDefaultReturn("nil");
        fields.setAttrObject("receiver");
        fields.setAttrAttribute("method");
        fields.setSubscriptValue("object");
        blockTypes.addAll(Arrays.asList("program", "then", "do", "else", "ensure", "block_body"));
        identifierTypes.addAll(Arrays.asList("instance_variable", "constant", "global_variable", "class_variable",
                "self"));
        attributeTypes.add("call");
        subscriptTypes.add("element_reference");

        expr(Expressions::identifier, "identifier", "instance_variable", "constant", "global_variable",
                "class_variable", "self");
        expr(Expressions::constLiteral, "integer", "float", "rational", "complex", "character",
                "simple_symbol", "hash_key_symbol", "delimited_symbol", "regex", "bare_string", "bare_symbol");
        expr(Expressions::canonicalTrue, "true");
        expr(Expressions::canonicalFalse, "false");
        expr(Expressions::canonicalNone, "nil");
        expr((ctx, n) -> Expressions.interpolated(ctx, n, STRING_FRAGMENTS, STRING_SUBSTITUTIONS),
                "string", "heredoc_body");
        expr(Expressions::binop, "binary");
        expr(Expressions::unop, "unary");
        expr(RubyProfile::call, "call");
        expr(Expressions::attribute, "scope_resolution");
        expr(Expressions::subscript, "element_reference");
        expr(Expressions::paren, "parenthesized_expression", "parenthesized_statements");
        expr(Expressions::listLiteral, "array", "string_array", "symbol_array");
        expr(Expressions::tupleLiteral, "right_assignment_list");
        expr((ctx, n) -> Expressions.object(ctx, n, "hash", Nodes.childrenOfType(n, "pair"), "key", "value"),
                "hash");
        expr(RubyProfile::argumentList, "argument_list");
        expr(Expressions::unwrap, "splat_argument", "hash_splat_argument", "block_argument", "pattern", "in");
        expr(RubyProfile::pairArgument, "pair");
        expr(RubyProfile::range, "range");
        expr(Expressions::conditional, "conditional");
        expr(RubyProfile::lambda, "lambda");
        expr(RubyProfile::block, "block", "do_block");
        expr((ctx, n) -> keywordCall(ctx, n, "super"), "super");
        expr((ctx, n) -> keywordCall(ctx, n, "yield"), "yield");
        expr(Statements::assignmentExpr, "assignment");
        expr(Statements::augmentedAssignmentExpr, "operator_assignment");

        stmt(Statements::assignment, "assignment");
        stmt(Statements::augmentedAssignment, "operator_assignment");
        stmt(Statements::ret, "return");
        stmt(ControlFlow::ifStmt, "if", "elsif");
        stmt(RubyProfile::unless, "unless");
        stmt((ctx, n) -> modifierIf(ctx, n, false), "if_modifier");
        stmt((ctx, n) -> modifierIf(ctx, n, true), "unless_modifier");
        stmt(ControlFlow::whileStmt, "while");
        stmt(RubyProfile::until, "until");
        stmt((ctx, n) -> modifierLoop(ctx, n, false), "while_modifier");
        stmt((ctx, n) -> modifierLoop(ctx, n, true), "until_modifier");
        stmt(RubyProfile::forLoop, "for");
        stmt(Definitions::functionDef, "method");
        stmt(RubyProfile::singletonMethod, "singleton_method");
        stmt(Definitions::classDef, "class", "module");
        stmt(RubyProfile::singletonClass, "singleton_class");
        stmt(ControlFlow::breakStmt, "break");
        stmt(ControlFlow::continueStmt, "next");
        stmt(RubyProfile::bodyStatement, "body_statement", "begin");
        stmt(RubyProfile::caseStmt, "case");
        ignore("alias", "undef", "empty_statement");
    }

    static Reg keywordCall(LoweringContext ctx, SyntaxNode node, String function) {
        SyntaxNode args = Nodes.firstChildOfType(node, "argument_list");
        return Expressions.callFunction(ctx, node, function, Expressions.callArgs(ctx, args));
    }

    /**
     * Lower an argument list in value position, as in {@code return x}, as its first argument.
     */
    static Reg argumentList(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode first = Nodes.firstNamedChild(node);
        return first != null ? ctx.lowerExpr(first) : ctx.constant(ctx.profile.literals.defaultReturn());
    }

    static Reg pairArgument(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        return value != null ? ctx.lowerExpr(value) : Expressions.unwrap(ctx, node);
    }

    static Reg range(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        List<Reg> bounds = new ArrayList<>();
        for (SyntaxNode bound : named) {
            bounds.add(ctx.lowerExpr(bound));
        }
        return Expressions.callFunction(ctx, node, "range", bounds);
    }

    /**
     * Lower a call. A block attached to the call is passed as the last argument.
     */
    static Reg call(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode receiver = node.getChildByFieldName("receiver");
        SyntaxNode method = node.getChildByFieldName("method");
        SyntaxNode args = node.getChildByFieldName("arguments");
        SyntaxNode blockNode = node.getChildByFieldName("block");
        if (blockNode == null) blockNode = Nodes.firstChildOfType(node, "block", "do_block");

        Reg obj = receiver != null && method != null ? ctx.lowerExpr(receiver) : null;
        List<Reg> argRegs = Expressions.callArgs(ctx, args);
        if (blockNode != null) {
            argRegs.add(block(ctx, blockNode));
        }
        if (obj != null) {
            return Expressions.callMethod(ctx, node, obj, ctx.text(method), argRegs);
        }
        if (method != null) {
            return Expressions.callFunction(ctx, node, ctx.text(method), argRegs);
        }
        Reg target = ctx.symbolic("unknown_call_target", ctx.loc(node));
        return ctx.produce(Opcode.CALL_UNKNOWN, ctx.loc(node), Collections.singletonList(target), argRegs);
    }

    /**
     * Lower a {@code { |x| ... }} or {@code do |x| ... end} block as a closure.
     */
    static Reg block(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode params = Nodes.fieldOrType(node, "parameters", "block_parameters");
        SyntaxNode body = Nodes.fieldOrType(node, "body", "block_body", "body_statement");
        return Definitions.lambda(ctx, node,
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> {
                    if (body != null) {
                        ctx.lowerBlock(body);
                    } else {
                        for (SyntaxNode child : node.getNamedChildren()) {
                            if (child != params && !ctx.profile.isSkipped(child.getType())) ctx.lowerStmt(child);
                        }
                    }
                    return null;
                });
    }

    /**
     * Lower {@code ->(x) { ... }}, whose body is itself a block.
     */
    static Reg lambda(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode params = Nodes.fieldOrType(node, "parameters", "lambda_parameters");
        SyntaxNode body = node.getChildByFieldName("body");
        return Definitions.lambda(ctx, node,
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> {
                    if (body != null) {
                        SyntaxNode inner = Nodes.fieldOrType(body, "body", "block_body", "body_statement");
                        ctx.lowerBlock(inner != null ? inner : body);
                    }
                    return null;
                });
    }

    private static Reg negate(LoweringContext ctx, SyntaxNode node, @Nullable SyntaxNode condition) {
        Reg cond = ctx.lowerExpr(condition);
        return ctx.produce(Opcode.UNOP, ctx.loc(node), "!", cond);
    }

    static void unless(LoweringContext ctx, SyntaxNode node) {
        Reg cond = negate(ctx, node, node.getChildByFieldName("condition"));
        SyntaxNode cons = node.getChildByFieldName("consequence");
        SyntaxNode alt = node.getChildByFieldName("alternative");
        ControlFlow.Alternative alternative = alt == null ? null : endLabel -> ctx.lowerBlock(alt);
        ControlFlow.ifThen(ctx, node, cond, () -> ctx.lowerBlock(cons), alternative);
    }

    /**
     * Lower {@code stmt if cond} and {@code stmt unless cond}.
     */
    static void modifierIf(LoweringContext ctx, SyntaxNode node, boolean unless) {
        SyntaxNode body = node.getChildByFieldName("body");
        SyntaxNode condition = node.getChildByFieldName("condition");
        List<SyntaxNode> named = node.getNamedChildren();
        if (body == null && !named.isEmpty()) body = named.get(0);
        if (condition == null && named.size() > 1) condition = named.get(1);
        if (body == null || condition == null) {
            ctx.malformed(node, "expected a statement and a condition");
            return;
        }
        Reg cond = unless ? negate(ctx, node, condition) : ctx.lowerExpr(condition);
        SyntaxNode stmt = body;
        ControlFlow.ifElse(ctx, node, cond, () -> ctx.lowerStmt(stmt), null);
    }

    static void until(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        ControlFlow.whileLoop(ctx, node, node.getChildByFieldName("condition"), () -> ctx.lowerBlock(body), true);
    }

    /**
     * Lower {@code stmt while cond} and {@code stmt until cond}.
     */
    static void modifierLoop(LoweringContext ctx, SyntaxNode node, boolean until) {
        SyntaxNode body = node.getChildByFieldName("body");
        SyntaxNode condition = node.getChildByFieldName("condition");
        List<SyntaxNode> named = node.getNamedChildren();
        if (body == null && !named.isEmpty()) body = named.get(0);
        if (condition == null && named.size() > 1) condition = named.get(1);
        if (body == null) {
            ctx.malformed(node, "expected a statement and a condition");
            return;
        }
        SyntaxNode stmt = body;
        ControlFlow.whileLoop(ctx, node, condition, () -> ctx.lowerStmt(stmt), until);
    }

    static void forLoop(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode pattern = node.getChildByFieldName("pattern");
        SyntaxNode value = node.getChildByFieldName("value");
        if (value != null && value.getType().equals("in")) value = Nodes.firstNamedChild(value);
        ControlFlow.forEach(ctx, node, pattern, value, node.getChildByFieldName("body"));
    }

    /**
     * Lower {@code def self.name}, naming the function after its receiver.
     */
    static void singletonMethod(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode object = node.getChildByFieldName("object");
        SyntaxNode name = node.getChildByFieldName("name");
        String funcName = (object != null ? ctx.text(object) : "self") + "." + (name != null ? ctx.text(name) : "__anon");
        Definitions.function(ctx, node, funcName,
                node.getChildByFieldName("parameters"), node.getChildByFieldName("body"));
    }

    /**
     * Lower {@code class << obj}, whose body is only reachable through the methods it defines.
     */
    static void singletonClass(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        SyntaxNode body = node.getChildByFieldName("body");
        String label = ctx.freshLabel("singleton_class");
        String endLabel = ctx.freshLabel("singleton_class_end");
        ctx.branch(endLabel);
        ctx.label(label);
        if (value != null) ctx.lowerExpr(value);
        ctx.lowerBlock(body);
        ctx.label(endLabel);
    }

    /**
     * Lower a statement sequence, which is a try statement when it has {@code rescue} or
     * {@code ensure} clauses.
     */
    static void bodyStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode container = node;
        SyntaxNode inner = Nodes.firstChildOfType(node, "body_statement");
        if (inner != null) container = inner;
        List<SyntaxNode> body = new ArrayList<>();
        List<ControlFlow.CatchClause> catches = new ArrayList<>();
        SyntaxNode ensure = null;
        SyntaxNode elseNode = null;
        for (SyntaxNode child : container.getNamedChildren()) {
            switch (child.getType()) {
                case "rescue":
                    catches.add(rescueClause(ctx, child));
                    break;
                case "ensure":
                    ensure = child;
                    break;
                case "else":
                    elseNode = child;
                    break;
                default:
                    body.add(child);
            }
        }
        if (catches.isEmpty() && ensure == null) {
            ctx.lowerStatements(body);
            return;
        }
        SyntaxNode ensureBody = ensure;
        SyntaxNode elseBody = elseNode;
        ControlFlow.tryCatch(ctx, node, () -> ctx.lowerStatements(body), catches,
                ensureBody == null ? null : () -> ctx.lowerChildren(ensureBody),
                elseBody == null ? null : () -> ctx.lowerChildren(elseBody));
    }

    private static ControlFlow.CatchClause rescueClause(LoweringContext ctx, SyntaxNode rescue) {
        SyntaxNode exceptions = Nodes.fieldOrType(rescue, "exceptions", "exceptions");
        SyntaxNode variable = Nodes.fieldOrType(rescue, "variable", "exception_variable");
        SyntaxNode name = variable != null ? Nodes.firstNamedChild(variable) : null;
        SyntaxNode body = Nodes.fieldOrType(rescue, "body", "then");
        return new ControlFlow.CatchClause(
                name != null ? ctx.text(name) : null,
                exceptions != null ? ctx.text(exceptions) : "StandardError",
                () -> ctx.lowerBlock(body));
    }

    /**
     * Lower {@code case}. With a subject, each {@code when} compares it with {@code ==}. Without
     * one, each {@code when} pattern is itself the condition.
     */
    static void caseStmt(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        List<ControlFlow.Case> cases = new ArrayList<>();
        for (SyntaxNode child : node.getNamedChildren()) {
            if (child.getType().equals("when")) {
                List<SyntaxNode> patterns = Nodes.childrenOfType(child, "pattern");
                SyntaxNode body = Nodes.fieldOrType(child, "body", "then");
                cases.add(new ControlFlow.Case(patterns, () -> ctx.lowerBlock(body)));
            } else if (child.getType().equals("else")) {
                cases.add(ControlFlow.Case.otherwise(() -> ctx.lowerChildren(child)));
            }
        }
        ControlFlow.switchChain(ctx, node, value != null ? ctx.lowerExpr(value) : null, cases, "==", false);
    }
}
