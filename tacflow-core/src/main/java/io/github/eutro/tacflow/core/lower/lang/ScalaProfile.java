package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.lower.*;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * The profile of Scala.
 * <p>
 * Like Rust, Scala blocks, {@code if}s and {@code match}es are expressions whose value is their
 * last expression, and a function returns the value of its body.
 */
public class ScalaProfile extends LanguageProfile {
    private static final int SYMBOLIC_TEXT_LIMIT = 60;

    public ScalaProfile() {
        super("scala");
        literals.setNone("null");
        literals.setDefaultReturn("()");
        fields.setAttrObject("value");
        fields.setAttrAttribute("field");
        commentTypes.add("block_comment");
        blockTypes.addAll(Arrays.asList("block", "template_body", "compilation_unit", "indented_block"));
        identifierTypes.addAll(Arrays.asList("this", "super", "type_identifier", "stable_identifier"));
        attributeTypes.add("field_expression");
        subscriptTypes.add("call_expression");

        expr(Expressions::identifier, "identifier", "this", "super", "type_identifier", "stable_identifier",
                "operator_identifier");
        expr(Expressions::constLiteral, "integer_literal", "floating_point_literal", "string", "boolean_literal",
                "null_literal", "unit", "character_literal", "symbol_literal", "interpolated_string_expression",
                "interpolated_string");
        expr(Expressions::binop, "infix_expression");
        expr(ScalaProfile::prefix, "prefix_expression");
        expr(Expressions::paren, "parenthesized_expression");
        expr(Expressions::call, "call_expression");
        expr(Expressions::attribute, "field_expression");
        expr(ScalaProfile::ifExpression, "if_expression");
        expr(ScalaProfile::matchExpression, "match_expression");
        expr(ScalaProfile::block, "block", "indented_block");
        expr(Statements::assignmentExpr, "assignment_expression");
        expr(ScalaProfile::returnExpression, "return_expression");
        expr((ctx, n) -> ctx.symbolic("wildcard:_", ctx.loc(n)), "wildcard");
        expr(Expressions::tupleLiteral, "tuple_expression");
        expr(ScalaProfile::lambda, "lambda_expression");
        expr(ScalaProfile::instance, "instance_expression");
        expr(ScalaProfile::symbolic, "generic_type", "generic_function", "typed_pattern", "case_class_pattern");
        expr(ScalaProfile::tryExpression, "try_expression");
        expr(ScalaProfile::throwExpression, "throw_expression");
        expr(ScalaProfile::forExpression, "for_expression");
        expr(ScalaProfile::ascription, "ascription_expression");
        expr(ScalaProfile::postfix, "postfix_expression");

        stmt(ScalaProfile::valDefinition, "val_definition", "var_definition", "lazy_val_definition");
        stmt(ScalaProfile::varDeclaration, "var_declaration", "val_declaration");
        stmt(ScalaProfile::function, "function_definition");
        stmt(ScalaProfile::classDefinition, "class_definition", "case_class_definition", "object_definition",
                "trait_definition", "enum_definition");
        stmt(ControlFlow::ifStmt, "if_expression");
        stmt(ControlFlow::whileStmt, "while_expression");
        stmt(ScalaProfile::doWhile, "do_while_expression");
        stmt((ctx, n) -> matchExpression(ctx, n), "match_expression");
        stmt((ctx, n) -> ctx.lowerChildren(n), "block", "template_body", "compilation_unit", "indented_block");
        stmt(Statements::expressionStatement, "expression_statement");
        stmt(ControlFlow::breakStmt, "break_expression");
        stmt(ControlFlow::continueStmt, "continue_expression");
        stmt((ctx, n) -> tryExpression(ctx, n), "try_expression");
        stmt((ctx, n) -> forExpression(ctx, n), "for_expression");
        stmt((ctx, n) -> returnExpression(ctx, n), "return_expression");
        stmt(ScalaProfile::packageObject, "package_object");
        ignore("import_declaration", "package_clause", "type_definition", "function_declaration",
                "export_declaration", "annotation");
    }

    /**
     * Splits an assignment target {@code a(i)} into {@code a} and {@code i}. Reads of {@code a(i)}
     * stay calls, since they cannot be told apart from function applications.
     */
    @Override
    public @Nullable Pair<SyntaxNode, SyntaxNode> subscriptParts(SyntaxNode node) {
        if (!node.getType().equals("call_expression")) {
            return super.subscriptParts(node);
        }
        SyntaxNode function = node.getChildByFieldName("function");
        SyntaxNode arguments = node.getChildByFieldName("arguments");
        if (function == null || arguments == null) return null;
        List<SyntaxNode> args = arguments.getNamedChildren();
        return args.size() == 1 ? Pair.of(function, args.get(0)) : null;
    }

    @Override
    public void lowerParams(LoweringContext ctx, SyntaxNode params) {
        for (SyntaxNode param : params.getNamedChildren()) {
            switch (param.getType()) {
                case "parameter":
                case "class_parameter":
                case "binding": {
                    SyntaxNode name = param.getChildByFieldName("name");
                    if (name == null) name = Nodes.firstChildOfType(param, "identifier");
                    if (name != null) Definitions.emitParam(ctx, ctx.text(name), ctx.loc(param));
                    break;
                }
                case "identifier":
                    Definitions.emitParam(ctx, ctx.text(param), ctx.loc(param));
                    break;
                default:
                    break;
            }
        }
    }

    /**
     * Get the name bound by a simple pattern, looking inside typed patterns.
     */
    static String patternName(LoweringContext ctx, @Nullable SyntaxNode pattern) {
        if (pattern == null) return "__unknown";
        if (pattern.getType().equals("identifier")) return ctx.text(pattern);
        SyntaxNode id = Nodes.firstChildOfType(pattern, "identifier");
        return id != null ? ctx.text(id) : ctx.text(pattern);
    }

    /**
     * Lower the statements of a block, returning the value of its last expression, or null if it
     * ends in a definition.
     *
     * @param ctx  The context.
     * @param node The block.
     * @return The value register, or null.
     */
    static @Nullable Reg blockValue(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> children = new ArrayList<>();
        for (SyntaxNode child : node.getNamedChildren()) {
            if (!ctx.profile.isSkipped(child.getType())) children.add(child);
        }
        if (children.isEmpty()) return null;
        ctx.lowerStatements(children.subList(0, children.size() - 1));
        SyntaxNode last = children.get(children.size() - 1);
        if (ctx.profile.expressionHandler(last.getType()) == null) {
            ctx.lowerStmt(last);
            return null;
        }
        return ctx.lowerExpr(last);
    }

    static Reg block(LoweringContext ctx, SyntaxNode node) {
        Reg value = blockValue(ctx, node);
        return value != null ? value : ctx.constant(ctx.profile.literals.none(), ctx.loc(node));
    }

    private static Reg bodyValue(LoweringContext ctx, @Nullable SyntaxNode node) {
        if (node == null) return ctx.constant(ctx.profile.literals.none());
        if (ctx.profile.isBlock(node.getType())) return block(ctx, node);
        return ctx.lowerExpr(node);
    }

    static Reg prefix(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode operand = Nodes.firstNamedChild(node);
        SyntaxNode op = node.getChildren().isEmpty() ? null : node.getChildren().get(0);
        Reg inner = ctx.lowerExpr(operand);
        return ctx.produce(Opcode.UNOP, ctx.loc(node), op != null ? ctx.text(op) : "-", inner);
    }

    /**
     * Lower {@code xs.length} style postfix application as a method call without arguments.
     */
    static Reg postfix(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.size() < 2) return Expressions.constLiteral(ctx, node);
        Reg receiver = ctx.lowerExpr(named.get(0));
        return Expressions.callMethod(ctx, node, receiver, ctx.text(named.get(1)), Collections.emptyList());
    }

    static Reg ascription(LoweringContext ctx, SyntaxNode node) {
        return ctx.lowerExpr(Nodes.firstNamedChild(node));
    }

    static Reg ifExpression(LoweringContext ctx, SyntaxNode node) {
        Reg cond = ctx.lowerExpr(node.getChildByFieldName("condition"));
        SyntaxNode consequence = node.getChildByFieldName("consequence");
        SyntaxNode alternative = node.getChildByFieldName("alternative");
        return ControlFlow.ifValue(ctx, node, cond,
                () -> bodyValue(ctx, consequence),
                alternative == null ? null : () -> bodyValue(ctx, alternative));
    }

    /**
     * Lower a match as a chain of equality tests against each case pattern. A wildcard case is
     * the default. Guards are not evaluated.
     */
    static Reg matchExpression(LoweringContext ctx, SyntaxNode node) {
        Reg subject = ctx.lowerExpr(node.getChildByFieldName("value"));
        SyntaxNode body = node.getChildByFieldName("body");
        List<List<SyntaxNode>> values = new ArrayList<>();
        List<Supplier<Reg>> results = new ArrayList<>();
        if (body != null) {
            for (SyntaxNode clause : Nodes.childrenOfType(body, "case_clause")) {
                SyntaxNode pattern = clause.getChildByFieldName("pattern");
                SyntaxNode armBody = clause.getChildByFieldName("body");
                values.add(patternValues(pattern));
                results.add(() -> bodyValue(ctx, armBody));
            }
        }
        return ControlFlow.switchValue(ctx, node, subject, values, results, "==");
    }

    private static List<SyntaxNode> patternValues(@Nullable SyntaxNode pattern) {
        if (pattern == null || pattern.getType().equals("wildcard")) {
            return Collections.emptyList();
        }
        if (pattern.getType().equals("alternative_pattern")) {
            List<SyntaxNode> values = new ArrayList<>();
            for (SyntaxNode alt : pattern.getNamedChildren()) {
                values.addAll(patternValues(alt));
            }
            return values;
        }
        return Collections.singletonList(pattern);
    }

    static Reg returnExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = Nodes.firstNamedChild(node);
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.defaultReturn());
        ctx.ret(reg, ctx.loc(node));
        return reg;
    }

    static Reg throwExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = Nodes.firstNamedChild(node);
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.defaultReturn());
        ctx.consume(Opcode.THROW, ctx.loc(node), reg);
        return reg;
    }

    /**
     * Lower a lambda, returning the value of its body.
     */
    static Reg lambda(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode params = node.getChildByFieldName("parameters");
        SyntaxNode body = node.getChildByFieldName("body");
        if (body == null) {
            List<SyntaxNode> named = node.getNamedChildren();
            if (!named.isEmpty()) body = named.get(named.size() - 1);
            if (body == params) body = null;
        }
        SyntaxNode bodyNode = body;
        return Definitions.lambda(ctx, node,
                () -> {
                    if (params == null) return;
                    if (params.getType().equals("identifier")) {
                        Definitions.emitParam(ctx, ctx.text(params), ctx.loc(params));
                    } else {
                        ctx.profile.lowerParams(ctx, params);
                    }
                },
                () -> bodyNode == null ? null : bodyValue(ctx, bodyNode));
    }

    /**
     * Lower {@code new T(args)} as a construction of {@code T}, and an anonymous class body as a
     * class followed by a construction of it.
     */
    static Reg instance(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = Nodes.firstChildOfType(node, "template_body");
        String type = "Object";
        SyntaxNode args = null;
        for (SyntaxNode child : node.getNamedChildren()) {
            switch (child.getType()) {
                case "type_identifier":
                case "generic_type":
                case "stable_type_identifier":
                    type = ctx.text(child);
                    break;
                case "arguments":
                    args = child;
                    break;
                default:
                    break;
            }
        }
        if (body != null) {
            type = "__anon_" + type;
            Definitions.classBody(ctx, node, type, () -> ctx.lowerBlock(body));
        }
        return Expressions.construct(ctx, node, type, args);
    }

    static Reg symbolic(LoweringContext ctx, SyntaxNode node) {
        String text = ctx.text(node);
        if (text.length() > SYMBOLIC_TEXT_LIMIT) text = text.substring(0, SYMBOLIC_TEXT_LIMIT);
        return ctx.symbolic(node.getType() + ":" + text, ctx.loc(node));
    }

    /**
     * Lower a try expression. Each case of the catch block is a separate catch clause, typed by
     * the type of its pattern.
     */
    static Reg tryExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        List<ControlFlow.CatchClause> catches = new ArrayList<>();
        Runnable finallyBody = null;
        for (SyntaxNode child : node.getNamedChildren()) {
            if (child.getType().equals("catch_clause")) {
                SyntaxNode catchBody = child.getChildByFieldName("body");
                if (catchBody == null) continue;
                List<SyntaxNode> cases = Nodes.childrenOfType(catchBody, "case_clause");
                if (cases.isEmpty()) {
                    catches.add(new ControlFlow.CatchClause(null, null, () -> ctx.lowerBlock(catchBody)));
                    continue;
                }
                for (SyntaxNode clause : cases) {
                    SyntaxNode pattern = clause.getChildByFieldName("pattern");
                    SyntaxNode clauseBody = clause.getChildByFieldName("body");
                    String variable = null;
                    String type = null;
                    if (pattern != null) {
                        SyntaxNode id = Nodes.firstChildOfType(pattern, "identifier");
                        SyntaxNode typeNode = Nodes.firstChildOfType(pattern, "type_identifier");
                        if (pattern.getType().equals("identifier")) id = pattern;
                        if (id != null) variable = ctx.text(id);
                        if (typeNode != null) type = ctx.text(typeNode);
                    }
                    catches.add(new ControlFlow.CatchClause(variable, type, () -> ctx.lowerBlock(clauseBody)));
                }
            } else if (child.getType().equals("finally_clause")) {
                SyntaxNode finallyNode = child.getChildByFieldName("body");
                if (finallyNode == null) finallyNode = Nodes.firstNamedChild(child);
                SyntaxNode finallyBlock = finallyNode;
                finallyBody = () -> ctx.lowerBlock(finallyBlock);
            }
        }
        ControlFlow.tryCatch(ctx, node, () -> ctx.lowerBlock(body), catches, finallyBody, null);
        return ctx.constant(ctx.profile.literals.none(), ctx.loc(node));
    }

    /**
     * Lower a for comprehension as nested loops, one per generator. A generator over
     * {@code a to b} or {@code a until b} is a counting loop, any other an iteration over the
     * collection. Guards skip the rest of the iteration when false.
     */
    static Reg forExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode enumerators = node.getChildByFieldName("enumerators");
        if (enumerators == null) enumerators = Nodes.firstChildOfType(node, "enumerators");
        SyntaxNode body = node.getChildByFieldName("body");
        if (body == null) {
            List<SyntaxNode> named = node.getNamedChildren();
            if (!named.isEmpty() && named.get(named.size() - 1) != enumerators) body = named.get(named.size() - 1);
        }
        List<SyntaxNode> steps = new ArrayList<>();
        if (enumerators != null) {
            for (SyntaxNode enumerator : enumerators.getNamedChildren()) {
                if (ctx.profile.isSkipped(enumerator.getType())) continue;
                steps.add(enumerator);
                steps.addAll(Nodes.childrenOfType(enumerator, "guard"));
            }
        }
        SyntaxNode bodyNode = body;
        forSteps(ctx, node, steps, 0, () -> ctx.lowerBlock(bodyNode));
        return ctx.constant(ctx.profile.literals.defaultReturn(), ctx.loc(node));
    }

    private static void forSteps(LoweringContext ctx, SyntaxNode loop, List<SyntaxNode> steps, int i, Runnable body) {
        if (i == steps.size()) {
            body.run();
            return;
        }
        SyntaxNode step = steps.get(i);
        Runnable rest = () -> forSteps(ctx, loop, steps, i + 1, body);
        if (step.getType().equals("guard")) {
            Reg cond = ctx.lowerExpr(Nodes.firstNamedChild(step));
            ControlFlow.ifElse(ctx, step, cond, rest, null);
            return;
        }
        List<SyntaxNode> parts = new ArrayList<>();
        for (SyntaxNode part : step.getNamedChildren()) {
            if (!part.getType().equals("guard")) parts.add(part);
        }
        if (parts.size() < 2) {
            ctx.malformed(step, "generator without a binding");
            rest.run();
            return;
        }
        SyntaxNode binding = parts.get(0);
        SyntaxNode source = parts.get(parts.size() - 1);
        if (Nodes.hasChildOfType(step, "=")) {
            ctx.storeVar(patternName(ctx, binding), ctx.lowerExpr(source), ctx.loc(step));
            rest.run();
            return;
        }
        if (source.getType().equals("infix_expression")) {
            SyntaxNode operator = source.getChildByFieldName("operator");
            String op = operator != null ? ctx.text(operator) : "";
            if (op.equals("to") || op.equals("until")) {
                Reg start = ctx.lowerExpr(source.getChildByFieldName("left"));
                Reg bound = ctx.lowerExpr(source.getChildByFieldName("right"));
                ControlFlow.rangeFor(ctx, step, patternName(ctx, binding), start, bound, ctx.constant("1"),
                        op.equals("to") ? "<=" : "<", rest);
                return;
            }
        }
        ControlFlow.forEach(ctx, step, source,
                (idx, elem) -> Statements.storeTarget(ctx, binding, elem, step), rest);
    }

    static void valDefinition(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode pattern = node.getChildByFieldName("pattern");
        SyntaxNode value = node.getChildByFieldName("value");
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
        if (pattern != null && Statements.DESTRUCTURING_TYPES.contains(pattern.getType())) {
            Statements.storeTarget(ctx, pattern, reg, node);
        } else {
            ctx.storeVar(patternName(ctx, pattern), reg, ctx.loc(node));
        }
    }

    static void varDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        ctx.storeVar(patternName(ctx, name), ctx.constant(ctx.profile.literals.none()), ctx.loc(node));
    }

    /**
     * Lower a function, returning the value of its body. Every parameter list is lowered, in order.
     */
    static void function(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        List<SyntaxNode> paramLists = Nodes.childrenOfType(node, "parameters");
        Definitions.function(ctx, node, name != null ? ctx.text(name) : "__anon",
                () -> {
                    for (SyntaxNode params : paramLists) ctx.profile.lowerParams(ctx, params);
                },
                () -> {
                    if (body == null) return;
                    if (ctx.profile.isBlock(body.getType())) {
                        Reg value = blockValue(ctx, body);
                        if (value != null) ctx.ret(value, ctx.loc(body));
                    } else if (ctx.profile.expressionHandler(body.getType()) != null) {
                        ctx.ret(ctx.lowerExpr(body), ctx.loc(body));
                    } else {
                        ctx.lowerStmt(body);
                    }
                });
    }

    /**
     * Lower a class, case class, object, trait or enum. Class parameters become fields of
     * {@code this}.
     */
    static void classDefinition(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        List<SyntaxNode> classParams = Nodes.childrenOfType(node, "class_parameters");
        Definitions.classBody(ctx, node, name != null ? ctx.text(name) : "__anon_class", () -> {
            for (SyntaxNode params : classParams) {
                for (SyntaxNode param : Nodes.childrenOfType(params, "class_parameter")) {
                    SyntaxNode paramName = param.getChildByFieldName("name");
                    if (paramName == null) continue;
                    Reg self = ctx.loadVar("this", ctx.loc(param));
                    Reg value = ctx.symbolic(IRNames.PARAM_PREFIX + ctx.text(paramName), ctx.loc(param));
                    ctx.consume(Opcode.STORE_FIELD, ctx.loc(param), self, ctx.text(paramName), value);
                }
            }
            if (body != null) ctx.lowerBlock(body);
        });
    }

    static void doWhile(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        SyntaxNode condition = node.getChildByFieldName("condition");
        ControlFlow.doWhile(ctx, node, () -> ctx.lowerBlock(body), condition, false);
    }

    static void packageObject(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        if (body != null) ctx.lowerBlock(body);
    }
}
