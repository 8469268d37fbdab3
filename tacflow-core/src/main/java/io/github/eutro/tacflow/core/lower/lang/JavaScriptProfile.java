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
 * The profile of JavaScript.
 */
public class JavaScriptProfile extends LanguageProfile {
    public JavaScriptProfile() {
        this("javascript");
    }

    protected JavaScriptProfile(String name) {
        super(name);
        literals.setNone("undefined");
        literals.setTrueValue("true");
        literals.setFalseValue("false");
        literals.setDefaultReturn("undefined");
        fields.setAttrAttribute("property");
        fields.setSubscriptValue("object");
        fields.setSubscriptIndex("index");
        noiseTypes.remove("newline");
        blockTypes.addAll(Arrays.asList("program", "statement_block", "class_body"));
        subscriptTypes.add("subscript_expression");
        identifierTypes.addAll(Arrays.asList("this", "super", "property_identifier", "shorthand_property_identifier"));

        expr(Expressions::identifier, "identifier", "this", "super", "property_identifier",
                "shorthand_property_identifier");
        expr(Expressions::constLiteral, "number", "string", "true", "false", "null", "undefined", "regex");
        expr(JavaScriptProfile::templateString, "template_string");
        expr(Expressions::unwrap, "template_substitution", "spread_element", "computed_property_name");
        expr(Expressions::binop, "binary_expression");
        expr(Statements::augmentedAssignmentExpr, "augmented_assignment_expression");
        expr(Statements::assignmentExpr, "assignment_expression");
        expr(Expressions::unop, "unary_expression");
        expr(Expressions::updateExpr, "update_expression");
        expr(Expressions::call, "call_expression");
        expr(JavaScriptProfile::newExpression, "new_expression");
        expr(Expressions::attribute, "member_expression");
        expr(Expressions::subscript, "subscript_expression");
        expr(Expressions::paren, "parenthesized_expression");
        expr(Expressions::listLiteral, "array");
        expr(JavaScriptProfile::objectLiteral, "object");
        expr(Definitions::lambda, "arrow_function", "function", "function_expression", "generator_function");
        expr(Expressions::conditional, "ternary_expression");
        expr((ctx, n) -> keywordCall(ctx, n, "await"), "await_expression");
        expr((ctx, n) -> keywordCall(ctx, n, "yield"), "yield_expression");
        expr(JavaScriptProfile::sequence, "sequence_expression");

        stmt(Statements::expressionStatement, "expression_statement");
        stmt(JavaScriptProfile::declaration, "lexical_declaration", "variable_declaration");
        stmt(Statements::ret, "return_statement");
        stmt(ControlFlow::ifStmt, "if_statement");
        stmt(ControlFlow::whileStmt, "while_statement");
        stmt(ControlFlow::doStmt, "do_statement");
        stmt(JavaScriptProfile::forStatement, "for_statement");
        stmt(JavaScriptProfile::forInStatement, "for_in_statement");
        stmt(Definitions::functionDef, "function_declaration", "generator_function_declaration",
                "method_definition");
        stmt(Definitions::classDef, "class_declaration");
        stmt(JavaScriptProfile::fieldDefinition, "field_definition", "public_field_definition");
        stmt(Statements::throwStmt, "throw_statement");
        stmt(ControlFlow::breakStmt, "break_statement");
        stmt(ControlFlow::continueStmt, "continue_statement");
        stmt(JavaScriptProfile::tryStatement, "try_statement");
        stmt(JavaScriptProfile::switchStatement, "switch_statement");
        stmt(JavaScriptProfile::labeledStatement, "labeled_statement");
        stmt((ctx, n) -> ctx.lowerChildren(n), "statement_block", "export_statement", "class_static_block");
        ignore("empty_statement", "import_statement", "debugger_statement");
    }

    @Override
    public @Nullable String paramName(LoweringContext ctx, SyntaxNode param) {
        switch (param.getType()) {
            case "identifier":
            case "object_pattern":
            case "array_pattern":
                return ctx.text(param);
            case "assignment_pattern": {
                SyntaxNode left = param.getChildByFieldName("left");
                return left == null ? null : ctx.text(left);
            }
            default:
                return super.paramName(ctx, param);
        }
    }

    static Reg keywordCall(LoweringContext ctx, SyntaxNode node, String function) {
        List<Reg> args = new ArrayList<>();
        SyntaxNode operand = Nodes.firstNamedChild(node);
        if (operand != null) args.add(ctx.lowerExpr(operand));
        return Expressions.callFunction(ctx, node, function, args);
    }

    static Reg sequence(LoweringContext ctx, SyntaxNode node) {
        Reg last = null;
        for (SyntaxNode child : Expressions.elements(ctx, node)) {
            last = ctx.lowerExpr(child);
        }
        return last != null ? last : ctx.constant(ctx.profile.literals.none());
    }

    /**
     * Lower a template string as the concatenation of its fragments and substitutions.
     */
    static Reg templateString(LoweringContext ctx, SyntaxNode node) {
        if (!Nodes.hasChildOfType(node, "template_substitution")) {
            return Expressions.constLiteral(ctx, node);
        }
        Reg result = null;
        for (SyntaxNode child : node.getChildren()) {
            Reg part;
            if (child.getType().equals("template_substitution")) {
                part = Expressions.unwrap(ctx, child);
            } else if (child.getType().equals("`")) {
                continue;
            } else {
                part = ctx.constant(ctx.text(child), ctx.loc(child));
            }
            result = result == null ? part : ctx.produce(Opcode.BINOP, ctx.loc(node), "+", result, part);
        }
        return result;
    }

    static Reg newExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode constructor = node.getChildByFieldName("constructor");
        return Expressions.construct(ctx, node, constructor != null ? ctx.text(constructor) : "Object",
                node.getChildByFieldName("arguments"));
    }

    static Reg objectLiteral(LoweringContext ctx, SyntaxNode node) {
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), "object");
        for (SyntaxNode child : node.getNamedChildren()) {
            switch (child.getType()) {
                case "pair": {
                    SyntaxNode key = child.getChildByFieldName("key");
                    SyntaxNode value = child.getChildByFieldName("value");
                    if (key == null || value == null) {
                        ctx.malformed(child, "expected a key and a value");
                        break;
                    }
                    Reg k = key.getType().equals("computed_property_name")
                            ? ctx.lowerExpr(key)
                            : ctx.constant(ctx.text(key), ctx.loc(key));
                    Reg v = ctx.lowerExpr(value);
                    ctx.consume(Opcode.STORE_INDEX, ctx.loc(child), obj, k, v);
                    break;
                }
                case "shorthand_property_identifier": {
                    Reg k = ctx.constant(ctx.text(child), ctx.loc(child));
                    Reg v = Expressions.identifier(ctx, child);
                    ctx.consume(Opcode.STORE_INDEX, ctx.loc(child), obj, k, v);
                    break;
                }
                case "method_definition": {
                    SyntaxNode name = child.getChildByFieldName("name");
                    Reg v = Definitions.lambda(ctx, child);
                    Reg k = ctx.constant(name != null ? ctx.text(name) : "__method", ctx.loc(child));
                    ctx.consume(Opcode.STORE_INDEX, ctx.loc(child), obj, k, v);
                    break;
                }
                default:
                    if (!ctx.profile.isSkipped(child.getType())) ctx.lowerExpr(child);
            }
        }
        return obj;
    }

    static void declaration(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode declarator : Nodes.childrenOfType(node, "variable_declarator")) {
            Statements.declarator(ctx, node, declarator, "name", "value");
        }
    }

    static void fieldDefinition(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = Nodes.fieldOrType(node, "property", "property_identifier", "private_property_identifier");
        if (name == null) name = node.getChildByFieldName("name");
        if (name == null) {
            ctx.malformed(node, "field without a name");
            return;
        }
        SyntaxNode value = node.getChildByFieldName("value");
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
        ctx.storeVar(ctx.text(name), reg, ctx.loc(node));
    }

    /**
     * Lower {@code for (init; cond; step)}, whose condition is wrapped in a statement node.
     */
    static void forStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode condition = node.getChildByFieldName("condition");
        if (condition != null) {
            if (condition.getType().equals("empty_statement")) {
                condition = null;
            } else if (condition.getType().equals("expression_statement")) {
                condition = Nodes.firstNamedChild(condition);
            }
        }
        SyntaxNode update = node.getChildByFieldName("increment");
        if (update == null) update = node.getChildByFieldName("update");
        SyntaxNode step = update;
        SyntaxNode body = node.getChildByFieldName("body");
        SyntaxNode init = node.getChildByFieldName("initializer");
        if (init != null && init.getType().equals("empty_statement")) init = null;
        ControlFlow.cStyleFor(ctx, node, init, condition,
                step == null ? null : () -> ctx.lowerExpr(step),
                () -> ctx.lowerBlock(body));
    }

    /**
     * Lower {@code for (x of xs)} over the elements, and {@code for (k in obj)} over
     * {@code keys(obj)}.
     */
    static void forInStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode left = node.getChildByFieldName("left");
        SyntaxNode operator = node.getChildByFieldName("operator");
        SyntaxNode body = node.getChildByFieldName("body");
        boolean forOf = operator != null && ctx.text(operator).equals("of");
        Reg collection = ctx.lowerExpr(node.getChildByFieldName("right"));
        if (!forOf) {
            collection = Expressions.callFunction(ctx, node, "keys", Collections.singletonList(collection));
        }
        SyntaxNode target = left != null && Nodes.hasChildOfType(left, "variable_declarator")
                ? Nodes.firstChildOfType(left, "variable_declarator").getChildByFieldName("name")
                : left;
        ControlFlow.forEach(ctx, node, forOf ? "for_of" : "for_in", collection,
                (idx, elem) -> {
                    if (target != null) Statements.storeTarget(ctx, target, elem, node);
                },
                () -> ctx.lowerBlock(body));
    }

    static void tryStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        SyntaxNode handler = node.getChildByFieldName("handler");
        SyntaxNode finalizer = node.getChildByFieldName("finalizer");
        List<ControlFlow.CatchClause> catches = new ArrayList<>();
        if (handler != null) {
            SyntaxNode param = handler.getChildByFieldName("parameter");
            SyntaxNode handlerBody = handler.getChildByFieldName("body");
            catches.add(new ControlFlow.CatchClause(param != null ? ctx.text(param) : null, null,
                    () -> ctx.lowerBlock(handlerBody)));
        }
        SyntaxNode finallyBody = finalizer != null ? finalizer.getChildByFieldName("body") : null;
        ControlFlow.tryCatch(ctx, node, () -> ctx.lowerBlock(body), catches,
                finallyBody == null ? null : () -> ctx.lowerBlock(finallyBody), null);
    }

    static void switchStatement(LoweringContext ctx, SyntaxNode node) {
        Reg subject = ctx.lowerExpr(node.getChildByFieldName("value"));
        SyntaxNode body = node.getChildByFieldName("body");
        List<ControlFlow.Case> cases = new ArrayList<>();
        if (body != null) {
            for (SyntaxNode arm : Nodes.childrenOfType(body, "switch_case", "switch_default")) {
                SyntaxNode value = arm.getChildByFieldName("value");
                Runnable lowerArm = () -> {
                    for (SyntaxNode stmt : arm.getNamedChildren()) {
                        if (stmt != value) ctx.lowerStmt(stmt);
                    }
                };
                cases.add(value == null
                        ? ControlFlow.Case.otherwise(lowerArm)
                        : new ControlFlow.Case(Collections.singletonList(value), lowerArm));
            }
        }
        ControlFlow.switchChain(ctx, node, subject, cases, "===");
    }

    static void labeledStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode label = node.getChildByFieldName("label");
        ctx.label(ctx.freshLabel(label != null ? ctx.text(label) : "unknown_label"));
        SyntaxNode body = node.getChildByFieldName("body");
        if (body != null) ctx.lowerStmt(body);
    }
}
