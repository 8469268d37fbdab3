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
import java.util.function.Supplier;

/**
 * The profile of Java.
 */
public class JavaProfile extends LanguageProfile {
    public JavaProfile() {
        super("java");
        literals.setNone("null");
        literals.setTrueValue("true");
        literals.setFalseValue("false");
        literals.setDefaultReturn("null");
        fields.setAttrAttribute("field");
        fields.setSubscriptValue("array");
        fields.setSubscriptIndex("index");
        commentTypes.addAll(Arrays.asList("line_comment", "block_comment"));
        blockTypes.addAll(Arrays.asList("program", "block", "class_body", "constructor_body"));
        identifierTypes.addAll(Arrays.asList("this", "super", "type_identifier"));
        subscriptTypes.add("array_access");

        expr(Expressions::constLiteral, "decimal_integer_literal", "hex_integer_literal",
                "octal_integer_literal", "binary_integer_literal", "decimal_floating_point_literal",
                "hex_floating_point_literal", "string_literal", "character_literal", "true", "false",
                "null_literal", "text_block");
        expr(Expressions::identifier, "identifier", "this", "super", "type_identifier");
        expr(Expressions::binop, "binary_expression");
        expr(Expressions::unop, "unary_expression");
        expr(Expressions::updateExpr, "update_expression");
        expr(Statements::anyAssignmentExpr, "assignment_expression");
        expr(JavaProfile::methodInvocation, "method_invocation");
        expr(JavaProfile::objectCreation, "object_creation_expression");
        expr(Expressions::attribute, "field_access");
        expr(Expressions::subscript, "array_access");
        expr(Expressions::paren, "parenthesized_expression");
        expr(JavaProfile::arrayCreation, "array_creation_expression");
        expr((ctx, n) -> Expressions.array(ctx, n, "array", Expressions.elements(ctx, n)), "array_initializer");
        expr(JavaProfile::cast, "cast_expression");
        expr(JavaProfile::instanceOf, "instanceof_expression");
        expr(Expressions::conditional, "ternary_expression");
        expr(JavaProfile::methodReference, "method_reference");
        expr(Definitions::lambda, "lambda_expression");
        expr(JavaProfile::classLiteral, "class_literal");
        expr(JavaProfile::switchExpression, "switch_expression");

        stmt(Statements::expressionStatement, "expression_statement");
        stmt(JavaProfile::localVariable, "local_variable_declaration");
        stmt(JavaProfile::fieldDeclaration, "field_declaration");
        stmt(Statements::ret, "return_statement");
        stmt(ControlFlow::ifStmt, "if_statement");
        stmt(ControlFlow::whileStmt, "while_statement");
        stmt(ControlFlow::doStmt, "do_statement");
        stmt(JavaProfile::forStatement, "for_statement");
        stmt(JavaProfile::enhancedFor, "enhanced_for_statement");
        stmt(Definitions::functionDef, "method_declaration");
        stmt(JavaProfile::constructor, "constructor_declaration");
        stmt(Definitions::classDef, "class_declaration", "record_declaration");
        stmt(JavaProfile::interfaceDeclaration, "interface_declaration");
        stmt(JavaProfile::enumDeclaration, "enum_declaration");
        stmt(Statements::throwStmt, "throw_statement");
        stmt(ControlFlow::breakStmt, "break_statement");
        stmt(ControlFlow::continueStmt, "continue_statement");
        stmt(JavaProfile::switchStatement, "switch_expression");
        stmt(JavaProfile::tryStatement, "try_statement", "try_with_resources_statement");
        stmt((ctx, n) -> ctx.lowerChildren(n), "block", "program", "static_initializer");
        stmt(JavaProfile::yieldStatement, "yield_statement");
        ignore("import_declaration", "package_declaration", "modifiers", "marker_annotation", "annotation",
                "empty_statement");
    }

    @Override
    public @Nullable String paramName(LoweringContext ctx, SyntaxNode param) {
        if (param.getType().equals("spread_parameter")) {
            SyntaxNode declarator = Nodes.firstChildOfType(param, "variable_declarator");
            SyntaxNode name = declarator != null ? declarator.getChildByFieldName("name") : null;
            return name != null ? ctx.text(name) : null;
        }
        if (param.getType().equals("receiver_parameter")) {
            return null;
        }
        return super.paramName(ctx, param);
    }

    /**
     * Lower {@code obj.name(args)} as a method call, and {@code name(args)} as a function call.
     */
    static Reg methodInvocation(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode object = node.getChildByFieldName("object");
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode args = node.getChildByFieldName("arguments");
        if (name == null) {
            ctx.malformed(node, "method invocation without a name");
            return Expressions.constLiteral(ctx, node);
        }
        if (object != null) {
            Reg receiver = ctx.lowerExpr(object);
            return Expressions.callMethod(ctx, node, receiver, ctx.text(name), Expressions.callArgs(ctx, args));
        }
        return Expressions.callFunction(ctx, node, ctx.text(name), Expressions.callArgs(ctx, args));
    }

    static Reg objectCreation(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode type = node.getChildByFieldName("type");
        return Expressions.construct(ctx, node, type != null ? ctx.text(type) : "Object",
                node.getChildByFieldName("arguments"));
    }

    /**
     * Lower {@code new T[n]} as an array of the given size, and {@code new T[] {...}} as its initializer.
     */
    static Reg arrayCreation(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode init = node.getChildByFieldName("value");
        if (init == null) init = Nodes.firstChildOfType(node, "array_initializer");
        if (init != null) {
            return ctx.lowerExpr(init);
        }
        SyntaxNode dims = Nodes.firstChildOfType(node, "dimensions_expr");
        SyntaxNode size = dims != null ? Nodes.firstNamedChild(dims) : null;
        Reg sizeReg = size != null ? ctx.lowerExpr(size) : ctx.constant("0");
        return ctx.produce(Opcode.NEW_ARRAY, ctx.loc(node), "array", sizeReg);
    }

    static Reg cast(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        if (value == null) {
            List<SyntaxNode> named = node.getNamedChildren();
            value = named.isEmpty() ? null : named.get(named.size() - 1);
        }
        return ctx.lowerExpr(value);
    }

    static Reg instanceOf(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode left = node.getChildByFieldName("left");
        SyntaxNode right = node.getChildByFieldName("right");
        List<SyntaxNode> named = node.getNamedChildren();
        if (left == null && !named.isEmpty()) left = named.get(0);
        if (right == null && named.size() > 1) right = named.get(1);
        Reg obj = ctx.lowerExpr(left);
        Reg type = ctx.constant(right != null ? ctx.text(right) : "Object", ctx.loc(right));
        return Expressions.callFunction(ctx, node, "instanceof", Arrays.asList(obj, type));
    }

    static Reg methodReference(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> children = node.getChildren();
        if (children.size() < 2) {
            ctx.malformed(node, "expected a receiver and a method");
            return Expressions.constLiteral(ctx, node);
        }
        Reg obj = ctx.lowerExpr(children.get(0));
        return ctx.produce(Opcode.LOAD_FIELD, ctx.loc(node), obj, ctx.text(children.get(children.size() - 1)));
    }

    static Reg classLiteral(LoweringContext ctx, SyntaxNode node) {
        Reg type = ctx.lowerExpr(Nodes.firstNamedChild(node));
        return ctx.produce(Opcode.LOAD_FIELD, ctx.loc(node), type, "class");
    }

    static void localVariable(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode declarator : Nodes.childrenOfType(node, "variable_declarator")) {
            Statements.declarator(ctx, node, declarator, "name", "value");
        }
    }

    /**
     * Lower a field declaration. Only fields with an initializer produce IR.
     */
    static void fieldDeclaration(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode declarator : Nodes.childrenOfType(node, "variable_declarator")) {
            SyntaxNode name = declarator.getChildByFieldName("name");
            SyntaxNode value = declarator.getChildByFieldName("value");
            if (name != null && value != null) {
                ctx.storeVar(ctx.text(name), ctx.lowerExpr(value), ctx.loc(declarator));
            }
        }
    }

    /**
     * Lower {@code for (init; cond; update)}, where init and update may each be several expressions.
     */
    static void forStatement(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> updates = node.getChildrenByFieldName("update");
        for (SyntaxNode init : node.getChildrenByFieldName("init")) {
            if (init.getType().equals("local_variable_declaration")) {
                ctx.lowerStmt(init);
            } else {
                ctx.lowerExpr(init);
            }
        }
        SyntaxNode body = node.getChildByFieldName("body");
        ControlFlow.cStyleFor(ctx, node, null, node.getChildByFieldName("condition"),
                updates.isEmpty() ? null : () -> {
                    for (SyntaxNode update : updates) ctx.lowerExpr(update);
                },
                () -> ctx.lowerBlock(body));
    }

    static void enhancedFor(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        ControlFlow.forEach(ctx, node, name, node.getChildByFieldName("value"), body);
    }

    static void constructor(LoweringContext ctx, SyntaxNode node) {
        Definitions.function(ctx, node, "__init__",
                node.getChildByFieldName("parameters"), node.getChildByFieldName("body"));
    }

    /**
     * Lower an interface as an object mapping each member name to its position.
     */
    static void interfaceDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        String typeName = name != null ? ctx.text(name) : "__anon";
        List<String> members = new ArrayList<>();
        if (body != null) {
            for (SyntaxNode member : body.getNamedChildren()) {
                SyntaxNode memberName = member.getChildByFieldName("name");
                if (memberName != null) members.add(ctx.text(memberName));
            }
        }
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), "interface:" + typeName);
        for (int i = 0; i < members.size(); i++) {
            Reg key = ctx.constant(members.get(i));
            Reg position = ctx.constant(String.valueOf(i));
            ctx.consume(Opcode.STORE_INDEX, ctx.loc(node), obj, key, position);
        }
        ctx.storeVar(typeName, obj, ctx.loc(node));
    }

    static void enumDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        List<String> members = new ArrayList<>();
        if (body != null) {
            for (SyntaxNode constant : Nodes.childrenOfType(body, "enum_constant")) {
                SyntaxNode constantName = constant.getChildByFieldName("name");
                members.add(ctx.text(constantName != null ? constantName : constant));
            }
        }
        Definitions.enumDef(ctx, node, name != null ? ctx.text(name) : "__anon", members);
    }

    /**
     * The arms of a switch, from either {@code case x:} groups or {@code case x ->} rules.
     */
    private static List<SyntaxNode> switchArms(@Nullable SyntaxNode body) {
        if (body == null) return Collections.emptyList();
        return Nodes.childrenOfType(body, "switch_block_statement_group", "switch_rule");
    }

    private static List<SyntaxNode> caseValues(SyntaxNode arm) {
        List<SyntaxNode> values = new ArrayList<>();
        for (SyntaxNode label : Nodes.childrenOfType(arm, "switch_label")) {
            values.addAll(label.getNamedChildren());
        }
        return values;
    }

    private static List<SyntaxNode> armBody(SyntaxNode arm) {
        List<SyntaxNode> body = new ArrayList<>();
        for (SyntaxNode child : arm.getNamedChildren()) {
            if (!child.getType().equals("switch_label")) body.add(child);
        }
        return body;
    }

    static void switchStatement(LoweringContext ctx, SyntaxNode node) {
        Reg subject = ctx.lowerExpr(node.getChildByFieldName("condition"));
        List<ControlFlow.Case> cases = new ArrayList<>();
        for (SyntaxNode arm : switchArms(node.getChildByFieldName("body"))) {
            List<SyntaxNode> body = armBody(arm);
            cases.add(new ControlFlow.Case(caseValues(arm), () -> ctx.lowerStatements(body)));
        }
        ControlFlow.switchChain(ctx, node, subject, cases, "==");
    }

    /**
     * Lower a switch used for its value. An arm's value is its expression, or the value of a
     * {@code yield} in its block.
     */
    static Reg switchExpression(LoweringContext ctx, SyntaxNode node) {
        Reg subject = ctx.lowerExpr(node.getChildByFieldName("condition"));
        List<List<SyntaxNode>> values = new ArrayList<>();
        List<Supplier<Reg>> results = new ArrayList<>();
        for (SyntaxNode arm : switchArms(node.getChildByFieldName("body"))) {
            values.add(caseValues(arm));
            List<SyntaxNode> body = armBody(arm);
            results.add(() -> armValue(ctx, body));
        }
        return ControlFlow.switchValue(ctx, node, subject, values, results, "==", false);
    }

    private static Reg armValue(LoweringContext ctx, List<SyntaxNode> body) {
        Reg value = null;
        for (SyntaxNode stmt : body) {
            if (stmt.getType().equals("expression_statement")) {
                value = ctx.lowerExpr(Nodes.firstNamedChild(stmt));
            } else if (stmt.getType().equals("yield_statement")) {
                value = ctx.lowerExpr(Nodes.firstNamedChild(stmt));
            } else if (stmt.getType().equals("block")) {
                for (SyntaxNode inner : stmt.getNamedChildren()) {
                    if (inner.getType().equals("yield_statement")) {
                        value = ctx.lowerExpr(Nodes.firstNamedChild(inner));
                    } else {
                        ctx.lowerStmt(inner);
                    }
                }
            } else if (ctx.profile.statementHandler(stmt.getType()) != null) {
                ctx.lowerStmt(stmt);
            } else {
                value = ctx.lowerExpr(stmt);
            }
        }
        return value != null ? value : ctx.constant(ctx.profile.literals.none());
    }

    static void yieldStatement(LoweringContext ctx, SyntaxNode node) {
        ctx.lowerExpr(Nodes.firstNamedChild(node));
    }

    static void tryStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode resources = node.getChildByFieldName("resources");
        if (resources != null) {
            for (SyntaxNode resource : Nodes.childrenOfType(resources, "resource")) {
                SyntaxNode name = resource.getChildByFieldName("name");
                SyntaxNode value = resource.getChildByFieldName("value");
                if (name != null && value != null) {
                    ctx.storeVar(ctx.text(name), ctx.lowerExpr(value), ctx.loc(resource));
                } else {
                    ctx.lowerExpr(Nodes.firstNamedChild(resource));
                }
            }
        }
        SyntaxNode body = node.getChildByFieldName("body");
        List<ControlFlow.CatchClause> catches = new ArrayList<>();
        for (SyntaxNode clause : Nodes.childrenOfType(node, "catch_clause")) {
            SyntaxNode param = Nodes.firstChildOfType(clause, "catch_formal_parameter");
            String variable = null;
            String type = null;
            if (param != null) {
                SyntaxNode name = param.getChildByFieldName("name");
                variable = name != null ? ctx.text(name) : null;
                for (SyntaxNode child : param.getNamedChildren()) {
                    if (child != name && !child.getType().equals("modifiers")) {
                        type = ctx.text(child);
                        break;
                    }
                }
            }
            SyntaxNode clauseBody = clause.getChildByFieldName("body");
            catches.add(new ControlFlow.CatchClause(variable, type, () -> ctx.lowerBlock(clauseBody)));
        }
        SyntaxNode finallyClause = Nodes.firstChildOfType(node, "finally_clause");
        SyntaxNode finallyBody = finallyClause == null ? null
                : Nodes.fieldOrType(finallyClause, "body", "block");
        ControlFlow.tryCatch(ctx, node, () -> ctx.lowerBlock(body), catches,
                finallyBody == null ? null : () -> ctx.lowerBlock(finallyBody), null);
    }
}
