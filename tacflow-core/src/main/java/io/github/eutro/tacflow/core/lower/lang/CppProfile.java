package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.lower.*;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The profile of C++, extending {@link CProfile} with classes, namespaces, templates, lambdas,
 * exceptions and range-based loops.
 */
public class CppProfile extends CProfile {
    private static final int SYMBOLIC_TEXT_LIMIT = 40;

    public CppProfile() {
        super("cpp");
        literals.setNone("nullptr");
        blockTypes.add("declaration_list");
        identifierTypes.addAll(Arrays.asList("qualified_identifier", "template_function", "this", "namespace_identifier"));

        expr(Expressions::identifier, "qualified_identifier", "template_function", "this");
        expr(Expressions::constLiteral, "nullptr", "user_defined_literal", "raw_string_literal");
        expr(Expressions::unwrap, "condition_clause");
        expr(CppProfile::newExpression, "new_expression");
        expr(CppProfile::deleteExpression, "delete_expression");
        expr(CppProfile::lambda, "lambda_expression");
        expr(CppProfile::throwExpression, "throw_expression");
        expr(CppProfile::namedCast, "static_cast_expression", "dynamic_cast_expression",
                "reinterpret_cast_expression", "const_cast_expression");

        stmt(CppProfile::classSpecifier, "class_specifier");
        stmt(CppProfile::namespace, "namespace_definition");
        stmt(CppProfile::template, "template_declaration");
        stmt(CppProfile::tryStatement, "try_statement");
        stmt(Statements::throwStmt, "throw_statement");
        stmt(CppProfile::rangeFor, "for_range_loop");
        ignore("using_declaration", "access_specifier", "alias_declaration",
                "static_assert_declaration", "friend_declaration");
    }

    /**
     * Lower {@code new T(args)} as a construction of {@code T}.
     */
    static Reg newExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode type = node.getChildByFieldName("type");
        SyntaxNode args = node.getChildByFieldName("arguments");
        return Expressions.construct(ctx, node, type != null ? ctx.text(type) : "__unknown", args);
    }

    static Reg deleteExpression(LoweringContext ctx, SyntaxNode node) {
        String text = ctx.text(node);
        if (text.length() > SYMBOLIC_TEXT_LIMIT) text = text.substring(0, SYMBOLIC_TEXT_LIMIT);
        return ctx.symbolic("delete:" + text, ctx.loc(node));
    }

    /**
     * Lower a lambda, whose parameters sit in its declarator. Captures are not represented.
     */
    static Reg lambda(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode declarator = node.getChildByFieldName("declarator");
        SyntaxNode params = declarator != null ? declarator.getChildByFieldName("parameters") : null;
        SyntaxNode body = node.getChildByFieldName("body");
        return Definitions.lambda(ctx, node,
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> {
                    if (body == null || body.getType().equals("compound_statement")) {
                        ctx.lowerBlock(body);
                        return null;
                    }
                    return ctx.lowerExpr(body);
                });
    }

    static Reg throwExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = Nodes.firstNamedChild(node);
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
        ctx.consume(Opcode.THROW, ctx.loc(node), reg);
        return reg;
    }

    static Reg namedCast(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        if (value == null) value = Nodes.firstChildOfType(node, "argument_list", "parenthesized_expression");
        return value != null ? Expressions.paren(ctx, value) : Expressions.constLiteral(ctx, node);
    }

    /**
     * Lower a class. Method prototypes are skipped, data members become fields of {@code this}.
     */
    static void classSpecifier(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        if (body == null) return;
        Definitions.classBody(ctx, node, name != null ? ctx.text(name) : "__anon_class",
                () -> recordBody(ctx, body));
    }

    static void namespace(LoweringContext ctx, SyntaxNode node) {
        ctx.lowerBlock(node.getChildByFieldName("body"));
    }

    /**
     * Lower the declaration of a template, ignoring its parameters.
     */
    static void template(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode inner = null;
        for (SyntaxNode child : node.getNamedChildren()) {
            if (!child.getType().equals("template_parameter_list")) inner = child;
        }
        if (inner != null) {
            ctx.lowerStmt(inner);
        } else {
            String text = ctx.text(node);
            if (text.length() > SYMBOLIC_TEXT_LIMIT) text = text.substring(0, SYMBOLIC_TEXT_LIMIT);
            ctx.symbolic("template:" + text, ctx.loc(node));
        }
    }

    static void tryStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        List<ControlFlow.CatchClause> catches = new ArrayList<>();
        for (SyntaxNode clause : Nodes.childrenOfType(node, "catch_clause")) {
            String variable = null;
            String type = null;
            SyntaxNode params = clause.getChildByFieldName("parameters");
            SyntaxNode param = params != null ? Nodes.firstChildOfType(params, "parameter_declaration") : null;
            if (param != null) {
                SyntaxNode typeNode = param.getChildByFieldName("type");
                SyntaxNode declarator = param.getChildByFieldName("declarator");
                if (typeNode != null) type = ctx.text(typeNode);
                if (declarator != null) variable = declaratorName(ctx, declarator);
            }
            SyntaxNode clauseBody = clause.getChildByFieldName("body");
            catches.add(new ControlFlow.CatchClause(variable, type, () -> ctx.lowerBlock(clauseBody)));
        }
        ControlFlow.tryCatch(ctx, node, () -> ctx.lowerBlock(body), catches, null, null);
    }

    /**
     * Lower {@code for (auto x : xs)} as an index-based loop over {@code xs}.
     */
    static void rangeFor(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode declarator = node.getChildByFieldName("declarator");
        SyntaxNode right = node.getChildByFieldName("right");
        SyntaxNode body = node.getChildByFieldName("body");
        Reg collection = ctx.lowerExpr(right);
        ControlFlow.forEach(ctx, node, "range_for", collection,
                (idx, elem) -> {
                    if (declarator != null) {
                        ctx.storeVar(declaratorName(ctx, declarator), elem, ctx.loc(declarator));
                    } else {
                        ctx.malformed(node, "range loop without a declarator");
                    }
                },
                () -> ctx.lowerBlock(body));
    }
}
