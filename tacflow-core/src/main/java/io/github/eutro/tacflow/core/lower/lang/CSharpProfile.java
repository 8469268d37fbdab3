package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.ir.SourceLocation;
import io.github.eutro.tacflow.core.lower.*;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The profile of C#.
 * <p>
 * Class members are lowered methods first, so that method references are bound before any field
 * initializer that calls them.
 */
public class CSharpProfile extends LanguageProfile {
    private static final Set<String> INTERPOLATION_NOISE = new HashSet<>(Arrays.asList(
            "interpolation_brace",
            "interpolation_format_clause",
            "interpolation_alignment_clause"));
    private static final Set<String> METHOD_TYPES = new HashSet<>(Arrays.asList("method_declaration", "constructor_declaration"));

    public CSharpProfile() {
        super("csharp");
        literals.setNone("null");
        literals.setTrueValue("true");
        literals.setFalseValue("false");
        literals.setDefaultReturn("null");
        fields.setAttrObject("expression");
        fields.setAttrAttribute("name");
        fields.setSubscriptValue("expression");
        fields.setSubscriptIndex("subscript");
        noiseTypes.add("using_directive");
        blockTypes.addAll(Arrays.asList("block", "compilation_unit", "declaration_list"));
        identifierTypes.addAll(Arrays.asList("this_expression", "this", "type_identifier", "predefined_type"));
        subscriptTypes.add("element_access_expression");

        expr(Expressions::identifier, "identifier", "this_expression", "this", "type_identifier", "predefined_type");
        expr(Expressions::constLiteral, "integer_literal", "real_literal", "string_literal", "character_literal",
                "verbatim_string_literal", "raw_string_literal", "constant_pattern");
        expr(CSharpProfile::bool, "boolean_literal");
        expr(Expressions::canonicalNone, "null_literal");
        expr(Expressions::binop, "binary_expression");
        expr(CSharpProfile::prefixUnary, "prefix_unary_expression");
        expr(Expressions::updateExpr, "postfix_unary_expression");
        expr(Expressions::paren, "parenthesized_expression");
        expr(Expressions::call, "invocation_expression");
        expr(CSharpProfile::objectCreation, "object_creation_expression");
        expr(CSharpProfile::implicitObjectCreation, "implicit_object_creation_expression");
        expr(Expressions::attribute, "member_access_expression");
        expr(Expressions::subscript, "element_access_expression");
        expr((ctx, n) -> Expressions.array(ctx, n, "list", Expressions.elements(ctx, n)), "initializer_expression");
        expr(Statements::anyAssignmentExpr, "assignment_expression");
        expr(CSharpProfile::cast, "cast_expression");
        expr(Expressions::conditional, "conditional_expression");
        expr(CSharpProfile::interpolatedString, "interpolated_string_expression");
        expr(CSharpProfile::typeOf, "typeof_expression");
        expr(CSharpProfile::isCheck, "is_expression", "is_pattern_expression");
        expr(CSharpProfile::as, "as_expression");
        expr(CSharpProfile::declarationPattern, "declaration_pattern");
        expr(Definitions::lambda, "lambda_expression");
        expr(CSharpProfile::arrayCreation, "array_creation_expression", "implicit_array_creation_expression");
        expr(CSharpProfile::await, "await_expression");
        expr(CSharpProfile::switchExpression, "switch_expression");
        expr(CSharpProfile::conditionalAccess, "conditional_access_expression");
        expr(CSharpProfile::memberBinding, "member_binding_expression");
        expr(CSharpProfile::tuple, "tuple_expression");
        expr(CSharpProfile::query, "query_expression");
        expr(CSharpProfile::lastOfChildren, "from_clause", "select_clause", "where_clause");

        stmt(Statements::expressionStatement, "expression_statement");
        stmt(CSharpProfile::localDeclaration, "local_declaration_statement", "field_declaration",
                "event_field_declaration");
        stmt(CSharpProfile::variableDeclaration, "variable_declaration");
        stmt(Statements::ret, "return_statement");
        stmt(ControlFlow::ifStmt, "if_statement");
        stmt(ControlFlow::whileStmt, "while_statement");
        stmt(ControlFlow::doStmt, "do_statement");
        stmt(CSharpProfile::forStatement, "for_statement");
        stmt(CSharpProfile::foreach, "foreach_statement");
        stmt(Definitions::functionDef, "method_declaration", "local_function_statement");
        stmt(CSharpProfile::constructor, "constructor_declaration");
        stmt(CSharpProfile::classDeclaration, "class_declaration", "struct_declaration", "record_declaration",
                "record_struct_declaration");
        stmt(JavaProfile::interfaceDeclaration, "interface_declaration");
        stmt(CSharpProfile::enumDeclaration, "enum_declaration");
        stmt(CSharpProfile::namespace, "namespace_declaration", "file_scoped_namespace_declaration");
        stmt(Statements::throwStmt, "throw_statement");
        stmt((ctx, n) -> ctx.lowerChildren(n), "block", "global_statement", "compilation_unit",
                "declaration_list", "checked_statement", "fixed_statement", "unsafe_statement");
        stmt(CSharpProfile::switchStatement, "switch_statement");
        stmt(CSharpProfile::tryStatement, "try_statement");
        stmt(CSharpProfile::propertyDeclaration, "property_declaration");
        stmt(ControlFlow::breakStmt, "break_statement");
        stmt(ControlFlow::continueStmt, "continue_statement");
        stmt(CSharpProfile::lock, "lock_statement");
        stmt(CSharpProfile::using, "using_statement");
        stmt(CSharpProfile::event, "event_declaration");
        stmt(CSharpProfile::delegate, "delegate_declaration");
        stmt(CSharpProfile::yield, "yield_statement");
        ignore("modifier", "attribute_list", "empty_statement");
    }

    @Override
    public @Nullable Pair<SyntaxNode, SyntaxNode> subscriptParts(SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName(fields.subscriptValue());
        SyntaxNode brackets = Nodes.fieldOrType(node, fields.subscriptIndex(), "bracketed_argument_list");
        if (value == null || brackets == null) {
            return super.subscriptParts(node);
        }
        SyntaxNode index = brackets;
        if (brackets.getType().equals("bracketed_argument_list")) {
            SyntaxNode arg = Nodes.firstNamedChild(brackets);
            if (arg == null) return null;
            index = arg;
        }
        if (index.getType().equals("argument")) {
            SyntaxNode inner = Nodes.firstNamedChild(index);
            if (inner != null) index = inner;
        }
        return Pair.of(value, index);
    }

    static Reg bool(LoweringContext ctx, SyntaxNode node) {
        return ctx.text(node).equals("true")
                ? Expressions.canonicalTrue(ctx, node)
                : Expressions.canonicalFalse(ctx, node);
    }

    static Reg prefixUnary(LoweringContext ctx, SyntaxNode node) {
        String text = ctx.text(node);
        if (text.startsWith("++") || text.startsWith("--")) {
            return Expressions.updateExpr(ctx, node);
        }
        return Expressions.unop(ctx, node);
    }

    static Reg objectCreation(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode type = node.getChildByFieldName("type");
        return Expressions.construct(ctx, node, type != null ? ctx.text(type) : "Object",
                node.getChildByFieldName("arguments"));
    }

    /**
     * Lower target-typed {@code new(...)}, whose class is not known from the expression.
     */
    static Reg implicitObjectCreation(LoweringContext ctx, SyntaxNode node) {
        return Expressions.construct(ctx, node, "__implicit",
                Nodes.fieldOrType(node, "arguments", "argument_list"));
    }

    static Reg cast(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        if (value != null) return ctx.lowerExpr(value);
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.size() >= 2) return ctx.lowerExpr(named.get(named.size() - 1));
        return Expressions.constLiteral(ctx, node);
    }

    /**
     * Lower {@code $"a{x}b"}. Format and alignment clauses are dropped.
     */
    static Reg interpolatedString(LoweringContext ctx, SyntaxNode node) {
        if (!Nodes.hasChildOfType(node, "interpolation")) {
            return Expressions.constLiteral(ctx, node);
        }
        List<Reg> parts = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (child.getType().equals("string_content")) {
                parts.add(ctx.constant(ctx.text(child), ctx.loc(child)));
            } else if (child.getType().equals("interpolation")) {
                for (SyntaxNode inner : child.getNamedChildren()) {
                    if (!INTERPOLATION_NOISE.contains(inner.getType())) {
                        parts.add(ctx.lowerExpr(inner));
                        break;
                    }
                }
            }
        }
        return Expressions.concat(ctx, node, parts);
    }

    static Reg typeOf(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode type = Nodes.firstNamedChild(node);
        Reg typeReg = ctx.constant(type != null ? ctx.text(type) : "Object");
        return Expressions.callFunction(ctx, node, "typeof", Collections.singletonList(typeReg));
    }

    /**
     * Lower {@code x is T} and {@code x is pattern} as {@code is_check(x, "T")}.
     */
    static Reg isCheck(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        Reg obj = ctx.lowerExpr(named.isEmpty() ? null : named.get(0));
        Reg type = ctx.constant(named.size() > 1 ? ctx.text(named.get(1)) : "Object");
        return Expressions.callFunction(ctx, node, "is_check", Arrays.asList(obj, type));
    }

    static Reg as(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode operand = Nodes.firstNamedChild(node);
        return operand != null ? ctx.lowerExpr(operand) : Expressions.constLiteral(ctx, node);
    }

    /**
     * Lower a pattern {@code T name}, binding the type tag to the name.
     */
    static Reg declarationPattern(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        Reg type = ctx.constant(named.isEmpty() ? "Object" : ctx.text(named.get(0)));
        if (named.size() > 1) {
            ctx.storeVar(ctx.text(named.get(1)), type, ctx.loc(node));
        }
        return type;
    }

    static Reg arrayCreation(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode init = Nodes.fieldOrType(node, "initializer", "initializer_expression");
        if (init != null) {
            return Expressions.array(ctx, node, "array", Expressions.elements(ctx, init));
        }
        SyntaxNode size = null;
        SyntaxNode type = Nodes.fieldOrType(node, "type", "array_type");
        SyntaxNode rank = type != null ? Nodes.firstChildOfType(type, "array_rank_specifier") : null;
        if (rank != null) size = Nodes.firstNamedChild(rank);
        Reg sizeReg = size != null ? ctx.lowerExpr(size) : ctx.symbolic("unknown_size", ctx.loc(node));
        return ctx.produce(Opcode.NEW_ARRAY, ctx.loc(node), "array", sizeReg);
    }

    static Reg await(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode operand = Nodes.firstNamedChild(node);
        Reg value = operand != null ? ctx.lowerExpr(operand) : ctx.constant(ctx.profile.literals.none());
        return Expressions.callFunction(ctx, node, "await", Collections.singletonList(value));
    }

    /**
     * Lower {@code x switch { p => v, _ => d }}. A discard pattern is the default arm.
     */
    static Reg switchExpression(LoweringContext ctx, SyntaxNode node) {
        Reg subject = ctx.lowerExpr(Nodes.firstNamedChild(node));
        List<List<SyntaxNode>> values = new ArrayList<>();
        List<Supplier<Reg>> results = new ArrayList<>();
        for (SyntaxNode arm : Nodes.childrenOfType(node, "switch_expression_arm")) {
            List<SyntaxNode> parts = arm.getNamedChildren();
            if (parts.size() < 2) {
                ctx.malformed(arm, "expected a pattern and a value");
                continue;
            }
            SyntaxNode pattern = parts.get(0);
            SyntaxNode value = parts.get(parts.size() - 1);
            boolean discard = pattern.getType().equals("discard") || ctx.text(pattern).equals("_");
            values.add(discard ? Collections.emptyList() : Collections.singletonList(pattern));
            results.add(() -> ctx.lowerExpr(value));
        }
        return ControlFlow.switchValue(ctx, node, subject, values, results, "==");
    }

    /**
     * Lower {@code x?.y} as a plain field load.
     */
    static Reg conditionalAccess(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.size() < 2) {
            return Expressions.constLiteral(ctx, node);
        }
        Reg obj = ctx.lowerExpr(named.get(0));
        SyntaxNode binding = named.get(1);
        String field;
        if (binding.getType().equals("member_binding_expression")) {
            SyntaxNode name = Nodes.firstChildOfType(binding, "identifier");
            field = name != null ? ctx.text(name) : "unknown";
        } else {
            field = ctx.text(binding);
        }
        return ctx.produce(Opcode.LOAD_FIELD, ctx.loc(node), obj, field);
    }

    static Reg memberBinding(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = Nodes.firstChildOfType(node, "identifier");
        return ctx.symbolic("member_binding:" + (name != null ? ctx.text(name) : "unknown"), ctx.loc(node));
    }

    static Reg tuple(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> elems = new ArrayList<>();
        for (SyntaxNode arg : Nodes.childrenOfType(node, "argument")) {
            SyntaxNode inner = Nodes.firstNamedChild(arg);
            elems.add(inner != null ? inner : arg);
        }
        return Expressions.array(ctx, node, "tuple", elems);
    }

    static Reg query(LoweringContext ctx, SyntaxNode node) {
        return Expressions.callFunction(ctx, node, "linq_query",
                Statements.lowerAll(ctx, Expressions.elements(ctx, node)));
    }

    static Reg lastOfChildren(LoweringContext ctx, SyntaxNode node) {
        List<Reg> regs = Statements.lowerAll(ctx, Expressions.elements(ctx, node));
        return regs.isEmpty() ? Expressions.constLiteral(ctx, node) : regs.get(regs.size() - 1);
    }

    static void localDeclaration(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode decl : Nodes.childrenOfType(node, "variable_declaration")) {
            variableDeclaration(ctx, decl);
        }
    }

    /**
     * Lower each declarator of a declaration. A declarator without a value is bound to null.
     */
    static void variableDeclaration(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode declarator : Nodes.childrenOfType(node, "variable_declarator")) {
            SyntaxNode name = Nodes.fieldOrType(declarator, "name", "identifier");
            if (name == null) {
                ctx.malformed(declarator, "declarator without a name");
                continue;
            }
            SyntaxNode value = initializer(declarator);
            Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
            ctx.storeVar(ctx.text(name), reg, ctx.loc(declarator));
        }
    }

    /**
     * Find the value after {@code =} in a declarator or property.
     */
    private static @Nullable SyntaxNode initializer(SyntaxNode node) {
        boolean afterEquals = false;
        for (SyntaxNode child : node.getChildren()) {
            if (child.getType().equals("equals_value_clause")) {
                return Nodes.firstNamedChild(child);
            }
            if (child.getType().equals("=")) {
                afterEquals = true;
            } else if (afterEquals && child.isNamed() && !child.getType().equals("accessor_list")) {
                return child;
            }
        }
        return null;
    }

    static void forStatement(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode init : node.getChildrenByFieldName("initializer")) {
            if (init.getType().equals("variable_declaration")) {
                variableDeclaration(ctx, init);
            } else {
                ctx.lowerExpr(init);
            }
        }
        List<SyntaxNode> updates = node.getChildrenByFieldName("update");
        SyntaxNode body = node.getChildByFieldName("body");
        ControlFlow.cStyleFor(ctx, node, null, node.getChildByFieldName("condition"),
                updates.isEmpty() ? null : () -> {
                    for (SyntaxNode update : updates) ctx.lowerExpr(update);
                },
                () -> ctx.lowerBlock(body));
    }

    static void foreach(LoweringContext ctx, SyntaxNode node) {
        ControlFlow.forEach(ctx, node,
                node.getChildByFieldName("left"),
                node.getChildByFieldName("right"),
                node.getChildByFieldName("body"));
    }

    static void constructor(LoweringContext ctx, SyntaxNode node) {
        Definitions.function(ctx, node, "__init__",
                node.getChildByFieldName("parameters"),
                node.getChildByFieldName("body"));
    }

    static void classDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        Definitions.classBody(ctx, node, name != null ? ctx.text(name) : "__anon_class", () -> {
            if (body == null) return;
            List<SyntaxNode> methods = new ArrayList<>();
            List<SyntaxNode> rest = new ArrayList<>();
            for (SyntaxNode member : body.getNamedChildren()) {
                (METHOD_TYPES.contains(member.getType()) ? methods : rest).add(member);
            }
            ctx.lowerStatements(methods);
            ctx.lowerStatements(rest);
        });
    }

    static void enumDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        if (name == null) {
            ctx.malformed(node, "enum without a name");
            return;
        }
        SyntaxNode body = Nodes.fieldOrType(node, "body", "enum_member_declaration_list");
        List<String> members = new ArrayList<>();
        if (body != null) {
            for (SyntaxNode member : Nodes.childrenOfType(body, "enum_member_declaration")) {
                SyntaxNode memberName = member.getChildByFieldName("name");
                members.add(ctx.text(memberName != null ? memberName : member));
            }
        }
        Definitions.enumDef(ctx, node, ctx.text(name), members);
    }

    static void namespace(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        if (body != null) {
            ctx.lowerBlock(body);
            return;
        }
        for (SyntaxNode child : node.getNamedChildren()) {
            if (child != node.getChildByFieldName("name")) ctx.lowerStmt(child);
        }
    }

    /**
     * Lower a property as a store of its initializer, or null, to a field of {@code this}. Accessor
     * bodies are lowered inline.
     */
    static void propertyDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        if (name == null) return;
        SyntaxNode value = initializer(node);
        Reg self = ctx.loadVar("this", SourceLocation.UNKNOWN);
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
        ctx.consume(Opcode.STORE_FIELD, ctx.loc(node), self, ctx.text(name), reg);
        SyntaxNode accessors = Nodes.fieldOrType(node, "accessors", "accessor_list");
        if (accessors != null) {
            for (SyntaxNode accessor : Nodes.childrenOfType(accessors, "accessor_declaration")) {
                SyntaxNode block = Nodes.fieldOrType(accessor, "body", "block");
                if (block != null) ctx.lowerBlock(block);
            }
        }
    }

    static void switchStatement(LoweringContext ctx, SyntaxNode node) {
        Reg subject = ctx.lowerExpr(node.getChildByFieldName("value"));
        SyntaxNode body = node.getChildByFieldName("body");
        List<ControlFlow.Case> cases = new ArrayList<>();
        if (body != null) {
            for (SyntaxNode section : Nodes.childrenOfType(body, "switch_section")) {
                List<SyntaxNode> values = new ArrayList<>();
                List<SyntaxNode> stmts = new ArrayList<>();
                for (SyntaxNode child : section.getNamedChildren()) {
                    switch (child.getType()) {
                        case "constant_pattern":
                            SyntaxNode inner = Nodes.firstNamedChild(child);
                            values.add(inner != null ? inner : child);
                            break;
                        case "case_switch_label":
                            SyntaxNode value = Nodes.firstNamedChild(child);
                            if (value != null) values.add(value);
                            break;
                        case "default_switch_label":
                            break;
                        default:
                            stmts.add(child);
                    }
                }
                Runnable lowerBody = () -> ctx.lowerStatements(stmts);
                cases.add(values.isEmpty()
                        ? ControlFlow.Case.otherwise(lowerBody)
                        : new ControlFlow.Case(values, lowerBody));
            }
        }
        ControlFlow.switchChain(ctx, node, subject, cases, "==");
    }

    static void tryStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        List<ControlFlow.CatchClause> catches = new ArrayList<>();
        for (SyntaxNode clause : Nodes.childrenOfType(node, "catch_clause")) {
            SyntaxNode decl = Nodes.firstChildOfType(clause, "catch_declaration");
            String variable = null;
            String type = null;
            if (decl != null) {
                SyntaxNode typeNode = Nodes.fieldOrType(decl, "type", "identifier", "qualified_name", "generic_name");
                SyntaxNode nameNode = decl.getChildByFieldName("name");
                if (nameNode == null) {
                    for (SyntaxNode child : Nodes.childrenOfType(decl, "identifier")) {
                        if (child != typeNode) nameNode = child;
                    }
                }
                type = typeNode != null ? ctx.text(typeNode) : null;
                variable = nameNode != null ? ctx.text(nameNode) : null;
            }
            SyntaxNode clauseBody = Nodes.fieldOrType(clause, "body", "block");
            catches.add(new ControlFlow.CatchClause(variable, type, () -> ctx.lowerBlock(clauseBody)));
        }
        SyntaxNode finallyClause = Nodes.firstChildOfType(node, "finally_clause");
        SyntaxNode finallyBody = finallyClause != null ? Nodes.firstChildOfType(finallyClause, "block") : null;
        ControlFlow.tryCatch(ctx, node, () -> ctx.lowerBlock(body), catches,
                finallyClause == null ? null : () -> ctx.lowerBlock(finallyBody), null);
    }

    static void lock(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode child : node.getNamedChildren()) {
            if (child.getType().equals("block")) {
                ctx.lowerBlock(child);
            } else if (!ctx.profile.isSkipped(child.getType())) {
                ctx.lowerStmt(child);
            }
        }
    }

    static void using(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode child : node.getNamedChildren()) {
            switch (child.getType()) {
                case "variable_declaration":
                    variableDeclaration(ctx, child);
                    break;
                case "block":
                    ctx.lowerBlock(child);
                    break;
                default:
                    ctx.lowerStmt(child);
            }
        }
    }

    static void event(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        if (name == null) return;
        String eventName = ctx.text(name);
        ctx.storeVar(eventName, ctx.constant("event:" + eventName), ctx.loc(node));
    }

    /**
     * Lower a delegate type as a function with an empty body.
     */
    static void delegate(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        Definitions.function(ctx, node, name != null ? ctx.text(name) : "__delegate", () -> {
        }, () -> {
        });
    }

    static void yield(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = Nodes.firstNamedChild(node);
        if (value == null && ctx.text(node).contains("break")) {
            Expressions.callFunction(ctx, node, "yield_break", Collections.emptyList());
            return;
        }
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
        Expressions.callFunction(ctx, node, "yield", Collections.singletonList(reg));
    }
}
