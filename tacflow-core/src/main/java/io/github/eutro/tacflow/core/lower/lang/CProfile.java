package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.IRInstruction;
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
import java.util.List;

/**
 * The profile of C.
 * <p>
 * A pointer dereference is a field named {@code "*"} of the pointer, so {@code *p = v} lowers
 * to {@code STORE_FIELD p "*" v}. Declarators are unwrapped through pointer and array
 * declarators to the declared name.
 */
public class CProfile extends LanguageProfile {
    public CProfile() {
        this("c");
    }

    protected CProfile(String name) {
        super(name);
        literals.setNone("NULL");
        literals.setTrueValue("true");
        literals.setFalseValue("false");
        literals.setDefaultReturn("0");
        fields.setAttrObject("argument");
        fields.setAttrAttribute("field");
        fields.setSubscriptValue("argument");
        fields.setSubscriptIndex("index");
        noiseTypes.addAll(Arrays.asList("preproc_include", "preproc_define", "preproc_ifdef", "preproc_ifndef",
                "preproc_if", "preproc_else", "preproc_elif", "preproc_endif", "preproc_call", "preproc_def"));
        blockTypes.addAll(Arrays.asList("compound_statement", "translation_unit"));
        identifierTypes.addAll(Arrays.asList("type_identifier", "field_identifier"));
        attributeTypes.addAll(Arrays.asList("field_expression", "pointer_expression"));
        subscriptTypes.add("subscript_expression");

        expr(Expressions::identifier, "identifier", "type_identifier");
        expr(Expressions::constLiteral, "number_literal", "string_literal", "char_literal",
                "concatenated_string", "preproc_arg");
        expr(Expressions::canonicalTrue, "true");
        expr(Expressions::canonicalFalse, "false");
        expr(Expressions::canonicalNone, "null");
        expr(Expressions::binop, "binary_expression");
        expr(Expressions::unop, "unary_expression");
        expr(Expressions::updateExpr, "update_expression");
        expr(Expressions::paren, "parenthesized_expression");
        expr(Expressions::call, "call_expression");
        expr(Expressions::attribute, "field_expression");
        expr(Expressions::subscript, "subscript_expression");
        expr(Statements::anyAssignmentExpr, "assignment_expression");
        expr(CProfile::cast, "cast_expression");
        expr(CProfile::pointer, "pointer_expression");
        expr(CProfile::sizeof, "sizeof_expression");
        expr(Expressions::conditional, "conditional_expression");
        expr(CProfile::comma, "comma_expression");
        expr(CProfile::compoundLiteral, "compound_literal_expression");
        expr((ctx, n) -> Expressions.array(ctx, n, "array", Expressions.elements(ctx, n)), "initializer_list");
        expr(CProfile::initializerPair, "initializer_pair");

        stmt(Statements::expressionStatement, "expression_statement");
        stmt(CProfile::declaration, "declaration");
        stmt(Statements::ret, "return_statement");
        stmt(ControlFlow::ifStmt, "if_statement");
        stmt(ControlFlow::whileStmt, "while_statement");
        stmt(ControlFlow::cStyleFor, "for_statement");
        stmt(ControlFlow::doStmt, "do_statement");
        stmt(CProfile::functionDefinition, "function_definition");
        stmt(CProfile::record, "struct_specifier", "union_specifier");
        stmt((ctx, n) -> ctx.lowerChildren(n), "compound_statement", "translation_unit");
        stmt(CProfile::switchStatement, "switch_statement");
        stmt(CProfile::gotoStatement, "goto_statement");
        stmt(CProfile::labeledStatement, "labeled_statement");
        stmt(ControlFlow::breakStmt, "break_statement");
        stmt(ControlFlow::continueStmt, "continue_statement");
        stmt(CProfile::typedef, "type_definition");
        stmt(CProfile::enumSpecifier, "enum_specifier");
        stmt(CProfile::macro, "preproc_function_def");
        ignore("field_declaration_list", "empty_statement");
    }

    /**
     * Splits {@code *p} into the pointer and its operator, so that the dereference is a field named
     * {@code "*"}. Address-of has no such shape.
     */
    @Override
    public @Nullable Pair<SyntaxNode, SyntaxNode> attributeParts(SyntaxNode node) {
        if (!node.getType().equals("pointer_expression")) {
            return super.attributeParts(node);
        }
        SyntaxNode operator = Nodes.fieldOrType(node, "operator", "*", "&");
        SyntaxNode argument = Nodes.fieldOrType(node, "argument");
        if (argument == null) argument = Nodes.firstNamedChild(node);
        if (operator == null || argument == null || !operator.getType().equals("*")) {
            return null;
        }
        return Pair.of(argument, operator);
    }

    @Override
    public void lowerParams(LoweringContext ctx, SyntaxNode params) {
        for (SyntaxNode param : Nodes.childrenOfType(params, "parameter_declaration", "optional_parameter_declaration")) {
            SyntaxNode declarator = param.getChildByFieldName("declarator");
            if (declarator != null) {
                Definitions.emitParam(ctx, declaratorName(ctx, declarator), ctx.loc(param));
            }
        }
    }

    /**
     * Get the name declared by a declarator, looking through pointer, array, reference and
     * function declarators.
     *
     * @param ctx        The context.
     * @param declarator The declarator.
     * @return The declared name.
     */
    public static String declaratorName(LoweringContext ctx, SyntaxNode declarator) {
        if (ctx.profile.isIdentifier(declarator)) {
            return ctx.text(declarator);
        }
        SyntaxNode inner = declarator.getChildByFieldName("declarator");
        if (inner != null) {
            return declaratorName(ctx, inner);
        }
        SyntaxNode id = Nodes.firstChildOfType(declarator, "identifier", "field_identifier");
        if (id != null) {
            return ctx.text(id);
        }
        SyntaxNode first = Nodes.firstNamedChild(declarator);
        return first != null ? declaratorName(ctx, first) : ctx.text(declarator);
    }

    static @Nullable SyntaxNode functionDeclarator(SyntaxNode node) {
        if (node.getType().equals("function_declarator")) {
            return node;
        }
        for (SyntaxNode child : node.getChildren()) {
            SyntaxNode found = functionDeclarator(child);
            if (found != null) return found;
        }
        return null;
    }

    static Reg cast(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        if (value != null) return ctx.lowerExpr(value);
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.isEmpty()) return Expressions.constLiteral(ctx, node);
        return ctx.lowerExpr(named.get(named.size() - 1));
    }

    /**
     * Lower {@code *p} as a load of the {@code "*"} field and {@code &x} as {@code UNOP "&"}.
     */
    static Reg pointer(LoweringContext ctx, SyntaxNode node) {
        if (ctx.profile.attributeParts(node) != null) {
            return Expressions.attribute(ctx, node);
        }
        SyntaxNode argument = node.getChildByFieldName("argument");
        if (argument == null) argument = Nodes.firstNamedChild(node);
        Reg value = ctx.lowerExpr(argument);
        return ctx.produce(Opcode.UNOP, ctx.loc(node), "&", value);
    }

    static Reg sizeof(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode type = Nodes.firstChildOfType(node, "type_descriptor");
        Reg arg;
        if (type != null) {
            arg = ctx.constant(ctx.text(type));
        } else {
            SyntaxNode value = node.getChildByFieldName("value");
            arg = ctx.lowerExpr(value != null ? value : Nodes.firstNamedChild(node));
        }
        return Expressions.callFunction(ctx, node, "sizeof", Collections.singletonList(arg));
    }

    static Reg comma(LoweringContext ctx, SyntaxNode node) {
        List<Reg> regs = Statements.lowerAll(ctx, Expressions.elements(ctx, node));
        return regs.isEmpty() ? Expressions.constLiteral(ctx, node) : regs.get(regs.size() - 1);
    }

    /**
     * Lower {@code (T){a, b}} as an object of type {@code T} with each element at its index.
     */
    static Reg compoundLiteral(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode type = Nodes.fieldOrType(node, "type", "type_descriptor");
        SyntaxNode init = Nodes.fieldOrType(node, "value", "initializer_list");
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), type != null ? ctx.text(type) : "compound");
        if (init != null) {
            int i = 0;
            for (SyntaxNode elem : Expressions.elements(ctx, init)) {
                Reg value = ctx.lowerExpr(elem);
                Reg idx = ctx.constant(String.valueOf(i++));
                ctx.consume(Opcode.STORE_INDEX, SourceLocation.UNKNOWN, obj, idx, value);
            }
        }
        return obj;
    }

    /**
     * Lower {@code .field = value} in an initializer list to its value; the designator is dropped.
     */
    static Reg initializerPair(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        if (value == null) {
            for (SyntaxNode child : node.getNamedChildren()) {
                if (!child.getType().equals("field_designator")) value = child;
            }
        }
        return value != null ? ctx.lowerExpr(value) : Expressions.constLiteral(ctx, node);
    }

    /**
     * Lower a declaration. Each declarator is bound to its initializer, or to the none literal.
     * A struct, union or enum body in the type is lowered first.
     */
    static void declaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode type = node.getChildByFieldName("type");
        if (type != null && type.getChildByFieldName("body") != null
                && ctx.profile.statementHandler(type.getType()) != null) {
            ctx.lowerStmt(type);
        }
        for (SyntaxNode declarator : node.getChildrenByFieldName("declarator")) {
            if (declarator.getType().equals("init_declarator")) {
                SyntaxNode target = declarator.getChildByFieldName("declarator");
                SyntaxNode value = declarator.getChildByFieldName("value");
                String name = target != null ? declaratorName(ctx, target) : "__anon";
                Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
                ctx.storeVar(name, reg, ctx.loc(node));
            } else if (functionDeclarator(declarator) == null) {
                ctx.storeVar(declaratorName(ctx, declarator), ctx.constant(ctx.profile.literals.none()), ctx.loc(node));
            }
        }
    }

    /**
     * Lower a function definition, whose name and parameters sit in a possibly nested function
     * declarator. Member initializers of a constructor are stored to fields of {@code this}
     * before the body.
     */
    static void functionDefinition(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode declarator = node.getChildByFieldName("declarator");
        SyntaxNode body = node.getChildByFieldName("body");
        SyntaxNode initializers = Nodes.firstChildOfType(node, "field_initializer_list");
        String name = "__anon";
        SyntaxNode params = null;
        if (declarator != null) {
            SyntaxNode function = functionDeclarator(declarator);
            if (function != null) {
                SyntaxNode nameNode = function.getChildByFieldName("declarator");
                params = function.getChildByFieldName("parameters");
                if (nameNode != null) name = declaratorName(ctx, nameNode);
            } else {
                name = declaratorName(ctx, declarator);
            }
        } else {
            ctx.malformed(node, "function without a declarator");
        }
        SyntaxNode paramNode = params;
        Definitions.function(ctx, node, name,
                () -> {
                    if (paramNode != null) ctx.profile.lowerParams(ctx, paramNode);
                },
                () -> {
                    if (initializers != null) fieldInitializers(ctx, initializers);
                    ctx.lowerBlock(body);
                });
    }

    private static void fieldInitializers(LoweringContext ctx, SyntaxNode node) {
        Reg self = ctx.loadVar("this", ctx.loc(node));
        for (SyntaxNode init : Nodes.childrenOfType(node, "field_initializer")) {
            SyntaxNode field = Nodes.firstChildOfType(init, "field_identifier");
            if (field == null) continue;
            SyntaxNode args = Nodes.firstChildOfType(init, "argument_list", "initializer_list");
            SyntaxNode value = args != null ? Nodes.firstNamedChild(args) : null;
            Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.defaultReturn());
            ctx.consume(Opcode.STORE_FIELD, ctx.loc(init), self, ctx.text(field), reg);
        }
    }

    /**
     * Lower a struct or union as a class. Each field is stored to {@code this} with a zero value.
     */
    static void record(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        if (body == null) return;
        Definitions.classBody(ctx, node, name != null ? ctx.text(name) : "__anon_" + node.getType().replace("_specifier", ""),
                () -> recordBody(ctx, body));
    }

    static void recordBody(LoweringContext ctx, SyntaxNode body) {
        for (SyntaxNode member : body.getNamedChildren()) {
            if (ctx.profile.isSkipped(member.getType())) continue;
            if (member.getType().equals("field_declaration")) {
                fieldDeclaration(ctx, member);
            } else {
                ctx.lowerStmt(member);
            }
        }
    }

    private static void fieldDeclaration(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode declarator : node.getChildrenByFieldName("declarator")) {
            if (functionDeclarator(declarator) != null) continue;
            Reg self = ctx.loadVar("this", SourceLocation.UNKNOWN);
            SyntaxNode value = node.getChildByFieldName("default_value");
            Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant("0");
            ctx.consume(Opcode.STORE_FIELD, ctx.loc(node), self, declaratorName(ctx, declarator), reg);
        }
    }

    static void switchStatement(LoweringContext ctx, SyntaxNode node) {
        Reg subject = ctx.lowerExpr(node.getChildByFieldName("condition"));
        SyntaxNode body = node.getChildByFieldName("body");
        List<ControlFlow.Case> cases = new ArrayList<>();
        if (body != null) {
            for (SyntaxNode arm : Nodes.childrenOfType(body, "case_statement")) {
                SyntaxNode value = arm.getChildByFieldName("value");
                List<SyntaxNode> stmts = new ArrayList<>();
                for (SyntaxNode child : arm.getNamedChildren()) {
                    if (child != value) stmts.add(child);
                }
                Runnable lowerBody = () -> ctx.lowerStatements(stmts);
                cases.add(value == null
                        ? ControlFlow.Case.otherwise(lowerBody)
                        : new ControlFlow.Case(Collections.singletonList(value), lowerBody));
            }
        }
        ControlFlow.switchChain(ctx, node, subject, cases, "==");
    }

    static void gotoStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode label = Nodes.fieldOrType(node, "label", "statement_identifier");
        if (label == null) {
            ctx.malformed(node, "goto without a label");
            return;
        }
        ctx.emit(IRInstruction.branch("user_" + ctx.text(label), ctx.loc(node)));
    }

    static void labeledStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode label = Nodes.fieldOrType(node, "label", "statement_identifier");
        if (label != null) ctx.label("user_" + ctx.text(label));
        for (SyntaxNode child : node.getNamedChildren()) {
            if (child != label) ctx.lowerStmt(child);
        }
    }

    /**
     * Lower {@code typedef T Alias} as a store of the type name to the alias.
     */
    static void typedef(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode type = node.getChildByFieldName("type");
        List<SyntaxNode> aliases = node.getChildrenByFieldName("declarator");
        if (type != null && type.getChildByFieldName("body") != null
                && ctx.profile.statementHandler(type.getType()) != null) {
            ctx.lowerStmt(type);
        }
        String typeName = type != null ? ctx.text(type) : "unknown_type";
        if (type != null && type.getChildByFieldName("name") != null && type.getChildByFieldName("body") != null) {
            typeName = ctx.text(type.getChildByFieldName("name"));
        }
        if (aliases.isEmpty()) {
            ctx.malformed(node, "typedef without an alias");
        }
        for (SyntaxNode alias : aliases) {
            ctx.storeVar(declaratorName(ctx, alias), ctx.constant(typeName), ctx.loc(node));
        }
    }

    /**
     * Lower an enum as an object with a field per enumerator, holding its value or its ordinal.
     */
    static void enumSpecifier(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        if (body == null) return;
        String enumName = name != null ? ctx.text(name) : "__anon_enum";
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), "enum:" + enumName);
        int i = 0;
        for (SyntaxNode enumerator : Nodes.childrenOfType(body, "enumerator")) {
            SyntaxNode memberName = enumerator.getChildByFieldName("name");
            SyntaxNode value = enumerator.getChildByFieldName("value");
            Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(String.valueOf(i));
            String member = memberName != null ? ctx.text(memberName) : "__enum_" + i;
            ctx.consume(Opcode.STORE_FIELD, ctx.loc(enumerator), obj, member, reg);
            i++;
        }
        ctx.storeVar(enumName, obj, ctx.loc(node));
    }

    /**
     * Lower a function-like macro as a function returning its replacement text.
     */
    static void macro(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode params = node.getChildByFieldName("parameters");
        SyntaxNode value = node.getChildByFieldName("value");
        Definitions.function(ctx, node, name != null ? ctx.text(name) : "__macro",
                () -> {
                    if (params == null) return;
                    for (SyntaxNode param : Nodes.childrenOfType(params, "identifier")) {
                        Definitions.emitParam(ctx, ctx.text(param), ctx.loc(param));
                    }
                },
                () -> {
                    if (value != null) ctx.ret(ctx.lowerExpr(value), ctx.loc(value));
                });
    }
}
