package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.ir.SourceLocation;
import io.github.eutro.tacflow.core.lower.*;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * The profile of Rust.
 * <p>
 * Rust is expression oriented: blocks, {@code if} and {@code match} all produce values. A block's
 * value is its trailing expression, and a function whose body ends in one returns it.
 */
public class RustProfile extends LanguageProfile {
    private static final Logger LOGGER = LogManager.getLogger();
    private static final int SYMBOLIC_TEXT_LIMIT = 60;

    public RustProfile() {
        super("rust");
        literals.setNone("()");
        literals.setDefaultReturn("()");
        fields.setAttrObject("value");
        fields.setAttrAttribute("field");
        commentTypes.addAll(Arrays.asList("line_comment", "block_comment"));
        blockTypes.addAll(Arrays.asList("block", "source_file", "declaration_list"));
        identifierTypes.addAll(Arrays.asList("type_identifier", "self", "scoped_identifier", "generic_function",
                "scoped_type_identifier"));
        attributeTypes.add("field_expression");
        subscriptTypes.add("index_expression");

        expr(Expressions::identifier, "identifier", "type_identifier", "self", "scoped_identifier",
                "generic_function", "scoped_type_identifier");
        expr(Expressions::constLiteral, "integer_literal", "float_literal", "string_literal", "char_literal",
                "boolean_literal", "raw_string_literal", "unit_expression");
        expr(Expressions::binop, "binary_expression");
        expr(Expressions::unop, "unary_expression");
        expr(Expressions::paren, "parenthesized_expression");
        expr(Expressions::call, "call_expression");
        expr(Expressions::attribute, "field_expression");
        expr(Expressions::subscript, "index_expression");
        expr(RustProfile::reference, "reference_expression");
        expr(Statements::assignmentExpr, "assignment_expression");
        expr(Statements::augmentedAssignmentExpr, "compound_assignment_expr");
        expr(RustProfile::ifExpression, "if_expression");
        expr(RustProfile::matchExpression, "match_expression");
        expr(RustProfile::closure, "closure_expression");
        expr(RustProfile::structExpression, "struct_expression");
        expr(RustProfile::block, "block");
        expr(Expressions::unwrap, "async_block", "unsafe_block", "else_clause", "expression_statement");
        expr(RustProfile::returnExpression, "return_expression");
        expr(RustProfile::macroInvocation, "macro_invocation");
        expr(RustProfile::arrayExpression, "array_expression");
        expr(Expressions::tupleLiteral, "tuple_expression");
        expr(RustProfile::cast, "type_cast_expression");
        expr((ctx, n) -> wrap(ctx, n, "try_unwrap"), "try_expression");
        expr((ctx, n) -> wrap(ctx, n, "await"), "await_expression");
        expr(RustProfile::symbolic, "range_expression", "tuple_struct_pattern", "struct_pattern",
                "range_pattern", "captured_pattern", "tuple_pattern", "ref_pattern", "slice_pattern");

        stmt(Statements::expressionStatement, "expression_statement");
        stmt(RustProfile::letDeclaration, "let_declaration");
        stmt(RustProfile::function, "function_item");
        stmt(RustProfile::structItem, "struct_item", "union_item");
        stmt((ctx, n) -> classLike(ctx, n, "type", "__anon_impl"), "impl_item");
        stmt((ctx, n) -> classLike(ctx, n, "name", "__anon_trait"), "trait_item");
        stmt(ControlFlow::ifStmt, "if_expression");
        stmt(ControlFlow::whileStmt, "while_expression");
        stmt((ctx, n) -> ControlFlow.infiniteLoop(ctx, n, () -> ctx.lowerBlock(n.getChildByFieldName("body"))),
                "loop_expression");
        stmt(RustProfile::forExpression, "for_expression");
        stmt(Statements::ret, "return_expression");
        stmt((ctx, n) -> ctx.lowerChildren(n), "block", "source_file");
        stmt(RustProfile::macroInvocation, "macro_invocation");
        stmt(ControlFlow::breakStmt, "break_expression");
        stmt(ControlFlow::continueStmt, "continue_expression");
        stmt(RustProfile::enumItem, "enum_item");
        stmt(RustProfile::constItem, "const_item", "static_item");
        stmt(RustProfile::typeItem, "type_item");
        stmt(RustProfile::modItem, "mod_item");
        ignore("use_declaration", "attribute_item", "inner_attribute_item", "extern_crate_declaration",
                "function_signature_item", "associated_type", "macro_definition");
    }

    @Override
    public @Nullable Pair<SyntaxNode, SyntaxNode> subscriptParts(SyntaxNode node) {
        if (!node.getType().equals("index_expression")) {
            return super.subscriptParts(node);
        }
        List<SyntaxNode> named = node.getNamedChildren();
        return named.size() < 2 ? null : Pair.of(named.get(0), named.get(1));
    }

    @Override
    public @Nullable String paramName(LoweringContext ctx, SyntaxNode param) {
        switch (param.getType()) {
            case "identifier":
                return ctx.text(param);
            case "self_parameter":
                return "self";
            case "parameter": {
                SyntaxNode pattern = param.getChildByFieldName("pattern");
                return pattern != null ? patternName(ctx, pattern) : null;
            }
            default:
                return null;
        }
    }

    @Override
    public void lowerParams(LoweringContext ctx, SyntaxNode params) {
        for (SyntaxNode param : params.getNamedChildren()) {
            String name = paramName(ctx, param);
            if (name != null) {
                Definitions.emitParam(ctx, name, ctx.loc(param));
            }
        }
    }

    /**
     * Get the name bound by a simple pattern, looking through {@code mut} and {@code ref}.
     */
    static String patternName(LoweringContext ctx, SyntaxNode pattern) {
        if (pattern.getType().equals("identifier")) {
            return ctx.text(pattern);
        }
        SyntaxNode id = Nodes.firstChildOfType(pattern, "identifier");
        return id != null ? ctx.text(id) : ctx.text(pattern);
    }

    /**
     * Lower the statements of a block, returning the value of its trailing expression, or null
     * if the block ends in a statement.
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
        if (last.getType().equals("return_expression")) {
            ctx.lowerStmt(last);
            return null;
        }
        if (last.getType().equals("expression_statement")) {
            SyntaxNode inner = Nodes.firstNamedChild(last);
            if (inner == null || endsWithSemicolon(last) || !producesValue(inner)) {
                ctx.lowerStmt(last);
                return null;
            }
            return ctx.lowerExpr(inner);
        }
        if (ctx.profile.expressionHandler(last.getType()) == null) {
            ctx.lowerStmt(last);
            return null;
        }
        return ctx.lowerExpr(last);
    }

    private static boolean endsWithSemicolon(SyntaxNode node) {
        List<SyntaxNode> children = node.getChildren();
        return !children.isEmpty() && children.get(children.size() - 1).getType().equals(";");
    }

    private static boolean producesValue(SyntaxNode node) {
        switch (node.getType()) {
            case "if_expression":
            case "match_expression":
            case "block":
            case "unsafe_block":
                return true;
            default:
                return false;
        }
    }

    static Reg block(LoweringContext ctx, SyntaxNode node) {
        Reg value = blockValue(ctx, node);
        return value != null ? value : ctx.constant(ctx.profile.literals.none(), ctx.loc(node));
    }

    private static Reg branchValue(LoweringContext ctx, @Nullable SyntaxNode node) {
        if (node == null) return ctx.constant(ctx.profile.literals.none());
        if (node.getType().equals("block")) return block(ctx, node);
        return ctx.lowerExpr(node);
    }

    static Reg reference(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        if (value == null) value = Nodes.firstNamedChild(node);
        Reg inner = ctx.lowerExpr(value);
        return ctx.produce(Opcode.UNOP, ctx.loc(node), "&", inner);
    }

    static Reg ifExpression(LoweringContext ctx, SyntaxNode node) {
        Reg cond = ctx.lowerExpr(node.getChildByFieldName("condition"));
        SyntaxNode consequence = node.getChildByFieldName("consequence");
        SyntaxNode alternative = node.getChildByFieldName("alternative");
        return ControlFlow.ifValue(ctx, node, cond,
                () -> branchValue(ctx, consequence),
                alternative == null ? null : () -> branchValue(ctx, Nodes.firstNamedChild(alternative)));
    }

    /**
     * Lower a match as a chain of equality tests against each arm's patterns. A wildcard arm is
     * the default, and guards are not evaluated.
     */
    static Reg matchExpression(LoweringContext ctx, SyntaxNode node) {
        Reg subject = ctx.lowerExpr(node.getChildByFieldName("value"));
        SyntaxNode body = node.getChildByFieldName("body");
        List<List<SyntaxNode>> values = new ArrayList<>();
        List<Supplier<Reg>> results = new ArrayList<>();
        if (body != null) {
            for (SyntaxNode arm : Nodes.childrenOfType(body, "match_arm")) {
                SyntaxNode pattern = arm.getChildByFieldName("pattern");
                SyntaxNode value = arm.getChildByFieldName("value");
                values.add(pattern != null ? patternValues(pattern) : Collections.emptyList());
                results.add(() -> branchValue(ctx, value));
            }
        }
        return ControlFlow.switchValue(ctx, node, subject, values, results, "==");
    }

    private static List<SyntaxNode> patternValues(SyntaxNode matchPattern) {
        SyntaxNode condition = matchPattern.getChildByFieldName("condition");
        List<SyntaxNode> values = new ArrayList<>();
        for (SyntaxNode child : matchPattern.getNamedChildren()) {
            if (child == condition) continue;
            if (child.getType().equals("or_pattern")) {
                collectAlternatives(child, values);
            } else {
                values.add(child);
            }
        }
        return values;
    }

    private static void collectAlternatives(SyntaxNode pattern, List<SyntaxNode> values) {
        for (SyntaxNode child : pattern.getNamedChildren()) {
            if (child.getType().equals("or_pattern")) {
                collectAlternatives(child, values);
            } else {
                values.add(child);
            }
        }
    }

    /**
     * Lower a closure. Its body is an expression or a block, whose value is returned.
     */
    static Reg closure(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode params = node.getChildByFieldName("parameters");
        SyntaxNode body = node.getChildByFieldName("body");
        return Definitions.lambda(ctx, node,
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> body != null && body.getType().equals("block")
                        ? blockValue(ctx, body)
                        : ctx.lowerExpr(body));
    }

    /**
     * Lower {@code Point { x: 1, y }} as a new object with a field store per initializer.
     */
    static Reg structExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), name != null ? ctx.text(name) : "Struct");
        if (body == null) return obj;
        for (SyntaxNode init : body.getNamedChildren()) {
            switch (init.getType()) {
                case "field_initializer": {
                    SyntaxNode field = init.getChildByFieldName("field");
                    SyntaxNode value = init.getChildByFieldName("value");
                    if (field == null) break;
                    Reg reg = ctx.lowerExpr(value);
                    ctx.consume(Opcode.STORE_FIELD, ctx.loc(init), obj, ctx.text(field), reg);
                    break;
                }
                case "shorthand_field_initializer": {
                    SyntaxNode field = Nodes.firstNamedChild(init);
                    if (field == null) break;
                    Reg reg = ctx.loadVar(ctx.text(field), ctx.loc(field));
                    ctx.consume(Opcode.STORE_FIELD, ctx.loc(init), obj, ctx.text(field), reg);
                    break;
                }
                default:
                    break;
            }
        }
        return obj;
    }

    static Reg returnExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = Nodes.firstNamedChild(node);
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.defaultReturn());
        ctx.ret(reg, ctx.loc(node));
        return reg;
    }

    /**
     * Lower a macro invocation as a call of {@code name!}. The token tree is not parsed, so the
     * arguments are not represented.
     */
    static Reg macroInvocation(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode macro = node.getChildByFieldName("macro");
        String name = macro != null ? ctx.text(macro) : ctx.text(node).split("!", 2)[0];
        return Expressions.callFunction(ctx, node, name + "!", Collections.emptyList());
    }

    /**
     * Lower {@code [a, b]} as a list, and {@code [v; n]} as a new array of size {@code n}.
     */
    static Reg arrayExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode length = node.getChildByFieldName("length");
        if (length == null) {
            return Expressions.listLiteral(ctx, node);
        }
        Reg size = ctx.lowerExpr(length);
        return ctx.produce(Opcode.NEW_ARRAY, ctx.loc(node), "list", size);
    }

    static Reg cast(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        return value != null ? ctx.lowerExpr(value) : Expressions.constLiteral(ctx, node);
    }

    private static Reg wrap(LoweringContext ctx, SyntaxNode node, String function) {
        Reg inner = ctx.lowerExpr(Nodes.firstNamedChild(node));
        return Expressions.callFunction(ctx, node, function, Collections.singletonList(inner));
    }

    static Reg symbolic(LoweringContext ctx, SyntaxNode node) {
        String text = ctx.text(node);
        if (text.length() > SYMBOLIC_TEXT_LIMIT) text = text.substring(0, SYMBOLIC_TEXT_LIMIT);
        return ctx.symbolic(node.getType() + ":" + text, ctx.loc(node));
    }

    static void letDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode pattern = node.getChildByFieldName("pattern");
        SyntaxNode value = node.getChildByFieldName("value");
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
        if (pattern == null) {
            ctx.malformed(node, "let without a pattern");
        } else if (Statements.DESTRUCTURING_TYPES.contains(pattern.getType())) {
            Statements.storeTarget(ctx, pattern, reg, node);
        } else {
            ctx.storeVar(patternName(ctx, pattern), reg, ctx.loc(node));
        }
    }

    /**
     * Lower a function, returning the trailing expression of its body.
     */
    static void function(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode params = node.getChildByFieldName("parameters");
        SyntaxNode body = node.getChildByFieldName("body");
        Definitions.function(ctx, node, name != null ? ctx.text(name) : "__anon",
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> {
                    if (body == null) return;
                    Reg value = blockValue(ctx, body);
                    if (value != null) ctx.ret(value, ctx.loc(body));
                });
    }

    static void structItem(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        Definitions.classBody(ctx, node, name != null ? ctx.text(name) : "__anon_struct", () -> {
        });
    }

    private static void classLike(LoweringContext ctx, SyntaxNode node, String nameField, String fallback) {
        SyntaxNode name = node.getChildByFieldName(nameField);
        SyntaxNode body = node.getChildByFieldName("body");
        Definitions.classBody(ctx, node, name != null ? ctx.text(name) : fallback, () -> ctx.lowerBlock(body));
    }

    /**
     * Lower {@code for x in start..end} as a counting loop, and any other {@code for} as an
     * iteration over the collection.
     */
    static void forExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode pattern = node.getChildByFieldName("pattern");
        SyntaxNode value = node.getChildByFieldName("value");
        SyntaxNode body = node.getChildByFieldName("body");
        if (pattern != null && value != null && value.getType().equals("range_expression")) {
            List<SyntaxNode> bounds = value.getNamedChildren();
            if (bounds.size() == 2) {
                boolean inclusive = Nodes.hasChildOfType(value, "..=");
                Reg start = ctx.lowerExpr(bounds.get(0));
                Reg bound = ctx.lowerExpr(bounds.get(1));
                Reg step = ctx.constant("1");
                ControlFlow.rangeFor(ctx, node, patternName(ctx, pattern), start, bound, step,
                        inclusive ? "<=" : "<", () -> ctx.lowerBlock(body));
                return;
            }
        }
        ControlFlow.forEach(ctx, node, pattern, value, body);
    }

    /**
     * Lower an enum as an object with a field per variant, holding the variant name.
     */
    static void enumItem(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        String enumName = name != null ? ctx.text(name) : "__anon_enum";
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), "enum:" + enumName);
        if (body != null) {
            for (SyntaxNode variant : Nodes.childrenOfType(body, "enum_variant")) {
                SyntaxNode variantName = variant.getChildByFieldName("name");
                String member = variantName != null ? ctx.text(variantName) : ctx.text(variant);
                Reg reg = ctx.constant(member);
                ctx.consume(Opcode.STORE_FIELD, SourceLocation.UNKNOWN, obj, member, reg);
            }
        }
        ctx.storeVar(enumName, obj, ctx.loc(node));
    }

    static void constItem(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode value = node.getChildByFieldName("value");
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
        ctx.storeVar(name != null ? ctx.text(name) : "__const", reg, ctx.loc(node));
    }

    /**
     * Lower {@code type Alias = T;} as a store of the type text to the alias.
     */
    static void typeItem(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode type = node.getChildByFieldName("type");
        Reg reg = ctx.constant(type != null ? ctx.text(type) : "()", ctx.loc(node));
        ctx.storeVar(name != null ? ctx.text(name) : "__type_alias", reg, ctx.loc(node));
    }

    static void modItem(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        LOGGER.debug("lowering module {}", name != null ? ctx.text(name) : "<anonymous>");
        SyntaxNode body = node.getChildByFieldName("body");
        if (body != null) ctx.lowerBlock(body);
    }
}
