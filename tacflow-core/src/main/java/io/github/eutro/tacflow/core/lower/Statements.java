package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.ir.SourceLocation;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared lowerings of assignments, declarations and other simple statements.
 */
public final class Statements {
    private Statements() {
    }

    /**
     * Node kinds destructured element by element when assigned to.
     */
    public static final Set<String> DESTRUCTURING_TYPES = new HashSet<>(Arrays.asList(
            "pattern_list",
            "tuple_pattern",
            "list_pattern",
            "expression_list",
            "tuple_expression",
            "array_pattern",
            "left_assignment_list",
            "destructuring_pattern"
    ));

    /**
     * Store a value to an assignment target.
     * <p>
     * A name becomes {@code STORE_VAR}, a member access {@code STORE_FIELD}, an index access
     * {@code STORE_INDEX}, and a tuple or list pattern is destructured through constant indices.
     * Anything else is stored to a variable named by its text.
     *
     * @param ctx    The context.
     * @param target The target node.
     * @param value  The value register.
     * @param parent The assignment, for its location.
     */
    public static void storeTarget(LoweringContext ctx, SyntaxNode target, Reg value, SyntaxNode parent) {
        LanguageProfile profile = ctx.profile;
        SourceLocation loc = ctx.loc(parent);
        if (profile.isIdentifier(target)) {
            ctx.storeVar(ctx.text(target), value, loc);
            return;
        }
        if (profile.isAttribute(target)) {
            Pair<SyntaxNode, SyntaxNode> parts = profile.attributeParts(target);
            if (parts != null) {
                Reg obj = ctx.lowerExpr(parts.left);
                ctx.consume(Opcode.STORE_FIELD, loc, obj, ctx.text(parts.right), value);
                return;
            }
        }
        if (profile.isSubscript(target)) {
            Pair<SyntaxNode, SyntaxNode> parts = profile.subscriptParts(target);
            if (parts != null) {
                Reg obj = ctx.lowerExpr(parts.left);
                Reg idx = ctx.lowerExpr(parts.right);
                ctx.consume(Opcode.STORE_INDEX, loc, obj, idx, value);
                return;
            }
        }
        if (DESTRUCTURING_TYPES.contains(target.getType())) {
            destructure(ctx, Expressions.elements(ctx, target), value, parent);
            return;
        }
        if (target.getType().equals("object_pattern")) {
            destructureFields(ctx, target, value, parent);
            return;
        }
        if (target.getType().equals("parenthesized_expression")) {
            SyntaxNode inner = Nodes.firstNamedChild(target);
            if (inner != null) {
                storeTarget(ctx, inner, value, parent);
                return;
            }
        }
        ctx.storeVar(ctx.text(target), value, loc);
    }

    /**
     * Store each element of a value to the corresponding target.
     *
     * @param ctx     The context.
     * @param targets The element targets.
     * @param value   The value to take apart.
     * @param parent  The assignment, for its location.
     */
    public static void destructure(LoweringContext ctx, List<SyntaxNode> targets, Reg value, SyntaxNode parent) {
        int i = 0;
        for (SyntaxNode target : targets) {
            Reg idx = ctx.constant(String.valueOf(i++));
            Reg elem = ctx.produce(Opcode.LOAD_INDEX, SourceLocation.UNKNOWN, value, idx);
            storeTarget(ctx, target, elem, parent);
        }
    }

    /**
     * Store the fields of a value named by an object pattern, as {@code {a, b: c} = v}.
     *
     * @param ctx     The context.
     * @param pattern The object pattern.
     * @param value   The value to take apart.
     * @param parent  The assignment, for its location.
     */
    public static void destructureFields(LoweringContext ctx, SyntaxNode pattern, Reg value, SyntaxNode parent) {
        for (SyntaxNode child : pattern.getNamedChildren()) {
            switch (child.getType()) {
                case "shorthand_property_identifier_pattern":
                case "shorthand_property_identifier": {
                    String name = ctx.text(child);
                    Reg field = ctx.produce(Opcode.LOAD_FIELD, ctx.loc(child), value, name);
                    ctx.storeVar(name, field, ctx.loc(parent));
                    break;
                }
                case "pair_pattern": {
                    SyntaxNode key = child.getChildByFieldName("key");
                    SyntaxNode local = child.getChildByFieldName("value");
                    if (key == null || local == null) {
                        ctx.malformed(child, "expected a key and a target");
                        break;
                    }
                    Reg field = ctx.produce(Opcode.LOAD_FIELD, ctx.loc(child), value, ctx.text(key));
                    storeTarget(ctx, local, field, parent);
                    break;
                }
                default:
                    if (!ctx.profile.isSkipped(child.getType())) {
                        ctx.malformed(child, "unexpected object pattern entry");
                    }
            }
        }
    }

    public static void assignment(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode left = node.getChildByFieldName(ctx.profile.fields.assignLeft());
        SyntaxNode right = node.getChildByFieldName(ctx.profile.fields.assignRight());
        if (left == null) {
            ctx.malformed(node, "assignment without a target");
            ctx.lowerExpr(right);
            return;
        }
        Reg value = ctx.lowerExpr(right);
        storeTarget(ctx, left, value, node);
    }

    /**
     * Lower an assignment used as an expression, whose value is the assigned value.
     *
     * @param ctx  The context.
     * @param node The assignment.
     * @return The value register.
     */
    public static Reg assignmentExpr(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode left = node.getChildByFieldName(ctx.profile.fields.assignLeft());
        SyntaxNode right = node.getChildByFieldName(ctx.profile.fields.assignRight());
        Reg value = ctx.lowerExpr(right);
        if (left != null) {
            storeTarget(ctx, left, value, node);
        } else {
            ctx.malformed(node, "assignment without a target");
        }
        return value;
    }

    /**
     * Lower an assignment expression whose operator may be {@code =} or compound, as in the
     * C family where both share one node kind.
     *
     * @param ctx  The context.
     * @param node The assignment.
     * @return The assigned value.
     */
    public static Reg anyAssignmentExpr(LoweringContext ctx, SyntaxNode node) {
        String op = assignmentOperator(ctx, node);
        if (op == null || op.equals("=") || op.equals(":=")) {
            return assignmentExpr(ctx, node);
        }
        return augmentedAssignmentExpr(ctx, node);
    }

    private static @Nullable String assignmentOperator(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode opNode = node.getChildByFieldName("operator");
        if (opNode != null) return ctx.text(opNode);
        for (SyntaxNode child : node.getChildren()) {
            if (!child.isNamed()) {
                String text = ctx.text(child);
                if (text.endsWith("=")) return text;
            }
        }
        return null;
    }

    /**
     * Lower {@code x op= y} as {@code x = x op y}.
     *
     * @param ctx  The context.
     * @param node The assignment.
     */
    public static void augmentedAssignment(LoweringContext ctx, SyntaxNode node) {
        augmentedAssignmentExpr(ctx, node);
    }

    public static Reg augmentedAssignmentExpr(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode left = node.getChildByFieldName(ctx.profile.fields.assignLeft());
        SyntaxNode right = node.getChildByFieldName(ctx.profile.fields.assignRight());
        SyntaxNode opNode = node.getChildByFieldName("operator");
        if (opNode == null) {
            for (SyntaxNode child : node.getChildren()) {
                if (!child.isNamed() && child != left && child != right) {
                    opNode = child;
                    break;
                }
            }
        }
        if (left == null || right == null || opNode == null) {
            ctx.malformed(node, "expected a target, an operator and a value");
            return ctx.lowerExpr(right);
        }
        String op = stripAssign(ctx.text(opNode));
        Reg l = ctx.lowerExpr(left);
        Reg r = ctx.lowerExpr(right);
        Reg result = ctx.produce(Opcode.BINOP, ctx.loc(node), op, l, r);
        storeTarget(ctx, left, result, node);
        return result;
    }

    /**
     * Strip the trailing {@code =} of a compound assignment operator.
     *
     * @param op The operator, e.g. {@code "+="}.
     * @return The arithmetic operator, e.g. {@code "+"}.
     */
    public static String stripAssign(String op) {
        int end = op.length();
        while (end > 0 && op.charAt(end - 1) == '=') end--;
        return end == 0 ? op : op.substring(0, end);
    }

    /**
     * Lower a return statement, returning the profile's default value when there is no operand.
     *
     * @param ctx  The context.
     * @param node The statement.
     */
    public static void ret(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = null;
        for (SyntaxNode child : node.getNamedChildren()) {
            if (!ctx.profile.isSkipped(child.getType())) {
                value = child;
                break;
            }
        }
        ret(ctx, node, value);
    }

    public static void ret(LoweringContext ctx, SyntaxNode node, @Nullable SyntaxNode value) {
        Reg reg = value != null
                ? ctx.lowerExpr(value)
                : ctx.constant(ctx.profile.literals.defaultReturn());
        ctx.ret(reg, ctx.loc(node));
    }

    /**
     * Lower a throw or raise statement.
     *
     * @param ctx  The context.
     * @param node The statement.
     */
    public static void throwStmt(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = Nodes.firstNamedChild(node);
        Reg reg = value != null
                ? ctx.lowerExpr(value)
                : ctx.constant(ctx.profile.literals.defaultReturn());
        ctx.consume(Opcode.THROW, ctx.loc(node), reg);
    }

    /**
     * Lower the expression wrapped by an expression statement.
     *
     * @param ctx  The context.
     * @param node The statement.
     */
    public static void expressionStatement(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode child : node.getNamedChildren()) {
            if (!ctx.profile.isSkipped(child.getType())) {
                ctx.lowerStmt(child);
            }
        }
    }

    /**
     * Lower a declaration with {@code variable_declarator} children, each with a {@code name}
     * and an optional {@code value}.
     *
     * @param ctx  The context.
     * @param node The declaration.
     */
    public static void varDeclaration(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> declarators = Nodes.childrenOfType(node, "variable_declarator", "init_declarator");
        if (declarators.isEmpty()) {
            ctx.malformed(node, "declaration without declarators");
        }
        for (SyntaxNode declarator : declarators) {
            declarator(ctx, node, declarator, "name", "value");
        }
    }

    /**
     * Lower one declarator, storing the none literal when there is no initializer.
     *
     * @param ctx        The context.
     * @param decl       The declaration, for its location.
     * @param declarator The declarator.
     * @param nameField  The field holding the declared name or pattern.
     * @param valueField The field holding the initializer.
     */
    public static void declarator(LoweringContext ctx, SyntaxNode decl, SyntaxNode declarator,
                                  String nameField, String valueField) {
        SyntaxNode name = declarator.getChildByFieldName(nameField);
        SyntaxNode value = declarator.getChildByFieldName(valueField);
        if (name == null) {
            List<SyntaxNode> named = declarator.getNamedChildren();
            if (named.isEmpty()) {
                ctx.malformed(declarator, "declarator without a name");
                return;
            }
            name = named.get(0);
        }
        Reg reg = value != null
                ? ctx.lowerExpr(value)
                : ctx.constant(ctx.profile.literals.none());
        storeTarget(ctx, name, reg, decl);
    }

    /**
     * Lower a list of expressions for their effects, as for comma separated statements.
     *
     * @param ctx   The context.
     * @param nodes The expressions.
     * @return The registers, in order.
     */
    public static List<Reg> lowerAll(LoweringContext ctx, List<SyntaxNode> nodes) {
        List<Reg> regs = new ArrayList<>();
        for (SyntaxNode node : nodes) {
            regs.add(ctx.lowerExpr(node));
        }
        return regs;
    }
}
