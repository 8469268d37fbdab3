package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The per-grammar configuration of the lowering engine.
 * <p>
 * A profile names the fields the shared routines look up, the literal tokens of the language,
 * the node kinds that are skipped or treated specially, and fills the statement and expression
 * dispatch tables. Subclasses configure all of this in their constructor.
 * <p>
 * Profiles hold no lowering state. Once {@link #freeze() frozen} they cannot be reconfigured,
 * and may be shared between concurrent lowerings.
 */
public abstract class LanguageProfile {
    private static void checkMutable(boolean frozen) {
        if (frozen) {
            throw new IllegalStateException("profile is frozen");
        }
    }

    /**
     * The literal tokens of a language.
     */
    public static final class Literals {
        private boolean frozen;
        private String none = "None";
        private String trueValue = "true";
        private String falseValue = "false";
        private String defaultReturn = "None";

        public String none() {
            return none;
        }

        public void setNone(String none) {
            checkMutable(frozen);
            this.none = none;
        }

        public String trueValue() {
            return trueValue;
        }

        public void setTrueValue(String trueValue) {
            checkMutable(frozen);
            this.trueValue = trueValue;
        }

        public String falseValue() {
            return falseValue;
        }

        public void setFalseValue(String falseValue) {
            checkMutable(frozen);
            this.falseValue = falseValue;
        }

        /**
         * @return The value returned by a function that falls off its end.
         */
        public String defaultReturn() {
            return defaultReturn;
        }

        public void setDefaultReturn(String defaultReturn) {
            checkMutable(frozen);
            this.defaultReturn = defaultReturn;
        }
    }

    /**
     * The field names the shared routines use to take nodes apart.
     */
    public static final class FieldNames {
        private boolean frozen;

        private String funcName = "name";
        private String funcParams = "parameters";
        private String funcBody = "body";

        private String ifCondition = "condition";
        private String ifConsequence = "consequence";
        private String ifAlternative = "alternative";

        private String whileCondition = "condition";
        private String whileBody = "body";

        private String callFunction = "function";
        private String callArguments = "arguments";

        private String className = "name";
        private String classBody = "body";

        private String attrObject = "object";
        private String attrAttribute = "attribute";

        private String subscriptValue = "value";
        private String subscriptIndex = "subscript";

        private String assignLeft = "left";
        private String assignRight = "right";

        public String funcName() {
            return funcName;
        }

        public void setFuncName(String funcName) {
            checkMutable(frozen);
            this.funcName = funcName;
        }

        public String funcParams() {
            return funcParams;
        }

        public void setFuncParams(String funcParams) {
            checkMutable(frozen);
            this.funcParams = funcParams;
        }

        public String funcBody() {
            return funcBody;
        }

        public void setFuncBody(String funcBody) {
            checkMutable(frozen);
            this.funcBody = funcBody;
        }

        public String ifCondition() {
            return ifCondition;
        }

        public void setIfCondition(String ifCondition) {
            checkMutable(frozen);
            this.ifCondition = ifCondition;
        }

        public String ifConsequence() {
            return ifConsequence;
        }

        public void setIfConsequence(String ifConsequence) {
            checkMutable(frozen);
            this.ifConsequence = ifConsequence;
        }

        public String ifAlternative() {
            return ifAlternative;
        }

        public void setIfAlternative(String ifAlternative) {
            checkMutable(frozen);
            this.ifAlternative = ifAlternative;
        }

        public String whileCondition() {
            return whileCondition;
        }

        public void setWhileCondition(String whileCondition) {
            checkMutable(frozen);
            this.whileCondition = whileCondition;
        }

        public String whileBody() {
            return whileBody;
        }

        public void setWhileBody(String whileBody) {
            checkMutable(frozen);
            this.whileBody = whileBody;
        }

        public String callFunction() {
            return callFunction;
        }

        public void setCallFunction(String callFunction) {
            checkMutable(frozen);
            this.callFunction = callFunction;
        }

        public String callArguments() {
            return callArguments;
        }

        public void setCallArguments(String callArguments) {
            checkMutable(frozen);
            this.callArguments = callArguments;
        }

        public String className() {
            return className;
        }

        public void setClassName(String className) {
            checkMutable(frozen);
            this.className = className;
        }

        public String classBody() {
            return classBody;
        }

        public void setClassBody(String classBody) {
            checkMutable(frozen);
            this.classBody = classBody;
        }

        public String attrObject() {
            return attrObject;
        }

        public void setAttrObject(String attrObject) {
            checkMutable(frozen);
            this.attrObject = attrObject;
        }

        public String attrAttribute() {
            return attrAttribute;
        }

        public void setAttrAttribute(String attrAttribute) {
            checkMutable(frozen);
            this.attrAttribute = attrAttribute;
        }

        public String subscriptValue() {
            return subscriptValue;
        }

        public void setSubscriptValue(String subscriptValue) {
            checkMutable(frozen);
            this.subscriptValue = subscriptValue;
        }

        public String subscriptIndex() {
            return subscriptIndex;
        }

        public void setSubscriptIndex(String subscriptIndex) {
            checkMutable(frozen);
            this.subscriptIndex = subscriptIndex;
        }

        public String assignLeft() {
            return assignLeft;
        }

        public void setAssignLeft(String assignLeft) {
            checkMutable(frozen);
            this.assignLeft = assignLeft;
        }

        public String assignRight() {
            return assignRight;
        }

        public void setAssignRight(String assignRight) {
            checkMutable(frozen);
            this.assignRight = assignRight;
        }
    }

    /**
     * The name of the language, e.g. {@code "python"}.
     */
    public final String name;
    public final Literals literals = new Literals();
    public final FieldNames fields = new FieldNames();

    protected Set<String> commentTypes = new HashSet<>(Collections.singletonList("comment"));
    protected Set<String> noiseTypes = new HashSet<>(Arrays.asList("newline", "\n"));
    /**
     * Node kinds whose children are always lowered as a statement list.
     */
    protected Set<String> blockTypes = new HashSet<>();
    /**
     * Node kinds that are plain names, for call classification and assignment.
     */
    protected Set<String> identifierTypes = new HashSet<>(Collections.singletonList("identifier"));
    /**
     * Node kinds that access a member of an object.
     */
    protected Set<String> attributeTypes = new HashSet<>(Arrays.asList(
            "attribute",
            "member_expression",
            "selector_expression",
            "member_access_expression",
            "field_access",
            "method_index_expression"
    ));
    /**
     * Node kinds that index into a collection. Both reads and writes through these kinds are lowered.
     */
    protected Set<String> subscriptTypes = new HashSet<>(Collections.singletonList("subscript"));

    private boolean frozen;

    private final Map<String, StatementHandler> statementHandlers = new HashMap<>();
    private final Map<String, ExpressionHandler> expressionHandlers = new HashMap<>();

    protected LanguageProfile(String name) {
        this.name = name;
    }

    /**
     * Stop any further configuration of this profile, so it can be shared.
     * <p>
     * Setters and handler registration throw {@link IllegalStateException} afterwards,
     * and the kind sets become read-only.
     *
     * @return This profile.
     */
    public final LanguageProfile freeze() {
        if (frozen) return this;
        frozen = true;
        literals.frozen = true;
        fields.frozen = true;
        commentTypes = Collections.unmodifiableSet(commentTypes);
        noiseTypes = Collections.unmodifiableSet(noiseTypes);
        blockTypes = Collections.unmodifiableSet(blockTypes);
        identifierTypes = Collections.unmodifiableSet(identifierTypes);
        attributeTypes = Collections.unmodifiableSet(attributeTypes);
        subscriptTypes = Collections.unmodifiableSet(subscriptTypes);
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    // registration

    protected final void stmt(StatementHandler handler, String... kinds) {
        checkMutable(frozen);
        for (String kind : kinds) {
            statementHandlers.put(kind, handler);
        }
    }

    protected final void expr(ExpressionHandler handler, String... kinds) {
        checkMutable(frozen);
        for (String kind : kinds) {
            expressionHandlers.put(kind, handler);
        }
    }

    /**
     * Register statement kinds that produce no IR.
     *
     * @param kinds The kinds.
     */
    protected final void ignore(String... kinds) {
        stmt((ctx, node) -> {
        }, kinds);
    }

    // lookup

    public @Nullable StatementHandler statementHandler(String kind) {
        return statementHandlers.get(kind);
    }

    public @Nullable ExpressionHandler expressionHandler(String kind) {
        return expressionHandlers.get(kind);
    }

    /**
     * Get every node kind this profile handles.
     *
     * @return The statement and expression kinds.
     */
    public Set<String> handledKinds() {
        Set<String> kinds = new TreeSet<>(statementHandlers.keySet());
        kinds.addAll(expressionHandlers.keySet());
        return kinds;
    }

    /**
     * Whether a node kind is a comment or formatting noise, never lowered.
     *
     * @param kind The kind.
     * @return Whether it is skipped.
     */
    public boolean isSkipped(String kind) {
        return commentTypes.contains(kind) || noiseTypes.contains(kind);
    }

    public boolean isBlock(String kind) {
        return blockTypes.contains(kind);
    }

    public boolean isIdentifier(SyntaxNode node) {
        return identifierTypes.contains(node.getType());
    }

    public boolean isAttribute(SyntaxNode node) {
        return attributeTypes.contains(node.getType());
    }

    public boolean isSubscript(SyntaxNode node) {
        return subscriptTypes.contains(node.getType());
    }

    // structural extraction

    /**
     * Split a member access into its object and member nodes.
     *
     * @param node The member access.
     * @return The object and member, or null if the node does not have that shape.
     */
    public @Nullable Pair<SyntaxNode, SyntaxNode> attributeParts(SyntaxNode node) {
        SyntaxNode obj = node.getChildByFieldName(fields.attrObject());
        SyntaxNode attr = node.getChildByFieldName(fields.attrAttribute());
        List<SyntaxNode> children = node.getChildren();
        if (obj == null && !children.isEmpty()) {
            obj = children.get(0);
        }
        if (attr == null && children.size() > 1) {
            attr = children.get(children.size() - 1);
        }
        return obj == null || attr == null ? null : Pair.of(obj, attr);
    }

    /**
     * Split an index access into its collection and index nodes.
     *
     * @param node The index access.
     * @return The collection and index, or null if the node does not have that shape.
     */
    public @Nullable Pair<SyntaxNode, SyntaxNode> subscriptParts(SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName(fields.subscriptValue());
        SyntaxNode index = node.getChildByFieldName(fields.subscriptIndex());
        List<SyntaxNode> named = node.getNamedChildren();
        if (value == null && !named.isEmpty()) {
            value = named.get(0);
        }
        if (index == null && named.size() > 1) {
            index = named.get(1);
        }
        return value == null || index == null ? null : Pair.of(value, index);
    }

    // parameters

    /**
     * Lower the parameter list of a function.
     *
     * @param ctx    The context.
     * @param params The parameter list node.
     */
    public void lowerParams(LoweringContext ctx, SyntaxNode params) {
        for (SyntaxNode child : params.getNamedChildren()) {
            if (isSkipped(child.getType())) continue;
            lowerParam(ctx, child);
        }
    }

    /**
     * Lower one parameter as {@code SYMBOLIC "param:<name>"} followed by a store of it to the name.
     *
     * @param ctx   The context.
     * @param param The parameter node.
     */
    public void lowerParam(LoweringContext ctx, SyntaxNode param) {
        String name = paramName(ctx, param);
        if (name == null) return;
        Definitions.emitParam(ctx, name, ctx.loc(param));
    }

    /**
     * Extract the name of a parameter.
     *
     * @param ctx   The context.
     * @param param The parameter node.
     * @return The name, or null if this node declares no parameter.
     */
    public @Nullable String paramName(LoweringContext ctx, SyntaxNode param) {
        if (isIdentifier(param)) {
            return ctx.text(param);
        }
        for (String field : new String[]{"name", "pattern"}) {
            SyntaxNode nameNode = param.getChildByFieldName(field);
            if (nameNode != null) {
                return isIdentifier(nameNode) || nameNode.getNamedChildren().isEmpty()
                        ? ctx.text(nameNode)
                        : paramName(ctx, nameNode);
            }
        }
        for (SyntaxNode child : param.getChildren()) {
            if (isIdentifier(child)) return ctx.text(child);
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
