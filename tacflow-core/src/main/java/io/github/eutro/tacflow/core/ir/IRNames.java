package io.github.eutro.tacflow.core.ir;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming conventions shared by the frontends and the CFG builder.
 * <p>
 * The function and class label prefixes are load-bearing: the CFG renderer groups blocks into
 * subgraphs purely by matching them.
 */
public final class IRNames {
    private IRNames() {
    }

    public static final String ENTRY_LABEL = "entry";
    public static final String FUNC_LABEL_PREFIX = "func_";
    public static final String END_LABEL_PREFIX = "end_";
    public static final String CLASS_LABEL_PREFIX = "class_";
    public static final String END_CLASS_LABEL_PREFIX = "end_class_";

    public static final String PARAM_PREFIX = "param:";
    public static final String UNSUPPORTED_PREFIX = "unsupported:";
    public static final String CAUGHT_EXCEPTION_PREFIX = "caught_exception:";

    /**
     * Matches a generated label, capturing the prefix and the counter.
     */
    public static final Pattern NUMBERED_LABEL = Pattern.compile("(.*)_(\\d+)");
    /**
     * Matches a function or class reference constant, capturing the kind, the name and the label.
     */
    public static final Pattern REF = Pattern.compile("<(function|class):([^@>]*)@([^>]+)>");

    /**
     * Format a function reference constant.
     *
     * @param name  The function name.
     * @param label The label of the function's entry block.
     * @return The constant, {@code <function:name@label>}.
     */
    public static String functionRef(String name, String label) {
        return "<function:" + name + "@" + label + ">";
    }

    /**
     * Format a class reference constant.
     *
     * @param name  The class name.
     * @param label The label of the class body.
     * @return The constant, {@code <class:name@label>}.
     */
    public static String classRef(String name, String label) {
        return "<class:" + name + "@" + label + ">";
    }

    /**
     * Strip the trailing {@code _<counter>} of a generated label.
     *
     * @param label The label.
     * @return The label without its counter, or the label itself if it has none.
     */
    public static String stripCounter(String label) {
        Matcher m = NUMBERED_LABEL.matcher(label);
        return m.matches() ? m.group(1) : label;
    }
}
