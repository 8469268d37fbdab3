package io.github.eutro.tacflow.core.analysis;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A catalogue of the functions and classes of a lowered unit.
 *
 * @see io.github.eutro.tacflow.core.passes.meta.BuildRegistry
 */
public final class FunctionRegistry {
    /**
     * The parameter names of each function, in declaration order, by entry label.
     */
    public final Map<String, List<String>> functionParams = new LinkedHashMap<>();
    /**
     * The body label of each class, by class name.
     */
    public final Map<String, String> classes = new LinkedHashMap<>();
    /**
     * The methods of each class, as method name to entry label, by class name.
     */
    public final Map<String, Map<String, String>> classMethods = new LinkedHashMap<>();

    /**
     * Find the entry label of a method.
     *
     * @param className The class name.
     * @param method    The method name.
     * @return The label, or null if the class has no such method.
     */
    public @Nullable String methodLabel(String className, String method) {
        Map<String, String> methods = classMethods.get(className);
        return methods == null ? null : methods.get(method);
    }

    @Override
    public String toString() {
        return "FunctionRegistry{functions=" + functionParams + ", classes=" + classes
                + ", methods=" + classMethods + "}";
    }
}
