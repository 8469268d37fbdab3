package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.analysis.FunctionRegistry;
import io.github.eutro.tacflow.core.passes.Passes;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;

public class RegistryTest {
    static String def(String name, String params) {
        return " (function_definition \"def\" name: (identifier \"" + name + "\")"
                + " parameters: (parameters \"(\"" + params + " \")\") \":\" body: (block (pass_statement \"pass\")))";
    }

    static String classDef(String name, String body) {
        return " (class_definition \"class\" name: (identifier \"" + name + "\") \":\" body: (block" + body + "))";
    }

    @Test
    void testClassesAndParams() {
        FunctionRegistry registry = Passes.REGISTRY.run(Utils.lower("python", "(module"
                + classDef("A",
                def("m", " (identifier \"self\") \",\" (identifier \"k\")")
                        + def("n", " (identifier \"self\")"))
                + def("top", " (identifier \"a\") \",\" (identifier \"b\")") + ")"));

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("func_m_2", Arrays.asList("self", "k"));
        params.put("func_n_4", Collections.singletonList("self"));
        params.put("func_top_6", Arrays.asList("a", "b"));
        Assertions.assertEquals(params, new LinkedHashMap<>(registry.functionParams));

        Assertions.assertEquals(Collections.singletonMap("A", "class_A_0"), registry.classes);
        Assertions.assertEquals("func_m_2", registry.methodLabel("A", "m"));
        Assertions.assertEquals("func_n_4", registry.methodLabel("A", "n"));
        Assertions.assertNull(registry.methodLabel("A", "top"));
        Assertions.assertNull(registry.methodLabel("B", "m"));
    }

    @Test
    void testNestedClasses() {
        FunctionRegistry registry = Passes.REGISTRY.run(Utils.lower("python", "(module"
                + classDef("Outer",
                classDef("Inner", def("f", " (identifier \"self\")"))
                        + def("g", " (identifier \"self\")")) + ")"));
        Assertions.assertEquals(new HashSet<>(Arrays.asList("Outer", "Inner")), registry.classes.keySet());
        Assertions.assertEquals("class_Inner_2", registry.classes.get("Inner"));
        Assertions.assertEquals(Collections.singletonMap("f", "func_f_4"), registry.classMethods.get("Inner"));
        Assertions.assertEquals(Collections.singletonMap("g", "func_g_6"), registry.classMethods.get("Outer"));
    }

    @Test
    void testNoFunctions() {
        FunctionRegistry registry = Passes.REGISTRY.run(Utils.lower("python", "(module (expression_statement (integer \"1\")))"));
        Assertions.assertTrue(registry.functionParams.isEmpty());
        Assertions.assertTrue(registry.classes.isEmpty());
        Assertions.assertTrue(registry.classMethods.isEmpty());
    }
}
