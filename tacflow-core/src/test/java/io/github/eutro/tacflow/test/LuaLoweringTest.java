package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.lower.Frontends;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

public class LuaLoweringTest {
    static List<String> lower(String tree) {
        return Utils.lowerText("lua", tree);
    }

    static String numericFor(String clause) {
        return "(chunk (for_statement \"for\" clause: (for_numeric_clause name: (identifier \"i\") \"=\" " + clause + ")"
                + " \"do\" body: (block (function_call name: (identifier \"f\")"
                + "   arguments: (arguments \"(\" (identifier \"i\") \")\"))) \"end\"))";
    }

    @Test
    void testTableConstructor() {
        List<String> text = lower("(chunk (assignment_statement (variable_list name: (identifier \"t\")) \"=\""
                + " (expression_list value: (table_constructor \"{\""
                + "   (field value: (number \"1\")) \",\""
                + "   (field name: (identifier \"x\") \"=\" value: (number \"2\")) \",\""
                + "   (field \"[\" name: (identifier \"k\") \"]\" \"=\" value: (number \"3\"))"
                + " \"}\"))))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = new_object table",
                "%1 = const 1",
                "%2 = const 1",
                "store_index %0 %1 %2",
                "%3 = const x",
                "%4 = const 2",
                "store_index %0 %3 %4",
                "%5 = load_var k",
                "%6 = const 3",
                "store_index %0 %5 %6",
                "store_var t %0"
        ), text);
    }

    @Test
    void testNumericForCountsUp() {
        List<String> text = lower(numericFor("start: (number \"1\") \",\" end: (identifier \"n\")"));
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = const 1",
                "%1 = load_var n",
                "%2 = const 1",
                "store_var i %0",
                "for_cond_0:",
                "%3 = load_var i",
                "%4 = binop <= %3 %1",
                "branch_if %4 for_body_1,for_end_3",
                "for_body_1:",
                "%5 = load_var i",
                "%6 = call_function f %5",
                "for_update_2:",
                "%7 = load_var i",
                "%8 = binop + %7 %2",
                "store_var i %8",
                "branch for_cond_0",
                "for_end_3:"
        ), text);
    }

    @Test
    void testNumericForNegativeStepCountsDown() {
        List<String> text = lower(numericFor("start: (number \"10\") \",\" end: (number \"1\") \",\""
                + " step: (unary_expression \"-\" operand: (number \"1\"))"));
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = const 10",
                "%1 = const 1",
                "%2 = const 1",
                "%3 = unop - %2",
                "store_var i %0",
                "for_cond_0:",
                "%4 = load_var i",
                "%5 = binop >= %4 %1",
                "branch_if %5 for_body_1,for_end_3",
                "for_body_1:",
                "%6 = load_var i",
                "%7 = call_function f %6",
                "for_update_2:",
                "%8 = load_var i",
                "%9 = binop + %8 %3",
                "store_var i %9",
                "branch for_cond_0",
                "for_end_3:"
        ), text);
    }

    @Test
    void testMissingValuesAreNil() {
        List<String> text = lower("(chunk (assignment_statement"
                + " (variable_list name: (identifier \"a\") \",\" name: (identifier \"b\")) \"=\""
                + " (expression_list value: (number \"1\"))))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = const 1",
                "store_var a %0",
                "%1 = const nil",
                "store_var b %1"
        ), text);
    }

    @Test
    void testHandledKinds() {
        Assertions.assertTrue(Frontends.profile("lua").handledKinds().containsAll(Arrays.asList(
                "table_constructor", "for_statement", "assignment_statement", "variable_declaration",
                "function_declaration", "repeat_statement", "bracket_index_expression")));
    }
}
