package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.lower.Frontends;
import io.github.eutro.tacflow.core.lower.lang.PascalProfile;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

public class PascalLoweringTest {
    static List<String> lower(String tree) {
        return Utils.lowerText("pascal", tree);
    }

    static String assign(String name, String value) {
        return " (assignment (identifier \"" + name + "\") (kAssign \":=\") " + value + ") \";\"";
    }

    @Test
    void testOperatorTable() {
        List<String> text = lower("(root"
                + assign("x", "(exprBinary (identifier \"a\") operator: (kMod \"mod\") (identifier \"b\"))")
                + assign("y", "(exprBinary (identifier \"a\") operator: \"<>\" (identifier \"b\"))")
                + assign("z", "(exprUnary operator: (kNot \"not\") (identifier \"p\"))")
                + ")");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = load_var a",
                "%1 = load_var b",
                "%2 = binop mod %0 %1",
                "store_var x %2",
                "%3 = load_var a",
                "%4 = load_var b",
                "%5 = binop != %3 %4",
                "store_var y %5",
                "%6 = load_var p",
                "%7 = unop not %6",
                "store_var z %7"
        ), text);
        Assertions.assertEquals("==", PascalProfile.OPERATORS.get("kEq"));
        Assertions.assertEquals("==", PascalProfile.OPERATORS.get("="));
    }

    @Test
    void testCaseArmsAreDisjunctions() {
        List<String> text = lower("(root (case (kCase \"case\") value: (identifier \"x\") (kOf \"of\")"
                + " (caseCase (caseLabel (literalNumber \"1\") \",\" (literalNumber \"2\")) \":\""
                + "   body: (assignment (identifier \"y\") (kAssign \":=\") (literalNumber \"10\"))) \";\""
                + " (caseCase (caseLabel (literalNumber \"3\")) \":\""
                + "   body: (assignment (identifier \"y\") (kAssign \":=\") (literalNumber \"20\"))) \";\""
                + " (kElse \"else\")"
                + assign("y", "(literalNumber \"30\")")
                + " (kEnd \"end\")))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = load_var x",
                "%1 = const 1",
                "%2 = binop == %0 %1",
                "%3 = const 2",
                "%4 = binop == %0 %3",
                "%5 = binop || %2 %4",
                "branch_if %5 case_body_1,case_next_2",
                "case_body_1:",
                "%6 = const 10",
                "store_var y %6",
                "branch switch_end_0",
                "case_next_2:",
                "%7 = const 3",
                "%8 = binop == %0 %7",
                "branch_if %8 case_body_3,case_next_4",
                "case_body_3:",
                "%9 = const 20",
                "store_var y %9",
                "branch switch_end_0",
                "case_next_4:",
                "%10 = const 30",
                "store_var y %10",
                "branch switch_end_0",
                "switch_end_0:"
        ), text);
    }

    @Test
    void testDownto() {
        List<String> text = lower("(root (for (kFor \"for\")"
                + " start: (assignment (identifier \"i\") (kAssign \":=\") (literalNumber \"10\"))"
                + " (kDownto \"downto\") end: (literalNumber \"1\") (kDo \"do\")"
                + " body: (exprCall entity: (identifier \"f\") args: (exprArgs \"(\" (identifier \"i\") \")\"))))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = const 10",
                "%1 = const 1",
                "%2 = const -1",
                "store_var i %0",
                "for_cond_0:",
                "%3 = load_var i",
                "%4 = binop >= %3 %1",
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
    void testFunctionReturnsResult() {
        List<String> text = lower("(root (defProc"
                + " (declProc (kFunction \"function\") name: (identifier \"one\") \":\""
                + "   type: (typeref (identifier \"Integer\")) \";\")"
                + " body: (block (kBegin \"begin\")" + assign("Result", "(literalNumber \"1\")") + " (kEnd \"end\"))"
                + " \";\"))");
        Utils.assertContainsInOrder(text,
                "func_one_0:",
                "%0 = const 1",
                "store_var Result %0",
                "%1 = load_var Result",
                "return %1",
                "end_one_1:");
    }

    @Test
    void testHandledKinds() {
        Assertions.assertTrue(Frontends.profile("pascal").handledKinds().containsAll(Arrays.asList(
                "exprBinary", "exprUnary", "case", "for", "repeat", "ifElse", "defProc", "exprSubscript")));
    }
}
