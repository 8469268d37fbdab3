package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.cfg.CFG;
import io.github.eutro.tacflow.core.cfg.Edge;
import io.github.eutro.tacflow.core.cfg.EdgeKind;
import io.github.eutro.tacflow.core.cfg.MermaidRenderer;
import io.github.eutro.tacflow.core.ir.*;
import io.github.eutro.tacflow.core.lower.Frontends;
import io.github.eutro.tacflow.core.passes.Passes;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.*;
import java.util.stream.Stream;

public class RosettaTest {
    static final List<String> PROGRAMS = Arrays.asList(
            "gcd", "factorial", "bubble_sort", "fibonacci", "fizzbuzz", "is_prime");

    static Stream<DynamicTest> forEachProgram(String what, Check check) {
        return PROGRAMS.stream().flatMap(program -> Frontends.SUPPORTED_LANGUAGES.stream()
                .map(lang -> DynamicTest.dynamicTest(what + " " + program + "/" + lang, () -> {
                    List<IRInstruction> insns = Utils.lowerResource(lang, "/rosetta/" + program + "/" + lang + ".sexp");
                    check.check(program, lang, insns);
                })));
    }

    interface Check {
        void check(String program, String lang, List<IRInstruction> insns) throws Throwable;
    }

    @TestFactory
    Stream<DynamicTest> testWellFormed() {
        return forEachProgram("well formed", (program, lang, insns) -> {
            Assertions.assertFalse(insns.isEmpty());
            Assertions.assertEquals(IRInstruction.label(IRNames.ENTRY_LABEL), insns.get(0));
            Assertions.assertEquals(0, IRStats.countUnsupported(insns), () -> Utils.dump(insns));

            Set<Reg> written = new HashSet<>();
            for (IRInstruction insn : insns) {
                Reg result = insn.getResult();
                if (result != null) {
                    Assertions.assertTrue(written.add(result), () -> result + " written twice");
                }
            }
            for (int i = 0; i < written.size(); i++) {
                Assertions.assertTrue(written.contains(Reg.of(i)), "register %" + i + " is never written");
            }
            for (IRInstruction insn : insns) {
                for (Reg read : insn.readRegs()) {
                    Assertions.assertTrue(written.contains(read), () -> insn.toText() + " reads unwritten " + read);
                }
            }

            List<String> labels = Utils.labels(insns);
            Assertions.assertEquals(labels.size(), new HashSet<>(labels).size(), () -> "duplicate labels " + labels);
            for (IRInstruction insn : insns) {
                for (String target : insn.jumpTargets()) {
                    Assertions.assertTrue(labels.contains(target), () -> insn.toText() + " jumps nowhere");
                }
            }
            Assertions.assertTrue(labels.stream().anyMatch($ -> IRNames.stripCounter($).equals("func_" + program)),
                    () -> "no function label in " + labels);
        });
    }

    @TestFactory
    Stream<DynamicTest> testProgramShape() {
        return forEachProgram("shape", (program, lang, insns) -> {
            Map<Opcode, Integer> counts = IRStats.countOpcodes(insns);
            Assertions.assertTrue(counts.containsKey(Opcode.BRANCH_IF), () -> Utils.dump(insns));
            Assertions.assertTrue(counts.containsKey(Opcode.RETURN));
            switch (program) {
                case "gcd":
                case "fizzbuzz":
                case "is_prime":
                    Assertions.assertTrue(Utils.withOpcode(insns, Opcode.BINOP).stream()
                                    .anyMatch($ -> $.getOperands().get(0).equals("%")
                                            || $.getOperands().get(0).equals("mod")),
                            () -> Utils.dump(insns));
                    break;
                case "factorial":
                case "fibonacci":
                    Assertions.assertTrue(Utils.withOpcode(insns, Opcode.CALL_FUNCTION).stream()
                                    .anyMatch($ -> $.getOperands().get(0).equals(program)),
                            () -> Utils.dump(insns));
                    break;
                case "bubble_sort":
                    Assertions.assertTrue(counts.containsKey(Opcode.STORE_INDEX), () -> Utils.dump(insns));
                    // a(i) reads are calls in scala
                    if (!lang.equals("scala")) {
                        Assertions.assertTrue(counts.containsKey(Opcode.LOAD_INDEX), () -> Utils.dump(insns));
                    }
                    break;
                default:
                    Assertions.fail("no shape for " + program);
            }
        });
    }

    @TestFactory
    Stream<DynamicTest> testCfg() {
        return forEachProgram("cfg", (program, lang, insns) -> {
            CFG cfg = Passes.BUILD_CFG.run(insns);
            Assertions.assertEquals(IRNames.ENTRY_LABEL, cfg.entry);
            Assertions.assertTrue(cfg.edges().stream().anyMatch($ -> $.kind == EdgeKind.TRUE));
            Assertions.assertTrue(cfg.edges().stream().anyMatch($ -> $.kind == EdgeKind.FALSE));
            for (Edge edge : cfg.edges()) {
                Assertions.assertTrue(cfg.blocks.containsKey(edge.to));
            }
            if (program.equals("factorial") || program.equals("fibonacci")) {
                Assertions.assertTrue(cfg.edges().stream()
                                .anyMatch($ -> $.kind == EdgeKind.CALL
                                        && IRNames.stripCounter($.to).equals("func_" + program)),
                        cfg::toString);
            }

            CFG function = Passes.functionCfg(program).run(insns);
            Assertions.assertEquals("func_" + program, IRNames.stripCounter(function.entry));
            Assertions.assertFalse(function.blocks.containsKey(IRNames.ENTRY_LABEL));
            String chart = Passes.functionMermaid(program).run(insns);
            Assertions.assertTrue(chart.startsWith("flowchart TD\n"));
            Assertions.assertTrue(chart.contains("style " + MermaidRenderer.nodeId(function.entry)), chart);
        });
    }

    @Test
    void testCommonOpcodes() throws Throwable {
        for (String program : PROGRAMS) {
            Set<Opcode> common = EnumSet.allOf(Opcode.class);
            for (String lang : Frontends.SUPPORTED_LANGUAGES) {
                List<IRInstruction> insns = Utils.lowerResource(lang, "/rosetta/" + program + "/" + lang + ".sexp");
                common.retainAll(IRStats.countOpcodes(insns).keySet());
            }
            Assertions.assertTrue(common.containsAll(EnumSet.of(Opcode.LABEL, Opcode.CONST, Opcode.LOAD_VAR,
                    Opcode.STORE_VAR, Opcode.SYMBOLIC, Opcode.BINOP, Opcode.BRANCH_IF, Opcode.BRANCH, Opcode.RETURN)),
                    program + " " + common);
        }
    }

    @Test
    void testComparableSizes() throws Throwable {
        for (String program : PROGRAMS) {
            Map<String, Integer> sizes = new TreeMap<>();
            for (String lang : Frontends.SUPPORTED_LANGUAGES) {
                sizes.put(lang, Utils.lowerResource(lang, "/rosetta/" + program + "/" + lang + ".sexp").size());
            }
            List<Integer> sorted = new ArrayList<>(sizes.values());
            Collections.sort(sorted);
            int median = sorted.get(sorted.size() / 2);
            for (Map.Entry<String, Integer> entry : sizes.entrySet()) {
                Assertions.assertTrue(entry.getValue() <= 5 * median,
                        () -> program + "/" + entry.getKey() + " lowers to " + entry.getValue()
                                + " instructions, median " + median + " in " + sizes);
            }
        }
    }
}
