package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.cfg.CFG;
import io.github.eutro.tacflow.core.cfg.Edge;
import io.github.eutro.tacflow.core.cfg.EdgeKind;
import io.github.eutro.tacflow.core.ir.*;
import io.github.eutro.tacflow.core.passes.Passes;
import io.github.eutro.tacflow.core.passes.misc.MergeFragments;
import io.github.eutro.tacflow.core.passes.misc.Renumber;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.regex.Matcher;

public class MergeFragmentsTest {
    static final String FIRST = "(module (function_definition \"def\" name: (identifier \"f\")"
            + " parameters: (parameters \"(\" \")\") \":\" body: (block (return_statement \"return\" (integer \"1\")))))";
    static final String SECOND = "(module (function_definition \"def\" name: (identifier \"g\")"
            + " parameters: (parameters \"(\" \")\") \":\""
            + " body: (block (while_statement \"while\" condition: (identifier \"x\") \":\""
            + "   body: (block (expression_statement (call function: (identifier \"f\")"
            + "     arguments: (argument_list \"(\" \")\"))))))))";

    @Test
    void testMerge() {
        List<IRInstruction> merged = MergeFragments.INSTANCE.run(Arrays.asList(
                Utils.lower("python", FIRST),
                Utils.lower("python", SECOND)
        ));
        List<String> labels = Utils.labels(merged);
        Assertions.assertEquals(labels.size(), new HashSet<>(labels).size(), labels::toString);
        Assertions.assertEquals(1, Collections.frequency(labels, IRNames.ENTRY_LABEL));
        Assertions.assertEquals(IRNames.ENTRY_LABEL, labels.get(0));
        Assertions.assertTrue(labels.contains("func_g_2"), labels::toString);

        Set<Reg> written = new HashSet<>();
        for (IRInstruction insn : merged) {
            if (insn.getResult() != null) {
                Assertions.assertTrue(written.add(insn.getResult()), insn::toText);
            }
        }
        for (IRInstruction insn : merged) {
            for (Reg read : insn.readRegs()) Assertions.assertTrue(written.contains(read), insn::toText);
            for (String target : insn.jumpTargets()) Assertions.assertTrue(labels.contains(target), insn::toText);
            for (Object operand : insn.getOperands()) {
                if (!(operand instanceof String)) continue;
                Matcher m = IRNames.REF.matcher((String) operand);
                if (m.matches()) Assertions.assertTrue(labels.contains(m.group(3)), insn::toText);
            }
        }

        CFG cfg = Passes.BUILD_CFG.run(merged);
        Assertions.assertTrue(cfg.edges().stream()
                .anyMatch($ -> $.kind == EdgeKind.CALL && $.to.equals("func_f_0")), cfg::toString);
        Assertions.assertTrue(cfg.edges().contains(new Edge("func_g_2", "while_cond_4", EdgeKind.FALLTHROUGH)),
                cfg::toString);
    }

    @Test
    void testSingleFragment() {
        List<IRInstruction> insns = Utils.lower("python", FIRST);
        Assertions.assertEquals(insns, MergeFragments.INSTANCE.run(Collections.singletonList(insns)));
        Assertions.assertTrue(MergeFragments.INSTANCE.run(Collections.emptyList()).isEmpty());
    }

    @Test
    void testRenumber() {
        Renumber renumber = new Renumber(10, 5);
        Assertions.assertEquals("if_true_5", renumber.shiftLabel("if_true_0"));
        Assertions.assertEquals("entry", renumber.shiftLabel("entry"));
        List<IRInstruction> out = renumber.run(Arrays.asList(
                IRInstruction.produce(Opcode.CONST, Reg.of(0),
                        Collections.singletonList(IRNames.functionRef("f", "func_f_0")), SourceLocation.UNKNOWN),
                IRInstruction.branchIf(Reg.of(0), BranchTargets.of("a_1", "b_2"), SourceLocation.UNKNOWN)
        ));
        Assertions.assertEquals("%10 = const <function:f@func_f_5>", out.get(0).toText());
        Assertions.assertEquals("branch_if %10 a_6,b_7", out.get(1).toText());
    }
}
