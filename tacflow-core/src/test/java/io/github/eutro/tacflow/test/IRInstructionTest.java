package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.ir.*;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class IRInstructionTest {
    @Test
    void testToText() {
        IRInstruction binop = IRInstruction.produce(Opcode.BINOP, Reg.of(2),
                Arrays.asList("+", Reg.of(0), Reg.of(1)), SourceLocation.of(3, 4, 3, 9));
        Assertions.assertEquals("%2 = binop + %0 %1", binop.toText());
        Assertions.assertEquals("%2 = binop + %0 %1  # 3:4-3:9", binop.toString());
        Assertions.assertEquals(Arrays.asList(Reg.of(0), Reg.of(1)), binop.readRegs());
        Assertions.assertTrue(binop.jumpTargets().isEmpty());

        IRInstruction branchIf = IRInstruction.branchIf(Reg.of(0), BranchTargets.of("t_0", "f_1"), SourceLocation.UNKNOWN);
        Assertions.assertEquals("branch_if %0 t_0,f_1", branchIf.toText());
        Assertions.assertEquals("t_0,f_1", branchIf.getLabel());
        Assertions.assertEquals(Arrays.asList("t_0", "f_1"), branchIf.jumpTargets());

        Assertions.assertEquals("loop_0:", IRInstruction.label("loop_0").toText());
        Assertions.assertEquals(Collections.singletonList("loop_0"),
                IRInstruction.branch("loop_0", SourceLocation.UNKNOWN).jumpTargets());
    }

    @Test
    void testValidation() {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> IRInstruction.consume(Opcode.CONST, Collections.singletonList("1"), SourceLocation.UNKNOWN));
        Assertions.assertEquals("CONST must produce a result register", e.getMessage());

        e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> IRInstruction.produce(Opcode.RETURN, Reg.of(0), Collections.emptyList(), SourceLocation.UNKNOWN));
        Assertions.assertEquals("RETURN cannot produce a result register", e.getMessage());

        e = Assertions.assertThrows(IllegalArgumentException.class, () -> IRInstruction.label(""));
        Assertions.assertEquals("LABEL requires a label", e.getMessage());

        e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> IRInstruction.consume(Opcode.BRANCH_IF, Collections.singletonList(Reg.of(0)), SourceLocation.UNKNOWN));
        Assertions.assertEquals("branch_if requires two targets", e.getMessage());

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> IRInstruction.produce(Opcode.CONST, Reg.of(0), Collections.singletonList(1), SourceLocation.UNKNOWN));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Reg.of(-1));
    }

    @Test
    void testBranchTargets() {
        BranchTargets targets = BranchTargets.parse("if_true_0,if_end_2");
        Assertions.assertEquals("if_true_0", targets.ifTrue);
        Assertions.assertEquals("if_end_2", targets.ifFalse);
        Assertions.assertEquals("if_true_0,if_end_2", targets.serialize());
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> BranchTargets.parse("a,b,c"));
        Assertions.assertEquals("expected two comma separated labels, got 'a,b,c'", e.getMessage());
        Assertions.assertThrows(IllegalArgumentException.class, () -> BranchTargets.parse("a"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> BranchTargets.parse(",b"));
    }

    @Test
    void testNames() {
        Assertions.assertEquals("func_gcd", IRNames.stripCounter("func_gcd_12"));
        Assertions.assertEquals("entry", IRNames.stripCounter("entry"));
        Assertions.assertEquals("<function:f@func_f_0>", IRNames.functionRef("f", "func_f_0"));
        Assertions.assertTrue(IRNames.REF.matcher(IRNames.classRef("A", "class_A_3")).matches());
        Assertions.assertTrue(Opcode.THROW.isTerminator());
        Assertions.assertFalse(Opcode.CALL_FUNCTION.isTerminator());
        Assertions.assertFalse(Opcode.LABEL.isProducer());
        Assertions.assertEquals("call_method", Opcode.CALL_METHOD.mnemonic());
    }

    @Test
    void testStats() {
        List<IRInstruction> insns = Arrays.asList(
                IRInstruction.label("entry"),
                IRInstruction.produce(Opcode.SYMBOLIC, Reg.of(0), Collections.singletonList("param:x"), SourceLocation.UNKNOWN),
                IRInstruction.produce(Opcode.SYMBOLIC, Reg.of(1), Collections.singletonList("unsupported:yield"), SourceLocation.UNKNOWN),
                IRInstruction.produce(Opcode.SYMBOLIC, Reg.of(2), Collections.singletonList("unsupported:await"), SourceLocation.UNKNOWN),
                IRInstruction.consume(Opcode.RETURN, Collections.singletonList(Reg.of(0)), SourceLocation.UNKNOWN)
        );
        Map<Opcode, Integer> counts = IRStats.countOpcodes(insns);
        Assertions.assertEquals(3, counts.get(Opcode.SYMBOLIC));
        Assertions.assertEquals(1, counts.get(Opcode.LABEL));
        Assertions.assertEquals(1, counts.get(Opcode.RETURN));
        Assertions.assertFalse(counts.containsKey(Opcode.CONST));
        Assertions.assertEquals(2, IRStats.countUnsupported(insns));
    }
}
