package ch.epfl.vlsc.vhdl.phase;

import ch.epfl.vlsc.vhdl.attribute.DesignQueries;
import ch.epfl.vlsc.vhdl.attribute.TypeAnnotations;
import ch.epfl.vlsc.vhdl.ir.design.DelaySensitivity;
import ch.epfl.vlsc.vhdl.ir.design.EnumType;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.ProcessKind;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBinaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprComparison;
import ch.epfl.vlsc.vhdl.ir.expr.ExprEnumItem;
import ch.epfl.vlsc.vhdl.ir.expr.ExprSlice;
import ch.epfl.vlsc.vhdl.ir.expr.ExprVariable;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAugmentedAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtBreak;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtFor;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtIf;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtWait;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueNext;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueVariable;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.type.BitType;
import ch.epfl.vlsc.vhdl.type.BoolType;
import ch.epfl.vlsc.vhdl.type.IntType;
import ch.epfl.vlsc.vhdl.type.SignedType;
import ch.epfl.vlsc.vhdl.type.UnsignedType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;

import static ch.epfl.vlsc.vhdl.DesignFixtures.add;
import static ch.epfl.vlsc.vhdl.DesignFixtures.assertConversionError;
import static ch.epfl.vlsc.vhdl.DesignFixtures.eq;
import static ch.epfl.vlsc.vhdl.DesignFixtures.literal;
import static ch.epfl.vlsc.vhdl.DesignFixtures.name;
import static ch.epfl.vlsc.vhdl.DesignFixtures.next;
import static ch.epfl.vlsc.vhdl.DesignFixtures.when;
import static ch.epfl.vlsc.vhdl.DesignFixtures.ifThen;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypeInferenceTest {

    private static TypeAnnotations infer(Process process) {
        TypeAnnotations.Builder annotations = TypeAnnotations.builder();
        new TypeInference(process, new DesignQueries(), annotations,
                Collections.newSetFromMap(new IdentityHashMap<>())).run();
        return annotations.build();
    }

    private static Process.Builder logic(ProcessKind kind) {
        return Process.builder("logic", kind)
                .signal(Signal.unsigned("a", 8, 0))
                .signal(Signal.unsigned("b", 4, 0))
                .signal(Signal.signed("s", 4, 0))
                .signal(Signal.bool("bit", false))
                .signal(Signal.unsigned("y", 8, 0));
    }

    @Test
    void vectorPlusIntegerKeepsTheVector() {
        ExprBinaryOp sum = add(name("a"), literal(1));
        StmtAssignment assignment = next("y", sum);
        TypeAnnotations types = infer(logic(ProcessKind.COMBINATIONAL).body(assignment).build());
        assertEquals(new UnsignedType(8), types.typeOf(sum));
        assertSame(IntType.INSTANCE, types.typeOf(sum.getRight()));
        assertEquals(new UnsignedType(8), types.typeOf(assignment.getTarget()));
    }

    @Test
    void twoUnsignedVectorsGiveTheWidestVector() {
        ExprBinaryOp sum = add(name("a"), name("b"));
        TypeAnnotations types = infer(logic(ProcessKind.COMBINATIONAL).body(next("y", sum)).build());
        assertEquals(new UnsignedType(8), types.typeOf(sum));
    }

    @Test
    void signedWithUnsignedIsAddedAsIntegers() {
        ExprBinaryOp sum = add(name("s"), name("b"));
        TypeAnnotations types = infer(logic(ProcessKind.COMBINATIONAL).body(next("y", sum)).build());
        assertSame(IntType.INSTANCE, types.typeOf(sum));
    }

    @Test
    void comparisonForcesItsOperandsToTheCombinedType() {
        ExprComparison less = new ExprComparison(ExprComparison.Operator.LT, name("s"), name("b"));
        StmtIf stmt = ifThen(when(less, next("y", literal(0))));
        TypeAnnotations types = infer(logic(ProcessKind.COMBINATIONAL).body(stmt).build());
        assertEquals(new SignedType(4), types.typeOf(less.getLeft()));
        assertEquals(new SignedType(4), types.typeOf(less.getRight()));
        assertSame(BoolType.INSTANCE, types.typeOf(less));
        assertTrue(types.isSignedContext(less));
    }

    @Test
    void bitComparedWithLiteral() {
        ExprComparison test = eq(name("bit"), literal(1));
        TypeAnnotations types = infer(logic(ProcessKind.COMBINATIONAL)
                .body(ifThen(when(test, next("y", literal(0))))).build());
        assertSame(BitType.INSTANCE, types.typeOf(test.getRight()));
        assertFalse(types.isSignedContext(test));
    }

    @Test
    void slicesHaveTheirWidth() {
        ExprSlice low = new ExprSlice(name("a"), literal(4), null);
        TypeAnnotations types = infer(logic(ProcessKind.COMBINATIONAL).body(next("y", low)).build());
        assertEquals(new UnsignedType(4), types.typeOf(low));
    }

    @Test
    void emptySliceIsMalformed() {
        Process process = logic(ProcessKind.COMBINATIONAL)
                .body(next("y", new ExprSlice(name("a"), literal(2), literal(2)))).build();
        assertConversionError(ConversionErrors.STRUCTURE, () -> infer(process));
    }

    @Test
    void loopIndexIsAnUndeclaredInteger() {
        StmtAssignment body = new StmtAssignment(new LValueVariable("acc"), name("i"));
        Process process = logic(ProcessKind.COMBINATIONAL)
                .variable(Variable.integer("acc"))
                .body(StmtFor.range("i", literal(0), literal(4), Arrays.asList(body)))
                .build();
        TypeAnnotations types = infer(process);
        assertSame(IntType.INSTANCE, types.typeOf(body.getValue()));
        assertTrue(types.isLoopVariable(process, "i"));
        assertFalse(types.isLoopVariable(process, "acc"));
    }

    @Test
    void loopStepMustBeOne() {
        StmtFor loop = new StmtFor("i", StmtFor.Direction.ASCENDING, literal(0), literal(8), literal(2),
                Arrays.asList(next("y", name("i"))));
        assertConversionError(ConversionErrors.LOOP_STEP, () -> infer(logic(ProcessKind.COMBINATIONAL).body(loop).build()));
    }

    @Test
    void breakOutsideOfALoop() {
        assertConversionError(ConversionErrors.STRUCTURE,
                () -> infer(logic(ProcessKind.COMBINATIONAL).body(new StmtBreak()).build()));
    }

    @Test
    void waitOnlyInInitialProcesses() {
        StmtWait wait = new StmtWait(Arrays.asList(new DelaySensitivity(10)));
        assertConversionError(ConversionErrors.NOT_SUPPORTED,
                () -> infer(logic(ProcessKind.SEQUENTIAL).body(wait).build()));
        infer(logic(ProcessKind.INITIAL).body(new StmtWait(Arrays.asList(new DelaySensitivity(10)))).build());
    }

    @Test
    void bitwiseOperatorOnSignedVector() {
        ExprBinaryOp and = new ExprBinaryOp(ExprBinaryOp.Operator.BITAND, name("s"), literal(3));
        assertConversionError(ConversionErrors.NOT_SUPPORTED,
                () -> infer(logic(ProcessKind.COMBINATIONAL).body(next("y", and)).build()));
    }

    @Test
    void trueDivisionIsRejected() {
        StmtAugmentedAssignment divide = new StmtAugmentedAssignment(StmtAugmentedAssignment.Operator.TRUEDIV,
                LValueNext.of("y"), literal(2));
        assertConversionError(ConversionErrors.NOT_SUPPORTED,
                () -> infer(logic(ProcessKind.COMBINATIONAL).body(divide).build()));
    }

    @Test
    void enumerationComparedWithInteger() {
        EnumType state = new EnumType("state", Arrays.asList("IDLE", "RUN"));
        Process process = logic(ProcessKind.COMBINATIONAL)
                .symbol("t_state", state)
                .signal(Signal.enumerated("current", state.getItem("IDLE").get()))
                .body(ifThen(when(eq(name("current"), literal(0)), next("y", literal(0)))))
                .build();
        assertConversionError(ConversionErrors.UNSUPPORTED_TYPE, () -> infer(process));
    }

    @Test
    void unknownEnumerationItem() {
        EnumType state = new EnumType("state", Arrays.asList("IDLE", "RUN"));
        Process process = logic(ProcessKind.COMBINATIONAL)
                .symbol("t_state", state)
                .signal(Signal.enumerated("current", state.getItem("IDLE").get()))
                .body(next("current", new ExprEnumItem("t_state", "STOP")))
                .build();
        assertConversionError(ConversionErrors.UNDEFINED_NAME, () -> infer(process));
    }

    @Test
    void assignmentToUndefinedName() {
        Process process = logic(ProcessKind.COMBINATIONAL).body(next("z", new ExprVariable("a"))).build();
        assertConversionError(ConversionErrors.UNDEFINED_NAME, () -> infer(process));
    }
}
