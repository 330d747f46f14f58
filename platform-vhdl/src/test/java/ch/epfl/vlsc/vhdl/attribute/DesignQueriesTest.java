package ch.epfl.vlsc.vhdl.attribute;

import ch.epfl.vlsc.vhdl.ir.design.Constant;
import ch.epfl.vlsc.vhdl.ir.design.EdgeKind;
import ch.epfl.vlsc.vhdl.ir.design.EdgeSensitivity;
import ch.epfl.vlsc.vhdl.ir.design.Memory;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.ProcessKind;
import ch.epfl.vlsc.vhdl.ir.design.Rom;
import ch.epfl.vlsc.vhdl.ir.design.Sensitivity;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.ir.expr.ExprApplication;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBinaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprEdge;
import ch.epfl.vlsc.vhdl.ir.expr.ExprIndexer;
import ch.epfl.vlsc.vhdl.ir.expr.ExprSlice;
import ch.epfl.vlsc.vhdl.ir.expr.ExprUnaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.reporting.CompilationException;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static ch.epfl.vlsc.vhdl.DesignFixtures.assertConversionError;
import static ch.epfl.vlsc.vhdl.DesignFixtures.eq;
import static ch.epfl.vlsc.vhdl.DesignFixtures.falling;
import static ch.epfl.vlsc.vhdl.DesignFixtures.literal;
import static ch.epfl.vlsc.vhdl.DesignFixtures.name;
import static ch.epfl.vlsc.vhdl.DesignFixtures.rising;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DesignQueriesTest {
    private final DesignQueries queries = new DesignQueries();

    private Signal clk;
    private Signal reset;
    private Process process;

    @BeforeEach
    void setUp() {
        clk = Signal.bool("clk", false);
        reset = Signal.bool("reset", true);
        process = Process.builder("logic", ProcessKind.SEQUENTIAL)
                .signal(clk)
                .signal(reset)
                .signal(Signal.unsigned("data", 8, 0))
                .symbol("WIDTH", Constant.of(12))
                .symbol("table", Rom.of(3, 5, 7))
                .symbol("mem", new Memory("mem", 16, Signal.unsigned("mem_0", 4, 0)))
                .variable(Variable.unsigned("acc", 6))
                .build();
    }

    private Optional<BigInteger> fold(Expression expression) {
        return queries.constantValue(process, expression);
    }

    @Test
    void localVariablesShadowSymbols() {
        Variable local = Variable.integer("clk");
        Process shadowing = Process.builder("p", ProcessKind.COMBINATIONAL).signal(clk).variable(local).build();
        assertSame(local, queries.lookup(shadowing, "clk").get());
        assertSame(clk, queries.lookup(process, "clk").get());
        assertFalse(queries.lookup(process, "missing").isPresent());
    }

    @Test
    void resolveRejectsUnknownNames() {
        assertConversionError(ConversionErrors.UNDEFINED_NAME, () -> queries.resolve(process, name("nope"), "nope"));
    }

    @Test
    void foldsArithmeticOnConstants() {
        assertEquals(Optional.of(BigInteger.valueOf(15)),
                fold(new ExprBinaryOp(ExprBinaryOp.Operator.ADD, name("WIDTH"), literal(3))));
        assertEquals(Optional.of(BigInteger.valueOf(-4)),
                fold(new ExprBinaryOp(ExprBinaryOp.Operator.FLOORDIV, literal(-7), literal(2))));
        assertEquals(Optional.of(BigInteger.valueOf(256)),
                fold(new ExprBinaryOp(ExprBinaryOp.Operator.LSHIFT, literal(1), literal(8))));
        assertEquals(Optional.of(BigInteger.valueOf(-13)),
                fold(new ExprUnaryOp(ExprUnaryOp.Operator.INVERT, name("WIDTH"))));
    }

    @Test
    void signalsAndDivisionByZeroAreNotConstant() {
        assertFalse(fold(new ExprBinaryOp(ExprBinaryOp.Operator.ADD, name("data"), literal(1))).isPresent());
        assertFalse(fold(new ExprBinaryOp(ExprBinaryOp.Operator.MOD, literal(5), literal(0))).isPresent());
    }

    @Test
    void divisionRoundsTowardsNegativeInfinity() {
        assertEquals(BigInteger.valueOf(-4), DesignQueries.floorDiv(BigInteger.valueOf(-7), BigInteger.valueOf(2)));
        assertEquals(BigInteger.ONE, DesignQueries.floorMod(BigInteger.valueOf(-7), BigInteger.valueOf(2)));
        assertEquals(BigInteger.valueOf(-1), DesignQueries.floorMod(BigInteger.valueOf(7), BigInteger.valueOf(-2)));
        assertEquals(BigInteger.valueOf(3), DesignQueries.floorDiv(BigInteger.valueOf(7), BigInteger.valueOf(2)));
    }

    @Test
    void lengthOfSizedObjects() {
        assertEquals(Optional.of(BigInteger.valueOf(8)), fold(new ExprApplication("len", Arrays.asList(name("data")))));
        assertEquals(Optional.of(BigInteger.valueOf(6)), fold(new ExprApplication("len", Arrays.asList(name("acc")))));
        assertEquals(Optional.of(BigInteger.valueOf(16)), fold(new ExprApplication("len", Arrays.asList(name("mem")))));
        assertEquals(Optional.of(BigInteger.valueOf(3)), fold(new ExprApplication("len", Arrays.asList(name("table")))));
    }

    @Test
    void constantRomEntryAndSlice() {
        assertEquals(Optional.of(BigInteger.valueOf(7)), fold(new ExprIndexer(name("table"), literal(2))));
        assertFalse(fold(new ExprIndexer(name("table"), literal(3))).isPresent());
        assertEquals(Optional.of(BigInteger.valueOf(13)), fold(new ExprSlice(literal(0xB6), literal(6), literal(2))));
    }

    @Test
    void edgeOfAnEdgeExpression() {
        List<Sensitivity> sensitivity = Arrays.asList(rising(clk), falling(reset));
        Optional<EdgeSensitivity> edge = queries.edgeOf(process, new ExprEdge("reset", EdgeKind.FALLING), sensitivity);
        assertSame(reset, edge.get().getSignal());
        assertFalse(queries.edgeOf(process, new ExprEdge("reset", EdgeKind.RISING), sensitivity).isPresent());
    }

    @Test
    void edgeOfALevelTest() {
        List<Sensitivity> sensitivity = Arrays.asList(rising(clk), falling(reset));
        Optional<EdgeSensitivity> edge = queries.edgeOf(process, eq(name("reset"), literal(0)), sensitivity);
        assertSame(reset, edge.get().getSignal());
        assertEquals(EdgeKind.FALLING, edge.get().getEdge());
        assertFalse(queries.edgeOf(process, eq(name("data"), literal(0)), sensitivity).isPresent());
    }

    @Test
    void constantIntRequiresAConstant() {
        assertEquals(12, queries.constantInt(process, name("WIDTH")));
        assertConversionError(ConversionErrors.NOT_CONSTANT, () -> queries.constantInt(process, name("data")));
    }

    @Test
    void constantIntOutsideTheIntegerRange() {
        CompilationException e = assertConversionError(ConversionErrors.NOT_SUPPORTED,
                () -> queries.constantInt(process, literal(1L << 40)));
        assertTrue(e.getMessage().contains("1099511627776"));
        assertConversionError(ConversionErrors.NOT_SUPPORTED,
                () -> queries.constantInt(process, new ExprUnaryOp(ExprUnaryOp.Operator.MINUS, literal(1L << 32))));
        assertEquals(Integer.MAX_VALUE, queries.constantInt(process, literal(Integer.MAX_VALUE)));
    }

    @Test
    void negativeShiftCountIsRejected() {
        assertConversionError(ConversionErrors.NOT_SUPPORTED,
                () -> fold(new ExprBinaryOp(ExprBinaryOp.Operator.LSHIFT, literal(1), literal(-2))));
        assertConversionError(ConversionErrors.NOT_SUPPORTED,
                () -> fold(new ExprBinaryOp(ExprBinaryOp.Operator.RSHIFT, literal(256), literal(-1))));
    }

    @Test
    void hugeShiftCountIsRejected() {
        assertConversionError(ConversionErrors.NOT_SUPPORTED,
                () -> fold(new ExprBinaryOp(ExprBinaryOp.Operator.LSHIFT, literal(1), literal(1L << 40))));
    }

    @Test
    void romIndexOutsideTheIntegerRangeIsNotConstant() {
        assertFalse(fold(new ExprIndexer(name("table"), literal(1L << 40))).isPresent());
        assertFalse(fold(new ExprIndexer(name("table"), literal(-1))).isPresent());
    }
}
