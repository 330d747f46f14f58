package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.math.BigInteger;
import java.util.Objects;

public class ExprLiteral extends Expression {

    public enum Kind {
        INTEGER, TRUE, FALSE, STRING
    }

    private final Kind kind;
    private final BigInteger value;
    private final String text;

    private ExprLiteral(SourcePosition position, Kind kind, BigInteger value, String text) {
        super(position);
        this.kind = kind;
        this.value = value;
        this.text = text;
    }

    public static ExprLiteral integer(long value) {
        return integer(SourcePosition.UNKNOWN, BigInteger.valueOf(value));
    }

    public static ExprLiteral integer(SourcePosition position, BigInteger value) {
        return new ExprLiteral(position, Kind.INTEGER, Objects.requireNonNull(value), value.toString());
    }

    public static ExprLiteral bool(boolean value) {
        return bool(SourcePosition.UNKNOWN, value);
    }

    public static ExprLiteral bool(SourcePosition position, boolean value) {
        return new ExprLiteral(position, value ? Kind.TRUE : Kind.FALSE,
                value ? BigInteger.ONE : BigInteger.ZERO, value ? "True" : "False");
    }

    public static ExprLiteral string(String text) {
        return string(SourcePosition.UNKNOWN, text);
    }

    public static ExprLiteral string(SourcePosition position, String text) {
        return new ExprLiteral(position, Kind.STRING, null, Objects.requireNonNull(text));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Numeric value of an integer or boolean literal.
     */
    public BigInteger getValue() {
        if (kind == Kind.STRING) {
            throw new IllegalStateException("String literal has no numeric value");
        }
        return value;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
