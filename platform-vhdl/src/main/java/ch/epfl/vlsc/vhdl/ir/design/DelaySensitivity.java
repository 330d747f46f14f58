package ch.epfl.vlsc.vhdl.ir.design;

public class DelaySensitivity extends Sensitivity {
    private final long nanoseconds;

    public DelaySensitivity(long nanoseconds) {
        if (nanoseconds < 0) {
            throw new IllegalArgumentException("Negative delay");
        }
        this.nanoseconds = nanoseconds;
    }

    public long getNanoseconds() {
        return nanoseconds;
    }

    @Override
    public Kind getKind() {
        return Kind.DELAY;
    }
}
