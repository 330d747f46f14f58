package ch.epfl.vlsc.vhdl.ir.design;

import java.util.Objects;

public class SignalSensitivity extends Sensitivity {
    private final Signal signal;

    public SignalSensitivity(Signal signal) {
        this.signal = Objects.requireNonNull(signal);
    }

    public Signal getSignal() {
        return signal;
    }

    @Override
    public Kind getKind() {
        return Kind.LEVEL;
    }
}
