package ch.epfl.vlsc.vhdl.ir.design;

import java.util.Objects;

public class EdgeSensitivity extends Sensitivity {
    private final Signal signal;
    private final EdgeKind edge;

    public EdgeSensitivity(Signal signal, EdgeKind edge) {
        this.signal = Objects.requireNonNull(signal);
        this.edge = Objects.requireNonNull(edge);
    }

    public Signal getSignal() {
        return signal;
    }

    public EdgeKind getEdge() {
        return edge;
    }

    @Override
    public Kind getKind() {
        return Kind.EDGE;
    }
}
