package ch.epfl.vlsc.vhdl.ir.design;

public enum EdgeKind {
    RISING("rising_edge"), FALLING("falling_edge");

    private final String function;

    EdgeKind(String function) {
        this.function = function;
    }

    /**
     * Name of the IEEE std_logic_1164 edge detection function.
     */
    public String getFunction() {
        return function;
    }
}
