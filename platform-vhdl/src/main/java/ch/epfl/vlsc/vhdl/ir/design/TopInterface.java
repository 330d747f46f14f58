package ch.epfl.vlsc.vhdl.ir.design;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The ports of the top level: argument names in declaration order and the signals bound to them.
 */
public class TopInterface {
    private final String name;
    private final ImmutableList<String> argNames;
    private final ImmutableMap<String, Signal> ports;

    public TopInterface(String name, Map<String, Signal> ports) {
        this.name = name;
        this.argNames = ImmutableList.copyOf(ports.keySet());
        this.ports = ImmutableMap.copyOf(ports);
    }

    public String getName() {
        return name;
    }

    public ImmutableList<String> getArgNames() {
        return argNames;
    }

    public ImmutableMap<String, Signal> getPorts() {
        return ports;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private final Map<String, Signal> ports = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder port(String name, Signal signal) {
            ports.put(name, signal);
            return this;
        }

        public TopInterface build() {
            return new TopInterface(name, ports);
        }
    }
}
