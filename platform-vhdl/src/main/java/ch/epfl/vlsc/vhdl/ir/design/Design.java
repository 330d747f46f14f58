package ch.epfl.vlsc.vhdl.ir.design;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * An elaborated design ready for conversion: its ports, its internal signals and memories,
 * and its processes.
 */
public class Design {
    private final TopInterface topInterface;
    private final ImmutableList<Signal> signals;
    private final ImmutableList<Memory> memories;
    private final ImmutableList<Process> processes;

    public Design(TopInterface topInterface, List<Signal> signals, List<Memory> memories, List<Process> processes) {
        this.topInterface = topInterface;
        this.signals = ImmutableList.copyOf(signals);
        this.memories = ImmutableList.copyOf(memories);
        this.processes = ImmutableList.copyOf(processes);
    }

    public String getName() {
        return topInterface.getName();
    }

    public TopInterface getTopInterface() {
        return topInterface;
    }

    /**
     * Every signal of the design, ports included.
     */
    public ImmutableList<Signal> getSignals() {
        return signals;
    }

    public ImmutableList<Memory> getMemories() {
        return memories;
    }

    public ImmutableList<Process> getProcesses() {
        return processes;
    }

    public Design withProcesses(List<Process> processes) {
        return new Design(topInterface, signals, memories, processes);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final TopInterface.Builder topInterface;
        private final ImmutableList.Builder<Signal> signals = ImmutableList.builder();
        private final ImmutableList.Builder<Memory> memories = ImmutableList.builder();
        private final ImmutableList.Builder<Process> processes = ImmutableList.builder();

        private Builder(String name) {
            this.topInterface = TopInterface.builder(name);
        }

        /**
         * Adds a port; the signal is also added to the design signals.
         */
        public Builder port(Signal signal) {
            topInterface.port(signal.getBaseName(), signal);
            signals.add(signal);
            return this;
        }

        public Builder signal(Signal... signal) {
            signals.add(signal);
            return this;
        }

        public Builder memory(Memory memory) {
            memories.add(memory);
            return this;
        }

        public Builder process(Process... process) {
            processes.add(process);
            return this;
        }

        public Design build() {
            return new Design(topInterface.build(), signals.build(), memories.build(), processes.build());
        }
    }
}
