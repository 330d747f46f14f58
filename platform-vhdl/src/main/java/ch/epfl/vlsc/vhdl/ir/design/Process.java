package ch.epfl.vlsc.vhdl.ir.design;

import ch.epfl.vlsc.vhdl.ir.stmt.Statement;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An analyzed process, or a function or procedure called from one.
 */
public class Process implements DesignObject {
    private final String name;
    private final ProcessKind kind;
    private final ImmutableMap<String, DesignObject> symbols;
    private final ImmutableMap<String, Variable> variables;
    private final ImmutableList<Statement> body;
    private final ImmutableList<Sensitivity> sensitivity;
    private final ImmutableList<String> parameters;
    private final ImmutableSet<String> inputs;
    private final ImmutableSet<String> outputs;
    private final Variable returnValue;
    private final boolean usesOutputText;
    private final SourcePosition position;

    private Process(Builder builder, String name) {
        this.name = name;
        this.kind = builder.kind;
        this.symbols = ImmutableMap.copyOf(builder.symbols);
        this.variables = ImmutableMap.copyOf(builder.variables);
        this.body = builder.body.build();
        this.sensitivity = builder.sensitivity.build();
        this.parameters = builder.parameters.build();
        this.inputs = ImmutableSet.copyOf(builder.inputs);
        this.outputs = ImmutableSet.copyOf(builder.outputs);
        this.returnValue = builder.returnValue;
        this.usesOutputText = builder.usesOutputText || builder.kind == ProcessKind.INITIAL;
        this.position = builder.position;
    }

    private Process(Process original, String name) {
        this.name = name;
        this.kind = original.kind;
        this.symbols = original.symbols;
        this.variables = original.variables;
        this.body = original.body;
        this.sensitivity = original.sensitivity;
        this.parameters = original.parameters;
        this.inputs = original.inputs;
        this.outputs = original.outputs;
        this.returnValue = original.returnValue;
        this.usesOutputText = original.usesOutputText;
        this.position = original.position;
    }

    public static Builder builder(String name, ProcessKind kind) {
        return new Builder(name, kind);
    }

    public String getName() {
        return name;
    }

    public Process withName(String name) {
        return name.equals(this.name) ? this : new Process(this, name);
    }

    public ProcessKind getKind() {
        return kind;
    }

    /**
     * Names visible from the body: signals, constants, memories, ROMs, enumerations and callables.
     */
    public ImmutableMap<String, DesignObject> getSymbols() {
        return symbols;
    }

    /**
     * Local variables in declaration order. Parameters of a callable are listed here as well.
     */
    public ImmutableMap<String, Variable> getVariables() {
        return variables;
    }

    public ImmutableList<Statement> getBody() {
        return body;
    }

    public ImmutableList<Sensitivity> getSensitivity() {
        return sensitivity;
    }

    public ImmutableList<String> getParameters() {
        return parameters;
    }

    public ImmutableSet<String> getInputs() {
        return inputs;
    }

    /**
     * Names written by the body. For a procedure, the parameters listed here are passed as signals.
     */
    public ImmutableSet<String> getOutputs() {
        return outputs;
    }

    public Optional<Variable> getReturnValue() {
        return Optional.ofNullable(returnValue);
    }

    public boolean usesOutputText() {
        return usesOutputText;
    }

    public SourcePosition getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return kind + " " + name;
    }

    public static class Builder {
        private final String name;
        private final ProcessKind kind;
        private final Map<String, DesignObject> symbols = new LinkedHashMap<>();
        private final Map<String, Variable> variables = new LinkedHashMap<>();
        private final ImmutableList.Builder<Statement> body = ImmutableList.builder();
        private final ImmutableList.Builder<Sensitivity> sensitivity = ImmutableList.builder();
        private final ImmutableList.Builder<String> parameters = ImmutableList.builder();
        private final Set<String> inputs = new LinkedHashSet<>();
        private final Set<String> outputs = new LinkedHashSet<>();
        private Variable returnValue;
        private boolean usesOutputText;
        private SourcePosition position = SourcePosition.UNKNOWN;

        private Builder(String name, ProcessKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder symbol(String name, DesignObject object) {
            symbols.put(name, object);
            return this;
        }

        /**
         * Binds a signal under its own name.
         */
        public Builder signal(Signal signal) {
            return symbol(signal.getBaseName(), signal);
        }

        public Builder variable(Variable variable) {
            variables.put(variable.getName(), variable);
            return this;
        }

        public Builder parameter(Variable variable) {
            parameters.add(variable.getName());
            return variable(variable);
        }

        public Builder body(Statement... statements) {
            body.add(statements);
            return this;
        }

        public Builder body(List<Statement> statements) {
            body.addAll(statements);
            return this;
        }

        public Builder sensitivity(Sensitivity... entries) {
            sensitivity.add(entries);
            return this;
        }

        public Builder input(String name) {
            inputs.add(name);
            return this;
        }

        public Builder output(String name) {
            outputs.add(name);
            return this;
        }

        public Builder returns(Variable returnValue) {
            this.returnValue = returnValue;
            return this;
        }

        public Builder usesOutputText() {
            this.usesOutputText = true;
            return this;
        }

        public Builder at(SourcePosition position) {
            this.position = position;
            return this;
        }

        public Process build() {
            return new Process(this, name);
        }
    }
}
