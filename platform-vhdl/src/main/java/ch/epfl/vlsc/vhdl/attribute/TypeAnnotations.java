package ch.epfl.vlsc.vhdl.attribute;

import ch.epfl.vlsc.vhdl.ir.IRNode;
import ch.epfl.vlsc.vhdl.ir.design.Memory;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.type.VhdlType;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of type inference: the type of every expression and assignment target, keyed by node identity.
 */
public final class TypeAnnotations {
    private final Map<IRNode, VhdlType> types;
    private final Set<IRNode> signedContexts;
    private final Map<Process, Set<String>> loopVariables;
    private final Set<Memory> referencedMemories;

    private TypeAnnotations(Builder builder) {
        this.types = Collections.unmodifiableMap(new IdentityHashMap<>(builder.types));
        Set<IRNode> signed = Collections.newSetFromMap(new IdentityHashMap<>());
        signed.addAll(builder.signedContexts);
        this.signedContexts = Collections.unmodifiableSet(signed);
        this.loopVariables = Collections.unmodifiableMap(new IdentityHashMap<>(builder.loopVariables));
        Set<Memory> memories = Collections.newSetFromMap(new IdentityHashMap<>());
        memories.addAll(builder.referencedMemories);
        this.referencedMemories = Collections.unmodifiableSet(memories);
    }

    public static Builder builder() {
        return new Builder();
    }

    public VhdlType typeOf(IRNode node) {
        VhdlType type = types.get(node);
        if (type == null) {
            throw new IllegalStateException("No type inferred for " + node.getClass().getSimpleName()
                    + " at " + node.getPosition());
        }
        return type;
    }

    public Optional<VhdlType> findType(IRNode node) {
        return Optional.ofNullable(types.get(node));
    }

    /**
     * True for a comparison whose operands are compared as signed vectors.
     */
    public boolean isSignedContext(IRNode node) {
        return signedContexts.contains(node);
    }

    /**
     * True when the name is the index of a range loop of the process. Such names are not declared.
     */
    public boolean isLoopVariable(Process process, String name) {
        return loopVariables.getOrDefault(process, Collections.emptySet()).contains(name);
    }

    /**
     * True when some process reads or writes the memory.
     */
    public boolean isReferenced(Memory memory) {
        return referencedMemories.contains(memory);
    }

    public int size() {
        return types.size();
    }

    public static final class Builder {
        private final Map<IRNode, VhdlType> types = new IdentityHashMap<>();
        private final Set<IRNode> signedContexts = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Map<Process, Set<String>> loopVariables = new IdentityHashMap<>();
        private final Set<Memory> referencedMemories = Collections.newSetFromMap(new IdentityHashMap<>());

        private Builder() {
        }

        /**
         * Sets the type of a node, replacing the type inferred bottom-up when the context imposes another one.
         */
        public Builder set(IRNode node, VhdlType type) {
            types.put(node, type);
            return this;
        }

        public Optional<VhdlType> get(IRNode node) {
            return Optional.ofNullable(types.get(node));
        }

        public Builder signedContext(IRNode node) {
            signedContexts.add(node);
            return this;
        }

        public Builder loopVariable(Process process, String name) {
            loopVariables.computeIfAbsent(process, p -> new HashSet<>()).add(name);
            return this;
        }

        public Builder referenced(Memory memory) {
            referencedMemories.add(memory);
            return this;
        }

        public TypeAnnotations build() {
            return new TypeAnnotations(this);
        }
    }
}
