package ch.epfl.vlsc.vhdl.platform;

import ch.epfl.vlsc.vhdl.attribute.TreeQueries;
import ch.epfl.vlsc.vhdl.attribute.TypeAnnotations;
import ch.epfl.vlsc.vhdl.ir.design.EnumType;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.platformutils.utils.Box;
import ch.epfl.vlsc.vhdl.reporting.Reporter;
import ch.epfl.vlsc.vhdl.settings.Configuration;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * State of one conversion. A new context is created for every top-level conversion, so nothing
 * declared by one conversion leaks into the next.
 */
public class ConversionContext {
    private final Configuration configuration;
    private final Reporter reporter;
    private final TreeQueries queries;
    private final Set<EnumType> declaredEnums = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Process> emittedCallables = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Box<TypeAnnotations> annotations = Box.empty();

    public ConversionContext(Configuration configuration, Reporter reporter, TreeQueries queries) {
        this.configuration = configuration;
        this.reporter = reporter;
        this.queries = queries;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    public Reporter getReporter() {
        return reporter;
    }

    public TreeQueries getQueries() {
        return queries;
    }

    /**
     * Marks the enumeration as declared.
     *
     * @return true the first time it is called for a type, i.e. when its declaration must be written
     */
    public boolean declareEnum(EnumType type) {
        return declaredEnums.add(type);
    }

    public boolean isDeclared(EnumType type) {
        return declaredEnums.contains(type);
    }

    /**
     * @return true the first time it is called for a callable, i.e. when its body must be written
     */
    public boolean declareCallable(Process callable) {
        return emittedCallables.add(callable);
    }

    public TypeAnnotations getAnnotations() {
        return annotations.get();
    }

    public boolean isAnnotated() {
        return !annotations.isEmpty();
    }

    public void setAnnotations(TypeAnnotations annotations) {
        this.annotations.set(annotations);
    }

    /**
     * Forgets the declared enumerations and callables and the inferred types.
     */
    public void clear() {
        declaredEnums.clear();
        emittedCallables.clear();
        annotations.clear();
    }
}
