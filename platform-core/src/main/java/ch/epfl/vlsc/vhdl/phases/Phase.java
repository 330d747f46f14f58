package ch.epfl.vlsc.vhdl.phases;

import ch.epfl.vlsc.vhdl.reporting.CompilationException;
import ch.epfl.vlsc.vhdl.settings.Setting;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One step of a compilation pipeline.
 *
 * @param <T> the task flowing through the pipeline
 * @param <C> the per-compilation context
 */
public interface Phase<T, C> {

    String getDescription();

    /**
     * Settings read by this phase.
     */
    default List<Setting<?>> getPhaseSettings() {
        return ImmutableList.of();
    }

    T execute(T task, C context) throws CompilationException;
}
