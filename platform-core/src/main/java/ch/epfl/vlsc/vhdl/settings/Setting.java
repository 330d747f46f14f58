package ch.epfl.vlsc.vhdl.settings;

import java.util.Optional;

/**
 * A named, typed configuration entry with a default value.
 *
 * @param <T> the value type
 */
public interface Setting<T> {

    String getKey();

    String getDescription();

    /**
     * Parses a textual value, e.g. from a properties file.
     *
     * @return the value, or empty if the text is not a valid value of this setting
     */
    Optional<T> read(String string);

    T defaultValue(Configuration configuration);
}
