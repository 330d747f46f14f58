package ch.epfl.vlsc.vhdl.settings;

import ch.epfl.vlsc.vhdl.reporting.CompilationException;
import ch.epfl.vlsc.vhdl.reporting.Diagnostic;
import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Values of the settings known to a conversion. Settings without a value fall back to their default.
 */
public final class Configuration {
    private final Map<Setting<?>, Object> values;

    private Configuration(Map<Setting<?>, Object> values) {
        this.values = new HashMap<>(values);
    }

    public static Configuration defaults() {
        return new Configuration(ImmutableMap.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the given settings from a properties file. Unknown keys are ignored.
     */
    public static Configuration load(Path file, List<Setting<?>> settings) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file)) {
            properties.load(reader);
        } catch (IOException e) {
            throw CompilationException.from(e);
        }
        return fromProperties(properties, settings);
    }

    public static Configuration fromProperties(Properties properties, List<Setting<?>> settings) {
        Builder builder = builder();
        for (Setting<?> setting : settings) {
            String text = properties.getProperty(setting.getKey());
            if (text != null) {
                builder.parse(setting, text);
            }
        }
        return builder.build();
    }

    public <T> T get(Setting<T> setting) {
        if (values.containsKey(setting)) {
            @SuppressWarnings("unchecked")
            T value = (T) values.get(setting);
            return value;
        }
        return setting.defaultValue(this);
    }

    public boolean isDefined(Setting<?> setting) {
        return values.containsKey(setting);
    }

    public <T> void set(Setting<T> setting, T value) {
        values.put(setting, value);
    }

    public static final class Builder {
        private final Map<Setting<?>, Object> values = new HashMap<>();

        private Builder() {
        }

        public <T> Builder set(Setting<T> setting, T value) {
            values.put(setting, value);
            return this;
        }

        private <T> void parse(Setting<T> setting, String text) {
            Optional<T> value = setting.read(text);
            if (!value.isPresent()) {
                throw new CompilationException(new Diagnostic(Diagnostic.Kind.ERROR,
                        String.format("Invalid value \"%s\" for setting %s", text, setting.getKey())));
            }
            values.put(setting, value.get());
        }

        public Configuration build() {
            return new Configuration(values);
        }
    }
}
