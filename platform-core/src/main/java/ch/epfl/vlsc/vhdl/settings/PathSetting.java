package ch.epfl.vlsc.vhdl.settings;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

public abstract class PathSetting implements Setting<Path> {

    @Override
    public Optional<Path> read(String string) {
        try {
            return Optional.of(Paths.get(string.trim()));
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }
}
