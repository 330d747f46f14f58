package ch.epfl.vlsc.vhdl.platformutils;

import ch.epfl.vlsc.vhdl.reporting.CompilationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * PathUtils class for platforms
 */
public class PathUtils {

    /**
     * Create a directory (recursively) if it does not exist yet.
     *
     * @param directory
     * @return the directory
     */
    public static Path createDirectory(Path directory) {
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw CompilationException.from(e);
        }
    }

    /**
     * Deletes a partially generated file.
     *
     * @param file
     * @throws IOException if the file exists but cannot be deleted
     */
    public static void discard(Path file) throws IOException {
        Files.deleteIfExists(file);
    }
}
