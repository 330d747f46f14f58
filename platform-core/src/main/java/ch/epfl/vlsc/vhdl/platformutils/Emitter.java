package ch.epfl.vlsc.vhdl.platformutils;

import ch.epfl.vlsc.vhdl.reporting.CompilationException;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

public class Emitter {
    private final String indentUnit;
    private int indentation;
    private PrintWriter writer;
    private StringWriter buffer;

    public Emitter() {
        this(4);
    }

    public Emitter(int indentationWidth) {
        StringBuilder unit = new StringBuilder();
        for (int i = 0; i < indentationWidth; i++) {
            unit.append(' ');
        }
        this.indentUnit = unit.toString();
    }

    public void open(Path file) {
        if (writer != null) throw new IllegalStateException("Must close previous file before opening a new.");
        try {
            writer = new PrintWriter(Files.newBufferedWriter(file));
        } catch (IOException e) {
            throw CompilationException.from(e);
        }
        indentation = 0;
    }

    public void open(Writer out) {
        if (writer != null) throw new IllegalStateException("Must close previous output before opening a new.");
        writer = new PrintWriter(out);
        indentation = 0;
    }

    /**
     * Opens an in-memory output; its text is returned by {@link #closeBuffer()}.
     */
    public void openBuffer() {
        buffer = new StringWriter();
        open(buffer);
    }

    public String closeBuffer() {
        if (buffer == null) throw new IllegalStateException("No buffer is currently open.");
        close();
        String text = buffer.toString();
        buffer = null;
        return text;
    }

    public boolean isOpen() {
        return writer != null;
    }

    public void close() {
        if (writer == null) {
            return;
        }
        writer.flush();
        writer.close();
        writer = null;
    }

    public void increaseIndentation() {
        indentation++;
    }

    public void decreaseIndentation() {
        if (indentation == 0) throw new IllegalStateException("Indentation is already at zero.");
        indentation--;
    }

    public void emit(String format, Object... values) {
        if (writer == null) {
            throw new IllegalStateException("No output file is currently open.");
        }
        if (!format.isEmpty()) {
            int indentation = this.indentation;
            while (indentation > 0) {
                writer.print(indentUnit);
                indentation--;
            }
            writer.printf(format, values);
        }
        writer.println();
    }

    /**
     * Writes text produced by another emitter, re-indented to the current level.
     */
    public void emitRawText(CharSequence text) {
        if (text.length() == 0) {
            return;
        }
        String[] lines = text.toString().split("\n", -1);
        int last = lines.length;
        if (lines[last - 1].isEmpty()) {
            last--;
        }
        for (int i = 0; i < last; i++) {
            if (lines[i].isEmpty()) {
                emitNewLine();
            } else {
                emit("%s", lines[i]);
            }
        }
    }

    public void emitNewLine() {
        emit("");
    }
}
