package ch.epfl.vlsc.vhdl.reporting;

import java.util.Objects;

/**
 * Location of a construct in the design description it was elaborated from.
 */
public final class SourcePosition {
    private final String file;
    private final int line;
    private final int column;

    public static final SourcePosition UNKNOWN = new SourcePosition("<unknown>", 0, 0);

    public SourcePosition(String file, int line, int column) {
        this.file = Objects.requireNonNull(file);
        this.line = line;
        this.column = column;
    }

    public static SourcePosition of(String file, int line) {
        return new SourcePosition(file, line, 0);
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isKnown() {
        return this != UNKNOWN && line > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition)) return false;
        SourcePosition that = (SourcePosition) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        if (column > 0) {
            return String.format("%s:%d:%d", file, line, column);
        }
        return String.format("%s:%d", file, line);
    }
}
