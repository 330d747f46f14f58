package ch.epfl.vlsc.vhdl.reporting;

import java.util.Objects;

public final class Diagnostic {
    private final Kind kind;
    private final String message;
    private final SourcePosition position;

    public Diagnostic(Kind kind, String message) {
        this(kind, message, SourcePosition.UNKNOWN);
    }

    public Diagnostic(Kind kind, String message, SourcePosition position) {
        this.kind = Objects.requireNonNull(kind);
        this.message = Objects.requireNonNull(message);
        this.position = position == null ? SourcePosition.UNKNOWN : position;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public String generateMessage() {
        StringBuilder builder = new StringBuilder();
        builder.append(kind.name());
        if (position.isKnown()) {
            builder.append(" [").append(position).append("]");
        }
        builder.append(": ").append(message);
        return builder.toString();
    }

    @Override
    public String toString() {
        return generateMessage();
    }

    public enum Kind {
        ERROR, WARNING, INFO
    }
}
