package ch.epfl.vlsc.vhdl.reporting;

/**
 * Everything that can go wrong while converting a design. Only the signal usage checks are advisories,
 * all the others abort the conversion.
 */
public enum ConversionErrors {
    ARG_TYPE("Inappropriate argument type"),
    FIRST_ARG_TYPE("The top level should be a function returning the design"),
    SHADOWING_SIGNAL("Port is shadowed by internal signal"),
    UNUSED_SIGNAL("Signal is driven but not read"),
    UNDRIVEN_SIGNAL("Signal is not driven"),
    NOT_SUPPORTED("Not supported"),
    UNSUPPORTED_TYPE("Object type is not supported in this context"),
    LIST_ELEMENT_NOT_UNIQUE("List contains Signals that are not unique to it"),
    UNDEFINED_NAME("Name is not defined"),
    NOT_CONSTANT("Expected a constant"),
    LOOP_STEP("Only a unit step is supported in a range"),
    SENSITIVITY_KIND("Sensitivity list mixes different kinds of entries"),
    NO_EDGE_TEST("Cannot find the edge tested by the asynchronous branch"),
    NO_ELSE_TEST("Asynchronous edge test needs an else branch"),
    RESERVED_NAME("Name is a VHDL reserved word"),
    STRUCTURE("Malformed design");

    private final String message;

    ConversionErrors(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public boolean isAdvisory() {
        return this == UNUSED_SIGNAL || this == UNDRIVEN_SIGNAL;
    }

    public Diagnostic diagnostic(String detail, SourcePosition position) {
        Diagnostic.Kind kind = isAdvisory() ? Diagnostic.Kind.WARNING : Diagnostic.Kind.ERROR;
        String text = detail == null || detail.isEmpty() ? message : message + ": " + detail;
        return new Diagnostic(kind, text, position);
    }

    public CompilationException exception(String detail, SourcePosition position) {
        return new CompilationException(diagnostic(detail, position));
    }

    public CompilationException exception(String detail) {
        return exception(detail, SourcePosition.UNKNOWN);
    }
}
