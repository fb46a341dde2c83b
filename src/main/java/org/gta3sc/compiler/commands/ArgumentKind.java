package org.gta3sc.compiler.commands;

/**
 * The shape of a command argument, as far as overload selection needs to know it.
 */
public enum ArgumentKind {
    /** Accepts any argument. */
    ANY,
    /** A label reference. */
    LABEL,
    /** An integer literal or integer-typed value. */
    INT,
    /** A float literal or float-typed value. */
    FLOAT,
    /** A text label literal or text-label-typed value. */
    TEXT_LABEL,
    /** A quoted string literal. */
    STRING,
    /** An integer variable (output position). */
    VAR_INT,
    /** A float variable (output position). */
    VAR_FLOAT,
    /** A text label variable (output position). */
    VAR_TEXT_LABEL;

    /**
     * Checks whether an argument of the given kind fits a parameter of this kind.
     * Value parameters accept their variable counterparts; variable parameters only accept variables.
     *
     * @param actual The kind of the argument at the call site.
     * @return {@code true} if acceptable.
     */
    public boolean accepts(ArgumentKind actual) {
        return switch (this) {
            case ANY -> true;
            case INT -> actual == INT || actual == VAR_INT;
            case FLOAT -> actual == FLOAT || actual == VAR_FLOAT;
            case TEXT_LABEL -> actual == TEXT_LABEL || actual == VAR_TEXT_LABEL;
            default -> actual == this;
        };
    }
}
