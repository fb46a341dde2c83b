package org.gta3sc.compiler.api;

import java.util.Optional;

/**
 * A compilation batch could not complete because of a defect, not a user error.
 * User errors are reported through diagnostics and never surface as this exception.
 */
public class CompilationException extends Exception {

    private final String unitName;

    /**
     * A failure of the batch as a whole, such as an interrupted wait.
     */
    public CompilationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    private CompilationException(String message, String unitName, Throwable cause) {
        super(message, cause);
        this.unitName = unitName;
    }

    /**
     * @param unitName The display name of the translation unit whose job threw.
     * @param cause    What the job threw.
     * @return An exception naming the unit.
     */
    public static CompilationException inUnit(String unitName, Throwable cause) {
        return new CompilationException("Internal failure while compiling '" + unitName + "'", unitName, cause);
    }

    /**
     * @return The failed translation unit, or empty if the batch failed as a whole.
     */
    public Optional<String> unitName() {
        return Optional.ofNullable(unitName);
    }
}
