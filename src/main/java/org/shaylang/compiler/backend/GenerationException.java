package org.shaylang.compiler.backend;

import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.api.SourcePosition;

/**
 * Signals that a backend cannot translate a program. Generation errors are fatal to the
 * whole generation; {@link CodeGenerator} converts them into its error state.
 */
public class GenerationException extends RuntimeException {

    private final CompilerErrorCode code;
    private final SourcePosition position;

    /**
     * @param code The error code.
     * @param message The error message.
     * @param position The position of the offending node, or null if there is none.
     */
    public GenerationException(CompilerErrorCode code, String message, SourcePosition position) {
        super(message);
        this.code = code;
        this.position = position;
    }

    public CompilerErrorCode getCode() {
        return code;
    }

    public SourcePosition getPosition() {
        return position;
    }
}
