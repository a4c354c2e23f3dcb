package io.gambit.core.error;

import java.io.Serial;
import java.util.Objects;

/// Carries a {@link CompileError} out of the checker or generator.
///
/// The compilation pipeline catches it at its boundary and turns it into a result value, so it
/// never escapes to the host process.
public class CompileException extends Exception {
    @Serial private static final long serialVersionUID = -2860473128394155702L;

    private final transient CompileError error;

    public CompileException(CompileError error) {
        super(Objects.requireNonNull(error, "error").toString());
        this.error = error;
    }

    public CompileException(ErrorKind kind) {
        this(CompileError.of(kind));
    }

    public CompileError getError() {
        return error;
    }

    /// Returns an exception whose error has an enclosing slot prepended.
    ///
    /// @param tokenKind kind of the enclosing token, not null
    /// @param argument slot name, not null
    /// @return new exception keeping this stack trace, never null
    public CompileException withContext(String tokenKind, String argument) {
        CompileException wrapped =
                new CompileException(error.withContext(new PathSegment(tokenKind, argument)));
        wrapped.setStackTrace(getStackTrace());
        return wrapped;
    }
}
