package io.gambit.cli.exception;

import java.io.Serial;

/// Thrown when a command's input file cannot be read or parsed.
///
/// Common causes:
/// - File not found or unreadable
/// - Malformed JSON, or a token without `"type"`
/// - A battle whose acting character is not on its team
///
/// @see io.gambit.cli.commands.GambitCommand
public class InputException extends Exception {

    @Serial private static final long serialVersionUID = -5120937414866482619L;

    /// @param message what could not be loaded, not null
    /// @param cause underlying I/O or parse failure
    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
