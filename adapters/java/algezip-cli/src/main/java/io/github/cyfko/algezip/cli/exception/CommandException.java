package io.github.cyfko.algezip.cli.exception;

/**
 * Exception thrown when a line typed at the shell prompt does not denote a valid command.
 * <p>
 * Messages are written for direct display to the user. Errors raised while a recognized
 * command runs (a malformed argument, a failed move, a rule that does not apply) are reported
 * with the core exceptions instead.
 * </p>
 *
 * <h2>Common Scenarios</h2>
 * <ul>
 *   <li><strong>Unknown command:</strong> the input matches no command name</li>
 *   <li><strong>Unexpected argument:</strong> a command that takes no argument is given one</li>
 *   <li><strong>Missing argument:</strong> a command that requires an argument is given none</li>
 * </ul>
 *
 * <h2>Error Examples</h2>
 * <pre>{@code
 * "c T"  -> command 'c' does not take an argument
 * "x"    -> command 'x' requires an argument
 * "zz"   -> unrecognized command
 * }</pre>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public class CommandException extends RuntimeException {

    /**
     * Constructs a new command exception with the specified detail message.
     *
     * @param message the detail message
     */
    public CommandException(String message) {
        super(message);
    }

    /**
     * Constructs a new command exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
