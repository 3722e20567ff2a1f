package com.mapper.dto.response;

/**
 * Outcome of a shell command that has nothing but a status line to print.
 *
 * @param success Whether the command did what was asked.
 * @param message The line shown to the user.
 */
public record CommandResponse(boolean success, String message) {

    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_RESET = "\u001B[0m";

    public static CommandResponse failure(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * @return The message in green on success and red on failure.
     */
    public String toAnsiString() {
        return (success ? ANSI_GREEN : ANSI_RED) + message + ANSI_RESET;
    }
}
