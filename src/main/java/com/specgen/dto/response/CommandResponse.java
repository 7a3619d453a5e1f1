package com.specgen.dto.response;

/**
 * A record that represents the outcome of a shell command execution.
 *
 * @param success Whether the command did what was asked.
 * @param message A confirmation or an error explanation.
 */
public record CommandResponse(boolean success, String message) {

    /**
     * Formats the message with ANSI colors: green for success, red for failure.
     *
     * @return The message wrapped in ANSI color codes.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
