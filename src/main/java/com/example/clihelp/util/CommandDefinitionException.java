package com.example.clihelp.util;

/**
 * A command definition could not be read or is malformed.
 */
public class CommandDefinitionException extends RuntimeException {

    private final String path;

    public CommandDefinitionException(String path, String message) {
        super(path == null || path.isEmpty() ? message : path + ": " + message);
        this.path = path;
    }

    public CommandDefinitionException(String path, String message, Throwable cause) {
        super(path == null || path.isEmpty() ? message : path + ": " + message, cause);
        this.path = path;
    }

    /** Location of the offending entry, e.g. {@code commands[1].options[0].short}. */
    public String getPath() {
        return path;
    }
}
