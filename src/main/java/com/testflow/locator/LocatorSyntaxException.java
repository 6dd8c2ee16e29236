package com.testflow.locator;

/**
 * A malformed element path. This is a configuration error in the flow, not an
 * automation failure, and is reported as such by validation.
 */
public class LocatorSyntaxException extends RuntimeException {

    private final String path;
    private final int    position;

    public LocatorSyntaxException(String message, String path, int position) {
        super(message + " at position " + position + " in '" + path + "'");
        this.path     = path;
        this.position = position;
    }

    public String getPath()     { return path; }
    public int    getPosition() { return position; }
}
