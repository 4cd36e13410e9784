package com.dcruver.tanaimport.io;

/**
 * Thrown when an export cannot be read as a Tana graph.
 */
public class GraphFormatException extends RuntimeException {

    public GraphFormatException(String message) {
        super(message);
    }

    public GraphFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
