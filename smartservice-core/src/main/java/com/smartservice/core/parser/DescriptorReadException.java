package com.smartservice.core.parser;

/**
 * Thrown when a descriptor cannot be read as a YAML or JSON document at all
 * (missing file, I/O failure, syntax error).
 */
public class DescriptorReadException extends Exception {

    public DescriptorReadException(String message) {
        super(message);
    }

    public DescriptorReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
