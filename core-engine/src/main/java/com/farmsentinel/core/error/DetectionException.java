package com.farmsentinel.core.error;

/**
 * Root of the detection failure taxonomy.
 *
 * @since 1.0.0
 */
public class DetectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
