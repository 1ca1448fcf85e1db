package com.farmsentinel.core.error;

/**
 * The window supplier holds no readings for the requested room, metric and
 * period. Fatal to the detection call.
 *
 * @since 1.0.0
 */
public class NoDataException extends DetectionException {

    private static final long serialVersionUID = 1L;

    public NoDataException(String message) {
        super(message);
    }
}
