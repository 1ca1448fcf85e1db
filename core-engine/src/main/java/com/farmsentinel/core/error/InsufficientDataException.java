package com.farmsentinel.core.error;

import com.farmsentinel.core.model.DetectorKind;

/**
 * A detector cannot fit the supplied window because it is too short or
 * degenerate. The ensemble skips that detector.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends DetectionException {

    private static final long serialVersionUID = 1L;

    private final DetectorKind kind;

    public InsufficientDataException(DetectorKind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public DetectorKind getKind() {
        return kind;
    }
}
