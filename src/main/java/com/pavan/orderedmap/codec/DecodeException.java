package com.pavan.orderedmap.codec;

import java.io.IOException;

/**
 * Thrown when serialized input cannot be turned back into ordered entries.
 * The target map is never modified when this is thrown.
 */
public class DecodeException extends IOException {
    
    private static final long serialVersionUID = 1L;
    
    /**
     * Why the input was rejected.
     */
    public enum Reason {
        /** The bytes are not valid JSON. */
        MALFORMED_INPUT,
        /** Valid JSON, but not an array of two-element [key, value] arrays. */
        STRUCTURE_MISMATCH,
        /** A key or value cannot be bound to the configured type. */
        TYPE_MISMATCH
    }
    
    private final Reason reason;
    
    public DecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
    
    public DecodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
    
    public Reason getReason() {
        return reason;
    }
}
