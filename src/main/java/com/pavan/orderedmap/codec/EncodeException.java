package com.pavan.orderedmap.codec;

import java.io.IOException;

/**
 * Thrown when the JSON encoder refuses the keys or values of a map.
 */
public class EncodeException extends IOException {
    
    private static final long serialVersionUID = 1L;
    
    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
