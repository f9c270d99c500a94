package com.metrics.domain.exception;

/**
 * A WHERE or HAVING expression references an unknown field or uses an
 * operation the active dialect cannot render.
 */
public class InvalidExpressionException extends InvalidRequestException {
    
    public InvalidExpressionException(String message) {
        super(message);
    }
}
