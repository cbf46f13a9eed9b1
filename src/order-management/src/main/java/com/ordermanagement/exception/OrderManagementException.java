package com.ordermanagement.exception;

/**
 * Base type for every caller-facing failure raised by the order management core.
 * All subclasses are recoverable; none of them leaves a book partially mutated.
 */
public abstract class OrderManagementException extends RuntimeException {

    protected OrderManagementException(String message) {
        super(message);
    }

    protected OrderManagementException(String message, Throwable cause) {
        super(message, cause);
    }
}
