package com.ordermanagement.exception;

/**
 * Order rejected at creation: non-positive amount, negative price or missing field.
 */
public class InvalidOrderException extends OrderManagementException {

    public InvalidOrderException(String message) {
        super(message);
    }
}
