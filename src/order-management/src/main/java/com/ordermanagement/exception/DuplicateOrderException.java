package com.ordermanagement.exception;

/**
 * An order with the same id is already resting in some book.
 */
public class DuplicateOrderException extends OrderManagementException {

    public DuplicateOrderException(String message) {
        super(message);
    }
}
