package com.ordermanagement.exception;

/**
 * No resting order with the given id.
 */
public class OrderNotFoundException extends OrderManagementException {

    public OrderNotFoundException(String message) {
        super(message);
    }
}
