package com.ordermanagement.exception;

/**
 * Price or trade request with a non-positive amount or missing field.
 */
public class InvalidRequestException extends OrderManagementException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
