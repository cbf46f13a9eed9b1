package com.ordermanagement.exception;

/**
 * No order book exists for the requested symbol.
 */
public class UnknownSymbolException extends OrderManagementException {

    public UnknownSymbolException(String message) {
        super(message);
    }
}
