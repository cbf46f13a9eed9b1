package com.ordermanagement.exception;

/**
 * Counter-side book cannot fully satisfy the requested amount.
 */
public class InsufficientLiquidityException extends OrderManagementException {

    public InsufficientLiquidityException(String message) {
        super(message);
    }
}
