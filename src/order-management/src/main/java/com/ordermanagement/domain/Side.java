package com.ordermanagement.domain;

/**
 * Order direction. Determines which half of the book an order rests in.
 */
public enum Side {
    BUY,
    SELL;

    /**
     * The side a request on this side consumes: a BUY takes resting SELL orders
     * and a SELL takes resting BUY orders.
     */
    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }
}
