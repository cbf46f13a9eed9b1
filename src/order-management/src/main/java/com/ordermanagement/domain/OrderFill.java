package com.ordermanagement.domain;

/**
 * Quantity taken from one resting order by a single trade.
 */
public record OrderFill(long orderId, long filledAmount, long fillPrice) {}
