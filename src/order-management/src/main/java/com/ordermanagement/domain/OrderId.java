package com.ordermanagement.domain;

/**
 * Value object wrapping the numeric order identifier.
 * Ids are unique across the whole system, not just per symbol.
 */
public record OrderId(long value) {

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
