package com.ordermanagement.matching;

import com.ordermanagement.domain.Order;
import com.ordermanagement.domain.OrderBook;
import com.ordermanagement.domain.Side;
import com.ordermanagement.exception.InsufficientLiquidityException;
import com.ordermanagement.exception.InvalidRequestException;

/**
 * Prices a hypothetical order against resting liquidity without touching the book.
 *
 * A BUY request is priced against the asks from the lowest price up; a SELL
 * request against the bids from the highest price down. Within a price level
 * orders are taken in arrival order.
 *
 * Time complexity: O(log P + F) where P = price levels, F = orders touched.
 */
public class PriceCalculator {

    /**
     * @return sum of {@code price * units} over every resting order consumed
     * @throws InsufficientLiquidityException if the counter side runs out first
     */
    public long calculate(OrderBook book, Side side, long amount) {
        if (amount <= 0) {
            throw new InvalidRequestException("Amount must be positive: " + amount);
        }

        long remaining = amount;
        long totalPrice = 0;

        try {
            for (Order resting : book.peekSide(side.opposite())) {
                long units = Math.min(remaining, resting.getAmount());
                totalPrice = Math.addExact(totalPrice,
                        Math.multiplyExact(units, resting.getPrice().cents()));
                remaining -= units;
                if (remaining == 0) {
                    return totalPrice;
                }
            }
        } catch (ArithmeticException e) {
            throw new InvalidRequestException(
                    "Total price for " + amount + " " + book.getSymbol() + " overflows", e);
        }

        throw new InsufficientLiquidityException(
                "Only " + (amount - remaining) + " of " + amount + " available to "
                        + side + " " + book.getSymbol());
    }
}
