package com.ordermanagement.matching;

import com.ordermanagement.domain.Order;
import com.ordermanagement.domain.OrderBook;
import com.ordermanagement.domain.OrderFill;
import com.ordermanagement.domain.OrderId;
import com.ordermanagement.domain.Side;
import com.ordermanagement.domain.Trade;
import com.ordermanagement.exception.InsufficientLiquidityException;
import com.ordermanagement.exception.InvalidRequestException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Executes a trade by consuming resting orders on the counter side in
 * price-time priority, the same traversal {@link PriceCalculator} uses.
 *
 * Two phases: the full fill plan is computed from a read-only walk, and only
 * if it covers the whole requested amount is it applied to the book. A request
 * that cannot be filled completely leaves the book untouched.
 *
 * Fully consumed orders are removed from the book; partially consumed orders
 * keep their position with a reduced amount.
 */
public class TradeExecutor {

    private final Clock clock;

    public TradeExecutor() {
        this(Clock.systemUTC());
    }

    public TradeExecutor(Clock clock) {
        this.clock = clock;
    }

    public Trade execute(OrderBook book, Side side, long amount) {
        if (amount <= 0) {
            throw new InvalidRequestException("Amount must be positive: " + amount);
        }

        // Phase 1: plan
        List<OrderFill> fills = new ArrayList<>();
        long remaining = amount;
        long totalPrice = 0;

        try {
            for (Order resting : book.peekSide(side.opposite())) {
                long fillQty = Math.min(remaining, resting.getAmount());
                long fillPrice = resting.getPrice().cents();
                fills.add(new OrderFill(resting.getId().value(), fillQty, fillPrice));
                totalPrice = Math.addExact(totalPrice, Math.multiplyExact(fillQty, fillPrice));
                remaining -= fillQty;
                if (remaining == 0) {
                    break;
                }
            }
        } catch (ArithmeticException e) {
            throw new InvalidRequestException(
                    "Total price for " + amount + " " + book.getSymbol() + " overflows", e);
        }

        if (remaining > 0) {
            throw new InsufficientLiquidityException(
                    "Only " + (amount - remaining) + " of " + amount + " available to "
                            + side + " " + book.getSymbol());
        }

        // Phase 2: apply
        for (OrderFill fill : fills) {
            book.fill(new OrderId(fill.orderId()), fill.filledAmount());
        }

        return new Trade(
                UUID.randomUUID().toString(),
                book.getSymbol(),
                side,
                amount,
                totalPrice,
                clock.instant(),
                fills);
    }
}
