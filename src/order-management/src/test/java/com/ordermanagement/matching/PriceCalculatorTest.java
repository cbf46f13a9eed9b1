package com.ordermanagement.matching;

import com.ordermanagement.domain.Order;
import com.ordermanagement.domain.OrderBook;
import com.ordermanagement.domain.OrderBookSnapshot;
import com.ordermanagement.domain.OrderId;
import com.ordermanagement.domain.Price;
import com.ordermanagement.domain.Side;
import com.ordermanagement.exception.InsufficientLiquidityException;
import com.ordermanagement.exception.InvalidRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PriceCalculator")
class PriceCalculatorTest {

    private final PriceCalculator calculator = new PriceCalculator();
    private OrderBook book;

    @BeforeEach
    void setUp() {
        book = new OrderBook("JPM");
    }

    private void rest(long id, Side side, long amount, long price) {
        book.insert(new Order(new OrderId(id), "JPM", side, amount, new Price(price), 0L));
    }

    @Test
    @DisplayName("BUY is priced against asks from the lowest price up")
    void buyWalksAsksAscending() {
        rest(4, Side.SELL, 10, 21);
        rest(1, Side.SELL, 20, 20);

        assertThat(calculator.calculate(book, Side.BUY, 22)).isEqualTo(20 * 20 + 21 * 2);
        assertThat(calculator.calculate(book, Side.BUY, 10)).isEqualTo(200);
        assertThat(calculator.calculate(book, Side.BUY, 20)).isEqualTo(400);
        assertThat(calculator.calculate(book, Side.BUY, 30)).isEqualTo(610);
    }

    @Test
    @DisplayName("SELL is priced against bids from the highest price down")
    void sellWalksBidsDescending() {
        rest(1, Side.BUY, 20, 20);
        rest(4, Side.BUY, 10, 21);

        assertThat(calculator.calculate(book, Side.SELL, 12)).isEqualTo(21 * 10 + 20 * 2);
    }

    @Test
    @DisplayName("Same-side orders are never used")
    void ignoresSameSide() {
        rest(1, Side.BUY, 100, 5);
        rest(2, Side.SELL, 10, 50);

        assertThat(calculator.calculate(book, Side.BUY, 10)).isEqualTo(500);
        assertThatThrownBy(() -> calculator.calculate(book, Side.BUY, 11))
                .isInstanceOf(InsufficientLiquidityException.class);
    }

    @Test
    @DisplayName("Insufficient liquidity fails without a partial price")
    void insufficientLiquidity() {
        rest(1, Side.SELL, 5, 20);

        assertThatThrownBy(() -> calculator.calculate(book, Side.BUY, 6))
                .isInstanceOf(InsufficientLiquidityException.class)
                .hasMessageContaining("5 of 6");
    }

    @Test
    @DisplayName("Pricing twice gives the same answer and leaves the book unchanged")
    void idempotentAndSideEffectFree() {
        rest(1, Side.SELL, 20, 20);
        rest(2, Side.SELL, 10, 21);
        OrderBookSnapshot before = book.snapshot();

        long first = calculator.calculate(book, Side.BUY, 25);
        long second = calculator.calculate(book, Side.BUY, 25);

        assertThat(first).isEqualTo(second).isEqualTo(505);
        assertThat(book.snapshot()).isEqualTo(before);
    }

    @Test
    @DisplayName("Non-positive amounts and overflowing totals are invalid requests")
    void invalidRequests() {
        rest(1, Side.SELL, Long.MAX_VALUE / 2, Long.MAX_VALUE / 2);

        assertThatThrownBy(() -> calculator.calculate(book, Side.BUY, 0))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> calculator.calculate(book, Side.BUY, -3))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> calculator.calculate(book, Side.BUY, 1_000))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("overflows");
    }
}
