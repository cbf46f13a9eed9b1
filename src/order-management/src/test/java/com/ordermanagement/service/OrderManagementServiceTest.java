package com.ordermanagement.service;

import com.ordermanagement.domain.OrderBookRegistry;
import com.ordermanagement.domain.OrderBookSnapshot;
import com.ordermanagement.domain.OrderFill;
import com.ordermanagement.domain.Side;
import com.ordermanagement.domain.Trade;
import com.ordermanagement.exception.DuplicateOrderException;
import com.ordermanagement.exception.InsufficientLiquidityException;
import com.ordermanagement.exception.InvalidOrderException;
import com.ordermanagement.exception.InvalidRequestException;
import com.ordermanagement.exception.OrderNotFoundException;
import com.ordermanagement.exception.UnknownSymbolException;
import com.ordermanagement.logging.OrderFlowStats;
import com.ordermanagement.metrics.MetricsRegistry;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OrderManagementService")
class OrderManagementServiceTest {

    private OrderManagementService service;
    private OrderFlowStats stats;

    @BeforeEach
    void setUp() {
        stats = new OrderFlowStats();
        service = new OrderManagementService(new OrderBookRegistry(),
                new MetricsRegistry(new PrometheusRegistry()), stats);
    }

    @Nested
    @DisplayName("add_order")
    class AddOrder {

        @Test
        @DisplayName("Creates the symbol's book on first add")
        void createsBook() {
            service.addOrder(1, "JPM", Side.BUY, 20, 20);

            assertThat(service.getRegistry().getBook("JPM")).isNotNull();
            assertThat(service.getOrderBook("JPM").buyOrders())
                    .containsExactly(new OrderBookSnapshot.Entry(1, 20, 20));
            assertThat(stats.ordersAdded.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("Rejects non-positive amount, negative price and missing fields")
        void rejectsInvalid() {
            assertThatThrownBy(() -> service.addOrder(1, "JPM", Side.BUY, 0, 20))
                    .isInstanceOf(InvalidOrderException.class);
            assertThatThrownBy(() -> service.addOrder(1, "JPM", Side.BUY, -5, 20))
                    .isInstanceOf(InvalidOrderException.class);
            assertThatThrownBy(() -> service.addOrder(1, "JPM", Side.BUY, 5, -1))
                    .isInstanceOf(InvalidOrderException.class);
            assertThatThrownBy(() -> service.addOrder(1, null, Side.BUY, 5, 1))
                    .isInstanceOf(InvalidOrderException.class);
            assertThatThrownBy(() -> service.addOrder(1, "JPM", null, 5, 1))
                    .isInstanceOf(InvalidOrderException.class);

            assertThat(service.getRegistry().getBook("JPM")).isNull();
            assertThat(stats.rejected.get()).isEqualTo(5);
        }

        @Test
        @DisplayName("Ids are unique across symbols")
        void rejectsDuplicateAcrossSymbols() {
            service.addOrder(1, "JPM", Side.BUY, 20, 20);

            assertThatThrownBy(() -> service.addOrder(1, "GOOG", Side.SELL, 5, 30))
                    .isInstanceOf(DuplicateOrderException.class);
            assertThat(service.getRegistry().getBook("GOOG")).isNull();
        }

        @Test
        @DisplayName("An overflowing resting total is rejected and frees the id")
        void rejectsOverflowingTotal() {
            service.addOrder(1, "JPM", Side.SELL, Long.MAX_VALUE, 20);

            assertThatThrownBy(() -> service.addOrder(2, "JPM", Side.SELL, Long.MAX_VALUE, 20))
                    .isInstanceOf(InvalidOrderException.class);

            assertThat(service.getOrderBook("JPM").sellOrders()).hasSize(1);
            service.addOrder(2, "GOOG", Side.SELL, 5, 20);
        }

        @Test
        @DisplayName("A removed id can be reused")
        void reusesRemovedId() {
            service.addOrder(1, "JPM", Side.BUY, 20, 20);
            service.removeOrder(1);

            service.addOrder(1, "GOOG", Side.SELL, 5, 30);

            assertThat(service.getOrderBook("GOOG").sellOrders()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("remove_order")
    class RemoveOrder {

        @Test
        @DisplayName("Removes from whichever book holds the id")
        void removesFromOwningBook() {
            service.addOrder(1, "JPM", Side.BUY, 20, 20);
            service.addOrder(2, "GOOG", Side.SELL, 10, 30);

            service.removeOrder(2);

            assertThat(service.getOrderBook("GOOG").sellOrders()).isEmpty();
            assertThat(service.getOrderBook("JPM").buyOrders()).hasSize(1);
        }

        @Test
        @DisplayName("Unknown id fails with NotFound, twice in a row")
        void unknownId() {
            service.addOrder(1, "JPM", Side.BUY, 20, 20);
            service.removeOrder(1);

            assertThatThrownBy(() -> service.removeOrder(1))
                    .isInstanceOf(OrderNotFoundException.class);
            assertThatThrownBy(() -> service.removeOrder(42))
                    .isInstanceOf(OrderNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("calculate_price")
    class CalculatePrice {

        @Test
        @DisplayName("Worked examples against SELL 20@20 and SELL 10@21")
        void workedExamples() {
            service.addOrder(1, "JPM", Side.SELL, 20, 20);
            service.addOrder(4, "JPM", Side.SELL, 10, 21);

            assertThat(service.calculatePrice("JPM", Side.BUY, 22)).isEqualTo(442);
            assertThat(service.calculatePrice("JPM", Side.BUY, 10)).isEqualTo(200);
            assertThat(service.calculatePrice("JPM", Side.BUY, 20)).isEqualTo(400);
        }

        @Test
        @DisplayName("Fails with UnknownSymbol, InvalidRequest and InsufficientLiquidity")
        void failures() {
            assertThatThrownBy(() -> service.calculatePrice("JPM", Side.BUY, 1))
                    .isInstanceOf(UnknownSymbolException.class);

            service.addOrder(1, "JPM", Side.SELL, 20, 20);

            assertThatThrownBy(() -> service.calculatePrice("JPM", Side.BUY, 0))
                    .isInstanceOf(InvalidRequestException.class);
            assertThatThrownBy(() -> service.calculatePrice("JPM", null, 1))
                    .isInstanceOf(InvalidRequestException.class);
            assertThatThrownBy(() -> service.calculatePrice("JPM", Side.BUY, 21))
                    .isInstanceOf(InsufficientLiquidityException.class);
            assertThatThrownBy(() -> service.calculatePrice("JPM", Side.SELL, 1))
                    .isInstanceOf(InsufficientLiquidityException.class);
        }

        @Test
        @DisplayName("An emptied book still exists")
        void emptiedBookIsKnown() {
            service.addOrder(1, "JPM", Side.SELL, 20, 20);
            service.removeOrder(1);

            assertThatThrownBy(() -> service.calculatePrice("JPM", Side.BUY, 1))
                    .isInstanceOf(InsufficientLiquidityException.class);
        }
    }

    @Nested
    @DisplayName("place_trade")
    class PlaceTrade {

        @Test
        @DisplayName("Consumes orders and frees the ids of fully filled ones")
        void consumesAndFreesIds() {
            service.addOrder(1, "JPM", Side.SELL, 20, 20);
            service.addOrder(4, "JPM", Side.SELL, 10, 21);

            Trade trade = service.placeTrade("JPM", Side.BUY, 22);

            assertThat(trade.getTotalPrice()).isEqualTo(442);
            assertThat(trade.getOrderFills()).containsExactly(
                    new OrderFill(1, 20, 20),
                    new OrderFill(4, 2, 21));
            assertThat(service.getOrderBook("JPM").sellOrders())
                    .containsExactly(new OrderBookSnapshot.Entry(4, 21, 8));

            assertThatThrownBy(() -> service.removeOrder(1))
                    .isInstanceOf(OrderNotFoundException.class);
            service.addOrder(1, "JPM", Side.BUY, 1, 1);
            assertThat(stats.tradesExecuted.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("Insufficient liquidity changes nothing")
        void allOrNothing() {
            service.addOrder(1, "JPM", Side.SELL, 20, 20);
            service.addOrder(4, "JPM", Side.SELL, 10, 21);
            OrderBookSnapshot before = service.getOrderBook("JPM");

            assertThatThrownBy(() -> service.placeTrade("JPM", Side.BUY, 31))
                    .isInstanceOf(InsufficientLiquidityException.class);

            assertThat(service.getOrderBook("JPM")).isEqualTo(before);
            assertThat(stats.tradesExecuted.get()).isZero();
        }

        @Test
        @DisplayName("Same preconditions as calculate_price")
        void preconditions() {
            assertThatThrownBy(() -> service.placeTrade("JPM", Side.BUY, 1))
                    .isInstanceOf(UnknownSymbolException.class);

            service.addOrder(1, "JPM", Side.SELL, 20, 20);

            assertThatThrownBy(() -> service.placeTrade("JPM", Side.BUY, -1))
                    .isInstanceOf(InvalidRequestException.class);
            assertThatThrownBy(() -> service.placeTrade(null, Side.BUY, 1))
                    .isInstanceOf(InvalidRequestException.class);
        }
    }

    @Test
    @DisplayName("Unknown symbol gives an empty order book view")
    void emptyViewForUnknownSymbol() {
        OrderBookSnapshot snapshot = service.getOrderBook("NONE");

        assertThat(snapshot.symbol()).isEqualTo("NONE");
        assertThat(snapshot.buyOrders()).isEmpty();
        assertThat(snapshot.sellOrders()).isEmpty();
    }
}
