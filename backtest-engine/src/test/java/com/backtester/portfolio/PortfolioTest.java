package com.backtester.portfolio;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Portfolio Tests")
class PortfolioTest {

    private static final Instant T0 = Instant.parse("2024-01-02T00:00:00Z");
    private static final double INITIAL_CAPITAL = 10000.0;

    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        portfolio = new Portfolio(INITIAL_CAPITAL);
    }

    private static Order buy(String instrument, int quantity, double price) {
        return Order.entry(instrument, OrderSide.LONG, quantity, price, 1).fill(price, T0);
    }

    private static Order sell(String instrument, int quantity, double price) {
        return Order.exit(instrument, OrderSide.SHORT, quantity, price).fill(price, T0);
    }

    private static RejectionReason reasonOf(Runnable action) {
        Throwable thrown = catchThrowable(action::run);
        assertThat(thrown).isInstanceOf(OrderRejectedException.class);
        return ((OrderRejectedException) thrown).getReason();
    }

    @Test
    @DisplayName("Should round-trip a long trade from 10000 to 10200")
    void shouldRunEndToEndScenario() {
        portfolio.processOrder(buy("AAPL", 10, 100));
        assertThat(portfolio.cash()).isCloseTo(9000.0, within(1e-9));

        portfolio.updatePositions(Map.of("AAPL", 120.0));
        assertThat(portfolio.positions().get("AAPL").getUnrealizedPnL()).isCloseTo(200.0, within(1e-9));

        portfolio.processOrder(sell("AAPL", 10, 120));

        assertThat(portfolio.cash()).isCloseTo(10200.0, within(1e-9));
        assertThat(portfolio.positions()).isEmpty();
        assertThat(portfolio.closedPositions()).hasSize(1);
        Position closed = portfolio.closedPositions().get(0);
        assertThat(closed.getStatus()).isEqualTo(PositionStatus.CLOSED);
        assertThat(closed.getRealizedPnL()).isCloseTo(200.0, within(1e-9));
        assertThat(portfolio.value()).isCloseTo(10200.0, within(1e-9));
        assertThat(portfolio.orderHistory()).hasSize(2);
    }

    @Nested
    @DisplayName("Entry validation")
    class EntryValidation {

        @Test
        @DisplayName("Should reject an entry it cannot afford and change nothing")
        void shouldRejectInsufficientCash() {
            RejectionReason reason = reasonOf(() -> portfolio.processOrder(buy("AAPL", 101, 100)));

            assertThat(reason).isEqualTo(RejectionReason.INSUFFICIENT_CASH);
            assertThat(portfolio.cash()).isEqualTo(INITIAL_CAPITAL);
            assertThat(portfolio.positions()).isEmpty();
            assertThat(portfolio.orderHistory()).isEmpty();
        }

        @Test
        @DisplayName("Should divide the cash requirement by leverage")
        void shouldApplyLeverageToCashRequirement() {
            Order levered = Order.entry("AAPL", OrderSide.LONG, 150, 100, 2).fill(100, T0);

            portfolio.processOrder(levered);

            assertThat(portfolio.cash()).isCloseTo(2500.0, within(1e-9));
            assertThat(portfolio.positions().get("AAPL").getLeverage()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should apply the default leverage to orders without leverage")
        void shouldApplyDefaultLeverage() {
            Portfolio levered = new Portfolio(PortfolioSettings.of(INITIAL_CAPITAL).withDefaultLeverage(4));

            Order committed = levered.processOrder(buy("AAPL", 100, 100));

            assertThat(committed.leverage()).isEqualTo(4.0);
            assertThat(levered.cash()).isCloseTo(7500.0, within(1e-9));
        }

        @Test
        @DisplayName("Should resolve entry leverage without committing")
        void shouldResolveLeverage() {
            Portfolio levered = new Portfolio(PortfolioSettings.of(INITIAL_CAPITAL).withDefaultLeverage(3));
            Order entry = buy("AAPL", 10, 100);
            Order exit = Order.exit("AAPL", OrderSide.SHORT, 10, 100).fill(100, T0);

            assertThat(levered.resolveLeverage(entry).leverage()).isEqualTo(3.0);
            assertThat(levered.resolveLeverage(entry).id()).isEqualTo(entry.id());
            assertThat(levered.resolveLeverage(Order.entry("AAPL", OrderSide.LONG, 1, 100, 5).fill(100, T0))
                    .leverage()).isEqualTo(5.0);
            assertThat(levered.resolveLeverage(exit)).isSameAs(exit);
            assertThat(levered.cash()).isEqualTo(INITIAL_CAPITAL);
            assertThat(levered.orderHistory()).isEmpty();
        }

        @Test
        @DisplayName("Should reject averaging in at a different leverage")
        void shouldRejectMixedLeverage() {
            portfolio.processOrder(buy("AAPL", 10, 100));
            Order levered = Order.entry("AAPL", OrderSide.LONG, 10, 100, 2).fill(100, T0);

            assertThat(reasonOf(() -> portfolio.processOrder(levered))).isEqualTo(RejectionReason.INVALID_ORDER);
            assertThat(portfolio.positions().get("AAPL").getQuantity()).isEqualTo(10);
            assertThat(portfolio.cash()).isEqualTo(9000.0);

            portfolio.processOrder(buy("AAPL", 10, 110));
            assertThat(portfolio.positions().get("AAPL").getOpenPrice()).isCloseTo(105.0, within(1e-9));
        }

        @Test
        @DisplayName("Should reject shorts when disabled")
        void shouldRejectShortsWhenDisabled() {
            Order shortEntry = Order.entry("AAPL", OrderSide.SHORT, 1, 100, 1).fill(100, T0);

            assertThat(reasonOf(() -> portfolio.processOrder(shortEntry))).isEqualTo(RejectionReason.SHORTS_DISABLED);
        }

        @Test
        @DisplayName("Should reject an entry against the open position's side")
        void shouldRejectOppositeSideEntry() {
            Portfolio shorts = new Portfolio(PortfolioSettings.of(INITIAL_CAPITAL).withShorts(true));
            shorts.processOrder(buy("AAPL", 10, 100));
            Order shortEntry = Order.entry("AAPL", OrderSide.SHORT, 5, 100, 1).fill(100, T0);

            assertThat(reasonOf(() -> shorts.processOrder(shortEntry))).isEqualTo(RejectionReason.INVALID_ORDER);
            assertThat(shorts.positions().get("AAPL").getQuantity()).isEqualTo(10);
        }

        @Test
        @DisplayName("Should reject an order without an execution price")
        void shouldRejectUnfilledOrder() {
            Order unfilled = Order.entry("AAPL", OrderSide.LONG, 10);

            assertThat(reasonOf(() -> portfolio.processOrder(unfilled))).isEqualTo(RejectionReason.INVALID_ORDER);
        }

        @Test
        @DisplayName("Should reject a blank instrument")
        void shouldRejectBlankInstrument() {
            assertThat(reasonOf(() -> portfolio.processOrder(buy(" ", 1, 10)))).isEqualTo(RejectionReason.INVALID_ORDER);
        }
    }

    @Nested
    @DisplayName("Exits")
    class Exits {

        @Test
        @DisplayName("Should reject an exit with no open position")
        void shouldRejectExitWithoutPosition() {
            assertThat(reasonOf(() -> portfolio.processOrder(sell("AAPL", 1, 100))))
                    .isEqualTo(RejectionReason.NO_OPEN_POSITION);
        }

        @Test
        @DisplayName("Should reject an exit larger than the position and change nothing")
        void shouldRejectOversizeExit() {
            portfolio.processOrder(buy("AAPL", 10, 100));
            double cash = portfolio.cash();

            assertThat(reasonOf(() -> portfolio.processOrder(sell("AAPL", 11, 100))))
                    .isEqualTo(RejectionReason.EXIT_EXCEEDS_SIZE);
            assertThat(portfolio.cash()).isEqualTo(cash);
            assertThat(portfolio.positions().get("AAPL").getQuantity()).isEqualTo(10);
            assertThat(portfolio.orderHistory()).hasSize(1);
        }

        @Test
        @DisplayName("Should keep a partially exited position open")
        void shouldKeepPartialPositionOpen() {
            portfolio.processOrder(buy("AAPL", 10, 100));
            portfolio.processOrder(sell("AAPL", 4, 110));

            Position position = portfolio.positions().get("AAPL");
            assertThat(position.getStatus()).isEqualTo(PositionStatus.PARTIALLY_OPEN);
            assertThat(portfolio.closedPositions()).isEmpty();
            assertThat(portfolio.cash()).isCloseTo(9000.0 + 440.0, within(1e-9));
        }

        @Test
        @DisplayName("Should open a fresh position after the previous one closed")
        void shouldReopenAsNewPosition() {
            portfolio.processOrder(buy("AAPL", 10, 100));
            portfolio.processOrder(sell("AAPL", 10, 100));
            portfolio.processOrder(buy("AAPL", 5, 100));

            assertThat(portfolio.positions().get("AAPL").getId())
                    .isNotEqualTo(portfolio.closedPositions().get(0).getId());
            assertThat(portfolio.positions().get("AAPL").getQuantity()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("Read-side projections")
    class Projections {

        @Test
        @DisplayName("Should summarize open and closed positions")
        void shouldComputeStats() {
            portfolio.processOrder(buy("AAPL", 10, 100));
            portfolio.processOrder(buy("MSFT", 5, 200));
            portfolio.processOrder(buy("TSLA", 2, 250));
            portfolio.processOrder(sell("TSLA", 2, 200));
            portfolio.updatePositions(Map.of("AAPL", 110.0, "MSFT", 190.0));

            PortfolioStats stats = portfolio.stats();

            assertThat(stats.openPositions()).isEqualTo(2);
            assertThat(stats.closedPositions()).isEqualTo(1);
            assertThat(stats.winningPositions()).isEqualTo(1);
            assertThat(stats.losingPositions()).isEqualTo(1);
            assertThat(stats.winningTrades()).isZero();
            assertThat(stats.losingTrades()).isEqualTo(1);
            assertThat(stats.totalUnrealizedPnL()).isCloseTo(50.0, within(1e-9));
            assertThat(stats.totalRealizedPnL()).isCloseTo(-100.0, within(1e-9));
            assertThat(stats.totalValue()).isCloseTo(portfolio.value(), within(1e-9));
        }

        @Test
        @DisplayName("Should report metrics for an open position")
        void shouldReportPositionMetrics() {
            portfolio.processOrder(buy("AAPL", 10, 100));
            portfolio.updatePositions(Map.of("AAPL", 90.0));

            PositionMetrics metrics = portfolio.positionMetrics("AAPL", T0.plusSeconds(7200));

            assertThat(metrics.roi()).isCloseTo(-0.10, within(1e-9));
            assertThat(metrics.duration()).isEqualTo(Duration.ofHours(2));
            assertThat(metrics.maxDrawdown()).isCloseTo(0.10, within(1e-9));
            assertThat(metrics.unrealizedPnL()).isCloseTo(-100.0, within(1e-9));
        }

        @Test
        @DisplayName("Should fail metrics lookup for an unknown instrument")
        void shouldRejectUnknownMetrics() {
            assertThat(reasonOf(() -> portfolio.positionMetrics("NOPE"))).isEqualTo(RejectionReason.NO_POSITION_FOUND);
        }

        @Test
        @DisplayName("Should expose read-only views")
        void shouldExposeReadOnlyViews() {
            portfolio.processOrder(buy("AAPL", 1, 100));

            assertThatThrownBy(() -> portfolio.positions().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> portfolio.orderHistory().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
