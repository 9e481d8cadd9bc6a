package com.trade.journal.store;

import com.trade.journal.core.Execution;
import com.trade.journal.core.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTradeStoreTest {

    private InMemoryTradeStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTradeStore();
    }

    @Test
    void addAssignsIdsAndBumpsVersion() {
        List<Execution> added = store.addExecutions(List.of(
                exec("AAPL", Side.BUY, "10"),
                exec("AAPL", Side.SELL, "11")));

        assertEquals(2, added.size());
        assertEquals(1, added.get(0).getId());
        assertEquals(2, added.get(1).getId());

        TradeSnapshot snapshot = store.snapshot();
        assertEquals(1, snapshot.getVersion());
        assertEquals(2, snapshot.getExecutions().size());
    }

    @Test
    void duplicatesSkippedWithinAndAcrossBatches() {
        store.addExecutions(List.of(exec("AAPL", Side.BUY, "10")));

        List<Execution> added = store.addExecutions(List.of(
                exec("AAPL", Side.BUY, "10"),
                exec("MSFT", Side.BUY, "10"),
                exec("MSFT", Side.BUY, "10")));

        assertEquals(1, added.size());
        assertEquals("MSFT", added.get(0).getSymbol());
        assertEquals(2, store.snapshot().getExecutions().size());
    }

    /**
     * 全部重复时不产生新版本
     */
    @Test
    void noChangeKeepsVersion() {
        store.addExecutions(List.of(exec("AAPL", Side.BUY, "10")));
        store.addExecutions(List.of(exec("AAPL", Side.BUY, "10")));

        assertEquals(1, store.snapshot().getVersion());
    }

    @Test
    void snapshotIsIsolatedFromLaterWrites() {
        store.addExecutions(List.of(exec("AAPL", Side.BUY, "10")));
        TradeSnapshot before = store.snapshot();

        store.clearAll();

        assertEquals(1, before.getExecutions().size());
        assertTrue(store.snapshot().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> before.getExecutions().clear());
    }

    @Test
    void clearAllReturnsRemovedCount() {
        store.addExecutions(List.of(exec("AAPL", Side.BUY, "10"), exec("AAPL", Side.SELL, "12")));

        assertEquals(2, store.clearAll());
        assertEquals(0, store.clearAll());
    }

    @Test
    void idsKeepIncreasingAfterClear() {
        store.addExecutions(List.of(exec("AAPL", Side.BUY, "10")));
        store.clearAll();

        List<Execution> added = store.addExecutions(List.of(exec("AAPL", Side.BUY, "10")));
        assertEquals(2, added.get(0).getId());
    }

    @Test
    void strategyAssignment() {
        long id = store.addExecutions(List.of(exec("AAPL", Side.BUY, "10"))).get(0).getId();
        store.saveStrategy(3, " Breakout ");

        Execution updated = store.assignStrategy(id, 3L);

        assertEquals(Long.valueOf(3L), updated.getStrategyId());
        assertEquals("Breakout", store.snapshot().getStrategies().get(3L));
        assertEquals(Long.valueOf(3L), store.snapshot().getExecutions().get(0).getStrategyId());

        assertNull(store.assignStrategy(id, null).getStrategyId());
    }

    @Test
    void assignUnknownExecutionRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.assignStrategy(99, 1L));
        assertThrows(IllegalArgumentException.class, () -> store.saveStrategy(1, " "));
    }

    /**
     * 数值相等但精度不同的记录同样视为重复
     */
    @Test
    void duplicateDetectionIgnoresScale() {
        store.addExecutions(List.of(exec("AAPL", Side.BUY, "10")));

        assertTrue(store.addExecutions(List.of(exec("AAPL", Side.BUY, "10.00"))).isEmpty());
    }

    @Test
    void largeReimportIsFullySkipped() {
        List<Execution> batch = new ArrayList<>();
        Instant start = Instant.parse("2024-01-02T14:30:00Z");
        for (int i = 0; i < 10_000; i++) {
            batch.add(Execution.builder()
                    .symbol("AAPL")
                    .side(i % 2 == 0 ? Side.BUY : Side.SELL)
                    .quantity(BigDecimal.ONE)
                    .price(new BigDecimal("100"))
                    .timestamp(start.plusSeconds(i))
                    .build());
        }

        assertEquals(10_000, store.addExecutions(batch).size());
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> assertTrue(store.addExecutions(batch).isEmpty()));
        assertEquals(1, store.snapshot().getVersion());
    }

    /**
     * 持久化失败时写操作整体不生效
     */
    @Test
    void failedPersistLeavesStateUntouched() {
        FailingStore failing = new FailingStore();
        failing.addExecutions(List.of(exec("AAPL", Side.BUY, "10")));
        failing.saveStrategy(1, "Momentum");
        failing.failing = true;

        assertThrows(TradeStoreException.class,
                () -> failing.addExecutions(List.of(exec("AAPL", Side.SELL, "12"))));
        assertThrows(TradeStoreException.class, () -> failing.assignStrategy(1, 1L));
        assertThrows(TradeStoreException.class, () -> failing.saveStrategy(2, "Breakout"));
        assertThrows(TradeStoreException.class, failing::clearAll);

        TradeSnapshot snapshot = failing.snapshot();
        assertEquals(2, snapshot.getVersion());
        assertEquals(1, snapshot.getExecutions().size());
        assertNull(snapshot.getExecutions().get(0).getStrategyId());
        assertEquals(1, snapshot.getStrategies().size());

        failing.failing = false;
        List<Execution> added = failing.addExecutions(List.of(exec("AAPL", Side.SELL, "12")));
        assertEquals(2, added.get(0).getId());
        assertEquals(3, failing.snapshot().getVersion());
    }

    // ==================== 辅助方法 ====================

    static Execution exec(String symbol, Side side, String price) {
        return Execution.builder()
                .symbol(symbol)
                .side(side)
                .quantity(BigDecimal.TEN)
                .price(new BigDecimal(price))
                .timestamp(Instant.parse("2024-03-01T14:30:00Z"))
                .build();
    }

    private static final class FailingStore extends InMemoryTradeStore {
        private boolean failing;

        @Override
        protected void persist(TradeSnapshot candidate) {
            if (failing) {
                throw new TradeStoreException("磁盘已满", new IOException("No space left on device"));
            }
        }
    }
}
