package com.trade.journal.matching;

import com.trade.journal.core.DateRange;
import com.trade.journal.core.Execution;
import com.trade.journal.core.PairingMethod;
import com.trade.journal.core.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LotMatcher 单元测试
 * 覆盖 FIFO / LIFO 配对、数量与手续费守恒、做空、期权乘数与区间过滤
 */
class LotMatcherTest {

    private static final Instant T1 = Instant.parse("2024-03-01T14:30:00Z");
    private static final Instant T2 = Instant.parse("2024-03-01T15:00:00Z");
    private static final Instant T3 = Instant.parse("2024-03-01T16:00:00Z");

    private LotMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new LotMatcher(BigDecimal.valueOf(100));
    }

    /**
     * FIFO：卖出15股先消耗最早的10股，再消耗第二笔的5股
     */
    @Test
    void testFifoConsumesOldestLotFirst() {
        List<Execution> executions = List.of(
                exec(1, "AAPL", Side.BUY, "10", "10", T1, "1"),
                exec(2, "AAPL", Side.BUY, "10", "12", T2, "1"),
                exec(3, "AAPL", Side.SELL, "15", "15", T3, "1.5"));

        MatchResult result = matcher.match(executions, PairingMethod.FIFO);

        assertEquals(2, result.getPairs().size());
        PairedTrade first = result.getPairs().get(0);
        assertEquals(1, first.getEntryExecutionId());
        assertEquals(0, new BigDecimal("10").compareTo(first.getQuantity()));
        assertEquals(0, new BigDecimal("50").compareTo(first.getGrossPnl()));

        PairedTrade second = result.getPairs().get(1);
        assertEquals(2, second.getEntryExecutionId());
        assertEquals(0, new BigDecimal("5").compareTo(second.getQuantity()));
        assertEquals(0, new BigDecimal("12").compareTo(second.getEntryPrice()));
        assertEquals(0, new BigDecimal("15").compareTo(second.getGrossPnl()));

        assertEquals(1, result.getOpenLots().size());
        OpenLot open = result.getOpenLots().get(0);
        assertEquals(2, open.getExecutionId());
        assertEquals(Side.BUY, open.getSide());
        assertEquals(0, new BigDecimal("5").compareTo(open.getRemainingQuantity()));
        assertEquals(0, new BigDecimal("12").compareTo(open.getPrice()));
    }

    /**
     * LIFO：卖出15股先消耗最新的10股
     */
    @Test
    void testLifoConsumesNewestLotFirst() {
        List<Execution> executions = List.of(
                exec(1, "AAPL", Side.BUY, "10", "10", T1, "0"),
                exec(2, "AAPL", Side.BUY, "10", "12", T2, "0"),
                exec(3, "AAPL", Side.SELL, "15", "15", T3, "0"));

        MatchResult result = matcher.match(executions, PairingMethod.LIFO);

        assertEquals(2, result.getPairs().size());
        assertEquals(2, result.getPairs().get(0).getEntryExecutionId());
        assertEquals(0, new BigDecimal("10").compareTo(result.getPairs().get(0).getQuantity()));
        assertEquals(1, result.getPairs().get(1).getEntryExecutionId());
        assertEquals(0, new BigDecimal("5").compareTo(result.getPairs().get(1).getQuantity()));

        OpenLot open = result.getOpenLots().get(0);
        assertEquals(1, open.getExecutionId());
        assertEquals(0, new BigDecimal("5").compareTo(open.getRemainingQuantity()));
        assertEquals(0, new BigDecimal("10").compareTo(open.getPrice()));
    }

    /**
     * 配对数量 + 未平仓数量 = 成交总数量
     */
    @Test
    void testQuantityConservation() {
        List<Execution> executions = List.of(
                exec(1, "MSFT", Side.BUY, "7", "100", T1, "0"),
                exec(2, "MSFT", Side.SELL, "3", "101", T2, "0"),
                exec(3, "MSFT", Side.SELL, "9", "102", T3, "0"),
                exec(4, "MSFT", Side.BUY, "1", "99", T3.plusSeconds(60), "0"));

        for (PairingMethod method : PairingMethod.values()) {
            MatchResult result = matcher.match(executions, method);
            BigDecimal paired = result.getPairs().stream()
                    .map(PairedTrade::getQuantity).reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal open = result.getOpenLots().stream()
                    .map(OpenLot::getRemainingQuantity).reduce(BigDecimal.ZERO, BigDecimal::add);

            // 每个回合的数量同时来自开仓和平仓两笔成交
            BigDecimal total = executions.stream().map(Execution::getQuantity).reduce(BigDecimal.ZERO, BigDecimal::add);
            assertEquals(0, total.compareTo(paired.multiply(BigDecimal.valueOf(2)).add(open)), method.name());
        }
    }

    /**
     * 分摊的手续费 + 未分摊的手续费 = 手续费总额
     */
    @Test
    void testFeeConservation() {
        List<Execution> executions = List.of(
                exec(1, "AAPL", Side.BUY, "10", "10", T1, "1"),
                exec(2, "AAPL", Side.BUY, "10", "12", T2, "1"),
                exec(3, "AAPL", Side.SELL, "15", "15", T3, "1.5"));

        MatchResult result = matcher.match(executions, PairingMethod.FIFO);

        BigDecimal allocated = result.getPairs().stream()
                .map(PairedTrade::getTotalFees).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal remaining = result.getOpenLots().stream()
                .map(OpenLot::getRemainingFees).reduce(BigDecimal.ZERO, BigDecimal::add);

        assertEquals(0, new BigDecimal("3.5").compareTo(allocated.add(remaining)));
        assertEquals(0, new BigDecimal("0.5").compareTo(remaining));

        PairedTrade first = result.getPairs().get(0);
        assertEquals(0, new BigDecimal("2").compareTo(first.getTotalFees()));
        assertEquals(0, new BigDecimal("48").compareTo(first.getNetPnl()));
    }

    /**
     * 先卖后买形成空头回合
     */
    @Test
    void testShortRoundTrip() {
        List<Execution> executions = List.of(
                exec(1, "TSLA", Side.SELL, "5", "20", T1, "0"),
                exec(2, "TSLA", Side.BUY, "5", "18", T2, "0"));

        MatchResult result = matcher.match(executions, PairingMethod.FIFO);

        assertEquals(1, result.getPairs().size());
        PairedTrade pair = result.getPairs().get(0);
        assertEquals(Side.SELL, pair.getSide());
        assertEquals(0, new BigDecimal("10").compareTo(pair.getGrossPnl()));
        assertEquals(new BigDecimal("10.0000"), pair.getReturnPercent());
        assertEquals(1800, pair.getHoldingSeconds());
        assertTrue(result.getOpenLots().isEmpty());
    }

    /**
     * 反手：卖出数量超过多头持仓，剩余部分开空
     */
    @Test
    void testReversalOpensOppositeLot() {
        List<Execution> executions = List.of(
                exec(1, "AAPL", Side.BUY, "5", "10", T1, "0"),
                exec(2, "AAPL", Side.SELL, "8", "11", T2, "0"));

        MatchResult result = matcher.match(executions, PairingMethod.FIFO);

        assertEquals(1, result.getPairs().size());
        assertEquals(1, result.getOpenLots().size());
        OpenLot open = result.getOpenLots().get(0);
        assertEquals(Side.SELL, open.getSide());
        assertEquals(0, new BigDecimal("3").compareTo(open.getRemainingQuantity()));
    }

    @Test
    void testOptionMultiplierApplied() {
        List<Execution> executions = List.of(
                exec(1, "SPY251218C00679000", Side.BUY, "1", "2.00", T1, "0"),
                exec(2, "SPY251218C00679000", Side.SELL, "1", "2.50", T2, "0"));

        PairedTrade pair = matcher.match(executions, PairingMethod.FIFO).getPairs().get(0);

        assertEquals(0, new BigDecimal("50").compareTo(pair.getGrossPnl()));
    }

    @Test
    void testSymbolsMatchedIndependently() {
        List<Execution> executions = List.of(
                exec(1, "AAPL", Side.BUY, "10", "10", T1, "0"),
                exec(2, "MSFT", Side.SELL, "10", "20", T2, "0"));

        MatchResult result = matcher.match(executions, PairingMethod.FIFO);

        assertTrue(result.getPairs().isEmpty());
        assertEquals(2, result.getOpenLots().size());
    }

    /**
     * 区间外平仓的回合不输出，但仍然消耗持仓
     */
    @Test
    void testExitRangeFiltersPairsButKeepsInventory() {
        Instant day1 = Instant.parse("2024-03-01T15:00:00Z");
        Instant day2 = Instant.parse("2024-03-02T15:00:00Z");
        Instant day3 = Instant.parse("2024-03-03T15:00:00Z");
        List<Execution> executions = List.of(
                exec(1, "AAPL", Side.BUY, "5", "10", day1, "0"),
                exec(2, "AAPL", Side.BUY, "5", "20", day1.plusSeconds(60), "0"),
                exec(3, "AAPL", Side.SELL, "5", "11", day2, "0"),
                exec(4, "AAPL", Side.SELL, "5", "21", day3, "0"));

        DateRange range = DateRange.of(Instant.parse("2024-03-03T00:00:00Z"), null);
        MatchResult result = matcher.match(executions, PairingMethod.FIFO, range);

        assertEquals(1, result.getPairs().size());
        PairedTrade pair = result.getPairs().get(0);
        assertEquals(2, pair.getEntryExecutionId());
        assertEquals(4, pair.getExitExecutionId());
        assertTrue(result.getOpenLots().isEmpty());
    }

    /**
     * 同一时间戳按 ID 排序，与输入顺序无关
     */
    @Test
    void testSameTimestampOrderedById() {
        List<Execution> executions = new ArrayList<>();
        executions.add(exec(2, "AAPL", Side.SELL, "1", "11", T1, "0"));
        executions.add(exec(1, "AAPL", Side.BUY, "1", "10", T1, "0"));

        PairedTrade pair = matcher.match(executions, PairingMethod.FIFO).getPairs().get(0);

        assertEquals(1, pair.getEntryExecutionId());
        assertEquals(Side.BUY, pair.getSide());
    }

    @Test
    void testStrategyFallsBackToExit() {
        Execution entry = exec(1, "AAPL", Side.BUY, "1", "10", T1, "0");
        Execution exit = exec(2, "AAPL", Side.SELL, "1", "11", T2, "0").withStrategyId(7L);

        PairedTrade pair = matcher.match(List.of(entry, exit), PairingMethod.FIFO).getPairs().get(0);

        assertEquals(Long.valueOf(7L), pair.getStrategyId());
    }

    @Test
    void testEmptyInput() {
        MatchResult result = matcher.match(List.of(), PairingMethod.LIFO);
        assertTrue(result.getPairs().isEmpty());
        assertTrue(result.getOpenLots().isEmpty());
    }

    // ==================== 辅助方法 ====================

    private Execution exec(long id, String symbol, Side side, String qty, String price, Instant time, String fees) {
        return Execution.builder()
                .id(id)
                .symbol(symbol)
                .side(side)
                .quantity(new BigDecimal(qty))
                .price(new BigDecimal(price))
                .timestamp(time)
                .fees(new BigDecimal(fees))
                .build();
    }
}
