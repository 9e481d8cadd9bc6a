package com.trade.journal.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.journal.core.AnalyticsConfig;
import com.trade.journal.core.JsonMappers;
import com.trade.journal.core.Side;
import com.trade.journal.distribution.DistributionConcentration;
import com.trade.journal.matching.OpenLot;
import com.trade.journal.matching.PairedTrade;
import com.trade.journal.matching.PositionGroup;
import com.trade.journal.metrics.EquityCurve;
import com.trade.journal.metrics.Metrics;
import com.trade.journal.metrics.StrategyPerformance;
import com.trade.journal.metrics.SymbolPnl;
import com.trade.journal.segment.EvaluationMetrics;
import com.trade.journal.store.ImportResult;
import com.trade.journal.store.InMemoryTradeStore;
import com.trade.journal.tilt.TiltStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JournalAnalyticsService 集成测试
 * 从 CSV 导入开始，覆盖各统计入口、日期过滤与参数校验
 */
class JournalAnalyticsServiceTest {

    private static final String CSV = """
            symbol,side,quantity,price,timestamp,fees
            AAPL,BUY,10,100,2024-03-01T14:30:00Z,0
            AAPL,SELL,10,110,2024-03-01T15:00:00Z,0
            MSFT,BUY,5,200,2024-03-04T14:30:00Z,0
            MSFT,SELL,5,190,2024-03-05T15:00:00Z,0
            TSLA,BUY,3,50,2024-03-06T14:30:00Z,0
            """;

    private InMemoryTradeStore store;
    private JournalAnalyticsService service;

    @BeforeEach
    void setUp() throws InvalidRequestException {
        store = new InMemoryTradeStore();
        service = new JournalAnalyticsService(store, AnalyticsConfig.defaults());
        ImportResult result = service.importTradesCsv(CSV);
        assertEquals(5, result.getImported());
    }

    @Test
    void testMetricsAcrossAllTrades() throws InvalidRequestException {
        Metrics metrics = service.computeMetrics(null, null, null);

        assertEquals(2, metrics.getTotalTrades());
        assertEquals(1, metrics.getWinningTrades());
        assertEquals(1, metrics.getLosingTrades());
        assertEquals(0, new BigDecimal("50").compareTo(metrics.getNetProfit()));
        assertEquals(new BigDecimal("2.0000"), metrics.getProfitFactor());
    }

    @Test
    void testDateFilterUsesExitTime() throws InvalidRequestException {
        Metrics metrics = service.computeMetrics("FIFO", "2024-03-05", "2024-03-05");

        assertEquals(1, metrics.getTotalTrades());
        assertEquals(0, new BigDecimal("-50").compareTo(metrics.getNetProfit()));

        // MSFT 开仓在区间之前，平仓在区间内，仍然计入
        List<SymbolPnl> symbols = service.computeSymbolPnl(null, "2024-03-05T00:00:00Z", null);
        assertEquals(1, symbols.stream().filter(s -> s.getClosedPositions() > 0).count());
    }

    /**
     * 默认情况下 strategy* 字段不受日期过滤影响
     */
    @Test
    void testStrategyFieldsIgnoreDateFilterByDefault() throws InvalidRequestException {
        service.saveStrategy(1, "Breakout");
        service.assignStrategy(1, 1L);

        Metrics metrics = service.computeMetrics(null, "2024-03-05", "2024-03-05");

        assertEquals(1, metrics.getTotalTrades());
        assertEquals(1, metrics.getStrategyWinningTrades());
        assertEquals(0, new BigDecimal("100").compareTo(metrics.getStrategyProfitLoss()));
    }

    @Test
    void testStrategyFieldsRespectDateFilterWhenConfigured() throws InvalidRequestException {
        JournalAnalyticsService filtered = new JournalAnalyticsService(store,
                AnalyticsConfig.builder().strategyRespectsDateFilter(true).build());
        service.assignStrategy(1, 1L);

        Metrics metrics = filtered.computeMetrics(null, "2024-03-05", "2024-03-05");

        assertEquals(0, metrics.getStrategyWinningTrades());
        assertEquals(0, BigDecimal.ZERO.compareTo(metrics.getStrategyProfitLoss()));
    }

    @Test
    void testStrategyPerformanceAndPairsByStrategy() throws InvalidRequestException {
        service.saveStrategy(1, "Breakout");
        service.assignStrategy(1, 1L);

        List<StrategyPerformance> performance = service.computeStrategyPerformance(null, null);
        assertEquals(2, performance.size());
        assertTrue(performance.stream().anyMatch(p -> "Breakout".equals(p.getStrategyName())));

        List<PairedTrade> breakout = service.getPairedTradesByStrategy(1L, null, null, null);
        assertEquals(1, breakout.size());
        assertEquals("AAPL", breakout.get(0).getSymbol());

        List<PairedTrade> unassigned = service.getPairedTradesByStrategy(null, null, null, null);
        assertEquals(1, unassigned.size());
        assertEquals("MSFT", unassigned.get(0).getSymbol());
    }

    /**
     * 未成交（撤单、挂单、拒单）的记录不参与配对，状态大小写不敏感
     */
    @Test
    void testOnlyFilledExecutionsArePaired() throws InvalidRequestException {
        service.clearAllTrades();
        ImportResult result = service.importTradesCsv("""
                symbol,side,quantity,price,timestamp,status
                NVDA,BUY,10,100,2024-03-07T14:30:00Z,FILLED
                NVDA,SELL,10,150,2024-03-07T15:00:00Z,CANCELLED
                NVDA,SELL,10,90,2024-03-07T15:10:00Z,Pending
                NVDA,SELL,10,120,2024-03-07T15:20:00Z,rejected
                """);
        assertEquals(4, result.getImported());

        Metrics metrics = service.computeMetrics("FIFO", null, null);
        assertEquals(0, metrics.getTotalTrades());
        assertEquals(0, BigDecimal.ZERO.compareTo(metrics.getNetProfit()));
        List<OpenLot> open = service.getOpenPositions(null);
        assertEquals(1, open.size());
        assertEquals(Side.BUY, open.get(0).getSide());

        service.importTradesCsv("""
                symbol,side,quantity,price,timestamp,status
                NVDA,SELL,10,105,2024-03-07T16:00:00Z,filled
                """);
        metrics = service.computeMetrics("FIFO", null, null);
        assertEquals(1, metrics.getTotalTrades());
        assertEquals(0, new BigDecimal("50").compareTo(metrics.getNetProfit()));
    }

    @Test
    void testPositionGroupsFilteredByEntryTime() throws InvalidRequestException {
        List<PositionGroup> groups = service.getPositionGroups(null, null, null);

        assertEquals(3, groups.size());
        assertEquals("TSLA", groups.get(0).getSymbol());
        assertFalse(groups.get(0).isClosed());
        assertEquals("AAPL", groups.get(2).getSymbol());
        assertEquals(0, new BigDecimal("100").compareTo(groups.get(2).getTotalPnl()));

        List<PositionGroup> march4 = service.getPositionGroups(null, "2024-03-04", "2024-03-04");
        assertEquals(1, march4.size());
        assertEquals("MSFT", march4.get(0).getSymbol());
        // 平仓发生在区间之后，组内成交仍完整
        assertEquals(2, march4.get(0).getExecutions().size());
        assertEquals(0, new BigDecimal("-50").compareTo(march4.get(0).getTotalPnl()));
    }

    /**
     * 加仓成交未归属策略：按开仓成交的策略统计
     */
    @Test
    void testScaleInAttributedToEntryStrategy() throws InvalidRequestException {
        service.clearAllTrades();
        service.importTradesCsv("""
                symbol,side,quantity,price,timestamp
                AMD,BUY,10,100,2024-03-08T14:30:00Z
                AMD,BUY,10,102,2024-03-08T14:40:00Z
                AMD,SELL,20,110,2024-03-08T15:00:00Z
                """);
        long entryId = store.snapshot().getExecutions().get(0).getId();
        long exitId = store.snapshot().getExecutions().get(2).getId();
        service.saveStrategy(1, "Breakout");
        service.saveStrategy(2, "Scalp");
        service.assignStrategy(entryId, 1L);
        service.assignStrategy(exitId, 2L);

        List<StrategyPerformance> performance = service.computeStrategyPerformance(null, null);

        assertEquals(1, performance.size());
        assertEquals("Breakout", performance.get(0).getStrategyName());
        assertEquals(2, performance.get(0).getTradeCount());
        assertEquals(2, service.getPairedTradesByStrategy(1L, null, null, null).size());
        assertTrue(service.getPairedTradesByStrategy(2L, null, null, null).isEmpty());
    }

    @Test
    void testRecentTradesNewestFirst() throws InvalidRequestException {
        service.saveStrategy(1, "Breakout");
        service.assignStrategy(2, 1L);

        List<RecentTrade> all = service.computeRecentTrades(null, null, null, null);
        assertEquals(2, all.size());
        assertEquals("MSFT", all.get(0).getSymbol());
        assertNull(all.get(0).getStrategyName());
        assertEquals("Breakout", all.get(1).getStrategyName());

        List<RecentTrade> one = service.computeRecentTrades(1, null, null, null);
        assertEquals(1, one.size());
        assertEquals("MSFT", one.get(0).getSymbol());
    }

    @Test
    void testOpenPositionsIgnoreDateFilter() throws InvalidRequestException {
        List<OpenLot> open = service.getOpenPositions(null);

        assertEquals(1, open.size());
        assertEquals("TSLA", open.get(0).getSymbol());
        assertEquals(0, new BigDecimal("3").compareTo(open.get(0).getRemainingQuantity()));
    }

    @Test
    void testOtherReportsRun() throws InvalidRequestException {
        EvaluationMetrics evaluation = service.computeEvaluationMetrics("lifo", null, null);
        assertEquals(2, evaluation.getSymbolPerformance().size());

        DistributionConcentration distribution = service.computeDistributionConcentration(null, null, null, 30);
        assertEquals(2, distribution.getConcentration().getTotalTrades());

        EquityCurve curve = service.computeEquityCurve(null, null, null);
        assertEquals(2, curve.getPoints().size());

        TiltStats tilt = service.computeTiltMetric(null, null, null);
        assertEquals(TiltStats.CATEGORY_INSUFFICIENT, tilt.getTiltCategory());
    }

    /**
     * 相同输入重复调用得到相同结果
     */
    @Test
    void testRepeatedCallsAreIdentical() throws Exception {
        ObjectMapper mapper = JsonMappers.create();

        String first = mapper.writeValueAsString(service.computeMetrics(null, "2024-03-01", "2024-03-31"));
        String second = mapper.writeValueAsString(service.computeMetrics(null, "2024-03-01", "2024-03-31"));
        assertEquals(first, second);

        String evalFirst = mapper.writeValueAsString(service.computeEvaluationMetrics(null, null, null));
        String evalSecond = mapper.writeValueAsString(service.computeEvaluationMetrics(null, null, null));
        assertEquals(evalFirst, evalSecond);
    }

    @Test
    void testEmptyJournalReturnsZeroStructures() throws InvalidRequestException {
        assertEquals(5, service.clearAllTrades());

        assertEquals(0, service.computeMetrics(null, null, null).getTotalTrades());
        assertTrue(service.computeSymbolPnl(null, null, null).isEmpty());
        assertTrue(service.computeRecentTrades(null, null, null, null).isEmpty());
        assertTrue(service.computeEquityCurve(null, null, null).getPoints().isEmpty());
        assertEquals(7, service.computeEvaluationMetrics(null, null, null).getWeekdayPerformance().size());
        assertEquals(new BigDecimal("100.00"), service.computeDistributionConcentration(null, null, null, null)
                .getConcentration().getStabilityScore());
        assertEquals(TiltStats.CATEGORY_INSUFFICIENT, service.computeTiltMetric(null, null, null).getTiltCategory());
        assertTrue(service.getOpenPositions(null).isEmpty());
    }

    // ==================== 参数校验 ====================

    @Test
    void testInvalidDate() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> service.computeMetrics(null, "2024-02-30", null));
        assertEquals(InvalidRequestException.ErrorCode.INVALID_DATE, e.getErrorCode());

        e = assertThrows(InvalidRequestException.class, () -> service.computeEquityCurve(null, null, "03/01/2024"));
        assertEquals(InvalidRequestException.ErrorCode.INVALID_DATE, e.getErrorCode());
    }

    @Test
    void testStartAfterEnd() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> service.computeSymbolPnl(null, "2024-03-10", "2024-03-01"));
        assertEquals(InvalidRequestException.ErrorCode.INVALID_DATE_RANGE, e.getErrorCode());
    }

    @Test
    void testUnknownPairingMethod() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> service.computeTiltMetric("HIFO", null, null));
        assertEquals(InvalidRequestException.ErrorCode.UNKNOWN_PAIRING_METHOD, e.getErrorCode());
    }

    @Test
    void testConcentrationOutOfRange() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> service.computeDistributionConcentration(null, null, null, 50));
        assertEquals(InvalidRequestException.ErrorCode.CONCENTRATION_OUT_OF_RANGE, e.getErrorCode());
    }

    @Test
    void testInvalidLimit() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> service.computeRecentTrades(0, null, null, null));
        assertEquals(InvalidRequestException.ErrorCode.INVALID_LIMIT, e.getErrorCode());
    }

    @Test
    void testInvalidCsv() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> service.importTradesCsv("foo,bar\n1,2\n"));
        assertEquals(InvalidRequestException.ErrorCode.INVALID_CSV, e.getErrorCode());
    }
}
