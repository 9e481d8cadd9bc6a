package com.trade.journal.tilt;

import com.trade.journal.core.AnalyticsConfig;
import com.trade.journal.core.Side;
import com.trade.journal.matching.PairedTrade;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TiltAnalyzer 单元测试
 */
class TiltAnalyzerTest {

    private final TiltAnalyzer analyzer = new TiltAnalyzer(AnalyticsConfig.defaults());

    @Test
    void testInsufficientHistory() {
        TiltStats stats = analyzer.analyze(sequence("10", "-5", "-5", "10", "-5"));

        assertEquals(5, stats.getTradeCount());
        assertEquals(TiltStats.CATEGORY_INSUFFICIENT, stats.getTiltCategory());
        assertEquals(new BigDecimal("0.00"), stats.getTiltScore());
        assertNull(stats.getRecommendedStreak());
        assertEquals(List.of("Not enough trade history to evaluate tilt yet. Need at least 10 trades."),
                stats.getCoachingLines());
        // 基础统计仍然计算
        assertEquals(new BigDecimal("0.4000"), stats.getBaselineWinRate());
        assertEquals(4, stats.getStreakStats().size());
    }

    /**
     * 盈亏交替：亏损后总是盈利，没有上头迹象
     */
    @Test
    void testCalmWhenLossesAreFollowedByWins() {
        List<String> pnl = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            pnl.add("10");
            pnl.add("-10");
        }

        TiltStats stats = analyzer.analyze(sequence(pnl.toArray(new String[0])));

        assertEquals(TiltStats.CATEGORY_CALM, stats.getTiltCategory());
        assertEquals(new BigDecimal("0.00"), stats.getTiltScore());
        assertEquals(new BigDecimal("1.0000"), stats.getWinRateAfterLoss());
        // 没有连续两笔亏损，回退为基准胜率
        assertEquals(stats.getBaselineWinRate(), stats.getWinRateAfter2Losses());
        assertEquals(0, stats.getStreakStats().get(1).getSampleSize());
        assertNull(stats.getRecommendedStreak());
        assertEquals(3, stats.getCoachingLines().size());
        assertTrue(stats.getCoachingLines().get(2).contains("optional"));
    }

    /**
     * 前10笔盈利，后10笔连续亏损且亏损扩大
     * 得分 = 3 + 3 + 2 × (30/28 - 1) + 2 ≈ 8.14
     */
    @Test
    void testSevereWhenLossesCluster() {
        TiltStats stats = analyzer.analyze(clusteredLosses());

        assertEquals(TiltStats.CATEGORY_SEVERE, stats.getTiltCategory());
        assertEquals(new BigDecimal("8.14"), stats.getTiltScore());
        assertEquals(new BigDecimal("0.5000"), stats.getBaselineWinRate());
        assertEquals(new BigDecimal("0.0000"), stats.getWinRateAfterLoss());
        assertEquals(new BigDecimal("0.9000"), stats.getWinRateAfterWin());
        assertEquals(new BigDecimal("1.0000"), stats.getProbLossAfterLoss());
        assertEquals(0, new BigDecimal("-28").compareTo(stats.getAvgLossNormally()));
        assertEquals(0, new BigDecimal("-30").compareTo(stats.getAvgLossAfterLoss()));

        StreakStats afterOne = stats.getStreakStats().get(0);
        assertEquals(1, afterOne.getK());
        assertEquals(9, afterOne.getSampleSize());
        // 样本不足10笔，不给出建议
        assertFalse(afterOne.isSufficientSample());
        assertNull(stats.getRecommendedStreak());
        assertTrue(stats.getCoachingLines().get(0).contains("strong signs of emotional tilt"));
    }

    /**
     * 一段5连亏同时计入 k=1..4：第 i 笔只要求紧邻的前 k 笔全部亏损
     */
    @Test
    void testLongLosingRunCountsForEveryShorterStreak() {
        TiltStats stats = analyzer.analyze(sequence("10", "-5", "-5", "-5", "-5", "-5", "10"));

        List<StreakStats> streaks = stats.getStreakStats();
        assertEquals(5, streaks.get(0).getSampleSize());
        assertEquals(4, streaks.get(1).getSampleSize());
        assertEquals(3, streaks.get(2).getSampleSize());
        assertEquals(2, streaks.get(3).getSampleSize());

        assertEquals(new BigDecimal("0.2000"), streaks.get(0).getWinRateAfterKLosses());
        assertEquals(new BigDecimal("0.3333"), streaks.get(2).getWinRateAfterKLosses());
        assertEquals(new BigDecimal("0.5000"), streaks.get(3).getWinRateAfterKLosses());
        assertEquals(0, new BigDecimal("-2").compareTo(streaks.get(0).getAvgPnlAfterKLosses()));
    }

    @Test
    void testClusteredLossSamplesShrinkByOnePerStreakLength() {
        List<StreakStats> streaks = analyzer.analyze(clusteredLosses()).getStreakStats();

        assertEquals(9, streaks.get(0).getSampleSize());
        assertEquals(8, streaks.get(1).getSampleSize());
        assertEquals(7, streaks.get(2).getSampleSize());
        assertEquals(6, streaks.get(3).getSampleSize());
        for (StreakStats streak : streaks) {
            assertEquals(new BigDecimal("0.0000"), streak.getWinRateAfterKLosses());
        }
    }

    /**
     * 持平交易打断连亏链
     */
    @Test
    void testScratchTradeBreaksLosingChain() {
        TiltStats stats = analyzer.analyze(sequence("-5", "0", "-5", "10"));

        assertEquals(1, stats.getStreakStats().get(0).getSampleSize());
        assertEquals(0, stats.getStreakStats().get(1).getSampleSize());
    }

    @Test
    void testRecommendedStreakWithSmallerSampleRequirement() {
        TiltAnalyzer lenient = new TiltAnalyzer(4, 5, 10, new BigDecimal("0.15"));

        TiltStats stats = lenient.analyze(clusteredLosses());

        assertEquals(Integer.valueOf(1), stats.getRecommendedStreak());
        assertTrue(stats.getCoachingLines().stream()
                .anyMatch(line -> line.contains("stop trading for the day after 1 consecutive losing trades")));
    }

    /**
     * 输入顺序不影响结果（按平仓时间排序）
     */
    @Test
    void testOrderIndependent() {
        List<PairedTrade> pairs = clusteredLosses();
        List<PairedTrade> shuffled = new ArrayList<>(pairs);
        Collections.reverse(shuffled);

        assertEquals(analyzer.analyze(pairs).getTiltScore(), analyzer.analyze(shuffled).getTiltScore());
    }

    @Test
    void testTiltScoreComponents() {
        BigDecimal score = TiltAnalyzer.tiltScore(new BigDecimal("0.6"), new BigDecimal("0.4"),
                new BigDecimal("0.3"), new BigDecimal("0.2"),
                new BigDecimal("-10"), new BigDecimal("-15"), new BigDecimal("0.7"));

        // 1.8 + 2.4 + 1.0 + 1.2
        assertEquals(new BigDecimal("6.40"), score);
    }

    @Test
    void testTiltScoreClampedAtTen() {
        BigDecimal score = TiltAnalyzer.tiltScore(BigDecimal.ONE, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                new BigDecimal("-10"), new BigDecimal("-100"), BigDecimal.ONE);

        assertEquals(new BigDecimal("10.00"), score);
    }

    // ==================== 辅助方法 ====================

    private static List<PairedTrade> clusteredLosses() {
        List<String> pnl = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            pnl.add("10");
        }
        pnl.add("-10");
        for (int i = 0; i < 9; i++) {
            pnl.add("-30");
        }
        return sequence(pnl.toArray(new String[0]));
    }

    /**
     * 按给定顺序生成回合，每笔间隔1分钟平仓
     */
    private static List<PairedTrade> sequence(String... pnl) {
        Instant start = Instant.parse("2024-03-01T14:30:00Z");
        BigDecimal entry = new BigDecimal("100");
        List<PairedTrade> pairs = new ArrayList<>();
        for (int i = 0; i < pnl.length; i++) {
            Instant exit = start.plusSeconds(60L * (i + 1));
            pairs.add(new PairedTrade("AAPL", Side.BUY, 2L * i + 1, 2L * i + 2, BigDecimal.ONE, entry,
                    entry.add(new BigDecimal(pnl[i])), exit.minusSeconds(30), exit,
                    BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ONE, null));
        }
        return pairs;
    }
}
