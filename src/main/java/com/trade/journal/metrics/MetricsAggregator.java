package com.trade.journal.metrics;

import com.trade.journal.core.Decimal;
import com.trade.journal.matching.PairedTrade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组合绩效指标计算
 * 纯函数：输入回合交易，输出 {@link Metrics}
 */
public class MetricsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(MetricsAggregator.class);

    /**
     * 按平仓时间排序，时间相同按开仓、平仓成交ID
     */
    public static final Comparator<PairedTrade> BY_EXIT = Comparator
            .comparing(PairedTrade::getExitTimestamp)
            .thenComparingLong(PairedTrade::getExitExecutionId)
            .thenComparingLong(PairedTrade::getEntryExecutionId);

    private final ZoneId zone;

    public MetricsAggregator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * 计算绩效指标
     *
     * @param pairs         日期过滤后的回合
     * @param strategyPairs 用于 strategy* 字段的回合（其中仅统计已归属策略的部分）
     */
    public Metrics compute(List<PairedTrade> pairs, List<PairedTrade> strategyPairs) {
        Metrics.Builder builder = Metrics.builder();
        applyStrategyFields(builder, strategyPairs);

        if (pairs.isEmpty()) {
            logger.debug("无回合交易，返回零值指标");
            return builder.build();
        }

        List<PairedTrade> ordered = new ArrayList<>(pairs);
        ordered.sort(BY_EXIT);

        WinLossSummary summary = WinLossSummary.of(ordered);
        Streaks streaks = Streaks.of(ordered);
        List<DailyPnl> days = DailyPnlSeries.of(ordered, zone);

        BigDecimal netProfit = summary.getTotalPnl();
        BigDecimal winRate = summary.getWinRate();
        BigDecimal expectancy = winRate.multiply(summary.getAverageWin())
                .add(BigDecimal.ONE.subtract(winRate).multiply(summary.getAverageLoss()))
                .setScale(Decimal.PRICE_SCALE, RoundingMode.HALF_UP);

        BigDecimal largestWin = BigDecimal.ZERO;
        BigDecimal largestLoss = BigDecimal.ZERO;
        BigDecimal totalVolume = BigDecimal.ZERO;
        BigDecimal totalFees = BigDecimal.ZERO;
        long holdingSeconds = 0;
        for (PairedTrade pair : ordered) {
            BigDecimal pnl = pair.getNetPnl();
            if (pnl.compareTo(largestWin) > 0) {
                largestWin = pnl;
            }
            if (pnl.compareTo(largestLoss) < 0) {
                largestLoss = pnl;
            }
            totalVolume = totalVolume.add(pair.getEntryValue());
            totalFees = totalFees.add(pair.getTotalFees());
            holdingSeconds += Math.max(0, pair.getHoldingSeconds());
        }

        DailyPnl bestDay = days.stream().max(Comparator.comparing(DailyPnl::getNetPnl)).orElseThrow();
        DailyPnl worstDay = days.stream().min(Comparator.comparing(DailyPnl::getNetPnl)).orElseThrow();

        builder.totalTrades(summary.getTradeCount())
                .winningTrades(summary.getWinningTrades())
                .losingTrades(summary.getLosingTrades())
                .totalProfitLoss(netProfit)
                .winRate(winRate)
                .averageProfit(summary.getAverageWin())
                .averageLoss(summary.getAverageLoss())
                .largestWin(largestWin)
                .largestLoss(largestLoss)
                .totalVolume(totalVolume)
                .tradesBySymbol(tradesBySymbol(ordered))
                .consecutiveWins(streaks.longestWins)
                .consecutiveLosses(streaks.longestLosses)
                .currentWinStreak(streaks.currentWins)
                .currentLossStreak(streaks.currentLosses)
                .expectancy(expectancy)
                .profitFactor(summary.getProfitFactor())
                .averageTrade(summary.getAveragePnl())
                .totalFees(totalFees)
                .netProfit(netProfit)
                .maxDrawdown(maxDrawdown(ordered))
                .sharpeRatio(sharpeRatio(days))
                .riskRewardRatio(summary.getPayoffRatio())
                .tradesPerDay(Decimal.divide(BigDecimal.valueOf(ordered.size()),
                        BigDecimal.valueOf(days.size()), Decimal.RATIO_SCALE))
                .bestDay(bestDay.getNetPnl())
                .bestDayDate(bestDay.getDate())
                .worstDay(worstDay.getNetPnl())
                .worstDayDate(worstDay.getDate())
                .averageHoldingTimeSeconds(Decimal.divide(BigDecimal.valueOf(holdingSeconds),
                        BigDecimal.valueOf(ordered.size()), 2));
        applyPercentFields(builder, ordered);

        Metrics metrics = builder.build();
        logger.debug("指标计算完成: 回合={}, 胜率={}, 净利润={}", metrics.getTotalTrades(),
                metrics.getWinRate(), metrics.getNetProfit());
        return metrics;
    }

    private void applyStrategyFields(Metrics.Builder builder, List<PairedTrade> strategyPairs) {
        List<PairedTrade> attributed = new ArrayList<>();
        for (PairedTrade pair : strategyPairs) {
            if (pair.getStrategyId() != null) {
                attributed.add(pair);
            }
        }
        attributed.sort(BY_EXIT);
        WinLossSummary summary = WinLossSummary.of(attributed);
        Streaks streaks = Streaks.of(attributed);
        builder.strategyWinRate(summary.getWinRate())
                .strategyWinningTrades(summary.getWinningTrades())
                .strategyLosingTrades(summary.getLosingTrades())
                .strategyProfitLoss(summary.getTotalPnl())
                .strategyConsecutiveWins(streaks.longestWins)
                .strategyConsecutiveLosses(streaks.longestLosses);
    }

    /**
     * 价格变动百分比（按方向调整），分别统计盈利、亏损回合
     */
    private void applyPercentFields(Metrics.Builder builder, List<PairedTrade> ordered) {
        List<BigDecimal> gains = new ArrayList<>();
        List<BigDecimal> losses = new ArrayList<>();
        BigDecimal largestWinPct = BigDecimal.ZERO;
        BigDecimal largestLossPct = BigDecimal.ZERO;
        for (PairedTrade pair : ordered) {
            if (pair.getEntryPrice().signum() <= 0) {
                continue;
            }
            BigDecimal pct = pair.getReturnPercent();
            if (pair.isWin()) {
                gains.add(pct);
                largestWinPct = largestWinPct.max(pct);
            } else if (pair.isLoss()) {
                losses.add(pct);
                largestLossPct = largestLossPct.min(pct);
            }
        }
        builder.averageGainPct(Decimal.scaleRatio(Decimal.mean(gains)))
                .averageLossPct(Decimal.scaleRatio(Decimal.mean(losses)))
                .largestWinPct(largestWinPct)
                .largestLossPct(largestLossPct);
    }

    private List<SymbolStats> tradesBySymbol(List<PairedTrade> ordered) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, BigDecimal> pnl = new LinkedHashMap<>();
        for (PairedTrade pair : ordered) {
            counts.merge(pair.getSymbol(), 1, Integer::sum);
            pnl.merge(pair.getSymbol(), pair.getNetPnl(), BigDecimal::add);
        }
        List<SymbolStats> stats = new ArrayList<>();
        counts.forEach((symbol, count) -> stats.add(new SymbolStats(symbol, count, pnl.get(symbol))));
        stats.sort(Comparator.comparingInt(SymbolStats::getCount).reversed()
                .thenComparing(SymbolStats::getSymbol));
        return stats;
    }

    /**
     * 累计净盈亏曲线的最大回撤（峰值从0开始），返回正数金额
     */
    static BigDecimal maxDrawdown(List<PairedTrade> ordered) {
        BigDecimal equity = BigDecimal.ZERO;
        BigDecimal peak = BigDecimal.ZERO;
        BigDecimal maxDd = BigDecimal.ZERO;
        for (PairedTrade pair : ordered) {
            equity = equity.add(pair.getNetPnl());
            if (equity.compareTo(peak) > 0) {
                peak = equity;
            }
            BigDecimal drawdown = peak.subtract(equity);
            if (drawdown.compareTo(maxDd) > 0) {
                maxDd = drawdown;
            }
        }
        return maxDd;
    }

    /**
     * 日盈亏均值 / 样本标准差，不年化；不足2天或标准差为0时为0
     */
    static BigDecimal sharpeRatio(List<DailyPnl> days) {
        if (days.size() < 2) {
            return Decimal.scaleRatio(BigDecimal.ZERO);
        }
        List<BigDecimal> values = new ArrayList<>(days.size());
        days.forEach(day -> values.add(day.getNetPnl()));
        BigDecimal stdDev = Decimal.stdDev(values, true);
        if (stdDev.signum() == 0) {
            return Decimal.scaleRatio(BigDecimal.ZERO);
        }
        return Decimal.divide(Decimal.mean(values), stdDev, Decimal.RATIO_SCALE);
    }
}
