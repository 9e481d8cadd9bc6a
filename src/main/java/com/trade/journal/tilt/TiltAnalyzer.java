package com.trade.journal.tilt;

import com.trade.journal.core.AnalyticsConfig;
import com.trade.journal.core.Decimal;
import com.trade.journal.matching.PairedTrade;
import com.trade.journal.metrics.MetricsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 情绪化交易分析
 * 按平仓时间排序后，统计亏损之后下一笔交易的表现；下一笔净盈亏为0的不计入样本
 *
 * 评分 = 3 × 亏1笔后胜率下降程度 + 3 × 连亏2笔后胜率下降程度 + 2 × 亏损放大程度 + 2 × 超额连亏程度，
 * 下降程度 = clamp(下降值 / 0.5, 0, 1)
 */
public class TiltAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TiltAnalyzer.class);

    private static final BigDecimal MAX_DROP = new BigDecimal("0.5");
    private static final BigDecimal CALM_LIMIT = BigDecimal.valueOf(3);
    private static final BigDecimal MODERATE_LIMIT = BigDecimal.valueOf(7);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final int maxStreak;
    private final int minSample;
    private final int minTrades;
    private final BigDecimal winDropThreshold;

    public TiltAnalyzer(AnalyticsConfig config) {
        this(config.getTiltMaxStreak(), config.getTiltMinSample(), config.getTiltMinTrades(),
                config.getTiltWinDropThreshold());
    }

    public TiltAnalyzer(int maxStreak, int minSample, int minTrades, BigDecimal winDropThreshold) {
        this.maxStreak = maxStreak;
        this.minSample = minSample;
        this.minTrades = minTrades;
        this.winDropThreshold = winDropThreshold;
    }

    public TiltStats analyze(List<PairedTrade> pairs) {
        List<PairedTrade> ordered = new ArrayList<>(pairs);
        ordered.sort(MetricsAggregator.BY_EXIT);
        List<BigDecimal> pnl = new ArrayList<>(ordered.size());
        ordered.forEach(pair -> pnl.add(pair.getNetPnl()));
        int n = pnl.size();

        int wins = 0;
        List<BigDecimal> losses = new ArrayList<>();
        for (BigDecimal value : pnl) {
            if (value.signum() > 0) {
                wins++;
            } else if (value.signum() < 0) {
                losses.add(value);
            }
        }
        BigDecimal baseline = Decimal.ratio(wins, n);
        BigDecimal baselineLossRate = Decimal.ratio(losses.size(), n);
        BigDecimal avgLossNormally = Decimal.mean(losses);

        // 亏损之后 / 盈利之后
        int afterLossTotal = 0;
        int afterLossWins = 0;
        List<BigDecimal> lossesAfterLoss = new ArrayList<>();
        int afterWinTotal = 0;
        int afterWinWins = 0;
        for (int i = 1; i < n; i++) {
            BigDecimal previous = pnl.get(i - 1);
            BigDecimal current = pnl.get(i);
            if (current.signum() == 0) {
                continue;
            }
            if (previous.signum() < 0) {
                afterLossTotal++;
                if (current.signum() > 0) {
                    afterLossWins++;
                } else {
                    lossesAfterLoss.add(current);
                }
            } else if (previous.signum() > 0) {
                afterWinTotal++;
                if (current.signum() > 0) {
                    afterWinWins++;
                }
            }
        }

        BigDecimal winRateAfterLoss = afterLossTotal > 0 ? Decimal.ratio(afterLossWins, afterLossTotal) : baseline;
        BigDecimal winRateAfterWin = afterWinTotal > 0 ? Decimal.ratio(afterWinWins, afterWinTotal) : baseline;
        BigDecimal avgLossAfterLoss = lossesAfterLoss.isEmpty() ? avgLossNormally : Decimal.mean(lossesAfterLoss);
        BigDecimal probLossAfterLoss = Decimal.ratio(lossesAfterLoss.size(), afterLossTotal);

        List<StreakStats> streakStats = new ArrayList<>(maxStreak);
        for (int k = 1; k <= maxStreak; k++) {
            streakStats.add(streakStats(pnl, k));
        }
        StreakStats afterTwo = maxStreak >= 2 ? streakStats.get(1) : streakStats(pnl, 2);
        BigDecimal winRateAfter2Losses = afterTwo.getSampleSize() > 0 ? afterTwo.getWinRateAfterKLosses() : baseline;

        boolean insufficient = n < minTrades;
        BigDecimal score;
        String category;
        Integer recommended = null;
        List<String> coaching = new ArrayList<>();

        if (insufficient) {
            score = Decimal.scalePercent(BigDecimal.ZERO);
            category = TiltStats.CATEGORY_INSUFFICIENT;
            coaching.add(String.format("Not enough trade history to evaluate tilt yet. Need at least %d trades.", minTrades));
        } else {
            score = tiltScore(baseline, baselineLossRate, winRateAfterLoss, winRateAfter2Losses,
                    avgLossNormally, avgLossAfterLoss, probLossAfterLoss);
            recommended = recommendedStreak(baseline, streakStats);
            if (score.compareTo(CALM_LIMIT) <= 0) {
                category = TiltStats.CATEGORY_CALM;
            } else if (score.compareTo(MODERATE_LIMIT) <= 0) {
                category = TiltStats.CATEGORY_MODERATE;
            } else {
                category = TiltStats.CATEGORY_SEVERE;
            }
            coaching.addAll(coachingLines(category, recommended, baseline, winRateAfterLoss,
                    winRateAfter2Losses, probLossAfterLoss));
        }

        TiltStats stats = new TiltStats(n, baseline, winRateAfterLoss, winRateAfterWin, winRateAfter2Losses,
                avgLossNormally, avgLossAfterLoss, probLossAfterLoss, score, category, recommended,
                streakStats, coaching);
        logger.debug("上头指标计算完成: {}", stats);
        return stats;
    }

    /**
     * 前 k 笔均为亏损时，统计第 i 笔的表现
     */
    private StreakStats streakStats(List<BigDecimal> pnl, int k) {
        int total = 0;
        int wins = 0;
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = k; i < pnl.size(); i++) {
            BigDecimal current = pnl.get(i);
            if (current.signum() == 0 || !precededByLosses(pnl, i, k)) {
                continue;
            }
            total++;
            sum = sum.add(current);
            if (current.signum() > 0) {
                wins++;
            }
        }
        BigDecimal avgPnl = total == 0 ? BigDecimal.ZERO : Decimal.divide(sum, BigDecimal.valueOf(total));
        return new StreakStats(k, total, Decimal.ratio(wins, total), avgPnl, total >= minSample);
    }

    private static boolean precededByLosses(List<BigDecimal> pnl, int index, int k) {
        for (int j = index - k; j < index; j++) {
            if (pnl.get(j).signum() >= 0) {
                return false;
            }
        }
        return true;
    }

    private Integer recommendedStreak(BigDecimal baseline, List<StreakStats> streakStats) {
        for (StreakStats stat : streakStats) {
            if (!stat.isSufficientSample()) {
                continue;
            }
            BigDecimal drop = baseline.subtract(stat.getWinRateAfterKLosses());
            if (drop.compareTo(winDropThreshold) >= 0 && stat.getAvgPnlAfterKLosses().signum() < 0) {
                return stat.getK();
            }
        }
        return null;
    }

    static BigDecimal tiltScore(BigDecimal baseline, BigDecimal baselineLossRate,
                                BigDecimal winRateAfterLoss, BigDecimal winRateAfter2Losses,
                                BigDecimal avgLossNormally, BigDecimal avgLossAfterLoss,
                                BigDecimal probLossAfterLoss) {
        BigDecimal score = severity(baseline.subtract(winRateAfterLoss)).multiply(BigDecimal.valueOf(3))
                .add(severity(baseline.subtract(winRateAfter2Losses)).multiply(BigDecimal.valueOf(3)));

        if (avgLossNormally.signum() != 0) {
            BigDecimal growth = Decimal.divide(avgLossAfterLoss.abs(), avgLossNormally.abs()).subtract(BigDecimal.ONE);
            score = score.add(Decimal.clamp(growth, BigDecimal.ZERO, BigDecimal.ONE).multiply(BigDecimal.valueOf(2)));
        }

        score = score.add(severity(probLossAfterLoss.subtract(baselineLossRate)).multiply(BigDecimal.valueOf(2)));
        return Decimal.scalePercent(Decimal.clamp(score, BigDecimal.ZERO, BigDecimal.TEN));
    }

    private static BigDecimal severity(BigDecimal drop) {
        return Decimal.clamp(drop.divide(MAX_DROP, Decimal.PRICE_SCALE, RoundingMode.HALF_UP),
                BigDecimal.ZERO, BigDecimal.ONE);
    }

    private static List<String> coachingLines(String category, Integer recommended, BigDecimal baseline,
                                              BigDecimal afterLoss, BigDecimal afterTwoLosses,
                                              BigDecimal probLossAfterLoss) {
        List<String> lines = new ArrayList<>();
        BigDecimal basePct = baseline.multiply(HUNDRED);
        BigDecimal afterLossPct = afterLoss.multiply(HUNDRED);

        if (TiltStats.CATEGORY_CALM.equals(category)) {
            lines.add("Your performance after losing trades is similar to your baseline. "
                    + "There is no strong evidence of emotional tilt.");
            lines.add(String.format("You win approximately %.1f%% overall and %.1f%% after a loss. "
                    + "Loss severity does not increase meaningfully after losing.", basePct, afterLossPct));
            if (recommended == null) {
                lines.add("A fixed 'stop after N losses' rule is optional for you. "
                        + "A standard daily loss cap is likely sufficient.");
            } else {
                lines.add(String.format("Your history still shows weaker results after %d losing trades in a row. "
                        + "Consider a soft stop at that point.", recommended));
            }
        } else if (TiltStats.CATEGORY_MODERATE.equals(category)) {
            lines.add("Your performance degrades after losing trades, but not catastrophically.");
            lines.add(String.format("Your win rate drops from %.1f%% to %.1f%% after a loss, and the chance of "
                    + "another loss after losing is %.1f%%.", basePct, afterLossPct, probLossAfterLoss.multiply(HUNDRED)));
            if (recommended != null) {
                lines.add(String.format("Based on your history, you should strongly consider stopping for the day "
                        + "after %d losing trades in a row. Beyond this streak, your expected PnL is consistently "
                        + "negative.", recommended));
            } else {
                lines.add("There is no single streak length that stands out as a clear cutoff, but you should pay "
                        + "attention to your behavior after losses and enforce a daily loss cap.");
            }
        } else {
            lines.add("Your trading shows strong signs of emotional tilt after losses.");
            lines.add(String.format("Your win rate falls from %.1f%% to %.1f%% after a loss, and to %.1f%% after "
                    + "two losses in a row.", basePct, afterLossPct, afterTwoLosses.multiply(HUNDRED)));
            lines.add("Your average loss becomes larger after losing, which suggests revenge trading or loss of "
                    + "discipline.");
            if (recommended != null) {
                lines.add(String.format("Recommendation: set a hard rule to stop trading for the day after %d "
                        + "consecutive losing trades.", recommended));
            }
            lines.add("Also consider using a fixed maximum daily loss and reducing position size immediately "
                    + "after a loss.");
        }
        return lines;
    }
}
