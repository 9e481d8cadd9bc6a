package com.trade.journal.distribution;

import com.trade.journal.core.Decimal;
import com.trade.journal.matching.PairedTrade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 盈亏分布与集中度分析
 *
 * 稳定性评分 = clamp(100 × (1 − 0.6 × 头部盈利占比 − 0.4 × min(变异系数 / 2, 1)), 0, 100)，
 * 变异系数取盈利回合的总体标准差 / 均值
 */
public class DistributionAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DistributionAnalyzer.class);

    public static final int MIN_CONCENTRATION_PERCENT = 5;
    public static final int MAX_CONCENTRATION_PERCENT = 30;

    private static final int MIN_RELIABLE_TRADES = 30;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal PROFIT_WEIGHT = new BigDecimal("0.6");
    private static final BigDecimal DISPERSION_WEIGHT = new BigDecimal("0.4");

    private final int histogramBins;

    public DistributionAnalyzer(int histogramBins) {
        if (histogramBins < 1) {
            throw new IllegalArgumentException("直方图分箱数必须大于0: " + histogramBins);
        }
        this.histogramBins = histogramBins;
    }

    /**
     * @param concentrationPercent 头部比例 k（5-30）
     */
    public DistributionConcentration analyze(List<PairedTrade> pairs, int concentrationPercent) {
        if (concentrationPercent < MIN_CONCENTRATION_PERCENT || concentrationPercent > MAX_CONCENTRATION_PERCENT) {
            throw new IllegalArgumentException("集中度比例超出范围 [5, 30]: " + concentrationPercent);
        }

        if (pairs.isEmpty()) {
            return new DistributionConcentration(List.of(), new ConcentrationStats(
                    concentrationPercent, 0, 0, 0, 0, 0,
                    BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                    Decimal.scalePercent(HUNDRED),
                    List.of("No trades in the selected timeframe.")));
        }

        List<BigDecimal> returns = new ArrayList<>(pairs.size());
        pairs.forEach(pair -> returns.add(pair.getNetPnl()));
        List<BigDecimal> sorted = new ArrayList<>(returns);
        sorted.sort(Comparator.naturalOrder());

        List<HistogramBin> histogram = histogram(sorted);

        List<BigDecimal> winners = new ArrayList<>();
        List<BigDecimal> losers = new ArrayList<>();
        for (BigDecimal value : sorted) {
            if (value.signum() > 0) {
                winners.add(value);
            } else if (value.signum() < 0) {
                losers.add(value);
            }
        }
        winners.sort(Comparator.reverseOrder());

        int topKProfit = topCount(winners.size(), concentrationPercent);
        int topKLoss = topCount(losers.size(), concentrationPercent);
        BigDecimal profitShareTop = share(winners, topKProfit);
        BigDecimal lossShareTop = share(losers, topKLoss);

        BigDecimal mean = Decimal.mean(returns);
        BigDecimal median = median(sorted);
        BigDecimal stability = stabilityScore(profitShareTop, coefficientOfVariation(winners));

        List<String> insights = insights(pairs.size(), concentrationPercent, profitShareTop, lossShareTop,
                mean, median, stability);

        ConcentrationStats stats = new ConcentrationStats(concentrationPercent, pairs.size(),
                winners.size(), losers.size(), topKProfit, topKLoss, profitShareTop, lossShareTop,
                mean, median, stability, insights);
        logger.debug("分布分析完成: 回合={}, k={}%, 头部盈利占比={}, 稳定性={}",
                pairs.size(), concentrationPercent, profitShareTop, stability);
        return new DistributionConcentration(histogram, stats);
    }

    /**
     * 等宽分箱，覆盖 [最小值, 最大值]；最小值等于最大值时只有一个分箱
     */
    private List<HistogramBin> histogram(List<BigDecimal> sorted) {
        BigDecimal min = sorted.get(0);
        BigDecimal max = sorted.get(sorted.size() - 1);
        BigDecimal range = max.subtract(min);

        if (range.signum() == 0) {
            return List.of(new HistogramBin(min, max, sorted.size(), Decimal.sum(sorted)));
        }

        int[] counts = new int[histogramBins];
        BigDecimal[] totals = new BigDecimal[histogramBins];
        Arrays.fill(totals, BigDecimal.ZERO);
        BigDecimal bins = BigDecimal.valueOf(histogramBins);
        for (BigDecimal value : sorted) {
            int index = value.subtract(min).multiply(bins).divide(range, 0, RoundingMode.FLOOR).intValue();
            index = Math.min(index, histogramBins - 1);
            counts[index]++;
            totals[index] = totals[index].add(value);
        }

        List<HistogramBin> histogram = new ArrayList<>(histogramBins);
        for (int i = 0; i < histogramBins; i++) {
            BigDecimal start = boundary(min, range, i);
            BigDecimal end = i == histogramBins - 1 ? max : boundary(min, range, i + 1);
            histogram.add(new HistogramBin(start, end, counts[i], totals[i]));
        }
        return histogram;
    }

    private BigDecimal boundary(BigDecimal min, BigDecimal range, int index) {
        return min.add(range.multiply(BigDecimal.valueOf(index))
                .divide(BigDecimal.valueOf(histogramBins), Decimal.PRICE_SCALE, RoundingMode.HALF_UP));
    }

    /**
     * ceil(k% × n)
     */
    static int topCount(int size, int percent) {
        return BigDecimal.valueOf((long) size * percent)
                .divide(HUNDRED, 0, RoundingMode.CEILING)
                .intValue();
    }

    /**
     * 前 k 笔绝对值之和 / 全部绝对值之和（列表已按绝对值降序）
     */
    private static BigDecimal share(List<BigDecimal> ordered, int k) {
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal top = BigDecimal.ZERO;
        for (int i = 0; i < ordered.size(); i++) {
            BigDecimal abs = ordered.get(i).abs();
            total = total.add(abs);
            if (i < k) {
                top = top.add(abs);
            }
        }
        return Decimal.divide(top, total);
    }

    private static BigDecimal median(List<BigDecimal> sorted) {
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return sorted.get(n / 2 - 1).add(sorted.get(n / 2))
                .divide(TWO, Decimal.PRICE_SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal coefficientOfVariation(List<BigDecimal> winners) {
        if (winners.size() < 2) {
            return BigDecimal.ZERO;
        }
        return Decimal.divide(Decimal.stdDev(winners, false), Decimal.mean(winners));
    }

    static BigDecimal stabilityScore(BigDecimal profitShareTop, BigDecimal cv) {
        BigDecimal dispersion = Decimal.divide(cv, TWO).min(BigDecimal.ONE);
        BigDecimal raw = BigDecimal.ONE
                .subtract(PROFIT_WEIGHT.multiply(profitShareTop))
                .subtract(DISPERSION_WEIGHT.multiply(dispersion))
                .multiply(HUNDRED);
        return Decimal.scalePercent(Decimal.clamp(raw, BigDecimal.ZERO, HUNDRED));
    }

    private static List<String> insights(int tradeCount, int k, BigDecimal profitShare, BigDecimal lossShare,
                                         BigDecimal mean, BigDecimal median, BigDecimal stability) {
        List<String> insights = new ArrayList<>();
        BigDecimal profitPct = profitShare.multiply(HUNDRED);
        BigDecimal lossPct = lossShare.multiply(HUNDRED);

        if (tradeCount < MIN_RELIABLE_TRADES) {
            insights.add("Limited data: results may be noisy with fewer than 30 trades.");
        }

        if (profitShare.compareTo(new BigDecimal("0.2")) < 0) {
            insights.add(String.format("Your profits are well distributed. The top %d%% of trades account for "
                    + "%.1f%% of total profit, indicating good consistency.", k, profitPct));
        } else if (profitShare.compareTo(new BigDecimal("0.4")) <= 0) {
            insights.add(String.format("Your profits show moderate concentration. The top %d%% of trades "
                    + "generate %.1f%% of total profit.", k, profitPct));
        } else if (profitShare.compareTo(new BigDecimal("0.7")) <= 0) {
            insights.add(String.format("A small percentage of your trades generates a large share of profits. "
                    + "The top %d%% of trades produce %.1f%% of your total profit. Consider systematizing "
                    + "the conditions of your best trades.", k, profitPct));
        } else {
            insights.add(String.format("Severe profit concentration: the top %d%% of trades generate %.1f%% of "
                    + "total profit. Your winners are doing the heavy lifting. Without them, your equity curve "
                    + "would be much flatter.", k, profitPct));
        }

        if (lossShare.compareTo(new BigDecimal("0.2")) < 0) {
            insights.add(String.format("Your losses are well distributed. The worst %d%% of trades account for "
                    + "%.1f%% of total loss.", k, lossPct));
        } else if (lossShare.compareTo(new BigDecimal("0.5")) <= 0) {
            insights.add(String.format("Your losses show moderate concentration. The worst %d%% of trades "
                    + "account for %.1f%% of total loss.", k, lossPct));
        } else if (lossShare.compareTo(new BigDecimal("0.7")) <= 0) {
            insights.add(String.format("A relatively small group of bad trades is responsible for most of your "
                    + "drawdowns. The worst %d%% of losing trades account for %.1f%% of total loss. Tightening "
                    + "risk controls could significantly stabilize your equity.", k, lossPct));
        } else {
            insights.add(String.format("Severe loss concentration: the worst %d%% of trades cause %.1f%% of "
                    + "total loss. Consider hard stop rules, daily loss limits, or reducing position size on "
                    + "lower conviction trades.", k, lossPct));
        }

        BigDecimal medianFloor = median.abs().max(new BigDecimal("0.01"));
        if (mean.signum() != 0 && Decimal.divide(mean.abs(), medianFloor).compareTo(new BigDecimal("1.5")) >= 0) {
            insights.add("Median and average returns differ significantly, suggesting performance is skewed "
                    + "by a small set of large winners or losers.");
        } else if (mean.subtract(median).abs().compareTo(mean.abs().multiply(new BigDecimal("0.1"))) < 0) {
            insights.add("Median and average returns are closely aligned, indicating consistent returns "
                    + "rather than rare outlier events.");
        }

        if (stability.compareTo(BigDecimal.valueOf(80)) >= 0) {
            insights.add("Your performance is broadly supported by many trades rather than a few outliers. "
                    + "This is a sign of a robust and repeatable process.");
        } else if (stability.compareTo(BigDecimal.valueOf(50)) < 0) {
            insights.add("Your results show high variance and instability. Focus on replicating your best "
                    + "setups while strictly capping downside on worst trades.");
        }
        return insights;
    }
}
