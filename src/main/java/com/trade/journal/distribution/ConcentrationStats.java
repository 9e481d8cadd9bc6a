package com.trade.journal.distribution;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * 盈亏集中度统计
 */
public final class ConcentrationStats {
    private final int concentrationPercent;
    private final int totalTrades;
    private final int profitableTradesCount;
    private final int losingTradesCount;
    private final int topKProfit;               // 参与统计的最大盈利笔数
    private final int topKLoss;                 // 参与统计的最大亏损笔数
    private final BigDecimal profitShareTop;    // 前 k% 盈利占全部盈利的比例
    private final BigDecimal lossShareTop;      // 前 k% 亏损占全部亏损的比例
    private final BigDecimal meanReturn;
    private final BigDecimal medianReturn;
    private final BigDecimal stabilityScore;    // 0-100
    private final List<String> insights;

    public ConcentrationStats(int concentrationPercent, int totalTrades, int profitableTradesCount,
                              int losingTradesCount, int topKProfit, int topKLoss,
                              BigDecimal profitShareTop, BigDecimal lossShareTop,
                              BigDecimal meanReturn, BigDecimal medianReturn,
                              BigDecimal stabilityScore, List<String> insights) {
        this.concentrationPercent = concentrationPercent;
        this.totalTrades = totalTrades;
        this.profitableTradesCount = profitableTradesCount;
        this.losingTradesCount = losingTradesCount;
        this.topKProfit = topKProfit;
        this.topKLoss = topKLoss;
        this.profitShareTop = profitShareTop;
        this.lossShareTop = lossShareTop;
        this.meanReturn = meanReturn;
        this.medianReturn = medianReturn;
        this.stabilityScore = stabilityScore;
        this.insights = Collections.unmodifiableList(insights);
    }

    public int getConcentrationPercent() { return concentrationPercent; }
    public int getTotalTrades() { return totalTrades; }
    public int getProfitableTradesCount() { return profitableTradesCount; }
    public int getLosingTradesCount() { return losingTradesCount; }
    public int getTopKProfit() { return topKProfit; }
    public int getTopKLoss() { return topKLoss; }
    public BigDecimal getProfitShareTop() { return profitShareTop; }
    public BigDecimal getLossShareTop() { return lossShareTop; }
    public BigDecimal getMeanReturn() { return meanReturn; }
    public BigDecimal getMedianReturn() { return medianReturn; }
    public BigDecimal getStabilityScore() { return stabilityScore; }
    public List<String> getInsights() { return insights; }
}
