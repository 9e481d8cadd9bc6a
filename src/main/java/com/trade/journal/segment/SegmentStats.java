package com.trade.journal.segment;

import com.trade.journal.metrics.WinLossSummary;

import java.math.BigDecimal;

/**
 * 一个分组（星期、日期、小时、标的、策略）的绩效
 */
public final class SegmentStats {
    private final String key;               // 分组键：星期 0-6、日期 1-31、小时 0-23、标的代码或策略ID
    private final String label;             // 展示名称
    private final Long strategyId;          // 仅策略分组使用
    private final int tradeCount;
    private final BigDecimal winRate;
    private final BigDecimal totalPnl;
    private final BigDecimal averagePnl;
    private final BigDecimal averageWin;
    private final BigDecimal averageLoss;   // 负数
    private final BigDecimal payoffRatio;   // 可能为 null
    private final BigDecimal profitFactor;  // 可能为 null
    private final BigDecimal grossProfit;
    private final BigDecimal grossLoss;     // 绝对值

    SegmentStats(String key, String label, Long strategyId, WinLossSummary summary) {
        this.key = key;
        this.label = label;
        this.strategyId = strategyId;
        this.tradeCount = summary.getTradeCount();
        this.winRate = summary.getWinRate();
        this.totalPnl = summary.getTotalPnl();
        this.averagePnl = summary.getAveragePnl();
        this.averageWin = summary.getAverageWin();
        this.averageLoss = summary.getAverageLoss();
        this.payoffRatio = summary.getPayoffRatio();
        this.profitFactor = summary.getProfitFactor();
        this.grossProfit = summary.getGrossProfit();
        this.grossLoss = summary.getGrossLoss();
    }

    public String getKey() { return key; }
    public String getLabel() { return label; }
    public Long getStrategyId() { return strategyId; }
    public int getTradeCount() { return tradeCount; }
    public BigDecimal getWinRate() { return winRate; }
    public BigDecimal getTotalPnl() { return totalPnl; }
    public BigDecimal getAveragePnl() { return averagePnl; }
    public BigDecimal getAverageWin() { return averageWin; }
    public BigDecimal getAverageLoss() { return averageLoss; }
    public BigDecimal getPayoffRatio() { return payoffRatio; }
    public BigDecimal getProfitFactor() { return profitFactor; }
    public BigDecimal getGrossProfit() { return grossProfit; }
    public BigDecimal getGrossLoss() { return grossLoss; }

    @Override
    public String toString() {
        return String.format("SegmentStats{%s, trades=%d, winRate=%s, pnl=%s}", label, tradeCount, winRate, totalPnl);
    }
}
