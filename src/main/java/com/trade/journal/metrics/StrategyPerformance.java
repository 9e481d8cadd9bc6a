package com.trade.journal.metrics;

import java.math.BigDecimal;

/**
 * 单个策略的交易概况
 */
public final class StrategyPerformance {
    private final Long strategyId;              // null 表示未归属
    private final String strategyName;
    private final int tradeCount;
    private final BigDecimal totalVolume;
    private final BigDecimal estimatedPnl;

    public StrategyPerformance(Long strategyId, String strategyName, int tradeCount,
                               BigDecimal totalVolume, BigDecimal estimatedPnl) {
        this.strategyId = strategyId;
        this.strategyName = strategyName;
        this.tradeCount = tradeCount;
        this.totalVolume = totalVolume;
        this.estimatedPnl = estimatedPnl;
    }

    public Long getStrategyId() { return strategyId; }
    public String getStrategyName() { return strategyName; }
    public int getTradeCount() { return tradeCount; }
    public BigDecimal getTotalVolume() { return totalVolume; }
    public BigDecimal getEstimatedPnl() { return estimatedPnl; }

    @Override
    public String toString() {
        return String.format("StrategyPerformance{%s(%s), trades=%d, volume=%s, pnl=%s}",
                strategyName, strategyId, tradeCount, totalVolume, estimatedPnl);
    }
}
