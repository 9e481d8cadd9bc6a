package com.trade.journal.metrics;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 基于日资金曲线的回撤统计
 */
public final class DrawdownMetrics {
    private final BigDecimal maxDrawdown;
    private final BigDecimal maxDrawdownPct;
    private final LocalDate maxDrawdownStart;       // 回撤开始前的峰值日
    private final LocalDate maxDrawdownEnd;         // 回撤最低点
    private final BigDecimal avgDrawdown;           // 处于回撤中的交易日的平均回撤
    private final int longestDrawdownDays;          // 最长连续回撤交易日数
    private final LocalDate longestDrawdownStart;
    private final LocalDate longestDrawdownEnd;

    public DrawdownMetrics(BigDecimal maxDrawdown, BigDecimal maxDrawdownPct,
                           LocalDate maxDrawdownStart, LocalDate maxDrawdownEnd,
                           BigDecimal avgDrawdown, int longestDrawdownDays,
                           LocalDate longestDrawdownStart, LocalDate longestDrawdownEnd) {
        this.maxDrawdown = maxDrawdown;
        this.maxDrawdownPct = maxDrawdownPct;
        this.maxDrawdownStart = maxDrawdownStart;
        this.maxDrawdownEnd = maxDrawdownEnd;
        this.avgDrawdown = avgDrawdown;
        this.longestDrawdownDays = longestDrawdownDays;
        this.longestDrawdownStart = longestDrawdownStart;
        this.longestDrawdownEnd = longestDrawdownEnd;
    }

    public static DrawdownMetrics empty() {
        return new DrawdownMetrics(BigDecimal.ZERO, BigDecimal.ZERO, null, null, BigDecimal.ZERO, 0, null, null);
    }

    public BigDecimal getMaxDrawdown() { return maxDrawdown; }
    public BigDecimal getMaxDrawdownPct() { return maxDrawdownPct; }
    public LocalDate getMaxDrawdownStart() { return maxDrawdownStart; }
    public LocalDate getMaxDrawdownEnd() { return maxDrawdownEnd; }
    public BigDecimal getAvgDrawdown() { return avgDrawdown; }
    public int getLongestDrawdownDays() { return longestDrawdownDays; }
    public LocalDate getLongestDrawdownStart() { return longestDrawdownStart; }
    public LocalDate getLongestDrawdownEnd() { return longestDrawdownEnd; }

    @Override
    public String toString() {
        return String.format("DrawdownMetrics{max=%s (%s%%), %s ~ %s, avg=%s, longest=%d天}",
                maxDrawdown, maxDrawdownPct, maxDrawdownStart, maxDrawdownEnd, avgDrawdown, longestDrawdownDays);
    }
}
