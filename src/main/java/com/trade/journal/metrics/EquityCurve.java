package com.trade.journal.metrics;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * 日资金曲线 + 回撤统计 + 最大上涨区间
 */
public final class EquityCurve {
    private final List<EquityPoint> points;
    private final DrawdownMetrics drawdownMetrics;
    private final LocalDate bestSurgeStart;
    private final LocalDate bestSurgeEnd;
    private final BigDecimal bestSurgeValue;

    public EquityCurve(List<EquityPoint> points, DrawdownMetrics drawdownMetrics,
                       LocalDate bestSurgeStart, LocalDate bestSurgeEnd, BigDecimal bestSurgeValue) {
        this.points = Collections.unmodifiableList(points);
        this.drawdownMetrics = drawdownMetrics;
        this.bestSurgeStart = bestSurgeStart;
        this.bestSurgeEnd = bestSurgeEnd;
        this.bestSurgeValue = bestSurgeValue;
    }

    public static EquityCurve empty() {
        return new EquityCurve(List.of(), DrawdownMetrics.empty(), null, null, BigDecimal.ZERO);
    }

    public List<EquityPoint> getPoints() { return points; }
    public DrawdownMetrics getDrawdownMetrics() { return drawdownMetrics; }
    public LocalDate getBestSurgeStart() { return bestSurgeStart; }
    public LocalDate getBestSurgeEnd() { return bestSurgeEnd; }
    public BigDecimal getBestSurgeValue() { return bestSurgeValue; }
}
