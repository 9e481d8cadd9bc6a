package com.trade.journal.distribution;

import java.math.BigDecimal;

/**
 * 直方图分箱，区间左闭右开（最后一个分箱右闭）
 */
public final class HistogramBin {
    private final BigDecimal binStart;
    private final BigDecimal binEnd;
    private final int count;
    private final BigDecimal totalPnl;

    public HistogramBin(BigDecimal binStart, BigDecimal binEnd, int count, BigDecimal totalPnl) {
        this.binStart = binStart;
        this.binEnd = binEnd;
        this.count = count;
        this.totalPnl = totalPnl;
    }

    public BigDecimal getBinStart() { return binStart; }
    public BigDecimal getBinEnd() { return binEnd; }
    public int getCount() { return count; }
    public BigDecimal getTotalPnl() { return totalPnl; }

    @Override
    public String toString() {
        return String.format("[%s, %s): %d", binStart, binEnd, count);
    }
}
