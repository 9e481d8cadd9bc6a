package com.trade.journal.tilt;

import java.math.BigDecimal;

/**
 * 连续亏损 k 笔（至少 k 笔）之后下一笔交易的表现
 */
public final class StreakStats {
    private final int k;
    private final int sampleSize;
    private final BigDecimal winRateAfterKLosses;
    private final BigDecimal avgPnlAfterKLosses;
    private final boolean sufficientSample;

    public StreakStats(int k, int sampleSize, BigDecimal winRateAfterKLosses,
                       BigDecimal avgPnlAfterKLosses, boolean sufficientSample) {
        this.k = k;
        this.sampleSize = sampleSize;
        this.winRateAfterKLosses = winRateAfterKLosses;
        this.avgPnlAfterKLosses = avgPnlAfterKLosses;
        this.sufficientSample = sufficientSample;
    }

    public int getK() { return k; }
    public int getSampleSize() { return sampleSize; }
    public BigDecimal getWinRateAfterKLosses() { return winRateAfterKLosses; }
    public BigDecimal getAvgPnlAfterKLosses() { return avgPnlAfterKLosses; }
    public boolean isSufficientSample() { return sufficientSample; }

    @Override
    public String toString() {
        return String.format("StreakStats{k=%d, n=%d, winRate=%s, avgPnl=%s}",
                k, sampleSize, winRateAfterKLosses, avgPnlAfterKLosses);
    }
}
