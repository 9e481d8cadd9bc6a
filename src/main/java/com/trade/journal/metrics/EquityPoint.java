package com.trade.journal.metrics;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 资金曲线上的一个交易日
 */
public final class EquityPoint {
    private final LocalDate date;
    private final BigDecimal dailyPnl;
    private final BigDecimal cumulativePnl;
    private final BigDecimal peakEquity;
    private final BigDecimal drawdown;          // 峰值 - 当前累计，非负
    private final BigDecimal drawdownPct;       // 相对峰值的百分比

    public EquityPoint(LocalDate date, BigDecimal dailyPnl, BigDecimal cumulativePnl,
                       BigDecimal peakEquity, BigDecimal drawdown, BigDecimal drawdownPct) {
        this.date = date;
        this.dailyPnl = dailyPnl;
        this.cumulativePnl = cumulativePnl;
        this.peakEquity = peakEquity;
        this.drawdown = drawdown;
        this.drawdownPct = drawdownPct;
    }

    public LocalDate getDate() { return date; }
    public BigDecimal getDailyPnl() { return dailyPnl; }
    public BigDecimal getCumulativePnl() { return cumulativePnl; }
    public BigDecimal getPeakEquity() { return peakEquity; }
    public BigDecimal getDrawdown() { return drawdown; }
    public BigDecimal getDrawdownPct() { return drawdownPct; }

    @Override
    public String toString() {
        return String.format("EquityPoint{%s, daily=%s, cum=%s, dd=%s}", date, dailyPnl, cumulativePnl, drawdown);
    }
}
