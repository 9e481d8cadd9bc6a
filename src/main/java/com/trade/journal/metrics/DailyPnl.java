package com.trade.journal.metrics;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 单日净盈亏（按平仓日期）
 */
public final class DailyPnl {
    private final LocalDate date;
    private final BigDecimal netPnl;
    private final int tradeCount;

    public DailyPnl(LocalDate date, BigDecimal netPnl, int tradeCount) {
        this.date = date;
        this.netPnl = netPnl;
        this.tradeCount = tradeCount;
    }

    public LocalDate getDate() { return date; }
    public BigDecimal getNetPnl() { return netPnl; }
    public int getTradeCount() { return tradeCount; }

    @Override
    public String toString() {
        return String.format("DailyPnl{%s, pnl=%s, trades=%d}", date, netPnl, tradeCount);
    }
}
