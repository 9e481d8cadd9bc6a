package com.trade.journal.metrics;

import java.math.BigDecimal;

/**
 * 按代码统计的回合数和净盈亏
 */
public final class SymbolStats {
    private final String symbol;
    private final int count;
    private final BigDecimal profitLoss;

    public SymbolStats(String symbol, int count, BigDecimal profitLoss) {
        this.symbol = symbol;
        this.count = count;
        this.profitLoss = profitLoss;
    }

    public String getSymbol() { return symbol; }
    public int getCount() { return count; }
    public BigDecimal getProfitLoss() { return profitLoss; }

    @Override
    public String toString() {
        return String.format("SymbolStats{%s, count=%d, pnl=%s}", symbol, count, profitLoss);
    }
}
