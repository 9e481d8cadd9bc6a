package com.trade.journal.metrics;

import java.math.BigDecimal;

/**
 * 按标的汇总的盈亏
 */
public final class SymbolPnl {
    private final String symbol;
    private final int closedPositions;
    private final BigDecimal openPositionQty;       // |多头剩余 - 空头剩余|
    private final BigDecimal totalGrossPnl;
    private final BigDecimal totalNetPnl;
    private final BigDecimal totalFees;
    private final int winningTrades;
    private final int losingTrades;
    private final BigDecimal winRate;               // 盈利 / (盈利 + 亏损)

    public SymbolPnl(String symbol, int closedPositions, BigDecimal openPositionQty,
                     BigDecimal totalGrossPnl, BigDecimal totalNetPnl, BigDecimal totalFees,
                     int winningTrades, int losingTrades, BigDecimal winRate) {
        this.symbol = symbol;
        this.closedPositions = closedPositions;
        this.openPositionQty = openPositionQty;
        this.totalGrossPnl = totalGrossPnl;
        this.totalNetPnl = totalNetPnl;
        this.totalFees = totalFees;
        this.winningTrades = winningTrades;
        this.losingTrades = losingTrades;
        this.winRate = winRate;
    }

    public String getSymbol() { return symbol; }
    public int getClosedPositions() { return closedPositions; }
    public BigDecimal getOpenPositionQty() { return openPositionQty; }
    public BigDecimal getTotalGrossPnl() { return totalGrossPnl; }
    public BigDecimal getTotalNetPnl() { return totalNetPnl; }
    public BigDecimal getTotalFees() { return totalFees; }
    public int getWinningTrades() { return winningTrades; }
    public int getLosingTrades() { return losingTrades; }
    public BigDecimal getWinRate() { return winRate; }

    @Override
    public String toString() {
        return String.format("SymbolPnl{%s, closed=%d, open=%s, net=%s, winRate=%s}",
                symbol, closedPositions, openPositionQty, totalNetPnl, winRate);
    }
}
