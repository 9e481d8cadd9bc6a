package com.trade.journal.service;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 最近平仓的回合
 */
public final class RecentTrade {
    private final String symbol;
    private final Instant entryTimestamp;
    private final Instant exitTimestamp;
    private final BigDecimal quantity;
    private final BigDecimal entryPrice;
    private final BigDecimal exitPrice;
    private final BigDecimal netPnl;
    private final String strategyName;      // 未归属策略时为 null

    public RecentTrade(String symbol, Instant entryTimestamp, Instant exitTimestamp, BigDecimal quantity,
                       BigDecimal entryPrice, BigDecimal exitPrice, BigDecimal netPnl, String strategyName) {
        this.symbol = symbol;
        this.entryTimestamp = entryTimestamp;
        this.exitTimestamp = exitTimestamp;
        this.quantity = quantity;
        this.entryPrice = entryPrice;
        this.exitPrice = exitPrice;
        this.netPnl = netPnl;
        this.strategyName = strategyName;
    }

    public String getSymbol() { return symbol; }
    public Instant getEntryTimestamp() { return entryTimestamp; }
    public Instant getExitTimestamp() { return exitTimestamp; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getExitPrice() { return exitPrice; }
    public BigDecimal getNetPnl() { return netPnl; }
    public String getStrategyName() { return strategyName; }

    @Override
    public String toString() {
        return String.format("RecentTrade{%s, exit=%s, qty=%s, net=%s}", symbol, exitTimestamp, quantity, netPnl);
    }
}
