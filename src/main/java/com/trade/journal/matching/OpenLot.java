package com.trade.journal.matching;

import com.trade.journal.core.Side;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 未平仓的剩余持仓
 */
public final class OpenLot {
    private final long executionId;
    private final String symbol;
    private final Side side;
    private final BigDecimal remainingQuantity;
    private final BigDecimal price;
    private final Instant timestamp;
    private final BigDecimal remainingFees;     // 尚未分摊的手续费

    public OpenLot(long executionId, String symbol, Side side, BigDecimal remainingQuantity,
                   BigDecimal price, Instant timestamp, BigDecimal remainingFees) {
        this.executionId = executionId;
        this.symbol = symbol;
        this.side = side;
        this.remainingQuantity = remainingQuantity;
        this.price = price;
        this.timestamp = timestamp;
        this.remainingFees = remainingFees;
    }

    public long getExecutionId() { return executionId; }
    public String getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public BigDecimal getRemainingQuantity() { return remainingQuantity; }
    public BigDecimal getPrice() { return price; }
    public Instant getTimestamp() { return timestamp; }
    public BigDecimal getRemainingFees() { return remainingFees; }

    public BigDecimal getCostBasis() {
        return remainingQuantity.multiply(price);
    }

    @Override
    public String toString() {
        return String.format("OpenLot{#%d %s %s %s@%s}", executionId, symbol, side, remainingQuantity, price);
    }
}
