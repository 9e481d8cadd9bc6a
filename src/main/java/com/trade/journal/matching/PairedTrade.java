package com.trade.journal.matching;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.trade.journal.core.Decimal;
import com.trade.journal.core.Side;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * 配对后的完整回合交易（开仓成交 + 平仓成交）
 * 仅在请求期间存在，不持久化
 */
public final class PairedTrade {
    private final String symbol;
    private final Side side;                    // 开仓方向：BUY 为多头回合，SELL 为空头回合
    private final long entryExecutionId;
    private final long exitExecutionId;
    private final BigDecimal quantity;
    private final BigDecimal entryPrice;
    private final BigDecimal exitPrice;
    private final Instant entryTimestamp;
    private final Instant exitTimestamp;
    private final BigDecimal entryFees;         // 分摊到本回合的开仓手续费
    private final BigDecimal exitFees;          // 分摊到本回合的平仓手续费
    private final BigDecimal grossPnl;          // 毛盈亏（不含手续费）
    private final BigDecimal netPnl;            // 净盈亏（扣除手续费）
    private final Long strategyId;

    public PairedTrade(String symbol, Side side, long entryExecutionId, long exitExecutionId,
                       BigDecimal quantity, BigDecimal entryPrice, BigDecimal exitPrice,
                       Instant entryTimestamp, Instant exitTimestamp,
                       BigDecimal entryFees, BigDecimal exitFees,
                       BigDecimal contractMultiplier, Long strategyId) {
        this.symbol = symbol;
        this.side = side;
        this.entryExecutionId = entryExecutionId;
        this.exitExecutionId = exitExecutionId;
        this.quantity = quantity;
        this.entryPrice = entryPrice;
        this.exitPrice = exitPrice;
        this.entryTimestamp = entryTimestamp;
        this.exitTimestamp = exitTimestamp;
        this.entryFees = entryFees;
        this.exitFees = exitFees;
        this.grossPnl = exitPrice.subtract(entryPrice)
                .multiply(quantity)
                .multiply(BigDecimal.valueOf(side.directionSign()))
                .multiply(contractMultiplier);
        this.netPnl = grossPnl.subtract(entryFees).subtract(exitFees);
        this.strategyId = strategyId;
    }

    private PairedTrade(PairedTrade source, Long strategyId) {
        this.symbol = source.symbol;
        this.side = source.side;
        this.entryExecutionId = source.entryExecutionId;
        this.exitExecutionId = source.exitExecutionId;
        this.quantity = source.quantity;
        this.entryPrice = source.entryPrice;
        this.exitPrice = source.exitPrice;
        this.entryTimestamp = source.entryTimestamp;
        this.exitTimestamp = source.exitTimestamp;
        this.entryFees = source.entryFees;
        this.exitFees = source.exitFees;
        this.grossPnl = source.grossPnl;
        this.netPnl = source.netPnl;
        this.strategyId = strategyId;
    }

    /**
     * 返回归属到指定策略的副本
     */
    public PairedTrade withStrategyId(Long newStrategyId) {
        return new PairedTrade(this, newStrategyId);
    }

    public String getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public long getEntryExecutionId() { return entryExecutionId; }
    public long getExitExecutionId() { return exitExecutionId; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getExitPrice() { return exitPrice; }
    public Instant getEntryTimestamp() { return entryTimestamp; }
    public Instant getExitTimestamp() { return exitTimestamp; }
    public BigDecimal getEntryFees() { return entryFees; }
    public BigDecimal getExitFees() { return exitFees; }
    public BigDecimal getGrossPnl() { return grossPnl; }
    public BigDecimal getNetPnl() { return netPnl; }
    public Long getStrategyId() { return strategyId; }

    @JsonIgnore
    public BigDecimal getTotalFees() {
        return entryFees.add(exitFees);
    }

    /**
     * 开仓成交额，用于统计交易量
     */
    @JsonIgnore
    public BigDecimal getEntryValue() {
        return entryPrice.multiply(quantity);
    }

    @JsonIgnore
    public boolean isWin() {
        return netPnl.compareTo(BigDecimal.ZERO) > 0;
    }

    @JsonIgnore
    public boolean isLoss() {
        return netPnl.compareTo(BigDecimal.ZERO) < 0;
    }

    public long getHoldingSeconds() {
        return Duration.between(entryTimestamp, exitTimestamp).getSeconds();
    }

    /**
     * 按方向调整后的价格变动百分比
     */
    public BigDecimal getReturnPercent() {
        if (entryPrice.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO.setScale(Decimal.RATIO_SCALE);
        }
        return exitPrice.subtract(entryPrice)
                .multiply(BigDecimal.valueOf(side.directionSign()))
                .multiply(BigDecimal.valueOf(100))
                .divide(entryPrice, Decimal.RATIO_SCALE, RoundingMode.HALF_UP);
    }

    @Override
    public String toString() {
        return String.format("PairedTrade{symbol=%s, side=%s, entry=#%d@%s, exit=#%d@%s, qty=%s, gross=%s, net=%s}",
                symbol, side, entryExecutionId, entryPrice, exitExecutionId, exitPrice, quantity, grossPnl, netPnl);
    }
}
