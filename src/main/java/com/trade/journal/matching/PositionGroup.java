package com.trade.journal.matching;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.trade.journal.core.Decimal;
import com.trade.journal.core.Execution;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 持仓分组：从开仓成交起，包含其后的加仓、减仓，直到净持仓归零
 */
public final class PositionGroup {
    private final Execution entryExecution;
    private final List<Execution> executions;   // 按时间升序，首笔即开仓成交
    private final BigDecimal totalPnl;          // 组内回合的净盈亏合计
    private final BigDecimal finalQuantity;     // 剩余净持仓：多头为正，空头为负，已平仓为0

    public PositionGroup(Execution entryExecution, List<Execution> executions,
                         BigDecimal totalPnl, BigDecimal finalQuantity) {
        this.entryExecution = entryExecution;
        this.executions = Collections.unmodifiableList(executions);
        this.totalPnl = totalPnl;
        this.finalQuantity = finalQuantity;
    }

    public Execution getEntryExecution() { return entryExecution; }
    public List<Execution> getExecutions() { return executions; }
    public BigDecimal getTotalPnl() { return totalPnl; }
    public BigDecimal getFinalQuantity() { return finalQuantity; }

    public String getSymbol() {
        return entryExecution.getSymbol();
    }

    @JsonIgnore
    public Instant getEntryTimestamp() {
        return entryExecution.getTimestamp();
    }

    @JsonIgnore
    public Long getEntryStrategyId() {
        return entryExecution.getStrategyId();
    }

    public boolean isClosed() {
        return Decimal.isDust(finalQuantity.abs());
    }

    @Override
    public String toString() {
        return String.format("PositionGroup{%s entry=#%d, executions=%d, pnl=%s, final=%s}",
                getSymbol(), entryExecution.getId(), executions.size(), totalPnl, finalQuantity);
    }
}
