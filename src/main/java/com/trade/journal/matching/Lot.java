package com.trade.journal.matching;

import com.trade.journal.core.Decimal;
import com.trade.journal.core.Execution;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 配对过程中的可变剩余持仓，仅在一次配对内存在
 * 同时记录该成交已分摊的手续费，最后一次消耗取剩余部分，保证分摊合计等于总手续费
 */
final class Lot {
    private final Execution execution;
    private BigDecimal remainingQuantity;
    private BigDecimal feesCharged = BigDecimal.ZERO;

    Lot(Execution execution) {
        this.execution = execution;
        this.remainingQuantity = execution.getQuantity();
    }

    Execution getExecution() { return execution; }
    BigDecimal getRemainingQuantity() { return remainingQuantity; }

    boolean isExhausted() {
        return Decimal.isDust(remainingQuantity);
    }

    /**
     * 消耗指定数量，返回该数量分摊的手续费
     */
    BigDecimal consume(BigDecimal quantity) {
        remainingQuantity = remainingQuantity.subtract(quantity);
        BigDecimal fee;
        if (isExhausted()) {
            fee = execution.getFees().subtract(feesCharged);
        } else {
            fee = execution.getFees()
                    .multiply(quantity)
                    .divide(execution.getQuantity(), Decimal.PRICE_SCALE, RoundingMode.HALF_UP);
        }
        feesCharged = feesCharged.add(fee);
        return fee;
    }

    BigDecimal getRemainingFees() {
        return execution.getFees().subtract(feesCharged);
    }

    OpenLot toOpenLot() {
        return new OpenLot(execution.getId(), execution.getSymbol(), execution.getSide(),
                remainingQuantity, execution.getPrice(), execution.getTimestamp(), getRemainingFees());
    }
}
