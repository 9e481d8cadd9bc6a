package com.trade.journal.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * 成交记录（不可变）
 * 由导入创建，永不修改；仅可通过清空操作整体删除
 */
public final class Execution {

    public static final String STATUS_FILLED = "FILLED";

    private final long id;                  // 成交ID，由存储分配
    private final String symbol;            // 交易代码
    private final Side side;                // 方向
    private final BigDecimal quantity;      // 成交数量（> 0）
    private final BigDecimal price;         // 成交价格（>= 0）
    private final Instant timestamp;        // 成交时间
    private final BigDecimal fees;          // 手续费（>= 0）
    private final Long strategyId;          // 所属策略ID（可选）
    private final String orderType;         // 订单类型（仅展示）
    private final String status;            // 导入时的状态，只有 FILLED 参与配对
    private final String notes;             // 备注

    @JsonCreator
    public Execution(@JsonProperty("id") long id,
                     @JsonProperty("symbol") String symbol,
                     @JsonProperty("side") Side side,
                     @JsonProperty("quantity") BigDecimal quantity,
                     @JsonProperty("price") BigDecimal price,
                     @JsonProperty("timestamp") Instant timestamp,
                     @JsonProperty("fees") BigDecimal fees,
                     @JsonProperty("strategyId") Long strategyId,
                     @JsonProperty("orderType") String orderType,
                     @JsonProperty("status") String status,
                     @JsonProperty("notes") String notes) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("交易代码为空");
        }
        if (side == null) {
            throw new IllegalArgumentException("成交方向为空: " + symbol);
        }
        if (quantity == null || quantity.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("成交数量必须大于0: " + quantity);
        }
        if (price == null || price.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("成交价格不能为负: " + price);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("成交时间为空: " + symbol);
        }
        BigDecimal actualFees = fees == null ? BigDecimal.ZERO : fees;
        if (actualFees.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("手续费不能为负: " + fees);
        }
        this.id = id;
        this.symbol = symbol.trim();
        this.side = side;
        this.quantity = quantity;
        this.price = price;
        this.timestamp = timestamp;
        this.fees = actualFees;
        this.strategyId = strategyId;
        this.orderType = orderType;
        this.status = status;
        this.notes = notes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getId() { return id; }
    public String getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getPrice() { return price; }
    public Instant getTimestamp() { return timestamp; }
    public BigDecimal getFees() { return fees; }
    public Long getStrategyId() { return strategyId; }
    public String getOrderType() { return orderType; }
    public String getStatus() { return status; }
    public String getNotes() { return notes; }

    /**
     * 成交金额
     */
    @JsonIgnore
    public BigDecimal getValue() {
        return price.multiply(quantity);
    }

    /**
     * 是否已成交：状态为 FILLED（大小写不敏感），未记录状态视为已成交
     */
    @JsonIgnore
    public boolean isFilled() {
        return status == null || STATUS_FILLED.equalsIgnoreCase(status.trim());
    }

    /**
     * 去重键：代码、方向、数量、价格、时间
     */
    @JsonIgnore
    public String getDuplicateKey() {
        return symbol + '|' + side + '|' + quantity.stripTrailingZeros().toPlainString()
                + '|' + price.stripTrailingZeros().toPlainString() + '|' + timestamp;
    }

    /**
     * 返回分配了新ID的副本
     */
    public Execution withId(long newId) {
        return new Execution(newId, symbol, side, quantity, price, timestamp, fees,
                strategyId, orderType, status, notes);
    }

    /**
     * 返回归属到指定策略的副本
     */
    public Execution withStrategyId(Long newStrategyId) {
        return new Execution(id, symbol, side, quantity, price, timestamp, fees,
                newStrategyId, orderType, status, notes);
    }

    /**
     * 判断是否与另一笔成交重复（代码、方向、数量、价格、时间均相同）
     */
    public boolean isDuplicateOf(Execution other) {
        return symbol.equals(other.symbol)
                && side == other.side
                && quantity.compareTo(other.quantity) == 0
                && price.compareTo(other.price) == 0
                && timestamp.equals(other.timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Execution that = (Execution) o;
        return id == that.id && isDuplicateOf(that)
                && fees.compareTo(that.fees) == 0
                && Objects.equals(strategyId, that.strategyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, symbol, side, timestamp);
    }

    @Override
    public String toString() {
        return String.format("Execution{id=%d, symbol=%s, side=%s, qty=%s, price=%s, fees=%s, time=%s}",
                id, symbol, side, quantity, price, fees, timestamp);
    }

    /**
     * Builder 模式
     */
    public static class Builder {
        private long id;
        private String symbol;
        private Side side;
        private BigDecimal quantity;
        private BigDecimal price;
        private Instant timestamp;
        private BigDecimal fees = BigDecimal.ZERO;
        private Long strategyId;
        private String orderType = "MARKET";
        private String status = STATUS_FILLED;
        private String notes;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder side(Side side) {
            this.side = side;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder fees(BigDecimal fees) {
            this.fees = fees;
            return this;
        }

        public Builder strategyId(Long strategyId) {
            this.strategyId = strategyId;
            return this;
        }

        public Builder orderType(String orderType) {
            this.orderType = orderType;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Execution build() {
            return new Execution(id, symbol, side, quantity, price, timestamp, fees,
                    strategyId, orderType, status, notes);
        }
    }
}
