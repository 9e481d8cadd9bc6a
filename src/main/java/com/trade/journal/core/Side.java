package com.trade.journal.core;

import java.util.Locale;

/**
 * 成交方向
 */
public enum Side {
    BUY("买入", "开多或平空"),
    SELL("卖出", "开空或平多");

    private final String chineseName;
    private final String description;

    Side(String chineseName, String description) {
        this.chineseName = chineseName;
        this.description = description;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * 以此方向开仓的盈亏符号：做多为 +1，做空为 -1
     */
    public int directionSign() {
        return this == BUY ? 1 : -1;
    }

    /**
     * 解析方向，大小写不敏感
     *
     * @throws IllegalArgumentException 无法识别的方向
     */
    public static Side parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("成交方向为空");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "BUY", "B" -> BUY;
            case "SELL", "S" -> SELL;
            default -> throw new IllegalArgumentException("无效的成交方向: " + value);
        };
    }

    public String getChineseName() {
        return chineseName;
    }

    public String getDescription() {
        return description;
    }
}
